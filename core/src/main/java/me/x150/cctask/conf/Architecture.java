package me.x150.cctask.conf;

import lombok.Getter;
import org.jetbrains.annotations.Nullable;

@Getter
public enum Architecture {
	X86("x86"),
	X64("x64");

	private final String displayName;

	Architecture(String displayName) {
		this.displayName = displayName;
	}

	public static @Nullable Architecture byName(String name) {
		for (Architecture value : values()) {
			if (value.displayName.equalsIgnoreCase(name) || value.name().equalsIgnoreCase(name)) return value;
		}
		return null;
	}

	@Override
	public String toString() {
		return displayName;
	}
}
