package me.x150.cctask.conf;

import lombok.Getter;
import org.jetbrains.annotations.Nullable;

@Getter
public enum BuildConfiguration {
	DEBUG("Debug"),
	RELEASE("Release");

	private final String displayName;

	BuildConfiguration(String displayName) {
		this.displayName = displayName;
	}

	public static @Nullable BuildConfiguration byName(String name) {
		for (BuildConfiguration value : values()) {
			if (value.displayName.equalsIgnoreCase(name)) return value;
		}
		return null;
	}

	@Override
	public String toString() {
		return displayName;
	}
}
