package me.x150.cctask.conf;

import org.jetbrains.annotations.Nullable;

/**
 * Kind of artifact a compiler task produces
 */
public enum AssemblyType {
	UNSPECIFIED,
	SHARED_LIBRARY,
	STATIC_LIBRARY,
	EXECUTABLE;

	public boolean isLibrary() {
		return this == SHARED_LIBRARY || this == STATIC_LIBRARY;
	}

	/**
	 * Accepts both the constant name and its camel-case form ({@code StaticLibrary})
	 */
	public static @Nullable AssemblyType byName(String name) {
		String normalized = name.replace("_", "");
		for (AssemblyType value : values()) {
			if (value.name().replace("_", "").equalsIgnoreCase(normalized)) return value;
		}
		return null;
	}
}
