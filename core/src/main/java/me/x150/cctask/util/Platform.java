package me.x150.cctask.util;

import me.x150.cctask.conf.AssemblyType;

import java.util.Locale;

/**
 * Host operating system families, and how each one names native artifacts.
 */
public enum Platform {
	WINDOWS("", ".dll", ".lib", ".exe"),
	MACOS("lib", ".dylib", ".a", ""),
	LINUX("lib", ".so", ".a", "");

	private static final Platform current = detect(System.getProperty("os.name", ""));

	private final String libraryPrefix;
	private final String sharedLibraryExtension;
	private final String staticLibraryExtension;
	private final String executableExtension;

	Platform(String libraryPrefix, String sharedLibraryExtension, String staticLibraryExtension, String executableExtension) {
		this.libraryPrefix = libraryPrefix;
		this.sharedLibraryExtension = sharedLibraryExtension;
		this.staticLibraryExtension = staticLibraryExtension;
		this.executableExtension = executableExtension;
	}

	static Platform detect(String osName) {
		String os = osName.toLowerCase(Locale.ROOT);
		if (os.startsWith("windows")) return WINDOWS;
		if (os.startsWith("mac") || os.startsWith("darwin")) return MACOS;
		// everything else gets unix conventions
		return LINUX;
	}

	public static Platform current() {
		return current;
	}

	public String artifactFileName(AssemblyType type, String baseName) {
		return switch (type) {
			case SHARED_LIBRARY -> libraryPrefix + baseName + sharedLibraryExtension;
			case STATIC_LIBRARY -> libraryPrefix + baseName + staticLibraryExtension;
			case EXECUTABLE -> baseName + executableExtension;
			case UNSPECIFIED -> throw new IllegalArgumentException("No artifact for " + type);
		};
	}
}
