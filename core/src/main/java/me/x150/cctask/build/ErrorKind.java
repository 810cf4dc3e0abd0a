package me.x150.cctask.build;

public enum ErrorKind {
	/**
	 * Missing or invalid task settings; nothing was run
	 */
	CONFIGURATION,
	TOOLCHAIN_NOT_FOUND,
	ENVIRONMENT_CAPTURE,
	/**
	 * Compile-only step returned non-zero or timed out
	 */
	COMPILATION,
	/**
	 * Merged compile and link step returned non-zero or timed out
	 */
	LINK,
	LIBRARIAN,
	/**
	 * A tool could not be started at all
	 */
	PROCESS_INVOCATION,
	CANCELLED,
	/**
	 * Copying headers next to a built library failed
	 */
	PROPAGATION,
	CLEAN
}
