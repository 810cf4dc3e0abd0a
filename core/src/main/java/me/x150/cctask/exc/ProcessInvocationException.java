package me.x150.cctask.exc;

import java.io.IOException;

/**
 * The executable could not be located or started.
 */
public class ProcessInvocationException extends IOException {
	public ProcessInvocationException(String executable, Throwable cause) {
		super("Failed to start " + executable, cause);
	}
}
