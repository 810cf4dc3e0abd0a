package me.x150.cctask.build;

import org.jetbrains.annotations.Nullable;

/**
 * @param cell     the failing cell, null for task-wide errors
 * @param exitCode exit code of the failing tool, if it ran to completion
 */
public record BuildError(ErrorKind kind, String message, @Nullable BuildCell.Id cell, @Nullable Integer exitCode, @Nullable Throwable cause) {
	public static BuildError of(ErrorKind kind, String message) {
		return new BuildError(kind, message, null, null, null);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("[").append(kind).append("] ");
		if (cell != null) sb.append(cell).append(": ");
		sb.append(message);
		if (cause != null) sb.append(" (").append(cause).append(")");
		return sb.toString();
	}
}
