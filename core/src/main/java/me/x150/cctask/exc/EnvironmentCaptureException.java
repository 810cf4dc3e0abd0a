package me.x150.cctask.exc;

import lombok.Getter;
import me.x150.cctask.conf.Architecture;

import java.nio.file.Path;

@Getter
public class EnvironmentCaptureException extends Exception {
	private final Architecture architecture;
	private final Path installPath;

	public EnvironmentCaptureException(Architecture architecture, Path installPath, String message, Throwable cause) {
		super(message, cause);
		this.architecture = architecture;
		this.installPath = installPath;
	}
}
