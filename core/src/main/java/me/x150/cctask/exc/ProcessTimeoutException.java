package me.x150.cctask.exc;

import lombok.Getter;

import java.time.Duration;

@Getter
public class ProcessTimeoutException extends Exception {
	private final String executable;
	private final Duration timeout;

	public ProcessTimeoutException(String executable, Duration timeout) {
		super(executable + " did not finish within " + timeout.toMillis() + " ms and was killed");
		this.executable = executable;
		this.timeout = timeout;
	}
}
