package me.x150.cctask.exec;

import me.x150.cctask.exc.ProcessInvocationException;
import me.x150.cctask.exc.ProcessTimeoutException;

import java.util.concurrent.CancellationException;

public interface ProcessRunner {
	/**
	 * Runs one process to completion.
	 *
	 * @return the exit code of the process
	 * @throws ProcessInvocationException if the executable could not be started
	 * @throws ProcessTimeoutException    if the timeout elapsed; the process has been killed
	 * @throws CancellationException      if the invocation's cancellation token fired; the process has been killed
	 */
	int run(Invocation invocation) throws ProcessInvocationException, ProcessTimeoutException, InterruptedException;
}
