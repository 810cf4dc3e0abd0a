package me.x150.cctask.exec;

import lombok.extern.log4j.Log4j2;
import me.x150.cctask.exc.ProcessInvocationException;
import me.x150.cctask.exc.ProcessTimeoutException;
import me.x150.cctask.util.PathChecks;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

@Log4j2
public class LocalProcessRunner implements ProcessRunner {
	private static final long PUMP_DRAIN_MILLIS = 2000;

	static void killTree(Process process) {
		process.descendants().forEach(ProcessHandle::destroyForcibly);
		process.destroyForcibly();
	}

	/**
	 * An explicit directory wins. A bare name is looked up in the {@code PATH} of the invocation's own environment
	 * first, since the child sees that one; anything else is left to the OS search.
	 */
	static String resolveExecutable(Invocation invocation) {
		String exe = invocation.executable();
		if (invocation.executableDirectory() != null) {
			return invocation.executableDirectory().resolve(exe).toString();
		}
		if (PathChecks.hasDirectoryPart(exe)) return exe;
		String searchPath = null;
		for (Map.Entry<String, String> e : invocation.environment().entrySet()) {
			if (e.getKey().equalsIgnoreCase("PATH")) {
				searchPath = e.getValue();
				break;
			}
		}
		if (searchPath == null) return exe;
		for (String dir : searchPath.split(File.pathSeparator)) {
			if (dir.isBlank()) continue;
			Path dirPath = PathChecks.tryParse(dir);
			if (dirPath == null) continue;
			Path candidate = dirPath.resolve(exe);
			if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
				return candidate.toString();
			}
		}
		return exe;
	}

	private static Thread pump(InputStream in, Consumer<String> sink, String name) {
		Thread t = new Thread(() -> {
			try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, Charset.defaultCharset()))) {
				String line;
				while ((line = reader.readLine()) != null) {
					try {
						sink.accept(line);
					} catch (RuntimeException e) {
						// keep draining, a stalled pipe would block the child
						log.warn("Output consumer of {} failed", name, e);
					}
				}
			} catch (IOException e) {
				log.debug("Stream {} closed while reading", name, e);
			}
		}, name);
		t.setDaemon(true);
		t.start();
		return t;
	}

	@Override
	public int run(Invocation invocation) throws ProcessInvocationException, ProcessTimeoutException, InterruptedException {
		String exe = resolveExecutable(invocation);
		List<String> command = new ArrayList<>();
		command.add(exe);
		command.addAll(invocation.args());

		ProcessBuilder pb = new ProcessBuilder(command);
		pb.directory(invocation.workingDirectory().toFile());
		pb.environment().putAll(invocation.environment());

		CancellationToken token = invocation.cancellation();
		if (token != null && token.isCancelled()) {
			throw new CancellationException(invocation.executable() + " was cancelled before it started");
		}

		log.debug("Running {} in {}", invocation.commandLine(), invocation.workingDirectory());
		Process process;
		try {
			process = pb.start();
		} catch (IOException e) {
			throw new ProcessInvocationException(exe, e);
		}
		if (token != null && !token.register(process)) {
			throw new CancellationException(invocation.executable() + " was cancelled before it started");
		}
		try {
			process.getOutputStream().close();
		} catch (IOException e) {
			log.debug("Could not close stdin of {}", exe, e);
		}

		Consumer<String> onStdout = invocation.onStdout() == null ? System.out::println : invocation.onStdout();
		Consumer<String> onStderr = invocation.onStderr() == null ? System.err::println : invocation.onStderr();
		String name = Path.of(exe).getFileName().toString();
		Thread out = pump(process.getInputStream(), onStdout, name + "-stdout");
		Thread err = pump(process.getErrorStream(), onStderr, name + "-stderr");

		try {
			Duration timeout = invocation.timeout();
			boolean finished;
			if (timeout == null) {
				process.waitFor();
				finished = true;
			} else {
				finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
			}
			if (!finished) {
				killTree(process);
				process.waitFor();
				out.join(PUMP_DRAIN_MILLIS);
				err.join(PUMP_DRAIN_MILLIS);
				throw new ProcessTimeoutException(invocation.executable(), timeout);
			}
			out.join();
			err.join();
			if (token != null && token.isCancelled()) {
				throw new CancellationException(invocation.executable() + " was cancelled");
			}
			int exit = process.exitValue();
			log.debug("{} exited with {}", name, exit);
			return exit;
		} catch (InterruptedException e) {
			killTree(process);
			throw e;
		} finally {
			if (token != null) token.unregister(process);
		}
	}
}
