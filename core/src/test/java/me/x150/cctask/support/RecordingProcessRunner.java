package me.x150.cctask.support;

import me.x150.cctask.exc.ProcessInvocationException;
import me.x150.cctask.exc.ProcessTimeoutException;
import me.x150.cctask.exec.Invocation;
import me.x150.cctask.exec.ProcessRunner;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Records every invocation and answers setup shells with a canned variable dump. Everything else goes to the
 * given tool behavior.
 */
public class RecordingProcessRunner implements ProcessRunner {
	private final List<Invocation> invocations = new ArrayList<>();
	private final ProcessRunner tools;
	private final List<String> dump;

	public RecordingProcessRunner(List<String> dump, ProcessRunner tools) {
		this.dump = dump;
		this.tools = tools;
	}

	public RecordingProcessRunner(ProcessRunner tools) {
		this(List.of("PATH=C:\\fake\\bin", "INCLUDE=C:\\fake\\include"), tools);
	}

	public static boolean isSetupShell(Invocation invocation) {
		return invocation.executable().equals("cmd.exe") || invocation.executable().equals("/bin/sh");
	}

	public static void touch(Path file) {
		try {
			Files.createDirectories(file.getParent());
			Files.writeString(file, "x");
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	@Override
	public int run(Invocation invocation) throws ProcessInvocationException, ProcessTimeoutException, InterruptedException {
		synchronized (invocations) {
			invocations.add(invocation);
		}
		if (isSetupShell(invocation)) {
			if (invocation.onStdout() != null) dump.forEach(invocation.onStdout());
			return 0;
		}
		return tools.run(invocation);
	}

	public List<Invocation> invocations() {
		synchronized (invocations) {
			return List.copyOf(invocations);
		}
	}

	public List<Invocation> toolInvocations() {
		return invocations().stream().filter(it -> !isSetupShell(it)).toList();
	}

	public List<Invocation> setupInvocations() {
		return invocations().stream().filter(RecordingProcessRunner::isSetupShell).toList();
	}
}
