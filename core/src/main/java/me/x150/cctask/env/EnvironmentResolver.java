package me.x150.cctask.env;

import lombok.extern.log4j.Log4j2;
import me.x150.cctask.conf.Architecture;
import me.x150.cctask.exc.EnvironmentCaptureException;
import me.x150.cctask.exc.InvalidArchitectureSelectionException;
import me.x150.cctask.exc.ProcessInvocationException;
import me.x150.cctask.exc.ProcessTimeoutException;
import me.x150.cctask.exec.CancellationToken;
import me.x150.cctask.exec.Invocation;
import me.x150.cctask.exec.ProcessRunner;
import me.x150.cctask.toolchain.SetupCommand;
import me.x150.cctask.toolchain.ToolchainBackend;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Captures the environment a toolchain's command line tools need for one target architecture, by running the
 * toolchain's setup script in a shell and reading back the variable table the shell prints afterwards.
 */
@Log4j2
public class EnvironmentResolver {
	private final ToolchainBackend backend;
	private final ProcessRunner runner;
	private final EnvironmentSnapshot base;
	private final Path workingDirectory;
	private final @Nullable Duration timeout;
	private final @Nullable CancellationToken cancellation;

	public EnvironmentResolver(ToolchainBackend backend, ProcessRunner runner, EnvironmentSnapshot base, Path workingDirectory,
							   @Nullable Duration timeout, @Nullable CancellationToken cancellation) {
		this.backend = backend;
		this.runner = runner;
		this.base = base;
		this.workingDirectory = workingDirectory;
		this.timeout = timeout;
		this.cancellation = cancellation;
	}

	public EnvironmentResolver(ToolchainBackend backend, ProcessRunner runner, EnvironmentSnapshot base, Path workingDirectory) {
		this(backend, runner, base, workingDirectory, null, null);
	}

	public EnvironmentSnapshot resolve(Path installPath, Architecture architecture) throws EnvironmentCaptureException, InterruptedException {
		return resolve(installPath, EnumSet.of(architecture));
	}

	/**
	 * @param architectures must hold exactly one architecture
	 * @throws InvalidArchitectureSelectionException if zero or several architectures are given. No process is
	 *                                               started in that case
	 * @throws EnvironmentCaptureException           if the setup shell could not run or reported failure
	 */
	public EnvironmentSnapshot resolve(Path installPath, Set<Architecture> architectures) throws EnvironmentCaptureException, InterruptedException {
		if (architectures.size() != 1) throw new InvalidArchitectureSelectionException(architectures);
		Architecture arch = architectures.iterator().next();

		SetupCommand setup = backend.environmentSetup(installPath, arch);
		StringBuilder stdout = new StringBuilder();
		Invocation invocation = Invocation.builder()
				.workingDirectory(workingDirectory)
				.executable(setup.shell())
				.args(setup.args())
				.environment(base.asMap())
				.timeout(timeout)
				.onStdout(line -> stdout.append(line).append('\n'))
				.onStderr(line -> log.debug("[{} env {}] {}", backend.name(), arch, line))
				.cancellation(cancellation)
				.build();

		int exit;
		try {
			exit = runner.run(invocation);
		} catch (ProcessInvocationException | ProcessTimeoutException e) {
			throw new EnvironmentCaptureException(arch, installPath, "Could not load the " + backend.name() + " environment for " + arch + " from " + installPath, e);
		}
		if (exit != 0) {
			throw new EnvironmentCaptureException(arch, installPath, "Loading the " + backend.name() + " environment for " + arch + " from " + installPath + " failed with exit code " + exit, null);
		}

		EnvironmentSnapshot snapshot = base.mergeDump(stdout.toString());
		log.debug("Captured {} environment for {}: {} variables", backend.name(), arch, snapshot.size());
		return snapshot;
	}
}
