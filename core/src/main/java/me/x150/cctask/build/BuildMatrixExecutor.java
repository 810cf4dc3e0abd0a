package me.x150.cctask.build;

import lombok.extern.log4j.Log4j2;
import me.x150.cctask.conf.Architecture;
import me.x150.cctask.conf.AssemblyType;
import me.x150.cctask.conf.BuildConfiguration;
import me.x150.cctask.conf.BuildContext;
import me.x150.cctask.conf.CompilerTaskConfig;
import me.x150.cctask.env.EnvironmentCache;
import me.x150.cctask.env.EnvironmentResolver;
import me.x150.cctask.env.EnvironmentSnapshot;
import me.x150.cctask.exc.EnvironmentCaptureException;
import me.x150.cctask.exc.ProcessInvocationException;
import me.x150.cctask.exc.ProcessTimeoutException;
import me.x150.cctask.exec.CancellationToken;
import me.x150.cctask.exec.Invocation;
import me.x150.cctask.toolchain.ToolchainBackend;
import me.x150.cctask.toolchain.ToolchainLocator;
import me.x150.cctask.toolchain.ToolchainRegistry;
import me.x150.cctask.toolchain.ToolchainVersion;
import me.x150.cctask.util.DirectoryCopier;
import me.x150.cctask.util.Util;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds one task for every requested (configuration, architecture) pair.
 * <p>
 * Each cell gets its own intermediary directory {@code <intermediary>/<Config> <Arch>} and its own output
 * directory {@code <output>/<Config> <Arch>}, and starts from a private copy of the task's flags. A failing cell
 * records one error and does not stop the others. The run succeeds only if every cell built.
 */
@Log4j2
public class BuildMatrixExecutor {
	private static final Set<String> SOURCE_EXTENSIONS = Set.of(".c", ".cpp", ".cxx");

	private final BuildContext context;
	private final ErrorLog errors = new ErrorLog();
	private volatile CancellationToken cancellation = new CancellationToken();

	public BuildMatrixExecutor(BuildContext context) {
		this.context = context;
	}

	/**
	 * Errors of the latest {@link #run} or {@link #clean}
	 */
	public ErrorLog getErrors() {
		return errors;
	}

	/**
	 * Stops the current run. Running tools are killed, cells that have not started yet fail as cancelled.
	 */
	public void cancel() {
		cancellation.cancel();
	}

	public boolean run(CompilerTaskConfig config, BuildRequest request) {
		errors.clear();
		CancellationToken token = new CancellationToken();
		cancellation = token;
		ToolchainBackend backend = context.backend();

		if (!checkPreconditions(backend, config, request)) return false;

		ToolchainVersion version = request.minimumVersion();
		ToolchainRegistry registry = new ToolchainLocator(backend, context.environment()).discover();
		Optional<Path> installPath = registry.installPath(version);
		if (installPath.isEmpty()) {
			String found = registry.isEmpty() ? "none" : registry.versions().stream().map(ToolchainVersion::displayName).collect(Collectors.joining(", "));
			errors.add(BuildError.of(ErrorKind.TOOLCHAIN_NOT_FOUND,
					String.format("An installation of %s %s could not be found (installed: %s)", backend.name(), version.displayName(), found)));
			log.error("No {} {} installed", backend.name(), version.displayName());
			return false;
		}
		log.info("Using {} {} at {}", backend.name(), version.displayName(), installPath.get());

		Path intermediaryRoot = config.hasIntermediaryDirectory() ? Path.of(config.getIntermediaryDirectory()) : config.getWorkingDirectory();
		Path outputRoot = config.resolve(config.getOutputDirectory());
		String artifactFileName = backend.artifactFileName(config.getOutputAssemblyType(), config.getOutputFileName());

		List<BuildCell> cells = new ArrayList<>();
		for (BuildConfiguration configuration : request.configurations()) {
			for (Architecture architecture : request.architectures()) {
				cells.add(new BuildCell(new BuildCell.Id(configuration, architecture), config.getCompilerFlags(), config.getLinkerFlags(),
						intermediaryRoot, outputRoot, artifactFileName));
			}
		}

		EnvironmentCache environments = new EnvironmentCache(new EnvironmentResolver(backend, context.processRunner(), context.environment(),
				config.getWorkingDirectory(), context.processTimeout(), token));
		CellRun cellRun = new CellRun(config, version, installPath.get(), environments, token);

		AtomicInteger attempted = new AtomicInteger();
		AtomicInteger succeeded = new AtomicInteger();
		ExecutorService executor = context.parallelExecutorForNThreads();
		try {
			CompletableFuture<?>[] futures = cells.stream().map(cell -> CompletableFuture.runAsync(() -> {
				attempted.incrementAndGet();
				if (cellRun.build(cell)) succeeded.incrementAndGet();
			}, executor)).toArray(CompletableFuture[]::new);
			CompletableFuture.allOf(futures).join();
		} finally {
			executor.shutdownNow();
		}

		log.info("{} of {} cell(s) built", succeeded.get(), request.cellCount());
		boolean ok = attempted.get() > 0 && succeeded.get() == attempted.get();
		if (ok && config.isAutoCopyIncludes() && config.getOutputAssemblyType().isLibrary()) {
			ok = propagateHeaders(config, outputRoot);
		}
		return ok;
	}

	/**
	 * Empties the intermediary directory, leaving the directory itself in place.
	 */
	public boolean clean(CompilerTaskConfig config) {
		errors.clear();
		if (!config.hasIntermediaryDirectory()) {
			errors.add(BuildError.of(ErrorKind.CONFIGURATION, "No intermediary directory set, nothing to clean"));
			return false;
		}
		Path dir = Path.of(config.getIntermediaryDirectory());
		try {
			if (Files.exists(dir)) Util.rmRf(dir);
			Files.createDirectories(dir);
		} catch (IOException e) {
			errors.add(new BuildError(ErrorKind.CLEAN, "Failed to clean " + dir, null, null, e));
			log.error("Failed to clean {}", dir, e);
			return false;
		}
		log.info("Cleaned {}", dir);
		return true;
	}

	private boolean checkPreconditions(ToolchainBackend backend, CompilerTaskConfig config, BuildRequest request) {
		List<String> problems = new ArrayList<>();
		if (config.getOutputDirectory().isBlank()) problems.add("No output directory specified");
		if (config.getOutputFileName().isBlank()) problems.add("No output file name specified");
		if (config.getSources().isEmpty()) problems.add("No source files specified");
		if (config.getOutputAssemblyType() == AssemblyType.UNSPECIFIED) problems.add("No output assembly type specified");
		if (request.configurations().isEmpty()) problems.add("No build configuration requested");
		if (request.architectures().isEmpty()) problems.add("No target architecture requested");
		EnumSet<Architecture> unsupported = EnumSet.noneOf(Architecture.class);
		unsupported.addAll(request.architectures());
		unsupported.removeAll(backend.supportedArchitectures());
		if (!unsupported.isEmpty()) problems.add(backend.name() + " cannot target " + unsupported);
		checkResolvable(problems, "sources", config.getSources(), config::resolve);
		checkResolvable(problems, "includePaths", config.getIncludePaths(), config::resolve);
		checkResolvable(problems, "libraryPaths", config.getLibraryPaths(), config::resolve);
		if (!config.getOutputDirectory().isBlank()) {
			checkResolvable(problems, "outputDirectory", List.of(config.getOutputDirectory()), config::resolve);
		}
		if (config.getOutputAssemblyType() != AssemblyType.UNSPECIFIED && !config.getOutputFileName().isBlank()) {
			checkResolvable(problems, "outputFileName", List.of(backend.artifactFileName(config.getOutputAssemblyType(), config.getOutputFileName())),
					Path::of);
		}
		for (String problem : problems) {
			errors.add(BuildError.of(ErrorKind.CONFIGURATION, problem));
			log.error(problem);
		}
		return problems.isEmpty();
	}

	private static void checkResolvable(List<String> problems, String field, List<String> values, Function<String, Path> resolver) {
		for (String value : values) {
			try {
				resolver.apply(value);
			} catch (InvalidPathException e) {
				problems.add(String.format("%s: not a valid path: %s", field, e.getMessage()));
			}
		}
	}

	private boolean propagateHeaders(CompilerTaskConfig config, Path outputRoot) {
		Path target = outputRoot.resolve("include");
		DirectoryCopier copier = DirectoryCopier.builder()
				.recursive(true)
				.overwrite(true)
				.excluded(SOURCE_EXTENSIONS)
				.build();
		for (String includePath : config.getIncludePaths()) {
			Path source = config.resolve(includePath);
			try {
				copier.copy(source, target);
			} catch (IOException e) {
				errors.add(new BuildError(ErrorKind.PROPAGATION, "Could not copy headers from " + source + " to " + target, null, null, e));
				log.error("Could not copy headers from {} to {}", source, target, e);
				return false;
			}
		}
		log.info("Copied headers of {} include path(s) to {}", config.getIncludePaths().size(), target);
		return true;
	}

	/**
	 * Per-run state shared by all cells of one run
	 */
	private class CellRun {
		private final CompilerTaskConfig config;
		private final ToolchainVersion version;
		private final Path installPath;
		private final EnvironmentCache environments;
		private final CancellationToken token;
		private final ToolchainBackend backend;
		private final List<Path> libraryPaths;

		CellRun(CompilerTaskConfig config, ToolchainVersion version, Path installPath, EnvironmentCache environments, CancellationToken token) {
			this.config = config;
			this.version = version;
			this.installPath = installPath;
			this.environments = environments;
			this.token = token;
			this.backend = context.backend();
			this.libraryPaths = config.getLibraryPaths().stream().map(config::resolve).toList();
		}

		boolean build(BuildCell cell) {
			try {
				return runSteps(cell);
			} catch (RuntimeException e) {
				ErrorKind kind;
				if (cell.getStatus() == BuildCell.Status.LINKING) kind = ErrorKind.LIBRARIAN;
				else kind = config.getOutputAssemblyType() == AssemblyType.STATIC_LIBRARY ? ErrorKind.COMPILATION : ErrorKind.LINK;
				log.error("Unexpected failure while building {}", cell.getId(), e);
				return fail(cell, kind, "Unexpected failure: " + e, null, e);
			}
		}

		private boolean runSteps(BuildCell cell) {
			BuildCell.Id id = cell.getId();
			if (token.isCancelled()) return fail(cell, ErrorKind.CANCELLED, "Cancelled before the cell started", null, null);

			EnvironmentSnapshot environment;
			try {
				environment = environments.get(version, installPath, id.architecture());
			} catch (EnvironmentCaptureException e) {
				return fail(cell, ErrorKind.ENVIRONMENT_CAPTURE, e.getMessage(), null, e);
			} catch (CancellationException e) {
				return fail(cell, ErrorKind.CANCELLED, "Cancelled while loading the toolchain environment", null, e);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return fail(cell, ErrorKind.CANCELLED, "Interrupted while loading the toolchain environment", null, e);
			}

			try {
				Files.createDirectories(cell.getIntermediaryDirectory());
				Files.createDirectories(cell.getOutputPath().getParent());
			} catch (IOException e) {
				ErrorKind kind = config.getOutputAssemblyType() == AssemblyType.STATIC_LIBRARY ? ErrorKind.COMPILATION : ErrorKind.LINK;
				return fail(cell, kind, "Could not create the directories of the cell", null, e);
			}

			composeFlags(cell);
			List<Path> sources = config.getSources().stream().map(config::resolve).toList();
			log.info("Building {} ({} source file(s))", id, sources.size());

			cell.setStatus(BuildCell.Status.COMPILING);
			if (config.getOutputAssemblyType() != AssemblyType.STATIC_LIBRARY) {
				List<String> args = backend.compileAndLinkArguments(cell.getCompilerFlags(), sources, cell.getLinkerFlags(), cell.getOutputPath(),
						libraryPaths, config.getAdditionalLibraries());
				if (!invoke(cell, backend.compilerExecutable(version), args, environment, ErrorKind.LINK)) return false;
			} else {
				List<String> args = backend.compileArguments(cell.getCompilerFlags(), sources);
				if (!invoke(cell, backend.compilerExecutable(version), args, environment, ErrorKind.COMPILATION)) return false;

				cell.setStatus(BuildCell.Status.LINKING);
				List<Path> objects;
				try {
					objects = objectFiles(cell.getIntermediaryDirectory());
				} catch (IOException e) {
					return fail(cell, ErrorKind.LIBRARIAN, "Could not list object files in " + cell.getIntermediaryDirectory(), null, e);
				}
				if (objects.isEmpty()) {
					return fail(cell, ErrorKind.LIBRARIAN, "The compiler left no object files in " + cell.getIntermediaryDirectory(), null, null);
				}
				List<String> archiveArgs = backend.archiveArguments(cell.getOutputPath(), objects, libraryPaths);
				if (!invoke(cell, backend.archiverExecutable(version), archiveArgs, environment, ErrorKind.LIBRARIAN)) return false;
			}

			cell.setStatus(BuildCell.Status.SUCCEEDED);
			log.info("Built {}: {}", id, cell.getOutputPath());
			return true;
		}

		private void composeFlags(BuildCell cell) {
			Architecture arch = cell.getId().architecture();
			List<String> compilerFlags = cell.getCompilerFlags();
			List<String> linkerFlags = cell.getLinkerFlags();
			compilerFlags.addAll(backend.configurationFlags(cell.getId().configuration()));
			compilerFlags.addAll(backend.intermediaryOutputFlags(cell.getIntermediaryDirectory()));
			compilerFlags.addAll(backend.architectureCompilerFlags(arch));
			for (String includePath : config.getIncludePaths()) {
				compilerFlags.add(backend.includeFlag(config.resolve(includePath)));
			}
			linkerFlags.addAll(backend.architectureLinkerFlags(arch));
			switch (config.getOutputAssemblyType()) {
				case SHARED_LIBRARY -> {
					compilerFlags.addAll(backend.sharedLibraryCompilerFlags());
					linkerFlags.addAll(backend.sharedLibraryLinkerFlags());
				}
				case STATIC_LIBRARY -> {
					if (!compilerFlags.contains(backend.compileOnlyFlag())) compilerFlags.add(backend.compileOnlyFlag());
				}
				case EXECUTABLE -> {
				}
				case UNSPECIFIED -> throw new IllegalStateException("Assembly type is checked before cells are built");
			}
		}

		private List<Path> objectFiles(Path dir) throws IOException {
			String ext = backend.objectFileExtension().toLowerCase(Locale.ROOT);
			try (Stream<Path> s = Files.list(dir)) {
				return s.filter(Files::isRegularFile)
						.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(ext))
						.sorted()
						.toList();
			}
		}

		private boolean invoke(BuildCell cell, String executable, List<String> args, EnvironmentSnapshot environment, ErrorKind failureKind) {
			BuildCell.Id id = cell.getId();
			Invocation invocation = Invocation.builder()
					.workingDirectory(cell.getIntermediaryDirectory())
					.executable(executable)
					.args(args)
					.environment(environment.asMap())
					.timeout(context.processTimeout())
					.onStdout(line -> log.info("[{}] {}", id, line))
					.onStderr(line -> log.warn("[{}] {}", id, line))
					.cancellation(token)
					.build();
			try {
				int exit = context.processRunner().run(invocation);
				if (exit == 0) return true;
				return fail(cell, failureKind, String.format("%s exited with code %d", executable, exit), exit, null);
			} catch (ProcessInvocationException e) {
				return fail(cell, ErrorKind.PROCESS_INVOCATION, e.getMessage(), null, e);
			} catch (ProcessTimeoutException e) {
				return fail(cell, failureKind, e.getMessage(), null, e);
			} catch (CancellationException e) {
				return fail(cell, ErrorKind.CANCELLED, executable + " was cancelled", null, e);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return fail(cell, ErrorKind.CANCELLED, executable + " was interrupted", null, e);
			}
		}

		private boolean fail(BuildCell cell, ErrorKind kind, String message, @Nullable Integer exitCode, @Nullable Throwable cause) {
			cell.setStatus(BuildCell.Status.FAILED);
			errors.add(new BuildError(kind, message, cell.getId(), exitCode, cause));
			log.error("{} failed: {}", cell.getId(), message);
			return false;
		}
	}
}
