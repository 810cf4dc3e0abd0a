package me.x150.cctask.toolchain;

import me.x150.cctask.conf.Architecture;
import me.x150.cctask.conf.AssemblyType;
import me.x150.cctask.conf.BuildConfiguration;
import me.x150.cctask.env.EnvironmentSnapshot;
import me.x150.cctask.util.PathChecks;
import me.x150.cctask.util.Platform;
import org.jetbrains.annotations.Nullable;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * GCC through its versioned driver ({@code gcc-12} and friends) found on {@code PATH}. Objects are written to the
 * working directory, which is the cell's intermediary directory, so no output flag is needed for them.
 */
public class GccBackend implements ToolchainBackend {
	private final Platform platform;

	public GccBackend(Platform platform) {
		this.platform = platform;
	}

	public GccBackend() {
		this(Platform.current());
	}

	static String shellQuote(String s) {
		return "'" + s.replace("'", "'\\''") + "'";
	}

	private static boolean looksLikeLibraryFile(String lib) {
		return PathChecks.hasDirectoryPart(lib) || lib.endsWith(".a") || lib.endsWith(".so") || lib.endsWith(".lib") || lib.endsWith(".dylib");
	}

	@Override
	public String name() {
		return "GCC";
	}

	@Override
	public List<GccVersion> knownVersions() {
		return Arrays.asList(GccVersion.values());
	}

	@Override
	public @Nullable ToolchainVersion parseVersion(String text) {
		String t = text.trim();
		for (GccVersion v : GccVersion.values()) {
			if (v.name().equalsIgnoreCase(t) || v.driverName().equalsIgnoreCase(t) || String.valueOf(v.major()).equals(t)) return v;
		}
		return null;
	}

	@Override
	public Set<Architecture> supportedArchitectures() {
		return EnumSet.of(Architecture.X86, Architecture.X64);
	}

	@Override
	public Optional<Path> probeInstallPath(ToolchainVersion version, EnvironmentSnapshot environment) {
		if (!(version instanceof GccVersion gcc)) return Optional.empty();
		String searchPath = environment.get("PATH");
		if (searchPath == null) return Optional.empty();
		for (String dir : searchPath.split(File.pathSeparator)) {
			if (dir.isBlank()) continue;
			Path p = PathChecks.tryParse(dir);
			if (p != null && Files.isRegularFile(p.resolve(gcc.driverName()))) return Optional.of(p);
		}
		return Optional.empty();
	}

	@Override
	public Path compilerBinary(ToolchainVersion version, Path installPath) {
		return installPath.resolve(compilerExecutable(version));
	}

	/**
	 * GCC needs no setup script; the shell only puts the install directory in front of {@code PATH} before
	 * printing the table.
	 */
	@Override
	public SetupCommand environmentSetup(Path installPath, Architecture architecture) {
		String script = "PATH=" + shellQuote(installPath.toString()) + File.pathSeparator + "\"$PATH\"; export PATH; env";
		return new SetupCommand("/bin/sh", List.of("-c", script));
	}

	@Override
	public String compilerExecutable(ToolchainVersion version) {
		return ((GccVersion) version).driverName();
	}

	@Override
	public String archiverExecutable(ToolchainVersion version) {
		return "ar";
	}

	@Override
	public List<String> configurationFlags(BuildConfiguration configuration) {
		return switch (configuration) {
			case DEBUG -> List.of("-O0", "-g", "-D_DEBUG");
			case RELEASE -> List.of("-O2", "-DNDEBUG");
		};
	}

	@Override
	public List<String> intermediaryOutputFlags(Path intermediaryDirectory) {
		return List.of();
	}

	@Override
	public List<String> architectureCompilerFlags(Architecture architecture) {
		return List.of(architecture == Architecture.X86 ? "-m32" : "-m64");
	}

	@Override
	public List<String> architectureLinkerFlags(Architecture architecture) {
		return List.of(architecture == Architecture.X86 ? "-m32" : "-m64");
	}

	@Override
	public String includeFlag(Path includePath) {
		return "-I" + includePath;
	}

	@Override
	public List<String> sharedLibraryCompilerFlags() {
		return List.of("-fPIC");
	}

	@Override
	public List<String> sharedLibraryLinkerFlags() {
		return List.of("-shared");
	}

	@Override
	public String compileOnlyFlag() {
		return "-c";
	}

	@Override
	public String objectFileExtension() {
		return ".o";
	}

	@Override
	public String artifactFileName(AssemblyType type, String baseName) {
		return platform.artifactFileName(type, baseName);
	}

	@Override
	public List<String> compileArguments(List<String> compilerFlags, List<Path> sources) {
		List<String> args = new ArrayList<>(compilerFlags);
		sources.forEach(it -> args.add(it.toString()));
		return args;
	}

	@Override
	public List<String> compileAndLinkArguments(List<String> compilerFlags, List<Path> sources, List<String> linkerFlags,
												Path output, List<Path> libraryPaths, List<String> libraries) {
		List<String> args = compileArguments(compilerFlags, sources);
		args.add("-o");
		args.add(output.toString());
		args.addAll(linkerFlags);
		for (Path libraryPath : libraryPaths) {
			args.add("-L" + libraryPath);
		}
		for (String library : libraries) {
			args.add(looksLikeLibraryFile(library) ? library : "-l" + library);
		}
		return args;
	}

	@Override
	public List<String> archiveArguments(Path output, List<Path> objectFiles, List<Path> libraryPaths) {
		// ar has no notion of search paths
		List<String> args = new ArrayList<>();
		args.add("rcs");
		args.add(output.toString());
		objectFiles.forEach(it -> args.add(it.toString()));
		return args;
	}
}
