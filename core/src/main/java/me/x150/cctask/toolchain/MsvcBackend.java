package me.x150.cctask.toolchain;

import me.x150.cctask.conf.Architecture;
import me.x150.cctask.conf.AssemblyType;
import me.x150.cctask.conf.BuildConfiguration;
import me.x150.cctask.env.EnvironmentSnapshot;
import me.x150.cctask.util.PathChecks;
import me.x150.cctask.util.Platform;
import org.jetbrains.annotations.Nullable;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Visual C++ through {@code cl.exe} and {@code lib.exe}. Installs are found through the {@code VS<nn>0COMNTOOLS}
 * variables, and the per-architecture environment comes from {@code vcvarsall.bat}.
 */
public class MsvcBackend implements ToolchainBackend {
	private static final String COMMON7 = "Common7";

	private static List<String> concat(List<String> a, List<String> b) {
		List<String> out = new ArrayList<>(a);
		out.addAll(b);
		return out;
	}

	@Override
	public String name() {
		return "MSVC";
	}

	@Override
	public List<MsvcVersion> knownVersions() {
		return Arrays.asList(MsvcVersion.values());
	}

	@Override
	public @Nullable ToolchainVersion parseVersion(String text) {
		String t = text.trim();
		for (MsvcVersion v : MsvcVersion.values()) {
			if (v.name().equalsIgnoreCase(t) || String.valueOf(v.major()).equals(t) || v.displayName().equalsIgnoreCase(t)) return v;
		}
		return null;
	}

	@Override
	public Set<Architecture> supportedArchitectures() {
		return EnumSet.of(Architecture.X86, Architecture.X64);
	}

	/**
	 * The tools variable looks like {@code C:\Program Files (x86)\Microsoft Visual Studio 14.0\Common7\Tools\}; the
	 * compilers live in {@code VC\bin} next to {@code Common7}.
	 */
	@Override
	public Optional<Path> probeInstallPath(ToolchainVersion version, EnvironmentSnapshot environment) {
		if (!(version instanceof MsvcVersion msvc)) return Optional.empty();
		String tools = environment.get(msvc.commonToolsVariable());
		if (tools == null || tools.isBlank()) return Optional.empty();
		String sane = PathChecks.toHostPath(tools.trim());
		int idx = sane.indexOf(File.separator + COMMON7);
		if (idx == -1) return Optional.empty();
		Path root = PathChecks.tryParse(sane.substring(0, idx));
		if (root == null) return Optional.empty();
		return Optional.of(root.resolve("VC").resolve("bin"));
	}

	@Override
	public Path compilerBinary(ToolchainVersion version, Path installPath) {
		return installPath.resolve("cl.exe");
	}

	/**
	 * {@code vcvarsall.bat} sits one level above {@code VC\bin}. {@code /S} makes cmd strip exactly the outer quote
	 * pair, so the quoted script path survives.
	 */
	@Override
	public SetupCommand environmentSetup(Path installPath, Architecture architecture) {
		Path vcvars = installPath.getParent().resolve("vcvarsall.bat");
		String arch = switch (architecture) {
			case X86 -> "x86";
			case X64 -> "amd64";
		};
		return new SetupCommand("cmd.exe", List.of("/S", "/C", "\"call \"" + vcvars + "\" " + arch + " && set\""));
	}

	@Override
	public String compilerExecutable(ToolchainVersion version) {
		return "cl.exe";
	}

	@Override
	public String archiverExecutable(ToolchainVersion version) {
		return "lib.exe";
	}

	@Override
	public List<String> configurationFlags(BuildConfiguration configuration) {
		return switch (configuration) {
			case DEBUG -> List.of("/Od", "/Zi", "/MDd", "/D_DEBUG");
			case RELEASE -> List.of("/O2", "/MD", "/DNDEBUG");
		};
	}

	@Override
	public List<String> intermediaryOutputFlags(Path intermediaryDirectory) {
		// trailing separator tells cl this is a directory
		return List.of("/Fo" + intermediaryDirectory + File.separator);
	}

	@Override
	public List<String> architectureCompilerFlags(Architecture architecture) {
		return List.of();
	}

	@Override
	public List<String> architectureLinkerFlags(Architecture architecture) {
		return List.of("/MACHINE:" + architecture.getDisplayName());
	}

	@Override
	public String includeFlag(Path includePath) {
		return "/I" + includePath;
	}

	@Override
	public List<String> sharedLibraryCompilerFlags() {
		return List.of("/D_USRDLL", "/D_WINDLL");
	}

	@Override
	public List<String> sharedLibraryLinkerFlags() {
		return List.of("/DLL");
	}

	@Override
	public String compileOnlyFlag() {
		return "/c";
	}

	@Override
	public String objectFileExtension() {
		return ".obj";
	}

	@Override
	public String artifactFileName(AssemblyType type, String baseName) {
		return Platform.WINDOWS.artifactFileName(type, baseName);
	}

	@Override
	public List<String> compileArguments(List<String> compilerFlags, List<Path> sources) {
		return concat(compilerFlags, sources.stream().map(Path::toString).toList());
	}

	@Override
	public List<String> compileAndLinkArguments(List<String> compilerFlags, List<Path> sources, List<String> linkerFlags,
												Path output, List<Path> libraryPaths, List<String> libraries) {
		List<String> args = compileArguments(compilerFlags, sources);
		args.add("/link");
		args.addAll(linkerFlags);
		args.add("/OUT:" + output);
		for (Path libraryPath : libraryPaths) {
			args.add("/LIBPATH:" + libraryPath);
		}
		args.addAll(libraries);
		return args;
	}

	@Override
	public List<String> archiveArguments(Path output, List<Path> objectFiles, List<Path> libraryPaths) {
		List<String> args = new ArrayList<>();
		args.add("/OUT:" + output);
		for (Path libraryPath : libraryPaths) {
			args.add("/LIBPATH:" + libraryPath);
		}
		objectFiles.forEach(it -> args.add(it.toString()));
		return args;
	}
}
