package me.x150.cctask.toolchain;

import me.x150.cctask.conf.Architecture;
import me.x150.cctask.conf.AssemblyType;
import me.x150.cctask.conf.BuildConfiguration;
import me.x150.cctask.env.EnvironmentSnapshot;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Everything that differs between compiler suites: how installs are found, how their environment is set up, which
 * flags mean what, and how command lines are laid out.
 */
public interface ToolchainBackend {
	String name();

	/**
	 * @return every version this backend can probe for, oldest first
	 */
	List<? extends ToolchainVersion> knownVersions();

	@Nullable ToolchainVersion parseVersion(String text);

	Set<Architecture> supportedArchitectures();

	/**
	 * Derives the install root of a version from the given environment, without checking that anything is there.
	 */
	Optional<Path> probeInstallPath(ToolchainVersion version, EnvironmentSnapshot environment);

	Path compilerBinary(ToolchainVersion version, Path installPath);

	SetupCommand environmentSetup(Path installPath, Architecture architecture);

	String compilerExecutable(ToolchainVersion version);

	String archiverExecutable(ToolchainVersion version);

	List<String> configurationFlags(BuildConfiguration configuration);

	/**
	 * @return flags placing object files into the directory; may be empty when the compiler writes them to its
	 * working directory
	 */
	List<String> intermediaryOutputFlags(Path intermediaryDirectory);

	List<String> architectureCompilerFlags(Architecture architecture);

	List<String> architectureLinkerFlags(Architecture architecture);

	String includeFlag(Path includePath);

	List<String> sharedLibraryCompilerFlags();

	List<String> sharedLibraryLinkerFlags();

	/**
	 * Flag that makes the compiler stop after producing object files
	 */
	String compileOnlyFlag();

	String objectFileExtension();

	String artifactFileName(AssemblyType type, String baseName);

	List<String> compileArguments(List<String> compilerFlags, List<Path> sources);

	/**
	 * Arguments for one invocation that compiles and links in one go.
	 */
	List<String> compileAndLinkArguments(List<String> compilerFlags, List<Path> sources, List<String> linkerFlags,
										 Path output, List<Path> libraryPaths, List<String> libraries);

	List<String> archiveArguments(Path output, List<Path> objectFiles, List<Path> libraryPaths);
}
