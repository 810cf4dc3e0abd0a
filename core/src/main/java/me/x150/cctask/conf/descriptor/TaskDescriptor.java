package me.x150.cctask.conf.descriptor;

/**
 * Raw contents of a task descriptor file. Values are not validated here; see {@link TaskDescriptorLoader}.
 */
public class TaskDescriptor extends DescriptorFields {
	@DescriptorValue(value = "toolchain", description = "Toolchain family: msvc or gcc", required = true)
	public String toolchain;
	@DescriptorValue(value = "minimumVersion", description = "Toolchain version that has to be installed, e.g. 14 or gcc-12", required = true)
	public String minimumVersion;
	@DescriptorValue(value = "configurations", description = "Debug, Release", required = true)
	public String[] configurations;
	@DescriptorValue(value = "architectures", description = "x86, x64", required = true)
	public String[] architectures;

	@DescriptorValue(value = "sources", description = "Source files", required = true, separator = ";")
	public String[] sources;
	@DescriptorValue(value = "includePaths", separator = ";")
	public String[] includePaths = new String[0];
	@DescriptorValue(value = "libraryPaths", separator = ";")
	public String[] libraryPaths = new String[0];
	@DescriptorValue(value = "additionalLibraries", description = "File names, or paths relative to the working directory", separator = ";")
	public String[] additionalLibraries = new String[0];
	@DescriptorValue(value = "compilerFlags", separator = "\\s+")
	public String[] compilerFlags = new String[0];
	@DescriptorValue(value = "linkerFlags", separator = "\\s+")
	public String[] linkerFlags = new String[0];

	@DescriptorValue(value = "workingDirectory", description = "Defaults to the directory of the descriptor")
	public String workingDirectory;
	@DescriptorValue(value = "intermediaryDirectory", description = "Object files go here, one subdirectory per cell")
	public String intermediaryDirectory;
	@DescriptorValue(value = "outputDirectory", required = true)
	public String outputDirectory;
	@DescriptorValue(value = "outputFileName", description = "Artifact name without prefix or extension", required = true)
	public String outputFileName;
	@DescriptorValue(value = "outputAssemblyType", description = "SharedLibrary, StaticLibrary or Executable", required = true)
	public String outputAssemblyType;

	@DescriptorValue(value = "strictPaths", description = "Check every path against the file system while loading")
	public boolean strictPaths;
	@DescriptorValue(value = "autoCopyIncludes", description = "Copy headers next to built libraries")
	public boolean autoCopyIncludes;
	@DescriptorValue(value = "parallelJobs", description = "Cells built at once, 0 for unlimited")
	public int parallelJobs = 1;
	@DescriptorValue(value = "processTimeoutSeconds", description = "Per tool invocation, 0 to wait forever")
	public long processTimeoutSeconds;
}
