package me.x150.cctask.conf.descriptor;

import lombok.extern.log4j.Log4j2;
import me.x150.cctask.build.BuildRequest;
import me.x150.cctask.conf.Architecture;
import me.x150.cctask.conf.AssemblyType;
import me.x150.cctask.conf.BuildConfiguration;
import me.x150.cctask.conf.CompilerTaskConfig;
import me.x150.cctask.exc.ConfigurationException;
import me.x150.cctask.exc.ConfigurationException.Reason;
import me.x150.cctask.toolchain.GccBackend;
import me.x150.cctask.toolchain.MsvcBackend;
import me.x150.cctask.toolchain.ToolchainBackend;
import me.x150.cctask.toolchain.ToolchainVersion;
import me.x150.cctask.util.PathChecks;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Turns a {@code .properties} task descriptor into a ready {@link CompilerTaskConfig} and {@link BuildRequest}.
 * A relative working directory is taken from the descriptor's directory, which is also the default; a relative
 * intermediary directory is taken from the working directory.
 */
@Log4j2
public class TaskDescriptorLoader {
	public LoadedTask load(Path descriptorFile) throws IOException, ConfigurationException {
		Properties props = new Properties();
		try (Reader reader = Files.newBufferedReader(descriptorFile, StandardCharsets.UTF_8)) {
			props.load(reader);
		}
		Path base = descriptorFile.toAbsolutePath().getParent();
		log.debug("Loading task descriptor {}", descriptorFile);
		return load(props, base);
	}

	public LoadedTask load(Properties props, Path baseDirectory) throws ConfigurationException {
		return build(read(props), baseDirectory.toAbsolutePath().normalize());
	}

	/**
	 * Fills a descriptor from raw properties. Unknown keys are logged and skipped.
	 *
	 * @throws ConfigurationException if a value cannot be converted, or listing every missing required key
	 */
	public TaskDescriptor read(Properties props) throws ConfigurationException {
		TaskDescriptor descriptor = new TaskDescriptor();
		for (String key : props.stringPropertyNames().stream().sorted().toList()) {
			if (!descriptor.hasKey(key)) {
				log.warn("Unknown descriptor key {}", key);
				continue;
			}
			String raw = props.getProperty(key);
			descriptor.setValue(key, convert(key, raw, descriptor.getValueType(key), descriptor.getMeta(key)));
		}
		Set<String> missing = descriptor.missingRequired();
		if (!missing.isEmpty()) {
			String joined = String.join(", ", missing);
			throw new ConfigurationException("descriptor", joined, Reason.REQUIRED, "Missing required descriptor keys: " + joined);
		}
		return descriptor;
	}

	private static Object convert(String key, String raw, Class<?> type, DescriptorValue meta) throws ConfigurationException {
		String value = raw.trim();
		if (type == String.class) return value;
		if (type == String[].class) {
			return Arrays.stream(value.split(meta.separator())).map(String::trim).filter(s -> !s.isEmpty()).toArray(String[]::new);
		}
		if (type == boolean.class) {
			if (value.equalsIgnoreCase("true")) return true;
			if (value.equalsIgnoreCase("false")) return false;
			throw malformed(key, raw, "expected true or false");
		}
		try {
			if (type == int.class) return Integer.parseInt(value);
			if (type == long.class) return Long.parseLong(value);
		} catch (NumberFormatException e) {
			throw malformed(key, raw, "expected a number");
		}
		throw new IllegalStateException("Unsupported descriptor field type " + type.getName() + " for " + key);
	}

	private static ConfigurationException malformed(String key, String value, String message) {
		return new ConfigurationException(key, value, Reason.MALFORMED, String.format("%s: %s (%s)", key, message, value));
	}

	static ToolchainBackend backendFor(String toolchain) throws ConfigurationException {
		return switch (toolchain.toLowerCase(Locale.ROOT)) {
			case "msvc" -> new MsvcBackend();
			case "gcc" -> new GccBackend();
			default -> throw malformed("toolchain", toolchain, "expected msvc or gcc");
		};
	}

	private LoadedTask build(TaskDescriptor d, Path base) throws ConfigurationException {
		ToolchainBackend backend = backendFor(d.toolchain);
		ToolchainVersion version = backend.parseVersion(d.minimumVersion);
		if (version == null) throw malformed("minimumVersion", d.minimumVersion, "unknown " + backend.name() + " version");

		EnumSet<BuildConfiguration> configurations = EnumSet.noneOf(BuildConfiguration.class);
		for (String name : d.configurations) {
			BuildConfiguration c = BuildConfiguration.byName(name);
			if (c == null) throw malformed("configurations", name, "expected Debug or Release");
			configurations.add(c);
		}
		EnumSet<Architecture> architectures = EnumSet.noneOf(Architecture.class);
		for (String name : d.architectures) {
			Architecture a = Architecture.byName(name);
			if (a == null) throw malformed("architectures", name, "expected x86 or x64");
			architectures.add(a);
		}
		AssemblyType type = AssemblyType.byName(d.outputAssemblyType);
		if (type == null) throw malformed("outputAssemblyType", d.outputAssemblyType, "expected SharedLibrary, StaticLibrary or Executable");

		// order matters: strictness and working directory affect every later check, libraries are searched in the library paths
		CompilerTaskConfig config = new CompilerTaskConfig();
		config.setStrictPaths(d.strictPaths);
		Path workingDirectory = d.workingDirectory == null || d.workingDirectory.isEmpty() ? base : base.resolve(PathChecks.toHostPath(d.workingDirectory));
		config.setWorkingDirectory(workingDirectory);
		config.setSources(List.of(d.sources));
		config.setIncludePaths(List.of(d.includePaths));
		config.setLibraryPaths(List.of(d.libraryPaths));
		config.setAdditionalLibraries(List.of(d.additionalLibraries));
		config.setCompilerFlags(List.of(d.compilerFlags));
		config.setLinkerFlags(List.of(d.linkerFlags));
		if (d.intermediaryDirectory != null && !d.intermediaryDirectory.isEmpty()) {
			Path intermediary = PathChecks.tryParse(PathChecks.toHostPath(d.intermediaryDirectory));
			String value = intermediary == null || intermediary.isAbsolute() ? d.intermediaryDirectory : config.resolve(intermediary.toString()).toString();
			config.setIntermediaryDirectory(value);
		}
		config.setOutputDirectory(d.outputDirectory);
		config.setOutputFileName(d.outputFileName);
		config.setOutputAssemblyType(type);
		config.setAutoCopyIncludes(d.autoCopyIncludes);

		Duration timeout = d.processTimeoutSeconds > 0 ? Duration.ofSeconds(d.processTimeoutSeconds) : null;
		log.debug("Loaded {} task for {} x {}", backend.name(), configurations, architectures);
		return new LoadedTask(backend, config, new BuildRequest(configurations, architectures, version), d.parallelJobs, timeout);
	}
}
