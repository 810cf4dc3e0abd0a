package me.x150.cctask.conf;

import lombok.Getter;
import lombok.Setter;
import me.x150.cctask.exc.ConfigurationException;
import me.x150.cctask.exc.ConfigurationException.Reason;
import me.x150.cctask.util.PathChecks;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One compilation request: what to compile, where to look for headers and libraries, which flags to pass and
 * where the artifact goes.
 * <p>
 * With {@link #isStrictPaths() strict paths} enabled, every path-valued setter checks the file system before
 * committing. A rejected value throws {@link ConfigurationException} and leaves the field as it was. Since bare
 * library names are looked up in the library paths configured <i>at that moment</i>, set library paths before
 * libraries.
 * <p>
 * List getters return unmodifiable copies and list setters copy their argument, so callers never share the
 * backing lists.
 */
public class CompilerTaskConfig {
	private List<String> sources = List.of();
	private List<String> includePaths = List.of();
	private List<String> libraryPaths = List.of();
	private List<String> additionalLibraries = List.of();
	private List<String> compilerFlags = List.of();
	private List<String> linkerFlags = List.of();

	/**
	 * Absolute, or empty when unset
	 */
	@Getter
	private String intermediaryDirectory = "";
	@Getter
	private String outputDirectory = "";
	@Getter
	private String outputFileName = "";
	@Getter
	@Setter
	private @NotNull AssemblyType outputAssemblyType = AssemblyType.UNSPECIFIED;
	@Getter
	@Setter
	private boolean strictPaths;
	@Getter
	@Setter
	private boolean autoCopyIncludes;
	@Getter
	private Path workingDirectory = Path.of("").toAbsolutePath();

	private static List<String> copyOf(@Nullable List<String> in) {
		return in == null ? List.of() : List.copyOf(in);
	}

	private static ConfigurationException reject(String field, String value, Reason reason, String message) {
		return new ConfigurationException(field, value, reason, String.format("%s: %s (%s)", field, message, value));
	}

	private Path parse(String field, String raw, String sane) throws ConfigurationException {
		Path p = PathChecks.containsIllegalPathCharacters(sane) ? null : PathChecks.tryParse(sane);
		if (p == null) throw reject(field, raw, Reason.ILLEGAL_CHARACTERS, "contains illegal path characters");
		return p;
	}

	public Path resolve(String value) {
		return workingDirectory.resolve(value).normalize();
	}

	public void setWorkingDirectory(@NotNull Path workingDirectory) throws ConfigurationException {
		Path abs = workingDirectory.toAbsolutePath().normalize();
		if (strictPaths && !Files.isDirectory(abs)) {
			throw reject("workingDirectory", workingDirectory.toString(), Files.exists(abs) ? Reason.NOT_A_DIRECTORY : Reason.MISSING, "working directory does not exist");
		}
		this.workingDirectory = abs;
	}

	public List<String> getSources() {
		return sources;
	}

	public void setSources(@Nullable List<String> sources) throws ConfigurationException {
		List<String> copy = copyOf(sources);
		if (strictPaths) {
			for (String entry : copy) {
				Path p = resolve(parse("sources", entry, PathChecks.toHostPath(entry)).toString());
				if (!Files.exists(p)) throw reject("sources", entry, Reason.MISSING, "source file could not be found");
				if (!Files.isRegularFile(p)) throw reject("sources", entry, Reason.NOT_A_FILE, "source is not a file");
			}
		}
		this.sources = copy;
	}

	public List<String> getIncludePaths() {
		return includePaths;
	}

	public void setIncludePaths(@Nullable List<String> includePaths) throws ConfigurationException {
		this.includePaths = checkDirectories("includePaths", includePaths);
	}

	public List<String> getLibraryPaths() {
		return libraryPaths;
	}

	public void setLibraryPaths(@Nullable List<String> libraryPaths) throws ConfigurationException {
		this.libraryPaths = checkDirectories("libraryPaths", libraryPaths);
	}

	private List<String> checkDirectories(String field, @Nullable List<String> in) throws ConfigurationException {
		List<String> out = new ArrayList<>();
		for (String entry : copyOf(in)) {
			String sane = PathChecks.toHostPath(entry);
			if (strictPaths) {
				Path p = resolve(parse(field, entry, sane).toString());
				if (!Files.exists(p)) throw reject(field, entry, Reason.MISSING, "directory does not exist");
				if (!Files.isDirectory(p)) throw reject(field, entry, Reason.NOT_A_DIRECTORY, "does not point to a directory");
			}
			out.add(sane);
		}
		return List.copyOf(out);
	}

	public List<String> getAdditionalLibraries() {
		return additionalLibraries;
	}

	public void setAdditionalLibraries(@Nullable List<String> additionalLibraries) throws ConfigurationException {
		List<String> copy = copyOf(additionalLibraries);
		if (strictPaths) {
			for (String entry : copy) {
				String sane = PathChecks.toHostPath(entry);
				Path parsed = parse("additionalLibraries", entry, sane);
				if (PathChecks.hasDirectoryPart(entry)) {
					Path p = resolve(parsed.toString());
					if (!Files.exists(p)) throw reject("additionalLibraries", entry, Reason.MISSING, "library could not be found");
					if (!Files.isRegularFile(p)) throw reject("additionalLibraries", entry, Reason.NOT_A_FILE, "library is not a file");
					continue;
				}
				if (libraryPaths.isEmpty()) {
					throw reject("additionalLibraries", entry, Reason.LIBRARY_PATHS_UNSET, "bare library name given but no library paths are configured");
				}
				boolean found = libraryPaths.stream().map(this::resolve).map(dir -> dir.resolve(sane)).anyMatch(Files::isRegularFile);
				if (!found) throw reject("additionalLibraries", entry, Reason.MISSING, "library not found in any library path");
			}
		}
		this.additionalLibraries = copy;
	}

	public List<String> getCompilerFlags() {
		return compilerFlags;
	}

	public void setCompilerFlags(@Nullable List<String> compilerFlags) {
		this.compilerFlags = copyOf(compilerFlags);
	}

	public List<String> getLinkerFlags() {
		return linkerFlags;
	}

	public void setLinkerFlags(@Nullable List<String> linkerFlags) {
		this.linkerFlags = copyOf(linkerFlags);
	}

	/**
	 * Must be absolute regardless of strictness, since cleaning deletes this directory recursively.
	 */
	public void setIntermediaryDirectory(@Nullable String intermediaryDirectory) throws ConfigurationException {
		if (intermediaryDirectory == null || intermediaryDirectory.isBlank()) {
			throw reject("intermediaryDirectory", String.valueOf(intermediaryDirectory), Reason.REQUIRED, "must not be empty");
		}
		Path p = parse("intermediaryDirectory", intermediaryDirectory, PathChecks.toHostPath(intermediaryDirectory));
		if (!p.isAbsolute()) {
			throw reject("intermediaryDirectory", intermediaryDirectory, Reason.NOT_ABSOLUTE, "must be an absolute path");
		}
		p = p.normalize();
		if (strictPaths) {
			Path parent = p.getParent();
			if (parent == null || !Files.isDirectory(parent)) {
				throw reject("intermediaryDirectory", intermediaryDirectory, Reason.MISSING, "parent directory does not exist");
			}
			if (Files.exists(p) && !Files.isDirectory(p)) {
				throw reject("intermediaryDirectory", intermediaryDirectory, Reason.NOT_A_DIRECTORY, "exists but is not a directory");
			}
		}
		this.intermediaryDirectory = p.toString();
	}

	public void setOutputDirectory(@Nullable String outputDirectory) throws ConfigurationException {
		String sane = outputDirectory == null ? "" : PathChecks.toHostPath(outputDirectory);
		if (strictPaths && !sane.isEmpty()) {
			Path p = resolve(parse("outputDirectory", outputDirectory, sane).toString());
			if (Files.exists(p) && !Files.isDirectory(p)) {
				throw reject("outputDirectory", outputDirectory, Reason.NOT_A_DIRECTORY, "exists but is not a directory");
			}
			Path parent = p.getParent();
			if (!Files.exists(p) && (parent == null || !Files.isDirectory(parent))) {
				throw reject("outputDirectory", outputDirectory, Reason.MISSING, "parent directory does not exist");
			}
		}
		this.outputDirectory = sane;
	}

	public void setOutputFileName(@Nullable String outputFileName) throws ConfigurationException {
		String name = outputFileName == null ? "" : outputFileName;
		if (strictPaths && PathChecks.containsIllegalFileNameCharacters(name)) {
			throw reject("outputFileName", name, Reason.ILLEGAL_CHARACTERS, "contains illegal file name characters");
		}
		this.outputFileName = name;
	}

	public boolean hasIntermediaryDirectory() {
		return !intermediaryDirectory.isEmpty();
	}
}
