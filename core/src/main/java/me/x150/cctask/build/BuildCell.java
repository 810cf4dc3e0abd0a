package me.x150.cctask.build;

import lombok.Getter;
import lombok.Setter;
import me.x150.cctask.conf.Architecture;
import me.x150.cctask.conf.BuildConfiguration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One (configuration, architecture) pair of a matrix run. Flag lists are the cell's own copies and are extended in
 * place while the cell's command lines are composed.
 */
@Getter
public class BuildCell {
	private final Id id;
	private final List<String> compilerFlags;
	private final List<String> linkerFlags;
	private final Path intermediaryDirectory;
	private final Path outputPath;
	@Setter
	private volatile Status status = Status.PENDING;

	BuildCell(Id id, List<String> compilerFlags, List<String> linkerFlags, Path intermediaryRoot, Path outputRoot, String artifactFileName) {
		this.id = id;
		this.compilerFlags = new ArrayList<>(compilerFlags);
		this.linkerFlags = new ArrayList<>(linkerFlags);
		this.intermediaryDirectory = intermediaryRoot.resolve(id.toString());
		this.outputPath = outputRoot.resolve(id.toString()).resolve(artifactFileName);
	}

	public enum Status {
		PENDING, COMPILING, LINKING, SUCCEEDED, FAILED
	}

	public record Id(BuildConfiguration configuration, Architecture architecture) {
		/**
		 * Doubles as the directory name of the cell, e.g. {@code Debug x64}
		 */
		@Override
		public String toString() {
			return configuration.getDisplayName() + " " + architecture.getDisplayName();
		}
	}
}
