package me.x150.cctask.util;

import lombok.Builder;
import lombok.Singular;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Copies the files of one directory into another. Filters name either an extension ({@code .h}) or a whole file
 * name, compared without regard to case, and apply at every depth. An empty include set lets everything through
 * that is not excluded.
 */
@Builder
public class DirectoryCopier {
	private final boolean recursive;
	private final boolean overwrite;
	@Singular("include")
	private final Set<String> included;
	@Singular("exclude")
	private final Set<String> excluded;

	private static String extensionOf(String fileName) {
		int dot = fileName.lastIndexOf('.');
		return dot == -1 ? "" : fileName.substring(dot);
	}

	private static boolean matches(Set<String> filters, String name, String ext) {
		for (String filter : filters) {
			if (filter.equalsIgnoreCase(name) || (!ext.isEmpty() && filter.equalsIgnoreCase(ext))) return true;
		}
		return false;
	}

	public boolean accepts(Path file) {
		String name = file.getFileName().toString();
		String ext = extensionOf(name);
		if (matches(excluded, name, ext)) return false;
		return included.isEmpty() || matches(included, name, ext);
	}

	/**
	 * @throws NoSuchFileException               if the source is not a directory
	 * @throws java.nio.file.FileAlreadyExistsException if a target exists and overwriting is off
	 */
	public void copy(Path source, Path destination) throws IOException {
		if (!Files.isDirectory(source)) throw new NoSuchFileException(source.toString(), null, "source directory does not exist");
		Files.createDirectories(destination);
		List<Path> children;
		try (Stream<Path> list = Files.list(source)) {
			children = list.sorted().toList();
		}
		for (Path child : children) {
			Path target = destination.resolve(child.getFileName().toString());
			if (Files.isDirectory(child)) {
				if (recursive) copy(child, target);
			} else if (accepts(child)) {
				if (overwrite) Files.copy(child, target, StandardCopyOption.REPLACE_EXISTING);
				else Files.copy(child, target);
			}
		}
	}
}
