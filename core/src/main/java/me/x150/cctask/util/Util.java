package me.x150.cctask.util;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

public class Util {
	/**
	 * Deletes a directory tree. Symbolic links are removed, not followed. Stops at the first failure.
	 */
	public static void rmRf(Path p) throws IOException {
		Files.walkFileTree(p, new FileVisitor<>() {
			@Override
			public @NotNull FileVisitResult preVisitDirectory(Path file, @NotNull BasicFileAttributes attrs) {
				return FileVisitResult.CONTINUE;
			}

			@Override
			public @NotNull FileVisitResult visitFile(Path file, @NotNull BasicFileAttributes attrs) throws IOException {
				Files.delete(file);
				return FileVisitResult.CONTINUE;
			}

			@Override
			public @NotNull FileVisitResult visitFileFailed(Path file, @NotNull IOException exc) throws IOException {
				throw exc;
			}

			@Override
			public @NotNull FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
				if (exc != null) throw exc;
				Files.delete(dir);
				return FileVisitResult.CONTINUE;
			}
		});
	}
}
