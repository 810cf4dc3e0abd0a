package me.x150.cctask.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UtilTest {
	@TempDir
	Path tmp;

	@Test
	public void testRmRf() throws Throwable {
		Path root = tmp.resolve("root");
		Files.createDirectories(root.resolve("a").resolve("b"));
		Files.writeString(root.resolve("a").resolve("b").resolve("f.obj"), "");
		Files.writeString(root.resolve("g.obj"), "");

		Util.rmRf(root);
		assertFalse(Files.exists(root));
		assertThrows(NoSuchFileException.class, () -> Util.rmRf(root));
	}
}
