package me.x150.cctask.conf;

import me.x150.cctask.exc.ConfigurationException;
import me.x150.cctask.exc.ConfigurationException.Reason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompilerTaskConfigTest {
	@TempDir
	Path tmp;
	CompilerTaskConfig strict;

	private static Reason reasonOf(ConfigurationException e) {
		return e.getReason();
	}

	@BeforeEach
	void setUp() throws Throwable {
		Files.createDirectories(tmp.resolve("include"));
		Files.createDirectories(tmp.resolve("lib"));
		Files.writeString(tmp.resolve("main.c"), "");
		Files.writeString(tmp.resolve("lib").resolve("zlib.lib"), "");
		strict = new CompilerTaskConfig();
		strict.setStrictPaths(true);
		strict.setWorkingDirectory(tmp);
	}

	@Test
	public void testStrictSources() throws Throwable {
		strict.setSources(List.of("main.c"));
		assertEquals(List.of("main.c"), strict.getSources());

		ConfigurationException e = assertThrows(ConfigurationException.class, () -> strict.setSources(List.of("main.c", "missing.c")));
		assertEquals(Reason.MISSING, reasonOf(e));
		assertEquals("sources", e.getField());
		assertEquals("missing.c", e.getValue());
		// rejected values leave the field alone
		assertEquals(List.of("main.c"), strict.getSources());

		assertEquals(Reason.NOT_A_FILE, reasonOf(assertThrows(ConfigurationException.class, () -> strict.setSources(List.of("include")))));
	}

	@Test
	public void testStrictDirectories() throws Throwable {
		strict.setIncludePaths(List.of("include"));
		assertEquals(Reason.MISSING, reasonOf(assertThrows(ConfigurationException.class, () -> strict.setIncludePaths(List.of("nope")))));
		assertEquals(Reason.NOT_A_DIRECTORY, reasonOf(assertThrows(ConfigurationException.class, () -> strict.setLibraryPaths(List.of("main.c")))));
		assertEquals(Reason.ILLEGAL_CHARACTERS, reasonOf(assertThrows(ConfigurationException.class, () -> strict.setIncludePaths(List.of("in|clude")))));
		assertEquals(List.of("include"), strict.getIncludePaths());
	}

	@Test
	public void testSeparatorsAreNormalized() throws Throwable {
		CompilerTaskConfig config = new CompilerTaskConfig();
		config.setIncludePaths(List.of("inc//sub\\", "a\\\\b"));
		assertEquals(List.of("inc" + File.separator + "sub", "a" + File.separator + "b"), config.getIncludePaths());
	}

	@Test
	public void testLenientAcceptsAnything() throws Throwable {
		CompilerTaskConfig config = new CompilerTaskConfig();
		config.setSources(List.of("missing.c"));
		config.setIncludePaths(List.of("nowhere"));
		config.setAdditionalLibraries(List.of("foo.lib"));
		config.setOutputFileName("we:ird");
		assertEquals(List.of("foo.lib"), config.getAdditionalLibraries());
		assertEquals("we:ird", config.getOutputFileName());
	}

	@Test
	public void testBareLibrariesNeedLibraryPaths() throws Throwable {
		ConfigurationException e = assertThrows(ConfigurationException.class, () -> strict.setAdditionalLibraries(List.of("zlib.lib")));
		assertEquals(Reason.LIBRARY_PATHS_UNSET, reasonOf(e));

		strict.setLibraryPaths(List.of("lib"));
		strict.setAdditionalLibraries(List.of("zlib.lib"));
		assertEquals(List.of("zlib.lib"), strict.getAdditionalLibraries());

		assertEquals(Reason.MISSING, reasonOf(assertThrows(ConfigurationException.class, () -> strict.setAdditionalLibraries(List.of("other.lib")))));
	}

	@Test
	public void testLibrariesWithDirectoryPart() throws Throwable {
		strict.setAdditionalLibraries(List.of("lib/zlib.lib"));
		assertEquals(Reason.MISSING, reasonOf(assertThrows(ConfigurationException.class, () -> strict.setAdditionalLibraries(List.of("lib/other.lib")))));
		assertEquals(Reason.NOT_A_FILE, reasonOf(assertThrows(ConfigurationException.class, () -> strict.setAdditionalLibraries(List.of("./lib")))));
	}

	@Test
	public void testIntermediaryDirectory() throws Throwable {
		CompilerTaskConfig config = new CompilerTaskConfig();
		assertFalse(config.hasIntermediaryDirectory());
		assertEquals(Reason.REQUIRED, reasonOf(assertThrows(ConfigurationException.class, () -> config.setIntermediaryDirectory(" "))));
		assertEquals(Reason.REQUIRED, reasonOf(assertThrows(ConfigurationException.class, () -> config.setIntermediaryDirectory(null))));
		// relative paths are refused even without strict checking
		assertEquals(Reason.NOT_ABSOLUTE, reasonOf(assertThrows(ConfigurationException.class, () -> config.setIntermediaryDirectory("obj"))));

		config.setIntermediaryDirectory(tmp.resolve("obj").resolve("..").resolve("obj2").toString());
		assertEquals(tmp.resolve("obj2").toString(), config.getIntermediaryDirectory());
		assertTrue(config.hasIntermediaryDirectory());

		assertEquals(Reason.MISSING, reasonOf(assertThrows(ConfigurationException.class,
				() -> strict.setIntermediaryDirectory(tmp.resolve("a").resolve("b").toString()))));
		assertEquals(Reason.NOT_A_DIRECTORY, reasonOf(assertThrows(ConfigurationException.class,
				() -> strict.setIntermediaryDirectory(tmp.resolve("main.c").toString()))));
		strict.setIntermediaryDirectory(tmp.resolve("obj").toString());
	}

	@Test
	public void testOutputSettings() throws Throwable {
		assertEquals(Reason.ILLEGAL_CHARACTERS, reasonOf(assertThrows(ConfigurationException.class, () -> strict.setOutputFileName("a:b"))));
		strict.setOutputFileName("native");
		assertEquals(Reason.NOT_A_DIRECTORY, reasonOf(assertThrows(ConfigurationException.class, () -> strict.setOutputDirectory("main.c"))));
		assertEquals(Reason.MISSING, reasonOf(assertThrows(ConfigurationException.class, () -> strict.setOutputDirectory("x/y"))));
		strict.setOutputDirectory("bin/");
		assertEquals("bin", strict.getOutputDirectory());
		assertEquals(tmp.resolve("bin"), strict.resolve(strict.getOutputDirectory()));
	}

	@Test
	public void testWorkingDirectory() {
		assertEquals(Reason.MISSING, reasonOf(assertThrows(ConfigurationException.class, () -> strict.setWorkingDirectory(tmp.resolve("nope")))));
		assertEquals(tmp.toAbsolutePath().normalize(), strict.getWorkingDirectory());
	}

	@Test
	public void testListsAreCopied() throws Throwable {
		CompilerTaskConfig config = new CompilerTaskConfig();
		List<String> flags = new ArrayList<>(List.of("/W4"));
		config.setCompilerFlags(flags);
		flags.add("/WX");
		assertEquals(List.of("/W4"), config.getCompilerFlags());
		assertThrows(UnsupportedOperationException.class, () -> config.getCompilerFlags().add("/WX"));

		config.setLinkerFlags(null);
		assertTrue(config.getLinkerFlags().isEmpty());
	}
}
