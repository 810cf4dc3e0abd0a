package me.x150.cctask.conf.descriptor;

import me.x150.cctask.conf.Architecture;
import me.x150.cctask.conf.AssemblyType;
import me.x150.cctask.conf.BuildConfiguration;
import me.x150.cctask.conf.BuildContext;
import me.x150.cctask.env.EnvironmentSnapshot;
import me.x150.cctask.exc.ConfigurationException;
import me.x150.cctask.exc.ConfigurationException.Reason;
import me.x150.cctask.toolchain.GccBackend;
import me.x150.cctask.toolchain.GccVersion;
import me.x150.cctask.toolchain.MsvcBackend;
import me.x150.cctask.toolchain.MsvcVersion;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskDescriptorLoaderTest {
	@TempDir
	Path tmp;

	private static Properties minimal() {
		Properties p = new Properties();
		p.setProperty("toolchain", "msvc");
		p.setProperty("minimumVersion", "14");
		p.setProperty("configurations", "Debug, Release");
		p.setProperty("architectures", "x64");
		p.setProperty("sources", "src/a.c; src/b.c");
		p.setProperty("outputDirectory", "bin");
		p.setProperty("outputFileName", "native");
		p.setProperty("outputAssemblyType", "SharedLibrary");
		return p;
	}

	@Test
	public void testLoadsDescriptorFile() throws Throwable {
		Path file = tmp.resolve("task.properties");
		Files.writeString(file, String.join("\n",
				"# native part of the project",
				"toolchain = gcc",
				"minimumVersion = gcc-12",
				"configurations = Release",
				"architectures = x86,x64",
				"sources = a.c;b.c",
				"includePaths = include",
				"compilerFlags = -Wall   -Werror",
				"linkerFlags = -lpthread",
				"intermediaryDirectory = obj",
				"outputDirectory = out",
				"outputFileName = native",
				"outputAssemblyType = StaticLibrary",
				"autoCopyIncludes = true",
				"parallelJobs = 0",
				"processTimeoutSeconds = 90",
				"somethingElse = ignored"));

		LoadedTask task = new TaskDescriptorLoader().load(file);

		assertInstanceOf(GccBackend.class, task.backend());
		assertEquals(GccVersion.GCC_12, task.request().minimumVersion());
		assertEquals(EnumSet.of(BuildConfiguration.RELEASE), task.request().configurations());
		assertEquals(EnumSet.allOf(Architecture.class), task.request().architectures());
		assertEquals(List.of("a.c", "b.c"), task.config().getSources());
		assertEquals(List.of("-Wall", "-Werror"), task.config().getCompilerFlags());
		assertEquals(List.of("-lpthread"), task.config().getLinkerFlags());
		assertEquals(tmp.toAbsolutePath().normalize(), task.config().getWorkingDirectory());
		assertEquals(tmp.toAbsolutePath().normalize().resolve("obj").toString(), task.config().getIntermediaryDirectory());
		assertEquals(AssemblyType.STATIC_LIBRARY, task.config().getOutputAssemblyType());
		assertTrue(task.config().isAutoCopyIncludes());
		assertEquals(0, task.parallelJobs());
		assertEquals(Duration.ofSeconds(90), task.processTimeout());
	}

	@Test
	public void testDefaults() throws Throwable {
		LoadedTask task = new TaskDescriptorLoader().load(minimal(), tmp);

		assertInstanceOf(MsvcBackend.class, task.backend());
		assertEquals(MsvcVersion.V14, task.request().minimumVersion());
		assertEquals(List.of("src/a.c", "src/b.c"), task.config().getSources());
		assertTrue(task.config().getIncludePaths().isEmpty());
		assertFalse(task.config().hasIntermediaryDirectory());
		assertFalse(task.config().isStrictPaths());
		assertEquals(1, task.parallelJobs());
		assertNull(task.processTimeout());

		BuildContext context = task.toContext(inv -> 0, EnvironmentSnapshot.empty());
		assertEquals(1, context.pJobs());
		assertInstanceOf(MsvcBackend.class, context.backend());
	}

	@Test
	public void testEveryMissingKeyIsReported() {
		Properties p = new Properties();
		p.setProperty("toolchain", "msvc");
		ConfigurationException e = assertThrows(ConfigurationException.class, () -> new TaskDescriptorLoader().read(p));
		assertEquals(Reason.REQUIRED, e.getReason());
		assertEquals("architectures, configurations, minimumVersion, outputAssemblyType, outputDirectory, outputFileName, sources", e.getValue());
	}

	@Test
	public void testMalformedValues() {
		TaskDescriptorLoader loader = new TaskDescriptorLoader();
		String[][] cases = {
				{"toolchain", "clang"},
				{"minimumVersion", "99"},
				{"configurations", "Debug,Profile"},
				{"architectures", "arm64"},
				{"outputAssemblyType", "Bundle"},
				{"strictPaths", "yes"},
				{"parallelJobs", "many"},
		};
		for (String[] c : cases) {
			Properties p = minimal();
			p.setProperty(c[0], c[1]);
			ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(p, tmp), c[0]);
			assertEquals(Reason.MALFORMED, e.getReason(), c[0]);
			assertEquals(c[0], e.getField());
		}
	}

	@Test
	public void testStrictPathsApplyBeforeOtherKeys() throws Throwable {
		Properties p = minimal();
		p.setProperty("strictPaths", "true");
		ConfigurationException e = assertThrows(ConfigurationException.class, () -> new TaskDescriptorLoader().load(p, tmp));
		assertEquals("sources", e.getField());
		assertEquals(Reason.MISSING, e.getReason());

		Files.createDirectories(tmp.resolve("src"));
		Files.writeString(tmp.resolve("src").resolve("a.c"), "");
		Files.writeString(tmp.resolve("src").resolve("b.c"), "");
		Files.createDirectories(tmp.resolve("libs"));
		Files.writeString(tmp.resolve("libs").resolve("z.lib"), "");
		p.setProperty("libraryPaths", "libs");
		p.setProperty("additionalLibraries", "z.lib");
		LoadedTask task = new TaskDescriptorLoader().load(p, tmp);
		assertEquals(List.of("z.lib"), task.config().getAdditionalLibraries());
	}

	@Test
	public void testWorkingDirectoryIsRelativeToDescriptor() throws Throwable {
		Properties p = minimal();
		p.setProperty("workingDirectory", "native");
		LoadedTask task = new TaskDescriptorLoader().load(p, tmp);
		assertEquals(tmp.toAbsolutePath().normalize().resolve("native"), task.config().getWorkingDirectory());
	}

	@Test
	public void testDescriptorFields() throws Throwable {
		TaskDescriptor descriptor = new TaskDescriptorLoader().read(minimal());
		assertTrue(descriptor.isSet("sources"));
		assertFalse(descriptor.isSet("includePaths"));
		assertArrayEquals(new String[]{"src/a.c", "src/b.c"}, (String[]) descriptor.getValue("sources"));
		assertEquals(String[].class, descriptor.getValueType("compilerFlags"));
		assertEquals(int.class, descriptor.getValueType("parallelJobs"));
		assertTrue(descriptor.missingRequired().isEmpty());
		assertEquals(19, descriptor.getKeys().length);
	}
}
