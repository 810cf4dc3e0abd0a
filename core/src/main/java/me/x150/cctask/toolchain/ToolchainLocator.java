package me.x150.cctask.toolchain;

import lombok.extern.log4j.Log4j2;
import me.x150.cctask.env.EnvironmentSnapshot;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Finds installed toolchain versions. Every call probes again; nothing is cached, since installs change between
 * runs. A version counts as installed only if its probe yields an install root and the compiler binary exists
 * beneath it. Finding nothing is not an error.
 */
@Log4j2
public class ToolchainLocator {
	private final ToolchainBackend backend;
	private final EnvironmentSnapshot environment;

	public ToolchainLocator(ToolchainBackend backend, EnvironmentSnapshot environment) {
		this.backend = backend;
		this.environment = environment;
	}

	public ToolchainRegistry discover() {
		return discover(backend.knownVersions());
	}

	public ToolchainRegistry discover(Collection<? extends ToolchainVersion> candidates) {
		Map<ToolchainVersion, Path> found = new LinkedHashMap<>();
		for (ToolchainVersion candidate : candidates) {
			Optional<Path> root = backend.probeInstallPath(candidate, environment);
			if (root.isEmpty()) {
				log.trace("{}: no install hint for {}", backend.name(), candidate.displayName());
				continue;
			}
			Path compiler = backend.compilerBinary(candidate, root.get());
			if (!Files.isRegularFile(compiler)) {
				log.debug("{}: {} points at {}, but {} does not exist", backend.name(), candidate.displayName(), root.get(), compiler);
				continue;
			}
			found.put(candidate, root.get());
		}
		log.debug("{}: found {} of {} candidate version(s): {}", backend.name(), found.size(), candidates.size(), found.keySet());
		return new ToolchainRegistry(found);
	}
}
