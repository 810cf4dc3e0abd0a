package me.x150.cctask.toolchain;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Installed toolchain versions and their install paths, as found by one discovery pass. Read-only.
 */
public final class ToolchainRegistry {
	private final Map<ToolchainVersion, Path> installs;

	public ToolchainRegistry(Map<? extends ToolchainVersion, Path> installs) {
		this.installs = Collections.unmodifiableMap(new LinkedHashMap<>(installs));
	}

	public boolean contains(ToolchainVersion version) {
		return installs.containsKey(version);
	}

	public Optional<Path> installPath(ToolchainVersion version) {
		return Optional.ofNullable(installs.get(version));
	}

	public Set<ToolchainVersion> versions() {
		return installs.keySet();
	}

	public boolean isEmpty() {
		return installs.isEmpty();
	}

	public int size() {
		return installs.size();
	}

	@Override
	public String toString() {
		return String.format("%s%s", getClass().getSimpleName(), installs);
	}
}
