package me.x150.cctask.env;

import me.x150.cctask.conf.Architecture;
import me.x150.cctask.exc.EnvironmentCaptureException;
import me.x150.cctask.toolchain.ToolchainVersion;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Snapshots only depend on toolchain version and architecture, so cells sharing both share one capture.
 */
public class EnvironmentCache {
	private final EnvironmentResolver resolver;
	private final Map<Key, EnvironmentSnapshot> snapshots = new HashMap<>();

	public EnvironmentCache(EnvironmentResolver resolver) {
		this.resolver = resolver;
	}

	public synchronized EnvironmentSnapshot get(ToolchainVersion version, Path installPath, Architecture architecture) throws EnvironmentCaptureException, InterruptedException {
		Key key = new Key(version, architecture);
		EnvironmentSnapshot snapshot = snapshots.get(key);
		if (snapshot == null) {
			snapshot = resolver.resolve(installPath, architecture);
			snapshots.put(key, snapshot);
		}
		return snapshot;
	}

	private record Key(ToolchainVersion version, Architecture architecture) {
	}
}
