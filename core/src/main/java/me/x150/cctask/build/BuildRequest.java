package me.x150.cctask.build;

import me.x150.cctask.conf.Architecture;
import me.x150.cctask.conf.BuildConfiguration;
import me.x150.cctask.toolchain.ToolchainVersion;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * What to build a task for. Sets iterate in declaration order, which is the order cells are built in.
 *
 * @param minimumVersion the toolchain version that has to be installed
 */
public record BuildRequest(Set<BuildConfiguration> configurations, Set<Architecture> architectures, ToolchainVersion minimumVersion) {
	public BuildRequest {
		EnumSet<BuildConfiguration> cfg = EnumSet.noneOf(BuildConfiguration.class);
		cfg.addAll(configurations);
		EnumSet<Architecture> arch = EnumSet.noneOf(Architecture.class);
		arch.addAll(architectures);
		configurations = Collections.unmodifiableSet(cfg);
		architectures = Collections.unmodifiableSet(arch);
	}

	public int cellCount() {
		return configurations.size() * architectures.size();
	}
}
