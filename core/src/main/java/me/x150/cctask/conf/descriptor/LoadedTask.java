package me.x150.cctask.conf.descriptor;

import me.x150.cctask.build.BuildRequest;
import me.x150.cctask.conf.BuildContext;
import me.x150.cctask.conf.CompilerTaskConfig;
import me.x150.cctask.env.EnvironmentSnapshot;
import me.x150.cctask.exec.ProcessRunner;
import me.x150.cctask.toolchain.ToolchainBackend;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;

public record LoadedTask(ToolchainBackend backend, CompilerTaskConfig config, BuildRequest request, int parallelJobs,
						 @Nullable Duration processTimeout) {
	public BuildContext toContext(ProcessRunner runner, EnvironmentSnapshot environment) {
		return BuildContext.builder()
				.backend(backend)
				.processRunner(runner)
				.environment(environment)
				.pJobs(parallelJobs)
				.processTimeout(processTimeout)
				.build();
	}
}
