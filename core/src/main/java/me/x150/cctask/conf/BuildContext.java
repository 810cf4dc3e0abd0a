package me.x150.cctask.conf;

import lombok.Builder;
import lombok.NonNull;
import me.x150.cctask.env.EnvironmentSnapshot;
import me.x150.cctask.exec.ProcessRunner;
import me.x150.cctask.toolchain.ToolchainBackend;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Collaborators and knobs of one executor.
 *
 * @param environment    ambient environment discovery and setup scripts see; normally {@link EnvironmentSnapshot#current()}
 * @param pJobs          cells built at once; zero or less is unlimited
 * @param processTimeout limit per external process; null waits forever
 */
@Builder
public record BuildContext(
		@NonNull ToolchainBackend backend,
		@NonNull ProcessRunner processRunner,
		@NonNull EnvironmentSnapshot environment,
		int pJobs,
		@Nullable Duration processTimeout
) {
	public ExecutorService parallelExecutorForNThreads() {
		if (pJobs <= 0) return Executors.newCachedThreadPool(); // unlimited
		if (pJobs == 1) return Executors.newSingleThreadExecutor(); // keeps declared order
		return Executors.newFixedThreadPool(pJobs);
	}
}
