package me.x150.cctask.exec;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * @param executable          file name (searched for) or path of the program
 * @param executableDirectory if set, the executable is taken from this directory instead of being searched for
 * @param environment         variables layered over the current process environment
 * @param timeout             null waits forever
 * @param onStdout            receives stdout line by line; null echoes to the console
 * @param onStderr            receives stderr line by line; null echoes to the console
 */
@Builder(toBuilder = true)
public record Invocation(
		@NonNull Path workingDirectory,
		@NonNull String executable,
		@Nullable Path executableDirectory,
		@Singular List<String> args,
		@Singular("environmentVariable") Map<String, String> environment,
		@Nullable Duration timeout,
		@Nullable Consumer<String> onStdout,
		@Nullable Consumer<String> onStderr,
		@Nullable CancellationToken cancellation
) {
	public String commandLine() {
		StringBuilder sb = new StringBuilder(executable);
		for (String arg : args) {
			sb.append(' ').append(arg);
		}
		return sb.toString();
	}
}
