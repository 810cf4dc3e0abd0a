package me.x150.cctask.toolchain;

import java.util.List;

/**
 * Shell invocation that runs a toolchain's environment setup and then prints the resulting variables as
 * {@code NAME=VALUE} lines on stdout.
 */
public record SetupCommand(String shell, List<String> args) {
	public SetupCommand {
		args = List.copyOf(args);
	}
}
