package me.x150.cctask.toolchain;

/**
 * One release of a toolchain. Implementations are enums whose declaration order is release order.
 */
public interface ToolchainVersion {
	int major();

	String displayName();
}
