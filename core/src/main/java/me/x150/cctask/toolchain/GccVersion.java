package me.x150.cctask.toolchain;

public enum GccVersion implements ToolchainVersion {
	GCC_9(9),
	GCC_10(10),
	GCC_11(11),
	GCC_12(12),
	GCC_13(13),
	GCC_14(14);

	private final int major;

	GccVersion(int major) {
		this.major = major;
	}

	@Override
	public int major() {
		return major;
	}

	@Override
	public String displayName() {
		return "GCC " + major;
	}

	/**
	 * @return the versioned driver name distributions install next to plain {@code gcc}
	 */
	public String driverName() {
		return "gcc-" + major;
	}
}
