package me.x150.cctask.toolchain;

public enum MsvcVersion implements ToolchainVersion {
	V11(11, "Visual Studio 2012"),
	V12(12, "Visual Studio 2013"),
	V14(14, "Visual Studio 2015");

	private final int major;
	private final String displayName;

	MsvcVersion(int major, String displayName) {
		this.major = major;
		this.displayName = displayName;
	}

	@Override
	public int major() {
		return major;
	}

	@Override
	public String displayName() {
		return displayName;
	}

	/**
	 * @return the variable the installer points at {@code <install>\Common7\Tools\}, e.g. {@code VS140COMNTOOLS}
	 */
	public String commonToolsVariable() {
		return "VS" + major + "0COMNTOOLS";
	}
}
