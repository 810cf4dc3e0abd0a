package me.x150.cctask.exc;

import lombok.Getter;

/**
 * Thrown when a configuration value is rejected. The offending field keeps its previous value.
 */
@Getter
public class ConfigurationException extends Exception {
	private final String field;
	private final String value;
	private final Reason reason;

	public ConfigurationException(String field, String value, Reason reason, String message) {
		super(message);
		this.field = field;
		this.value = value;
		this.reason = reason;
	}

	public enum Reason {
		/**
		 * A value required at this point was not given
		 */
		REQUIRED,
		ILLEGAL_CHARACTERS,
		MISSING,
		NOT_A_DIRECTORY,
		NOT_A_FILE,
		NOT_ABSOLUTE,
		/**
		 * A bare library name was given before any library path was configured
		 */
		LIBRARY_PATHS_UNSET,
		/**
		 * A value could not be converted into the type the key expects
		 */
		MALFORMED
	}
}
