package me.x150.cctask.util;

import org.jetbrains.annotations.Nullable;

import java.io.File;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class PathChecks {
	private static final Pattern SEPARATOR_RUN = Pattern.compile("[/\\\\]+");
	private static final String ILLEGAL_PATH_CHARS = "\"<>|";
	private static final String ILLEGAL_FILE_NAME_CHARS = ILLEGAL_PATH_CHARS + "/\\:*?";

	/**
	 * Collapses every run of forward or backward slashes into the host separator and drops a trailing separator.
	 * A lone root ("/") is kept.
	 */
	public static String toHostPath(String value) {
		if (value.isEmpty()) return value;
		String replaced = SEPARATOR_RUN.matcher(value).replaceAll(Matcher.quoteReplacement(File.separator));
		if (replaced.length() > 1 && replaced.endsWith(File.separator)) {
			replaced = replaced.substring(0, replaced.length() - 1);
		}
		return replaced;
	}

	public static boolean containsIllegalPathCharacters(String value) {
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c < 0x20 || ILLEGAL_PATH_CHARS.indexOf(c) != -1) return true;
		}
		return false;
	}

	public static boolean containsIllegalFileNameCharacters(String value) {
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c < 0x20 || ILLEGAL_FILE_NAME_CHARS.indexOf(c) != -1) return true;
		}
		return false;
	}

	/**
	 * @return true if the value names more than a bare file, i.e. it carries at least one directory component
	 */
	public static boolean hasDirectoryPart(String value) {
		return value.indexOf('/') != -1 || value.indexOf('\\') != -1;
	}

	/**
	 * @return the parsed path, or null if the host file system refuses it
	 */
	public static @Nullable Path tryParse(String value) {
		try {
			return Path.of(value);
		} catch (InvalidPathException e) {
			return null;
		}
	}
}
