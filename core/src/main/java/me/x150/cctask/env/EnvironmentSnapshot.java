package me.x150.cctask.env;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Immutable, case-insensitive table of environment variables. A variable keeps the spelling it was first seen with;
 * merging only replaces values.
 */
public final class EnvironmentSnapshot {
	private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");
	private static final EnvironmentSnapshot EMPTY = new EnvironmentSnapshot(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

	private final SortedMap<String, String> variables;

	private EnvironmentSnapshot(TreeMap<String, String> variables) {
		this.variables = Collections.unmodifiableSortedMap(variables);
	}

	public static EnvironmentSnapshot empty() {
		return EMPTY;
	}

	public static EnvironmentSnapshot of(Map<String, String> variables) {
		TreeMap<String, String> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		map.putAll(variables);
		return new EnvironmentSnapshot(map);
	}

	public static EnvironmentSnapshot current() {
		return of(System.getenv());
	}

	/**
	 * Reads the {@code NAME=VALUE} lines a shell prints for its variable table. Each line is split at the first
	 * {@code =}; lines without one, or with a blank name, are skipped.
	 */
	public static Map<String, String> parseDump(String dump) {
		Map<String, String> parsed = new LinkedHashMap<>();
		for (String line : LINE_BREAK.split(dump)) {
			int eq = line.indexOf('=');
			if (eq < 0) continue;
			String name = line.substring(0, eq);
			if (name.isBlank()) continue;
			parsed.put(name, line.substring(eq + 1));
		}
		return parsed;
	}

	public @Nullable String get(String name) {
		return variables.get(name);
	}

	public boolean contains(String name) {
		return variables.containsKey(name);
	}

	public int size() {
		return variables.size();
	}

	public Map<String, String> asMap() {
		return variables;
	}

	public EnvironmentSnapshot with(String name, String value) {
		return merge(Map.of(name, value));
	}

	/**
	 * @return a new snapshot where the given variables replace or extend this one
	 */
	public EnvironmentSnapshot merge(Map<String, String> overrides) {
		TreeMap<String, String> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		map.putAll(variables);
		map.putAll(overrides);
		return new EnvironmentSnapshot(map);
	}

	public EnvironmentSnapshot mergeDump(String dump) {
		return merge(parseDump(dump));
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof EnvironmentSnapshot other && variables.equals(other.variables);
	}

	@Override
	public int hashCode() {
		int h = 0;
		for (Map.Entry<String, String> e : variables.entrySet()) {
			h += foldedHash(e.getKey()) ^ Objects.hashCode(e.getValue());
		}
		return h;
	}

	// same folding as String.CASE_INSENSITIVE_ORDER
	private static int foldedHash(String name) {
		int h = 0;
		for (int i = 0; i < name.length(); i++) {
			h = 31 * h + Character.toLowerCase(Character.toUpperCase(name.charAt(i)));
		}
		return h;
	}

	@Override
	public String toString() {
		return String.format("%s{%d variables}", getClass().getSimpleName(), variables.size());
	}
}
