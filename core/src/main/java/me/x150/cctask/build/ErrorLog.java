package me.x150.cctask.build;

import java.util.ArrayList;
import java.util.List;

/**
 * Failures of the latest run or clean, in the order they were recorded.
 */
public class ErrorLog {
	private final List<BuildError> entries = new ArrayList<>();

	synchronized void add(BuildError error) {
		entries.add(error);
	}

	synchronized void clear() {
		entries.clear();
	}

	public synchronized List<BuildError> entries() {
		return List.copyOf(entries);
	}

	public synchronized int size() {
		return entries.size();
	}

	public synchronized boolean isEmpty() {
		return entries.isEmpty();
	}

	public synchronized List<BuildError> ofKind(ErrorKind kind) {
		return entries.stream().filter(e -> e.kind() == kind).toList();
	}
}
