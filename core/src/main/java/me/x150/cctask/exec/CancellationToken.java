package me.x150.cctask.exec;

import lombok.extern.log4j.Log4j2;

import java.util.HashSet;
import java.util.Set;

/**
 * Shared between every process of one task. Cancelling kills all registered processes, and any process registered
 * afterwards is killed immediately.
 */
@Log4j2
public class CancellationToken {
	private final Set<Process> running = new HashSet<>();
	private boolean cancelled;

	public synchronized boolean isCancelled() {
		return cancelled;
	}

	public void cancel() {
		Set<Process> toKill;
		synchronized (this) {
			if (cancelled) return;
			cancelled = true;
			toKill = new HashSet<>(running);
			running.clear();
		}
		log.info("Cancelling, killing {} running process(es)", toKill.size());
		toKill.forEach(LocalProcessRunner::killTree);
	}

	/**
	 * @return false if the token was already cancelled, in which case the process has been killed
	 */
	boolean register(Process process) {
		synchronized (this) {
			if (!cancelled) {
				running.add(process);
				return true;
			}
		}
		LocalProcessRunner.killTree(process);
		return false;
	}

	synchronized void unregister(Process process) {
		running.remove(process);
	}
}
