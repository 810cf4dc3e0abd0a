package me.x150.cctask.exc;

import me.x150.cctask.conf.Architecture;

import java.util.Set;

public class InvalidArchitectureSelectionException extends IllegalArgumentException {
	public InvalidArchitectureSelectionException(Set<Architecture> selection) {
		super("Exactly one architecture must be selected, got " + selection);
	}
}
