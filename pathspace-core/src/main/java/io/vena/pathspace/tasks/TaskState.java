package io.vena.pathspace.tasks;

/**
 * Lifecycle of a task held in a slot. Transitions only move forward.
 */
public enum TaskState {
	UNSCHEDULED,
	RUNNING,
	DONE,
}
