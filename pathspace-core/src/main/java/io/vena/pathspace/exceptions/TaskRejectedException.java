package io.vena.pathspace.exceptions;

/**
 * Thrown by {@link io.vena.pathspace.tasks.TaskPool#submit} after the pool has begun shutting down.
 */
public class TaskRejectedException extends IllegalStateException {
	public TaskRejectedException(String message) { super(message); }
}
