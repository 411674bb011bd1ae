package io.vena.pathspace;

public enum TaskCategory {
	/**
	 * Queued on the worker pool as soon as it's inserted.
	 */
	IMMEDIATE,

	/**
	 * Runs on the thread of the first reader that finds it, at most once.
	 */
	LAZY,
}
