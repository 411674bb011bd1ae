package io.vena.pathspace;

public enum Permission {
	READ,
	WRITE,
	EXECUTE,

	/**
	 * Implies every other permission.
	 */
	ALL,
}
