package io.vena.pathspace;

/**
 * The kinds of failure a {@link PathSpace} operation can report through {@link SpaceError}.
 */
public enum ErrorCode {
	/**
	 * Nothing exists at the requested path.
	 */
	NO_SUCH_PATH,

	/**
	 * The path exists but its queue holds no live slot (or the index is out of range).
	 */
	NO_OBJECT_FOUND,

	INVALID_PATH,
	INVALID_PATH_SUBCOMPONENT,
	MALFORMED_INPUT,
	UNMATCHED_QUOTES,

	/**
	 * The front slot holds a value of a different type than requested.
	 */
	INVALID_TYPE,
	TYPE_MISMATCH,

	/**
	 * A blocking operation reached its deadline, or the space shut down while it waited.
	 */
	TIMEOUT,

	CAPABILITY_MISMATCH,
	CAPABILITY_WRITE_MISSING,
	CAPACITY_EXCEEDED,
	UNSERIALIZABLE_TYPE,
	SERIALIZATION_FUNCTION_MISSING,
	MEMORY_ALLOCATION_FAILED,

	/**
	 * A task's function threw. The slot keeps reporting this until it is taken.
	 */
	TASK_FAILED,

	UNKNOWN_ERROR,
}
