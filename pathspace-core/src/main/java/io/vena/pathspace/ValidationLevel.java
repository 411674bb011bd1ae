package io.vena.pathspace;

/**
 * How strictly {@link Path#parse(String, ValidationLevel)} checks its input.
 */
public enum ValidationLevel {
	/**
	 * Only a leading slash is required. Segments are taken as-is.
	 */
	NONE,

	/**
	 * Rejects trailing slashes, empty segments, and <code>.</code> or <code>..</code> segments.
	 */
	BASIC,

	/**
	 * Like {@link #BASIC}, and also rejects malformed wildcard brackets and character ranges.
	 */
	FULL,
}
