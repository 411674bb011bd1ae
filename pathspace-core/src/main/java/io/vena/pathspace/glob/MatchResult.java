package io.vena.pathspace.glob;

import lombok.Value;

/**
 * Outcome of matching one glob component against one concrete component.
 *
 * <p>
 * A <em>supermatch</em> means the pattern contained <code>**</code> and
 * may go on to consume further path segments.
 */
@Value
public class MatchResult {
	boolean matched;
	boolean supermatch;

	public static final MatchResult NO_MATCH = new MatchResult(false, false);
	public static final MatchResult MATCH = new MatchResult(true, false);
	public static final MatchResult SUPERMATCH = new MatchResult(true, true);
}
