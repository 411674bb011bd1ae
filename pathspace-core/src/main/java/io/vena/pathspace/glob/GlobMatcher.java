package io.vena.pathspace.glob;

import java.util.Arrays;
import java.util.List;

/**
 * Stateless wildcard matching for path components and whole paths.
 *
 * <p>
 * Supported syntax within a component:
 * <ul>
 * <li><code>?</code> matches any single character</li>
 * <li><code>*</code> matches zero or more characters, by skipping ahead to the next
 *     occurrence of the pattern's following character</li>
 * <li><code>**</code> matches and additionally reports a supermatch, allowing the
 *     match to continue across <code>/</code></li>
 * <li><code>[abc]</code>, <code>[a-z]</code>, <code>[!a-z]</code> character classes</li>
 * <li><code>\</code> escapes the following character</li>
 * </ul>
 *
 * <p>
 * A single <code>*</code> does not backtrack: <code>a*b*c</code> aligns each star with the
 * first occurrence of the following literal. Patterns that need the second occurrence
 * (eg. <code>*ab</code> against <code>aab</code>) don't match.
 */
public final class GlobMatcher {
	private GlobMatcher() { }

	public static MatchResult match(String pattern, String candidate) {
		int patternLength = pattern.length();
		int candidateLength = candidate.length();
		int p = 0;
		int c = 0;
		while (c < candidateLength) {
			if (p >= patternLength) {
				return MatchResult.NO_MATCH;
			}
			char pc = pattern.charAt(p);
			if (pc == '\\') {
				p++;
				if (p < patternLength && pattern.charAt(p) == candidate.charAt(c)) {
					p++;
					c++;
				} else {
					return MatchResult.NO_MATCH;
				}
			} else if (pc == '?') {
				p++;
				c++;
			} else if (pc == '*') {
				int next = p + 1;
				if (next < patternLength && pattern.charAt(next) == '*') {
					return MatchResult.SUPERMATCH;
				}
				if (next == patternLength) {
					return MatchResult.MATCH;
				}
				int aligned = candidate.indexOf(pattern.charAt(next), c);
				if (aligned < 0) {
					return MatchResult.NO_MATCH;
				}
				p = next;
				c = aligned;
			} else if (pc == '[') {
				p++;
				boolean negated = false;
				if (p < patternLength && pattern.charAt(p) == '!') {
					negated = true;
					p++;
				}
				char ch = candidate.charAt(c);
				boolean inClass = false;
				while (p < patternLength && pattern.charAt(p) != ']') {
					if (p + 2 < patternLength && pattern.charAt(p + 1) == '-' && pattern.charAt(p + 2) != ']') {
						if (pattern.charAt(p) <= ch && ch <= pattern.charAt(p + 2)) {
							inClass = true;
						}
						p += 3;
					} else {
						if (pattern.charAt(p) == ch) {
							inClass = true;
						}
						p++;
					}
				}
				if (p == patternLength) {
					// Unterminated class
					return MatchResult.NO_MATCH;
				}
				p++;
				if (inClass == negated) {
					return MatchResult.NO_MATCH;
				}
				c++;
			} else if (pc == candidate.charAt(c)) {
				p++;
				c++;
			} else {
				return MatchResult.NO_MATCH;
			}
		}

		while (p < patternLength && pattern.charAt(p) == '*') {
			p++;
		}
		return (p == patternLength) ? MatchResult.MATCH : MatchResult.NO_MATCH;
	}

	/**
	 * Matches a whole <code>/</code>-separated path, component by component.
	 * Neither argument is validated; both are expected to start with <code>/</code>.
	 */
	public static boolean matchPath(String pattern, String candidate) {
		return matchSegments(segmentsOf(pattern), segmentsOf(candidate));
	}

	/**
	 * @param pattern glob components, possibly containing <code>**</code>
	 * @param candidate concrete components
	 */
	public static boolean matchSegments(List<String> pattern, List<String> candidate) {
		return matchFrom(pattern, 0, candidate, 0);
	}

	private static boolean matchFrom(List<String> pattern, int p, List<String> candidate, int c) {
		if (p == pattern.size() || c == candidate.size()) {
			return p == pattern.size() && c == candidate.size();
		}
		MatchResult result = match(pattern.get(p), candidate.get(c));
		if (!result.matched()) {
			return false;
		} else if (result.supermatch()) {
			// The component absorbs candidate[c] and any number of following segments
			for (int next = c + 1; next <= candidate.size(); next++) {
				if (matchFrom(pattern, p + 1, candidate, next)) {
					return true;
				}
			}
			return false;
		} else {
			return matchFrom(pattern, p + 1, candidate, c + 1);
		}
	}

	/**
	 * Two-way matching between keys that may each be concrete or glob:
	 * true if they're equal, or either one is a glob that matches the other.
	 */
	public static boolean matchEitherWay(String a, String b) {
		if (a.equals(b)) {
			return true;
		} else if (isGlob(a) && matchPath(a, b)) {
			return true;
		} else {
			return isGlob(b) && matchPath(b, a);
		}
	}

	/**
	 * @return true if <code>component</code> contains an unescaped wildcard character.
	 * A digits-only index like <code>name[3]</code> at the end of a component doesn't count,
	 * so this also works on whole path strings.
	 */
	public static boolean isGlob(String component) {
		boolean escaped = false;
		for (int i = 0; i < component.length(); i++) {
			char ch = component.charAt(i);
			if (escaped) {
				escaped = false;
			} else if (ch == '\\') {
				escaped = true;
			} else if (ch == '[') {
				int close = component.indexOf(']', i + 1);
				if (close > i + 1 && isAllDigits(component, i + 1, close) && (close + 1 == component.length() || component.charAt(close + 1) == '/')) {
					i = close;
				} else {
					return true;
				}
			} else if (ch == '*' || ch == '?' || ch == ']') {
				return true;
			}
		}
		return false;
	}

	static List<String> segmentsOf(String path) {
		if (path.isEmpty() || "/".equals(path)) {
			return List.of();
		}
		String body = path.startsWith("/") ? path.substring(1) : path;
		return Arrays.asList(body.split("/", -1));
	}

	private static boolean isAllDigits(String s, int from, int to) {
		for (int i = from; i < to; i++) {
			char ch = s.charAt(i);
			if (ch < '0' || ch > '9') {
				return false;
			}
		}
		return true;
	}
}
