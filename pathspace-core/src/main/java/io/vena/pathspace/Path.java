package io.vena.pathspace;

import io.vena.pathspace.glob.GlobMatcher;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;

import static io.vena.pathspace.ErrorCode.INVALID_PATH;
import static io.vena.pathspace.ErrorCode.INVALID_PATH_SUBCOMPONENT;
import static java.util.Arrays.asList;
import static java.util.stream.Collectors.joining;
import static lombok.AccessLevel.PACKAGE;

/**
 * A sequence of segments leading from the root of a {@link PathSpace} to a node.
 *
 * <p>
 * A path is <em>concrete</em> if it names exactly one node, or a <em>glob</em> if one or more
 * of its segments contain wildcards (see {@link GlobMatcher}).
 * The last segment may carry an index suffix <code>[n]</code>, which selects
 * the n-th slot at that node rather than a different node.
 *
 * <p>
 * Parsing never throws for bad input: {@link #parse} reports problems as an
 * {@link ErrorCode#INVALID_PATH} or {@link ErrorCode#INVALID_PATH_SUBCOMPONENT} error.
 * Paths built programmatically with {@link #then} are not validated;
 * segments are taken literally.
 */
@RequiredArgsConstructor(access = PACKAGE)
public abstract class Path implements Iterable<String> {
	public abstract int length();

	public final boolean isEmpty() { return length() == 0; }

	public static Expected<Path> parse(String pathString) {
		return parse(pathString, ValidationLevel.BASIC);
	}

	/**
	 * @param pathString slash-separated segments with a leading slash; <code>"/"</code> is the root.
	 */
	public static Expected<Path> parse(String pathString, ValidationLevel level) {
		if (pathString == null || pathString.isEmpty()) {
			return Expected.failure(INVALID_PATH, "Empty path");
		} else if (!pathString.startsWith("/")) {
			return Expected.failure(INVALID_PATH, "Path must start with '/': \"" + pathString + "\"");
		} else if ("/".equals(pathString)) {
			return Expected.of(ROOT_PATH);
		}
		if (level != ValidationLevel.NONE && pathString.endsWith("/")) {
			return Expected.failure(INVALID_PATH, "Path ends with slash: \"" + pathString + "\"");
		}
		List<String> segments = asList(pathString.substring(1).split("/", -1));
		if (level != ValidationLevel.NONE) {
			for (String segment: segments) {
				SpaceError problem = segmentProblem(segment, level);
				if (problem != null) {
					return Expected.failure(problem);
				}
			}
		}
		Path result = ROOT_PATH.then(segments);
		if (result.index().isPresent() && result.isGlob()) {
			return Expected.failure(INVALID_PATH, "Indexed path cannot contain wildcards: \"" + pathString + "\"");
		}
		return Expected.of(result);
	}

	private static SpaceError segmentProblem(String segment, ValidationLevel level) {
		if (segment.isEmpty()) {
			return SpaceError.of(INVALID_PATH, "Empty path component");
		} else if (".".equals(segment) || "..".equals(segment)) {
			return SpaceError.of(INVALID_PATH_SUBCOMPONENT, "Relative paths not allowed: \"" + segment + "\"");
		} else if (level == ValidationLevel.FULL) {
			return bracketProblem(segment);
		} else {
			return null;
		}
	}

	private static SpaceError bracketProblem(String segment) {
		boolean escaped = false;
		int openedAt = -1;
		for (int i = 0; i < segment.length(); i++) {
			char ch = segment.charAt(i);
			if (escaped) {
				escaped = false;
			} else if (ch == '\\') {
				escaped = true;
			} else if (ch == '[') {
				if (openedAt >= 0) {
					return SpaceError.of(INVALID_PATH, "Nested brackets: \"" + segment + "\"");
				}
				openedAt = i;
			} else if (ch == ']') {
				if (openedAt < 0) {
					return SpaceError.of(INVALID_PATH, "Unmatched closing bracket: \"" + segment + "\"");
				}
				openedAt = -1;
			} else if (ch == '-' && openedAt >= 0) {
				int classStart = openedAt + 1;
				if (classStart < segment.length() && segment.charAt(classStart) == '!') {
					classStart++;
				}
				boolean hasLow = i > classStart;
				boolean hasHigh = i + 1 < segment.length() && segment.charAt(i + 1) != ']';
				if (!hasLow || !hasHigh || segment.charAt(i - 1) > segment.charAt(i + 1)) {
					return SpaceError.of(INVALID_PATH, "Invalid character range: \"" + segment + "\"");
				}
				// Skip the high end so "a-c-e" is treated as a range followed by a literal
				i++;
			}
		}
		if (openedAt >= 0) {
			return SpaceError.of(INVALID_PATH, "Unclosed bracket: \"" + segment + "\"");
		}
		return null;
	}

	/**
	 * @return Path with no segments
	 */
	public static Path root() {
		return ROOT_PATH;
	}

	/**
	 * Build a path out of the given segments, taken literally.
	 */
	public static Path of(String... segments) {
		return ROOT_PATH.then(segments);
	}

	public static Path of(List<String> segments) {
		return ROOT_PATH.then(segments);
	}

	public final Path then(String... segments) {
		return this.then(asList(segments));
	}

	public final Path then(List<String> segments) {
		Path result = this;
		for (String segment: segments) {
			result = new NestedPath(result, segment);
		}
		return result;
	}

	public final boolean isPrefixOf(Path other) {
		int excessSegments = other.length() - this.length();
		if (excessSegments >= 0) {
			return this.equals(other.truncatedBy(excessSegments));
		} else {
			return false;
		}
	}

	public final Path truncatedBy(int droppedSegments) {
		if (droppedSegments < 0) {
			throw new IllegalArgumentException("Negative number of segments to drop: " + droppedSegments);
		} else if (droppedSegments == 0) {
			return this;
		} else if (droppedSegments > length()) {
			throw new IllegalArgumentException("Cannot truncate " + droppedSegments + " segments from path of length " + length() + ": " + this);
		} else {
			return truncatedByImpl(droppedSegments);
		}
	}

	public final Path truncatedTo(int remainingSegments) {
		return truncatedBy(length() - remainingSegments);
	}

	public final String segment(int index) {
		return this.truncatedBy(length()-1-index).lastSegment();
	}

	/**
	 * @return the rightmost segment
	 * @throws IllegalArgumentException if {@link #isEmpty()}
	 */
	public abstract String lastSegment();

	public final boolean isGlob() {
		return segmentStream().anyMatch(GlobMatcher::isGlob);
	}

	public final boolean isConcrete() {
		return !isGlob();
	}

	/**
	 * @return the <code>n</code> from a trailing <code>[n]</code> on the last segment, if any.
	 * The suffix counts only when it has a non-empty base name before it and ends the segment.
	 */
	public final OptionalInt index() {
		if (isEmpty()) {
			return OptionalInt.empty();
		}
		String last = lastSegment();
		int open = indexSuffixStart(last);
		if (open < 0) {
			return OptionalInt.empty();
		}
		try {
			return OptionalInt.of(Integer.parseInt(last.substring(open + 1, last.length() - 1)));
		} catch (NumberFormatException e) {
			// Too many digits for an int; no slot can live at that index anyway
			return OptionalInt.of(Integer.MAX_VALUE);
		}
	}

	/**
	 * @return this path with any index suffix removed from its last segment
	 */
	public final Path withoutIndex() {
		if (isEmpty()) {
			return this;
		}
		String last = lastSegment();
		int open = indexSuffixStart(last);
		if (open < 0) {
			return this;
		} else {
			return truncatedBy(1).then(last.substring(0, open));
		}
	}

	private static int indexSuffixStart(String segment) {
		if (!segment.endsWith("]")) {
			return -1;
		}
		boolean escaped = false;
		for (int i = 0; i < segment.length(); i++) {
			char ch = segment.charAt(i);
			if (escaped) {
				escaped = false;
			} else if (ch == '\\') {
				escaped = true;
			} else if (ch == '[') {
				int digitsEnd = segment.length() - 1;
				if (i == 0 || digitsEnd == i + 1) {
					return -1;
				}
				for (int j = i + 1; j < digitsEnd; j++) {
					if (!Character.isDigit(segment.charAt(j))) {
						return -1;
					}
				}
				return i;
			}
		}
		return -1;
	}

	public final List<String> segments() {
		List<String> result = new ArrayList<>(length());
		forEach(result::add);
		return result;
	}

	@Override
	public final String toString() {
		return "/" + segmentStream().collect(joining("/"));
	}

	@Override
	public final boolean equals(Object obj) {
		if (this == obj) {
			return true;
		} else if (obj instanceof Path) {
			return toString().equals(obj.toString());
		} else {
			return false;
		}
	}

	@Override
	public final int hashCode() {
		return toString().hashCode();
	}

	@Override
	public final Iterator<String> iterator() {
		return segmentStream().iterator();
	}

	public final Stream<String> segmentStream() {
		Stream.Builder<String> builder = Stream.builder();
		addSegmentsTo(builder);
		return builder.build();
	}

	protected abstract void addSegmentsTo(Stream.Builder<String> builder);
	protected abstract Path truncatedByImpl(int n);

	/**
	 * A {@link Path} that isn't the root path <code>"/"</code>.
	 * Implemented as a linked list.
	 */
	private static final class NestedPath extends Path {
		private final Path prefix;
		private final String segment;
		private final int length;

		public NestedPath(Path prefix, String segment) {
			this.prefix = prefix;
			this.segment = segment;
			this.length = 1 + prefix.length();
		}

		@Override public int length() { return length; }
		@Override public String lastSegment() { return segment; }

		@Override
		protected void addSegmentsTo(Stream.Builder<String> builder) {
			prefix.addSegmentsTo(builder);
			builder.add(segment);
		}

		@Override
		protected Path truncatedByImpl(int n) {
			if (n == 0) {
				return this;
			} else {
				return prefix.truncatedByImpl(n-1);
			}
		}
	}

	/**
	 * Special subclass of {@link Path} representing the root path <code>"/"</code>.
	 *
	 * <p>
	 * Implementing this as its own subclass prevents lots of
	 * corner-case <code>if</code> statements elsewhere.
	 */
	@RequiredArgsConstructor
	private static final class RootPath extends Path {
		@Override public int length() { return 0; }

		@Override protected void addSegmentsTo(Stream.Builder<String> builder) { }

		@Override
		public String lastSegment() {
			throw new IllegalArgumentException("Root path has no lastSegment");
		}

		@Override
		protected Path truncatedByImpl(int n) {
			assert n == 0: "Should never be called with any value of n other than 0";
			return this;
		}
	}

	private static final Path ROOT_PATH = new RootPath();
}
