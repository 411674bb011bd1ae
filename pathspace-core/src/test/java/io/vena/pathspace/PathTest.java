package io.vena.pathspace;

import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static io.vena.pathspace.ErrorCode.INVALID_PATH;
import static io.vena.pathspace.ErrorCode.INVALID_PATH_SUBCOMPONENT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathTest {

	@ParameterizedTest
	@ValueSource(strings = { "/a", "/a/b", "/a/b/c", "/with spaces", "/ints[3]", "/a*/b", "/**" })
	void parse_valid_roundTrips(String pathString) {
		Path path = Path.parse(pathString).value();
		assertEquals(pathString, path.toString());
		assertEquals(path, Path.parse(path.toString()).value());
	}

	@Test
	void parse_root() {
		Path root = Path.parse("/").value();
		assertSame(Path.root(), root);
		assertTrue(root.isEmpty());
		assertEquals("/", root.toString());
	}

	@ParameterizedTest
	@ValueSource(strings = { "", "relative", "/a/", "/a//b", "/a*/b[3]" })
	void parse_invalid_invalidPath(String pathString) {
		assertEquals(INVALID_PATH, Path.parse(pathString).errorCode());
	}

	@ParameterizedTest
	@ValueSource(strings = { "/.", "/a/..", "/a/./b" })
	void parse_relativeSegments_invalidSubcomponent(String pathString) {
		assertEquals(INVALID_PATH_SUBCOMPONENT, Path.parse(pathString).errorCode());
	}

	@Test
	void parse_noValidation_acceptsTrailingSlash() {
		Path path = Path.parse("/a/", ValidationLevel.NONE).value();
		assertEquals(List.of("a", ""), path.segments());
	}

	@ParameterizedTest
	@ValueSource(strings = { "/a[b", "/a]b", "/[c-a]", "/[a[b]]", "/[-a]" })
	void parse_fullValidation_badBrackets(String pathString) {
		assertTrue(Path.parse(pathString, ValidationLevel.BASIC).hasValue(), "Basic validation ignores brackets");
		assertEquals(INVALID_PATH, Path.parse(pathString, ValidationLevel.FULL).errorCode());
	}

	@ParameterizedTest
	@ValueSource(strings = { "/[a-c]x", "/[!a-c]", "/ints[3]", "/a\\[b" })
	void parse_fullValidation_goodBrackets(String pathString) {
		assertTrue(Path.parse(pathString, ValidationLevel.FULL).hasValue());
	}

	@Test
	void index_present() {
		Path path = Path.parse("/a/ints[12]").value();
		assertEquals(OptionalInt.of(12), path.index());
		assertEquals(Path.of("a", "ints"), path.withoutIndex());
	}

	@Test
	void index_absent() {
		assertEquals(OptionalInt.empty(), Path.parse("/a/ints").value().index());
		assertEquals(OptionalInt.empty(), Path.root().index());
		// No base name before the bracket
		assertEquals(OptionalInt.empty(), Path.of("[3]").index());
		// Only the last segment counts
		assertEquals(OptionalInt.empty(), Path.parse("/a[3]/b").value().index());
	}

	@Test
	void index_overflow_maxValue() {
		assertEquals(OptionalInt.of(Integer.MAX_VALUE), Path.parse("/ints[99999999999]").value().index());
	}

	@Test
	void isGlob() {
		assertTrue(Path.parse("/a/*").value().isGlob());
		assertTrue(Path.parse("/a/**").value().isGlob());
		assertTrue(Path.parse("/a?/b").value().isGlob());
		assertFalse(Path.parse("/a/b").value().isGlob());
		assertFalse(Path.parse("/ints[3]").value().isGlob());
		assertTrue(Path.parse("/ints[3]").value().isConcrete());
	}

	@Test
	void then_truncate_prefix() {
		Path ab = Path.of("a", "b");
		Path abc = ab.then("c");
		assertEquals("/a/b/c", abc.toString());
		assertEquals(3, abc.length());
		assertEquals("b", abc.segment(1));
		assertEquals("c", abc.lastSegment());
		assertEquals(ab, abc.truncatedBy(1));
		assertEquals(Path.of("a"), abc.truncatedTo(1));
		assertTrue(ab.isPrefixOf(abc));
		assertTrue(Path.root().isPrefixOf(abc));
		assertFalse(abc.isPrefixOf(ab));
		assertFalse(Path.of("x").isPrefixOf(abc));
	}

	@Test
	void truncate_tooFar_throws() {
		assertThrows(IllegalArgumentException.class, () -> Path.of("a").truncatedBy(2));
		assertThrows(IllegalArgumentException.class, () -> Path.of("a").truncatedBy(-1));
		assertThrows(IllegalArgumentException.class, () -> Path.root().lastSegment());
	}

	@Test
	void iterator_yieldsSegments() {
		List<String> segments = new java.util.ArrayList<>();
		for (String segment: Path.of("x", "y")) {
			segments.add(segment);
		}
		assertEquals(List.of("x", "y"), segments);
	}
}
