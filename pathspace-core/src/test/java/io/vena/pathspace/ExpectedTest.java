package io.vena.pathspace;

import io.vena.pathspace.exceptions.SpaceErrorException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

import static io.vena.pathspace.ErrorCode.NO_SUCH_PATH;
import static io.vena.pathspace.ErrorCode.TIMEOUT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpectedTest {

	@Test
	void value() {
		Expected<String> expected = Expected.of("x");
		assertTrue(expected.hasValue());
		assertFalse(expected.hasError());
		assertEquals("x", expected.value());
		assertNull(expected.errorCode());
		assertThrows(IllegalStateException.class, expected::error);
		assertThrows(IllegalStateException.class, expected::propagate);
	}

	@Test
	void failure() {
		Expected<String> expected = Expected.failure(NO_SUCH_PATH, "gone");
		assertTrue(expected.hasError());
		assertEquals(NO_SUCH_PATH, expected.errorCode());
		assertEquals("gone", expected.error().message());
		assertEquals("fallback", expected.orElse("fallback"));
		SpaceErrorException e = assertThrows(SpaceErrorException.class, expected::value);
		assertEquals(NO_SUCH_PATH, e.error().code());
	}

	@Test
	void propagate_keepsError() {
		Expected<String> failed = Expected.failure(SpaceError.of(TIMEOUT));
		Expected<Integer> propagated = failed.propagate();
		assertSame(failed.error(), propagated.error());
	}

	@Test
	void flatMap_and_ifPresent() {
		List<Integer> seen = new ArrayList<>();
		Expected.of(2).flatMap(n -> Expected.of(n * 10)).ifPresent(seen::add);
		Expected.<Integer>failure(TIMEOUT, "late").flatMap(n -> Expected.of(n * 10)).ifPresent(seen::add);
		assertEquals(List.of(20), seen);
		assertEquals(TIMEOUT, Expected.of(1).flatMap(n -> Expected.<Integer>failure(TIMEOUT, "x")).errorCode());
	}

	@Test
	void spaceError_toString() {
		assertEquals("TIMEOUT", SpaceError.of(TIMEOUT).toString());
		assertEquals("TIMEOUT: late", SpaceError.of(TIMEOUT, "late").toString());
		assertFalse(SpaceError.of(TIMEOUT).optionalMessage().isPresent());
	}
}
