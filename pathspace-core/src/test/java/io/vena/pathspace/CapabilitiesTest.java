package io.vena.pathspace;

import org.junit.jupiter.api.Test;

import static io.vena.pathspace.Permission.EXECUTE;
import static io.vena.pathspace.Permission.READ;
import static io.vena.pathspace.Permission.WRITE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapabilitiesTest {
	static final Path PUBLIC_A = Path.of("public", "a");
	static final Path PUBLIC_A_B = Path.of("public", "a", "b");
	static final Path PRIVATE_X = Path.of("private", "x");

	@Test
	void all_permitsEverything() {
		Capabilities all = Capabilities.all();
		for (Permission permission: Permission.values()) {
			assertTrue(all.permits(Path.root(), permission));
			assertTrue(all.permits(PUBLIC_A_B, permission));
		}
	}

	@Test
	void none_permitsNothing() {
		assertFalse(Capabilities.none().permits(Path.root(), READ));
		assertFalse(Capabilities.none().permits(PUBLIC_A, READ));
	}

	@Test
	void of_globRule_scopedToMatchingPaths() {
		Capabilities caps = Capabilities.of("/public/**", READ);
		assertTrue(caps.permits(PUBLIC_A, READ));
		assertTrue(caps.permits(PUBLIC_A_B, READ));
		assertFalse(caps.permits(PUBLIC_A, WRITE));
		assertFalse(caps.permits(PRIVATE_X, READ));
		assertFalse(caps.permits(Path.of("public"), READ), "Double star needs at least one segment");
	}

	@Test
	void with_accumulatesPermissions() {
		Capabilities caps = Capabilities.of("/public/*", READ)
			.with("/public/*", WRITE)
			.with("/private/x", EXECUTE);
		assertTrue(caps.permits(PUBLIC_A, READ));
		assertTrue(caps.permits(PUBLIC_A, WRITE));
		assertFalse(caps.permits(PUBLIC_A_B, READ));
		assertTrue(caps.permits(PRIVATE_X, EXECUTE));
		assertEquals(2, caps.rules().size());
	}

	@Test
	void allPermission_impliesOthers() {
		Capabilities caps = Capabilities.of("/private/*", Permission.ALL);
		assertTrue(caps.permits(PRIVATE_X, WRITE));
		assertTrue(caps.permits(PRIVATE_X, EXECUTE));
	}

	@Test
	void without_removesRule() {
		Capabilities caps = Capabilities.of("/public/*", READ).with("/private/*", READ);
		Capabilities reduced = caps.without("/private/*");
		assertTrue(reduced.permits(PUBLIC_A, READ));
		assertFalse(reduced.permits(PRIVATE_X, READ));
		assertTrue(caps.permits(PRIVATE_X, READ), "Original is unchanged");
	}

	@Test
	void equality() {
		assertEquals(Capabilities.of("/a", READ), Capabilities.none().with("/a", READ));
	}
}
