package io.vena.pathspace.tasks;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskTokenTest {

	@Test
	void registerAndRelease_countsInFlight() {
		TaskToken token = new TaskToken();
		assertTrue(token.tryRegister());
		assertTrue(token.tryRegister());
		assertEquals(2, token.inFlight());
		token.release();
		token.release();
		assertEquals(0, token.inFlight());
	}

	@Test
	void invalidate_rejectsRegistration() {
		TaskToken token = new TaskToken();
		token.invalidate();
		assertFalse(token.isValid());
		assertFalse(token.tryRegister());
		assertEquals(0, token.inFlight());
	}

	@Test
	void release_unregistered_throws() {
		assertThrows(IllegalStateException.class, () -> new TaskToken().release());
	}

	@Test
	void invalidateAndAwait_waitsForRelease() throws InterruptedException {
		TaskToken token = new TaskToken();
		CountDownLatch registered = new CountDownLatch(1);
		Thread worker = new Thread(() -> {
			assertTrue(token.tryRegister());
			registered.countDown();
			try {
				Thread.sleep(100);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			} finally {
				token.release();
			}
		});
		worker.start();
		assertTrue(registered.await(5, TimeUnit.SECONDS));
		assertTrue(token.invalidateAndAwait(Duration.ofSeconds(5)));
		assertEquals(0, token.inFlight());
		assertFalse(token.tryRegister());
		worker.join();
	}

	@Test
	void invalidateAndAwait_timesOut() throws InterruptedException {
		TaskToken token = new TaskToken();
		assertTrue(token.tryRegister());
		assertFalse(token.invalidateAndAwait(Duration.ofMillis(50)));
		assertEquals(1, token.inFlight());
		token.release();
		assertTrue(token.invalidateAndAwait(Duration.ZERO));
	}
}
