package io.vena.pathspace;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.vena.pathspace.ErrorCode.INVALID_TYPE;
import static io.vena.pathspace.ErrorCode.TIMEOUT;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class BlockingTest extends AbstractPathSpaceTest {
	ExecutorService executor;

	@BeforeEach
	void setupExecutor() {
		executor = Executors.newCachedThreadPool();
	}

	@AfterEach
	void teardownExecutor() {
		executor.shutdownNow();
	}

	@Test
	void blockingRead_wokenByInsert() throws Exception {
		Future<Expected<String>> reader = executor.submit(() ->
			space.read("/mailbox", String.class, ReadOptions.blocking(Duration.ofSeconds(5))));
		awaitWaiters();
		space.insert("/mailbox", "letter");
		assertEquals("letter", reader.get(5, TimeUnit.SECONDS).value());
		assertEquals("letter", space.read("/mailbox", String.class).value(), "Read leaves the value");
	}

	@Test
	void blockingTake_globWokenByConcreteInsert() throws Exception {
		Future<Expected<Integer>> taker = executor.submit(() ->
			space.take("/jobs/*", Integer.class, ReadOptions.blocking(Duration.ofSeconds(5))));
		awaitWaiters();
		space.insert("/jobs/7", 7);
		assertEquals(7, taker.get(5, TimeUnit.SECONDS).value());
	}

	@Test
	void blockingRead_timesOut() {
		Duration timeout = Duration.ofMillis(200);
		long start = System.nanoTime();
		Expected<String> result = space.read("/empty", String.class, ReadOptions.blocking(timeout));
		long elapsed = System.nanoTime() - start;
		assertEquals(TIMEOUT, result.errorCode());
		assertThat(elapsed, greaterThanOrEqualTo(timeout.toNanos()));
		assertFalse(space.hasWaiters());
	}

	@Test
	void blockingRead_unrelatedInsertDoesNotSatisfy() {
		space.insert("/other/1", 1);
		Expected<Integer> result = space.read("/test/*", Integer.class, ReadOptions.blocking(Duration.ofMillis(100)));
		assertEquals(TIMEOUT, result.errorCode());
	}

	@Test
	void blockingRead_wrongTypeFailsImmediately() {
		space.insert("/typed", "string");
		long start = System.nanoTime();
		Expected<Integer> result = space.read("/typed", Integer.class, ReadOptions.blocking(Duration.ofSeconds(5)));
		assertEquals(INVALID_TYPE, result.errorCode());
		assertThat(System.nanoTime() - start, lessThan(Duration.ofSeconds(5).toNanos()));
	}

	@Test
	void competingTakers_eachValueTakenOnce() throws Exception {
		ReadOptions options = ReadOptions.blocking(Duration.ofSeconds(5));
		Future<Expected<Integer>> first = executor.submit(() -> space.take("/queue", Integer.class, options));
		Future<Expected<Integer>> second = executor.submit(() -> space.take("/queue", Integer.class, options));
		awaitWaiters();
		space.insert("/queue", 1);
		space.insert("/queue", 2);
		List<Integer> taken = new CopyOnWriteArrayList<>();
		taken.add(first.get(5, TimeUnit.SECONDS).value());
		taken.add(second.get(5, TimeUnit.SECONDS).value());
		assertThat(taken, containsInAnyOrder(1, 2));
	}

	@Test
	void manyProducersAndConsumers_noValueLostOrDuplicated() throws Exception {
		int count = 200;
		ReadOptions options = ReadOptions.blocking(Duration.ofSeconds(10));
		List<Future<Expected<Integer>>> consumers = new CopyOnWriteArrayList<>();
		for (int i = 0; i < count; i++) {
			consumers.add(executor.submit(() -> space.take("/work", Integer.class, options)));
		}
		for (int i = 0; i < count; i++) {
			int value = i;
			executor.submit(() -> space.insert("/work", value));
		}
		boolean[] seen = new boolean[count];
		for (Future<Expected<Integer>> consumer: consumers) {
			int value = consumer.get(20, TimeUnit.SECONDS).value();
			assertFalse(seen[value], "Value " + value + " taken twice");
			seen[value] = true;
		}
	}

	@Test
	void shutdown_wakesBlockedReaders() throws Exception {
		Future<Expected<String>> reader = executor.submit(() ->
			space.read("/never", String.class, ReadOptions.blocking(Duration.ofSeconds(30))));
		awaitWaiters();
		long start = System.nanoTime();
		space.shutdown();
		assertEquals(TIMEOUT, reader.get(10, TimeUnit.SECONDS).errorCode());
		assertThat(System.nanoTime() - start, lessThan(Duration.ofSeconds(10).toNanos()));
	}

	@Test
	void defaultTimeout_usedWhenUnset() {
		space.shutdown();
		space = new PathSpace(settings().defaultTimeout(Duration.ofMillis(100)).build());
		ReadOptions options = ReadOptions.builder().doBlock(true).build();
		Expected<String> result = space.read("/x", String.class, options);
		assertEquals(TIMEOUT, result.errorCode());
		assertThat(result.error().message(), containsString("within PT0.1S"));
	}
}
