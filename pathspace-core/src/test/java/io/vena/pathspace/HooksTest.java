package io.vena.pathspace;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

import static io.vena.pathspace.Permission.READ;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;

class HooksTest extends AbstractPathSpaceTest {

	@Test
	void subscribe_calledForMatchingInserts() {
		List<Path> changes = new CopyOnWriteArrayList<>();
		Subscription subscription = space.subscribe("/events/*", changes::add).value();
		space.insert("/events/1", "a");
		space.insert("/other/1", "b");
		space.insert("/events/2", "c");
		assertThat(changes, contains(Path.of("events", "1"), Path.of("events", "2")));

		subscription.close();
		space.insert("/events/3", "d");
		assertEquals(2, changes.size());
	}

	@Test
	void subscribe_calledForTakes() {
		space.insert("/jobs/1", "a");
		List<Path> changes = new CopyOnWriteArrayList<>();
		space.subscribe("/jobs/*", changes::add);
		space.read("/jobs/*", String.class);
		assertThat(changes, empty());
		space.take("/jobs/*", String.class);
		assertThat(changes, contains(Path.of("jobs", "1")));
	}

	@Test
	void subscribe_named() {
		Subscription subscription = space.subscribe("audit", "/x", path -> { }, Capabilities.all()).value();
		assertEquals("audit", subscription.name());
		assertEquals("/x", subscription.key());
	}

	@Test
	void subscribe_taskCompletionNotifies() {
		List<Path> changes = new CopyOnWriteArrayList<>();
		space.subscribe("/lazy", changes::add);
		space.insert("/lazy", Task.lazy(Integer.class, () -> 1));
		space.read("/lazy", Integer.class);
		// Once for the insert, once for the completion
		assertThat(changes, contains(Path.of("lazy"), Path.of("lazy")));
	}

	@Test
	void subscribe_restrictedCapabilities_seeOnlyReadablePaths() {
		List<Path> changes = new CopyOnWriteArrayList<>();
		space.subscribe("/**", changes::add, Capabilities.of("/open/**", READ));
		space.insert("/open/1", 1);
		space.insert("/closed/1", 1);
		assertThat(changes, contains(Path.of("open", "1")));
	}

	@Test
	void hooksTriggeredByHooks_runBreadthFirst() {
		List<String> calls = new CopyOnWriteArrayList<>();
		space.subscribe("/start", path -> {
			calls.add("start");
			space.insert("/second", 2);
			space.insert("/third", 3);
		});
		space.subscribe("/second", path -> {
			calls.add("second");
			space.insert("/fourth", 4);
		});
		space.subscribe("/third", path -> calls.add("third"));
		space.subscribe("/fourth", path -> calls.add("fourth"));
		space.insert("/start", 1);
		assertThat(calls, contains("start", "second", "third", "fourth"));
	}

	@Test
	void hookException_doesNotBreakInsert() {
		List<Path> changes = new CopyOnWriteArrayList<>();
		space.subscribe("/boom", path -> {
			throw new IllegalStateException("Deliberate hook failure");
		});
		space.subscribe("/boom", changes::add);
		assertEquals(1, space.insert("/boom", 1).nbrInserted());
		assertEquals(1, changes.size());
	}

	@Test
	void subscribe_invalidPath() {
		assertEquals(ErrorCode.INVALID_PATH, space.subscribe("no-slash", path -> { }).errorCode());
	}

	@Test
	void shutdown_dropsSubscriptions() {
		List<Path> changes = new CopyOnWriteArrayList<>();
		space.subscribe("/x", changes::add);
		space.shutdown();
		space.insert("/x", 1);
		assertThat(changes, empty());
	}
}
