package io.vena.pathspace;

import io.vena.pathspace.PathTree.Lookup;
import io.vena.pathspace.PathTree.Target;
import io.vena.pathspace.codecs.Codec;
import io.vena.pathspace.exceptions.CodecException;
import io.vena.pathspace.exceptions.TaskRejectedException;
import io.vena.pathspace.tasks.TaskPool;
import io.vena.pathspace.tasks.TaskState;
import io.vena.pathspace.tasks.TaskToken;
import io.vena.pathspace.wait.WaitMap;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.pathspace.ErrorCode.CAPABILITY_MISMATCH;
import static io.vena.pathspace.ErrorCode.CAPABILITY_WRITE_MISSING;
import static io.vena.pathspace.ErrorCode.CAPACITY_EXCEEDED;
import static io.vena.pathspace.ErrorCode.INVALID_PATH;
import static io.vena.pathspace.ErrorCode.TIMEOUT;
import static io.vena.pathspace.ErrorCode.UNKNOWN_ERROR;
import static io.vena.pathspace.ErrorCode.UNSERIALIZABLE_TYPE;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

/**
 * A hierarchical, path-addressed store that behaves like a concurrent tuple space.
 *
 * <p>
 * Each path holds a FIFO queue of values. Producers {@link #insert} values, or {@link Task}s
 * that compute values, at paths. Consumers {@link #read} (peek) or {@link #take} (pop)
 * the oldest value of a requested type, optionally blocking until one arrives.
 * Any of these may use glob paths (see {@link io.vena.pathspace.glob.GlobMatcher}):
 * a glob insert goes to every existing matching node, and a glob read serves
 * the first matching node, in name order, whose oldest value has the requested type.
 *
 * <p>
 * No operation throws for bad input or failed lookups; outcomes are reported through
 * {@link Expected} and {@link InsertReturn}. A failed operation leaves the store unchanged,
 * except that a glob insert keeps whatever it managed to insert before hitting an error.
 *
 * <p>
 * Values are stored encoded, using the {@link io.vena.pathspace.codecs.CodecRegistry}
 * from {@link PathSpaceSettings#codecs()}, and read back by exact class.
 *
 * @see Capabilities
 * @see SpaceHook
 */
public final class PathSpace implements AutoCloseable {
	private final PathSpaceSettings settings;
	private final PathTree tree;
	private final WaitMap waitMap = new WaitMap();
	private final TaskPool pool;
	private final boolean ownsPool;
	private final TaskToken taskToken = new TaskToken();
	private final SpaceDiagnosticContext diagnosticContext = new SpaceDiagnosticContext();
	private final HookQueue hooks = new HookQueue(diagnosticContext);
	private final @Nullable ScheduledExecutorService sweeper;
	private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
	private final AtomicInteger subscriptionCounter = new AtomicInteger();

	public PathSpace() {
		this(PathSpaceSettings.defaults());
	}

	public PathSpace(PathSpaceSettings settings) {
		this(settings, null);
	}

	/**
	 * @param sharedPool runs this space's immediate tasks. If null, the space creates its own
	 * pool, and shuts it down in {@link #shutdown()}. A shared pool is left running.
	 */
	public PathSpace(@NonNull PathSpaceSettings settings, @Nullable TaskPool sharedPool) {
		settings.validate();
		this.settings = settings;
		this.tree = new PathTree(settings.clock(), settings.maxSlotsPerNode());
		if (sharedPool == null) {
			this.pool = new TaskPool(settings.name(), settings.workerThreads());
			this.ownsPool = true;
		} else {
			this.pool = sharedPool;
			this.ownsPool = false;
		}
		Duration sweepInterval = settings.ttlSweepInterval();
		if (sweepInterval.isZero()) {
			this.sweeper = null;
		} else {
			this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
				Thread t = new Thread(r, settings.name() + "-ttl-sweeper");
				t.setDaemon(true);
				return t;
			});
			sweeper.scheduleWithFixedDelay(this::sweepExpired, sweepInterval.toNanos(), sweepInterval.toNanos(), TimeUnit.NANOSECONDS);
		}
		LOGGER.debug("Created PathSpace {}", settings.name());
	}

	public String name() {
		return settings.name();
	}

	public PathSpaceSettings settings() {
		return settings;
	}

	public SpaceDiagnosticContext diagnosticContext() {
		return diagnosticContext;
	}

	///////////////////////
	//
	//  Insert
	//

	public <T> InsertReturn<T> insert(String path, T value) {
		return insert(path, value, InsertOptions.defaults());
	}

	/**
	 * Appends <code>value</code> to the queue at <code>path</code>.
	 *
	 * <p>
	 * A concrete path creates any missing nodes along the way. A glob path appends to every
	 * existing node it matches, and creates none.
	 *
	 * <p>
	 * If <code>value</code> is a {@link Task}, each target gets a slot holding its own execution
	 * of that task, and readers see the task's result as a {@link Task#resultType()}.
	 */
	public <T> InsertReturn<T> insert(String pathString, @NonNull T value, @NonNull InsertOptions options) {
		if (shuttingDown.get()) {
			return InsertReturn.failure(SpaceError.of(UNKNOWN_ERROR, "PathSpace " + name() + " is shut down"));
		}
		Expected<Path> parsed = Path.parse(pathString, options.validationLevel());
		if (parsed.hasError()) {
			return InsertReturn.failure(parsed.error());
		}
		Path path = parsed.value();
		if (path.isEmpty()) {
			return InsertReturn.failure(SpaceError.of(INVALID_PATH, "Cannot insert at the root path"));
		} else if (path.index().isPresent()) {
			return InsertReturn.failure(SpaceError.of(INVALID_PATH, "Cannot insert at an indexed path: " + path));
		}

		Task<?> task = (value instanceof Task) ? (Task<?>) value : null;
		Class<?> storedType = (task == null) ? value.getClass() : task.resultType();
		Expected<? extends Codec<?>> codec = settings.codecs().lookup(storedType);
		if (codec.hasError()) {
			return InsertReturn.failure(codec.error());
		}
		byte[] payload = null;
		if (task == null) {
			try {
				payload = encode(codec.value(), value);
			} catch (CodecException e) {
				LOGGER.debug("Unable to encode {} for {}", storedType.getSimpleName(), path, e);
				return InsertReturn.failure(SpaceError.of(UNSERIALIZABLE_TYPE, "Unable to encode " + storedType.getName() + ": " + e.getMessage()));
			}
		}

		Instant expiry = (options.ttl() == null) ? null : settings.clock().instant().plus(options.ttl());
		Capabilities capabilities = options.capabilities();
		List<Path> targetPaths = path.isGlob()
			? tree.matching(path).stream().map(Target::path).collect(toList())
			: List.of(path);
		LOGGER.debug("Insert {} at {} ({} target{})", storedType.getSimpleName(), path, targetPaths.size(), (targetPaths.size() == 1)? "":"s");

		InsertReturn.Accumulator<T> result = InsertReturn.accumulator();
		for (Path targetPath: targetPaths) {
			if (result.nbrInserted() >= options.maxInsertions()) {
				result.failed(SpaceError.of(CAPACITY_EXCEEDED, "Insertion limit " + options.maxInsertions() + " reached before " + targetPath));
				continue;
			} else if (!capabilities.permits(targetPath, Permission.WRITE)) {
				result.failed(SpaceError.of(CAPABILITY_WRITE_MISSING, "Write not permitted at " + targetPath));
				continue;
			} else if (task != null && task.category() == TaskCategory.IMMEDIATE && !capabilities.permits(targetPath, Permission.EXECUTE)) {
				result.failed(SpaceError.of(CAPABILITY_MISMATCH, "Execute not permitted at " + targetPath));
				continue;
			}

			// Glob targets already exist; this only creates nodes for a concrete path
			Target target = new Target(targetPath, tree.findOrCreate(targetPath));
			TaskExecution<?> execution = (task == null) ? null : newExecution(task, codec.value(), targetPath);
			byte[] encoded = payload;
			SpaceError error = tree.append(target, sequence -> (execution == null)
				? Slot.ofValue(storedType, sequence, expiry, encoded)
				: Slot.ofTask(execution, sequence, expiry),
				options.waitForLocks());
			if (error != null) {
				result.failed(error);
				continue;
			}
			result.inserted(targetPath, value, task != null);
			if (execution != null && execution.category() == TaskCategory.IMMEDIATE) {
				schedule(execution);
			}
			changed(targetPath);
		}
		return result.build();
	}

	@SuppressWarnings("unchecked")
	private static <T> byte[] encode(Codec<?> codec, Object value) throws CodecException {
		return ((Codec<T>) codec).encode((T) value);
	}

	@SuppressWarnings("unchecked")
	private <T> TaskExecution<T> newExecution(Task<T> task, Codec<?> codec, Path path) {
		return new TaskExecution<>(task, (Codec<T>) codec, path, name(), taskToken, diagnosticContext, this::taskDone);
	}

	private void schedule(TaskExecution<?> execution) {
		ExecutionOptions options = execution.task().options();
		try {
			pool.submit(execution, options.priority(), options.interval());
		} catch (TaskRejectedException e) {
			// The task token decides whether it may still run
			LOGGER.debug("Pool rejected task at {}; resolving it inline", execution.path(), e);
			execution.runIfUnscheduled();
		}
	}

	private void taskDone(TaskExecution<?> execution) {
		LOGGER.debug("Task at {} done", execution.path());
		changed(execution.path());
	}

	private void changed(Path path) {
		waitMap.notify(path.toString());
		hooks.trigger(path);
	}

	///////////////////////
	//
	//  Read and take
	//

	public <T> Expected<T> read(String path, Class<T> type) {
		return read(path, type, ReadOptions.defaults());
	}

	/**
	 * Returns the oldest value at <code>path</code> without removing it.
	 *
	 * <p>
	 * An index suffix like <code>/queue[2]</code> returns the third-oldest value instead.
	 * A glob path returns the oldest value of the first matching node (in name order)
	 * whose oldest value is a <code>type</code>.
	 */
	public <T> Expected<T> read(String path, Class<T> type, ReadOptions options) {
		return extract(path, type, options, false);
	}

	public <T> Expected<T> take(String path, Class<T> type) {
		return take(path, type, ReadOptions.defaults());
	}

	/**
	 * Like {@link #read} but removes the value. When several threads race to take
	 * the same value, exactly one gets it.
	 *
	 * <p>
	 * A taker that runs a lazy task releases the node before taking the result, so a
	 * concurrent taker may get the value instead; the one that ran the task then sees
	 * {@link ErrorCode#NO_OBJECT_FOUND}, or keeps waiting if the read is blocking.
	 */
	public <T> Expected<T> take(String path, Class<T> type, ReadOptions options) {
		return extract(path, type, options, true);
	}

	public <T> Expected<T> grab(String path, Class<T> type) {
		return take(path, type);
	}

	public <T> Expected<T> grab(String path, Class<T> type, ReadOptions options) {
		return take(path, type, options);
	}

	private <T> Expected<T> extract(String pathString, @NonNull Class<T> type, @NonNull ReadOptions options, boolean remove) {
		Expected<Path> parsed = Path.parse(pathString, options.validationLevel());
		if (parsed.hasError()) {
			return parsed.propagate();
		}
		Path path = parsed.value();
		Expected<Codec<T>> codec = settings.codecs().lookup(type);
		if (codec.hasError()) {
			return codec.propagate();
		}
		Duration timeout = options.doBlock()
			? (options.timeout() == null ? settings.defaultTimeout() : options.timeout())
			: settings.taskWaitTimeout();
		long deadline = System.nanoTime() + timeout.toNanos();
		Lookup<T> outcome;
		try {
			outcome = extractUntil(path, type, codec.value(), options, remove, timeout, deadline);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return Expected.failure(TIMEOUT, "Interrupted while waiting at " + path);
		}
		if (outcome.removedFrom() != null) {
			changed(outcome.removedFrom());
		}
		return requireNonNull(outcome.result());
	}

	/**
	 * @return a finished lookup: never pending
	 */
	private <T> Lookup<T> extractUntil(Path path, Class<T> type, Codec<T> codec, ReadOptions options, boolean remove, Duration timeout, long deadline) throws InterruptedException {
		Capabilities capabilities = options.capabilities();
		Supplier<Lookup<T>> attempt = () -> tree.lookup(path, type, codec, capabilities, remove);
		while (true) {
			Lookup<T> lookup = attempt.get();
			if (lookup.isRetryable() && options.doBlock()) {
				lookup = awaitValue(path.withoutIndex().toString(), attempt, deadline);
				if (lookup == null) {
					return Lookup.done(TIMEOUT, "Nothing arrived at " + path + " within " + timeout);
				}
			}
			if (!lookup.isPending()) {
				return lookup;
			}
			SpaceError problem = realize(requireNonNull(lookup.pendingTask()), capabilities, deadline);
			if (problem != null) {
				return Lookup.done(Expected.failure(problem));
			}
		}
	}

	/**
	 * Blocks until <code>attempt</code> produces something other than "nothing there".
	 *
	 * @return the non-retryable lookup, or null on timeout or shutdown
	 */
	private <T> @Nullable Lookup<T> awaitValue(String waitKey, Supplier<Lookup<T>> attempt, long deadline) throws InterruptedException {
		AtomicReference<Lookup<T>> latest = new AtomicReference<>();
		try (var guard = waitMap.waitFor(waitKey)) {
			// The first evaluation happens after registration, so an insert can't slip in unnoticed
			boolean satisfied = guard.waitUntil(deadline, () -> {
				if (shuttingDown.get()) {
					return true;
				}
				Lookup<T> lookup = attempt.get();
				latest.set(lookup);
				return !lookup.isRetryable();
			});
			Lookup<T> result = latest.get();
			if (!satisfied || result == null || result.isRetryable()) {
				LOGGER.debug("Gave up waiting at {}", waitKey);
				return null;
			}
			return result;
		}
	}

	/**
	 * Makes sure <code>task</code> is done: runs it here if it's lazy and nobody has
	 * started it, otherwise waits for whoever is running it.
	 *
	 * @return null if the task is done; otherwise the reason it isn't
	 */
	private @Nullable SpaceError realize(TaskExecution<?> task, Capabilities capabilities, long deadline) throws InterruptedException {
		if (task.category() == TaskCategory.LAZY && task.state() == TaskState.UNSCHEDULED) {
			if (!capabilities.permits(task.path(), Permission.EXECUTE)) {
				return SpaceError.of(CAPABILITY_MISMATCH, "Execute not permitted at " + task.path());
			}
			if (task.runIfUnscheduled()) {
				return null;
			}
		}
		try (var guard = waitMap.waitFor(task.path().toString())) {
			if (guard.waitUntil(deadline, () -> task.isDone() || shuttingDown.get()) && task.isDone()) {
				return null;
			}
		}
		return SpaceError.of(TIMEOUT, "Task at " + task.path() + " did not finish in time");
	}

	///////////////////////
	//
	//  Subscriptions
	//

	public Expected<Subscription> subscribe(String path, SpaceHook hook) {
		return subscribe(path, hook, Capabilities.all());
	}

	public Expected<Subscription> subscribe(String path, SpaceHook hook, Capabilities capabilities) {
		return subscribe("subscription-" + subscriptionCounter.incrementAndGet(), path, hook, capabilities);
	}

	/**
	 * Causes <code>hook</code> to be called with the concrete path of each insert, take,
	 * or task completion whose path matches <code>path</code>. Either may be a glob.
	 *
	 * <p>
	 * Hooks run one at a time, on whichever thread caused the change.
	 * Changes made by a hook trigger further hooks breadth-first rather than recursively.
	 * Only changes at paths that <code>capabilities</code> can read are reported,
	 * and a concrete <code>path</code> must itself be readable.
	 */
	public Expected<Subscription> subscribe(String name, String pathString, @NonNull SpaceHook hook, @NonNull Capabilities capabilities) {
		Expected<Path> parsed = Path.parse(pathString, ValidationLevel.FULL);
		if (parsed.hasError()) {
			return parsed.propagate();
		}
		Path path = parsed.value();
		if (path.isConcrete() && !capabilities.permits(path, Permission.READ)) {
			return Expected.failure(CAPABILITY_MISMATCH, "Read not permitted at " + path);
		}
		return Expected.of(hooks.register(name, path.toString(), capabilities, hook));
	}

	///////////////////////
	//
	//  Inspection
	//

	public Expected<Set<String>> listChildren(String path) {
		return listChildren(path, Capabilities.all());
	}

	/**
	 * @return the names of the nodes immediately below <code>path</code>, in sorted order
	 */
	public Expected<Set<String>> listChildren(String pathString, Capabilities capabilities) {
		Expected<Path> parsed = Path.parse(pathString);
		if (parsed.hasError()) {
			return parsed.propagate();
		}
		Path path = parsed.value();
		if (path.isGlob() || path.index().isPresent()) {
			return Expected.failure(INVALID_PATH, "Can only list children of a concrete path: " + path);
		} else if (!capabilities.permits(path, Permission.READ)) {
			return Expected.failure(CAPABILITY_MISMATCH, "Read not permitted at " + path);
		}
		return tree.listChildren(path);
	}

	public Expected<Integer> visit(String path, SpaceVisitor visitor) {
		return visit(path, visitor, Capabilities.all());
	}

	/**
	 * Walks the subtree at <code>path</code> depth-first, siblings in name order,
	 * skipping (but still descending through) nodes that <code>capabilities</code> can't read.
	 *
	 * @return the number of nodes visited
	 */
	public Expected<Integer> visit(String pathString, @NonNull SpaceVisitor visitor, @NonNull Capabilities capabilities) {
		Expected<Path> parsed = Path.parse(pathString);
		if (parsed.hasError()) {
			return parsed.propagate();
		}
		Path path = parsed.value();
		if (path.isGlob() || path.index().isPresent()) {
			return Expected.failure(INVALID_PATH, "Can only visit from a concrete path: " + path);
		}
		return tree.visit(path, visitor, capabilities);
	}

	/**
	 * @return the number of nodes in the tree, not counting the root
	 */
	public int nodeCount() {
		return tree.nodeCount();
	}

	/**
	 * @return true if some thread is blocked in a read or take
	 */
	public boolean hasWaiters() {
		return waitMap.hasWaiters();
	}

	///////////////////////
	//
	//  Lifecycle
	//

	/**
	 * Removes every node and value, and wakes blocked readers so they re-check.
	 * Unstarted lazy tasks in removed slots never run.
	 */
	public void clear() {
		LOGGER.debug("Clearing {}", name());
		tree.clear();
		waitMap.notifyAllWaiters();
	}

	public boolean isShutDown() {
		return shuttingDown.get();
	}

	/**
	 * Wakes all blocked readers (they return {@link ErrorCode#TIMEOUT}), stops accepting inserts,
	 * stops the worker pool if this space owns it, and waits up to
	 * {@link PathSpaceSettings#shutdownTimeout()} for running tasks.
	 * Queued tasks that haven't started never run. Idempotent.
	 */
	public void shutdown() {
		if (!shuttingDown.compareAndSet(false, true)) {
			return;
		}
		LOGGER.info("Shutting down PathSpace {}", name());
		try {
			taskToken.invalidate();
			waitMap.notifyAllWaiters();
			if (sweeper != null) {
				sweeper.shutdownNow();
			}
			if (ownsPool) {
				pool.shutdown(settings.shutdownTimeout());
			}
			taskToken.invalidateAndAwait(settings.shutdownTimeout());
		} catch (InterruptedException e) {
			LOGGER.warn("Interrupted while shutting down PathSpace {}", name(), e);
			Thread.currentThread().interrupt();
		} finally {
			waitMap.clear();
			hooks.clear();
		}
	}

	@Override
	public void close() {
		shutdown();
	}

	/**
	 * Physically removes expired slots throughout the tree. Expired slots are already
	 * invisible to readers; this only reclaims their memory.
	 *
	 * @return the number of slots removed
	 */
	public int pruneExpired() {
		int removed = tree.pruneAllExpired();
		if (removed > 0) {
			LOGGER.debug("Pruned {} expired slot{}", removed, (removed >= 2)? "s":"");
		}
		return removed;
	}

	private void sweepExpired() {
		try {
			pruneExpired();
		} catch (RuntimeException e) {
			// An exception would cancel the periodic schedule
			LOGGER.error("TTL sweep failed: {}", e.getMessage(), e);
		}
	}

	@Override
	public String toString() {
		return "PathSpace(" + name() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PathSpace.class);
}
