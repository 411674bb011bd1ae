package io.vena.pathspace;

import io.vena.pathspace.codecs.Codec;
import io.vena.pathspace.exceptions.CodecException;
import io.vena.pathspace.glob.GlobMatcher;
import io.vena.pathspace.glob.MatchResult;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.function.LongFunction;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.pathspace.ErrorCode.CAPABILITY_MISMATCH;
import static io.vena.pathspace.ErrorCode.CAPACITY_EXCEEDED;
import static io.vena.pathspace.ErrorCode.INVALID_PATH;
import static io.vena.pathspace.ErrorCode.INVALID_TYPE;
import static io.vena.pathspace.ErrorCode.MALFORMED_INPUT;
import static io.vena.pathspace.ErrorCode.NO_OBJECT_FOUND;
import static io.vena.pathspace.ErrorCode.NO_SUCH_PATH;
import static io.vena.pathspace.ErrorCode.TIMEOUT;

/**
 * The node hierarchy and the single-attempt operations on it.
 * Blocking, notification, and task scheduling are layered on top by {@link PathSpace}.
 *
 * <p>
 * There is no tree-wide lock. Child maps are concurrent, and each node's slot queue
 * is guarded by that node's own lock. At most one node lock is held at a time.
 */
@RequiredArgsConstructor
final class PathTree {
	private final Node root = new Node("");
	private final Clock clock;
	private final int maxSlotsPerNode;

	@Value
	static class Target {
		Path path;
		Node node;
	}

	/**
	 * The outcome of one read or take attempt: either a final result, or a task
	 * that has to finish before the attempt can be retried.
	 */
	@Value
	static class Lookup<T> {
		@Nullable Expected<T> result;
		@Nullable TaskExecution<?> pendingTask;

		/**
		 * The node a slot was removed from, if any.
		 */
		@Nullable Path removedFrom;

		static <TT> Lookup<TT> done(Expected<TT> result) {
			return new Lookup<>(result, null, null);
		}

		static <TT> Lookup<TT> removed(Expected<TT> result, Path nodePath) {
			return new Lookup<>(result, null, nodePath);
		}

		static <TT> Lookup<TT> done(ErrorCode code, String message) {
			return done(Expected.failure(code, message));
		}

		static <TT> Lookup<TT> pending(TaskExecution<?> task) {
			return new Lookup<>(null, task, null);
		}

		boolean isPending() {
			return pendingTask != null;
		}

		/**
		 * @return true if waiting for an insert could change the outcome
		 */
		boolean isRetryable() {
			if (result == null || result.hasValue()) {
				return false;
			}
			ErrorCode code = result.errorCode();
			return code == NO_OBJECT_FOUND || code == NO_SUCH_PATH;
		}
	}

	///////////////////////
	//
	//  Navigation
	//

	@Nullable Node find(Path concretePath) {
		Node node = root;
		for (String segment: concretePath) {
			node = node.child(segment);
			if (node == null) {
				return null;
			}
		}
		return node;
	}

	Node findOrCreate(Path concretePath) {
		Node node = root;
		for (String segment: concretePath) {
			node = node.childOrCreate(segment);
		}
		return node;
	}

	/**
	 * @return the existing nodes matching <code>globPath</code>, in depth-first order
	 * with siblings sorted by name. Never creates nodes.
	 */
	List<Target> matching(Path globPath) {
		Set<Target> found = new LinkedHashSet<>();
		collect(root, Path.root(), globPath.segments(), 0, found);
		return new ArrayList<>(found);
	}

	private void collect(Node node, Path nodePath, List<String> pattern, int index, Set<Target> found) {
		if (index == pattern.size()) {
			found.add(new Target(nodePath, node));
			return;
		}
		String component = pattern.get(index);
		if (!GlobMatcher.isGlob(component)) {
			Node child = node.child(component);
			if (child != null) {
				collect(child, nodePath.then(component), pattern, index + 1, found);
			}
			return;
		}
		for (String name: node.childNames()) {
			Node child = node.child(name);
			if (child == null) {
				continue;
			}
			MatchResult result = GlobMatcher.match(component, name);
			if (result.matched()) {
				Path childPath = nodePath.then(name);
				collect(child, childPath, pattern, index + 1, found);
				if (result.supermatch()) {
					absorb(child, childPath, pattern, index, found);
				}
			}
		}
	}

	/**
	 * Lets the supermatching component at <code>index</code> consume further segments below <code>node</code>.
	 */
	private void absorb(Node node, Path nodePath, List<String> pattern, int index, Set<Target> found) {
		for (String name: node.childNames()) {
			Node child = node.child(name);
			if (child != null) {
				Path childPath = nodePath.then(name);
				collect(child, childPath, pattern, index + 1, found);
				absorb(child, childPath, pattern, index, found);
			}
		}
	}

	///////////////////////
	//
	//  Writing
	//

	/**
	 * Appends one slot at <code>node</code>.
	 *
	 * @param slotFactory called under the node's lock with the slot's sequence number
	 * @return null on success
	 */
	@Nullable SpaceError append(Target target, LongFunction<Slot> slotFactory, boolean waitForLocks) {
		Node node = target.node();
		if (waitForLocks) {
			node.lock.lock();
		} else if (!node.lock.tryLock()) {
			return SpaceError.of(TIMEOUT, "Node is busy: " + target.path());
		}
		try {
			node.pruneExpired(clock.instant());
			if (node.slotCount() >= maxSlotsPerNode) {
				return SpaceError.of(CAPACITY_EXCEEDED, "Node " + target.path() + " already holds " + node.slotCount() + " slots");
			}
			Slot slot = slotFactory.apply(node.takeSequenceNumber());
			node.append(slot);
			LOGGER.trace("Appended {} at {}", slot, target.path());
			return null;
		} finally {
			node.lock.unlock();
		}
	}

	///////////////////////
	//
	//  Reading
	//

	/**
	 * One non-blocking attempt to read (or, if <code>remove</code>, take) a value of exactly
	 * type <code>type</code> at <code>path</code>.
	 */
	<T> Lookup<T> lookup(Path path, Class<T> type, Codec<T> codec, Capabilities capabilities, boolean remove) {
		if (path.isGlob()) {
			return lookupGlob(path, type, codec, capabilities, remove);
		} else {
			return lookupConcrete(path, type, codec, capabilities, remove);
		}
	}

	private <T> Lookup<T> lookupConcrete(Path path, Class<T> type, Codec<T> codec, Capabilities capabilities, boolean remove) {
		OptionalInt index = path.index();
		Path nodePath = path.withoutIndex();
		if (index.isPresent() && remove) {
			return Lookup.done(INVALID_PATH, "Cannot take from an indexed path: " + path);
		}
		if (!capabilities.permits(nodePath, Permission.READ)) {
			return Lookup.done(CAPABILITY_MISMATCH, "Read not permitted at " + nodePath);
		}
		Node node = find(nodePath);
		if (node == null) {
			return Lookup.done(NO_SUCH_PATH, "No such path: " + nodePath);
		}
		node.lock.lock();
		try {
			node.pruneExpired(clock.instant());
			Slot slot = index.isPresent() ? node.slotAt(index.getAsInt()) : node.front();
			if (slot == null) {
				if (index.isPresent()) {
					return Lookup.done(NO_OBJECT_FOUND, "Index " + index.getAsInt() + " out of range at " + nodePath + " holding " + node.slotCount() + " slots");
				} else {
					return Lookup.done(NO_OBJECT_FOUND, "Nothing at " + nodePath);
				}
			} else if (slot.type != type) {
				return Lookup.done(INVALID_TYPE, "Requested " + type.getName() + " but found " + slot.type.getName() + " at " + nodePath);
			} else {
				return consume(node, nodePath, slot, codec, remove);
			}
		} finally {
			node.lock.unlock();
		}
	}

	private <T> Lookup<T> lookupGlob(Path path, Class<T> type, Codec<T> codec, Capabilities capabilities, boolean remove) {
		List<Target> candidates = matching(path);
		if (candidates.isEmpty()) {
			return Lookup.done(NO_SUCH_PATH, "Nothing matches " + path);
		}
		boolean foundOtherType = false;
		boolean foundPermitted = false;
		for (Target candidate: candidates) {
			if (!capabilities.permits(candidate.path(), Permission.READ)) {
				continue;
			}
			foundPermitted = true;
			Node node = candidate.node();
			node.lock.lock();
			try {
				node.pruneExpired(clock.instant());
				Slot slot = node.front();
				if (slot == null) {
					continue;
				} else if (slot.type != type) {
					LOGGER.trace("Skipping {} at {}: wanted {}", slot, candidate.path(), type.getSimpleName());
					foundOtherType = true;
					continue;
				}
				return consume(node, candidate.path(), slot, codec, remove);
			} finally {
				node.lock.unlock();
			}
		}
		if (foundOtherType) {
			return Lookup.done(INVALID_TYPE, "No node matching " + path + " holds a " + type.getName());
		} else if (!foundPermitted) {
			return Lookup.done(CAPABILITY_MISMATCH, "Read not permitted at any node matching " + path);
		} else {
			return Lookup.done(NO_OBJECT_FOUND, "Nothing at any node matching " + path);
		}
	}

	/**
	 * Requires the node's lock, and that <code>slot</code> has the requested type.
	 */
	private <T> Lookup<T> consume(Node node, Path nodePath, Slot slot, Codec<T> codec, boolean remove) {
		if (slot.isPendingTask()) {
			return Lookup.pending(slot.task);
		}
		Expected<T> value = decode(slot, codec);
		// A value that won't decode stays put; a failed task is consumed by take like any other result
		if (remove && (value.hasValue() || slot.task != null)) {
			node.remove(slot);
			return Lookup.removed(value, nodePath);
		}
		return Lookup.done(value);
	}

	private static <T> Expected<T> decode(Slot slot, Codec<T> codec) {
		Expected<byte[]> payload = slot.payload();
		if (payload.hasError()) {
			return payload.propagate();
		}
		try {
			return Expected.of(codec.decode(payload.value()));
		} catch (CodecException e) {
			LOGGER.debug("Unable to decode {}", slot, e);
			return Expected.failure(MALFORMED_INPUT, "Unable to decode " + codec.type().getName() + ": " + e.getMessage());
		}
	}

	///////////////////////
	//
	//  Inspection and maintenance
	//

	Expected<Set<String>> listChildren(Path concretePath) {
		Node node = find(concretePath);
		if (node == null) {
			return Expected.failure(NO_SUCH_PATH, "No such path: " + concretePath);
		}
		Set<String> names = Collections.unmodifiableSortedSet(new TreeSet<>(node.childNames()));
		return Expected.of(names);
	}

	/**
	 * Depth-first, siblings in name order, starting at (and including) <code>start</code>.
	 *
	 * @return the number of nodes passed to <code>visitor</code>
	 */
	Expected<Integer> visit(Path start, SpaceVisitor visitor, Capabilities capabilities) {
		Node node = find(start);
		if (node == null) {
			return Expected.failure(NO_SUCH_PATH, "No such path: " + start);
		}
		int[] count = { 0 };
		visitNode(node, start, visitor, capabilities, count);
		return Expected.of(count[0]);
	}

	/**
	 * @return false if the visitor asked to stop
	 */
	private boolean visitNode(Node node, Path path, SpaceVisitor visitor, Capabilities capabilities, int[] count) {
		if (capabilities.permits(path, Permission.READ)) {
			int slotCount;
			node.lock.lock();
			try {
				node.pruneExpired(clock.instant());
				slotCount = node.slotCount();
			} finally {
				node.lock.unlock();
			}
			count[0]++;
			VisitControl control = visitor.visit(new PathEntry(path, slotCount, node.childCount()));
			if (control == VisitControl.STOP) {
				return false;
			} else if (control == VisitControl.SKIP_CHILDREN) {
				return true;
			}
		}
		for (String name: node.childNames()) {
			Node child = node.child(name);
			if (child != null && !visitNode(child, path.then(name), visitor, capabilities, count)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return the number of expired slots removed from the whole tree
	 */
	int pruneAllExpired() {
		Instant now = clock.instant();
		int[] removed = { 0 };
		forEachNode(root, node -> {
			node.lock.lock();
			try {
				removed[0] += node.pruneExpired(now);
			} finally {
				node.lock.unlock();
			}
		});
		return removed[0];
	}

	int nodeCount() {
		int[] count = { 0 };
		forEachNode(root, node -> count[0]++);
		// Don't count the root
		return count[0] - 1;
	}

	private static void forEachNode(Node node, Consumer<Node> action) {
		action.accept(node);
		for (String name: node.childNames()) {
			Node child = node.child(name);
			if (child != null) {
				forEachNode(child, action);
			}
		}
	}

	/**
	 * Discards every node and slot. Tasks in discarded slots that haven't started
	 * are orphaned and never run.
	 */
	void clear() {
		root.lock.lock();
		try {
			root.clearSlots();
		} finally {
			root.lock.unlock();
		}
		root.clearChildren();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PathTree.class);
}
