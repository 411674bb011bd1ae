package io.vena.pathspace;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.stream.Collectors.toList;

/**
 * One segment of the tree. A node exclusively owns its children, and holds
 * a FIFO queue of {@link Slot}s for values stored at exactly its own path.
 *
 * <p>
 * The queue and the sequence counter are guarded by {@link #lock};
 * the children map is concurrent and needs no lock.
 */
final class Node {
	final String name;
	final ReentrantLock lock = new ReentrantLock();
	private final ConcurrentMap<String, Node> children = new ConcurrentHashMap<>();
	private final ArrayDeque<Slot> slots = new ArrayDeque<>();
	private long nextSequence = 0;

	Node(String name) {
		this.name = name;
	}

	Node child(String childName) {
		return children.get(childName);
	}

	Node childOrCreate(String childName) {
		return children.computeIfAbsent(childName, Node::new);
	}

	/**
	 * @return a snapshot of child names, sorted, so traversals are deterministic
	 */
	List<String> childNames() {
		return children.keySet().stream().sorted().collect(toList());
	}

	int childCount() {
		return children.size();
	}

	void clearChildren() {
		children.clear();
	}

	///////////////////////
	//
	//  The rest require the lock
	//

	long takeSequenceNumber() {
		assert lock.isHeldByCurrentThread();
		return nextSequence++;
	}

	void append(Slot slot) {
		assert lock.isHeldByCurrentThread();
		slots.addLast(slot);
	}

	/**
	 * Physically removes expired slots.
	 *
	 * @return the number removed
	 */
	int pruneExpired(Instant now) {
		assert lock.isHeldByCurrentThread();
		int removed = 0;
		for (Iterator<Slot> iter = slots.iterator(); iter.hasNext(); ) {
			if (iter.next().isExpiredAt(now)) {
				iter.remove();
				removed++;
			}
		}
		return removed;
	}

	Slot front() {
		assert lock.isHeldByCurrentThread();
		return slots.peekFirst();
	}

	/**
	 * @return the slot at position <code>index</code> counting from the oldest, or null if out of range
	 */
	Slot slotAt(int index) {
		assert lock.isHeldByCurrentThread();
		if (index < 0 || index >= slots.size()) {
			return null;
		}
		Iterator<Slot> iter = slots.iterator();
		for (int i = 0; i < index; i++) {
			iter.next();
		}
		return iter.next();
	}

	void remove(Slot slot) {
		assert lock.isHeldByCurrentThread();
		if (slots.peekFirst() == slot) {
			slots.pollFirst();
		} else {
			slots.remove(slot);
		}
	}

	int slotCount() {
		assert lock.isHeldByCurrentThread();
		return slots.size();
	}

	void clearSlots() {
		assert lock.isHeldByCurrentThread();
		slots.clear();
	}

	@Override
	public String toString() {
		return "Node(" + name + ")";
	}
}
