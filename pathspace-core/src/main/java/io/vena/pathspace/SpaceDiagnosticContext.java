package io.vena.pathspace;

import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.pcollections.OrderedPMap;

/**
 * A thread-local set of name-value pairs that travel with an insert
 * to the worker thread that runs its task, and to the hooks it triggers.
 */
public final class SpaceDiagnosticContext {
	private final ThreadLocal<OrderedPMap<String, String>> currentAttributes = ThreadLocal.withInitial(OrderedPMap::empty);

	public final class DiagnosticScope implements AutoCloseable {
		final OrderedPMap<String, String> oldAttributes = currentAttributes.get();

		DiagnosticScope(OrderedPMap<String, String> attributes) {
			currentAttributes.set(attributes);
		}

		@Override
		public void close() {
			currentAttributes.set(oldAttributes);
		}
	}

	/**
	 * @return the current thread's value of the attribute with the given <code>name</code>,
	 * or <code>null</code> if no such attribute has been defined.
	 */
	public @Nullable String getAttribute(String name) {
		return currentAttributes.get().get(name);
	}

	public @NotNull Map<String, String> getAttributes() {
		return currentAttributes.get();
	}

	/**
	 * Adds a single attribute to the current thread's diagnostic context.
	 * If the attribute already exists, it will be replaced.
	 */
	public DiagnosticScope withAttribute(String name, String value) {
		return new DiagnosticScope(currentAttributes.get().plus(name, value));
	}

	/**
	 * Replaces all attributes in the current thread's diagnostic context.
	 * This is how context propagates from one thread to another.
	 *
	 * <p>
	 * If <code>attributes</code> is null, this is a no-op, and any existing attributes on this thread are retained.
	 */
	public DiagnosticScope withOnly(@Nullable Map<String, String> attributes) {
		if (attributes == null) {
			return new DiagnosticScope(currentAttributes.get());
		} else {
			return new DiagnosticScope(OrderedPMap.from(attributes));
		}
	}
}
