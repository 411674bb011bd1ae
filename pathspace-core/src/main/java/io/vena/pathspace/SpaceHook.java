package io.vena.pathspace;

/**
 * Called when something was inserted at a path matching a subscription,
 * or a task there finished.
 */
@FunctionalInterface
public interface SpaceHook {
	/**
	 * @param path the concrete path that changed. The value may already be gone by the time this runs.
	 */
	void onChanged(Path path);
}
