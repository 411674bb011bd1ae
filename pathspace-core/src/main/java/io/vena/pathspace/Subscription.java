package io.vena.pathspace;

/**
 * A registered {@link SpaceHook}. Closing it stops further calls,
 * though a call already queued may still run.
 */
public interface Subscription extends AutoCloseable {
	String name();

	/**
	 * The path or glob pattern the hook was registered on.
	 */
	String key();

	@Override
	void close();
}
