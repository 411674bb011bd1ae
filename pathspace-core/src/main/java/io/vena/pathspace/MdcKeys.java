package io.vena.pathspace;

/**
 * Keys under which PathSpace threads publish to the slf4j MDC.
 */
public final class MdcKeys {
	private MdcKeys() { }

	public static final String SPACE_NAME = "pathspace.name";
	public static final String TASK_PATH  = "pathspace.task";
}
