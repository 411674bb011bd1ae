package io.vena.pathspace;

import org.jetbrains.annotations.Nullable;
import org.slf4j.MDC;

import static io.vena.pathspace.MdcKeys.SPACE_NAME;
import static io.vena.pathspace.MdcKeys.TASK_PATH;

final class MappedDiagnosticContext {

	static MDCScope setupMDC(String spaceName, @Nullable String taskPath) {
		MDCScope result = new MDCScope();
		MDC.put(SPACE_NAME, spaceName);
		if (taskPath != null) {
			MDC.put(TASK_PATH, taskPath);
		}
		return result;
	}

	/**
	 * Like {@link org.slf4j.MDC.MDCCloseable} except it restores the prior values
	 * instead of deleting them, which allows nesting.
	 *
	 * <p>
	 * Use this in a try block with no catch or finally clause: those run after
	 * {@link #close()} and wouldn't see the diagnostic context.
	 */
	static final class MDCScope implements AutoCloseable {
		final String oldName = MDC.get(SPACE_NAME);
		final String oldTask = MDC.get(TASK_PATH);

		@Override public void close() {
			restore(SPACE_NAME, oldName);
			restore(TASK_PATH, oldTask);
		}

		private static void restore(String key, @Nullable String value) {
			if (value == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, value);
			}
		}
	}

}
