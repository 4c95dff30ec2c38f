package dev.attrib.logging;

import org.slf4j.MDC;

import static dev.attrib.logging.MdcKeys.ATTRIBUTE;
import static dev.attrib.logging.MdcKeys.RECORD_TYPE;

public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() {}

	/**
	 * Sets {@link MdcKeys#RECORD_TYPE} and {@link MdcKeys#ATTRIBUTE}
	 * until the returned scope is closed.
	 */
	public static MDCScope setupMDC(String typeName, String attribute) {
		MDCScope result = new MDCScope();
		MDC.put(RECORD_TYPE, typeName);
		MDC.put(ATTRIBUTE, attribute);
		return result;
	}

	/**
	 * This is like {@link org.slf4j.MDC.MDCCloseable} except instead of
	 * deleting the MDC entries at the end, it restores them to their prior values,
	 * which allows us to nest these. A write hook on one record may
	 * trigger writes on another, for example.
	 *
	 * <p>
	 * Note that for a try block using one of these, the catch and finally
	 * blocks will run after {@link #close()} and won't have the context.
	 */
	public static final class MDCScope implements AutoCloseable {
		final String oldTypeName = MDC.get(RECORD_TYPE);
		final String oldAttribute = MDC.get(ATTRIBUTE);

		@Override
		public void close() {
			restore(RECORD_TYPE, oldTypeName);
			restore(ATTRIBUTE, oldAttribute);
		}

		private static void restore(String key, String oldValue) {
			if (oldValue == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, oldValue);
			}
		}
	}
}
