package dev.attrib.interceptors;

import dev.attrib.RawAttributes;
import dev.attrib.Resolution;
import dev.attrib.WriteListener;
import dev.attrib.logging.MdcKeys;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static dev.attrib.logging.MappedDiagnosticContext.setupMDC;
import static lombok.AccessLevel.PRIVATE;

/**
 * Logs every attribute write, with its previous stored value,
 * under the MDC keys {@link MdcKeys#RECORD_TYPE} and {@link MdcKeys#ATTRIBUTE}.
 *
 * <p>
 * Declared fields keep their values outside the store,
 * so for those, the previous value is logged as absent.
 */
@RequiredArgsConstructor(access = PRIVATE)
public class AuditingWriteListener implements WriteListener {
	private final String typeName;

	public static AuditingWriteListener forType(Class<?> recordClass) {
		return new AuditingWriteListener(recordClass.getSimpleName());
	}

	@Override
	public void beforeWrite(RawAttributes raw, String name, Object value) {
		if (!LOGGER.isInfoEnabled()) {
			return;
		}
		try (var __ = setupMDC(typeName, name)) {
			if (raw.get(name) instanceof Resolution.Found previous) {
				LOGGER.info("{}.{} = {} (was {})", typeName, name, value, previous.value());
			} else {
				LOGGER.info("{}.{} = {}", typeName, name, value);
			}
		}
	}

	@Override
	public String toString() {
		return "AuditingWriteListener(" + typeName + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AuditingWriteListener.class);
}
