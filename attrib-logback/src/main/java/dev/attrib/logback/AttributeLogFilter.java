package dev.attrib.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import dev.attrib.RecordType;
import dev.attrib.logging.MdcKeys;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static dev.attrib.logging.MdcKeys.RECORD_TYPE;
import static java.util.stream.Collectors.toMap;

/**
 * Lets the log level of particular loggers be raised or lowered
 * only for log events concerning a particular record type,
 * as identified by the MDC key {@link MdcKeys#RECORD_TYPE}.
 *
 * <p>
 * Install this filter on an appender in <code>logback.xml</code>, then
 * {@link #withController register} a {@link LogController} for each record type of interest.
 * Since the MDC holds the {@link RecordType#name() type name}, record types
 * with the same name share a controller.
 */
public class AttributeLogFilter extends Filter<ILoggingEvent> {
	private static final ConcurrentHashMap<String, LogController> controllersByTypeName = new ConcurrentHashMap<>();

	public static final class LogController {
		final Map<String, Level> overrides = new ConcurrentHashMap<>();

		// We'd like to use SLF4J's "Level" but that doesn't support OFF
		public void setLogging(Level level, Class<?>... loggers) {
			// Put them all in one atomic operation
			overrides.putAll(Stream.of(loggers).collect(toMap(Class::getName, c->level)));
		}

		public void clearLogging(Class<?>... loggers) {
			for (Class<?> logger: loggers) {
				overrides.remove(logger.getName());
			}
		}
	}

	public static LogController withOverrides(RecordType<?> recordType, Level level, Class<?>... loggers) {
		LogController controller = new LogController();
		controller.setLogging(level, loggers);
		return withController(recordType, controller);
	}

	/**
	 * Causes the given <code>controller</code> to control logs emitted
	 * with the MDC key {@link MdcKeys#RECORD_TYPE} equal to the given
	 * <code>recordType</code>'s {@link RecordType#name() name}.
	 * Replaces any controller previously registered for that name.
	 *
	 * @return <code>controller</code>
	 */
	public static LogController withController(RecordType<?> recordType, LogController controller) {
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Registering controller {} for record type \"{}\"", System.identityHashCode(controller), recordType.name());
		}
		LogController old = controllersByTypeName.put(recordType.name(), controller);
		if (old != null && old != controller) {
			LOGGER.warn("Replaced log controller for record type \"{}\"", recordType.name());
		}
		return controller;
	}

	/**
	 * @return true if a controller was registered for <code>recordType</code>
	 */
	public static boolean removeController(RecordType<?> recordType) {
		return controllersByTypeName.remove(recordType.name()) != null;
	}

	@Override
	public FilterReply decide(ILoggingEvent event) {
		String typeName = MDC.get(RECORD_TYPE);
		if (typeName == null) {
			return NEUTRAL;
		}
		var controller = controllersByTypeName.get(typeName);
		if (controller == null) {
			return NEUTRAL;
		}
		Level level = controller.overrides.get(event.getLoggerName());
		if (level == null) {
			return NEUTRAL;
		}
		if (event.getLevel().isGreaterOrEqual(level)) {
			return NEUTRAL;
		} else {
			return DENY;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AttributeLogFilter.class);
}
