package dev.attrib;

import dev.attrib.exceptions.AttributeMissingException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles every read of an undeclared attribute, present or not.
 *
 * <p>
 * Lookup goes in this order, stopping at the first answer:
 * <ol>
 *     <li>the record's own store, read through {@link RawAttributes};</li>
 *     <li>the {@link ReadInterceptor};</li>
 *     <li>the {@link LazyBinder}, if the type has one.</li>
 * </ol>
 * None of these can reach back into the intercepted entry point,
 * because none of them is given the record.
 */
public final class FullInterceptor {
	private final String typeName;
	private final ReadInterceptor interceptor;
	private final @Nullable LazyBinder lazyBinder;

	FullInterceptor(String typeName, ReadInterceptor interceptor, @Nullable LazyBinder lazyBinder) {
		this.typeName = typeName;
		this.interceptor = interceptor;
		this.lazyBinder = lazyBinder;
	}

	/**
	 * @throws AttributeMissingException if no stage has a value for <code>name</code>
	 */
	public @Nullable Object read(RawAttributes raw, String name) {
		LOGGER.trace("Intercepted read of {}.{}", typeName, name);
		Resolution resolution = raw.get(name)
			.or(() -> interceptor.intercept(raw, name));
		if (resolution instanceof Resolution.Found found) {
			return found.value();
		} else if (lazyBinder != null) {
			return lazyBinder.read(raw, name);
		} else {
			throw new AttributeMissingException(name, typeName + " has no attribute \"" + name + "\"");
		}
	}

	@Override
	public String toString() {
		return "FullInterceptor(" + typeName + ", " + interceptor + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FullInterceptor.class);
}
