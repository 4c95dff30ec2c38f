package dev.attrib;

import java.util.Map;

/**
 * A {@link ReadInterceptor} for records whose attributes live in an
 * external map, stored on the record under the reserved name {@link #BACKING_FIELD}.
 *
 * <p>
 * Records install their map with {@link #attach}, usually from their constructor.
 * Attributes written to the record itself take precedence over the map.
 */
public final class BackingMapInterceptor implements ReadInterceptor {
	public static final String BACKING_FIELD = "$backing";

	private static final BackingMapInterceptor INSTANCE = new BackingMapInterceptor();

	private BackingMapInterceptor() { }

	public static BackingMapInterceptor instance() {
		return INSTANCE;
	}

	public static void attach(RawAttributes raw, Map<String, ?> backingMap) {
		raw.put(BACKING_FIELD, backingMap);
	}

	@Override
	public Resolution intercept(RawAttributes raw, String name) {
		if (raw.get(BACKING_FIELD) instanceof Resolution.Found found
			&& found.value() instanceof Map<?, ?> backingMap
			&& backingMap.containsKey(name)) {
			return Resolution.found(backingMap.get(name));
		} else {
			return Resolution.missing();
		}
	}

	@Override
	public String toString() {
		return "BackingMapInterceptor";
	}
}
