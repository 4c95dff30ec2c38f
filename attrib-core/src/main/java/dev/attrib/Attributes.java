package dev.attrib;

import dev.attrib.exceptions.AttributeMissingException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableMap;

/**
 * Generic attribute utilities that work the same on any {@link Interceptable},
 * whatever interception it uses.
 */
public final class Attributes {
	private Attributes() {}

	public static boolean has(Interceptable target, String name) {
		return target.hasAttribute(name);
	}

	public static @Nullable Object getOrDefault(Interceptable target, String name, @Nullable Object defaultValue) {
		try {
			return target.getAttribute(name);
		} catch (AttributeMissingException e) {
			return defaultValue;
		}
	}

	/**
	 * @throws AttributeMissingException if there's no such attribute
	 * @throws ClassCastException if the attribute's value is not a <code>type</code>
	 */
	public static <T> @Nullable T get(Interceptable target, String name, Class<T> type) {
		return type.cast(target.getAttribute(name));
	}

	/**
	 * @return the current value of every {@link Interceptable#attributeNames() populated attribute},
	 * in order. Doesn't trigger lazy computation; may trigger read interception.
	 */
	public static Map<String, Object> snapshot(Interceptable target) {
		Map<String, Object> result = new LinkedHashMap<>();
		for (String name: target.attributeNames()) {
			result.put(name, target.getAttribute(name));
		}
		return unmodifiableMap(result);
	}
}
