package dev.attrib;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableSet;

/**
 * A record's own mapping from attribute name to value.
 * Owned by exactly one {@link AttributeRecord}; not thread-safe.
 *
 * <p>
 * Names containing <code>$</code> are reserved for bookkeeping by
 * interceptors. They can be stored here, but they can't be read or written through
 * {@link Interceptable#getAttribute} and {@link Interceptable#setAttribute},
 * and aren't listed by {@link Interceptable#attributeNames()}.
 */
public final class AttributeStore implements RawAttributes {
	private final Map<String, Object> values = new LinkedHashMap<>();

	AttributeStore() { }

	@Override
	public Resolution get(String name) {
		Object value = values.get(name);
		if (value != null || values.containsKey(name)) {
			return Resolution.found(value);
		} else {
			return Resolution.missing();
		}
	}

	@Override
	public void put(String name, @Nullable Object value) {
		values.put(name, value);
	}

	@Override
	public boolean remove(String name) {
		if (values.containsKey(name)) {
			values.remove(name);
			return true;
		} else {
			return false;
		}
	}

	@Override
	public Set<String> names() {
		return unmodifiableSet(values.keySet());
	}

	public static boolean isReserved(String name) {
		return name.indexOf(RESERVED_MARKER) >= 0;
	}

	@Override
	public String toString() {
		return values.toString();
	}

	public static final char RESERVED_MARKER = '$';
}
