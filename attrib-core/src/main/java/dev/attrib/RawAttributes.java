package dev.attrib;

import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Direct access to a record's own attribute storage, bypassing every
 * declared field and interceptor.
 *
 * <p>
 * Interceptors and lazy computers receive one of these instead of the
 * record itself. Since a <code>RawAttributes</code> has no intercepted
 * entry point, code holding one can't accidentally recurse back into
 * the interceptor that is currently running.
 */
public interface RawAttributes {
	/**
	 * @return {@link Resolution.Found} if <code>name</code> is present, even if its value is null.
	 */
	Resolution get(String name);

	void put(String name, @Nullable Object value);

	/**
	 * @return true if <code>name</code> was present
	 */
	boolean remove(String name);

	default boolean contains(String name) {
		return get(name).isFound();
	}

	/**
	 * @return every stored name, in insertion order, including reserved names.
	 */
	Set<String> names();
}
