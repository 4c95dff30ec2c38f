package dev.attrib;

import dev.attrib.exceptions.AttributeMissingException;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * The intercepted entry points for attribute access on a record.
 *
 * <p>
 * Every read and write through this interface passes through the record's
 * declared fields and interceptors. Interceptors themselves never see this
 * interface; they work on {@link RawAttributes}.
 */
public interface Interceptable {
	/**
	 * @throws AttributeMissingException if no stage of the lookup can produce a value
	 */
	@Nullable Object getAttribute(String name);

	void setAttribute(String name, @Nullable Object value);

	/**
	 * Like {@link #getAttribute} but returns false instead of throwing
	 * {@link AttributeMissingException}. Note that this may trigger a lazy
	 * computation, just as {@link #getAttribute} would.
	 */
	default boolean hasAttribute(String name) {
		try {
			getAttribute(name);
			return true;
		} catch (AttributeMissingException e) {
			return false;
		}
	}

	/**
	 * @return the names of the attributes currently populated, without
	 * triggering any lazy computation or interception.
	 */
	Set<String> attributeNames();
}
