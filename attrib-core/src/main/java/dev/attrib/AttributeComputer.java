package dev.attrib;

import dev.attrib.exceptions.AttributeMissingException;
import org.jetbrains.annotations.Nullable;

/**
 * Computes the value of an attribute that a record doesn't have yet.
 *
 * @see LazyBinder
 */
@FunctionalInterface
public interface AttributeComputer {
	/**
	 * @param raw the record's own attributes, in case the computation depends on them
	 * @throws AttributeMissingException if <code>name</code> is not an attribute this computer knows how to provide
	 */
	@Nullable Object compute(RawAttributes raw, String name);
}
