package dev.attrib;

import dev.attrib.exceptions.AttributeMissingException;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of one stage of attribute lookup: either a value was
 * {@link Found found} (possibly <code>null</code>), or the name is
 * {@link Missing missing} and the next stage should be consulted.
 */
public sealed interface Resolution permits Resolution.Found, Resolution.Missing {

	record Found(@Nullable Object value) implements Resolution { }

	record Missing() implements Resolution { }

	static Resolution found(@Nullable Object value) {
		return new Found(value);
	}

	static Resolution missing() {
		return MISSING;
	}

	default boolean isFound() {
		return this instanceof Found;
	}

	/**
	 * @return this if {@link Found found}; otherwise the result of calling <code>nextStage</code>.
	 */
	default Resolution or(Supplier<Resolution> nextStage) {
		if (this instanceof Found) {
			return this;
		} else {
			return nextStage.get();
		}
	}

	/**
	 * @throws AttributeMissingException if this is {@link Missing missing}
	 */
	default Object valueOrThrow(String name) {
		if (this instanceof Found f) {
			return f.value();
		} else {
			throw new AttributeMissingException(name);
		}
	}

	Missing MISSING = new Missing();
}
