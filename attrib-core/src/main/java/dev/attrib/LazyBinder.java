package dev.attrib;

import dev.attrib.exceptions.AttributeMissingException;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static dev.attrib.logging.MappedDiagnosticContext.setupMDC;

/**
 * Fills in missing attributes on first read, then gets out of the way.
 *
 * <p>
 * The computed value is stored in the record's own {@link AttributeStore},
 * so a second read of the same name is an ordinary store hit and the
 * {@link AttributeComputer} runs at most once per record and name.
 * The binder itself holds no per-record state.
 */
@RequiredArgsConstructor
public final class LazyBinder {
	private final String typeName;
	private final AttributeComputer computer;

	/**
	 * @return the stored value of <code>name</code> if there is one;
	 * otherwise a newly computed value, which is stored before returning.
	 * @throws AttributeMissingException if the computer doesn't recognize <code>name</code>.
	 * Nothing is stored in that case.
	 */
	public @Nullable Object read(RawAttributes raw, String name) {
		Resolution existing = raw.get(name);
		if (existing instanceof Resolution.Found found) {
			return found.value();
		}
		try (var __ = setupMDC(typeName, name)) {
			LOGGER.debug("Computing {}.{}", typeName, name);
			Object value = computer.compute(raw, name);
			raw.put(name, value);
			LOGGER.debug("Populated {}.{} = {}", typeName, name, value);
			return value;
		}
	}

	@Override
	public String toString() {
		return "LazyBinder(" + typeName + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LazyBinder.class);
}
