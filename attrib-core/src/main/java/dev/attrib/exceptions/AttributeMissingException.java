package dev.attrib.exceptions;

import dev.attrib.Interceptable;

/**
 * Thrown when {@link Interceptable#getAttribute} finds no declared field,
 * no stored value, no lazily computed value, and no intercepted value
 * for the requested name.
 *
 * <p>
 * Existence checks like {@link Interceptable#hasAttribute} catch this and return <code>false</code>.
 * A lazy computer or read interceptor that wants to report an unknown name should throw this too,
 * so callers can't tell intercepted attributes from ordinary ones.
 */
@SuppressWarnings("serial")
public class AttributeMissingException extends RuntimeException {
	private final String name;

	public AttributeMissingException(String name) {
		super("No attribute \"" + name + "\"");
		this.name = name;
	}

	public AttributeMissingException(Class<?> recordClass, String name) {
		super(recordClass.getSimpleName() + " has no attribute \"" + name + "\"");
		this.name = name;
	}

	public AttributeMissingException(String name, String message) {
		super(message);
		this.name = name;
	}

	public String name() {
		return name;
	}
}
