package dev.attrib.exceptions;

import dev.attrib.ValidatedField;

/**
 * Thrown when {@link ValidatedField#write} rejects a value.
 * The field's stored value is unchanged.
 */
@SuppressWarnings("serial")
public class ValidationException extends IllegalArgumentException {
	private final String fieldName;
	private final String reason;

	public ValidationException(String fieldName, String reason) {
		super("Invalid value for " + fieldName + ": " + reason);
		this.fieldName = fieldName;
		this.reason = reason;
	}

	public String fieldName() {
		return fieldName;
	}

	public String reason() {
		return reason;
	}
}
