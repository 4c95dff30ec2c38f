package dev.attrib.exceptions;

/**
 * Indicates a malformed record type declaration, detected when the
 * type is built. These are programming errors, so this is unchecked:
 * record types are usually built in static initializers.
 */
@SuppressWarnings("serial")
public class InvalidRecordTypeException extends RuntimeException {
	public InvalidRecordTypeException(String message) { super(message); }
	public InvalidRecordTypeException(String message, Throwable cause) { super(message, cause); }

	public static InvalidRecordTypeException forField(Class<?> recordClass, String fieldName, String message) {
		return new InvalidRecordTypeException("Invalid field " + recordClass.getSimpleName() + "." + fieldName + ": " + message);
	}
}
