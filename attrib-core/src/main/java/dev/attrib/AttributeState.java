package dev.attrib;

/**
 * How a particular attribute of a particular record is currently resolved.
 *
 * @see RecordType#stateOf
 */
public enum AttributeState {
	/**
	 * Owned by a {@link ValidatedField}.
	 */
	DECLARED_VALIDATED,

	/**
	 * Not yet computed by the type's {@link LazyBinder}.
	 * Changes to {@link #LAZY_PRESENT} on the first read that succeeds.
	 */
	LAZY_MISSING,

	/**
	 * Present in the record's store on a type with a {@link LazyBinder}.
	 * Terminal: the binder won't be called for this name again.
	 */
	LAZY_PRESENT,

	/**
	 * Handled by the type's {@link FullInterceptor} on every read.
	 */
	FULLY_INTERCEPTED,

	/**
	 * No interception at all: the name is read straight from the store.
	 */
	PLAIN,
}
