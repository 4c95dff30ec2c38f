package dev.attrib.logging;

import dev.attrib.RecordType;

/**
 * Keys to use for SLF4J's Mapped Diagnostic Context.
 */
public final class MdcKeys {
	private MdcKeys() {}

	/**
	 * The value of {@link RecordType#name()} for the record being accessed.
	 */
	public static final String RECORD_TYPE = "attrib.recordType";

	/**
	 * The name of the attribute being read, computed or written.
	 */
	public static final String ATTRIBUTE = "attrib.attribute";
}
