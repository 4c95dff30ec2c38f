package dev.attrib;

import java.util.LinkedHashSet;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableSet;

/**
 * Base class for record-like objects whose attributes are managed by a {@link RecordType}.
 *
 * <p>
 * Subclasses pass their type to the constructor, typically a
 * <code>static final</code> constant, and may use {@link #raw()} for
 * their own bookkeeping. Everyone else goes through the {@link Interceptable} methods.
 *
 * <p>
 * Declared fields store their values outside the record, keyed by identity,
 * so subclasses may override {@link #equals} and {@link #hashCode} freely.
 */
public abstract class AttributeRecord implements Interceptable {
	private final RecordType<?> recordType;
	private final AttributeStore store = new AttributeStore();

	protected AttributeRecord(RecordType<?> recordType) {
		if (!recordType.recordClass().isInstance(this)) {
			throw new IllegalArgumentException(getClass().getSimpleName() + " can't use record type for " + recordType.name());
		}
		this.recordType = recordType;
	}

	public final RecordType<?> recordType() {
		return recordType;
	}

	/**
	 * Access to this record's own store that bypasses all interception.
	 */
	protected final RawAttributes raw() {
		return store;
	}

	final AttributeStore store() {
		return store;
	}

	@Override
	public final @Nullable Object getAttribute(String name) {
		return recordType.read(this, name);
	}

	@Override
	public final void setAttribute(String name, @Nullable Object value) {
		recordType.write(this, name, value);
	}

	/**
	 * Declared fields that have been written, followed by stored attributes,
	 * excluding reserved names.
	 */
	@Override
	public final Set<String> attributeNames() {
		Set<String> result = new LinkedHashSet<>();
		for (ValidatedField<?> field: recordType.declaredFields()) {
			if (field.isSet(this)) {
				result.add(field.name());
			}
		}
		for (String name: store.names()) {
			if (!AttributeStore.isReserved(name)) {
				result.add(name);
			}
		}
		return unmodifiableSet(result);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + Attributes.snapshot(this);
	}
}
