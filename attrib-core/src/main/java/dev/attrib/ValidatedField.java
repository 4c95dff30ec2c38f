package dev.attrib;

import com.google.common.collect.MapMaker;
import dev.attrib.exceptions.InvalidRecordTypeException;
import dev.attrib.exceptions.ValidationException;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A reusable, validated attribute shared by every record of the types that declare it.
 *
 * <p>
 * One instance serves any number of records, so the per-record values live
 * in a side table keyed by record identity. The keys are held weakly:
 * the side table never keeps a record alive, and a record's entry disappears
 * once the record is collected.
 *
 * <p>
 * {@link #read} never throws and never touches anything but the side table,
 * so it's safe to call from hot paths.
 * {@link #write} runs the {@link Validator} every time; a rejected write
 * leaves the previous value in place.
 *
 * <p>
 * Only records whose {@link RecordType} declares the field may be written;
 * for any other record, {@link #read} just returns the {@link #defaultValue()}.
 *
 * <p>
 * Different records may be accessed concurrently through the same field.
 * Concurrent writes to the same record's value are not supported.
 *
 * @param <V> the value type; never a primitive
 */
@Accessors(fluent = true)
public final class ValidatedField<V> {
	@Getter private final String name;
	@Getter private final Class<V> valueClass;
	private final Validator<? super V> validator;
	@Getter private final @Nullable V defaultValue;
	@Getter private final boolean writeOnce;

	// Identity-keyed; Optional because the map can't hold null values
	private final ConcurrentMap<AttributeRecord, Optional<V>> valuesByRecord = new MapMaker().weakKeys().makeMap();

	private static final String IMMUTABLE = "field is immutable once set";

	private ValidatedField(Builder<V> builder) {
		this.name = builder.name;
		this.valueClass = builder.valueClass;
		this.validator = builder.validator;
		this.defaultValue = builder.defaultValue;
		this.writeOnce = builder.writeOnce;
	}

	public static <VV> Builder<VV> builder(String name, Class<VV> valueClass) {
		return new Builder<>(name, valueClass);
	}

	public static <VV> ValidatedField<VV> of(String name, Class<VV> valueClass, @Nullable VV defaultValue, Validator<? super VV> validator) {
		return builder(name, valueClass)
			.defaultValue(defaultValue)
			.validator(validator)
			.build();
	}

	/**
	 * @return the value most recently written for <code>record</code>,
	 * or {@link #defaultValue()} if there is none.
	 */
	public @Nullable V read(AttributeRecord record) {
		Optional<V> value = valuesByRecord.get(record);
		if (value == null) {
			return defaultValue;
		} else {
			return value.orElse(null);
		}
	}

	/**
	 * @throws ValidationException if the {@link Validator} rejects <code>value</code>,
	 * or if this field is {@link #writeOnce()} and already has a value for <code>record</code>.
	 * In either case, the stored value is unchanged.
	 * @throws IllegalArgumentException if <code>record</code>'s type doesn't declare this field
	 */
	public void write(AttributeRecord record, @Nullable V value) {
		commit(record, validate(record, value));
	}

	/**
	 * Like {@link #write} for a value whose type is known only at runtime.
	 *
	 * @throws ValidationException if <code>value</code> is not a {@link #valueClass()}.
	 */
	void writeObject(AttributeRecord record, @Nullable Object value) {
		commit(record, validate(record, value));
	}

	/**
	 * Runs every check {@link #write} would, without writing.
	 *
	 * @return <code>value</code>, cast to the field's value type
	 * @throws ValidationException if {@link #write} would reject <code>value</code>
	 * @throws IllegalArgumentException if <code>record</code>'s type doesn't declare this field
	 */
	@Nullable V validate(AttributeRecord record, @Nullable Object value) {
		requireNonNull(record);
		if (record.recordType().declaredField(name) != this) {
			throw new IllegalArgumentException(this + " is not declared by " + record.recordType());
		}
		if (value != null && !valueClass.isInstance(value)) {
			throw new ValidationException(name, "expected " + valueClass.getSimpleName() + "; got " + value.getClass().getSimpleName());
		}
		V typedValue = valueClass.cast(value);
		String reason = validator.rejectionReason(typedValue);
		if (reason != null) {
			throw new ValidationException(name, reason);
		}
		if (writeOnce && valuesByRecord.containsKey(record)) {
			throw new ValidationException(name, IMMUTABLE);
		}
		return typedValue;
	}

	/**
	 * Stores a value that has already passed {@link #validate}.
	 */
	void commit(AttributeRecord record, @Nullable V value) {
		if (writeOnce) {
			Optional<V> existing = valuesByRecord.putIfAbsent(record, Optional.ofNullable(value));
			if (existing != null) {
				// Lost a race with another writer of the same record
				throw new ValidationException(name, IMMUTABLE);
			}
		} else {
			valuesByRecord.put(record, Optional.ofNullable(value));
		}
	}

	/**
	 * @return true if a value has been written for <code>record</code>.
	 */
	public boolean isSet(AttributeRecord record) {
		return valuesByRecord.containsKey(record);
	}

	/**
	 * Reverts <code>record</code> to the {@link #defaultValue()}.
	 * Note that this allows a {@link #writeOnce()} field to be written again.
	 */
	public void clear(AttributeRecord record) {
		valuesByRecord.remove(record);
	}

	/**
	 * @return the number of records whose entries are still in the side table.
	 * Entries for collected records are not counted, even if the
	 * side table hasn't gotten around to discarding them yet.
	 */
	public int liveEntryCount() {
		int count = 0;
		for (AttributeRecord ignored: valuesByRecord.keySet()) {
			count++;
		}
		return count;
	}

	@Override
	public String toString() {
		return "ValidatedField(" + name + ": " + valueClass.getSimpleName() + ")";
	}

	public static final class Builder<V> {
		private final String name;
		private final Class<V> valueClass;
		private Validator<? super V> validator = Validators.always();
		private @Nullable V defaultValue = null;
		private boolean writeOnce = false;

		Builder(String name, Class<V> valueClass) {
			this.name = requireNonNull(name);
			this.valueClass = requireNonNull(valueClass);
		}

		public Builder<V> validator(Validator<? super V> validator) {
			this.validator = requireNonNull(validator);
			return this;
		}

		public Builder<V> defaultValue(@Nullable V defaultValue) {
			this.defaultValue = defaultValue;
			return this;
		}

		/**
		 * Rejects every write after the first successful one.
		 */
		public Builder<V> writeOnce() {
			this.writeOnce = true;
			return this;
		}

		/**
		 * @throws InvalidRecordTypeException if the name or value class isn't allowed,
		 * or if the default value is rejected by the validator.
		 */
		public ValidatedField<V> build() {
			String nameProblem = DeclarationValidation.attributeNameProblem(name);
			if (nameProblem != null) {
				throw new InvalidRecordTypeException("Invalid field name \"" + name + "\": " + nameProblem);
			}
			DeclarationValidation.validateValueClass(name, valueClass);
			String defaultProblem = validator.rejectionReason(defaultValue);
			if (defaultProblem != null) {
				throw new InvalidRecordTypeException("Default value for field \"" + name + "\" is invalid: " + defaultProblem);
			}
			return new ValidatedField<>(this);
		}
	}
}
