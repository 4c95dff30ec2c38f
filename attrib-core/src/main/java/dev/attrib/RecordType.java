package dev.attrib;

import dev.attrib.annotations.Declared;
import dev.attrib.exceptions.AttributeMissingException;
import dev.attrib.exceptions.InvalidRecordTypeException;
import dev.attrib.interceptors.ForwardingWriteListener;
import dev.attrib.util.ReflectionHelpers;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;
import org.pcollections.OrderedPMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.reflect.Modifier.isStatic;
import static java.util.Objects.requireNonNull;

/**
 * The declaration of a record type: its {@link ValidatedField}s and the
 * interceptors applied to its undeclared attributes.
 * Built once, usually as a <code>static final</code> constant of the record class,
 * and immutable afterward.
 *
 * <p>
 * A read of <code>name</code> is resolved as follows:
 * <ol>
 *     <li>If a declared field owns <code>name</code>, it answers.</li>
 *     <li>Otherwise, if there is a {@link FullInterceptor}, it answers.</li>
 *     <li>Otherwise, the record's own store answers if it has <code>name</code>.</li>
 *     <li>Otherwise, the {@link LazyBinder} answers if there is one.</li>
 *     <li>Otherwise, {@link AttributeMissingException}.</li>
 * </ol>
 * Reserved names (see {@link AttributeStore}) are never resolved.
 * Writes go through the {@link WriteInterceptor}, if any, and then to
 * the declared field or the store.
 */
@Accessors(fluent = true)
public final class RecordType<R extends AttributeRecord> {
	@Getter private final Class<R> recordClass;
	private final OrderedPMap<String, ValidatedField<?>> declaredFields;
	private final @Nullable LazyBinder lazyBinder;
	private final @Nullable FullInterceptor fullInterceptor;
	private final @Nullable WriteInterceptor writeInterceptor;

	private RecordType(
		Class<R> recordClass,
		OrderedPMap<String, ValidatedField<?>> declaredFields,
		@Nullable LazyBinder lazyBinder,
		@Nullable FullInterceptor fullInterceptor,
		@Nullable WriteInterceptor writeInterceptor
	) {
		this.recordClass = recordClass;
		this.declaredFields = declaredFields;
		this.lazyBinder = lazyBinder;
		this.fullInterceptor = fullInterceptor;
		this.writeInterceptor = writeInterceptor;
	}

	public static <RR extends AttributeRecord> Builder<RR> builder(Class<RR> recordClass) {
		return new Builder<>(recordClass);
	}

	/**
	 * A record type with no declared fields and no interception.
	 */
	public static <RR extends AttributeRecord> RecordType<RR> plain(Class<RR> recordClass) {
		return builder(recordClass).build();
	}

	public String name() {
		return recordClass.getSimpleName();
	}

	public Collection<ValidatedField<?>> declaredFields() {
		return declaredFields.values();
	}

	public @Nullable ValidatedField<?> declaredField(String name) {
		return declaredFields.get(name);
	}

	public boolean hasLazyBinder() {
		return lazyBinder != null;
	}

	public boolean hasFullInterceptor() {
		return fullInterceptor != null;
	}

	public boolean hasWriteInterceptor() {
		return writeInterceptor != null;
	}

	@Nullable Object read(AttributeRecord record, String name) {
		if (AttributeStore.isReserved(name)) {
			throw new AttributeMissingException(name, "Attribute name \"" + name + "\" is reserved");
		}
		ValidatedField<?> field = declaredFields.get(name);
		if (field != null) {
			return field.read(record);
		}
		AttributeStore store = record.store();
		if (fullInterceptor != null) {
			return fullInterceptor.read(store, name);
		}
		Resolution stored = store.get(name);
		if (stored instanceof Resolution.Found found) {
			return found.value();
		} else if (lazyBinder != null) {
			return lazyBinder.read(store, name);
		} else {
			throw new AttributeMissingException(recordClass, name);
		}
	}

	void write(AttributeRecord record, String name, @Nullable Object value) {
		if (AttributeStore.isReserved(name)) {
			throw new IllegalArgumentException("Attribute name \"" + name + "\" is reserved");
		}
		ValidatedField<?> field = declaredFields.get(name);
		AttributeStore store = record.store();
		if (writeInterceptor == null) {
			if (field == null) {
				store.put(name, value);
			} else {
				field.writeObject(record, value);
			}
		} else {
			if (field == null) {
				writeInterceptor.write(store, name, value);
			} else {
				writeInterceptor.writeDeclared(record, store, field, value);
			}
		}
	}

	/**
	 * Reports how <code>name</code> would be resolved for <code>record</code>
	 * without actually resolving it.
	 */
	public AttributeState stateOf(R record, String name) {
		if (declaredFields.containsKey(name)) {
			return AttributeState.DECLARED_VALIDATED;
		} else if (fullInterceptor != null) {
			return AttributeState.FULLY_INTERCEPTED;
		} else if (lazyBinder != null) {
			return record.store().contains(name) ? AttributeState.LAZY_PRESENT : AttributeState.LAZY_MISSING;
		} else {
			return AttributeState.PLAIN;
		}
	}

	@Override
	public String toString() {
		return "RecordType(" + name() + ", declared=" + declaredFields.keySet() + ")";
	}

	public static final class Builder<R extends AttributeRecord> {
		private final Class<R> recordClass;
		private final List<ValidatedField<?>> fields = new ArrayList<>();
		private @Nullable AttributeComputer computer;
		private @Nullable ReadInterceptor readInterceptor;
		private final List<WriteListener> writeListeners = new ArrayList<>();

		Builder(Class<R> recordClass) {
			this.recordClass = requireNonNull(recordClass);
		}

		public Builder<R> declare(ValidatedField<?> field) {
			fields.add(requireNonNull(field));
			return this;
		}

		/**
		 * Declares every static field of the record class annotated with {@link Declared},
		 * in the order they appear in the class file.
		 *
		 * @throws InvalidRecordTypeException if an annotated field is not a static {@link ValidatedField},
		 * or has not been initialized yet.
		 */
		public Builder<R> scanDeclaredFields() {
			int numFound = 0;
			for (Field f: ReflectionHelpers.getDeclaredFieldsInOrder(recordClass)) {
				if (!f.isAnnotationPresent(Declared.class)) {
					continue;
				}
				if (!isStatic(f.getModifiers())) {
					throw InvalidRecordTypeException.forField(recordClass, f.getName(), "@" + Declared.class.getSimpleName() + " field must be static");
				} else if (!ValidatedField.class.isAssignableFrom(f.getType())) {
					throw InvalidRecordTypeException.forField(recordClass, f.getName(), "@" + Declared.class.getSimpleName() + " field must be a " + ValidatedField.class.getSimpleName());
				}
				Object value;
				try {
					value = ReflectionHelpers.setAccessible(f).get(null);
				} catch (IllegalAccessException | IllegalArgumentException e) {
					throw new InvalidRecordTypeException("Unable to read @" + Declared.class.getSimpleName() + " field " + f, e);
				}
				if (value == null) {
					throw InvalidRecordTypeException.forField(recordClass, f.getName(), "not yet initialized; declare it before the RecordType");
				}
				LOGGER.debug("Found declared field {}.{}", recordClass.getSimpleName(), f.getName());
				declare((ValidatedField<?>) value);
				numFound++;
			}
			if (numFound == 0) {
				LOGGER.warn("Found no @{} fields in {}; may be misconfigured", Declared.class.getSimpleName(), recordClass.getSimpleName());
			}
			return this;
		}

		/**
		 * Computes missing attributes on first read.
		 */
		public Builder<R> lazy(AttributeComputer computer) {
			if (this.computer != null) {
				throw new IllegalStateException("Lazy computer already set for " + recordClass.getSimpleName());
			}
			this.computer = requireNonNull(computer);
			return this;
		}

		/**
		 * Intercepts every read of an undeclared attribute.
		 */
		public Builder<R> intercept(ReadInterceptor readInterceptor) {
			if (this.readInterceptor != null) {
				throw new IllegalStateException("Read interceptor already set for " + recordClass.getSimpleName());
			}
			this.readInterceptor = requireNonNull(readInterceptor);
			return this;
		}

		/**
		 * Adds a listener to be called before every write.
		 * Listeners run in the order they're added.
		 */
		public Builder<R> onWrite(WriteListener listener) {
			writeListeners.add(requireNonNull(listener));
			return this;
		}

		/**
		 * Adds a listener that calls the {@link dev.attrib.annotations.WriteHook}
		 * methods of <code>receiver</code>.
		 */
		public Builder<R> writeHooks(Object receiver) {
			return onWrite(WriteHookRegistrar.listenerFor(receiver));
		}

		/**
		 * @throws InvalidRecordTypeException if two fields have the same name
		 */
		public RecordType<R> build() {
			OrderedPMap<String, ValidatedField<?>> declared = OrderedPMap.empty();
			for (ValidatedField<?> field: fields) {
				DeclarationValidation.validateAttributeName(recordClass, field.name());
				if (declared.containsKey(field.name())) {
					throw InvalidRecordTypeException.forField(recordClass, field.name(), "declared more than once");
				}
				declared = declared.plus(field.name(), field);
			}
			String typeName = recordClass.getSimpleName();
			LazyBinder lazyBinder = (computer == null) ? null : new LazyBinder(typeName, computer);
			FullInterceptor fullInterceptor = (readInterceptor == null) ? null : new FullInterceptor(typeName, readInterceptor, lazyBinder);
			WriteInterceptor writeInterceptor = switch (writeListeners.size()) {
				case 0 -> null;
				case 1 -> new WriteInterceptor(writeListeners.get(0));
				default -> new WriteInterceptor(new ForwardingWriteListener(List.copyOf(writeListeners)));
			};
			RecordType<R> result = new RecordType<>(recordClass, declared, lazyBinder, fullInterceptor, writeInterceptor);
			LOGGER.debug("Built {}", result);
			return result;
		}

		@Override
		public String toString() {
			return "RecordType.Builder(" + recordClass.getSimpleName() + ")";
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RecordType.class);
}
