package dev.attrib;

import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;

/**
 * Routes every write through a {@link WriteListener} before committing it.
 *
 * <p>
 * Once the listener returns normally, the commit always happens.
 * Declared fields validate before the listener runs.
 * Commits go to the raw store, or to the {@link ValidatedField} for declared names,
 * never back through {@link Interceptable#setAttribute}.
 */
@RequiredArgsConstructor
public final class WriteInterceptor {
	private final WriteListener listener;

	public void write(RawAttributes raw, String name, @Nullable Object value) {
		listener.beforeWrite(raw, name, value);
		raw.put(name, value);
	}

	/**
	 * Like {@link #write}, but for a declared field. The field's checks run
	 * before the listener, so the listener only sees writes that will be committed.
	 */
	<V> void writeDeclared(AttributeRecord record, RawAttributes raw, ValidatedField<V> field, @Nullable Object value) {
		V checked = field.validate(record, value);
		listener.beforeWrite(raw, field.name(), value);
		field.commit(record, checked);
	}

	@Override
	public String toString() {
		return "WriteInterceptor(" + listener + ")";
	}
}
