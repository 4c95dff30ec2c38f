package dev.attrib;

import org.jetbrains.annotations.Nullable;

/**
 * A deterministic check applied by a {@link ValidatedField} on every write.
 *
 * @see Validators
 */
@FunctionalInterface
public interface Validator<V> {
	/**
	 * @return null if <code>value</code> is acceptable; otherwise a
	 * human-readable reason it was rejected.
	 * Must not have side effects, and must give the same answer every time for the same value.
	 */
	@Nullable String rejectionReason(@Nullable V value);

	default Validator<V> and(Validator<? super V> other) {
		return value -> {
			String reason = this.rejectionReason(value);
			if (reason == null) {
				return other.rejectionReason(value);
			} else {
				return reason;
			}
		};
	}
}
