package dev.attrib;

import java.util.function.Predicate;

/**
 * Commonly used {@link Validator}s.
 */
public final class Validators {
	private Validators() {}

	public static <V> Validator<V> always() {
		return value -> null;
	}

	public static <V> Validator<V> of(Predicate<? super V> predicate, String requirement) {
		return value -> predicate.test(value) ? null : requirement + "; got " + value;
	}

	public static <V> Validator<V> notNull() {
		return value -> value == null ? "must not be null" : null;
	}

	/**
	 * Null values are rejected.
	 */
	public static <V extends Comparable<? super V>> Validator<V> range(V min, V max) {
		if (min.compareTo(max) > 0) {
			throw new IllegalArgumentException("Empty range: " + min + " > " + max);
		}
		return Validators.<V>notNull().and(Validators.<V>of(
			v -> min.compareTo(v) <= 0 && v.compareTo(max) <= 0,
			"must be between " + min + " and " + max));
	}

	public static <V extends Comparable<? super V>> Validator<V> atLeast(V min) {
		return Validators.<V>notNull().and(Validators.<V>of(
			v -> min.compareTo(v) <= 0,
			"must be >= " + min));
	}

	public static <V extends Comparable<? super V>> Validator<V> greaterThan(V min) {
		return Validators.<V>notNull().and(Validators.<V>of(
			v -> min.compareTo(v) < 0,
			"must be > " + min));
	}
}
