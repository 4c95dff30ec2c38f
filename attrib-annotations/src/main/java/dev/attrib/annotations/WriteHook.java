package dev.attrib.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a method to be called before each attribute write on records
 * of a type built with <code>RecordType.Builder.writeHooks</code>.
 *
 * <p>
 * Parameters are matched by type: a <code>String</code> receives the attribute name,
 * an <code>Object</code> receives the new value,
 * and a <code>RawAttributes</code> receives the record's raw attributes.
 * Each may appear at most once.
 * Currently ignored on interface methods.
 */
@Retention(RUNTIME)
@Target(METHOD)
public @interface WriteHook {
	/**
	 * Attribute names this hook applies to. Empty means all attributes.
	 */
	String[] value() default {};

	/**
	 * Indicates the order in which hooks should run.
	 * Higher numbers run first. Hooks with the same
	 * <code>priority</code> run in bytecode order,
	 * with inherited hooks running first.
	 */
	int priority() default 0;
}
