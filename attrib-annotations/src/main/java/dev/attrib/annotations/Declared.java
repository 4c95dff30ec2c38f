package dev.attrib.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a <code>static final ValidatedField</code> constant to be registered
 * on its enclosing record type when the type is built with
 * <code>RecordType.Builder.scanDeclaredFields()</code>.
 *
 * <p>
 * Fields are registered in the order they appear in the classfile,
 * so the constant holding the <code>RecordType</code> itself must be
 * declared after every <code>@Declared</code> constant; otherwise the
 * scanner sees a null and refuses to build the type.
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface Declared {

}
