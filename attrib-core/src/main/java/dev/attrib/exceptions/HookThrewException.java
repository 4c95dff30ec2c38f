package dev.attrib.exceptions;

import java.lang.reflect.InvocationTargetException;

/**
 * Wraps an exception that was thrown by a <code>@WriteHook</code> method.
 * The write that triggered the hook is not committed.
 *
 * <p>
 * Basically a {@link RuntimeException} version of {@link
 * InvocationTargetException}.  {@link #getCause()} returns the original
 * exception; same as {@link InvocationTargetException#getCause()}.
 */
@SuppressWarnings("serial")
public class HookThrewException extends RuntimeException {
	public HookThrewException(String message, Throwable cause) { super(message, cause); }
}
