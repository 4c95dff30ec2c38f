package dev.attrib;

import org.jetbrains.annotations.Nullable;

/**
 * Side-effecting logic run by a {@link WriteInterceptor} before each write is committed.
 * Throwing an exception prevents the commit.
 *
 * @see dev.attrib.interceptors.AuditingWriteListener
 * @see dev.attrib.interceptors.ForwardingWriteListener
 */
@FunctionalInterface
public interface WriteListener {
	void beforeWrite(RawAttributes raw, String name, @Nullable Object value);
}
