package dev.attrib.interceptors;

import dev.attrib.RawAttributes;
import dev.attrib.WriteListener;
import lombok.RequiredArgsConstructor;

/**
 * Passes each write to several listeners in order.
 * An exception from any of them stops the rest, and the write is not committed.
 */
@RequiredArgsConstructor
public class ForwardingWriteListener implements WriteListener {
	private final Iterable<? extends WriteListener> downstream;

	@Override
	public void beforeWrite(RawAttributes raw, String name, Object value) {
		for (WriteListener l: downstream) {
			l.beforeWrite(raw, name, value);
		}
	}

	@Override
	public String toString() {
		return "ForwardingWriteListener{" +
			"downstream=" + downstream +
			'}';
	}
}
