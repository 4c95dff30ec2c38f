package dev.attrib;

/**
 * Custom read logic for a {@link FullInterceptor}, consulted for names
 * that aren't in the record's own store.
 */
@FunctionalInterface
public interface ReadInterceptor {
	/**
	 * @param raw the record's own attributes. Reading the interceptor's own
	 *            bookkeeping fields through this can't recurse.
	 * @return {@link Resolution#missing()} if this interceptor has no value for <code>name</code>
	 */
	Resolution intercept(RawAttributes raw, String name);
}
