/**
 * Ready-made {@link dev.attrib.WriteListener}s that can be combined
 * on a {@link dev.attrib.RecordType.Builder}.
 */
package dev.attrib.interceptors;
