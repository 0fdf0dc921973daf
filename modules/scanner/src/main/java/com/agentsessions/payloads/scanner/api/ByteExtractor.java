package com.agentsessions.payloads.scanner.api;

/**
 * Single forward pass over a file's bytes, emitting spans into a {@link SpanSink}.
 *
 * <p>Implementations keep O(1) state per nesting level and never look back at bytes
 * they have already been fed.
 */
public interface ByteExtractor {

    /**
     * Consumes the next run of bytes.
     *
     * @param data       byte source
     * @param offset     first byte to read in {@code data}
     * @param length     number of bytes to read
     * @param fileOffset absolute file offset of {@code data[offset]}
     */
    void feed(byte[] data, int offset, int length, long fileOffset);

    /**
     * Signals end of input so pending candidates can be flushed.
     * Not called when a scan is cancelled.
     */
    default void finish() {
    }
}
