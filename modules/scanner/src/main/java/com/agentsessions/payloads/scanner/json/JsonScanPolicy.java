package com.agentsessions.payloads.scanner.json;

/**
 * Dialect rules plugged into {@link JsonStructureTracker}.
 *
 * <p>The tracker owns the byte-level state machine; a policy only decides which strings
 * matter and what a finished string, closed container or ended line means.
 *
 * @param <T> per-frame attachment type
 */
public interface JsonScanPolicy<T> {

    /**
     * Called right after a container frame is pushed.
     *
     * @return attachment stored on the frame (may be null)
     */
    T open(JsonFrame<T> frame);

    /**
     * Classifies the string about to start as the value of {@code key} in {@code object}.
     */
    StringClass classifyValue(JsonFrame<T> object, String key);

    /**
     * A {@link StringClass#SMALL_VALUE} string finished.
     */
    void onSmallValue(JsonFrame<T> object, String key, String value);

    /**
     * A {@link StringClass#LARGE_VALUE} string finished.
     */
    void onLargeValue(JsonFrame<T> object, String key, LargeString value);

    /**
     * An object is about to be popped.
     */
    default void onObjectClose(JsonFrame<T> object) {
    }

    /**
     * A raw newline ended a line; only called in line-delimited mode.
     *
     * @param lineIndex index of the line that just ended
     */
    default void onLineEnd(long lineIndex) {
    }

    /**
     * Input is exhausted.
     *
     * @param lineIndex index of the last (possibly unterminated) line
     */
    default void onEndOfInput(long lineIndex) {
    }

    /**
     * True once the policy wants no more input.
     */
    default boolean halted() {
        return false;
    }
}
