package com.agentsessions.payloads.scanner.json;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Streaming, non-validating JSON structure tracker with an explicit frame stack.
 *
 * <p>Structural bytes drive the state of the top frame; string tokens are classified by the
 * {@link JsonScanPolicy} when they open and reported to it when they close. Large values
 * are never buffered, so memory is bounded by nesting depth plus two 512-byte buffers,
 * independent of file and payload size.
 *
 * <p>Malformed input never raises: closers on an empty stack are ignored, and bytes that
 * do not fit the current state are skipped. In line-delimited mode every raw newline
 * resets all state, which also recovers from a torn last line of an append-only log.
 *
 * @param <T> per-frame attachment type of the policy
 */
public final class JsonStructureTracker<T> {

    /** Buffer limit for keys and small values; longer strings are truncated. */
    public static final int MAX_SMALL_STRING_BYTES = 512;

    private final JsonScanPolicy<T> policy;
    private final boolean lineDelimited;
    private final List<JsonFrame<T>> stack = new ArrayList<>();

    // String token state
    private boolean inString;
    private boolean escaped;
    private StringClass stringClass = StringClass.IGNORED;
    private final byte[] small = new byte[MAX_SMALL_STRING_BYTES];
    private int smallLength;
    private long stringContentOffset;
    private long stringLineIndex;
    private boolean largeInvalid;

    private long lineIndex;
    private boolean halted;

    /**
     * @param policy        dialect rules
     * @param lineDelimited true for JSONL input (state resets on every newline)
     */
    public JsonStructureTracker(JsonScanPolicy<T> policy, boolean lineDelimited) {
        this.policy = policy;
        this.lineDelimited = lineDelimited;
    }

    /**
     * Feeds a run of bytes. Returns early once the policy halts.
     */
    public void feed(byte[] data, int offset, int length, long fileOffset) {
        int end = offset + length;
        for (int i = offset; i < end && !halted; i++) {
            accept(data[i], fileOffset + (i - offset));
        }
    }

    /**
     * Signals end of input to the policy.
     */
    public void finish() {
        if (!halted) {
            policy.onEndOfInput(lineIndex);
            halted = policy.halted();
        }
    }

    /**
     * Number of newline bytes seen so far.
     */
    public long lineIndex() {
        return lineIndex;
    }

    /**
     * Current nesting depth.
     */
    public int depth() {
        return stack.size();
    }

    public boolean isHalted() {
        return halted;
    }

    private void accept(byte b, long pos) {
        if (b == '\n' && lineDelimited) {
            endLine();
            return;
        }
        if (inString) {
            acceptStringByte(b, pos);
            return;
        }
        switch (b) {
            case '\n' -> lineIndex++;
            case ' ', '\t', '\r' -> {
                // whitespace
            }
            case '"' -> beginString(pos);
            case '{' -> open(JsonFrame.Kind.OBJECT, pos);
            case '[' -> open(JsonFrame.Kind.ARRAY, pos);
            case '}', ']' -> close();
            case ':' -> colon();
            case ',' -> comma();
            default -> consumeValueSlot();
        }
    }

    private void acceptStringByte(byte b, long pos) {
        if (b == '\n') {
            lineIndex++;
        }
        if (escaped) {
            escaped = false;
            switch (stringClass) {
                case KEY, SMALL_VALUE -> {
                    if (b != '"' && b != '\\' && b != '/') {
                        appendSmall((byte) '\\');
                    }
                    appendSmall(b);
                }
                case LARGE_VALUE -> largeInvalid = true;
                case IGNORED -> {
                    // not buffered
                }
            }
            return;
        }
        if (b == '\\') {
            escaped = true;
            if (stringClass == StringClass.LARGE_VALUE) {
                largeInvalid = true;
            }
            return;
        }
        if (b == '"') {
            endString(pos);
            return;
        }
        if (stringClass == StringClass.KEY || stringClass == StringClass.SMALL_VALUE) {
            appendSmall(b);
        }
    }

    private void appendSmall(byte b) {
        if (smallLength < MAX_SMALL_STRING_BYTES) {
            small[smallLength++] = b;
        }
    }

    private String smallString() {
        return new String(small, 0, smallLength, StandardCharsets.UTF_8);
    }

    private JsonFrame<T> top() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }

    private void beginString(long quoteOffset) {
        inString = true;
        escaped = false;
        smallLength = 0;
        largeInvalid = false;
        stringContentOffset = quoteOffset + 1;
        stringLineIndex = lineIndex;
        stringClass = classify(top());
    }

    private StringClass classify(JsonFrame<T> top) {
        if (top == null || !top.isObject()) {
            return StringClass.IGNORED;
        }
        return switch (top.objectState) {
            case EXPECT_KEY_OR_END -> StringClass.KEY;
            case EXPECT_VALUE -> {
                StringClass c = policy.classifyValue(top, top.currentKey == null ? "" : top.currentKey);
                yield c == StringClass.KEY ? StringClass.IGNORED : c;
            }
            default -> StringClass.IGNORED;
        };
    }

    private void endString(long endQuoteOffset) {
        inString = false;
        escaped = false;
        JsonFrame<T> top = top();
        if (top == null) {
            return;
        }
        if (top.isArray()) {
            if (top.arrayState == JsonFrame.ArrayState.EXPECT_VALUE_OR_END) {
                top.arrayState = JsonFrame.ArrayState.EXPECT_COMMA_OR_END;
            }
            return;
        }

        if (stringClass == StringClass.KEY && top.objectState == JsonFrame.ObjectState.EXPECT_KEY_OR_END) {
            top.currentKey = smallString();
            top.objectState = JsonFrame.ObjectState.EXPECT_COLON;
            return;
        }
        if (top.objectState != JsonFrame.ObjectState.EXPECT_VALUE) {
            return;
        }

        String key = top.currentKey == null ? "" : top.currentKey;
        top.currentKey = null;
        top.objectState = JsonFrame.ObjectState.EXPECT_COMMA_OR_END;
        switch (stringClass) {
            case SMALL_VALUE -> policy.onSmallValue(top, key, smallString());
            case LARGE_VALUE -> policy.onLargeValue(top, key,
                    new LargeString(stringContentOffset, endQuoteOffset, !largeInvalid, stringLineIndex));
            default -> {
                return;
            }
        }
        halted = policy.halted();
    }

    private void open(JsonFrame.Kind kind, long pos) {
        JsonFrame<T> parent = top();
        String parentKey = consumeValueSlot();
        JsonFrame<T> frame = new JsonFrame<>(kind, parent, stack.size(), pos, parentKey);
        stack.add(frame);
        frame.attach(policy.open(frame));
    }

    private void close() {
        if (stack.isEmpty()) {
            return;
        }
        JsonFrame<T> frame = stack.remove(stack.size() - 1);
        if (frame.isObject()) {
            policy.onObjectClose(frame);
            halted = policy.halted();
        }
    }

    private void colon() {
        JsonFrame<T> top = top();
        if (top != null && top.isObject() && top.objectState == JsonFrame.ObjectState.EXPECT_COLON) {
            top.objectState = JsonFrame.ObjectState.EXPECT_VALUE;
        }
    }

    private void comma() {
        JsonFrame<T> top = top();
        if (top == null) {
            return;
        }
        if (top.isObject()) {
            if (top.objectState == JsonFrame.ObjectState.EXPECT_COMMA_OR_END) {
                top.objectState = JsonFrame.ObjectState.EXPECT_KEY_OR_END;
            }
        } else if (top.arrayState == JsonFrame.ArrayState.EXPECT_COMMA_OR_END) {
            top.arrayState = JsonFrame.ArrayState.EXPECT_VALUE_OR_END;
        }
    }

    /**
     * Marks the pending value slot of the top frame as filled.
     *
     * @return the key the value belongs to when the top frame is an object expecting a value
     */
    private String consumeValueSlot() {
        JsonFrame<T> top = top();
        if (top == null) {
            return null;
        }
        if (top.isObject()) {
            if (top.objectState == JsonFrame.ObjectState.EXPECT_VALUE) {
                String key = top.currentKey;
                top.currentKey = null;
                top.objectState = JsonFrame.ObjectState.EXPECT_COMMA_OR_END;
                return key;
            }
        } else if (top.arrayState == JsonFrame.ArrayState.EXPECT_VALUE_OR_END) {
            top.arrayState = JsonFrame.ArrayState.EXPECT_COMMA_OR_END;
        }
        return null;
    }

    private void endLine() {
        policy.onLineEnd(lineIndex);
        halted = policy.halted();
        lineIndex++;
        stack.clear();
        inString = false;
        escaped = false;
        stringClass = StringClass.IGNORED;
        smallLength = 0;
        largeInvalid = false;
    }
}
