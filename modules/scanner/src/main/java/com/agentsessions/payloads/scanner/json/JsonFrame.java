package com.agentsessions.payloads.scanner.json;

/**
 * One level of the tracker's explicit nesting stack.
 *
 * <p>Frames are O(1) in size: parse state, the key currently being read, the offset of
 * the opening brace or bracket, and a dialect-owned attachment.
 *
 * @param <T> dialect attachment type
 */
public final class JsonFrame<T> {

    public enum Kind { OBJECT, ARRAY }

    public enum ObjectState { EXPECT_KEY_OR_END, EXPECT_COLON, EXPECT_VALUE, EXPECT_COMMA_OR_END }

    public enum ArrayState { EXPECT_VALUE_OR_END, EXPECT_COMMA_OR_END }

    private final Kind kind;
    private final JsonFrame<T> parent;
    private final int depth;
    private final long openOffset;
    private final String parentKey;

    ObjectState objectState = ObjectState.EXPECT_KEY_OR_END;
    ArrayState arrayState = ArrayState.EXPECT_VALUE_OR_END;
    String currentKey;
    private T attachment;

    JsonFrame(Kind kind, JsonFrame<T> parent, int depth, long openOffset, String parentKey) {
        this.kind = kind;
        this.parent = parent;
        this.depth = depth;
        this.openOffset = openOffset;
        this.parentKey = parentKey;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isObject() {
        return kind == Kind.OBJECT;
    }

    public boolean isArray() {
        return kind == Kind.ARRAY;
    }

    /**
     * Enclosing frame, or null for a top-level value.
     */
    public JsonFrame<T> parent() {
        return parent;
    }

    /**
     * 0 for a top-level value.
     */
    public int depth() {
        return depth;
    }

    /**
     * File offset of the opening brace or bracket.
     */
    public long openOffset() {
        return openOffset;
    }

    /**
     * Key under which this container is the value, or null inside arrays and at top level.
     */
    public String parentKey() {
        return parentKey;
    }

    /**
     * Key whose value is being read; only meaningful for objects.
     */
    public String currentKey() {
        return currentKey;
    }

    public ObjectState objectState() {
        return objectState;
    }

    public ArrayState arrayState() {
        return arrayState;
    }

    public T attachment() {
        return attachment;
    }

    void attach(T attachment) {
        this.attachment = attachment;
    }
}
