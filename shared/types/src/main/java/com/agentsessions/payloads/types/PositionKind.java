package com.agentsessions.payloads.types;

/**
 * How a located span is positioned within the session it was found in.
 */
public enum PositionKind {
    /** 0-based count of raw newline bytes preceding the span. */
    LINE(0, "line"),
    /** 0-based element index within a designated message array. */
    ITEM(1, "item"),
    /** Message id plus the line within that message's auxiliary part file. */
    MESSAGE_PART(2, "message-part");

    private final int id;
    private final String label;

    PositionKind(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static PositionKind fromId(int id) {
        for (PositionKind k : values()) {
            if (k.id == id) return k;
        }
        throw new IllegalArgumentException("Unknown PositionKind id: " + id);
    }
}
