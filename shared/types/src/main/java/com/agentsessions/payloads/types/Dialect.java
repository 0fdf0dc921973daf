package com.agentsessions.payloads.types;

/**
 * Transcript schema variants that embed base64 images.
 * Each dialect tags its spans with exactly one {@link PositionKind}.
 */
public enum Dialect {
    /** Codex rollouts: flat {@code data:image/...;base64,} URLs anywhere in the file. */
    CODEX(0, "codex", PositionKind.LINE, false),
    /** Claude Code JSONL: user image blocks with a nested base64 {@code source} object. */
    CLAUDE(1, "claude", PositionKind.LINE, false),
    /** OpenClaw JSONL: user image blocks with flat {@code mimeType}/{@code data} fields. */
    OPENCLAW(2, "openclaw", PositionKind.LINE, false),
    /** Gemini session JSON: {@code inlineData} objects inside an indexed message array. */
    GEMINI(3, "gemini", PositionKind.ITEM, false),
    /** OpenCode: images live in per-message part files next to the session file. */
    OPENCODE(4, "opencode", PositionKind.MESSAGE_PART, true);

    private final int id;
    private final String label;
    private final PositionKind positionKind;
    private final boolean delegated;

    Dialect(int id, String label, PositionKind positionKind, boolean delegated) {
        this.id = id;
        this.label = label;
        this.positionKind = positionKind;
        this.delegated = delegated;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public PositionKind positionKind() {
        return positionKind;
    }

    /**
     * True when the session file itself is not scanned; its auxiliary files are.
     */
    public boolean delegated() {
        return delegated;
    }

    public static Dialect fromId(int id) {
        for (Dialect d : values()) {
            if (d.id == id) return d;
        }
        throw new IllegalArgumentException("Unknown Dialect id: " + id);
    }

    public static Dialect fromLabel(String label) {
        for (Dialect d : values()) {
            if (d.label.equalsIgnoreCase(label)) return d;
        }
        throw new IllegalArgumentException("Unknown Dialect label: " + label);
    }
}
