package com.agentsessions.payloads.scanner.json;

/**
 * How the tracker treats a JSON string token while it streams past.
 */
public enum StringClass {
    /** Object key; buffered up to {@link JsonStructureTracker#MAX_SMALL_STRING_BYTES}. */
    KEY,
    /** Short semantic value (role, type, mime type); buffered up to the same limit. */
    SMALL_VALUE,
    /** Potentially huge value such as a base64 payload; only its extent is recorded. */
    LARGE_VALUE,
    /** Neither buffered nor reported. */
    IGNORED
}
