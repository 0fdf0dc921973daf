package com.agentsessions.payloads.scanner.api;

/**
 * Per-scan settings handed to an {@link ExtractorFactory}.
 *
 * @param mode                     enumerate or presence-only
 * @param presenceMinPayloadChars  payload characters a presence scan must see before it
 *                                 reports a hit, for dialects that exit early
 */
public record ScanOptions(ScanMode mode, int presenceMinPayloadChars) {

    public static final int DEFAULT_PRESENCE_MIN_PAYLOAD_CHARS = 64;

    public ScanOptions {
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        presenceMinPayloadChars = Math.max(1, presenceMinPayloadChars);
    }

    public static ScanOptions enumerate() {
        return new ScanOptions(ScanMode.ENUMERATE, DEFAULT_PRESENCE_MIN_PAYLOAD_CHARS);
    }

    public static ScanOptions presence(int minPayloadChars) {
        return new ScanOptions(ScanMode.PRESENCE, minPayloadChars);
    }

    public boolean presenceOnly() {
        return mode == ScanMode.PRESENCE;
    }
}
