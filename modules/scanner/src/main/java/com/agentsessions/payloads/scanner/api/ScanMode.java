package com.agentsessions.payloads.scanner.api;

/**
 * What a scan is asked to produce.
 */
public enum ScanMode {
    /** Locate complete spans, up to the match cap. */
    ENUMERATE,
    /** Answer "is there any image" and stop as early as the dialect allows. */
    PRESENCE
}
