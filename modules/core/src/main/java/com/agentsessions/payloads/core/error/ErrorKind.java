package com.agentsessions.payloads.core.error;

/**
 * Failure categories surfaced by enumerate scans and decodes.
 */
public enum ErrorKind {
    /** File unreadable or unseekable; not retryable for that call. */
    IO_ERROR,
    /** The caller's cancellation predicate fired. */
    CANCELLED,
    /** Decoding produced no bytes. */
    INVALID_BASE64,
    /** Estimated or exact decoded size exceeds the caller's budget. */
    TOO_LARGE
}
