package com.agentsessions.payloads.core.error;

/**
 * Thrown when a payload's decoded size exceeds the caller's budget.
 */
public class PayloadTooLargeException extends PayloadLocatorException {

    private final long size;
    private final long limit;
    private final boolean exact;

    public PayloadTooLargeException(long size, long limit, boolean exact) {
        super(ErrorKind.TOO_LARGE, (exact ? "Decoded size " : "Estimated decoded size ")
                + size + " exceeds limit " + limit);
        this.size = size;
        this.limit = limit;
        this.exact = exact;
    }

    public long size() {
        return size;
    }

    public long limit() {
        return limit;
    }

    /**
     * False when the estimate rejected the payload before any bytes were read.
     */
    public boolean exact() {
        return exact;
    }
}
