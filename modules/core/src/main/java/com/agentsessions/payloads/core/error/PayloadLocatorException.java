package com.agentsessions.payloads.core.error;

/**
 * Base class of all typed failures raised by the locator and decoder.
 */
public abstract class PayloadLocatorException extends RuntimeException {

    private final ErrorKind kind;

    protected PayloadLocatorException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PayloadLocatorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
