package com.agentsessions.payloads.core.error;

/**
 * Thrown by a decode whose cancellation predicate fired. Scans never throw it;
 * they return the spans found so far.
 */
public class ScanCancelledException extends PayloadLocatorException {

    public ScanCancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }
}
