package com.agentsessions.payloads.core.error;

/**
 * Thrown when a payload slice contains no decodable base64 characters.
 */
public class InvalidBase64Exception extends PayloadLocatorException {

    public InvalidBase64Exception(String message) {
        super(ErrorKind.INVALID_BASE64, message);
    }
}
