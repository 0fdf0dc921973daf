package com.agentsessions.payloads.core.error;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Wraps checked I/O exceptions from opening or reading a session file.
 */
public class PayloadIoException extends PayloadLocatorException {

    private final Path file;

    public PayloadIoException(Path file, String message, IOException cause) {
        super(ErrorKind.IO_ERROR, message + ": " + file, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
