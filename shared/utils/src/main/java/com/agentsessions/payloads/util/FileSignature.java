package com.agentsessions.payloads.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Cheap identity of a file's content version: size plus modification time.
 *
 * <p>Callers that cache located spans key them by this value; a session log that is
 * still being appended to changes both fields.
 *
 * @param size             size in bytes
 * @param lastModifiedMillis modification time, epoch milliseconds
 */
public record FileSignature(long size, long lastModifiedMillis) {

    public FileSignature {
        if (size < 0) {
            throw new IllegalArgumentException("Negative size: " + size);
        }
    }

    /**
     * Reads the signature of a file.
     */
    public static FileSignature of(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        return new FileSignature(attrs.size(), attrs.lastModifiedTime().toMillis());
    }

    /**
     * Parses the {@link #toString()} form {@code size:mtime}.
     */
    public static FileSignature parse(String text) {
        int colon = text.indexOf(':');
        if (colon <= 0 || colon == text.length() - 1) {
            throw new IllegalArgumentException("Invalid signature: " + text);
        }
        try {
            return new FileSignature(
                    Long.parseLong(text.substring(0, colon)),
                    Long.parseLong(text.substring(colon + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid signature: " + text, e);
        }
    }

    @Override
    public String toString() {
        return size + ":" + lastModifiedMillis;
    }
}
