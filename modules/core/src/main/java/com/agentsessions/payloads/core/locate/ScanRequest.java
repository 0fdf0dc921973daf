package com.agentsessions.payloads.core.locate;

import com.agentsessions.payloads.types.Dialect;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Full option set of one scan.
 *
 * @param file                   session file to scan
 * @param dialect                transcript dialect of the file
 * @param maxMatches             hard cap on returned spans
 * @param cancel                 polled at a fixed byte interval; true stops the scan
 * @param messageIds             messages whose part files are scanned (delegated dialects only; empty means all)
 * @param requireImageUrlContext keep only spans whose data URL is the value of a JSON {@code image_url} field
 */
public record ScanRequest(
        Path file,
        Dialect dialect,
        int maxMatches,
        BooleanSupplier cancel,
        List<String> messageIds,
        boolean requireImageUrlContext
) {
    public static final BooleanSupplier NEVER_CANCEL = () -> false;

    public ScanRequest {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(dialect, "dialect");
        cancel = cancel == null ? NEVER_CANCEL : cancel;
        messageIds = messageIds == null ? List.of() : List.copyOf(messageIds);
    }

    public static ScanRequest of(Path file, Dialect dialect, int maxMatches) {
        return new ScanRequest(file, dialect, maxMatches, NEVER_CANCEL, List.of(), false);
    }

    public ScanRequest withCancel(BooleanSupplier cancel) {
        return new ScanRequest(file, dialect, maxMatches, cancel, messageIds, requireImageUrlContext);
    }

    public ScanRequest withMessageIds(List<String> messageIds) {
        return new ScanRequest(file, dialect, maxMatches, cancel, messageIds, requireImageUrlContext);
    }

    public ScanRequest withMaxMatches(int maxMatches) {
        return new ScanRequest(file, dialect, maxMatches, cancel, messageIds, requireImageUrlContext);
    }

    public ScanRequest requiringImageUrlContext() {
        return new ScanRequest(file, dialect, maxMatches, cancel, messageIds, true);
    }
}
