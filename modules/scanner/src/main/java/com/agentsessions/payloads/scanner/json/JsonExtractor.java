package com.agentsessions.payloads.scanner.json;

import com.agentsessions.payloads.scanner.api.ByteExtractor;

/**
 * Adapts a {@link JsonStructureTracker} driven by one dialect policy to the
 * {@link ByteExtractor} contract.
 */
public final class JsonExtractor<T> implements ByteExtractor {

    private final JsonStructureTracker<T> tracker;

    public JsonExtractor(JsonScanPolicy<T> policy, boolean lineDelimited) {
        this.tracker = new JsonStructureTracker<>(policy, lineDelimited);
    }

    @Override
    public void feed(byte[] data, int offset, int length, long fileOffset) {
        tracker.feed(data, offset, length, fileOffset);
    }

    @Override
    public void finish() {
        tracker.finish();
    }
}
