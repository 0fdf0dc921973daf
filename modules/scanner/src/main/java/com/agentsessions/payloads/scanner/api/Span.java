package com.agentsessions.payloads.scanner.api;

import java.util.Objects;

/**
 * Byte range of one base64 image payload located inside a file.
 *
 * @param startOffset        inclusive offset of the enclosing marker or object
 * @param endOffsetExclusive offset just past the payload's closing delimiter
 * @param mediaType          declared media type, e.g. {@code image/png}
 * @param payloadOffset      offset of the first base64 character
 * @param payloadLength      number of base64 characters (not decoded bytes)
 * @param approxDecodedBytes {@code floor(payloadLength * 3 / 4)}
 */
public record Span(
        long startOffset,
        long endOffsetExclusive,
        String mediaType,
        long payloadOffset,
        int payloadLength,
        int approxDecodedBytes
) {
    public Span {
        Objects.requireNonNull(mediaType, "mediaType");
        if (startOffset < 0) {
            throw new IllegalArgumentException("Negative startOffset: " + startOffset);
        }
        if (payloadLength < 0) {
            throw new IllegalArgumentException("Negative payloadLength: " + payloadLength);
        }
        if (payloadOffset < startOffset) {
            throw new IllegalArgumentException(
                    "payloadOffset " + payloadOffset + " precedes startOffset " + startOffset);
        }
        if (payloadOffset + payloadLength > endOffsetExclusive) {
            throw new IllegalArgumentException(
                    "Payload [" + payloadOffset + ", +" + payloadLength + ") overruns end " + endOffsetExclusive);
        }
        if (approxDecodedBytes != approxDecodedBytes(payloadLength)) {
            throw new IllegalArgumentException(
                    "approxDecodedBytes " + approxDecodedBytes + " does not match payloadLength " + payloadLength);
        }
    }

    /**
     * Creates a span, deriving {@code approxDecodedBytes} from the payload length.
     */
    public static Span of(long startOffset, long endOffsetExclusive, String mediaType,
                          long payloadOffset, int payloadLength) {
        return new Span(startOffset, endOffsetExclusive, mediaType,
                payloadOffset, payloadLength, approxDecodedBytes(payloadLength));
    }

    /**
     * Cheap pre-decode size estimate for a base64 character count.
     */
    public static int approxDecodedBytes(int payloadLength) {
        return (int) ((payloadLength * 3L) / 4);
    }

    /**
     * Stable identifier of this span within its file.
     */
    public String id() {
        return startOffset + "-" + endOffsetExclusive;
    }
}
