package com.agentsessions.payloads.scanner.dialects;

import com.agentsessions.payloads.scanner.api.ByteExtractor;
import com.agentsessions.payloads.scanner.api.LocatedSpan;
import com.agentsessions.payloads.scanner.api.ScanOptions;
import com.agentsessions.payloads.scanner.api.Span;
import com.agentsessions.payloads.scanner.api.SpanSink;
import com.agentsessions.payloads.scanner.match.KmpMatcher;

import java.nio.charset.StandardCharsets;

/**
 * Flat scan for {@code data:image...;base64,<payload>} URLs anywhere in a file's bytes.
 *
 * <p>Not JSON-aware: the marker is found with {@link KmpMatcher}, the header between
 * {@code data:image} and {@code ;base64,} is capped at {@value #MAX_HEADER_BYTES} bytes,
 * and the payload runs until the first terminator byte. Spans are tagged with the
 * 0-based line on which their marker starts.
 *
 * <p>In presence mode the extractor reports a partial span as soon as the payload reaches
 * {@link ScanOptions#presenceMinPayloadChars()} characters, and halts the sink if the
 * sink keeps it. A rejected candidate is skipped and the search resumes after it.
 */
public final class DataUrlExtractor implements ByteExtractor {

    public static final int MAX_HEADER_BYTES = 512;

    static final KmpMatcher START = KmpMatcher.of("data:image");
    static final KmpMatcher BASE64_MARKER = KmpMatcher.of(";base64,");

    private static final String DEFAULT_MEDIA_TYPE = "image";

    private enum State { SEARCH, HEADER, PAYLOAD }

    private final ScanOptions options;
    private final SpanSink sink;

    private State state = State.SEARCH;
    private int startMatch;
    private int markerMatch;
    private final byte[] header = new byte[MAX_HEADER_BYTES];
    private int headerLength;

    private long candidateStart;
    private long candidateLine;
    private long payloadOffset;
    private long payloadLength;
    private String mediaType = DEFAULT_MEDIA_TYPE;
    private long lineIndex;

    public DataUrlExtractor(ScanOptions options, SpanSink sink) {
        this.options = options;
        this.sink = sink;
    }

    /**
     * True for bytes that end a data URL: quotes, whitespace and closing brackets.
     */
    public static boolean isTerminator(byte b) {
        return switch (b) {
            case '"', '\'', ' ', '\t', '\n', '\r', ')', ']', '}', '>' -> true;
            default -> false;
        };
    }

    @Override
    public void feed(byte[] data, int offset, int length, long fileOffset) {
        int end = offset + length;
        for (int i = offset; i < end && !sink.isFull(); i++) {
            byte b = data[i];
            long pos = fileOffset + (i - offset);
            if (b == '\n') {
                lineIndex++;
            }
            switch (state) {
                case SEARCH -> search(b, pos);
                case HEADER -> header(b, pos);
                case PAYLOAD -> payload(b, pos);
            }
        }
    }

    private void search(byte b, long pos) {
        startMatch = START.advance(startMatch, b);
        if (START.isComplete(startMatch)) {
            state = State.HEADER;
            candidateStart = pos - START.length() + 1;
            candidateLine = lineIndex;
            headerLength = 0;
            markerMatch = 0;
            payloadLength = 0;
            mediaType = DEFAULT_MEDIA_TYPE;
            startMatch = 0;
        }
    }

    private void header(byte b, long pos) {
        if (isTerminator(b)) {
            // Not a data URL, e.g. prose or code mentioning "data:image".
            state = State.SEARCH;
            return;
        }
        if (headerLength == MAX_HEADER_BYTES) {
            state = State.SEARCH;
            search(b, pos);
            return;
        }
        header[headerLength++] = b;
        markerMatch = BASE64_MARKER.advance(markerMatch, b);
        if (BASE64_MARKER.isComplete(markerMatch)) {
            mediaType = parseMediaType(header, headerLength);
            payloadOffset = pos + 1;
            state = State.PAYLOAD;
        }
    }

    private void payload(byte b, long pos) {
        if (isTerminator(b)) {
            if (payloadLength > 0 && !options.presenceOnly()) {
                emit(pos + 1);
            }
            state = State.SEARCH;
            return;
        }
        payloadLength++;
        if (options.presenceOnly() && payloadLength == options.presenceMinPayloadChars()) {
            if (emit(pos + 1)) {
                sink.halt();
            }
        }
    }

    /**
     * @return true if the sink kept the span
     */
    private boolean emit(long endExclusive) {
        int length = (int) Math.min(Integer.MAX_VALUE, payloadLength);
        Span span = Span.of(candidateStart, endExclusive, mediaType, payloadOffset, length);
        int before = sink.size();
        sink.accept(LocatedSpan.atLine(span, (int) Math.min(Integer.MAX_VALUE, candidateLine)));
        return sink.size() > before;
    }

    /**
     * Media type from the header bytes that follow {@code data:image}, e.g. {@code /png;base64,}.
     * JSON-escaped slashes are normalised; an empty subtype yields {@code image}.
     */
    static String parseMediaType(byte[] header, int length) {
        int semi = 0;
        while (semi < length && header[semi] != ';') {
            semi++;
        }
        String raw = "image" + new String(header, 0, semi, StandardCharsets.UTF_8);
        String normalized = raw.replace("\\/", "/").trim();
        return normalized.isEmpty() ? DEFAULT_MEDIA_TYPE : normalized;
    }
}
