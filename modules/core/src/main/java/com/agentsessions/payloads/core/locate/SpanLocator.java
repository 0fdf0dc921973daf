package com.agentsessions.payloads.core.locate;

import com.agentsessions.payloads.core.error.PayloadIoException;
import com.agentsessions.payloads.core.layout.PartFileLayout;
import com.agentsessions.payloads.core.layout.StorageLayoutResolver;
import com.agentsessions.payloads.scanner.api.ByteExtractor;
import com.agentsessions.payloads.scanner.api.LocatedSpan;
import com.agentsessions.payloads.scanner.api.ScanOptions;
import com.agentsessions.payloads.scanner.api.Span;
import com.agentsessions.payloads.scanner.api.SpanSink;
import com.agentsessions.payloads.scanner.registry.DialectRegistry;
import com.agentsessions.payloads.types.Dialect;
import com.agentsessions.payloads.util.FileSignature;
import com.agentsessions.payloads.util.stream.ByteStreamReader;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

/**
 * Runs a dialect extractor over one session file and returns the located spans.
 *
 * <p>Files are read front to back in chunks; the cancellation predicate is polled before
 * every chunk and every {@code payloads.scan.cancel-check-interval} bytes within one.
 * A cancelled scan returns the spans found so far. Spans come back in ascending start
 * offset, never more than the requested cap.
 *
 * <p>Delegated dialects are scanned through their part files: the
 * {@link StorageLayoutResolver} lists them and each is scanned as a Codex file.
 *
 * <p>Span filters (the {@code image_url} context check, the part-file minimums) run as
 * each span is emitted, so rejected spans never count toward the cap or end a presence scan.
 *
 * <p>Stateless; concurrent scans of different files are independent.
 */
@ApplicationScoped
public class SpanLocator {

    private static final Logger log = Logger.getLogger(SpanLocator.class);

    @Inject
    DialectRegistry registry;

    @Inject
    StorageLayoutResolver layoutResolver;

    @Inject
    ImageUrlContextProbe contextProbe;

    @ConfigProperty(name = "payloads.scan.chunk-size", defaultValue = "65536")
    int chunkSize;

    @ConfigProperty(name = "payloads.scan.cancel-check-interval", defaultValue = "32768")
    int cancelCheckInterval;

    @ConfigProperty(name = "payloads.scan.max-matches", defaultValue = "200")
    int defaultMaxMatches;

    @ConfigProperty(name = "payloads.scan.presence-min-payload-chars", defaultValue = "64")
    int presenceMinPayloadChars;

    @ConfigProperty(name = "payloads.parts.max-matches", defaultValue = "400")
    int partsMaxMatches;

    @ConfigProperty(name = "payloads.parts.min-payload-chars", defaultValue = "64")
    int partsMinPayloadChars;

    @ConfigProperty(name = "payloads.parts.min-approx-bytes", defaultValue = "32")
    int partsMinApproxBytes;

    private record ScanOutcome(List<LocatedSpan> spans, boolean cancelled) {
    }

    /**
     * Scans with the configured match cap of the dialect and no cancellation.
     */
    public List<LocatedSpan> scan(Path file, Dialect dialect) {
        return scan(ScanRequest.of(file, dialect, defaultMaxMatches(dialect)));
    }

    public List<LocatedSpan> scan(Path file, Dialect dialect, int maxMatches, BooleanSupplier cancel) {
        return scan(ScanRequest.of(file, dialect, maxMatches).withCancel(cancel));
    }

    /**
     * Enumerates the spans of a file.
     *
     * @throws PayloadIoException if the file (or, for delegated dialects, the part store) cannot be read
     */
    public List<LocatedSpan> scan(ScanRequest request) {
        if (request.maxMatches() <= 0) {
            return List.of();
        }
        try {
            List<LocatedSpan> spans = request.dialect().delegated()
                    ? scanParts(request, ScanOptions.enumerate())
                    : scanSingle(request, ScanOptions.enumerate());
            log.debugf("Scanned %s as %s: %d spans", request.file(), request.dialect().label(), spans.size());
            return spans;
        } catch (IOException e) {
            throw new PayloadIoException(request.file(), "Failed to scan", e);
        } catch (UncheckedIOException e) {
            throw new PayloadIoException(request.file(), "Failed to scan", e.getCause());
        }
    }

    /**
     * Cheap "does this file hold any image" check. Never throws: unreadable files,
     * cancellation and any other failure all answer false.
     */
    public boolean containsImage(Path file, Dialect dialect, BooleanSupplier cancel) {
        return containsImage(ScanRequest.of(file, dialect, 1).withCancel(cancel));
    }

    public boolean containsImage(ScanRequest request) {
        ScanRequest single = request.withMaxMatches(1);
        ScanOptions options = ScanOptions.presence(presenceMinPayloadChars);
        try {
            List<LocatedSpan> spans = single.dialect().delegated()
                    ? scanParts(single, options)
                    : scanSingle(single, options);
            return !spans.isEmpty();
        } catch (IOException | RuntimeException e) {
            log.debugf("Presence check failed for %s: %s", request.file(), e.getMessage());
            return false;
        }
    }

    /**
     * Size and modification time of a session file, for callers that cache spans per file.
     *
     * @throws PayloadIoException if the file cannot be stat'ed
     */
    public FileSignature signature(Path file) {
        try {
            return FileSignature.of(file);
        } catch (IOException e) {
            throw new PayloadIoException(file, "Failed to read file attributes", e);
        }
    }

    int defaultMaxMatches(Dialect dialect) {
        return dialect.delegated() ? partsMaxMatches : defaultMaxMatches;
    }

    private List<LocatedSpan> scanSingle(ScanRequest request, ScanOptions options) throws IOException {
        ScanOutcome outcome = scanFile(request.file(), request.dialect(), options, request.maxMatches(),
                request.cancel(), request.requireImageUrlContext(), span -> true);
        if (outcome.cancelled() && options.presenceOnly()) {
            return List.of();
        }
        return outcome.spans();
    }

    private List<LocatedSpan> scanParts(ScanRequest request, ScanOptions options) throws IOException {
        PartFileLayout layout = layoutResolver.resolve(request.file(), request.messageIds());
        log.debugf("Resolved %d part files (%s) for %s", layout.fileCount(), layout.schema(), request.file());

        List<LocatedSpan> out = new ArrayList<>();
        for (Map.Entry<String, List<Path>> message : layout.partsByMessage().entrySet()) {
            String messageId = message.getKey();
            if (messageId.isEmpty()) {
                continue;
            }
            for (Path part : message.getValue()) {
                if (request.cancel().getAsBoolean()) {
                    log.debugf("Part scan of %s cancelled after %d spans", request.file(), out.size());
                    return options.presenceOnly() ? List.of() : out;
                }
                ScanOutcome outcome;
                try {
                    outcome = scanFile(part, Dialect.CODEX, options, request.maxMatches() - out.size(),
                            request.cancel(), request.requireImageUrlContext(), this::meetsPartMinimum);
                } catch (IOException e) {
                    log.warnf("Skipping unreadable part file %s: %s", part, e.getMessage());
                    continue;
                }
                for (LocatedSpan located : outcome.spans()) {
                    out.add(LocatedSpan.inMessagePart(located.span(), messageId, part, located.position()));
                    if (out.size() >= request.maxMatches()) {
                        return out;
                    }
                }
                if (outcome.cancelled()) {
                    return options.presenceOnly() ? List.of() : out;
                }
            }
        }
        return out;
    }

    private boolean meetsPartMinimum(LocatedSpan located) {
        Span span = located.span();
        return span.payloadLength() >= partsMinPayloadChars && span.approxDecodedBytes() >= partsMinApproxBytes;
    }

    private ScanOutcome scanFile(Path file, Dialect dialect, ScanOptions options, int maxMatches,
                                 BooleanSupplier cancel, boolean requireImageUrlContext,
                                 Predicate<LocatedSpan> keep) throws IOException {
        int interval = Math.max(1, cancelCheckInterval);

        try (ByteStreamReader reader = ByteStreamReader.open(file)) {
            Predicate<LocatedSpan> filter = requireImageUrlContext
                    ? keep.and(located -> hasImageUrlContext(reader, located))
                    : keep;
            SpanSink sink = new SpanSink(maxMatches, filter);
            ByteExtractor extractor = registry.require(dialect).createExtractor(options, sink);
            while (!sink.isFull()) {
                if (cancel.getAsBoolean()) {
                    log.debugf("Scan of %s cancelled at offset %d with %d spans", file, reader.position(), sink.size());
                    return new ScanOutcome(sink.spans(), true);
                }
                ByteBuffer chunk = reader.nextChunk(chunkSize);
                if (!chunk.hasRemaining()) {
                    extractor.finish();
                    break;
                }
                byte[] data = chunk.array();
                int base = chunk.arrayOffset() + chunk.position();
                int length = chunk.remaining();
                long fileOffset = reader.chunkOffset();
                for (int done = 0; done < length && !sink.isFull(); ) {
                    int step = Math.min(interval, length - done);
                    extractor.feed(data, base + done, step, fileOffset + done);
                    done += step;
                    if (done < length && !sink.isFull() && cancel.getAsBoolean()) {
                        log.debugf("Scan of %s cancelled at offset %d with %d spans", file, fileOffset + done, sink.size());
                        return new ScanOutcome(sink.spans(), true);
                    }
                }
            }
            return new ScanOutcome(sink.spans(), false);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private boolean hasImageUrlContext(ByteStreamReader reader, LocatedSpan located) {
        try {
            return contextProbe.isImageUrlContext(reader, located.span().startOffset());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
