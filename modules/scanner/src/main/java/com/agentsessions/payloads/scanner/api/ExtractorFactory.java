package com.agentsessions.payloads.scanner.api;

import com.agentsessions.payloads.types.Dialect;

/**
 * Factory for the byte extractor of one dialect.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface ExtractorFactory {
    /**
     * The dialect whose files this factory's extractors understand.
     */
    Dialect dialect();

    /**
     * Creates a fresh extractor for one scan.
     *
     * @param options scan mode and thresholds
     * @param sink    receives located spans
     */
    ByteExtractor createExtractor(ScanOptions options, SpanSink sink);
}
