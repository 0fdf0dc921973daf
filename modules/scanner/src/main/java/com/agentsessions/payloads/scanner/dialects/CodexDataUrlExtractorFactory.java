package com.agentsessions.payloads.scanner.dialects;

import com.agentsessions.payloads.scanner.api.ByteExtractor;
import com.agentsessions.payloads.scanner.api.ExtractorFactory;
import com.agentsessions.payloads.scanner.api.ScanOptions;
import com.agentsessions.payloads.scanner.api.SpanSink;
import com.agentsessions.payloads.types.Dialect;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Extractor factory for Codex session logs, which embed images as plain data URLs.
 * The same scan is reused for OpenCode part files.
 */
@ApplicationScoped
public class CodexDataUrlExtractorFactory implements ExtractorFactory {

    @Override
    public Dialect dialect() {
        return Dialect.CODEX;
    }

    @Override
    public ByteExtractor createExtractor(ScanOptions options, SpanSink sink) {
        return new DataUrlExtractor(options, sink);
    }
}
