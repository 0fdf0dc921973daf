package com.agentsessions.payloads.scanner.dialects;

import com.agentsessions.payloads.scanner.api.ByteExtractor;
import com.agentsessions.payloads.scanner.api.ExtractorFactory;
import com.agentsessions.payloads.scanner.api.LocatedSpan;
import com.agentsessions.payloads.scanner.api.ScanOptions;
import com.agentsessions.payloads.scanner.api.Span;
import com.agentsessions.payloads.scanner.api.SpanSink;
import com.agentsessions.payloads.scanner.json.JsonExtractor;
import com.agentsessions.payloads.scanner.json.JsonFrame;
import com.agentsessions.payloads.scanner.json.JsonScanPolicy;
import com.agentsessions.payloads.scanner.json.LargeString;
import com.agentsessions.payloads.scanner.json.StringClass;
import com.agentsessions.payloads.types.Dialect;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;

/**
 * Extractor factory for OpenClaw JSONL transcripts, whose image blocks are flat:
 * <pre>{"type":"image","mimeType":"image/jpeg","data":"..."}</pre>
 *
 * <p>The first {@code role} value on a line decides whether the line is user-authored,
 * and it may be written after the content array. Candidate blocks are therefore held
 * until the line (or the file) ends and only emitted when the role is {@code user}.
 */
@ApplicationScoped
public class OpenClawImageBlockExtractorFactory implements ExtractorFactory {

    @Override
    public Dialect dialect() {
        return Dialect.OPENCLAW;
    }

    @Override
    public ByteExtractor createExtractor(ScanOptions options, SpanSink sink) {
        return new JsonExtractor<>(new FlatImagePolicy(sink), true);
    }

    private static final class BlockState {
        boolean image;
        String mimeType;
        LargeString data;
    }

    private static final class FlatImagePolicy implements JsonScanPolicy<BlockState> {
        private final SpanSink sink;
        private final List<Span> pending = new ArrayList<>();
        private String lineRole;

        FlatImagePolicy(SpanSink sink) {
            this.sink = sink;
        }

        @Override
        public BlockState open(JsonFrame<BlockState> frame) {
            return frame.isObject() ? new BlockState() : null;
        }

        @Override
        public StringClass classifyValue(JsonFrame<BlockState> object, String key) {
            return switch (key) {
                case "data" -> StringClass.LARGE_VALUE;
                case "role", "type", "mimeType" -> StringClass.SMALL_VALUE;
                default -> StringClass.IGNORED;
            };
        }

        @Override
        public void onSmallValue(JsonFrame<BlockState> object, String key, String value) {
            BlockState block = object.attachment();
            switch (key) {
                case "role" -> {
                    if (lineRole == null) {
                        lineRole = value;
                    }
                }
                case "type" -> block.image = "image".equals(value);
                case "mimeType" -> {
                    if (!value.isEmpty()) {
                        block.mimeType = value;
                    }
                }
                default -> {
                }
            }
        }

        @Override
        public void onLargeValue(JsonFrame<BlockState> object, String key, LargeString value) {
            if (value.usable()) {
                object.attachment().data = value;
            }
        }

        @Override
        public void onObjectClose(JsonFrame<BlockState> object) {
            BlockState block = object.attachment();
            if (block.image && block.data != null) {
                String media = block.mimeType != null ? block.mimeType : "image";
                pending.add(Span.of(object.openOffset(), block.data.endQuoteOffset() + 1, media,
                        block.data.contentOffset(), block.data.length()));
            }
        }

        @Override
        public void onLineEnd(long lineIndex) {
            flush(lineIndex);
        }

        @Override
        public void onEndOfInput(long lineIndex) {
            flush(lineIndex);
        }

        @Override
        public boolean halted() {
            return sink.isFull();
        }

        private void flush(long lineIndex) {
            if ("user".equals(lineRole)) {
                int line = (int) Math.min(Integer.MAX_VALUE, lineIndex);
                for (Span span : pending) {
                    if (!sink.accept(LocatedSpan.atLine(span, line))) {
                        break;
                    }
                }
            }
            pending.clear();
            lineRole = null;
        }
    }
}
