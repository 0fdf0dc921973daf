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

import java.util.Locale;
import java.util.Set;

/**
 * Extractor factory for Claude JSONL transcripts.
 *
 * <p>Images are two-level content blocks:
 * <pre>{"type":"image","source":{"type":"base64","media_type":"image/png","data":"..."}}</pre>
 * Only blocks on user-authored lines are reported, so screenshots returned inside tool
 * results (which arrive as escaped JSON text or on assistant lines) are skipped.
 * A span is emitted as soon as its {@code data} string closes: this format writes
 * {@code role} and {@code type} ahead of the message content.
 */
@ApplicationScoped
public class ClaudeImageBlockExtractorFactory implements ExtractorFactory {

    static final Set<String> USER_ROLES = Set.of("user", "human");
    static final Set<String> USER_LINE_TYPES = Set.of("user", "user_input", "user-input", "input", "prompt", "human");

    @Override
    public Dialect dialect() {
        return Dialect.CLAUDE;
    }

    @Override
    public ByteExtractor createExtractor(ScanOptions options, SpanSink sink) {
        return new JsonExtractor<>(new ImageBlockPolicy(sink), true);
    }

    private static final class BlockState {
        boolean image;
        boolean base64Source;
        String mediaType;
    }

    private static final class ImageBlockPolicy implements JsonScanPolicy<BlockState> {
        private final SpanSink sink;
        private boolean userLine;

        ImageBlockPolicy(SpanSink sink) {
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
                case "role", "type", "media_type" -> StringClass.SMALL_VALUE;
                default -> StringClass.IGNORED;
            };
        }

        @Override
        public void onSmallValue(JsonFrame<BlockState> object, String key, String value) {
            BlockState block = object.attachment();
            String lower = value.toLowerCase(Locale.ROOT);
            switch (key) {
                case "role" -> {
                    if (USER_ROLES.contains(lower)) {
                        userLine = true;
                    }
                }
                case "type" -> {
                    if (object.depth() == 0 && USER_LINE_TYPES.contains(lower)) {
                        userLine = true;
                    }
                    if ("image".equals(lower)) {
                        block.image = true;
                    } else if ("base64".equals(lower)) {
                        block.base64Source = true;
                    }
                }
                case "media_type" -> {
                    if (!value.isEmpty()) {
                        block.mediaType = value;
                    }
                }
                default -> {
                }
            }
        }

        @Override
        public void onLargeValue(JsonFrame<BlockState> object, String key, LargeString value) {
            BlockState block = object.attachment();
            if (!userLine || !block.base64Source || !value.usable() || !underImageBlock(object)) {
                return;
            }
            String media = block.mediaType != null ? block.mediaType : "image";
            Span span = Span.of(object.openOffset(), value.endQuoteOffset() + 1, media,
                    value.contentOffset(), value.length());
            sink.accept(LocatedSpan.atLine(span, (int) Math.min(Integer.MAX_VALUE, value.lineIndex())));
        }

        @Override
        public void onLineEnd(long lineIndex) {
            userLine = false;
        }

        @Override
        public boolean halted() {
            return sink.isFull();
        }

        private static boolean underImageBlock(JsonFrame<BlockState> frame) {
            for (JsonFrame<BlockState> f = frame; f != null; f = f.parent()) {
                if (f.attachment() != null && f.attachment().image) {
                    return true;
                }
            }
            return false;
        }
    }
}
