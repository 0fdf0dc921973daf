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

import java.util.Set;

/**
 * Extractor factory for Gemini session files: one JSON document whose message list holds
 * {@code {"inlineData":{"mimeType":"image/png","data":"..."}}} parts at any depth.
 *
 * <p>Each direct element of a {@code messages}, {@code history} or {@code items} array
 * gets a 0-based item index; a span is tagged with the index of its nearest enclosing
 * element, or 0 outside any indexed array. Spans are emitted when the inline data object
 * closes, so {@code mimeType} and {@code data} may come in either order.
 */
@ApplicationScoped
public class GeminiInlineDataExtractorFactory implements ExtractorFactory {

    static final Set<String> INDEXED_ARRAY_KEYS = Set.of("messages", "history", "items");
    static final Set<String> INLINE_DATA_KEYS = Set.of("inlineData", "inline_data");

    @Override
    public Dialect dialect() {
        return Dialect.GEMINI;
    }

    @Override
    public ByteExtractor createExtractor(ScanOptions options, SpanSink sink) {
        return new JsonExtractor<>(new InlineDataPolicy(sink), false);
    }

    private static final class FrameState {
        // arrays
        boolean indexed;
        int nextIndex;
        // objects
        int itemIndex = -1;
        boolean inlineData;
        String mimeType;
        LargeString data;
    }

    private static final class InlineDataPolicy implements JsonScanPolicy<FrameState> {
        private final SpanSink sink;

        InlineDataPolicy(SpanSink sink) {
            this.sink = sink;
        }

        @Override
        public FrameState open(JsonFrame<FrameState> frame) {
            FrameState state = new FrameState();
            String key = frame.parentKey();
            if (frame.isArray()) {
                state.indexed = key != null && INDEXED_ARRAY_KEYS.contains(key);
                return state;
            }
            state.inlineData = key != null && INLINE_DATA_KEYS.contains(key);
            JsonFrame<FrameState> parent = frame.parent();
            if (parent != null && parent.isArray() && parent.attachment().indexed) {
                state.itemIndex = parent.attachment().nextIndex++;
            }
            return state;
        }

        @Override
        public StringClass classifyValue(JsonFrame<FrameState> object, String key) {
            if (!object.attachment().inlineData) {
                return StringClass.IGNORED;
            }
            return switch (key) {
                case "data" -> StringClass.LARGE_VALUE;
                case "mimeType", "mime_type" -> StringClass.SMALL_VALUE;
                default -> StringClass.IGNORED;
            };
        }

        @Override
        public void onSmallValue(JsonFrame<FrameState> object, String key, String value) {
            object.attachment().mimeType = value;
        }

        @Override
        public void onLargeValue(JsonFrame<FrameState> object, String key, LargeString value) {
            if (value.usable()) {
                object.attachment().data = value;
            }
        }

        @Override
        public void onObjectClose(JsonFrame<FrameState> object) {
            FrameState state = object.attachment();
            if (!state.inlineData || state.data == null) {
                return;
            }
            String mime = state.mimeType == null ? "" : state.mimeType.trim();
            if (!mime.startsWith("image/")) {
                return;
            }
            Span span = Span.of(object.openOffset(), state.data.endQuoteOffset() + 1, mime,
                    state.data.contentOffset(), state.data.length());
            sink.accept(LocatedSpan.atItem(span, itemIndex(object)));
        }

        @Override
        public boolean halted() {
            return sink.isFull();
        }

        private static int itemIndex(JsonFrame<FrameState> frame) {
            for (JsonFrame<FrameState> f = frame; f != null; f = f.parent()) {
                if (f.isObject() && f.attachment().itemIndex >= 0) {
                    return f.attachment().itemIndex;
                }
            }
            return 0;
        }
    }
}
