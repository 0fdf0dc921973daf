package com.agentsessions.payloads.scanner.dialects;

import com.agentsessions.payloads.scanner.api.ByteExtractor;
import com.agentsessions.payloads.scanner.api.LocatedSpan;
import com.agentsessions.payloads.scanner.api.ScanOptions;
import com.agentsessions.payloads.scanner.api.Span;
import com.agentsessions.payloads.scanner.api.SpanSink;
import com.agentsessions.payloads.types.Dialect;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OpenClawImageBlockExtractorFactoryTest {

    private static final String ROLE_AFTER_CONTENT =
            "{\"type\":\"message\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"look\"},"
                    + "{\"type\":\"image\",\"data\":\"iVBORw0K\",\"mimeType\":\"image/png\"}],\"role\":\"user\"}}\n";

    private final OpenClawImageBlockExtractorFactory factory = new OpenClawImageBlockExtractorFactory();

    private List<LocatedSpan> scan(String content, int maxMatches) {
        SpanSink sink = new SpanSink(maxMatches);
        ByteExtractor extractor = factory.createExtractor(ScanOptions.enumerate(), sink);
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        extractor.feed(bytes, 0, bytes.length, 0);
        extractor.finish();
        return sink.spans();
    }

    private List<LocatedSpan> scan(String content) {
        return scan(content, 200);
    }

    @Test
    void shouldServeOpenClawDialect() {
        assertThat(factory.dialect()).isEqualTo(Dialect.OPENCLAW);
    }

    @Test
    void shouldEmitWhenRoleFollowsContent() {
        List<LocatedSpan> spans = scan(ROLE_AFTER_CONTENT);

        assertThat(spans).hasSize(1);
        Span span = spans.get(0).span();
        assertThat(span.mediaType()).isEqualTo("image/png");
        assertThat(span.payloadLength()).isEqualTo(8);
        assertThat(span.payloadOffset()).isEqualTo(ROLE_AFTER_CONTENT.indexOf("iVBORw0K"));
        assertThat(span.startOffset()).isEqualTo(ROLE_AFTER_CONTENT.indexOf("{\"type\":\"image\""));
        assertThat(span.endOffsetExclusive()).isEqualTo(span.payloadOffset() + 9);
    }

    @Test
    void shouldOnlyEmitFromUserLines() {
        String assistant = ROLE_AFTER_CONTENT.replace("\"role\":\"user\"", "\"role\":\"assistant\"");
        List<LocatedSpan> spans = scan(assistant + ROLE_AFTER_CONTENT + assistant);
        assertThat(spans).singleElement().satisfies(s -> assertThat(s.position()).isEqualTo(1));
    }

    @Test
    void shouldLetFirstRoleDecide() {
        String line = "{\"message\":{\"role\":\"assistant\",\"content\":[{\"type\":\"image\",\"data\":\"AAAA\","
                + "\"mimeType\":\"image/png\"}]},\"meta\":{\"role\":\"user\"}}\n";
        assertThat(scan(line)).isEmpty();
    }

    @Test
    void shouldFlushLastLineWithoutNewline() {
        String line = ROLE_AFTER_CONTENT.substring(0, ROLE_AFTER_CONTENT.length() - 1);
        assertThat(scan("{}\n" + line)).singleElement().satisfies(s -> assertThat(s.position()).isEqualTo(1));
    }

    @Test
    void shouldDropBlockCutMidPayload() {
        String torn = "{\"role\":\"user\",\"content\":[{\"type\":\"image\",\"mimeType\":\"image/png\",\"data\":\"AAAA";
        assertThat(scan(torn)).isEmpty();
    }

    @Test
    void shouldRequireImageType() {
        String line = "{\"role\":\"user\",\"content\":[{\"type\":\"file\",\"data\":\"AAAA\",\"mimeType\":\"image/png\"}]}\n";
        assertThat(scan(line)).isEmpty();
    }

    @Test
    void shouldHonorMatchCapWithinLine() {
        String block = "{\"type\":\"image\",\"data\":\"AAAA\",\"mimeType\":\"image/png\"}";
        String line = "{\"role\":\"user\",\"content\":[" + block + "," + block + "," + block + "]}\n";
        assertThat(scan(line, 2)).hasSize(2);
    }

    @Test
    void shouldDefaultMediaType() {
        String line = "{\"role\":\"user\",\"content\":[{\"type\":\"image\",\"data\":\"AAAA\"}]}\n";
        assertThat(scan(line)).singleElement()
                .satisfies(s -> assertThat(s.span().mediaType()).isEqualTo("image"));
    }
}
