package com.agentsessions.payloads;

import com.agentsessions.payloads.core.decode.PayloadDecoder;
import com.agentsessions.payloads.core.error.PayloadTooLargeException;
import com.agentsessions.payloads.core.locate.ScanRequest;
import com.agentsessions.payloads.core.locate.SpanLocator;
import com.agentsessions.payloads.scanner.api.LocatedSpan;
import com.agentsessions.payloads.types.Dialect;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end locate and decode through the CDI wiring and configuration.
 */
@QuarkusTest
class SpanLocatorIntegrationTest {

    @Inject
    SpanLocator locator;

    @Inject
    PayloadDecoder decoder;

    @ConfigProperty(name = "payloads.scan.max-matches")
    int maxMatches;

    @ConfigProperty(name = "payloads.decode.max-decoded-bytes")
    long maxDecodedBytes;

    private Path workDir;

    @BeforeEach
    void setUp() throws IOException {
        workDir = Files.createTempDirectory("payload-locator-it");
    }

    @AfterEach
    void tearDown() throws IOException {
        try (Stream<Path> walk = Files.walk(workDir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }

    @Test
    void shouldBindConfiguration() {
        assertThat(maxMatches).isEqualTo(200);
        assertThat(maxDecodedBytes).isEqualTo(26_214_400L);
    }

    @Test
    void shouldLocateAndDecodeUserImage() throws IOException {
        byte[] image = new byte[300];
        for (int i = 0; i < image.length; i++) {
            image[i] = (byte) i;
        }
        String payload = Base64.getEncoder().encodeToString(image);
        String content = "{\"type\":\"assistant\",\"message\":{\"role\":\"assistant\",\"content\":\"hi\"}}\n"
                + "{\"type\":\"user\",\"message\":{\"role\":\"user\",\"content\":[{\"type\":\"image\",\"source\":"
                + "{\"type\":\"base64\",\"media_type\":\"image/png\",\"data\":\"" + payload + "\"}}]}}\n";
        Path file = workDir.resolve("claude.jsonl");
        Files.writeString(file, content, StandardCharsets.UTF_8);

        List<LocatedSpan> spans = locator.scan(file, Dialect.CLAUDE);

        assertThat(spans).hasSize(1);
        LocatedSpan located = spans.get(0);
        assertThat(located.position()).isEqualTo(1);
        assertThat(located.span().payloadLength()).isEqualTo(payload.length());
        assertThat(decoder.decode(file, located.span())).containsExactly(image);
        assertThat(locator.containsImage(file, Dialect.CLAUDE, ScanRequest.NEVER_CANCEL)).isTrue();

        assertThatThrownBy(() -> decoder.decode(file, located.span(), 100))
                .isInstanceOf(PayloadTooLargeException.class);
    }

    @Test
    void shouldLocateGeminiInlineData() throws IOException {
        String content = "{\"messages\":[{\"type\":\"user\",\"parts\":[{\"text\":\"x\"}]},"
                + "{\"type\":\"user\",\"parts\":[{\"inlineData\":{\"mimeType\":\"image/webp\",\"data\":\"UklGRg==\"}}]}]}";
        Path file = workDir.resolve("gemini.json");
        Files.writeString(file, content, StandardCharsets.UTF_8);

        assertThat(locator.scan(file, Dialect.GEMINI)).singleElement().satisfies(s -> {
            assertThat(s.position()).isEqualTo(1);
            assertThat(s.span().mediaType()).isEqualTo("image/webp");
            assertThat(new String(decoder.decode(file, s.span()), StandardCharsets.US_ASCII)).isEqualTo("RIFF");
        });
    }
}
