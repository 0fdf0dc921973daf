package com.agentsessions.payloads.util.stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ByteStreamReaderTest {

    @TempDir
    Path tmp;

    private Path write(String content) throws IOException {
        Path file = tmp.resolve("data.bin");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static String text(ByteBuffer chunk) {
        byte[] bytes = new byte[chunk.remaining()];
        chunk.duplicate().get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Test
    void shouldReadSequentialChunksWithOffsets() throws Exception {
        Path file = write("Hello, World!");

        try (ByteStreamReader reader = ByteStreamReader.open(file)) {
            ByteBuffer first = reader.nextChunk(5);
            assertThat(reader.chunkOffset()).isZero();
            assertThat(text(first)).isEqualTo("Hello");

            ByteBuffer second = reader.nextChunk(5);
            assertThat(reader.chunkOffset()).isEqualTo(5);
            assertThat(text(second)).isEqualTo(", Wor");

            ByteBuffer third = reader.nextChunk(5);
            assertThat(reader.chunkOffset()).isEqualTo(10);
            assertThat(text(third)).isEqualTo("ld!");
            assertThat(reader.position()).isEqualTo(13);
        }
    }

    @Test
    void shouldReturnEmptyChunkAtEof() throws Exception {
        Path file = write("AB");

        try (ByteStreamReader reader = ByteStreamReader.open(file)) {
            assertThat(reader.nextChunk(64).remaining()).isEqualTo(2);
            assertThat(reader.nextChunk(64).hasRemaining()).isFalse();
            assertThat(reader.nextChunk(64).hasRemaining()).isFalse();
        }
    }

    @Test
    void sliceShouldNotMoveSequentialCursor() throws Exception {
        Path file = write("0123456789");

        try (ByteStreamReader reader = ByteStreamReader.open(file)) {
            reader.nextChunk(4);
            byte[] slice = reader.readSlice(6, 3);
            assertThat(new String(slice, StandardCharsets.US_ASCII)).isEqualTo("678");

            assertThat(text(reader.nextChunk(3))).isEqualTo("456");
        }
    }

    @Test
    void sliceShouldBeShortWhenFileEndsFirst() throws Exception {
        Path file = write("abcdef");

        try (ByteStreamReader reader = ByteStreamReader.open(file)) {
            assertThat(reader.readSlice(4, 10)).containsExactly('e', 'f');
            assertThat(reader.readSlice(20, 4)).isEmpty();
        }
    }

    @Test
    void shouldRejectInvalidArguments() throws Exception {
        Path file = write("abc");

        try (ByteStreamReader reader = ByteStreamReader.open(file)) {
            assertThatIllegalArgumentException().isThrownBy(() -> reader.nextChunk(0));
            assertThatIllegalArgumentException().isThrownBy(() -> reader.readSlice(-1, 2));
            assertThatIllegalArgumentException().isThrownBy(() -> reader.readSlice(0, -2));
        }
    }

    @Test
    void shouldFailToOpenMissingFile() {
        assertThatThrownBy(() -> ByteStreamReader.open(tmp.resolve("missing.jsonl")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void shouldCloseOnce() throws Exception {
        Path file = write("abc");
        ByteStreamReader reader = ByteStreamReader.open(file);
        assertThat(reader.isOpen()).isTrue();

        reader.close();
        reader.close();
        assertThat(reader.isOpen()).isFalse();
    }

    @Test
    void shouldReadLargeFileAcrossManyChunks() throws Exception {
        byte[] block = "A".repeat(1024).getBytes(StandardCharsets.US_ASCII);
        Path file = tmp.resolve("large.bin");
        try (var out = Files.newOutputStream(file)) {
            for (int i = 0; i < 300; i++) {
                out.write(block);
            }
        }

        long total = 0;
        int chunks = 0;
        try (ByteStreamReader reader = ByteStreamReader.open(file)) {
            assertThat(reader.size()).isEqualTo(300 * 1024L);
            while (true) {
                ByteBuffer chunk = reader.nextChunk(64 * 1024);
                if (!chunk.hasRemaining()) break;
                assertThat(reader.chunkOffset()).isEqualTo(total);
                total += chunk.remaining();
                chunks++;
            }
        }
        assertThat(total).isEqualTo(300 * 1024L);
        assertThat(chunks).isEqualTo(5);
    }
}
