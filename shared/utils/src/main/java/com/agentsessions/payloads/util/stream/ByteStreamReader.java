package com.agentsessions.payloads.util.stream;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Sequential chunked reader over a file or any {@link SeekableByteChannel}.
 *
 * <p>{@link #nextChunk(int)} walks the channel front to back and keeps track of the
 * absolute offset of every chunk it hands out. {@link #readSlice(long, int)} is a
 * separate positioned read that leaves the sequential cursor where it was.
 *
 * <p>Chunks are views of one reusable heap buffer: a chunk is valid until the next
 * call to {@code nextChunk}. Not thread-safe; one reader per scan.
 */
public class ByteStreamReader implements AutoCloseable {

    /** Largest chunk a single {@link #nextChunk(int)} call will return. */
    public static final int MAX_CHUNK_SIZE = 1024 * 1024;

    private final SeekableByteChannel channel;
    private ByteBuffer chunk;
    private long cursor;
    private long chunkOffset;
    private boolean open = true;

    /**
     * Wraps an open channel. Sequential reads start at the channel's current position.
     */
    public ByteStreamReader(SeekableByteChannel channel) throws IOException {
        this.channel = channel;
        this.cursor = channel.position();
        this.chunkOffset = cursor;
    }

    /**
     * Opens a file for reading.
     *
     * @throws IOException if the file does not exist or cannot be opened
     */
    public static ByteStreamReader open(Path path) throws IOException {
        return new ByteStreamReader(FileChannel.open(path, StandardOpenOption.READ));
    }

    /**
     * Reads the next run of sequential bytes.
     *
     * @param maxBytes upper bound for this chunk (clamped to {@link #MAX_CHUNK_SIZE})
     * @return a heap buffer positioned at the first byte; no remaining bytes means end of file
     */
    public ByteBuffer nextChunk(int maxBytes) throws IOException {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        int capacity = Math.min(maxBytes, MAX_CHUNK_SIZE);
        if (chunk == null || chunk.capacity() < capacity) {
            chunk = ByteBuffer.allocate(capacity);
        }
        chunk.clear().limit(capacity);

        channel.position(cursor);
        chunkOffset = cursor;
        while (chunk.hasRemaining()) {
            int n = channel.read(chunk);
            if (n < 0) break;
            if (n == 0 && chunk.position() > 0) break;
        }
        chunk.flip();
        cursor += chunk.remaining();
        return chunk;
    }

    /**
     * Absolute file offset of the first byte of the most recent chunk.
     */
    public long chunkOffset() {
        return chunkOffset;
    }

    /**
     * Absolute file offset the next chunk will start at.
     */
    public long position() {
        return cursor;
    }

    /**
     * Current size of the underlying channel.
     */
    public long size() throws IOException {
        return channel.size();
    }

    /**
     * Positioned read for random access. The sequential cursor is unaffected.
     *
     * @return up to {@code length} bytes; shorter when the file ends first
     */
    public byte[] readSlice(long offset, int length) throws IOException {
        if (offset < 0) {
            throw new IllegalArgumentException("Negative offset: " + offset);
        }
        if (length < 0) {
            throw new IllegalArgumentException("Negative length: " + length);
        }
        ByteBuffer dst = ByteBuffer.allocate(length);
        if (channel instanceof FileChannel fc) {
            long pos = offset;
            while (dst.hasRemaining()) {
                int n = fc.read(dst, pos);
                if (n < 0) break;
                pos += n;
            }
        } else {
            channel.position(offset);
            while (dst.hasRemaining()) {
                if (channel.read(dst) < 0) break;
            }
            channel.position(cursor);
        }

        if (dst.position() == length) {
            return dst.array();
        }
        byte[] shorter = new byte[dst.position()];
        dst.flip();
        dst.get(shorter);
        return shorter;
    }

    public boolean isOpen() {
        return open && channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        if (open) {
            open = false;
            channel.close();
        }
    }
}
