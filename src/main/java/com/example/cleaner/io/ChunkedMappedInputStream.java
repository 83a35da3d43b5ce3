package com.example.cleaner.io;

import com.example.cleaner.util.MappedBuffers;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Reads a file through a sliding read-only memory-mapped window of fixed size.
 * Only one window is mapped at a time; the previous one is released before the next is mapped.
 */
@Slf4j
public class ChunkedMappedInputStream extends InputStream {

    private final FileChannel channel;
    private final long fileSize;
    private final long windowSize;

    // absolute position where the next window starts
    private long nextWindowStart = 0L;
    private MappedByteBuffer window;

    public ChunkedMappedInputStream(Path file, long windowSize) throws IOException {
        Objects.requireNonNull(file, "file");
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive: " + windowSize);
        }
        this.channel = FileChannel.open(file, StandardOpenOption.READ);
        this.fileSize = channel.size();
        this.windowSize = windowSize;
        mapNextWindow();
    }

    private void mapNextWindow() throws IOException {
        MappedBuffers.release(window);
        if (nextWindowStart >= fileSize) {
            window = null;
            return;
        }
        long size = Math.min(windowSize, fileSize - nextWindowStart);
        window = channel.map(FileChannel.MapMode.READ_ONLY, nextWindowStart, size);
        log.debug("Mapped input window: start={}, size={}", nextWindowStart, size);
        nextWindowStart += size;
    }

    /** Bytes handed out to callers so far. */
    public long bytesRead() {
        if (window == null) return fileSize;
        return nextWindowStart - window.remaining();
    }

    public long size() {
        return fileSize;
    }

    @Override
    public int read() throws IOException {
        while (window != null) {
            if (window.hasRemaining()) {
                return window.get() & 0xFF;
            }
            mapNextWindow();
        }
        return -1;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) return 0;
        int total = 0;
        while (len > 0 && window != null) {
            if (!window.hasRemaining()) {
                mapNextWindow();
                continue;
            }
            int n = Math.min(len, window.remaining());
            window.get(b, off, n);
            off += n;
            len -= n;
            total += n;
        }
        return total == 0 ? -1 : total;
    }

    @Override
    public int available() {
        return window == null ? 0 : window.remaining();
    }

    @Override
    public void close() throws IOException {
        try {
            MappedBuffers.release(window);
            window = null;
        } finally {
            channel.close();
        }
    }
}
