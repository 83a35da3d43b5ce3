package com.example.cleaner.io;

import com.example.cleaner.util.MappedBuffers;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * OutputStream writing through read-write memory-mapped windows. The file is grown one
 * window at a time and cut back to the exact number of bytes written on close, so an
 * existing file at the same path is fully replaced.
 */
@Slf4j
public class ChunkedMappedOutputStream extends OutputStream {

    private final Path file;
    private final FileChannel channel;
    private final long windowSize;

    // absolute file position where the current window starts
    private long windowStart = 0L;
    private MappedByteBuffer window;
    private boolean closed;

    public ChunkedMappedOutputStream(Path file, long windowSize) throws IOException {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive: " + windowSize);
        }
        this.file = file;
        this.windowSize = windowSize;
        this.channel = FileChannel.open(file,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING);
    }

    private void mapNextWindow(long minSize) throws IOException {
        if (window != null) {
            windowStart += window.position();
            MappedBuffers.release(window);
            window = null;
        }
        long size = Math.max(minSize, windowSize);
        long required = windowStart + size;
        if (channel.size() < required) {
            // grow the file; FileChannel.truncate never extends
            channel.write(ByteBuffer.wrap(new byte[1]), required - 1);
        }
        window = channel.map(FileChannel.MapMode.READ_WRITE, windowStart, size);
        log.debug("Mapped output window for {}: start={}, size={}", file, windowStart, size);
    }

    /** Bytes written so far. */
    public long bytesWritten() {
        return window == null ? windowStart : windowStart + window.position();
    }

    @Override
    public void write(int b) throws IOException {
        ensureOpen();
        if (window == null || !window.hasRemaining()) {
            mapNextWindow(1);
        }
        window.put((byte) b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        ensureOpen();
        while (len > 0) {
            if (window == null || !window.hasRemaining()) {
                mapNextWindow(len);
            }
            int n = Math.min(window.remaining(), len);
            window.put(b, off, n);
            off += n;
            len -= n;
        }
    }

    private void ensureOpen() throws IOException {
        if (closed) throw new IOException("Stream closed: " + file);
    }

    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;
        try {
            long written = bytesWritten();
            if (window != null) {
                window.force();
                MappedBuffers.release(window);
                window = null;
                windowStart = written;
            }
            if (channel.size() > written) {
                channel.truncate(written);
            }
        } finally {
            channel.close();
        }
    }
}
