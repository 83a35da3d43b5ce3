package com.example.cleaner.util;

import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;

/**
 * Releases the off-heap region behind a {@link MappedByteBuffer} without waiting for GC.
 * The cleaner hook is looked up once; if the running JVM does not expose it, release
 * becomes a no-op and the region is reclaimed when the buffer is collected.
 */
@Slf4j
public final class MappedBuffers {

    private static final Object UNSAFE;
    private static final Method INVOKE_CLEANER;

    static {
        Object unsafe = null;
        Method invokeCleaner = null;
        try {
            Class<?> unsafeClass = Class.forName("sun.misc.Unsafe");
            Field f = unsafeClass.getDeclaredField("theUnsafe");
            f.setAccessible(true);
            unsafe = f.get(null);
            invokeCleaner = unsafeClass.getMethod("invokeCleaner", ByteBuffer.class);
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.warn("Explicit unmapping unavailable, mapped windows will be left to GC: {}", e.getMessage());
        }
        UNSAFE = unsafe;
        INVOKE_CLEANER = invokeCleaner;
    }

    private MappedBuffers() {}

    public static void release(MappedByteBuffer buffer) {
        if (buffer == null || INVOKE_CLEANER == null) return;
        try {
            INVOKE_CLEANER.invoke(UNSAFE, buffer);
        } catch (ReflectiveOperationException e) {
            log.warn("Unable to unmap buffer of capacity {}: {}", buffer.capacity(), e.getMessage());
        }
    }
}
