package com.questrail.hamgateway.buffer;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.PooledByteBufAllocator;

import java.util.Objects;

/**
 * BufferPool
 * =============================================================================
 * Scoped rental of fixed-size byte buffers backed by a Netty
 * {@link ByteBufAllocator}.
 *
 * <p>The same allocator is handed to the listeners' channels, so receive
 * buffers, per-connection read buffers and right-sized message copies all
 * come from one pool.</p>
 *
 * <p>This class is thread-safe.</p>
 */
public final class BufferPool
{
    private final ByteBufAllocator allocator;

    /**
     * Creates a pool backed by {@link PooledByteBufAllocator#DEFAULT}.
     */
    public BufferPool()
    {
        this(PooledByteBufAllocator.DEFAULT);
    }

    public BufferPool(ByteBufAllocator allocator)
    {
        this.allocator = Objects.requireNonNull(allocator, "allocator");
    }

    public ByteBufAllocator allocator()
    {
        return allocator;
    }

    /**
     * Rents an empty buffer that can hold at most {@code capacity} bytes.
     */
    public OwnedBuffer rent(int capacity)
    {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0");
        }
        return new OwnedBuffer(allocator.buffer(capacity, capacity));
    }

    /**
     * Rents a right-sized buffer holding a copy of the readable bytes of
     * {@code source}. The source's indexes are not modified.
     */
    public OwnedBuffer copyOf(ByteBuf source)
    {
        Objects.requireNonNull(source, "source");

        int length = source.readableBytes();
        OwnedBuffer copy = rent(length);
        try {
            copy.content().writeBytes(source, source.readerIndex(), length);
            return copy;
        } catch (RuntimeException e) {
            copy.close();
            throw e;
        }
    }

    /**
     * Rents a right-sized buffer holding a copy of the written bytes of
     * {@code source}. The source remains owned by the caller.
     */
    public OwnedBuffer copyOf(OwnedBuffer source)
    {
        Objects.requireNonNull(source, "source");
        return copyOf(source.content());
    }

    /**
     * Rents a right-sized buffer holding a copy of {@code bytes}.
     */
    public OwnedBuffer copyOf(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");

        OwnedBuffer copy = rent(bytes.length);
        copy.append(bytes);
        return copy;
    }
}
