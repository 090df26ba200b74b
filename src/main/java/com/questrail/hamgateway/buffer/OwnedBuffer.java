package com.questrail.hamgateway.buffer;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.buffer.ByteBufUtil;

import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * OwnedBuffer
 * =============================================================================
 * A fixed-capacity byte region rented from a {@link BufferPool} with
 * single-owner semantics.
 *
 * <h2>Ownership</h2>
 * Exactly one party holds an {@code OwnedBuffer} at a time and that party
 * releases it, normally through try-with-resources. {@link #close()} returns
 * the memory to the pool exactly once; repeated calls are no-ops. Every other
 * method throws {@link IllegalStateException} after release, so a buffer can
 * never be read once another renter may own the same memory.
 *
 * <h2>Visibility</h2>
 * Only bytes {@code [0, length())} written by the current owner are ever
 * exposed. A freshly rented buffer has length zero regardless of what a
 * previous renter left in the pooled memory.
 *
 * <p>Instances are not thread-safe; hand-off between threads must happen
 * through a safe publication point such as an executor submission.</p>
 */
public final class OwnedBuffer implements AutoCloseable
{
    private final ByteBuf content;
    private final AtomicBoolean released = new AtomicBoolean(false);

    OwnedBuffer(ByteBuf content)
    {
        this.content = Objects.requireNonNull(content, "content");
    }

    /**
     * Number of bytes written so far.
     */
    public int length()
    {
        return checked().readableBytes();
    }

    /**
     * Maximum number of bytes this buffer can hold.
     */
    public int capacity()
    {
        return checked().maxCapacity();
    }

    /**
     * Number of bytes that can still be appended.
     */
    public int remaining()
    {
        return checked().maxWritableBytes();
    }

    public boolean isFull()
    {
        return remaining() == 0;
    }

    public boolean isReleased()
    {
        return released.get();
    }

    /**
     * Appends as many readable bytes of {@code source} as fit, advancing the
     * source's reader index by the amount copied.
     *
     * @return number of bytes copied; less than {@code source.readableBytes()}
     *         when this buffer became full
     */
    public int append(ByteBuf source)
    {
        Objects.requireNonNull(source, "source");
        ByteBuf target = checked();

        int count = Math.min(source.readableBytes(), target.maxWritableBytes());
        target.writeBytes(source, count);
        return count;
    }

    /**
     * Appends as many bytes of {@code source} as fit.
     *
     * @return number of bytes copied
     */
    public int append(byte[] source)
    {
        Objects.requireNonNull(source, "source");
        ByteBuf target = checked();

        int count = Math.min(source.length, target.maxWritableBytes());
        target.writeBytes(source, 0, count);
        return count;
    }

    /**
     * Copies the written bytes into a new array.
     */
    public byte[] toByteArray()
    {
        return ByteBufUtil.getBytes(checked());
    }

    /**
     * Opens a stream over the written bytes. The stream does not own the
     * buffer; it must not be used after this buffer is closed.
     */
    public InputStream openStream()
    {
        return new ByteBufInputStream(checked().duplicate());
    }

    public String toString(Charset charset)
    {
        return checked().toString(charset);
    }

    /**
     * Returns the underlying memory to the pool. Idempotent.
     */
    @Override
    public void close()
    {
        if (released.compareAndSet(false, true)) {
            content.release();
        }
    }

    ByteBuf content()
    {
        return checked();
    }

    private ByteBuf checked()
    {
        if (released.get()) {
            throw new IllegalStateException("Buffer has already been returned to the pool");
        }
        return content;
    }

    @Override
    public String toString()
    {
        if (released.get()) {
            return "OwnedBuffer[released]";
        }
        return "OwnedBuffer[length=" + content.readableBytes() + ", capacity=" + content.maxCapacity() + "]";
    }
}
