//
// ========================================================================
// Copyright (c) 1995-2021 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.cirjson.util;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * <p>A bundle of reusable byte and char arrays, one slot per purpose.</p>
 * <p>A recycler is owned by one parser or generator at a time, but the slots are atomic so
 * that a recycler shared by mistake never hands out the same array twice.</p>
 * <p>When a buffer is released, it replaces the retained one only if it is larger.</p>
 */
public class BufferRecycler implements RecyclerPool.WithPool<BufferRecycler>
{
    /**
     * Buffer used for reading byte-based input.
     */
    public static final int BYTE_READ_IO_BUFFER = 0;
    /**
     * Buffer used for temporarily storing encoded content.
     */
    public static final int BYTE_WRITE_ENCODING_BUFFER = 1;
    /**
     * Buffer used for temporarily concatenating output.
     */
    public static final int BYTE_WRITE_CONCAT_BUFFER = 2;
    /**
     * Buffer used for decoding Base64 content.
     */
    public static final int BYTE_BASE64_CODEC_BUFFER = 3;

    /**
     * Buffer used for tokenizing char-based input.
     */
    public static final int CHAR_TOKEN_BUFFER = 0;
    /**
     * Buffer used for char-based output.
     */
    public static final int CHAR_CONCAT_BUFFER = 1;
    /**
     * Buffer used for accumulating parsed text.
     */
    public static final int CHAR_TEXT_BUFFER = 2;
    /**
     * Buffer used for copying property names.
     */
    public static final int CHAR_NAME_COPY_BUFFER = 3;

    private static final int[] BYTE_BUFFER_LENGTHS = {8000, 8000, 2000, 2000};
    private static final int[] CHAR_BUFFER_LENGTHS = {4000, 4000, 200, 200};

    protected final AtomicReferenceArray<byte[]> _byteBuffers;
    protected final AtomicReferenceArray<char[]> _charBuffers;
    private volatile RecyclerPool<BufferRecycler> _pool;

    public BufferRecycler()
    {
        this(BYTE_BUFFER_LENGTHS.length, CHAR_BUFFER_LENGTHS.length);
    }

    /**
     * @param byteBufferCount the number of byte buffer slots
     * @param charBufferCount the number of char buffer slots
     */
    protected BufferRecycler(int byteBufferCount, int charBufferCount)
    {
        _byteBuffers = new AtomicReferenceArray<>(byteBufferCount);
        _charBuffers = new AtomicReferenceArray<>(charBufferCount);
    }

    public final byte[] allocByteBuffer(int index)
    {
        return allocByteBuffer(index, 0);
    }

    /**
     * @param index the purpose slot
     * @param minSize the minimum length of the returned buffer
     * @return the retained buffer for the slot if large enough, otherwise a new buffer
     */
    public byte[] allocByteBuffer(int index, int minSize)
    {
        int defaultSize = byteBufferLength(index);
        if (minSize < defaultSize)
            minSize = defaultSize;
        byte[] buffer = _byteBuffers.getAndSet(index, null);
        if (buffer == null || buffer.length < minSize)
            buffer = new byte[minSize];
        return buffer;
    }

    public void releaseByteBuffer(int index, byte[] buffer)
    {
        byte[] old = _byteBuffers.get(index);
        if (old == null || buffer.length > old.length)
            _byteBuffers.set(index, buffer);
    }

    public final char[] allocCharBuffer(int index)
    {
        return allocCharBuffer(index, 0);
    }

    /**
     * @param index the purpose slot
     * @param minSize the minimum length of the returned buffer
     * @return the retained buffer for the slot if large enough, otherwise a new buffer
     */
    public char[] allocCharBuffer(int index, int minSize)
    {
        int defaultSize = charBufferLength(index);
        if (minSize < defaultSize)
            minSize = defaultSize;
        char[] buffer = _charBuffers.getAndSet(index, null);
        if (buffer == null || buffer.length < minSize)
            buffer = new char[minSize];
        return buffer;
    }

    public void releaseCharBuffer(int index, char[] buffer)
    {
        char[] old = _charBuffers.get(index);
        if (old == null || buffer.length > old.length)
            _charBuffers.set(index, buffer);
    }

    protected int byteBufferLength(int index)
    {
        return BYTE_BUFFER_LENGTHS[index];
    }

    protected int charBufferLength(int index)
    {
        return CHAR_BUFFER_LENGTHS[index];
    }

    @Override
    public BufferRecycler withPool(RecyclerPool<BufferRecycler> pool)
    {
        if (_pool != null)
            throw new IllegalStateException("BufferRecycler already linked to pool " + _pool);
        _pool = Objects.requireNonNull(pool);
        return this;
    }

    /**
     * @return the pool this recycler is linked to, or null
     */
    public RecyclerPool<BufferRecycler> getPool()
    {
        return _pool;
    }

    @Override
    public void releaseToPool()
    {
        RecyclerPool<BufferRecycler> pool = _pool;
        if (pool != null)
        {
            // Unlink first, as the pool may hand this recycler out again at once.
            _pool = null;
            pool.releasePooled(this);
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x", getClass().getSimpleName(), hashCode());
    }
}
