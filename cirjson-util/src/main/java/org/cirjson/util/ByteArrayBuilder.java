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

import java.util.Arrays;

/**
 * <p>A growable byte accumulator, used for decoding Base64 content.</p>
 * <p>When created with a {@link BufferRecycler}, the initial buffer is borrowed from its
 * {@link BufferRecycler#BYTE_BASE64_CODEC_BUFFER} slot and returned by {@link #release()}.</p>
 */
public class ByteArrayBuilder implements AutoCloseable
{
    private static final int INITIAL_BLOCK_SIZE = 500;
    private static final int MAX_BLOCK_SIZE = 128 * 1024;

    private final BufferRecycler _recycler;
    private byte[] _buffer;
    private int _length;

    public ByteArrayBuilder()
    {
        this(null);
    }

    public ByteArrayBuilder(BufferRecycler recycler)
    {
        _recycler = recycler;
        _buffer = recycler == null ? new byte[INITIAL_BLOCK_SIZE] : recycler.allocByteBuffer(BufferRecycler.BYTE_BASE64_CODEC_BUFFER);
    }

    public void reset()
    {
        _length = 0;
    }

    public int size()
    {
        return _length;
    }

    public void append(int b)
    {
        ensure(1);
        _buffer[_length++] = (byte)b;
    }

    public void appendTwoBytes(int b16)
    {
        ensure(2);
        _buffer[_length++] = (byte)(b16 >> 8);
        _buffer[_length++] = (byte)b16;
    }

    public void appendThreeBytes(int b24)
    {
        ensure(3);
        _buffer[_length++] = (byte)(b24 >> 16);
        _buffer[_length++] = (byte)(b24 >> 8);
        _buffer[_length++] = (byte)b24;
    }

    public void write(byte[] bytes, int offset, int length)
    {
        ensure(length);
        System.arraycopy(bytes, offset, _buffer, _length, length);
        _length += length;
    }

    private void ensure(int needed)
    {
        int required = _length + needed;
        if (required > _buffer.length)
        {
            int grow = Math.min(MAX_BLOCK_SIZE, Math.max(INITIAL_BLOCK_SIZE, _buffer.length >> 1));
            _buffer = Arrays.copyOf(_buffer, Math.max(required, _buffer.length + grow));
        }
    }

    public byte[] toByteArray()
    {
        return Arrays.copyOf(_buffer, _length);
    }

    /**
     * Returns the buffer to the recycler, if any. The builder must not be used afterwards.
     */
    public void release()
    {
        _length = 0;
        if (_recycler != null && _buffer != null)
        {
            _recycler.releaseByteBuffer(BufferRecycler.BYTE_BASE64_CODEC_BUFFER, _buffer);
            _buffer = null;
        }
    }

    @Override
    public void close()
    {
        release();
    }
}
