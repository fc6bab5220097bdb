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

package org.cirjson.core.async;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;

import org.cirjson.core.exception.WrappedIOException;
import org.cirjson.core.io.IOContext;
import org.cirjson.core.symbols.CharsToNameCanonicalizer;

/**
 * <p>A non-blocking parser fed with {@link ByteBuffer}s through {@link ByteBufferFeeder}.</p>
 * <p>Bytes are read with absolute gets, so the position of a fed buffer is not moved.</p>
 */
public class NonBlockingByteBufferCirJsonParser extends NonBlockingUtf8CirJsonParserBase implements ByteBufferFeeder
{
    private ByteBuffer _inputBuffer = ByteBuffer.allocate(0);

    public NonBlockingByteBufferCirJsonParser(IOContext ioContext, int streamReadFeatures, int formatReadFeatures, CharsToNameCanonicalizer symbols)
    {
        super(ioContext, streamReadFeatures, formatReadFeatures, symbols);
    }

    @Override
    public ByteBufferFeeder getNonBlockingInputFeeder()
    {
        return this;
    }

    @Override
    public void feedInput(ByteBuffer buffer)
    {
        startChunk(buffer.position(), buffer.limit());
        _inputBuffer = buffer;
    }

    @Override
    protected byte getByteFromBuffer(int ptr)
    {
        return _inputBuffer.get(ptr);
    }

    @Override
    public int releaseBuffered(OutputStream out)
    {
        int count = _inputEnd - _inputPtr;
        if (count > 0)
        {
            byte[] bytes = new byte[count];
            for (int i = 0; i < count; ++i)
            {
                bytes[i] = _inputBuffer.get(_inputPtr + i);
            }
            try
            {
                out.write(bytes);
            }
            catch (IOException x)
            {
                throw new WrappedIOException(this, x);
            }
        }
        return count;
    }

    @Override
    protected void closeInput()
    {
        _inputBuffer = ByteBuffer.allocate(0);
        _inputPtr = 0;
        _inputEnd = 0;
    }
}
