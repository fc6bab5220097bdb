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

import org.cirjson.core.exception.WrappedIOException;
import org.cirjson.core.io.IOContext;
import org.cirjson.core.symbols.CharsToNameCanonicalizer;

/**
 * A non-blocking parser fed with byte arrays through {@link ByteArrayFeeder}.
 */
public class NonBlockingByteArrayCirJsonParser extends NonBlockingUtf8CirJsonParserBase implements ByteArrayFeeder
{
    private static final byte[] NO_BYTES = new byte[0];

    private byte[] _inputBuffer = NO_BYTES;

    public NonBlockingByteArrayCirJsonParser(IOContext ioContext, int streamReadFeatures, int formatReadFeatures, CharsToNameCanonicalizer symbols)
    {
        super(ioContext, streamReadFeatures, formatReadFeatures, symbols);
    }

    @Override
    public ByteArrayFeeder getNonBlockingInputFeeder()
    {
        return this;
    }

    @Override
    public void feedInput(byte[] buffer, int start, int end)
    {
        startChunk(start, end);
        _inputBuffer = buffer;
    }

    @Override
    protected byte getByteFromBuffer(int ptr)
    {
        return _inputBuffer[ptr];
    }

    @Override
    public int releaseBuffered(OutputStream out)
    {
        int count = _inputEnd - _inputPtr;
        if (count > 0)
        {
            try
            {
                out.write(_inputBuffer, _inputPtr, count);
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
        _inputBuffer = NO_BYTES;
        _inputPtr = 0;
        _inputEnd = 0;
    }
}
