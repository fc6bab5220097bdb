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

package org.cirjson.core.cirjson;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import org.cirjson.core.CirJsonToken;
import org.cirjson.core.async.NonBlockingUtf8CirJsonParserBase;
import org.cirjson.core.exception.WrappedIOException;
import org.cirjson.core.io.IOContext;
import org.cirjson.core.symbols.CharsToNameCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A blocking parser over UTF-8 bytes, read from an {@link InputStream} or taken
 * from a {@code byte[]}.</p>
 * <p>Tokens are decoded by the same state machine as the non-blocking parsers: whenever it
 * needs more input, this parser blocks reading the stream, and signals the end of input
 * when the stream is exhausted. Locations report byte offsets.</p>
 */
public class UTF8StreamCirJsonParser extends NonBlockingUtf8CirJsonParserBase
{
    private static final Logger LOG = LoggerFactory.getLogger(UTF8StreamCirJsonParser.class);

    private InputStream _inputStream;
    private byte[] _inputBuffer;

    /**
     * Whether the input buffer was borrowed from the recycler and must be returned.
     */
    private final boolean _bufferRecyclable;

    public UTF8StreamCirJsonParser(IOContext ioContext, int streamReadFeatures, int formatReadFeatures, InputStream in, CharsToNameCanonicalizer symbols)
    {
        super(ioContext, streamReadFeatures, formatReadFeatures, symbols);
        _inputStream = in;
        _inputBuffer = ioContext.allocReadIOBuffer();
        _bufferRecyclable = true;
        if (LOG.isDebugEnabled())
            LOG.debug("Created {} for {}", this, ioContext.contentDescription());
    }

    public UTF8StreamCirJsonParser(IOContext ioContext, int streamReadFeatures, int formatReadFeatures, CharsToNameCanonicalizer symbols,
                                   byte[] input, int start, int end)
    {
        super(ioContext, streamReadFeatures, formatReadFeatures, symbols);
        _inputStream = null;
        _inputBuffer = input;
        _bufferRecyclable = false;
        startChunk(start, end);
        if (LOG.isDebugEnabled())
            LOG.debug("Created {} for {}", this, ioContext.contentDescription());
    }

    @Override
    public CirJsonToken nextToken()
    {
        while (true)
        {
            CirJsonToken t = super.nextToken();
            if (t != CirJsonToken.NOT_AVAILABLE)
                return t;
            if (!loadMore())
                endOfInput();
        }
    }

    @Override
    protected byte getByteFromBuffer(int ptr)
    {
        return _inputBuffer[ptr];
    }

    /**
     * Reads more bytes into the buffer.
     *
     * @return whether bytes are available
     */
    protected boolean loadMore()
    {
        if (_inputStream == null)
            return false;
        int count;
        try
        {
            count = _inputStream.read(_inputBuffer, 0, _inputBuffer.length);
        }
        catch (IOException x)
        {
            throw new WrappedIOException(this, x);
        }
        if (count > 0)
        {
            startChunk(0, count);
            return true;
        }
        if (count == 0)
            throw new WrappedIOException(this, new IOException("InputStream.read() returned 0 characters when trying to read " + _inputBuffer.length + " bytes"));
        return false;
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
    protected void closeInput() throws IOException
    {
        if (_inputStream != null)
        {
            if (shouldCloseInput())
                _inputStream.close();
            _inputStream = null;
        }
    }

    @Override
    protected void releaseBuffers()
    {
        super.releaseBuffers();
        if (_bufferRecyclable)
        {
            byte[] buffer = _inputBuffer;
            if (buffer != null)
            {
                _inputBuffer = null;
                _ioContext.releaseReadIOBuffer(buffer);
            }
        }
    }
}
