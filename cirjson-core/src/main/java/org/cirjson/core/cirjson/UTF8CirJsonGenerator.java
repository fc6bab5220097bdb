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
import java.io.OutputStream;

import org.cirjson.core.StreamWriteFeature;
import org.cirjson.core.exception.StreamWriteException;
import org.cirjson.core.exception.WrappedIOException;
import org.cirjson.core.io.IOContext;
import org.cirjson.util.NumberOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A generator that encodes UTF-8 into an {@link OutputStream}, through a recycled buffer.</p>
 * <p>Surrogate pairs are encoded as one four byte sequence; a surrogate that is not part
 * of a pair fails the write.</p>
 */
public class UTF8CirJsonGenerator extends CirJsonGeneratorImpl
{
    private static final Logger LOG = LoggerFactory.getLogger(UTF8CirJsonGenerator.class);

    private static final int MAX_NUMBER_LENGTH = 24;

    private OutputStream _out;
    private byte[] _outputBuffer;
    private int _outputTail;
    private final int _outputEnd;

    // The first half of a surrogate pair, waiting for the second.
    private char _pendingSurrogate;

    /**
     * @param ioContext the resources of the generator
     * @param streamWriteFeatures the mask of enabled {@link StreamWriteFeature}s
     * @param formatWriteFeatures the mask of enabled {@link CirJsonWriteFeature}s
     * @param out the output target
     * @param rootValueSeparator the text written between root level values, or null for none
     */
    public UTF8CirJsonGenerator(IOContext ioContext, int streamWriteFeatures, int formatWriteFeatures, OutputStream out, String rootValueSeparator)
    {
        super(ioContext, streamWriteFeatures, formatWriteFeatures, rootValueSeparator);
        _out = out;
        _outputBuffer = ioContext.allocWriteEncodingBuffer();
        _outputEnd = _outputBuffer.length;
        if (LOG.isDebugEnabled())
            LOG.debug("Created {} for {}", this, ioContext.contentDescription());
    }

    public OutputStream getOutputTarget()
    {
        return _out;
    }

    @Override
    public int getOutputBuffered()
    {
        return _outputTail;
    }

    private void ensureRoom(int count)
    {
        if (_outputTail + count > _outputEnd)
            flushBuffer();
    }

    @Override
    protected void writeChar(char c)
    {
        if (_pendingSurrogate != 0)
        {
            char first = _pendingSurrogate;
            _pendingSurrogate = 0;
            if (!Character.isLowSurrogate(c))
                throw new StreamWriteException(this, String.format("Invalid surrogate pair: first char 0x%04X, second 0x%04X", (int)first, (int)c));
            writeCodePoint(Character.toCodePoint(first, c));
            return;
        }
        if (c < 0x80)
        {
            ensureRoom(1);
            _outputBuffer[_outputTail++] = (byte)c;
        }
        else if (c < 0x800)
        {
            ensureRoom(2);
            _outputBuffer[_outputTail++] = (byte)(0xC0 | (c >> 6));
            _outputBuffer[_outputTail++] = (byte)(0x80 | (c & 0x3F));
        }
        else if (Character.isHighSurrogate(c))
        {
            _pendingSurrogate = c;
        }
        else if (Character.isLowSurrogate(c))
        {
            throw new StreamWriteException(this, String.format("Unmatched second part of surrogate pair (0x%04X)", (int)c));
        }
        else
        {
            ensureRoom(3);
            _outputBuffer[_outputTail++] = (byte)(0xE0 | (c >> 12));
            _outputBuffer[_outputTail++] = (byte)(0x80 | ((c >> 6) & 0x3F));
            _outputBuffer[_outputTail++] = (byte)(0x80 | (c & 0x3F));
        }
    }

    private void writeCodePoint(int cp)
    {
        ensureRoom(4);
        _outputBuffer[_outputTail++] = (byte)(0xF0 | (cp >> 18));
        _outputBuffer[_outputTail++] = (byte)(0x80 | ((cp >> 12) & 0x3F));
        _outputBuffer[_outputTail++] = (byte)(0x80 | ((cp >> 6) & 0x3F));
        _outputBuffer[_outputTail++] = (byte)(0x80 | (cp & 0x3F));
    }

    @Override
    protected void writeRawText(String text)
    {
        for (int i = 0, length = text.length(); i < length; ++i)
        {
            writeChar(text.charAt(i));
        }
    }

    @Override
    protected void writeIntDigits(int value)
    {
        ensureRoom(MAX_NUMBER_LENGTH);
        _outputTail = NumberOutput.outputInt(value, _outputBuffer, _outputTail);
    }

    @Override
    protected void writeLongDigits(long value)
    {
        ensureRoom(MAX_NUMBER_LENGTH);
        _outputTail = NumberOutput.outputLong(value, _outputBuffer, _outputTail);
    }

    @Override
    protected void flushBuffer()
    {
        int length = _outputTail;
        if (length == 0 || _out == null)
            return;
        _outputTail = 0;
        try
        {
            _out.write(_outputBuffer, 0, length);
        }
        catch (IOException x)
        {
            throw new WrappedIOException(this, x);
        }
    }

    @Override
    protected void flushTarget() throws IOException
    {
        if (_out != null)
            _out.flush();
    }

    @Override
    protected void closeTarget() throws IOException
    {
        OutputStream out = _out;
        if (out == null)
            return;
        if (_ioContext.isResourceManaged() || isEnabled(StreamWriteFeature.AUTO_CLOSE_TARGET))
            out.close();
        else if (isEnabled(StreamWriteFeature.FLUSH_PASSED_TO_STREAM))
            out.flush();
    }

    @Override
    protected void releaseBuffers()
    {
        _out = null;
        byte[] buffer = _outputBuffer;
        if (buffer != null)
        {
            _outputBuffer = null;
            _ioContext.releaseWriteEncodingBuffer(buffer);
        }
        _ioContext.close();
    }
}
