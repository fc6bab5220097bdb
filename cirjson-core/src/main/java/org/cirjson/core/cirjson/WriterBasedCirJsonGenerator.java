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
import java.io.Writer;

import org.cirjson.core.StreamWriteFeature;
import org.cirjson.core.exception.WrappedIOException;
import org.cirjson.core.io.IOContext;
import org.cirjson.util.NumberOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A generator that writes chars to a {@link Writer}, through a recycled buffer.
 */
public class WriterBasedCirJsonGenerator extends CirJsonGeneratorImpl
{
    private static final Logger LOG = LoggerFactory.getLogger(WriterBasedCirJsonGenerator.class);

    // Room for the longest number that NumberOutput writes into the buffer.
    private static final int MAX_NUMBER_LENGTH = 24;

    private Writer _writer;
    private char[] _outputBuffer;
    private int _outputTail;
    private final int _outputEnd;

    /**
     * @param ioContext the resources of the generator
     * @param streamWriteFeatures the mask of enabled {@link StreamWriteFeature}s
     * @param formatWriteFeatures the mask of enabled {@link CirJsonWriteFeature}s
     * @param writer the output target
     * @param rootValueSeparator the text written between root level values, or null for none
     */
    public WriterBasedCirJsonGenerator(IOContext ioContext, int streamWriteFeatures, int formatWriteFeatures, Writer writer, String rootValueSeparator)
    {
        super(ioContext, streamWriteFeatures, formatWriteFeatures, rootValueSeparator);
        _writer = writer;
        _outputBuffer = ioContext.allocConcatBuffer();
        _outputEnd = _outputBuffer.length;
        if (LOG.isDebugEnabled())
            LOG.debug("Created {} for {}", this, ioContext.contentDescription());
    }

    public Writer getOutputTarget()
    {
        return _writer;
    }

    @Override
    public int getOutputBuffered()
    {
        return _outputTail;
    }

    @Override
    protected void writeChar(char c)
    {
        if (_outputTail >= _outputEnd)
            flushBuffer();
        _outputBuffer[_outputTail++] = c;
    }

    @Override
    protected void writeRawText(String text)
    {
        int offset = 0;
        int length = text.length();
        while (length > 0)
        {
            if (_outputTail >= _outputEnd)
                flushBuffer();
            int count = Math.min(length, _outputEnd - _outputTail);
            text.getChars(offset, offset + count, _outputBuffer, _outputTail);
            _outputTail += count;
            offset += count;
            length -= count;
        }
    }

    @Override
    protected void writeIntDigits(int value)
    {
        if (_outputTail + MAX_NUMBER_LENGTH > _outputEnd)
            flushBuffer();
        _outputTail = NumberOutput.outputInt(value, _outputBuffer, _outputTail);
    }

    @Override
    protected void writeLongDigits(long value)
    {
        if (_outputTail + MAX_NUMBER_LENGTH > _outputEnd)
            flushBuffer();
        _outputTail = NumberOutput.outputLong(value, _outputBuffer, _outputTail);
    }

    @Override
    protected void flushBuffer()
    {
        int length = _outputTail;
        if (length == 0 || _writer == null)
            return;
        _outputTail = 0;
        try
        {
            _writer.write(_outputBuffer, 0, length);
        }
        catch (IOException x)
        {
            throw new WrappedIOException(this, x);
        }
    }

    @Override
    protected void flushTarget() throws IOException
    {
        if (_writer != null)
            _writer.flush();
    }

    @Override
    protected void closeTarget() throws IOException
    {
        Writer writer = _writer;
        if (writer == null)
            return;
        if (_ioContext.isResourceManaged() || isEnabled(StreamWriteFeature.AUTO_CLOSE_TARGET))
            writer.close();
        else if (isEnabled(StreamWriteFeature.FLUSH_PASSED_TO_STREAM))
            writer.flush();
    }

    @Override
    protected void releaseBuffers()
    {
        _writer = null;
        char[] buffer = _outputBuffer;
        if (buffer != null)
        {
            _outputBuffer = null;
            _ioContext.releaseConcatBuffer(buffer);
        }
        _ioContext.close();
    }
}
