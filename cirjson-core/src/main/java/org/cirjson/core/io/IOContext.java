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

package org.cirjson.core.io;

import org.cirjson.core.StreamReadConstraints;
import org.cirjson.core.StreamWriteConstraints;
import org.cirjson.util.BufferRecycler;
import org.cirjson.util.RecyclerPool;
import org.cirjson.util.TextBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>The resources of one parser or generator: the {@link BufferRecycler} acquired from
 * the configured pool, the buffers borrowed from it, the constraints, and a description
 * of the content.</p>
 * <p>Each purpose buffer can be borrowed only once at a time, and must be released with
 * the same (or a larger) array. {@link #close()} returns the recycler to its pool exactly once.</p>
 */
public class IOContext implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(IOContext.class);

    private final StreamReadConstraints _streamReadConstraints;
    private final StreamWriteConstraints _streamWriteConstraints;
    private final BufferRecycler _bufferRecycler;
    private final boolean _releaseRecycler;
    private final Object _content;
    private final boolean _managedResource;

    private byte[] _readIOBuffer;
    private byte[] _writeEncodingBuffer;
    private char[] _tokenCBuffer;
    private char[] _concatCBuffer;

    private boolean _closed;

    /**
     * @param readConstraints the read limits
     * @param writeConstraints the write limits
     * @param pool the pool to acquire the recycler from
     * @param content the input or output, for locations and diagnostics; may be null
     * @param managedResource whether the content was created by the factory rather than passed by the caller
     */
    public IOContext(StreamReadConstraints readConstraints, StreamWriteConstraints writeConstraints, RecyclerPool<BufferRecycler> pool,
                     Object content, boolean managedResource)
    {
        _streamReadConstraints = readConstraints;
        _streamWriteConstraints = writeConstraints;
        _bufferRecycler = pool.acquireAndLinkPooled();
        // Thread-local recyclers are not linked and stay with their thread.
        _releaseRecycler = _bufferRecycler.getPool() != null;
        _content = content;
        _managedResource = managedResource;
    }

    public StreamReadConstraints streamReadConstraints()
    {
        return _streamReadConstraints;
    }

    public StreamWriteConstraints streamWriteConstraints()
    {
        return _streamWriteConstraints;
    }

    public BufferRecycler bufferRecycler()
    {
        return _bufferRecycler;
    }

    public Object content()
    {
        return _content;
    }

    public boolean isResourceManaged()
    {
        return _managedResource;
    }

    /**
     * @return a short description of the content, for locations
     */
    public String contentDescription()
    {
        if (_content == null)
            return "UNKNOWN";
        if (_content instanceof byte[])
            return "(byte[])[" + ((byte[])_content).length + " bytes]";
        if (_content instanceof char[])
            return "(char[])[" + ((char[])_content).length + " chars]";
        if (_content instanceof CharSequence)
        {
            CharSequence text = (CharSequence)_content;
            if (text.length() <= 50)
                return "(String)\"" + text + "\"";
            return "(String)\"" + text.subSequence(0, 50) + "\"[truncated " + (text.length() - 50) + " chars]";
        }
        return "(" + _content.getClass().getName() + ")";
    }

    public TextBuffer constructTextBuffer()
    {
        return new ReadConstrainedTextBuffer(_streamReadConstraints, _bufferRecycler);
    }

    public byte[] allocReadIOBuffer()
    {
        verifyAlloc(_readIOBuffer);
        return _readIOBuffer = _bufferRecycler.allocByteBuffer(BufferRecycler.BYTE_READ_IO_BUFFER);
    }

    public byte[] allocWriteEncodingBuffer()
    {
        verifyAlloc(_writeEncodingBuffer);
        return _writeEncodingBuffer = _bufferRecycler.allocByteBuffer(BufferRecycler.BYTE_WRITE_ENCODING_BUFFER);
    }

    public char[] allocTokenBuffer()
    {
        verifyAlloc(_tokenCBuffer);
        return _tokenCBuffer = _bufferRecycler.allocCharBuffer(BufferRecycler.CHAR_TOKEN_BUFFER);
    }

    public char[] allocConcatBuffer()
    {
        verifyAlloc(_concatCBuffer);
        return _concatCBuffer = _bufferRecycler.allocCharBuffer(BufferRecycler.CHAR_CONCAT_BUFFER);
    }

    public void releaseReadIOBuffer(byte[] buffer)
    {
        if (buffer != null)
        {
            verifyRelease(buffer, _readIOBuffer);
            _readIOBuffer = null;
            _bufferRecycler.releaseByteBuffer(BufferRecycler.BYTE_READ_IO_BUFFER, buffer);
        }
    }

    public void releaseWriteEncodingBuffer(byte[] buffer)
    {
        if (buffer != null)
        {
            verifyRelease(buffer, _writeEncodingBuffer);
            _writeEncodingBuffer = null;
            _bufferRecycler.releaseByteBuffer(BufferRecycler.BYTE_WRITE_ENCODING_BUFFER, buffer);
        }
    }

    public void releaseTokenBuffer(char[] buffer)
    {
        if (buffer != null)
        {
            verifyRelease(buffer, _tokenCBuffer);
            _tokenCBuffer = null;
            _bufferRecycler.releaseCharBuffer(BufferRecycler.CHAR_TOKEN_BUFFER, buffer);
        }
    }

    public void releaseConcatBuffer(char[] buffer)
    {
        if (buffer != null)
        {
            verifyRelease(buffer, _concatCBuffer);
            _concatCBuffer = null;
            _bufferRecycler.releaseCharBuffer(BufferRecycler.CHAR_CONCAT_BUFFER, buffer);
        }
    }

    private static void verifyAlloc(Object buffer)
    {
        if (buffer != null)
            throw new IllegalStateException("Trying to call same allocXxx() method second time");
    }

    private static void verifyRelease(byte[] toRelease, byte[] src)
    {
        if (src == null)
            throw new IllegalStateException("Trying to release a buffer that was not allocated");
        if (toRelease != src && toRelease.length < src.length)
            throw new IllegalArgumentException("Trying to release buffer smaller than original");
    }

    private static void verifyRelease(char[] toRelease, char[] src)
    {
        if (src == null)
            throw new IllegalStateException("Trying to release a buffer that was not allocated");
        if (toRelease != src && toRelease.length < src.length)
            throw new IllegalArgumentException("Trying to release buffer smaller than original");
    }

    public boolean isClosed()
    {
        return _closed;
    }

    /**
     * Returns the recycler to its pool. Further calls do nothing.
     */
    @Override
    public void close()
    {
        if (_closed)
            return;
        _closed = true;
        if (_releaseRecycler)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Releasing {} to {}", _bufferRecycler, _bufferRecycler.getPool());
            _bufferRecycler.releaseToPool();
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[content=%s,closed=%b]", getClass().getSimpleName(), hashCode(), contentDescription(), _closed);
    }
}
