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

package org.cirjson.core;

import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;

import org.cirjson.core.async.NonBlockingByteArrayCirJsonParser;
import org.cirjson.core.async.NonBlockingByteBufferCirJsonParser;
import org.cirjson.core.cirjson.CirJsonReadFeature;
import org.cirjson.core.cirjson.CirJsonWriteFeature;
import org.cirjson.core.cirjson.ReaderBasedCirJsonParser;
import org.cirjson.core.cirjson.UTF8CirJsonGenerator;
import org.cirjson.core.cirjson.UTF8StreamCirJsonParser;
import org.cirjson.core.cirjson.WriterBasedCirJsonGenerator;
import org.cirjson.core.io.IOContext;
import org.cirjson.core.symbols.CharsToNameCanonicalizer;
import org.cirjson.util.BufferRecycler;
import org.cirjson.util.RecyclerPool;

/**
 * <p>Creates parsers and generators, all configured alike.</p>
 * <p>A factory is immutable and thread-safe once built; use {@link #builder()} or
 * {@link #rebuild()} to configure one. The factory owns the root table of property
 * names that its parsers share, so that names seen by one parser are found by the next.</p>
 */
public class CirJsonFactory
{
    /**
     * The text written between values at the root level by default.
     */
    public static final String DEFAULT_ROOT_VALUE_SEPARATOR = " ";

    private final int _streamReadFeatures;
    private final int _streamWriteFeatures;
    private final int _formatReadFeatures;
    private final int _formatWriteFeatures;
    private final StreamReadConstraints _streamReadConstraints;
    private final StreamWriteConstraints _streamWriteConstraints;
    private final RecyclerPool<BufferRecycler> _recyclerPool;
    private final String _rootValueSeparator;
    private final CharsToNameCanonicalizer _rootCharSymbols = CharsToNameCanonicalizer.createRoot();

    public CirJsonFactory()
    {
        this(new CirJsonFactoryBuilder());
    }

    public CirJsonFactory(CirJsonFactoryBuilder builder)
    {
        _streamReadFeatures = builder.streamReadFeatures();
        _streamWriteFeatures = builder.streamWriteFeatures();
        _formatReadFeatures = builder.formatReadFeatures();
        _formatWriteFeatures = builder.formatWriteFeatures();
        _streamReadConstraints = builder.streamReadConstraints();
        _streamWriteConstraints = builder.streamWriteConstraints();
        _recyclerPool = builder.recyclerPool();
        _rootValueSeparator = builder.rootValueSeparator();
    }

    public static CirJsonFactoryBuilder builder()
    {
        return new CirJsonFactoryBuilder();
    }

    /**
     * @return a builder with the configuration of this factory
     */
    public CirJsonFactoryBuilder rebuild()
    {
        return new CirJsonFactoryBuilder(this);
    }

    public boolean isEnabled(StreamReadFeature feature)
    {
        return feature.enabledIn(_streamReadFeatures);
    }

    public boolean isEnabled(StreamWriteFeature feature)
    {
        return feature.enabledIn(_streamWriteFeatures);
    }

    public boolean isEnabled(CirJsonReadFeature feature)
    {
        return feature.enabledIn(_formatReadFeatures);
    }

    public boolean isEnabled(CirJsonWriteFeature feature)
    {
        return feature.enabledIn(_formatWriteFeatures);
    }

    public int getStreamReadFeatures()
    {
        return _streamReadFeatures;
    }

    public int getStreamWriteFeatures()
    {
        return _streamWriteFeatures;
    }

    public int getFormatReadFeatures()
    {
        return _formatReadFeatures;
    }

    public int getFormatWriteFeatures()
    {
        return _formatWriteFeatures;
    }

    public StreamReadConstraints streamReadConstraints()
    {
        return _streamReadConstraints;
    }

    public StreamWriteConstraints streamWriteConstraints()
    {
        return _streamWriteConstraints;
    }

    public RecyclerPool<BufferRecycler> getRecyclerPool()
    {
        return _recyclerPool;
    }

    public String getRootValueSeparator()
    {
        return _rootValueSeparator;
    }

    public CirJsonParser createParser(byte[] data)
    {
        return createParser(data, 0, data.length);
    }

    public CirJsonParser createParser(byte[] data, int offset, int length)
    {
        checkRange(data.length, offset, length);
        IOContext ioContext = createContext(data, true);
        return new UTF8StreamCirJsonParser(ioContext, _streamReadFeatures, _formatReadFeatures, _rootCharSymbols.makeChild(), data, offset, offset + length);
    }

    public CirJsonParser createParser(char[] content)
    {
        return createParser(content, 0, content.length);
    }

    public CirJsonParser createParser(char[] content, int offset, int length)
    {
        checkRange(content.length, offset, length);
        IOContext ioContext = createContext(content, true);
        return new ReaderBasedCirJsonParser(ioContext, _streamReadFeatures, _formatReadFeatures, _rootCharSymbols.makeChild(), content, offset, offset + length);
    }

    public CirJsonParser createParser(String content)
    {
        IOContext ioContext = createContext(content, true);
        char[] chars = content.toCharArray();
        return new ReaderBasedCirJsonParser(ioContext, _streamReadFeatures, _formatReadFeatures, _rootCharSymbols.makeChild(), chars, 0, chars.length);
    }

    /**
     * Creates a parser reading from a {@link Reader}. The reader is closed with the parser if
     * {@link StreamReadFeature#AUTO_CLOSE_SOURCE} is enabled.
     */
    public CirJsonParser createParser(Reader reader)
    {
        IOContext ioContext = createContext(reader, false);
        return new ReaderBasedCirJsonParser(ioContext, _streamReadFeatures, _formatReadFeatures, reader, _rootCharSymbols.makeChild());
    }

    /**
     * Creates a parser reading UTF-8 from an {@link InputStream}. The stream is closed with
     * the parser if {@link StreamReadFeature#AUTO_CLOSE_SOURCE} is enabled.
     */
    public CirJsonParser createParser(InputStream in)
    {
        IOContext ioContext = createContext(in, false);
        return new UTF8StreamCirJsonParser(ioContext, _streamReadFeatures, _formatReadFeatures, in, _rootCharSymbols.makeChild());
    }

    public NonBlockingByteArrayCirJsonParser createNonBlockingByteArrayParser()
    {
        IOContext ioContext = createContext(null, false);
        return new NonBlockingByteArrayCirJsonParser(ioContext, _streamReadFeatures, _formatReadFeatures, _rootCharSymbols.makeChild());
    }

    public NonBlockingByteBufferCirJsonParser createNonBlockingByteBufferParser()
    {
        IOContext ioContext = createContext(null, false);
        return new NonBlockingByteBufferCirJsonParser(ioContext, _streamReadFeatures, _formatReadFeatures, _rootCharSymbols.makeChild());
    }

    public CirJsonGenerator createGenerator(Writer writer)
    {
        IOContext ioContext = createContext(writer, false);
        return new WriterBasedCirJsonGenerator(ioContext, _streamWriteFeatures, _formatWriteFeatures, writer, _rootValueSeparator);
    }

    /**
     * Creates a generator writing UTF-8 to an {@link OutputStream}. The stream is closed with
     * the generator if {@link StreamWriteFeature#AUTO_CLOSE_TARGET} is enabled.
     */
    public CirJsonGenerator createGenerator(OutputStream out)
    {
        IOContext ioContext = createContext(out, false);
        return new UTF8CirJsonGenerator(ioContext, _streamWriteFeatures, _formatWriteFeatures, out, _rootValueSeparator);
    }

    protected IOContext createContext(Object content, boolean managedResource)
    {
        return new IOContext(_streamReadConstraints, _streamWriteConstraints, _recyclerPool, content, managedResource);
    }

    private static void checkRange(int bufferLength, int offset, int length)
    {
        if (offset < 0 || length < 0 || offset > bufferLength - length)
            throw new IllegalArgumentException(String.format("Invalid 'offset' (%d) and/or 'len' (%d) arguments for an input of length %d", offset, length, bufferLength));
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[pool=%s,symbols=%s]", getClass().getSimpleName(), hashCode(), _recyclerPool, _rootCharSymbols);
    }
}
