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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import org.cirjson.core.async.ByteArrayFeeder;
import org.cirjson.core.async.ByteBufferFeeder;
import org.cirjson.core.async.NonBlockingInputFeeder;

/**
 * The ways a document can be handed to a parser. Blocking streams return few
 * chars or bytes per read, non-blocking parsers are fed in fixed size chunks.
 */
public enum ParserMode
{
    STRING(false, 0),
    CHARS(false, 0),
    READER(false, 3),
    BYTES(true, 0),
    INPUT_STREAM(true, 5),
    ASYNC_BYTES_1(true, 1),
    ASYNC_BYTES_7(true, 7),
    ASYNC_BYTES_ALL(true, Integer.MAX_VALUE),
    ASYNC_BUFFER_3(true, 3);

    private final boolean _byteBased;
    private final int _chunk;

    ParserMode(boolean byteBased, int chunk)
    {
        _byteBased = byteBased;
        _chunk = chunk;
    }

    public boolean isByteBased()
    {
        return _byteBased;
    }

    public boolean isAsync()
    {
        return name().startsWith("ASYNC");
    }

    public TokenSource open(CirJsonFactory factory, String doc)
    {
        byte[] bytes = doc.getBytes(StandardCharsets.UTF_8);
        switch (this)
        {
            case STRING:
                return new TokenSource(factory.createParser(doc));
            case CHARS:
            {
                // Surrounding padding checks that offsets start at the range start.
                char[] padded = ("xx" + doc + "yy").toCharArray();
                return new TokenSource(factory.createParser(padded, 2, doc.length()));
            }
            case READER:
                return new TokenSource(factory.createParser(new SlowReader(new StringReader(doc), _chunk)));
            case BYTES:
                return new TokenSource(factory.createParser(bytes));
            case INPUT_STREAM:
                return new TokenSource(factory.createParser(new SlowInputStream(new ByteArrayInputStream(bytes), _chunk)));
            case ASYNC_BUFFER_3:
                return new TokenSource(factory.createNonBlockingByteBufferParser(), bytes, _chunk, true);
            default:
                return new TokenSource(factory.createNonBlockingByteArrayParser(), bytes, _chunk, false);
        }
    }

    /**
     * Wraps a parser so that non-blocking parsers read like blocking ones.
     */
    public static class TokenSource implements AutoCloseable
    {
        private final CirJsonParser _parser;
        private final byte[] _input;
        private final int _chunk;
        private final boolean _byteBuffer;
        private int _offset;

        TokenSource(CirJsonParser parser)
        {
            this(parser, null, 0, false);
        }

        TokenSource(CirJsonParser parser, byte[] input, int chunk, boolean byteBuffer)
        {
            _parser = parser;
            _input = input;
            _chunk = chunk;
            _byteBuffer = byteBuffer;
        }

        public CirJsonParser parser()
        {
            return _parser;
        }

        public CirJsonToken nextToken()
        {
            while (true)
            {
                CirJsonToken token = _parser.nextToken();
                if (token != CirJsonToken.NOT_AVAILABLE || _input == null)
                    return token;
                feed();
            }
        }

        /**
         * Reads tokens until the end of input and returns the last one read.
         */
        public CirJsonToken readAll()
        {
            CirJsonToken last = null;
            CirJsonToken token;
            while ((token = nextToken()) != null)
            {
                last = token;
            }
            return last;
        }

        /**
         * Feeds the rest of the document to a non-blocking parser at once and ends its input.
         * Call it only before reading or when the last chunk fed was consumed.
         */
        public void feedAll()
        {
            if (_input == null)
                return;
            if (_offset < _input.length)
                feed(_input.length);
            _parser.getNonBlockingInputFeeder().endOfInput();
        }

        private void feed()
        {
            if (_offset >= _input.length)
            {
                _parser.getNonBlockingInputFeeder().endOfInput();
                return;
            }
            feed((int)Math.min((long)_offset + _chunk, _input.length));
        }

        private void feed(int end)
        {
            NonBlockingInputFeeder feeder = _parser.getNonBlockingInputFeeder();
            if (_byteBuffer)
                ((ByteBufferFeeder)feeder).feedInput(ByteBuffer.wrap(_input, _offset, end - _offset));
            else
                ((ByteArrayFeeder)feeder).feedInput(_input, _offset, end);
            _offset = end;
        }

        @Override
        public void close()
        {
            _parser.close();
        }
    }

    private static class SlowReader extends Reader
    {
        private final Reader _delegate;
        private final int _max;

        SlowReader(Reader delegate, int max)
        {
            _delegate = delegate;
            _max = max;
        }

        @Override
        public int read(char[] buffer, int offset, int length) throws IOException
        {
            return _delegate.read(buffer, offset, Math.min(length, _max));
        }

        @Override
        public void close() throws IOException
        {
            _delegate.close();
        }
    }

    private static class SlowInputStream extends InputStream
    {
        private final InputStream _delegate;
        private final int _max;

        SlowInputStream(InputStream delegate, int max)
        {
            _delegate = delegate;
            _max = max;
        }

        @Override
        public int read() throws IOException
        {
            return _delegate.read();
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException
        {
            return _delegate.read(buffer, offset, Math.min(length, _max));
        }

        @Override
        public void close() throws IOException
        {
            _delegate.close();
        }
    }
}
