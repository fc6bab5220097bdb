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

import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import org.cirjson.core.cirjson.CirJsonReadFeature;
import org.cirjson.core.cirjson.CirJsonWriteFeature;
import org.cirjson.core.cirjson.ReaderBasedCirJsonParser;
import org.cirjson.core.exception.StreamReadException;
import org.cirjson.util.BufferRecycler;
import org.cirjson.util.CirJsonRecyclerPools;
import org.cirjson.util.RecyclerPool;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CirJsonFactoryTest
{
    @Test
    public void testDefaultFeatures()
    {
        CirJsonFactory factory = new CirJsonFactory();
        assertThat(factory.isEnabled(StreamReadFeature.AUTO_CLOSE_SOURCE), is(true));
        assertThat(factory.isEnabled(StreamReadFeature.STRICT_DUPLICATE_DETECTION), is(false));
        assertThat(factory.isEnabled(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION), is(false));
        assertThat(factory.isEnabled(StreamWriteFeature.AUTO_CLOSE_TARGET), is(true));
        assertThat(factory.isEnabled(StreamWriteFeature.AUTO_CLOSE_CONTENT), is(true));
        assertThat(factory.isEnabled(StreamWriteFeature.FLUSH_PASSED_TO_STREAM), is(true));
        assertThat(factory.isEnabled(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN), is(false));
        assertThat(factory.isEnabled(CirJsonReadFeature.ALLOW_TRAILING_COMMA), is(false));
        assertThat(factory.isEnabled(CirJsonWriteFeature.QUOTE_PROPERTY_NAMES), is(true));
        assertThat(factory.isEnabled(CirJsonWriteFeature.WRITE_NAN_AS_STRINGS), is(true));
        assertThat(factory.isEnabled(CirJsonWriteFeature.ESCAPE_NON_ASCII), is(false));
        assertThat(factory.isEnabled(CirJsonWriteFeature.WRITE_HEX_UPPER_CASE), is(true));
        assertThat(factory.getRootValueSeparator(), is(" "));
        assertThat(factory.streamReadConstraints().getMaxNestingDepth(), is(StreamReadConstraints.DEFAULT_MAX_DEPTH));
        assertThat(factory.streamReadConstraints().hasMaxDocumentLength(), is(false));
    }

    @Test
    public void testRebuildKeepsConfiguration()
    {
        RecyclerPool<BufferRecycler> pool = CirJsonRecyclerPools.newConcurrentDequePool();
        CirJsonFactory factory = CirJsonFactory.builder()
            .enable(CirJsonReadFeature.ALLOW_TRAILING_COMMA)
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .recyclerPool(pool)
            .rootValueSeparator("\n")
            .build();

        CirJsonFactory copy = factory.rebuild().configure(StreamReadFeature.STRICT_DUPLICATE_DETECTION, true).build();
        assertThat(copy.isEnabled(CirJsonReadFeature.ALLOW_TRAILING_COMMA), is(true));
        assertThat(copy.isEnabled(StreamWriteFeature.AUTO_CLOSE_TARGET), is(false));
        assertThat(copy.isEnabled(StreamReadFeature.STRICT_DUPLICATE_DETECTION), is(true));
        assertThat(copy.getRecyclerPool(), sameInstance(pool));
        assertThat(copy.getRootValueSeparator(), is("\n"));
        assertThat(factory.isEnabled(StreamReadFeature.STRICT_DUPLICATE_DETECTION), is(false));
    }

    @Test
    public void testNullPoolIsRejected()
    {
        assertThrows(NullPointerException.class, () -> CirJsonFactory.builder().recyclerPool(null));
    }

    @Test
    public void testInputRangeIsChecked()
    {
        CirJsonFactory factory = new CirJsonFactory();
        byte[] bytes = new byte[10];
        IllegalArgumentException x = assertThrows(IllegalArgumentException.class, () -> factory.createParser(bytes, 8, 5));
        assertThat(x.getMessage(), is("Invalid 'offset' (8) and/or 'len' (5) arguments for an input of length 10"));
        x = assertThrows(IllegalArgumentException.class, () -> factory.createParser(new char[4], -1, 2));
        assertThat(x.getMessage(), is("Invalid 'offset' (-1) and/or 'len' (2) arguments for an input of length 4"));
    }

    @Test
    public void testByteSlice()
    {
        CirJsonFactory factory = new CirJsonFactory();
        byte[] bytes = "junk[\"0\",42]junk".getBytes(StandardCharsets.UTF_8);
        try (CirJsonParser parser = factory.createParser(bytes, 4, 8))
        {
            assertThat(parser.nextToken(), is(CirJsonToken.START_ARRAY));
            assertThat(parser.nextToken(), is(CirJsonToken.VALUE_STRING));
            assertThat(parser.nextToken(), is(CirJsonToken.VALUE_NUMBER_INT));
            assertThat(parser.getIntValue(), is(42));
            assertThat(parser.nextToken(), is(CirJsonToken.END_ARRAY));
            assertThat(parser.nextToken(), nullValue());
        }
    }

    @Test
    public void testSourceInLocation()
    {
        CirJsonFactory plain = new CirJsonFactory();
        StreamReadException x = assertThrows(StreamReadException.class, () -> readAll(plain, "["));
        assertThat(x.getMessage(), containsString("[Source: UNKNOWN; line: 1, column: 1]"));

        CirJsonFactory described = plain.rebuild().enable(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION).build();
        x = assertThrows(StreamReadException.class, () -> readAll(described, "["));
        assertThat(x.getMessage(), containsString("[Source: (String)\"[\"; line: 1, column: 1]"));
    }

    @Test
    public void testAutoCloseSource()
    {
        CirJsonFactory factory = new CirJsonFactory();
        ClosingReader reader = new ClosingReader("[\"0\"]");
        try (CirJsonParser parser = factory.createParser(reader))
        {
            while (parser.nextToken() != null)
            {
                assertThat(reader._closed, is(false));
            }
        }
        assertThat(reader._closed, is(true));

        CirJsonFactory keepOpen = factory.rebuild().disable(StreamReadFeature.AUTO_CLOSE_SOURCE).build();
        ClosingReader other = new ClosingReader("[\"0\"]");
        try (CirJsonParser parser = keepOpen.createParser(other))
        {
            assertThat(parser.nextToken(), is(CirJsonToken.START_ARRAY));
        }
        assertThat(other._closed, is(false));
    }

    @Test
    public void testReleaseBufferedChars()
    {
        CirJsonFactory factory = new CirJsonFactory();
        try (CirJsonParser parser = factory.createParser("[\"0\"] tail"))
        {
            assertThat(parser.nextToken(), is(CirJsonToken.START_ARRAY));
            assertThat(parser.nextToken(), is(CirJsonToken.VALUE_STRING));
            assertThat(parser.nextToken(), is(CirJsonToken.END_ARRAY));
            StringWriter rest = new StringWriter();
            assertThat(((ReaderBasedCirJsonParser)parser).releaseBuffered(rest), is(5));
            assertThat(rest.toString(), is(" tail"));
        }
    }

    @Test
    public void testRecyclerReturnedToPool()
    {
        RecyclerPool<BufferRecycler> pool = CirJsonRecyclerPools.newBoundedPool(4);
        CirJsonFactory factory = CirJsonFactory.builder().recyclerPool(pool).build();
        assertThat(pool.pooledCount(), is(0));

        CirJsonParser parser = factory.createParser("{\"__cirJsonId__\":\"0\"}".getBytes(StandardCharsets.UTF_8));
        readAll(parser);
        // The parser closes itself at the end of input.
        assertThat(pool.pooledCount(), is(1));
        parser.close();
        assertThat(pool.pooledCount(), is(1));

        StringWriter out = new StringWriter();
        try (CirJsonGenerator generator = factory.createGenerator(out))
        {
            assertThat(pool.pooledCount(), is(0));
            Object value = new Object();
            generator.writeStartArray(value);
            generator.writeArrayId(value);
            generator.writeEndArray();
        }
        assertThat(pool.pooledCount(), is(1));
        assertThat(out.toString(), is("[\"0\"]"));
    }

    @Test
    public void testParserClosedAtEndOfInput()
    {
        CirJsonFactory factory = new CirJsonFactory();
        CirJsonParser parser = factory.createParser("[\"0\",1]");
        assertThat(parser.nextToken(), is(CirJsonToken.START_ARRAY));
        assertThat(parser.isClosed(), is(false));
        readAll(parser);
        assertThat(parser.isClosed(), is(true));
        assertThat(parser.nextToken(), nullValue());

        ClosingReader reader = new ClosingReader("[\"0\"]");
        CirJsonParser fromReader = factory.createParser(reader);
        readAll(fromReader);
        assertThat(fromReader.isClosed(), is(true));
        assertThat(reader._closed, is(true));
    }

    @Test
    public void testRootValueSeparatorFromFactory()
    {
        CirJsonFactory factory = CirJsonFactory.builder().rootValueSeparator(null).build();
        StringWriter out = new StringWriter();
        try (CirJsonGenerator generator = factory.createGenerator(out))
        {
            generator.writeNumber(1);
            generator.writeNumber(2);
        }
        assertThat(out.toString(), is("12"));
    }

    @Test
    public void testReadConstraintsBuilder()
    {
        IllegalArgumentException x = assertThrows(IllegalArgumentException.class, () -> StreamReadConstraints.builder().maxNestingDepth(-1));
        assertThat(x.getMessage(), is("Cannot set maxNestingDepth to a negative value"));
        x = assertThrows(IllegalArgumentException.class, () -> StreamReadConstraints.builder().maxStringLength(-5));
        assertThat(x.getMessage(), is("Cannot set maxStringLength to a negative value"));

        StreamReadConstraints unlimited = StreamReadConstraints.builder().maxDocumentLength(0).build();
        assertThat(unlimited.hasMaxDocumentLength(), is(false));
        unlimited.validateDocumentLength(Long.MAX_VALUE);

        StreamReadConstraints limited = unlimited.rebuild().maxDocumentLength(10).build();
        assertThat(limited.hasMaxDocumentLength(), is(true));
        assertThat(limited.getMaxDocumentLength(), is(10L));
        assertThat(limited, not(sameInstance(unlimited)));
    }

    private static void readAll(CirJsonFactory factory, String doc)
    {
        try (CirJsonParser parser = factory.createParser(doc))
        {
            readAll(parser);
        }
    }

    private static void readAll(CirJsonParser parser)
    {
        while (parser.nextToken() != null)
        {
            parser.skipChildren();
        }
    }

    private static class ClosingReader extends StringReader
    {
        private boolean _closed;

        private ClosingReader(String text)
        {
            super(text);
        }

        @Override
        public void close()
        {
            _closed = true;
            super.close();
        }
    }
}
