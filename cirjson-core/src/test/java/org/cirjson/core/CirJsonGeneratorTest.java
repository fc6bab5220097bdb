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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.cirjson.core.async.ByteArrayFeeder;
import org.cirjson.core.cirjson.CirJsonWriteFeature;
import org.cirjson.core.exception.StreamConstraintsException;
import org.cirjson.core.exception.StreamWriteException;
import org.cirjson.core.exception.WrappedIOException;
import org.cirjson.util.Base64Variants;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CirJsonGeneratorTest
{
    private static final CirJsonFactory FACTORY = new CirJsonFactory();

    private static String write(CirJsonFactory factory, GeneratorAction action)
    {
        StringWriter writer = new StringWriter();
        try (CirJsonGenerator generator = factory.createGenerator(writer))
        {
            action.write(generator);
        }
        return writer.toString();
    }

    private interface GeneratorAction
    {
        void write(CirJsonGenerator generator);
    }

    @Test
    public void testObjectsAndArraysWithIds()
    {
        Object root = new Object();
        Object list = List.of("x");
        String out = write(FACTORY, g ->
        {
            g.writeStartObject(root);
            g.writeObjectId(root);
            g.writeStringProperty("name", "CirJSON");
            g.writeArrayPropertyStart("values");
            g.writeArrayId(list);
            g.writeNumber(1);
            g.writeNumber(-2.5);
            g.writeBoolean(true);
            g.writeNull();
            g.writeEndArray();
            g.writeNumberProperty("count", 3L);
            g.writeEndObject();
        });
        assertThat(out, is("{\"__cirJsonId__\":\"0\",\"name\":\"CirJSON\",\"values\":[\"1\",1,-2.5,true,null],\"count\":3}"));
    }

    @Test
    public void testSameValueGetsSameId()
    {
        Map<String, String> shared = Map.of();
        String out = write(FACTORY, g ->
        {
            g.writeStartArray();
            g.writeArrayId(new Object());
            for (int i = 0; i < 2; ++i)
            {
                g.writeStartObject(shared);
                g.writeObjectId(shared);
                g.writeEndObject();
            }
            g.writeEndArray();
        });
        assertThat(out, is("[\"0\",{\"__cirJsonId__\":\"1\"},{\"__cirJsonId__\":\"1\"}]"));
    }

    @Test
    public void testExplicitIdsAreSkipped()
    {
        Object explicit = new Object();
        Object other = new Object();
        String out = write(FACTORY, g ->
        {
            g.getIDHolder().setID("0", explicit, false);
            g.writeStartArray();
            g.writeArrayId(other);
            g.writeStartObject();
            g.writeObjectId(explicit);
            g.writeEndObject();
            g.writeEndArray();
        });
        assertThat(out, is("[\"1\",{\"__cirJsonId__\":\"0\"}]"));
    }

    @Test
    public void testIdOfOtherContainerKind()
    {
        Object value = new Object();
        StringWriter writer = new StringWriter();
        try (CirJsonGenerator generator = FACTORY.createGenerator(writer))
        {
            generator.writeStartObject();
            generator.writeObjectId(value);
            generator.writeName("inner");
            generator.writeStartArray();
            StreamWriteException x = assertThrows(StreamWriteException.class, () -> generator.writeArrayId(value));
            assertThat(x.getMessage(), containsString("already has id '0' as an Object, can not use it as an Array"));
            assertThat(x.getProcessor(), sameInstance(generator));
        }
    }

    @Test
    public void testIdsOnlyAsFirstEntry()
    {
        StringWriter writer = new StringWriter();
        try (CirJsonGenerator generator = FACTORY.createGenerator(writer))
        {
            StreamWriteException x = assertThrows(StreamWriteException.class, () -> generator.writeObjectId(new Object()));
            assertThat(x.getMessage(), is("Can not write an object id, expecting it as the first property of an Object (context: root)"));
            x = assertThrows(StreamWriteException.class, () -> generator.writeArrayId(new Object()));
            assertThat(x.getMessage(), is("Can not write an array id, expecting it as the first element of an Array (context: root)"));

            generator.writeStartObject();
            generator.writeObjectId(new Object());
            x = assertThrows(StreamWriteException.class, () -> generator.writeObjectId(new Object()));
            assertThat(x.getMessage(), containsString("expecting it as the first property of an Object (context: Object)"));

            generator.writeArrayPropertyStart("a");
            generator.writeArrayId(new Object());
            x = assertThrows(StreamWriteException.class, () -> generator.writeArrayId(new Object()));
            assertThat(x.getMessage(), containsString("expecting it as the first element of an Array (context: Array)"));
        }
    }

    @Test
    public void testStructureErrors()
    {
        StringWriter writer = new StringWriter();
        try (CirJsonGenerator generator = FACTORY.createGenerator(writer))
        {
            StreamWriteException x = assertThrows(StreamWriteException.class, generator::writeEndArray);
            assertThat(x.getMessage(), is("Current context not Array but root"));
            x = assertThrows(StreamWriteException.class, generator::writeEndObject);
            assertThat(x.getMessage(), is("Current context not Object but root"));

            generator.writeStartObject();
            x = assertThrows(StreamWriteException.class, () -> generator.writeString("value"));
            assertThat(x.getMessage(), is("Can not write a string, expecting a property name (context: Object)"));
            x = assertThrows(StreamWriteException.class, generator::writeEndArray);
            assertThat(x.getMessage(), is("Current context not Array but Object"));

            generator.writeName("n");
            x = assertThrows(StreamWriteException.class, () -> generator.writeName("m"));
            assertThat(x.getMessage(), is("Can not write a property name, expecting a value"));
            x = assertThrows(StreamWriteException.class, generator::writeEndObject);
            assertThat(x.getMessage(), is("Can not write end of Object, expecting a value for property 'n'"));
            generator.writeNumber(1);
            generator.writeEndObject();
        }
        assertThat(writer.toString(), is("{\"n\":1}"));
    }

    @Test
    public void testNamesOutsideObject()
    {
        StringWriter writer = new StringWriter();
        try (CirJsonGenerator generator = FACTORY.createGenerator(writer))
        {
            generator.writeStartArray();
            StreamWriteException x = assertThrows(StreamWriteException.class, () -> generator.writeName("a"));
            assertThat(x.getMessage(), is("Can not write a property name, expecting a value"));
        }
    }

    @Test
    public void testStringEscaping()
    {
        String out = write(FACTORY, g -> g.writeString("q\"b\\s/\b\t\f\n\r\u0001\u001Fé€"));
        assertThat(out, is("\"q\\\"b\\\\s/\\b\\t\\f\\n\\r\\u0001\\u001Fé€\""));

        CirJsonFactory escaping = CirJsonFactory.builder()
            .enable(CirJsonWriteFeature.ESCAPE_NON_ASCII)
            .enable(CirJsonWriteFeature.ESCAPE_FORWARD_SLASHES)
            .build();
        out = write(escaping, g -> g.writeString("a/é😀"));
        assertThat(out, is("\"a\\/\\u00E9\\uD83D\\uDE00\""));
    }

    @Test
    public void testCharArrayString()
    {
        char[] chars = "xx\"hi\"yy".toCharArray();
        String out = write(FACTORY, g -> g.writeString(chars, 2, 4));
        assertThat(out, is("\"\\\"hi\\\"\""));
    }

    @Test
    public void testNullValues()
    {
        String out = write(FACTORY, g ->
        {
            g.writeStartArray();
            g.writeString((String)null);
            g.writeNumber((BigDecimal)null);
            g.writeNumber((BigInteger)null);
            g.writeNumber((String)null);
            g.writeEndArray();
        });
        assertThat(out, is("[null,null,null,null]"));
    }

    @Test
    public void testNumbers()
    {
        String out = write(FACTORY, g ->
        {
            g.writeStartArray();
            g.writeNumber((short)-7);
            g.writeNumber(Integer.MIN_VALUE);
            g.writeNumber(Long.MAX_VALUE);
            g.writeNumber(new BigInteger("123456789012345678901234567890"));
            g.writeNumber(0.1);
            g.writeNumber(1.0E-5f);
            g.writeNumber(new BigDecimal("1E+3"));
            g.writeNumber("12.50");
            g.writeNumber(Double.NaN);
            g.writeNumber(Float.NEGATIVE_INFINITY);
            g.writeEndArray();
        });
        assertThat(out, is("[-7,-2147483648,9223372036854775807,123456789012345678901234567890,0.1,1.0E-5,1E+3,12.50,\"NaN\",\"-Infinity\"]"));
    }

    @Test
    public void testNonFiniteNumbersUnquoted()
    {
        CirJsonFactory factory = CirJsonFactory.builder().disable(CirJsonWriteFeature.WRITE_NAN_AS_STRINGS).build();
        String out = write(factory, g ->
        {
            g.writeStartArray();
            g.writeNumber(Double.POSITIVE_INFINITY);
            g.writeNumber(Float.NaN);
            g.writeEndArray();
        });
        assertThat(out, is("[Infinity,NaN]"));
    }

    @Test
    public void testNumbersAsStrings()
    {
        CirJsonFactory factory = CirJsonFactory.builder().enable(CirJsonWriteFeature.WRITE_NUMBERS_AS_STRINGS).build();
        String out = write(factory, g ->
        {
            g.writeStartArray();
            g.writeNumber(42);
            g.writeNumber(42L);
            g.writeNumber(4.5);
            g.writeNumber(new BigDecimal("0.5"));
            g.writeEndArray();
        });
        assertThat(out, is("[\"42\",\"42\",\"4.5\",\"0.5\"]"));
    }

    @Test
    public void testBigDecimalAsPlain()
    {
        CirJsonFactory factory = CirJsonFactory.builder().enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN).build();
        assertThat(write(factory, g -> g.writeNumber(new BigDecimal("1E+3"))), is("1000"));

        StringWriter writer = new StringWriter();
        try (CirJsonGenerator generator = factory.createGenerator(writer))
        {
            StreamWriteException x = assertThrows(StreamWriteException.class, () -> generator.writeNumber(new BigDecimal("1E+10000")));
            assertThat(x.getMessage(), is("Attempt to write plain `java.math.BigDecimal` (see StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN) " +
                "with illegal scale (-10000): needs to be between [-9999, 9999]"));
        }
    }

    @Test
    public void testRootValueSeparator()
    {
        GeneratorAction action = g ->
        {
            g.writeNumber(1);
            g.writeString("two");
            g.writeStartArray();
            g.writeEndArray();
        };
        assertThat(write(FACTORY, action), is("1 \"two\" []"));
        assertThat(write(CirJsonFactory.builder().rootValueSeparator("\n").build(), action), is("1\n\"two\"\n[]"));
        assertThat(write(CirJsonFactory.builder().rootValueSeparator(null).build(), action), is("1\"two\"[]"));
    }

    @Test
    public void testUnquotedPropertyNames()
    {
        CirJsonFactory factory = CirJsonFactory.builder().disable(CirJsonWriteFeature.QUOTE_PROPERTY_NAMES).build();
        String out = write(factory, g ->
        {
            g.writeStartObject();
            g.writeBooleanProperty("flag", false);
            g.writeNullProperty("none");
            g.writeEndObject();
        });
        assertThat(out, is("{flag:false,none:null}"));
    }

    @Test
    public void testBinary()
    {
        byte[] data = "Hello".getBytes(StandardCharsets.US_ASCII);
        String out = write(FACTORY, g ->
        {
            g.writeStartArray();
            g.writeBinary(data);
            g.writeBinary(data, 1, 2);
            g.writeBinary(Base64Variants.MODIFIED_FOR_URL, new byte[]{(byte)0xFB, (byte)0xFF}, 0, 2);
            g.writeEndArray();
        });
        assertThat(out, is("[\"SGVsbG8=\",\"ZWw=\",\"-_8\"]"));

        StringWriter writer = new StringWriter();
        try (CirJsonGenerator generator = FACTORY.createGenerator(writer))
        {
            StreamWriteException x = assertThrows(StreamWriteException.class, () -> generator.writeBinary(data, 3, 5));
            assertThat(x.getMessage(), is("Invalid 'offset' (3) and/or 'len' (5) arguments for `byte[]` of length 5"));
        }
    }

    @Test
    public void testRawOutput()
    {
        String out = write(FACTORY, g ->
        {
            g.writeStartArray();
            g.writeRawValue("{\"__cirJsonId__\":\"9\"}");
            g.writeRaw(' ');
            g.writeRawValue("7");
            g.writeRaw("/*c*/");
            g.writeEndArray();
        });
        assertThat(out, is("[{\"__cirJsonId__\":\"9\"} ,7/*c*/]"));
    }

    @Test
    public void testDuplicateDetection()
    {
        CirJsonFactory factory = CirJsonFactory.builder().enable(StreamWriteFeature.STRICT_DUPLICATE_DETECTION).build();
        StringWriter writer = new StringWriter();
        try (CirJsonGenerator generator = factory.createGenerator(writer))
        {
            generator.writeStartObject();
            generator.writeNumberProperty("a", 1);
            generator.writeObjectPropertyStart("b");
            // Names are tracked per object.
            generator.writeNumberProperty("a", 2);
            generator.writeEndObject();
            StreamWriteException x = assertThrows(StreamWriteException.class, () -> generator.writeName("a"));
            assertThat(x.getMessage(), is("Duplicate Object property \"a\""));
            assertThat(x.getProcessor(), sameInstance(generator));
        }
    }

    @Test
    public void testNestingDepthLimit()
    {
        CirJsonFactory factory = CirJsonFactory.builder()
            .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(2).build())
            .build();
        StringWriter writer = new StringWriter();
        try (CirJsonGenerator generator = factory.createGenerator(writer))
        {
            generator.writeStartArray();
            generator.writeStartArray();
            StreamConstraintsException x = assertThrows(StreamConstraintsException.class, generator::writeStartObject);
            assertThat(x.getMessage(), containsString("Document nesting depth (3) exceeds the maximum allowed (2"));
        }
        assertThat(writer.toString(), is("[[]]"));
    }

    @Test
    public void testCurrentValueAndContext()
    {
        Object value = new Object();
        StringWriter writer = new StringWriter();
        try (CirJsonGenerator generator = FACTORY.createGenerator(writer))
        {
            generator.writeStartObject(value);
            assertThat(generator.currentValue(), sameInstance(value));
            generator.writeName("a");
            assertThat(generator.streamWriteContext().currentName(), is("a"));
            assertThat(generator.streamWriteContext().hasPendingName(), is(true));
            generator.writeStartArray();
            assertThat(generator.streamWriteContext().getNestingDepth(), is(2));
        }
    }

    @Test
    public void testCloseWritesEndMarkers()
    {
        TrackingWriter writer = new TrackingWriter();
        CirJsonGenerator generator = FACTORY.createGenerator(writer);
        generator.writeStartObject();
        generator.writeArrayPropertyStart("a");
        generator.writeNumber(1);
        generator.close();
        assertThat(writer.toString(), is("{\"a\":[1]}"));
        assertThat(writer.closed, is(true));
        assertThat(generator.isClosed(), is(true));
        // A second close does nothing.
        generator.close();
    }

    @Test
    public void testCloseWithoutClosingContentOrTarget()
    {
        CirJsonFactory factory = CirJsonFactory.builder()
            .disable(StreamWriteFeature.AUTO_CLOSE_CONTENT)
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();
        TrackingWriter writer = new TrackingWriter();
        CirJsonGenerator generator = factory.createGenerator(writer);
        generator.writeStartArray();
        generator.writeNumber(1);
        generator.close();
        assertThat(writer.toString(), is("[1"));
        assertThat(writer.closed, is(false));
        assertThat(writer.flushes, is(1));
    }

    @Test
    public void testFlushNotPassedToTarget()
    {
        CirJsonFactory factory = CirJsonFactory.builder().disable(StreamWriteFeature.FLUSH_PASSED_TO_STREAM).build();
        TrackingWriter writer = new TrackingWriter();
        CirJsonGenerator generator = factory.createGenerator(writer);
        generator.writeNumber(5);
        assertThat(generator.getOutputBuffered(), is(1));
        generator.flush();
        assertThat(generator.getOutputBuffered(), is(0));
        assertThat(writer.toString(), is("5"));
        assertThat(writer.flushes, is(0));
        generator.close();
    }

    @Test
    public void testWriteFailureIsWrapped()
    {
        CirJsonGenerator generator = FACTORY.createGenerator(new Writer()
        {
            @Override
            public void write(char[] buffer, int offset, int length) throws IOException
            {
                throw new IOException("broken pipe");
            }

            @Override
            public void flush()
            {
            }

            @Override
            public void close() throws IOException
            {
                throw new IOException("close failed");
            }
        });
        generator.writeString("data");
        WrappedIOException x = assertThrows(WrappedIOException.class, generator::flush);
        assertThat(x.getCause().getMessage(), is("broken pipe"));
        assertThat(x.getProcessor(), sameInstance(generator));

        generator.writeString("more");
        x = assertThrows(WrappedIOException.class, generator::close);
        assertThat(x.getCause().getMessage(), is("broken pipe"));
        assertThat(x.getSuppressed()[0].getMessage(), is("close failed"));
        assertThat(generator.isClosed(), is(true));
    }

    @Test
    public void testOutputStreamIsUtf8()
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (CirJsonGenerator generator = FACTORY.createGenerator(out))
        {
            generator.writeStartArray();
            generator.writeArrayId(new Object());
            generator.writeString("é€😀");
            generator.writeEndArray();
        }
        assertThat(out.toByteArray(), is("[\"0\",\"é€😀\"]".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testOutputStreamWrittenOnCloseWithoutTargetFeatures()
    {
        CirJsonFactory factory = CirJsonFactory.builder()
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .disable(StreamWriteFeature.FLUSH_PASSED_TO_STREAM)
            .build();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        CirJsonGenerator generator = factory.createGenerator(out);
        generator.writeStartArray();
        generator.writeArrayId(new Object());
        generator.writeNumber(1);
        generator.writeEndArray();
        generator.close();
        assertThat(out.toString(StandardCharsets.UTF_8), is("[\"0\",1]"));
    }

    @Test
    public void testOutputStreamNumbersAndEscapes()
    {
        CirJsonFactory factory = CirJsonFactory.builder()
            .enable(CirJsonWriteFeature.ESCAPE_NON_ASCII)
            .disable(CirJsonWriteFeature.WRITE_HEX_UPPER_CASE)
            .build();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (CirJsonGenerator generator = factory.createGenerator(out))
        {
            generator.writeStartArray();
            generator.writeArrayId(new Object());
            generator.writeNumber(Integer.MIN_VALUE);
            generator.writeNumber(Long.MAX_VALUE);
            generator.writeNumber(0.25);
            generator.writeString("\u001Fé");
            generator.writeEndArray();
        }
        assertThat(out.toString(StandardCharsets.UTF_8), is("[\"0\",-2147483648,9223372036854775807,0.25,\"\\u001f\\u00e9\"]"));
    }

    @Test
    public void testOutputStreamLongContent()
    {
        String text = "é€😀x".repeat(5000);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (CirJsonGenerator generator = FACTORY.createGenerator(out))
        {
            generator.writeString(text);
        }
        assertThat(out.toString(StandardCharsets.UTF_8), is("\"" + text + "\""));
    }

    @Test
    public void testOutputStreamSurrogateErrors()
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (CirJsonGenerator generator = FACTORY.createGenerator(out))
        {
            StreamWriteException x = assertThrows(StreamWriteException.class, () -> generator.writeString("a\uDE00"));
            assertThat(x.getMessage(), is("Unmatched second part of surrogate pair (0xDE00)"));
            x = assertThrows(StreamWriteException.class, () -> generator.writeString("\uD83Da"));
            assertThat(x.getMessage(), is("Invalid surrogate pair: first char 0xD83D, second 0x0061"));
        }
    }

    @Test
    public void testLowerCaseHexEscapes()
    {
        CirJsonFactory factory = CirJsonFactory.builder().disable(CirJsonWriteFeature.WRITE_HEX_UPPER_CASE).build();
        assertThat(write(factory, g -> g.writeString("\u001F")), is("\"\\u001f\""));
        assertThat(write(FACTORY, g -> g.writeString("\u001F")), is("\"\\u001F\""));
    }

    @Test
    public void testCloseKeepsContentWrittenBeforeFailure()
    {
        TrackingWriter writer = new TrackingWriter();
        CirJsonGenerator generator = FACTORY.createGenerator(writer);
        generator.writeStartObject();
        generator.writeObjectId(new Object());
        generator.writeName("a");
        StreamWriteException x = assertThrows(StreamWriteException.class, generator::close);
        assertThat(x.getMessage(), is("Can not write end of Object, expecting a value for property 'a'"));
        assertThat(writer.toString(), is("{\"__cirJsonId__\":\"0\",\"a\""));
        assertThat(writer.closed, is(true));
        assertThat(generator.isClosed(), is(true));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        CirJsonGenerator bytes = FACTORY.createGenerator(out);
        bytes.writeStartObject();
        bytes.writeObjectId(new Object());
        bytes.writeName("a");
        assertThrows(StreamWriteException.class, bytes::close);
        assertThat(out.toString(StandardCharsets.UTF_8), is("{\"__cirJsonId__\":\"0\",\"a\""));
    }

    @Test
    public void testFailedObjectIdTakesNoId()
    {
        FailingWriter writer = new FailingWriter();
        CirJsonGenerator generator = FACTORY.createGenerator(writer);
        generator.writeStartObject();
        // Fill the buffer exactly, so that the next char written flushes it.
        while (writer.length() == 0)
        {
            generator.writeRaw('x');
        }
        int capacity = writer.length();
        for (int i = 1; i < capacity; ++i)
        {
            generator.writeRaw('x');
        }
        writer.failing = true;
        Object value = new Object();
        assertThrows(WrappedIOException.class, () -> generator.writeObjectId(value));
        assertThat(generator.getIDHolder().size(), is(0));
        assertThat(generator.getIDHolder().getID(new Object(), true), is("0"));
        writer.failing = false;
        // The id property name was accepted by the context before the flush failed.
        assertThrows(StreamWriteException.class, generator::close);
    }

    @Test
    public void testObjectIdOfOtherKindWritesNothing()
    {
        Object value = new Object();
        StringWriter writer = new StringWriter();
        try (CirJsonGenerator generator = FACTORY.createGenerator(writer))
        {
            generator.writeStartArray();
            generator.writeArrayId(value);
            generator.writeStartObject();
            assertThrows(StreamWriteException.class, () -> generator.writeObjectId(value));
            generator.writeObjectId(new Object());
            generator.writeEndObject();
            generator.writeEndArray();
        }
        assertThat(writer.toString(), is("[\"0\",{\"__cirJsonId__\":\"1\"}]"));
    }

    @Test
    public void testCopyCurrentStructure()
    {
        String doc = "{\"__cirJsonId__\":\"0\",\"a\":[\"1\",1.50,12345678901234567890,true,null,\"s\"],\"b\":{\"__cirJsonId__\":\"2\"}}";
        StringWriter writer = new StringWriter();
        try (CirJsonParser parser = FACTORY.createParser(doc);
             CirJsonGenerator generator = FACTORY.createGenerator(writer))
        {
            parser.nextToken();
            generator.copyCurrentStructure(parser);
            assertThat(parser.currentToken(), is(CirJsonToken.END_OBJECT));
        }
        assertThat(writer.toString(), is(doc));
    }

    @Test
    public void testCopyPropertyWithValue()
    {
        String doc = "{\"__cirJsonId__\":\"0\",\"a\":[\"1\",2],\"b\":3}";
        StringWriter writer = new StringWriter();
        try (CirJsonParser parser = FACTORY.createParser(doc);
             CirJsonGenerator generator = FACTORY.createGenerator(writer))
        {
            generator.writeStartObject();
            parser.nextToken();
            parser.nextToken();
            parser.nextToken();
            assertThat(parser.nextToken(), is(CirJsonToken.PROPERTY_NAME));
            generator.copyCurrentStructure(parser);
            assertThat(parser.currentToken(), is(CirJsonToken.END_ARRAY));
            generator.writeEndObject();
        }
        assertThat(writer.toString(), is("{\"a\":[\"1\",2]}"));
    }

    @Test
    public void testCopyErrors()
    {
        StringWriter writer = new StringWriter();
        try (CirJsonParser parser = FACTORY.createParser("[\"0\",1");
             CirJsonGenerator generator = FACTORY.createGenerator(writer))
        {
            StreamWriteException x = assertThrows(StreamWriteException.class, () -> generator.copyCurrentEvent(parser));
            assertThat(x.getMessage(), is("No current event to copy: null"));

            parser.nextToken();
            assertThrows(CirJacksonException.class, () -> generator.copyCurrentStructure(parser));
        }
    }

    @Test
    public void testCopyFromNonBlockingParserWithoutInput()
    {
        StringWriter writer = new StringWriter();
        try (CirJsonParser parser = FACTORY.createNonBlockingByteArrayParser();
             CirJsonGenerator generator = FACTORY.createGenerator(writer))
        {
            byte[] input = "[\"0\",".getBytes(StandardCharsets.UTF_8);
            ((ByteArrayFeeder)parser.getNonBlockingInputFeeder()).feedInput(input, 0, input.length);
            parser.nextToken();
            StreamWriteException x = assertThrows(StreamWriteException.class, () -> generator.copyCurrentStructure(parser));
            assertThat(x.getMessage(), is("Unexpected end of content while copying a structure: NOT_AVAILABLE"));
        }
    }

    private static class FailingWriter extends Writer
    {
        private final StringBuilder _content = new StringBuilder();
        private boolean failing;

        private int length()
        {
            return _content.length();
        }

        @Override
        public void write(char[] buffer, int offset, int length) throws IOException
        {
            if (failing)
                throw new IOException("write failed");
            _content.append(buffer, offset, length);
        }

        @Override
        public void flush()
        {
        }

        @Override
        public void close()
        {
        }
    }

    private static class TrackingWriter extends StringWriter
    {
        private boolean closed;
        private int flushes;

        @Override
        public void flush()
        {
            ++flushes;
            super.flush();
        }

        @Override
        public void close() throws IOException
        {
            closed = true;
            super.close();
        }
    }
}
