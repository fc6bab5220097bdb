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

import java.io.Closeable;
import java.io.Flushable;
import java.math.BigDecimal;
import java.math.BigInteger;

import org.cirjson.core.cirjson.CirJsonWriteContext;
import org.cirjson.core.cirjson.CirJsonWriteFeature;
import org.cirjson.core.cirjson.DuplicateDetector;
import org.cirjson.core.cirjson.IDHolder;
import org.cirjson.core.exception.StreamWriteException;
import org.cirjson.core.io.IOContext;
import org.cirjson.util.Base64Variant;
import org.cirjson.util.Base64Variants;

/**
 * <p>Writes CirJSON content token by token.</p>
 * <p>The generator tracks the container nesting in a {@link CirJsonWriteContext}; every
 * write is checked against it before any output is produced, so that calls out of place,
 * such as a value where a property name is due, fail with a {@link StreamWriteException}.
 * The identity of objects and arrays is written with {@link #writeObjectId(Object)} and
 * {@link #writeArrayId(Object)}, using the ids of the generator's {@link IDHolder}.</p>
 */
public abstract class CirJsonGenerator implements Closeable, Flushable
{
    protected static final String WRITE_BINARY = "write a binary value";
    protected static final String WRITE_BOOLEAN = "write a boolean value";
    protected static final String WRITE_NULL = "write a null";
    protected static final String WRITE_NUMBER = "write a number";
    protected static final String WRITE_RAW = "write a raw (unencoded) value";
    protected static final String WRITE_STRING = "write a string";
    protected static final String WRITE_START_ARRAY = "start an array";
    protected static final String WRITE_START_OBJECT = "start an object";

    protected final IOContext _ioContext;
    protected final StreamWriteConstraints _streamWriteConstraints;
    protected final int _streamWriteFeatures;
    protected final int _formatWriteFeatures;
    protected final IDHolder _idHolder = new IDHolder();
    protected CirJsonWriteContext _writeContext;
    protected boolean _closed;

    protected CirJsonGenerator(IOContext ioContext, int streamWriteFeatures, int formatWriteFeatures)
    {
        _ioContext = ioContext;
        _streamWriteConstraints = ioContext.streamWriteConstraints();
        _streamWriteFeatures = streamWriteFeatures;
        _formatWriteFeatures = formatWriteFeatures;
        DuplicateDetector dups = StreamWriteFeature.STRICT_DUPLICATE_DETECTION.enabledIn(streamWriteFeatures) ? DuplicateDetector.rootDetector(this) : null;
        _writeContext = CirJsonWriteContext.createRootContext(dups);
    }

    public boolean isEnabled(StreamWriteFeature feature)
    {
        return feature.enabledIn(_streamWriteFeatures);
    }

    public boolean isEnabled(CirJsonWriteFeature feature)
    {
        return feature.enabledIn(_formatWriteFeatures);
    }

    public StreamWriteConstraints streamWriteConstraints()
    {
        return _streamWriteConstraints;
    }

    public CirJsonWriteContext streamWriteContext()
    {
        return _writeContext;
    }

    public Object currentValue()
    {
        return _writeContext.currentValue();
    }

    public void assignCurrentValue(Object value)
    {
        _writeContext.assignCurrentValue(value);
    }

    public IDHolder getIDHolder()
    {
        return _idHolder;
    }

    /**
     * @param referenced the value an object or array is written for
     * @param isArray whether the value is written as an array
     * @return the id of the value
     * @throws StreamWriteException if the value was written as the other kind of container
     */
    public String getID(Object referenced, boolean isArray)
    {
        try
        {
            return _idHolder.getID(referenced, isArray);
        }
        catch (IllegalStateException x)
        {
            throw new StreamWriteException(this, x.getMessage(), x);
        }
    }

    public boolean isClosed()
    {
        return _closed;
    }

    /**
     * @return the number of chars or bytes written but not yet passed to the output target
     */
    public abstract int getOutputBuffered();

    public CirJsonGenerator writeStartArray()
    {
        return writeStartArray(null);
    }

    /**
     * @param currentValue the value the array is written for, kept as the current value of its context
     */
    public abstract CirJsonGenerator writeStartArray(Object currentValue);

    public abstract CirJsonGenerator writeEndArray();

    public CirJsonGenerator writeStartObject()
    {
        return writeStartObject(null);
    }

    /**
     * @param currentValue the value the object is written for, kept as the current value of its context
     */
    public abstract CirJsonGenerator writeStartObject(Object currentValue);

    public abstract CirJsonGenerator writeEndObject();

    public abstract CirJsonGenerator writeName(String name);

    /**
     * Writes the identity property of an object: the name {@value CirJsonToken#CIRJSON_ID_NAME}
     * and the id of the referenced value as a string. Allowed only as the first entry of an object.
     *
     * @param referenced the value the object is written for
     */
    public CirJsonGenerator writeObjectId(Object referenced)
    {
        CirJsonWriteContext context = _writeContext;
        if (!context.inObject() || context.getEntryCount() > 0 || context.hasPendingName())
            throw new StreamWriteException(this, "Can not write an object id, expecting it as the first property of an Object (context: " + context.typeDescription() + ")");
        try
        {
            _idHolder.verifyKind(referenced, false);
        }
        catch (IllegalStateException x)
        {
            throw new StreamWriteException(this, x.getMessage(), x);
        }
        // The id is taken only once its name was written.
        writeName(CirJsonToken.CIRJSON_ID_NAME);
        return writeString(getID(referenced, false));
    }

    /**
     * Writes the identity of an array: the id of the referenced value as a string.
     * Allowed only as the first element of an array.
     *
     * @param referenced the value the array is written for
     */
    public CirJsonGenerator writeArrayId(Object referenced)
    {
        CirJsonWriteContext context = _writeContext;
        if (!context.inArray() || context.getEntryCount() > 0)
            throw new StreamWriteException(this, "Can not write an array id, expecting it as the first element of an Array (context: " + context.typeDescription() + ")");
        return writeString(getID(referenced, true));
    }

    public abstract CirJsonGenerator writeString(String text);

    public abstract CirJsonGenerator writeString(char[] text, int offset, int length);

    public abstract CirJsonGenerator writeNumber(short value);

    public abstract CirJsonGenerator writeNumber(int value);

    public abstract CirJsonGenerator writeNumber(long value);

    public abstract CirJsonGenerator writeNumber(BigInteger value);

    public abstract CirJsonGenerator writeNumber(double value);

    public abstract CirJsonGenerator writeNumber(float value);

    public abstract CirJsonGenerator writeNumber(BigDecimal value);

    /**
     * Writes a number given as text, as is.
     *
     * @param encodedValue the textual representation of the number
     */
    public abstract CirJsonGenerator writeNumber(String encodedValue);

    public abstract CirJsonGenerator writeBoolean(boolean state);

    public abstract CirJsonGenerator writeNull();

    /**
     * Writes bytes as a Base64 encoded string.
     */
    public abstract CirJsonGenerator writeBinary(Base64Variant variant, byte[] data, int offset, int length);

    public CirJsonGenerator writeBinary(byte[] data, int offset, int length)
    {
        return writeBinary(Base64Variants.getDefaultVariant(), data, offset, length);
    }

    public CirJsonGenerator writeBinary(byte[] data)
    {
        return writeBinary(Base64Variants.getDefaultVariant(), data, 0, data.length);
    }

    /**
     * Writes text as a value, without any escaping or validation of its content.
     */
    public abstract CirJsonGenerator writeRawValue(String text);

    /**
     * Writes text as is, outside of the context checks.
     */
    public abstract CirJsonGenerator writeRaw(String text);

    public abstract CirJsonGenerator writeRaw(char c);

    public CirJsonGenerator writeStringProperty(String name, String value)
    {
        writeName(name);
        return writeString(value);
    }

    public CirJsonGenerator writeBooleanProperty(String name, boolean value)
    {
        writeName(name);
        return writeBoolean(value);
    }

    public CirJsonGenerator writeNullProperty(String name)
    {
        writeName(name);
        return writeNull();
    }

    public CirJsonGenerator writeNumberProperty(String name, int value)
    {
        writeName(name);
        return writeNumber(value);
    }

    public CirJsonGenerator writeNumberProperty(String name, long value)
    {
        writeName(name);
        return writeNumber(value);
    }

    public CirJsonGenerator writeNumberProperty(String name, double value)
    {
        writeName(name);
        return writeNumber(value);
    }

    public CirJsonGenerator writeNumberProperty(String name, BigDecimal value)
    {
        writeName(name);
        return writeNumber(value);
    }

    public CirJsonGenerator writeArrayPropertyStart(String name)
    {
        writeName(name);
        return writeStartArray();
    }

    public CirJsonGenerator writeObjectPropertyStart(String name)
    {
        writeName(name);
        return writeStartObject();
    }

    /**
     * Writes the current token of a parser.
     *
     * @param parser the parser positioned on the token
     * @throws StreamWriteException if the parser has no current token
     */
    public void copyCurrentEvent(CirJsonParser parser)
    {
        CirJsonToken t = parser.currentToken();
        if (t == null || t == CirJsonToken.NOT_AVAILABLE)
            throw new StreamWriteException(this, "No current event to copy: " + t);
        switch (t)
        {
            case START_OBJECT:
                writeStartObject();
                break;
            case END_OBJECT:
                writeEndObject();
                break;
            case START_ARRAY:
                writeStartArray();
                break;
            case END_ARRAY:
                writeEndArray();
                break;
            case CIRJSON_ID_PROPERTY_NAME:
            case PROPERTY_NAME:
                writeName(parser.currentName());
                break;
            case VALUE_STRING:
                if (parser.hasTextCharacters())
                    writeString(parser.getTextCharacters(), parser.getTextOffset(), parser.getTextLength());
                else
                    writeString(parser.getText());
                break;
            case VALUE_NUMBER_INT:
                copyInteger(parser);
                break;
            case VALUE_NUMBER_FLOAT:
                copyFloat(parser);
                break;
            case VALUE_TRUE:
                writeBoolean(true);
                break;
            case VALUE_FALSE:
                writeBoolean(false);
                break;
            case VALUE_NULL:
                writeNull();
                break;
            default:
                throw new StreamWriteException(this, "Can not copy token " + t);
        }
    }

    private void copyInteger(CirJsonParser parser)
    {
        switch (parser.getNumberType())
        {
            case INT:
                writeNumber(parser.getIntValue());
                break;
            case LONG:
                writeNumber(parser.getLongValue());
                break;
            default:
                writeNumber(parser.getBigIntegerValue());
                break;
        }
    }

    private void copyFloat(CirJsonParser parser)
    {
        if (parser.isNaN())
        {
            writeNumber(parser.getDoubleValue());
            return;
        }
        // The text is copied as is, so no precision is lost.
        writeNumber(parser.getText());
    }

    /**
     * Writes the current token of a parser and, if it starts a container, everything up to
     * the matching end token, leaving the parser on that end token. On a property name, the
     * name and its value are copied.
     *
     * @param parser the parser positioned on the first token to copy
     */
    public void copyCurrentStructure(CirJsonParser parser)
    {
        CirJsonToken t = parser.currentToken();
        if (t != null && t.isPropertyName())
        {
            writeName(parser.currentName());
            t = parser.nextToken();
        }
        if (t == null || t == CirJsonToken.NOT_AVAILABLE)
            throw new StreamWriteException(this, "No current event to copy: " + t);
        copyCurrentEvent(parser);
        if (!t.isStructStart())
            return;
        int depth = 1;
        while (depth > 0)
        {
            t = parser.nextToken();
            if (t == null || t == CirJsonToken.NOT_AVAILABLE)
                throw new StreamWriteException(this, "Unexpected end of content while copying a structure: " + t);
            copyCurrentEvent(parser);
            if (t.isStructStart())
                ++depth;
            else if (t.isStructEnd())
                --depth;
        }
    }

    /**
     * Checks that a value may be written in the current context.
     *
     * @param typeMessage what is being written, for the error message
     * @return the separator status, one of the {@code STATUS_OK_} constants of {@link CirJsonWriteContext}
     * @throws StreamWriteException if a property name is due
     */
    protected int verifyValueWrite(String typeMessage)
    {
        int status = _writeContext.writeValue();
        if (status == CirJsonWriteContext.STATUS_EXPECT_NAME)
            throw new StreamWriteException(this, "Can not " + typeMessage + ", expecting a property name (context: " + _writeContext.typeDescription() + ")");
        return status;
    }

    @Override
    public abstract void flush();

    /**
     * Closes the generator: writes the end markers of the open containers if
     * {@link StreamWriteFeature#AUTO_CLOSE_CONTENT} is enabled, flushes, closes the output
     * target if configured to, and releases the buffers. Closing twice does nothing.
     */
    @Override
    public abstract void close();

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s,closed=%b]", getClass().getSimpleName(), hashCode(), _writeContext, _closed);
    }
}
