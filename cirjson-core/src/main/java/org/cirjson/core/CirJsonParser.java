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
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;

import org.cirjson.core.async.NonBlockingInputFeeder;
import org.cirjson.core.cirjson.CirJsonReadFeature;
import org.cirjson.core.exception.InputCoercionException;
import org.cirjson.core.exception.StreamReadException;
import org.cirjson.util.Base64Variant;
import org.cirjson.util.Base64Variants;
import org.cirjson.util.NumberInput;

/**
 * <p>A pull parser of CirJSON content.</p>
 * <p>Each call to {@link #nextToken()} advances to the next {@link CirJsonToken}; the
 * text and value accessors describe the current token and are valid until the next call.
 * Blocking parsers return {@code null} once the input is exhausted. Non-blocking parsers,
 * obtained from {@code CirJsonFactory.createNonBlockingByteArrayParser()} and similar,
 * return {@link CirJsonToken#NOT_AVAILABLE} when more input is needed.</p>
 * <p>Every object must start with the {@code __cirJsonId__} property, reported as
 * {@link CirJsonToken#CIRJSON_ID_PROPERTY_NAME}; every array starts with its identity
 * string, reported as an ordinary {@link CirJsonToken#VALUE_STRING}.</p>
 * <p>Parsers are not thread-safe.</p>
 */
public abstract class CirJsonParser implements Closeable
{
    /**
     * The Java types a number value may be represented as.
     */
    public enum NumberType
    {
        INT, LONG, BIG_INTEGER, FLOAT, DOUBLE, BIG_DECIMAL
    }

    protected int _streamReadFeatures;
    protected int _formatReadFeatures;

    protected CirJsonParser(int streamReadFeatures, int formatReadFeatures)
    {
        _streamReadFeatures = streamReadFeatures;
        _formatReadFeatures = formatReadFeatures;
    }

    public boolean isEnabled(StreamReadFeature feature)
    {
        return feature.enabledIn(_streamReadFeatures);
    }

    public boolean isEnabled(CirJsonReadFeature feature)
    {
        return feature.enabledIn(_formatReadFeatures);
    }

    public abstract StreamReadConstraints streamReadConstraints();

    /**
     * @return the name of the identity property of objects
     */
    public String getIdName()
    {
        return CirJsonToken.CIRJSON_ID_NAME;
    }

    /**
     * @return the feeder to push input to a non-blocking parser, or null for blocking parsers
     */
    public NonBlockingInputFeeder getNonBlockingInputFeeder()
    {
        return null;
    }

    /**
     * Writes the input read but not yet processed to the given stream.
     *
     * @param out the stream to write to
     * @return the number of bytes written, or -1 if not supported
     */
    public int releaseBuffered(OutputStream out)
    {
        return -1;
    }

    /**
     * Advances to the next token.
     *
     * @return the next token, {@link CirJsonToken#NOT_AVAILABLE} if a non-blocking parser needs
     * more input, or null at the end of input
     * @throws StreamReadException if the input is not valid
     */
    public abstract CirJsonToken nextToken();

    /**
     * Skips to the end of the container that the current start token opens.
     * Does nothing if the current token is not {@link CirJsonToken#START_OBJECT} or
     * {@link CirJsonToken#START_ARRAY}.
     *
     * @return this parser
     */
    public abstract CirJsonParser skipChildren();

    /**
     * Completes the current token, if it was left incomplete. Parsers that complete
     * tokens eagerly do nothing.
     */
    public void finishToken()
    {
    }

    public abstract CirJsonToken currentToken();

    public int currentTokenId()
    {
        CirJsonToken t = currentToken();
        return t == null ? CirJsonTokenId.ID_NO_TOKEN : t.id();
    }

    public boolean hasCurrentToken()
    {
        return currentToken() != null;
    }

    public boolean hasToken(CirJsonToken t)
    {
        return currentToken() == t;
    }

    public boolean hasTokenId(int id)
    {
        return currentTokenId() == id;
    }

    public boolean isExpectedStartArrayToken()
    {
        return currentToken() == CirJsonToken.START_ARRAY;
    }

    public boolean isExpectedStartObjectToken()
    {
        return currentToken() == CirJsonToken.START_OBJECT;
    }

    public boolean isExpectedNumberIntToken()
    {
        return currentToken() == CirJsonToken.VALUE_NUMBER_INT;
    }

    /**
     * @return whether the current token is a floating point NaN or infinity
     */
    public boolean isNaN()
    {
        return false;
    }

    /**
     * Forgets the current token, remembering it as the last cleared token.
     */
    public abstract void clearCurrentToken();

    public abstract CirJsonToken getLastClearedToken();

    /**
     * @return the current property name while on a name or a value within an object,
     * or the name of the container while on its start token
     */
    public abstract String currentName();

    public abstract TokenStreamContext streamReadContext();

    /**
     * @return the location after the last input processed
     */
    public abstract CirJsonLocation currentLocation();

    /**
     * @return the location of the first char of the current token
     */
    public abstract CirJsonLocation currentTokenLocation();

    public abstract Object currentValue();

    public abstract void assignCurrentValue(Object value);

    public abstract boolean isClosed();

    /**
     * Closes this parser, releasing its buffers. Closing more than once has no effect.
     */
    @Override
    public abstract void close();

    /**
     * Advances and returns the property name if the next token is a name.
     *
     * @return the property name, or null if the next token is not a name
     */
    public String nextName()
    {
        CirJsonToken t = nextToken();
        return t != null && t.isPropertyName() ? currentName() : null;
    }

    /**
     * Advances and returns the string value if the next token is a string.
     *
     * @return the string value, or null if the next token is not a string
     */
    public String nextTextValue()
    {
        return nextToken() == CirJsonToken.VALUE_STRING ? getText() : null;
    }

    /**
     * @return the text of the current token, or null if there is none
     */
    public abstract String getText();

    public abstract char[] getTextCharacters();

    public abstract int getTextLength();

    public abstract int getTextOffset();

    public abstract boolean hasTextCharacters();

    public abstract Number getNumberValue();

    public abstract NumberType getNumberType();

    public abstract int getIntValue();

    public abstract long getLongValue();

    public abstract BigInteger getBigIntegerValue();

    public abstract float getFloatValue();

    public abstract double getDoubleValue();

    public abstract BigDecimal getDecimalValue();

    /**
     * @return the current integer value as a byte
     * @throws InputCoercionException if the value is outside the byte range
     */
    public abstract byte getByteValue();

    /**
     * @return the current integer value as a short
     * @throws InputCoercionException if the value is outside the short range
     */
    public abstract short getShortValue();

    public boolean getBooleanValue()
    {
        CirJsonToken t = currentToken();
        if (t == CirJsonToken.VALUE_TRUE)
            return true;
        if (t == CirJsonToken.VALUE_FALSE)
            return false;
        throw constructReadException(String.format("Current token (%s) not of boolean type", t));
    }

    /**
     * Decodes the current string value as Base64.
     *
     * @param variant the Base64 variant to decode with
     * @return the decoded bytes
     */
    public abstract byte[] getBinaryValue(Base64Variant variant);

    public byte[] getBinaryValue()
    {
        return getBinaryValue(Base64Variants.getDefaultVariant());
    }

    public String getValueAsString()
    {
        return getValueAsString(null);
    }

    /**
     * @return the text of a scalar value or a property name, or the default for
     * null, containers and the end of input
     */
    public String getValueAsString(String defaultValue)
    {
        CirJsonToken t = currentToken();
        if (t == CirJsonToken.VALUE_STRING)
            return getText();
        if (t == null || t == CirJsonToken.VALUE_NULL || !t.isScalarValue())
        {
            if (t != null && t.isPropertyName())
                return currentName();
            return defaultValue;
        }
        return getText();
    }

    public int getValueAsInt()
    {
        return getValueAsInt(0);
    }

    /**
     * @return the current value converted to int if possible, or the default
     */
    public int getValueAsInt(int defaultValue)
    {
        CirJsonToken t = currentToken();
        if (t == null)
            return defaultValue;
        switch (t.id())
        {
            case CirJsonTokenId.ID_NUMBER_INT:
            case CirJsonTokenId.ID_NUMBER_FLOAT:
                return getIntValue();
            case CirJsonTokenId.ID_TRUE:
                return 1;
            case CirJsonTokenId.ID_FALSE:
            case CirJsonTokenId.ID_NULL:
                return 0;
            case CirJsonTokenId.ID_STRING:
                return NumberInput.parseAsInt(getText(), defaultValue);
            default:
                return defaultValue;
        }
    }

    public long getValueAsLong()
    {
        return getValueAsLong(0L);
    }

    public long getValueAsLong(long defaultValue)
    {
        CirJsonToken t = currentToken();
        if (t == null)
            return defaultValue;
        switch (t.id())
        {
            case CirJsonTokenId.ID_NUMBER_INT:
            case CirJsonTokenId.ID_NUMBER_FLOAT:
                return getLongValue();
            case CirJsonTokenId.ID_TRUE:
                return 1L;
            case CirJsonTokenId.ID_FALSE:
            case CirJsonTokenId.ID_NULL:
                return 0L;
            case CirJsonTokenId.ID_STRING:
                return NumberInput.parseAsLong(getText(), defaultValue);
            default:
                return defaultValue;
        }
    }

    public double getValueAsDouble()
    {
        return getValueAsDouble(0.0);
    }

    public double getValueAsDouble(double defaultValue)
    {
        CirJsonToken t = currentToken();
        if (t == null)
            return defaultValue;
        switch (t.id())
        {
            case CirJsonTokenId.ID_NUMBER_INT:
            case CirJsonTokenId.ID_NUMBER_FLOAT:
                return getDoubleValue();
            case CirJsonTokenId.ID_TRUE:
                return 1.0;
            case CirJsonTokenId.ID_FALSE:
            case CirJsonTokenId.ID_NULL:
                return 0.0;
            case CirJsonTokenId.ID_STRING:
                return NumberInput.parseAsDouble(getText(), defaultValue);
            default:
                return defaultValue;
        }
    }

    public boolean getValueAsBoolean()
    {
        return getValueAsBoolean(false);
    }

    public boolean getValueAsBoolean(boolean defaultValue)
    {
        CirJsonToken t = currentToken();
        if (t == null)
            return defaultValue;
        switch (t.id())
        {
            case CirJsonTokenId.ID_TRUE:
                return true;
            case CirJsonTokenId.ID_FALSE:
            case CirJsonTokenId.ID_NULL:
                return false;
            case CirJsonTokenId.ID_NUMBER_INT:
                return getIntValue() != 0;
            case CirJsonTokenId.ID_STRING:
                String text = getText().trim();
                if ("true".equals(text))
                    return true;
                if ("false".equals(text) || "null".equals(text))
                    return false;
                return defaultValue;
            default:
                return defaultValue;
        }
    }

    /**
     * @param message the message
     * @return an exception for this parser at its current location
     */
    protected StreamReadException constructReadException(String message)
    {
        return new StreamReadException(this, message);
    }
}
