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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;

import org.cirjson.core.CirJsonGenerator;
import org.cirjson.core.StreamWriteFeature;
import org.cirjson.core.exception.StreamWriteException;
import org.cirjson.core.exception.WrappedIOException;
import org.cirjson.core.io.IOContext;
import org.cirjson.util.Base64Variant;
import org.cirjson.util.CharTypes;
import org.cirjson.util.NumberOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>The text generation shared by the char and byte generators: context checks,
 * separators, escaping, number and literal formatting, and the close sequence.</p>
 * <p>Separators are written lazily: the comma, colon or root value separator that precedes
 * a value is written with the value, once the write context accepted it.</p>
 * <p>Subclasses own the output buffer and the target, and implement the char level writes.</p>
 */
public abstract class CirJsonGeneratorImpl extends CirJsonGenerator
{
    private static final Logger LOG = LoggerFactory.getLogger(CirJsonGeneratorImpl.class);

    /**
     * The largest absolute scale of a {@link BigDecimal} written in plain notation.
     */
    public static final int MAX_BIG_DECIMAL_SCALE = 9999;

    protected static final String NULL_TEXT = "null";
    protected static final String TRUE_TEXT = "true";
    protected static final String FALSE_TEXT = "false";

    protected final String _rootValueSeparator;
    protected final int[] _outputEscapes;
    protected final boolean _escapeNonAscii;
    protected final boolean _hexUpperCase;

    protected CirJsonGeneratorImpl(IOContext ioContext, int streamWriteFeatures, int formatWriteFeatures, String rootValueSeparator)
    {
        super(ioContext, streamWriteFeatures, formatWriteFeatures);
        _rootValueSeparator = rootValueSeparator;
        int[] escapes = CharTypes.get7BitOutputEscapes();
        if (CirJsonWriteFeature.ESCAPE_FORWARD_SLASHES.enabledIn(formatWriteFeatures))
            escapes['/'] = '/';
        _outputEscapes = escapes;
        _escapeNonAscii = CirJsonWriteFeature.ESCAPE_NON_ASCII.enabledIn(formatWriteFeatures);
        _hexUpperCase = CirJsonWriteFeature.WRITE_HEX_UPPER_CASE.enabledIn(formatWriteFeatures);
    }

    /**
     * Writes one char of output, encoding it as the target requires.
     */
    protected abstract void writeChar(char c);

    /**
     * Writes text as is, without escaping.
     */
    protected abstract void writeRawText(String text);

    protected abstract void writeIntDigits(int value);

    protected abstract void writeLongDigits(long value);

    /**
     * Passes the buffered output to the target.
     */
    protected abstract void flushBuffer();

    /**
     * Flushes the target itself, if there still is one.
     */
    protected abstract void flushTarget() throws IOException;

    /**
     * Closes the target if it is managed or {@link StreamWriteFeature#AUTO_CLOSE_TARGET} is
     * enabled, otherwise flushes it if {@link StreamWriteFeature#FLUSH_PASSED_TO_STREAM} is enabled.
     */
    protected abstract void closeTarget() throws IOException;

    /**
     * Returns the output buffer to the recycler, drops the target and closes the {@link IOContext}.
     */
    protected abstract void releaseBuffers();

    @Override
    public CirJsonGenerator writeStartArray(Object currentValue)
    {
        int status = verifyValueWrite(WRITE_START_ARRAY);
        _streamWriteConstraints.validateNestingDepth(_writeContext.getNestingDepth() + 1);
        writeSeparator(status);
        _writeContext = _writeContext.createChildArrayContext(currentValue);
        writeChar('[');
        return this;
    }

    @Override
    public CirJsonGenerator writeEndArray()
    {
        if (!_writeContext.inArray())
            throw new StreamWriteException(this, "Current context not Array but " + _writeContext.typeDescription());
        writeChar(']');
        _writeContext = _writeContext.clearAndGetParent();
        return this;
    }

    @Override
    public CirJsonGenerator writeStartObject(Object currentValue)
    {
        int status = verifyValueWrite(WRITE_START_OBJECT);
        _streamWriteConstraints.validateNestingDepth(_writeContext.getNestingDepth() + 1);
        writeSeparator(status);
        _writeContext = _writeContext.createChildObjectContext(currentValue);
        writeChar('{');
        return this;
    }

    @Override
    public CirJsonGenerator writeEndObject()
    {
        if (!_writeContext.inObject())
            throw new StreamWriteException(this, "Current context not Object but " + _writeContext.typeDescription());
        if (_writeContext.hasPendingName())
            throw new StreamWriteException(this, "Can not write end of Object, expecting a value for property '" + _writeContext.currentName() + "'");
        writeChar('}');
        _writeContext = _writeContext.clearAndGetParent();
        return this;
    }

    @Override
    public CirJsonGenerator writeName(String name)
    {
        int status = _writeContext.writeName(name);
        if (status == CirJsonWriteContext.STATUS_EXPECT_VALUE)
            throw new StreamWriteException(this, "Can not write a property name, expecting a value");
        if (status == CirJsonWriteContext.STATUS_OK_AFTER_COMMA)
            writeChar(',');
        if (isEnabled(CirJsonWriteFeature.QUOTE_PROPERTY_NAMES))
        {
            writeChar('"');
            writeEscaped(name);
            writeChar('"');
        }
        else
        {
            writeEscaped(name);
        }
        return this;
    }

    @Override
    public CirJsonGenerator writeString(String text)
    {
        int status = verifyValueWrite(WRITE_STRING);
        writeSeparator(status);
        if (text == null)
        {
            writeRawText(NULL_TEXT);
            return this;
        }
        writeChar('"');
        writeEscaped(text);
        writeChar('"');
        return this;
    }

    @Override
    public CirJsonGenerator writeString(char[] text, int offset, int length)
    {
        int status = verifyValueWrite(WRITE_STRING);
        writeSeparator(status);
        writeChar('"');
        for (int i = offset, end = offset + length; i < end; ++i)
        {
            writeEscaped(text[i]);
        }
        writeChar('"');
        return this;
    }

    @Override
    public CirJsonGenerator writeNumber(short value)
    {
        return writeNumber((int)value);
    }

    @Override
    public CirJsonGenerator writeNumber(int value)
    {
        int status = verifyValueWrite(WRITE_NUMBER);
        writeSeparator(status);
        boolean quoted = isEnabled(CirJsonWriteFeature.WRITE_NUMBERS_AS_STRINGS);
        if (quoted)
            writeChar('"');
        writeIntDigits(value);
        if (quoted)
            writeChar('"');
        return this;
    }

    @Override
    public CirJsonGenerator writeNumber(long value)
    {
        int status = verifyValueWrite(WRITE_NUMBER);
        writeSeparator(status);
        boolean quoted = isEnabled(CirJsonWriteFeature.WRITE_NUMBERS_AS_STRINGS);
        if (quoted)
            writeChar('"');
        writeLongDigits(value);
        if (quoted)
            writeChar('"');
        return this;
    }

    @Override
    public CirJsonGenerator writeNumber(BigInteger value)
    {
        if (value == null)
            return writeNull();
        return writeNumberText(value.toString(), isEnabled(CirJsonWriteFeature.WRITE_NUMBERS_AS_STRINGS));
    }

    @Override
    public CirJsonGenerator writeNumber(double value)
    {
        boolean quoted = isEnabled(CirJsonWriteFeature.WRITE_NUMBERS_AS_STRINGS) ||
            (NumberOutput.notFinite(value) && isEnabled(CirJsonWriteFeature.WRITE_NAN_AS_STRINGS));
        return writeNumberText(NumberOutput.toString(value), quoted);
    }

    @Override
    public CirJsonGenerator writeNumber(float value)
    {
        boolean quoted = isEnabled(CirJsonWriteFeature.WRITE_NUMBERS_AS_STRINGS) ||
            (NumberOutput.notFinite(value) && isEnabled(CirJsonWriteFeature.WRITE_NAN_AS_STRINGS));
        return writeNumberText(NumberOutput.toString(value), quoted);
    }

    @Override
    public CirJsonGenerator writeNumber(BigDecimal value)
    {
        if (value == null)
            return writeNull();
        return writeNumberText(bigDecimalText(value), isEnabled(CirJsonWriteFeature.WRITE_NUMBERS_AS_STRINGS));
    }

    @Override
    public CirJsonGenerator writeNumber(String encodedValue)
    {
        if (encodedValue == null)
            return writeNull();
        return writeNumberText(encodedValue, isEnabled(CirJsonWriteFeature.WRITE_NUMBERS_AS_STRINGS));
    }

    private CirJsonGenerator writeNumberText(String text, boolean quoted)
    {
        int status = verifyValueWrite(WRITE_NUMBER);
        writeSeparator(status);
        if (quoted)
            writeChar('"');
        writeRawText(text);
        if (quoted)
            writeChar('"');
        return this;
    }

    private String bigDecimalText(BigDecimal value)
    {
        if (!isEnabled(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN))
            return value.toString();
        int scale = value.scale();
        if (scale < -MAX_BIG_DECIMAL_SCALE || scale > MAX_BIG_DECIMAL_SCALE)
            throw new StreamWriteException(this, String.format(
                "Attempt to write plain `java.math.BigDecimal` (see StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN) with illegal scale (%d): needs to be between [-%d, %d]",
                scale, MAX_BIG_DECIMAL_SCALE, MAX_BIG_DECIMAL_SCALE));
        return value.toPlainString();
    }

    @Override
    public CirJsonGenerator writeBoolean(boolean state)
    {
        int status = verifyValueWrite(WRITE_BOOLEAN);
        writeSeparator(status);
        writeRawText(state ? TRUE_TEXT : FALSE_TEXT);
        return this;
    }

    @Override
    public CirJsonGenerator writeNull()
    {
        int status = verifyValueWrite(WRITE_NULL);
        writeSeparator(status);
        writeRawText(NULL_TEXT);
        return this;
    }

    @Override
    public CirJsonGenerator writeBinary(Base64Variant variant, byte[] data, int offset, int length)
    {
        if (offset < 0 || length < 0 || offset > data.length - length)
            throw new StreamWriteException(this, String.format("Invalid 'offset' (%d) and/or 'len' (%d) arguments for `byte[]` of length %d", offset, length, data.length));
        int status = verifyValueWrite(WRITE_BINARY);
        writeSeparator(status);
        byte[] bytes = offset == 0 && length == data.length ? data : Arrays.copyOfRange(data, offset, offset + length);
        writeRawText(variant.encode(bytes, true));
        return this;
    }

    @Override
    public CirJsonGenerator writeRawValue(String text)
    {
        int status = verifyValueWrite(WRITE_RAW);
        writeSeparator(status);
        writeRawText(text);
        return this;
    }

    @Override
    public CirJsonGenerator writeRaw(String text)
    {
        writeRawText(text);
        return this;
    }

    @Override
    public CirJsonGenerator writeRaw(char c)
    {
        writeChar(c);
        return this;
    }

    private void writeSeparator(int status)
    {
        switch (status)
        {
            case CirJsonWriteContext.STATUS_OK_AFTER_COMMA:
                writeChar(',');
                break;
            case CirJsonWriteContext.STATUS_OK_AFTER_COLON:
                writeChar(':');
                break;
            case CirJsonWriteContext.STATUS_OK_AFTER_SPACE:
                if (_rootValueSeparator != null)
                    writeRawText(_rootValueSeparator);
                break;
            default:
                break;
        }
    }

    private void writeEscaped(String text)
    {
        for (int i = 0, length = text.length(); i < length; ++i)
        {
            writeEscaped(text.charAt(i));
        }
    }

    private void writeEscaped(char c)
    {
        int[] escapes = _outputEscapes;
        if (c < escapes.length)
        {
            int escape = escapes[c];
            if (escape == 0)
            {
                writeChar(c);
            }
            else if (escape == CharTypes.ESCAPE_STANDARD)
            {
                writeUnicodeEscape(c);
            }
            else
            {
                writeChar('\\');
                writeChar((char)escape);
            }
        }
        else if (_escapeNonAscii)
        {
            writeUnicodeEscape(c);
        }
        else
        {
            writeChar(c);
        }
    }

    private void writeUnicodeEscape(char c)
    {
        writeChar('\\');
        writeChar('u');
        writeChar(CharTypes.hexDigit(c >> 12, _hexUpperCase));
        writeChar(CharTypes.hexDigit(c >> 8, _hexUpperCase));
        writeChar(CharTypes.hexDigit(c >> 4, _hexUpperCase));
        writeChar(CharTypes.hexDigit(c, _hexUpperCase));
    }

    @Override
    public void flush()
    {
        flushBuffer();
        if (isEnabled(StreamWriteFeature.FLUSH_PASSED_TO_STREAM))
        {
            try
            {
                flushTarget();
            }
            catch (IOException x)
            {
                throw new WrappedIOException(this, x);
            }
        }
    }

    @Override
    public void close()
    {
        if (_closed)
            return;
        if (LOG.isDebugEnabled())
            LOG.debug("Closing {}", this);
        try
        {
            RuntimeException failure = null;
            try
            {
                if (isEnabled(StreamWriteFeature.AUTO_CLOSE_CONTENT))
                    closeContent();
            }
            catch (RuntimeException x)
            {
                failure = x;
            }
            // Whatever was written before a failure still reaches the target.
            try
            {
                flushBuffer();
            }
            catch (RuntimeException x)
            {
                failure = addFailure(failure, x);
            }
            try
            {
                closeTarget();
            }
            catch (IOException x)
            {
                failure = addFailure(failure, new WrappedIOException(this, x));
            }
            catch (RuntimeException x)
            {
                failure = addFailure(failure, x);
            }
            if (failure != null)
                throw failure;
        }
        finally
        {
            _closed = true;
            releaseBuffers();
        }
    }

    private static RuntimeException addFailure(RuntimeException failure, RuntimeException x)
    {
        if (failure == null)
            return x;
        if (failure != x)
            failure.addSuppressed(x);
        LOG.trace("IGNORED", x);
        return failure;
    }

    private void closeContent()
    {
        while (true)
        {
            CirJsonWriteContext context = _writeContext;
            if (context.inArray())
                writeEndArray();
            else if (context.inObject())
                writeEndObject();
            else
                break;
        }
    }
}
