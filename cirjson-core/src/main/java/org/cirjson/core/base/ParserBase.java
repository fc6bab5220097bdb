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

package org.cirjson.core.base;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;

import org.cirjson.core.CirJsonLocation;
import org.cirjson.core.CirJsonParser;
import org.cirjson.core.CirJsonToken;
import org.cirjson.core.CirJsonTokenId;
import org.cirjson.core.StreamReadConstraints;
import org.cirjson.core.StreamReadFeature;
import org.cirjson.core.cirjson.CirJsonReadContext;
import org.cirjson.core.cirjson.CirJsonReadFeature;
import org.cirjson.core.cirjson.DuplicateDetector;
import org.cirjson.core.exception.InputCoercionException;
import org.cirjson.core.exception.StreamReadException;
import org.cirjson.core.exception.WrappedIOException;
import org.cirjson.core.io.IOContext;
import org.cirjson.util.Base64Variant;
import org.cirjson.util.ByteArrayBuilder;
import org.cirjson.util.CharTypes;
import org.cirjson.util.NumberInput;
import org.cirjson.util.TextBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>The state shared by the CirJSON parsers: the current token, the read context,
 * the input position and row counters, the text buffer and the lazily converted number
 * value of the current token.</p>
 * <p>Number tokens are kept as text until a value accessor asks for them. Integers are
 * then converted to the smallest of int, long and {@link BigInteger} that holds them;
 * floating point numbers to the requested type. Narrowing conversions check the range
 * and fail with {@link InputCoercionException} rather than wrap around.</p>
 */
public abstract class ParserBase extends CirJsonParser
{
    private static final Logger LOG = LoggerFactory.getLogger(ParserBase.class);

    protected static final int NR_UNKNOWN = 0;
    protected static final int NR_INT = 0x0001;
    protected static final int NR_LONG = 0x0002;
    protected static final int NR_BIGINT = 0x0004;
    protected static final int NR_DOUBLE = 0x0008;
    protected static final int NR_BIGDECIMAL = 0x0010;
    protected static final int NR_FLOAT = 0x0020;

    static final BigInteger BI_MIN_INT = BigInteger.valueOf(Integer.MIN_VALUE);
    static final BigInteger BI_MAX_INT = BigInteger.valueOf(Integer.MAX_VALUE);
    static final BigInteger BI_MIN_LONG = BigInteger.valueOf(Long.MIN_VALUE);
    static final BigInteger BI_MAX_LONG = BigInteger.valueOf(Long.MAX_VALUE);
    static final BigDecimal BD_MIN_INT = new BigDecimal(BI_MIN_INT);
    static final BigDecimal BD_MAX_INT = new BigDecimal(BI_MAX_INT);
    static final BigDecimal BD_MIN_LONG = new BigDecimal(BI_MIN_LONG);
    static final BigDecimal BD_MAX_LONG = new BigDecimal(BI_MAX_LONG);

    // Longest number text included in error messages.
    private static final int MAX_ERROR_TOKEN_LENGTH = 256;

    protected final IOContext _ioContext;
    protected final StreamReadConstraints _streamReadConstraints;
    protected final TextBuffer _textBuffer;

    protected boolean _closed;

    protected CirJsonToken _currToken;
    protected CirJsonToken _lastClearedToken;

    protected CirJsonReadContext _parsingContext;

    /**
     * Index of the next char or byte to read in the input buffer.
     */
    protected int _inputPtr;

    /**
     * Index after the last valid char or byte in the input buffer.
     */
    protected int _inputEnd;

    /**
     * Number of chars or bytes in the buffers before the current one.
     */
    protected long _currInputProcessed;

    /**
     * Current row, starting from 1.
     */
    protected int _currInputRow = 1;

    /**
     * Index in the current buffer where the current row starts; may be negative
     * when the row started in an earlier buffer.
     */
    protected int _currInputRowStart;

    protected long _tokenInputTotal;
    protected int _tokenInputRow = 1;

    /**
     * Zero based column of the first char of the current token.
     */
    protected int _tokenInputCol;

    protected int _numTypesValid = NR_UNKNOWN;
    protected int _numberInt;
    protected long _numberLong;
    protected float _numberFloat;
    protected double _numberDouble;
    protected BigInteger _numberBigInt;
    protected BigDecimal _numberBigDecimal;

    protected boolean _numberNegative;
    protected int _intLength;
    protected int _fractLength;
    protected int _expLength;

    protected byte[] _binaryValue;
    protected ByteArrayBuilder _byteArrayBuilder;

    private char[] _nameChars;

    protected ParserBase(IOContext ioContext, int streamReadFeatures, int formatReadFeatures)
    {
        super(streamReadFeatures, formatReadFeatures);
        _ioContext = ioContext;
        _streamReadConstraints = ioContext.streamReadConstraints();
        _textBuffer = ioContext.constructTextBuffer();
        DuplicateDetector dups = StreamReadFeature.STRICT_DUPLICATE_DETECTION.enabledIn(streamReadFeatures) ? DuplicateDetector.rootDetector(this) : null;
        _parsingContext = CirJsonReadContext.createRootContext(dups);
    }

    public IOContext ioContext()
    {
        return _ioContext;
    }

    @Override
    public StreamReadConstraints streamReadConstraints()
    {
        return _streamReadConstraints;
    }

    @Override
    public CirJsonToken currentToken()
    {
        return _currToken;
    }

    @Override
    public int currentTokenId()
    {
        CirJsonToken t = _currToken;
        return t == null ? CirJsonTokenId.ID_NO_TOKEN : t.id();
    }

    @Override
    public void clearCurrentToken()
    {
        if (_currToken != null)
        {
            _lastClearedToken = _currToken;
            _currToken = null;
        }
    }

    @Override
    public CirJsonToken getLastClearedToken()
    {
        return _lastClearedToken;
    }

    @Override
    public CirJsonReadContext streamReadContext()
    {
        return _parsingContext;
    }

    @Override
    public String currentName()
    {
        if (_currToken == CirJsonToken.START_OBJECT || _currToken == CirJsonToken.START_ARRAY)
        {
            CirJsonReadContext parent = _parsingContext.getParent();
            if (parent != null)
                return parent.currentName();
        }
        return _parsingContext.currentName();
    }

    @Override
    public Object currentValue()
    {
        return _parsingContext.currentValue();
    }

    @Override
    public void assignCurrentValue(Object value)
    {
        _parsingContext.assignCurrentValue(value);
    }

    @Override
    public boolean isClosed()
    {
        return _closed;
    }

    @Override
    public boolean isNaN()
    {
        if (_currToken == CirJsonToken.VALUE_NUMBER_FLOAT && (_numTypesValid & NR_DOUBLE) != 0)
            return !Double.isFinite(_numberDouble);
        return false;
    }

    @Override
    public void close()
    {
        if (_closed)
            return;
        _closed = true;
        if (LOG.isDebugEnabled())
            LOG.debug("Closing {}", this);
        try
        {
            closeInput();
        }
        catch (IOException x)
        {
            throw new WrappedIOException(this, x);
        }
        finally
        {
            releaseBuffers();
            _ioContext.close();
        }
    }

    /**
     * Closes the underlying input, if this parser owns it or is configured to close it.
     */
    protected abstract void closeInput() throws IOException;

    /**
     * Returns the buffers borrowed from the recycler.
     */
    protected void releaseBuffers()
    {
        _textBuffer.releaseBuffers();
        if (_byteArrayBuilder != null)
        {
            _byteArrayBuilder.release();
            _byteArrayBuilder = null;
        }
    }

    /**
     * @return whether the input should be closed with this parser
     */
    protected boolean shouldCloseInput()
    {
        return _ioContext.isResourceManaged() || isEnabled(StreamReadFeature.AUTO_CLOSE_SOURCE);
    }

    protected String sourceDescription()
    {
        return isEnabled(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION) ? _ioContext.contentDescription() : null;
    }

    @Override
    public CirJsonParser skipChildren()
    {
        if (_currToken != CirJsonToken.START_OBJECT && _currToken != CirJsonToken.START_ARRAY)
            return this;
        int open = 1;
        while (true)
        {
            CirJsonToken t = nextToken();
            if (t == null)
            {
                handleEOF();
                return this;
            }
            if (t == CirJsonToken.NOT_AVAILABLE)
                throw constructReadException("Not enough input to skip children; feed the whole content before calling skipChildren()");
            if (t.isStructStart())
            {
                ++open;
            }
            else if (t.isStructEnd())
            {
                if (--open == 0)
                    return this;
            }
        }
    }

    /**
     * Fails if the input ended within a container.
     */
    protected void handleEOF()
    {
        if (!_parsingContext.inRoot())
        {
            String marker = _parsingContext.inArray() ? "Array" : "Object";
            reportInvalidEOF(String.format(": expected close marker for %s (start marker at %s)", marker,
                _parsingContext.startLocation(sourceDescription())), null);
        }
    }

    protected void createChildArrayContext(int lineNr, int colNr)
    {
        _parsingContext = _parsingContext.createChildArrayContext(lineNr, colNr);
        _streamReadConstraints.validateNestingDepth(_parsingContext.getNestingDepth());
    }

    protected void createChildObjectContext(int lineNr, int colNr)
    {
        _parsingContext = _parsingContext.createChildObjectContext(lineNr, colNr);
        _streamReadConstraints.validateNestingDepth(_parsingContext.getNestingDepth());
    }

    /**
     * Records a property name in the current object context.
     *
     * @param name the canonical name
     * @return {@link CirJsonToken#CIRJSON_ID_PROPERTY_NAME} for the first property of
     * the object, {@link CirJsonToken#PROPERTY_NAME} otherwise
     */
    protected CirJsonToken setPropertyName(String name)
    {
        CirJsonToken t = CirJsonToken.PROPERTY_NAME;
        if (_parsingContext.getEntryCount() == 1)
        {
            if (!CirJsonToken.CIRJSON_ID_NAME.equals(name))
                reportError("Expected property name '" + CirJsonToken.CIRJSON_ID_NAME + "', received '" + name + "'");
            t = CirJsonToken.CIRJSON_ID_PROPERTY_NAME;
        }
        _parsingContext.setCurrentName(name);
        return t;
    }

    protected boolean isEnabledFormatFeature(CirJsonReadFeature feature)
    {
        return feature.enabledIn(_formatReadFeatures);
    }

    @Override
    public String getText()
    {
        CirJsonToken t = _currToken;
        if (t == null)
            return null;
        switch (t.id())
        {
            case CirJsonTokenId.ID_PROPERTY_NAME:
            case CirJsonTokenId.ID_CIRJSON_ID_PROPERTY_NAME:
                return _parsingContext.currentName();
            case CirJsonTokenId.ID_STRING:
            case CirJsonTokenId.ID_NUMBER_INT:
            case CirJsonTokenId.ID_NUMBER_FLOAT:
                return _textBuffer.contentsAsString();
            default:
                return t.asString();
        }
    }

    @Override
    public char[] getTextCharacters()
    {
        CirJsonToken t = _currToken;
        if (t == null)
            return null;
        switch (t.id())
        {
            case CirJsonTokenId.ID_PROPERTY_NAME:
            case CirJsonTokenId.ID_CIRJSON_ID_PROPERTY_NAME:
                return nameChars();
            case CirJsonTokenId.ID_STRING:
            case CirJsonTokenId.ID_NUMBER_INT:
            case CirJsonTokenId.ID_NUMBER_FLOAT:
                return _textBuffer.getTextBuffer();
            default:
                return t.asCharArray();
        }
    }

    private char[] nameChars()
    {
        String name = _parsingContext.currentName();
        int length = name.length();
        if (_nameChars == null || _nameChars.length < length)
            _nameChars = new char[Math.max(length, 32)];
        name.getChars(0, length, _nameChars, 0);
        return _nameChars;
    }

    @Override
    public int getTextLength()
    {
        CirJsonToken t = _currToken;
        if (t == null)
            return 0;
        switch (t.id())
        {
            case CirJsonTokenId.ID_PROPERTY_NAME:
            case CirJsonTokenId.ID_CIRJSON_ID_PROPERTY_NAME:
                return _parsingContext.currentName().length();
            case CirJsonTokenId.ID_STRING:
            case CirJsonTokenId.ID_NUMBER_INT:
            case CirJsonTokenId.ID_NUMBER_FLOAT:
                return _textBuffer.size();
            default:
                char[] chars = t.asCharArray();
                return chars == null ? 0 : chars.length;
        }
    }

    @Override
    public int getTextOffset()
    {
        CirJsonToken t = _currToken;
        if (t == null)
            return 0;
        switch (t.id())
        {
            case CirJsonTokenId.ID_STRING:
            case CirJsonTokenId.ID_NUMBER_INT:
            case CirJsonTokenId.ID_NUMBER_FLOAT:
                return _textBuffer.getTextOffset();
            default:
                return 0;
        }
    }

    @Override
    public boolean hasTextCharacters()
    {
        CirJsonToken t = _currToken;
        if (t == CirJsonToken.VALUE_STRING)
            return _textBuffer.hasTextAsCharacters();
        return t != null && t.isPropertyName();
    }

    @Override
    public byte[] getBinaryValue(Base64Variant variant)
    {
        if (_currToken != CirJsonToken.VALUE_STRING)
            throw constructReadException(String.format("Current token (%s) not VALUE_STRING or VALUE_EMBEDDED_OBJECT, can not access as binary", _currToken));
        if (_binaryValue == null)
        {
            if (_byteArrayBuilder == null)
                _byteArrayBuilder = new ByteArrayBuilder(_ioContext.bufferRecycler());
            else
                _byteArrayBuilder.reset();
            try
            {
                variant.decode(getText(), _byteArrayBuilder);
            }
            catch (IllegalArgumentException x)
            {
                throw new StreamReadException(this, "Failed to decode VALUE_STRING as base64 (" + variant + "): " + x.getMessage(), x);
            }
            _binaryValue = _byteArrayBuilder.toByteArray();
        }
        return _binaryValue;
    }

    /**
     * Prepares the state for an integer token whose text is in the text buffer.
     */
    protected final CirJsonToken resetInt(boolean negative, int intLength)
    {
        _streamReadConstraints.validateIntegerLength(intLength);
        _numberNegative = negative;
        _intLength = intLength;
        _fractLength = 0;
        _expLength = 0;
        _numTypesValid = NR_UNKNOWN;
        return CirJsonToken.VALUE_NUMBER_INT;
    }

    /**
     * Prepares the state for a floating point token whose text is in the text buffer.
     */
    protected final CirJsonToken resetFloat(boolean negative, int intLength, int fractLength, int expLength)
    {
        _streamReadConstraints.validateFPLength(intLength + fractLength + expLength);
        _numberNegative = negative;
        _intLength = intLength;
        _fractLength = fractLength;
        _expLength = expLength;
        _numTypesValid = NR_UNKNOWN;
        return CirJsonToken.VALUE_NUMBER_FLOAT;
    }

    /**
     * Prepares the state for one of the non-numeric floating point tokens, such as {@code NaN}.
     */
    protected final CirJsonToken resetAsNaN(String text, double value)
    {
        _textBuffer.resetWithString(text);
        _numberDouble = value;
        _numTypesValid = NR_DOUBLE;
        return CirJsonToken.VALUE_NUMBER_FLOAT;
    }

    @Override
    public Number getNumberValue()
    {
        if (_numTypesValid == NR_UNKNOWN)
            parseNumericValue(NR_UNKNOWN);
        if (_currToken == CirJsonToken.VALUE_NUMBER_INT)
        {
            if ((_numTypesValid & NR_INT) != 0)
                return _numberInt;
            if ((_numTypesValid & NR_LONG) != 0)
                return _numberLong;
            return _numberBigInt;
        }
        if ((_numTypesValid & NR_BIGDECIMAL) != 0)
            return _numberBigDecimal;
        if ((_numTypesValid & NR_DOUBLE) != 0)
            return _numberDouble;
        return _numberFloat;
    }

    @Override
    public NumberType getNumberType()
    {
        if (_numTypesValid == NR_UNKNOWN)
            parseNumericValue(NR_UNKNOWN);
        if (_currToken == CirJsonToken.VALUE_NUMBER_INT)
        {
            if ((_numTypesValid & NR_INT) != 0)
                return NumberType.INT;
            if ((_numTypesValid & NR_LONG) != 0)
                return NumberType.LONG;
            return NumberType.BIG_INTEGER;
        }
        if ((_numTypesValid & NR_BIGDECIMAL) != 0)
            return NumberType.BIG_DECIMAL;
        if ((_numTypesValid & NR_DOUBLE) != 0)
            return NumberType.DOUBLE;
        return NumberType.FLOAT;
    }

    @Override
    public int getIntValue()
    {
        if ((_numTypesValid & NR_INT) == 0)
        {
            if (_numTypesValid == NR_UNKNOWN)
                parseNumericValue(NR_INT);
            if ((_numTypesValid & NR_INT) == 0)
                convertNumberToInt();
        }
        return _numberInt;
    }

    @Override
    public long getLongValue()
    {
        if ((_numTypesValid & NR_LONG) == 0)
        {
            if (_numTypesValid == NR_UNKNOWN)
                parseNumericValue(NR_LONG);
            if ((_numTypesValid & NR_LONG) == 0)
                convertNumberToLong();
        }
        return _numberLong;
    }

    @Override
    public BigInteger getBigIntegerValue()
    {
        if ((_numTypesValid & NR_BIGINT) == 0)
        {
            if (_numTypesValid == NR_UNKNOWN)
                parseNumericValue(NR_BIGINT);
            if ((_numTypesValid & NR_BIGINT) == 0)
                convertNumberToBigInteger();
        }
        return _numberBigInt;
    }

    @Override
    public float getFloatValue()
    {
        if ((_numTypesValid & NR_FLOAT) == 0)
        {
            if (_numTypesValid == NR_UNKNOWN)
                parseNumericValue(NR_FLOAT);
            if ((_numTypesValid & NR_FLOAT) == 0)
                convertNumberToFloat();
        }
        return _numberFloat;
    }

    @Override
    public double getDoubleValue()
    {
        if ((_numTypesValid & NR_DOUBLE) == 0)
        {
            if (_numTypesValid == NR_UNKNOWN)
                parseNumericValue(NR_DOUBLE);
            if ((_numTypesValid & NR_DOUBLE) == 0)
                convertNumberToDouble();
        }
        return _numberDouble;
    }

    @Override
    public BigDecimal getDecimalValue()
    {
        if ((_numTypesValid & NR_BIGDECIMAL) == 0)
        {
            if (_numTypesValid == NR_UNKNOWN)
                parseNumericValue(NR_BIGDECIMAL);
            if ((_numTypesValid & NR_BIGDECIMAL) == 0)
                convertNumberToBigDecimal();
        }
        return _numberBigDecimal;
    }

    @Override
    public byte getByteValue()
    {
        int value = getIntValue();
        if (value < Byte.MIN_VALUE || value > Byte.MAX_VALUE)
            throw new InputCoercionException(this, String.format("Numeric value (%s) out of range of Java byte", errorText()), _currToken, Byte.TYPE);
        return (byte)value;
    }

    @Override
    public short getShortValue()
    {
        int value = getIntValue();
        if (value < Short.MIN_VALUE || value > Short.MAX_VALUE)
            throw new InputCoercionException(this, String.format("Numeric value (%s) out of range of Java short", errorText()), _currToken, Short.TYPE);
        return (short)value;
    }

    /**
     * Converts the number text of the current token.
     *
     * @param expType the type the caller asked for, one of the {@code NR_} constants
     */
    protected void parseNumericValue(int expType)
    {
        if (_closed)
            reportError("Internal error: number value requested after the parser was closed");
        if (_currToken == CirJsonToken.VALUE_NUMBER_INT)
        {
            char[] buffer = _textBuffer.getTextBuffer();
            int offset = _textBuffer.getTextOffset();
            int length = _textBuffer.size();
            int intLength = _intLength;
            if (intLength <= 9)
            {
                _numberInt = NumberInput.parseInt(buffer, offset, length);
                _numTypesValid = NR_INT;
                return;
            }
            if (intLength <= 18)
            {
                long value = NumberInput.parseLong(buffer, offset, length);
                if (intLength == 10 && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE)
                {
                    _numberInt = (int)value;
                    _numTypesValid = NR_INT;
                    return;
                }
                _numberLong = value;
                _numTypesValid = NR_LONG;
                return;
            }
            int digitsOffset = _numberNegative ? offset + 1 : offset;
            if (NumberInput.inLongRange(buffer, digitsOffset, intLength, _numberNegative))
            {
                _numberLong = NumberInput.parseLong(buffer, offset, length);
                _numTypesValid = NR_LONG;
                return;
            }
            try
            {
                _numberBigInt = NumberInput.parseBigInteger(_textBuffer.contentsAsString(), isEnabled(StreamReadFeature.USE_FAST_BIG_NUMBER_PARSER));
            }
            catch (NumberFormatException x)
            {
                throw new StreamReadException(this, "Malformed numeric value (" + errorText() + ")", x);
            }
            _numTypesValid = NR_BIGINT;
            return;
        }
        if (_currToken == CirJsonToken.VALUE_NUMBER_FLOAT)
        {
            String text = _textBuffer.contentsAsString();
            try
            {
                if (expType == NR_BIGDECIMAL)
                {
                    _numberBigDecimal = NumberInput.parseBigDecimal(text, isEnabled(StreamReadFeature.USE_FAST_BIG_NUMBER_PARSER));
                    _numTypesValid = NR_BIGDECIMAL;
                }
                else if (expType == NR_FLOAT)
                {
                    _numberFloat = NumberInput.parseFloat(text, isEnabled(StreamReadFeature.USE_FAST_DOUBLE_PARSER));
                    _numTypesValid = NR_FLOAT;
                }
                else
                {
                    _numberDouble = NumberInput.parseDouble(text, isEnabled(StreamReadFeature.USE_FAST_DOUBLE_PARSER));
                    _numTypesValid = NR_DOUBLE;
                }
            }
            catch (NumberFormatException x)
            {
                throw new StreamReadException(this, "Malformed numeric value (" + errorText() + ")", x);
            }
            return;
        }
        throw new InputCoercionException(this, String.format("Current token (%s) not numeric, can not use numeric value accessors", _currToken),
            _currToken, Number.class);
    }

    protected void convertNumberToInt()
    {
        if ((_numTypesValid & NR_LONG) != 0)
        {
            int result = (int)_numberLong;
            if (result != _numberLong)
                reportOverflowInt();
            _numberInt = result;
        }
        else if ((_numTypesValid & NR_BIGINT) != 0)
        {
            if (BI_MIN_INT.compareTo(_numberBigInt) > 0 || BI_MAX_INT.compareTo(_numberBigInt) < 0)
                reportOverflowInt();
            _numberInt = _numberBigInt.intValue();
        }
        else if ((_numTypesValid & NR_DOUBLE) != 0)
        {
            if (_numberDouble < Integer.MIN_VALUE || _numberDouble > Integer.MAX_VALUE || Double.isNaN(_numberDouble))
                reportOverflowInt();
            _numberInt = (int)_numberDouble;
        }
        else if ((_numTypesValid & NR_FLOAT) != 0)
        {
            if (_numberFloat < Integer.MIN_VALUE || _numberFloat > Integer.MAX_VALUE || Float.isNaN(_numberFloat))
                reportOverflowInt();
            _numberInt = (int)_numberFloat;
        }
        else if ((_numTypesValid & NR_BIGDECIMAL) != 0)
        {
            if (BD_MIN_INT.compareTo(_numberBigDecimal) > 0 || BD_MAX_INT.compareTo(_numberBigDecimal) < 0)
                reportOverflowInt();
            _numberInt = _numberBigDecimal.intValue();
        }
        _numTypesValid |= NR_INT;
    }

    protected void convertNumberToLong()
    {
        if ((_numTypesValid & NR_INT) != 0)
        {
            _numberLong = _numberInt;
        }
        else if ((_numTypesValid & NR_BIGINT) != 0)
        {
            if (BI_MIN_LONG.compareTo(_numberBigInt) > 0 || BI_MAX_LONG.compareTo(_numberBigInt) < 0)
                reportOverflowLong();
            _numberLong = _numberBigInt.longValue();
        }
        else if ((_numTypesValid & NR_DOUBLE) != 0)
        {
            if (_numberDouble < Long.MIN_VALUE || _numberDouble > Long.MAX_VALUE || Double.isNaN(_numberDouble))
                reportOverflowLong();
            _numberLong = (long)_numberDouble;
        }
        else if ((_numTypesValid & NR_FLOAT) != 0)
        {
            if (_numberFloat < Long.MIN_VALUE || _numberFloat > Long.MAX_VALUE || Float.isNaN(_numberFloat))
                reportOverflowLong();
            _numberLong = (long)_numberFloat;
        }
        else if ((_numTypesValid & NR_BIGDECIMAL) != 0)
        {
            if (BD_MIN_LONG.compareTo(_numberBigDecimal) > 0 || BD_MAX_LONG.compareTo(_numberBigDecimal) < 0)
                reportOverflowLong();
            _numberLong = _numberBigDecimal.longValue();
        }
        _numTypesValid |= NR_LONG;
    }

    protected void convertNumberToBigInteger()
    {
        if ((_numTypesValid & NR_BIGDECIMAL) != 0)
        {
            _streamReadConstraints.validateBigIntegerScale(_numberBigDecimal.scale());
            _numberBigInt = _numberBigDecimal.toBigInteger();
        }
        else if ((_numTypesValid & NR_LONG) != 0)
        {
            _numberBigInt = BigInteger.valueOf(_numberLong);
        }
        else if ((_numTypesValid & NR_INT) != 0)
        {
            _numberBigInt = BigInteger.valueOf(_numberInt);
        }
        else if ((_numTypesValid & NR_DOUBLE) != 0)
        {
            if (!Double.isFinite(_numberDouble))
                reportNonFiniteConversion("java.math.BigInteger");
            BigDecimal value = NumberInput.parseBigDecimal(_textBuffer.contentsAsString(), isEnabled(StreamReadFeature.USE_FAST_BIG_NUMBER_PARSER));
            _streamReadConstraints.validateBigIntegerScale(value.scale());
            _numberBigInt = value.toBigInteger();
        }
        else if ((_numTypesValid & NR_FLOAT) != 0)
        {
            BigDecimal value = NumberInput.parseBigDecimal(_textBuffer.contentsAsString(), isEnabled(StreamReadFeature.USE_FAST_BIG_NUMBER_PARSER));
            _streamReadConstraints.validateBigIntegerScale(value.scale());
            _numberBigInt = value.toBigInteger();
        }
        _numTypesValid |= NR_BIGINT;
    }

    protected void convertNumberToDouble()
    {
        if ((_numTypesValid & NR_BIGDECIMAL) != 0)
            _numberDouble = _numberBigDecimal.doubleValue();
        else if ((_numTypesValid & NR_FLOAT) != 0)
            _numberDouble = NumberInput.parseDouble(_textBuffer.contentsAsString(), isEnabled(StreamReadFeature.USE_FAST_DOUBLE_PARSER));
        else if ((_numTypesValid & NR_BIGINT) != 0)
            _numberDouble = _numberBigInt.doubleValue();
        else if ((_numTypesValid & NR_LONG) != 0)
            _numberDouble = _numberLong;
        else if ((_numTypesValid & NR_INT) != 0)
            _numberDouble = _numberInt;
        _numTypesValid |= NR_DOUBLE;
    }

    protected void convertNumberToFloat()
    {
        if ((_numTypesValid & NR_BIGDECIMAL) != 0)
            _numberFloat = _numberBigDecimal.floatValue();
        else if ((_numTypesValid & NR_DOUBLE) != 0)
            _numberFloat = (float)_numberDouble;
        else if ((_numTypesValid & NR_BIGINT) != 0)
            _numberFloat = _numberBigInt.floatValue();
        else if ((_numTypesValid & NR_LONG) != 0)
            _numberFloat = _numberLong;
        else if ((_numTypesValid & NR_INT) != 0)
            _numberFloat = _numberInt;
        _numTypesValid |= NR_FLOAT;
    }

    protected void convertNumberToBigDecimal()
    {
        if ((_numTypesValid & (NR_DOUBLE | NR_FLOAT)) != 0)
        {
            if (isNaN())
                reportNonFiniteConversion("java.math.BigDecimal");
            _numberBigDecimal = NumberInput.parseBigDecimal(_textBuffer.contentsAsString(), isEnabled(StreamReadFeature.USE_FAST_BIG_NUMBER_PARSER));
        }
        else if ((_numTypesValid & NR_BIGINT) != 0)
        {
            _numberBigDecimal = new BigDecimal(_numberBigInt);
        }
        else if ((_numTypesValid & NR_LONG) != 0)
        {
            _numberBigDecimal = BigDecimal.valueOf(_numberLong);
        }
        else if ((_numTypesValid & NR_INT) != 0)
        {
            _numberBigDecimal = BigDecimal.valueOf(_numberInt);
        }
        _numTypesValid |= NR_BIGDECIMAL;
    }

    private String errorText()
    {
        String text = getText();
        if (text != null && text.length() > MAX_ERROR_TOKEN_LENGTH)
            return text.substring(0, MAX_ERROR_TOKEN_LENGTH) + "[truncated " + (text.length() - MAX_ERROR_TOKEN_LENGTH) + " chars]";
        return text;
    }

    protected void reportOverflowInt()
    {
        throw new InputCoercionException(this, String.format("Numeric value (%s) out of range of int (%d - %d)", errorText(), Integer.MIN_VALUE, Integer.MAX_VALUE),
            _currToken, Integer.TYPE);
    }

    protected void reportOverflowLong()
    {
        throw new InputCoercionException(this, String.format("Numeric value (%s) out of range of long (%d - %d)", errorText(), Long.MIN_VALUE, Long.MAX_VALUE),
            _currToken, Long.TYPE);
    }

    private void reportNonFiniteConversion(String type)
    {
        throw new InputCoercionException(this, String.format("Numeric value (%s) can not be converted to %s", errorText(), type), _currToken, BigDecimal.class);
    }

    /**
     * @throws StreamReadException always
     */
    protected void reportError(String message)
    {
        throw constructReadException(message);
    }

    protected void reportUnexpectedChar(int ch, String comment)
    {
        String message = String.format("Unexpected character (%s)", CharTypes.getCharDesc(ch));
        if (comment != null)
            message += ": " + comment;
        reportError(message);
    }

    protected void reportInvalidEOF(String message, CirJsonToken currToken)
    {
        throw new StreamReadException(this, "Unexpected end-of-input" + message, currentLocation());
    }

    protected void reportMismatchedEndMarker(int actCh, char expCh)
    {
        CirJsonReadContext context = _parsingContext;
        if (context.inRoot())
        {
            reportError(String.format("Unexpected close marker '%s': no open Array or Object", (char)actCh));
            return;
        }
        reportError(String.format("Unexpected close marker '%s': expected '%c' (for %s starting at %s)", (char)actCh, expCh,
            context.typeDescription(), context.startLocation(sourceDescription())));
    }

    protected void reportInvalidNumber(String message)
    {
        reportError("Invalid numeric value: " + message);
    }

    /**
     * Reports a char that cannot start a value where a value is expected.
     */
    protected void reportUnexpectedValueChar(int ch)
    {
        if ((ch == 'N' || ch == 'I' || ch == '+') && !isEnabledFormatFeature(CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS))
            reportUnexpectedChar(ch, "expected a valid value; enable `CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS` to allow NaN and Infinity");
        if (ch == ']' || ch == '}')
            reportUnexpectedChar(ch, "expected a value");
        reportUnexpectedChar(ch, "expected a valid value (Number, String, Array, Object, 'true', 'false' or 'null')");
    }

    /**
     * Reports a literal that does not match any keyword.
     *
     * @param matched the part of the literal that matched
     * @param ch the first char that did not match
     */
    protected void reportInvalidToken(String matched, int ch)
    {
        reportError(String.format("Unrecognized token '%s%c': was expecting (CirJSON String, Number, Array, Object or token 'null', 'true' or 'false')",
            matched, (char)ch));
    }

    /**
     * Reports a control char found unescaped within a string or property name, unless
     * {@link CirJsonReadFeature#ALLOW_UNESCAPED_CONTROL_CHARS} accepts it, in which case
     * this method returns normally.
     */
    protected void throwUnquotedSpace(int ch, String name)
    {
        if (ch < ' ' && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS))
            return;
        reportError(String.format("Illegal unquoted character (%s): has to be escaped using backslash to be included in %s",
            CharTypes.getCharDesc(ch), name));
    }

    protected void throwInvalidSpace(int ch)
    {
        reportError(String.format("Illegal character (%s): only regular white space (\\r, \\n, \\t) is allowed between tokens",
            CharTypes.getCharDesc(ch)));
    }

    protected char decodeEscapeChar(int ch)
    {
        switch (ch)
        {
            case 'b':
                return '\b';
            case 't':
                return '\t';
            case 'n':
                return '\n';
            case 'f':
                return '\f';
            case 'r':
                return '\r';
            case '"':
            case '/':
            case '\\':
                return (char)ch;
            case '\'':
                if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_SINGLE_QUOTES))
                    return '\'';
                break;
            default:
                break;
        }
        if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER))
            return (char)ch;
        reportError("Unrecognized character escape " + CharTypes.getCharDesc(ch));
        return (char)ch;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s,%s,closed=%b]", getClass().getSimpleName(), hashCode(), _currToken, _parsingContext, _closed);
    }
}
