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
import java.io.Reader;
import java.io.Writer;

import org.cirjson.core.CirJsonLocation;
import org.cirjson.core.CirJsonToken;
import org.cirjson.core.base.ParserBase;
import org.cirjson.core.exception.WrappedIOException;
import org.cirjson.core.io.IOContext;
import org.cirjson.core.symbols.CharsToNameCanonicalizer;
import org.cirjson.util.CharTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A blocking parser over chars, read from a {@link Reader} or taken from a
 * {@code char[]} or {@code String}.</p>
 * <p>The value that follows a property name is parsed together with the name, and
 * returned by the next call to {@link #nextToken()}. Locations report char offsets.</p>
 */
public class ReaderBasedCirJsonParser extends ParserBase
{
    private static final Logger LOG = LoggerFactory.getLogger(ReaderBasedCirJsonParser.class);

    private final boolean _debugEnabled = LOG.isDebugEnabled();

    private final CharsToNameCanonicalizer _symbols;

    private Reader _reader;
    private char[] _inputBuffer;

    /**
     * Whether the input buffer was borrowed from the recycler and must be returned.
     */
    private final boolean _bufferRecyclable;

    /**
     * The value token parsed along with the current property name.
     */
    private CirJsonToken _nextToken;

    private long _nameInputTotal;
    private int _nameInputRow;
    private int _nameInputCol;

    /**
     * Creates a parser reading from a {@link Reader} into a recycled buffer.
     */
    public ReaderBasedCirJsonParser(IOContext ioContext, int streamReadFeatures, int formatReadFeatures, Reader reader, CharsToNameCanonicalizer symbols)
    {
        super(ioContext, streamReadFeatures, formatReadFeatures);
        _reader = reader;
        _symbols = symbols;
        _inputBuffer = ioContext.allocTokenBuffer();
        _bufferRecyclable = true;
        if (_debugEnabled)
            LOG.debug("Created {} for {}", this, ioContext.contentDescription());
    }

    /**
     * Creates a parser over a range of chars that is already in memory.
     */
    public ReaderBasedCirJsonParser(IOContext ioContext, int streamReadFeatures, int formatReadFeatures, CharsToNameCanonicalizer symbols,
                                    char[] input, int start, int end)
    {
        super(ioContext, streamReadFeatures, formatReadFeatures);
        _reader = null;
        _symbols = symbols;
        _inputBuffer = input;
        _bufferRecyclable = false;
        _inputPtr = start;
        _inputEnd = end;
        _currInputRowStart = start;
        _currInputProcessed = -start;
        _streamReadConstraints.validateDocumentLength(end - start);
        if (_debugEnabled)
            LOG.debug("Created {} for {}", this, ioContext.contentDescription());
    }

    public CharsToNameCanonicalizer getSymbols()
    {
        return _symbols;
    }

    @Override
    public CirJsonLocation currentLocation()
    {
        int col = _inputPtr - _currInputRowStart + 1;
        return new CirJsonLocation(sourceDescription(), -1L, _currInputProcessed + _inputPtr, _currInputRow, col);
    }

    @Override
    public CirJsonLocation currentTokenLocation()
    {
        if (_currToken != null && _currToken.isPropertyName())
            return new CirJsonLocation(sourceDescription(), -1L, _nameInputTotal, _nameInputRow, _nameInputCol + 1);
        return new CirJsonLocation(sourceDescription(), -1L, _tokenInputTotal, _tokenInputRow, _tokenInputCol + 1);
    }

    /**
     * Writes the chars read but not yet processed.
     *
     * @param writer the writer to write to
     * @return the number of chars written
     */
    public int releaseBuffered(Writer writer)
    {
        int count = _inputEnd - _inputPtr;
        if (count < 1)
            return 0;
        try
        {
            writer.write(_inputBuffer, _inputPtr, count);
        }
        catch (IOException x)
        {
            throw new WrappedIOException(this, x);
        }
        return count;
    }

    @Override
    protected void closeInput() throws IOException
    {
        if (_reader != null)
        {
            if (shouldCloseInput())
                _reader.close();
            _reader = null;
        }
    }

    @Override
    protected void releaseBuffers()
    {
        super.releaseBuffers();
        _symbols.release();
        if (_bufferRecyclable)
        {
            char[] buffer = _inputBuffer;
            if (buffer != null)
            {
                _inputBuffer = null;
                _ioContext.releaseTokenBuffer(buffer);
            }
        }
    }

    /**
     * Reads more chars into the buffer.
     *
     * @return whether chars are available
     */
    protected boolean loadMore()
    {
        if (_reader == null)
            return false;
        int count;
        try
        {
            count = _reader.read(_inputBuffer, 0, _inputBuffer.length);
        }
        catch (IOException x)
        {
            throw new WrappedIOException(this, x);
        }
        int bufferSize = _inputEnd;
        _currInputProcessed += bufferSize;
        _currInputRowStart -= bufferSize;
        if (count > 0)
        {
            _streamReadConstraints.validateDocumentLength(_currInputProcessed + count);
            _inputPtr = 0;
            _inputEnd = count;
            return true;
        }
        _inputPtr = 0;
        _inputEnd = 0;
        if (count == 0)
            throw new WrappedIOException(this, new IOException("Reader returned 0 characters when trying to read " + _inputBuffer.length));
        return false;
    }

    private boolean ensureInput()
    {
        return _inputPtr < _inputEnd || loadMore();
    }

    @Override
    public CirJsonToken nextToken()
    {
        if (_currToken == CirJsonToken.PROPERTY_NAME || _currToken == CirJsonToken.CIRJSON_ID_PROPERTY_NAME)
            return nextAfterName();
        _numTypesValid = NR_UNKNOWN;
        _binaryValue = null;
        if (_closed)
            return _currToken = null;

        int i = skipWSOrEnd();
        if (i < 0)
        {
            handleEOF();
            close();
            return _currToken = null;
        }

        if (i == ']' || i == '}')
        {
            closeScope(i);
            return _currToken;
        }

        if (_parsingContext.expectComma())
        {
            if (i != ',')
                reportUnexpectedChar(i, "was expecting comma to separate " + _parsingContext.typeDescription() + " entries");
            i = skipWS();
            if ((i == ']' || i == '}') && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_TRAILING_COMMA))
            {
                closeScope(i);
                return _currToken;
            }
        }

        if (_parsingContext.inObject())
        {
            updateNameLocation();
            CirJsonToken nameToken = setPropertyName(i == '"' ? parseName() : parseOddName(i));
            i = skipColon();
            updateLocation();
            _nextToken = parseValue(i);
            return _currToken = nameToken;
        }

        updateLocation();
        CirJsonToken t = parseValue(i);
        if (t == CirJsonToken.START_ARRAY)
            createChildArrayContext(_tokenInputRow, _tokenInputCol + 1);
        else if (t == CirJsonToken.START_OBJECT)
            createChildObjectContext(_tokenInputRow, _tokenInputCol + 1);
        return _currToken = t;
    }

    private CirJsonToken nextAfterName()
    {
        CirJsonToken t = _nextToken;
        _nextToken = null;
        if (t == CirJsonToken.START_ARRAY)
            createChildArrayContext(_tokenInputRow, _tokenInputCol + 1);
        else if (t == CirJsonToken.START_OBJECT)
            createChildObjectContext(_tokenInputRow, _tokenInputCol + 1);
        return _currToken = t;
    }

    private CirJsonToken parseValue(int i)
    {
        switch (i)
        {
            case '"':
                parseString();
                return CirJsonToken.VALUE_STRING;
            case '\'':
                if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_SINGLE_QUOTES))
                {
                    _textBuffer.resetWithEmpty();
                    finishQuoted("string value", '\'');
                    return CirJsonToken.VALUE_STRING;
                }
                break;
            case '[':
                return CirJsonToken.START_ARRAY;
            case '{':
                return CirJsonToken.START_OBJECT;
            case 't':
                matchLiteral("true");
                return CirJsonToken.VALUE_TRUE;
            case 'f':
                matchLiteral("false");
                return CirJsonToken.VALUE_FALSE;
            case 'n':
                matchLiteral("null");
                return CirJsonToken.VALUE_NULL;
            case '-':
            case '0':
            case '1':
            case '2':
            case '3':
            case '4':
            case '5':
            case '6':
            case '7':
            case '8':
            case '9':
                return parseNumber(i);
            case 'N':
                if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS))
                {
                    matchLiteral("NaN");
                    return resetAsNaN("NaN", Double.NaN);
                }
                break;
            case 'I':
                if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS))
                {
                    matchLiteral("Infinity");
                    return resetAsNaN("Infinity", Double.POSITIVE_INFINITY);
                }
                break;
            case '+':
                if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS) &&
                    (!isEnabledFormatFeature(CirJsonReadFeature.ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS) || (ensureInput() && _inputBuffer[_inputPtr] == 'I')))
                {
                    matchLiteral("+Infinity");
                    return resetAsNaN("+Infinity", Double.POSITIVE_INFINITY);
                }
                if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS))
                    return parseNumber(i);
                break;
            case '.':
                if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS))
                    return parseNumber(i);
                break;
            case ',':
            case ']':
                if (_parsingContext.inArray() && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_MISSING_VALUES))
                {
                    // The separator is read again by the next call.
                    --_inputPtr;
                    return CirJsonToken.VALUE_NULL;
                }
                break;
            default:
                break;
        }
        reportUnexpectedValueChar(i);
        return null;
    }

    private void closeScope(int i)
    {
        updateLocation();
        if (i == ']')
        {
            if (!_parsingContext.inArray())
                reportMismatchedEndMarker(i, '}');
            _parsingContext = _parsingContext.clearAndGetParent();
            _currToken = CirJsonToken.END_ARRAY;
        }
        else
        {
            if (!_parsingContext.inObject())
                reportMismatchedEndMarker(i, ']');
            _parsingContext = _parsingContext.clearAndGetParent();
            _currToken = CirJsonToken.END_OBJECT;
        }
    }

    private void updateLocation()
    {
        int ptr = _inputPtr - 1;
        _tokenInputTotal = _currInputProcessed + ptr;
        _tokenInputRow = _currInputRow;
        _tokenInputCol = ptr - _currInputRowStart;
    }

    private void updateNameLocation()
    {
        int ptr = _inputPtr - 1;
        _nameInputTotal = _currInputProcessed + ptr;
        _nameInputRow = _currInputRow;
        _nameInputCol = ptr - _currInputRowStart;
    }

    /**
     * @return the next char that is not white space, or -1 at the end of input
     */
    private int skipWSOrEnd()
    {
        while (true)
        {
            if (!ensureInput())
                return -1;
            char c = _inputBuffer[_inputPtr++];
            if (c > ' ')
            {
                // A byte order mark at the very start is skipped and does not count as a column.
                if (c == 0xFEFF && _currInputProcessed + _inputPtr == 1)
                {
                    _currInputRowStart = _inputPtr;
                    continue;
                }
                if (c == '/' && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_JAVA_COMMENTS))
                {
                    skipComment();
                    continue;
                }
                if (c == '#' && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_YAML_COMMENTS))
                {
                    skipLine();
                    continue;
                }
                return c;
            }
            skipSpace(c);
        }
    }

    private void skipComment()
    {
        if (!ensureInput())
            reportInvalidEOF(" in a comment", null);
        char c = _inputBuffer[_inputPtr++];
        if (c == '/')
            skipLine();
        else if (c == '*')
            skipCComment();
        else
            reportUnexpectedChar(c, "was expecting either '*' or '/' for a comment");
    }

    /**
     * Skips up to and including the end of the current line.
     */
    private void skipLine()
    {
        while (ensureInput())
        {
            char c = _inputBuffer[_inputPtr++];
            if (c == '\n' || c == '\r')
            {
                skipSpace(c);
                return;
            }
        }
    }

    private void skipCComment()
    {
        while (ensureInput())
        {
            char c = _inputBuffer[_inputPtr++];
            if (c == '*')
            {
                if (ensureInput() && _inputBuffer[_inputPtr] == '/')
                {
                    ++_inputPtr;
                    return;
                }
            }
            else if (c == '\n' || c == '\r')
            {
                skipSpace(c);
            }
        }
        reportInvalidEOF(" in a comment", null);
    }

    /**
     * @return the next char that is not white space
     */
    private int skipWS()
    {
        int i = skipWSOrEnd();
        if (i < 0)
            reportInvalidEOF(" within/between " + _parsingContext.typeDescription() + " entries", null);
        return i;
    }

    private void skipSpace(char c)
    {
        if (c == ' ' || c == '\t')
            return;
        if (c == '\n')
        {
            ++_currInputRow;
            _currInputRowStart = _inputPtr;
        }
        else if (c == '\r')
        {
            if (ensureInput() && _inputBuffer[_inputPtr] == '\n')
                ++_inputPtr;
            ++_currInputRow;
            _currInputRowStart = _inputPtr;
        }
        else
        {
            throwInvalidSpace(c);
        }
    }

    private int skipColon()
    {
        int i = skipWS();
        if (i != ':')
            reportUnexpectedChar(i, "was expecting a colon to separate property name and value");
        return skipWS();
    }

    private void matchLiteral(String literal)
    {
        for (int i = 1, length = literal.length(); i < length; ++i)
        {
            if (!ensureInput())
                reportInvalidEOF(" in a value", null);
            char c = _inputBuffer[_inputPtr];
            if (c != literal.charAt(i))
                reportInvalidToken(literal.substring(0, i), c);
            ++_inputPtr;
        }
    }

    private String parseName()
    {
        int ptr = _inputPtr;
        while (ptr < _inputEnd)
        {
            char c = _inputBuffer[ptr];
            if (CharTypes.inputCodeLatin1(c) != 0)
            {
                if (c != '"')
                    break;
                int start = _inputPtr;
                int length = ptr - start;
                _inputPtr = ptr + 1;
                _streamReadConstraints.validateNameLength(length);
                return _symbols.findSymbol(_inputBuffer, start, length, _symbols.calcHash(_inputBuffer, start, length));
            }
            ++ptr;
        }
        int start = _inputPtr;
        _textBuffer.resetWithCopy(_inputBuffer, start, ptr - start);
        _inputPtr = ptr;
        finishQuoted("name", '"');
        return bufferedName();
    }

    /**
     * Parses a property name that does not start with a double quote.
     */
    private String parseOddName(int first)
    {
        if (first == '\'' && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_SINGLE_QUOTES))
        {
            _textBuffer.resetWithEmpty();
            finishQuoted("name", '\'');
            return bufferedName();
        }
        if (!isEnabledFormatFeature(CirJsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES))
            reportUnexpectedChar(first, "was expecting double-quote to start property name");
        if (!CharTypes.isNameStart(first))
            reportUnexpectedChar(first, "was expecting either valid name character (for unquoted name) or double-quote (for quoted) to start property name");
        _textBuffer.resetWithEmpty();
        _textBuffer.append((char)first);
        while (ensureInput() && CharTypes.isNamePart(_inputBuffer[_inputPtr]))
        {
            _textBuffer.append(_inputBuffer[_inputPtr++]);
        }
        return bufferedName();
    }

    private String bufferedName()
    {
        char[] chars = _textBuffer.getTextBuffer();
        int offset = _textBuffer.getTextOffset();
        int length = _textBuffer.size();
        _streamReadConstraints.validateNameLength(length);
        return _symbols.findSymbol(chars, offset, length, _symbols.calcHash(chars, offset, length));
    }

    private void parseString()
    {
        int ptr = _inputPtr;
        while (ptr < _inputEnd)
        {
            char c = _inputBuffer[ptr];
            if (CharTypes.inputCodeLatin1(c) != 0)
            {
                if (c != '"')
                    break;
                _textBuffer.resetWithShared(_inputBuffer, _inputPtr, ptr - _inputPtr);
                _inputPtr = ptr + 1;
                return;
            }
            ++ptr;
        }
        _textBuffer.resetWithCopy(_inputBuffer, _inputPtr, ptr - _inputPtr);
        _inputPtr = ptr;
        finishQuoted("string value", '"');
    }

    /**
     * Appends the rest of a quoted string to the text buffer, up to and excluding the closing quote.
     */
    private void finishQuoted(String what, char quote)
    {
        char[] outBuffer = _textBuffer.getCurrentSegment();
        int outPtr = _textBuffer.getCurrentSegmentSize();
        while (true)
        {
            if (!ensureInput())
                reportInvalidEOF(": was expecting closing quote for a " + what, CirJsonToken.VALUE_STRING);
            char c = _inputBuffer[_inputPtr++];
            if (c == quote)
                break;
            if (c == '\\')
                c = decodeEscaped();
            else if (c < ' ')
                throwUnquotedSpace(c, what);
            if (outPtr >= outBuffer.length)
            {
                outBuffer = _textBuffer.finishCurrentSegment();
                outPtr = 0;
            }
            outBuffer[outPtr++] = c;
        }
        _textBuffer.setCurrentLength(outPtr);
    }

    private char decodeEscaped()
    {
        if (!ensureInput())
            reportInvalidEOF(" in character escape sequence", CirJsonToken.VALUE_STRING);
        char c = _inputBuffer[_inputPtr++];
        if (c != 'u')
            return decodeEscapeChar(c);
        int value = 0;
        for (int i = 0; i < 4; ++i)
        {
            if (!ensureInput())
                reportInvalidEOF(" in character escape sequence", CirJsonToken.VALUE_STRING);
            int ch = _inputBuffer[_inputPtr++];
            int digit = CharTypes.charToHex(ch);
            if (digit < 0)
                reportUnexpectedChar(ch, "expected a hex-digit for character escape sequence");
            value = (value << 4) | digit;
        }
        return (char)value;
    }

    private CirJsonToken parseNumber(int first)
    {
        _textBuffer.resetWithEmpty();
        int ch = first;
        boolean negative = ch == '-';
        if (negative || ch == '+')
        {
            if (negative)
                _textBuffer.append('-');
            if (!ensureInput())
                reportInvalidEOF(" in a Number value", CirJsonToken.VALUE_NUMBER_INT);
            ch = _inputBuffer[_inputPtr++];
            if (negative && ch == 'I' && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS))
            {
                matchLiteral("-Infinity".substring(1));
                return resetAsNaN("-Infinity", Double.NEGATIVE_INFINITY);
            }
            if (ch == '.' && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS))
                return parseFraction(negative, 0);
            if (!isDigit(ch))
                reportUnexpectedChar(ch, "expected digit (0-9) to follow " + (negative ? "minus" : "plus") + " sign, for valid numeric value");
        }
        else if (ch == '.')
        {
            return parseFraction(negative, 0);
        }

        if (ch == '0' && ensureInput() && isDigit(_inputBuffer[_inputPtr]))
        {
            if (!isEnabledFormatFeature(CirJsonReadFeature.ALLOW_LEADING_ZEROS_FOR_NUMBERS))
                reportInvalidNumber("Leading zeroes not allowed");
            while (ensureInput() && _inputBuffer[_inputPtr] == '0')
            {
                ++_inputPtr;
            }
            if (ensureInput() && isDigit(_inputBuffer[_inputPtr]))
                ch = _inputBuffer[_inputPtr++];
        }

        int intLength = 1;
        _textBuffer.append((char)ch);
        while (ensureInput() && isDigit(_inputBuffer[_inputPtr]))
        {
            _textBuffer.append(_inputBuffer[_inputPtr++]);
            ++intLength;
        }

        if (ensureInput() && _inputBuffer[_inputPtr] == '.')
        {
            ++_inputPtr;
            return parseFraction(negative, intLength);
        }
        return parseExponent(negative, intLength, 0, false);
    }

    /**
     * Parses the rest of a number from just after its decimal point.
     */
    private CirJsonToken parseFraction(boolean negative, int intLength)
    {
        _textBuffer.append('.');
        int fractLength = 0;
        while (ensureInput() && isDigit(_inputBuffer[_inputPtr]))
        {
            _textBuffer.append(_inputBuffer[_inputPtr++]);
            ++fractLength;
        }
        if (fractLength == 0 && (intLength == 0 || !isEnabledFormatFeature(CirJsonReadFeature.ALLOW_TRAILING_DECIMAL_POINT_FOR_NUMBERS)))
            reportInvalidNumber("Decimal point not followed by a digit");
        return parseExponent(negative, intLength, fractLength, true);
    }

    private CirJsonToken parseExponent(boolean negative, int intLength, int fractLength, boolean fraction)
    {
        int expLength = 0;
        if (ensureInput() && (_inputBuffer[_inputPtr] == 'e' || _inputBuffer[_inputPtr] == 'E'))
        {
            _textBuffer.append(_inputBuffer[_inputPtr++]);
            if (ensureInput() && (_inputBuffer[_inputPtr] == '-' || _inputBuffer[_inputPtr] == '+'))
                _textBuffer.append(_inputBuffer[_inputPtr++]);
            while (ensureInput() && isDigit(_inputBuffer[_inputPtr]))
            {
                _textBuffer.append(_inputBuffer[_inputPtr++]);
                ++expLength;
            }
            if (expLength == 0)
                reportInvalidNumber("Exponent indicator not followed by a digit");
        }

        if (!fraction && expLength == 0)
            return resetInt(negative, intLength);
        return resetFloat(negative, intLength, fractLength, expLength);
    }

    private static boolean isDigit(int ch)
    {
        return ch >= '0' && ch <= '9';
    }
}
