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

package org.cirjson.core.async;

import org.cirjson.core.CirJsonLocation;
import org.cirjson.core.CirJsonToken;
import org.cirjson.core.base.ParserBase;
import org.cirjson.core.cirjson.CirJsonReadFeature;
import org.cirjson.core.io.IOContext;
import org.cirjson.core.symbols.CharsToNameCanonicalizer;
import org.cirjson.util.CharTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>An incremental parser of UTF-8 encoded CirJSON.</p>
 * <p>The parser never blocks: when the input fed so far ends in the middle of a token,
 * {@link #nextToken()} returns {@link CirJsonToken#NOT_AVAILABLE} and the progress made
 * on the token is kept in a {@link MajorState}, a {@link MinorState} and a few
 * accumulators, so that the next call resumes where the previous one stopped. The
 * tokens returned are the same however the input is split into chunks.</p>
 * <p>Subclasses hold the input buffer and provide {@link #getByteFromBuffer(int)}.</p>
 */
public abstract class NonBlockingUtf8CirJsonParserBase extends ParserBase
{
    private static final Logger LOG = LoggerFactory.getLogger(NonBlockingUtf8CirJsonParserBase.class);

    /**
     * Where the parser is between tokens: what may come next.
     */
    public enum MajorState
    {
        /**
         * Nothing read yet; a byte order mark may come.
         */
        INITIAL,
        /**
         * At the root level, expecting a value or the end of input.
         */
        ROOT,
        ARRAY_FIRST,
        ARRAY_NEXT,
        ARRAY_AFTER_COMMA,
        OBJECT_FIRST,
        OBJECT_NEXT,
        OBJECT_AFTER_COMMA,
        /**
         * After a property name, expecting the colon.
         */
        OBJECT_COLON,
        /**
         * After the colon, expecting the value.
         */
        OBJECT_VALUE,
        CLOSED
    }

    /**
     * Which partial token is in progress, if any.
     */
    public enum MinorState
    {
        NONE,
        BOM,
        /**
         * After the slash that starts a comment.
         */
        COMMENT_START,
        COMMENT_LINE,
        COMMENT_C,
        /**
         * Within a C style comment, after a star that may end it.
         */
        COMMENT_C_STAR,
        NAME_UNQUOTED,
        NAME_UNQUOTED_UTF8,
        STRING,
        STRING_UTF8,
        STRING_ESCAPE,
        STRING_ESCAPE_UNICODE,
        LITERAL,
        NUMBER_MINUS,
        NUMBER_PLUS,
        NUMBER_LEADING_ZERO,
        NUMBER_INT,
        NUMBER_DOT,
        NUMBER_FRACTION,
        NUMBER_EXP_MARKER,
        NUMBER_EXP_SIGN,
        NUMBER_EXP_DIGITS
    }

    private final boolean _debugEnabled = LOG.isDebugEnabled();

    protected final CharsToNameCanonicalizer _symbols;

    protected MajorState _majorState = MajorState.INITIAL;
    protected MinorState _minorState = MinorState.NONE;

    protected boolean _endOfInput;

    /**
     * Index of the first byte of the current chunk in the input buffer.
     */
    protected int _currBufferStart;

    /**
     * Length of the current chunk.
     */
    protected int _origBufferLen;

    // The last white space byte was a CR, so an LF that follows does not start another row.
    private boolean _pendingCR;

    // Whether the string in progress is a property name.
    private boolean _parsingName;

    // The quote that ends the string in progress.
    private int _quoteChar;

    // Code point of a multi-byte UTF-8 sequence in progress, or the matched bytes of a BOM.
    private int _pending32;
    private int _pendingBytes;

    // Value and digit count of a unicode escape in progress.
    private int _quoted32;
    private int _quotedDigits;

    private String _literal;
    private int _literalIndex;
    private CirJsonToken _literalToken;
    private double _literalValue;

    protected NonBlockingUtf8CirJsonParserBase(IOContext ioContext, int streamReadFeatures, int formatReadFeatures, CharsToNameCanonicalizer symbols)
    {
        super(ioContext, streamReadFeatures, formatReadFeatures);
        _symbols = symbols;
    }

    /**
     * @param ptr an index between {@link #_inputPtr} and {@link #_inputEnd}
     * @return the byte at the index of the input buffer
     */
    protected abstract byte getByteFromBuffer(int ptr);

    public CharsToNameCanonicalizer getSymbols()
    {
        return _symbols;
    }

    public MajorState getMajorState()
    {
        return _majorState;
    }

    public MinorState getMinorState()
    {
        return _minorState;
    }

    /**
     * @return whether all input fed so far was consumed and more may be fed
     */
    public boolean needMoreInput()
    {
        return _inputPtr >= _inputEnd && !_endOfInput;
    }

    /**
     * Signals that no more input will be fed.
     */
    public void endOfInput()
    {
        if (_debugEnabled)
            LOG.debug("End of input for {}", this);
        _endOfInput = true;
    }

    /**
     * Makes a new chunk of the input buffer current.
     *
     * @param start the index of the first byte of the chunk
     * @param end the index after the last byte of the chunk
     */
    protected void startChunk(int start, int end)
    {
        if (_inputPtr < _inputEnd)
            reportError(String.format("Still have %d undecoded bytes, should not call 'feedInput'", _inputEnd - _inputPtr));
        if (end < start)
            reportError(String.format("Input end (%d) may not be before start (%d)", end, start));
        if (_endOfInput)
            reportError("Already closed, can not feed more input");
        if (_closed)
            reportError("Parser closed, can not feed more input");
        _currInputProcessed += _origBufferLen;
        _streamReadConstraints.validateDocumentLength(_currInputProcessed + (end - start));
        // Keep the start of the current row relative to the new chunk.
        _currInputRowStart = start - (_inputEnd - _currInputRowStart);
        _currBufferStart = start;
        _inputPtr = start;
        _inputEnd = end;
        _origBufferLen = end - start;
        if (_debugEnabled)
            LOG.debug("Fed {} bytes to {}", end - start, this);
    }

    @Override
    public CirJsonLocation currentLocation()
    {
        int col = _inputPtr - _currInputRowStart + 1;
        return new CirJsonLocation(sourceDescription(), _currInputProcessed + (_inputPtr - _currBufferStart), -1L, _currInputRow, col);
    }

    @Override
    public CirJsonLocation currentTokenLocation()
    {
        return new CirJsonLocation(sourceDescription(), _tokenInputTotal, -1L, _tokenInputRow, _tokenInputCol + 1);
    }

    @Override
    protected void releaseBuffers()
    {
        super.releaseBuffers();
        _symbols.release();
    }

    @Override
    public CirJsonToken nextToken()
    {
        if (_closed)
            return _currToken = null;
        if (_currToken != CirJsonToken.NOT_AVAILABLE)
        {
            _numTypesValid = NR_UNKNOWN;
            _binaryValue = null;
        }
        CirJsonToken t = _minorState == MinorState.NONE ? startToken() : continueToken();
        if (t == CirJsonToken.NOT_AVAILABLE && _endOfInput)
            t = finishTokenAtEOF();
        return _currToken = t;
    }

    private void setMajorState(MajorState state)
    {
        if (_debugEnabled)
            LOG.debug("{} --> {}", _majorState, state);
        _majorState = state;
    }

    private CirJsonToken startToken()
    {
        while (_inputPtr < _inputEnd)
        {
            int ch = getByteFromBuffer(_inputPtr++) & 0xFF;
            markTokenStart();

            if (_majorState == MajorState.INITIAL)
            {
                setMajorState(MajorState.ROOT);
                if (ch == 0xEF)
                {
                    _pending32 = 1;
                    _minorState = MinorState.BOM;
                    return continueBom();
                }
            }

            if (ch <= 0x20)
            {
                skipSpace(ch);
                continue;
            }
            _pendingCR = false;

            if (ch == '/' && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_JAVA_COMMENTS))
            {
                _minorState = MinorState.COMMENT_START;
                if (!skipComment())
                    return CirJsonToken.NOT_AVAILABLE;
                continue;
            }
            if (ch == '#' && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_YAML_COMMENTS))
            {
                _minorState = MinorState.COMMENT_LINE;
                if (!skipComment())
                    return CirJsonToken.NOT_AVAILABLE;
                continue;
            }

            switch (_majorState)
            {
                case ROOT:
                    if (ch == ']' || ch == '}')
                        return closeScope(ch);
                    return startValue(ch);

                case ARRAY_FIRST:
                    if (ch == ']' || ch == '}')
                        return closeScope(ch);
                    return startValue(ch);

                case ARRAY_NEXT:
                    if (ch == ']' || ch == '}')
                        return closeScope(ch);
                    if (ch != ',')
                        reportUnexpectedChar(ch, "was expecting comma to separate Array entries");
                    setMajorState(MajorState.ARRAY_AFTER_COMMA);
                    continue;

                case ARRAY_AFTER_COMMA:
                    if ((ch == ']' || ch == '}') && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_TRAILING_COMMA))
                        return closeScope(ch);
                    return startValue(ch);

                case OBJECT_FIRST:
                    if (ch == ']' || ch == '}')
                        return closeScope(ch);
                    return startName(ch);

                case OBJECT_NEXT:
                    if (ch == ']' || ch == '}')
                        return closeScope(ch);
                    if (ch != ',')
                        reportUnexpectedChar(ch, "was expecting comma to separate Object entries");
                    setMajorState(MajorState.OBJECT_AFTER_COMMA);
                    continue;

                case OBJECT_AFTER_COMMA:
                    if ((ch == ']' || ch == '}') && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_TRAILING_COMMA))
                        return closeScope(ch);
                    return startName(ch);

                case OBJECT_COLON:
                    if (ch != ':')
                        reportUnexpectedChar(ch, "was expecting a colon to separate property name and value");
                    setMajorState(MajorState.OBJECT_VALUE);
                    continue;

                case OBJECT_VALUE:
                    return startValue(ch);

                default:
                    throw new IllegalStateException("Unexpected state " + _majorState);
            }
        }
        if (_endOfInput)
            return eofAsNextToken();
        return CirJsonToken.NOT_AVAILABLE;
    }

    private void markTokenStart()
    {
        int ptr = _inputPtr - 1;
        _tokenInputTotal = _currInputProcessed + (ptr - _currBufferStart);
        _tokenInputRow = _currInputRow;
        _tokenInputCol = ptr - _currInputRowStart;
    }

    private void skipSpace(int ch)
    {
        if (ch == '\n')
        {
            if (_pendingCR)
                _pendingCR = false;
            else
                ++_currInputRow;
            _currInputRowStart = _inputPtr;
            return;
        }
        _pendingCR = false;
        if (ch == '\r')
        {
            ++_currInputRow;
            _currInputRowStart = _inputPtr;
            _pendingCR = true;
        }
        else if (ch != ' ' && ch != '\t')
        {
            throwInvalidSpace(ch);
        }
    }

    /**
     * Skips the comment in progress.
     *
     * @return whether the comment ended, or false if more input is needed
     */
    private boolean skipComment()
    {
        while (_inputPtr < _inputEnd)
        {
            int ch = getByteFromBuffer(_inputPtr++) & 0xFF;
            switch (_minorState)
            {
                case COMMENT_START:
                    if (ch == '/')
                        _minorState = MinorState.COMMENT_LINE;
                    else if (ch == '*')
                        _minorState = MinorState.COMMENT_C;
                    else
                        reportUnexpectedChar(ch, "was expecting either '*' or '/' for a comment");
                    break;
                case COMMENT_LINE:
                    if (ch == '\n' || ch == '\r')
                    {
                        skipSpace(ch);
                        _minorState = MinorState.NONE;
                        return true;
                    }
                    break;
                case COMMENT_C_STAR:
                    if (ch == '/')
                    {
                        _pendingCR = false;
                        _minorState = MinorState.NONE;
                        return true;
                    }
                    if (ch != '*')
                    {
                        _minorState = MinorState.COMMENT_C;
                        skipCommentByte(ch);
                    }
                    break;
                case COMMENT_C:
                    if (ch == '*')
                        _minorState = MinorState.COMMENT_C_STAR;
                    else
                        skipCommentByte(ch);
                    break;
                default:
                    throw new IllegalStateException("Not in a comment: " + _minorState);
            }
        }
        return false;
    }

    private void skipCommentByte(int ch)
    {
        if (ch == '\n' || ch == '\r')
            skipSpace(ch);
        else
            _pendingCR = false;
    }

    private CirJsonToken eofAsNextToken()
    {
        handleEOF();
        setMajorState(MajorState.CLOSED);
        close();
        return null;
    }

    private CirJsonToken continueToken()
    {
        switch (_minorState)
        {
            case BOM:
                return continueBom();
            case COMMENT_START:
            case COMMENT_LINE:
            case COMMENT_C:
            case COMMENT_C_STAR:
                if (!skipComment())
                    return CirJsonToken.NOT_AVAILABLE;
                return startToken();
            case NAME_UNQUOTED:
            case NAME_UNQUOTED_UTF8:
                return continueUnquotedName();
            case STRING:
            case STRING_UTF8:
            case STRING_ESCAPE:
            case STRING_ESCAPE_UNICODE:
                return continueString();
            case LITERAL:
                return continueLiteral();
            default:
                return continueNumber();
        }
    }

    private CirJsonToken finishTokenAtEOF()
    {
        switch (_minorState)
        {
            case NUMBER_INT:
            case NUMBER_LEADING_ZERO:
            case NUMBER_FRACTION:
            case NUMBER_EXP_DIGITS:
                return completeNumber();
            case NUMBER_MINUS:
            case NUMBER_PLUS:
                reportInvalidEOF(" in a Number value", CirJsonToken.VALUE_NUMBER_INT);
                break;
            case NUMBER_DOT:
                if (allowsTrailingDecimalPoint())
                    return completeNumber();
                reportInvalidNumber("Decimal point not followed by a digit");
                break;
            case COMMENT_LINE:
                _minorState = MinorState.NONE;
                return startToken();
            case COMMENT_START:
            case COMMENT_C:
            case COMMENT_C_STAR:
                reportInvalidEOF(" in a comment", null);
                break;
            case NAME_UNQUOTED:
                return finishName();
            case NAME_UNQUOTED_UTF8:
                reportInvalidEOF(" in a name", CirJsonToken.PROPERTY_NAME);
                break;
            case NUMBER_EXP_MARKER:
            case NUMBER_EXP_SIGN:
                reportInvalidNumber("Exponent indicator not followed by a digit");
                break;
            case STRING_ESCAPE:
            case STRING_ESCAPE_UNICODE:
                reportInvalidEOF(" in character escape sequence", CirJsonToken.VALUE_STRING);
                break;
            case STRING:
            case STRING_UTF8:
                reportInvalidEOF(": was expecting closing quote for a " + stringDescription(), CirJsonToken.VALUE_STRING);
                break;
            case LITERAL:
                reportInvalidEOF(" in a value", null);
                break;
            case BOM:
                reportInvalidEOF(" in a byte order mark", null);
                break;
            default:
                break;
        }
        throw new IllegalStateException("No token in progress at end of input: " + _minorState);
    }

    private CirJsonToken continueBom()
    {
        while (_pending32 < 3)
        {
            if (_inputPtr >= _inputEnd)
                return CirJsonToken.NOT_AVAILABLE;
            int ch = getByteFromBuffer(_inputPtr) & 0xFF;
            int expected = _pending32 == 1 ? 0xBB : 0xBF;
            if (ch != expected)
                reportError(String.format("Unexpected byte 0x%02x following 0xEF; should get 0x%02x as part of UTF-8 BOM", ch, expected));
            ++_inputPtr;
            ++_pending32;
        }
        _minorState = MinorState.NONE;
        // The byte order mark does not count as a column.
        _currInputRowStart = _inputPtr;
        return startToken();
    }

    private CirJsonToken closeScope(int ch)
    {
        if (ch == ']')
        {
            if (!_parsingContext.inArray())
                reportMismatchedEndMarker(ch, '}');
            _parsingContext = _parsingContext.clearAndGetParent();
            setMajorState(afterValueState());
            return CirJsonToken.END_ARRAY;
        }
        if (!_parsingContext.inObject())
            reportMismatchedEndMarker(ch, ']');
        _parsingContext = _parsingContext.clearAndGetParent();
        setMajorState(afterValueState());
        return CirJsonToken.END_OBJECT;
    }

    private MajorState afterValueState()
    {
        if (_parsingContext.inArray())
            return MajorState.ARRAY_NEXT;
        if (_parsingContext.inObject())
            return MajorState.OBJECT_NEXT;
        return MajorState.ROOT;
    }

    private CirJsonToken valueComplete(CirJsonToken t)
    {
        _minorState = MinorState.NONE;
        setMajorState(afterValueState());
        return t;
    }

    private CirJsonToken startName(int ch)
    {
        _parsingContext.expectComma();
        _parsingName = true;
        _textBuffer.resetWithEmpty();
        if (ch == '"' || (ch == '\'' && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_SINGLE_QUOTES)))
        {
            _quoteChar = ch;
            _minorState = MinorState.STRING;
            return continueString();
        }
        if (!isEnabledFormatFeature(CirJsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES))
            reportUnexpectedChar(ch, "was expecting double-quote to start property name");
        // The first char is read again, as part of the name.
        --_inputPtr;
        _minorState = MinorState.NAME_UNQUOTED;
        return continueUnquotedName();
    }

    private CirJsonToken continueUnquotedName()
    {
        while (_inputPtr < _inputEnd)
        {
            int c = getByteFromBuffer(_inputPtr) & 0xFF;
            if (_minorState == MinorState.NAME_UNQUOTED_UTF8)
            {
                ++_inputPtr;
                if ((c & 0xC0) != 0x80)
                    reportError(String.format("Invalid UTF-8 middle byte 0x%x", c));
                _pending32 = (_pending32 << 6) | (c & 0x3F);
                if (--_pendingBytes > 0)
                    continue;
                _minorState = MinorState.NAME_UNQUOTED;
                if (!appendNameChar(_pending32))
                    reportUnexpectedChar(_pending32, "was expecting a colon to separate property name and value");
            }
            else if (c < 0x80)
            {
                if (!appendNameChar(c))
                    return finishName();
                ++_inputPtr;
            }
            else
            {
                ++_inputPtr;
                int code = CharTypes.inputCodeUtf8(c);
                if (code < 2)
                    reportError(String.format("Invalid UTF-8 start byte 0x%x", c));
                _pendingBytes = code - 1;
                _pending32 = c & (code == 2 ? 0x1F : code == 3 ? 0x0F : 0x07);
                _minorState = MinorState.NAME_UNQUOTED_UTF8;
            }
        }
        return CirJsonToken.NOT_AVAILABLE;
    }

    /**
     * Appends a char of an unquoted name.
     *
     * @return whether the char belongs to the name
     */
    private boolean appendNameChar(int c)
    {
        if (_textBuffer.size() == 0)
        {
            if (!CharTypes.isNameStart(c))
                reportUnexpectedChar(c, "was expecting either valid name character (for unquoted name) or double-quote (for quoted) to start property name");
        }
        else if (!CharTypes.isNamePart(c))
        {
            return false;
        }
        _textBuffer.append((char)c);
        return true;
    }

    private CirJsonToken finishName()
    {
        char[] chars = _textBuffer.getTextBuffer();
        int offset = _textBuffer.getTextOffset();
        int length = _textBuffer.size();
        _streamReadConstraints.validateNameLength(length);
        String name = _symbols.findSymbol(chars, offset, length, _symbols.calcHash(chars, offset, length));
        _minorState = MinorState.NONE;
        CirJsonToken t = setPropertyName(name);
        setMajorState(MajorState.OBJECT_COLON);
        return t;
    }

    private CirJsonToken startValue(int ch)
    {
        if (!_parsingContext.inObject())
            _parsingContext.expectComma();
        switch (ch)
        {
            case '"':
                _parsingName = false;
                _quoteChar = ch;
                _textBuffer.resetWithEmpty();
                _minorState = MinorState.STRING;
                return continueString();
            case '\'':
                if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_SINGLE_QUOTES))
                {
                    _parsingName = false;
                    _quoteChar = ch;
                    _textBuffer.resetWithEmpty();
                    _minorState = MinorState.STRING;
                    return continueString();
                }
                break;
            case '[':
                createChildArrayContext(_tokenInputRow, _tokenInputCol + 1);
                setMajorState(MajorState.ARRAY_FIRST);
                return CirJsonToken.START_ARRAY;
            case '{':
                createChildObjectContext(_tokenInputRow, _tokenInputCol + 1);
                setMajorState(MajorState.OBJECT_FIRST);
                return CirJsonToken.START_OBJECT;
            case 't':
                return startLiteral("true", 1, CirJsonToken.VALUE_TRUE, 0.0);
            case 'f':
                return startLiteral("false", 1, CirJsonToken.VALUE_FALSE, 0.0);
            case 'n':
                return startLiteral("null", 1, CirJsonToken.VALUE_NULL, 0.0);
            case '-':
                startNumber(true);
                _minorState = MinorState.NUMBER_MINUS;
                return continueNumber();
            case '0':
                startNumber(false);
                _textBuffer.append('0');
                _intLength = 1;
                _minorState = MinorState.NUMBER_LEADING_ZERO;
                return continueNumber();
            case '1':
            case '2':
            case '3':
            case '4':
            case '5':
            case '6':
            case '7':
            case '8':
            case '9':
                startNumber(false);
                _textBuffer.append((char)ch);
                _intLength = 1;
                _minorState = MinorState.NUMBER_INT;
                return continueNumber();
            case 'N':
                if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS))
                    return startLiteral("NaN", 1, CirJsonToken.VALUE_NUMBER_FLOAT, Double.NaN);
                break;
            case 'I':
                if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS))
                    return startLiteral("Infinity", 1, CirJsonToken.VALUE_NUMBER_FLOAT, Double.POSITIVE_INFINITY);
                break;
            case '+':
                if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS))
                {
                    startNumber(false);
                    _minorState = MinorState.NUMBER_PLUS;
                    return continueNumber();
                }
                if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS))
                    return startLiteral("+Infinity", 1, CirJsonToken.VALUE_NUMBER_FLOAT, Double.POSITIVE_INFINITY);
                break;
            case '.':
                if (isEnabledFormatFeature(CirJsonReadFeature.ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS))
                {
                    startNumber(false);
                    _textBuffer.append('.');
                    _minorState = MinorState.NUMBER_DOT;
                    return continueNumber();
                }
                break;
            case ',':
            case ']':
                if (_parsingContext.inArray() && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_MISSING_VALUES))
                {
                    // The separator is read again as such.
                    --_inputPtr;
                    return valueComplete(CirJsonToken.VALUE_NULL);
                }
                break;
            default:
                break;
        }
        reportUnexpectedValueChar(ch);
        return null;
    }

    private CirJsonToken startLiteral(String literal, int matched, CirJsonToken token, double value)
    {
        _literal = literal;
        _literalIndex = matched;
        _literalToken = token;
        _literalValue = value;
        _minorState = MinorState.LITERAL;
        return continueLiteral();
    }

    private CirJsonToken continueLiteral()
    {
        String literal = _literal;
        while (_literalIndex < literal.length())
        {
            if (_inputPtr >= _inputEnd)
                return CirJsonToken.NOT_AVAILABLE;
            int ch = getByteFromBuffer(_inputPtr) & 0xFF;
            if (ch != literal.charAt(_literalIndex))
                reportInvalidToken(literal.substring(0, _literalIndex), ch);
            ++_inputPtr;
            ++_literalIndex;
        }
        if (_literalToken == CirJsonToken.VALUE_NUMBER_FLOAT)
            return valueComplete(resetAsNaN(literal, _literalValue));
        return valueComplete(_literalToken);
    }

    private void startNumber(boolean negative)
    {
        _textBuffer.resetWithEmpty();
        if (negative)
            _textBuffer.append('-');
        _numberNegative = negative;
        _intLength = 0;
        _fractLength = 0;
        _expLength = 0;
    }

    private CirJsonToken continueNumber()
    {
        while (_inputPtr < _inputEnd)
        {
            int ch = getByteFromBuffer(_inputPtr) & 0xFF;
            switch (_minorState)
            {
                case NUMBER_MINUS:
                case NUMBER_PLUS:
                    if (ch == 'I' && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS))
                    {
                        ++_inputPtr;
                        if (_numberNegative)
                            return startLiteral("-Infinity", 2, CirJsonToken.VALUE_NUMBER_FLOAT, Double.NEGATIVE_INFINITY);
                        return startLiteral("+Infinity", 2, CirJsonToken.VALUE_NUMBER_FLOAT, Double.POSITIVE_INFINITY);
                    }
                    if (ch == '.' && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS))
                    {
                        ++_inputPtr;
                        _textBuffer.append('.');
                        _minorState = MinorState.NUMBER_DOT;
                        break;
                    }
                    if (!isDigit(ch))
                        reportUnexpectedChar(ch, "expected digit (0-9) to follow " + (_numberNegative ? "minus" : "plus") + " sign, for valid numeric value");
                    ++_inputPtr;
                    _textBuffer.append((char)ch);
                    _intLength = 1;
                    _minorState = ch == '0' ? MinorState.NUMBER_LEADING_ZERO : MinorState.NUMBER_INT;
                    break;

                case NUMBER_LEADING_ZERO:
                    if (!isDigit(ch))
                    {
                        _minorState = MinorState.NUMBER_INT;
                        break;
                    }
                    if (!isEnabledFormatFeature(CirJsonReadFeature.ALLOW_LEADING_ZEROS_FOR_NUMBERS))
                        reportInvalidNumber("Leading zeroes not allowed");
                    ++_inputPtr;
                    if (ch != '0')
                    {
                        // Replace the single zero kept so far by the first significant digit.
                        _textBuffer.setCurrentLength(_textBuffer.getCurrentSegmentSize() - 1);
                        _textBuffer.append((char)ch);
                        _minorState = MinorState.NUMBER_INT;
                    }
                    break;

                case NUMBER_INT:
                    if (isDigit(ch))
                    {
                        ++_inputPtr;
                        _textBuffer.append((char)ch);
                        ++_intLength;
                    }
                    else if (ch == '.')
                    {
                        ++_inputPtr;
                        _textBuffer.append('.');
                        _minorState = MinorState.NUMBER_DOT;
                    }
                    else if (ch == 'e' || ch == 'E')
                    {
                        ++_inputPtr;
                        _textBuffer.append((char)ch);
                        _minorState = MinorState.NUMBER_EXP_MARKER;
                    }
                    else
                    {
                        return completeNumber();
                    }
                    break;

                case NUMBER_DOT:
                    if (!isDigit(ch))
                    {
                        if (!allowsTrailingDecimalPoint())
                            reportInvalidNumber("Decimal point not followed by a digit");
                        if (ch != 'e' && ch != 'E')
                            return completeNumber();
                        ++_inputPtr;
                        _textBuffer.append((char)ch);
                        _minorState = MinorState.NUMBER_EXP_MARKER;
                        break;
                    }
                    ++_inputPtr;
                    _textBuffer.append((char)ch);
                    ++_fractLength;
                    _minorState = MinorState.NUMBER_FRACTION;
                    break;

                case NUMBER_FRACTION:
                    if (isDigit(ch))
                    {
                        ++_inputPtr;
                        _textBuffer.append((char)ch);
                        ++_fractLength;
                    }
                    else if (ch == 'e' || ch == 'E')
                    {
                        ++_inputPtr;
                        _textBuffer.append((char)ch);
                        _minorState = MinorState.NUMBER_EXP_MARKER;
                    }
                    else
                    {
                        return completeNumber();
                    }
                    break;

                case NUMBER_EXP_MARKER:
                    if (ch == '+' || ch == '-')
                    {
                        ++_inputPtr;
                        _textBuffer.append((char)ch);
                        _minorState = MinorState.NUMBER_EXP_SIGN;
                        break;
                    }
                    if (!isDigit(ch))
                        reportInvalidNumber("Exponent indicator not followed by a digit");
                    ++_inputPtr;
                    _textBuffer.append((char)ch);
                    ++_expLength;
                    _minorState = MinorState.NUMBER_EXP_DIGITS;
                    break;

                case NUMBER_EXP_SIGN:
                    if (!isDigit(ch))
                        reportInvalidNumber("Exponent indicator not followed by a digit");
                    ++_inputPtr;
                    _textBuffer.append((char)ch);
                    ++_expLength;
                    _minorState = MinorState.NUMBER_EXP_DIGITS;
                    break;

                case NUMBER_EXP_DIGITS:
                    if (!isDigit(ch))
                        return completeNumber();
                    ++_inputPtr;
                    _textBuffer.append((char)ch);
                    ++_expLength;
                    break;

                default:
                    throw new IllegalStateException("Not in a number: " + _minorState);
            }
        }
        return CirJsonToken.NOT_AVAILABLE;
    }

    // A number such as "1." ends after its decimal point only with digits before it.
    private boolean allowsTrailingDecimalPoint()
    {
        return _intLength > 0 && isEnabledFormatFeature(CirJsonReadFeature.ALLOW_TRAILING_DECIMAL_POINT_FOR_NUMBERS);
    }

    private CirJsonToken completeNumber()
    {
        CirJsonToken t;
        if (_minorState == MinorState.NUMBER_INT || _minorState == MinorState.NUMBER_LEADING_ZERO)
            t = resetInt(_numberNegative, _intLength);
        else
            t = resetFloat(_numberNegative, _intLength, _fractLength, _expLength);
        return valueComplete(t);
    }

    private String stringDescription()
    {
        return _parsingName ? "name" : "string value";
    }

    private CirJsonToken continueString()
    {
        while (_inputPtr < _inputEnd)
        {
            switch (_minorState)
            {
                case STRING:
                {
                    int c = getByteFromBuffer(_inputPtr++) & 0xFF;
                    if (c == _quoteChar)
                    {
                        if (_parsingName)
                            return finishName();
                        return valueComplete(CirJsonToken.VALUE_STRING);
                    }
                    int code = CharTypes.inputCodeUtf8(c);
                    if (code == 0 || c == '"')
                    {
                        _textBuffer.append((char)c);
                    }
                    else if (c == '\\')
                    {
                        _minorState = MinorState.STRING_ESCAPE;
                    }
                    else if (code > 1)
                    {
                        _pendingBytes = code - 1;
                        _pending32 = c & (code == 2 ? 0x1F : code == 3 ? 0x0F : 0x07);
                        _minorState = MinorState.STRING_UTF8;
                    }
                    else if (c < 0x20)
                    {
                        throwUnquotedSpace(c, stringDescription());
                        _textBuffer.append((char)c);
                    }
                    else
                    {
                        reportError(String.format("Invalid UTF-8 start byte 0x%x", c));
                    }
                    break;
                }
                case STRING_UTF8:
                {
                    int c = getByteFromBuffer(_inputPtr++) & 0xFF;
                    if ((c & 0xC0) != 0x80)
                        reportError(String.format("Invalid UTF-8 middle byte 0x%x", c));
                    _pending32 = (_pending32 << 6) | (c & 0x3F);
                    if (--_pendingBytes == 0)
                    {
                        appendCodePoint(_pending32);
                        _minorState = MinorState.STRING;
                    }
                    break;
                }
                case STRING_ESCAPE:
                {
                    int c = getByteFromBuffer(_inputPtr++) & 0xFF;
                    if (c == 'u')
                    {
                        _quoted32 = 0;
                        _quotedDigits = 0;
                        _minorState = MinorState.STRING_ESCAPE_UNICODE;
                    }
                    else
                    {
                        _textBuffer.append(decodeEscapeChar(c));
                        _minorState = MinorState.STRING;
                    }
                    break;
                }
                case STRING_ESCAPE_UNICODE:
                {
                    int c = getByteFromBuffer(_inputPtr++) & 0xFF;
                    int digit = CharTypes.charToHex(c);
                    if (digit < 0)
                        reportUnexpectedChar(c, "expected a hex-digit for character escape sequence");
                    _quoted32 = (_quoted32 << 4) | digit;
                    if (++_quotedDigits == 4)
                    {
                        _textBuffer.append((char)_quoted32);
                        _minorState = MinorState.STRING;
                    }
                    break;
                }
                default:
                    throw new IllegalStateException("Not in a string: " + _minorState);
            }
        }
        return CirJsonToken.NOT_AVAILABLE;
    }

    private void appendCodePoint(int cp)
    {
        if (cp > 0xFFFF)
        {
            cp -= 0x10000;
            _textBuffer.append((char)(0xD800 | (cp >> 10)));
            _textBuffer.append((char)(0xDC00 | (cp & 0x3FF)));
        }
        else
        {
            _textBuffer.append((char)cp);
        }
    }

    private static boolean isDigit(int ch)
    {
        return ch >= '0' && ch <= '9';
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s/%s,%s,%s,closed=%b]", getClass().getSimpleName(), hashCode(), _majorState, _minorState, _currToken, _parsingContext, _closed);
    }
}
