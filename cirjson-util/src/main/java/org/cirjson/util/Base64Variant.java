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

package org.cirjson.util;

import java.util.Arrays;
import java.util.Objects;

/**
 * <p>A Base64 encoding variant: alphabet, padding and line length.</p>
 * <p>The standard variants are in {@link Base64Variants}. Variants are immutable;
 * the {@code with*} methods return a copy that differs in how padding is handled.</p>
 */
public final class Base64Variant
{
    /**
     * How padding is handled when decoding.
     */
    public enum PaddingReadBehaviour
    {
        /**
         * Padding is not allowed; an error is thrown if found.
         */
        PADDING_FORBIDDEN,
        /**
         * Padding is required; an error is thrown if missing.
         */
        PADDING_REQUIRED,
        /**
         * Padding is allowed but not required.
         */
        PADDING_ALLOWED
    }

    /**
     * Decoding marker for characters that are not part of the alphabet.
     */
    public static final int BASE64_VALUE_INVALID = -1;

    /**
     * Decoding marker for the padding character.
     */
    public static final int BASE64_VALUE_PADDING = -2;

    static final char PADDING_CHAR_NONE = '\0';

    private final int[] _asciiToBase64 = new int[128];
    private final char[] _base64ToAsciiC = new char[64];

    private final String _name;
    private final boolean _writePadding;
    private final char _paddingChar;
    private final int _maxLineLength;
    private final PaddingReadBehaviour _paddingReadBehaviour;

    public Base64Variant(String name, String alphabet, boolean writePadding, char paddingChar, int maxLineLength)
    {
        _name = name;
        _writePadding = writePadding;
        _paddingChar = paddingChar;
        _maxLineLength = maxLineLength;

        int length = alphabet.length();
        if (length != 64)
            throw new IllegalArgumentException("Base64Alphabet length must be exactly 64 (was " + length + ")");

        alphabet.getChars(0, length, _base64ToAsciiC, 0);
        Arrays.fill(_asciiToBase64, BASE64_VALUE_INVALID);
        for (int i = 0; i < length; ++i)
        {
            char alpha = _base64ToAsciiC[i];
            _asciiToBase64[alpha] = i;
        }
        if (writePadding)
            _asciiToBase64[paddingChar] = BASE64_VALUE_PADDING;

        _paddingReadBehaviour = writePadding ? PaddingReadBehaviour.PADDING_REQUIRED : PaddingReadBehaviour.PADDING_FORBIDDEN;
    }

    /**
     * Copies a variant with a different name and line length.
     */
    public Base64Variant(Base64Variant base, String name, int maxLineLength)
    {
        this(base, name, base._writePadding, base._paddingChar, maxLineLength);
    }

    /**
     * Copies a variant's alphabet with different padding and line length.
     */
    public Base64Variant(Base64Variant base, String name, boolean writePadding, char paddingChar, int maxLineLength)
    {
        this(base, name, writePadding, paddingChar, base._paddingReadBehaviour, maxLineLength);
    }

    private Base64Variant(Base64Variant base, String name, boolean writePadding, char paddingChar, PaddingReadBehaviour paddingReadBehaviour, int maxLineLength)
    {
        _name = name;
        System.arraycopy(base._base64ToAsciiC, 0, _base64ToAsciiC, 0, 64);
        System.arraycopy(base._asciiToBase64, 0, _asciiToBase64, 0, 128);
        _writePadding = writePadding;
        _paddingChar = paddingChar;
        _maxLineLength = maxLineLength;
        _paddingReadBehaviour = paddingReadBehaviour;
    }

    public Base64Variant withPaddingAllowed()
    {
        return withReadPadding(PaddingReadBehaviour.PADDING_ALLOWED);
    }

    public Base64Variant withPaddingRequired()
    {
        return withReadPadding(PaddingReadBehaviour.PADDING_REQUIRED);
    }

    public Base64Variant withPaddingForbidden()
    {
        return withReadPadding(PaddingReadBehaviour.PADDING_FORBIDDEN);
    }

    public Base64Variant withReadPadding(PaddingReadBehaviour readPadding)
    {
        if (readPadding == _paddingReadBehaviour)
            return this;
        return new Base64Variant(this, _name, _writePadding, _paddingChar, readPadding, _maxLineLength);
    }

    public Base64Variant withWritePadding(boolean writePadding)
    {
        if (writePadding == _writePadding)
            return this;
        return new Base64Variant(this, _name, writePadding, _paddingChar, _paddingReadBehaviour, _maxLineLength);
    }

    public String getName()
    {
        return _name;
    }

    public boolean usesPadding()
    {
        return _writePadding;
    }

    public boolean requiresPaddingOnRead()
    {
        return _paddingReadBehaviour == PaddingReadBehaviour.PADDING_REQUIRED;
    }

    public boolean acceptsPaddingOnRead()
    {
        return _paddingReadBehaviour != PaddingReadBehaviour.PADDING_FORBIDDEN;
    }

    public boolean usesPaddingChar(char c)
    {
        return c == _paddingChar;
    }

    public boolean usesPaddingChar(int ch)
    {
        return ch == (int)_paddingChar;
    }

    public PaddingReadBehaviour getPaddingReadBehaviour()
    {
        return _paddingReadBehaviour;
    }

    public char getPaddingChar()
    {
        return _paddingChar;
    }

    public int getMaxLineLength()
    {
        return _maxLineLength;
    }

    /**
     * @return the 6-bit value of the char, {@link #BASE64_VALUE_PADDING} for the padding
     * char, or {@link #BASE64_VALUE_INVALID}
     */
    public int decodeBase64Char(char c)
    {
        return c <= 127 ? _asciiToBase64[c] : BASE64_VALUE_INVALID;
    }

    public int decodeBase64Char(int ch)
    {
        return ch >= 0 && ch <= 127 ? _asciiToBase64[ch] : BASE64_VALUE_INVALID;
    }

    public char encodeBase64BitsAsChar(int value)
    {
        return _base64ToAsciiC[value];
    }

    /**
     * Encodes 24 bits as 4 chars.
     *
     * @return the offset after the last char written
     */
    public int encodeBase64Chunk(int b24, char[] buffer, int offset)
    {
        buffer[offset++] = _base64ToAsciiC[(b24 >> 18) & 0x3F];
        buffer[offset++] = _base64ToAsciiC[(b24 >> 12) & 0x3F];
        buffer[offset++] = _base64ToAsciiC[(b24 >> 6) & 0x3F];
        buffer[offset++] = _base64ToAsciiC[b24 & 0x3F];
        return offset;
    }

    public void encodeBase64Chunk(StringBuilder builder, int b24)
    {
        builder.append(_base64ToAsciiC[(b24 >> 18) & 0x3F]);
        builder.append(_base64ToAsciiC[(b24 >> 12) & 0x3F]);
        builder.append(_base64ToAsciiC[(b24 >> 6) & 0x3F]);
        builder.append(_base64ToAsciiC[b24 & 0x3F]);
    }

    /**
     * Encodes the last 1 or 2 bytes of input, left-aligned in the 24 bits.
     *
     * @return the offset after the last char written
     */
    public int encodeBase64Partial(int bits, int outputBytes, char[] buffer, int offset)
    {
        buffer[offset++] = _base64ToAsciiC[(bits >> 18) & 0x3F];
        buffer[offset++] = _base64ToAsciiC[(bits >> 12) & 0x3F];
        if (_writePadding)
        {
            buffer[offset++] = outputBytes == 2 ? _base64ToAsciiC[(bits >> 6) & 0x3F] : _paddingChar;
            buffer[offset++] = _paddingChar;
        }
        else if (outputBytes == 2)
        {
            buffer[offset++] = _base64ToAsciiC[(bits >> 6) & 0x3F];
        }
        return offset;
    }

    public void encodeBase64Partial(StringBuilder builder, int bits, int outputBytes)
    {
        builder.append(_base64ToAsciiC[(bits >> 18) & 0x3F]);
        builder.append(_base64ToAsciiC[(bits >> 12) & 0x3F]);
        if (_writePadding)
        {
            builder.append(outputBytes == 2 ? _base64ToAsciiC[(bits >> 6) & 0x3F] : _paddingChar);
            builder.append(_paddingChar);
        }
        else if (outputBytes == 2)
        {
            builder.append(_base64ToAsciiC[(bits >> 6) & 0x3F]);
        }
    }

    public String encode(byte[] input)
    {
        return encode(input, false);
    }

    /**
     * Encodes with line feeds written as the two-char escape {@code \n}, as needed inside
     * a quoted string value.
     */
    public String encode(byte[] input, boolean addQuotes)
    {
        return encode(input, addQuotes, "\\n");
    }

    public String encode(byte[] input, boolean addQuotes, String linefeed)
    {
        int inputEnd = input.length;
        StringBuilder builder = new StringBuilder(inputEnd + (inputEnd >> 2) + (inputEnd >> 3));
        if (addQuotes)
            builder.append('"');

        int chunksBeforeLF = _maxLineLength >> 2;
        int inputPtr = 0;
        int safeInputEnd = inputEnd - 3;
        while (inputPtr <= safeInputEnd)
        {
            int b24 = input[inputPtr++] << 8;
            b24 |= input[inputPtr++] & 0xFF;
            b24 = (b24 << 8) | (input[inputPtr++] & 0xFF);
            encodeBase64Chunk(builder, b24);
            if (--chunksBeforeLF <= 0)
            {
                builder.append(linefeed);
                chunksBeforeLF = _maxLineLength >> 2;
            }
        }

        int inputLeft = inputEnd - inputPtr;
        if (inputLeft > 0)
        {
            int b24 = input[inputPtr++] << 16;
            if (inputLeft == 2)
                b24 |= (input[inputPtr] & 0xFF) << 8;
            encodeBase64Partial(builder, b24, inputLeft);
        }

        if (addQuotes)
            builder.append('"');
        return builder.toString();
    }

    /**
     * @throws IllegalArgumentException if the input is not valid for this variant
     */
    public byte[] decode(String input)
    {
        try (ByteArrayBuilder builder = new ByteArrayBuilder())
        {
            decode(input, builder);
            return builder.toByteArray();
        }
    }

    /**
     * Decodes the input, appending to the builder. White space is allowed between
     * 4-char units.
     *
     * @throws IllegalArgumentException if the input is not valid for this variant
     */
    public void decode(String input, ByteArrayBuilder builder)
    {
        int ptr = 0;
        int length = input.length();

        while (true)
        {
            char c;
            do
            {
                if (ptr >= length)
                    return;
                c = input.charAt(ptr++);
            }
            while (c <= ' ');

            int bits = decodeBase64Char(c);
            if (bits < 0)
                throw invalidBase64(c, 0, null);
            if (ptr >= length)
                throw missingPadding();

            c = input.charAt(ptr++);
            int decoded = bits;
            bits = decodeBase64Char(c);
            if (bits < 0)
                throw invalidBase64(c, 1, null);
            decoded = (decoded << 6) | bits;

            if (ptr >= length)
            {
                if (!requiresPaddingOnRead())
                {
                    builder.append(decoded >> 4);
                    return;
                }
                throw missingPadding();
            }

            c = input.charAt(ptr++);
            bits = decodeBase64Char(c);
            if (bits < 0)
            {
                if (bits != BASE64_VALUE_PADDING)
                    throw invalidBase64(c, 2, null);
                if (!acceptsPaddingOnRead())
                    throw unexpectedPadding();
                if (ptr >= length)
                    throw missingPadding();
                c = input.charAt(ptr++);
                if (!usesPaddingChar(c))
                    throw invalidBase64(c, 3, "expected padding character '" + _paddingChar + "'");
                builder.append(decoded >> 4);
                continue;
            }
            decoded = (decoded << 6) | bits;

            if (ptr >= length)
            {
                if (!requiresPaddingOnRead())
                {
                    builder.appendTwoBytes(decoded >> 2);
                    return;
                }
                throw missingPadding();
            }

            c = input.charAt(ptr++);
            bits = decodeBase64Char(c);
            if (bits < 0)
            {
                if (bits != BASE64_VALUE_PADDING)
                    throw invalidBase64(c, 3, null);
                if (!acceptsPaddingOnRead())
                    throw unexpectedPadding();
                builder.appendTwoBytes(decoded >> 2);
            }
            else
            {
                decoded = (decoded << 6) | bits;
                builder.appendThreeBytes(decoded);
            }
        }
    }

    /**
     * @param c the offending char
     * @param index the position of the char in its 4-char unit
     * @param message an optional detail message
     * @return the exception to throw
     */
    public IllegalArgumentException invalidBase64(char c, int index, String message)
    {
        String base;
        if (c <= ' ')
            base = String.format("Illegal white space character (code 0x%s) as character #%d of 4-char base64 unit: can only used between units", Integer.toHexString(c), index + 1);
        else if (usesPaddingChar(c))
            base = String.format("Unexpected padding character ('%c') as character #%d of 4-char base64 unit: padding only legal as 3rd or 4th character", _paddingChar, index + 1);
        else if (!Character.isDefined(c) || Character.isISOControl(c))
            base = String.format("Illegal character (code 0x%s) in base64 content", Integer.toHexString(c));
        else
            base = String.format("Illegal character '%c' (code 0x%s) in base64 content", c, Integer.toHexString(c));
        if (message != null)
            base = base + ": " + message;
        return new IllegalArgumentException(base);
    }

    public IllegalArgumentException missingPadding()
    {
        return new IllegalArgumentException(missingPaddingMessage());
    }

    public String missingPaddingMessage()
    {
        return String.format("Unexpected end of base64-encoded String: base64 variant '%s' expects padding (one or more '%c' characters) at the end. This Base64Variant might have been incorrectly configured", _name, _paddingChar);
    }

    public IllegalArgumentException unexpectedPadding()
    {
        return new IllegalArgumentException(unexpectedPaddingMessage());
    }

    public String unexpectedPaddingMessage()
    {
        return String.format("Unexpected end of base64-encoded String: base64 variant '%s' expects no padding at the end while decoding. This Base64Variant might have been incorrectly configured", _name);
    }

    @Override
    public boolean equals(Object o)
    {
        if (o == this)
            return true;
        if (o == null || o.getClass() != getClass())
            return false;
        Base64Variant other = (Base64Variant)o;
        return other._paddingChar == _paddingChar &&
            other._maxLineLength == _maxLineLength &&
            other._writePadding == _writePadding &&
            other._paddingReadBehaviour == _paddingReadBehaviour &&
            _name.equals(other._name);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_name, _paddingChar, _maxLineLength, _writePadding, _paddingReadBehaviour);
    }

    @Override
    public String toString()
    {
        return _name;
    }
}
