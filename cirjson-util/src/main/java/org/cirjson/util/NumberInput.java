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

import java.math.BigDecimal;
import java.math.BigInteger;

import ch.randelshofer.fastdoubleparser.JavaBigDecimalParser;
import ch.randelshofer.fastdoubleparser.JavaBigIntegerParser;
import ch.randelshofer.fastdoubleparser.JavaDoubleParser;
import ch.randelshofer.fastdoubleparser.JavaFloatParser;

/**
 * <p>Text to number conversions.</p>
 * <p>The {@code char[]} variants expect input already validated by a tokenizer: an optional
 * leading minus sign followed by digits. The {@code String} variants validate their input
 * and throw {@link NumberFormatException} when it is not a number or does not fit the
 * target type; narrowing never wraps around.</p>
 * <p>The floating point and big number conversions take a {@code useFastParser} flag that
 * selects the parsers of the {@code fastdoubleparser} library over the JDK ones. Both give
 * the same values.</p>
 */
public final class NumberInput
{
    /**
     * Numbers with more digits than this are always out of the long range.
     */
    static final String MIN_LONG_STRING_NO_SIGN = "9223372036854775808";
    static final String MAX_LONG_STRING = "9223372036854775807";

    private NumberInput()
    {
    }

    /**
     * Parses a run of at most 9 digits, optionally preceded by a minus sign.
     */
    public static int parseInt(char[] chars, int offset, int length)
    {
        boolean negative = length > 0 && chars[offset] == '-';
        if (negative)
        {
            ++offset;
            --length;
        }
        int num = 0;
        int end = offset + length;
        for (int i = offset; i < end; ++i)
        {
            num = num * 10 + (chars[i] - '0');
        }
        return negative ? -num : num;
    }

    /**
     * Parses a run of digits that fits in a long, optionally preceded by a minus sign.
     */
    public static long parseLong(char[] chars, int offset, int length)
    {
        boolean negative = length > 0 && chars[offset] == '-';
        if (negative)
        {
            ++offset;
            --length;
        }
        // Accumulate negatively so that Long.MIN_VALUE fits.
        long num = 0;
        int end = offset + length;
        for (int i = offset; i < end; ++i)
        {
            num = num * 10 - (chars[i] - '0');
        }
        return negative ? num : -num;
    }

    /**
     * @param chars the digits, without sign
     * @param offset the offset of the first digit
     * @param length the number of digits
     * @param negative whether the number is negative
     * @return whether the number fits in a long
     */
    public static boolean inLongRange(char[] chars, int offset, int length, boolean negative)
    {
        String cmpStr = negative ? MIN_LONG_STRING_NO_SIGN : MAX_LONG_STRING;
        int cmpLength = cmpStr.length();
        if (length < cmpLength)
            return true;
        if (length > cmpLength)
            return false;
        for (int i = 0; i < cmpLength; ++i)
        {
            int diff = chars[offset + i] - cmpStr.charAt(i);
            if (diff != 0)
                return diff < 0;
        }
        return true;
    }

    public static boolean inLongRange(String digits, boolean negative)
    {
        return inLongRange(digits.toCharArray(), 0, digits.length(), negative);
    }

    /**
     * @throws NumberFormatException if the text is not an int
     */
    public static int parseInt(String text)
    {
        return Integer.parseInt(text.trim());
    }

    /**
     * @throws NumberFormatException if the text is not a long
     */
    public static long parseLong(String text)
    {
        return Long.parseLong(text.trim());
    }

    /**
     * @throws NumberFormatException if the text is not an integer in the byte range
     */
    public static byte parseByte(String text)
    {
        int value = parseInt(text);
        if (value < Byte.MIN_VALUE || value > Byte.MAX_VALUE)
            throw new NumberFormatException(String.format("Value \"%s\" out of range of byte (%d - %d)", text, Byte.MIN_VALUE, Byte.MAX_VALUE));
        return (byte)value;
    }

    /**
     * @throws NumberFormatException if the text is not an integer in the short range
     */
    public static short parseShort(String text)
    {
        int value = parseInt(text);
        if (value < Short.MIN_VALUE || value > Short.MAX_VALUE)
            throw new NumberFormatException(String.format("Value \"%s\" out of range of short (%d - %d)", text, Short.MIN_VALUE, Short.MAX_VALUE));
        return (short)value;
    }

    /**
     * Lenient int parsing: surrounding whitespace and a leading plus sign are accepted,
     * and a floating point value is truncated.
     *
     * @return the parsed value, or the default if the text is not a number
     */
    public static int parseAsInt(String text, int defaultValue)
    {
        if (text == null)
            return defaultValue;
        text = text.trim();
        int length = text.length();
        if (length == 0)
            return defaultValue;
        int i = 0;
        char first = text.charAt(0);
        if (first == '+')
        {
            text = text.substring(1);
            --length;
        }
        else if (first == '-')
        {
            ++i;
        }
        for (; i < length; ++i)
        {
            char c = text.charAt(i);
            if (c > '9' || c < '0')
            {
                try
                {
                    return (int)parseDouble(text);
                }
                catch (NumberFormatException x)
                {
                    return defaultValue;
                }
            }
        }
        try
        {
            return Integer.parseInt(text);
        }
        catch (NumberFormatException x)
        {
            return defaultValue;
        }
    }

    /**
     * @return the parsed value, or the default if the text is not a number
     * @see #parseAsInt(String, int)
     */
    public static long parseAsLong(String text, long defaultValue)
    {
        if (text == null)
            return defaultValue;
        text = text.trim();
        int length = text.length();
        if (length == 0)
            return defaultValue;
        int i = 0;
        char first = text.charAt(0);
        if (first == '+')
        {
            text = text.substring(1);
            --length;
        }
        else if (first == '-')
        {
            ++i;
        }
        for (; i < length; ++i)
        {
            char c = text.charAt(i);
            if (c > '9' || c < '0')
            {
                try
                {
                    return (long)parseDouble(text);
                }
                catch (NumberFormatException x)
                {
                    return defaultValue;
                }
            }
        }
        try
        {
            return Long.parseLong(text);
        }
        catch (NumberFormatException x)
        {
            return defaultValue;
        }
    }

    /**
     * @return the parsed value, or the default if the text is not a number
     */
    public static double parseAsDouble(String text, double defaultValue)
    {
        if (text == null)
            return defaultValue;
        text = text.trim();
        if (text.isEmpty())
            return defaultValue;
        try
        {
            return parseDouble(text);
        }
        catch (NumberFormatException x)
        {
            return defaultValue;
        }
    }

    /**
     * @throws NumberFormatException if the text is not a floating point number
     */
    public static double parseDouble(String text)
    {
        return parseDouble(text, false);
    }

    /**
     * @throws NumberFormatException if the text is not a floating point number
     */
    public static double parseDouble(String text, boolean useFastParser)
    {
        return useFastParser ? JavaDoubleParser.parseDouble(text) : Double.parseDouble(text);
    }

    /**
     * @throws NumberFormatException if the text is not a floating point number
     */
    public static float parseFloat(String text)
    {
        return parseFloat(text, false);
    }

    /**
     * @throws NumberFormatException if the text is not a floating point number
     */
    public static float parseFloat(String text, boolean useFastParser)
    {
        return useFastParser ? JavaFloatParser.parseFloat(text) : Float.parseFloat(text);
    }

    /**
     * @throws NumberFormatException if the text is not an integer
     */
    public static BigInteger parseBigInteger(String text)
    {
        return parseBigInteger(text, false);
    }

    /**
     * @throws NumberFormatException if the text is not an integer
     */
    public static BigInteger parseBigInteger(String text, boolean useFastParser)
    {
        return useFastParser ? JavaBigIntegerParser.parseBigInteger(text) : new BigInteger(text);
    }

    /**
     * @throws NumberFormatException if the text is not a decimal number
     */
    public static BigDecimal parseBigDecimal(String text)
    {
        return parseBigDecimal(text, false);
    }

    /**
     * @throws NumberFormatException if the text is not a decimal number
     */
    public static BigDecimal parseBigDecimal(String text, boolean useFastParser)
    {
        try
        {
            return useFastParser ? JavaBigDecimalParser.parseBigDecimal(text) : new BigDecimal(text);
        }
        catch (NumberFormatException | ArithmeticException x)
        {
            throw badBigDecimal(text, x);
        }
    }

    /**
     * @throws NumberFormatException if the chars are not a decimal number
     */
    public static BigDecimal parseBigDecimal(char[] chars, int offset, int length)
    {
        return parseBigDecimal(chars, offset, length, false);
    }

    /**
     * @throws NumberFormatException if the chars are not a decimal number
     */
    public static BigDecimal parseBigDecimal(char[] chars, int offset, int length, boolean useFastParser)
    {
        try
        {
            if (useFastParser)
                return JavaBigDecimalParser.parseBigDecimal(chars, offset, length);
            return new BigDecimal(chars, offset, length);
        }
        catch (NumberFormatException | ArithmeticException x)
        {
            throw badBigDecimal(new String(chars, offset, length), x);
        }
    }

    private static NumberFormatException badBigDecimal(String text, RuntimeException cause)
    {
        String value = text.length() <= 1000 ? text : text.substring(0, 1000) + "[truncated]";
        NumberFormatException failure = new NumberFormatException("Value \"" + value + "\" can not be represented as `java.math.BigDecimal`, reason: " + cause.getMessage());
        failure.initCause(cause);
        return failure;
    }

    /**
     * @return whether the text has the shape of a decimal number: optional sign, digits,
     * optional fraction and optional exponent
     */
    public static boolean looksLikeValidNumber(String text)
    {
        if (text == null || text.isEmpty())
            return false;
        int length = text.length();
        int i = 0;
        char c = text.charAt(0);
        if (c == '-' || c == '+')
        {
            if (length == 1)
                return false;
            ++i;
        }
        int digits = 0;
        while (i < length && isDigit(text.charAt(i)))
        {
            ++digits;
            ++i;
        }
        if (i < length && text.charAt(i) == '.')
        {
            ++i;
            while (i < length && isDigit(text.charAt(i)))
            {
                ++digits;
                ++i;
            }
        }
        if (digits == 0)
            return false;
        if (i < length && (text.charAt(i) == 'e' || text.charAt(i) == 'E'))
        {
            ++i;
            if (i < length && (text.charAt(i) == '-' || text.charAt(i) == '+'))
                ++i;
            int expDigits = 0;
            while (i < length && isDigit(text.charAt(i)))
            {
                ++expDigits;
                ++i;
            }
            if (expDigits == 0)
                return false;
        }
        return i == length;
    }

    private static boolean isDigit(char c)
    {
        return c >= '0' && c <= '9';
    }
}
