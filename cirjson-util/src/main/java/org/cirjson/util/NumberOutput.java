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

import org.cirjson.util.schubfach.DoubleToDecimal;
import org.cirjson.util.schubfach.FloatToDecimal;

/**
 * Number rendering into char and byte arrays, and shortest round-trip rendering of
 * floating point values.
 */
public final class NumberOutput
{
    private static final char[] MIN_INT_CHARS = String.valueOf(Integer.MIN_VALUE).toCharArray();
    private static final char[] MIN_LONG_CHARS = String.valueOf(Long.MIN_VALUE).toCharArray();

    private static final String[] SMALL_INTS = {"0", "1", "2", "3", "4", "5", "6", "7", "8", "9", "10"};
    private static final String[] SMALL_NEGATIVE_INTS = {"-1", "-2", "-3", "-4", "-5", "-6", "-7", "-8", "-9", "-10"};

    private NumberOutput()
    {
    }

    /**
     * Writes the decimal representation of the value.
     *
     * @param v the value
     * @param buffer the buffer, with room for at least 11 chars from offset
     * @param offset the offset to write at
     * @return the offset after the last char written
     */
    public static int outputInt(int v, char[] buffer, int offset)
    {
        if (v == Integer.MIN_VALUE)
        {
            System.arraycopy(MIN_INT_CHARS, 0, buffer, offset, MIN_INT_CHARS.length);
            return offset + MIN_INT_CHARS.length;
        }
        if (v < 0)
        {
            buffer[offset++] = '-';
            v = -v;
        }
        int end = offset + digitCount(v);
        int pos = end;
        do
        {
            int q = v / 10;
            buffer[--pos] = (char)('0' + (v - q * 10));
            v = q;
        }
        while (v != 0);
        return end;
    }

    public static int outputInt(int v, byte[] buffer, int offset)
    {
        if (v == Integer.MIN_VALUE)
        {
            for (char c : MIN_INT_CHARS)
            {
                buffer[offset++] = (byte)c;
            }
            return offset;
        }
        if (v < 0)
        {
            buffer[offset++] = '-';
            v = -v;
        }
        int end = offset + digitCount(v);
        int pos = end;
        do
        {
            int q = v / 10;
            buffer[--pos] = (byte)('0' + (v - q * 10));
            v = q;
        }
        while (v != 0);
        return end;
    }

    /**
     * Writes the decimal representation of the value.
     *
     * @param v the value
     * @param buffer the buffer, with room for at least 20 chars from offset
     * @param offset the offset to write at
     * @return the offset after the last char written
     */
    public static int outputLong(long v, char[] buffer, int offset)
    {
        if (v == Long.MIN_VALUE)
        {
            System.arraycopy(MIN_LONG_CHARS, 0, buffer, offset, MIN_LONG_CHARS.length);
            return offset + MIN_LONG_CHARS.length;
        }
        if (v < 0)
        {
            buffer[offset++] = '-';
            v = -v;
        }
        int end = offset + digitCount(v);
        int pos = end;
        do
        {
            long q = v / 10;
            buffer[--pos] = (char)('0' + (int)(v - q * 10));
            v = q;
        }
        while (v != 0);
        return end;
    }

    public static int outputLong(long v, byte[] buffer, int offset)
    {
        if (v == Long.MIN_VALUE)
        {
            for (char c : MIN_LONG_CHARS)
            {
                buffer[offset++] = (byte)c;
            }
            return offset;
        }
        if (v < 0)
        {
            buffer[offset++] = '-';
            v = -v;
        }
        int end = offset + digitCount(v);
        int pos = end;
        do
        {
            long q = v / 10;
            buffer[--pos] = (byte)('0' + (int)(v - q * 10));
            v = q;
        }
        while (v != 0);
        return end;
    }

    private static int digitCount(long v)
    {
        int count = 1;
        long limit = 10;
        while (count < 19 && v >= limit)
        {
            ++count;
            limit *= 10;
        }
        return count;
    }

    public static String toString(int v)
    {
        if (v >= 0 && v < SMALL_INTS.length)
            return SMALL_INTS[v];
        if (v < 0 && v >= -SMALL_NEGATIVE_INTS.length)
            return SMALL_NEGATIVE_INTS[-v - 1];
        return Integer.toString(v);
    }

    public static String toString(long v)
    {
        if (v <= Integer.MAX_VALUE && v >= Integer.MIN_VALUE)
            return toString((int)v);
        return Long.toString(v);
    }

    /**
     * @param v the value
     * @return the shortest decimal rendering that parses back to the same value
     */
    public static String toString(double v)
    {
        return DoubleToDecimal.toString(v);
    }

    /**
     * @param v the value
     * @return the shortest decimal rendering that parses back to the same value
     */
    public static String toString(float v)
    {
        return FloatToDecimal.toString(v);
    }

    /**
     * @return whether the value is NaN or infinite
     */
    public static boolean notFinite(double v)
    {
        return Double.isNaN(v) || Double.isInfinite(v);
    }

    public static boolean notFinite(float v)
    {
        return Float.isNaN(v) || Float.isInfinite(v);
    }
}
