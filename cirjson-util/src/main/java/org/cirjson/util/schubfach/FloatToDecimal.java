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

package org.cirjson.util.schubfach;

import java.nio.charset.StandardCharsets;

import static java.lang.Float.floatToRawIntBits;
import static java.lang.Integer.numberOfLeadingZeros;
import static java.lang.Math.multiplyHigh;
import static org.cirjson.util.schubfach.MathUtils.flog10pow2;
import static org.cirjson.util.schubfach.MathUtils.flog10threeQuartersPow2;
import static org.cirjson.util.schubfach.MathUtils.flog2pow10;
import static org.cirjson.util.schubfach.MathUtils.g1;
import static org.cirjson.util.schubfach.MathUtils.pow10;

/**
 * <p>Renders a {@code float} as the shortest decimal string that parses back to it.</p>
 * <p>Same algorithm and layout rules as {@link DoubleToDecimal}, on 32-bit arithmetic
 * and the upper 63 bits of the power-of-ten table.</p>
 */
public final class FloatToDecimal
{
    static final int P = 24;
    private static final int W = (Float.SIZE - 1) - (P - 1);
    static final int Q_MIN = (-1 << W - 1) - P + 3;
    static final int C_TINY = 8;
    static final int H = 9;

    private static final int C_MIN = 1 << P - 1;
    private static final int BQ_MASK = (1 << W) - 1;
    private static final int T_MASK = (1 << P - 1) - 1;
    private static final long MASK_32 = (1L << 32) - 1;
    private static final int MASK_28 = (1 << 28) - 1;

    private static final int NON_SPECIAL = 0;
    private static final int PLUS_ZERO = 1;
    private static final int MINUS_ZERO = 2;
    private static final int PLUS_INF = 3;
    private static final int MINUS_INF = 4;
    private static final int NAN = 5;

    public static final int MAX_CHARS = H + 6;

    private final byte[] _bytes = new byte[MAX_CHARS];
    private int _index;

    private FloatToDecimal()
    {
    }

    public static String toString(float v)
    {
        return new FloatToDecimal().toDecimalString(v);
    }

    private String toDecimalString(float v)
    {
        switch (toDecimal(v))
        {
            case NON_SPECIAL:
                return new String(_bytes, 0, _index + 1, StandardCharsets.ISO_8859_1);
            case PLUS_ZERO:
                return "0.0";
            case MINUS_ZERO:
                return "-0.0";
            case PLUS_INF:
                return "Infinity";
            case MINUS_INF:
                return "-Infinity";
            default:
                return "NaN";
        }
    }

    private int toDecimal(float v)
    {
        int bits = floatToRawIntBits(v);
        int t = bits & T_MASK;
        int bq = (bits >>> P - 1) & BQ_MASK;
        if (bq < BQ_MASK)
        {
            _index = -1;
            if (bits < 0)
                append('-');
            if (bq != 0)
            {
                int mq = -Q_MIN + 1 - bq;
                int c = C_MIN | t;
                if (0 < mq & mq < P)
                {
                    int f = c >> mq;
                    if (f << mq == c)
                        return toChars(f, 0);
                }
                return toDecimal(-mq, c, 0);
            }
            if (t != 0)
            {
                return t < C_TINY
                    ? toDecimal(Q_MIN, 10 * t, -1)
                    : toDecimal(Q_MIN, t, 0);
            }
            return bits == 0 ? PLUS_ZERO : MINUS_ZERO;
        }
        if (t != 0)
            return NAN;
        return bits > 0 ? PLUS_INF : MINUS_INF;
    }

    private int toDecimal(int q, int c, int dk)
    {
        int out = c & 0x1;
        long cb = c << 2;
        long cbr = cb + 2;
        long cbl;
        int k;
        if (c != C_MIN | q == Q_MIN)
        {
            cbl = cb - 2;
            k = flog10pow2(q);
        }
        else
        {
            cbl = cb - 1;
            k = flog10threeQuartersPow2(q);
        }
        int h = q + flog2pow10(-k) + 33;

        long g = g1(k) + 1;

        int vb = rop(g, cb << h);
        int vbl = rop(g, cbl << h);
        int vbr = rop(g, cbr << h);

        int s = vb >> 2;
        if (s >= 100)
        {
            // floor(s / 10) = floor(s 1_717_986_919 / 2^34)
            int sp10 = 10 * (int)(s * 1_717_986_919L >>> 34);
            int tp10 = sp10 + 10;
            boolean upin = vbl + out <= sp10 << 2;
            boolean wpin = (tp10 << 2) + out <= vbr;
            if (upin != wpin)
                return toChars(upin ? sp10 : tp10, k);
        }

        int t = s + 1;
        boolean uin = vbl + out <= s << 2;
        boolean win = (t << 2) + out <= vbr;
        if (uin != win)
            return toChars(uin ? s : t, k + dk);

        int cmp = vb - (s + t << 1);
        return toChars(cmp < 0 || cmp == 0 && (s & 0x1) == 0 ? s : t, k + dk);
    }

    private static int rop(long g, long cp)
    {
        long x1 = multiplyHigh(g, cp);
        long vbp = x1 >>> 31;
        return (int)(vbp | (x1 & MASK_32) + MASK_32 >>> 32);
    }

    private int toChars(int f, int e)
    {
        int len = flog10pow2(Integer.SIZE - numberOfLeadingZeros(f));
        if (f >= pow10(len))
            len += 1;

        f *= (int)pow10(H - len);
        e += len;

        // f = h 10^8 + l
        int h = (int)(f * 1_441_151_881L >>> 57);
        int l = f - 100_000_000 * h;

        if (0 < e && e <= 7)
            return toChars1(h, l, e);
        if (-3 < e && e <= 0)
            return toChars2(h, l, e);
        return toChars3(h, l, e);
    }

    private int toChars1(int h, int l, int e)
    {
        appendDigit(h);
        int y = y(l);
        int t;
        int i = 1;
        for (; i < e; ++i)
        {
            t = 10 * y;
            appendDigit(t >>> 28);
            y = t & MASK_28;
        }
        append('.');
        for (; i <= 8; ++i)
        {
            t = 10 * y;
            appendDigit(t >>> 28);
            y = t & MASK_28;
        }
        removeTrailingZeroes();
        return NON_SPECIAL;
    }

    private int toChars2(int h, int l, int e)
    {
        appendDigit(0);
        append('.');
        for (; e < 0; ++e)
        {
            appendDigit(0);
        }
        appendDigit(h);
        append8Digits(l);
        removeTrailingZeroes();
        return NON_SPECIAL;
    }

    private int toChars3(int h, int l, int e)
    {
        appendDigit(h);
        append('.');
        append8Digits(l);
        removeTrailingZeroes();
        exponent(e - 1);
        return NON_SPECIAL;
    }

    private void append8Digits(int m)
    {
        int y = y(m);
        for (int i = 0; i < 8; ++i)
        {
            int t = 10 * y;
            appendDigit(t >>> 28);
            y = t & MASK_28;
        }
    }

    private void removeTrailingZeroes()
    {
        while (_bytes[_index] == '0')
        {
            --_index;
        }
        if (_bytes[_index] == '.')
            ++_index;
    }

    private int y(int a)
    {
        return (int)(multiplyHigh((long)(a + 1) << 28, 193_428_131_138_340_668L) >>> 20) - 1;
    }

    private void exponent(int e)
    {
        append('E');
        if (e < 0)
        {
            append('-');
            e = -e;
        }
        if (e < 10)
        {
            appendDigit(e);
            return;
        }
        // floor(e / 10)
        int d = e * 103 >>> 10;
        appendDigit(d);
        appendDigit(e - 10 * d);
    }

    private void append(int c)
    {
        _bytes[++_index] = (byte)c;
    }

    private void appendDigit(int digit)
    {
        _bytes[++_index] = (byte)('0' + digit);
    }
}
