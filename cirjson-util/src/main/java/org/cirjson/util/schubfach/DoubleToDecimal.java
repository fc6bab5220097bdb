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

import static java.lang.Double.doubleToRawLongBits;
import static java.lang.Long.numberOfLeadingZeros;
import static java.lang.Math.multiplyHigh;
import static org.cirjson.util.schubfach.MathUtils.flog10pow2;
import static org.cirjson.util.schubfach.MathUtils.flog10threeQuartersPow2;
import static org.cirjson.util.schubfach.MathUtils.flog2pow10;
import static org.cirjson.util.schubfach.MathUtils.g0;
import static org.cirjson.util.schubfach.MathUtils.g1;
import static org.cirjson.util.schubfach.MathUtils.pow10;

/**
 * <p>Renders a {@code double} as the shortest decimal string that parses back to it,
 * using Raffaello Giulietti's Schubfach algorithm.</p>
 * <p>Among the shortest decimals in the rounding interval the closest one is chosen,
 * ties resolved towards an even last digit. Values in [10^-3, 10^7) are rendered in plain
 * notation, with at least one digit after the decimal point; other values use computerized
 * scientific notation such as {@code 1.0E7} or {@code 4.9E-324}.</p>
 */
public final class DoubleToDecimal
{
    // Precision, in bits.
    static final int P = 53;
    // Exponent width, in bits.
    private static final int W = (Double.SIZE - 1) - (P - 1);
    static final int Q_MIN = (-1 << W - 1) - P + 3;
    static final long C_TINY = 3;
    // Digits in the decimal significand after normalization.
    static final int H = 17;

    private static final long C_MIN = 1L << P - 1;
    private static final int BQ_MASK = (1 << W) - 1;
    private static final long T_MASK = (1L << P - 1) - 1;
    private static final long MASK_63 = (1L << 63) - 1;
    private static final int MASK_28 = (1 << 28) - 1;

    private static final int NON_SPECIAL = 0;
    private static final int PLUS_ZERO = 1;
    private static final int MINUS_ZERO = 2;
    private static final int PLUS_INF = 3;
    private static final int MINUS_INF = 4;
    private static final int NAN = 5;

    /**
     * The maximum number of characters of a rendering, as in {@code -2.2250738585072014E-308}.
     */
    public static final int MAX_CHARS = H + 7;

    private final byte[] _bytes = new byte[MAX_CHARS];
    private int _index;

    private DoubleToDecimal()
    {
    }

    /**
     * @param v the value to render
     * @return the shortest decimal rendering of the value
     */
    public static String toString(double v)
    {
        return new DoubleToDecimal().toDecimalString(v);
    }

    private String toDecimalString(double v)
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

    private int toDecimal(double v)
    {
        long bits = doubleToRawLongBits(v);
        long t = bits & T_MASK;
        int bq = (int)(bits >>> P - 1) & BQ_MASK;
        if (bq < BQ_MASK)
        {
            _index = -1;
            if (bits < 0)
                append('-');
            if (bq != 0)
            {
                // Normal value, mq = -q.
                int mq = -Q_MIN + 1 - bq;
                long c = C_MIN | t;
                // Integer values need no rounding.
                if (0 < mq & mq < P)
                {
                    long f = c >> mq;
                    if (f << mq == c)
                        return toChars(f, 0);
                }
                return toDecimal(-mq, c, 0);
            }
            if (t != 0)
            {
                // Subnormal value.
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

    private int toDecimal(int q, long c, int dk)
    {
        // The rounding interval is [cbl, cbr] around cb, all scaled by 4.
        int out = (int)c & 0x1;
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
            // Irregular spacing: the interval below c is half as wide.
            cbl = cb - 1;
            k = flog10threeQuartersPow2(q);
        }
        int h = q + flog2pow10(-k) + 2;

        long g1 = g1(k);
        long g0 = g0(k);

        long vb = rop(g1, g0, cb << h);
        long vbl = rop(g1, g0, cbl << h);
        long vbr = rop(g1, g0, cbr << h);

        long s = vb >> 2;
        if (s >= 100)
        {
            // sp10 = 10 floor(s / 10), tp10 = sp10 + 10: try one digit fewer first.
            long sp10 = 10 * multiplyHigh(s, 115_292_150_460_684_698L << 4);
            long tp10 = sp10 + 10;
            boolean upin = vbl + out <= sp10 << 2;
            boolean wpin = (tp10 << 2) + out <= vbr;
            if (upin != wpin)
                return toChars(upin ? sp10 : tp10, k);
        }

        long t = s + 1;
        boolean uin = vbl + out <= s << 2;
        boolean win = (t << 2) + out <= vbr;
        if (uin != win)
            return toChars(uin ? s : t, k + dk);

        // Both candidates are in the interval, pick the closest, ties to even.
        long cmp = vb - (s + t << 1);
        return toChars(cmp < 0 || cmp == 0 && (s & 0x1) == 0 ? s : t, k + dk);
    }

    /**
     * @return the rounded-to-odd product of g and cp, shifted right by 127 bits
     */
    private static long rop(long g1, long g0, long cp)
    {
        long x1 = multiplyHigh(g0, cp);
        long y0 = g1 * cp;
        long y1 = multiplyHigh(g1, cp);
        long z = (y0 >>> 1) + x1;
        long vbp = y1 + (z >>> 63);
        return vbp | (z & MASK_63) + MASK_63 >>> 63;
    }

    private int toChars(long f, int e)
    {
        // 10^(len-1) <= f < 10^len
        int len = flog10pow2(Long.SIZE - numberOfLeadingZeros(f));
        if (f >= pow10(len))
            len += 1;

        // Normalize to 10^(H-1) <= f < 10^H.
        f *= pow10(H - len);
        e += len;

        // f = h 10^16 + m 10^8 + l, with h a single digit and m, l 8 digits each.
        long hm = multiplyHigh(f, 193_428_131_138_340_668L) >>> 20;
        int l = (int)(f - 100_000_000 * hm);
        int h = (int)(hm * 1_441_151_881L >>> 57);
        int m = (int)(hm - 100_000_000 * h);

        if (0 < e && e <= 7)
            return toChars1(h, m, l, e);
        if (-3 < e && e <= 0)
            return toChars2(h, m, l, e);
        return toChars3(h, m, l, e);
    }

    private int toChars1(int h, int m, int l, int e)
    {
        // Plain notation, no leading zeroes.
        appendDigit(h);
        int y = y(m);
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
        lowDigits(l);
        return NON_SPECIAL;
    }

    private int toChars2(int h, int m, int l, int e)
    {
        // Plain notation with leading zeroes.
        appendDigit(0);
        append('.');
        for (; e < 0; ++e)
        {
            appendDigit(0);
        }
        appendDigit(h);
        append8Digits(m);
        lowDigits(l);
        return NON_SPECIAL;
    }

    private int toChars3(int h, int m, int l, int e)
    {
        appendDigit(h);
        append('.');
        append8Digits(m);
        lowDigits(l);
        exponent(e - 1);
        return NON_SPECIAL;
    }

    private void lowDigits(int l)
    {
        if (l != 0)
            append8Digits(l);
        removeTrailingZeroes();
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
        // Keep one digit after the point.
        if (_bytes[_index] == '.')
            ++_index;
    }

    /**
     * @return floor((a + 1) 2^28 / 10^8) - 1, for 0 <= a < 10^8
     */
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
        int d;
        if (e >= 100)
        {
            // floor(e / 100)
            d = e * 1_311 >>> 17;
            appendDigit(d);
            e -= 100 * d;
        }
        // floor(e / 10)
        d = e * 103 >>> 10;
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
