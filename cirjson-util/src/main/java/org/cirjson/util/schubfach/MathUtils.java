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

import java.math.BigInteger;

/**
 * <p>Integer approximations of logarithms and the table of 126-bit powers of ten
 * used by {@link DoubleToDecimal} and {@link FloatToDecimal}.</p>
 * <p>For every {@code k} in [{@link #K_MIN}, {@link #K_MAX}] the table holds
 * {@code g = floor(10^-k 2^-r) + 1}, where {@code r} is chosen so that
 * {@code 2^125 <= floor(10^-k 2^-r) < 2^126}, split as {@code g = g1 2^63 + g0}.
 * The table is computed exactly with {@link BigInteger} on class initialization.</p>
 */
final class MathUtils
{
    static final int K_MIN = -324;
    static final int K_MAX = 292;

    private static final int H = 17;

    private static final long MASK_63 = (1L << 63) - 1;

    private static final long[] POW10 = new long[H + 1];

    private static final long[] G = new long[2 * (K_MAX - K_MIN + 1)];

    static
    {
        long p = 1;
        for (int i = 0; i <= H; ++i)
        {
            POW10[i] = p;
            p *= 10;
        }

        BigInteger mask63 = BigInteger.valueOf(MASK_63);
        for (int k = K_MIN; k <= K_MAX; ++k)
        {
            BigInteger g;
            if (k <= 0)
            {
                BigInteger pow = BigInteger.TEN.pow(-k);
                int shift = 126 - pow.bitLength();
                g = shift >= 0 ? pow.shiftLeft(shift) : pow.shiftRight(-shift);
            }
            else
            {
                BigInteger pow = BigInteger.TEN.pow(k);
                g = BigInteger.ONE.shiftLeft(125 + pow.bitLength()).divide(pow);
            }
            g = g.add(BigInteger.ONE);
            int index = (k - K_MIN) << 1;
            G[index] = g.shiftRight(63).longValue();
            G[index + 1] = g.and(mask63).longValue();
        }
    }

    private MathUtils()
    {
    }

    /**
     * @return 10^e, for 0 <= e <= 17
     */
    static long pow10(int e)
    {
        return POW10[e];
    }

    /**
     * @return floor(log10(2^e)), for |e| <= 5_456_721
     */
    static int flog10pow2(int e)
    {
        return (int)(e * 661_971_961_083L >> 41);
    }

    /**
     * @return floor(log10(3/4 2^e)), for |e| <= 2_708_567
     */
    static int flog10threeQuartersPow2(int e)
    {
        return (int)(e * 661_971_961_083L + -274_743_187_321L >> 41);
    }

    /**
     * @return floor(log2(10^e)), for |e| <= 1_838_394
     */
    static int flog2pow10(int e)
    {
        return (int)(e * 913_124_641_741L >> 38);
    }

    /**
     * @return the most significant 63 bits of the 126-bit g for k
     */
    static long g1(int k)
    {
        return G[(k - K_MIN) << 1];
    }

    /**
     * @return the least significant 63 bits of the 126-bit g for k
     */
    static long g0(int k)
    {
        return G[(k - K_MIN) << 1 | 1];
    }
}
