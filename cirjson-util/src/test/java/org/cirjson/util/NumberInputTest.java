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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NumberInputTest
{
    @Test
    public void testParseIntFromChars()
    {
        char[] chars = "[123456789,-42]".toCharArray();
        assertThat(NumberInput.parseInt(chars, 1, 9), is(123456789));
        assertThat(NumberInput.parseInt(chars, 11, 3), is(-42));
    }

    @Test
    public void testParseLongFromChars()
    {
        char[] max = "9223372036854775807".toCharArray();
        assertThat(NumberInput.parseLong(max, 0, max.length), is(Long.MAX_VALUE));
        char[] min = "-9223372036854775808".toCharArray();
        assertThat(NumberInput.parseLong(min, 0, min.length), is(Long.MIN_VALUE));
    }

    @Test
    public void testInLongRange()
    {
        assertTrue(NumberInput.inLongRange("9223372036854775807", false));
        assertFalse(NumberInput.inLongRange("9223372036854775808", false));
        assertTrue(NumberInput.inLongRange("9223372036854775808", true));
        assertFalse(NumberInput.inLongRange("9223372036854775809", true));
        assertTrue(NumberInput.inLongRange("123", false));
        assertFalse(NumberInput.inLongRange("10000000000000000000", false));
    }

    @Test
    public void testNarrowingNeverWraps()
    {
        assertThat(NumberInput.parseByte("-128"), is((byte)-128));
        NumberFormatException x = assertThrows(NumberFormatException.class, () -> NumberInput.parseByte("128"));
        assertThat(x.getMessage(), containsString("out of range of byte"));
        assertThat(NumberInput.parseShort(" 32767 "), is((short)32767));
        assertThrows(NumberFormatException.class, () -> NumberInput.parseShort("-32769"));
        assertThrows(NumberFormatException.class, () -> NumberInput.parseInt("2147483648"));
    }

    @Test
    public void testLenientParsing()
    {
        assertThat(NumberInput.parseAsInt("+17", 0), is(17));
        assertThat(NumberInput.parseAsInt(" 3.9 ", 0), is(3));
        assertThat(NumberInput.parseAsInt("abc", -1), is(-1));
        assertThat(NumberInput.parseAsInt(null, 5), is(5));
        assertThat(NumberInput.parseAsLong("-12345678901", 0L), is(-12345678901L));
        assertThat(NumberInput.parseAsDouble("", 0.5), is(0.5));
        assertThat(NumberInput.parseAsDouble("1e3", 0.0), is(1000.0));
    }

    @Test
    public void testParseFloat()
    {
        assertThat(NumberInput.parseFloat("0.1"), is(0.1f));
        assertThat(NumberInput.parseFloat("-3.5e2"), is(-350f));
        assertThrows(NumberFormatException.class, () -> NumberInput.parseFloat("abc"));
    }

    @Test
    public void testBigNumbers()
    {
        assertEquals(new BigInteger("123456789012345678901234567890"), NumberInput.parseBigInteger("123456789012345678901234567890"));
        char[] chars = "x1.50e2".toCharArray();
        assertEquals(new BigDecimal("1.50e2"), NumberInput.parseBigDecimal(chars, 1, 6));
        NumberFormatException x = assertThrows(NumberFormatException.class, () -> NumberInput.parseBigDecimal("1.2.3"));
        assertThat(x.getMessage(), containsString("can not be represented as `java.math.BigDecimal`"));
    }

    @ParameterizedTest
    @ValueSource(booleans = {false, true})
    public void testFastAndJdkParsersAgree(boolean useFastParser)
    {
        assertThat(NumberInput.parseDouble("0.1", useFastParser), is(0.1));
        assertThat(NumberInput.parseDouble("-1.7976931348623157E308", useFastParser), is(-Double.MAX_VALUE));
        assertThat(NumberInput.parseDouble("4.9e-324", useFastParser), is(Double.MIN_VALUE));
        assertThat(NumberInput.parseDouble("2.2250738585072011e-308", useFastParser), is(Double.parseDouble("2.2250738585072011e-308")));
        assertThat(NumberInput.parseFloat("3.4028235e38", useFastParser), is(Float.MAX_VALUE));
        assertThat(NumberInput.parseFloat("1.17549435E-38", useFastParser), is(Float.MIN_NORMAL));

        String digits = "1234567890".repeat(50);
        assertEquals(new BigInteger("-" + digits), NumberInput.parseBigInteger("-" + digits, useFastParser));
        assertEquals(new BigDecimal(digits + ".25e-7"), NumberInput.parseBigDecimal(digits + ".25e-7", useFastParser));
        char[] chars = ("[" + digits + ".5]").toCharArray();
        assertEquals(new BigDecimal(digits + ".5"), NumberInput.parseBigDecimal(chars, 1, chars.length - 2, useFastParser));

        assertThrows(NumberFormatException.class, () -> NumberInput.parseDouble("1.5x", useFastParser));
        assertThrows(NumberFormatException.class, () -> NumberInput.parseBigInteger("12a", useFastParser));
        NumberFormatException x = assertThrows(NumberFormatException.class, () -> NumberInput.parseBigDecimal("1.2.3", useFastParser));
        assertThat(x.getMessage(), containsString("can not be represented as `java.math.BigDecimal`"));
    }

    @Test
    public void testLooksLikeValidNumber()
    {
        assertTrue(NumberInput.looksLikeValidNumber("0"));
        assertTrue(NumberInput.looksLikeValidNumber("-1.5e+10"));
        assertTrue(NumberInput.looksLikeValidNumber(".5"));
        assertFalse(NumberInput.looksLikeValidNumber("-"));
        assertFalse(NumberInput.looksLikeValidNumber("1e"));
        assertFalse(NumberInput.looksLikeValidNumber("NaN"));
        assertFalse(NumberInput.looksLikeValidNumber(""));
    }
}
