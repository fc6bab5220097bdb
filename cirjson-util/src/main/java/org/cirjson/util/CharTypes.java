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

/**
 * Character classification tables used by the tokenizers and the generator.
 */
public final class CharTypes
{
    private static final char[] HEX_CHARS_UPPER = "0123456789ABCDEF".toCharArray();
    private static final char[] HEX_CHARS_LOWER = "0123456789abcdef".toCharArray();

    /**
     * Escape code meaning that the char is written as a backslash-u escape with four hex digits.
     */
    public static final int ESCAPE_STANDARD = -1;

    // For chars in string values: 0 = ordinary, 1 = quote or backslash, -1 = control.
    private static final int[] INPUT_CODES_LATIN1 = new int[256];

    // For bytes in UTF-8 string values: as above for ASCII, otherwise the length of the
    // multi-byte sequence started by a lead byte, or -1.
    private static final int[] INPUT_CODES_UTF8 = new int[256];

    // For output: 0 = as is, ESCAPE_STANDARD or the char after the backslash.
    private static final int[] OUTPUT_ESCAPES_128 = new int[128];

    private static final int[] HEX_VALUES = new int[256];

    static
    {
        for (int i = 0; i < 32; ++i)
        {
            INPUT_CODES_LATIN1[i] = -1;
        }
        INPUT_CODES_LATIN1['"'] = 1;
        INPUT_CODES_LATIN1['\\'] = 1;

        System.arraycopy(INPUT_CODES_LATIN1, 0, INPUT_CODES_UTF8, 0, 128);
        for (int c = 128; c < 256; ++c)
        {
            int code;
            if ((c & 0xE0) == 0xC0)
                code = 2;
            else if ((c & 0xF0) == 0xE0)
                code = 3;
            else if ((c & 0xF8) == 0xF0)
                code = 4;
            else
                code = -1;
            INPUT_CODES_UTF8[c] = code;
        }

        for (int i = 0; i < 32; ++i)
        {
            OUTPUT_ESCAPES_128[i] = ESCAPE_STANDARD;
        }
        OUTPUT_ESCAPES_128['"'] = '"';
        OUTPUT_ESCAPES_128['\\'] = '\\';
        OUTPUT_ESCAPES_128[0x08] = 'b';
        OUTPUT_ESCAPES_128[0x09] = 't';
        OUTPUT_ESCAPES_128[0x0C] = 'f';
        OUTPUT_ESCAPES_128[0x0A] = 'n';
        OUTPUT_ESCAPES_128[0x0D] = 'r';

        Arrays.fill(HEX_VALUES, -1);
        for (int i = 0; i < 10; ++i)
        {
            HEX_VALUES['0' + i] = i;
        }
        for (int i = 0; i < 6; ++i)
        {
            HEX_VALUES['a' + i] = 10 + i;
            HEX_VALUES['A' + i] = 10 + i;
        }
    }

    private CharTypes()
    {
    }

    /**
     * @return 0 for chars copied as is in string values, non-zero for chars that end the
     * fast path: quote, backslash and control chars
     */
    public static int inputCodeLatin1(int c)
    {
        return c < 256 ? INPUT_CODES_LATIN1[c] : 0;
    }

    /**
     * @return 0 for ordinary ASCII bytes, -1 for control bytes and invalid lead bytes,
     * 1 for quote and backslash, or the length of the multi-byte sequence started by a lead byte
     */
    public static int inputCodeUtf8(int b)
    {
        return INPUT_CODES_UTF8[b & 0xFF];
    }

    /**
     * @return a copy of the standard output escape table for chars below 128
     */
    public static int[] get7BitOutputEscapes()
    {
        return OUTPUT_ESCAPES_128.clone();
    }

    /**
     * @return the value of a hex digit, or -1
     */
    public static int charToHex(int c)
    {
        return c >= 0 && c < 256 ? HEX_VALUES[c] : -1;
    }

    public static char hexDigit(int value)
    {
        return HEX_CHARS_UPPER[value & 0xF];
    }

    public static char hexDigit(int value, boolean upperCase)
    {
        return (upperCase ? HEX_CHARS_UPPER : HEX_CHARS_LOWER)[value & 0xF];
    }

    /**
     * @return whether the char may start an unquoted property name
     */
    public static boolean isNameStart(int c)
    {
        return c <= 0xFFFF && !Character.isSurrogate((char)c) && Character.isJavaIdentifierStart(c);
    }

    /**
     * @return whether the char may continue an unquoted property name
     */
    public static boolean isNamePart(int c)
    {
        return c <= 0xFFFF && !Character.isSurrogate((char)c) && Character.isJavaIdentifierPart(c) && !Character.isIdentifierIgnorable(c);
    }

    /**
     * Appends the value as a quoted string literal, escaping as needed.
     */
    public static void appendQuoted(StringBuilder builder, String content)
    {
        int[] escapes = OUTPUT_ESCAPES_128;
        for (int i = 0, length = content.length(); i < length; ++i)
        {
            char c = content.charAt(i);
            if (c >= escapes.length || escapes[c] == 0)
            {
                builder.append(c);
                continue;
            }
            builder.append('\\');
            int escape = escapes[c];
            if (escape < 0)
            {
                builder.append('u').append('0').append('0');
                builder.append(hexDigit(c >> 4));
                builder.append(hexDigit(c));
            }
            else
            {
                builder.append((char)escape);
            }
        }
    }

    /**
     * @return a printable description of a char for error messages
     */
    public static String getCharDesc(int ch)
    {
        char c = (char)ch;
        if (Character.isISOControl(c))
            return "(CTRL-CHAR, code " + ch + ")";
        if (ch > 255)
            return "'" + c + "' (code " + ch + " / 0x" + Integer.toHexString(ch) + ")";
        return "'" + c + "' (code " + ch + ")";
    }
}
