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

import org.cirjson.core.CirJacksonFeature;

/**
 * CirJSON specific features of parsers, relaxing the grammar.
 */
public enum CirJsonReadFeature implements CirJacksonFeature
{
    /**
     * Whether Java and C++ style comments, {@code /* ... *}{@code /} and {@code // ...}, are
     * allowed wherever white space is.
     */
    ALLOW_JAVA_COMMENTS(false),

    /**
     * Whether YAML style comments, from {@code #} to the end of the line, are allowed
     * wherever white space is.
     */
    ALLOW_YAML_COMMENTS(false),

    /**
     * Whether strings and property names may be quoted with apostrophes. Within them a
     * double quote needs no escape, and an apostrophe may be escaped with a backslash.
     */
    ALLOW_SINGLE_QUOTES(false),

    /**
     * Whether property names may be written without quotes. Such names are made of the chars
     * allowed in Java identifiers.
     */
    ALLOW_UNQUOTED_FIELD_NAMES(false),

    /**
     * Whether control chars below 32, tab and line feed included, may appear unescaped in
     * strings and property names.
     */
    ALLOW_UNESCAPED_CONTROL_CHARS(false),

    /**
     * Whether a backslash may escape any char, which then stands for itself.
     */
    ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER(false),

    /**
     * Whether integral parts of numbers may have leading zeroes, as in {@code 007}.
     */
    ALLOW_LEADING_ZEROS_FOR_NUMBERS(false),

    /**
     * Whether numbers may start with a plus sign, as in {@code +1}. The sign is not part of
     * the number text.
     */
    ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS(false),

    /**
     * Whether numbers may start with a decimal point, as in {@code .5}.
     */
    ALLOW_LEADING_DECIMAL_POINT_FOR_NUMBERS(false),

    /**
     * Whether numbers may end with a decimal point, as in {@code 5.}. Such numbers are
     * floating point values.
     */
    ALLOW_TRAILING_DECIMAL_POINT_FOR_NUMBERS(false),

    /**
     * Whether the tokens {@code NaN}, {@code Infinity}, {@code +Infinity} and {@code -Infinity}
     * are accepted as floating point values.
     */
    ALLOW_NON_NUMERIC_NUMBERS(false),

    /**
     * Whether array elements may be left out between commas, as in {@code ["0",1,,3]}. A missing
     * element is read as {@link org.cirjson.core.CirJsonToken#VALUE_NULL}, and so is a trailing one
     * unless {@link #ALLOW_TRAILING_COMMA} is enabled as well.
     */
    ALLOW_MISSING_VALUES(false),

    /**
     * Whether a single trailing comma is allowed before the end of an array or object.
     */
    ALLOW_TRAILING_COMMA(false);

    private final boolean _defaultState;
    private final int _mask;

    CirJsonReadFeature(boolean defaultState)
    {
        _defaultState = defaultState;
        _mask = 1 << ordinal();
    }

    @Override
    public boolean enabledByDefault()
    {
        return _defaultState;
    }

    @Override
    public int getMask()
    {
        return _mask;
    }
}
