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
 * CirJSON specific features of generators.
 */
public enum CirJsonWriteFeature implements CirJacksonFeature
{
    /**
     * Whether property names are written in double quotes.
     */
    QUOTE_PROPERTY_NAMES(true),

    /**
     * Whether NaN and infinite values are written as quoted strings instead of bare tokens.
     */
    WRITE_NAN_AS_STRINGS(true),

    /**
     * Whether all numbers are written as quoted strings.
     */
    WRITE_NUMBERS_AS_STRINGS(false),

    /**
     * Whether chars above 127 are written as escapes.
     */
    ESCAPE_NON_ASCII(false),

    /**
     * Whether the forward slash is escaped.
     */
    ESCAPE_FORWARD_SLASHES(false),

    /**
     * Whether the hex digits of backslash-u escapes are written in upper case.
     */
    WRITE_HEX_UPPER_CASE(true);

    private final boolean _defaultState;
    private final int _mask;

    CirJsonWriteFeature(boolean defaultState)
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
