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

package org.cirjson.core;

/**
 * Format-independent features of parsers.
 */
public enum StreamReadFeature implements CirJacksonFeature
{
    /**
     * Whether the parser closes the input source it was created over, when closed itself.
     * Sources created by the factory itself, such as from a byte array, are always released.
     */
    AUTO_CLOSE_SOURCE(true),

    /**
     * Whether duplicate property names within an object are reported as errors.
     */
    STRICT_DUPLICATE_DETECTION(false),

    /**
     * Whether locations include a description of the input source.
     */
    INCLUDE_SOURCE_IN_LOCATION(false),

    /**
     * Whether {@code double} and {@code float} values are converted with the parsers of the
     * {@code fastdoubleparser} library instead of the JDK ones.
     */
    USE_FAST_DOUBLE_PARSER(false),

    /**
     * Whether {@link java.math.BigDecimal} and {@link java.math.BigInteger} values are converted
     * with the parsers of the {@code fastdoubleparser} library instead of the JDK constructors.
     */
    USE_FAST_BIG_NUMBER_PARSER(false);

    private final boolean _defaultState;
    private final int _mask;

    StreamReadFeature(boolean defaultState)
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
