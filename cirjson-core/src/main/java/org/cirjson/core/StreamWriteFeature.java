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
 * Format-independent features of generators.
 */
public enum StreamWriteFeature implements CirJacksonFeature
{
    /**
     * Whether the generator closes the output target when closed itself.
     */
    AUTO_CLOSE_TARGET(true),

    /**
     * Whether closing the generator writes the end markers of the open containers.
     */
    AUTO_CLOSE_CONTENT(true),

    /**
     * Whether {@code flush()} on the generator also flushes the output target.
     */
    FLUSH_PASSED_TO_STREAM(true),

    /**
     * Whether {@code BigDecimal} values are written in plain notation, without exponent.
     */
    WRITE_BIGDECIMAL_AS_PLAIN(false),

    /**
     * Whether writing a duplicate property name within an object is an error.
     */
    STRICT_DUPLICATE_DETECTION(false);

    private final boolean _defaultState;
    private final int _mask;

    StreamWriteFeature(boolean defaultState)
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
