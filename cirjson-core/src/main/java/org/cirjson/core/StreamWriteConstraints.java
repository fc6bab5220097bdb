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

import org.cirjson.core.exception.StreamConstraintsException;

/**
 * Limits applied while writing; currently only the nesting depth, {@value #DEFAULT_MAX_DEPTH} by default.
 */
public class StreamWriteConstraints
{
    public static final int DEFAULT_MAX_DEPTH = 500;

    private static final StreamWriteConstraints DEFAULTS = new StreamWriteConstraints(DEFAULT_MAX_DEPTH);

    private final int _maxNestingDepth;

    protected StreamWriteConstraints(int maxNestingDepth)
    {
        _maxNestingDepth = maxNestingDepth;
    }

    public static StreamWriteConstraints defaults()
    {
        return DEFAULTS;
    }

    public static Builder builder()
    {
        return new Builder(DEFAULTS);
    }

    public Builder rebuild()
    {
        return new Builder(this);
    }

    public int getMaxNestingDepth()
    {
        return _maxNestingDepth;
    }

    public void validateNestingDepth(int depth)
    {
        if (depth > _maxNestingDepth)
            throw new StreamConstraintsException(String.format("Document nesting depth (%d) exceeds the maximum allowed (%d, from %s)",
                depth, _maxNestingDepth, "`StreamWriteConstraints.getMaxNestingDepth()`"));
    }

    public static final class Builder
    {
        private int _maxNestingDepth;

        Builder(StreamWriteConstraints src)
        {
            _maxNestingDepth = src._maxNestingDepth;
        }

        public Builder maxNestingDepth(int maxNestingDepth)
        {
            if (maxNestingDepth < 0)
                throw new IllegalArgumentException("Cannot set maxNestingDepth to a negative value");
            _maxNestingDepth = maxNestingDepth;
            return this;
        }

        public StreamWriteConstraints build()
        {
            return new StreamWriteConstraints(_maxNestingDepth);
        }
    }
}
