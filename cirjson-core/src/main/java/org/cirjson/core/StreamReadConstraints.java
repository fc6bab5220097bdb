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
 * <p>Limits applied while reading, guarding against oversized input constructs.</p>
 * <p>Defaults: nesting depth {@value #DEFAULT_MAX_DEPTH}, document length unlimited,
 * number length {@value #DEFAULT_MAX_NUM_LEN} chars, string length
 * {@value #DEFAULT_MAX_STRING_LEN} chars, property name length {@value #DEFAULT_MAX_NAME_LEN} chars.</p>
 */
public class StreamReadConstraints
{
    public static final int DEFAULT_MAX_DEPTH = 500;
    public static final long DEFAULT_MAX_DOC_LEN = -1L;
    public static final int DEFAULT_MAX_NUM_LEN = 1000;
    public static final int DEFAULT_MAX_STRING_LEN = 20_000_000;
    public static final int DEFAULT_MAX_NAME_LEN = 50_000;

    private static final int MAX_BIGINT_SCALE_MAGNITUDE = 100_000;

    private static final StreamReadConstraints DEFAULTS = new StreamReadConstraints(DEFAULT_MAX_DEPTH, DEFAULT_MAX_DOC_LEN,
        DEFAULT_MAX_NUM_LEN, DEFAULT_MAX_STRING_LEN, DEFAULT_MAX_NAME_LEN);

    private final int _maxNestingDepth;
    private final long _maxDocLength;
    private final int _maxNumLength;
    private final int _maxStringLength;
    private final int _maxNameLength;

    protected StreamReadConstraints(int maxNestingDepth, long maxDocLength, int maxNumLength, int maxStringLength, int maxNameLength)
    {
        _maxNestingDepth = maxNestingDepth;
        _maxDocLength = maxDocLength;
        _maxNumLength = maxNumLength;
        _maxStringLength = maxStringLength;
        _maxNameLength = maxNameLength;
    }

    public static StreamReadConstraints defaults()
    {
        return DEFAULTS;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public Builder rebuild()
    {
        return new Builder(this);
    }

    public int getMaxNestingDepth()
    {
        return _maxNestingDepth;
    }

    public long getMaxDocumentLength()
    {
        return _maxDocLength;
    }

    public boolean hasMaxDocumentLength()
    {
        return _maxDocLength > 0L;
    }

    public int getMaxNumberLength()
    {
        return _maxNumLength;
    }

    public int getMaxStringLength()
    {
        return _maxStringLength;
    }

    public int getMaxNameLength()
    {
        return _maxNameLength;
    }

    public void validateNestingDepth(int depth)
    {
        if (depth > _maxNestingDepth)
            throw new StreamConstraintsException(String.format("Document nesting depth (%d) exceeds the maximum allowed (%d, from %s)",
                depth, _maxNestingDepth, constraintRef("getMaxNestingDepth")));
    }

    public void validateDocumentLength(long length)
    {
        if (length > _maxDocLength && hasMaxDocumentLength())
            throw new StreamConstraintsException(String.format("Document length (%d) exceeds the maximum allowed (%d, from %s)",
                length, _maxDocLength, constraintRef("getMaxDocumentLength")));
    }

    public void validateFPLength(int length)
    {
        validateNumberLength(length);
    }

    public void validateIntegerLength(int length)
    {
        validateNumberLength(length);
    }

    private void validateNumberLength(int length)
    {
        if (length > _maxNumLength)
            throw new StreamConstraintsException(String.format("Number value length (%d) exceeds the maximum allowed (%d, from %s)",
                length, _maxNumLength, constraintRef("getMaxNumberLength")));
    }

    public void validateStringLength(int length)
    {
        if (length > _maxStringLength)
            throw new StreamConstraintsException(String.format("String value length (%d) exceeds the maximum allowed (%d, from %s)",
                length, _maxStringLength, constraintRef("getMaxStringLength")));
    }

    public void validateNameLength(int length)
    {
        if (length > _maxNameLength)
            throw new StreamConstraintsException(String.format("Name length (%d) exceeds the maximum allowed (%d, from %s)",
                length, _maxNameLength, constraintRef("getMaxNameLength")));
    }

    /**
     * Checks the scale of a {@code BigDecimal} about to be converted to a {@code BigInteger}.
     */
    public void validateBigIntegerScale(int scale)
    {
        int absScale = Math.abs(scale);
        if (absScale > MAX_BIGINT_SCALE_MAGNITUDE)
            throw new StreamConstraintsException(String.format("BigDecimal scale (%d) magnitude exceeds the maximum allowed (%d)",
                scale, MAX_BIGINT_SCALE_MAGNITUDE));
    }

    private static String constraintRef(String method)
    {
        return "`StreamReadConstraints." + method + "()`";
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[depth=%d,docLength=%d,numberLength=%d,stringLength=%d,nameLength=%d]",
            getClass().getSimpleName(), hashCode(), _maxNestingDepth, _maxDocLength, _maxNumLength, _maxStringLength, _maxNameLength);
    }

    public static final class Builder
    {
        private int _maxNestingDepth;
        private long _maxDocLength;
        private int _maxNumLength;
        private int _maxStringLength;
        private int _maxNameLength;

        Builder()
        {
            this(DEFAULTS);
        }

        Builder(StreamReadConstraints src)
        {
            _maxNestingDepth = src._maxNestingDepth;
            _maxDocLength = src._maxDocLength;
            _maxNumLength = src._maxNumLength;
            _maxStringLength = src._maxStringLength;
            _maxNameLength = src._maxNameLength;
        }

        public Builder maxNestingDepth(int maxNestingDepth)
        {
            if (maxNestingDepth < 0)
                throw new IllegalArgumentException("Cannot set maxNestingDepth to a negative value");
            _maxNestingDepth = maxNestingDepth;
            return this;
        }

        /**
         * @param maxDocLength the maximum document length, zero or negative for unlimited
         */
        public Builder maxDocumentLength(long maxDocLength)
        {
            _maxDocLength = maxDocLength <= 0L ? -1L : maxDocLength;
            return this;
        }

        public Builder maxNumberLength(int maxNumLength)
        {
            if (maxNumLength < 0)
                throw new IllegalArgumentException("Cannot set maxNumberLength to a negative value");
            _maxNumLength = maxNumLength;
            return this;
        }

        public Builder maxStringLength(int maxStringLength)
        {
            if (maxStringLength < 0)
                throw new IllegalArgumentException("Cannot set maxStringLength to a negative value");
            _maxStringLength = maxStringLength;
            return this;
        }

        public Builder maxNameLength(int maxNameLength)
        {
            if (maxNameLength < 0)
                throw new IllegalArgumentException("Cannot set maxNameLength to a negative value");
            _maxNameLength = maxNameLength;
            return this;
        }

        public StreamReadConstraints build()
        {
            return new StreamReadConstraints(_maxNestingDepth, _maxDocLength, _maxNumLength, _maxStringLength, _maxNameLength);
        }
    }
}
