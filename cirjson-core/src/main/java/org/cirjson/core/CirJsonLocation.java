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

import java.util.Objects;

/**
 * <p>An immutable position in the input: byte or char offset, line and column.</p>
 * <p>Parsers over bytes report {@link #getByteOffset()} and parsers over chars report
 * {@link #getCharOffset()}; the other offset is -1. Lines and columns are 1-based.</p>
 */
public class CirJsonLocation
{
    /**
     * The location used when no location is known.
     */
    public static final CirJsonLocation NA = new CirJsonLocation(null, -1L, -1L, -1, -1);

    private final String _sourceDescription;
    private final long _byteOffset;
    private final long _charOffset;
    private final int _line;
    private final int _column;

    public CirJsonLocation(String sourceDescription, long byteOffset, long charOffset, int line, int column)
    {
        _sourceDescription = sourceDescription;
        _byteOffset = byteOffset;
        _charOffset = charOffset;
        _line = line;
        _column = column;
    }

    /**
     * @return a description of the input, or null if not known or not included
     */
    public String getSourceDescription()
    {
        return _sourceDescription;
    }

    public long getByteOffset()
    {
        return _byteOffset;
    }

    public long getCharOffset()
    {
        return _charOffset;
    }

    public int getLineNr()
    {
        return _line;
    }

    public int getColumnNr()
    {
        return _column;
    }

    /**
     * @return the location without the source, as in {@code line: 1, column: 7}
     */
    public String offsetDescription()
    {
        StringBuilder builder = new StringBuilder(40);
        if (_line > 0)
        {
            builder.append("line: ").append(_line);
            if (_column > 0)
                builder.append(", column: ").append(_column);
        }
        else
        {
            builder.append("line: UNKNOWN");
            if (_column > 0)
                builder.append(", column: ").append(_column);
            else if (_byteOffset >= 0)
                builder.append(", byte offset: #").append(_byteOffset);
            else if (_charOffset >= 0)
                builder.append(", char offset: #").append(_charOffset);
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object o)
    {
        if (o == this)
            return true;
        if (!(o instanceof CirJsonLocation))
            return false;
        CirJsonLocation other = (CirJsonLocation)o;
        return _byteOffset == other._byteOffset &&
            _charOffset == other._charOffset &&
            _line == other._line &&
            _column == other._column &&
            Objects.equals(_sourceDescription, other._sourceDescription);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_sourceDescription, _byteOffset, _charOffset, _line, _column);
    }

    @Override
    public String toString()
    {
        return "[Source: " + (_sourceDescription == null ? "UNKNOWN" : _sourceDescription) + "; " + offsetDescription() + "]";
    }
}
