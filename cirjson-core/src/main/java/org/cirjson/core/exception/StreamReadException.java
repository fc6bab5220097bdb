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

package org.cirjson.core.exception;

import org.cirjson.core.CirJacksonException;
import org.cirjson.core.CirJsonLocation;
import org.cirjson.core.CirJsonParser;

/**
 * Thrown when the input is not valid CirJSON, or cannot be read as requested.
 */
public class StreamReadException extends CirJacksonException
{
    public StreamReadException(CirJsonParser parser, String message)
    {
        this(parser, message, parser == null ? null : parser.currentLocation(), null);
    }

    public StreamReadException(CirJsonParser parser, String message, Throwable cause)
    {
        this(parser, message, parser == null ? null : parser.currentLocation(), cause);
    }

    public StreamReadException(CirJsonParser parser, String message, CirJsonLocation location)
    {
        this(parser, message, location, null);
    }

    public StreamReadException(CirJsonParser parser, String message, CirJsonLocation location, Throwable cause)
    {
        super(parser, message, location, cause);
    }

    @Override
    public CirJsonParser getProcessor()
    {
        return (CirJsonParser)super.getProcessor();
    }
}
