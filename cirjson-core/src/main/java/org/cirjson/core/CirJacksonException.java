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

import java.io.Closeable;

/**
 * <p>The root of the exceptions thrown when reading or writing CirJSON.</p>
 * <p>The exception carries the parser or generator that threw it, and the location of
 * the problem in the input when known; the location is appended to the message.</p>
 */
public class CirJacksonException extends RuntimeException
{
    private final transient Closeable _processor;
    private final CirJsonLocation _location;

    public CirJacksonException(String message)
    {
        this(null, message, null, null);
    }

    public CirJacksonException(String message, Throwable cause)
    {
        this(null, message, null, cause);
    }

    public CirJacksonException(Closeable processor, String message)
    {
        this(processor, message, null, null);
    }

    public CirJacksonException(Closeable processor, String message, CirJsonLocation location, Throwable cause)
    {
        super(message, cause);
        _processor = processor;
        _location = location;
    }

    /**
     * @return the location of the problem, or null if not known
     */
    public CirJsonLocation getLocation()
    {
        return _location;
    }

    /**
     * @return the parser or generator that threw this exception, or null
     */
    public Object getProcessor()
    {
        return _processor;
    }

    /**
     * @return the message without the location
     */
    public String getOriginalMessage()
    {
        return super.getMessage();
    }

    @Override
    public String getMessage()
    {
        String message = super.getMessage();
        if (message == null)
            message = "N/A";
        if (_location == null || _location == CirJsonLocation.NA)
            return message;
        return message + "\n at " + _location;
    }

    @Override
    public String toString()
    {
        return getClass().getName() + ": " + getMessage();
    }
}
