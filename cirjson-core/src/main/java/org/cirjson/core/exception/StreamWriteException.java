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
import org.cirjson.core.CirJsonGenerator;

/**
 * Thrown when a generator is used in a way that would produce invalid output.
 */
public class StreamWriteException extends CirJacksonException
{
    public StreamWriteException(CirJsonGenerator generator, String message)
    {
        super(generator, message, null, null);
    }

    public StreamWriteException(CirJsonGenerator generator, String message, Throwable cause)
    {
        super(generator, message, null, cause);
    }

    @Override
    public CirJsonGenerator getProcessor()
    {
        return (CirJsonGenerator)super.getProcessor();
    }
}
