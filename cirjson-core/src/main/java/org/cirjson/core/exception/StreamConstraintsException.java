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

/**
 * Thrown when the input or output exceeds a configured limit, such as the maximum nesting depth.
 */
public class StreamConstraintsException extends CirJacksonException
{
    public StreamConstraintsException(String message)
    {
        super(message);
    }

    public StreamConstraintsException(String message, CirJsonLocation location)
    {
        super(null, message, location, null);
    }
}
