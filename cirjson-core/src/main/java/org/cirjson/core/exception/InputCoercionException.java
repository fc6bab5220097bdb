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

import org.cirjson.core.CirJsonParser;
import org.cirjson.core.CirJsonToken;

/**
 * Thrown when the current value cannot be represented as the requested type,
 * such as an integer out of the range of {@code byte}.
 */
public class InputCoercionException extends StreamReadException
{
    private final CirJsonToken _inputType;
    private final Class<?> _targetType;

    public InputCoercionException(CirJsonParser parser, String message, CirJsonToken inputType, Class<?> targetType)
    {
        super(parser, message);
        _inputType = inputType;
        _targetType = targetType;
    }

    /**
     * @return the token that could not be coerced
     */
    public CirJsonToken getInputType()
    {
        return _inputType;
    }

    /**
     * @return the requested type
     */
    public Class<?> getTargetType()
    {
        return _targetType;
    }
}
