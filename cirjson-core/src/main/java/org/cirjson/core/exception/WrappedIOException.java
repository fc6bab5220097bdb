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

import java.io.Closeable;
import java.io.IOException;

import org.cirjson.core.CirJacksonException;

/**
 * Wraps an {@link IOException} thrown by the underlying input or output.
 */
public class WrappedIOException extends CirJacksonException
{
    public WrappedIOException(Closeable processor, IOException cause)
    {
        super(processor, cause.getMessage(), null, cause);
    }

    @Override
    public IOException getCause()
    {
        return (IOException)super.getCause();
    }
}
