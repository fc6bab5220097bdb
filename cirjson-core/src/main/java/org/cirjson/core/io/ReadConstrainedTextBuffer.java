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

package org.cirjson.core.io;

import org.cirjson.core.StreamReadConstraints;
import org.cirjson.util.BufferRecycler;
import org.cirjson.util.TextBuffer;

/**
 * A {@link TextBuffer} that enforces {@link StreamReadConstraints#getMaxStringLength()}.
 */
public class ReadConstrainedTextBuffer extends TextBuffer
{
    private final StreamReadConstraints _constraints;

    public ReadConstrainedTextBuffer(StreamReadConstraints constraints, BufferRecycler recycler)
    {
        super(recycler);
        _constraints = constraints;
    }

    @Override
    protected void validateStringLength(int length)
    {
        _constraints.validateStringLength(length);
    }
}
