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

package org.cirjson.core.async;

import java.nio.ByteBuffer;

/**
 * Feeds input held in {@link ByteBuffer}s.
 */
public interface ByteBufferFeeder extends NonBlockingInputFeeder
{
    /**
     * Feeds the remaining bytes of a buffer, from its position to its limit. The buffer
     * must not be modified until the parser needs more input again.
     *
     * @param buffer the bytes
     * @throws org.cirjson.core.exception.StreamReadException if the parser still has undecoded input
     * or the end of input was already signalled
     */
    void feedInput(ByteBuffer buffer);
}
