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

/**
 * Feeds input held in byte arrays.
 */
public interface ByteArrayFeeder extends NonBlockingInputFeeder
{
    /**
     * Feeds a range of bytes. The array must not be modified until the parser
     * needs more input again.
     *
     * @param buffer the bytes
     * @param start the index of the first byte
     * @param end the index after the last byte
     * @throws org.cirjson.core.exception.StreamReadException if the parser still has undecoded input,
     * the end of input was already signalled, or the range is invalid
     */
    void feedInput(byte[] buffer, int start, int end);
}
