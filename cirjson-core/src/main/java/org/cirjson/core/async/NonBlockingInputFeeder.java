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
 * <p>The push side of a non-blocking parser.</p>
 * <p>Input is fed in chunks, only when {@link #needMoreInput()} is true, that is after
 * the parser returned {@link org.cirjson.core.CirJsonToken#NOT_AVAILABLE}. After the last
 * chunk, {@link #endOfInput()} lets the parser complete its pending token and then
 * report the end of input.</p>
 */
public interface NonBlockingInputFeeder
{
    /**
     * @return whether all fed input was consumed and more can be fed
     */
    boolean needMoreInput();

    /**
     * Signals that no more input will be fed.
     */
    void endOfInput();
}
