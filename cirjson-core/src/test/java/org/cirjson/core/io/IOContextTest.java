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
import org.cirjson.core.StreamWriteConstraints;
import org.cirjson.core.exception.StreamConstraintsException;
import org.cirjson.util.BufferRecycler;
import org.cirjson.util.CirJsonRecyclerPools;
import org.cirjson.util.RecyclerPool;
import org.cirjson.util.TextBuffer;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class IOContextTest
{
    private static IOContext newContext(RecyclerPool<BufferRecycler> pool, Object content)
    {
        return new IOContext(StreamReadConstraints.defaults(), StreamWriteConstraints.defaults(), pool, content, false);
    }

    @Test
    public void testBufferCanOnlyBeBorrowedOnce()
    {
        try (IOContext context = newContext(CirJsonRecyclerPools.newConcurrentDequePool(), null))
        {
            char[] buffer = context.allocTokenBuffer();
            IllegalStateException x = assertThrows(IllegalStateException.class, context::allocTokenBuffer);
            assertThat(x.getMessage(), is("Trying to call same allocXxx() method second time"));

            context.releaseTokenBuffer(buffer);
            assertThat(context.allocTokenBuffer(), sameInstance(buffer));
        }
    }

    @Test
    public void testReleaseSmallerBuffer()
    {
        try (IOContext context = newContext(CirJsonRecyclerPools.newConcurrentDequePool(), null))
        {
            byte[] buffer = context.allocReadIOBuffer();
            IllegalArgumentException x = assertThrows(IllegalArgumentException.class, () -> context.releaseReadIOBuffer(new byte[1]));
            assertThat(x.getMessage(), is("Trying to release buffer smaller than original"));

            context.releaseReadIOBuffer(buffer);
            char[] concat = context.allocConcatBuffer();
            // A larger replacement is accepted.
            context.releaseConcatBuffer(new char[concat.length + 1]);
        }
    }

    @Test
    public void testReleaseWithoutAlloc()
    {
        try (IOContext context = newContext(CirJsonRecyclerPools.newConcurrentDequePool(), null))
        {
            IllegalStateException x = assertThrows(IllegalStateException.class, () -> context.releaseTokenBuffer(new char[10]));
            assertThat(x.getMessage(), is("Trying to release a buffer that was not allocated"));
            x = assertThrows(IllegalStateException.class, () -> context.releaseReadIOBuffer(new byte[10]));
            assertThat(x.getMessage(), is("Trying to release a buffer that was not allocated"));

            byte[] buffer = context.allocWriteEncodingBuffer();
            context.releaseWriteEncodingBuffer(buffer);
            // Released once, the slot is empty again.
            assertThrows(IllegalStateException.class, () -> context.releaseWriteEncodingBuffer(buffer));
        }
    }

    @Test
    public void testCloseReturnsRecyclerToPool()
    {
        RecyclerPool<BufferRecycler> pool = CirJsonRecyclerPools.newConcurrentDequePool();
        IOContext context = newContext(pool, null);
        BufferRecycler recycler = context.bufferRecycler();
        assertThat(pool.pooledCount(), is(0));
        context.close();
        assertThat(context.isClosed(), is(true));
        assertThat(pool.pooledCount(), is(1));
        // Closing again does not release twice.
        context.close();
        assertThat(pool.pooledCount(), is(1));

        try (IOContext next = newContext(pool, null))
        {
            assertThat(next.bufferRecycler(), sameInstance(recycler));
        }
    }

    @Test
    public void testThreadLocalRecyclerStaysWithThread()
    {
        RecyclerPool<BufferRecycler> pool = CirJsonRecyclerPools.threadLocalPool();
        IOContext first = newContext(pool, null);
        BufferRecycler recycler = first.bufferRecycler();
        first.close();
        try (IOContext second = newContext(pool, null))
        {
            assertThat(second.bufferRecycler(), sameInstance(recycler));
        }
    }

    @Test
    public void testContentDescription()
    {
        RecyclerPool<BufferRecycler> pool = CirJsonRecyclerPools.nonRecyclingPool();
        assertThat(newContext(pool, null).contentDescription(), is("UNKNOWN"));
        assertThat(newContext(pool, new byte[3]).contentDescription(), is("(byte[])[3 bytes]"));
        assertThat(newContext(pool, new char[4]).contentDescription(), is("(char[])[4 chars]"));
        assertThat(newContext(pool, "[\"0\"]").contentDescription(), is("(String)\"[\"0\"]\""));
        assertThat(newContext(pool, "x".repeat(60)).contentDescription(), is("(String)\"" + "x".repeat(50) + "\"[truncated 10 chars]"));
        assertThat(newContext(pool, new StringBuilder()).contentDescription(), is("(String)\"\""));
        assertThat(newContext(pool, Integer.valueOf(1)).contentDescription(), is("(java.lang.Integer)"));
    }

    @Test
    public void testTextBufferEnforcesStringLength()
    {
        StreamReadConstraints constraints = StreamReadConstraints.builder().maxStringLength(3).build();
        IOContext context = new IOContext(constraints, StreamWriteConstraints.defaults(), CirJsonRecyclerPools.nonRecyclingPool(), null, true);
        assertThat(context.isResourceManaged(), is(true));
        TextBuffer buffer = context.constructTextBuffer();
        buffer.resetWithCopy("abc".toCharArray(), 0, 3);
        assertThat(buffer.contentsAsString(), is("abc"));
        buffer.resetWithCopy("abcd".toCharArray(), 0, 4);
        StreamConstraintsException x = assertThrows(StreamConstraintsException.class, buffer::contentsAsString);
        assertThat(x.getMessage(), containsString("String value length (4) exceeds the maximum allowed (3"));
    }
}
