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

package org.cirjson.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RecyclerPoolTest
{
    public static Stream<RecyclerPool<BufferRecycler>> pools()
    {
        return Stream.of(
            CirJsonRecyclerPools.threadLocalPool(),
            CirJsonRecyclerPools.nonRecyclingPool(),
            CirJsonRecyclerPools.newConcurrentDequePool(),
            CirJsonRecyclerPools.newBoundedPool(4)
        );
    }

    @ParameterizedTest
    @MethodSource("pools")
    public void testAcquireRelease(RecyclerPool<BufferRecycler> pool)
    {
        BufferRecycler recycler = pool.acquireAndLinkPooled();
        assertNotNull(recycler);
        byte[] buffer = recycler.allocByteBuffer(BufferRecycler.BYTE_READ_IO_BUFFER);
        assertThat(buffer.length, is(8000));
        recycler.releaseByteBuffer(BufferRecycler.BYTE_READ_IO_BUFFER, buffer);
        recycler.releaseToPool();
        // A second release is a no-op.
        recycler.releaseToPool();
    }

    @Test
    public void testConcurrentDequeReusesReleased()
    {
        RecyclerPool<BufferRecycler> pool = CirJsonRecyclerPools.newConcurrentDequePool();
        BufferRecycler first = pool.acquireAndLinkPooled();
        assertThat(pool.pooledCount(), is(0));
        first.releaseToPool();
        assertThat(pool.pooledCount(), is(1));
        BufferRecycler second = pool.acquireAndLinkPooled();
        assertThat(second, sameInstance(first));
        assertThat(second.getPool(), sameInstance(pool));
        second.releaseToPool();
        assertTrue(pool.clear());
        assertThat(pool.pooledCount(), is(0));
    }

    @Test
    public void testLinkTwiceFails()
    {
        RecyclerPool<BufferRecycler> pool = CirJsonRecyclerPools.newConcurrentDequePool();
        BufferRecycler recycler = pool.acquireAndLinkPooled();
        assertThrows(IllegalStateException.class, () -> recycler.withPool(pool));
    }

    @Test
    public void testThreadLocalIsNotLinked()
    {
        RecyclerPool<BufferRecycler> pool = CirJsonRecyclerPools.threadLocalPool();
        BufferRecycler first = pool.acquireAndLinkPooled();
        assertThat(first.getPool(), nullValue());
        assertThat(pool.acquireAndLinkPooled(), sameInstance(first));
        assertThat(pool.pooledCount(), is(-1));
    }

    @Test
    public void testNonRecyclingCreatesEveryTime()
    {
        RecyclerPool<BufferRecycler> pool = CirJsonRecyclerPools.nonRecyclingPool();
        BufferRecycler first = pool.acquireAndLinkPooled();
        first.releaseToPool();
        assertThat(pool.acquireAndLinkPooled(), not(sameInstance(first)));
        assertThat(pool.pooledCount(), is(0));
    }

    @Test
    public void testBoundedNeverBlocks()
    {
        RecyclerPool<BufferRecycler> pool = CirJsonRecyclerPools.newBoundedPool(2);
        List<BufferRecycler> acquired = new ArrayList<>();
        for (int i = 0; i < 5; ++i)
        {
            acquired.add(pool.acquireAndLinkPooled());
        }
        assertThat(pool.pooledCount(), is(0));
        for (BufferRecycler recycler : acquired)
        {
            recycler.releaseToPool();
        }
        // Excess releases are dropped.
        assertThat(pool.pooledCount(), is(2));
        assertThat(acquired.contains(pool.acquirePooled()), is(true));
    }

    @Test
    public void testBoundedDefaultCapacity()
    {
        CirJsonRecyclerPools.BoundedPool pool = (CirJsonRecyclerPools.BoundedPool)CirJsonRecyclerPools.newBoundedPool(0);
        assertEquals(RecyclerPool.DEFAULT_CAPACITY, pool.capacity());
    }

    @Test
    public void testForName()
    {
        assertThat(CirJsonRecyclerPools.forName(null), sameInstance(CirJsonRecyclerPools.sharedConcurrentDequePool()));
        assertThat(CirJsonRecyclerPools.forName("threadLocal"), sameInstance(CirJsonRecyclerPools.threadLocalPool()));
        assertThat(CirJsonRecyclerPools.forName("BOUNDED"), sameInstance(CirJsonRecyclerPools.sharedBoundedPool()));
        assertThat(CirJsonRecyclerPools.forName("nonRecycling"), sameInstance(CirJsonRecyclerPools.nonRecyclingPool()));
        assertThat(CirJsonRecyclerPools.forName("unknown"), sameInstance(CirJsonRecyclerPools.sharedConcurrentDequePool()));
    }

    @Test
    public void testConcurrentAcquireRelease() throws Exception
    {
        RecyclerPool<BufferRecycler> pool = CirJsonRecyclerPools.newBoundedPool(3);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try
        {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; ++t)
            {
                futures.add(executor.submit(() ->
                {
                    start.await();
                    for (int i = 0; i < 1000; ++i)
                    {
                        BufferRecycler recycler = pool.acquireAndLinkPooled();
                        char[] buffer = recycler.allocCharBuffer(BufferRecycler.CHAR_TEXT_BUFFER);
                        recycler.releaseCharBuffer(BufferRecycler.CHAR_TEXT_BUFFER, buffer);
                        recycler.releaseToPool();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures)
            {
                future.get(30, TimeUnit.SECONDS);
            }
        }
        finally
        {
            executor.shutdownNow();
        }
        assertTrue(pool.pooledCount() <= 3);
    }
}
