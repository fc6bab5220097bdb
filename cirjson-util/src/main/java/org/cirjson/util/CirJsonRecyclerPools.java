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

import java.lang.ref.SoftReference;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>The {@link RecyclerPool} implementations for {@link BufferRecycler}s.</p>
 * <p>The pool used when none is configured is {@link #defaultPool()}, a shared unbounded
 * concurrent pool, unless the system property {@value #DEFAULT_POOL_PROPERTY} names
 * another strategy: {@code threadLocal}, {@code concurrentDeque}, {@code bounded}
 * or {@code nonRecycling}.</p>
 */
public final class CirJsonRecyclerPools
{
    private static final Logger LOG = LoggerFactory.getLogger(CirJsonRecyclerPools.class);

    public static final String DEFAULT_POOL_PROPERTY = "org.cirjson.util.RecyclerPool.default";

    private static final RecyclerPool<BufferRecycler> DEFAULT_POOL = forName(System.getProperty(DEFAULT_POOL_PROPERTY));

    private CirJsonRecyclerPools()
    {
    }

    /**
     * @return the process-wide default pool
     */
    public static RecyclerPool<BufferRecycler> defaultPool()
    {
        return DEFAULT_POOL;
    }

    /**
     * @param name the strategy name, may be null
     * @return the shared pool for the named strategy, or the shared concurrent pool
     * if the name is null or unknown
     */
    public static RecyclerPool<BufferRecycler> forName(String name)
    {
        if (name == null || name.isBlank())
            return sharedConcurrentDequePool();
        switch (name.trim().toLowerCase(Locale.ENGLISH))
        {
            case "threadlocal":
                return threadLocalPool();
            case "concurrentdeque":
                return sharedConcurrentDequePool();
            case "bounded":
                return sharedBoundedPool();
            case "nonrecycling":
                return nonRecyclingPool();
            default:
                LOG.warn("Unknown recycler pool '{}', using concurrentDeque", name);
                return sharedConcurrentDequePool();
        }
    }

    public static RecyclerPool<BufferRecycler> threadLocalPool()
    {
        return ThreadLocalPool.GLOBAL;
    }

    public static RecyclerPool<BufferRecycler> nonRecyclingPool()
    {
        return NonRecyclingPool.GLOBAL;
    }

    public static RecyclerPool<BufferRecycler> sharedConcurrentDequePool()
    {
        return ConcurrentDequePool.GLOBAL;
    }

    public static RecyclerPool<BufferRecycler> newConcurrentDequePool()
    {
        return new ConcurrentDequePool();
    }

    public static RecyclerPool<BufferRecycler> sharedBoundedPool()
    {
        return BoundedPool.GLOBAL;
    }

    public static RecyclerPool<BufferRecycler> newBoundedPool(int capacity)
    {
        return new BoundedPool(capacity);
    }

    /**
     * <p>Keeps one {@link BufferRecycler} per thread, softly referenced so that it can
     * be reclaimed when memory is short.</p>
     */
    public static class ThreadLocalPool extends RecyclerPool.ThreadLocalPoolBase<BufferRecycler>
    {
        private static final ThreadLocalPool GLOBAL = new ThreadLocalPool();
        private static final ThreadLocal<SoftReference<BufferRecycler>> RECYCLER = new ThreadLocal<>();

        protected ThreadLocalPool()
        {
        }

        @Override
        public BufferRecycler acquirePooled()
        {
            SoftReference<BufferRecycler> reference = RECYCLER.get();
            BufferRecycler recycler = reference == null ? null : reference.get();
            if (recycler == null)
            {
                recycler = new BufferRecycler();
                RECYCLER.set(new SoftReference<>(recycler));
            }
            return recycler;
        }
    }

    public static class NonRecyclingPool extends RecyclerPool.NonRecyclingPoolBase<BufferRecycler>
    {
        private static final NonRecyclingPool GLOBAL = new NonRecyclingPool();

        protected NonRecyclingPool()
        {
        }

        @Override
        public BufferRecycler acquirePooled()
        {
            return new BufferRecycler();
        }
    }

    public static class ConcurrentDequePool extends RecyclerPool.ConcurrentDequePoolBase<BufferRecycler>
    {
        private static final ConcurrentDequePool GLOBAL = new ConcurrentDequePool();

        protected ConcurrentDequePool()
        {
        }

        @Override
        public BufferRecycler createPooled()
        {
            return new BufferRecycler();
        }
    }

    public static class BoundedPool extends RecyclerPool.BoundedPoolBase<BufferRecycler>
    {
        private static final BoundedPool GLOBAL = new BoundedPool(DEFAULT_CAPACITY);

        protected BoundedPool(int capacity)
        {
            super(capacity);
        }

        @Override
        public BufferRecycler createPooled()
        {
            return new BufferRecycler();
        }
    }
}
