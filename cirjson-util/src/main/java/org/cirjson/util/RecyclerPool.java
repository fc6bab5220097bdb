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

import java.util.Deque;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentLinkedDeque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A pool of reusable objects, typically {@link BufferRecycler}s.</p>
 * <p>Pooled objects are acquired with {@link #acquirePooled()} and handed back with
 * {@link #releasePooled(WithPool)}. Alternatively, {@link #acquireAndLinkPooled()} links the
 * pooled object to this pool so that it can return itself with {@link WithPool#releaseToPool()}.</p>
 * <p>Implementations are thread-safe and never block: when a pool is empty a new object is
 * created, when a bounded pool is full the released object is discarded.</p>
 *
 * @param <P> the type of the pooled objects
 */
public interface RecyclerPool<P extends RecyclerPool.WithPool<P>>
{
    /**
     * Default capacity of the bounded pools.
     */
    int DEFAULT_CAPACITY = 100;

    /**
     * <p>A pooled object that may be linked back to the pool it came from.</p>
     *
     * @param <P> the type of the pooled object itself
     */
    interface WithPool<P extends WithPool<P>>
    {
        /**
         * Links this object to the pool it must be released to.
         *
         * @param pool the owning pool
         * @return this object
         * @throws IllegalStateException if this object is already linked to a pool
         */
        P withPool(RecyclerPool<P> pool);

        /**
         * Releases this object to the pool it is linked to, and unlinks it.
         * Does nothing if this object is not linked to a pool.
         */
        void releaseToPool();
    }

    /**
     * @return a pooled object, either recycled or newly created
     */
    P acquirePooled();

    /**
     * Acquires a pooled object and links it back to this pool.
     *
     * @return a pooled object linked to this pool
     */
    default P acquireAndLinkPooled()
    {
        return acquirePooled().withPool(this);
    }

    /**
     * @param pooled the object to return to this pool
     */
    void releasePooled(P pooled);

    /**
     * Discards all the pooled objects.
     *
     * @return whether this pool supports clearing
     */
    default boolean clear()
    {
        return false;
    }

    /**
     * @return the number of pooled objects currently available, or -1 if not known
     */
    default int pooledCount()
    {
        return -1;
    }

    /**
     * <p>A pool that keeps at most one object per thread, in a {@link ThreadLocal}.</p>
     * <p>The object stays with its thread, so it is never linked and releasing it is a no-op.</p>
     */
    abstract class ThreadLocalPoolBase<P extends WithPool<P>> implements RecyclerPool<P>
    {
        @Override
        public P acquireAndLinkPooled()
        {
            return acquirePooled();
        }

        @Override
        public void releasePooled(P pooled)
        {
        }

        @Override
        public String toString()
        {
            return getClass().getSimpleName();
        }
    }

    /**
     * A pool that does not pool: every acquire creates a new object.
     */
    abstract class NonRecyclingPoolBase<P extends WithPool<P>> implements RecyclerPool<P>
    {
        @Override
        public P acquireAndLinkPooled()
        {
            return acquirePooled();
        }

        @Override
        public void releasePooled(P pooled)
        {
        }

        @Override
        public boolean clear()
        {
            return true;
        }

        @Override
        public int pooledCount()
        {
            return 0;
        }

        @Override
        public String toString()
        {
            return getClass().getSimpleName();
        }
    }

    /**
     * <p>Base class for pools that retain the released objects.</p>
     */
    abstract class StatefulPoolBase<P extends WithPool<P>> implements RecyclerPool<P>
    {
        /**
         * @return a new object, used when the pool has none available
         */
        public abstract P createPooled();
    }

    /**
     * <p>An unbounded, lock-free pool backed by a {@link ConcurrentLinkedDeque}.</p>
     */
    abstract class ConcurrentDequePoolBase<P extends WithPool<P>> extends StatefulPoolBase<P>
    {
        private static final Logger LOG = LoggerFactory.getLogger(ConcurrentDequePoolBase.class);

        private final Deque<P> _pool = new ConcurrentLinkedDeque<>();

        @Override
        public P acquirePooled()
        {
            P pooled = _pool.pollFirst();
            if (pooled == null)
            {
                pooled = createPooled();
                if (LOG.isDebugEnabled())
                    LOG.debug("Created {} in {}", pooled, this);
            }
            return pooled;
        }

        @Override
        public void releasePooled(P pooled)
        {
            _pool.offerLast(pooled);
        }

        @Override
        public boolean clear()
        {
            _pool.clear();
            return true;
        }

        @Override
        public int pooledCount()
        {
            return _pool.size();
        }

        @Override
        public String toString()
        {
            return String.format("%s@%x[size=%d]", getClass().getSimpleName(), hashCode(), _pool.size());
        }
    }

    /**
     * <p>A pool that retains at most a fixed number of objects, backed by an
     * {@link ArrayBlockingQueue} used only through its non-blocking methods.</p>
     */
    abstract class BoundedPoolBase<P extends WithPool<P>> extends StatefulPoolBase<P>
    {
        private static final Logger LOG = LoggerFactory.getLogger(BoundedPoolBase.class);

        private final ArrayBlockingQueue<P> _pool;
        private final int _capacity;

        protected BoundedPoolBase(int capacity)
        {
            if (capacity <= 0)
                capacity = DEFAULT_CAPACITY;
            _capacity = capacity;
            _pool = new ArrayBlockingQueue<>(capacity);
        }

        public int capacity()
        {
            return _capacity;
        }

        @Override
        public P acquirePooled()
        {
            P pooled = _pool.poll();
            if (pooled == null)
                pooled = createPooled();
            return pooled;
        }

        @Override
        public void releasePooled(P pooled)
        {
            if (!_pool.offer(pooled))
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Pool full, discarding {} from {}", pooled, this);
            }
        }

        @Override
        public boolean clear()
        {
            _pool.clear();
            return true;
        }

        @Override
        public int pooledCount()
        {
            return _pool.size();
        }

        @Override
        public String toString()
        {
            return String.format("%s@%x[size=%d,capacity=%d]", getClass().getSimpleName(), hashCode(), _pool.size(), _capacity);
        }
    }
}
