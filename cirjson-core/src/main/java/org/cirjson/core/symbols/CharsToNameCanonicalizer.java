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

package org.cirjson.core.symbols;

import java.util.Arrays;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A table of canonical property name {@code String}s, looked up by their chars.</p>
 * <p>The factory owns a root table; every parser works on a child obtained from
 * {@link #makeChild()}, which shares the root's arrays until it adds a name and then
 * copies them. When the parser is done, {@link #release()} merges the child back into the
 * root if it learned names the root does not have, so later parsers find them.</p>
 * <p>Tables grow by doubling once three quarters full, up to {@value #MAX_T_SIZE} buckets;
 * a table that would grow past that is cleared instead.</p>
 */
public final class CharsToNameCanonicalizer
{
    private static final Logger LOG = LoggerFactory.getLogger(CharsToNameCanonicalizer.class);

    public static final int HASH_MULT = 33;

    static final int DEFAULT_T_SIZE = 64;
    static final int MAX_T_SIZE = 0x10000;
    static final int MAX_ENTRIES_FOR_REUSE = 12000;

    private final CharsToNameCanonicalizer _parent;
    private final AtomicReference<TableInfo> _tableInfo;
    private final int _seed;
    private final boolean _intern;

    private Bucket[] _buckets;
    private int _size;
    private int _sizeThreshold;
    private int _indexMask;
    private int _longestCollisionList;
    private boolean _hashShared;

    private CharsToNameCanonicalizer(int seed, boolean intern)
    {
        _parent = null;
        _seed = seed;
        _intern = intern;
        _hashShared = true;
        _tableInfo = new AtomicReference<>(TableInfo.createInitial(DEFAULT_T_SIZE));
    }

    private CharsToNameCanonicalizer(CharsToNameCanonicalizer parent, int seed, boolean intern, TableInfo info)
    {
        _parent = parent;
        _seed = seed;
        _intern = intern;
        _tableInfo = null;
        _buckets = info._buckets;
        _size = info._size;
        _longestCollisionList = info._longestCollisionList;
        _indexMask = _buckets.length - 1;
        _sizeThreshold = thresholdFor(_buckets.length);
        _hashShared = true;
    }

    /**
     * @return a new root table with a random hash seed, interning names
     */
    public static CharsToNameCanonicalizer createRoot()
    {
        return createRoot(ThreadLocalRandom.current().nextInt(), true);
    }

    public static CharsToNameCanonicalizer createRoot(int seed, boolean intern)
    {
        return new CharsToNameCanonicalizer(seed, intern);
    }

    /**
     * @return a child table for one parser, starting with the root's current names
     */
    public CharsToNameCanonicalizer makeChild()
    {
        return new CharsToNameCanonicalizer(this, _seed, _intern, _tableInfo.get());
    }

    /**
     * Merges the names learned by this child into its root, if any.
     */
    public void release()
    {
        if (!maybeDirty() || _parent == null)
            return;
        _parent.mergeChild(new TableInfo(_size, _longestCollisionList, _buckets));
        // The arrays now belong to the root too.
        _hashShared = true;
    }

    private void mergeChild(TableInfo childState)
    {
        int childCount = childState._size;
        TableInfo currentState = _tableInfo.get();
        if (childCount == currentState._size)
            return;
        if (childCount > MAX_ENTRIES_FOR_REUSE)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Discarding {} names learned by a child of {}", childCount, this);
            childState = TableInfo.createInitial(DEFAULT_T_SIZE);
        }
        else if (childCount < currentState._size)
        {
            return;
        }
        _tableInfo.compareAndSet(currentState, childState);
    }

    public int size()
    {
        if (_tableInfo != null)
            return _tableInfo.get()._size;
        return _size;
    }

    public int bucketCount()
    {
        if (_tableInfo != null)
            return _tableInfo.get()._buckets.length;
        return _buckets.length;
    }

    /**
     * @return whether this child has added names since it was created or last released
     */
    public boolean maybeDirty()
    {
        return !_hashShared;
    }

    public int hashSeed()
    {
        return _seed;
    }

    public int collisionCount()
    {
        int count = 0;
        Bucket[] buckets = _tableInfo != null ? _tableInfo.get()._buckets : _buckets;
        for (Bucket bucket : buckets)
        {
            if (bucket != null)
                count += bucket._length - 1;
        }
        return count;
    }

    public int maxCollisionLength()
    {
        return _longestCollisionList;
    }

    public int calcHash(char[] buffer, int start, int length)
    {
        int hash = _seed;
        for (int i = start, end = start + length; i < end; ++i)
        {
            hash = (hash * HASH_MULT) + buffer[i];
        }
        return hash == 0 ? 1 : hash;
    }

    public int calcHash(String key)
    {
        int hash = _seed;
        for (int i = 0, length = key.length(); i < length; ++i)
        {
            hash = (hash * HASH_MULT) + key.charAt(i);
        }
        return hash == 0 ? 1 : hash;
    }

    private int hashToIndex(int rawHash)
    {
        rawHash += rawHash >>> 15;
        rawHash ^= rawHash << 7;
        rawHash += rawHash >>> 3;
        return rawHash & _indexMask;
    }

    /**
     * @param buffer the chars of the name
     * @param start the offset of the name
     * @param length the length of the name
     * @param hash the hash from {@link #calcHash(char[], int, int)}
     * @return the canonical string for the name
     */
    public String findSymbol(char[] buffer, int start, int length, int hash)
    {
        if (length < 1)
            return "";

        int index = hashToIndex(hash);
        for (Bucket bucket = _buckets[index]; bucket != null; bucket = bucket._next)
        {
            if (bucket.matches(buffer, start, length))
                return bucket._symbol;
        }
        return addSymbol(buffer, start, length, hash, index);
    }

    private String addSymbol(char[] buffer, int start, int length, int hash, int index)
    {
        if (_hashShared)
        {
            _buckets = Arrays.copyOf(_buckets, _buckets.length);
            _hashShared = false;
        }
        else if (_size >= _sizeThreshold)
        {
            rehash();
            index = hashToIndex(hash);
        }

        String symbol = new String(buffer, start, length);
        if (_intern)
            symbol = symbol.intern();
        ++_size;
        Bucket bucket = new Bucket(symbol, _buckets[index]);
        _buckets[index] = bucket;
        _longestCollisionList = Math.max(bucket._length, _longestCollisionList);
        return symbol;
    }

    private void rehash()
    {
        Bucket[] oldBuckets = _buckets;
        int size = oldBuckets.length;
        int newSize = size + size;
        if (newSize > MAX_T_SIZE)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Clearing {} names from {}", _size, this);
            _size = 0;
            Arrays.fill(_buckets, null);
            _longestCollisionList = 0;
            return;
        }

        _buckets = new Bucket[newSize];
        _indexMask = newSize - 1;
        _sizeThreshold = thresholdFor(newSize);
        _longestCollisionList = 0;
        for (Bucket chain : oldBuckets)
        {
            for (Bucket bucket = chain; bucket != null; bucket = bucket._next)
            {
                String symbol = bucket._symbol;
                int index = hashToIndex(calcHash(symbol));
                Bucket moved = new Bucket(symbol, _buckets[index]);
                _buckets[index] = moved;
                _longestCollisionList = Math.max(moved._length, _longestCollisionList);
            }
        }
    }

    private static int thresholdFor(int hashAreaSize)
    {
        return hashAreaSize - (hashAreaSize >> 2);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[size=%d,buckets=%d,root=%b]", getClass().getSimpleName(), hashCode(), size(), bucketCount(), _parent == null);
    }

    private static final class Bucket
    {
        private final String _symbol;
        private final Bucket _next;
        private final int _length;

        private Bucket(String symbol, Bucket next)
        {
            _symbol = symbol;
            _next = next;
            _length = next == null ? 1 : next._length + 1;
        }

        private boolean matches(char[] buffer, int start, int length)
        {
            if (_symbol.length() != length)
                return false;
            for (int i = 0; i < length; ++i)
            {
                if (_symbol.charAt(i) != buffer[start + i])
                    return false;
            }
            return true;
        }
    }

    private static final class TableInfo
    {
        private final int _size;
        private final int _longestCollisionList;
        private final Bucket[] _buckets;

        private TableInfo(int size, int longestCollisionList, Bucket[] buckets)
        {
            _size = size;
            _longestCollisionList = longestCollisionList;
            _buckets = buckets;
        }

        private static TableInfo createInitial(int size)
        {
            return new TableInfo(0, 0, new Bucket[size]);
        }
    }
}
