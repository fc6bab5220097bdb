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

package org.cirjson.core.cirjson;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * <p>The identities of the objects and arrays written by one generator.</p>
 * <p>Referenced values are matched by identity, never by {@code equals()}. A value gets an
 * id the first time it is written, from a counter that starts at {@code 0} and skips ids
 * registered explicitly with {@link #setID(String, Object, boolean)}; later writes of the
 * same value get the same id. A value must always be written as the same kind of
 * container.</p>
 */
public class IDHolder
{
    private final Map<Object, Entry> _byReferenced = new IdentityHashMap<>();
    private final Map<String, Entry> _byId = new HashMap<>();
    private int _nextId;

    /**
     * @param referenced the value an object or array is written for
     * @param isArray whether the value is written as an array
     * @return the id of the value, created if the value was not seen yet
     * @throws IllegalStateException if the value was seen as the other kind of container
     */
    public String getID(Object referenced, boolean isArray)
    {
        Entry entry = checkKind(referenced, isArray);
        if (entry != null)
            return entry._id;
        String id = Integer.toString(_nextId++);
        while (_byId.containsKey(id))
        {
            id = Integer.toString(_nextId++);
        }
        register(new Entry(id, referenced, isArray));
        return id;
    }

    /**
     * Checks that a value, if it already has an id, has it as the same kind of container.
     *
     * @param referenced the value an object or array is written for
     * @param isArray whether the value is written as an array
     * @return the entry of the value, or null if it has no id yet
     * @throws IllegalStateException if the value was seen as the other kind of container
     */
    private Entry checkKind(Object referenced, boolean isArray)
    {
        Entry entry = _byReferenced.get(referenced);
        if (entry != null && entry._isArray != isArray)
            throw new IllegalStateException(String.format("%s already has id '%s' as %s, can not use it as %s",
                describe(referenced), entry._id, kind(entry._isArray), kind(isArray)));
        return entry;
    }

    /**
     * @param referenced the value an object or array is written for
     * @param isArray whether the value is written as an array
     * @throws IllegalStateException if the value was seen as the other kind of container
     */
    public void verifyKind(Object referenced, boolean isArray)
    {
        checkKind(referenced, isArray);
    }

    /**
     * Registers an explicit id.
     *
     * @param id the id
     * @param referenced the value the id stands for
     * @param isArray whether the value is written as an array
     * @throws IllegalStateException if the id is already used for another value, or the value
     * already has another id
     */
    public void setID(String id, Object referenced, boolean isArray)
    {
        Entry byId = _byId.get(id);
        if (byId != null)
        {
            if (byId._referenced != referenced)
                throw new IllegalStateException(String.format("Id '%s' already used for %s", id, describe(byId._referenced)));
            if (byId._isArray != isArray)
                throw new IllegalStateException(String.format("Id '%s' already used as %s, can not use it as %s", id, kind(byId._isArray), kind(isArray)));
            return;
        }
        Entry byReferenced = _byReferenced.get(referenced);
        if (byReferenced != null)
            throw new IllegalStateException(String.format("%s already has id '%s', can not give it id '%s'", describe(referenced), byReferenced._id, id));
        register(new Entry(id, referenced, isArray));
    }

    /**
     * @param id an id returned or registered before
     * @return the value with the id, or null if the id is unknown
     */
    public Object getFromID(String id)
    {
        Entry entry = _byId.get(id);
        return entry == null ? null : entry._referenced;
    }

    public int size()
    {
        return _byId.size();
    }

    private void register(Entry entry)
    {
        _byReferenced.put(entry._referenced, entry);
        _byId.put(entry._id, entry);
    }

    private static String kind(boolean isArray)
    {
        return isArray ? "an Array" : "an Object";
    }

    private static String describe(Object referenced)
    {
        return String.format("%s@%x", referenced.getClass().getName(), System.identityHashCode(referenced));
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[ids=%d,next=%d]", getClass().getSimpleName(), hashCode(), _byId.size(), _nextId);
    }

    private static final class Entry
    {
        private final String _id;
        private final Object _referenced;
        private final boolean _isArray;

        private Entry(String id, Object referenced, boolean isArray)
        {
            _id = id;
            _referenced = referenced;
            _isArray = isArray;
        }
    }
}
