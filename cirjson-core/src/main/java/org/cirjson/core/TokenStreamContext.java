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

package org.cirjson.core;

import org.cirjson.util.CharTypes;

/**
 * <p>One level of the container nesting of a token stream: the root, an array or an
 * object.</p>
 * <p>A context knows its parent, its depth, the index of the current entry and, within
 * objects, the current property name. Contexts render as path segments: {@code /} for
 * the root, {@code [index]} for arrays and {@code {"name"}} for objects.</p>
 */
public abstract class TokenStreamContext
{
    public static final int TYPE_ROOT = 0;
    public static final int TYPE_ARRAY = 1;
    public static final int TYPE_OBJECT = 2;

    protected int _type;

    /**
     * Index of the current entry, -1 before the first entry.
     */
    protected int _index;

    protected int _nestingDepth;

    protected TokenStreamContext()
    {
    }

    protected TokenStreamContext(int type, int index)
    {
        _type = type;
        _index = index;
    }

    public abstract TokenStreamContext getParent();

    /**
     * @return the current property name, or null outside objects or before a name
     */
    public abstract String currentName();

    public boolean hasCurrentName()
    {
        return currentName() != null;
    }

    public final boolean inArray()
    {
        return _type == TYPE_ARRAY;
    }

    public final boolean inRoot()
    {
        return _type == TYPE_ROOT;
    }

    public final boolean inObject()
    {
        return _type == TYPE_OBJECT;
    }

    public final int getNestingDepth()
    {
        return _nestingDepth;
    }

    /**
     * @return {@code root}, {@code Array} or {@code Object}
     */
    public final String typeDescription()
    {
        switch (_type)
        {
            case TYPE_ROOT:
                return "root";
            case TYPE_ARRAY:
                return "Array";
            case TYPE_OBJECT:
                return "Object";
            default:
                return "?";
        }
    }

    /**
     * @return the number of entries seen so far in this context
     */
    public final int getEntryCount()
    {
        return _index + 1;
    }

    public final int getCurrentIndex()
    {
        return Math.max(_index, 0);
    }

    /**
     * @return whether the current index refers to an actual entry; in arrays the first
     * element is the identity of the array and is not counted
     */
    public boolean hasValidIndex()
    {
        return _type == TYPE_ARRAY ? _index > 0 : _index >= 0;
    }

    public boolean hasPathSegment()
    {
        if (_type == TYPE_OBJECT)
            return hasCurrentName();
        if (_type == TYPE_ARRAY)
            return hasValidIndex();
        return false;
    }

    /**
     * @return the value associated with this context by the caller, if any
     */
    public Object currentValue()
    {
        return null;
    }

    public void assignCurrentValue(Object value)
    {
    }

    /**
     * @return the path from the root to this context, as in {@code /a/0/b}
     */
    public String pathAsPointer()
    {
        return pathAsPointer(false).toString();
    }

    /**
     * @param includeRoot whether the index of the current root level value is the first segment
     * @return the pointer to this context
     */
    public CirJsonPointer pathAsPointer(boolean includeRoot)
    {
        return CirJsonPointer.forPath(this, includeRoot);
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder(64);
        switch (_type)
        {
            case TYPE_ROOT:
                builder.append('/');
                break;
            case TYPE_ARRAY:
                builder.append('[').append(getCurrentIndex()).append(']');
                break;
            default:
                builder.append('{');
                String name = currentName();
                if (name != null)
                {
                    builder.append('"');
                    CharTypes.appendQuoted(builder, name);
                    builder.append('"');
                }
                else
                {
                    builder.append('?');
                }
                builder.append('}');
                break;
        }
        return builder.toString();
    }
}
