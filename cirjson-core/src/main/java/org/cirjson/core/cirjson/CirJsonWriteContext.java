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

import org.cirjson.core.CirJsonGenerator;
import org.cirjson.core.TokenStreamContext;
import org.cirjson.core.exception.StreamWriteException;

/**
 * The write context of a CirJSON generator, telling the generator which separator
 * precedes the next name or value, or that the call is out of place.
 */
public final class CirJsonWriteContext extends TokenStreamContext
{
    public static final int STATUS_OK_AS_IS = 0;
    public static final int STATUS_OK_AFTER_COMMA = 1;
    public static final int STATUS_OK_AFTER_COLON = 2;
    public static final int STATUS_OK_AFTER_SPACE = 3;
    public static final int STATUS_EXPECT_VALUE = 4;
    public static final int STATUS_EXPECT_NAME = 5;

    private final CirJsonWriteContext _parent;
    private DuplicateDetector _dups;
    private CirJsonWriteContext _child;

    private String _currentName;
    private Object _currentValue;

    /**
     * Whether a name was written and its value not yet.
     */
    private boolean _gotName;

    private CirJsonWriteContext(int type, CirJsonWriteContext parent, DuplicateDetector dups, Object currentValue)
    {
        _type = type;
        _parent = parent;
        _nestingDepth = parent == null ? 0 : parent._nestingDepth + 1;
        _dups = dups;
        _index = -1;
        _currentValue = currentValue;
    }

    private CirJsonWriteContext reset(int type, Object currentValue)
    {
        _type = type;
        _index = -1;
        _currentName = null;
        _gotName = false;
        _currentValue = currentValue;
        if (_dups != null)
            _dups.reset();
        return this;
    }

    /**
     * @param dups the detector for duplicate names, or null to not detect them
     */
    public static CirJsonWriteContext createRootContext(DuplicateDetector dups)
    {
        return new CirJsonWriteContext(TYPE_ROOT, null, dups, null);
    }

    public CirJsonWriteContext createChildArrayContext(Object currentValue)
    {
        CirJsonWriteContext context = _child;
        if (context == null)
            return _child = new CirJsonWriteContext(TYPE_ARRAY, this, _dups == null ? null : _dups.child(), currentValue);
        return context.reset(TYPE_ARRAY, currentValue);
    }

    public CirJsonWriteContext createChildObjectContext(Object currentValue)
    {
        CirJsonWriteContext context = _child;
        if (context == null)
            return _child = new CirJsonWriteContext(TYPE_OBJECT, this, _dups == null ? null : _dups.child(), currentValue);
        return context.reset(TYPE_OBJECT, currentValue);
    }

    public CirJsonWriteContext clearAndGetParent()
    {
        _currentValue = null;
        return _parent;
    }

    @Override
    public CirJsonWriteContext getParent()
    {
        return _parent;
    }

    @Override
    public String currentName()
    {
        return _currentName;
    }

    @Override
    public boolean hasCurrentName()
    {
        return _currentName != null;
    }

    @Override
    public Object currentValue()
    {
        return _currentValue;
    }

    @Override
    public void assignCurrentValue(Object value)
    {
        _currentValue = value;
    }

    public DuplicateDetector getDupDetector()
    {
        return _dups;
    }

    /**
     * @param name the property name to write
     * @return {@link #STATUS_OK_AS_IS} or {@link #STATUS_OK_AFTER_COMMA}, or
     * {@link #STATUS_EXPECT_VALUE} if a name is not allowed here
     * @throws StreamWriteException if duplicate detection is enabled and the name was already written
     */
    public int writeName(String name)
    {
        if (_type != TYPE_OBJECT || _gotName)
            return STATUS_EXPECT_VALUE;
        if (_dups != null && _dups.isDup(name))
        {
            Object source = _dups.getSource();
            CirJsonGenerator generator = source instanceof CirJsonGenerator ? (CirJsonGenerator)source : null;
            throw new StreamWriteException(generator, "Duplicate Object property \"" + name + "\"");
        }
        _gotName = true;
        _currentName = name;
        return _index < 0 ? STATUS_OK_AS_IS : STATUS_OK_AFTER_COMMA;
    }

    /**
     * @return the separator status for a value, or {@link #STATUS_EXPECT_NAME} if an
     * object property name is due first
     */
    public int writeValue()
    {
        if (_type == TYPE_OBJECT)
        {
            if (!_gotName)
                return STATUS_EXPECT_NAME;
            _gotName = false;
            ++_index;
            return STATUS_OK_AFTER_COLON;
        }
        if (_type == TYPE_ARRAY)
        {
            int index = _index;
            ++_index;
            return index < 0 ? STATUS_OK_AS_IS : STATUS_OK_AFTER_COMMA;
        }
        ++_index;
        return _index == 0 ? STATUS_OK_AS_IS : STATUS_OK_AFTER_SPACE;
    }

    /**
     * @return whether a name was written whose value is still due
     */
    public boolean hasPendingName()
    {
        return _gotName;
    }
}
