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

import org.cirjson.core.CirJsonLocation;
import org.cirjson.core.CirJsonParser;
import org.cirjson.core.TokenStreamContext;
import org.cirjson.core.exception.StreamReadException;

/**
 * <p>The read context of a CirJSON parser: one per open container, plus the root.</p>
 * <p>Child contexts are reused: a context keeps the last child it created and resets
 * it for the next container at the same depth.</p>
 */
public final class CirJsonReadContext extends TokenStreamContext
{
    private final CirJsonReadContext _parent;
    private DuplicateDetector _dups;
    private CirJsonReadContext _child;

    private String _currentName;
    private Object _currentValue;

    private int _lineNr;
    private int _columnNr;

    public CirJsonReadContext(CirJsonReadContext parent, int nestingDepth, DuplicateDetector dups, int type, int lineNr, int colNr)
    {
        _parent = parent;
        _dups = dups;
        _type = type;
        _nestingDepth = nestingDepth;
        _lineNr = lineNr;
        _columnNr = colNr;
        _index = -1;
    }

    private void reset(int type, int lineNr, int colNr)
    {
        _type = type;
        _index = -1;
        _lineNr = lineNr;
        _columnNr = colNr;
        _currentName = null;
        _currentValue = null;
        if (_dups != null)
            _dups.reset();
    }

    /**
     * @param dups the detector for duplicate names, or null to not detect them
     * @return a new root context
     */
    public static CirJsonReadContext createRootContext(DuplicateDetector dups)
    {
        return new CirJsonReadContext(null, 0, dups, TYPE_ROOT, 1, 0);
    }

    public CirJsonReadContext createChildArrayContext(int lineNr, int colNr)
    {
        return createChild(TYPE_ARRAY, lineNr, colNr);
    }

    public CirJsonReadContext createChildObjectContext(int lineNr, int colNr)
    {
        return createChild(TYPE_OBJECT, lineNr, colNr);
    }

    private CirJsonReadContext createChild(int type, int lineNr, int colNr)
    {
        CirJsonReadContext context = _child;
        if (context == null)
            _child = context = new CirJsonReadContext(this, _nestingDepth + 1, _dups == null ? null : _dups.child(), type, lineNr, colNr);
        else
            context.reset(type, lineNr, colNr);
        return context;
    }

    /**
     * @return the parent context, after clearing the current value of this one
     */
    public CirJsonReadContext clearAndGetParent()
    {
        _currentValue = null;
        return _parent;
    }

    @Override
    public CirJsonReadContext getParent()
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
     * Moves to the next entry.
     *
     * @return whether a comma is expected before the entry
     */
    public boolean expectComma()
    {
        int index = ++_index;
        return _type != TYPE_ROOT && index > 0;
    }

    /**
     * @param name the new current property name
     * @throws StreamReadException if duplicate detection is enabled and the name was already seen in this object
     */
    public void setCurrentName(String name)
    {
        _currentName = name;
        if (_dups != null && _dups.isDup(name))
        {
            Object source = _dups.getSource();
            CirJsonParser parser = source instanceof CirJsonParser ? (CirJsonParser)source : null;
            throw new StreamReadException(parser, "Duplicate Object property \"" + name + "\"");
        }
    }

    /**
     * @param sourceDescription the description of the input, or null
     * @return the location of the start marker of this container
     */
    public CirJsonLocation startLocation(String sourceDescription)
    {
        return new CirJsonLocation(sourceDescription, -1L, -1L, _lineNr, _columnNr);
    }
}
