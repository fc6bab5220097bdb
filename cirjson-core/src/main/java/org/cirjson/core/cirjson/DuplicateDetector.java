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

import java.util.HashSet;
import java.util.Set;

import org.cirjson.core.CirJsonGenerator;
import org.cirjson.core.CirJsonParser;

/**
 * Tracks the property names of one object to detect duplicates. The first two names
 * are kept in fields; a set is only allocated for objects with more properties.
 */
public class DuplicateDetector
{
    private final Object _source;

    private String _firstName;
    private String _secondName;
    private Set<String> _seen;

    private DuplicateDetector(Object source)
    {
        _source = source;
    }

    public static DuplicateDetector rootDetector(CirJsonParser parser)
    {
        return new DuplicateDetector(parser);
    }

    public static DuplicateDetector rootDetector(CirJsonGenerator generator)
    {
        return new DuplicateDetector(generator);
    }

    /**
     * @return a new detector for a nested object, with the same source
     */
    public DuplicateDetector child()
    {
        return new DuplicateDetector(_source);
    }

    public void reset()
    {
        _firstName = null;
        _secondName = null;
        _seen = null;
    }

    /**
     * @return the parser or generator this detector reports for
     */
    public Object getSource()
    {
        return _source;
    }

    /**
     * Records a name.
     *
     * @param name the property name
     * @return whether the name was already recorded
     */
    public boolean isDup(String name)
    {
        if (_firstName == null)
        {
            _firstName = name;
            return false;
        }
        if (name.equals(_firstName))
            return true;
        if (_secondName == null)
        {
            _secondName = name;
            return false;
        }
        if (name.equals(_secondName))
            return true;
        if (_seen == null)
        {
            _seen = new HashSet<>(16);
            _seen.add(_firstName);
            _seen.add(_secondName);
        }
        return !_seen.add(name);
    }
}
