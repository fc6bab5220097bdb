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

import java.util.ArrayList;
import java.util.List;

import org.cirjson.util.NumberInput;

/**
 * <p>A CirJSON Pointer: a path such as {@code /a/0/b} that locates a value in a document.</p>
 * <p>A pointer is a chain of segments. Each instance matches one segment, a property
 * name or an array index, and links to the pointer for the rest of the path; the chain
 * ends with {@link #EMPTY}, which matches the current value. In segments, {@code ~1}
 * stands for {@code /} and {@code ~0} for {@code ~}.</p>
 * <p>Instances are immutable.</p>
 */
public class CirJsonPointer
{
    public static final char SEPARATOR = '/';

    /**
     * The pointer that matches the current value.
     */
    public static final CirJsonPointer EMPTY = new CirJsonPointer();

    private final String _asString;
    private final String _matchingProperty;
    private final int _matchingIndex;
    private final CirJsonPointer _nextSegment;

    private CirJsonPointer()
    {
        _asString = "";
        _matchingProperty = null;
        _matchingIndex = -1;
        _nextSegment = null;
    }

    private CirJsonPointer(String asString, String property, CirJsonPointer next)
    {
        _asString = asString;
        _matchingProperty = property;
        _matchingIndex = parseIndex(property);
        _nextSegment = next;
    }

    /**
     * @param expression the pointer expression, empty or starting with {@code /}
     * @return the pointer for the expression
     * @throws IllegalArgumentException if the expression does not start with {@code /}
     */
    public static CirJsonPointer compile(String expression) throws IllegalArgumentException
    {
        if (expression == null || expression.isEmpty())
            return EMPTY;
        if (expression.charAt(0) != SEPARATOR)
            throw new IllegalArgumentException("Invalid input: CirJSON Pointer expression must start with '/': \"" + expression + "\"");

        List<Integer> starts = new ArrayList<>();
        List<String> segments = new ArrayList<>();
        int i = 0;
        int length = expression.length();
        while (i < length)
        {
            starts.add(i);
            StringBuilder segment = new StringBuilder();
            ++i;
            while (i < length)
            {
                char c = expression.charAt(i);
                if (c == SEPARATOR)
                    break;
                ++i;
                if (c == '~' && i < length)
                {
                    char next = expression.charAt(i);
                    if (next == '0' || next == '1')
                    {
                        ++i;
                        c = next == '0' ? '~' : SEPARATOR;
                    }
                }
                segment.append(c);
            }
            segments.add(segment.toString());
        }

        CirJsonPointer pointer = EMPTY;
        for (int s = segments.size(); s-- > 0; )
        {
            pointer = new CirJsonPointer(expression.substring(starts.get(s)), segments.get(s), pointer);
        }
        return pointer;
    }

    /**
     * <p>Returns the pointer to where a stream context is.</p>
     * <p>A context that is not yet at any entry, such as an array before its first element,
     * adds no segment.</p>
     *
     * @param context the context, or null
     * @param includeRoot whether the index of the current root level value is the first segment
     * @return the pointer for the context
     */
    public static CirJsonPointer forPath(TokenStreamContext context, boolean includeRoot)
    {
        if (context == null)
            return EMPTY;
        if (!context.hasPathSegment() && !(includeRoot && context.inRoot() && context.hasValidIndex()))
            context = context.getParent();

        List<String> segments = new ArrayList<>();
        while (context != null)
        {
            if (context.inObject())
            {
                String name = context.currentName();
                segments.add(escape(name == null ? "" : name));
            }
            else if (context.inArray() || includeRoot)
            {
                segments.add(String.valueOf(context.getCurrentIndex()));
            }
            context = context.getParent();
        }

        StringBuilder builder = new StringBuilder();
        for (int i = segments.size(); i-- > 0; )
        {
            builder.append(SEPARATOR).append(segments.get(i));
        }
        return compile(builder.toString());
    }

    /**
     * @return the segment with {@code ~} and {@code /} escaped
     */
    public static String escape(String segment)
    {
        if (segment.indexOf('~') < 0 && segment.indexOf(SEPARATOR) < 0)
            return segment;
        StringBuilder builder = new StringBuilder(segment.length() + 4);
        for (int i = 0; i < segment.length(); ++i)
        {
            char c = segment.charAt(i);
            if (c == '~')
                builder.append("~0");
            else if (c == SEPARATOR)
                builder.append("~1");
            else
                builder.append(c);
        }
        return builder.toString();
    }

    private static int parseIndex(String segment)
    {
        int length = segment.length();
        if (length == 0 || length > 10)
            return -1;
        char c = segment.charAt(0);
        if (c == '0')
            return length == 1 ? 0 : -1;
        for (int i = 0; i < length; ++i)
        {
            c = segment.charAt(i);
            if (c < '0' || c > '9')
                return -1;
        }
        if (length == 10)
        {
            long value = NumberInput.parseLong(segment);
            return value > Integer.MAX_VALUE ? -1 : (int)value;
        }
        return NumberInput.parseInt(segment);
    }

    /**
     * @return whether this pointer matches the current value, with no segment left
     */
    public boolean matches()
    {
        return _nextSegment == null;
    }

    public String getMatchingProperty()
    {
        return _matchingProperty;
    }

    /**
     * @return the index this segment matches, or -1 if it is not a valid index
     */
    public int getMatchingIndex()
    {
        return _matchingIndex;
    }

    public boolean mayMatchProperty()
    {
        return _matchingProperty != null;
    }

    public boolean mayMatchElement()
    {
        return _matchingIndex >= 0;
    }

    /**
     * @return the pointer for the rest of the path, or null if this pointer matches
     */
    public CirJsonPointer tail()
    {
        return _nextSegment;
    }

    /**
     * @return the pointer to the last segment, or null if this pointer matches
     */
    public CirJsonPointer last()
    {
        if (matches())
            return null;
        CirJsonPointer current = this;
        while (!current._nextSegment.matches())
        {
            current = current._nextSegment;
        }
        return current;
    }

    /**
     * @return the pointer without its last segment, or null if this pointer matches
     */
    public CirJsonPointer head()
    {
        CirJsonPointer last = last();
        if (last == null)
            return null;
        return compile(_asString.substring(0, _asString.length() - last._asString.length()));
    }

    /**
     * @param name the property name of the current entry
     * @return the pointer for the rest of the path if the first segment is the name, else null
     */
    public CirJsonPointer matchProperty(String name)
    {
        if (_nextSegment != null && name.equals(_matchingProperty))
            return _nextSegment;
        return null;
    }

    /**
     * @param index the index of the current element
     * @return the pointer for the rest of the path if the first segment is the index, else null
     */
    public CirJsonPointer matchElement(int index)
    {
        if (_nextSegment != null && index == _matchingIndex && index >= 0)
            return _nextSegment;
        return null;
    }

    /**
     * @param tail the path to add
     * @return a pointer to the path of this pointer followed by the tail
     */
    public CirJsonPointer append(CirJsonPointer tail)
    {
        if (this == EMPTY)
            return tail;
        if (tail == EMPTY)
            return this;
        String head = _asString;
        // A trailing separator would add an empty segment.
        if (head.endsWith("/"))
            head = head.substring(0, head.length() - 1);
        return compile(head + tail._asString);
    }

    public CirJsonPointer appendProperty(String property)
    {
        if (property == null)
            return this;
        return compile(_asString + SEPARATOR + escape(property));
    }

    public CirJsonPointer appendIndex(int index)
    {
        if (index < 0)
            throw new IllegalArgumentException("Negative index cannot be appended");
        return compile(_asString + SEPARATOR + index);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof CirJsonPointer))
            return false;
        return _asString.equals(((CirJsonPointer)o)._asString);
    }

    @Override
    public int hashCode()
    {
        return _asString.hashCode();
    }

    @Override
    public String toString()
    {
        return _asString;
    }
}
