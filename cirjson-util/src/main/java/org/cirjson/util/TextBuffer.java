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
import java.util.Arrays;
import java.util.List;

/**
 * <p>A segmented accumulator of characters, used by parsers to collect token text.</p>
 * <p>Content is held in one of three ways: a shared slice of the caller's input buffer
 * (no copy), a cached {@code String}, or a list of finished segments plus a current
 * segment. The first segment is borrowed from a {@link BufferRecycler} when one is
 * available, and returned by {@link #releaseBuffers()}.</p>
 */
public class TextBuffer
{
    static final char[] NO_CHARS = new char[0];

    static final int MIN_SEGMENT_LEN = 500;
    static final int MAX_SEGMENT_LEN = 64 * 1024;

    private final BufferRecycler _recycler;

    private char[] _inputBuffer;
    private int _inputStart;
    private int _inputLen;

    private List<char[]> _segments;
    private boolean _hasSegments;
    private int _segmentSize;

    private char[] _currentSegment;
    private int _currentSize;

    private String _resultString;
    private char[] _resultArray;

    public TextBuffer(BufferRecycler recycler)
    {
        _recycler = recycler;
    }

    /**
     * Returns the buffers to the recycler, if any, and empties this buffer.
     */
    public void releaseBuffers()
    {
        _inputStart = -1;
        _currentSize = 0;
        _inputLen = 0;
        _inputBuffer = null;
        _resultString = null;
        _resultArray = null;
        if (_hasSegments)
            clearSegments();
        if (_recycler != null && _currentSegment != null)
        {
            char[] buffer = _currentSegment;
            _currentSegment = null;
            _recycler.releaseCharBuffer(BufferRecycler.CHAR_TEXT_BUFFER, buffer);
        }
    }

    public void resetWithEmpty()
    {
        _inputStart = -1;
        _currentSize = 0;
        _inputLen = 0;
        _inputBuffer = null;
        _resultString = null;
        _resultArray = null;
        if (_hasSegments)
            clearSegments();
    }

    /**
     * Makes the content a slice of the given buffer, without copying.
     * The caller must not modify the slice while it is in use.
     */
    public void resetWithShared(char[] buffer, int start, int length)
    {
        _resultString = null;
        _resultArray = null;
        _inputBuffer = buffer;
        _inputStart = start;
        _inputLen = length;
        if (_hasSegments)
            clearSegments();
    }

    public void resetWithCopy(char[] buffer, int start, int length)
    {
        _inputBuffer = null;
        _inputStart = -1;
        _inputLen = 0;
        _resultString = null;
        _resultArray = null;
        if (_hasSegments)
            clearSegments();
        else if (_currentSegment == null)
            _currentSegment = buffer(length);
        _currentSize = 0;
        _segmentSize = 0;
        append(buffer, start, length);
    }

    public void resetWithString(String value)
    {
        _inputBuffer = null;
        _inputStart = -1;
        _inputLen = 0;
        validateStringLength(value.length());
        _resultString = value;
        _resultArray = null;
        if (_hasSegments)
            clearSegments();
        _currentSize = 0;
    }

    private char[] buffer(int needed)
    {
        if (_recycler != null)
            return _recycler.allocCharBuffer(BufferRecycler.CHAR_TEXT_BUFFER, needed);
        return new char[Math.max(needed, MIN_SEGMENT_LEN)];
    }

    private void clearSegments()
    {
        _hasSegments = false;
        _segments.clear();
        _currentSize = 0;
        _segmentSize = 0;
    }

    public int size()
    {
        if (_inputStart >= 0)
            return _inputLen;
        if (_resultArray != null)
            return _resultArray.length;
        if (_resultString != null)
            return _resultString.length();
        return _segmentSize + _currentSize;
    }

    public int getTextOffset()
    {
        return _inputStart >= 0 ? _inputStart : 0;
    }

    public boolean hasTextAsCharacters()
    {
        if (_inputStart >= 0 || _resultArray != null)
            return true;
        return _resultString == null;
    }

    /**
     * @return an array holding the content from {@link #getTextOffset()}
     */
    public char[] getTextBuffer()
    {
        if (_inputStart >= 0)
            return _inputBuffer;
        if (_resultArray != null)
            return _resultArray;
        if (_resultString != null)
            return _resultArray = _resultString.toCharArray();
        if (!_hasSegments)
            return _currentSegment == null ? NO_CHARS : _currentSegment;
        return contentsAsArray();
    }

    public String contentsAsString()
    {
        if (_resultString == null)
        {
            if (_resultArray != null)
            {
                _resultString = new String(_resultArray);
            }
            else if (_inputStart >= 0)
            {
                validateStringLength(_inputLen);
                _resultString = _inputLen < 1 ? "" : new String(_inputBuffer, _inputStart, _inputLen);
            }
            else
            {
                int segLen = _segmentSize;
                int currLen = _currentSize;
                if (segLen == 0)
                {
                    validateStringLength(currLen);
                    _resultString = currLen == 0 ? "" : new String(_currentSegment, 0, currLen);
                }
                else
                {
                    int total = segLen + currLen;
                    validateStringLength(total);
                    StringBuilder builder = new StringBuilder(total);
                    for (char[] segment : _segments)
                    {
                        builder.append(segment, 0, segment.length);
                    }
                    builder.append(_currentSegment, 0, _currentSize);
                    _resultString = builder.toString();
                }
            }
        }
        return _resultString;
    }

    public char[] contentsAsArray()
    {
        char[] result = _resultArray;
        if (result == null)
            _resultArray = result = resultArray();
        return result;
    }

    private char[] resultArray()
    {
        if (_resultString != null)
            return _resultString.toCharArray();
        if (_inputStart >= 0)
        {
            int length = _inputLen;
            if (length < 1)
                return NO_CHARS;
            validateStringLength(length);
            return Arrays.copyOfRange(_inputBuffer, _inputStart, _inputStart + length);
        }
        int size = size();
        if (size < 1)
            return NO_CHARS;
        validateStringLength(size);
        char[] result = new char[size];
        int offset = 0;
        if (_hasSegments)
        {
            for (char[] segment : _segments)
            {
                System.arraycopy(segment, 0, result, offset, segment.length);
                offset += segment.length;
            }
        }
        System.arraycopy(_currentSegment, 0, result, offset, _currentSize);
        return result;
    }

    /**
     * Copies any shared content into an owned segment, so the content can be appended to.
     */
    private void unshare(int needExtra)
    {
        int sharedLen = _inputLen;
        _inputLen = 0;
        char[] inputBuffer = _inputBuffer;
        _inputBuffer = null;
        int start = _inputStart;
        _inputStart = -1;

        int needed = sharedLen + needExtra;
        if (_currentSegment == null || needed > _currentSegment.length)
            _currentSegment = buffer(needed);
        if (sharedLen > 0)
            System.arraycopy(inputBuffer, start, _currentSegment, 0, sharedLen);
        _segmentSize = 0;
        _currentSize = sharedLen;
    }

    private void unshareString()
    {
        if (_resultString != null && _inputStart < 0 && _segmentSize == 0 && _currentSize == 0)
        {
            String value = _resultString;
            _resultString = null;
            _resultArray = null;
            append(value, 0, value.length());
            return;
        }
        _resultString = null;
        _resultArray = null;
    }

    public void append(char c)
    {
        unshareString();
        if (_inputStart >= 0)
            unshare(16);
        char[] current = _currentSegment;
        if (current == null)
            current = _currentSegment = buffer(0);
        if (_currentSize >= current.length)
        {
            expand();
            current = _currentSegment;
        }
        current[_currentSize++] = c;
    }

    public void append(char[] chars, int start, int length)
    {
        unshareString();
        if (_inputStart >= 0)
            unshare(length);
        if (_currentSegment == null)
            _currentSegment = buffer(length);
        char[] current = _currentSegment;
        int max = current.length - _currentSize;
        if (max >= length)
        {
            System.arraycopy(chars, start, current, _currentSize, length);
            _currentSize += length;
            return;
        }
        if (max > 0)
        {
            System.arraycopy(chars, start, current, _currentSize, max);
            start += max;
            length -= max;
        }
        do
        {
            expand();
            int amount = Math.min(_currentSegment.length, length);
            System.arraycopy(chars, start, _currentSegment, 0, amount);
            _currentSize += amount;
            start += amount;
            length -= amount;
        }
        while (length > 0);
    }

    public void append(String text, int offset, int length)
    {
        unshareString();
        if (_inputStart >= 0)
            unshare(length);
        if (_currentSegment == null)
            _currentSegment = buffer(length);
        char[] current = _currentSegment;
        int max = current.length - _currentSize;
        if (max >= length)
        {
            text.getChars(offset, offset + length, current, _currentSize);
            _currentSize += length;
            return;
        }
        if (max > 0)
        {
            text.getChars(offset, offset + max, current, _currentSize);
            length -= max;
            offset += max;
        }
        do
        {
            expand();
            int amount = Math.min(_currentSegment.length, length);
            text.getChars(offset, offset + amount, _currentSegment, 0);
            _currentSize += amount;
            offset += amount;
            length -= amount;
        }
        while (length > 0);
    }

    /**
     * Empties the content and returns the current segment for direct filling.
     *
     * @return the current segment, to be filled from index 0
     */
    public char[] emptyAndGetCurrentSegment()
    {
        _inputStart = -1;
        _currentSize = 0;
        _inputLen = 0;
        _inputBuffer = null;
        _resultString = null;
        _resultArray = null;
        if (_hasSegments)
            clearSegments();
        char[] current = _currentSegment;
        if (current == null)
            _currentSegment = current = buffer(0);
        return current;
    }

    public char[] getCurrentSegment()
    {
        if (_inputStart >= 0)
            unshare(1);
        else if (_currentSegment == null)
            _currentSegment = buffer(0);
        return _currentSegment;
    }

    public int getCurrentSegmentSize()
    {
        return _currentSize;
    }

    public void setCurrentLength(int length)
    {
        _resultString = null;
        _resultArray = null;
        _currentSize = length;
    }

    /**
     * Sets the used length of the current segment and returns the whole content.
     */
    public String setCurrentAndReturn(int length)
    {
        _resultString = null;
        _resultArray = null;
        _currentSize = length;
        if (_segmentSize > 0)
            return contentsAsString();
        validateStringLength(length);
        String result = length == 0 ? "" : new String(_currentSegment, 0, length);
        _resultString = result;
        return result;
    }

    /**
     * Moves the full current segment to the finished segments and starts a new one.
     *
     * @return the new current segment
     */
    public char[] finishCurrentSegment()
    {
        _resultString = null;
        _resultArray = null;
        if (_segments == null)
            _segments = new ArrayList<>();
        _hasSegments = true;
        _segments.add(_currentSegment);
        int oldLen = _currentSegment.length;
        _segmentSize += oldLen;
        validateStringLength(_segmentSize);
        _currentSize = 0;
        char[] current = new char[nextSegmentLength(oldLen)];
        _currentSegment = current;
        return current;
    }

    /**
     * Grows the current segment in place, keeping its content.
     *
     * @return the grown current segment
     */
    public char[] expandCurrentSegment()
    {
        char[] current = _currentSegment;
        int length = current.length;
        int newLength = length == MAX_SEGMENT_LEN ? MAX_SEGMENT_LEN + 1 : Math.min(MAX_SEGMENT_LEN, length + (length >> 1));
        return _currentSegment = Arrays.copyOf(current, newLength);
    }

    private void expand()
    {
        if (_segments == null)
            _segments = new ArrayList<>();
        char[] current = _currentSegment;
        _hasSegments = true;
        _segments.add(current);
        _segmentSize += current.length;
        validateStringLength(_segmentSize);
        _currentSize = 0;
        _currentSegment = new char[nextSegmentLength(current.length)];
    }

    private static int nextSegmentLength(int oldLength)
    {
        return Math.min(MAX_SEGMENT_LEN, Math.max(MIN_SEGMENT_LEN, oldLength + (oldLength >> 1)));
    }

    /**
     * Called whenever the accumulated length grows or a result is built, so that
     * subclasses can enforce a maximum length.
     *
     * @param length the length to validate
     */
    protected void validateStringLength(int length)
    {
    }

    @Override
    public String toString()
    {
        return contentsAsString();
    }
}
