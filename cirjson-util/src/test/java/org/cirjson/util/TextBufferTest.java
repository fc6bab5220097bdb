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

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TextBufferTest
{
    @Test
    public void testSharedContentIsNotCopied()
    {
        char[] input = "[\"abc\",1]".toCharArray();
        TextBuffer buffer = new TextBuffer(new BufferRecycler());
        buffer.resetWithShared(input, 2, 3);
        assertThat(buffer.size(), is(3));
        assertThat(buffer.getTextBuffer(), sameInstance(input));
        assertThat(buffer.getTextOffset(), is(2));
        assertThat(buffer.contentsAsString(), is("abc"));
    }

    @Test
    public void testAppendToShared()
    {
        char[] input = "xabc".toCharArray();
        TextBuffer buffer = new TextBuffer(new BufferRecycler());
        buffer.resetWithShared(input, 1, 3);
        buffer.append('d');
        buffer.append("efg", 1, 2);
        assertEquals("abcdfg", buffer.contentsAsString());
        assertThat(buffer.getTextOffset(), is(0));
        // The shared input is left alone.
        assertEquals("xabc", new String(input));
    }

    @Test
    public void testStringContent()
    {
        TextBuffer buffer = new TextBuffer(null);
        buffer.resetWithString("value");
        assertFalse(buffer.hasTextAsCharacters());
        assertThat(buffer.size(), is(5));
        assertArrayEquals("value".toCharArray(), buffer.contentsAsArray());
        buffer.append('!');
        assertEquals("value!", buffer.contentsAsString());
    }

    @Test
    public void testGrowsAcrossSegments()
    {
        TextBuffer buffer = new TextBuffer(new BufferRecycler());
        buffer.resetWithEmpty();
        StringBuilder expected = new StringBuilder();
        for (int i = 0; i < 20000; ++i)
        {
            char c = (char)('a' + (i % 26));
            buffer.append(c);
            expected.append(c);
        }
        String chunk = "0123456789".repeat(700);
        buffer.append(chunk, 0, chunk.length());
        expected.append(chunk);
        buffer.append(chunk.toCharArray(), 5, 100);
        expected.append(chunk, 5, 105);

        assertThat(buffer.size(), is(expected.length()));
        assertEquals(expected.toString(), buffer.contentsAsString());
        assertArrayEquals(expected.toString().toCharArray(), buffer.contentsAsArray());
        assertTrue(buffer.hasTextAsCharacters());
    }

    @Test
    public void testDirectSegmentFilling()
    {
        TextBuffer buffer = new TextBuffer(new BufferRecycler());
        char[] segment = buffer.emptyAndGetCurrentSegment();
        int length = segment.length;
        for (int i = 0; i < length; ++i)
        {
            segment[i] = 'x';
        }
        segment = buffer.finishCurrentSegment();
        segment[0] = 'y';
        segment[1] = 'z';
        String result = buffer.setCurrentAndReturn(2);
        assertThat(result.length(), is(length + 2));
        assertTrue(result.endsWith("xyz"));
        assertThat(buffer.size(), is(length + 2));
    }

    @Test
    public void testExpandKeepsContent()
    {
        TextBuffer buffer = new TextBuffer(null);
        char[] segment = buffer.emptyAndGetCurrentSegment();
        segment[0] = 'q';
        char[] expanded = buffer.expandCurrentSegment();
        assertTrue(expanded.length > segment.length);
        assertThat(expanded[0], is('q'));
        buffer.setCurrentLength(1);
        assertEquals("q", buffer.contentsAsString());
    }

    @Test
    public void testCopyAndEmpty()
    {
        TextBuffer buffer = new TextBuffer(new BufferRecycler());
        char[] input = "copied".toCharArray();
        buffer.resetWithCopy(input, 0, input.length);
        input[0] = 'X';
        assertEquals("copied", buffer.contentsAsString());
        buffer.resetWithEmpty();
        assertThat(buffer.size(), is(0));
        assertEquals("", buffer.contentsAsString());
    }

    @Test
    public void testReleaseReturnsSegmentToRecycler()
    {
        BufferRecycler recycler = new BufferRecycler();
        TextBuffer buffer = new TextBuffer(recycler);
        char[] segment = buffer.emptyAndGetCurrentSegment();
        buffer.releaseBuffers();
        assertThat(recycler.allocCharBuffer(BufferRecycler.CHAR_TEXT_BUFFER), sameInstance(segment));
    }
}
