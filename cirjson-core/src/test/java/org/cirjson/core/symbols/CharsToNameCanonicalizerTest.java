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

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

public class CharsToNameCanonicalizerTest
{
    private static String find(CharsToNameCanonicalizer symbols, String name)
    {
        // Surrounding chars check that only the given range is used.
        char[] chars = ("<" + name + ">").toCharArray();
        return symbols.findSymbol(chars, 1, name.length(), symbols.calcHash(chars, 1, name.length()));
    }

    @Test
    public void testSameNameSameInstance()
    {
        CharsToNameCanonicalizer root = CharsToNameCanonicalizer.createRoot(7, false);
        CharsToNameCanonicalizer child = root.makeChild();
        String first = find(child, "name");
        assertThat(first, is("name"));
        assertThat(find(child, "name"), sameInstance(first));
        assertThat(child.size(), is(1));
        assertThat(child.maybeDirty(), is(true));
        assertThat(find(child, ""), is(""));
        assertThat(child.size(), is(1));
    }

    @Test
    public void testInterning()
    {
        CharsToNameCanonicalizer interning = CharsToNameCanonicalizer.createRoot(1, true).makeChild();
        assertThat(find(interning, "value"), sameInstance("value"));

        CharsToNameCanonicalizer plain = CharsToNameCanonicalizer.createRoot(1, false).makeChild();
        assertThat(find(plain, "value"), not(sameInstance("value")));
    }

    @Test
    public void testHashOfStringMatchesHashOfChars()
    {
        CharsToNameCanonicalizer root = CharsToNameCanonicalizer.createRoot(12345, true);
        assertThat(root.hashSeed(), is(12345));
        char[] chars = "__cirJsonId__".toCharArray();
        assertThat(root.calcHash("__cirJsonId__"), is(root.calcHash(chars, 0, chars.length)));
    }

    @Test
    public void testReleaseMergesIntoRoot()
    {
        CharsToNameCanonicalizer root = CharsToNameCanonicalizer.createRoot(3, true);
        CharsToNameCanonicalizer stale = root.makeChild();
        CharsToNameCanonicalizer child = root.makeChild();
        find(child, "a");
        find(child, "b");
        find(child, "c");
        assertThat(root.size(), is(0));
        child.release();
        assertThat(root.size(), is(3));
        assertThat(child.maybeDirty(), is(false));

        // A child that learned fewer names does not replace the root's table.
        find(stale, "z");
        stale.release();
        assertThat(root.size(), is(3));

        CharsToNameCanonicalizer next = root.makeChild();
        assertThat(next.size(), is(3));
        find(next, "b");
        assertThat(next.maybeDirty(), is(false));
        assertThat(next.size(), is(3));
    }

    @Test
    public void testCleanChildDoesNotMerge()
    {
        CharsToNameCanonicalizer root = CharsToNameCanonicalizer.createRoot(3, true);
        CharsToNameCanonicalizer child = root.makeChild();
        child.release();
        assertThat(root.size(), is(0));
        assertThat(root.bucketCount(), is(64));
    }

    @Test
    public void testGrowth()
    {
        CharsToNameCanonicalizer root = CharsToNameCanonicalizer.createRoot(11, true);
        CharsToNameCanonicalizer child = root.makeChild();
        List<String> names = new ArrayList<>();
        for (int i = 0; i < 500; ++i)
        {
            names.add(find(child, "property" + i));
        }
        assertThat(child.size(), is(500));
        assertThat(child.bucketCount(), greaterThan(500));
        assertThat(child.maxCollisionLength(), greaterThan(0));
        for (int i = 0; i < 500; ++i)
        {
            assertThat(find(child, "property" + i), sameInstance(names.get(i)));
        }
        assertThat(child.size(), is(500));
        assertThat(child.collisionCount() < 500, is(true));

        child.release();
        assertThat(root.size(), is(500));
        assertThat(root.bucketCount(), is(child.bucketCount()));
    }

    @Test
    public void testTooManyNamesAreNotKept()
    {
        CharsToNameCanonicalizer root = CharsToNameCanonicalizer.createRoot(5, true);
        CharsToNameCanonicalizer child = root.makeChild();
        for (int i = 0; i <= CharsToNameCanonicalizer.MAX_ENTRIES_FOR_REUSE; ++i)
        {
            find(child, "n" + i);
        }
        child.release();
        assertThat(root.size(), is(0));
        assertThat(root.bucketCount(), is(CharsToNameCanonicalizer.DEFAULT_T_SIZE));
    }
}
