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

/**
 * The standard {@link Base64Variant}s.
 */
public final class Base64Variants
{
    static final String STD_BASE64_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

    /**
     * The "MIME" variant of RFC 2045: standard alphabet, padding, lines of 76 chars.
     */
    public static final Base64Variant MIME = new Base64Variant("MIME", STD_BASE64_ALPHABET, true, '=', 76);

    /**
     * As {@link #MIME}, without line feeds. This is the default variant.
     */
    public static final Base64Variant MIME_NO_LINEFEEDS = new Base64Variant(MIME, "MIME-NO-LINEFEEDS", Integer.MAX_VALUE);

    /**
     * As {@link #MIME}, with lines of 64 chars.
     */
    public static final Base64Variant PEM = new Base64Variant(MIME, "PEM", true, '=', 64);

    /**
     * The URL-safe variant: {@code -} and {@code _} instead of {@code +} and {@code /}, no padding,
     * no line feeds.
     */
    public static final Base64Variant MODIFIED_FOR_URL = new Base64Variant("MODIFIED-FOR-URL",
        STD_BASE64_ALPHABET.replace('+', '-').replace('/', '_'), false, Base64Variant.PADDING_CHAR_NONE, Integer.MAX_VALUE);

    private Base64Variants()
    {
    }

    public static Base64Variant getDefaultVariant()
    {
        return MIME_NO_LINEFEEDS;
    }

    /**
     * @param name the variant name, such as {@code MIME-NO-LINEFEEDS}
     * @return the standard variant with that name
     * @throws IllegalArgumentException if there is no such variant
     */
    public static Base64Variant valueOf(String name)
    {
        if (MIME.getName().equals(name))
            return MIME;
        if (MIME_NO_LINEFEEDS.getName().equals(name))
            return MIME_NO_LINEFEEDS;
        if (PEM.getName().equals(name))
            return PEM;
        if (MODIFIED_FOR_URL.getName().equals(name))
            return MODIFIED_FOR_URL;
        throw new IllegalArgumentException("No Base64Variant with name " + (name == null ? "<null>" : "'" + name + "'"));
    }
}
