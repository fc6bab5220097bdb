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

/**
 * An on/off feature, represented as one bit of an int mask.
 */
public interface CirJacksonFeature
{
    boolean enabledByDefault();

    int getMask();

    default boolean enabledIn(int flags)
    {
        return (flags & getMask()) != 0;
    }

    /**
     * @param features the enum type of the features
     * @return the mask of the features enabled by default
     */
    static <F extends Enum<F> & CirJacksonFeature> int collectDefaults(Class<F> features)
    {
        int flags = 0;
        for (F feature : features.getEnumConstants())
        {
            if (feature.enabledByDefault())
                flags |= feature.getMask();
        }
        return flags;
    }
}
