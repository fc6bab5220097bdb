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

import java.util.Objects;

import org.cirjson.core.cirjson.CirJsonReadFeature;
import org.cirjson.core.cirjson.CirJsonWriteFeature;
import org.cirjson.util.BufferRecycler;
import org.cirjson.util.CirJsonRecyclerPools;
import org.cirjson.util.RecyclerPool;

/**
 * Configures and builds {@link CirJsonFactory} instances.
 */
public class CirJsonFactoryBuilder
{
    private int _streamReadFeatures;
    private int _streamWriteFeatures;
    private int _formatReadFeatures;
    private int _formatWriteFeatures;
    private StreamReadConstraints _streamReadConstraints;
    private StreamWriteConstraints _streamWriteConstraints;
    private RecyclerPool<BufferRecycler> _recyclerPool;
    private String _rootValueSeparator;

    public CirJsonFactoryBuilder()
    {
        _streamReadFeatures = CirJacksonFeature.collectDefaults(StreamReadFeature.class);
        _streamWriteFeatures = CirJacksonFeature.collectDefaults(StreamWriteFeature.class);
        _formatReadFeatures = CirJacksonFeature.collectDefaults(CirJsonReadFeature.class);
        _formatWriteFeatures = CirJacksonFeature.collectDefaults(CirJsonWriteFeature.class);
        _streamReadConstraints = StreamReadConstraints.defaults();
        _streamWriteConstraints = StreamWriteConstraints.defaults();
        _recyclerPool = CirJsonRecyclerPools.defaultPool();
        _rootValueSeparator = CirJsonFactory.DEFAULT_ROOT_VALUE_SEPARATOR;
    }

    public CirJsonFactoryBuilder(CirJsonFactory factory)
    {
        _streamReadFeatures = factory.getStreamReadFeatures();
        _streamWriteFeatures = factory.getStreamWriteFeatures();
        _formatReadFeatures = factory.getFormatReadFeatures();
        _formatWriteFeatures = factory.getFormatWriteFeatures();
        _streamReadConstraints = factory.streamReadConstraints();
        _streamWriteConstraints = factory.streamWriteConstraints();
        _recyclerPool = factory.getRecyclerPool();
        _rootValueSeparator = factory.getRootValueSeparator();
    }

    public CirJsonFactoryBuilder enable(StreamReadFeature feature)
    {
        _streamReadFeatures |= feature.getMask();
        return this;
    }

    public CirJsonFactoryBuilder disable(StreamReadFeature feature)
    {
        _streamReadFeatures &= ~feature.getMask();
        return this;
    }

    public CirJsonFactoryBuilder configure(StreamReadFeature feature, boolean state)
    {
        return state ? enable(feature) : disable(feature);
    }

    public CirJsonFactoryBuilder enable(StreamWriteFeature feature)
    {
        _streamWriteFeatures |= feature.getMask();
        return this;
    }

    public CirJsonFactoryBuilder disable(StreamWriteFeature feature)
    {
        _streamWriteFeatures &= ~feature.getMask();
        return this;
    }

    public CirJsonFactoryBuilder configure(StreamWriteFeature feature, boolean state)
    {
        return state ? enable(feature) : disable(feature);
    }

    public CirJsonFactoryBuilder enable(CirJsonReadFeature feature)
    {
        _formatReadFeatures |= feature.getMask();
        return this;
    }

    public CirJsonFactoryBuilder disable(CirJsonReadFeature feature)
    {
        _formatReadFeatures &= ~feature.getMask();
        return this;
    }

    public CirJsonFactoryBuilder configure(CirJsonReadFeature feature, boolean state)
    {
        return state ? enable(feature) : disable(feature);
    }

    public CirJsonFactoryBuilder enable(CirJsonWriteFeature feature)
    {
        _formatWriteFeatures |= feature.getMask();
        return this;
    }

    public CirJsonFactoryBuilder disable(CirJsonWriteFeature feature)
    {
        _formatWriteFeatures &= ~feature.getMask();
        return this;
    }

    public CirJsonFactoryBuilder configure(CirJsonWriteFeature feature, boolean state)
    {
        return state ? enable(feature) : disable(feature);
    }

    public CirJsonFactoryBuilder streamReadConstraints(StreamReadConstraints constraints)
    {
        _streamReadConstraints = Objects.requireNonNull(constraints);
        return this;
    }

    public CirJsonFactoryBuilder streamWriteConstraints(StreamWriteConstraints constraints)
    {
        _streamWriteConstraints = Objects.requireNonNull(constraints);
        return this;
    }

    public CirJsonFactoryBuilder recyclerPool(RecyclerPool<BufferRecycler> pool)
    {
        _recyclerPool = Objects.requireNonNull(pool);
        return this;
    }

    /**
     * @param separator the text written between root level values, or null for none
     */
    public CirJsonFactoryBuilder rootValueSeparator(String separator)
    {
        _rootValueSeparator = separator;
        return this;
    }

    public int streamReadFeatures()
    {
        return _streamReadFeatures;
    }

    public int streamWriteFeatures()
    {
        return _streamWriteFeatures;
    }

    public int formatReadFeatures()
    {
        return _formatReadFeatures;
    }

    public int formatWriteFeatures()
    {
        return _formatWriteFeatures;
    }

    public StreamReadConstraints streamReadConstraints()
    {
        return _streamReadConstraints;
    }

    public StreamWriteConstraints streamWriteConstraints()
    {
        return _streamWriteConstraints;
    }

    public RecyclerPool<BufferRecycler> recyclerPool()
    {
        return _recyclerPool;
    }

    public String rootValueSeparator()
    {
        return _rootValueSeparator;
    }

    public CirJsonFactory build()
    {
        return new CirJsonFactory(this);
    }
}
