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

import java.io.StringWriter;

import org.cirjson.core.cirjson.WriterBasedCirJsonGenerator;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

public class CirJsonTokenTest
{
    @Test
    public void testTokenProperties()
    {
        assertThat(CirJsonToken.START_OBJECT.asString(), is("{"));
        assertThat(new String(CirJsonToken.VALUE_TRUE.asCharArray()), is("true"));
        assertThat(CirJsonToken.VALUE_NULL.asByteArray(), is(new byte[]{'n', 'u', 'l', 'l'}));
        assertThat(CirJsonToken.CIRJSON_ID_PROPERTY_NAME.asString(), is(CirJsonToken.CIRJSON_ID_NAME));
        assertThat(CirJsonToken.VALUE_STRING.asString(), nullValue());
        assertThat(CirJsonToken.NOT_AVAILABLE.id(), is(CirJsonTokenId.ID_NOT_AVAILABLE));

        assertThat(CirJsonToken.VALUE_NUMBER_INT.isNumeric(), is(true));
        assertThat(CirJsonToken.VALUE_NUMBER_FLOAT.isNumeric(), is(true));
        assertThat(CirJsonToken.VALUE_STRING.isNumeric(), is(false));
        assertThat(CirJsonToken.VALUE_FALSE.isBoolean(), is(true));
        assertThat(CirJsonToken.VALUE_NULL.isBoolean(), is(false));
        assertThat(CirJsonToken.START_ARRAY.isStructStart(), is(true));
        assertThat(CirJsonToken.END_OBJECT.isStructEnd(), is(true));
        assertThat(CirJsonToken.VALUE_NULL.isScalarValue(), is(true));
        assertThat(CirJsonToken.PROPERTY_NAME.isScalarValue(), is(false));
    }

    @Test
    public void testValueDescriptions()
    {
        assertThat(CirJsonToken.valueDescFor(null), is("<end of input>"));
        assertThat(CirJsonToken.valueDescFor(CirJsonToken.PROPERTY_NAME), is("Object value"));
        assertThat(CirJsonToken.valueDescFor(CirJsonToken.END_ARRAY), is("Array value"));
        assertThat(CirJsonToken.valueDescFor(CirJsonToken.VALUE_TRUE), is("Boolean value"));
        assertThat(CirJsonToken.valueDescFor(CirJsonToken.VALUE_NUMBER_FLOAT), is("Floating-point value"));
        assertThat(CirJsonToken.valueDescFor(CirJsonToken.VALUE_NUMBER_INT), is("Int value"));
        assertThat(CirJsonToken.valueDescFor(CirJsonToken.NOT_AVAILABLE), is("[Unavailable value]"));
    }

    @Test
    public void testParserTokenQueries()
    {
        CirJsonFactory factory = CirJsonFactory.builder().enable(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION).build();
        try (CirJsonParser parser = factory.createParser("[\"0\",\"x\",7]"))
        {
            assertThat(parser.getIdName(), is("__cirJsonId__"));
            assertThat(parser.hasCurrentToken(), is(false));
            assertThat(parser.streamReadContext().hasPathSegment(), is(false));

            assertThat(parser.nextToken(), is(CirJsonToken.START_ARRAY));
            assertThat(parser.isExpectedStartArrayToken(), is(true));
            assertThat(parser.isExpectedStartObjectToken(), is(false));
            assertThat(parser.hasTokenId(CirJsonTokenId.ID_START_ARRAY), is(true));

            assertThat(parser.nextTextValue(), is("0"));
            assertThat(parser.streamReadContext().hasPathSegment(), is(false));
            assertThat(parser.nextTextValue(), is("x"));
            assertThat(parser.streamReadContext().hasPathSegment(), is(true));
            assertThat(parser.nextTextValue(), nullValue());
            assertThat(parser.hasToken(CirJsonToken.VALUE_NUMBER_INT), is(true));
            assertThat(parser.isExpectedNumberIntToken(), is(true));

            parser.finishToken();
            parser.clearCurrentToken();
            assertThat(parser.currentToken(), nullValue());
            assertThat(parser.getLastClearedToken(), is(CirJsonToken.VALUE_NUMBER_INT));
            assertThat(parser.currentLocation().getSourceDescription(), is("(String)\"[\"0\",\"x\",7]\""));
        }
    }

    @Test
    public void testGeneratorOutputTarget()
    {
        StringWriter out = new StringWriter();
        try (CirJsonGenerator generator = new CirJsonFactory().createGenerator(out))
        {
            assertThat(((WriterBasedCirJsonGenerator)generator).getOutputTarget(), sameInstance(out));
        }
    }
}
