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
 * The tokens returned by {@link CirJsonParser#nextToken()}.
 */
public enum CirJsonToken
{
    /**
     * Returned by non-blocking parsers when not enough input is available to complete
     * the next token. Never returned by blocking parsers.
     */
    NOT_AVAILABLE(null, CirJsonTokenId.ID_NOT_AVAILABLE),

    START_OBJECT("{", CirJsonTokenId.ID_START_OBJECT),

    END_OBJECT("}", CirJsonTokenId.ID_END_OBJECT),

    START_ARRAY("[", CirJsonTokenId.ID_START_ARRAY),

    END_ARRAY("]", CirJsonTokenId.ID_END_ARRAY),

    /**
     * The identity property name, which must be the first property of every object.
     */
    CIRJSON_ID_PROPERTY_NAME("__cirJsonId__", CirJsonTokenId.ID_CIRJSON_ID_PROPERTY_NAME),

    PROPERTY_NAME(null, CirJsonTokenId.ID_PROPERTY_NAME),

    VALUE_EMBEDDED_OBJECT(null, CirJsonTokenId.ID_EMBEDDED_OBJECT),

    VALUE_STRING(null, CirJsonTokenId.ID_STRING),

    VALUE_NUMBER_INT(null, CirJsonTokenId.ID_NUMBER_INT),

    VALUE_NUMBER_FLOAT(null, CirJsonTokenId.ID_NUMBER_FLOAT),

    VALUE_TRUE("true", CirJsonTokenId.ID_TRUE),

    VALUE_FALSE("false", CirJsonTokenId.ID_FALSE),

    VALUE_NULL("null", CirJsonTokenId.ID_NULL);

    /**
     * The name of the identity property.
     */
    public static final String CIRJSON_ID_NAME = "__cirJsonId__";

    private final String _token;
    private final char[] _chars;
    private final byte[] _bytes;
    private final int _id;

    CirJsonToken(String token, int id)
    {
        _token = token;
        _id = id;
        if (token == null)
        {
            _chars = null;
            _bytes = null;
        }
        else
        {
            _chars = token.toCharArray();
            _bytes = new byte[_chars.length];
            for (int i = 0; i < _chars.length; ++i)
            {
                _bytes[i] = (byte)_chars[i];
            }
        }
    }

    public int id()
    {
        return _id;
    }

    /**
     * @return the fixed textual form of the token, or null if its text varies
     */
    public String asString()
    {
        return _token;
    }

    public char[] asCharArray()
    {
        return _chars;
    }

    public byte[] asByteArray()
    {
        return _bytes;
    }

    public boolean isNumeric()
    {
        return _id == CirJsonTokenId.ID_NUMBER_INT || _id == CirJsonTokenId.ID_NUMBER_FLOAT;
    }

    public boolean isStructStart()
    {
        return _id == CirJsonTokenId.ID_START_OBJECT || _id == CirJsonTokenId.ID_START_ARRAY;
    }

    public boolean isStructEnd()
    {
        return _id == CirJsonTokenId.ID_END_OBJECT || _id == CirJsonTokenId.ID_END_ARRAY;
    }

    public boolean isPropertyName()
    {
        return _id == CirJsonTokenId.ID_CIRJSON_ID_PROPERTY_NAME || _id == CirJsonTokenId.ID_PROPERTY_NAME;
    }

    /**
     * @return whether this is a value token other than the start or end of a container
     */
    public boolean isScalarValue()
    {
        return _id >= CirJsonTokenId.ID_STRING;
    }

    public boolean isBoolean()
    {
        return _id == CirJsonTokenId.ID_TRUE || _id == CirJsonTokenId.ID_FALSE;
    }

    /**
     * @param token the token, or null for the end of input
     * @return a description of the kind of value the token belongs to, for error messages
     */
    public static String valueDescFor(CirJsonToken token)
    {
        if (token == null)
            return "<end of input>";
        switch (token)
        {
            case START_OBJECT:
            case END_OBJECT:
            case CIRJSON_ID_PROPERTY_NAME:
            case PROPERTY_NAME:
                return "Object value";
            case START_ARRAY:
            case END_ARRAY:
                return "Array value";
            case VALUE_FALSE:
            case VALUE_TRUE:
                return "Boolean value";
            case VALUE_EMBEDDED_OBJECT:
                return "Embedded Object value";
            case VALUE_NUMBER_FLOAT:
                return "Floating-point value";
            case VALUE_NUMBER_INT:
                return "Int value";
            case VALUE_STRING:
                return "String value";
            case VALUE_NULL:
                return "Null value";
            default:
                return "[Unavailable value]";
        }
    }
}
