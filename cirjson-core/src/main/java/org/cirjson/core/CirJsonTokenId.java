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
 * Integer ids of the {@link CirJsonToken}s, for use in switch statements.
 */
public interface CirJsonTokenId
{
    int ID_NO_TOKEN = 0;
    int ID_NOT_AVAILABLE = -1;
    int ID_START_OBJECT = 1;
    int ID_END_OBJECT = 2;
    int ID_START_ARRAY = 3;
    int ID_END_ARRAY = 4;
    int ID_CIRJSON_ID_PROPERTY_NAME = 5;
    int ID_PROPERTY_NAME = 6;
    int ID_STRING = 7;
    int ID_NUMBER_INT = 8;
    int ID_NUMBER_FLOAT = 9;
    int ID_TRUE = 10;
    int ID_FALSE = 11;
    int ID_NULL = 12;
    int ID_EMBEDDED_OBJECT = 13;
}
