/* (c) 2014 LinkedIn Corp. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use
 * this file except in compliance with the License. You may obtain a copy of the
 * License at  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed
 * under the License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR
 * CONDITIONS OF ANY KIND, either express or implied.
 */

package com.linkedin.minicube.cube;

public enum CubeExceptionType
{
    INVALID_SCHEMA,
    MISSING_COLUMN,
    NOT_NUMERIC,
    UNKNOWN_DIMENSION,
    UNKNOWN_MEASURE,
    DUPLICATE_DIMENSION,
    INVALID_CONFIG;

    /**
     * Returns true for the failures that abort building a record store.
     */
    public boolean isSchemaError()
    {
        return this == INVALID_SCHEMA || this == MISSING_COLUMN || this == NOT_NUMERIC;
    }
}
