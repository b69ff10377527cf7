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

package com.linkedin.minicube.operator.aggregate;

import com.linkedin.minicube.cube.CubeException;
import com.linkedin.minicube.cube.CubeExceptionType;

/**
 * Built-in aggregations of a measure.
 *
 * @see AggregationFunctions
 */
public enum AggregationType
{
    AVG, SUM, MIN, MAX;

    /**
     * Parses an aggregation name such as "avg" or "SUM".
     *
     * @throws CubeException
     *             INVALID_CONFIG if the name is not a known aggregation
     */
    public static AggregationType fromName(String name) throws CubeException
    {
        if (name != null)
        {
            for (AggregationType type : values())
            {
                if (type.name().equalsIgnoreCase(name.trim()))
                    return type;
            }
        }

        throw new CubeException(CubeExceptionType.INVALID_CONFIG, "Unknown aggregation ["
                + name + "]. Expected one of avg, sum, min, max");
    }
}
