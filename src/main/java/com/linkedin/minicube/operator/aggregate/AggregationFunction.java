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

import org.apache.pig.data.Tuple;

import com.linkedin.minicube.block.BlockSchema;
import com.linkedin.minicube.cube.EmptyGroupException;

/**
 * Specifies a function to aggregate a numeric column.
 *
 * The function is stateful: it is reset, fed with the values of one group, and then
 * asked for the output. Computation is carried out in full double precision; rounding
 * for display is left to the caller.
 *
 * @author Maneesh Varshney
 *
 */
public interface AggregationFunction
{
    /**
     * Configure the aggregation function.
     *
     * @param inputSchema
     *            the schema of the tuples that will be aggregated
     * @param inputColumn
     *            the name of the aggregated column
     */
    void setup(BlockSchema inputSchema, String inputColumn);

    /**
     * Resets the state of the aggregator.
     */
    void resetState();

    /**
     * Aggregate the input column of the specified tuple. Null values are ignored.
     *
     * @param input
     */
    void aggregate(Tuple input);

    /**
     * Aggregate a single value.
     *
     * @param value
     */
    void aggregate(double value);

    /**
     * Number of values aggregated since the last reset.
     */
    long getCount();

    /**
     * Returns the aggregate of the values seen since the last reset.
     *
     * @return the aggregated value
     * @throws EmptyGroupException
     *             if no value has been aggregated
     */
    double output();

    AggregationType getType();
}
