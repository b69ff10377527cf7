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
import com.linkedin.minicube.utils.TupleUtils;

public abstract class AbstractAggregationFunction implements AggregationFunction
{
    protected String inputColumn;
    protected int inputColumnIndex = -1;

    protected double doubleAggVal;
    protected long count;

    @Override
    public void setup(BlockSchema inputSchema, String inputColumn)
    {
        if (!inputSchema.getType(inputColumn).isNumerical())
            throw new IllegalArgumentException("Expected type for " + getType() + "("
                    + inputColumn + "): int, long, float or double. Found: "
                    + inputSchema.getType(inputColumn));

        this.inputColumn = inputColumn;
        this.inputColumnIndex = inputSchema.getIndex(inputColumn);

        resetState();
    }

    /**
     * NOTE: This derived method is made final to protect the <code>count</code>. To use
     * this class effectively, override <code>resetAggregateValues</code> method to clean
     * internal values.
     */
    @Override
    final public void resetState()
    {
        count = 0;
        resetAggregateValues();
    }

    /**
     * All derived classes need to override this method to clear internal aggregation
     * values.
     */
    public abstract void resetAggregateValues();

    /**
     * Folds one non-null value into the aggregate.
     */
    protected abstract void accumulate(double value);

    @Override
    public void aggregate(Tuple input)
    {
        if (inputColumnIndex < 0)
            throw new IllegalStateException("Aggregation " + getType() + " is not set up");

        Object obj = TupleUtils.get(input, inputColumnIndex);
        if (obj == null)
            return;

        aggregate(((Number) obj).doubleValue());
    }

    @Override
    public void aggregate(double value)
    {
        count++;
        accumulate(value);
    }

    @Override
    public long getCount()
    {
        return count;
    }

    @Override
    public double output()
    {
        if (count == 0)
            throw new EmptyGroupException(getType() + " of "
                    + (inputColumn == null ? "values" : inputColumn)
                    + " requested for an empty group");

        return doubleAggVal;
    }
}
