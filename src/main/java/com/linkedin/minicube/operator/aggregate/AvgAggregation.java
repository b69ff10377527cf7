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

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Arithmetic mean. The sum of the exact binary values is kept as a BigDecimal and
 * divided only when the output is requested, so the result is the double nearest to the
 * true mean.
 */
public class AvgAggregation extends AbstractAggregationFunction
{
    private BigDecimal sum = BigDecimal.ZERO;
    private boolean allFinite = true;

    @Override
    public void resetAggregateValues()
    {
        doubleAggVal = 0;
        sum = BigDecimal.ZERO;
        allFinite = true;
    }

    @Override
    protected void accumulate(double value)
    {
        doubleAggVal += value;
        if (Double.isNaN(value) || Double.isInfinite(value))
            allFinite = false;
        else
            sum = sum.add(new BigDecimal(value));
    }

    @Override
    public double output()
    {
        // NaN and infinities propagate as in double arithmetic
        double doubleSum = super.output();
        if (!allFinite)
            return doubleSum / count;

        return sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL128).doubleValue();
    }

    @Override
    public AggregationType getType()
    {
        return AggregationType.AVG;
    }
}
