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

public class MinAggregation extends AbstractAggregationFunction
{
    @Override
    public void resetAggregateValues()
    {
        doubleAggVal = Double.POSITIVE_INFINITY;
    }

    @Override
    protected void accumulate(double value)
    {
        doubleAggVal = Math.min(doubleAggVal, value);
    }

    @Override
    public AggregationType getType()
    {
        return AggregationType.MIN;
    }
}
