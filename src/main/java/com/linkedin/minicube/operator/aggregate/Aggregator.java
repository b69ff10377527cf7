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
import java.math.RoundingMode;
import java.util.List;

import com.linkedin.minicube.cube.EmptyGroupException;

/**
 * Summarizes a list of values with one of the built-in aggregations.
 * <p>
 * Results are full precision. {@link #round(double)} is applied when a value is written
 * into a result table, so chained computations never see rounded intermediates.
 */
public class Aggregator
{
    /** Decimal places of the aggregated values in result tables. */
    public static final int DISPLAY_PRECISION = 2;

    public static double aggregate(double[] values, AggregationType type)
    {
        if (values.length == 0)
            throw new EmptyGroupException(type + " requested for an empty group");

        AggregationFunction function = AggregationFunctions.get(type);
        function.resetState();
        for (double value : values)
            function.aggregate(value);

        return function.output();
    }

    public static double aggregate(List<? extends Number> values, AggregationType type)
    {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++)
            array[i] = values.get(i).doubleValue();

        return aggregate(array, type);
    }

    public static double round(double value)
    {
        return round(value, DISPLAY_PRECISION);
    }

    /**
     * Rounds half-even on the exact binary value of the double, so a value such as 2.675
     * (stored as 2.67499999...) rounds down to 2.67.
     */
    public static double round(double value, int places)
    {
        if (Double.isNaN(value) || Double.isInfinite(value))
            return value;

        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    private Aggregator()
    {

    }
}
