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

import java.util.Arrays;

import org.apache.pig.data.Tuple;

import com.linkedin.minicube.utils.TupleUtils;

/**
 * The values of the grouping dimensions of a record, in grouping order. Two records
 * belong to the same group iff their keys are equal.
 *
 * @author Maneesh Varshney
 *
 * @author Krishna Puttaswamy
 *
 */
public class DimensionKey
{
    private final Object[] values;

    public DimensionKey(Object... values)
    {
        this.values = values.clone();
    }

    /**
     * Extracts the key of a record.
     *
     * @param record
     *            the record tuple
     * @param indexes
     *            positions of the grouping dimensions in the record
     */
    public static DimensionKey of(Tuple record, int[] indexes)
    {
        Object[] values = new Object[indexes.length];
        for (int i = 0; i < indexes.length; i++)
            values[i] = TupleUtils.get(record, indexes[i]);

        return new DimensionKey(values);
    }

    public int size()
    {
        return values.length;
    }

    public Object get(int index)
    {
        return values[index];
    }

    public Object[] getValues()
    {
        return values.clone();
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(values);
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        DimensionKey other = (DimensionKey) obj;
        return Arrays.equals(values, other.values);
    }

    @Override
    public String toString()
    {
        StringBuilder b = new StringBuilder();

        for (int i = 0; i < values.length; i++)
        {
            b.append(values[i]);
            if (i != values.length - 1)
                b.append(",");
        }

        return b.toString();
    }
}
