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


package com.linkedin.minicube.block;

import java.util.Comparator;

import org.apache.pig.data.Tuple;

import com.linkedin.minicube.utils.TupleUtils;

/**
 * Orders tuples on the specified columns, in the order the columns are given. Each
 * column is compared in the natural order of its values (see
 * {@link #compareObjects(Object, Object)}).
 *
 * @author Maneesh Varshney
 *
 */
public class TupleComparator implements Comparator<Tuple>
{
    private final int[] keyIndex;

    public TupleComparator(BlockSchema schema, String[] columns)
    {
        keyIndex = new int[columns.length];
        for (int i = 0; i < columns.length; i++)
            keyIndex[i] = schema.getIndex(columns[i]);
    }

    /**
     * Natural ordering of two field values. Nulls sort first; numbers of different boxed
     * types are compared numerically, as longs when both are integral.
     */
    @SuppressWarnings({ "rawtypes", "unchecked" })
    public static int compareObjects(Object o1, Object o2)
    {
        if (o1 == null || o2 == null)
            return (o1 == null ? 0 : 1) - (o2 == null ? 0 : 1);

        if (o1.getClass() == o2.getClass() || !(o1 instanceof Number) || !(o2 instanceof Number))
            return ((Comparable) o1).compareTo(o2);

        Number n1 = (Number) o1;
        Number n2 = (Number) o2;
        if (DataType.getDataType(n1).isIntOrLong() && DataType.getDataType(n2).isIntOrLong())
            return Long.compare(n1.longValue(), n2.longValue());

        return Double.compare(n1.doubleValue(), n2.doubleValue());
    }

    @Override
    public int compare(Tuple tuple1, Tuple tuple2)
    {
        for (int index : keyIndex)
        {
            int cmp = compareObjects(TupleUtils.get(tuple1, index), TupleUtils.get(tuple2, index));
            if (cmp != 0)
                return cmp;
        }

        return 0;
    }
}
