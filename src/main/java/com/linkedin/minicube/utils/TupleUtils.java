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

package com.linkedin.minicube.utils;

import org.apache.pig.backend.executionengine.ExecException;
import org.apache.pig.data.Tuple;
import org.apache.pig.data.TupleFactory;

/**
 * Various Tuple utility methods.
 * <p>
 * The tuples handled by this project are always addressed through their schema, so an
 * out of range index is a programming error; the checked ExecException thrown by Pig is
 * rethrown unchecked.
 *
 * @author Maneesh Varshney
 *
 */
public class TupleUtils
{
    public static Object get(Tuple tuple, int index)
    {
        try
        {
            return tuple.get(index);
        }
        catch (ExecException e)
        {
            throw new RuntimeException(e);
        }
    }

    public static void set(Tuple tuple, int index, Object value)
    {
        try
        {
            tuple.set(index, value);
        }
        catch (ExecException e)
        {
            throw new RuntimeException(e);
        }
    }

    public static double getDouble(Tuple tuple, int index)
    {
        return ((Number) get(tuple, index)).doubleValue();
    }

    public static Tuple newTuple(Object... values)
    {
        Tuple tuple = TupleFactory.getInstance().newTuple(values.length);
        for (int i = 0; i < values.length; i++)
            set(tuple, i, values[i]);

        return tuple;
    }

    private TupleUtils()
    {

    }
}
