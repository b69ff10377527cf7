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


package com.linkedin.minicube.operator;

import java.util.Iterator;

import org.codehaus.jackson.JsonNode;

import com.linkedin.minicube.block.DataType;
import com.linkedin.minicube.block.TupleComparator;
import com.linkedin.minicube.utils.JsonUtils;

/**
 * A predicate on the value of one dimension: either an exact match or an inclusive
 * range.
 * <p>
 * Numbers compare numerically regardless of their boxed type (so 5.0 matches the
 * integer 5); strings compare lexicographically. A number never matches a string.
 */
public abstract class DiceCondition
{
    public static DiceCondition exact(Object value)
    {
        return new ExactMatch(value);
    }

    public static DiceCondition range(Object low, Object high)
    {
        return new RangeMatch(low, high);
    }

    /**
     * Reads a condition from json: a two element array is an inclusive range, any other
     * value an exact match.
     */
    public static DiceCondition fromJson(JsonNode json)
    {
        if (json.isArray() && json.size() == 2)
        {
            Iterator<JsonNode> it = json.getElements();
            return range(JsonUtils.asObject(it.next()), JsonUtils.asObject(it.next()));
        }

        if (json.isContainerNode())
            throw new IllegalArgumentException("Condition must be a value or a [low, high] range. Found: "
                    + json);

        return exact(JsonUtils.asObject(json));
    }

    public abstract boolean matches(Object value);

    /**
     * Returns a condition whose operands are converted to the type of the dimension it
     * is applied on. Operands that cannot be converted are kept as they are (and will
     * not match).
     */
    public abstract DiceCondition bind(DataType type);

    public abstract JsonNode toJson();

    static Object convert(Object operand, DataType type)
    {
        if (operand == null)
            return null;

        // numbers are compared numerically, no narrowing needed
        if (type.isNumerical() && operand instanceof Number)
            return operand;

        try
        {
            return type.convert(operand);
        }
        catch (NumberFormatException e)
        {
            return operand;
        }
    }

    static boolean comparable(Object o1, Object o2)
    {
        if (o1 == null || o2 == null)
            return false;

        return (o1 instanceof Number && o2 instanceof Number)
                || (o1 instanceof String && o2 instanceof String);
    }

    public static final class ExactMatch extends DiceCondition
    {
        private final Object value;

        ExactMatch(Object value)
        {
            this.value = value;
        }

        public Object getValue()
        {
            return value;
        }

        @Override
        public boolean matches(Object recordValue)
        {
            return comparable(recordValue, value)
                    && TupleComparator.compareObjects(recordValue, value) == 0;
        }

        @Override
        public DiceCondition bind(DataType type)
        {
            return new ExactMatch(convert(value, type));
        }

        @Override
        public JsonNode toJson()
        {
            return JsonUtils.valueNode(value);
        }

        @Override
        public String toString()
        {
            return "= " + value;
        }
    }

    public static final class RangeMatch extends DiceCondition
    {
        private final Object low;
        private final Object high;

        RangeMatch(Object low, Object high)
        {
            this.low = low;
            this.high = high;
        }

        public Object getLow()
        {
            return low;
        }

        public Object getHigh()
        {
            return high;
        }

        @Override
        public boolean matches(Object recordValue)
        {
            return comparable(recordValue, low) && comparable(recordValue, high)
                    && TupleComparator.compareObjects(recordValue, low) >= 0
                    && TupleComparator.compareObjects(recordValue, high) <= 0;
        }

        @Override
        public DiceCondition bind(DataType type)
        {
            return new RangeMatch(convert(low, type), convert(high, type));
        }

        @Override
        public JsonNode toJson()
        {
            return JsonUtils.createArrayNode(low, high);
        }

        @Override
        public String toString()
        {
            return "in [" + low + ", " + high + "]";
        }
    }
}
