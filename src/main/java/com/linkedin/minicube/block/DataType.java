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

/**
 * Data types of the fields stored in record tuples.
 *
 * @author Maneesh Varshney
 *
 */
public enum DataType
{
    INT,

    LONG,

    FLOAT,

    DOUBLE,

    STRING;

    public boolean isNumerical()
    {
        return this == INT || this == LONG || this == FLOAT || this == DOUBLE;
    }

    public boolean isIntOrLong()
    {
        return this == LONG || this == INT;
    }

    public boolean isReal()
    {
        return this == DOUBLE || this == FLOAT;
    }

    /**
     * Parses the text representation of a value of this type.
     * <p>
     * Integral types accept a real number and truncate it toward zero (e.g. "5.5" is 5),
     * since delimited exports frequently write integer scores as reals.
     *
     * @param text
     *            the raw text, already trimmed
     * @return the parsed value
     * @throws NumberFormatException
     *             if a numerical type cannot be parsed from the text
     */
    public Object parse(String text)
    {
        switch (this)
        {
        case INT:
            return (int) parseIntegral(text, Integer.MIN_VALUE, Integer.MAX_VALUE);
        case LONG:
            return parseIntegral(text, Long.MIN_VALUE, Long.MAX_VALUE);
        case FLOAT:
            return Float.parseFloat(text);
        case DOUBLE:
            return Double.parseDouble(text);
        default:
            return text;
        }
    }

    /**
     * Converts a value obtained elsewhere (e.g. a json constant) into the java type used
     * for this data type. Strings are parsed; numbers are narrowed or widened.
     *
     * @param value
     * @return the converted value
     * @throws NumberFormatException
     *             if the value cannot be represented in this type
     */
    public Object convert(Object value)
    {
        if (value == null)
            return null;

        if (this == STRING)
            return value.toString();

        if (value instanceof String)
        {
            String text = ((String) value).trim();
            if (!isIntOrLong())
                return parse(text);

            // a fractional operand is converted like a json number, never truncated
            try
            {
                value = Long.parseLong(text);
            }
            catch (NumberFormatException e)
            {
                value = Double.parseDouble(text);
            }
        }

        Number number = (Number) value;
        switch (this)
        {
        case INT:
        case LONG:
        {
            double d = number.doubleValue();
            if (d != Math.rint(d))
                throw new NumberFormatException("Value " + value + " is not integral");
            return this == INT ? (Object) number.intValue() : (Object) number.longValue();
        }
        case FLOAT:
            return number.floatValue();
        default:
            return number.doubleValue();
        }
    }

    private static long parseIntegral(String text, long min, long max)
    {
        long value;
        try
        {
            value = Long.parseLong(text);
        }
        catch (NumberFormatException e)
        {
            double d = Double.parseDouble(text);
            if (Double.isNaN(d) || Double.isInfinite(d))
                throw new NumberFormatException("Value [" + text + "] is not a finite number");
            value = (long) d;
        }

        if (value < min || value > max)
            throw new NumberFormatException("Value [" + text + "] is out of range");

        return value;
    }

    public static DataType getDataType(Object obj)
    {
        if (obj instanceof Integer)
            return DataType.INT;
        if (obj instanceof Long)
            return DataType.LONG;
        if (obj instanceof Float)
            return DataType.FLOAT;
        if (obj instanceof Double)
            return DataType.DOUBLE;
        if (obj instanceof String)
            return DataType.STRING;

        throw new IllegalArgumentException("Unsupported field value " + obj);
    }
}
