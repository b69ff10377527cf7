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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.map.ObjectMapper;
import org.codehaus.jackson.node.ArrayNode;
import org.codehaus.jackson.node.ObjectNode;

/**
 * Various utility methods for operating with Json objects.
 *
 * @author Maneesh Varshney
 *
 */
public class JsonUtils
{
    private static final ObjectMapper mapper = new ObjectMapper();

    public static ObjectMapper getMapper()
    {
        return mapper;
    }

    public static JsonNode get(JsonNode node, String property)
    {
        JsonNode val = node.get(property);
        if (val == null || val.isNull())
        {
            throw new IllegalArgumentException("Property " + property
                    + " is not defined in " + node);
        }
        return val;
    }

    public static String getText(JsonNode node, String property, String defaultValue)
    {
        if (!node.has(property) || node.get(property).isNull())
            return defaultValue;
        return get(node, property).getTextValue();
    }

    public static String getText(JsonNode node, String property)
    {
        JsonNode val = get(node, property);
        if (!val.isTextual())
            throw new IllegalArgumentException("Property " + property
                    + " is not a string in " + node);
        return val.getTextValue();
    }

    public static String[] asArray(JsonNode parent, String property)
    {
        if (!parent.has(property) || parent.get(property).isNull())
            return null;

        return asArray(get(parent, property));
    }

    public static String[] asArray(JsonNode node)
    {
        if (node == null)
            throw new IllegalArgumentException("Specified JsonNode is null");

        if (node.isArray())
        {
            int nelements = node.size();
            String[] array = new String[nelements];
            for (int i = 0; i < nelements; i++)
            {
                array[i] = node.get(i).getTextValue();
            }
            return array;
        }
        else
        {
            return new String[] { node.getTextValue() };
        }
    }

    public static double[] asDoubleArray(JsonNode node)
    {
        if (node == null || !node.isArray())
            throw new IllegalArgumentException("Expected an array of numbers. Found: "
                    + node);

        double[] array = new double[node.size()];
        for (int i = 0; i < array.length; i++)
        {
            if (!node.get(i).isNumber())
                throw new IllegalArgumentException("Expected a number. Found: "
                        + node.get(i));
            array[i] = node.get(i).getDoubleValue();
        }
        return array;
    }

    public static Object asObject(JsonNode node)
    {
        if (node.isTextual())
            return node.getTextValue();
        else if (node.isInt())
            return node.getIntValue();
        else if (node.isLong())
            return node.getLongValue();
        else if (node.isFloatingPointNumber())
            return node.getDoubleValue();
        else if (node.isBoolean())
            return node.getBooleanValue();

        return null;
    }

    /**
     * Creates a json node for a tuple field value; numbers keep their java type.
     */
    public static JsonNode valueNode(Object value)
    {
        ArrayNode holder = mapper.createArrayNode();
        if (value == null)
            holder.addNull();
        else if (value instanceof Integer)
            holder.add(((Integer) value).intValue());
        else if (value instanceof Long)
            holder.add(((Long) value).longValue());
        else if (value instanceof Float)
            holder.add(((Float) value).floatValue());
        else if (value instanceof Double)
            holder.add(((Double) value).doubleValue());
        else
            holder.add(value.toString());

        return holder.get(0);
    }

    public static ObjectNode createObjectNode(Object... keyvals)
    {
        ObjectNode node = mapper.createObjectNode();
        for (int i = 0; i < keyvals.length; i += 2)
        {
            String key = (String) keyvals[i];
            Object val = keyvals[i + 1];
            if (val instanceof JsonNode)
                node.put(key, (JsonNode) val);
            else
                node.put(key, valueNode(val));
        }

        return node;
    }

    public static ArrayNode createArrayNode(Object... items)
    {
        ArrayNode anode = mapper.createArrayNode();
        for (Object item : items)
        {
            if (item instanceof JsonNode)
                anode.add((JsonNode) item);
            else
                anode.add(valueNode(item));
        }
        return anode;
    }

    public static JsonNode readJson(File file) throws IOException
    {
        return mapper.readTree(file);
    }

    public static JsonNode readJson(InputStream in) throws IOException
    {
        try
        {
            return mapper.readTree(in);
        }
        finally
        {
            in.close();
        }
    }

    /**
     * Reads a json document bundled on the classpath.
     */
    public static JsonNode readResource(String resourceName) throws IOException
    {
        InputStream in = JsonUtils.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null)
            throw new IOException("Resource " + resourceName + " not found on classpath");

        return readJson(in);
    }

    /**
     * Parses json written with single quotes, which is convenient in tests.
     */
    public static JsonNode makeJson(String str)
    {
        try
        {
            return mapper.readTree(str.replace('\'', '"'));
        }
        catch (IOException e)
        {
            throw new IllegalArgumentException("Cannot parse json: " + str, e);
        }
    }

    private JsonUtils()
    {

    }
}
