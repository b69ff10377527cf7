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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.node.ArrayNode;

import com.linkedin.minicube.utils.JsonUtils;

/**
 * Describes the layout of the tuples in a record store or a result table: an ordered
 * list of uniquely named, typed columns.
 *
 * @author Maneesh Varshney
 *
 */
public class BlockSchema
{
    private final List<ColumnType> columns;
    private final Map<String, Integer> indexMap = new HashMap<String, Integer>();

    public BlockSchema(ColumnType[] columnTypes)
    {
        if (columnTypes == null)
            throw new IllegalArgumentException("input argument is null");

        columns = Collections.unmodifiableList(new ArrayList<ColumnType>(Arrays.asList(columnTypes)));
        indexColumns();
    }

    /**
     * Reads a json array of {"name": ..., "type": ...} objects.
     */
    public BlockSchema(JsonNode json)
    {
        if (json == null || !json.isArray())
            throw new IllegalArgumentException("Expected an array of columns. Found: " + json);

        List<ColumnType> list = new ArrayList<ColumnType>();
        for (JsonNode column : json)
            list.add(new ColumnType(column));

        columns = Collections.unmodifiableList(list);
        indexColumns();
    }

    /**
     * Parses a schema of the form "INT quality, DOUBLE fixed acidity". The first token of
     * each comma separated definition is the type; the remainder (which may contain
     * spaces) is the column name.
     */
    public BlockSchema(String str)
    {
        if (str == null)
            throw new IllegalArgumentException("input argument is null");

        List<ColumnType> list = new ArrayList<ColumnType>();
        for (String definition : str.split(","))
            list.add(parseColumn(definition.trim()));

        columns = Collections.unmodifiableList(list);
        indexColumns();
    }

    private static ColumnType parseColumn(String definition)
    {
        String[] typeAndName = definition.split("\\s+", 2);
        if (typeAndName.length != 2)
            throw new IllegalArgumentException("Malformed column definition [" + definition
                    + "]");

        return new ColumnType(typeAndName[1].trim(),
                              DataType.valueOf(typeAndName[0].toUpperCase()));
    }

    private void indexColumns()
    {
        for (int i = 0; i < columns.size(); i++)
        {
            String name = columns.get(i).getName();
            if (indexMap.put(name, i) != null)
                throw new IllegalArgumentException("Column [" + name
                        + "] is defined more than once");
        }
    }

    public int getNumColumns()
    {
        return columns.size();
    }

    public String getName(int index)
    {
        return columns.get(index).getName();
    }

    public DataType getType(int index)
    {
        return columns.get(index).getType();
    }

    public DataType getType(String columnName)
    {
        return getType(getIndex(columnName));
    }

    public ColumnType getColumnType(int index)
    {
        return columns.get(index);
    }

    public boolean hasIndex(String columnName)
    {
        return indexMap.containsKey(columnName);
    }

    /**
     * @throws IllegalArgumentException
     *             if the schema has no column of that name
     */
    public int getIndex(String columnName)
    {
        Integer index = indexMap.get(columnName);
        if (index == null)
            throw new IllegalArgumentException("Column [" + columnName
                    + "] is not part of schema : " + this);

        return index;
    }

    public String[] getColumnNames()
    {
        String[] names = new String[columns.size()];
        for (int i = 0; i < names.length; i++)
            names[i] = getName(i);
        return names;
    }

    /**
     * Projects the schema on the specified columns, in the order given.
     */
    public BlockSchema getSubset(String[] subset)
    {
        ColumnType[] projected = new ColumnType[subset.length];
        for (int i = 0; i < subset.length; i++)
            projected[i] = columns.get(getIndex(subset[i]));

        return new BlockSchema(projected);
    }

    /**
     * Returns a schema with the columns of this schema followed by those of the other.
     */
    public BlockSchema append(BlockSchema other)
    {
        List<ColumnType> all = new ArrayList<ColumnType>(columns);
        all.addAll(other.columns);
        return new BlockSchema(all.toArray(new ColumnType[all.size()]));
    }

    public JsonNode toJson()
    {
        ArrayNode node = JsonUtils.createArrayNode();
        for (ColumnType column : columns)
            node.add(column.toJson());
        return node;
    }

    @Override
    public int hashCode()
    {
        return columns.hashCode();
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (!(obj instanceof BlockSchema))
            return false;
        return columns.equals(((BlockSchema) obj).columns);
    }

    @Override
    public String toString()
    {
        return columns.toString();
    }
}
