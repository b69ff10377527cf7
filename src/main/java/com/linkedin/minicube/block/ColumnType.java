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

import static com.linkedin.minicube.utils.JsonUtils.getText;

import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.map.ObjectMapper;
import org.codehaus.jackson.node.ObjectNode;

/**
 * Defines the schema of a column.
 *
 * The description includes the column name and data type.
 *
 * @author Maneesh Varshney
 *
 */
public class ColumnType
{
    private final String name;

    private final DataType type;

    public ColumnType(JsonNode json)
    {
        name = getText(json, "name");
        type = DataType.valueOf(getText(json, "type").toUpperCase());
    }

    public ColumnType(String name, DataType type)
    {
        if (name == null || type == null)
            throw new IllegalArgumentException("column name and type are required");

        this.name = name;
        this.type = type;
    }

    public String getName()
    {
        return name;
    }

    public DataType getType()
    {
        return type;
    }

    public JsonNode toJson()
    {
        ObjectNode node = new ObjectMapper().createObjectNode();
        node.put("name", name);
        node.put("type", type.toString());
        return node;
    }

    @Override
    public String toString()
    {
        return String.format("%s %s", type, name);
    }

    @Override
    public int hashCode()
    {
        return 31 * name.hashCode() + type.hashCode();
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
        ColumnType other = (ColumnType) obj;
        return name.equals(other.name) && type == other.type;
    }
}
