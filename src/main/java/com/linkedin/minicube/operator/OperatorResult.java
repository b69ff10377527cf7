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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.node.ArrayNode;
import org.codehaus.jackson.node.ObjectNode;

import com.linkedin.minicube.utils.JsonUtils;

/**
 * The output of one cube operator call: a message describing the call and the tables
 * it produced. A result without data (a slice or dice that matched no record) carries
 * no tables.
 */
public class OperatorResult
{
    private final OperatorType operatorType;
    private final String message;
    private final boolean hasData;
    private final List<ResultTable> tables;

    public OperatorResult(OperatorType operatorType, String message, List<ResultTable> tables)
    {
        this(operatorType, message, true, tables);
    }

    protected OperatorResult(OperatorType operatorType,
                             String message,
                             boolean hasData,
                             List<ResultTable> tables)
    {
        this.operatorType = operatorType;
        this.message = message;
        this.hasData = hasData;
        this.tables = Collections.unmodifiableList(new ArrayList<ResultTable>(tables));
    }

    public OperatorType getOperatorType()
    {
        return operatorType;
    }

    public String getMessage()
    {
        return message;
    }

    /**
     * Returns false for the "no data" outcome of a filter that matched nothing.
     */
    public boolean hasData()
    {
        return hasData;
    }

    public List<ResultTable> getTables()
    {
        return tables;
    }

    public JsonNode toJson()
    {
        ArrayNode tablesNode = JsonUtils.createArrayNode();
        for (ResultTable table : tables)
            tablesNode.add(table.toJson());

        ObjectNode node =
                JsonUtils.createObjectNode("operator",
                                           operatorType.toString(),
                                           "message",
                                           message);
        node.put("hasData", hasData);
        node.put("tables", tablesNode);
        return node;
    }

    @Override
    public String toString()
    {
        return operatorType + ": " + message + " " + tables;
    }
}
