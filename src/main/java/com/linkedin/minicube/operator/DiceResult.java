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
import org.codehaus.jackson.node.ObjectNode;

/**
 * Result of a dice: the number of matching records, statistics of the report measures
 * over them, and the distribution of the distribution dimension (absent when the cube
 * declares none).
 */
public class DiceResult extends OperatorResult
{
    private final int matchCount;
    private final ResultTable statistics;
    private final ResultTable distribution;

    DiceResult(String message, int matchCount, ResultTable statistics, ResultTable distribution)
    {
        super(OperatorType.DICE, message, tables(statistics, distribution));
        this.matchCount = matchCount;
        this.statistics = statistics;
        this.distribution = distribution;
    }

    private DiceResult(String message)
    {
        super(OperatorType.DICE, message, false, Collections.<ResultTable> emptyList());
        this.matchCount = 0;
        this.statistics = null;
        this.distribution = null;
    }

    static DiceResult noData(String message)
    {
        return new DiceResult(message);
    }

    private static List<ResultTable> tables(ResultTable statistics, ResultTable distribution)
    {
        List<ResultTable> tables = new ArrayList<ResultTable>();
        tables.add(statistics);
        if (distribution != null)
            tables.add(distribution);
        return tables;
    }

    public int getMatchCount()
    {
        return matchCount;
    }

    public ResultTable getStatistics()
    {
        return statistics;
    }

    public ResultTable getDistribution()
    {
        return distribution;
    }

    @Override
    public JsonNode toJson()
    {
        ObjectNode node = (ObjectNode) super.toJson();
        node.put("matchCount", matchCount);
        return node;
    }
}
