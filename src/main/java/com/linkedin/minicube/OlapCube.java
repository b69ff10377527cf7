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


package com.linkedin.minicube;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.codehaus.jackson.JsonNode;

import com.linkedin.minicube.cube.CubeException;
import com.linkedin.minicube.cube.CubeSchema;
import com.linkedin.minicube.cube.RecordStore;
import com.linkedin.minicube.operator.CubeOperator;
import com.linkedin.minicube.operator.DiceCondition;
import com.linkedin.minicube.operator.DiceOperator;
import com.linkedin.minicube.operator.DiceResult;
import com.linkedin.minicube.operator.DrilldownOperator;
import com.linkedin.minicube.operator.OperatorFactory;
import com.linkedin.minicube.operator.OperatorResult;
import com.linkedin.minicube.operator.ResultTable;
import com.linkedin.minicube.operator.RollupOperator;
import com.linkedin.minicube.operator.SliceOperator;
import com.linkedin.minicube.operator.SliceResult;
import com.linkedin.minicube.operator.aggregate.AggregationType;

/**
 * Entry point for OLAP queries over a loaded {@link RecordStore}.
 * <p>
 * Every call runs a freshly created operator; the store is never modified, so one cube
 * can serve any number of queries.
 */
public class OlapCube
{
    private final RecordStore store;

    public OlapCube(RecordStore store)
    {
        this.store = store;
    }

    public static OlapCube load(List<Map<String, String>> rawRecords, CubeSchema schema) throws CubeException
    {
        return new OlapCube(RecordStore.load(rawRecords, schema));
    }

    public RecordStore getStore()
    {
        return store;
    }

    public CubeSchema getSchema()
    {
        return store.getSchema();
    }

    /**
     * Aggregates the measure separately for each dimension of the hierarchy; one table
     * per level.
     */
    public List<ResultTable> rollup(List<String> hierarchy, String measure, AggregationType type) throws CubeException
    {
        return run(new RollupOperator(hierarchy, measure, type)).getTables();
    }

    /**
     * Aggregates the measure by the start dimension, then by each longer prefix of start
     * plus drill dimensions; one table per level.
     */
    public List<ResultTable> drilldown(String startDimension,
                                       List<String> drillDimensions,
                                       String measure,
                                       AggregationType type) throws CubeException
    {
        return run(new DrilldownOperator(startDimension, drillDimensions, measure, type)).getTables();
    }

    /**
     * @param measures
     *            the measures to summarize, or null for the report measures
     */
    public SliceResult slice(String dimension, Object value, List<String> measures) throws CubeException
    {
        return (SliceResult) run(new SliceOperator(dimension, value, measures));
    }

    /**
     * @param conditions
     *            conditions keyed by dimension, evaluated in iteration order
     * @param measures
     *            the measures to summarize, or null for the report measures
     */
    public DiceResult dice(Map<String, DiceCondition> conditions, List<String> measures) throws CubeException
    {
        return (DiceResult) run(new DiceOperator(conditions, measures));
    }

    public OperatorResult execute(JsonNode operatorJson) throws CubeException
    {
        return run(OperatorFactory.getOperator(operatorJson));
    }

    /**
     * Runs a list of operator configurations, in order.
     */
    public List<OperatorResult> executeAll(JsonNode operatorsJson) throws CubeException
    {
        List<OperatorResult> results = new ArrayList<OperatorResult>();
        for (JsonNode operatorJson : operatorsJson)
            results.add(execute(operatorJson));
        return results;
    }

    public OperatorResult run(CubeOperator operator) throws CubeException
    {
        return operator.run(store);
    }
}
