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
import java.util.Arrays;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.codehaus.jackson.JsonNode;

import com.linkedin.minicube.cube.CubeException;
import com.linkedin.minicube.cube.CubeExceptionType;
import com.linkedin.minicube.cube.CubeSchema;
import com.linkedin.minicube.cube.GroupingEngine;
import com.linkedin.minicube.cube.Groups;
import com.linkedin.minicube.cube.RecordStore;
import com.linkedin.minicube.operator.aggregate.AggregationType;
import com.linkedin.minicube.utils.JsonUtils;

/**
 * Aggregates a measure at each level of a dimension hierarchy.
 * <p>
 * Every level groups the whole store by the single dimension of that level, so the
 * levels are independent of each other. The operator emits one table per level titled
 * "Rollup Level i: dimension".
 * <p>
 * Configuration:
 *
 * <pre>
 * {"operator": "ROLLUP", "dimensions": ["alcohol_range", "quality"], "measure": "fixed acidity", "aggregate": "avg"}
 * </pre>
 */
public class RollupOperator implements CubeOperator
{
    private static final Log LOG = LogFactory.getLog(RollupOperator.class);

    private String[] hierarchy;
    private String measure;
    private AggregationType aggregationType;

    public RollupOperator()
    {

    }

    public RollupOperator(List<String> hierarchy, String measure, AggregationType aggregationType)
    {
        this.hierarchy = hierarchy.toArray(new String[hierarchy.size()]);
        this.measure = measure;
        this.aggregationType = aggregationType;
    }

    @Override
    public void configure(JsonNode json) throws CubeException
    {
        try
        {
            hierarchy = JsonUtils.asArray(JsonUtils.get(json, "dimensions"));
            measure = JsonUtils.getText(json, "measure");
        }
        catch (IllegalArgumentException e)
        {
            throw new CubeException(CubeExceptionType.INVALID_CONFIG, e.getMessage(), e);
        }
        aggregationType = AggregationType.fromName(JsonUtils.getText(json, "aggregate", "avg"));
    }

    @Override
    public OperatorResult run(RecordStore store) throws CubeException
    {
        CubeSchema schema = store.getSchema();

        if (hierarchy == null || hierarchy.length == 0)
            throw new CubeException(CubeExceptionType.INVALID_CONFIG,
                                    "Rollup needs at least one dimension");
        for (String dimension : hierarchy)
            schema.checkDimension(dimension);
        schema.checkMeasure(measure);

        GroupingEngine engine = new GroupingEngine(schema);
        List<ResultTable> levels = new ArrayList<ResultTable>();

        for (int level = 0; level < hierarchy.length; level++)
        {
            Groups groups = engine.groupBy(store, hierarchy[level]);
            String title = "Rollup Level " + (level + 1) + ": " + hierarchy[level];
            levels.add(ResultTables.aggregate(title,
                                              groups,
                                              store.getRecordSchema(),
                                              measure,
                                              aggregationType));

            LOG.debug(title + " has " + groups.size() + " groups");
        }

        String message =
                "Rollup of " + ResultTables.aggregateColumn(measure, aggregationType)
                        + " over " + Arrays.toString(hierarchy);
        LOG.info(message + ": " + levels.size() + " levels");

        return new OperatorResult(OperatorType.ROLLUP, message, levels);
    }

    @Override
    public OperatorType getType()
    {
        return OperatorType.ROLLUP;
    }
}
