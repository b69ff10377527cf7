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

import org.apache.commons.lang.StringUtils;
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
 * Aggregates a measure at successively finer granularity.
 * <p>
 * Level 1 groups the store by the start dimension; each further level adds the next
 * drill dimension to the grouping key. A level therefore never has fewer rows than the
 * level before it.
 * <p>
 * Configuration:
 *
 * <pre>
 * {"operator": "DRILLDOWN", "start": "quality", "drill": ["alcohol_range", "pH_range"], "measure": "volatile acidity", "aggregate": "avg"}
 * </pre>
 */
public class DrilldownOperator implements CubeOperator
{
    private static final Log LOG = LogFactory.getLog(DrilldownOperator.class);

    private String startDimension;
    private String[] drillDimensions;
    private String measure;
    private AggregationType aggregationType;

    public DrilldownOperator()
    {

    }

    public DrilldownOperator(String startDimension,
                             List<String> drillDimensions,
                             String measure,
                             AggregationType aggregationType)
    {
        this.startDimension = startDimension;
        this.drillDimensions = drillDimensions.toArray(new String[drillDimensions.size()]);
        this.measure = measure;
        this.aggregationType = aggregationType;
    }

    @Override
    public void configure(JsonNode json) throws CubeException
    {
        try
        {
            startDimension = JsonUtils.getText(json, "start");
            drillDimensions = JsonUtils.asArray(json, "drill");
            measure = JsonUtils.getText(json, "measure");
        }
        catch (IllegalArgumentException e)
        {
            throw new CubeException(CubeExceptionType.INVALID_CONFIG, e.getMessage(), e);
        }
        if (drillDimensions == null)
            drillDimensions = new String[0];
        aggregationType = AggregationType.fromName(JsonUtils.getText(json, "aggregate", "avg"));
    }

    @Override
    public OperatorResult run(RecordStore store) throws CubeException
    {
        CubeSchema schema = store.getSchema();

        if (startDimension == null)
            throw new CubeException(CubeExceptionType.INVALID_CONFIG,
                                    "Drilldown needs a start dimension");

        String[] dimensions = new String[drillDimensions.length + 1];
        dimensions[0] = startDimension;
        System.arraycopy(drillDimensions, 0, dimensions, 1, drillDimensions.length);

        schema.checkDimensions(dimensions);
        schema.checkMeasure(measure);

        GroupingEngine engine = new GroupingEngine(schema);
        List<ResultTable> levels = new ArrayList<ResultTable>();

        for (int level = 1; level <= dimensions.length; level++)
        {
            String[] current = Arrays.copyOf(dimensions, level);
            Groups groups = engine.groupBy(store, current);
            String title = "Drilldown Level " + level + ": " + StringUtils.join(current, " + ");
            levels.add(ResultTables.aggregate(title,
                                              groups,
                                              store.getRecordSchema(),
                                              measure,
                                              aggregationType));

            LOG.debug(title + " has " + groups.size() + " groups");
        }

        String message =
                "Drilldown of " + ResultTables.aggregateColumn(measure, aggregationType)
                        + " from " + startDimension + " into "
                        + Arrays.toString(drillDimensions);
        LOG.info(message + ": " + levels.size() + " levels");

        return new OperatorResult(OperatorType.DRILLDOWN, message, levels);
    }

    @Override
    public OperatorType getType()
    {
        return OperatorType.DRILLDOWN;
    }
}
