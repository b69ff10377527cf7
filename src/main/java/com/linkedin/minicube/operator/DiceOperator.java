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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.pig.data.Tuple;
import org.codehaus.jackson.JsonNode;

import com.linkedin.minicube.block.BlockSchema;
import com.linkedin.minicube.block.TupleStoreBlock;
import com.linkedin.minicube.cube.CubeException;
import com.linkedin.minicube.cube.CubeExceptionType;
import com.linkedin.minicube.cube.CubeSchema;
import com.linkedin.minicube.cube.GroupingEngine;
import com.linkedin.minicube.cube.RecordStore;
import com.linkedin.minicube.utils.JsonUtils;
import com.linkedin.minicube.utils.TupleUtils;

/**
 * Filters the store on several dimensions at once and summarizes the matching records.
 * <p>
 * A record matches if it satisfies every condition; conditions are evaluated in the
 * order given and evaluation stops at the first failing one. Besides the statistics of
 * the report measures, the result holds the distribution of the cube's distribution
 * dimension over the matched records.
 * <p>
 * Configuration (a two element array is an inclusive range, any other value an exact
 * match; "measures" is optional):
 *
 * <pre>
 * {"operator": "DICE", "conditions": {"quality": [6, 8], "alcohol_range": "Medium (9.5-11.5)"}, "measures": ["citric acid"]}
 * </pre>
 */
public class DiceOperator implements CubeOperator
{
    private static final Log LOG = LogFactory.getLog(DiceOperator.class);

    private Map<String, DiceCondition> conditions;
    private List<String> measures;

    public DiceOperator()
    {

    }

    /**
     * @param conditions
     *            the conditions keyed by dimension, in evaluation order
     * @param measures
     *            the measures to summarize; null for the report measures of the cube
     */
    public DiceOperator(Map<String, DiceCondition> conditions, List<String> measures)
    {
        this.conditions = new LinkedHashMap<String, DiceCondition>(conditions);
        this.measures = measures;
    }

    @Override
    public void configure(JsonNode json) throws CubeException
    {
        try
        {
            JsonNode conditionsJson = JsonUtils.get(json, "conditions");
            if (!conditionsJson.isObject())
                throw new IllegalArgumentException("Property conditions must be an object. Found: "
                        + conditionsJson);

            conditions = new LinkedHashMap<String, DiceCondition>();
            Iterator<Map.Entry<String, JsonNode>> it = conditionsJson.getFields();
            while (it.hasNext())
            {
                Map.Entry<String, JsonNode> field = it.next();
                conditions.put(field.getKey(), DiceCondition.fromJson(field.getValue()));
            }

            String[] names = JsonUtils.asArray(json, "measures");
            measures = names == null ? null : Arrays.asList(names);
        }
        catch (IllegalArgumentException e)
        {
            throw new CubeException(CubeExceptionType.INVALID_CONFIG, e.getMessage(), e);
        }
    }

    @Override
    public OperatorResult run(RecordStore store) throws CubeException
    {
        CubeSchema schema = store.getSchema();
        BlockSchema recordSchema = store.getRecordSchema();

        if (conditions == null || conditions.isEmpty())
            throw new CubeException(CubeExceptionType.INVALID_CONFIG,
                                    "Dice needs at least one condition");

        int[] indexes = new int[conditions.size()];
        DiceCondition[] bound = new DiceCondition[conditions.size()];
        int i = 0;
        for (Map.Entry<String, DiceCondition> entry : conditions.entrySet())
        {
            bound[i] = entry.getValue().bind(schema.getDimensionType(entry.getKey()));
            indexes[i] = recordSchema.getIndex(entry.getKey());
            i++;
        }
        List<String> reportMeasures = SliceOperator.resolveMeasures(schema, measures);

        List<Tuple> matches = new ArrayList<Tuple>();
        for (Tuple record : store.getRecords())
        {
            if (matches(record, indexes, bound))
                matches.add(record);
        }

        if (matches.isEmpty())
        {
            String message = "No data found matching the conditions " + conditions;
            LOG.warn(message);
            return DiceResult.noData(message);
        }

        ResultTable statistics =
                ResultTables.statistics("Dice Results", matches, recordSchema, reportMeasures);

        ResultTable distribution = null;
        String distributionDimension = schema.getDistributionDimension();
        if (distributionDimension != null)
        {
            GroupingEngine engine = new GroupingEngine(schema);
            distribution =
                    ResultTables.distribution(engine.groupBy(new TupleStoreBlock(matches,
                                                                                 recordSchema),
                                                             distributionDimension),
                                              recordSchema);
        }

        String message = "Found " + matches.size() + " records matching conditions";
        LOG.info(message + " " + conditions);
        return new DiceResult(message, matches.size(), statistics, distribution);
    }

    private static boolean matches(Tuple record, int[] indexes, DiceCondition[] conditions)
    {
        for (int i = 0; i < conditions.length; i++)
        {
            if (!conditions[i].matches(TupleUtils.get(record, indexes[i])))
                return false;
        }
        return true;
    }

    @Override
    public OperatorType getType()
    {
        return OperatorType.DICE;
    }
}
