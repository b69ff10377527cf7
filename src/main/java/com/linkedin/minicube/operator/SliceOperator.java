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
import org.apache.pig.data.Tuple;
import org.codehaus.jackson.JsonNode;

import com.linkedin.minicube.block.BlockSchema;
import com.linkedin.minicube.cube.CubeException;
import com.linkedin.minicube.cube.CubeExceptionType;
import com.linkedin.minicube.cube.CubeSchema;
import com.linkedin.minicube.cube.RecordStore;
import com.linkedin.minicube.utils.JsonUtils;
import com.linkedin.minicube.utils.TupleUtils;

/**
 * Fixes one dimension to a single value and summarizes the matching records.
 * <p>
 * The value is compared after conversion to the type of the dimension. When no record
 * matches, the result carries no tables and a "no data" message.
 * <p>
 * Configuration ("measures" and "sampleSize" are optional):
 *
 * <pre>
 * {"operator": "SLICE", "dimension": "quality", "value": 5, "measures": ["alcohol"], "sampleSize": 5}
 * </pre>
 */
public class SliceOperator implements CubeOperator
{
    private static final Log LOG = LogFactory.getLog(SliceOperator.class);

    public static final int DEFAULT_SAMPLE_SIZE = 5;

    private String dimension;
    private Object value;
    private List<String> measures;
    private int sampleSize = DEFAULT_SAMPLE_SIZE;

    public SliceOperator()
    {

    }

    /**
     * @param measures
     *            the measures to summarize; null for the report measures of the cube
     */
    public SliceOperator(String dimension, Object value, List<String> measures)
    {
        this.dimension = dimension;
        this.value = value;
        this.measures = measures;
    }

    public SliceOperator setSampleSize(int sampleSize)
    {
        if (sampleSize < 0)
            throw new IllegalArgumentException("Sample size cannot be negative: " + sampleSize);
        this.sampleSize = sampleSize;
        return this;
    }

    @Override
    public void configure(JsonNode json) throws CubeException
    {
        try
        {
            dimension = JsonUtils.getText(json, "dimension");
            value = JsonUtils.asObject(JsonUtils.get(json, "value"));
            String[] names = JsonUtils.asArray(json, "measures");
            measures = names == null ? null : Arrays.asList(names);
            if (json.has("sampleSize"))
                setSampleSize(json.get("sampleSize").getIntValue());
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

        DiceCondition condition =
                DiceCondition.exact(value).bind(schema.getDimensionType(dimension));
        List<String> reportMeasures = resolveMeasures(schema, measures);

        int index = recordSchema.getIndex(dimension);
        List<Tuple> matches = new ArrayList<Tuple>();
        for (Tuple record : store.getRecords())
        {
            if (condition.matches(TupleUtils.get(record, index)))
                matches.add(record);
        }

        String title = "Slice: " + dimension + " = " + value;
        if (matches.isEmpty())
        {
            String message = "No data found for " + dimension + " = " + value;
            LOG.warn(message);
            return SliceResult.noData(message);
        }

        List<String> sampleColumns = schema.getSampleColumns();
        if (sampleColumns.isEmpty())
            sampleColumns = Arrays.asList(recordSchema.getColumnNames());

        ResultTable statistics =
                ResultTables.statistics(title, matches, recordSchema, reportMeasures);
        ResultTable sample =
                ResultTables.sample("Sample Records",
                                    matches,
                                    recordSchema,
                                    sampleColumns,
                                    sampleSize);

        String message = title + ": " + matches.size() + " records";
        LOG.info(message);
        return new SliceResult(message, statistics, sample);
    }

    /**
     * Validates the requested measures, defaulting to the report measures of the cube
     * (or all its measures if it declares none).
     */
    static List<String> resolveMeasures(CubeSchema schema, List<String> measures) throws CubeException
    {
        if (measures == null)
        {
            measures = schema.getReportMeasures();
            if (measures.isEmpty())
                measures = schema.getMeasures();
        }

        if (measures.isEmpty())
            throw new CubeException(CubeExceptionType.INVALID_CONFIG,
                                    "At least one measure is required");

        for (String measure : measures)
            schema.checkMeasure(measure);

        return measures;
    }

    @Override
    public OperatorType getType()
    {
        return OperatorType.SLICE;
    }
}
