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
import java.util.List;

import org.apache.commons.lang.WordUtils;
import org.apache.pig.data.Tuple;

import com.linkedin.minicube.block.BlockSchema;
import com.linkedin.minicube.block.ColumnType;
import com.linkedin.minicube.block.DataType;
import com.linkedin.minicube.cube.DimensionKey;
import com.linkedin.minicube.cube.Groups;
import com.linkedin.minicube.operator.aggregate.AggregationFunction;
import com.linkedin.minicube.operator.aggregate.AggregationFunctions;
import com.linkedin.minicube.operator.aggregate.AggregationType;
import com.linkedin.minicube.operator.aggregate.Aggregator;
import com.linkedin.minicube.utils.TupleUtils;

/**
 * Builds the result tables shared by the cube operators.
 */
final class ResultTables
{
    static final String COUNT = "Count";
    static final String PERCENTAGE = "Percentage";

    static final String[] STATS_COLUMNS =
            { "Measure", COUNT, "Average", "Min", "Max", "Sum" };

    private static final AggregationType[] STATS_AGGREGATES =
            { AggregationType.AVG, AggregationType.MIN, AggregationType.MAX,
                    AggregationType.SUM };

    /**
     * Name of the column holding the aggregate of a measure, e.g. "fixed acidity (AVG)".
     */
    static String aggregateColumn(String measure, AggregationType type)
    {
        return measure + " (" + type + ")";
    }

    /**
     * One row per group: the key values, the rounded aggregate of the measure and the
     * group size. Rows are sorted by the key columns.
     */
    static ResultTable aggregate(String title,
                                 Groups groups,
                                 BlockSchema recordSchema,
                                 String measure,
                                 AggregationType type)
    {
        String[] dimensions = groups.getDimensions();
        ColumnType[] columns = new ColumnType[dimensions.length + 2];
        for (int i = 0; i < dimensions.length; i++)
            columns[i] = recordSchema.getColumnType(recordSchema.getIndex(dimensions[i]));
        columns[dimensions.length] =
                new ColumnType(aggregateColumn(measure, type), DataType.DOUBLE);
        columns[dimensions.length + 1] = new ColumnType(COUNT, DataType.INT);

        ResultTable table = new ResultTable(title, columns);

        AggregationFunction function = AggregationFunctions.get(type);
        function.setup(recordSchema, measure);

        for (DimensionKey key : groups.keys())
        {
            function.resetState();
            List<Tuple> records = groups.get(key);
            for (Tuple record : records)
                function.aggregate(record);

            Object[] row = new Object[columns.length];
            System.arraycopy(key.getValues(), 0, row, 0, dimensions.length);
            row[dimensions.length] = Aggregator.round(function.output());
            row[dimensions.length + 1] = records.size();
            table.addRow(row);
        }

        return table.sort(dimensions);
    }

    /**
     * One row per measure: count, average, min, max and sum over the records, rounded.
     * The records must not be empty.
     */
    static ResultTable statistics(String title,
                                  List<Tuple> records,
                                  BlockSchema recordSchema,
                                  List<String> measures)
    {
        ResultTable table =
                new ResultTable(title,
                                new ColumnType(STATS_COLUMNS[0], DataType.STRING),
                                new ColumnType(STATS_COLUMNS[1], DataType.INT),
                                new ColumnType(STATS_COLUMNS[2], DataType.DOUBLE),
                                new ColumnType(STATS_COLUMNS[3], DataType.DOUBLE),
                                new ColumnType(STATS_COLUMNS[4], DataType.DOUBLE),
                                new ColumnType(STATS_COLUMNS[5], DataType.DOUBLE));

        for (String measure : measures)
        {
            List<AggregationFunction> functions = new ArrayList<AggregationFunction>();
            for (AggregationType type : STATS_AGGREGATES)
            {
                AggregationFunction function = AggregationFunctions.get(type);
                function.setup(recordSchema, measure);
                function.resetState();
                functions.add(function);
            }

            for (Tuple record : records)
            {
                for (AggregationFunction function : functions)
                    function.aggregate(record);
            }

            table.addRow(measure,
                         (int) functions.get(0).getCount(),
                         Aggregator.round(functions.get(0).output()),
                         Aggregator.round(functions.get(1).output()),
                         Aggregator.round(functions.get(2).output()),
                         Aggregator.round(functions.get(3).output()));
        }

        return table;
    }

    /**
     * The first records of a list, projected on the specified columns.
     */
    static ResultTable sample(String title,
                              List<Tuple> records,
                              BlockSchema recordSchema,
                              List<String> columns,
                              int sampleSize)
    {
        String[] names = columns.toArray(new String[columns.size()]);
        int[] indexes = new int[names.length];
        for (int i = 0; i < names.length; i++)
            indexes[i] = recordSchema.getIndex(names[i]);

        ResultTable table = new ResultTable(title, recordSchema.getSubset(names));
        for (int r = 0; r < records.size() && r < sampleSize; r++)
        {
            Tuple record = records.get(r);
            Object[] row = new Object[indexes.length];
            for (int i = 0; i < indexes.length; i++)
                row[i] = TupleUtils.get(record, indexes[i]);
            table.addRow(row);
        }

        return table;
    }

    /**
     * Share of each value of a dimension among the grouped records, as a percentage
     * rounded to one decimal, sorted by value.
     */
    static ResultTable distribution(Groups groups, BlockSchema recordSchema)
    {
        String dimension = groups.getDimensions()[0];
        ResultTable table =
                new ResultTable(WordUtils.capitalize(dimension) + " Distribution",
                                recordSchema.getColumnType(recordSchema.getIndex(dimension)),
                                new ColumnType(COUNT, DataType.INT),
                                new ColumnType(PERCENTAGE, DataType.DOUBLE));
        table.setPercentColumn(PERCENTAGE);

        double total = groups.getTotalCount();
        for (DimensionKey key : groups.keys())
        {
            int count = groups.get(key).size();
            table.addRow(key.get(0), count, Aggregator.round(count / total * 100, 1));
        }

        return table.sort(dimension);
    }

    private ResultTables()
    {

    }
}
