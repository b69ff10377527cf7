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

package com.linkedin.minicube.cube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.pig.data.Tuple;
import org.apache.pig.data.TupleFactory;

import com.linkedin.minicube.block.Block;
import com.linkedin.minicube.block.BlockSchema;
import com.linkedin.minicube.block.DataType;
import com.linkedin.minicube.block.TupleStoreBlock;
import com.linkedin.minicube.utils.TupleUtils;

/**
 * The finalized, read-only set of records of a cube.
 * <p>
 * Records are tuples laid out by {@link CubeSchema#getRecordSchema()}: the typed source
 * columns followed by the labels of the derived dimensions. The labels are computed once,
 * while loading, and the tuples are never modified afterwards. Any number of readers may
 * therefore scan the store concurrently.
 */
public final class RecordStore
{
    private static final Log LOG = LogFactory.getLog(RecordStore.class.getName());

    private final CubeSchema schema;
    private final List<Tuple> records;

    private RecordStore(CubeSchema schema, List<Tuple> records)
    {
        this.schema = schema;
        this.records = Collections.unmodifiableList(records);
    }

    /**
     * Builds a store from raw records.
     * <p>
     * Every raw record must carry a value for every source column of the schema; values
     * of numerical columns must parse as numbers. Each derived dimension's classifier is
     * then applied to its source value. Columns of the raw record that the schema does
     * not declare are ignored.
     *
     * @param rawRecords
     *            the records as maps of column name to text value
     * @param schema
     *            the cube schema
     * @return the populated store
     * @throws CubeException
     *             (MISSING_COLUMN or NOT_NUMERIC) if any record does not fit the schema; no
     *             store is created in that case
     */
    public static RecordStore load(List<Map<String, String>> rawRecords, CubeSchema schema) throws CubeException
    {
        BlockSchema sourceSchema = schema.getSourceSchema();
        BlockSchema recordSchema = schema.getRecordSchema();
        List<DerivedDimension> derived = schema.getDerivedDimensions();

        int numSourceColumns = sourceSchema.getNumColumns();
        int[] derivedSourceIndex = new int[derived.size()];
        for (int i = 0; i < derivedSourceIndex.length; i++)
            derivedSourceIndex[i] = sourceSchema.getIndex(derived.get(i).getSourceColumn());

        TupleFactory factory = TupleFactory.getInstance();
        List<Tuple> records = new ArrayList<Tuple>(rawRecords.size());

        int recordNumber = 0;
        for (Map<String, String> raw : rawRecords)
        {
            recordNumber++;
            Tuple tuple = factory.newTuple(recordSchema.getNumColumns());

            for (int i = 0; i < numSourceColumns; i++)
            {
                String column = sourceSchema.getName(i);
                String text = raw.get(column);
                if (text == null)
                    throw new CubeException(CubeExceptionType.MISSING_COLUMN, "Record "
                            + recordNumber + " is missing column [" + column + "]");

                TupleUtils.set(tuple, i, parse(text, sourceSchema.getType(i), column, recordNumber));
            }

            for (int i = 0; i < derivedSourceIndex.length; i++)
            {
                double value = TupleUtils.getDouble(tuple, derivedSourceIndex[i]);
                TupleUtils.set(tuple, numSourceColumns + i, derived.get(i).classify(value));
            }

            records.add(tuple);
        }

        LOG.info("Loaded " + records.size() + " records with " + derived.size()
                + " derived dimensions");

        return new RecordStore(schema, records);
    }

    private static Object parse(String text, DataType type, String column, int recordNumber) throws CubeException
    {
        if (type == DataType.STRING)
            return text;

        try
        {
            return type.parse(text.trim());
        }
        catch (NumberFormatException e)
        {
            throw new CubeException(CubeExceptionType.NOT_NUMERIC, "Record " + recordNumber
                    + ": value [" + text + "] of column [" + column + "] is not a valid "
                    + type, e);
        }
    }

    public CubeSchema getSchema()
    {
        return schema;
    }

    public BlockSchema getRecordSchema()
    {
        return schema.getRecordSchema();
    }

    public int size()
    {
        return records.size();
    }

    public boolean isEmpty()
    {
        return records.isEmpty();
    }

    public Tuple get(int index)
    {
        return records.get(index);
    }

    /**
     * Returns the value of the named column of the record at the specified position.
     */
    public Object getValue(int index, String column)
    {
        return TupleUtils.get(records.get(index), getRecordSchema().getIndex(column));
    }

    public List<Tuple> getRecords()
    {
        return records;
    }

    /**
     * Returns a new block that scans the records in store order.
     */
    public Block newBlock()
    {
        return new TupleStoreBlock(records, getRecordSchema());
    }
}
