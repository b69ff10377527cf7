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

import org.apache.pig.data.Tuple;

import com.linkedin.minicube.block.Block;
import com.linkedin.minicube.block.BlockSchema;

/**
 * Partitions records into {@link Groups} by the values of an ordered list of dimensions.
 * <p>
 * Unlike a sort-based group by, the input need not be ordered: the records are hashed on
 * their {@link DimensionKey}.
 */
public class GroupingEngine
{
    private final CubeSchema schema;

    public GroupingEngine(CubeSchema schema)
    {
        this.schema = schema;
    }

    /**
     * Groups all records of the store.
     *
     * @param store
     * @param dimensionKeys
     *            the grouping dimensions, in key order
     * @return the groups
     * @throws CubeException
     *             UNKNOWN_DIMENSION if a name is not a dimension, DUPLICATE_DIMENSION if a
     *             name repeats
     */
    public Groups groupBy(RecordStore store, String... dimensionKeys) throws CubeException
    {
        return groupBy(store.newBlock(), dimensionKeys);
    }

    /**
     * Groups the records produced by a block (e.g. a filtered subset of the store).
     */
    public Groups groupBy(Block block, String... dimensionKeys) throws CubeException
    {
        schema.checkDimensions(dimensionKeys);

        BlockSchema recordSchema = block.getSchema();
        int[] indexes = new int[dimensionKeys.length];
        for (int i = 0; i < indexes.length; i++)
            indexes[i] = recordSchema.getIndex(dimensionKeys[i]);

        Groups groups = new Groups(dimensionKeys);

        Tuple record;
        while ((record = block.next()) != null)
            groups.add(DimensionKey.of(record, indexes), record);

        return groups;
    }
}
