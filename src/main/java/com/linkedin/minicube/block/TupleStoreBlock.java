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

package com.linkedin.minicube.block;

import java.util.Iterator;
import java.util.List;

import org.apache.pig.data.Tuple;

/**
 * Provides a block interface over an in-memory list of tuples.
 *
 * Every block instance keeps its own cursor, so several blocks may scan the same list
 * at the same time.
 *
 * @author Maneesh Varshney
 *
 */
public class TupleStoreBlock implements Block
{
    private final List<Tuple> store;
    private final BlockSchema schema;
    private Iterator<Tuple> iterator;

    public TupleStoreBlock(List<Tuple> store, BlockSchema schema)
    {
        this.store = store;
        this.schema = schema;
        this.iterator = store.iterator();
    }

    @Override
    public BlockSchema getSchema()
    {
        return schema;
    }

    @Override
    public Tuple next()
    {
        if (!iterator.hasNext())
            return null;

        return iterator.next();
    }

    @Override
    public void rewind()
    {
        iterator = store.iterator();
    }

}
