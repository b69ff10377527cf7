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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.pig.data.Tuple;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.linkedin.minicube.utils.TupleUtils;

public class TestTupleComparator
{
    @Test
    public void testCompareObjects()
    {
        Assert.assertTrue(TupleComparator.compareObjects(5, 7) < 0);
        Assert.assertEquals(TupleComparator.compareObjects(5, 5.0), 0);
        Assert.assertTrue(TupleComparator.compareObjects(7L, 6) > 0);
        Assert.assertTrue(TupleComparator.compareObjects(null, 1) < 0);
        Assert.assertEquals(TupleComparator.compareObjects(null, null), 0);
        Assert.assertTrue(TupleComparator.compareObjects("High (> 11.5)", "Low (< 9.5)") < 0);
    }

    @Test
    public void testSortOnTwoColumns()
    {
        BlockSchema schema = new BlockSchema("INT quality, STRING alcohol_range, DOUBLE alcohol");

        List<Tuple> tuples = new ArrayList<Tuple>();
        tuples.add(TupleUtils.newTuple(6, "Medium (9.5-11.5)", 10.0));
        tuples.add(TupleUtils.newTuple(5, "Medium (9.5-11.5)", 9.8));
        tuples.add(TupleUtils.newTuple(6, "Low (< 9.5)", 9.1));
        tuples.add(TupleUtils.newTuple(5, "Low (< 9.5)", 9.4));

        Collections.sort(tuples,
                         new TupleComparator(schema, new String[] { "quality", "alcohol_range" }));

        Assert.assertEquals(TupleUtils.getDouble(tuples.get(0), 2), 9.4);
        Assert.assertEquals(TupleUtils.getDouble(tuples.get(1), 2), 9.8);
        Assert.assertEquals(TupleUtils.getDouble(tuples.get(2), 2), 9.1);
        Assert.assertEquals(TupleUtils.getDouble(tuples.get(3), 2), 10.0);
    }

    @Test
    public void testTupleStoreBlock()
    {
        BlockSchema schema = new BlockSchema("INT quality");
        List<Tuple> tuples = new ArrayList<Tuple>();
        tuples.add(TupleUtils.newTuple(5));
        tuples.add(TupleUtils.newTuple(6));

        Block block = new TupleStoreBlock(tuples, schema);
        Assert.assertEquals(TupleUtils.get(block.next(), 0), 5);
        Assert.assertEquals(TupleUtils.get(block.next(), 0), 6);
        Assert.assertNull(block.next());

        block.rewind();
        Assert.assertEquals(TupleUtils.get(block.next(), 0), 5);
    }
}
