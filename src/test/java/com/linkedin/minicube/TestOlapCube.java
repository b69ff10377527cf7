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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import com.linkedin.minicube.cube.CubeSchema;
import com.linkedin.minicube.operator.DiceCondition;
import com.linkedin.minicube.operator.DiceResult;
import com.linkedin.minicube.operator.OperatorResult;
import com.linkedin.minicube.operator.ResultTable;
import com.linkedin.minicube.operator.SliceResult;
import com.linkedin.minicube.operator.aggregate.AggregationType;
import com.linkedin.minicube.utils.JsonUtils;

public class TestOlapCube
{
    private OlapCube cube;

    @BeforeClass
    public void setUp() throws Exception
    {
        cube = OlapCube.load(CubeTestData.wineSampleRecords(), CubeSchema.wine());
    }

    @Test
    public void testRollup() throws Exception
    {
        List<ResultTable> levels =
                cube.rollup(Arrays.asList("alcohol_range", "pH_range", "quality"),
                            "fixed acidity",
                            AggregationType.AVG);

        Assert.assertEquals(levels.size(), 3);
        Assert.assertEquals(levels.get(2).getColumn("Count"), Arrays.<Object> asList(6, 1, 3));
    }

    @Test
    public void testDrilldown() throws Exception
    {
        List<ResultTable> levels =
                cube.drilldown("quality",
                               Arrays.asList("alcohol_range", "pH_range"),
                               "volatile acidity",
                               AggregationType.AVG);

        Assert.assertEquals(levels.size(), 3);
        Assert.assertEquals(levels.get(2).size(), 6);
    }

    @Test
    public void testSliceAndDice() throws Exception
    {
        SliceResult slice = cube.slice("quality", 5, null);
        Assert.assertEquals(slice.getStatistics().getValue(0, "Count"), 6);

        Map<String, DiceCondition> conditions = new LinkedHashMap<String, DiceCondition>();
        conditions.put("quality", DiceCondition.range(6, 8));
        conditions.put("alcohol_range", DiceCondition.exact("Medium (9.5-11.5)"));
        DiceResult dice =
                cube.dice(conditions, Arrays.asList("fixed acidity", "volatile acidity", "citric acid"));
        Assert.assertEquals(dice.getMatchCount(), 4);
    }

    @Test
    public void testQueriesDoNotChangeStore() throws Exception
    {
        int size = cube.getStore().size();
        Object first = cube.getStore().getValue(0, "alcohol_range");

        cube.slice("quality", 7, null);
        cube.rollup(Arrays.asList("quality"), "alcohol", AggregationType.SUM);

        Assert.assertEquals(cube.getStore().size(), size);
        Assert.assertEquals(cube.getStore().getValue(0, "alcohol_range"), first);
    }

    @Test
    public void testExecuteAll() throws Exception
    {
        List<OperatorResult> results =
                cube.executeAll(JsonUtils.makeJson("[{'operator': 'SLICE', 'dimension': 'quality', 'value': 9}, "
                        + "{'operator': 'ROLLUP', 'dimensions': ['density_range'], 'measure': 'density', 'aggregate': 'min'}]"));

        Assert.assertEquals(results.size(), 2);
        Assert.assertFalse(results.get(0).hasData());
        Assert.assertEquals(results.get(1).getTables().get(0).getColumn("density_range"),
                            Arrays.<Object> asList("Heavy (> 0.998)",
                                                   "Light (< 0.996)",
                                                   "Medium (0.996-0.998)"));
    }
}
