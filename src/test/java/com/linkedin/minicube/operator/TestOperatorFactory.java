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

import org.codehaus.jackson.JsonNode;
import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import com.linkedin.minicube.CubeTestData;
import com.linkedin.minicube.cube.CubeException;
import com.linkedin.minicube.cube.CubeExceptionType;
import com.linkedin.minicube.cube.RecordStore;
import com.linkedin.minicube.utils.JsonUtils;

public class TestOperatorFactory
{
    private RecordStore store;

    @BeforeClass
    public void setUp() throws Exception
    {
        store = CubeTestData.wineSampleStore();
    }

    private static void assertInvalid(String json)
    {
        try
        {
            OperatorFactory.getOperator(JsonUtils.makeJson(json));
            Assert.fail("Configuration should have been rejected: " + json);
        }
        catch (CubeException e)
        {
            Assert.assertEquals(e.getExceptionType(), CubeExceptionType.INVALID_CONFIG);
        }
    }

    @Test
    public void testOperatorTypes()
    {
        for (OperatorType type : OperatorType.values())
            Assert.assertEquals(OperatorFactory.getOperator(type).getType(), type);

        Assert.assertTrue(OperatorType.SLICE.isFilter());
        Assert.assertFalse(OperatorType.ROLLUP.isFilter());
    }

    @Test
    public void testRollupFromJson() throws Exception
    {
        CubeOperator operator =
                OperatorFactory.getOperator(JsonUtils.makeJson("{'operator': 'rollup', 'dimensions': ['quality'], 'measure': 'alcohol', 'aggregate': 'max'}"));
        Assert.assertTrue(operator instanceof RollupOperator);

        OperatorResult result = operator.run(store);
        Assert.assertEquals(result.getOperatorType(), OperatorType.ROLLUP);
        Assert.assertEquals(result.getTables().get(0).getColumn("alcohol (MAX)").get(2), 10.5);
    }

    @Test
    public void testDefaultAggregate() throws Exception
    {
        CubeOperator operator =
                OperatorFactory.getOperator(JsonUtils.makeJson("{'operator': 'DRILLDOWN', 'start': 'quality', 'measure': 'alcohol'}"));

        OperatorResult result = operator.run(store);
        Assert.assertEquals(result.getTables().size(), 1);
        Assert.assertTrue(result.getTables().get(0).getSchema().hasIndex("alcohol (AVG)"));
    }

    @Test
    public void testDiceFromJson() throws Exception
    {
        JsonNode json =
                JsonUtils.makeJson("{'operator': 'DICE', 'conditions': {'quality': [6, 8], 'alcohol_range': 'Medium (9.5-11.5)'}, 'measures': ['citric acid']}");
        DiceResult result = (DiceResult) OperatorFactory.getOperator(json).run(store);

        Assert.assertEquals(result.getMatchCount(), 4);
        Assert.assertEquals(result.getStatistics().getColumn("Measure").size(), 1);
    }

    @Test
    public void testSliceFromJson() throws Exception
    {
        JsonNode json =
                JsonUtils.makeJson("{'operator': 'SLICE', 'dimension': 'quality', 'value': 8, 'sampleSize': 3}");
        OperatorResult result = OperatorFactory.getOperator(json).run(store);

        Assert.assertTrue(result instanceof SliceResult);
        Assert.assertFalse(result.hasData());
    }

    @Test
    public void testDemoOperations() throws Exception
    {
        JsonNode operations = JsonUtils.readResource("wine-demo.json");
        Assert.assertEquals(operations.size(), 4);

        OperatorType[] expected =
                { OperatorType.ROLLUP, OperatorType.DRILLDOWN, OperatorType.SLICE,
                        OperatorType.DICE };
        for (int i = 0; i < expected.length; i++)
        {
            OperatorResult result = OperatorFactory.getOperator(operations.get(i)).run(store);
            Assert.assertEquals(result.getOperatorType(), expected[i]);
            Assert.assertTrue(result.hasData());
        }
    }

    @Test
    public void testInvalidConfigurations()
    {
        assertInvalid("{'dimensions': ['quality']}");
        assertInvalid("{'operator': 'PIVOT'}");
        assertInvalid("{'operator': 'ROLLUP', 'measure': 'alcohol'}");
        assertInvalid("{'operator': 'ROLLUP', 'dimensions': ['quality'], 'measure': 'alcohol', 'aggregate': 'median'}");
        assertInvalid("{'operator': 'SLICE', 'dimension': 'quality'}");
        assertInvalid("{'operator': 'DICE', 'conditions': [6, 8]}");
        assertInvalid("{'operator': 'DICE', 'conditions': {'quality': [6, 7, 8]}}");
    }
}
