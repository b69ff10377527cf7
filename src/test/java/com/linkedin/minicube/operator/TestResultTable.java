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

import java.util.Arrays;

import org.codehaus.jackson.JsonNode;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.linkedin.minicube.block.ColumnType;
import com.linkedin.minicube.block.DataType;

public class TestResultTable
{
    private static ResultTable newTable()
    {
        return new ResultTable("Rollup Level 1: quality",
                               new ColumnType("quality", DataType.INT),
                               new ColumnType("alcohol (AVG)", DataType.DOUBLE),
                               new ColumnType("Count", DataType.INT));
    }

    @Test
    public void testAddAndSort()
    {
        ResultTable table = newTable();
        table.addRow(7, 10.0, 3).addRow(5, 9.6, 6).addRow(6, 9.8, 1);
        table.sort("quality");

        Assert.assertEquals(table.size(), 3);
        Assert.assertEquals(table.getValue(0, "quality"), 5);
        Assert.assertEquals(table.getValue(2, "Count"), 3);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testWrongArity()
    {
        newTable().addRow(5, 9.6);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testWrongType()
    {
        newTable().addRow(5, "9.6", 6);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownPercentColumn()
    {
        newTable().setPercentColumn("Percentage");
    }

    @Test
    public void testToJson()
    {
        ResultTable table = newTable().addRow(5, 9.6, 6);
        JsonNode json = table.toJson();

        Assert.assertEquals(json.get("title").getTextValue(), "Rollup Level 1: quality");
        Assert.assertEquals(json.get("schema").size(), 3);
        Assert.assertEquals(json.get("rows").get(0).get("quality").getIntValue(), 5);
        Assert.assertEquals(json.get("rows").get(0).get("alcohol (AVG)").getDoubleValue(), 9.6);
    }

    @Test
    public void testResultJson()
    {
        OperatorResult result =
                new OperatorResult(OperatorType.ROLLUP,
                                   "Rollup",
                                   Arrays.asList(newTable().addRow(5, 9.6, 6)));
        JsonNode json = result.toJson();

        Assert.assertEquals(json.get("operator").getTextValue(), "ROLLUP");
        Assert.assertTrue(json.get("hasData").getBooleanValue());
        Assert.assertEquals(json.get("tables").size(), 1);
    }
}
