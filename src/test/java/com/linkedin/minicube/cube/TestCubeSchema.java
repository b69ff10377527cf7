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

import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.linkedin.minicube.CubeTestData;
import com.linkedin.minicube.block.DataType;
import com.linkedin.minicube.utils.JsonUtils;

public class TestCubeSchema
{
    private static void assertFails(String json, CubeExceptionType expected)
    {
        try
        {
            CubeSchema.fromJson(JsonUtils.makeJson(json));
            Assert.fail("Schema should have been rejected: " + json);
        }
        catch (CubeException e)
        {
            Assert.assertEquals(e.getExceptionType(), expected);
        }
    }

    @Test
    public void testWineSchema() throws Exception
    {
        CubeSchema schema = CubeSchema.wine();

        Assert.assertEquals(schema.getDimensions(),
                            Arrays.asList("quality", "alcohol_range", "pH_range", "density_range"));
        Assert.assertEquals(schema.getMeasures().size(), 11);
        Assert.assertEquals(schema.getSourceSchema().getNumColumns(), 12);
        Assert.assertEquals(schema.getRecordSchema().getNumColumns(), 15);
        Assert.assertEquals(schema.getDimensionType("quality"), DataType.INT);
        Assert.assertEquals(schema.getDimensionType("alcohol_range"), DataType.STRING);
        Assert.assertEquals(schema.getReportMeasures(),
                            Arrays.asList("fixed acidity", "volatile acidity", "alcohol"));
        Assert.assertEquals(schema.getSampleColumns(),
                            Arrays.asList("quality", "alcohol", "pH", "fixed acidity", "volatile acidity"));
        Assert.assertEquals(schema.getDistributionDimension(), "quality");
        Assert.assertTrue(schema.isMeasure("citric acid"));
        Assert.assertFalse(schema.isMeasure("quality"));
    }

    @Test
    public void testDimensionChecks() throws Exception
    {
        CubeSchema schema = CubeTestData.miniSchema();
        schema.checkDimensions(new String[] { "quality", "alcohol_range" });

        try
        {
            schema.checkDimension("color");
            Assert.fail();
        }
        catch (CubeException e)
        {
            Assert.assertEquals(e.getExceptionType(), CubeExceptionType.UNKNOWN_DIMENSION);
        }

        try
        {
            schema.checkDimensions(new String[] { "quality", "pH_range", "quality" });
            Assert.fail();
        }
        catch (CubeException e)
        {
            Assert.assertEquals(e.getExceptionType(), CubeExceptionType.DUPLICATE_DIMENSION);
        }

        try
        {
            schema.checkDimensions(new String[0]);
            Assert.fail();
        }
        catch (CubeException e)
        {
            Assert.assertEquals(e.getExceptionType(), CubeExceptionType.INVALID_CONFIG);
        }

        try
        {
            schema.checkMeasure("quality");
            Assert.fail();
        }
        catch (CubeException e)
        {
            Assert.assertEquals(e.getExceptionType(), CubeExceptionType.UNKNOWN_MEASURE);
        }
    }

    @Test
    public void testInlineClassifier() throws Exception
    {
        CubeSchema schema =
                CubeSchema.fromJson(JsonUtils.makeJson("{'columns': [{'name': 'sugar', 'type': 'DOUBLE'}], "
                        + "'measures': ['sugar'], "
                        + "'derivedDimensions': [{'name': 'sweetness', 'source': 'sugar', 'boundaries': [4], 'labels': ['dry', 'sweet']}]}"));

        Assert.assertEquals(schema.getDimensions(), Arrays.asList("sweetness"));
        Assert.assertEquals(schema.getDerivedDimensions().get(0).classify(4.0), "sweet");
        Assert.assertNull(schema.getDistributionDimension());
    }

    @Test
    public void testInvalidSchemas()
    {
        assertFails("{'measures': ['a']}", CubeExceptionType.INVALID_SCHEMA);
        assertFails("{'columns': [{'name': 'a', 'type': 'STRING'}], 'measures': ['a']}",
                    CubeExceptionType.INVALID_SCHEMA);
        assertFails("{'columns': [{'name': 'a', 'type': 'INT'}], 'dimensions': ['b'], 'measures': []}",
                    CubeExceptionType.INVALID_SCHEMA);
        assertFails("{'columns': [{'name': 'a', 'type': 'INT'}], 'dimensions': ['a'], 'measures': ['a']}",
                    CubeExceptionType.INVALID_SCHEMA);
        assertFails("{'columns': [{'name': 'a', 'type': 'DOUBLE'}], 'measures': ['a'], "
                            + "'derivedDimensions': [{'name': 'r', 'source': 'a', 'classifier': 'sulphates'}]}",
                    CubeExceptionType.INVALID_SCHEMA);
        assertFails("{'columns': [{'name': 'a', 'type': 'DOUBLE'}], 'measures': ['a'], "
                            + "'distributionDimension': 'a'}",
                    CubeExceptionType.INVALID_SCHEMA);
    }
}
