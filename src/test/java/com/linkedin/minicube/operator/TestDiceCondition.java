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

import org.testng.Assert;
import org.testng.annotations.Test;

import com.linkedin.minicube.block.DataType;
import com.linkedin.minicube.utils.JsonUtils;

public class TestDiceCondition
{
    @Test
    public void testExactMatch()
    {
        DiceCondition condition = DiceCondition.exact(5);

        Assert.assertTrue(condition.matches(5));
        Assert.assertTrue(condition.matches(5.0));
        Assert.assertTrue(condition.matches(5L));
        Assert.assertFalse(condition.matches(6));
        Assert.assertFalse(condition.matches("5"));
        Assert.assertFalse(condition.matches(null));
    }

    @Test
    public void testRangeMatch()
    {
        DiceCondition condition = DiceCondition.range(6, 8);

        Assert.assertFalse(condition.matches(5));
        Assert.assertTrue(condition.matches(6));
        Assert.assertTrue(condition.matches(7));
        Assert.assertTrue(condition.matches(7.5));
        Assert.assertTrue(condition.matches(8));
        Assert.assertFalse(condition.matches(9));
        Assert.assertFalse(DiceCondition.range(8, 6).matches(7));
    }

    @Test
    public void testStringRange()
    {
        DiceCondition condition = DiceCondition.range("B", "D");

        Assert.assertTrue(condition.matches("C"));
        Assert.assertTrue(condition.matches("D"));
        Assert.assertFalse(condition.matches("E"));
        Assert.assertFalse(condition.matches(3));
    }

    @Test
    public void testBind()
    {
        Assert.assertTrue(DiceCondition.exact("5").bind(DataType.INT).matches(5));
        Assert.assertTrue(DiceCondition.exact(7).bind(DataType.STRING).matches("7"));
        Assert.assertFalse(DiceCondition.exact("abc").bind(DataType.INT).matches(5));
        Assert.assertTrue(DiceCondition.range("6", "8").bind(DataType.INT).matches(7));
        Assert.assertTrue(DiceCondition.range(6.5, 8).bind(DataType.INT).matches(7));
    }

    @Test
    public void testFromJson()
    {
        DiceCondition range = DiceCondition.fromJson(JsonUtils.makeJson("[6, 8]"));
        Assert.assertTrue(range instanceof DiceCondition.RangeMatch);
        Assert.assertEquals(((DiceCondition.RangeMatch) range).getLow(), 6);
        Assert.assertEquals(((DiceCondition.RangeMatch) range).getHigh(), 8);

        DiceCondition exact =
                DiceCondition.fromJson(JsonUtils.makeJson("{'v': 'Medium (9.5-11.5)'}").get("v"));
        Assert.assertTrue(exact instanceof DiceCondition.ExactMatch);
        Assert.assertTrue(exact.matches("Medium (9.5-11.5)"));

        Assert.assertEquals(range.toJson().toString(), "[6,8]");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testMalformedJson()
    {
        DiceCondition.fromJson(JsonUtils.makeJson("[6, 7, 8]"));
    }
}
