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


package com.linkedin.minicube.classify;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.linkedin.minicube.utils.JsonUtils;

public class TestRangeClassifier
{
    @Test
    public void testBoundariesBelongToUpperBucket()
    {
        RangeClassifier classifier =
                new RangeClassifier(new double[] { 10, 20 }, new String[] { "a", "b", "c" });

        Assert.assertEquals(classifier.classify(-5), "a");
        Assert.assertEquals(classifier.classify(9.999), "a");
        Assert.assertEquals(classifier.classify(10), "b");
        Assert.assertEquals(classifier.classify(19.999), "b");
        Assert.assertEquals(classifier.classify(20), "c");
        Assert.assertEquals(classifier.classify(Double.POSITIVE_INFINITY), "c");
    }

    @Test
    public void testNaNFallsInLastBucket()
    {
        RangeClassifier classifier =
                new RangeClassifier(new double[] { 1 }, new String[] { "low", "high" });
        Assert.assertEquals(classifier.classify(Double.NaN), "high");
    }

    @Test
    public void testFromJson()
    {
        RangeClassifier classifier =
                new RangeClassifier(JsonUtils.makeJson("{'boundaries': [0.5], 'labels': ['small', 'large']}"));

        Assert.assertEquals(classifier.classify(0.4), "small");
        Assert.assertEquals(classifier.classify(0.5), "large");
        Assert.assertEquals(classifier.getLabels(), new String[] { "small", "large" });
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testLabelCountMismatch()
    {
        new RangeClassifier(new double[] { 1, 2 }, new String[] { "a", "b" });
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testBoundariesNotAscending()
    {
        new RangeClassifier(new double[] { 2, 1 }, new String[] { "a", "b", "c" });
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonNumericBoundary()
    {
        new RangeClassifier(JsonUtils.makeJson("{'boundaries': ['x'], 'labels': ['a', 'b']}"));
    }
}
