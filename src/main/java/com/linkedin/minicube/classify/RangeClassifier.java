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

import java.util.Arrays;

import org.codehaus.jackson.JsonNode;

import com.linkedin.minicube.utils.JsonUtils;

/**
 * Classifies values into half-open buckets {@code [lo, hi)}.
 * <p>
 * With boundaries {@code b0 < b1 < ... < bn-1}, a value gets the first label whose
 * upper boundary it is strictly less than; a value at or above the last boundary gets
 * the last label. A value equal to a boundary therefore always falls into the upper
 * bucket. NaN compares false against every boundary and lands in the last bucket.
 *
 * The json form is
 *
 * <pre>
 * { "boundaries": [9.5, 11.5], "labels": ["Low", "Medium", "High"] }
 * </pre>
 */
public class RangeClassifier implements DimensionClassifier
{
    private final double[] boundaries;
    private final String[] labels;

    public RangeClassifier(double[] boundaries, String[] labels)
    {
        if (boundaries == null || labels == null)
            throw new IllegalArgumentException("boundaries and labels are required");

        if (labels.length != boundaries.length + 1)
            throw new IllegalArgumentException("Expected " + (boundaries.length + 1)
                    + " labels for " + boundaries.length + " boundaries. Found: "
                    + labels.length);

        for (int i = 0; i < boundaries.length; i++)
        {
            if (Double.isNaN(boundaries[i]))
                throw new IllegalArgumentException("Boundary cannot be NaN");
            if (i > 0 && boundaries[i] <= boundaries[i - 1])
                throw new IllegalArgumentException("Boundaries must be strictly ascending: "
                        + Arrays.toString(boundaries));
        }

        for (String label : labels)
            if (label == null)
                throw new IllegalArgumentException("Labels cannot be null");

        this.boundaries = boundaries.clone();
        this.labels = labels.clone();
    }

    public RangeClassifier(JsonNode json)
    {
        this(JsonUtils.asDoubleArray(JsonUtils.get(json, "boundaries")),
             JsonUtils.asArray(JsonUtils.get(json, "labels")));
    }

    @Override
    public String classify(double value)
    {
        for (int i = 0; i < boundaries.length; i++)
        {
            if (value < boundaries[i])
                return labels[i];
        }

        return labels[labels.length - 1];
    }

    /**
     * Returns the labels in bucket order.
     */
    public String[] getLabels()
    {
        return labels.clone();
    }

    @Override
    public String toString()
    {
        return "RangeClassifier " + Arrays.toString(boundaries) + " "
                + Arrays.toString(labels);
    }
}
