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

import org.codehaus.jackson.JsonNode;

import com.linkedin.minicube.classify.DimensionClassifier;
import com.linkedin.minicube.classify.RangeClassifier;
import com.linkedin.minicube.classify.WineClassifiers;
import com.linkedin.minicube.utils.JsonUtils;

/**
 * A dimension whose label is computed from a numeric source column when the record is
 * loaded.
 */
public class DerivedDimension
{
    private final String name;
    private final String sourceColumn;
    private final DimensionClassifier classifier;

    public DerivedDimension(String name, String sourceColumn, DimensionClassifier classifier)
    {
        if (name == null || sourceColumn == null || classifier == null)
            throw new IllegalArgumentException("name, source column and classifier are required");

        this.name = name;
        this.sourceColumn = sourceColumn;
        this.classifier = classifier;
    }

    /**
     * Creates a derived dimension from json. The classifier is either a built-in one
     * named by the "classifier" property, or a {@link RangeClassifier} described inline
     * by "boundaries" and "labels".
     *
     * @param json
     * @throws CubeException
     *             if the classifier cannot be resolved
     */
    public static DerivedDimension fromJson(JsonNode json) throws CubeException
    {
        String name = JsonUtils.getText(json, "name");
        String source = JsonUtils.getText(json, "source");

        DimensionClassifier classifier;
        try
        {
            if (json.has("classifier"))
            {
                String classifierName = JsonUtils.getText(json, "classifier");
                classifier = WineClassifiers.get(classifierName);
                if (classifier == null)
                    throw new CubeException(CubeExceptionType.INVALID_SCHEMA,
                                            "Unknown classifier [" + classifierName
                                                    + "] for dimension " + name);
            }
            else
            {
                classifier = new RangeClassifier(json);
            }
        }
        catch (IllegalArgumentException e)
        {
            throw new CubeException(CubeExceptionType.INVALID_SCHEMA,
                                    "Invalid classifier for dimension " + name + ": "
                                            + e.getMessage(),
                                    e);
        }

        return new DerivedDimension(name, source, classifier);
    }

    public String getName()
    {
        return name;
    }

    public String getSourceColumn()
    {
        return sourceColumn;
    }

    public DimensionClassifier getClassifier()
    {
        return classifier;
    }

    public String classify(double value)
    {
        return classifier.classify(value);
    }

    @Override
    public String toString()
    {
        return name + " <- " + sourceColumn;
    }
}
