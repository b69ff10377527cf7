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

/**
 * Classifiers for the wine quality dataset.
 */
public class WineClassifiers
{
    public static final DimensionClassifier ALCOHOL =
            new RangeClassifier(new double[] { 9.5, 11.5 },
                                new String[] { "Low (< 9.5)", "Medium (9.5-11.5)",
                                        "High (> 11.5)" });

    public static final DimensionClassifier PH =
            new RangeClassifier(new double[] { 3.2, 3.4 },
                                new String[] { "Very Acidic (< 3.2)", "Acidic (3.2-3.4)",
                                        "Less Acidic (> 3.4)" });

    public static final DimensionClassifier DENSITY =
            new RangeClassifier(new double[] { 0.996, 0.998 },
                                new String[] { "Light (< 0.996)", "Medium (0.996-0.998)",
                                        "Heavy (> 0.998)" });

    /**
     * Looks up a classifier by name ("alcohol", "pH" or "density", case insensitive).
     *
     * @param name
     * @return the classifier, or null if there is no classifier of that name
     */
    public static DimensionClassifier get(String name)
    {
        if ("alcohol".equalsIgnoreCase(name))
            return ALCOHOL;
        if ("ph".equalsIgnoreCase(name))
            return PH;
        if ("density".equalsIgnoreCase(name))
            return DENSITY;

        return null;
    }

    private WineClassifiers()
    {

    }
}
