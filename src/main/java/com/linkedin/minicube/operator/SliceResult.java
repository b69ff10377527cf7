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
import java.util.Collections;

/**
 * Result of a slice: statistics of the report measures over the matching records, and
 * a sample of those records. A slice that matched nothing has neither table.
 */
public class SliceResult extends OperatorResult
{
    private final ResultTable statistics;
    private final ResultTable sample;

    SliceResult(String message, ResultTable statistics, ResultTable sample)
    {
        super(OperatorType.SLICE, message, Arrays.asList(statistics, sample));
        this.statistics = statistics;
        this.sample = sample;
    }

    private SliceResult(String message)
    {
        super(OperatorType.SLICE, message, false, Collections.<ResultTable> emptyList());
        this.statistics = null;
        this.sample = null;
    }

    static SliceResult noData(String message)
    {
        return new SliceResult(message);
    }

    /**
     * @return the statistics table, or null if the slice matched no record
     */
    public ResultTable getStatistics()
    {
        return statistics;
    }

    /**
     * @return the sample table, or null if the slice matched no record
     */
    public ResultTable getSample()
    {
        return sample;
    }
}
