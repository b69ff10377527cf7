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

/**
 * The operators supported over a record store.
 *
 * The boolean field specifies if the operator filters the store (and may therefore
 * report "no data") rather than aggregating all of it.
 *
 * @author Maneesh Varshney
 *
 */
public enum OperatorType
{
    ROLLUP(false),
    DRILLDOWN(false),
    SLICE(true),
    DICE(true);

    private final boolean isFilter;

    private OperatorType(boolean isFilter)
    {
        this.isFilter = isFilter;
    }

    public boolean isFilter()
    {
        return isFilter;
    }
}
