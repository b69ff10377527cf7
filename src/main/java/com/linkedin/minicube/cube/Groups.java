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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.pig.data.Tuple;

/**
 * Records partitioned by the values of one or more dimensions.
 * <p>
 * Keys are kept in order of first appearance, and the records of a group are kept in
 * input order. A group is created by its first record, so no group is ever empty.
 */
public class Groups
{
    private final String[] dimensions;
    private final Map<DimensionKey, List<Tuple>> groups =
            new LinkedHashMap<DimensionKey, List<Tuple>>();
    private int totalCount;

    Groups(String[] dimensions)
    {
        this.dimensions = dimensions.clone();
    }

    void add(DimensionKey key, Tuple record)
    {
        List<Tuple> group = groups.get(key);
        if (group == null)
        {
            group = new ArrayList<Tuple>();
            groups.put(key, group);
        }

        group.add(record);
        totalCount++;
    }

    /**
     * The grouping dimensions, in key order.
     */
    public String[] getDimensions()
    {
        return dimensions.clone();
    }

    public Set<DimensionKey> keys()
    {
        return Collections.unmodifiableSet(groups.keySet());
    }

    public List<Tuple> get(DimensionKey key)
    {
        List<Tuple> group = groups.get(key);
        return group == null ? null : Collections.unmodifiableList(group);
    }

    /**
     * Number of groups.
     */
    public int size()
    {
        return groups.size();
    }

    /**
     * Number of records over all groups.
     */
    public int getTotalCount()
    {
        return totalCount;
    }

    @Override
    public String toString()
    {
        StringBuilder b = new StringBuilder();
        for (Map.Entry<DimensionKey, List<Tuple>> entry : groups.entrySet())
        {
            b.append("(").append(entry.getKey()).append(") => ");
            b.append(entry.getValue().size()).append("\n");
        }
        return b.toString();
    }
}
