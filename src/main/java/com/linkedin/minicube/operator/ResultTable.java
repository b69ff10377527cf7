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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.pig.data.Tuple;
import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.node.ArrayNode;
import org.codehaus.jackson.node.ObjectNode;

import com.linkedin.minicube.block.BlockSchema;
import com.linkedin.minicube.block.ColumnType;
import com.linkedin.minicube.block.DataType;
import com.linkedin.minicube.block.TupleComparator;
import com.linkedin.minicube.utils.JsonUtils;
import com.linkedin.minicube.utils.TupleUtils;

/**
 * An ordered table of typed rows produced by a cube operator.
 * <p>
 * The columns are described by a {@link BlockSchema}; each row is a tuple in that
 * layout. Rendering is left to the caller (see
 * {@link com.linkedin.minicube.io.text.TablePrinter}).
 */
public class ResultTable
{
    private final String title;
    private final BlockSchema schema;
    private final List<Tuple> rows = new ArrayList<Tuple>();
    private final Set<String> percentColumns = new HashSet<String>();

    public ResultTable(String title, BlockSchema schema)
    {
        this.title = title;
        this.schema = schema;
    }

    public ResultTable(String title, ColumnType... columns)
    {
        this(title, new BlockSchema(columns));
    }

    /**
     * Appends a row. The values must match the column types of the table.
     */
    public ResultTable addRow(Object... values)
    {
        if (values.length != schema.getNumColumns())
            throw new IllegalArgumentException("Expected " + schema.getNumColumns()
                    + " values. Found: " + values.length);

        for (int i = 0; i < values.length; i++)
        {
            if (values[i] != null && DataType.getDataType(values[i]) != schema.getType(i))
                throw new IllegalArgumentException("Value " + values[i] + " of column ["
                        + schema.getName(i) + "] is not of type " + schema.getType(i));
        }

        rows.add(TupleUtils.newTuple(values));
        return this;
    }

    /**
     * Sorts the rows ascending on the specified columns, in natural order of the values.
     */
    public ResultTable sort(String... columns)
    {
        Collections.sort(rows, new TupleComparator(schema, columns));
        return this;
    }

    /**
     * Marks a column whose values are percentages, for display.
     */
    public ResultTable setPercentColumn(String column)
    {
        schema.getIndex(column);
        percentColumns.add(column);
        return this;
    }

    public boolean isPercentColumn(String column)
    {
        return percentColumns.contains(column);
    }

    public String getTitle()
    {
        return title;
    }

    public BlockSchema getSchema()
    {
        return schema;
    }

    public List<Tuple> getRows()
    {
        return Collections.unmodifiableList(rows);
    }

    public int size()
    {
        return rows.size();
    }

    public Tuple getRow(int index)
    {
        return rows.get(index);
    }

    public Object getValue(int row, String column)
    {
        return TupleUtils.get(rows.get(row), schema.getIndex(column));
    }

    /**
     * Returns the values of one column, in row order.
     */
    public List<Object> getColumn(String column)
    {
        int index = schema.getIndex(column);
        List<Object> values = new ArrayList<Object>(rows.size());
        for (Tuple row : rows)
            values.add(TupleUtils.get(row, index));
        return values;
    }

    public JsonNode toJson()
    {
        ObjectNode node = JsonUtils.createObjectNode("title", title, "schema", schema.toJson());

        ArrayNode rowsNode = JsonUtils.createArrayNode();
        String[] names = schema.getColumnNames();
        for (Tuple row : rows)
        {
            ObjectNode rowNode = JsonUtils.createObjectNode();
            for (int i = 0; i < names.length; i++)
                rowNode.put(names[i], JsonUtils.valueNode(TupleUtils.get(row, i)));
            rowsNode.add(rowNode);
        }
        node.put("rows", rowsNode);

        return node;
    }

    @Override
    public String toString()
    {
        StringBuilder b = new StringBuilder(title).append(" ").append(schema);
        for (Tuple row : rows)
            b.append("\n").append(row);
        return b.toString();
    }
}
