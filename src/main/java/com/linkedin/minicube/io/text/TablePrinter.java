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


package com.linkedin.minicube.io.text;

import java.io.PrintStream;

import org.apache.commons.lang.StringUtils;
import org.apache.pig.data.Tuple;

import com.linkedin.minicube.block.BlockSchema;
import com.linkedin.minicube.operator.ResultTable;
import com.linkedin.minicube.utils.TupleUtils;

/**
 * Renders result tables as fixed width text:
 *
 * <pre>
 * ============================================================
 * Rollup Level 1: quality
 * ============================================================
 * | quality | fixed acidity (AVG) | Count |
 * |---------|---------------------|-------|
 * | 5       | 8.17                | 681   |
 * </pre>
 */
public class TablePrinter
{
    public static final int BANNER_WIDTH = 60;

    private final PrintStream out;

    public TablePrinter(PrintStream out)
    {
        this.out = out;
    }

    public void print(ResultTable table)
    {
        out.print(render(table));
    }

    public void printMessage(String message)
    {
        out.println();
        out.println(message);
    }

    public static String render(ResultTable table)
    {
        BlockSchema schema = table.getSchema();
        int ncols = schema.getNumColumns();
        String[] headers = schema.getColumnNames();

        String[][] cells = new String[table.size()][ncols];
        int[] widths = new int[ncols];
        for (int c = 0; c < ncols; c++)
            widths[c] = headers[c].length();

        for (int r = 0; r < table.size(); r++)
        {
            Tuple row = table.getRow(r);
            for (int c = 0; c < ncols; c++)
            {
                Object value = TupleUtils.get(row, c);
                String cell = value == null ? "" : value.toString();
                if (value != null && table.isPercentColumn(headers[c]))
                    cell += "%";
                cells[r][c] = cell;
                widths[c] = Math.max(widths[c], cell.length());
            }
        }

        String banner = StringUtils.repeat("=", BANNER_WIDTH);
        StringBuilder b = new StringBuilder();
        b.append('\n').append(banner).append('\n');
        b.append(table.getTitle()).append('\n');
        b.append(banner).append('\n');

        appendLine(b, headers, widths);

        b.append('|');
        for (int c = 0; c < ncols; c++)
            b.append(StringUtils.repeat("-", widths[c] + 2)).append('|');
        b.append('\n');

        for (String[] line : cells)
            appendLine(b, line, widths);

        return b.toString();
    }

    private static void appendLine(StringBuilder b, String[] cells, int[] widths)
    {
        b.append('|');
        for (int c = 0; c < cells.length; c++)
            b.append(' ').append(StringUtils.rightPad(cells[c], widths[c])).append(" |");
        b.append('\n');
    }
}
