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

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.commons.lang.StringEscapeUtils;
import org.apache.commons.lang.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Reads delimited text with a header row into raw records, one map per data row keyed
 * by the header names.
 * <p>
 * The separator may be given with java escapes (e.g. "\t"). Header names are stripped
 * of surrounding whitespace and double quotes; blank lines are skipped.
 *
 * @author Krishna Puttaswamy
 *
 */
public class DelimitedTextLoader
{
    private static final Log LOG = LogFactory.getLog(DelimitedTextLoader.class);

    public static final String DEFAULT_SEPARATOR = ";";

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final String separator;
    private final Pattern splitter;

    public DelimitedTextLoader()
    {
        this(DEFAULT_SEPARATOR);
    }

    public DelimitedTextLoader(String separator)
    {
        if (separator == null || separator.isEmpty())
            throw new IllegalArgumentException("Separator cannot be empty");

        this.separator = StringEscapeUtils.unescapeJava(separator);
        this.splitter = Pattern.compile(Pattern.quote(this.separator));
    }

    public String getSeparator()
    {
        return separator;
    }

    public List<Map<String, String>> load(File file) throws IOException
    {
        Reader reader = new InputStreamReader(new FileInputStream(file), "UTF-8");
        try
        {
            List<Map<String, String>> records = load(reader);
            LOG.info("Read " + records.size() + " rows from " + file);
            return records;
        }
        finally
        {
            reader.close();
        }
    }

    /**
     * Reads all rows. The reader is not closed.
     *
     * @throws IOException
     *             if the input has no header, or a row has a different number of fields
     *             than the header
     */
    public List<Map<String, String>> load(Reader reader) throws IOException
    {
        BufferedReader in = new BufferedReader(reader);
        List<Map<String, String>> records = new ArrayList<Map<String, String>>();

        String[] header = null;
        String line;
        int lineNumber = 0;
        while ((line = in.readLine()) != null)
        {
            lineNumber++;
            if (header == null && line.startsWith(BYTE_ORDER_MARK))
                line = line.substring(BYTE_ORDER_MARK.length());

            if (StringUtils.isBlank(line))
                continue;

            String[] fields = splitter.split(line, -1);

            if (header == null)
            {
                header = new String[fields.length];
                for (int i = 0; i < fields.length; i++)
                    header[i] = StringUtils.strip(fields[i].trim(), "\"");
                continue;
            }

            if (fields.length != header.length)
                throw new IOException("Line " + lineNumber + " has " + fields.length
                        + " fields. Expected " + header.length);

            Map<String, String> record = new LinkedHashMap<String, String>();
            for (int i = 0; i < fields.length; i++)
                record.put(header[i], fields[i].trim());
            records.add(record);
        }

        if (header == null)
            throw new IOException("Input has no header row");

        return records;
    }
}
