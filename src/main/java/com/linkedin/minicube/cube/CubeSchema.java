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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.codehaus.jackson.JsonNode;

import com.linkedin.minicube.block.BlockSchema;
import com.linkedin.minicube.block.ColumnType;
import com.linkedin.minicube.block.DataType;
import com.linkedin.minicube.utils.JsonUtils;

/**
 * Declares the columns of a dataset and their roles in the cube.
 * <p>
 * The source columns are read from every raw record. Some of them are raw
 * <em>dimensions</em>, some are <em>measures</em> (numeric, aggregatable), and the rest
 * are plain attributes. <em>Derived dimensions</em> are STRING columns appended after the
 * source columns, each computed by a classifier from a numeric source column.
 * <p>
 * The json form is
 *
 * <pre>
 * {
 *   "columns": [ {"name": "alcohol", "type": "DOUBLE"}, {"name": "quality", "type": "INT"} ],
 *   "dimensions": ["quality"],
 *   "measures": ["alcohol"],
 *   "derivedDimensions": [ {"name": "alcohol_range", "source": "alcohol", "classifier": "alcohol"} ],
 *   "sampleColumns": ["quality", "alcohol"],
 *   "reportMeasures": ["alcohol"],
 *   "distributionDimension": "quality"
 * }
 * </pre>
 */
public class CubeSchema
{
    public static final String WINE_SCHEMA_RESOURCE = "wine-cube.json";

    private final BlockSchema sourceSchema;
    private final BlockSchema recordSchema;
    private final List<String> rawDimensions;
    private final List<DerivedDimension> derivedDimensions;
    private final Map<String, DataType> dimensions;
    private final List<String> measures;
    private final List<String> sampleColumns;
    private final List<String> reportMeasures;
    private final String distributionDimension;

    private CubeSchema(Builder builder) throws CubeException
    {
        if (builder.columns.isEmpty())
            throw new CubeException(CubeExceptionType.INVALID_SCHEMA,
                                    "At least one source column must be declared");

        try
        {
            sourceSchema =
                    new BlockSchema(builder.columns.toArray(new ColumnType[builder.columns.size()]));
        }
        catch (IllegalArgumentException e)
        {
            throw new CubeException(CubeExceptionType.INVALID_SCHEMA, e.getMessage(), e);
        }

        rawDimensions = Collections.unmodifiableList(new ArrayList<String>(builder.dimensions));
        derivedDimensions =
                Collections.unmodifiableList(new ArrayList<DerivedDimension>(builder.derivedDimensions));
        measures = Collections.unmodifiableList(new ArrayList<String>(builder.measures));

        Map<String, DataType> dims = new LinkedHashMap<String, DataType>();
        for (String dim : rawDimensions)
        {
            if (!sourceSchema.hasIndex(dim))
                throw new CubeException(CubeExceptionType.INVALID_SCHEMA, "Dimension [" + dim
                        + "] is not a declared column");
            if (dims.put(dim, sourceSchema.getType(dim)) != null)
                throw new CubeException(CubeExceptionType.INVALID_SCHEMA, "Dimension [" + dim
                        + "] is declared more than once");
        }

        Set<String> measureSet = new HashSet<String>();
        for (String measure : measures)
        {
            if (!sourceSchema.hasIndex(measure))
                throw new CubeException(CubeExceptionType.INVALID_SCHEMA, "Measure ["
                        + measure + "] is not a declared column");
            if (!sourceSchema.getType(measure).isNumerical())
                throw new CubeException(CubeExceptionType.INVALID_SCHEMA, "Measure ["
                        + measure + "] must be numerical. Found: "
                        + sourceSchema.getType(measure));
            if (dims.containsKey(measure) || !measureSet.add(measure))
                throw new CubeException(CubeExceptionType.INVALID_SCHEMA, "Measure ["
                        + measure + "] is declared more than once");
        }

        List<ColumnType> derivedColumns = new ArrayList<ColumnType>();
        for (DerivedDimension derived : derivedDimensions)
        {
            String source = derived.getSourceColumn();
            if (!sourceSchema.hasIndex(source) || !sourceSchema.getType(source).isNumerical())
                throw new CubeException(CubeExceptionType.INVALID_SCHEMA,
                                        "Derived dimension [" + derived.getName()
                                                + "] needs a numerical source column. Found: "
                                                + source);
            if (sourceSchema.hasIndex(derived.getName())
                    || dims.put(derived.getName(), DataType.STRING) != null)
                throw new CubeException(CubeExceptionType.INVALID_SCHEMA, "Dimension ["
                        + derived.getName() + "] is declared more than once");

            derivedColumns.add(new ColumnType(derived.getName(), DataType.STRING));
        }

        dimensions = Collections.unmodifiableMap(dims);
        recordSchema =
                sourceSchema.append(new BlockSchema(derivedColumns.toArray(new ColumnType[derivedColumns.size()])));

        sampleColumns = Collections.unmodifiableList(new ArrayList<String>(builder.sampleColumns));
        for (String column : sampleColumns)
        {
            if (!recordSchema.hasIndex(column))
                throw new CubeException(CubeExceptionType.INVALID_SCHEMA, "Sample column ["
                        + column + "] is not a declared column");
        }

        reportMeasures = Collections.unmodifiableList(new ArrayList<String>(builder.reportMeasures));
        for (String measure : reportMeasures)
        {
            if (!measureSet.contains(measure))
                throw new CubeException(CubeExceptionType.INVALID_SCHEMA, "Report measure ["
                        + measure + "] is not a declared measure");
        }

        distributionDimension = builder.distributionDimension;
        if (distributionDimension != null && !dimensions.containsKey(distributionDimension))
            throw new CubeException(CubeExceptionType.INVALID_SCHEMA,
                                    "Distribution dimension [" + distributionDimension
                                            + "] is not a declared dimension");
    }

    public static CubeSchema fromJson(JsonNode json) throws CubeException
    {
        try
        {
            Builder builder = new Builder();

            for (JsonNode column : JsonUtils.get(json, "columns"))
                builder.column(new ColumnType(column));

            String[] dims = JsonUtils.asArray(json, "dimensions");
            if (dims != null)
                builder.dimensions(dims);

            builder.measures(JsonUtils.asArray(JsonUtils.get(json, "measures")));

            if (json.has("derivedDimensions"))
            {
                for (JsonNode derived : json.get("derivedDimensions"))
                    builder.derivedDimension(DerivedDimension.fromJson(derived));
            }

            String[] sample = JsonUtils.asArray(json, "sampleColumns");
            if (sample != null)
                builder.sampleColumns(sample);

            String[] report = JsonUtils.asArray(json, "reportMeasures");
            if (report != null)
                builder.reportMeasures(report);

            builder.distributionDimension(JsonUtils.getText(json,
                                                            "distributionDimension",
                                                            null));

            return builder.build();
        }
        catch (IllegalArgumentException e)
        {
            throw new CubeException(CubeExceptionType.INVALID_SCHEMA,
                                    "Malformed cube schema: " + e.getMessage(),
                                    e);
        }
    }

    /**
     * Returns the schema of the wine quality dataset bundled with this library.
     */
    public static CubeSchema wine() throws CubeException,
            IOException
    {
        return fromJson(JsonUtils.readResource(WINE_SCHEMA_RESOURCE));
    }

    /**
     * The columns read from raw records.
     */
    public BlockSchema getSourceSchema()
    {
        return sourceSchema;
    }

    /**
     * The layout of the stored record tuples: the source columns followed by the derived
     * dimensions.
     */
    public BlockSchema getRecordSchema()
    {
        return recordSchema;
    }

    public List<String> getRawDimensions()
    {
        return rawDimensions;
    }

    public List<DerivedDimension> getDerivedDimensions()
    {
        return derivedDimensions;
    }

    /**
     * All dimension names, raw dimensions first.
     */
    public List<String> getDimensions()
    {
        return new ArrayList<String>(dimensions.keySet());
    }

    public List<String> getMeasures()
    {
        return measures;
    }

    public List<String> getSampleColumns()
    {
        return sampleColumns;
    }

    public List<String> getReportMeasures()
    {
        return reportMeasures;
    }

    public String getDistributionDimension()
    {
        return distributionDimension;
    }

    public boolean isDimension(String name)
    {
        return dimensions.containsKey(name);
    }

    public boolean isMeasure(String name)
    {
        return measures.contains(name);
    }

    public DataType getDimensionType(String name) throws CubeException
    {
        checkDimension(name);
        return dimensions.get(name);
    }

    public void checkDimension(String name) throws CubeException
    {
        if (!isDimension(name))
            throw new CubeException(CubeExceptionType.UNKNOWN_DIMENSION, "Dimension ["
                    + name + "] is not part of the cube. Available: " + dimensions.keySet());
    }

    public void checkMeasure(String name) throws CubeException
    {
        if (!isMeasure(name))
            throw new CubeException(CubeExceptionType.UNKNOWN_MEASURE, "Measure [" + name
                    + "] is not part of the cube. Available: " + measures);
    }

    /**
     * Validates an ordered list of grouping dimensions: every name must be a declared
     * dimension and no name may repeat.
     */
    public void checkDimensions(String[] names) throws CubeException
    {
        if (names == null || names.length == 0)
            throw new CubeException(CubeExceptionType.INVALID_CONFIG,
                                    "At least one dimension is required");

        Set<String> seen = new HashSet<String>();
        for (String name : names)
        {
            checkDimension(name);
            if (!seen.add(name))
                throw new CubeException(CubeExceptionType.DUPLICATE_DIMENSION,
                                        "Dimension [" + name + "] is repeated in "
                                                + Arrays.toString(names));
        }
    }

    @Override
    public String toString()
    {
        return "CubeSchema [dimensions=" + dimensions.keySet() + ", measures=" + measures
                + "]";
    }

    /**
     * Assembles a {@link CubeSchema}; the declarations are validated by {@link #build()}.
     */
    public static class Builder
    {
        private final List<ColumnType> columns = new ArrayList<ColumnType>();
        private final List<String> dimensions = new ArrayList<String>();
        private final List<String> measures = new ArrayList<String>();
        private final List<DerivedDimension> derivedDimensions =
                new ArrayList<DerivedDimension>();
        private final List<String> sampleColumns = new ArrayList<String>();
        private final List<String> reportMeasures = new ArrayList<String>();
        private String distributionDimension;

        public Builder column(ColumnType column)
        {
            columns.add(column);
            return this;
        }

        public Builder column(String name, DataType type)
        {
            return column(new ColumnType(name, type));
        }

        public Builder dimensions(String... names)
        {
            dimensions.addAll(Arrays.asList(names));
            return this;
        }

        public Builder measures(String... names)
        {
            measures.addAll(Arrays.asList(names));
            return this;
        }

        public Builder derivedDimension(DerivedDimension derived)
        {
            derivedDimensions.add(derived);
            return this;
        }

        public Builder sampleColumns(String... names)
        {
            sampleColumns.addAll(Arrays.asList(names));
            return this;
        }

        public Builder reportMeasures(String... names)
        {
            reportMeasures.addAll(Arrays.asList(names));
            return this;
        }

        public Builder distributionDimension(String name)
        {
            distributionDimension = name;
            return this;
        }

        public CubeSchema build() throws CubeException
        {
            return new CubeSchema(this);
        }
    }
}
