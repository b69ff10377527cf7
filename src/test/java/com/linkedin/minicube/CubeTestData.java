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


package com.linkedin.minicube;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.linkedin.minicube.block.DataType;
import com.linkedin.minicube.classify.WineClassifiers;
import com.linkedin.minicube.cube.CubeException;
import com.linkedin.minicube.cube.CubeSchema;
import com.linkedin.minicube.cube.DerivedDimension;
import com.linkedin.minicube.cube.RecordStore;
import com.linkedin.minicube.io.text.DelimitedTextLoader;

/**
 * Schemas and records shared by the tests.
 */
public class CubeTestData
{
    public static final String WINE_SAMPLE = "wine-sample.csv";

    /**
     * A small cube: raw dimension quality, derived alcohol_range and pH_range, measures
     * alcohol, pH and fixed acidity.
     */
    public static CubeSchema miniSchema() throws CubeException
    {
        return new CubeSchema.Builder().column("alcohol", DataType.DOUBLE)
                                       .column("pH", DataType.DOUBLE)
                                       .column("fixed acidity", DataType.DOUBLE)
                                       .column("quality", DataType.INT)
                                       .dimensions("quality")
                                       .measures("alcohol", "pH", "fixed acidity")
                                       .derivedDimension(new DerivedDimension("alcohol_range",
                                                                              "alcohol",
                                                                              WineClassifiers.ALCOHOL))
                                       .derivedDimension(new DerivedDimension("pH_range",
                                                                              "pH",
                                                                              WineClassifiers.PH))
                                       .sampleColumns("quality", "alcohol")
                                       .reportMeasures("fixed acidity")
                                       .distributionDimension("quality")
                                       .build();
    }

    /**
     * Raw records for {@link #miniSchema()}, one row of {alcohol, pH, fixed acidity,
     * quality} each.
     */
    public static List<Map<String, String>> miniRecords(String[]... rows)
    {
        String[] header = { "alcohol", "pH", "fixed acidity", "quality" };
        List<Map<String, String>> records = new ArrayList<Map<String, String>>();
        for (String[] row : rows)
        {
            Map<String, String> record = new LinkedHashMap<String, String>();
            for (int i = 0; i < header.length; i++)
                record.put(header[i], row[i]);
            records.add(record);
        }
        return records;
    }

    public static RecordStore miniStore(String[]... rows) throws CubeException
    {
        return RecordStore.load(miniRecords(rows), miniSchema());
    }

    public static List<Map<String, String>> wineSampleRecords() throws IOException
    {
        Reader reader =
                new InputStreamReader(CubeTestData.class.getClassLoader()
                                                        .getResourceAsStream(WINE_SAMPLE),
                                      "UTF-8");
        try
        {
            return new DelimitedTextLoader().load(reader);
        }
        finally
        {
            reader.close();
        }
    }

    /**
     * The ten rows of the bundled sample, loaded with the wine cube.
     */
    public static RecordStore wineSampleStore() throws IOException,
            CubeException
    {
        return RecordStore.load(wineSampleRecords(), CubeSchema.wine());
    }

    private CubeTestData()
    {

    }
}
