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

import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.linkedin.minicube.CubeTestData;

public class TestDelimitedTextLoader
{
    @Test
    public void testHeaderAndRows() throws Exception
    {
        String text = "\"fixed acidity\";\"quality\"\n7.4;5\n\n  \n7.8;6\n";
        List<Map<String, String>> records =
                new DelimitedTextLoader().load(new StringReader(text));

        Assert.assertEquals(records.size(), 2);
        Assert.assertEquals(records.get(0).get("fixed acidity"), "7.4");
        Assert.assertEquals(records.get(1).get("quality"), "6");
    }

    @Test
    public void testByteOrderMark() throws Exception
    {
        String text = "\uFEFF\"fixed acidity\";\"quality\"\n7.4;5\n";
        List<Map<String, String>> records =
                new DelimitedTextLoader().load(new StringReader(text));

        Assert.assertEquals(records.get(0).keySet().iterator().next(), "fixed acidity");
        Assert.assertEquals(records.get(0).get("fixed acidity"), "7.4");
    }

    @Test
    public void testEscapedSeparator() throws Exception
    {
        DelimitedTextLoader loader = new DelimitedTextLoader("\\t");
        Assert.assertEquals(loader.getSeparator(), "\t");

        List<Map<String, String>> records =
                loader.load(new StringReader("a\tb\n1\t2\n"));
        Assert.assertEquals(records.get(0).get("b"), "2");
    }

    @Test
    public void testRegexCharacterSeparator() throws Exception
    {
        List<Map<String, String>> records =
                new DelimitedTextLoader("|").load(new StringReader("a|b\n1|2\n"));
        Assert.assertEquals(records.get(0).get("a"), "1");
    }

    @Test
    public void testFieldCountMismatch()
    {
        try
        {
            new DelimitedTextLoader(",").load(new StringReader("a,b\n1,2\n3\n"));
            Assert.fail();
        }
        catch (IOException e)
        {
            Assert.assertTrue(e.getMessage().startsWith("Line 3"));
        }
    }

    @Test(expectedExceptions = IOException.class)
    public void testNoHeader() throws Exception
    {
        new DelimitedTextLoader().load(new StringReader("\n\n"));
    }

    @Test
    public void testWineSample() throws Exception
    {
        List<Map<String, String>> records = CubeTestData.wineSampleRecords();

        Assert.assertEquals(records.size(), 10);
        Assert.assertEquals(records.get(0).size(), 12);
        Assert.assertEquals(records.get(0).get("free sulfur dioxide"), "11");
        Assert.assertEquals(records.get(9).get("alcohol"), "9.9");
    }
}
