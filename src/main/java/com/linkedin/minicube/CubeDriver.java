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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.node.ArrayNode;
import org.joda.time.DateTime;
import org.joda.time.Period;

import com.linkedin.minicube.cube.CubeException;
import com.linkedin.minicube.cube.CubeSchema;
import com.linkedin.minicube.io.text.DelimitedTextLoader;
import com.linkedin.minicube.io.text.TablePrinter;
import com.linkedin.minicube.operator.OperatorResult;
import com.linkedin.minicube.operator.ResultTable;
import com.linkedin.minicube.utils.JsonUtils;

/**
 * Command line entry point: loads a delimited file into a cube and runs a list of
 * operators on it.
 *
 * <pre>
 * CubeDriver -i winequality-red.csv [-s ;] [-c cube.json] [-f operations.json] [-j]
 * </pre>
 *
 * Without -c the wine cube is used; without -f the wine demo operations are run.
 *
 * @author Maneesh Varshney
 *
 */
public class CubeDriver
{
    private static final Log LOG = LogFactory.getLog(CubeDriver.class);

    public static final String DEMO_OPERATIONS_RESOURCE = "wine-demo.json";

    public static void main(String[] args) throws Exception
    {
        int status = run(args, System.out, System.err);
        if (status != 0)
            System.exit(status);
    }

    /**
     * Runs the driver and returns the exit status: 0 on success, 1 for usage errors or
     * unreadable input, 2 if the cube rejects the data or an operation.
     */
    public static int run(String[] args, PrintStream out, PrintStream err) throws IOException
    {
        Options options = getOptions();
        CommandLine cmdLine;
        try
        {
            CommandLineParser parser = new PosixParser();
            cmdLine = parser.parse(options, args);
        }
        catch (ParseException e)
        {
            err.println(e.getMessage());
            printHelp(options, err);
            return 1;
        }

        if (cmdLine.hasOption("h"))
        {
            printHelp(options, out);
            return 0;
        }

        if (!cmdLine.hasOption("i"))
        {
            err.println("Input file not specified");
            printHelp(options, err);
            return 1;
        }

        File input = new File(cmdLine.getOptionValue("i"));
        if (!input.isFile())
        {
            err.println("Error: File '" + input + "' not found");
            return 1;
        }

        DelimitedTextLoader loader =
                new DelimitedTextLoader(cmdLine.getOptionValue("s",
                                                               DelimitedTextLoader.DEFAULT_SEPARATOR));

        try
        {
            CubeSchema schema =
                    cmdLine.hasOption("c")
                            ? CubeSchema.fromJson(readJson(cmdLine.getOptionValue("c")))
                            : CubeSchema.wine();

            JsonNode operations =
                    cmdLine.hasOption("f") ? readJson(cmdLine.getOptionValue("f"))
                            : JsonUtils.readResource(DEMO_OPERATIONS_RESOURCE);
            if (!operations.isArray())
                throw new IOException("Operations file must hold a json array");

            List<Map<String, String>> rawRecords = loader.load(input);
            OlapCube cube = OlapCube.load(rawRecords, schema);
            LOG.info("Running " + operations.size() + " operations on " + schema);

            DateTime start = new DateTime();
            List<OperatorResult> results = cube.executeAll(operations);
            LOG.info("Finished " + results.size() + " operations in "
                    + new Period(start, new DateTime()));

            if (cmdLine.hasOption("j"))
                printJson(results, out);
            else
                printText(results, out);
        }
        catch (CubeException e)
        {
            err.println("Error: " + e.getMessage());
            return 2;
        }
        catch (IOException e)
        {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        return 0;
    }

    private static JsonNode readJson(String path) throws IOException
    {
        File file = new File(path);
        if (!file.isFile())
            throw new IOException("File '" + path + "' not found");
        return JsonUtils.readJson(file);
    }

    private static void printText(List<OperatorResult> results, PrintStream out)
    {
        TablePrinter printer = new TablePrinter(out);
        for (OperatorResult result : results)
        {
            printer.printMessage(result.getMessage());
            for (ResultTable table : result.getTables())
                printer.print(table);
        }
    }

    private static void printJson(List<OperatorResult> results, PrintStream out) throws IOException
    {
        ArrayNode array = JsonUtils.createArrayNode();
        for (OperatorResult result : results)
            array.add(result.toJson());

        out.println(JsonUtils.getMapper().writerWithDefaultPrettyPrinter().writeValueAsString(array));
    }

    @SuppressWarnings("static-access")
    private static Options getOptions()
    {
        Options options = new Options();

        options.addOption(OptionBuilder.withArgName("file")
                                       .hasArg()
                                       .withDescription("delimited input file with a header row")
                                       .withLongOpt("input")
                                       .create("i"));
        options.addOption(OptionBuilder.withArgName("separator")
                                       .hasArg()
                                       .withDescription("field separator (default ;)")
                                       .withLongOpt("separator")
                                       .create("s"));
        options.addOption(OptionBuilder.withArgName("json file")
                                       .hasArg()
                                       .withDescription("cube schema (default: the wine cube)")
                                       .withLongOpt("schema")
                                       .create("c"));
        options.addOption(OptionBuilder.withArgName("json file")
                                       .hasArg()
                                       .withDescription("operations to run (default: the wine demo)")
                                       .withLongOpt("operations")
                                       .create("f"));
        options.addOption("j", "json", false, "print the results in JSON");
        options.addOption("h", "help", false, "shows this message");

        return options;
    }

    private static void printHelp(Options options, PrintStream stream)
    {
        HelpFormatter formatter = new HelpFormatter();
        PrintWriter writer = new PrintWriter(stream);
        formatter.printHelp(writer,
                            HelpFormatter.DEFAULT_WIDTH,
                            "CubeDriver -i <input file> [options]",
                            null,
                            options,
                            HelpFormatter.DEFAULT_LEFT_PAD,
                            HelpFormatter.DEFAULT_DESC_PAD,
                            null);
        writer.flush();
    }
}
