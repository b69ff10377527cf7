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

import org.codehaus.jackson.JsonNode;

import com.linkedin.minicube.cube.CubeException;
import com.linkedin.minicube.cube.CubeExceptionType;
import com.linkedin.minicube.utils.JsonUtils;

public class OperatorFactory
{
    public static CubeOperator getOperator(OperatorType type)
    {
        switch (type)
        {
        case ROLLUP:
            return new RollupOperator();
        case DRILLDOWN:
            return new DrilldownOperator();
        case SLICE:
            return new SliceOperator();
        case DICE:
            return new DiceOperator();
        default:
            throw new IllegalArgumentException("Operator [" + type + "] is not supported");
        }
    }

    /**
     * Creates and configures the operator named by the "operator" property of the json.
     */
    public static CubeOperator getOperator(JsonNode json) throws CubeException
    {
        OperatorType type;
        try
        {
            type = OperatorType.valueOf(JsonUtils.getText(json, "operator").trim().toUpperCase());
        }
        catch (IllegalArgumentException e)
        {
            throw new CubeException(CubeExceptionType.INVALID_CONFIG, "Unknown operator in "
                    + json, e);
        }

        CubeOperator operator = getOperator(type);
        operator.configure(json);
        return operator;
    }

    private OperatorFactory()
    {

    }
}
