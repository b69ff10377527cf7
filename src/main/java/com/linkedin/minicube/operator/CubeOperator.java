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
import com.linkedin.minicube.cube.RecordStore;

/**
 * Interface for operators that compute result tables from a record store.
 * <p>
 * An operator is configured either through its typed constructor or through
 * {@link #configure(JsonNode)}, and can then be run any number of times. Running never
 * modifies the store.
 *
 * @author Maneesh Varshney
 *
 */
public interface CubeOperator
{
    void configure(JsonNode json) throws CubeException;

    OperatorResult run(RecordStore store) throws CubeException;

    OperatorType getType();
}
