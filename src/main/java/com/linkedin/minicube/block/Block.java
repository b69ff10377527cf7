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

package com.linkedin.minicube.block;

import org.apache.pig.data.Tuple;

/**
 * A sequence of Tuples sharing one schema.
 *
 * The rows can be retrieved via the {@code next} method, which returns null once the
 * block is exhausted. The returned tuples belong to the underlying store and must not
 * be modified.
 *
 * @author Maneesh Varshney
 *
 */
public interface Block
{
    BlockSchema getSchema();

    Tuple next();

    void rewind();
}
