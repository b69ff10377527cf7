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

package com.linkedin.minicube.classify;

/**
 * Maps a continuous value to a discrete dimension label.
 * <p>
 * Implementations must be pure: the same input always yields the same label, and every
 * double (negative, zero, infinite or NaN) yields some label.
 *
 * @see RangeClassifier
 * @see WineClassifiers
 */
public interface DimensionClassifier
{
    String classify(double value);
}
