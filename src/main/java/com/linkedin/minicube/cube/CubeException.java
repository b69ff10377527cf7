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

/**
 * Signals a failure of a cube call that the caller can act on: a record set that does
 * not fit the schema, or an operation referencing names the schema does not declare.
 */
public class CubeException extends Exception
{
    private static final long serialVersionUID = 3920851317326024762L;
    private final CubeExceptionType exceptionType;

    public CubeException(CubeExceptionType exceptionType, String message)
    {
        super(message);
        this.exceptionType = exceptionType;
    }

    public CubeException(CubeExceptionType exceptionType, String message, Throwable cause)
    {
        super(message, cause);
        this.exceptionType = exceptionType;
    }

    public CubeExceptionType getExceptionType()
    {
        return exceptionType;
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder();
        builder.append("CubeException [")
               .append(exceptionType)
               .append("] ")
               .append(getMessage());
        return builder.toString();
    }

}
