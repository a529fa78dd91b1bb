/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package propcheck.utils;

import net.nicoulaj.compilecommand.annotations.Inline;

public class Invariants
{
    public static <T> T nonNull(T param)
    {
        if (param == null)
            throw new NullPointerException();
        return param;
    }

    public static <T> T nonNull(T param, String name)
    {
        if (param == null)
            throw new NullPointerException(name + " must not be null");
        return param;
    }

    @Inline
    public static int isNatural(int input, String name)
    {
        if (input < 0)
            throw new IllegalArgumentException(String.format("%s (%d) must not be negative", name, input));
        return input;
    }

    @Inline
    public static int isPositive(int input, String name)
    {
        if (input <= 0)
            throw new IllegalArgumentException(String.format("%s (%d) must be positive", name, input));
        return input;
    }

    @Inline
    public static double isPositive(double input, String name)
    {
        if (!(input > 0))
            throw new IllegalArgumentException(String.format("%s (%s) must be positive", name, input));
        return input;
    }

    public static void checkArgument(boolean condition, String msg)
    {
        if (!condition)
            throw new IllegalArgumentException(msg);
    }

    public static void checkArgument(boolean condition, String fmt, Object... args)
    {
        if (!condition)
            throw new IllegalArgumentException(String.format(fmt, args));
    }
}
