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

package propcheck.api;

import java.util.Arrays;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Renders generated values for failure messages.
 */
@FunctionalInterface
public interface Prettifier
{
    String apply(Object value);

    Prettifier DEFAULT = Prettifier::prettify;

    static String prettify(Object value)
    {
        if (value == null)
            return "null";
        if (value instanceof String)
            return '"' + (String) value + '"';
        if (value instanceof Character)
            return "'" + value + "'";
        // one day java arrays will have a useful toString... one day...
        if (value.getClass().isArray())
        {
            Class<?> subType = value.getClass().getComponentType();
            if (!subType.isPrimitive())
                return Arrays.stream((Object[]) value).map(Prettifier::prettify).collect(Collectors.joining(", ", "[", "]"));
            if (Byte.TYPE == subType)
                return Arrays.toString((byte[]) value);
            if (Character.TYPE == subType)
                return Arrays.toString((char[]) value);
            if (Short.TYPE == subType)
                return Arrays.toString((short[]) value);
            if (Integer.TYPE == subType)
                return Arrays.toString((int[]) value);
            if (Long.TYPE == subType)
                return Arrays.toString((long[]) value);
            if (Float.TYPE == subType)
                return Arrays.toString((float[]) value);
            if (Double.TYPE == subType)
                return Arrays.toString((double[]) value);
            if (Boolean.TYPE == subType)
                return Arrays.toString((boolean[]) value);
        }
        try
        {
            String result = value.toString();
            if (result != null && result.length() > 100 && value instanceof Collection)
                result = ((Collection<?>) value).stream().map(o -> "\n\t     " + prettify(o)).collect(Collectors.joining(",", "[", "]"));
            return result;
        }
        catch (Throwable t)
        {
            return "Object.toString failed: " + t.getClass().getCanonicalName() + ": " + t.getMessage();
        }
    }
}
