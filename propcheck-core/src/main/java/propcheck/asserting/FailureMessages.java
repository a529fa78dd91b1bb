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

package propcheck.asserting;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import propcheck.api.Prettifier;
import propcheck.check.PropertyArgument;

public class FailureMessages
{
    public static String propertyCheckSucceeded()
    {
        return "Property check succeeded";
    }

    public static String propCheckExhausted(int succeeded, int discarded)
    {
        return "Gave up after " + succeeded + (succeeded == 1 ? " successful property evaluation. " : " successful property evaluations. ")
               + discarded + (discarded == 1 ? " evaluation was discarded." : " evaluations were discarded.");
    }

    public static String propertyException(String exceptionName)
    {
        return exceptionName + " was thrown during property evaluation.";
    }

    public static String propertyFailed(int succeeded)
    {
        return "Property failed after " + succeeded + (succeeded == 1 ? " successful evaluation." : " successful evaluations.");
    }

    public static String thrownExceptionMessage(String message)
    {
        return "Message: " + message;
    }

    public static String thrownExceptionsLocation(String location)
    {
        return "Location: (" + location + ')';
    }

    public static String initSeed(long seed)
    {
        return "Init Seed: " + seed;
    }

    public static String occurredOnValues()
    {
        return "Occurred when passed generated values (";
    }

    /**
     * One line per argument, {@code name = value}, unlabeled arguments named after their position.
     */
    public static String prettyArgs(List<PropertyArgument> args, Prettifier prettifier)
    {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++)
        {
            PropertyArgument arg = args.get(i);
            if (i > 0)
                sb.append('\n');
            sb.append("    ")
              .append(arg.label == null || arg.label.isEmpty() ? "arg" + i : arg.label)
              .append(" = ")
              .append(prettifier.apply(arg.value));
            if (i < args.size() - 1)
                sb.append(',');
        }
        return sb.toString();
    }

    public static String labelDisplay(Collection<String> labels)
    {
        if (labels.isEmpty())
            return "";
        return "\n  " + (labels.size() == 1 ? "Label of failing property:" : "Labels of failing property:") + '\n'
               + labels.stream().map(label -> "    " + label).collect(Collectors.joining("\n"));
    }
}
