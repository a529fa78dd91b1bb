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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import propcheck.api.Prettifier;
import propcheck.api.PropertyCheckFailedError;
import propcheck.api.SourcePosition;
import propcheck.check.PropertyArgument;
import propcheck.check.PropertyCheckResult;

/**
 * A {@link PropertyCheckResult} rendered for people: the message to show, and the structured fields a failure
 * carries. Rendering is a pure function of its inputs.
 */
public final class PropertyCheckReport
{
    public final PropertyCheckResult.Kind kind;
    public final String message;
    public final String undecoratedMessage;
    public final List<PropertyArgument> arguments;
    public final List<String> labels;
    @Nullable
    public final Throwable cause;
    @Nullable
    public final SourcePosition position;

    private PropertyCheckReport(PropertyCheckResult.Kind kind, String message, String undecoratedMessage, List<PropertyArgument> arguments,
                                List<String> labels, @Nullable Throwable cause, @Nullable SourcePosition position)
    {
        this.kind = kind;
        this.message = message;
        this.undecoratedMessage = undecoratedMessage;
        this.arguments = ImmutableList.copyOf(arguments);
        this.labels = ImmutableList.copyOf(labels);
        this.cause = cause;
        this.position = position;
    }

    public boolean isSuccess()
    {
        return kind == PropertyCheckResult.Kind.SUCCESS;
    }

    /**
     * @param argNames names to show instead of the recorded labels; ignored unless there is exactly one per argument
     */
    public static PropertyCheckReport render(PropertyCheckResult result, Prettifier prettifier, @Nullable SourcePosition position, @Nullable List<String> argNames)
    {
        switch (result.kind)
        {
            default: throw new AssertionError("Unexpected kind: " + result.kind);
            case SUCCESS:
            {
                String message = FailureMessages.propertyCheckSucceeded();
                return new PropertyCheckReport(result.kind, message, message, result.argumentsUsed, ImmutableList.of(), null, position);
            }
            case EXHAUSTED:
            {
                PropertyCheckResult.Exhausted exhausted = result.asExhausted();
                String message = FailureMessages.propCheckExhausted(exhausted.succeeded, exhausted.discarded);
                return new PropertyCheckReport(result.kind, message, message, ImmutableList.of(), ImmutableList.of(), null, position);
            }
            case FAILURE:
            {
                PropertyCheckResult.Failure failure = result.asFailure();
                List<String> labels = ImmutableList.copyOf(new LinkedHashSet<>(failure.labels));
                String message = failureMessage(failure, labels, prettifier, position, argNames);
                return new PropertyCheckReport(result.kind, message, FailureMessages.propertyFailed(failure.succeeded),
                                               failure.argumentsUsed, labels, failure.cause, position);
            }
        }
    }

    private static String failureMessage(PropertyCheckResult.Failure failure, List<String> labels, Prettifier prettifier,
                                         @Nullable SourcePosition position, @Nullable List<String> argNames)
    {
        Throwable cause = failure.cause;
        String exceptionName = cause == null ? PropertyCheckFailedError.class.getSimpleName() : cause.getClass().getSimpleName();

        StringBuilder sb = new StringBuilder();
        sb.append(FailureMessages.propertyException(exceptionName)).append('\n');
        if (position != null)
            sb.append(" (").append(position.fileNameAndLineNumber()).append(")\n");
        if (cause != null && cause.getMessage() != null)
        {
            // keep multi-line messages aligned under the header
            sb.append("  ").append(FailureMessages.thrownExceptionMessage(cause.getMessage().replace("\n", "\n    "))).append('\n');
        }
        sb.append("  ").append(FailureMessages.propertyFailed(failure.succeeded)).append('\n');
        SourcePosition thrownFrom = cause == null ? null : SourcePosition.thrownFrom(cause);
        if (thrownFrom != null)
            sb.append("  ").append(FailureMessages.thrownExceptionsLocation(thrownFrom.fileNameAndLineNumber())).append('\n');
        sb.append("  ").append(FailureMessages.initSeed(failure.seed)).append('\n');
        sb.append("  ").append(FailureMessages.occurredOnValues()).append('\n');
        sb.append(FailureMessages.prettyArgs(withNames(argNames, failure.argumentsUsed), prettifier)).append('\n');
        sb.append("  )");
        sb.append(FailureMessages.labelDisplay(labels));
        return sb.toString();
    }

    static List<PropertyArgument> withNames(@Nullable List<String> argNames, List<PropertyArgument> args)
    {
        if (argNames == null || argNames.size() != args.size())
            return args;

        List<PropertyArgument> renamed = new ArrayList<>(args.size());
        for (int i = 0; i < args.size(); i++)
            renamed.add(args.get(i).withLabel(argNames.get(i)));
        return renamed;
    }

    public List<Object> argumentValues()
    {
        List<Object> values = new ArrayList<>(arguments.size());
        for (PropertyArgument arg : arguments)
            values.add(arg.value);
        return values;
    }

    public PropertyCheckFailedError toError()
    {
        return new PropertyCheckFailedError(message, undecoratedMessage, cause, position, argumentValues(), labels);
    }

    @Override
    public String toString()
    {
        return message;
    }
}
