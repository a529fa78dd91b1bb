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

package propcheck.check;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

/**
 * The terminal state of one property check: it either proved the property often enough ({@link Success}), gave up
 * because too many evaluations were discarded ({@link Exhausted}), or found a counter example ({@link Failure}).
 * <p>
 * Every variant records the arguments of the last evaluation, and the seed the check started from.
 */
public abstract class PropertyCheckResult
{
    public enum Kind { SUCCESS, FAILURE, EXHAUSTED }

    public final Kind kind;
    public final long seed;
    public final List<PropertyArgument> argumentsUsed;

    private PropertyCheckResult(Kind kind, long seed, List<PropertyArgument> argumentsUsed)
    {
        this.kind = kind;
        this.seed = seed;
        this.argumentsUsed = ImmutableList.copyOf(argumentsUsed);
    }

    public boolean isSuccess()
    {
        return kind == Kind.SUCCESS;
    }

    public boolean isFailure()
    {
        return kind == Kind.FAILURE;
    }

    public boolean isExhausted()
    {
        return kind == Kind.EXHAUSTED;
    }

    public Success asSuccess()
    {
        return (Success) this;
    }

    public Failure asFailure()
    {
        return (Failure) this;
    }

    public Exhausted asExhausted()
    {
        return (Exhausted) this;
    }

    public static final class Success extends PropertyCheckResult
    {
        public Success(long seed, List<PropertyArgument> argumentsUsed)
        {
            super(Kind.SUCCESS, seed, argumentsUsed);
        }

        @Override
        public String toString()
        {
            return "Success{args=" + argumentsUsed + '}';
        }
    }

    public static final class Failure extends PropertyCheckResult
    {
        public final int succeeded;
        @Nullable
        public final Throwable cause;
        public final List<String> names;
        public final List<String> labels;

        public Failure(long seed, int succeeded, @Nullable Throwable cause, List<String> names, List<PropertyArgument> argumentsUsed)
        {
            this(seed, succeeded, cause, names, argumentsUsed, ImmutableList.of());
        }

        public Failure(long seed, int succeeded, @Nullable Throwable cause, List<String> names, List<PropertyArgument> argumentsUsed, List<String> labels)
        {
            super(Kind.FAILURE, seed, argumentsUsed);
            this.succeeded = succeeded;
            this.cause = cause;
            this.names = ImmutableList.copyOf(names);
            this.labels = ImmutableList.copyOf(labels);
        }

        public Optional<Throwable> cause()
        {
            return Optional.ofNullable(cause);
        }

        @Override
        public String toString()
        {
            return "Failure{succeeded=" + succeeded + ", cause=" + cause + ", args=" + argumentsUsed + '}';
        }
    }

    public static final class Exhausted extends PropertyCheckResult
    {
        public final int succeeded;
        public final int discarded;
        public final List<String> names;

        public Exhausted(long seed, int succeeded, int discarded, List<String> names, List<PropertyArgument> argumentsUsed)
        {
            super(Kind.EXHAUSTED, seed, argumentsUsed);
            this.succeeded = succeeded;
            this.discarded = discarded;
            this.names = ImmutableList.copyOf(names);
        }

        @Override
        public String toString()
        {
            return "Exhausted{succeeded=" + succeeded + ", discarded=" + discarded + ", args=" + argumentsUsed + '}';
        }
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PropertyCheckResult that = (PropertyCheckResult) o;
        if (seed != that.seed || !argumentsUsed.equals(that.argumentsUsed))
            return false;
        switch (kind)
        {
            default: throw new AssertionError("Unexpected kind: " + kind);
            case SUCCESS:
                return true;
            case FAILURE:
                Failure failure = (Failure) this, otherFailure = (Failure) that;
                return failure.succeeded == otherFailure.succeeded
                       && Objects.equals(failure.cause, otherFailure.cause)
                       && failure.names.equals(otherFailure.names)
                       && failure.labels.equals(otherFailure.labels);
            case EXHAUSTED:
                Exhausted exhausted = (Exhausted) this, otherExhausted = (Exhausted) that;
                return exhausted.succeeded == otherExhausted.succeeded
                       && exhausted.discarded == otherExhausted.discarded
                       && exhausted.names.equals(otherExhausted.names);
        }
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, seed, argumentsUsed);
    }
}
