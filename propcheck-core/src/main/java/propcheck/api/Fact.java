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

import java.util.Objects;
import java.util.function.Supplier;
import javax.annotation.Nullable;

import propcheck.utils.Invariants;

/**
 * A ternary verdict: {@code Yes}, {@code No}, or a vacuous {@code Yes} (a yes that proves nothing because its
 * precondition did not hold). Expectation style property checks discard vacuous facts, count yes facts as successes,
 * and fail on the first no.
 */
public final class Fact
{
    public enum Kind { YES, VACUOUS_YES, NO }

    public final Kind kind;
    public final String message;
    @Nullable
    public final Throwable cause;

    private Fact(Kind kind, String message, @Nullable Throwable cause)
    {
        this.kind = Invariants.nonNull(kind);
        this.message = Invariants.nonNull(message, "message");
        this.cause = cause;
    }

    public static Fact yes(String message)
    {
        return new Fact(Kind.YES, message, null);
    }

    public static Fact vacuousYes(String message)
    {
        return new Fact(Kind.VACUOUS_YES, message, null);
    }

    public static Fact no(String message)
    {
        return new Fact(Kind.NO, message, null);
    }

    public static Fact no(String message, @Nullable Throwable cause)
    {
        return new Fact(Kind.NO, message, cause);
    }

    public static Fact of(boolean condition, String message)
    {
        return condition ? yes(message) : no(message);
    }

    /**
     * True for both plain and vacuous yes facts.
     */
    public boolean isYes()
    {
        return kind != Kind.NO;
    }

    public boolean isVacuousYes()
    {
        return kind == Kind.VACUOUS_YES;
    }

    public boolean isNo()
    {
        return kind == Kind.NO;
    }

    public Fact and(Supplier<Fact> other)
    {
        if (isNo())
            return this;
        Fact that = other.get();
        if (that.isNo())
            return that;
        return isVacuousYes() || that.isVacuousYes() ? vacuousYes(message + ", and " + that.message)
                                                     : yes(message + ", and " + that.message);
    }

    public Fact or(Supplier<Fact> other)
    {
        if (kind == Kind.YES)
            return this;
        Fact that = other.get();
        if (that.isYes() || isNo())
            return that;
        return this;
    }

    /**
     * Logical implication: when this fact is a no the consequent is never evaluated and the result is vacuously true.
     */
    public Fact implies(Supplier<Fact> consequent)
    {
        if (isNo())
            return vacuousYes(message);
        return consequent.get();
    }

    public Fact negate()
    {
        return isYes() ? no("not (" + message + ')') : yes("not (" + message + ')');
    }

    /**
     * Converts a no into a thrown {@link PropertyCheckFailedError}.
     */
    public Assertion toAssertion()
    {
        if (isNo())
            throw new PropertyCheckFailedError(message, cause);
        return Assertion.SUCCEEDED;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Fact fact = (Fact) o;
        return kind == fact.kind && message.equals(fact.message) && Objects.equals(cause, fact.cause);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, message, cause);
    }

    @Override
    public String toString()
    {
        switch (kind)
        {
            default: throw new AssertionError("Unexpected kind: " + kind);
            case YES: return "Yes(" + message + ')';
            case VACUOUS_YES: return "VacuousYes(" + message + ')';
            case NO: return "No(" + message + ')';
        }
    }
}
