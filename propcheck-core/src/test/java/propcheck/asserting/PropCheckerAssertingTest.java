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

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import propcheck.api.Assertion;
import propcheck.api.Fact;
import propcheck.api.Gens;
import propcheck.api.Prettifier;
import propcheck.api.PropertyCheckFailedError;
import propcheck.api.PropertyConfig;
import propcheck.api.SourcePosition;
import propcheck.check.DiscardedEvaluationException;
import propcheck.utils.Randomizer;

import static org.assertj.core.api.Assertions.assertThat;

public class PropCheckerAssertingTest
{
    private static final SourcePosition POSITION = SourcePosition.of("ExampleTest.java", 12);
    private static final List<String> X = ImmutableList.of("x");
    private static final List<String> XY = ImmutableList.of("x", "y");
    private static final Executor DIRECT = MoreExecutors.directExecutor();

    @Test
    public void assertionSucceeds()
    {
        Assertion result = PropCheckerAsserting.assertions().check1(x -> Assertion.SUCCEEDED, Gens.ints(0, 10), PropertyConfig.DEFAULT, Randomizer.of(1),
                                                                    Prettifier.DEFAULT, POSITION, X, null);
        assertThat(result).isEqualTo(Assertion.SUCCEEDED);
    }

    @Test
    public void assertionThrowsOnFailure()
    {
        IllegalStateException boom = new IllegalStateException("boom");
        PropertyCheckFailedError error = Assertions.assertThrows(PropertyCheckFailedError.class, () -> {
            PropCheckerAsserting.assertions().check2((x, y) -> { throw boom; }, Gens.constant(4), Gens.constant(5), PropertyConfig.DEFAULT,
                                                     Randomizer.of(1), Prettifier.DEFAULT, POSITION, XY, null);
        });
        assertThat(error.getMessage()).startsWith("IllegalStateException was thrown during property evaluation.\n (ExampleTest.java:12)\n  Message: boom\n");
        assertThat(error.getMessage()).contains("    x = 4,\n    y = 5\n");
        assertThat(error.getCause()).isSameAs(boom);
        assertThat(error.arguments()).containsExactly(4, 5);
        assertThat(error.position()).isEqualTo(POSITION);
    }

    @Test
    public void assertionThrowsWhenExhausted()
    {
        PropertyCheckFailedError error = Assertions.assertThrows(PropertyCheckFailedError.class, () -> {
            PropCheckerAsserting.assertions().check1(x -> { throw new DiscardedEvaluationException(); }, Gens.ints(0, 10), PropertyConfig.DEFAULT,
                                                     Randomizer.of(1), Prettifier.DEFAULT, POSITION, X, null);
        });
        assertThat(error).hasMessage("Gave up after 0 successful property evaluations. 50 evaluations were discarded.");
        assertThat(error.getCause()).isNull();
        assertThat(error.arguments()).isEmpty();
    }

    @Test
    public void expectationSucceeds()
    {
        Fact fact = PropCheckerAsserting.expectations().check1(x -> Fact.of(x >= 0, "non-negative"), Gens.ints(0, 10), PropertyConfig.DEFAULT,
                                                               Randomizer.of(1), Prettifier.DEFAULT, POSITION, X, null);
        assertThat(fact).isEqualTo(Fact.yes("Property check succeeded"));
    }

    @Test
    public void expectationFails()
    {
        Fact fact = PropCheckerAsserting.expectations().check1(x -> Fact.of(x < 5, "small"), Gens.ints(0, 10), PropertyConfig.DEFAULT,
                                                               Randomizer.of(1), Prettifier.DEFAULT, POSITION, X, null);
        assertThat(fact.isNo()).isTrue();
        assertThat(fact.message).startsWith("PropertyCheckFailedError was thrown during property evaluation.");
        assertThat(fact.message).contains("    x = ");
        assertThat(fact.cause).isNull();
    }

    @Test
    public void expectationKeepsCause()
    {
        IllegalArgumentException cause = new IllegalArgumentException("why");
        Fact fact = PropCheckerAsserting.expectations().check1(x -> Fact.no("never", cause), Gens.ints(0, 10), PropertyConfig.DEFAULT,
                                                               Randomizer.of(1), Prettifier.DEFAULT, null, X, null);
        assertThat(fact.cause).isSameAs(cause);
        assertThat(fact.message).startsWith("IllegalArgumentException was thrown during property evaluation.\n  Message: why\n");
    }

    @Test
    public void expectationDiscardsVacuousFacts()
    {
        Fact exhausted = PropCheckerAsserting.expectations().check1(x -> Fact.vacuousYes("nothing to see"), Gens.ints(0, 10), PropertyConfig.DEFAULT,
                                                                    Randomizer.of(1), Prettifier.DEFAULT, POSITION, X, null);
        assertThat(exhausted).isEqualTo(Fact.no("Gave up after 0 successful property evaluations. 50 evaluations were discarded."));

        Fact implied = PropCheckerAsserting.expectations().check1(x -> Fact.of(x % 2 == 0, "even").implies(() -> Fact.of((x / 2) * 2 == x, "halves")),
                                                                  Gens.ints(0, 1000), PropertyConfig.DEFAULT.withMinSuccessful(50),
                                                                  Randomizer.of(1), Prettifier.DEFAULT, POSITION, X, null);
        assertThat(implied.isYes()).isTrue();
    }

    @Test
    public void futureAssertionSucceeds() throws Exception
    {
        ListenableFuture<Assertion> result = PropCheckerAsserting.futureAssertions(DIRECT).check1(x -> Futures.immediateFuture(Assertion.SUCCEEDED),
                                                                                                  Gens.ints(0, 10), PropertyConfig.DEFAULT, Randomizer.of(1),
                                                                                                  Prettifier.DEFAULT, POSITION, X, null);
        assertThat(result.get()).isEqualTo(Assertion.SUCCEEDED);
    }

    @Test
    public void futureAssertionFails()
    {
        IllegalStateException boom = new IllegalStateException("boom");
        ListenableFuture<Assertion> result = PropCheckerAsserting.futureAssertions(DIRECT).check2((x, y) -> Futures.<Assertion>immediateFailedFuture(boom),
                                                                                                  Gens.constant(4), Gens.constant(5), PropertyConfig.DEFAULT,
                                                                                                  Randomizer.of(1), Prettifier.DEFAULT, POSITION, XY, null);
        ExecutionException e = Assertions.assertThrows(ExecutionException.class, result::get);
        assertThat(e.getCause()).isInstanceOf(PropertyCheckFailedError.class);
        PropertyCheckFailedError error = (PropertyCheckFailedError) e.getCause();
        assertThat(error.getCause()).isSameAs(boom);
        assertThat(error.arguments()).containsExactly(4, 5);
    }

    @Test
    public void futureAssertionRejected()
    {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        executor.shutdown();
        SettableFuture<Assertion> pending = SettableFuture.create();
        ListenableFuture<Assertion> result = PropCheckerAsserting.futureAssertions(executor).check1(x -> pending, Gens.ints(0, 10), PropertyConfig.DEFAULT,
                                                                                                    Randomizer.of(1), Prettifier.DEFAULT, POSITION, X, null);
        pending.set(Assertion.SUCCEEDED);
        ExecutionException e = Assertions.assertThrows(ExecutionException.class, () -> result.get(1, TimeUnit.MINUTES));
        assertThat(e.getCause()).isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    public void labelsReachTheError()
    {
        PropertyCheckFailedError error = Assertions.assertThrows(PropertyCheckFailedError.class, () -> {
            PropCheckerAsserting.assertions().check1(x -> { throw PropertyCheckFailedError.labeled("odd", "parity", "parity"); }, Gens.constant(3),
                                                     PropertyConfig.DEFAULT, Randomizer.of(1), Prettifier.DEFAULT, POSITION, X, null);
        });
        assertThat(error.labels()).containsExactly("parity");
        assertThat(error.getMessage()).endsWith("\n  Label of failing property:\n    parity");
    }

    @Test
    public void allArities()
    {
        PropCheckerAsserting<Assertion, Assertion> assertions = PropCheckerAsserting.assertions();
        PropertyConfig config = PropertyConfig.DEFAULT;
        Randomizer rnd = Randomizer.of(3);
        assertThat(assertions.check3((a, b, c) -> Assertion.SUCCEEDED, Gens.constant(1), Gens.constant(2), Gens.constant(3),
                                     config, rnd, Prettifier.DEFAULT, null, ImmutableList.of("a", "b", "c"), null)).isEqualTo(Assertion.SUCCEEDED);
        assertThat(assertions.check4((a, b, c, d) -> Assertion.SUCCEEDED, Gens.constant(1), Gens.constant(2), Gens.constant(3), Gens.constant(4),
                                     config, rnd, Prettifier.DEFAULT, null, ImmutableList.of("a", "b", "c", "d"), null)).isEqualTo(Assertion.SUCCEEDED);
        assertThat(assertions.check5((a, b, c, d, e) -> Assertion.SUCCEEDED, Gens.constant(1), Gens.constant(2), Gens.constant(3), Gens.constant(4),
                                     Gens.constant(5), config, rnd, Prettifier.DEFAULT, null, ImmutableList.of("a", "b", "c", "d", "e"), null)).isEqualTo(Assertion.SUCCEEDED);

        PropertyCheckFailedError error = Assertions.assertThrows(PropertyCheckFailedError.class, () -> {
            assertions.check6((a, b, c, d, e, f) -> { throw new AssertionError(a + b + c + d + e + f); },
                              Gens.constant(1), Gens.constant(2), Gens.constant(3), Gens.constant(4), Gens.constant(5), Gens.constant(6),
                              config, rnd, Prettifier.DEFAULT, null, ImmutableList.of("a", "b", "c", "d", "e", "f"), null);
        });
        assertThat(error.arguments()).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(error.getMessage()).contains("  Message: 21\n");
    }
}
