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
import java.util.concurrent.Executor;
import javax.annotation.Nullable;

import com.google.common.util.concurrent.ListenableFuture;

import propcheck.api.Assertion;
import propcheck.api.Fact;
import propcheck.api.Generator;
import propcheck.api.Prettifier;
import propcheck.api.Property1;
import propcheck.api.Property2;
import propcheck.api.Property3;
import propcheck.api.Property4;
import propcheck.api.Property5;
import propcheck.api.Property6;
import propcheck.api.PropertyConfig;
import propcheck.api.SourcePosition;
import propcheck.utils.Randomizer;

/**
 * How property checks over a particular property result type {@code T} are run and reported. An implementation
 * decides which results are discarded and which count as successes, and how success or failure is signaled to the
 * caller through the check's return type {@code R}: by returning a value, by throwing, or through a future.
 * <p>
 * Pick an implementation per property result type:
 * <ul>
 *     <li>{@link #assertions()} for properties that only signal failure by throwing</li>
 *     <li>{@link #expectations()} for properties returning a {@link Fact}</li>
 *     <li>{@link #futureAssertions(Executor)} for properties completing asynchronously</li>
 * </ul>
 *
 * @param <T> what the checked property returns
 * @param <R> what a check returns
 */
public interface PropCheckerAsserting<T, R>
{
    static PropCheckerAsserting<Assertion, Assertion> assertions()
    {
        return AssertionPropCheckerAsserting.instance;
    }

    static PropCheckerAsserting<Fact, Fact> expectations()
    {
        return ExpectationPropCheckerAsserting.instance;
    }

    static PropCheckerAsserting<ListenableFuture<Assertion>, ListenableFuture<Assertion>> futureAssertions(Executor executor)
    {
        return new FutureAssertionPropCheckerAsserting(executor);
    }

    <A> R check1(Property1<A, ? extends T> fn, Generator<A> genA, PropertyConfig config, Randomizer randomizer,
              Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames);

    <A, B> R check2(Property2<A, B, ? extends T> fn, Generator<A> genA, Generator<B> genB, PropertyConfig config, Randomizer randomizer,
                 Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames);

    <A, B, C> R check3(Property3<A, B, C, ? extends T> fn, Generator<A> genA, Generator<B> genB, Generator<C> genC, PropertyConfig config, Randomizer randomizer,
                    Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames);

    <A, B, C, D> R check4(Property4<A, B, C, D, ? extends T> fn, Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, PropertyConfig config, Randomizer randomizer,
                       Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames);

    <A, B, C, D, E> R check5(Property5<A, B, C, D, E, ? extends T> fn, Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, PropertyConfig config, Randomizer randomizer,
                          Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames);

    <A, B, C, D, E, F> R check6(Property6<A, B, C, D, E, F, ? extends T> fn, Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, Generator<F> genF, PropertyConfig config, Randomizer randomizer,
                             Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames);
}
