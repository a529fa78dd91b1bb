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

import com.google.common.collect.ImmutableList;
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
import propcheck.utils.Invariants;
import propcheck.utils.Randomizer;

/**
 * Entry point for property checks:
 * <pre>{@code
 * property().withMinSuccessful(100)
 *           .withNames("x", "y")
 *           .check(ints, ints, (x, y) -> assertEquals(x + y, y + x));
 * }</pre>
 * {@code check} runs properties that fail by throwing, {@code expect} runs properties returning a {@link Fact}, and
 * {@code checkAsync} runs properties returning a future. Unless a seed is given, each check starts from
 * {@link Randomizer#defaultRandomizer()}.
 */
public class PropertyChecks
{
    private PropertyConfig config;
    @Nullable
    private Long seed;
    private Prettifier prettifier = Prettifier.DEFAULT;
    @Nullable
    private List<String> names;
    @Nullable
    private List<String> argNames;
    @Nullable
    private SourcePosition position;

    private PropertyChecks(PropertyConfig config)
    {
        this.config = config;
    }

    public static PropertyChecks property()
    {
        return new PropertyChecks(PropertyConfig.fromSystemProperties());
    }

    public static PropertyChecks property(PropertyConfig config)
    {
        return new PropertyChecks(Invariants.nonNull(config, "config"));
    }

    public PropertyChecks withConfig(PropertyConfig config)
    {
        this.config = Invariants.nonNull(config, "config");
        return this;
    }

    public PropertyChecks withMinSuccessful(int minSuccessful)
    {
        config = config.withMinSuccessful(minSuccessful);
        return this;
    }

    public PropertyChecks withMaxDiscardedFactor(double maxDiscardedFactor)
    {
        config = config.withMaxDiscardedFactor(maxDiscardedFactor);
        return this;
    }

    public PropertyChecks withMinSize(int minSize)
    {
        config = config.withMinSize(minSize);
        return this;
    }

    public PropertyChecks withSizeRange(int sizeRange)
    {
        config = config.withSizeRange(sizeRange);
        return this;
    }

    /**
     * When a check fails, set the seed reported with the failure here to repeat it.
     */
    public PropertyChecks withSeed(long seed)
    {
        this.seed = seed;
        return this;
    }

    public PropertyChecks withPrettifier(Prettifier prettifier)
    {
        this.prettifier = Invariants.nonNull(prettifier, "prettifier");
        return this;
    }

    public PropertyChecks withNames(String... names)
    {
        this.names = ImmutableList.copyOf(names);
        return this;
    }

    /**
     * Names to show for the arguments of a failure, instead of those given to {@link #withNames}.
     */
    public PropertyChecks withArgNames(String... argNames)
    {
        this.argNames = ImmutableList.copyOf(argNames);
        return this;
    }

    public PropertyChecks at(SourcePosition position)
    {
        this.position = position;
        return this;
    }

    public PropertyConfig config()
    {
        return config;
    }

    private Randomizer randomizer()
    {
        return seed == null ? Randomizer.defaultRandomizer() : Randomizer.of(seed);
    }

    private List<String> names(int arity)
    {
        if (names != null)
            return names;

        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (int i = 0; i < arity; i++)
            builder.add("arg" + i);
        return builder.build();
    }

    private SourcePosition position()
    {
        return position != null ? position : SourcePosition.callerOf(PropertyChecks.class);
    }

    public interface FailingConsumer<A>
    {
        void accept(A a) throws Throwable;
    }

    public <A> Assertion check(Generator<A> genA, FailingConsumer<A> fn)
    {
        return PropCheckerAsserting.assertions().check1((a) -> {
            fn.accept(a);
            return Assertion.SUCCEEDED;
        }, genA, config, randomizer(), prettifier, position(), names(1), argNames);
    }

    public <A> Fact expect(Generator<A> genA, Property1<A, Fact> fn)
    {
        return PropCheckerAsserting.expectations().check1(fn, genA, config, randomizer(), prettifier, position(), names(1), argNames);
    }

    public <A> ListenableFuture<Assertion> checkAsync(Executor executor, Generator<A> genA, Property1<A, ListenableFuture<Assertion>> fn)
    {
        return PropCheckerAsserting.futureAssertions(executor).check1(fn, genA, config, randomizer(), prettifier, position(), names(1), argNames);
    }

    public interface FailingBiConsumer<A, B>
    {
        void accept(A a, B b) throws Throwable;
    }

    public <A, B> Assertion check(Generator<A> genA, Generator<B> genB, FailingBiConsumer<A, B> fn)
    {
        return PropCheckerAsserting.assertions().check2((a, b) -> {
            fn.accept(a, b);
            return Assertion.SUCCEEDED;
        }, genA, genB, config, randomizer(), prettifier, position(), names(2), argNames);
    }

    public <A, B> Fact expect(Generator<A> genA, Generator<B> genB, Property2<A, B, Fact> fn)
    {
        return PropCheckerAsserting.expectations().check2(fn, genA, genB, config, randomizer(), prettifier, position(), names(2), argNames);
    }

    public <A, B> ListenableFuture<Assertion> checkAsync(Executor executor, Generator<A> genA, Generator<B> genB, Property2<A, B, ListenableFuture<Assertion>> fn)
    {
        return PropCheckerAsserting.futureAssertions(executor).check2(fn, genA, genB, config, randomizer(), prettifier, position(), names(2), argNames);
    }

    public interface FailingTriConsumer<A, B, C>
    {
        void accept(A a, B b, C c) throws Throwable;
    }

    public <A, B, C> Assertion check(Generator<A> genA, Generator<B> genB, Generator<C> genC, FailingTriConsumer<A, B, C> fn)
    {
        return PropCheckerAsserting.assertions().check3((a, b, c) -> {
            fn.accept(a, b, c);
            return Assertion.SUCCEEDED;
        }, genA, genB, genC, config, randomizer(), prettifier, position(), names(3), argNames);
    }

    public <A, B, C> Fact expect(Generator<A> genA, Generator<B> genB, Generator<C> genC, Property3<A, B, C, Fact> fn)
    {
        return PropCheckerAsserting.expectations().check3(fn, genA, genB, genC, config, randomizer(), prettifier, position(), names(3), argNames);
    }

    public <A, B, C> ListenableFuture<Assertion> checkAsync(Executor executor, Generator<A> genA, Generator<B> genB, Generator<C> genC, Property3<A, B, C, ListenableFuture<Assertion>> fn)
    {
        return PropCheckerAsserting.futureAssertions(executor).check3(fn, genA, genB, genC, config, randomizer(), prettifier, position(), names(3), argNames);
    }

    public interface FailingQuadConsumer<A, B, C, D>
    {
        void accept(A a, B b, C c, D d) throws Throwable;
    }

    public <A, B, C, D> Assertion check(Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, FailingQuadConsumer<A, B, C, D> fn)
    {
        return PropCheckerAsserting.assertions().check4((a, b, c, d) -> {
            fn.accept(a, b, c, d);
            return Assertion.SUCCEEDED;
        }, genA, genB, genC, genD, config, randomizer(), prettifier, position(), names(4), argNames);
    }

    public <A, B, C, D> Fact expect(Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Property4<A, B, C, D, Fact> fn)
    {
        return PropCheckerAsserting.expectations().check4(fn, genA, genB, genC, genD, config, randomizer(), prettifier, position(), names(4), argNames);
    }

    public <A, B, C, D> ListenableFuture<Assertion> checkAsync(Executor executor, Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Property4<A, B, C, D, ListenableFuture<Assertion>> fn)
    {
        return PropCheckerAsserting.futureAssertions(executor).check4(fn, genA, genB, genC, genD, config, randomizer(), prettifier, position(), names(4), argNames);
    }

    public interface FailingPentaConsumer<A, B, C, D, E>
    {
        void accept(A a, B b, C c, D d, E e) throws Throwable;
    }

    public <A, B, C, D, E> Assertion check(Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, FailingPentaConsumer<A, B, C, D, E> fn)
    {
        return PropCheckerAsserting.assertions().check5((a, b, c, d, e) -> {
            fn.accept(a, b, c, d, e);
            return Assertion.SUCCEEDED;
        }, genA, genB, genC, genD, genE, config, randomizer(), prettifier, position(), names(5), argNames);
    }

    public <A, B, C, D, E> Fact expect(Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, Property5<A, B, C, D, E, Fact> fn)
    {
        return PropCheckerAsserting.expectations().check5(fn, genA, genB, genC, genD, genE, config, randomizer(), prettifier, position(), names(5), argNames);
    }

    public <A, B, C, D, E> ListenableFuture<Assertion> checkAsync(Executor executor, Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, Property5<A, B, C, D, E, ListenableFuture<Assertion>> fn)
    {
        return PropCheckerAsserting.futureAssertions(executor).check5(fn, genA, genB, genC, genD, genE, config, randomizer(), prettifier, position(), names(5), argNames);
    }

    public interface FailingHexaConsumer<A, B, C, D, E, F>
    {
        void accept(A a, B b, C c, D d, E e, F f) throws Throwable;
    }

    public <A, B, C, D, E, F> Assertion check(Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, Generator<F> genF, FailingHexaConsumer<A, B, C, D, E, F> fn)
    {
        return PropCheckerAsserting.assertions().check6((a, b, c, d, e, f) -> {
            fn.accept(a, b, c, d, e, f);
            return Assertion.SUCCEEDED;
        }, genA, genB, genC, genD, genE, genF, config, randomizer(), prettifier, position(), names(6), argNames);
    }

    public <A, B, C, D, E, F> Fact expect(Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, Generator<F> genF, Property6<A, B, C, D, E, F, Fact> fn)
    {
        return PropCheckerAsserting.expectations().check6(fn, genA, genB, genC, genD, genE, genF, config, randomizer(), prettifier, position(), names(6), argNames);
    }

    public <A, B, C, D, E, F> ListenableFuture<Assertion> checkAsync(Executor executor, Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, Generator<F> genF, Property6<A, B, C, D, E, F, ListenableFuture<Assertion>> fn)
    {
        return PropCheckerAsserting.futureAssertions(executor).check6(fn, genA, genB, genC, genD, genE, genF, config, randomizer(), prettifier, position(), names(6), argNames);
    }
}
