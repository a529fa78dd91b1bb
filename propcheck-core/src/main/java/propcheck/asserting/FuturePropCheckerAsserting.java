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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;

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
import propcheck.check.AsyncPropertyChecker;
import propcheck.check.PropertyCheckResult;
import propcheck.check.ResultClassifier;
import propcheck.utils.Invariants;
import propcheck.utils.Randomizer;

/**
 * Runs checks of properties that complete asynchronously with the {@link AsyncPropertyChecker} loop. Each future's
 * value is classified as a {@link SyncPropCheckerAsserting} would classify a plain result; the rendered outcome is
 * delivered through the returned future, with failures thrown from {@link #indicateFutureFailure} failing it.
 *
 * @param <S> what the property's futures complete with
 * @param <R> what the check's future completes with
 */
public abstract class FuturePropCheckerAsserting<S, R> implements PropCheckerAsserting<ListenableFuture<S>, ListenableFuture<R>>, ResultClassifier<S>
{
    protected final Executor executor;

    protected FuturePropCheckerAsserting(Executor executor)
    {
        this.executor = Invariants.nonNull(executor, "executor");
    }

    protected abstract R indicateFutureSuccess(String message);

    protected abstract R indicateFutureFailure(PropertyCheckReport report);

    protected ListenableFuture<R> checkResult(ListenableFuture<PropertyCheckResult> result, Prettifier prettifier,
                                              @Nullable SourcePosition position, @Nullable List<String> argNames)
    {
        return Futures.transform(result, r -> {
            PropertyCheckReport report = PropertyCheckReport.render(r, prettifier, position, argNames);
            if (report.isSuccess())
                return indicateFutureSuccess(report.message);
            return indicateFutureFailure(report);
        }, executor);
    }

    @Override
    public <A> ListenableFuture<R> check1(Property1<A, ? extends ListenableFuture<S>> fn, Generator<A> genA, PropertyConfig config, Randomizer randomizer,
                    Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames)
    {
        ListenableFuture<PropertyCheckResult> result = AsyncPropertyChecker.checkForAll(names, config, randomizer, genA, this, executor, fn);
        return checkResult(result, prettifier, position, argNames);
    }

    @Override
    public <A, B> ListenableFuture<R> check2(Property2<A, B, ? extends ListenableFuture<S>> fn, Generator<A> genA, Generator<B> genB, PropertyConfig config, Randomizer randomizer,
                    Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames)
    {
        ListenableFuture<PropertyCheckResult> result = AsyncPropertyChecker.checkForAll(names, config, randomizer, genA, genB, this, executor, fn);
        return checkResult(result, prettifier, position, argNames);
    }

    @Override
    public <A, B, C> ListenableFuture<R> check3(Property3<A, B, C, ? extends ListenableFuture<S>> fn, Generator<A> genA, Generator<B> genB, Generator<C> genC, PropertyConfig config, Randomizer randomizer,
                    Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames)
    {
        ListenableFuture<PropertyCheckResult> result = AsyncPropertyChecker.checkForAll(names, config, randomizer, genA, genB, genC, this, executor, fn);
        return checkResult(result, prettifier, position, argNames);
    }

    @Override
    public <A, B, C, D> ListenableFuture<R> check4(Property4<A, B, C, D, ? extends ListenableFuture<S>> fn, Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, PropertyConfig config, Randomizer randomizer,
                    Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames)
    {
        ListenableFuture<PropertyCheckResult> result = AsyncPropertyChecker.checkForAll(names, config, randomizer, genA, genB, genC, genD, this, executor, fn);
        return checkResult(result, prettifier, position, argNames);
    }

    @Override
    public <A, B, C, D, E> ListenableFuture<R> check5(Property5<A, B, C, D, E, ? extends ListenableFuture<S>> fn, Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, PropertyConfig config, Randomizer randomizer,
                    Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames)
    {
        ListenableFuture<PropertyCheckResult> result = AsyncPropertyChecker.checkForAll(names, config, randomizer, genA, genB, genC, genD, genE, this, executor, fn);
        return checkResult(result, prettifier, position, argNames);
    }

    @Override
    public <A, B, C, D, E, F> ListenableFuture<R> check6(Property6<A, B, C, D, E, F, ? extends ListenableFuture<S>> fn, Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, Generator<F> genF, PropertyConfig config, Randomizer randomizer,
                    Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames)
    {
        ListenableFuture<PropertyCheckResult> result = AsyncPropertyChecker.checkForAll(names, config, randomizer, genA, genB, genC, genD, genE, genF, this, executor, fn);
        return checkResult(result, prettifier, position, argNames);
    }
}
