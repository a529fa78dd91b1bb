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
import javax.annotation.Nullable;

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
import propcheck.check.PropertyCheckResult;
import propcheck.check.PropertyChecker;
import propcheck.check.ResultClassifier;
import propcheck.utils.Randomizer;

/**
 * Runs checks with the blocking {@link PropertyChecker} loop, classifying the property's results itself. Subclasses
 * only decide how a rendered outcome reaches the caller.
 */
public abstract class SyncPropCheckerAsserting<T, R> implements PropCheckerAsserting<T, R>, ResultClassifier<T>
{
    protected abstract R indicateSuccess(String message);

    protected abstract R indicateFailure(PropertyCheckReport report);

    protected R checkResult(PropertyCheckResult result, Prettifier prettifier, @Nullable SourcePosition position, @Nullable List<String> argNames)
    {
        PropertyCheckReport report = PropertyCheckReport.render(result, prettifier, position, argNames);
        if (report.isSuccess())
            return indicateSuccess(report.message);
        return indicateFailure(report);
    }

    @Override
    public <A> R check1(Property1<A, ? extends T> fn, Generator<A> genA, PropertyConfig config, Randomizer randomizer,
                    Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames)
    {
        PropertyCheckResult result = PropertyChecker.checkForAll(names, config, randomizer, genA, this, fn);
        return checkResult(result, prettifier, position, argNames);
    }

    @Override
    public <A, B> R check2(Property2<A, B, ? extends T> fn, Generator<A> genA, Generator<B> genB, PropertyConfig config, Randomizer randomizer,
                    Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames)
    {
        PropertyCheckResult result = PropertyChecker.checkForAll(names, config, randomizer, genA, genB, this, fn);
        return checkResult(result, prettifier, position, argNames);
    }

    @Override
    public <A, B, C> R check3(Property3<A, B, C, ? extends T> fn, Generator<A> genA, Generator<B> genB, Generator<C> genC, PropertyConfig config, Randomizer randomizer,
                    Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames)
    {
        PropertyCheckResult result = PropertyChecker.checkForAll(names, config, randomizer, genA, genB, genC, this, fn);
        return checkResult(result, prettifier, position, argNames);
    }

    @Override
    public <A, B, C, D> R check4(Property4<A, B, C, D, ? extends T> fn, Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, PropertyConfig config, Randomizer randomizer,
                    Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames)
    {
        PropertyCheckResult result = PropertyChecker.checkForAll(names, config, randomizer, genA, genB, genC, genD, this, fn);
        return checkResult(result, prettifier, position, argNames);
    }

    @Override
    public <A, B, C, D, E> R check5(Property5<A, B, C, D, E, ? extends T> fn, Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, PropertyConfig config, Randomizer randomizer,
                    Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames)
    {
        PropertyCheckResult result = PropertyChecker.checkForAll(names, config, randomizer, genA, genB, genC, genD, genE, this, fn);
        return checkResult(result, prettifier, position, argNames);
    }

    @Override
    public <A, B, C, D, E, F> R check6(Property6<A, B, C, D, E, F, ? extends T> fn, Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, Generator<F> genF, PropertyConfig config, Randomizer randomizer,
                    Prettifier prettifier, @Nullable SourcePosition position, List<String> names, @Nullable List<String> argNames)
    {
        PropertyCheckResult result = PropertyChecker.checkForAll(names, config, randomizer, genA, genB, genC, genD, genE, genF, this, fn);
        return checkResult(result, prettifier, position, argNames);
    }
}
