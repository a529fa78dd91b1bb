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

import com.google.common.collect.ImmutableList;

import propcheck.api.Generator;
import propcheck.api.Property1;
import propcheck.api.Property2;
import propcheck.api.Property3;
import propcheck.api.Property4;
import propcheck.api.Property5;
import propcheck.api.Property6;
import propcheck.api.PropertyConfig;
import propcheck.utils.Randomizer;

/**
 * Checks a property whose result is available as soon as it returns.
 * <p>
 * Each evaluation draws one value per generator, applies the property, and classifies the outcome. The check stops
 * with {@link PropertyCheckResult.Success} once {@link PropertyConfig#minSuccessful} evaluations have succeeded,
 * with {@link PropertyCheckResult.Exhausted} once {@link PropertyConfig#maxDiscarded()} have been discarded, and with
 * {@link PropertyCheckResult.Failure} as soon as one fails.
 */
public class PropertyChecker
{
    public static <S> PropertyCheckResult checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                      List<? extends Generator<?>> generators, ResultClassifier<S> classifier,
                                                      Evaluation<? extends S> fn)
    {
        CheckLoop<S> loop = new CheckLoop<>(names, config, randomizer, generators, classifier);
        while (true)
        {
            Object[] values = loop.generate();
            S value;
            try
            {
                value = fn.evaluate(values);
            }
            catch (Throwable t)
            {
                PropertyCheckResult result = loop.onError(t, values);
                if (result != null)
                    return result;
                continue;
            }

            PropertyCheckResult result = loop.onResult(value, values);
            if (result != null)
                return result;
        }
    }

    @SuppressWarnings("unchecked")
    public static <A, S> PropertyCheckResult checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                       Generator<A> genA, ResultClassifier<S> classifier, Property1<A, ? extends S> fn)
    {
        return checkForAll(names, config, randomizer, ImmutableList.of(genA), classifier, args -> fn.apply((A) args[0]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, S> PropertyCheckResult checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                       Generator<A> genA, Generator<B> genB, ResultClassifier<S> classifier, Property2<A, B, ? extends S> fn)
    {
        return checkForAll(names, config, randomizer, ImmutableList.of(genA, genB), classifier, args -> fn.apply((A) args[0], (B) args[1]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, S> PropertyCheckResult checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                       Generator<A> genA, Generator<B> genB, Generator<C> genC, ResultClassifier<S> classifier, Property3<A, B, C, ? extends S> fn)
    {
        return checkForAll(names, config, randomizer, ImmutableList.of(genA, genB, genC), classifier, args -> fn.apply((A) args[0], (B) args[1], (C) args[2]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, D, S> PropertyCheckResult checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                       Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, ResultClassifier<S> classifier, Property4<A, B, C, D, ? extends S> fn)
    {
        return checkForAll(names, config, randomizer, ImmutableList.of(genA, genB, genC, genD), classifier, args -> fn.apply((A) args[0], (B) args[1], (C) args[2], (D) args[3]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, D, E, S> PropertyCheckResult checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                       Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, ResultClassifier<S> classifier, Property5<A, B, C, D, E, ? extends S> fn)
    {
        return checkForAll(names, config, randomizer, ImmutableList.of(genA, genB, genC, genD, genE), classifier, args -> fn.apply((A) args[0], (B) args[1], (C) args[2], (D) args[3], (E) args[4]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, D, E, F, S> PropertyCheckResult checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                       Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, Generator<F> genF, ResultClassifier<S> classifier, Property6<A, B, C, D, E, F, ? extends S> fn)
    {
        return checkForAll(names, config, randomizer, ImmutableList.of(genA, genB, genC, genD, genE, genF), classifier, args -> fn.apply((A) args[0], (B) args[1], (C) args[2], (D) args[3], (E) args[4], (F) args[5]));
    }
}
