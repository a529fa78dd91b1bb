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
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;

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
 * Checks a property that returns its result as a {@link ListenableFuture}. Classification is the same as
 * {@link PropertyChecker}'s; the difference is that the next evaluation only starts once the previous future has
 * completed, so a check never has two evaluations in flight.
 * <p>
 * The first evaluation runs on the calling thread. Evaluations that follow a future that was not yet done when the
 * property returned it run on {@code executor}; futures that are already done are classified in place, without
 * growing the stack.
 */
public class AsyncPropertyChecker
{
    public static <S> ListenableFuture<PropertyCheckResult> checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                                        List<? extends Generator<?>> generators, ResultClassifier<S> classifier,
                                                                        Executor executor, Evaluation<? extends ListenableFuture<? extends S>> fn)
    {
        Driver<S> driver = new Driver<>(new CheckLoop<>(names, config, randomizer, generators, classifier), executor, fn);
        driver.run();
        return driver.result;
    }

    private static class Driver<S> implements Runnable
    {
        final CheckLoop<S> loop;
        final Executor executor;
        final Evaluation<? extends ListenableFuture<? extends S>> fn;
        final SettableFuture<PropertyCheckResult> result = SettableFuture.create();

        Driver(CheckLoop<S> loop, Executor executor, Evaluation<? extends ListenableFuture<? extends S>> fn)
        {
            this.loop = loop;
            this.executor = rejectionPropagating(executor, result);
            this.fn = fn;
        }

        /**
         * Fails {@code result} with any rejection of a continuation, which Guava itself would only log.
         */
        private static Executor rejectionPropagating(Executor executor, SettableFuture<?> result)
        {
            return command -> {
                try
                {
                    executor.execute(command);
                }
                catch (RejectedExecutionException e)
                {
                    result.setException(e);
                }
            };
        }

        @Override
        public void run()
        {
            try
            {
                while (true)
                {
                    Object[] values = loop.generate();
                    ListenableFuture<? extends S> future = evaluate(values);
                    if (!future.isDone())
                    {
                        future.addListener(() -> resume(future, values), executor);
                        return;
                    }

                    PropertyCheckResult done = complete(future, values);
                    if (done != null)
                    {
                        result.set(done);
                        return;
                    }
                }
            }
            catch (Throwable t)
            {
                result.setException(t);
            }
        }

        private void resume(ListenableFuture<? extends S> future, Object[] values)
        {
            try
            {
                PropertyCheckResult done = complete(future, values);
                if (done != null)
                {
                    result.set(done);
                    return;
                }
            }
            catch (Throwable t)
            {
                result.setException(t);
                return;
            }
            run();
        }

        private ListenableFuture<? extends S> evaluate(Object[] values)
        {
            try
            {
                ListenableFuture<? extends S> future = fn.evaluate(values);
                if (future == null)
                    return Futures.immediateFailedFuture(new NullPointerException("Property returned a null future"));
                return future;
            }
            catch (Throwable t)
            {
                return Futures.immediateFailedFuture(t);
            }
        }

        @Nullable
        private PropertyCheckResult complete(ListenableFuture<? extends S> future, Object[] values)
        {
            S value;
            try
            {
                value = Futures.getDone(future);
            }
            catch (ExecutionException e)
            {
                return loop.onError(e.getCause(), values);
            }
            catch (CancellationException e)
            {
                return loop.onError(e, values);
            }
            return loop.onResult(value, values);
        }
    }

    @SuppressWarnings("unchecked")
    public static <A, S> ListenableFuture<PropertyCheckResult> checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                                         Generator<A> genA, ResultClassifier<S> classifier, Executor executor,
                                                                         Property1<A, ? extends ListenableFuture<S>> fn)
    {
        return checkForAll(names, config, randomizer, ImmutableList.of(genA), classifier, executor, args -> fn.apply((A) args[0]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, S> ListenableFuture<PropertyCheckResult> checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                                         Generator<A> genA, Generator<B> genB, ResultClassifier<S> classifier, Executor executor,
                                                                         Property2<A, B, ? extends ListenableFuture<S>> fn)
    {
        return checkForAll(names, config, randomizer, ImmutableList.of(genA, genB), classifier, executor, args -> fn.apply((A) args[0], (B) args[1]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, S> ListenableFuture<PropertyCheckResult> checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                                         Generator<A> genA, Generator<B> genB, Generator<C> genC, ResultClassifier<S> classifier, Executor executor,
                                                                         Property3<A, B, C, ? extends ListenableFuture<S>> fn)
    {
        return checkForAll(names, config, randomizer, ImmutableList.of(genA, genB, genC), classifier, executor, args -> fn.apply((A) args[0], (B) args[1], (C) args[2]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, D, S> ListenableFuture<PropertyCheckResult> checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                                         Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, ResultClassifier<S> classifier, Executor executor,
                                                                         Property4<A, B, C, D, ? extends ListenableFuture<S>> fn)
    {
        return checkForAll(names, config, randomizer, ImmutableList.of(genA, genB, genC, genD), classifier, executor, args -> fn.apply((A) args[0], (B) args[1], (C) args[2], (D) args[3]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, D, E, S> ListenableFuture<PropertyCheckResult> checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                                         Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, ResultClassifier<S> classifier, Executor executor,
                                                                         Property5<A, B, C, D, E, ? extends ListenableFuture<S>> fn)
    {
        return checkForAll(names, config, randomizer, ImmutableList.of(genA, genB, genC, genD, genE), classifier, executor, args -> fn.apply((A) args[0], (B) args[1], (C) args[2], (D) args[3], (E) args[4]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, D, E, F, S> ListenableFuture<PropertyCheckResult> checkForAll(List<String> names, PropertyConfig config, Randomizer randomizer,
                                                                         Generator<A> genA, Generator<B> genB, Generator<C> genC, Generator<D> genD, Generator<E> genE, Generator<F> genF, ResultClassifier<S> classifier, Executor executor,
                                                                         Property6<A, B, C, D, E, F, ? extends ListenableFuture<S>> fn)
    {
        return checkForAll(names, config, randomizer, ImmutableList.of(genA, genB, genC, genD, genE, genF), classifier, executor, args -> fn.apply((A) args[0], (B) args[1], (C) args[2], (D) args[3], (E) args[4], (F) args[5]));
    }
}
