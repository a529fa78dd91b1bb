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

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import propcheck.api.Generator;
import propcheck.api.PropertyCheckFailedError;
import propcheck.api.PropertyConfig;
import propcheck.api.SizeParam;
import propcheck.utils.Invariants;
import propcheck.utils.Randomizer;

/**
 * The state of one property check, and the step that classifies each evaluation. Shared by the blocking and the
 * asynchronous check loops, which differ only in how they wait for a property's result.
 * <p>
 * Not thread safe; a check owns its loop exclusively, and evaluations are strictly sequential.
 */
class CheckLoop<S>
{
    private static final Logger logger = LoggerFactory.getLogger(CheckLoop.class);

    private final List<String> names;
    private final PropertyConfig config;
    private final ResultClassifier<S> classifier;
    private final List<Generator<Object>> generators;
    private final int maxDiscarded;
    private final long seed;

    private int succeededCount;
    private int discardedCount;
    private final List<List<Object>> edges;
    private Randomizer randomizer;
    private SizePlan sizes;

    @SuppressWarnings("unchecked")
    CheckLoop(List<String> names, PropertyConfig config, Randomizer randomizer, List<? extends Generator<?>> generators, ResultClassifier<S> classifier)
    {
        Invariants.checkArgument(!generators.isEmpty() && generators.size() <= 6, "Unsupported arity: %d", generators.size());
        this.names = ImmutableList.copyOf(names);
        this.config = Invariants.nonNull(config, "config");
        this.classifier = Invariants.nonNull(classifier, "classifier");
        this.generators = new ArrayList<>(generators.size());
        for (Generator<?> generator : generators)
            this.generators.add((Generator<Object>) Invariants.nonNull(generator, "generator"));
        this.maxDiscarded = config.maxDiscarded();
        this.seed = randomizer.seed();

        int maxSize = config.maxSize();
        Invariants.checkArgument(config.minSize <= maxSize, "minSize (%d) must not exceed maxSize (%d)", config.minSize, maxSize);

        SizePlan.Planned planned = SizePlan.plan(config.minSize, maxSize, randomizer);
        this.sizes = planned.plan;
        randomizer = planned.next;

        int maxEdges = Math.max(0, config.maxEdges());
        this.edges = new ArrayList<>(generators.size());
        for (Generator<Object> generator : this.generators)
        {
            Generator.Edges<Object> initial = generator.initEdges(maxEdges, randomizer);
            edges.add(initial.edges);
            randomizer = initial.next;
        }
        this.randomizer = randomizer;

        logger.debug("Checking property of arity {} with seed {}, {}, giving up after {} discards",
                     generators.size(), seed, config, maxDiscarded);
    }

    /**
     * Draws the arguments for the next evaluation, advancing the size plan, the edge pools and the randomizer.
     */
    Object[] generate()
    {
        SizePlan.NextSize next = sizes.next(randomizer);
        sizes = next.remaining;
        Randomizer rnd = next.next;
        SizeParam size = new SizeParam(config.minSize, config.sizeRange, next.size);

        Object[] values = new Object[generators.size()];
        for (int i = 0; i < values.length; i++)
        {
            Generator.Sample<Object> sample = generators.get(i).next(size, edges.get(i), rnd);
            values[i] = sample.value;
            edges.set(i, sample.edges);
            rnd = sample.next;
        }
        randomizer = rnd;
        return values;
    }

    List<PropertyArgument> arguments(Object[] values)
    {
        List<PropertyArgument> args = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++)
            args.add(new PropertyArgument(i < names.size() ? names.get(i) : null, values[i]));
        return args;
    }

    /**
     * Classifies a completed evaluation.
     *
     * @return the terminal result, or {@code null} if the check should continue
     */
    @Nullable
    PropertyCheckResult onResult(S result, Object[] values)
    {
        boolean discard;
        ResultClassifier.Verdict verdict = null;
        try
        {
            discard = classifier.discard(result);
            if (!discard)
                verdict = classifier.succeed(result);
        }
        catch (Throwable t)
        {
            // classifier errors fail the check like any error raised by the property
            return onError(t, values);
        }

        if (discard)
            return onDiscard(values);

        if (!verdict.success)
            return failure(verdict.cause, values);

        if (++succeededCount < config.minSuccessful)
            return null;

        logger.debug("Property passed {} evaluations, {} discarded", succeededCount, discardedCount);
        return new PropertyCheckResult.Success(seed, arguments(values));
    }

    /**
     * Classifies an evaluation that raised {@code t}. Only a {@link DiscardedEvaluationException} is treated as a
     * discard; virtual machine errors propagate, and an {@link InterruptedException} fails the check with the
     * thread's interrupt status restored.
     *
     * @return the terminal result, or {@code null} if the check should continue
     */
    @Nullable
    PropertyCheckResult onError(Throwable t, Object[] values)
    {
        Throwables.throwIfInstanceOf(t, VirtualMachineError.class);
        if (t instanceof InterruptedException)
            Thread.currentThread().interrupt();
        if (t instanceof DiscardedEvaluationException)
            return onDiscard(values);
        return failure(t, values);
    }

    @Nullable
    private PropertyCheckResult onDiscard(Object[] values)
    {
        if (++discardedCount < maxDiscarded)
        {
            if (logger.isTraceEnabled())
                logger.trace("Discarded evaluation {} of {} on {}", discardedCount, maxDiscarded, arguments(values));
            return null;
        }

        logger.debug("Property exhausted after {} successful evaluations, {} discarded", succeededCount, discardedCount);
        return new PropertyCheckResult.Exhausted(seed, succeededCount, discardedCount, names, arguments(values));
    }

    private PropertyCheckResult failure(@Nullable Throwable cause, Object[] values)
    {
        logger.debug("Property failed after {} successful evaluations with seed {}", succeededCount, seed, cause);
        return new PropertyCheckResult.Failure(seed, succeededCount, cause, names, arguments(values), labels(cause));
    }

    private static List<String> labels(@Nullable Throwable cause)
    {
        if (cause instanceof PropertyCheckFailedError)
            return ((PropertyCheckFailedError) cause).labels();
        return ImmutableList.of();
    }
}
