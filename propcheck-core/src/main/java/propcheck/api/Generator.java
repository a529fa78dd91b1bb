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

import java.util.List;

import com.google.common.collect.ImmutableList;

import propcheck.utils.Randomizer;

/**
 * Produces values of type {@code T} for property checks. Implementations are pure: all randomness comes from the
 * {@link Randomizer} passed in, and the successor randomizer is returned alongside the value.
 * <p>
 * Each generator may front-load a pool of edge cases (boundary or otherwise special values). The check loop asks for
 * the pool once, via {@link #initEdges}, then threads whatever {@link #next} leaves of it through every later draw.
 */
public interface Generator<T>
{
    class Edges<T>
    {
        public final List<T> edges;
        public final Randomizer next;

        public Edges(List<T> edges, Randomizer next)
        {
            this.edges = edges;
            this.next = next;
        }
    }

    class Sample<T>
    {
        public final T value;
        public final List<T> edges;
        public final Randomizer next;

        public Sample(T value, List<T> edges, Randomizer next)
        {
            this.value = value;
            this.edges = edges;
            this.next = next;
        }
    }

    /**
     * @param maxLength the largest number of edge cases the caller will accept
     */
    default Edges<T> initEdges(int maxLength, Randomizer randomizer)
    {
        return new Edges<>(ImmutableList.of(), randomizer);
    }

    /**
     * Draws the next value, consuming the head of {@code edges} if there is one.
     */
    Sample<T> next(SizeParam size, List<T> edges, Randomizer randomizer);
}
