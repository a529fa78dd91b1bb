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

import java.util.Arrays;

import org.agrona.collections.IntArrayList;

import propcheck.utils.Invariants;
import propcheck.utils.Randomizer;

/**
 * The sizes a check feeds its generators. A plan starts with up to {@value #PLANNED_SIZES} pre-drawn sizes, sorted
 * ascending and always headed by the minimum size, so that the first evaluations see the smallest inputs. Once the
 * plan is used up every further size is drawn uniformly from {@code [minSize, maxSize]}.
 */
public final class SizePlan
{
    public static final int PLANNED_SIZES = 10;

    public static class Planned
    {
        public final SizePlan plan;
        public final Randomizer next;

        Planned(SizePlan plan, Randomizer next)
        {
            this.plan = plan;
            this.next = next;
        }
    }

    public static class NextSize
    {
        public final int size;
        public final SizePlan remaining;
        public final Randomizer next;

        NextSize(int size, SizePlan remaining, Randomizer next)
        {
            this.size = size;
            this.remaining = remaining;
            this.next = next;
        }
    }

    public final int minSize;
    public final int maxSize;
    private final int[] sizes;
    private final int position;

    private SizePlan(int minSize, int maxSize, int[] sizes, int position)
    {
        this.minSize = minSize;
        this.maxSize = maxSize;
        this.sizes = sizes;
        this.position = position;
    }

    public static Planned plan(int minSize, int maxSize, Randomizer randomizer)
    {
        Invariants.isNatural(minSize, "minSize");
        Invariants.checkArgument(minSize <= maxSize, "minSize (%d) must not exceed maxSize (%d)", minSize, maxSize);

        IntArrayList sizes = new IntArrayList(PLANNED_SIZES, Integer.MIN_VALUE);
        sizes.addInt(minSize);
        while (sizes.size() < PLANNED_SIZES)
        {
            Randomizer.NextInt size = randomizer.chooseInt(minSize, maxSize);
            sizes.addInt(size.value);
            randomizer = size.next;
        }
        int[] sorted = sizes.toIntArray();
        Arrays.sort(sorted);
        return new Planned(new SizePlan(minSize, maxSize, sorted, 0), randomizer);
    }

    /**
     * Takes the next planned size, or draws a random one once the plan is exhausted.
     */
    public NextSize next(Randomizer randomizer)
    {
        if (position < sizes.length)
            return new NextSize(sizes[position], new SizePlan(minSize, maxSize, sizes, position + 1), randomizer);

        Randomizer.NextInt size = randomizer.chooseInt(minSize, maxSize);
        return new NextSize(size.value, this, size.next);
    }

    public int remaining()
    {
        return sizes.length - position;
    }

    public int[] planned()
    {
        return Arrays.copyOfRange(sizes, position, sizes.length);
    }

    @Override
    public String toString()
    {
        return "SizePlan{" + minSize + ".." + maxSize + ", planned=" + Arrays.toString(planned()) + '}';
    }
}
