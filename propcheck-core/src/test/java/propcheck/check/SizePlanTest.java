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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import propcheck.utils.Randomizer;

import static org.assertj.core.api.Assertions.assertThat;

public class SizePlanTest
{
    @Test
    public void planStartsAtMinSizeAndAscends()
    {
        Randomizer randomizer = Randomizer.of(0);
        for (int i = 0; i < 100; i++)
        {
            SizePlan.Planned planned = SizePlan.plan(3, 50, randomizer);
            int[] sizes = planned.plan.planned();
            assertThat(sizes).hasSize(SizePlan.PLANNED_SIZES);
            assertThat(sizes[0]).isEqualTo(3);
            int[] sorted = sizes.clone();
            Arrays.sort(sorted);
            assertThat(sizes).isEqualTo(sorted);
            for (int size : sizes)
                assertThat(size).isBetween(3, 50);
            randomizer = planned.next;
        }
    }

    @Test
    public void drawsOnceExhausted()
    {
        SizePlan.Planned planned = SizePlan.plan(0, 20, Randomizer.of(5));
        SizePlan plan = planned.plan;
        Randomizer randomizer = planned.next;
        int[] expected = plan.planned();
        for (int i = 0; i < expected.length; i++)
        {
            SizePlan.NextSize next = plan.next(randomizer);
            assertThat(next.size).isEqualTo(expected[i]);
            assertThat(next.next).isSameAs(randomizer);
            plan = next.remaining;
        }
        assertThat(plan.remaining()).isZero();

        for (int i = 0; i < 100; i++)
        {
            SizePlan.NextSize next = plan.next(randomizer);
            assertThat(next.size).isBetween(0, 20);
            assertThat(next.remaining.remaining()).isZero();
            randomizer = next.next;
        }
    }

    @Test
    public void singleSize()
    {
        SizePlan plan = SizePlan.plan(4, 4, Randomizer.of(1)).plan;
        assertThat(plan.planned()).containsOnly(4);
    }

    @Test
    public void rejectsInvertedBounds()
    {
        Assertions.assertThrows(IllegalArgumentException.class, () -> SizePlan.plan(5, 4, Randomizer.of(1)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> SizePlan.plan(-1, 4, Randomizer.of(1)));
    }
}
