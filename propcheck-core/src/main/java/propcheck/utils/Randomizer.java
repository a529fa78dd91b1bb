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

package propcheck.utils;

import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable pseudo-random source. Every draw returns the drawn value together with the successor
 * {@link Randomizer}; the receiver is never modified, so the same randomizer always yields the same value.
 * <p>
 * Uses the same 48-bit linear congruential generator as {@link java.util.Random}, so a seed reproduces the
 * same sequence of draws on every JVM.
 */
public final class Randomizer
{
    public static final String SEED_PROPERTY_NAME = "propcheck.seed";
    private static final Logger logger = LoggerFactory.getLogger(Randomizer.class);

    private static final long MULTIPLIER = 0x5DEECE66DL;
    private static final long ADDEND = 0xBL;
    private static final long MASK = (1L << 48) - 1;

    private static final AtomicReference<Long> defaultSeed = new AtomicReference<>(readSeedProperty());

    public static class NextInt
    {
        public final int value;
        public final Randomizer next;

        NextInt(int value, Randomizer next)
        {
            this.value = value;
            this.next = next;
        }
    }

    public static class NextLong
    {
        public final long value;
        public final Randomizer next;

        NextLong(long value, Randomizer next)
        {
            this.value = value;
            this.next = next;
        }
    }

    private final long initialSeed;
    private final long state;

    private Randomizer(long initialSeed, long state)
    {
        this.initialSeed = initialSeed;
        this.state = state;
    }

    public static Randomizer of(long seed)
    {
        return new Randomizer(seed, (seed ^ MULTIPLIER) & MASK);
    }

    /**
     * A randomizer seeded from the process-wide default seed if one has been set (programmatically or through the
     * {@value #SEED_PROPERTY_NAME} system property), otherwise from the current time.
     */
    public static Randomizer defaultRandomizer()
    {
        Long seed = defaultSeed.get();
        return of(seed != null ? seed : System.currentTimeMillis());
    }

    /**
     * Pins the seed used by {@link #defaultRandomizer()}; {@code null} restores time based seeding.
     */
    public static void setDefaultSeed(@Nullable Long seed)
    {
        defaultSeed.set(seed);
    }

    @Nullable
    public static Long defaultSeed()
    {
        return defaultSeed.get();
    }

    @Nullable
    private static Long readSeedProperty()
    {
        String seed = System.getProperty(SEED_PROPERTY_NAME);
        if (seed == null)
            return null;

        try
        {
            return Long.parseLong(seed.trim());
        }
        catch (NumberFormatException e)
        {
            logger.warn(String.format("Cannot parse %s=%s as a seed, ignoring", SEED_PROPERTY_NAME, seed), e);
            return null;
        }
    }

    /**
     * The seed this randomizer's sequence was started from; successors share their ancestor's seed.
     */
    public long seed()
    {
        return initialSeed;
    }

    private Randomizer successor()
    {
        return new Randomizer(initialSeed, (state * MULTIPLIER + ADDEND) & MASK);
    }

    private int bits(int bits)
    {
        return (int) (state >>> (48 - bits));
    }

    public NextInt nextInt()
    {
        Randomizer next = successor();
        return new NextInt(next.bits(32), next);
    }

    public NextLong nextLong()
    {
        Randomizer first = successor();
        Randomizer second = first.successor();
        return new NextLong(((long) first.bits(32) << 32) + second.bits(32), second);
    }

    /**
     * Draws a value uniformly from {@code [0, bound)}.
     */
    public NextInt nextInt(int bound)
    {
        Invariants.checkArgument(bound > 0, "bound (%d) must be positive", bound);

        Randomizer next = successor();
        int r = next.bits(31);
        int m = bound - 1;
        if ((bound & m) == 0) // power of two
            return new NextInt((int) ((bound * (long) r) >> 31), next);

        // reject over-represented candidates
        for (int u = r; u - (r = u % bound) + m < 0; )
        {
            next = next.successor();
            u = next.bits(31);
        }
        return new NextInt(r, next);
    }

    /**
     * Draws a value uniformly from the closed range between {@code from} and {@code to}; the bounds may be given in
     * either order.
     */
    public NextInt chooseInt(int from, int to)
    {
        if (from == to)
            return new NextInt(from, this);

        int min = Math.min(from, to);
        int max = Math.max(from, to);
        long range = (long) max - min + 1;
        if (range <= Integer.MAX_VALUE)
        {
            NextInt offset = nextInt((int) range);
            return new NextInt(min + offset.value, offset.next);
        }

        NextInt draw = nextInt();
        while (draw.value < min || draw.value > max)
            draw = draw.next.nextInt();
        return draw;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Randomizer that = (Randomizer) o;
        return initialSeed == that.initialSeed && state == that.state;
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode(state) * 31 + Long.hashCode(initialSeed);
    }

    @Override
    public String toString()
    {
        return "Randomizer{seed=" + initialSeed + '}';
    }
}
