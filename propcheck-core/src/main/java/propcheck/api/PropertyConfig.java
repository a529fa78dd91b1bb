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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import propcheck.utils.Invariants;

/**
 * Parameters of a single property check. Immutable; the {@code with} methods return modified copies.
 */
public final class PropertyConfig
{
    private static final Logger logger = LoggerFactory.getLogger(PropertyConfig.class);

    public static final String MIN_SUCCESSFUL_PROPERTY_NAME = "propcheck.minSuccessful";
    public static final String MAX_DISCARDED_FACTOR_PROPERTY_NAME = "propcheck.maxDiscardedFactor";
    public static final String MIN_SIZE_PROPERTY_NAME = "propcheck.minSize";
    public static final String SIZE_RANGE_PROPERTY_NAME = "propcheck.sizeRange";

    public static final PropertyConfig DEFAULT = new PropertyConfig(10, 5.0, 0, 100);

    public final int minSuccessful;
    public final double maxDiscardedFactor;
    public final int minSize;
    public final int sizeRange;

    public PropertyConfig(int minSuccessful, double maxDiscardedFactor, int minSize, int sizeRange)
    {
        this.minSuccessful = Invariants.isPositive(minSuccessful, "minSuccessful");
        this.maxDiscardedFactor = Invariants.isPositive(maxDiscardedFactor, "maxDiscardedFactor");
        this.minSize = Invariants.isNatural(minSize, "minSize");
        this.sizeRange = Invariants.isNatural(sizeRange, "sizeRange");
        Invariants.checkArgument((long) minSize + sizeRange <= Integer.MAX_VALUE,
                                 "minSize (%d) + sizeRange (%d) exceeds the largest supported size", minSize, sizeRange);
        Invariants.checkArgument(!Double.isInfinite(maxDiscardedFactor), "maxDiscardedFactor must be finite");
    }

    /**
     * {@link #DEFAULT}, with any parameter overridden by its {@code propcheck.*} system property.
     */
    public static PropertyConfig fromSystemProperties()
    {
        return new PropertyConfig(property(MIN_SUCCESSFUL_PROPERTY_NAME, Integer::parseInt, DEFAULT.minSuccessful),
                                  property(MAX_DISCARDED_FACTOR_PROPERTY_NAME, Double::parseDouble, DEFAULT.maxDiscardedFactor),
                                  property(MIN_SIZE_PROPERTY_NAME, Integer::parseInt, DEFAULT.minSize),
                                  property(SIZE_RANGE_PROPERTY_NAME, Integer::parseInt, DEFAULT.sizeRange));
    }

    private static <T> T property(String name, Function<String, T> parser, T defaultValue)
    {
        String value = System.getProperty(name);
        if (value == null)
            return defaultValue;

        try
        {
            return parser.apply(value.trim());
        }
        catch (NumberFormatException e)
        {
            logger.warn(String.format("Cannot parse %s=%s, using %s", name, value, defaultValue), e);
            return defaultValue;
        }
    }

    public int maxSize()
    {
        return minSize + sizeRange;
    }

    /**
     * The number of discarded evaluations after which a check gives up: {@code minSuccessful * maxDiscardedFactor},
     * rounded up, and never less than one.
     */
    public int maxDiscarded()
    {
        // in decimal, so that 100 * 0.07 is 7 rather than 7.000000000000001
        BigDecimal max = BigDecimal.valueOf(maxDiscardedFactor)
                                   .multiply(BigDecimal.valueOf(minSuccessful))
                                   .setScale(0, RoundingMode.CEILING);
        if (max.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) >= 0)
            return Integer.MAX_VALUE;
        return Math.max(1, max.intValue());
    }

    /**
     * How many edge cases each generator may contribute before random generation takes over.
     */
    public int maxEdges()
    {
        return minSuccessful / 5;
    }

    public PropertyConfig withMinSuccessful(int minSuccessful)
    {
        return new PropertyConfig(minSuccessful, maxDiscardedFactor, minSize, sizeRange);
    }

    public PropertyConfig withMaxDiscardedFactor(double maxDiscardedFactor)
    {
        return new PropertyConfig(minSuccessful, maxDiscardedFactor, minSize, sizeRange);
    }

    public PropertyConfig withMinSize(int minSize)
    {
        return new PropertyConfig(minSuccessful, maxDiscardedFactor, minSize, sizeRange);
    }

    public PropertyConfig withSizeRange(int sizeRange)
    {
        return new PropertyConfig(minSuccessful, maxDiscardedFactor, minSize, sizeRange);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PropertyConfig that = (PropertyConfig) o;
        return minSuccessful == that.minSuccessful
               && Double.compare(that.maxDiscardedFactor, maxDiscardedFactor) == 0
               && minSize == that.minSize
               && sizeRange == that.sizeRange;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(minSuccessful, maxDiscardedFactor, minSize, sizeRange);
    }

    @Override
    public String toString()
    {
        return "PropertyConfig{" +
               "minSuccessful=" + minSuccessful +
               ", maxDiscardedFactor=" + maxDiscardedFactor +
               ", minSize=" + minSize +
               ", sizeRange=" + sizeRange +
               '}';
    }
}
