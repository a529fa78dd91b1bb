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

import propcheck.utils.Invariants;

/**
 * Size bounds handed to a {@link Generator} for one draw: generated values should have a size in
 * {@code [minSize, maxSize()]}, and {@link #size} is the size picked for this particular draw.
 */
public final class SizeParam
{
    public final int minSize;
    public final int sizeRange;
    public final int size;

    public SizeParam(int minSize, int sizeRange, int size)
    {
        Invariants.isNatural(minSize, "minSize");
        Invariants.isNatural(sizeRange, "sizeRange");
        Invariants.checkArgument(size >= minSize && size - minSize <= sizeRange,
                                 "size (%d) must be within [%d, %d]", size, minSize, (long) minSize + sizeRange);
        this.minSize = minSize;
        this.sizeRange = sizeRange;
        this.size = size;
    }

    public int maxSize()
    {
        return minSize + sizeRange;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SizeParam that = (SizeParam) o;
        return minSize == that.minSize && sizeRange == that.sizeRange && size == that.size;
    }

    @Override
    public int hashCode()
    {
        return (minSize * 31 + sizeRange) * 31 + size;
    }

    @Override
    public String toString()
    {
        return "SizeParam{" + minSize + ".." + maxSize() + ", size=" + size + '}';
    }
}
