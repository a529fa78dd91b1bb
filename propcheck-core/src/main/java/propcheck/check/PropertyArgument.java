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

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * One value fed to a property, with the name of the parameter it was fed to where known.
 */
public final class PropertyArgument
{
    @Nullable
    public final String label;
    @Nullable
    public final Object value;

    public PropertyArgument(@Nullable String label, @Nullable Object value)
    {
        this.label = label;
        this.value = value;
    }

    public PropertyArgument withLabel(String label)
    {
        return new PropertyArgument(label, value);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PropertyArgument that = (PropertyArgument) o;
        return Objects.equals(label, that.label) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(label, value);
    }

    @Override
    public String toString()
    {
        return (label == null ? "?" : label) + '=' + value;
    }
}
