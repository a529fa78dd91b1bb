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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class PropertyConfigTest
{
    @Test
    public void defaults()
    {
        PropertyConfig config = PropertyConfig.DEFAULT;
        assertThat(config.minSuccessful).isEqualTo(10);
        assertThat(config.maxDiscardedFactor).isEqualTo(5.0);
        assertThat(config.minSize).isZero();
        assertThat(config.sizeRange).isEqualTo(100);
        assertThat(config.maxSize()).isEqualTo(100);
        assertThat(config.maxDiscarded()).isEqualTo(50);
        assertThat(config.maxEdges()).isEqualTo(2);
    }

    @Test
    public void maxDiscardedRoundsUp()
    {
        assertThat(new PropertyConfig(3, 0.5, 0, 0).maxDiscarded()).isEqualTo(2);
        assertThat(new PropertyConfig(3, 1.0, 0, 0).maxDiscarded()).isEqualTo(3);
        assertThat(new PropertyConfig(7, 1.1, 0, 0).maxDiscarded()).isEqualTo(8);
        assertThat(new PropertyConfig(1, 0.01, 0, 0).maxDiscarded()).isEqualTo(1);
        assertThat(new PropertyConfig(Integer.MAX_VALUE, 10, 0, 0).maxDiscarded()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    public void maxDiscardedExactProducts()
    {
        assertThat(new PropertyConfig(100, 0.07, 0, 0).maxDiscarded()).isEqualTo(7);
        assertThat(new PropertyConfig(100, 0.14, 0, 0).maxDiscarded()).isEqualTo(14);
        assertThat(new PropertyConfig(10, 0.3, 0, 0).maxDiscarded()).isEqualTo(3);
        assertThat(new PropertyConfig(100, 0.071, 0, 0).maxDiscarded()).isEqualTo(8);
    }

    @Test
    public void rejectsInvalid()
    {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PropertyConfig(0, 5.0, 0, 100));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PropertyConfig(-1, 5.0, 0, 100));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PropertyConfig(10, 0, 0, 100));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PropertyConfig(10, Double.NaN, 0, 100));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PropertyConfig(10, Double.POSITIVE_INFINITY, 0, 100));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PropertyConfig(10, 5.0, -1, 100));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PropertyConfig(10, 5.0, 0, -1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PropertyConfig(10, 5.0, Integer.MAX_VALUE, 1));
    }

    @Test
    public void withCopies()
    {
        PropertyConfig config = PropertyConfig.DEFAULT.withMinSuccessful(25)
                                                      .withMaxDiscardedFactor(2.0)
                                                      .withMinSize(3)
                                                      .withSizeRange(7);
        assertThat(config).isEqualTo(new PropertyConfig(25, 2.0, 3, 7));
        assertThat(config.maxSize()).isEqualTo(10);
        assertThat(PropertyConfig.DEFAULT.minSuccessful).isEqualTo(10);
    }

    @Test
    public void systemProperties()
    {
        System.setProperty(PropertyConfig.MIN_SUCCESSFUL_PROPERTY_NAME, "25");
        System.setProperty(PropertyConfig.SIZE_RANGE_PROPERTY_NAME, " 7 ");
        System.setProperty(PropertyConfig.MAX_DISCARDED_FACTOR_PROPERTY_NAME, "lots");
        try
        {
            PropertyConfig config = PropertyConfig.fromSystemProperties();
            assertThat(config.minSuccessful).isEqualTo(25);
            assertThat(config.sizeRange).isEqualTo(7);
            assertThat(config.maxDiscardedFactor).isEqualTo(PropertyConfig.DEFAULT.maxDiscardedFactor);
            assertThat(config.minSize).isEqualTo(PropertyConfig.DEFAULT.minSize);
        }
        finally
        {
            System.clearProperty(PropertyConfig.MIN_SUCCESSFUL_PROPERTY_NAME);
            System.clearProperty(PropertyConfig.SIZE_RANGE_PROPERTY_NAME);
            System.clearProperty(PropertyConfig.MAX_DISCARDED_FACTOR_PROPERTY_NAME);
        }
        assertThat(PropertyConfig.fromSystemProperties()).isEqualTo(PropertyConfig.DEFAULT);
    }
}
