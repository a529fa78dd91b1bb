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

package propcheck.asserting;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import propcheck.api.Prettifier;
import propcheck.check.PropertyArgument;

import static org.assertj.core.api.Assertions.assertThat;

public class FailureMessagesTest
{
    @Test
    public void exhausted()
    {
        assertThat(FailureMessages.propCheckExhausted(0, 50))
            .isEqualTo("Gave up after 0 successful property evaluations. 50 evaluations were discarded.");
        assertThat(FailureMessages.propCheckExhausted(1, 1))
            .isEqualTo("Gave up after 1 successful property evaluation. 1 evaluation was discarded.");
    }

    @Test
    public void failed()
    {
        assertThat(FailureMessages.propertyFailed(1)).isEqualTo("Property failed after 1 successful evaluation.");
        assertThat(FailureMessages.propertyFailed(3)).isEqualTo("Property failed after 3 successful evaluations.");
        assertThat(FailureMessages.propertyException("IllegalStateException"))
            .isEqualTo("IllegalStateException was thrown during property evaluation.");
    }

    @Test
    public void prettyArgs()
    {
        String args = FailureMessages.prettyArgs(ImmutableList.of(new PropertyArgument("x", 4),
                                                                  new PropertyArgument(null, "four"),
                                                                  new PropertyArgument("z", new int[]{ 1, 2 })),
                                                 Prettifier.DEFAULT);
        assertThat(args).isEqualTo("    x = 4,\n" +
                                   "    arg1 = \"four\",\n" +
                                   "    z = [1, 2]");
    }

    @Test
    public void labels()
    {
        assertThat(FailureMessages.labelDisplay(ImmutableList.of())).isEmpty();
        assertThat(FailureMessages.labelDisplay(ImmutableList.of("a"))).isEqualTo("\n  Label of failing property:\n    a");
        assertThat(FailureMessages.labelDisplay(ImmutableList.of("a", "b"))).isEqualTo("\n  Labels of failing property:\n    a\n    b");
    }
}
