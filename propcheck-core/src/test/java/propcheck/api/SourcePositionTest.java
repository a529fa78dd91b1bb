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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SourcePositionTest
{
    @Test
    public void callerSkipsGivenClasses()
    {
        SourcePosition position = Helper.where();
        assertThat(position).isNotNull();
        assertThat(position.fileName).isEqualTo("SourcePositionTest.java");
        assertThat(position.lineNumber).isPositive();
    }

    @Test
    public void thrownFrom()
    {
        Throwable t = new RuntimeException();
        t.setStackTrace(new StackTraceElement[]{ new StackTraceElement("a.B", "c", "B.java", 7) });
        assertThat(SourcePosition.thrownFrom(t)).isEqualTo(SourcePosition.of("B.java", 7));

        t.setStackTrace(new StackTraceElement[]{ new StackTraceElement("a.B", "c", null, -1) });
        assertThat(SourcePosition.thrownFrom(t)).isNull();

        t.setStackTrace(new StackTraceElement[0]);
        assertThat(SourcePosition.thrownFrom(t)).isNull();
    }

    @Test
    public void format()
    {
        assertThat(SourcePosition.of("Foo.java", 12).fileNameAndLineNumber()).isEqualTo("Foo.java:12");
    }

    static class Helper
    {
        static SourcePosition where()
        {
            return SourcePosition.callerOf(Helper.class);
        }
    }
}
