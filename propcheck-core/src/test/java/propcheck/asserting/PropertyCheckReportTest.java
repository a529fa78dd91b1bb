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

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import propcheck.api.Prettifier;
import propcheck.api.PropertyCheckFailedError;
import propcheck.api.SourcePosition;
import propcheck.check.PropertyArgument;
import propcheck.check.PropertyCheckResult;

import static org.assertj.core.api.Assertions.assertThat;

public class PropertyCheckReportTest
{
    private static final SourcePosition POSITION = SourcePosition.of("ExampleTest.java", 12);
    private static final List<String> XY = ImmutableList.of("x", "y");
    private static final List<PropertyArgument> ARGS = ImmutableList.of(new PropertyArgument("x", 4), new PropertyArgument("y", 5));

    private static Throwable withoutTrace(Throwable t)
    {
        t.setStackTrace(new StackTraceElement[0]);
        return t;
    }

    @Test
    public void success()
    {
        PropertyCheckReport report = PropertyCheckReport.render(new PropertyCheckResult.Success(1, ARGS), Prettifier.DEFAULT, POSITION, null);
        assertThat(report.isSuccess()).isTrue();
        assertThat(report.message).isEqualTo("Property check succeeded");
        assertThat(report.arguments).isEqualTo(ARGS);
    }

    @Test
    public void exhausted()
    {
        PropertyCheckReport report = PropertyCheckReport.render(new PropertyCheckResult.Exhausted(1, 3, 50, XY, ARGS), Prettifier.DEFAULT, POSITION, null);
        assertThat(report.kind).isEqualTo(PropertyCheckResult.Kind.EXHAUSTED);
        assertThat(report.message).isEqualTo("Gave up after 3 successful property evaluations. 50 evaluations were discarded.");
        assertThat(report.arguments).isEmpty();
        assertThat(report.cause).isNull();
    }

    @Test
    public void failureWithCause()
    {
        Throwable cause = withoutTrace(new IllegalArgumentException("bad value"));
        PropertyCheckResult result = new PropertyCheckResult.Failure(42, 1, cause, XY, ARGS, ImmutableList.of("positive", "small", "positive"));
        PropertyCheckReport report = PropertyCheckReport.render(result, Prettifier.DEFAULT, POSITION, null);
        assertThat(report.message).isEqualTo("IllegalArgumentException was thrown during property evaluation.\n" +
                                             " (ExampleTest.java:12)\n" +
                                             "  Message: bad value\n" +
                                             "  Property failed after 1 successful evaluation.\n" +
                                             "  Init Seed: 42\n" +
                                             "  Occurred when passed generated values (\n" +
                                             "    x = 4,\n" +
                                             "    y = 5\n" +
                                             "  )\n" +
                                             "  Labels of failing property:\n" +
                                             "    positive\n" +
                                             "    small");
        assertThat(report.undecoratedMessage).isEqualTo("Property failed after 1 successful evaluation.");
        assertThat(report.labels).containsExactly("positive", "small");
        assertThat(report.cause).isSameAs(cause);
        assertThat(report.argumentValues()).containsExactly(4, 5);
    }

    @Test
    public void failureWithoutCause()
    {
        PropertyCheckResult result = new PropertyCheckResult.Failure(7, 0, null, XY, ARGS);
        PropertyCheckReport report = PropertyCheckReport.render(result, Prettifier.DEFAULT, null, null);
        assertThat(report.message).isEqualTo("PropertyCheckFailedError was thrown during property evaluation.\n" +
                                             "  Property failed after 0 successful evaluations.\n" +
                                             "  Init Seed: 7\n" +
                                             "  Occurred when passed generated values (\n" +
                                             "    x = 4,\n" +
                                             "    y = 5\n" +
                                             "  )");
    }

    @Test
    public void failureLocation()
    {
        Throwable cause = new IllegalStateException();
        cause.setStackTrace(new StackTraceElement[]{ new StackTraceElement("example.Thing", "run", "Thing.java", 33) });
        PropertyCheckReport report = PropertyCheckReport.render(new PropertyCheckResult.Failure(7, 0, cause, XY, ARGS), Prettifier.DEFAULT, null, null);
        assertThat(report.message).contains("\n  Location: (Thing.java:33)\n")
                                  .doesNotContain("Message:");
    }

    @Test
    public void multiLineMessageIsIndented()
    {
        Throwable cause = withoutTrace(new AssertionError("expected: 1\nbut was: 2"));
        PropertyCheckReport report = PropertyCheckReport.render(new PropertyCheckResult.Failure(7, 0, cause, XY, ARGS), Prettifier.DEFAULT, null, null);
        assertThat(report.message).contains("  Message: expected: 1\n    but was: 2\n");
    }

    @Test
    public void renderingIsRepeatable()
    {
        Throwable cause = new IllegalArgumentException("bad value");
        PropertyCheckResult result = new PropertyCheckResult.Failure(42, 1, cause, XY, ARGS);
        PropertyCheckReport first = PropertyCheckReport.render(result, Prettifier.DEFAULT, POSITION, null);
        PropertyCheckReport second = PropertyCheckReport.render(result, Prettifier.DEFAULT, POSITION, null);
        assertThat(second.message).isEqualTo(first.message);
        assertThat(second.arguments).isEqualTo(first.arguments);
    }

    @Test
    public void argNamesOverrideLabels()
    {
        PropertyCheckResult result = new PropertyCheckResult.Failure(7, 0, null, XY, ARGS);
        assertThat(PropertyCheckReport.render(result, Prettifier.DEFAULT, null, ImmutableList.of("width", "height")).message)
            .contains("    width = 4,\n    height = 5\n");
        assertThat(PropertyCheckReport.render(result, Prettifier.DEFAULT, null, ImmutableList.of("width")).message)
            .contains("    x = 4,\n    y = 5\n");
    }

    @Test
    public void customPrettifier()
    {
        PropertyCheckResult result = new PropertyCheckResult.Failure(7, 0, null, XY, ARGS);
        String message = PropertyCheckReport.render(result, value -> "<" + value + ">", null, null).message;
        assertThat(message).contains("    x = <4>,\n    y = <5>\n");
    }

    @Test
    public void toError()
    {
        Throwable cause = new IllegalArgumentException("bad value");
        PropertyCheckResult result = new PropertyCheckResult.Failure(42, 1, cause, XY, ARGS, ImmutableList.of("small"));
        PropertyCheckReport report = PropertyCheckReport.render(result, Prettifier.DEFAULT, POSITION, null);
        PropertyCheckFailedError error = report.toError();
        assertThat(error).hasMessage(report.message);
        assertThat(error.getCause()).isSameAs(cause);
        assertThat(error.undecoratedMessage()).isEqualTo("Property failed after 1 successful evaluation.");
        assertThat(error.arguments()).containsExactly(4, 5);
        assertThat(error.labels()).containsExactly("small");
        assertThat(error.failedCodeFileNameAndLineNumber()).isEqualTo("ExampleTest.java:12");
    }
}
