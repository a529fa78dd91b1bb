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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

import propcheck.utils.Invariants;

/**
 * Where a property check was invoked from. Only used to point failure reports at the right line.
 */
public final class SourcePosition
{
    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    public final String fileName;
    public final int lineNumber;

    public SourcePosition(String fileName, int lineNumber)
    {
        this.fileName = Invariants.nonNull(fileName, "fileName");
        this.lineNumber = lineNumber;
    }

    public static SourcePosition of(String fileName, int lineNumber)
    {
        return new SourcePosition(fileName, lineNumber);
    }

    /**
     * The position of the first stack frame that does not belong to {@code skip}, i.e. the caller of the API
     * represented by those classes.
     */
    @Nullable
    public static SourcePosition callerOf(Class<?>... skip)
    {
        Set<Class<?>> skipped = new HashSet<>(Arrays.asList(skip));
        skipped.add(SourcePosition.class);
        Optional<StackWalker.StackFrame> frame = WALKER.walk(frames -> frames.filter(f -> !skipped.contains(f.getDeclaringClass()))
                                                                              .findFirst());
        return frame.filter(f -> f.getFileName() != null)
                    .map(f -> new SourcePosition(f.getFileName(), f.getLineNumber()))
                    .orElse(null);
    }

    /**
     * The position the given throwable was raised from, if its stack trace carries source information.
     */
    @Nullable
    public static SourcePosition thrownFrom(Throwable t)
    {
        StackTraceElement[] trace = t.getStackTrace();
        if (trace == null || trace.length == 0 || trace[0].getFileName() == null || trace[0].getLineNumber() < 0)
            return null;
        return new SourcePosition(trace[0].getFileName(), trace[0].getLineNumber());
    }

    public String fileNameAndLineNumber()
    {
        return fileName + ':' + lineNumber;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourcePosition that = (SourcePosition) o;
        return lineNumber == that.lineNumber && fileName.equals(that.fileName);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(fileName, lineNumber);
    }

    @Override
    public String toString()
    {
        return fileNameAndLineNumber();
    }
}
