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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

/**
 * Raised when a property check fails or gives up. Carries the reproducing argument values alongside the rendered
 * message so that callers need not parse the message.
 */
public class PropertyCheckFailedError extends AssertionError
{
    private final String undecoratedMessage;
    @Nullable
    private final SourcePosition position;
    private final List<Object> arguments;
    private final List<String> labels;

    public PropertyCheckFailedError(String message, @Nullable Throwable cause)
    {
        this(message, message, cause, null, ImmutableList.of(), ImmutableList.of());
    }

    /**
     * A failure to throw from a property, tagged with labels that are reported alongside the failing arguments.
     */
    public static PropertyCheckFailedError labeled(String message, String... labels)
    {
        return new PropertyCheckFailedError(message, message, null, null, ImmutableList.of(), ImmutableList.copyOf(labels));
    }

    public PropertyCheckFailedError(String message, String undecoratedMessage, @Nullable Throwable cause,
                                    @Nullable SourcePosition position, List<Object> arguments, List<String> labels)
    {
        super(message, cause);
        this.undecoratedMessage = undecoratedMessage;
        this.position = position;
        // values may legitimately be null, so no ImmutableList here
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.labels = ImmutableList.copyOf(labels);
    }

    /**
     * The short form of the message, without argument values or locations.
     */
    public String undecoratedMessage()
    {
        return undecoratedMessage;
    }

    @Nullable
    public SourcePosition position()
    {
        return position;
    }

    @Nullable
    public String failedCodeFileNameAndLineNumber()
    {
        return position == null ? null : position.fileNameAndLineNumber();
    }

    public List<Object> arguments()
    {
        return arguments;
    }

    public List<String> labels()
    {
        return labels;
    }
}
