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

import javax.annotation.Nullable;

/**
 * Decides what a property's result means: whether the evaluation should be discarded, and otherwise whether it
 * counts as a success.
 */
public interface ResultClassifier<S>
{
    class Verdict
    {
        private static final Verdict SUCCESS = new Verdict(true, null);

        public final boolean success;
        @Nullable
        public final Throwable cause;

        private Verdict(boolean success, @Nullable Throwable cause)
        {
            this.success = success;
            this.cause = cause;
        }

        public static Verdict success()
        {
            return SUCCESS;
        }

        public static Verdict failure(@Nullable Throwable cause)
        {
            return new Verdict(false, cause);
        }
    }

    boolean discard(S result);

    Verdict succeed(S result);
}
