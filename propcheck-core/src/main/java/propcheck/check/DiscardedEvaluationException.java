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

/**
 * Thrown by a property to discard the current evaluation, typically because the generated arguments do not satisfy a
 * precondition. Discarded evaluations count neither as successes nor as failures; a check gives up once too many
 * evaluations have been discarded.
 */
public class DiscardedEvaluationException extends RuntimeException
{
    public DiscardedEvaluationException()
    {
        super(null, null, false, false);
    }

    public DiscardedEvaluationException(String message)
    {
        super(message, null, false, false);
    }
}
