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

import propcheck.api.Fact;
import propcheck.check.ResultClassifier;

/**
 * For properties returning a {@link Fact}: vacuous facts are discarded, yes facts succeed, and a no fact fails the
 * check with the fact's own cause. The outcome is returned as a fact rather than thrown.
 */
public class ExpectationPropCheckerAsserting extends SyncPropCheckerAsserting<Fact, Fact>
{
    static final ExpectationPropCheckerAsserting instance = new ExpectationPropCheckerAsserting();

    @Override
    public boolean discard(Fact result)
    {
        return result.isVacuousYes();
    }

    @Override
    public ResultClassifier.Verdict succeed(Fact result)
    {
        return result.isYes() ? ResultClassifier.Verdict.success() : ResultClassifier.Verdict.failure(result.cause);
    }

    @Override
    protected Fact indicateSuccess(String message)
    {
        return Fact.yes(message);
    }

    @Override
    protected Fact indicateFailure(PropertyCheckReport report)
    {
        return Fact.no(report.message, report.cause);
    }
}
