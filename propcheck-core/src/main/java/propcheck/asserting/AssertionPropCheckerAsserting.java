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

import propcheck.api.Assertion;
import propcheck.check.ResultClassifier;

/**
 * For properties that signal failure only by throwing: nothing is discarded, every normal return is a success, and
 * a failed check throws a {@link propcheck.api.PropertyCheckFailedError}.
 */
public class AssertionPropCheckerAsserting extends SyncPropCheckerAsserting<Assertion, Assertion>
{
    static final AssertionPropCheckerAsserting instance = new AssertionPropCheckerAsserting();

    @Override
    public boolean discard(Assertion result)
    {
        return false;
    }

    @Override
    public ResultClassifier.Verdict succeed(Assertion result)
    {
        return ResultClassifier.Verdict.success();
    }

    @Override
    protected Assertion indicateSuccess(String message)
    {
        return Assertion.SUCCEEDED;
    }

    @Override
    protected Assertion indicateFailure(PropertyCheckReport report)
    {
        throw report.toError();
    }
}
