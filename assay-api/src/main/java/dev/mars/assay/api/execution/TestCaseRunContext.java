/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.assay.api.execution;

import dev.mars.assay.api.TestCase;
import dev.mars.assay.api.identity.TestCaseIdentity;
import dev.mars.assay.api.messages.MessageSink;

/**
 * Everything a {@link TestCaseRunner} needs to run one test case.
 *
 * @param testCase             the test case
 * @param identity             the test case's position in the hierarchy
 * @param displayName          the display name to report
 * @param skipReason           the skip reason, or null when the case runs
 * @param timeout              timeout in milliseconds, 0 for none
 * @param constructorArguments arguments for the test class constructor
 * @param testMethodArguments  arguments for the test method, or null
 * @param diagnosticMessageSink sink for diagnostics
 * @param messageBus           bus for execution messages
 * @param aggregator           collects exceptions raised by the runner
 * @param cancellationToken    cooperative cancellation flag
 */
public record TestCaseRunContext(
    TestCase testCase,
    TestCaseIdentity identity,
    String displayName,
    String skipReason,
    int timeout,
    Object[] constructorArguments,
    Object[] testMethodArguments,
    MessageSink diagnosticMessageSink,
    MessageBus messageBus,
    ExceptionAggregator aggregator,
    CancellationToken cancellationToken
) {

    public boolean isSkipped() {
        return skipReason != null;
    }
}
