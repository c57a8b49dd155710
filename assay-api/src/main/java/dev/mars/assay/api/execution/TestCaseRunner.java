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

import java.util.concurrent.CompletableFuture;

/**
 * Runs a single test case. Supplied by the execution engine; the test case only hands
 * over its identity and metadata.
 *
 * <p>A context with a non-null skip reason must be reported as skipped without running
 * the test body. The timeout is advisory metadata for the runner to enforce.</p>
 */
@FunctionalInterface
public interface TestCaseRunner {

    CompletableFuture<RunSummary> run(TestCaseRunContext context);
}
