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
package dev.mars.assay.api.messages;

import java.math.BigDecimal;

/**
 * Aggregate counts and timing for a completed scope of execution.
 *
 * <p>Valid summaries satisfy {@code testsRun >= testsFailed + testsSkipped}; producers
 * are responsible for that, it is not checked here.</p>
 */
public interface ExecutionSummaryMetadata {

    /**
     * @return the elapsed time in seconds
     */
    BigDecimal getExecutionTime();

    int getTestsRun();

    int getTestsFailed();

    int getTestsSkipped();
}
