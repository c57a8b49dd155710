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

import dev.mars.assay.api.util.WriteOnce;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Published when a test collection has finished executing, meaning every test class in
 * the collection has finished.
 *
 * <p>Each summary field is written once by the producer and can only be read after it has
 * been written. Values are stored as given; no range checks are applied.</p>
 */
public class TestCollectionFinished extends TestCollectionMessage implements ExecutionSummaryMetadata {

    private final WriteOnce<BigDecimal> executionTime = new WriteOnce<>("ExecutionTime", getClass());
    private final WriteOnce<Integer> testsFailed = new WriteOnce<>("TestsFailed", getClass());
    private final WriteOnce<Integer> testsRun = new WriteOnce<>("TestsRun", getClass());
    private final WriteOnce<Integer> testsSkipped = new WriteOnce<>("TestsSkipped", getClass());

    public TestCollectionFinished(String assemblyUniqueId, String collectionUniqueId) {
        super(assemblyUniqueId, collectionUniqueId);
    }

    @Override
    public BigDecimal getExecutionTime() {
        return executionTime.get();
    }

    public void setExecutionTime(BigDecimal value) {
        executionTime.set(Objects.requireNonNull(value, "Execution time cannot be null"));
    }

    @Override
    public int getTestsFailed() {
        return testsFailed.get();
    }

    public void setTestsFailed(int value) {
        testsFailed.set(value);
    }

    @Override
    public int getTestsRun() {
        return testsRun.get();
    }

    public void setTestsRun(int value) {
        testsRun.set(value);
    }

    @Override
    public int getTestsSkipped() {
        return testsSkipped.get();
    }

    public void setTestsSkipped(int value) {
        testsSkipped.set(value);
    }

    @Override
    public String toString() {
        return super.toString() + " run=" + testsRun + " failed=" + testsFailed
            + " skipped=" + testsSkipped + " time=" + executionTime;
    }
}
