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

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Counts and timing produced by running one or more test cases.
 */
public class RunSummary {

    private int total;
    private int failed;
    private int skipped;
    private BigDecimal time = BigDecimal.ZERO;

    public RunSummary() {
    }

    public RunSummary(int total, int failed, int skipped, BigDecimal time) {
        this.total = total;
        this.failed = failed;
        this.skipped = skipped;
        this.time = Objects.requireNonNull(time, "Time cannot be null");
    }

    /**
     * Adds another summary's counts and time to this one.
     */
    public void aggregate(RunSummary other) {
        Objects.requireNonNull(other, "Other summary cannot be null");
        total += other.total;
        failed += other.failed;
        skipped += other.skipped;
        time = time.add(other.time);
    }

    public int getTotal() {
        return total;
    }

    public int getFailed() {
        return failed;
    }

    public int getSkipped() {
        return skipped;
    }

    /**
     * @return elapsed time in seconds
     */
    public BigDecimal getTime() {
        return time;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunSummary that = (RunSummary) o;
        return total == that.total && failed == that.failed && skipped == that.skipped
            && time.compareTo(that.time) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(total, failed, skipped, time.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return String.format("RunSummary{total=%d, failed=%d, skipped=%d, time=%s}", total, failed, skipped, time);
    }
}
