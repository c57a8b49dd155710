package dev.mars.assay.api.execution;

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

import dev.mars.assay.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Execution Support Tests")
class ExecutionSupportTest {

    @Test
    @DisplayName("Should aggregate run summaries")
    void testRunSummaryAggregate() {
        RunSummary summary = new RunSummary();
        summary.aggregate(new RunSummary(3, 1, 1, new BigDecimal("0.5")));
        summary.aggregate(new RunSummary(2, 0, 1, new BigDecimal("0.25")));

        assertEquals(new RunSummary(5, 1, 2, new BigDecimal("0.750")), summary);
        assertEquals(5, summary.getTotal());
    }

    @Test
    @DisplayName("Should collect exceptions and combine them as suppressed")
    void testExceptionAggregator() {
        ExceptionAggregator aggregator = new ExceptionAggregator();
        assertNull(aggregator.toException());

        aggregator.run(() -> {
            throw new IllegalStateException("first");
        });
        aggregator.add(new IllegalArgumentException("second"));
        aggregator.run(() -> { });

        assertTrue(aggregator.hasExceptions());
        assertEquals(2, aggregator.getExceptions().size());
        Throwable combined = aggregator.toException();
        assertEquals("first", combined.getMessage());
        assertEquals("second", combined.getSuppressed()[0].getMessage());

        aggregator.clear();
        assertFalse(aggregator.hasExceptions());
    }

    @Test
    @DisplayName("Should signal cooperative cancellation")
    void testCancellationToken() {
        CancellationToken token = new CancellationToken();
        token.throwIfCancellationRequested();

        token.cancel();

        assertTrue(token.isCancellationRequested());
        assertThrows(CancellationException.class, token::throwIfCancellationRequested);
    }
}
