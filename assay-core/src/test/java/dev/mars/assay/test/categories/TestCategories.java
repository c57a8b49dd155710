package dev.mars.assay.test.categories;

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

/**
 * Tag names used to select test groups with Maven Surefire {@code groups}.
 */
public final class TestCategories {

    /**
     * Core tests - fast unit tests with test doubles only, no external infrastructure.
     */
    public static final String CORE = "core";

    /**
     * Integration tests - exercise several components together through reflection.
     */
    public static final String INTEGRATION = "integration";

    private TestCategories() {
        // Utility class - no instantiation
    }
}
