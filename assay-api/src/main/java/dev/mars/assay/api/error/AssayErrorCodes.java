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
package dev.mars.assay.api.error;

/**
 * Standard error and diagnostic codes for the Assay framework.
 *
 * Code ranges:
 * - ASYERR0001-0049: General errors
 * - ASYERR0100-0149: Lifecycle/initialization errors
 * - ASYERR0200-0249: Serialization errors
 * - ASYINF0300-0349: Trait discovery diagnostics (non-fatal)
 */
public final class AssayErrorCodes {

    private AssayErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "ASYERR0001";
    public static final String INVALID_ARGUMENT = "ASYERR0002";

    // ========================================================================
    // Lifecycle Errors (0100-0149)
    // ========================================================================
    public static final String UNINITIALIZED_PROPERTY = "ASYERR0100";
    public static final String ALREADY_INITIALIZED = "ASYERR0101";
    public static final String MISSING_FACT_ATTRIBUTE = "ASYERR0102";

    // ========================================================================
    // Serialization Errors (0200-0249)
    // ========================================================================
    public static final String MISSING_FIELD = "ASYERR0200";
    public static final String SERIALIZATION_FAILED = "ASYERR0201";
    public static final String UNKNOWN_SERIALIZED_TYPE = "ASYERR0202";

    // ========================================================================
    // Trait Discovery Diagnostics (0300-0349)
    // ========================================================================
    public static final String UNRESOLVED_TRAIT_DISCOVERER = "ASYINF0300";
    public static final String TRAIT_DISCOVERER_FAILED = "ASYINF0301";
}
