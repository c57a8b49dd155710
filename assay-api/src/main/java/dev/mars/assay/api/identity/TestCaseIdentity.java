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
package dev.mars.assay.api.identity;

/**
 * The addressable position of a test case within the test hierarchy.
 *
 * <p>The assembly and collection IDs are always present. The class and method IDs are
 * {@code null} for test cases that do not belong to a class or method (for example,
 * dynamically generated cases). IDs are opaque and assigned by discovery.</p>
 *
 * @param assemblyUniqueId   the test assembly unique ID (required, non-empty)
 * @param collectionUniqueId the test collection unique ID (required, non-empty)
 * @param classUniqueId      the test class unique ID, or null
 * @param methodUniqueId     the test method unique ID, or null
 */
public record TestCaseIdentity(
    String assemblyUniqueId,
    String collectionUniqueId,
    String classUniqueId,
    String methodUniqueId
) {

    public TestCaseIdentity {
        requireNonEmpty(assemblyUniqueId, "assemblyUniqueId");
        requireNonEmpty(collectionUniqueId, "collectionUniqueId");
    }

    /**
     * Creates an identity that has no class or method level.
     */
    public static TestCaseIdentity of(String assemblyUniqueId, String collectionUniqueId) {
        return new TestCaseIdentity(assemblyUniqueId, collectionUniqueId, null, null);
    }

    private static void requireNonEmpty(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
    }
}
