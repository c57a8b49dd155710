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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Derives stable unique IDs for each level of the test hierarchy.
 *
 * <p>Each ID is the lowercase hex SHA-256 digest of its parent ID followed by the
 * identifying strings of the level. Inputs are NUL-separated so that adjacent inputs
 * cannot run together.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public final class UniqueIdGenerator {

    private UniqueIdGenerator() {
        // Utility class - no instantiation
    }

    public static String forAssembly(String assemblyName, String configFilePath) {
        requireNonEmpty(assemblyName, "assemblyName");
        return hash(assemblyName, configFilePath);
    }

    public static String forTestCollection(String assemblyUniqueId, String collectionDisplayName) {
        requireNonEmpty(assemblyUniqueId, "assemblyUniqueId");
        requireNonEmpty(collectionDisplayName, "collectionDisplayName");
        return hash(assemblyUniqueId, collectionDisplayName);
    }

    /**
     * @return the class ID, or null when {@code className} is null
     */
    public static String forTestClass(String collectionUniqueId, String className) {
        requireNonEmpty(collectionUniqueId, "collectionUniqueId");
        if (className == null) {
            return null;
        }
        return hash(collectionUniqueId, className);
    }

    /**
     * @return the method ID, or null when either input is null
     */
    public static String forTestMethod(String classUniqueId, String methodName) {
        if (classUniqueId == null || methodName == null) {
            return null;
        }
        return hash(classUniqueId, methodName);
    }

    /**
     * Derives a test case ID from its parent and its argument keys.
     *
     * @param parentUniqueId the method ID, or the collection ID when there is no method
     * @param argumentKeys   one lossless encoding per test method argument (may be empty)
     */
    public static String forTestCase(String parentUniqueId, List<String> argumentKeys) {
        requireNonEmpty(parentUniqueId, "parentUniqueId");
        String[] parts = new String[argumentKeys.size() + 1];
        parts[0] = parentUniqueId;
        for (int i = 0; i < argumentKeys.size(); i++) {
            parts[i + 1] = argumentKeys.get(i);
        }
        return hash(parts);
    }

    private static String hash(String... parts) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available on this JVM", e);
        }
        for (String part : parts) {
            if (part != null) {
                digest.update(part.getBytes(StandardCharsets.UTF_8));
            }
            digest.update((byte) 0);
        }
        byte[] bytes = digest.digest();
        StringBuilder hex = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            hex.append(String.format("%02x", b));
        }
        return hex.toString();
    }

    private static void requireNonEmpty(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
    }
}
