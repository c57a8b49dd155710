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

/**
 * Base type for messages that relate to a test assembly.
 */
public abstract class TestAssemblyMessage extends AssayMessage {

    private final String assemblyUniqueId;

    protected TestAssemblyMessage(String assemblyUniqueId) {
        this.assemblyUniqueId = requireNonEmpty(assemblyUniqueId, "assemblyUniqueId");
    }

    public String getAssemblyUniqueId() {
        return assemblyUniqueId;
    }

    static String requireNonEmpty(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
        return value;
    }

    @Override
    public String toString() {
        return super.toString() + " assembly=" + assemblyUniqueId;
    }
}
