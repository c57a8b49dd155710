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
 * Base type for messages that relate to a test collection.
 */
public abstract class TestCollectionMessage extends TestAssemblyMessage {

    private final String collectionUniqueId;

    protected TestCollectionMessage(String assemblyUniqueId, String collectionUniqueId) {
        super(assemblyUniqueId);
        this.collectionUniqueId = requireNonEmpty(collectionUniqueId, "collectionUniqueId");
    }

    public String getCollectionUniqueId() {
        return collectionUniqueId;
    }

    @Override
    public String toString() {
        return super.toString() + " collection=" + collectionUniqueId;
    }
}
