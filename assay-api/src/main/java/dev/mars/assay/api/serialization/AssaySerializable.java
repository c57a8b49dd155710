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
package dev.mars.assay.api.serialization;

/**
 * Contract for objects that can be flattened into a {@link SerializationInfo} and
 * rebuilt from one, so they can cross a process boundary.
 *
 * <p>Subtypes that add state must call {@code super.serialize(info)} before writing their
 * own keys, and {@code super.deserialize(info)} before reading them. {@code deserialize}
 * reads back every key {@code serialize} writes and treats optional keys that are absent
 * as {@code null}.</p>
 */
public interface AssaySerializable {

    void serialize(SerializationInfo info);

    void deserialize(SerializationInfo info);
}
