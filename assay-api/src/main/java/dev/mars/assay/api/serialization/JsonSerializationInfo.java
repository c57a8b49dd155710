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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.assay.api.error.MissingFieldException;
import dev.mars.assay.api.error.SerializationException;

import java.util.Objects;

/**
 * Jackson-backed {@link SerializationInfo} that keeps its values in a JSON object.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class JsonSerializationInfo implements SerializationInfo {

    private final ObjectMapper objectMapper;
    private final ObjectNode data;
    private final String ownerTypeName;

    public JsonSerializationInfo(ObjectMapper objectMapper, String ownerTypeName) {
        this(objectMapper, objectMapper.createObjectNode(), ownerTypeName);
    }

    public JsonSerializationInfo(ObjectMapper objectMapper, ObjectNode data, String ownerTypeName) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
        this.data = Objects.requireNonNull(data, "Data cannot be null");
        this.ownerTypeName = Objects.requireNonNull(ownerTypeName, "Owner type name cannot be null");
    }

    /**
     * Parses a bag from the JSON produced by {@link #toJson()}.
     *
     * @throws SerializationException if the text is not a JSON object
     */
    public static JsonSerializationInfo fromJson(ObjectMapper objectMapper, String json, String ownerTypeName) {
        Objects.requireNonNull(json, "JSON cannot be null");
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Malformed serialization data for '" + ownerTypeName + "'", e);
        }
        if (node == null || !node.isObject()) {
            throw new SerializationException("Serialization data for '" + ownerTypeName + "' is not a JSON object");
        }
        return new JsonSerializationInfo(objectMapper, (ObjectNode) node, ownerTypeName);
    }

    @Override
    public void addValue(String key, Object value) {
        Objects.requireNonNull(key, "Key cannot be null");
        if (value == null) {
            data.putNull(key);
            return;
        }
        try {
            data.set(key, objectMapper.valueToTree(value));
        } catch (IllegalArgumentException e) {
            throw new SerializationException(
                "Cannot serialize value of type " + value.getClass().getName() + " for key '" + key + "'", e);
        }
    }

    @Override
    public <T> T getValue(String key, Class<T> type) {
        JsonNode node = data.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SerializationException(
                "Value for key '" + key + "' of '" + ownerTypeName + "' is not a " + type.getSimpleName(), e);
        }
    }

    @Override
    public <T> T getRequiredValue(String key, Class<T> type) {
        T value = getValue(key, type);
        if (value == null) {
            throw new MissingFieldException(key, ownerTypeName);
        }
        return value;
    }

    @Override
    public boolean hasValue(String key) {
        return data.has(key);
    }

    @Override
    public String getOwnerTypeName() {
        return ownerTypeName;
    }

    public ObjectNode getData() {
        return data;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to write serialization data for '" + ownerTypeName + "'", e);
        }
    }

    @Override
    public String toString() {
        return "JsonSerializationInfo{owner='" + ownerTypeName + "', data=" + data + "}";
    }
}
