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
package dev.mars.assay.core.testcase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.assay.api.error.AssayErrorCodes;
import dev.mars.assay.api.error.MissingFieldException;
import dev.mars.assay.api.error.SerializationException;
import dev.mars.assay.api.serialization.JsonSerializationInfo;
import dev.mars.assay.api.serialization.SerializationInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes test cases to a JSON envelope {@code {"type": tag, "data": {...}}} and rebuilds
 * them on the other side of a process boundary.
 *
 * <p>Each concrete test case type is registered under a tag together with its
 * {@code fromSerializedForm} factory. Serializing a type that is not registered, or reading
 * an unknown tag, fails with {@link IllegalArgumentException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-15
 * @version 1.0
 */
public class TestCaseSerializer {
    private static final Logger logger = LoggerFactory.getLogger(TestCaseSerializer.class);

    public static final String ASSAY_TYPE = "assay";
    public static final String EXECUTION_ERROR_TYPE = "execution-error";

    static final String TYPE_FIELD = "type";
    static final String DATA_FIELD = "data";
    private static final String ENVELOPE = "test case envelope";

    /**
     * Rebuilds a test case of one registered type.
     */
    @FunctionalInterface
    public interface SerializedFormFactory<T extends TestMethodTestCase> {
        T fromSerializedForm(SerializationInfo info, TestCaseContext context);
    }

    private static final class Registration {
        final String tag;
        final Class<? extends TestMethodTestCase> type;
        final SerializedFormFactory<?> factory;

        Registration(String tag, Class<? extends TestMethodTestCase> type, SerializedFormFactory<?> factory) {
            this.tag = tag;
            this.type = type;
            this.factory = factory;
        }
    }

    private final ObjectMapper objectMapper;
    private final TestCaseContext context;
    private final Map<String, Registration> byTag = new ConcurrentHashMap<>();
    private final Map<Class<?>, Registration> byType = new ConcurrentHashMap<>();

    public TestCaseSerializer(ObjectMapper objectMapper, TestCaseContext context) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
        this.context = Objects.requireNonNull(context, "Test case context cannot be null");
        register(ASSAY_TYPE, AssayTestCase.class, AssayTestCase::fromSerializedForm);
        register(EXECUTION_ERROR_TYPE, ExecutionErrorTestCase.class, ExecutionErrorTestCase::fromSerializedForm);
    }

    public TestCaseSerializer(TestCaseContext context) {
        this(new ObjectMapper(), context);
    }

    /**
     * Registers a test case type under a tag, replacing any previous registration of the tag
     * or of the type.
     */
    public <T extends TestMethodTestCase> void register(String tag, Class<T> type, SerializedFormFactory<T> factory) {
        if (tag == null || tag.trim().isEmpty()) {
            throw new IllegalArgumentException("Type tag cannot be null or empty");
        }
        Objects.requireNonNull(type, "Test case type cannot be null");
        Objects.requireNonNull(factory, "Factory cannot be null");

        Registration registration = new Registration(tag, type, factory);
        Registration previous = byTag.put(tag, registration);
        if (previous != null) {
            byType.remove(previous.type);
        }
        Registration previousForType = byType.put(type, registration);
        if (previousForType != null && !previousForType.tag.equals(tag)) {
            byTag.remove(previousForType.tag);
        }
        logger.debug("Registered test case type {} as '{}'", type.getName(), tag);
    }

    public Set<String> getRegisteredTags() {
        return Set.copyOf(byTag.keySet());
    }

    /**
     * @return the JSON envelope for an initialized or deserialized test case
     */
    public String serialize(TestMethodTestCase testCase) {
        Objects.requireNonNull(testCase, "Test case cannot be null");
        Registration registration = byType.get(testCase.getClass());
        if (registration == null) {
            throw new IllegalArgumentException(String.format("[%s] Test case type %s is not registered",
                AssayErrorCodes.UNKNOWN_SERIALIZED_TYPE, testCase.getClass().getName()));
        }

        JsonSerializationInfo info = new JsonSerializationInfo(objectMapper, registration.type.getName());
        testCase.serialize(info);

        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put(TYPE_FIELD, registration.tag);
        envelope.set(DATA_FIELD, info.getData());
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to write test case '" + testCase.getDisplayName() + "'", e);
        }
    }

    /**
     * Rebuilds a test case from a JSON envelope written by {@link #serialize(TestMethodTestCase)}.
     *
     * @throws IllegalArgumentException if the type tag is not registered
     * @throws SerializationException if the JSON is malformed or a required value is missing
     */
    public TestMethodTestCase deserialize(String json) {
        Objects.requireNonNull(json, "Serialized test case cannot be null");
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Malformed serialized test case", e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new SerializationException("Serialized test case is not a JSON object");
        }

        JsonNode typeNode = envelope.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new MissingFieldException(TYPE_FIELD, ENVELOPE);
        }
        Registration registration = byTag.get(typeNode.asText());
        if (registration == null) {
            throw new IllegalArgumentException(String.format("[%s] Unknown test case type '%s'",
                AssayErrorCodes.UNKNOWN_SERIALIZED_TYPE, typeNode.asText()));
        }

        JsonNode data = envelope.get(DATA_FIELD);
        if (data == null || !data.isObject()) {
            throw new MissingFieldException(DATA_FIELD, ENVELOPE);
        }
        SerializationInfo info = new JsonSerializationInfo(objectMapper, (ObjectNode) data, registration.type.getName());
        return registration.factory.fromSerializedForm(info, context);
    }
}
