package dev.mars.assay.core.testcase;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.assay.api.error.AssayErrorCodes;
import dev.mars.assay.api.error.MissingFieldException;
import dev.mars.assay.api.error.SerializationException;
import dev.mars.assay.api.error.UninitializedPropertyException;
import dev.mars.assay.api.identity.SourceInformation;
import dev.mars.assay.api.identity.TestCaseIdentity;
import dev.mars.assay.api.introspection.TestMethod;
import dev.mars.assay.api.serialization.JsonSerializationInfo;
import dev.mars.assay.core.Mocks;
import dev.mars.assay.core.traits.TraitAttributeCache;
import dev.mars.assay.test.categories.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Test Case Serializer Tests")
class TestCaseSerializerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TestMethod testMethod;
    private TestCaseContext context;
    private TestCaseSerializer serializer;

    @BeforeEach
    void setUp() {
        testMethod = Mocks.testMethod("adds", List.of("a", "b"),
            Mocks.factAttribute(null, "flaky", 250), Mocks.traitAttribute("Category", "unit"),
            Mocks.traitAttribute("category", "fast"));
        context = TestCaseContext.builder()
            .traitAttributeCache(new TraitAttributeCache())
            .testMethodResolver((assembly, className, methodName) -> testMethod)
            .build();
        serializer = new TestCaseSerializer(objectMapper, context);
    }

    private AssayTestCase initialized(TestCaseIdentity identity, Object[] arguments) {
        AssayTestCase testCase = AssayTestCase.fromAnnotations(identity, testMethod, arguments, context);
        testCase.setSourceInformation(new SourceInformation("MyTests.java", 42));
        testCase.initialize();
        return testCase;
    }

    @Test
    @DisplayName("Should reproduce every value of a test case after a round trip")
    void testRoundTrip() {
        AssayTestCase original = initialized(
            new TestCaseIdentity("asm-id", "coll-id", "class-id", "method-id"), new Object[] {1, "x"});

        TestMethodTestCase copy = serializer.deserialize(serializer.serialize(original));

        AssayTestCase restored = assertInstanceOf(AssayTestCase.class, copy);
        assertEquals(original.getIdentity(), restored.getIdentity());
        assertEquals(250, restored.getTimeout());
        assertEquals(original.getDisplayName(), restored.getDisplayName());
        assertEquals("flaky", restored.getSkipReason());
        assertEquals(List.of("unit", "fast"), restored.getTraits().get("CATEGORY"));
        assertEquals(original.getUniqueId(), restored.getUniqueId());
        assertEquals(new SourceInformation("MyTests.java", 42), restored.getSourceInformation());
        assertArrayEquals(new Object[] {1, "x"}, restored.getTestMethodArguments());
        assertSame(testMethod, restored.getTestMethod());
    }

    @Test
    @DisplayName("Should keep absent class and method IDs absent")
    void testAbsentOptionalIds() {
        AssayTestCase original = initialized(TestCaseIdentity.of("asm-id", "coll-id"), null);

        AssayTestCase restored = (AssayTestCase) serializer.deserialize(serializer.serialize(original));

        assertNull(restored.getIdentity().classUniqueId());
        assertNull(restored.getIdentity().methodUniqueId());
        assertNull(restored.getTestMethodArguments());
    }

    @Test
    @DisplayName("Should write the type tag and the documented keys")
    void testEnvelope() throws Exception {
        AssayTestCase original = initialized(TestCaseIdentity.of("asm-id", "coll-id"), null);

        ObjectNode envelope = (ObjectNode) objectMapper.readTree(serializer.serialize(original));

        assertEquals(TestCaseSerializer.ASSAY_TYPE, envelope.get("type").asText());
        ObjectNode data = (ObjectNode) envelope.get("data");
        for (String key : List.of("TestMethod.Assembly", "TestMethod.Class", "TestMethod.Method", "DisplayName",
                "UniqueID", "TestAssemblyUniqueID", "TestCollectionUniqueID", "Timeout")) {
            assertTrue(data.has(key), key);
        }
        assertTrue(data.get("TestClassUniqueID").isNull());
        assertEquals("com.acme.MyTests", data.get("TestMethod.Class").asText());
    }

    @Test
    @DisplayName("Should refuse to initialize a deserialized test case")
    void testInitializeAfterDeserialize() {
        TestMethodTestCase restored = serializer.deserialize(
            serializer.serialize(initialized(TestCaseIdentity.of("asm-id", "coll-id"), null)));

        assertThrows(IllegalStateException.class, restored::initialize);
        JsonSerializationInfo info = new JsonSerializationInfo(objectMapper, "Owner");
        assertThrows(IllegalStateException.class, () -> restored.deserialize(info));
    }

    @Test
    @DisplayName("Should fail serializing a test case that was never initialized")
    void testSerializeUninitialized() {
        AssayTestCase testCase = AssayTestCase.fromAnnotations(TestCaseIdentity.of("asm-id", "coll-id"),
            testMethod, null, context);

        assertThrows(UninitializedPropertyException.class, () -> serializer.serialize(testCase));
    }

    @Test
    @DisplayName("Should name the missing key when a required value is absent")
    void testMissingRequiredKey() throws Exception {
        ObjectNode envelope = (ObjectNode) objectMapper.readTree(
            serializer.serialize(initialized(TestCaseIdentity.of("asm-id", "coll-id"), null)));
        ((ObjectNode) envelope.get("data")).remove("Timeout");

        MissingFieldException e = assertThrows(MissingFieldException.class,
            () -> serializer.deserialize(objectMapper.writeValueAsString(envelope)));
        assertEquals("Timeout", e.getFieldName());
        assertEquals(AssayTestCase.class.getName(), e.getOwnerTypeName());
    }

    @Test
    @DisplayName("Should reject invalid serialized identity values")
    void testInvalidIdentity() throws Exception {
        ObjectNode envelope = (ObjectNode) objectMapper.readTree(
            serializer.serialize(initialized(TestCaseIdentity.of("asm-id", "coll-id"), null)));
        ((ObjectNode) envelope.get("data")).put("TestCollectionUniqueID", "");

        assertThrows(SerializationException.class, () -> serializer.deserialize(objectMapper.writeValueAsString(envelope)));
    }

    @Test
    @DisplayName("Should reject unknown type tags and malformed input")
    void testUnknownAndMalformed() {
        IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class,
            () -> serializer.deserialize("{\"type\":\"mystery\",\"data\":{}}"));
        assertTrue(unknown.getMessage().contains(AssayErrorCodes.UNKNOWN_SERIALIZED_TYPE));

        assertThrows(SerializationException.class, () -> serializer.deserialize("{\"type\":"));
        assertThrows(MissingFieldException.class, () -> serializer.deserialize("{\"data\":{}}"));
        assertThrows(MissingFieldException.class, () -> serializer.deserialize("{\"type\":\"assay\"}"));
    }

    @Test
    @DisplayName("Should round-trip execution error test cases under their own tag")
    void testExecutionErrorRoundTrip() throws Exception {
        ExecutionErrorTestCase original = ExecutionErrorTestCase.create(TestCaseIdentity.of("asm-id", "coll-id"),
            testMethod, null, "Timeout cannot be negative", context);
        original.initialize();

        String json = serializer.serialize(original);
        ExecutionErrorTestCase restored = (ExecutionErrorTestCase) serializer.deserialize(json);

        assertEquals(TestCaseSerializer.EXECUTION_ERROR_TYPE, objectMapper.readTree(json).get("type").asText());
        assertEquals("Timeout cannot be negative", restored.getErrorMessage());
        assertEquals(original.getDisplayName(), restored.getDisplayName());
    }

    @Test
    @DisplayName("Should reject serializing an unregistered test case type")
    void testUnregisteredType() {
        AssayTestCase anonymous = new AssayTestCase(TestCaseIdentity.of("asm-id", "coll-id"), testMethod, null, context) {
        };
        anonymous.initialize();

        assertThrows(IllegalArgumentException.class, () -> serializer.serialize(anonymous));
        assertEquals(Set.of(TestCaseSerializer.ASSAY_TYPE, TestCaseSerializer.EXECUTION_ERROR_TYPE),
            serializer.getRegisteredTags());
    }

    @Test
    @DisplayName("Should retire the old tag when a type is registered under a new one")
    void testReRegisterTypeUnderNewTag() throws Exception {
        String legacy = serializer.serialize(initialized(TestCaseIdentity.of("asm-id", "coll-id"), null));

        serializer.register("fact", AssayTestCase.class, AssayTestCase::fromSerializedForm);

        assertEquals(Set.of("fact", TestCaseSerializer.EXECUTION_ERROR_TYPE), serializer.getRegisteredTags());
        String json = serializer.serialize(initialized(TestCaseIdentity.of("asm-id", "coll-id"), null));
        assertEquals("fact", objectMapper.readTree(json).get("type").asText());
        assertInstanceOf(AssayTestCase.class, serializer.deserialize(json));
        assertThrows(IllegalArgumentException.class, () -> serializer.deserialize(legacy));
    }
}
