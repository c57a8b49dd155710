package dev.mars.assay.api.messages;

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

import dev.mars.assay.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Test Case Discovered Message Tests")
class TestCaseDiscoveredTest {

    private TestCaseDiscovered.Builder baseBuilder() {
        return TestCaseDiscovered.builder()
            .assemblyUniqueId("asm-id")
            .collectionUniqueId("coll-id")
            .testCaseUniqueId("case-id")
            .testCaseDisplayName("MyTests.addsNumbers");
    }

    @Test
    @DisplayName("Should build a message without a test case reference on the receiving side")
    void testReceivingSide() {
        TestCaseDiscovered message = baseBuilder()
            .skipReason("flaky")
            .serialization("{\"type\":\"assay\"}")
            .sourceFilePath("MyTests.java")
            .sourceLineNumber(42)
            .build();

        assertNull(message.getTestCase());
        assertNull(message.getClassUniqueId());
        assertNull(message.getMethodUniqueId());
        assertEquals("case-id", message.getTestCaseUniqueId());
        assertEquals("flaky", message.getSkipReason());
        assertEquals("{\"type\":\"assay\"}", message.getSerialization());
        assertEquals("MyTests.java", message.getSourceFilePath());
        assertEquals(42, message.getSourceLineNumber());
        assertTrue(message.getTraits().isEmpty());
    }

    @Test
    @DisplayName("Should hold a deep, read-only copy of the traits")
    void testTraitsCopied() {
        List<String> values = new ArrayList<>(List.of("unit"));
        Map<String, List<String>> traits = new HashMap<>();
        traits.put("Category", values);

        TestCaseDiscovered message = baseBuilder().traits(traits).build();
        values.add("slow");
        traits.put("Owner", List.of("alice"));

        assertEquals(List.of("unit"), message.getTraits().get("category"));
        assertFalse(message.getTraits().containsKey("Owner"));
        assertThrows(UnsupportedOperationException.class, () -> message.getTraits().get("Category").add("x"));
    }

    @Test
    @DisplayName("Should require a non-empty display name and case ID")
    void testRequiredFields() {
        assertThrows(IllegalArgumentException.class, () -> baseBuilder().testCaseDisplayName("").build());
        assertThrows(IllegalArgumentException.class, () -> baseBuilder().testCaseUniqueId(null).build());
        assertThrows(IllegalArgumentException.class, () -> baseBuilder().collectionUniqueId("").build());
    }
}
