package dev.mars.assay.api.identity;

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

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Test Case Identity Tests")
class TestCaseIdentityTest {

    @Test
    @DisplayName("Should keep nullable class and method IDs")
    void testOptionalLevels() {
        TestCaseIdentity identity = TestCaseIdentity.of("asm-id", "coll-id");

        assertEquals("asm-id", identity.assemblyUniqueId());
        assertEquals("coll-id", identity.collectionUniqueId());
        assertNull(identity.classUniqueId());
        assertNull(identity.methodUniqueId());
    }

    @Test
    @DisplayName("Should reject a missing or empty assembly or collection ID")
    void testRequiredIds() {
        assertThrows(IllegalArgumentException.class, () -> new TestCaseIdentity(null, "c", null, null));
        assertThrows(IllegalArgumentException.class, () -> new TestCaseIdentity("", "c", null, null));
        assertThrows(IllegalArgumentException.class, () -> new TestCaseIdentity("a", "", "x", "y"));
    }

    @Test
    @DisplayName("Should reject a negative source line number")
    void testSourceInformation() {
        assertThrows(IllegalArgumentException.class, () -> new SourceInformation("Foo.java", -1));
        assertEquals(12, new SourceInformation("Foo.java", 12).lineNumber());
        assertNull(new SourceInformation(null, null).fileName());
    }
}
