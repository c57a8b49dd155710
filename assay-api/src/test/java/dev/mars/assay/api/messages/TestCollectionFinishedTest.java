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

import dev.mars.assay.api.error.UninitializedPropertyException;
import dev.mars.assay.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Test Collection Finished Message Tests")
class TestCollectionFinishedTest {

    @Test
    @DisplayName("Should fail reading summary fields before they are written")
    void testUnsetFields() {
        TestCollectionFinished message = new TestCollectionFinished("asm-id", "coll-id");

        UninitializedPropertyException e = assertThrows(UninitializedPropertyException.class, message::getTestsRun);
        assertEquals("TestsRun", e.getPropertyName());
        assertEquals(TestCollectionFinished.class.getName(), e.getOwnerTypeName());
        assertThrows(UninitializedPropertyException.class, message::getTestsFailed);
        assertThrows(UninitializedPropertyException.class, message::getTestsSkipped);
        assertThrows(UninitializedPropertyException.class, message::getExecutionTime);
    }

    @Test
    @DisplayName("Should read back written summary fields")
    void testWrittenFields() {
        TestCollectionFinished message = new TestCollectionFinished("asm-id", "coll-id");
        message.setTestsRun(5);
        message.setTestsFailed(1);
        message.setTestsSkipped(2);
        message.setExecutionTime(new BigDecimal("1.25"));

        assertEquals(5, message.getTestsRun());
        assertEquals(1, message.getTestsFailed());
        assertEquals(2, message.getTestsSkipped());
        assertEquals(new BigDecimal("1.25"), message.getExecutionTime());
        assertEquals("asm-id", message.getAssemblyUniqueId());
        assertEquals("coll-id", message.getCollectionUniqueId());
    }

    @Test
    @DisplayName("Should not enforce the relationship between counts")
    void testNoRangeChecks() {
        TestCollectionFinished message = new TestCollectionFinished("asm-id", "coll-id");
        message.setTestsRun(1);
        message.setTestsFailed(3);

        assertEquals(3, message.getTestsFailed());
    }

    @Test
    @DisplayName("Should require assembly and collection IDs")
    void testRequiredIds() {
        assertThrows(IllegalArgumentException.class, () -> new TestCollectionFinished("", "coll-id"));
        assertThrows(IllegalArgumentException.class, () -> new TestCollectionFinished("asm-id", null));
    }

    @Test
    @DisplayName("Should name the runtime type when a subclass field is read before it is written")
    void testUnsetFieldOnSubclass() {
        TestCollectionFinished message = new TimedCollectionFinished("asm-id", "coll-id");

        UninitializedPropertyException e = assertThrows(UninitializedPropertyException.class,
            message::getExecutionTime);
        assertEquals(TimedCollectionFinished.class.getName(), e.getOwnerTypeName());
    }

    @Test
    @DisplayName("Should reject writing a summary field twice")
    void testFieldWrittenTwice() {
        TestCollectionFinished message = new TestCollectionFinished("asm-id", "coll-id");
        message.setTestsRun(4);

        assertThrows(IllegalStateException.class, () -> message.setTestsRun(5));
        assertEquals(4, message.getTestsRun());
    }

    static class TimedCollectionFinished extends TestCollectionFinished {
        TimedCollectionFinished(String assemblyUniqueId, String collectionUniqueId) {
            super(assemblyUniqueId, collectionUniqueId);
        }
    }
}
