package dev.mars.assay.api.util;

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

import dev.mars.assay.api.error.AssayErrorCodes;
import dev.mars.assay.api.error.UninitializedPropertyException;
import dev.mars.assay.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Write Once Slot Tests")
class WriteOnceTest {

    @Test
    @DisplayName("Should fail reading an unset slot, naming property and owner")
    void testUnsetRead() {
        WriteOnce<String> slot = new WriteOnce<>("DisplayName", WriteOnceTest.class);

        UninitializedPropertyException e = assertThrows(UninitializedPropertyException.class, slot::get);
        assertEquals("DisplayName", e.getPropertyName());
        assertEquals(WriteOnceTest.class.getName(), e.getOwnerTypeName());
        assertEquals(AssayErrorCodes.UNINITIALIZED_PROPERTY, e.getErrorCode());
        assertEquals("Attempted to get DisplayName on an uninitialized '" + WriteOnceTest.class.getName()
            + "' object", e.getMessage());
        assertFalse(slot.isSet());
        assertEquals("<unset>", slot.toString());
    }

    @Test
    @DisplayName("Should distinguish a null value from an unset slot")
    void testNullValue() {
        WriteOnce<String> slot = new WriteOnce<>("SkipReason", WriteOnceTest.class);
        slot.set(null);

        assertTrue(slot.isSet());
        assertNull(slot.get());
    }

    @Test
    @DisplayName("Should reject a second write and keep the first value")
    void testSecondWriteRejected() {
        WriteOnce<Integer> slot = new WriteOnce<>("Timeout", WriteOnceTest.class);
        slot.set(100);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> slot.set(200));
        assertTrue(e.getMessage().contains(AssayErrorCodes.ALREADY_INITIALIZED));
        assertTrue(e.getMessage().contains("Timeout"));
        assertEquals(100, slot.get());
    }
}
