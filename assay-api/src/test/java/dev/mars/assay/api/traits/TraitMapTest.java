package dev.mars.assay.api.traits;

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

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Trait Map Tests")
class TraitMapTest {

    @Test
    @DisplayName("Should merge names case-insensitively and keep insertion order of values")
    void testCaseInsensitiveMerge() {
        TraitMap traits = new TraitMap();
        traits.add("Category", "unit");
        traits.add("category", "fast");
        traits.add(new TraitEntry("CATEGORY", "unit"));

        assertEquals(1, traits.size());
        assertEquals(List.of("unit", "fast", "unit"), traits.get("category"));
        assertTrue(traits.contains("CaTeGoRy"));
    }

    @Test
    @DisplayName("Should return an empty list for an unknown name")
    void testMissingName() {
        TraitMap traits = new TraitMap();

        assertTrue(traits.get("owner").isEmpty());
        assertTrue(traits.isEmpty());
    }

    @Test
    @DisplayName("Should snapshot into a read-only, case-insensitive map")
    void testReadOnlySnapshot() {
        TraitMap traits = new TraitMap();
        traits.add("Owner", "alice");
        Map<String, List<String>> snapshot = traits.toReadOnlyMap();

        traits.add("Owner", "bob");

        assertEquals(List.of("alice"), snapshot.get("OWNER"));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("x", List.of()));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.get("owner").add("carol"));
    }

    @Test
    @DisplayName("Should treat maps differing only in name case as equal")
    void testEquality() {
        TraitMap first = TraitMap.copyOf(Map.of("Priority", List.of("1")));
        TraitMap second = TraitMap.copyOf(Map.of("priority", List.of("1")));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    @DisplayName("Should reject null names and values")
    void testNulls() {
        TraitMap traits = new TraitMap();

        assertThrows(NullPointerException.class, () -> traits.add(null, "v"));
        assertThrows(NullPointerException.class, () -> traits.add("n", null));
        assertThrows(NullPointerException.class, () -> new TraitEntry("n", null));
    }
}
