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
package dev.mars.assay.api.traits;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Multi-valued trait map with case-insensitive names.
 *
 * <p>Adding never overwrites: every value is appended to the list for its name, in the
 * order it was added, and identical pairs are kept. The first spelling of a name is the one
 * reported by {@link #names()}.</p>
 *
 * <p>Not thread-safe. A test case fills its map during initialization and only hands out
 * read-only copies afterwards.</p>
 */
public final class TraitMap {

    private final TreeMap<String, List<String>> traits = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public TraitMap() {
    }

    /**
     * Creates a map holding a copy of the given traits.
     */
    public static TraitMap copyOf(Map<String, ? extends List<String>> source) {
        TraitMap result = new TraitMap();
        if (source != null) {
            source.forEach((name, values) -> {
                if (values != null) {
                    values.forEach(value -> result.add(name, value));
                }
            });
        }
        return result;
    }

    public void add(String name, String value) {
        Objects.requireNonNull(name, "Trait name cannot be null");
        Objects.requireNonNull(value, "Trait value cannot be null");
        traits.computeIfAbsent(name, key -> new ArrayList<>()).add(value);
    }

    public void add(TraitEntry entry) {
        add(entry.name(), entry.value());
    }

    /**
     * @return the values for the name in insertion order, or an empty list
     */
    public List<String> get(String name) {
        List<String> values = traits.get(name);
        return values == null ? List.of() : Collections.unmodifiableList(values);
    }

    public boolean contains(String name) {
        return traits.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(traits.keySet());
    }

    public boolean isEmpty() {
        return traits.isEmpty();
    }

    public int size() {
        return traits.size();
    }

    /**
     * Returns a read-only snapshot. Later changes to this map are not visible through it,
     * and lookups on it are case-insensitive.
     */
    public Map<String, List<String>> toReadOnlyMap() {
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        traits.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraitMap that = (TraitMap) o;
        return traits.equals(that.traits);
    }

    @Override
    public int hashCode() {
        // names compare case-insensitively, so hash them the same way
        int hash = 0;
        for (Map.Entry<String, List<String>> entry : traits.entrySet()) {
            hash += entry.getKey().toLowerCase(Locale.ROOT).hashCode() ^ entry.getValue().hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        return "TraitMap" + traits;
    }
}
