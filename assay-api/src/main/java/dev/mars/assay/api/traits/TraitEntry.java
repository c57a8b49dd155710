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

import java.util.Objects;

/**
 * One name/value classification pair yielded by a {@link TraitDiscoverer}.
 */
public record TraitEntry(String name, String value) {

    public TraitEntry {
        Objects.requireNonNull(name, "Trait name cannot be null");
        Objects.requireNonNull(value, "Trait value cannot be null");
    }
}
