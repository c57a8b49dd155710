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

import dev.mars.assay.api.introspection.AttributeInfo;

import java.util.List;

/**
 * Extracts trait pairs from one kind of trait attribute.
 *
 * <p>Discoverers are registered against an attribute type name and are shared across
 * threads, so implementations must be stateless or thread-safe.</p>
 */
@FunctionalInterface
public interface TraitDiscoverer {

    /**
     * @param traitAttribute the attribute to read
     * @return zero or more trait pairs, never null
     */
    List<TraitEntry> getTraits(AttributeInfo traitAttribute);
}
