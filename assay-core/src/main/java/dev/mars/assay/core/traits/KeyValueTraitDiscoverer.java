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
package dev.mars.assay.core.traits;

import dev.mars.assay.api.introspection.AttributeInfo;
import dev.mars.assay.api.traits.TraitDiscoverer;
import dev.mars.assay.api.traits.TraitEntry;

import java.util.List;

/**
 * Discoverer for {@link dev.mars.assay.api.annotations.Trait}: yields one pair from the
 * attribute's {@code name} and {@code value}. Falls back to the first two positional
 * arguments when the named ones are not available.
 */
public class KeyValueTraitDiscoverer implements TraitDiscoverer {

    @Override
    public List<TraitEntry> getTraits(AttributeInfo traitAttribute) {
        String name = traitAttribute.getNamedArgument("name", String.class);
        String value = traitAttribute.getNamedArgument("value", String.class);
        if (name == null || value == null) {
            List<Object> arguments = traitAttribute.getConstructorArguments();
            if (arguments.size() < 2) {
                return List.of();
            }
            name = String.valueOf(arguments.get(0));
            value = String.valueOf(arguments.get(1));
        }
        return List.of(new TraitEntry(name, value));
    }
}
