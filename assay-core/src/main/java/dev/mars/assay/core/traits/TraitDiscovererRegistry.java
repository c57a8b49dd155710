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

import dev.mars.assay.api.annotations.Trait;
import dev.mars.assay.api.traits.TraitDiscoverer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps trait attribute type names to the discoverers that read them.
 *
 * <p>Populated while discovery is being configured. Lookups are exact on the fully
 * qualified attribute type name.</p>
 */
public class TraitDiscovererRegistry {
    private static final Logger logger = LoggerFactory.getLogger(TraitDiscovererRegistry.class);

    private final Map<String, TraitDiscoverer> discoverers = new ConcurrentHashMap<>();

    /**
     * Creates a registry with no discoverers.
     */
    public TraitDiscovererRegistry() {
    }

    /**
     * Creates a registry with the built-in {@link Trait} discoverer registered.
     */
    public static TraitDiscovererRegistry withDefaults() {
        TraitDiscovererRegistry registry = new TraitDiscovererRegistry();
        registry.register(Trait.class.getName(), new KeyValueTraitDiscoverer());
        return registry;
    }

    public void register(String attributeTypeName, TraitDiscoverer discoverer) {
        if (attributeTypeName == null || attributeTypeName.trim().isEmpty()) {
            throw new IllegalArgumentException("Attribute type name cannot be null or empty");
        }
        Objects.requireNonNull(discoverer, "Discoverer cannot be null");
        TraitDiscoverer previous = discoverers.put(attributeTypeName, discoverer);
        if (previous != null) {
            logger.debug("Replaced trait discoverer for {}: {} -> {}", attributeTypeName,
                previous.getClass().getName(), discoverer.getClass().getName());
        } else {
            logger.debug("Registered trait discoverer for {}: {}", attributeTypeName, discoverer.getClass().getName());
        }
    }

    public void register(Class<?> attributeType, TraitDiscoverer discoverer) {
        Objects.requireNonNull(attributeType, "Attribute type cannot be null");
        register(attributeType.getName(), discoverer);
    }

    public void unregister(String attributeTypeName) {
        if (discoverers.remove(attributeTypeName) != null) {
            logger.debug("Unregistered trait discoverer for {}", attributeTypeName);
        }
    }

    public Optional<TraitDiscoverer> find(String attributeTypeName) {
        if (attributeTypeName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(discoverers.get(attributeTypeName));
    }

    public Set<String> getRegisteredTypes() {
        return Set.copyOf(discoverers.keySet());
    }
}
