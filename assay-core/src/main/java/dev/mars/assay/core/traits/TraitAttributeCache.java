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

import dev.mars.assay.api.annotations.TraitAttribute;
import dev.mars.assay.api.introspection.AssemblyInfo;
import dev.mars.assay.api.introspection.AttributeInfo;
import dev.mars.assay.api.introspection.AttributeProvider;
import dev.mars.assay.api.introspection.TypeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Memoizes the trait attributes declared on assemblies and on types.
 *
 * <p>Every test method in the same assembly or class sees the same assembly-level and
 * class-level trait attributes, so those lookups are done once per name and shared. The two
 * caches are independent and keyed case-insensitively by assembly name and type name.
 * Population uses {@link ConcurrentMap#computeIfAbsent}, so concurrent first lookups of a key
 * compute it once and every caller gets the same immutable list.</p>
 *
 * <p>Instances live for the life of the process and are never torn down. Tests create their
 * own instances; production code normally uses {@link #shared()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class TraitAttributeCache {
    private static final Logger logger = LoggerFactory.getLogger(TraitAttributeCache.class);

    static final String TRAIT_ATTRIBUTE_TYPE = TraitAttribute.class.getName();

    private static final TraitAttributeCache SHARED = new TraitAttributeCache();

    private final ConcurrentMap<String, List<AttributeInfo>> assemblyTraitAttributes = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<AttributeInfo>> typeTraitAttributes = new ConcurrentHashMap<>();

    /**
     * @return the process-wide cache
     */
    public static TraitAttributeCache shared() {
        return SHARED;
    }

    public List<AttributeInfo> getTraitAttributes(AssemblyInfo assembly) {
        Objects.requireNonNull(assembly, "Assembly cannot be null");
        return lookup(assemblyTraitAttributes, "assembly", assembly.getName(), assembly);
    }

    public List<AttributeInfo> getTraitAttributes(TypeInfo type) {
        Objects.requireNonNull(type, "Type cannot be null");
        return lookup(typeTraitAttributes, "type", type.getName(), type);
    }

    private static List<AttributeInfo> lookup(ConcurrentMap<String, List<AttributeInfo>> cache, String kind,
                                              String name, AttributeProvider provider) {
        Objects.requireNonNull(name, "Name cannot be null");
        return cache.computeIfAbsent(name.toLowerCase(Locale.ROOT), key -> {
            List<AttributeInfo> attributes = List.copyOf(provider.getCustomAttributes(TRAIT_ATTRIBUTE_TYPE));
            logger.debug("Cached {} trait attribute(s) for {} '{}'", attributes.size(), kind, name);
            return attributes;
        });
    }

    public int getAssemblyCacheSize() {
        return assemblyTraitAttributes.size();
    }

    public int getTypeCacheSize() {
        return typeTraitAttributes.size();
    }

    /**
     * Drops every cached entry. Only meant for test isolation.
     */
    public void clear() {
        assemblyTraitAttributes.clear();
        typeTraitAttributes.clear();
    }
}
