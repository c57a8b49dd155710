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

import dev.mars.assay.api.error.AssayErrorCodes;
import dev.mars.assay.api.introspection.AttributeInfo;
import dev.mars.assay.api.introspection.TestMethod;
import dev.mars.assay.api.messages.DiagnosticMessage;
import dev.mars.assay.api.messages.MessageSink;
import dev.mars.assay.api.traits.TraitDiscoverer;
import dev.mars.assay.api.traits.TraitEntry;
import dev.mars.assay.api.traits.TraitMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the trait map of a test method from three sources, in this order: the assembly,
 * the method itself, then the test class. Values are appended, never replaced.
 *
 * <p>An attribute without a registered discoverer, or whose discoverer throws, contributes
 * nothing and is reported to the diagnostic sink; the remaining attributes are still read.</p>
 */
public class TraitCollector {
    private static final Logger logger = LoggerFactory.getLogger(TraitCollector.class);

    private final TraitAttributeCache cache;
    private final TraitDiscovererRegistry registry;

    public TraitCollector(TraitAttributeCache cache, TraitDiscovererRegistry registry) {
        this.cache = Objects.requireNonNull(cache, "Trait attribute cache cannot be null");
        this.registry = Objects.requireNonNull(registry, "Trait discoverer registry cannot be null");
    }

    /**
     * @param testMethod the method to collect traits for
     * @param displayName the test case display name, used in diagnostics
     * @param diagnosticMessageSink receives diagnostics for unusable trait attributes
     */
    public TraitMap collect(TestMethod testMethod, String displayName, MessageSink diagnosticMessageSink) {
        Objects.requireNonNull(testMethod, "Test method cannot be null");
        Objects.requireNonNull(diagnosticMessageSink, "Diagnostic message sink cannot be null");

        TraitMap traits = new TraitMap();
        for (AttributeInfo traitAttribute : getTraitAttributes(testMethod)) {
            Optional<TraitDiscoverer> discoverer = registry.find(traitAttribute.getAttributeTypeName());
            if (discoverer.isEmpty()) {
                logger.debug("No trait discoverer registered for {} on '{}'",
                    traitAttribute.getAttributeTypeName(), displayName);
                diagnosticMessageSink.onMessage(new DiagnosticMessage(
                    "Trait attribute on '" + displayName + "' did not have a registered trait discoverer",
                    AssayErrorCodes.UNRESOLVED_TRAIT_DISCOVERER));
                continue;
            }

            List<TraitEntry> entries;
            try {
                entries = discoverer.get().getTraits(traitAttribute);
            } catch (RuntimeException e) {
                logger.warn("Trait discoverer for {} failed on '{}'", traitAttribute.getAttributeTypeName(), displayName, e);
                diagnosticMessageSink.onMessage(new DiagnosticMessage(
                    "Trait discoverer for '" + traitAttribute.getAttributeTypeName() + "' on '" + displayName
                        + "' threw " + e.getClass().getName() + ": " + e.getMessage(),
                    AssayErrorCodes.TRAIT_DISCOVERER_FAILED));
                continue;
            }
            if (entries != null) {
                entries.forEach(traits::add);
            }
        }
        return traits;
    }

    private List<AttributeInfo> getTraitAttributes(TestMethod testMethod) {
        List<AttributeInfo> attributes = new ArrayList<>(cache.getTraitAttributes(testMethod.assembly()));
        // method attributes are already method-specific, so they are not cached
        attributes.addAll(testMethod.method().getCustomAttributes(TraitAttributeCache.TRAIT_ATTRIBUTE_TYPE));
        attributes.addAll(cache.getTraitAttributes(testMethod.testClass()));
        return attributes;
    }
}
