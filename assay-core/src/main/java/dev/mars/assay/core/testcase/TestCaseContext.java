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
package dev.mars.assay.core.testcase;

import dev.mars.assay.api.execution.TestCaseRunner;
import dev.mars.assay.api.messages.MessageSink;
import dev.mars.assay.core.config.AssayConfiguration;
import dev.mars.assay.core.config.AssayConfiguration.DisplayConfig;
import dev.mars.assay.core.display.ArgumentFormatter;
import dev.mars.assay.core.diagnostics.LoggingDiagnosticMessageSink;
import dev.mars.assay.core.display.DisplayNameFormatter;
import dev.mars.assay.core.reflect.ReflectionTestMethodResolver;
import dev.mars.assay.core.traits.TraitAttributeCache;
import dev.mars.assay.core.traits.TraitCollector;
import dev.mars.assay.core.traits.TraitDiscovererRegistry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * The collaborators a test case uses to initialize, rebuild and run itself.
 *
 * <p>One context is normally shared by every test case of a discovery run.</p>
 */
public final class TestCaseContext {

    private final MessageSink diagnosticMessageSink;
    private final TraitCollector traitCollector;
    private final DisplayNameFormatter displayNameFormatter;
    private final TestCaseRunner runner;
    private final TestMethodResolver testMethodResolver;

    private TestCaseContext(Builder builder) {
        this.diagnosticMessageSink = builder.diagnosticMessageSink;
        this.traitCollector = new TraitCollector(builder.traitAttributeCache, builder.traitDiscovererRegistry);
        this.displayNameFormatter = new DisplayNameFormatter(
            builder.displayConfig.getMethodDisplay(), new ArgumentFormatter(builder.displayConfig));
        this.runner = builder.runner;
        this.testMethodResolver = builder.testMethodResolver;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a context with default collaborators and display settings from the configuration
     */
    public static TestCaseContext fromConfiguration(AssayConfiguration configuration) {
        return builder().displayConfig(configuration.getDisplayConfig()).build();
    }

    public MessageSink getDiagnosticMessageSink() {
        return diagnosticMessageSink;
    }

    public TraitCollector getTraitCollector() {
        return traitCollector;
    }

    public DisplayNameFormatter getDisplayNameFormatter() {
        return displayNameFormatter;
    }

    public ArgumentFormatter getArgumentFormatter() {
        return displayNameFormatter.getArgumentFormatter();
    }

    public TestCaseRunner getRunner() {
        return runner;
    }

    public TestMethodResolver getTestMethodResolver() {
        return testMethodResolver;
    }

    public static final class Builder {
        private MessageSink diagnosticMessageSink = new LoggingDiagnosticMessageSink();
        private TraitAttributeCache traitAttributeCache = TraitAttributeCache.shared();
        private TraitDiscovererRegistry traitDiscovererRegistry = TraitDiscovererRegistry.withDefaults();
        private DisplayConfig displayConfig = DisplayConfig.defaults();
        private TestCaseRunner runner = context -> CompletableFuture.failedFuture(
            new IllegalStateException("No test case runner has been configured"));
        private TestMethodResolver testMethodResolver = new ReflectionTestMethodResolver();

        private Builder() {
        }

        public Builder diagnosticMessageSink(MessageSink diagnosticMessageSink) {
            this.diagnosticMessageSink = Objects.requireNonNull(diagnosticMessageSink, "Diagnostic message sink cannot be null");
            return this;
        }

        public Builder traitAttributeCache(TraitAttributeCache traitAttributeCache) {
            this.traitAttributeCache = Objects.requireNonNull(traitAttributeCache, "Trait attribute cache cannot be null");
            return this;
        }

        public Builder traitDiscovererRegistry(TraitDiscovererRegistry traitDiscovererRegistry) {
            this.traitDiscovererRegistry = Objects.requireNonNull(traitDiscovererRegistry, "Trait discoverer registry cannot be null");
            return this;
        }

        public Builder displayConfig(DisplayConfig displayConfig) {
            this.displayConfig = Objects.requireNonNull(displayConfig, "Display config cannot be null");
            return this;
        }

        public Builder runner(TestCaseRunner runner) {
            this.runner = Objects.requireNonNull(runner, "Runner cannot be null");
            return this;
        }

        public Builder testMethodResolver(TestMethodResolver testMethodResolver) {
            this.testMethodResolver = Objects.requireNonNull(testMethodResolver, "Test method resolver cannot be null");
            return this;
        }

        public TestCaseContext build() {
            return new TestCaseContext(this);
        }
    }
}
