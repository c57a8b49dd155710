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

import dev.mars.assay.api.execution.CancellationToken;
import dev.mars.assay.api.execution.ExceptionAggregator;
import dev.mars.assay.api.execution.MessageBus;
import dev.mars.assay.api.execution.RunSummary;
import dev.mars.assay.api.identity.TestCaseIdentity;
import dev.mars.assay.api.introspection.AttributeInfo;
import dev.mars.assay.api.introspection.TestMethod;
import dev.mars.assay.api.messages.MessageSink;
import dev.mars.assay.api.serialization.SerializationInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Stands in for a test method that discovery could not turn into a runnable case.
 * Running it never invokes the method; it reports one failed test carrying the error message.
 */
public class ExecutionErrorTestCase extends AssayTestCase {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionErrorTestCase.class);

    static final String KEY_ERROR_MESSAGE = "ErrorMessage";

    private String errorMessage;

    protected ExecutionErrorTestCase(TestCaseIdentity identity, TestMethod testMethod, Object[] testMethodArguments,
                                     String errorMessage, TestCaseContext context) {
        super(identity, testMethod, testMethodArguments, context);
        this.errorMessage = Objects.requireNonNull(errorMessage, "Error message cannot be null");
    }

    protected ExecutionErrorTestCase(TestCaseContext context) {
        super(context);
    }

    public static ExecutionErrorTestCase create(TestCaseIdentity identity, TestMethod testMethod,
                                                Object[] testMethodArguments, String errorMessage,
                                                TestCaseContext context) {
        return new ExecutionErrorTestCase(identity, testMethod, testMethodArguments, errorMessage, context);
    }

    public static ExecutionErrorTestCase fromSerializedForm(SerializationInfo info, TestCaseContext context) {
        Objects.requireNonNull(info, "Serialization info cannot be null");
        return restore(new ExecutionErrorTestCase(context), info);
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * @return the first fact-like annotation, or null when the method has none
     */
    @Override
    protected AttributeInfo findFactAttribute() {
        List<AttributeInfo> attributes = getTestMethod().method().getCustomAttributes(FACT_ATTRIBUTE_TYPE);
        return attributes.isEmpty() ? null : attributes.get(0);
    }

    @Override
    protected String getSkipReason(AttributeInfo factAttribute) {
        return null;
    }

    @Override
    protected int getTimeout(AttributeInfo factAttribute) {
        return 0;
    }

    @Override
    public CompletableFuture<RunSummary> runAsync(MessageSink diagnosticMessageSink, MessageBus messageBus,
                                                  Object[] constructorArguments, ExceptionAggregator aggregator,
                                                  CancellationToken cancellationToken) {
        Objects.requireNonNull(diagnosticMessageSink, "Diagnostic message sink cannot be null");
        Objects.requireNonNull(messageBus, "Message bus cannot be null");
        Objects.requireNonNull(constructorArguments, "Constructor arguments cannot be null");
        Objects.requireNonNull(aggregator, "Exception aggregator cannot be null");
        Objects.requireNonNull(cancellationToken, "Cancellation token cannot be null");

        logger.debug("Reporting execution error for '{}': {}", getDisplayName(), errorMessage);
        aggregator.add(new IllegalStateException(errorMessage));
        return CompletableFuture.completedFuture(new RunSummary(1, 1, 0, BigDecimal.ZERO));
    }

    @Override
    public void serialize(SerializationInfo info) {
        super.serialize(info);
        info.addValue(KEY_ERROR_MESSAGE, errorMessage);
    }

    @Override
    public void deserialize(SerializationInfo info) {
        super.deserialize(info);
        errorMessage = info.getRequiredValue(KEY_ERROR_MESSAGE, String.class);
    }
}
