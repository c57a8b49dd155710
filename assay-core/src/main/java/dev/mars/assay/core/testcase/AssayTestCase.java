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

import dev.mars.assay.api.annotations.Fact;
import dev.mars.assay.api.error.AssayErrorCodes;
import dev.mars.assay.api.execution.CancellationToken;
import dev.mars.assay.api.execution.ExceptionAggregator;
import dev.mars.assay.api.execution.MessageBus;
import dev.mars.assay.api.execution.RunSummary;
import dev.mars.assay.api.execution.TestCaseRunContext;
import dev.mars.assay.api.identity.TestCaseIdentity;
import dev.mars.assay.api.introspection.AttributeInfo;
import dev.mars.assay.api.introspection.TestMethod;
import dev.mars.assay.api.messages.MessageSink;
import dev.mars.assay.api.serialization.SerializationInfo;
import dev.mars.assay.api.util.WriteOnce;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * The standard test case: a test method marked with {@link Fact} (or a fact-like annotation
 * such as {@code @Theory}), optionally bound to one row of arguments.
 *
 * <p>Instances come from one of two factories. {@link #fromAnnotations} reads display name,
 * skip reason, timeout and traits from the annotations; {@link #fromSerializedForm} rebuilds
 * every value from a serialized form produced by {@link #serialize(SerializationInfo)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-15
 * @version 1.0
 */
public class AssayTestCase extends TestMethodTestCase {

    static final String KEY_ASSEMBLY_ID = "TestAssemblyUniqueID";
    static final String KEY_COLLECTION_ID = "TestCollectionUniqueID";
    static final String KEY_CLASS_ID = "TestClassUniqueID";
    static final String KEY_METHOD_ID = "TestMethodUniqueID";
    static final String KEY_TIMEOUT = "Timeout";

    static final String FACT_ATTRIBUTE_TYPE = Fact.class.getName();

    private final WriteOnce<Integer> timeout = new WriteOnce<>("Timeout", getClass());
    private TestCaseIdentity identity;

    protected AssayTestCase(TestCaseIdentity identity, TestMethod testMethod, Object[] testMethodArguments,
                            TestCaseContext context) {
        super(context, testMethod, testMethodArguments);
        this.identity = Objects.requireNonNull(identity, "Test case identity cannot be null");
    }

    protected AssayTestCase(TestCaseContext context) {
        super(context);
    }

    /**
     * Creates a test case for a discovered method.
     * The returned case is not initialized; call {@link #initialize()} before reading its metadata.
     */
    public static AssayTestCase fromAnnotations(TestCaseIdentity identity, TestMethod testMethod,
                                                Object[] testMethodArguments, TestCaseContext context) {
        return new AssayTestCase(identity, testMethod, testMethodArguments, context);
    }

    /**
     * Rebuilds a test case from its serialized form.
     *
     * @throws dev.mars.assay.api.error.SerializationException if a required value is missing or invalid
     */
    public static AssayTestCase fromSerializedForm(SerializationInfo info, TestCaseContext context) {
        Objects.requireNonNull(info, "Serialization info cannot be null");
        return restore(new AssayTestCase(context), info);
    }

    @Override
    protected void onInitialize() {
        super.onInitialize();

        AttributeInfo factAttribute = findFactAttribute();
        String declaredName = factAttribute == null ? null
            : factAttribute.getNamedArgument("displayName", String.class);
        String baseDisplayName = declaredName != null && !declaredName.isEmpty() ? declaredName : getBaseDisplayName();

        String displayName = getDisplayName(factAttribute, baseDisplayName);
        setDisplayName(displayName);
        setSkipReason(getSkipReason(factAttribute));
        setTimeout(getTimeout(factAttribute));
        setTraits(getContext().getTraitCollector()
            .collect(getTestMethod(), displayName, getContext().getDiagnosticMessageSink()));
    }

    /**
     * @return the first fact-like annotation on the test method
     * @throws IllegalStateException if the method has none
     */
    protected AttributeInfo findFactAttribute() {
        List<AttributeInfo> attributes = getTestMethod().method().getCustomAttributes(FACT_ATTRIBUTE_TYPE);
        if (attributes.isEmpty()) {
            throw new IllegalStateException(String.format(
                "[%s] Test method %s.%s does not have a fact attribute", AssayErrorCodes.MISSING_FACT_ATTRIBUTE,
                getTestMethod().testClass().getName(), getTestMethod().method().getName()));
        }
        return attributes.get(0);
    }

    /**
     * Computes the display name. The default appends the formatted arguments to {@code baseDisplayName}.
     */
    protected String getDisplayName(AttributeInfo factAttribute, String baseDisplayName) {
        return formatDisplayName(baseDisplayName);
    }

    /**
     * @return the skip reason declared on the fact attribute, or null
     */
    protected String getSkipReason(AttributeInfo factAttribute) {
        return factAttribute.getNamedArgument("skip", String.class);
    }

    /**
     * @return the timeout in milliseconds declared on the fact attribute, or 0
     */
    protected int getTimeout(AttributeInfo factAttribute) {
        Integer value = factAttribute.getNamedArgument("timeout", Integer.class);
        return value == null ? 0 : value;
    }

    protected final void setTimeout(int value) {
        requireWritable("Timeout");
        if (value < 0) {
            throw new IllegalArgumentException(String.format(
                "[%s] Timeout cannot be negative: %d", AssayErrorCodes.INVALID_ARGUMENT, value));
        }
        timeout.set(value);
    }

    /**
     * @return the timeout in milliseconds, 0 when unbounded
     */
    public int getTimeout() {
        return timeout.get();
    }

    @Override
    public TestCaseIdentity getIdentity() {
        return identity;
    }

    /**
     * Hands this test case to the configured {@link dev.mars.assay.api.execution.TestCaseRunner}.
     * Skipped cases are passed on too; the runner reports them without running the method.
     */
    public CompletableFuture<RunSummary> runAsync(MessageSink diagnosticMessageSink, MessageBus messageBus,
                                                  Object[] constructorArguments, ExceptionAggregator aggregator,
                                                  CancellationToken cancellationToken) {
        Objects.requireNonNull(diagnosticMessageSink, "Diagnostic message sink cannot be null");
        Objects.requireNonNull(messageBus, "Message bus cannot be null");
        Objects.requireNonNull(constructorArguments, "Constructor arguments cannot be null");
        Objects.requireNonNull(aggregator, "Exception aggregator cannot be null");
        Objects.requireNonNull(cancellationToken, "Cancellation token cannot be null");

        TestCaseRunContext runContext = new TestCaseRunContext(this, identity, getDisplayName(), getSkipReason(),
            getTimeout(), constructorArguments.clone(), getTestMethodArguments(), diagnosticMessageSink,
            messageBus, aggregator, cancellationToken);
        return getContext().getRunner().run(runContext);
    }

    @Override
    public void serialize(SerializationInfo info) {
        super.serialize(info);
        info.addValue(KEY_ASSEMBLY_ID, identity.assemblyUniqueId());
        info.addValue(KEY_COLLECTION_ID, identity.collectionUniqueId());
        info.addValue(KEY_CLASS_ID, identity.classUniqueId());
        info.addValue(KEY_METHOD_ID, identity.methodUniqueId());
        info.addValue(KEY_TIMEOUT, getTimeout());
    }

    @Override
    public void deserialize(SerializationInfo info) {
        super.deserialize(info);
        identity = new TestCaseIdentity(
            info.getRequiredValue(KEY_ASSEMBLY_ID, String.class),
            info.getRequiredValue(KEY_COLLECTION_ID, String.class),
            info.getValue(KEY_CLASS_ID, String.class),
            info.getValue(KEY_METHOD_ID, String.class));
        setTimeout(info.getRequiredValue(KEY_TIMEOUT, Integer.class));
    }
}
