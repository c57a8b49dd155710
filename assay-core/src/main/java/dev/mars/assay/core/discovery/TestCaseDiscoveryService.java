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
package dev.mars.assay.core.discovery;

import dev.mars.assay.api.annotations.Fact;
import dev.mars.assay.api.error.SerializationException;
import dev.mars.assay.api.identity.TestCaseIdentity;
import dev.mars.assay.api.identity.UniqueIdGenerator;
import dev.mars.assay.api.introspection.TestMethod;
import dev.mars.assay.api.messages.DiagnosticMessage;
import dev.mars.assay.api.messages.MessageSink;
import dev.mars.assay.api.messages.TestCaseDiscovered;
import dev.mars.assay.core.config.AssayConfiguration;
import dev.mars.assay.core.reflect.ReflectionMethodInfo;
import dev.mars.assay.core.reflect.ReflectionTypeInfo;
import dev.mars.assay.core.testcase.AssayTestCase;
import dev.mars.assay.core.testcase.ExecutionErrorTestCase;
import dev.mars.assay.core.testcase.TestCaseContext;
import dev.mars.assay.core.testcase.TestCaseSerializer;
import dev.mars.assay.core.testcase.TestMethodTestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns test methods into initialized test cases and announces each one with a
 * {@link TestCaseDiscovered} message.
 *
 * <p>Every test class forms its own test collection. A case whose metadata cannot be derived
 * (for example a negative timeout) is reported as an {@link ExecutionErrorTestCase} so that the
 * problem surfaces when the run is executed. A case that cannot be serialized is still announced,
 * without its serialized form, and a diagnostic names it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-16
 * @version 1.0
 */
public class TestCaseDiscoveryService {
    private static final Logger logger = LoggerFactory.getLogger(TestCaseDiscoveryService.class);

    private static final String FACT_ATTRIBUTE_TYPE = Fact.class.getName();

    private final AssayConfiguration configuration;
    private final TestCaseContext context;
    private final TestCaseSerializer serializer;

    public TestCaseDiscoveryService(AssayConfiguration configuration, TestCaseContext context,
                                    TestCaseSerializer serializer) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.context = Objects.requireNonNull(context, "Test case context cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "Serializer cannot be null");
    }

    public TestCaseDiscoveryService(AssayConfiguration configuration, TestCaseContext context) {
        this(configuration, context, new TestCaseSerializer(context));
    }

    /**
     * Discovers one test case per argument row.
     *
     * @param testMethod   the test method
     * @param argumentRows argument rows; null or empty discovers a single case without arguments
     * @param sink         receives one {@link TestCaseDiscovered} per case
     * @return the discovered cases, empty when the method has no fact-like annotation
     */
    public List<TestMethodTestCase> discover(TestMethod testMethod, List<Object[]> argumentRows, MessageSink sink) {
        Objects.requireNonNull(testMethod, "Test method cannot be null");
        Objects.requireNonNull(sink, "Message sink cannot be null");

        if (testMethod.method().getCustomAttributes(FACT_ATTRIBUTE_TYPE).isEmpty()) {
            logger.debug("Skipping {}.{}: no fact attribute", testMethod.testClass().getName(),
                testMethod.method().getName());
            return List.of();
        }

        TestCaseIdentity identity = identityOf(testMethod);
        List<Object[]> rows = argumentRows == null || argumentRows.isEmpty()
            ? Collections.<Object[]>singletonList(null)
            : argumentRows;

        List<TestMethodTestCase> discovered = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            TestMethodTestCase testCase = createTestCase(identity, testMethod, row);
            String serialization = configuration.isIncludeSerialization() ? serialize(testCase) : null;
            sink.onMessage(TestCaseDiscovered.from(testCase, serialization));
            discovered.add(testCase);
        }
        logger.debug("Discovered {} test case(s) for {}.{}", discovered.size(),
            testMethod.testClass().getName(), testMethod.method().getName());
        return discovered;
    }

    /**
     * Discovers a single argument-free case for every fact-annotated method of the class,
     * in method name order.
     */
    public List<TestMethodTestCase> discover(Class<?> testClass, MessageSink sink) {
        Objects.requireNonNull(testClass, "Test class cannot be null");
        ReflectionTypeInfo typeInfo = new ReflectionTypeInfo(testClass);

        Method[] methods = testClass.getDeclaredMethods();
        Arrays.sort(methods, Comparator.comparing(Method::getName));

        List<TestMethodTestCase> discovered = new ArrayList<>();
        for (Method method : methods) {
            if (method.isSynthetic() || Modifier.isStatic(method.getModifiers())) {
                continue;
            }
            discovered.addAll(discover(new TestMethod(typeInfo, new ReflectionMethodInfo(method)), null, sink));
        }
        logger.info("Discovered {} test case(s) in {}", discovered.size(), testClass.getName());
        return discovered;
    }

    private TestMethodTestCase createTestCase(TestCaseIdentity identity, TestMethod testMethod, Object[] arguments) {
        AssayTestCase testCase = AssayTestCase.fromAnnotations(identity, testMethod, arguments, context);
        try {
            testCase.initialize();
            return testCase;
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.warn("Could not initialize test case for {}.{}: {}", testMethod.testClass().getName(),
                testMethod.method().getName(), e.getMessage());
            String errorMessage = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            ExecutionErrorTestCase errorCase = ExecutionErrorTestCase.create(identity, testMethod, arguments,
                errorMessage, context);
            errorCase.initialize();
            return errorCase;
        }
    }

    /**
     * @return the serialized case, or null after reporting a diagnostic when it cannot be serialized
     */
    private String serialize(TestMethodTestCase testCase) {
        try {
            return serializer.serialize(testCase);
        } catch (SerializationException e) {
            logger.warn("Could not serialize test case '{}': {}", testCase.getDisplayName(), e.getMessage());
            context.getDiagnosticMessageSink().onMessage(new DiagnosticMessage(String.format(
                "Test case '%s' could not be serialized and is reported without its serialized form: %s",
                testCase.getDisplayName(), e.getMessage()), e.getErrorCode()));
            return null;
        }
    }

    static TestCaseIdentity identityOf(TestMethod testMethod) {
        String className = testMethod.testClass().getName();
        String assemblyId = UniqueIdGenerator.forAssembly(testMethod.assembly().getName(), null);
        String collectionId = UniqueIdGenerator.forTestCollection(assemblyId, "Test collection for " + className);
        String classId = UniqueIdGenerator.forTestClass(collectionId, className);
        String methodId = UniqueIdGenerator.forTestMethod(classId, testMethod.method().getName());
        return new TestCaseIdentity(assemblyId, collectionId, classId, methodId);
    }
}
