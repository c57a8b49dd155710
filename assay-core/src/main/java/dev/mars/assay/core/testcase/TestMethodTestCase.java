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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.assay.api.TestCase;
import dev.mars.assay.api.error.AssayErrorCodes;
import dev.mars.assay.api.error.SerializationException;
import dev.mars.assay.api.identity.SourceInformation;
import dev.mars.assay.api.identity.UniqueIdGenerator;
import dev.mars.assay.api.introspection.TestMethod;
import dev.mars.assay.api.serialization.AssaySerializable;
import dev.mars.assay.api.serialization.SerializationInfo;
import dev.mars.assay.api.traits.TraitMap;
import dev.mars.assay.api.util.WriteOnce;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for test cases that run a single test method, optionally with arguments.
 *
 * <p>Derived metadata (display name, skip reason, traits and unique ID) is held in
 * {@link WriteOnce} slots and is filled in exactly one of two ways: by {@link #initialize()}
 * for a freshly discovered case, or by {@link #deserialize(SerializationInfo)} for a case
 * rebuilt from serialized form. Reading any of it before then throws
 * {@link dev.mars.assay.api.error.UninitializedPropertyException}.</p>
 *
 * <p>{@code initialize()} must be called by a single thread before the instance is shared.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-15
 * @version 1.0
 */
public abstract class TestMethodTestCase implements TestCase, AssaySerializable {
    private static final Logger logger = LoggerFactory.getLogger(TestMethodTestCase.class);
    private static final ObjectMapper ARGUMENT_MAPPER = new ObjectMapper();

    static final String KEY_ASSEMBLY = "TestMethod.Assembly";
    static final String KEY_CLASS = "TestMethod.Class";
    static final String KEY_METHOD = "TestMethod.Method";
    static final String KEY_ARGUMENTS = "TestMethodArguments";
    static final String KEY_DISPLAY_NAME = "DisplayName";
    static final String KEY_SKIP_REASON = "SkipReason";
    static final String KEY_TRAITS = "Traits";
    static final String KEY_SOURCE_FILE = "SourceFilePath";
    static final String KEY_SOURCE_LINE = "SourceLineNumber";
    static final String KEY_UNIQUE_ID = "UniqueID";

    /**
     * Lifecycle of the derived metadata.
     */
    private enum State {
        UNINITIALIZED,
        INITIALIZING,
        INITIALIZED,
        AWAITING_DESERIALIZATION,
        DESERIALIZING,
        DESERIALIZED,
        FAILED
    }

    private final TestCaseContext context;
    private final WriteOnce<String> displayName = new WriteOnce<>("DisplayName", getClass());
    private final WriteOnce<String> skipReason = new WriteOnce<>("SkipReason", getClass());
    private final WriteOnce<TraitMap> traits = new WriteOnce<>("Traits", getClass());
    private final WriteOnce<String> uniqueId = new WriteOnce<>("UniqueID", getClass());

    private TestMethod testMethod;
    private Object[] testMethodArguments;
    private SourceInformation sourceInformation;
    private Map<String, List<String>> traitView;
    private State state;

    /**
     * Creates a case that will be initialized from the method's annotations.
     */
    protected TestMethodTestCase(TestCaseContext context, TestMethod testMethod, Object[] testMethodArguments) {
        this.context = Objects.requireNonNull(context, "Test case context cannot be null");
        this.testMethod = Objects.requireNonNull(testMethod, "Test method cannot be null");
        this.testMethodArguments = testMethodArguments == null ? null : testMethodArguments.clone();
        this.state = State.UNINITIALIZED;
    }

    /**
     * Creates an empty case to be filled by {@link #deserialize(SerializationInfo)}.
     */
    protected TestMethodTestCase(TestCaseContext context) {
        this.context = Objects.requireNonNull(context, "Test case context cannot be null");
        this.state = State.AWAITING_DESERIALIZATION;
    }

    /**
     * Derives display name, skip reason, traits and unique ID from the test method.
     *
     * @throws IllegalStateException if the case was already initialized or was rebuilt from serialized form
     */
    public final void initialize() {
        if (state == State.AWAITING_DESERIALIZATION || state == State.DESERIALIZING || state == State.DESERIALIZED) {
            throw new IllegalStateException(String.format(
                "[%s] Test case of type '%s' was rebuilt from serialized form and cannot be initialized",
                AssayErrorCodes.ALREADY_INITIALIZED, getClass().getName()));
        }
        if (state != State.UNINITIALIZED) {
            throw new IllegalStateException(String.format(
                "[%s] Test case of type '%s' has already been initialized (state %s)",
                AssayErrorCodes.ALREADY_INITIALIZED, getClass().getName(), state));
        }

        state = State.INITIALIZING;
        try {
            onInitialize();
            applyDefaults();
            verifyComplete();
            state = State.INITIALIZED;
        } catch (RuntimeException e) {
            state = State.FAILED;
            throw e;
        }
        logger.debug("Initialized test case '{}' ({})", displayName.get(), uniqueId.get());
    }

    /**
     * Fills the derived metadata. Overrides call {@code super.onInitialize()} first.
     *
     * <p>The base implementation computes the unique ID. Whatever an override leaves unset
     * gets the default display name, no skip reason or no traits.</p>
     */
    protected void onInitialize() {
        setUniqueId(computeUniqueId());
    }

    private void applyDefaults() {
        if (!displayName.isSet()) {
            setDisplayName(formatDisplayName(getBaseDisplayName()));
        }
        if (!skipReason.isSet()) {
            setSkipReason(null);
        }
        if (!traits.isSet()) {
            setTraits(new TraitMap());
        }
    }

    /**
     * @return the default display name of the test method, without arguments
     */
    protected String getBaseDisplayName() {
        return context.getDisplayNameFormatter().getBaseDisplayName(testMethod);
    }

    /**
     * Appends the formatted test method arguments to {@code baseDisplayName}.
     */
    protected String formatDisplayName(String baseDisplayName) {
        return context.getDisplayNameFormatter()
            .getDisplayNameWithArguments(baseDisplayName, testMethod, testMethodArguments);
    }

    private String computeUniqueId() {
        List<String> parts = new ArrayList<>();
        String parentId = getIdentity().methodUniqueId();
        if (parentId == null) {
            // cases without a method ID are scoped to the collection, so add the method coordinates
            parentId = getIdentity().collectionUniqueId();
            parts.add(testMethod.testClass().getName());
            parts.add(testMethod.method().getName());
        }
        if (testMethodArguments != null) {
            for (Object argument : testMethodArguments) {
                parts.add(argumentKey(argument));
            }
        }
        return UniqueIdGenerator.forTestCase(parentId, parts);
    }

    /**
     * Encodes an argument for the unique ID as its runtime type plus its JSON form. Values Jackson
     * cannot write use their own {@code toString()}, or their identity when they have none.
     */
    static String argumentKey(Object argument) {
        if (argument == null) {
            return "null";
        }
        Class<?> type = argument.getClass();
        try {
            return type.getName() + ":" + ARGUMENT_MAPPER.writeValueAsString(argument);
        } catch (JsonProcessingException e) {
            logger.debug("Argument of type {} is not JSON-serializable, using a fallback key", type.getName());
        }
        if (overridesToString(type)) {
            return type.getName() + "=" + argument;
        }
        return type.getName() + "@" + Integer.toHexString(System.identityHashCode(argument));
    }

    private static boolean overridesToString(Class<?> type) {
        try {
            return type.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("toString() not found on " + type.getName(), e);
        }
    }

    private void verifyComplete() {
        String name = displayName.get();
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException(String.format(
                "[%s] Test case of type '%s' produced an empty display name",
                AssayErrorCodes.INVALID_ARGUMENT, getClass().getName()));
        }
        skipReason.get();
        uniqueId.get();
        traitView = traits.get().toReadOnlyMap();
    }

    protected final void setDisplayName(String value) {
        requireWritable("DisplayName");
        displayName.set(value);
    }

    protected final void setSkipReason(String value) {
        requireWritable("SkipReason");
        skipReason.set(value == null || value.isEmpty() ? null : value);
    }

    protected final void setTraits(TraitMap value) {
        requireWritable("Traits");
        traits.set(Objects.requireNonNull(value, "Traits cannot be null"));
    }

    protected final void setUniqueId(String value) {
        requireWritable("UniqueID");
        uniqueId.set(value);
    }

    /**
     * Sets the source location. Only allowed before initialization completes.
     */
    public void setSourceInformation(SourceInformation sourceInformation) {
        if (state != State.UNINITIALIZED) {
            requireWritable("SourceInformation");
        }
        this.sourceInformation = sourceInformation;
    }

    protected final void requireWritable(String propertyName) {
        if (state != State.INITIALIZING && state != State.DESERIALIZING) {
            throw new IllegalStateException(String.format(
                "Cannot set %s on '%s' in state %s", propertyName, getClass().getName(), state));
        }
    }

    protected final TestCaseContext getContext() {
        return context;
    }

    @Override
    public String getUniqueId() {
        return uniqueId.get();
    }

    @Override
    public String getDisplayName() {
        return displayName.get();
    }

    @Override
    public String getSkipReason() {
        return skipReason.get();
    }

    @Override
    public Map<String, List<String>> getTraits() {
        traits.get();
        return traitView != null ? traitView : traits.get().toReadOnlyMap();
    }

    @Override
    public SourceInformation getSourceInformation() {
        return sourceInformation;
    }

    @Override
    public TestMethod getTestMethod() {
        return testMethod;
    }

    @Override
    public Object[] getTestMethodArguments() {
        return testMethodArguments == null ? null : testMethodArguments.clone();
    }

    @Override
    public void serialize(SerializationInfo info) {
        Objects.requireNonNull(info, "Serialization info cannot be null");
        info.addValue(KEY_ASSEMBLY, testMethod.assembly().getName());
        info.addValue(KEY_CLASS, testMethod.testClass().getName());
        info.addValue(KEY_METHOD, testMethod.method().getName());
        info.addValue(KEY_ARGUMENTS, testMethodArguments);
        info.addValue(KEY_DISPLAY_NAME, getDisplayName());
        info.addValue(KEY_SKIP_REASON, getSkipReason());
        info.addValue(KEY_TRAITS, getTraits());
        info.addValue(KEY_SOURCE_FILE, sourceInformation == null ? null : sourceInformation.fileName());
        info.addValue(KEY_SOURCE_LINE, sourceInformation == null ? null : sourceInformation.lineNumber());
        info.addValue(KEY_UNIQUE_ID, getUniqueId());
    }

    /**
     * Reads the base keys. Only callable while the case is being rebuilt through
     * {@link #restore(TestMethodTestCase, SerializationInfo)}.
     */
    @Override
    public void deserialize(SerializationInfo info) {
        Objects.requireNonNull(info, "Serialization info cannot be null");
        if (state != State.DESERIALIZING) {
            throw new IllegalStateException(String.format(
                "[%s] Test case of type '%s' cannot be deserialized in state %s",
                AssayErrorCodes.ALREADY_INITIALIZED, getClass().getName(), state));
        }

        String assemblyName = info.getRequiredValue(KEY_ASSEMBLY, String.class);
        String className = info.getRequiredValue(KEY_CLASS, String.class);
        String methodName = info.getRequiredValue(KEY_METHOD, String.class);
        testMethod = context.getTestMethodResolver().resolve(assemblyName, className, methodName);
        if (testMethod == null) {
            throw new SerializationException(String.format(
                "Could not resolve test method %s.%s in '%s'", className, methodName, assemblyName));
        }

        testMethodArguments = info.getValue(KEY_ARGUMENTS, Object[].class);
        setDisplayName(info.getRequiredValue(KEY_DISPLAY_NAME, String.class));
        setSkipReason(info.getValue(KEY_SKIP_REASON, String.class));
        setTraits(readTraits(info));
        setUniqueId(info.getRequiredValue(KEY_UNIQUE_ID, String.class));

        String sourceFile = info.getValue(KEY_SOURCE_FILE, String.class);
        Integer sourceLine = info.getValue(KEY_SOURCE_LINE, Integer.class);
        if (sourceFile != null || sourceLine != null) {
            sourceInformation = new SourceInformation(sourceFile, sourceLine);
        }
    }

    private static TraitMap readTraits(SerializationInfo info) {
        TraitMap result = new TraitMap();
        Map<?, ?> raw = info.getValue(KEY_TRAITS, LinkedHashMap.class);
        if (raw == null) {
            return result;
        }
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getValue() instanceof List)) {
                throw new SerializationException(String.format(
                    "Trait '%s' of '%s' is not a list of values", entry.getKey(), info.getOwnerTypeName()));
            }
            for (Object value : (List<?>) entry.getValue()) {
                result.add(String.valueOf(entry.getKey()), String.valueOf(value));
            }
        }
        return result;
    }

    /**
     * Runs {@code deserialize} on a case created with {@link #TestMethodTestCase(TestCaseContext)}
     * and marks it complete. A failure leaves no usable instance behind.
     */
    protected static <T extends TestMethodTestCase> T restore(T testCase, SerializationInfo info) {
        TestMethodTestCase base = testCase;
        if (base.state != State.AWAITING_DESERIALIZATION) {
            throw new IllegalStateException(String.format(
                "[%s] Test case of type '%s' cannot be deserialized in state %s",
                AssayErrorCodes.ALREADY_INITIALIZED, base.getClass().getName(), base.state));
        }
        base.state = State.DESERIALIZING;
        try {
            base.deserialize(info);
            base.verifyComplete();
        } catch (IllegalArgumentException e) {
            base.state = State.FAILED;
            throw new SerializationException("Invalid serialized value for '" + info.getOwnerTypeName() + "'", e);
        } catch (RuntimeException e) {
            base.state = State.FAILED;
            throw e;
        }
        base.state = State.DESERIALIZED;
        logger.debug("Rebuilt test case '{}' from serialized form", base.displayName.get());
        return testCase;
    }

    @Override
    public String toString() {
        return String.format("%s{displayName=%s, uniqueId=%s, state=%s}",
            getClass().getSimpleName(), displayName, uniqueId, state);
    }
}
