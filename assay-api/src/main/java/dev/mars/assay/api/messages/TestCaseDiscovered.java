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
package dev.mars.assay.api.messages;

import dev.mars.assay.api.TestCase;
import dev.mars.assay.api.identity.SourceInformation;
import dev.mars.assay.api.identity.TestCaseIdentity;
import dev.mars.assay.api.traits.TraitMap;

import java.util.List;
import java.util.Map;

/**
 * Published once for every test case found during discovery.
 *
 * <p>An immutable snapshot taken when the message is created. The message keeps its own
 * copies of the display data so it stays valid after crossing a process boundary, where
 * {@link #getTestCase()} is null because the originating object does not exist there.</p>
 */
public class TestCaseDiscovered extends TestCaseMessage implements TestCaseMetadata {

    private final TestCase testCase;
    private final String testCaseDisplayName;
    private final String skipReason;
    private final String serialization;
    private final String sourceFilePath;
    private final Integer sourceLineNumber;
    private final Map<String, List<String>> traits;

    private TestCaseDiscovered(Builder builder) {
        super(builder.assemblyUniqueId, builder.collectionUniqueId, builder.classUniqueId,
              builder.methodUniqueId, builder.testCaseUniqueId);
        this.testCase = builder.testCase;
        this.testCaseDisplayName = requireNonEmpty(builder.testCaseDisplayName, "testCaseDisplayName");
        this.skipReason = builder.skipReason;
        this.serialization = builder.serialization;
        this.sourceFilePath = builder.sourceFilePath;
        this.sourceLineNumber = builder.sourceLineNumber;
        this.traits = TraitMap.copyOf(builder.traits).toReadOnlyMap();
    }

    /**
     * Snapshots a test case.
     *
     * @param testCase      the discovered test case
     * @param serialization the serialized test case, or null when serialization was not requested
     */
    public static TestCaseDiscovered from(TestCase testCase, String serialization) {
        TestCaseIdentity identity = testCase.getIdentity();
        SourceInformation source = testCase.getSourceInformation();
        return builder()
            .assemblyUniqueId(identity.assemblyUniqueId())
            .collectionUniqueId(identity.collectionUniqueId())
            .classUniqueId(identity.classUniqueId())
            .methodUniqueId(identity.methodUniqueId())
            .testCaseUniqueId(testCase.getUniqueId())
            .testCase(testCase)
            .testCaseDisplayName(testCase.getDisplayName())
            .skipReason(testCase.getSkipReason())
            .serialization(serialization)
            .sourceFilePath(source != null ? source.fileName() : null)
            .sourceLineNumber(source != null ? source.lineNumber() : null)
            .traits(testCase.getTraits())
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the originating test case, or null on the receiving side of a process boundary
     */
    public TestCase getTestCase() {
        return testCase;
    }

    @Override
    public String getTestCaseDisplayName() {
        return testCaseDisplayName;
    }

    @Override
    public String getSkipReason() {
        return skipReason;
    }

    /**
     * @return the serialized test case, or null when discovery did not include serialization
     */
    public String getSerialization() {
        return serialization;
    }

    @Override
    public String getSourceFilePath() {
        return sourceFilePath;
    }

    @Override
    public Integer getSourceLineNumber() {
        return sourceLineNumber;
    }

    @Override
    public Map<String, List<String>> getTraits() {
        return traits;
    }

    @Override
    public String toString() {
        return super.toString() + " name=\"" + testCaseDisplayName + "\"";
    }

    public static final class Builder {
        private String assemblyUniqueId;
        private String collectionUniqueId;
        private String classUniqueId;
        private String methodUniqueId;
        private String testCaseUniqueId;
        private TestCase testCase;
        private String testCaseDisplayName;
        private String skipReason;
        private String serialization;
        private String sourceFilePath;
        private Integer sourceLineNumber;
        private Map<String, List<String>> traits = Map.of();

        private Builder() {
        }

        public Builder assemblyUniqueId(String assemblyUniqueId) {
            this.assemblyUniqueId = assemblyUniqueId;
            return this;
        }

        public Builder collectionUniqueId(String collectionUniqueId) {
            this.collectionUniqueId = collectionUniqueId;
            return this;
        }

        public Builder classUniqueId(String classUniqueId) {
            this.classUniqueId = classUniqueId;
            return this;
        }

        public Builder methodUniqueId(String methodUniqueId) {
            this.methodUniqueId = methodUniqueId;
            return this;
        }

        public Builder testCaseUniqueId(String testCaseUniqueId) {
            this.testCaseUniqueId = testCaseUniqueId;
            return this;
        }

        public Builder testCase(TestCase testCase) {
            this.testCase = testCase;
            return this;
        }

        public Builder testCaseDisplayName(String testCaseDisplayName) {
            this.testCaseDisplayName = testCaseDisplayName;
            return this;
        }

        public Builder skipReason(String skipReason) {
            this.skipReason = skipReason;
            return this;
        }

        public Builder serialization(String serialization) {
            this.serialization = serialization;
            return this;
        }

        public Builder sourceFilePath(String sourceFilePath) {
            this.sourceFilePath = sourceFilePath;
            return this;
        }

        public Builder sourceLineNumber(Integer sourceLineNumber) {
            this.sourceLineNumber = sourceLineNumber;
            return this;
        }

        public Builder traits(Map<String, List<String>> traits) {
            this.traits = traits != null ? traits : Map.of();
            return this;
        }

        public TestCaseDiscovered build() {
            return new TestCaseDiscovered(this);
        }
    }
}
