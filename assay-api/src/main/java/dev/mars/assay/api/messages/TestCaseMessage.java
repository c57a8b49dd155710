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

/**
 * Base type for messages that relate to a single test case. The class and method IDs are
 * null for test cases that do not belong to a class or method.
 */
public abstract class TestCaseMessage extends TestCollectionMessage {

    private final String classUniqueId;
    private final String methodUniqueId;
    private final String testCaseUniqueId;

    protected TestCaseMessage(String assemblyUniqueId, String collectionUniqueId,
                              String classUniqueId, String methodUniqueId, String testCaseUniqueId) {
        super(assemblyUniqueId, collectionUniqueId);
        this.classUniqueId = classUniqueId;
        this.methodUniqueId = methodUniqueId;
        this.testCaseUniqueId = requireNonEmpty(testCaseUniqueId, "testCaseUniqueId");
    }

    public String getClassUniqueId() {
        return classUniqueId;
    }

    public String getMethodUniqueId() {
        return methodUniqueId;
    }

    public String getTestCaseUniqueId() {
        return testCaseUniqueId;
    }

    @Override
    public String toString() {
        return super.toString() + " case=" + testCaseUniqueId;
    }
}
