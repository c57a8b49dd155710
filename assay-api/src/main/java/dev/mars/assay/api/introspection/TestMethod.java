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
package dev.mars.assay.api.introspection;

import java.util.Objects;

/**
 * A test method together with the test class it is run against. The test class may be a
 * subtype of the method's declaring type.
 *
 * @param testClass the class the method is discovered on
 * @param method    the method
 */
public record TestMethod(TypeInfo testClass, MethodInfo method) {

    public TestMethod {
        Objects.requireNonNull(testClass, "Test class cannot be null");
        Objects.requireNonNull(method, "Method cannot be null");
    }

    public AssemblyInfo assembly() {
        return testClass.getAssembly();
    }
}
