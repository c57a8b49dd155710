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
package dev.mars.assay.api;

import dev.mars.assay.api.identity.SourceInformation;
import dev.mars.assay.api.identity.TestCaseIdentity;
import dev.mars.assay.api.introspection.TestMethod;

import java.util.List;
import java.util.Map;

/**
 * One executable unit of test work, possibly parameterized.
 *
 * <p>Implementations derive their metadata once; every getter returns the same value for
 * the life of the instance.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public interface TestCase {

    /**
     * @return the case's own unique ID, stable across processes
     */
    String getUniqueId();

    TestCaseIdentity getIdentity();

    /**
     * @return the human readable name, never empty
     */
    String getDisplayName();

    /**
     * @return the reason the case must not run, or null when it runs
     */
    String getSkipReason();

    /**
     * @return the source location, or null when unknown
     */
    SourceInformation getSourceInformation();

    TestMethod getTestMethod();

    /**
     * @return a copy of the arguments for a parameterized case, or null
     */
    Object[] getTestMethodArguments();

    /**
     * @return a read-only, case-insensitive view of the traits
     */
    Map<String, List<String>> getTraits();
}
