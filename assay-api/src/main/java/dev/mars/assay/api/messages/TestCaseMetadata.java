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

import java.util.List;
import java.util.Map;

/**
 * Read-only metadata that describes a test case in a message.
 */
public interface TestCaseMetadata {

    String getTestCaseDisplayName();

    /**
     * @return the skip reason, or null when the test case runs
     */
    String getSkipReason();

    String getSourceFilePath();

    Integer getSourceLineNumber();

    /**
     * @return a read-only, case-insensitive view of the traits
     */
    Map<String, List<String>> getTraits();
}
