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
package dev.mars.assay.core.display;

import java.util.Locale;

/**
 * How the default display name of a test method is built.
 */
public enum TestMethodDisplay {
    /** Fully qualified class name, a dot, then the method name. */
    CLASS_AND_METHOD,
    /** Method name only. */
    METHOD;

    /**
     * @return the matching constant, ignoring case and dashes, or null when nothing matches
     */
    public static TestMethodDisplay parse(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (TestMethodDisplay display : values()) {
            if (display.name().equals(normalized)) {
                return display;
            }
        }
        return null;
    }
}
