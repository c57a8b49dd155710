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

import dev.mars.assay.api.introspection.ParameterInfo;
import dev.mars.assay.api.introspection.TestMethod;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds default display names and appends formatted arguments to them.
 */
public class DisplayNameFormatter {

    static final String UNKNOWN = "???";

    private final TestMethodDisplay methodDisplay;
    private final ArgumentFormatter argumentFormatter;

    public DisplayNameFormatter(TestMethodDisplay methodDisplay, ArgumentFormatter argumentFormatter) {
        this.methodDisplay = Objects.requireNonNull(methodDisplay, "Method display cannot be null");
        this.argumentFormatter = Objects.requireNonNull(argumentFormatter, "Argument formatter cannot be null");
    }

    /**
     * @return the default display name for the method, without arguments
     */
    public String getBaseDisplayName(TestMethod testMethod) {
        String methodName = testMethod.method().getName();
        if (methodDisplay == TestMethodDisplay.CLASS_AND_METHOD) {
            return testMethod.testClass().getName() + "." + methodName;
        }
        return methodName;
    }

    /**
     * Appends {@code (name: value, ...)} to the base name. Surplus arguments are labelled
     * {@code ???}; parameters without an argument show {@code ???} as the value.
     */
    public String getDisplayNameWithArguments(String baseDisplayName, TestMethod testMethod, Object[] arguments) {
        if (arguments == null) {
            return baseDisplayName;
        }
        List<ParameterInfo> parameters = testMethod.method().getParameters();
        int count = Math.max(parameters.size(), arguments.length);
        if (count == 0) {
            return baseDisplayName;
        }
        List<String> parts = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String name = i < parameters.size() ? parameters.get(i).getName() : UNKNOWN;
            String value = i < arguments.length ? argumentFormatter.format(arguments[i]) : UNKNOWN;
            parts.add(name + ": " + value);
        }
        return baseDisplayName + "(" + String.join(", ", parts) + ")";
    }

    public ArgumentFormatter getArgumentFormatter() {
        return argumentFormatter;
    }
}
