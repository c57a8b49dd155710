package dev.mars.assay.core.config;

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


import dev.mars.assay.core.display.TestMethodDisplay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Configuration for discovery and display name formatting.
 *
 * <p>Properties are layered, later sources winning: {@code assay-default.properties},
 * {@code assay-<profile>.properties}, {@code ASSAY_*} environment variables,
 * {@code assay.*} system properties, then any explicit overrides.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class AssayConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(AssayConfiguration.class);

    public static final String INCLUDE_SERIALIZATION = "assay.discovery.include-serialization";
    public static final String METHOD_DISPLAY = "assay.display.method-display";
    public static final String MAX_STRING_LENGTH = "assay.display.max-string-length";
    public static final String MAX_ENUMERABLE_LENGTH = "assay.display.max-enumerable-length";
    public static final String MAX_DEPTH = "assay.display.max-depth";

    private final Properties properties;
    private final String profile;

    public AssayConfiguration() {
        this(getActiveProfile());
    }

    public AssayConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Constructor for programmatic configuration. The overrides win over every other source,
     * so tests can configure an instance without touching system properties.
     *
     * @param profile the configuration profile to use
     * @param overrides properties applied last
     */
    public AssayConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        if (overrides != null) {
            overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        }
        validateConfiguration();
        logger.info("Loaded Assay configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("assay.profile",
               System.getenv("ASSAY_PROFILE") != null ? System.getenv("ASSAY_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/assay-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/assay-" + profile + ".properties");
        }

        // a double underscore stands for a dash: ASSAY_DISPLAY_MAX__DEPTH -> assay.display.max-depth
        System.getenv().forEach((key, value) -> {
            if (key.startsWith("ASSAY_")) {
                String propKey = key.toLowerCase(Locale.ROOT).replace("__", "-").replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("assay.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        String methodDisplay = getString(METHOD_DISPLAY, TestMethodDisplay.CLASS_AND_METHOD.name());
        if (TestMethodDisplay.parse(methodDisplay) == null) {
            errors.add("Method display must be one of CLASS_AND_METHOD, METHOD but was '" + methodDisplay + "'");
        }
        if (getInt(MAX_STRING_LENGTH, 50) < 1) {
            errors.add("Max string length must be at least 1");
        }
        if (getInt(MAX_ENUMERABLE_LENGTH, 5) < 1) {
            errors.add("Max enumerable length must be at least 1");
        }
        if (getInt(MAX_DEPTH, 3) < 1) {
            errors.add("Max depth must be at least 1");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }
    }

    // Configuration getters with defaults
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public String getProfile() {
        return profile;
    }

    public boolean isIncludeSerialization() {
        return getBoolean(INCLUDE_SERIALIZATION, false);
    }

    public DisplayConfig getDisplayConfig() {
        return new DisplayConfig(
            TestMethodDisplay.parse(getString(METHOD_DISPLAY, TestMethodDisplay.CLASS_AND_METHOD.name())),
            getInt(MAX_STRING_LENGTH, 50),
            getInt(MAX_ENUMERABLE_LENGTH, 5),
            getInt(MAX_DEPTH, 3)
        );
    }

    public static class DisplayConfig {
        private final TestMethodDisplay methodDisplay;
        private final int maxStringLength;
        private final int maxEnumerableLength;
        private final int maxDepth;

        public DisplayConfig(TestMethodDisplay methodDisplay, int maxStringLength,
                             int maxEnumerableLength, int maxDepth) {
            this.methodDisplay = methodDisplay;
            this.maxStringLength = maxStringLength;
            this.maxEnumerableLength = maxEnumerableLength;
            this.maxDepth = maxDepth;
        }

        public static DisplayConfig defaults() {
            return new DisplayConfig(TestMethodDisplay.CLASS_AND_METHOD, 50, 5, 3);
        }

        public TestMethodDisplay getMethodDisplay() { return methodDisplay; }
        public int getMaxStringLength() { return maxStringLength; }
        public int getMaxEnumerableLength() { return maxEnumerableLength; }
        public int getMaxDepth() { return maxDepth; }

        @Override
        public String toString() {
            return "DisplayConfig{methodDisplay=" + methodDisplay + ", maxStringLength=" + maxStringLength
                + ", maxEnumerableLength=" + maxEnumerableLength + ", maxDepth=" + maxDepth + "}";
        }
    }
}
