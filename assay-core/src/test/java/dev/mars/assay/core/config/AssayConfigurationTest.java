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
import dev.mars.assay.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Assay Configuration Tests")
class AssayConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(AssayConfiguration.MAX_DEPTH);
        System.clearProperty(AssayConfiguration.METHOD_DISPLAY);
    }

    @Test
    @DisplayName("Should load the classpath defaults")
    void testDefaults() {
        AssayConfiguration configuration = new AssayConfiguration("default");
        AssayConfiguration.DisplayConfig display = configuration.getDisplayConfig();

        assertEquals("default", configuration.getProfile());
        assertFalse(configuration.isIncludeSerialization());
        assertEquals(TestMethodDisplay.CLASS_AND_METHOD, display.getMethodDisplay());
        assertEquals(50, display.getMaxStringLength());
        assertEquals(5, display.getMaxEnumerableLength());
        assertEquals(3, display.getMaxDepth());
    }

    @Test
    @DisplayName("Should layer the profile file over the defaults")
    void testProfileOverridesDefaults() {
        AssayConfiguration configuration = new AssayConfiguration("ci");

        assertTrue(configuration.isIncludeSerialization());
        assertEquals(TestMethodDisplay.METHOD, configuration.getDisplayConfig().getMethodDisplay());
        assertEquals(50, configuration.getDisplayConfig().getMaxStringLength());
    }

    @Test
    @DisplayName("Should let system properties win over the profile and overrides win over both")
    void testOverridePrecedence() {
        System.setProperty(AssayConfiguration.METHOD_DISPLAY, "CLASS_AND_METHOD");
        System.setProperty(AssayConfiguration.MAX_DEPTH, "7");

        AssayConfiguration fromSystem = new AssayConfiguration("ci");
        assertEquals(TestMethodDisplay.CLASS_AND_METHOD, fromSystem.getDisplayConfig().getMethodDisplay());
        assertEquals(7, fromSystem.getDisplayConfig().getMaxDepth());

        Properties overrides = new Properties();
        overrides.setProperty(AssayConfiguration.MAX_DEPTH, "2");
        AssayConfiguration overridden = new AssayConfiguration("ci", overrides);
        assertEquals(2, overridden.getDisplayConfig().getMaxDepth());
    }

    @Test
    @DisplayName("Should report every invalid value in one failure")
    void testValidationAggregatesErrors() {
        Properties overrides = new Properties();
        overrides.setProperty(AssayConfiguration.METHOD_DISPLAY, "SIDEWAYS");
        overrides.setProperty(AssayConfiguration.MAX_STRING_LENGTH, "0");

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> new AssayConfiguration("default", overrides));
        assertTrue(e.getMessage().contains("SIDEWAYS"));
        assertTrue(e.getMessage().contains("Max string length"));
    }

    @Test
    @DisplayName("Should fall back to the default for a non-numeric value")
    void testInvalidIntegerFallsBack() {
        Properties overrides = new Properties();
        overrides.setProperty(AssayConfiguration.MAX_ENUMERABLE_LENGTH, "many");

        AssayConfiguration configuration = new AssayConfiguration("default", overrides);
        assertEquals(5, configuration.getDisplayConfig().getMaxEnumerableLength());
    }

    @Test
    @DisplayName("Should parse method display ignoring case and dashes")
    void testMethodDisplayParsing() {
        assertEquals(TestMethodDisplay.CLASS_AND_METHOD, TestMethodDisplay.parse("class-and-method"));
        assertEquals(TestMethodDisplay.METHOD, TestMethodDisplay.parse(" method "));
        assertNull(TestMethodDisplay.parse("nope"));
    }
}
