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

package dev.mars.flowlift.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for FlowliftConfiguration.
 * Validates defaults, explicit properties, system property overrides and
 * fallback on malformed values.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
class FlowliftConfigurationTest {

    private FlowliftConfiguration config;

    @BeforeEach
    void setUp() {
        config = new FlowliftConfiguration(new Properties());
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(FlowliftConfiguration.MACRO_MAX_DEPTH);
        System.clearProperty(FlowliftConfiguration.ISOLATED_INPUT_BRONZE);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaultMacroSettings() {
        assertFalse(config.isMacroInteractive());
        assertEquals(3, config.getMaxPromptAttempts());
        assertEquals(16, config.getMaxMacroDepth());
        assertTrue(config.getMacroSearchDirectories().isEmpty());
        assertTrue(config.getSkippedMacros().isEmpty());
    }

    @Test
    void testDefaultAnalysisSettings() {
        assertFalse(config.isIsolatedInputBronze());
        assertEquals(50, config.getModelNameMaxLength());
        assertTrue(config.isMetricsEnabled());
        assertNull(config.getToolMappingFile());
    }

    // ========== Explicit Properties Tests ==========

    @Test
    void testSearchDirectoriesAreSplitOnComma() {
        Properties props = new Properties();
        props.setProperty(FlowliftConfiguration.MACRO_SEARCH_DIRS, "macros, shared/macros ,");
        FlowliftConfiguration custom = new FlowliftConfiguration(props);

        assertEquals(List.of(Paths.get("macros"), Paths.get("shared/macros")),
                custom.getMacroSearchDirectories());
    }

    @Test
    void testSkippedMacrosKeepDeclarationOrder() {
        Properties props = new Properties();
        props.setProperty(FlowliftConfiguration.MACRO_SKIP, "Legacy.yxmc,Cleanse.yxmc,Legacy.yxmc");
        FlowliftConfiguration custom = new FlowliftConfiguration(props);

        Set<String> skipped = custom.getSkippedMacros();
        assertEquals(List.of("Legacy.yxmc", "Cleanse.yxmc"), List.copyOf(skipped));
    }

    @Test
    void testInvalidIntegerFallsBackToDefault() {
        Properties props = new Properties();
        props.setProperty(FlowliftConfiguration.MACRO_MAX_DEPTH, "deep");
        props.setProperty(FlowliftConfiguration.MODEL_NAME_MAX_LENGTH, "-4");
        FlowliftConfiguration custom = new FlowliftConfiguration(props);

        assertEquals(16, custom.getMaxMacroDepth());
        assertEquals(50, custom.getModelNameMaxLength());
    }

    @Test
    void testInvalidBooleanFallsBackToDefault() {
        Properties props = new Properties();
        props.setProperty(FlowliftConfiguration.METRICS_ENABLED, "sometimes");
        FlowliftConfiguration custom = new FlowliftConfiguration(props);

        assertTrue(custom.isMetricsEnabled());
    }

    @Test
    void testSetPropertyOverridesDefault() {
        config.setProperty(FlowliftConfiguration.ISOLATED_INPUT_BRONZE, "true");
        assertTrue(config.isIsolatedInputBronze());
        assertEquals("true", config.getProperty(FlowliftConfiguration.ISOLATED_INPUT_BRONZE));
        assertEquals("fallback", config.getProperty("flowlift.unknown", "fallback"));
    }

    // ========== System Property Tests ==========

    @Test
    void testSystemPropertiesOverrideDefaults() {
        System.setProperty(FlowliftConfiguration.MACRO_MAX_DEPTH, "4");
        System.setProperty(FlowliftConfiguration.ISOLATED_INPUT_BRONZE, "true");

        FlowliftConfiguration fromEnvironment = new FlowliftConfiguration();

        assertEquals(4, fromEnvironment.getMaxMacroDepth());
        assertTrue(fromEnvironment.isIsolatedInputBronze());
    }

    @Test
    void testToStringMentionsKeySettings() {
        String text = config.toString();
        assertTrue(text.contains("maxMacroDepth=16"));
        assertTrue(text.contains("metricsEnabled=true"));
    }
}
