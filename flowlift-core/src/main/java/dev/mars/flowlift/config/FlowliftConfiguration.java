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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Configuration management for Flowlift.
 * Properties are layered: built-in defaults, then the first readable
 * {@code flowlift.properties} file, then the classpath resource of the same name,
 * then {@code flowlift.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class FlowliftConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(FlowliftConfiguration.class);

    public static final String MACRO_SEARCH_DIRS = "flowlift.macro.search.dirs";
    public static final String MACRO_INTERACTIVE = "flowlift.macro.interactive";
    public static final String MACRO_SKIP = "flowlift.macro.skip";
    public static final String MACRO_MAX_PROMPT_ATTEMPTS = "flowlift.macro.max.prompt.attempts";
    public static final String MACRO_MAX_DEPTH = "flowlift.macro.max.depth";
    public static final String TOOL_MAPPING_FILE = "flowlift.ingest.tool.mapping.file";
    public static final String ISOLATED_INPUT_BRONZE = "flowlift.analysis.isolated.input.bronze";
    public static final String MODEL_NAME_MAX_LENGTH = "flowlift.analysis.model.name.max.length";
    public static final String METRICS_ENABLED = "flowlift.monitoring.metrics.enabled";

    // Default configuration values
    private static final int DEFAULT_MAX_PROMPT_ATTEMPTS = 3;
    private static final int DEFAULT_MAX_DEPTH = 16;
    private static final int DEFAULT_MODEL_NAME_MAX_LENGTH = 50;

    private final Properties properties;

    public FlowliftConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public FlowliftConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Macro resolution
    public List<Path> getMacroSearchDirectories() {
        List<Path> dirs = new ArrayList<>();
        for (String entry : getListProperty(MACRO_SEARCH_DIRS)) {
            dirs.add(Paths.get(entry));
        }
        return dirs;
    }

    public boolean isMacroInteractive() {
        return getBooleanProperty(MACRO_INTERACTIVE, false);
    }

    public Set<String> getSkippedMacros() {
        return new LinkedHashSet<>(getListProperty(MACRO_SKIP));
    }

    public int getMaxPromptAttempts() {
        return getIntProperty(MACRO_MAX_PROMPT_ATTEMPTS, DEFAULT_MAX_PROMPT_ATTEMPTS);
    }

    public int getMaxMacroDepth() {
        return getIntProperty(MACRO_MAX_DEPTH, DEFAULT_MAX_DEPTH);
    }

    // Ingestion
    public Path getToolMappingFile() {
        String value = getProperty(TOOL_MAPPING_FILE);
        return value == null || value.isBlank() ? null : Paths.get(value.trim());
    }

    // Analysis
    public boolean isIsolatedInputBronze() {
        return getBooleanProperty(ISOLATED_INPUT_BRONZE, false);
    }

    public int getModelNameMaxLength() {
        return getIntProperty(MODEL_NAME_MAX_LENGTH, DEFAULT_MODEL_NAME_MAX_LENGTH);
    }

    // Monitoring
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    // Utility methods for type conversion
    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
                logger.warn("Non-positive value for property {}: {}. Using default: {}", key, value, defaultValue);
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            String trimmed = value.trim();
            if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
                return Boolean.parseBoolean(trimmed);
            }
            logger.warn("Invalid boolean value for property {}: {}. Using default: {}", key, value, defaultValue);
        }
        return defaultValue;
    }

    /**
     * Comma or path-separator delimited list; blank entries are dropped.
     */
    private List<String> getListProperty(String key) {
        List<String> result = new ArrayList<>();
        String value = properties.getProperty(key);
        if (value == null) {
            return result;
        }
        for (String part : value.split("[," + File.pathSeparator + "]")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(MACRO_INTERACTIVE, "false");
        properties.setProperty(MACRO_MAX_PROMPT_ATTEMPTS, String.valueOf(DEFAULT_MAX_PROMPT_ATTEMPTS));
        properties.setProperty(MACRO_MAX_DEPTH, String.valueOf(DEFAULT_MAX_DEPTH));
        properties.setProperty(ISOLATED_INPUT_BRONZE, "false");
        properties.setProperty(MODEL_NAME_MAX_LENGTH, String.valueOf(DEFAULT_MODEL_NAME_MAX_LENGTH));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "flowlift.properties",
                "config/flowlift.properties",
                System.getProperty("user.home") + "/.flowlift/flowlift.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    break;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("flowlift.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("flowlift."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "FlowliftConfiguration{" +
                "macroSearchDirectories=" + getMacroSearchDirectories() +
                ", macroInteractive=" + isMacroInteractive() +
                ", maxMacroDepth=" + getMaxMacroDepth() +
                ", isolatedInputBronze=" + isIsolatedInputBronze() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
