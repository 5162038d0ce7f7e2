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

package dev.mars.flowlift.workflow;

import dev.mars.flowlift.core.NodeKind;
import dev.mars.flowlift.core.exceptions.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Lookup table from plugin identifier to {@link NodeKind}.
 *
 * <p>The table ships as the classpath resource {@value #DEFAULT_RESOURCE}. A user
 * file with the same layout can extend or override entries. Lookup tries the
 * full plugin identifier first, then the last dotted segment against the simple
 * name table (case-insensitive), and falls back to {@link NodeKind#OTHER}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class ToolKindRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ToolKindRegistry.class);

    public static final String DEFAULT_RESOURCE = "flowlift/tool-kinds.yaml";

    private final Map<String, NodeKind> plugins;
    private final Map<String, NodeKind> simpleNames;

    private ToolKindRegistry(Map<String, NodeKind> plugins, Map<String, NodeKind> simpleNames) {
        this.plugins = Map.copyOf(plugins);
        this.simpleNames = Map.copyOf(simpleNames);
    }

    /**
     * Loads the bundled table.
     *
     * @throws IllegalStateException if the bundled resource is missing or malformed
     */
    public static ToolKindRegistry loadDefault() {
        try (InputStream input = ToolKindRegistry.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Tool kind table not found on classpath: " + DEFAULT_RESOURCE);
            }
            Map<String, NodeKind> plugins = new HashMap<>();
            Map<String, NodeKind> simpleNames = new HashMap<>();
            merge(load(input, DEFAULT_RESOURCE), plugins, simpleNames, DEFAULT_RESOURCE);
            return new ToolKindRegistry(plugins, simpleNames);
        } catch (IOException | FormatException e) {
            throw new IllegalStateException("Unable to load tool kind table " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads the bundled table and applies the entries of {@code overrideFile} on
     * top of it. A {@code null} file yields the bundled table unchanged.
     */
    public static ToolKindRegistry load(Path overrideFile) throws FormatException {
        ToolKindRegistry defaults = loadDefault();
        if (overrideFile == null) {
            return defaults;
        }
        Map<String, NodeKind> plugins = new HashMap<>(defaults.plugins);
        Map<String, NodeKind> simpleNames = new HashMap<>(defaults.simpleNames);
        try (InputStream input = Files.newInputStream(overrideFile)) {
            merge(load(input, overrideFile.toString()), plugins, simpleNames, overrideFile.toString());
        } catch (IOException e) {
            throw new FormatException(overrideFile.toString(), "Failed to read tool mapping file", e);
        }
        logger.info("Loaded tool kind overrides from {}", overrideFile);
        return new ToolKindRegistry(plugins, simpleNames);
    }

    private static Map<String, Object> load(InputStream input, String source) throws FormatException {
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object data = yaml.load(input);
            if (data == null) {
                return Map.of();
            }
            if (!(data instanceof Map)) {
                throw new FormatException(source, "Tool mapping must be a YAML mapping");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) data;
            return map;
        } catch (YAMLException e) {
            throw new FormatException(source, "YAML parsing failed", e);
        }
    }

    private static void merge(Map<String, Object> data, Map<String, NodeKind> plugins,
                              Map<String, NodeKind> simpleNames, String source) {
        putAll(getMapValue(data, "plugins"), plugins, false, source);
        putAll(getMapValue(data, "simpleNames"), simpleNames, true, source);
    }

    private static void putAll(Map<String, Object> entries, Map<String, NodeKind> target,
                               boolean lowerCaseKeys, String source) {
        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            NodeKind kind = NodeKind.fromName(entry.getValue() != null ? entry.getValue().toString() : null);
            if (kind == null) {
                logger.warn("Ignoring tool mapping {} -> {} in {}: unknown kind", entry.getKey(), entry.getValue(), source);
                continue;
            }
            String key = lowerCaseKeys ? entry.getKey().toLowerCase(Locale.ROOT) : entry.getKey();
            target.put(key, kind);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    /**
     * Kind for a plugin identifier. Blank plugins are not resolved here; the
     * ingestor treats them as macro references.
     */
    public NodeKind kindOf(String plugin) {
        if (plugin == null || plugin.isBlank()) {
            return NodeKind.OTHER;
        }
        NodeKind kind = plugins.get(plugin.trim());
        if (kind != null) {
            return kind;
        }
        kind = simpleNames.get(simpleName(plugin).toLowerCase(Locale.ROOT));
        return kind != null ? kind : NodeKind.OTHER;
    }

    /**
     * Last dotted segment of a plugin identifier, e.g. {@code Filter} for
     * {@code AlteryxBasePluginsGui.Filter.Filter}.
     */
    public static String simpleName(String plugin) {
        if (plugin == null) {
            return "";
        }
        String trimmed = plugin.trim();
        int dot = trimmed.lastIndexOf('.');
        return dot >= 0 ? trimmed.substring(dot + 1) : trimmed;
    }

    public int size() {
        return plugins.size() + simpleNames.size();
    }
}
