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

package dev.mars.flowlift.workflow.macro;

import dev.mars.flowlift.core.exceptions.FormatException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link ResolutionConfig} from YAML:
 *
 * <pre>
 * searchDirectories:
 *   - shared/macros
 *   - /opt/alteryx/macros
 * interactive: false
 * skip:
 *   - Legacy.yxmc
 * maxPromptAttempts: 3
 * maxDepth: 16
 * </pre>
 *
 * Relative search directories are resolved against the directory of the YAML file.
 */
public class ResolutionConfigLoader {

    private final Yaml yaml;

    public ResolutionConfigLoader() {
        this.yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    public ResolutionConfig load(Path file) throws FormatException {
        try {
            String content = Files.readString(file);
            Path base = file.toAbsolutePath().getParent();
            return loadFromString(content, base, file.getFileName().toString());
        } catch (IOException e) {
            throw new FormatException(file.toString(), "Failed to read resolution config", e);
        }
    }

    /**
     * @param baseDirectory directory relative search paths are resolved against; may be {@code null}
     */
    public ResolutionConfig loadFromString(String content, Path baseDirectory, String sourceName)
            throws FormatException {
        Map<String, Object> data;
        try {
            Object loaded = yaml.load(content);
            if (loaded == null) {
                return ResolutionConfig.defaults();
            }
            if (!(loaded instanceof Map)) {
                throw new FormatException(sourceName, "Resolution config must be a YAML mapping");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) loaded;
            data = map;
        } catch (YAMLException e) {
            throw new FormatException(sourceName, "YAML parsing failed", e);
        }

        ResolutionConfig.Builder builder = ResolutionConfig.builder();
        for (String dir : getStringList(data, "searchDirectories")) {
            Path path = Paths.get(dir);
            builder.addSearchDirectory(baseDirectory != null && !path.isAbsolute() ? baseDirectory.resolve(path) : path);
        }
        for (String skipped : getStringList(data, "skip")) {
            builder.skip(skipped);
        }
        builder.interactive(getBooleanValue(data, "interactive", false));
        try {
            builder.maxPromptAttempts(getIntValue(data, "maxPromptAttempts", ResolutionConfig.DEFAULT_MAX_PROMPT_ATTEMPTS, sourceName));
            builder.maxDepth(getIntValue(data, "maxDepth", ResolutionConfig.DEFAULT_MAX_DEPTH, sourceName));
        } catch (IllegalArgumentException e) {
            throw new FormatException(sourceName, e.getMessage(), e);
        }
        return builder.build();
    }

    private List<String> getStringList(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List) {
            List<?> raw = (List<?>) value;
            return raw.stream().filter(item -> item != null).map(Object::toString).toList();
        }
        return List.of(value.toString());
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private int getIntValue(Map<String, Object> data, String key, int defaultValue, String sourceName)
            throws FormatException {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new FormatException(sourceName, 0, key, "Expected an integer but found '" + value + "'", e);
        }
    }
}
