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

import dev.mars.flowlift.config.FlowliftConfiguration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Settings of a macro resolution run: where to search, whether to consult a
 * {@link MissingMacroHandler}, which references to skip outright, and the
 * recursion and prompt limits.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-09
 * @version 1.0
 */
public final class ResolutionConfig {

    public static final int DEFAULT_MAX_PROMPT_ATTEMPTS = 3;
    public static final int DEFAULT_MAX_DEPTH = 16;

    private final List<Path> searchDirectories;
    private final boolean interactive;
    private final Set<String> skippedMacros;
    private final int maxPromptAttempts;
    private final int maxDepth;
    private final boolean metricsEnabled;

    private ResolutionConfig(Builder builder) {
        this.searchDirectories = List.copyOf(builder.searchDirectories);
        this.interactive = builder.interactive;
        this.skippedMacros = Set.copyOf(builder.skippedMacros);
        this.maxPromptAttempts = builder.maxPromptAttempts;
        this.maxDepth = builder.maxDepth;
        this.metricsEnabled = builder.metricsEnabled;
    }

    public static ResolutionConfig defaults() {
        return builder().build();
    }

    public static ResolutionConfig fromConfiguration(FlowliftConfiguration configuration) {
        return builder()
                .searchDirectories(configuration.getMacroSearchDirectories())
                .interactive(configuration.isMacroInteractive())
                .skippedMacros(configuration.getSkippedMacros())
                .maxPromptAttempts(configuration.getMaxPromptAttempts())
                .maxDepth(configuration.getMaxMacroDepth())
                .metricsEnabled(configuration.isMetricsEnabled())
                .build();
    }

    /**
     * Search directories in priority order.
     */
    public List<Path> getSearchDirectories() {
        return searchDirectories;
    }

    public boolean isInteractive() {
        return interactive;
    }

    /**
     * References (full string or file name) that are marked skipped without searching.
     */
    public Set<String> getSkippedMacros() {
        return skippedMacros;
    }

    public boolean isSkipped(String reference, String fileName) {
        return skippedMacros.contains(reference) || skippedMacros.contains(fileName);
    }

    public int getMaxPromptAttempts() {
        return maxPromptAttempts;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public Builder toBuilder() {
        return builder()
                .searchDirectories(searchDirectories)
                .interactive(interactive)
                .skippedMacros(skippedMacros)
                .maxPromptAttempts(maxPromptAttempts)
                .maxDepth(maxDepth)
                .metricsEnabled(metricsEnabled);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolutionConfig that = (ResolutionConfig) o;
        return interactive == that.interactive &&
               maxPromptAttempts == that.maxPromptAttempts &&
               maxDepth == that.maxDepth &&
               metricsEnabled == that.metricsEnabled &&
               searchDirectories.equals(that.searchDirectories) &&
               skippedMacros.equals(that.skippedMacros);
    }

    @Override
    public int hashCode() {
        return Objects.hash(searchDirectories, interactive, skippedMacros, maxPromptAttempts, maxDepth, metricsEnabled);
    }

    @Override
    public String toString() {
        return "ResolutionConfig{" +
               "searchDirectories=" + searchDirectories +
               ", interactive=" + interactive +
               ", skippedMacros=" + skippedMacros +
               ", maxPromptAttempts=" + maxPromptAttempts +
               ", maxDepth=" + maxDepth +
               '}';
    }

    public static class Builder {
        private List<Path> searchDirectories = new ArrayList<>();
        private boolean interactive;
        private Set<String> skippedMacros = new LinkedHashSet<>();
        private int maxPromptAttempts = DEFAULT_MAX_PROMPT_ATTEMPTS;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private boolean metricsEnabled = true;

        private Builder() {
        }

        public Builder searchDirectories(List<Path> searchDirectories) {
            this.searchDirectories = new ArrayList<>(searchDirectories);
            return this;
        }

        public Builder addSearchDirectory(Path directory) {
            this.searchDirectories.add(Objects.requireNonNull(directory, "Directory cannot be null"));
            return this;
        }

        public Builder interactive(boolean interactive) {
            this.interactive = interactive;
            return this;
        }

        public Builder skippedMacros(Set<String> skippedMacros) {
            this.skippedMacros = new LinkedHashSet<>(skippedMacros);
            return this;
        }

        public Builder skip(String reference) {
            this.skippedMacros.add(Objects.requireNonNull(reference, "Reference cannot be null"));
            return this;
        }

        public Builder maxPromptAttempts(int maxPromptAttempts) {
            if (maxPromptAttempts < 1) {
                throw new IllegalArgumentException("maxPromptAttempts must be positive: " + maxPromptAttempts);
            }
            this.maxPromptAttempts = maxPromptAttempts;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 1) {
                throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public ResolutionConfig build() {
            return new ResolutionConfig(this);
        }
    }
}
