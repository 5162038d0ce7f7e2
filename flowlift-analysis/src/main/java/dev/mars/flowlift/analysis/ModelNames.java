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

package dev.mars.flowlift.analysis;

import dev.mars.flowlift.core.NodeKind;
import dev.mars.flowlift.core.WorkflowNode;

import java.util.Locale;

/**
 * Suggested model names for generated transformations:
 * {@code <prefix>_<workflow>_<base>} where the prefix is {@code stg} for BRONZE,
 * {@code int} for SILVER, and {@code fct} or {@code dim} for GOLD depending on
 * whether the node aggregates.
 */
public class ModelNames {

    public static final int DEFAULT_MAX_LENGTH = 50;
    public static final String FALLBACK = "unknown";

    private final int maxLength;

    public ModelNames() {
        this(DEFAULT_MAX_LENGTH);
    }

    public ModelNames(int maxLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    /**
     * Lowercases, replaces every character outside {@code [a-z0-9_]} with an
     * underscore, collapses and trims underscores and truncates to the maximum
     * length. Falls back to {@value #FALLBACK} when nothing is left.
     */
    public String sanitize(String name) {
        if (name == null) {
            return FALLBACK;
        }
        String sanitized = name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_]", "_")
                .replaceAll("_+", "_");
        sanitized = trimUnderscores(sanitized);
        if (sanitized.length() > maxLength) {
            sanitized = trimUnderscores(sanitized.substring(0, maxLength));
        }
        return sanitized.isEmpty() ? FALLBACK : sanitized;
    }

    public String modelName(WorkflowNode node, MedallionLayer layer, String workflowName) {
        return prefix(node, layer) + "_" + sanitize(workflowName) + "_" + sanitize(baseName(node));
    }

    static String prefix(WorkflowNode node, MedallionLayer layer) {
        switch (layer) {
            case BRONZE:
                return "stg";
            case SILVER:
                return "int";
            default:
                return node.getKind() == NodeKind.SUMMARIZE || node.getConfig().hasAggregations() ? "fct" : "dim";
        }
    }

    static String baseName(WorkflowNode node) {
        DataEndpoint endpoint = DataEndpoint.of(node);
        if (endpoint != null && (endpoint.table() != null || endpoint.path() != null)) {
            return endpoint.name();
        }
        if (node.getAnnotation() != null) {
            return node.getAnnotation();
        }
        return node.getDisplayName();
    }

    public int getMaxLength() {
        return maxLength;
    }

    private static String trimUnderscores(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '_') {
            end--;
        }
        return value.substring(start, end);
    }
}
