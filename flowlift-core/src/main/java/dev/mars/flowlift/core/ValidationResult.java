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

package dev.mars.flowlift.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Diagnostics accumulated while building a graph. Node-level problems that do
 * not abort ingestion (skipped nodes, dropped connections, unknown container
 * children) are recorded here as warnings so nothing is dropped silently.
 * Problems that do abort are raised as exceptions instead.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class ValidationResult {

    private final List<ValidationIssue> warnings;

    public ValidationResult() {
        this.warnings = new ArrayList<>();
    }

    private ValidationResult(List<ValidationIssue> warnings) {
        this.warnings = new ArrayList<>(warnings);
    }

    public void addWarning(Integer nodeId, String message) {
        warnings.add(new ValidationIssue(nodeId, null, message));
    }

    public void addWarning(Integer nodeId, String fieldPath, String message) {
        warnings.add(new ValidationIssue(nodeId, fieldPath, message));
    }

    /**
     * Appends every warning of {@code other} to this result.
     */
    public void merge(ValidationResult other) {
        if (other != null) {
            warnings.addAll(other.warnings);
        }
    }

    public ValidationResult copy() {
        return new ValidationResult(warnings);
    }

    public List<ValidationIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    public List<ValidationIssue> getWarningsFor(int nodeId) {
        List<ValidationIssue> result = new ArrayList<>();
        for (ValidationIssue warning : warnings) {
            if (warning.getNodeId() != null && warning.getNodeId() == nodeId) {
                result.add(warning);
            }
        }
        return result;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    @Override
    public String toString() {
        return "ValidationResult{warnings=" + warnings.size() + "}";
    }

    /**
     * A single warning, optionally tied to a node and to an element path
     * inside the source document.
     */
    public static class ValidationIssue {

        private final Integer nodeId;
        private final String fieldPath;
        private final String message;

        public ValidationIssue(Integer nodeId, String fieldPath, String message) {
            this.nodeId = nodeId;
            this.fieldPath = fieldPath;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public Integer getNodeId() {
            return nodeId;
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return Objects.equals(nodeId, that.nodeId) &&
                   Objects.equals(fieldPath, that.fieldPath) &&
                   Objects.equals(message, that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(nodeId, fieldPath, message);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("WARNING");

            if (nodeId != null) {
                sb.append(" (node ").append(nodeId).append(")");
            }

            if (fieldPath != null) {
                sb.append(" [").append(fieldPath).append("]");
            }

            sb.append(": ").append(message);

            return sb.toString();
        }
    }
}
