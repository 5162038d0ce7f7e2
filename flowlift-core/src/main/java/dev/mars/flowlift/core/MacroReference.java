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

import dev.mars.flowlift.core.exceptions.InvalidTransitionException;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Reference from a macro node to an external macro document, together with its
 * resolution state. Values are immutable: every transition returns a new
 * reference and terminal states reject further transitions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public final class MacroReference {

    private final String reference;
    private final MacroStatus status;
    private final MissingReason missingReason;
    private final Path resolvedPath;
    private final SearchLocation location;
    private final WorkflowGraph subGraph;
    private final String detail;

    private MacroReference(String reference, MacroStatus status, MissingReason missingReason,
                           Path resolvedPath, SearchLocation location, WorkflowGraph subGraph,
                           String detail) {
        this.reference = reference != null ? reference : "";
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.missingReason = missingReason;
        this.resolvedPath = resolvedPath;
        this.location = location;
        this.subGraph = subGraph;
        this.detail = detail;
    }

    public static MacroReference unresolved(String reference) {
        return new MacroReference(reference, MacroStatus.UNRESOLVED, null, null, null, null, null);
    }

    public MacroReference searching() {
        checkTransition(MacroStatus.SEARCHING);
        return new MacroReference(reference, MacroStatus.SEARCHING, null, null, null, null, null);
    }

    public MacroReference resolved(WorkflowGraph graph, Path path, SearchLocation foundAt) {
        checkTransition(MacroStatus.RESOLVED);
        Objects.requireNonNull(graph, "Resolved sub-graph cannot be null");
        return new MacroReference(reference, MacroStatus.RESOLVED, null, path, foundAt, graph, null);
    }

    public MacroReference missing(MissingReason reason, String missingDetail) {
        checkTransition(MacroStatus.MISSING);
        Objects.requireNonNull(reason, "Missing reason cannot be null");
        return new MacroReference(reference, MacroStatus.MISSING, reason, null, null, null, missingDetail);
    }

    private void checkTransition(MacroStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(reference, status, target, status.getValidTransitions());
        }
    }

    public String getReference() {
        return reference;
    }

    public boolean hasReference() {
        return !reference.isBlank();
    }

    public MacroStatus getStatus() {
        return status;
    }

    public MissingReason getMissingReason() {
        return missingReason;
    }

    public Path getResolvedPath() {
        return resolvedPath;
    }

    public SearchLocation getLocation() {
        return location;
    }

    /**
     * The parsed macro document; present only when {@link MacroStatus#RESOLVED}.
     */
    public WorkflowGraph getSubGraph() {
        return subGraph;
    }

    public String getDetail() {
        return detail;
    }

    public boolean isResolved() {
        return status == MacroStatus.RESOLVED;
    }

    public boolean isUnresolved() {
        return status == MacroStatus.UNRESOLVED;
    }

    /**
     * Final path segment of the reference, accepting both Windows and POSIX separators.
     */
    public String fileName() {
        return fileName(reference);
    }

    public static String fileName(String reference) {
        if (reference == null) {
            return "";
        }
        String trimmed = reference.trim();
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    /**
     * File name without its extension, e.g. {@code Cleanse} for {@code C:\macros\Cleanse.yxmc}.
     */
    public static String fileStem(String reference) {
        String name = fileName(reference);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MacroReference that = (MacroReference) o;
        return reference.equals(that.reference) &&
               status == that.status &&
               missingReason == that.missingReason &&
               Objects.equals(resolvedPath, that.resolvedPath) &&
               location == that.location &&
               Objects.equals(subGraph, that.subGraph) &&
               Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reference, status, missingReason, resolvedPath, location);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("MacroReference{");
        sb.append("reference='").append(reference).append('\'');
        sb.append(", status=").append(status);
        if (missingReason != null) {
            sb.append(", reason=").append(missingReason);
        }
        if (resolvedPath != null) {
            sb.append(", path=").append(resolvedPath);
        }
        sb.append('}');
        return sb.toString();
    }
}
