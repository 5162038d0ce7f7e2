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

import dev.mars.flowlift.core.MacroReference;
import dev.mars.flowlift.core.MacroStatus;
import dev.mars.flowlift.core.MissingReason;
import dev.mars.flowlift.core.SearchLocation;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of one macro reference node during a resolution run.
 *
 * @param workflowName  name of the document containing the reference node
 * @param nodeId        id of the reference node within that document
 * @param reference     reference string as written
 * @param status        RESOLVED or MISSING
 * @param missingReason set when missing
 * @param resolvedPath  set when resolved
 * @param location      set when resolved
 * @param cacheHit      whether the document came from the resolution cache
 * @param depth         nesting depth, 1 for references in the root document
 * @param detail        human-readable detail of a miss, may be {@code null}
 */
public record MacroResolution(String workflowName, int nodeId, String reference, MacroStatus status,
                              MissingReason missingReason, Path resolvedPath, SearchLocation location,
                              boolean cacheHit, int depth, String detail) {

    public MacroResolution {
        Objects.requireNonNull(workflowName, "workflowName");
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(status, "status");
    }

    static MacroResolution of(String workflowName, int nodeId, MacroReference outcome, boolean cacheHit, int depth) {
        return new MacroResolution(workflowName, nodeId, outcome.getReference(), outcome.getStatus(),
                outcome.getMissingReason(), outcome.getResolvedPath(), outcome.getLocation(),
                cacheHit, depth, outcome.getDetail());
    }

    public boolean isResolved() {
        return status == MacroStatus.RESOLVED;
    }

    public boolean isMissing() {
        return status == MacroStatus.MISSING;
    }

    public String fileName() {
        return MacroReference.fileName(reference);
    }
}
