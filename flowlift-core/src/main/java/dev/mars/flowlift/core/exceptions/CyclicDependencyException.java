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

package dev.mars.flowlift.core.exceptions;

import java.util.List;

/**
 * Thrown by the analyzer when the connections between flow nodes contain a cycle,
 * so no transformation order exists. The graph itself is left untouched.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class CyclicDependencyException extends FlowliftException {

    private final List<Integer> unorderedNodeIds;

    public CyclicDependencyException(String workflowName, List<Integer> unorderedNodeIds) {
        super("Circular dependency detected in workflow '" + workflowName + "' among nodes: " + unorderedNodeIds);
        this.unorderedNodeIds = List.copyOf(unorderedNodeIds);
    }

    /**
     * Nodes that could not be ordered, ascending. Every cycle member is included,
     * along with any node that only sits downstream of a cycle.
     */
    public List<Integer> getUnorderedNodeIds() {
        return unorderedNodeIds;
    }
}
