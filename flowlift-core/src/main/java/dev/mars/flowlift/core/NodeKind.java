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

/**
 * The closed set of tool kinds the IR distinguishes. Every plugin identifier
 * found in a workflow document maps to exactly one kind; plugins the kind table
 * does not know become {@link #OTHER}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public enum NodeKind {
    INPUT("Input"),
    OUTPUT("Output"),
    FILTER("Filter"),
    FORMULA("Formula"),
    JOIN("Join"),
    SUMMARIZE("Summarize"),
    SELECT("Select"),
    SORT("Sort"),
    UNION("Union"),
    CONTAINER("Container"),
    MACRO("Macro"),
    OTHER("Other");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether nodes of this kind take part in data flow. Containers only group
     * other nodes for presentation.
     */
    public boolean isFlowKind() {
        return this != CONTAINER;
    }

    /**
     * Lenient lookup used by the kind table loader: accepts the enum name or the
     * label in any case.
     *
     * @return the matching kind, or {@code null} if nothing matches
     */
    public static NodeKind fromName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        for (NodeKind kind : values()) {
            if (kind.name().equalsIgnoreCase(trimmed) || kind.label.equalsIgnoreCase(trimmed)) {
                return kind;
            }
        }
        return null;
    }
}
