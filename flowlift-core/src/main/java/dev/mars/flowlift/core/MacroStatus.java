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
 * Lifecycle status of a macro reference node.
 *
 * The flow is:
 * UNRESOLVED -> SEARCHING -> RESOLVED
 *
 * Alternative flows:
 * SEARCHING -> MISSING (not found, parse failure, circular reference, skipped)
 * UNRESOLVED -> MISSING (force-skipped before any search)
 *
 * RESOLVED and MISSING are terminal; a reference never changes after the
 * resolution run that settled it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public enum MacroStatus {

    /**
     * Created by the ingestor; no resolution has been attempted.
     */
    UNRESOLVED("Macro reference not yet resolved", false),

    /**
     * The resolver is walking the search candidates for this reference.
     */
    SEARCHING("Searching for macro document", false),

    /**
     * A macro document was found, parsed and spliced into the host graph.
     */
    RESOLVED("Macro resolved and expanded", true),

    /**
     * Resolution gave up; see {@link MissingReason}. Analysis continues with the
     * reference node as an opaque block.
     */
    MISSING("Macro missing", true);

    private final String description;
    private final boolean terminal;

    MacroStatus(String description, boolean terminal) {
        this.description = description;
        this.terminal = terminal;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Check if transition from this status to the target status is valid.
     */
    public boolean canTransitionTo(MacroStatus target) {
        if (this.isTerminal()) {
            return false;
        }

        switch (this) {
            case UNRESOLVED:
                return target == SEARCHING || target == MISSING;
            case SEARCHING:
                return target == RESOLVED || target == MISSING;
            default:
                return false;
        }
    }

    public MacroStatus[] getValidTransitions() {
        switch (this) {
            case UNRESOLVED:
                return new MacroStatus[]{SEARCHING, MISSING};
            case SEARCHING:
                return new MacroStatus[]{RESOLVED, MISSING};
            default:
                return new MacroStatus[0];
        }
    }
}
