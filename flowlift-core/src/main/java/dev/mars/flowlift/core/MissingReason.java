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
 * Why a macro reference ended up {@link MacroStatus#MISSING}.
 */
public enum MissingReason {
    /** No search candidate exists. */
    NOT_FOUND("Macro not found"),
    /** At least one candidate existed but none parsed as a workflow document. */
    PARSE_FAILED("Macro document could not be parsed"),
    /** The candidate is already being resolved further up the reference chain. */
    CIRCULAR("Circular macro reference"),
    /** An external decision (force-skip list or missing-macro handler) skipped it. */
    SKIPPED("Macro skipped");

    private final String description;

    MissingReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
