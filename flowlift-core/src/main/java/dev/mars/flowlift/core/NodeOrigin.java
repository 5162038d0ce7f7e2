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

import java.util.Objects;

/**
 * Provenance of a node that was spliced into a host graph from a macro document.
 *
 * @param macroNodeId the host's macro reference node that was expanded
 * @param originalId  the node's identifier inside the macro document
 * @param reference   the macro reference string that was resolved
 */
public record NodeOrigin(int macroNodeId, int originalId, String reference) {

    public NodeOrigin {
        Objects.requireNonNull(reference, "reference");
    }
}
