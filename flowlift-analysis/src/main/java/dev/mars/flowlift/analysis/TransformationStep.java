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

/**
 * One node of the transformation order.
 *
 * @param sequence    1-based position in the order
 * @param nodeId      id of the node
 * @param kind        tool kind
 * @param displayName display name of the node
 * @param description what the step does, in a short phrase
 * @param expression  normalized filter predicate or formula assignments, else {@code null}
 * @param layer       suggested layer
 */
public record TransformationStep(int sequence, int nodeId, NodeKind kind, String displayName, String description,
                                 String expression, MedallionLayer layer) {
}
