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

/**
 * Assigns a {@link MedallionLayer} to a flow node from its position in the flow.
 *
 * <p>Sinks and aggregating Summarize or Output nodes are GOLD; Inputs without
 * upstream nodes are BRONZE; everything else is SILVER. The sink rule is
 * applied first, so an Input with no downstream node is GOLD unless isolated
 * Inputs are configured to be BRONZE.</p>
 */
public class LayerClassifier {

    private final boolean isolatedInputBronze;

    public LayerClassifier() {
        this(false);
    }

    public LayerClassifier(boolean isolatedInputBronze) {
        this.isolatedInputBronze = isolatedInputBronze;
    }

    public MedallionLayer classify(WorkflowNode node, FlowDependencyGraph dependencies) {
        boolean source = node.getKind() == NodeKind.INPUT && dependencies.getDependencies(node.getId()).isEmpty();
        boolean sink = dependencies.getDependents(node.getId()).isEmpty();

        if (isolatedInputBronze && source && sink) {
            return MedallionLayer.BRONZE;
        }
        if (sink || aggregates(node)) {
            return MedallionLayer.GOLD;
        }
        if (source) {
            return MedallionLayer.BRONZE;
        }
        return MedallionLayer.SILVER;
    }

    static boolean aggregates(WorkflowNode node) {
        return (node.getKind() == NodeKind.SUMMARIZE || node.getKind() == NodeKind.OUTPUT)
                && node.getConfig().hasAggregations();
    }

    public boolean isIsolatedInputBronze() {
        return isolatedInputBronze;
    }
}
