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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of analyzing one workflow graph. Steps, directives and inventories are
 * in transformation order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-13
 * @version 1.0
 */
public final class AnalysisResult {

    private final String workflowName;
    private final List<TransformationStep> steps;
    private final Map<Integer, MedallionLayer> layers;
    private final List<GenerationDirective> directives;
    private final List<DataEndpoint> sources;
    private final List<DataEndpoint> targets;

    public AnalysisResult(String workflowName, List<TransformationStep> steps, List<GenerationDirective> directives,
                          List<DataEndpoint> sources, List<DataEndpoint> targets) {
        this.workflowName = workflowName;
        this.steps = List.copyOf(steps);
        this.directives = List.copyOf(directives);
        this.sources = List.copyOf(sources);
        this.targets = List.copyOf(targets);
        Map<Integer, MedallionLayer> byNode = new LinkedHashMap<>();
        for (TransformationStep step : steps) {
            byNode.put(step.nodeId(), step.layer());
        }
        this.layers = Collections.unmodifiableMap(byNode);
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public List<TransformationStep> getSteps() {
        return steps;
    }

    /**
     * Layer per flow node id, in transformation order.
     */
    public Map<Integer, MedallionLayer> getLayers() {
        return layers;
    }

    /**
     * Layer of a flow node, or {@code null} for nodes that are not part of the flow.
     */
    public MedallionLayer layerOf(int nodeId) {
        return layers.get(nodeId);
    }

    public List<Integer> nodesIn(MedallionLayer layer) {
        List<Integer> result = new ArrayList<>();
        for (Map.Entry<Integer, MedallionLayer> entry : layers.entrySet()) {
            if (entry.getValue() == layer) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    public List<GenerationDirective> getDirectives() {
        return directives;
    }

    public Optional<GenerationDirective> directiveFor(int nodeId) {
        return directives.stream().filter(directive -> directive.nodeId() == nodeId).findFirst();
    }

    public List<DataEndpoint> getSources() {
        return sources;
    }

    public List<DataEndpoint> getTargets() {
        return targets;
    }

    /**
     * Ordered node ids.
     */
    public List<Integer> getOrder() {
        List<Integer> order = new ArrayList<>();
        steps.forEach(step -> order.add(step.nodeId()));
        return order;
    }

    @Override
    public String toString() {
        return "AnalysisResult{" +
               "workflow='" + workflowName + '\'' +
               ", steps=" + steps.size() +
               ", sources=" + sources.size() +
               ", targets=" + targets.size() +
               '}';
    }
}
