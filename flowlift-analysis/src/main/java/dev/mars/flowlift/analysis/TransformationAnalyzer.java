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

import dev.mars.flowlift.config.FlowliftConfiguration;
import dev.mars.flowlift.core.NodeKind;
import dev.mars.flowlift.core.WorkflowGraph;
import dev.mars.flowlift.core.WorkflowNode;
import dev.mars.flowlift.core.exceptions.CyclicDependencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a resolved workflow graph into an ordered list of transformation steps,
 * a layer per step, generation directives and the source and target inventories.
 * The graph is only read.
 *
 * <p>Typical use:</p>
 * <pre>
 * WorkflowGraph graph = resolver.resolve(parser.parse(path)).graph();
 * AnalysisResult result = new TransformationAnalyzer().analyze(graph);
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-13
 * @version 1.0
 */
public class TransformationAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(TransformationAnalyzer.class);

    private final LayerClassifier classifier;
    private final ModelNames modelNames;
    private final DirectiveBuilder directiveBuilder;

    public TransformationAnalyzer() {
        this(new LayerClassifier(), new ModelNames());
    }

    public TransformationAnalyzer(LayerClassifier classifier, ModelNames modelNames) {
        this.classifier = Objects.requireNonNull(classifier, "Classifier cannot be null");
        this.modelNames = Objects.requireNonNull(modelNames, "Model names cannot be null");
        this.directiveBuilder = new DirectiveBuilder();
    }

    public static TransformationAnalyzer fromConfiguration(FlowliftConfiguration configuration) {
        return new TransformationAnalyzer(new LayerClassifier(configuration.isIsolatedInputBronze()),
                new ModelNames(configuration.getModelNameMaxLength()));
    }

    /**
     * @throws CyclicDependencyException if the flow nodes form a cycle
     */
    public AnalysisResult analyze(WorkflowGraph graph) throws CyclicDependencyException {
        Objects.requireNonNull(graph, "Graph cannot be null");
        FlowDependencyGraph dependencies = new FlowDependencyGraph(graph);
        List<WorkflowNode> order = dependencies.topologicalSort();

        List<TransformationStep> steps = new ArrayList<>();
        List<GenerationDirective> directives = new ArrayList<>();
        List<DataEndpoint> sources = new ArrayList<>();
        List<DataEndpoint> targets = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();

        int sequence = 1;
        for (WorkflowNode node : order) {
            MedallionLayer layer = classifier.classify(node, dependencies);
            steps.add(new TransformationStep(sequence++, node.getId(), node.getKind(), node.getDisplayName(),
                    StepDescriber.describe(node), StepDescriber.expression(node), layer));

            String modelName = modelNames.modelName(node, layer, graph.getName());
            if (!usedNames.add(modelName)) {
                modelName = modelName + "_" + node.getId();
                usedNames.add(modelName);
            }
            directives.add(directiveBuilder.build(graph, node, layer, modelName,
                    new ArrayList<>(dependencies.getDependencies(node.getId()))));

            DataEndpoint endpoint = DataEndpoint.of(node);
            if (endpoint != null) {
                if (node.getKind() == NodeKind.INPUT) {
                    sources.add(endpoint);
                } else if (node.getKind() == NodeKind.OUTPUT) {
                    targets.add(endpoint);
                }
            }
        }

        AnalysisResult result = new AnalysisResult(graph.getName(), steps, directives, sources, targets);
        logger.info("Analyzed '{}': {} steps ({} bronze, {} silver, {} gold), {} sources, {} targets",
                graph.getName(), steps.size(),
                result.nodesIn(MedallionLayer.BRONZE).size(),
                result.nodesIn(MedallionLayer.SILVER).size(),
                result.nodesIn(MedallionLayer.GOLD).size(),
                sources.size(), targets.size());
        return result;
    }
}
