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
import dev.mars.flowlift.core.Connection;
import dev.mars.flowlift.core.MacroReference;
import dev.mars.flowlift.core.MissingReason;
import dev.mars.flowlift.core.NodeKind;
import dev.mars.flowlift.core.ToolConfig;
import dev.mars.flowlift.core.WorkflowGraph;
import dev.mars.flowlift.core.WorkflowNode;
import dev.mars.flowlift.core.exceptions.CyclicDependencyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Properties;

import static dev.mars.flowlift.analysis.GraphFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class TransformationAnalyzerTest {

    private TransformationAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new TransformationAnalyzer();
    }

    @Nested
    @DisplayName("Layers")
    class Layers {

        @Test
        void linearFlowIsBronzeSilverGold() throws Exception {
            AnalysisResult result = analyzer.analyze(linear());

            assertEquals(List.of(1, 2, 3), result.getOrder());
            assertEquals(MedallionLayer.BRONZE, result.layerOf(1));
            assertEquals(MedallionLayer.SILVER, result.layerOf(2));
            assertEquals(MedallionLayer.GOLD, result.layerOf(3));
        }

        @Test
        void aggregatingSummarizeIsGoldEvenWithDownstream() throws Exception {
            WorkflowGraph graph = WorkflowGraph.builder("Totals")
                    .addNode(fileInput(1, "sales.csv"))
                    .addNode(summarize(2, List.of("Region"), new ToolConfig.Aggregation("Amount", "Sum", "Total")))
                    .addNode(filter(3, "[Total] > 10"))
                    .addNode(fileOutput(4, "totals.csv"))
                    .addConnection(edge(1, 2))
                    .addConnection(edge(2, 3))
                    .addConnection(edge(3, 4))
                    .build();

            AnalysisResult result = analyzer.analyze(graph);

            assertEquals(MedallionLayer.GOLD, result.layerOf(2));
            assertEquals(MedallionLayer.SILVER, result.layerOf(3));
            assertEquals(List.of(2, 4), result.nodesIn(MedallionLayer.GOLD));
        }

        @Test
        void summarizeWithoutAggregationsFollowsPosition() throws Exception {
            WorkflowGraph graph = WorkflowGraph.builder("Distinct")
                    .addNode(fileInput(1, "sales.csv"))
                    .addNode(summarize(2, List.of("Region")))
                    .addNode(fileOutput(3, "regions.csv"))
                    .addConnection(edge(1, 2))
                    .addConnection(edge(2, 3))
                    .build();

            assertEquals(MedallionLayer.SILVER, analyzer.analyze(graph).layerOf(2));
        }

        @Test
        void isolatedInputIsGoldUnlessConfigured() throws Exception {
            WorkflowGraph graph = WorkflowGraph.builder("Lonely").addNode(fileInput(1, "a.csv")).build();

            assertEquals(MedallionLayer.GOLD, analyzer.analyze(graph).layerOf(1));
            TransformationAnalyzer bronze = new TransformationAnalyzer(new LayerClassifier(true), new ModelNames());
            assertEquals(MedallionLayer.BRONZE, bronze.analyze(graph).layerOf(1));
        }

        @Test
        void configurationControlsIsolatedInputsAndNameLength() throws Exception {
            Properties properties = new Properties();
            properties.setProperty(FlowliftConfiguration.ISOLATED_INPUT_BRONZE, "true");
            properties.setProperty(FlowliftConfiguration.MODEL_NAME_MAX_LENGTH, "6");
            TransformationAnalyzer configured = TransformationAnalyzer.fromConfiguration(new FlowliftConfiguration(properties));
            WorkflowGraph graph = WorkflowGraph.builder("Quarterly Report").addNode(fileInput(1, "a.csv")).build();

            AnalysisResult result = configured.analyze(graph);

            assertEquals(MedallionLayer.BRONZE, result.layerOf(1));
            assertEquals("stg_quarte_a", result.getDirectives().get(0).modelName());
        }
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        void upstreamComesFirstRegardlessOfId() throws Exception {
            WorkflowGraph graph = WorkflowGraph.builder("Reversed")
                    .addNode(fileInput(9, "a.csv"))
                    .addNode(filter(1, "[x] = 1"))
                    .addNode(fileOutput(3, "b.csv"))
                    .addConnection(edge(9, 1))
                    .addConnection(edge(1, 3))
                    .build();

            assertEquals(List.of(9, 1, 3), analyzer.analyze(graph).getOrder());
        }

        @Test
        void readyNodesAreTakenInAscendingIdOrder() throws Exception {
            WorkflowGraph graph = WorkflowGraph.builder("Fan In")
                    .addNode(fileInput(4, "a.csv"))
                    .addNode(fileInput(2, "b.csv"))
                    .addNode(WorkflowNode.builder(7, NodeKind.UNION).config(new ToolConfig.Union("Auto")).build())
                    .addNode(fileOutput(8, "c.csv"))
                    .addConnection(edge(4, 7))
                    .addConnection(edge(2, 7))
                    .addConnection(edge(7, 8))
                    .build();

            AnalysisResult result = analyzer.analyze(graph);

            assertEquals(List.of(2, 4, 7, 8), result.getOrder());
            assertThat(result.getSteps()).extracting(TransformationStep::sequence).containsExactly(1, 2, 3, 4);
            GenerationDirective union = result.directiveFor(7).orElseThrow();
            assertEquals(2, union.parameter(GenerationDirective.INPUT_COUNT));
            assertEquals(List.of(2, 4), union.upstreamIds());
        }

        @Test
        void cycleIsReportedWithUnorderedNodes() throws Exception {
            WorkflowGraph graph = WorkflowGraph.builder("Loop")
                    .addNode(fileInput(1, "a.csv"))
                    .addNode(filter(2, "[a] > 1"))
                    .addNode(filter(3, "[b] > 1"))
                    .addNode(fileOutput(4, "b.csv"))
                    .addConnection(edge(1, 2))
                    .addConnection(edge(2, 3))
                    .addConnection(edge(3, 2))
                    .addConnection(edge(3, 4))
                    .build();

            assertThatThrownBy(() -> analyzer.analyze(graph))
                    .isInstanceOfSatisfying(CyclicDependencyException.class,
                            e -> assertEquals(List.of(2, 3, 4), e.getUnorderedNodeIds()));
            assertEquals(4, graph.getConnections().size());
            assertEquals(4, graph.size());
            assertTrue(new FlowDependencyGraph(graph).hasCycles());
        }
    }

    @Nested
    @DisplayName("Flow nodes")
    class FlowNodes {

        @Test
        void containersAndResolvedMarkersAreSkipped() throws Exception {
            WorkflowGraph graph = WorkflowGraph.builder("Grouped")
                    .addNode(fileInput(1, "a.csv"))
                    .addNode(WorkflowNode.builder(2, NodeKind.FILTER)
                            .config(new ToolConfig.Filter("[a] > 1", false))
                            .containerId(10)
                            .build())
                    .addNode(fileOutput(3, "b.csv"))
                    .addNode(resolvedMacro(5, linear()))
                    .addNode(WorkflowNode.builder(10, NodeKind.CONTAINER)
                            .config(new ToolConfig.Container("Cleaning", false))
                            .childIds(List.of(2))
                            .build())
                    .addConnection(edge(1, 2))
                    .addConnection(edge(2, 3))
                    .build();

            AnalysisResult result = analyzer.analyze(graph);

            assertEquals(List.of(1, 2, 3), result.getOrder());
            assertNull(result.layerOf(5));
            assertNull(result.layerOf(10));
        }

        @Test
        void missingMacroStaysAsOpaqueStep() throws Exception {
            MacroReference missing = MacroReference.unresolved("Gone.yxmc").searching()
                    .missing(MissingReason.NOT_FOUND, "Searched 4 locations");
            WorkflowGraph graph = WorkflowGraph.builder("Opaque")
                    .addNode(fileInput(1, "a.csv"))
                    .addNode(WorkflowNode.builder(2, NodeKind.MACRO).config(new ToolConfig.Macro(missing)).build())
                    .addNode(fileOutput(3, "b.csv"))
                    .addConnection(edge(1, 2))
                    .addConnection(edge(2, 3))
                    .build();

            AnalysisResult result = analyzer.analyze(graph);

            assertEquals(MedallionLayer.SILVER, result.layerOf(2));
            GenerationDirective directive = result.directiveFor(2).orElseThrow();
            assertEquals("Gone.yxmc", directive.parameter(GenerationDirective.MACRO_REFERENCE));
            assertEquals("MISSING", directive.parameter(GenerationDirective.MACRO_STATUS));
            assertEquals("NOT_FOUND", directive.parameter(GenerationDirective.MISSING_REASON));
            assertThat(result.getSteps().get(1).description()).contains("Gone.yxmc").contains("MISSING");
        }
    }

    @Nested
    @DisplayName("Directives")
    class Directives {

        @Test
        void filterDirectiveCarriesNormalizedPredicate() throws Exception {
            AnalysisResult result = analyzer.analyze(linear());

            GenerationDirective filter = result.directiveFor(2).orElseThrow();
            assertEquals("Amount > 0", filter.parameter(GenerationDirective.PREDICATE));
            assertEquals(List.of("Amount"), filter.parameter(GenerationDirective.FIELDS));
            assertEquals("int_linear_flow_filter", filter.modelName());
            assertEquals("view", filter.materialization());
            assertEquals(List.of(1), filter.upstreamIds());
            assertEquals("Amount > 0", result.getSteps().get(1).expression());
        }

        @Test
        void endpointsNameBronzeAndGoldModels() throws Exception {
            AnalysisResult result = analyzer.analyze(linear());

            assertEquals("stg_linear_flow_orders", result.directiveFor(1).orElseThrow().modelName());
            GenerationDirective output = result.directiveFor(3).orElseThrow();
            assertEquals("dim_linear_flow_clean_orders", output.modelName());
            assertEquals("table", output.materialization());
        }

        @Test
        void joinVariantFollowsConfiguredTypeThenAnchors() throws Exception {
            WorkflowGraph derived = joinGraph(null, "Join", "Right");
            WorkflowGraph leftOnly = joinGraph(null, "Left", null);
            WorkflowGraph configured = joinGraph("Left", "Join", "Right");

            assertEquals("RIGHT_OUTER", joinDirective(derived).parameter(GenerationDirective.JOIN_VARIANT));
            assertEquals("LEFT_ANTI", joinDirective(leftOnly).parameter(GenerationDirective.JOIN_VARIANT));
            assertEquals("LEFT_OUTER", joinDirective(configured).parameter(GenerationDirective.JOIN_VARIANT));
        }

        @Test
        void joinKeysAreNormalized() throws Exception {
            GenerationDirective directive = joinDirective(joinGraph(null, "Join", null));

            List<Map<String, String>> keys = directive.listParameter(GenerationDirective.JOIN_KEYS);
            assertEquals(List.of(Map.of("left", "CustomerID", "right", "ID")), keys);
            assertEquals(Boolean.FALSE, directive.parameter(GenerationDirective.BY_POSITION));
        }

        @Test
        void nestedParametersCannotBeModified() throws Exception {
            GenerationDirective directive = joinDirective(joinGraph(null, "Join", null));

            List<Map<String, String>> keys = directive.listParameter(GenerationDirective.JOIN_KEYS);
            assertThatThrownBy(() -> keys.add(Map.of("left", "x", "right", "y")))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> keys.get(0).put("left", "Other"))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> directive.parameters().put(GenerationDirective.PLUGIN, "x"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void unknownToolCarriesPluginOnly() throws Exception {
            WorkflowGraph graph = WorkflowGraph.builder("Plugin")
                    .addNode(fileInput(1, "a.csv"))
                    .addNode(WorkflowNode.builder(2, NodeKind.OTHER)
                            .plugin("AlteryxBasePluginsGui.Sample.Sample")
                            .config(new ToolConfig.Other("<Configuration/>"))
                            .build())
                    .addConnection(edge(1, 2))
                    .build();

            GenerationDirective directive = analyzer.analyze(graph).directiveFor(2).orElseThrow();

            assertEquals(Map.of(GenerationDirective.PLUGIN, "AlteryxBasePluginsGui.Sample.Sample"),
                    directive.parameters());
        }

        @Test
        void containerConfigurationHasNoDirective() throws Exception {
            WorkflowNode odd = WorkflowNode.builder(1, NodeKind.OTHER)
                    .config(new ToolConfig.Container("Group", false))
                    .build();
            WorkflowGraph graph = WorkflowGraph.builder("Odd").addNode(odd).build();

            assertThatThrownBy(() -> new DirectiveBuilder().parameters(graph, odd))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Container");
        }

        @Test
        void summarizeDirectiveListsGroupingAndAggregations() throws Exception {
            WorkflowGraph graph = WorkflowGraph.builder("Totals")
                    .addNode(fileInput(1, "sales.csv"))
                    .addNode(summarize(2, List.of("[Region]"), new ToolConfig.Aggregation("[Amount]", "Sum", "Total")))
                    .addConnection(edge(1, 2))
                    .build();

            GenerationDirective directive = analyzer.analyze(graph).directiveFor(2).orElseThrow();

            assertEquals(List.of("Region"), directive.parameter(GenerationDirective.GROUP_BY));
            assertEquals(List.of(Map.of("field", "Amount", "operation", "Sum", "outputName", "Total")),
                    directive.parameter(GenerationDirective.AGGREGATIONS));
            assertEquals("fct_totals_summarize", directive.modelName());
        }

        @Test
        void selectAndSortDirectives() throws Exception {
            WorkflowGraph graph = WorkflowGraph.builder("Shape")
                    .addNode(fileInput(1, "a.csv"))
                    .addNode(WorkflowNode.builder(2, NodeKind.SELECT)
                            .config(new ToolConfig.Select(List.of(
                                    new ToolConfig.SelectField("Name", true, "CustomerName", null),
                                    new ToolConfig.SelectField("Id", true, null, null),
                                    new ToolConfig.SelectField("Notes", false, null, null)), true))
                            .build())
                    .addNode(WorkflowNode.builder(3, NodeKind.SORT)
                            .config(new ToolConfig.Sort(List.of(new ToolConfig.SortField("Name", false))))
                            .build())
                    .addConnection(edge(1, 2))
                    .addConnection(edge(2, 3))
                    .build();

            AnalysisResult result = analyzer.analyze(graph);

            GenerationDirective select = result.directiveFor(2).orElseThrow();
            assertEquals(List.of(Map.of("field", "Name", "alias", "CustomerName"), Map.of("field", "Id", "alias", "Id")),
                    select.parameter(GenerationDirective.COLUMNS));
            assertEquals(List.of("Notes"), select.parameter(GenerationDirective.DROPPED));
            assertEquals(List.of(Map.of("field", "Name", "direction", "DESC")),
                    result.directiveFor(3).orElseThrow().parameter(GenerationDirective.ORDER_BY));
        }

        @Test
        void repeatedModelNamesAreMadeUnique() throws Exception {
            WorkflowGraph graph = WorkflowGraph.builder("Twice")
                    .addNode(fileInput(1, "a.csv"))
                    .addNode(filter(2, "[a] > 1"))
                    .addNode(filter(3, "[a] < 9"))
                    .addNode(fileOutput(4, "b.csv"))
                    .addConnection(edge(1, 2))
                    .addConnection(edge(2, 3))
                    .addConnection(edge(3, 4))
                    .build();

            AnalysisResult result = analyzer.analyze(graph);

            assertEquals("int_twice_filter", result.directiveFor(2).orElseThrow().modelName());
            assertEquals("int_twice_filter_3", result.directiveFor(3).orElseThrow().modelName());
        }

        private WorkflowGraph joinGraph(String joinType, String firstAnchor, String secondAnchor) throws Exception {
            WorkflowGraph.Builder builder = WorkflowGraph.builder("Joined")
                    .addNode(tableInput(1, "odbc:DSN=Sales", "Orders"))
                    .addNode(tableInput(2, "odbc:DSN=Sales", "Customers"))
                    .addNode(join(3, joinType, new ToolConfig.JoinKey("[CustomerID]", "[ID]")))
                    .addNode(fileOutput(4, "first.csv"))
                    .addConnection(new Connection(1, "Output", 3, "Left"))
                    .addConnection(new Connection(2, "Output", 3, "Right"))
                    .addConnection(edge(3, firstAnchor, 4));
            if (secondAnchor != null) {
                builder.addNode(fileOutput(5, "second.csv")).addConnection(edge(3, secondAnchor, 5));
            }
            return builder.build();
        }

        private GenerationDirective joinDirective(WorkflowGraph graph) throws Exception {
            return analyzer.analyze(graph).directiveFor(3).orElseThrow();
        }
    }

    @Nested
    @DisplayName("Inventories")
    class Inventories {

        @Test
        void sourcesAndTargetsExcludeMacroBoundaries() throws Exception {
            WorkflowGraph graph = WorkflowGraph.builder("Macro Body")
                    .addNode(WorkflowNode.builder(1, NodeKind.INPUT)
                            .config(new ToolConfig.Input(null, null, null, null, "Input"))
                            .build())
                    .addNode(tableInput(2, "odbc:DSN=Ref", "Rates"))
                    .addNode(join(3, null, new ToolConfig.JoinKey("Code", "Code")))
                    .addNode(WorkflowNode.builder(4, NodeKind.OUTPUT)
                            .config(new ToolConfig.Output(null, null, null, "Output"))
                            .build())
                    .addNode(fileOutput(5, "C:\\audit\\rates_used.csv"))
                    .addConnection(edge(1, 3))
                    .addConnection(edge(2, 3))
                    .addConnection(edge(3, "Join", 4))
                    .addConnection(edge(3, "Join", 5))
                    .build();

            AnalysisResult result = analyzer.analyze(graph);

            assertThat(result.getSources()).extracting(DataEndpoint::nodeId).containsExactly(2);
            assertEquals(DataEndpoint.Type.DATABASE, result.getSources().get(0).type());
            assertThat(result.getTargets()).extracting(DataEndpoint::nodeId).containsExactly(5);
            assertEquals("rates_used", result.getTargets().get(0).name());
            assertEquals(DataEndpoint.Type.FILE, result.getTargets().get(0).type());
        }
    }
}
