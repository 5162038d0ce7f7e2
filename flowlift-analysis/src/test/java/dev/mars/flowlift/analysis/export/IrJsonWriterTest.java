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

package dev.mars.flowlift.analysis.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.flowlift.analysis.AnalysisResult;
import dev.mars.flowlift.analysis.TransformationAnalyzer;
import dev.mars.flowlift.core.WorkflowGraph;
import dev.mars.flowlift.workflow.YxmdWorkflowParser;
import dev.mars.flowlift.workflow.macro.MacroResolver;
import dev.mars.flowlift.workflow.macro.ResolutionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parses a workflow with a macro, resolves, analyzes and exports it.
 */
class IrJsonWriterTest {

    private static final String INPUT = "AlteryxBasePluginsGui.DbFileInput.DbFileInput";
    private static final String OUTPUT = "AlteryxBasePluginsGui.DbFileOutput.DbFileOutput";
    private static final String FILTER = "AlteryxBasePluginsGui.Filter.Filter";
    private static final String MACRO_INPUT = "AlteryxBasePluginsGui.MacroInput.MacroInput";
    private static final String MACRO_OUTPUT = "AlteryxBasePluginsGui.MacroOutput.MacroOutput";

    @TempDir
    Path dir;

    private WorkflowGraph graph;
    private AnalysisResult result;

    @BeforeEach
    void setUp() throws Exception {
        write("macros/Positive.yxmc", document("Positive",
                node(1, MACRO_INPUT, "<Name>Input</Name>")
                        + node(2, FILTER, "<Mode>Custom</Mode><Expression>[Amount] &gt; 0</Expression>")
                        + node(3, MACRO_OUTPUT, "<Name>Output</Name>"),
                connection(1, 2) + connection(2, 3)));
        Path host = write("payments.yxmd", document("Payments",
                node(1, INPUT, "<File>C:\\data\\payments.csv</File>")
                        + macro(2, "Positive.yxmc")
                        + node(3, OUTPUT, "<File>C:\\out\\positive_payments.csv</File>"),
                connection(1, 2) + connection(2, 3)));

        YxmdWorkflowParser parser = new YxmdWorkflowParser();
        MacroResolver resolver = new MacroResolver(parser, ResolutionConfig.builder().metricsEnabled(false).build());
        graph = resolver.resolve(parser.parse(host)).graph();
        result = new TransformationAnalyzer().analyze(graph);
    }

    @Test
    void analysisRunsThroughSplicedMacro() {
        // host 1,2,3 then macro nodes 4,5,6; node 2 is the resolved marker
        assertEquals(List.of(1, 4, 5, 6, 3), result.getOrder());
        assertNull(result.layerOf(2));
        assertEquals(1, result.getSources().size());
        assertEquals(1, result.getTargets().size());
    }

    @Test
    void writesGraphAndAnalysis() throws Exception {
        JsonNode root = new ObjectMapper().readTree(new IrJsonWriter().toJson(graph, result));

        assertEquals(IrJsonWriter.FORMAT_VERSION, root.get("formatVersion").asInt());
        assertEquals("Payments", root.path("workflow").path("name").asText());
        assertEquals(6, root.get("nodes").size());
        assertEquals(4, root.get("connections").size());

        JsonNode marker = root.get("nodes").get(1);
        assertEquals(2, marker.get("id").asInt());
        assertEquals("RESOLVED", marker.path("macro").path("status").asText());
        assertEquals("MACROS_SUBDIRECTORY", marker.path("macro").path("location").asText());
        assertEquals(2, root.get("nodes").get(4).path("origin").path("macroNodeId").asInt());

        JsonNode analysis = root.get("analysis");
        assertEquals(5, analysis.get("steps").size());
        assertEquals("BRONZE", analysis.path("layers").path("1").asText());
        assertEquals("GOLD", analysis.path("layers").path("3").asText());
        JsonNode filter = analysis.get("directives").get(2);
        assertEquals(5, filter.get("nodeId").asInt());
        assertEquals("Amount > 0", filter.path("parameters").path("predicate").asText());
        assertEquals("positive_payments", analysis.get("targets").get(0).get("name").asText());
    }

    @Test
    void writesToFile() throws Exception {
        Path file = dir.resolve("out/payments.json");

        new IrJsonWriter().write(graph, result, file);

        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"formatVersion\""));
        assertTrue(json.contains("stg_payments_payments"));
    }

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private static String document(String name, String nodes, String connections) {
        return "<?xml version=\"1.0\"?>\n<AlteryxDocument yxmdVer=\"2023.1\">\n"
                + "<Nodes>" + nodes + "</Nodes>\n"
                + "<Connections>" + connections + "</Connections>\n"
                + "<Properties><MetaInfo><Name>" + name + "</Name></MetaInfo></Properties>\n"
                + "</AlteryxDocument>\n";
    }

    private static String node(int id, String plugin, String configuration) {
        return "<Node ToolID=\"" + id + "\"><GuiSettings Plugin=\"" + plugin + "\"><Position x=\"0\" y=\"0\"/></GuiSettings>"
                + "<Properties><Configuration>" + configuration + "</Configuration></Properties></Node>\n";
    }

    private static String macro(int id, String reference) {
        return "<Node ToolID=\"" + id + "\"><GuiSettings><Position x=\"0\" y=\"0\"/></GuiSettings>"
                + "<Properties><Configuration/></Properties><EngineSettings Macro=\"" + reference + "\"/></Node>\n";
    }

    private static String connection(int origin, int destination) {
        return "<Connection><Origin ToolID=\"" + origin + "\" Connection=\"Output\"/>"
                + "<Destination ToolID=\"" + destination + "\" Connection=\"Input\"/></Connection>\n";
    }
}
