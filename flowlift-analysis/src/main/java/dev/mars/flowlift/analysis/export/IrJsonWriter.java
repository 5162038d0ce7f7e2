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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.flowlift.analysis.AnalysisResult;
import dev.mars.flowlift.core.Connection;
import dev.mars.flowlift.core.MacroReference;
import dev.mars.flowlift.core.ValidationResult;
import dev.mars.flowlift.core.WorkflowGraph;
import dev.mars.flowlift.core.WorkflowMetadata;
import dev.mars.flowlift.core.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a workflow graph and its analysis as a JSON intermediate representation
 * for generators that run out of process.
 *
 * <pre>
 * {
 *   "formatVersion": 1,
 *   "workflow": { "name": ..., "description": ..., "sourceVersion": ... },
 *   "nodes": [ ... ],
 *   "connections": [ ... ],
 *   "warnings": [ ... ],
 *   "analysis": { "steps": [...], "layers": {...}, "directives": [...], "sources": [...], "targets": [...] }
 * }
 * </pre>
 *
 * Embedded macro sub-graphs are not repeated; a resolved macro marker carries
 * its reference, status and resolved path only.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-14
 * @version 1.0
 */
public class IrJsonWriter {

    private static final Logger logger = LoggerFactory.getLogger(IrJsonWriter.class);

    public static final int FORMAT_VERSION = 1;

    private final ObjectMapper objectMapper;

    public IrJsonWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(WorkflowGraph graph, AnalysisResult result) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toTree(graph, result));
    }

    public void write(WorkflowGraph graph, AnalysisResult result, Writer writer) throws IOException {
        objectMapper.writeValue(writer, toTree(graph, result));
    }

    public void write(WorkflowGraph graph, AnalysisResult result, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(graph, result, writer);
        }
        logger.info("Wrote intermediate representation of '{}' to {}", graph.getName(), file);
    }

    Map<String, Object> toTree(WorkflowGraph graph, AnalysisResult result) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("formatVersion", FORMAT_VERSION);
        root.put("workflow", workflow(graph.getMetadata()));

        List<Map<String, Object>> nodes = new ArrayList<>();
        for (WorkflowNode node : graph.getNodes()) {
            nodes.add(node(node));
        }
        root.put("nodes", nodes);

        List<Map<String, Object>> connections = new ArrayList<>();
        for (Connection connection : graph.getConnections()) {
            Map<String, Object> edge = new LinkedHashMap<>();
            edge.put("origin", connection.getOriginId());
            edge.put("originAnchor", connection.getOriginAnchor());
            edge.put("destination", connection.getDestinationId());
            edge.put("destinationAnchor", connection.getDestinationAnchor());
            if (connection.isWireless()) {
                edge.put("wireless", true);
            }
            connections.add(edge);
        }
        root.put("connections", connections);

        List<Map<String, Object>> warnings = new ArrayList<>();
        for (ValidationResult.ValidationIssue issue : graph.getDiagnostics().getWarnings()) {
            Map<String, Object> warning = new LinkedHashMap<>();
            putIfPresent(warning, "nodeId", issue.getNodeId());
            putIfPresent(warning, "field", issue.getFieldPath());
            warning.put("message", issue.getMessage());
            warnings.add(warning);
        }
        root.put("warnings", warnings);

        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("steps", result.getSteps());
        Map<String, Object> layers = new LinkedHashMap<>();
        result.getLayers().forEach((nodeId, layer) -> layers.put(String.valueOf(nodeId), layer.name()));
        analysis.put("layers", layers);
        analysis.put("directives", result.getDirectives());
        analysis.put("sources", result.getSources());
        analysis.put("targets", result.getTargets());
        root.put("analysis", analysis);
        return root;
    }

    private static Map<String, Object> workflow(WorkflowMetadata metadata) {
        Map<String, Object> workflow = new LinkedHashMap<>();
        workflow.put("name", metadata.getName());
        putIfPresent(workflow, "description", metadata.getDescription());
        putIfPresent(workflow, "author", metadata.getAuthor());
        putIfPresent(workflow, "sourceVersion", metadata.getSourceVersion());
        if (metadata.getDocumentPath() != null) {
            workflow.put("document", metadata.getDocumentPath().toString());
        }
        return workflow;
    }

    private static Map<String, Object> node(WorkflowNode node) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", node.getId());
        values.put("kind", node.getKind().name());
        values.put("plugin", node.getPlugin());
        values.put("displayName", node.getDisplayName());
        putIfPresent(values, "annotation", node.getAnnotation());
        if (node.getPosition() != null) {
            values.put("x", node.getPosition().x());
            values.put("y", node.getPosition().y());
        }
        putIfPresent(values, "containerId", node.getContainerId());
        if (!node.getChildIds().isEmpty()) {
            values.put("childIds", node.getChildIds());
        }
        if (node.getOrigin() != null) {
            Map<String, Object> origin = new LinkedHashMap<>();
            origin.put("macroNodeId", node.getOrigin().macroNodeId());
            origin.put("originalId", node.getOrigin().originalId());
            origin.put("reference", node.getOrigin().reference());
            values.put("origin", origin);
        }
        MacroReference reference = node.getMacroReference();
        if (reference != null) {
            Map<String, Object> macro = new LinkedHashMap<>();
            macro.put("reference", reference.getReference());
            macro.put("status", reference.getStatus().name());
            if (reference.getMissingReason() != null) {
                macro.put("missingReason", reference.getMissingReason().name());
            }
            if (reference.getResolvedPath() != null) {
                macro.put("resolvedPath", reference.getResolvedPath().toString());
            }
            if (reference.getLocation() != null) {
                macro.put("location", reference.getLocation().name());
            }
            values.put("macro", macro);
        }
        return values;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
