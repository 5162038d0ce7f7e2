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

import dev.mars.flowlift.core.Connection;
import dev.mars.flowlift.core.MacroReference;
import dev.mars.flowlift.core.ToolConfig;
import dev.mars.flowlift.core.WorkflowGraph;
import dev.mars.flowlift.core.WorkflowNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dev.mars.flowlift.analysis.GenerationDirective.*;

/**
 * Derives the kind-specific parameters of a {@link GenerationDirective} from a
 * node's typed configuration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-13
 * @version 1.0
 */
public class DirectiveBuilder {

    public GenerationDirective build(WorkflowGraph graph, WorkflowNode node, MedallionLayer layer, String modelName,
                                     List<Integer> upstreamIds) {
        return new GenerationDirective(node.getId(), node.getKind(), layer, modelName, layer.getMaterialization(),
                upstreamIds, parameters(graph, node));
    }

    Map<String, Object> parameters(WorkflowGraph graph, WorkflowNode node) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        ToolConfig config = node.getConfig();

        if (config instanceof ToolConfig.Filter) {
            String expression = ((ToolConfig.Filter) config).expression();
            putIfPresent(parameters, PREDICATE, FieldReferences.normalizeExpression(expression));
            parameters.put(FIELDS, Collections.unmodifiableList(FieldReferences.referencedFields(expression)));
        } else if (config instanceof ToolConfig.Formula) {
            List<Map<String, String>> assignments = new ArrayList<>();
            for (ToolConfig.FormulaField field : ((ToolConfig.Formula) config).fields()) {
                Map<String, String> assignment = new LinkedHashMap<>();
                assignment.put("field", FieldReferences.normalizeField(field.field()));
                assignment.put("expression", FieldReferences.normalizeExpression(field.expression()));
                putIfPresent(assignment, "type", field.type());
                assignments.add(Collections.unmodifiableMap(assignment));
            }
            parameters.put(ASSIGNMENTS, Collections.unmodifiableList(assignments));
        } else if (config instanceof ToolConfig.Join) {
            ToolConfig.Join join = (ToolConfig.Join) config;
            parameters.put(JOIN_VARIANT, joinVariant(graph, node, join).name());
            List<Map<String, String>> keys = new ArrayList<>();
            for (ToolConfig.JoinKey key : join.keys()) {
                Map<String, String> pair = new LinkedHashMap<>();
                pair.put("left", FieldReferences.normalizeField(key.left()));
                pair.put("right", FieldReferences.normalizeField(key.right()));
                keys.add(Collections.unmodifiableMap(pair));
            }
            parameters.put(JOIN_KEYS, Collections.unmodifiableList(keys));
            parameters.put(BY_POSITION, join.byPosition());
        } else if (config instanceof ToolConfig.Summarize) {
            ToolConfig.Summarize summarize = (ToolConfig.Summarize) config;
            List<String> groupBy = new ArrayList<>();
            summarize.groupBy().forEach(field -> groupBy.add(FieldReferences.normalizeField(field)));
            parameters.put(GROUP_BY, Collections.unmodifiableList(groupBy));
            List<Map<String, String>> aggregations = new ArrayList<>();
            for (ToolConfig.Aggregation aggregation : summarize.aggregations()) {
                Map<String, String> entry = new LinkedHashMap<>();
                entry.put("field", FieldReferences.normalizeField(aggregation.field()));
                entry.put("operation", aggregation.operation());
                entry.put("outputName", aggregation.outputName());
                aggregations.add(Collections.unmodifiableMap(entry));
            }
            parameters.put(AGGREGATIONS, Collections.unmodifiableList(aggregations));
        } else if (config instanceof ToolConfig.Select) {
            ToolConfig.Select select = (ToolConfig.Select) config;
            List<Map<String, String>> columns = new ArrayList<>();
            List<String> dropped = new ArrayList<>();
            for (ToolConfig.SelectField field : select.fields()) {
                String name = FieldReferences.normalizeField(field.field());
                if (field.selected()) {
                    Map<String, String> column = new LinkedHashMap<>();
                    column.put("field", name);
                    column.put("alias", field.rename() != null ? field.rename() : name);
                    columns.add(Collections.unmodifiableMap(column));
                } else {
                    dropped.add(name);
                }
            }
            parameters.put(COLUMNS, Collections.unmodifiableList(columns));
            parameters.put(DROPPED, Collections.unmodifiableList(dropped));
            parameters.put(INCLUDE_UNKNOWN, select.includeUnknownFields());
        } else if (config instanceof ToolConfig.Sort) {
            List<Map<String, String>> orderBy = new ArrayList<>();
            for (ToolConfig.SortField field : ((ToolConfig.Sort) config).fields()) {
                Map<String, String> entry = new LinkedHashMap<>();
                entry.put("field", FieldReferences.normalizeField(field.field()));
                entry.put("direction", field.ascending() ? "ASC" : "DESC");
                orderBy.add(Collections.unmodifiableMap(entry));
            }
            parameters.put(ORDER_BY, Collections.unmodifiableList(orderBy));
        } else if (config instanceof ToolConfig.Union) {
            putIfPresent(parameters, UNION_MODE, ((ToolConfig.Union) config).mode());
            parameters.put(INPUT_COUNT, graph.incomingConnections(node.getId()).size());
        } else if (config instanceof ToolConfig.Input || config instanceof ToolConfig.Output) {
            DataEndpoint endpoint = DataEndpoint.of(node);
            if (endpoint != null) {
                parameters.put(ENDPOINT, endpointParameters(endpoint));
            }
        } else if (config instanceof ToolConfig.Macro) {
            MacroReference reference = ((ToolConfig.Macro) config).reference();
            parameters.put(MACRO_REFERENCE, reference.getReference());
            parameters.put(MACRO_STATUS, reference.getStatus().name());
            if (reference.getMissingReason() != null) {
                parameters.put(MISSING_REASON, reference.getMissingReason().name());
            }
        } else if (config instanceof ToolConfig.Other) {
            putIfPresent(parameters, PLUGIN, node.getPlugin());
        } else {
            throw new IllegalStateException("No directive parameters for " + config.getClass().getSimpleName()
                    + " configuration of node " + node.getId());
        }
        return parameters;
    }

    static JoinVariant joinVariant(WorkflowGraph graph, WorkflowNode node, ToolConfig.Join join) {
        JoinVariant configured = JoinVariant.fromConfigured(join.joinType());
        if (configured != null) {
            return configured;
        }
        Set<String> anchors = new LinkedHashSet<>();
        for (Connection connection : graph.outgoingConnections(node.getId())) {
            anchors.add(connection.getOriginAnchor());
        }
        return JoinVariant.fromAnchors(anchors);
    }

    private static Map<String, Object> endpointParameters(DataEndpoint endpoint) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", endpoint.name());
        values.put("type", endpoint.type().name());
        putIfPresent(values, "path", endpoint.path());
        putIfPresent(values, "connection", endpoint.connection());
        putIfPresent(values, "table", endpoint.table());
        putIfPresent(values, "query", endpoint.query());
        return Collections.unmodifiableMap(values);
    }

    private static <V> void putIfPresent(Map<String, V> map, String key, V value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
