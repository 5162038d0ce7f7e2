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

package dev.mars.flowlift.workflow.macro;

import dev.mars.flowlift.core.Connection;
import dev.mars.flowlift.core.MacroReference;
import dev.mars.flowlift.core.NodeOrigin;
import dev.mars.flowlift.core.ToolConfig;
import dev.mars.flowlift.core.ValidationResult;
import dev.mars.flowlift.core.WorkflowGraph;
import dev.mars.flowlift.core.WorkflowNode;
import dev.mars.flowlift.core.exceptions.StructuralException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Inlines a resolved macro sub-graph into its host graph.
 *
 * <p>Sub-graph nodes receive fresh ids above the host's highest id, assigned in
 * ascending order of their original ids, and remember where they came from in a
 * {@link NodeOrigin}. Host edges into the macro node are rerouted to the Macro
 * Input tool with the matching anchor name; host edges out of it leave from the
 * matching Macro Output tool. A macro with a single boundary tool on a side
 * takes every anchor on that side; otherwise an unmatched anchor falls back to
 * the boundary tool with the lowest id. The macro node itself stays in the graph,
 * without edges, as a RESOLVED marker carrying the sub-graph.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-10
 * @version 1.0
 */
public final class MacroSplicer {

    private static final Logger logger = LoggerFactory.getLogger(MacroSplicer.class);

    private MacroSplicer() {
    }

    public static WorkflowGraph splice(WorkflowGraph host, int macroNodeId, MacroReference resolved)
            throws StructuralException {
        if (resolved == null || !resolved.isResolved()) {
            throw new IllegalArgumentException("Only a resolved macro reference can be spliced: " + resolved);
        }
        WorkflowNode macroNode = host.getNode(macroNodeId);
        WorkflowGraph sub = resolved.getSubGraph();

        Map<Integer, Integer> idMap = new HashMap<>();
        int nextId = host.maxNodeId();
        try {
            for (WorkflowNode node : sub.getNodes()) {
                nextId = Math.addExact(nextId, 1);
                idMap.put(node.getId(), nextId);
            }
        } catch (ArithmeticException e) {
            throw new StructuralException(host.getName(), "Cannot splice macro '" + resolved.getReference()
                    + "' into node " + macroNodeId + ": " + sub.size() + " node ids above "
                    + host.maxNodeId() + " exceed the id range");
        }

        WorkflowGraph.Builder builder = host.toBuilder();
        builder.putNode(macroNode.toBuilder().config(new ToolConfig.Macro(resolved)).build());

        Integer hostContainer = macroNode.getContainerId();
        List<Integer> adopted = new ArrayList<>();
        for (WorkflowNode node : sub.getNodes()) {
            int newId = idMap.get(node.getId());
            Integer containerId;
            if (node.getContainerId() != null) {
                containerId = idMap.get(node.getContainerId());
            } else {
                containerId = hostContainer;
                if (hostContainer != null) {
                    adopted.add(newId);
                }
            }
            List<Integer> children = new ArrayList<>();
            for (Integer childId : node.getChildIds()) {
                children.add(idMap.get(childId));
            }
            builder.addNode(node.toBuilder()
                    .id(newId)
                    .containerId(containerId)
                    .childIds(children)
                    .origin(new NodeOrigin(macroNodeId, node.getId(), resolved.getReference()))
                    .build());
        }
        if (!adopted.isEmpty()) {
            WorkflowNode.Builder container = builder.node(hostContainer).toBuilder();
            adopted.forEach(container::addChild);
            builder.putNode(container.build());
        }

        List<WorkflowNode> inputs = new ArrayList<>();
        List<WorkflowNode> outputs = new ArrayList<>();
        for (WorkflowNode node : sub.getNodes()) {
            if (node.isMacroInput()) {
                inputs.add(node);
            } else if (node.isMacroOutput()) {
                outputs.add(node);
            }
        }

        ValidationResult diagnostics = new ValidationResult();
        List<Connection> connections = new ArrayList<>();
        for (Connection connection : host.getConnections()) {
            if (connection.getDestinationId() == macroNodeId) {
                WorkflowNode boundary = boundaryFor(inputs, connection.getDestinationAnchor());
                if (boundary == null) {
                    diagnostics.addWarning(macroNodeId, "Dropped edge " + connection
                            + ": macro '" + resolved.getReference() + "' has no input");
                    continue;
                }
                connections.add(connection.withDestination(idMap.get(boundary.getId()), Connection.DEFAULT_INPUT_ANCHOR));
            } else if (connection.getOriginId() == macroNodeId) {
                WorkflowNode boundary = boundaryFor(outputs, connection.getOriginAnchor());
                if (boundary == null) {
                    diagnostics.addWarning(macroNodeId, "Dropped edge " + connection
                            + ": macro '" + resolved.getReference() + "' has no output");
                    continue;
                }
                connections.add(connection.withOrigin(idMap.get(boundary.getId()), Connection.DEFAULT_OUTPUT_ANCHOR));
            } else {
                connections.add(connection);
            }
        }
        for (Connection connection : sub.getConnections()) {
            connections.add(new Connection(idMap.get(connection.getOriginId()), connection.getOriginAnchor(),
                    idMap.get(connection.getDestinationId()), connection.getDestinationAnchor(),
                    connection.isWireless()));
        }
        builder.connections(connections).diagnostics(diagnostics);

        logger.debug("Spliced macro '{}' into node {} of '{}': {} nodes above id {}",
                resolved.getReference(), macroNodeId, host.getName(), sub.size(), host.maxNodeId());
        return builder.build();
    }

    private static WorkflowNode boundaryFor(List<WorkflowNode> boundaries, String anchor) {
        if (boundaries.isEmpty()) {
            return null;
        }
        if (boundaries.size() == 1) {
            return boundaries.get(0);
        }
        for (WorkflowNode boundary : boundaries) {
            if (boundary.getAnchorName().equalsIgnoreCase(anchor)) {
                return boundary;
            }
        }
        return boundaries.get(0);
    }
}
