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
import dev.mars.flowlift.core.WorkflowGraph;
import dev.mars.flowlift.core.WorkflowNode;
import dev.mars.flowlift.core.exceptions.CyclicDependencyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Queue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Dependencies between the flow nodes of a workflow graph. Provides
 * topological ordering and cycle detection.
 *
 * <p>Flow nodes are all nodes except containers and resolved macro markers,
 * whose spliced contents take their place. Unresolved and missing macro nodes
 * remain flow nodes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class FlowDependencyGraph {

    private final String workflowName;
    private final Map<Integer, WorkflowNode> nodes = new TreeMap<>();
    private final Map<Integer, Set<Integer>> dependencies = new HashMap<>();
    private final Map<Integer, Set<Integer>> dependents = new HashMap<>();

    public FlowDependencyGraph(WorkflowGraph graph) {
        this.workflowName = graph.getName();
        for (WorkflowNode node : graph.getNodes()) {
            if (isFlowNode(node)) {
                nodes.put(node.getId(), node);
                dependencies.put(node.getId(), new TreeSet<>());
                dependents.put(node.getId(), new TreeSet<>());
            }
        }
        for (Connection connection : graph.getConnections()) {
            int origin = connection.getOriginId();
            int destination = connection.getDestinationId();
            if (nodes.containsKey(origin) && nodes.containsKey(destination)) {
                dependencies.get(destination).add(origin);
                dependents.get(origin).add(destination);
            }
        }
    }

    public static boolean isFlowNode(WorkflowNode node) {
        if (!node.getKind().isFlowKind()) {
            return false;
        }
        MacroReference reference = node.getMacroReference();
        return reference == null || !reference.isResolved();
    }

    /**
     * Upstream flow node ids, ascending.
     */
    public Set<Integer> getDependencies(int nodeId) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(nodeId, Set.of()));
    }

    /**
     * Downstream flow node ids, ascending.
     */
    public Set<Integer> getDependents(int nodeId) {
        return Collections.unmodifiableSet(dependents.getOrDefault(nodeId, Set.of()));
    }

    /**
     * Orders flow nodes so every node follows all of its upstream nodes. Among
     * nodes that are ready at the same time the lowest id goes first.
     *
     * @throws CyclicDependencyException listing the nodes that could not be ordered
     */
    public List<WorkflowNode> topologicalSort() throws CyclicDependencyException {
        Map<Integer, Integer> inDegree = new HashMap<>();
        Queue<Integer> queue = new PriorityQueue<>();
        for (Map.Entry<Integer, Set<Integer>> entry : dependencies.entrySet()) {
            inDegree.put(entry.getKey(), entry.getValue().size());
            if (entry.getValue().isEmpty()) {
                queue.offer(entry.getKey());
            }
        }

        List<WorkflowNode> result = new ArrayList<>();
        while (!queue.isEmpty()) {
            int current = queue.poll();
            result.add(nodes.get(current));
            for (int dependent : dependents.get(current)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(dependent);
                }
            }
        }

        if (result.size() != nodes.size()) {
            List<Integer> unordered = new ArrayList<>();
            for (Map.Entry<Integer, Integer> entry : new TreeMap<>(inDegree).entrySet()) {
                if (entry.getValue() > 0) {
                    unordered.add(entry.getKey());
                }
            }
            throw new CyclicDependencyException(workflowName, unordered);
        }
        return result;
    }

    public boolean hasCycles() {
        try {
            topologicalSort();
            return false;
        } catch (CyclicDependencyException e) {
            return true;
        }
    }

    @Override
    public String toString() {
        return "FlowDependencyGraph{" +
               "workflow='" + workflowName + '\'' +
               ", nodes=" + nodes.keySet() +
               ", dependencies=" + dependencies +
               '}';
    }
}
