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

package dev.mars.flowlift.core;

import dev.mars.flowlift.core.exceptions.StructuralException;

import java.util.*;

/**
 * Immutable directed graph of workflow tools.
 *
 * <p>Nodes are stored in a map sorted by id, so identifiers may be sparse and
 * every query that returns several nodes returns them in ascending id order.
 * Connections keep their document order. Incoming and outgoing connection
 * indices are computed once at construction.</p>
 *
 * <p>There is no mutation API. Derived graphs (for example after macro
 * expansion) are produced through {@link #toBuilder()}; {@link Builder#build()}
 * re-checks every structural invariant.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public final class WorkflowGraph {

    private final WorkflowMetadata metadata;
    private final NavigableMap<Integer, WorkflowNode> nodes;
    private final List<Connection> connections;
    private final Map<Integer, List<Connection>> incoming;
    private final Map<Integer, List<Connection>> outgoing;
    private final ValidationResult diagnostics;

    private WorkflowGraph(WorkflowMetadata metadata, NavigableMap<Integer, WorkflowNode> nodes,
                          List<Connection> connections, ValidationResult diagnostics) {
        this.metadata = metadata;
        this.nodes = Collections.unmodifiableNavigableMap(new TreeMap<>(nodes));
        this.connections = List.copyOf(connections);
        this.diagnostics = diagnostics.copy();

        Map<Integer, List<Connection>> in = new HashMap<>();
        Map<Integer, List<Connection>> out = new HashMap<>();
        for (Connection connection : this.connections) {
            out.computeIfAbsent(connection.getOriginId(), k -> new ArrayList<>()).add(connection);
            in.computeIfAbsent(connection.getDestinationId(), k -> new ArrayList<>()).add(connection);
        }
        this.incoming = freeze(in);
        this.outgoing = freeze(out);
    }

    private static Map<Integer, List<Connection>> freeze(Map<Integer, List<Connection>> index) {
        Map<Integer, List<Connection>> frozen = new HashMap<>();
        for (Map.Entry<Integer, List<Connection>> entry : index.entrySet()) {
            frozen.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(frozen);
    }

    public WorkflowMetadata getMetadata() {
        return metadata;
    }

    public String getName() {
        return metadata.getName();
    }

    /**
     * Ingest warnings recorded for this graph. Returns a copy.
     */
    public ValidationResult getDiagnostics() {
        return diagnostics.copy();
    }

    public Optional<WorkflowNode> findNode(int nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /**
     * @throws NoSuchElementException if no node has this id
     */
    public WorkflowNode getNode(int nodeId) {
        WorkflowNode node = nodes.get(nodeId);
        if (node == null) {
            throw new NoSuchElementException("No node with id " + nodeId + " in '" + getName() + "'");
        }
        return node;
    }

    /**
     * All nodes in ascending id order.
     */
    public Collection<WorkflowNode> getNodes() {
        return nodes.values();
    }

    public List<Connection> getConnections() {
        return connections;
    }

    public List<Connection> incomingConnections(int nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }

    public List<Connection> outgoingConnections(int nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    /**
     * Distinct nodes with a connection terminating at {@code nodeId}, ascending by
     * id. Parallel connections contribute the origin once. Unknown ids yield an
     * empty list.
     */
    public List<WorkflowNode> upstreamOf(int nodeId) {
        SortedSet<Integer> ids = new TreeSet<>();
        for (Connection connection : incomingConnections(nodeId)) {
            ids.add(connection.getOriginId());
        }
        return toNodes(ids);
    }

    /**
     * Distinct nodes reached by a connection leaving {@code nodeId}, ascending by id.
     */
    public List<WorkflowNode> downstreamOf(int nodeId) {
        SortedSet<Integer> ids = new TreeSet<>();
        for (Connection connection : outgoingConnections(nodeId)) {
            ids.add(connection.getDestinationId());
        }
        return toNodes(ids);
    }

    /**
     * Nodes of the given kind in ascending id order.
     */
    public Set<WorkflowNode> sourcesOf(NodeKind kind) {
        Set<WorkflowNode> result = new LinkedHashSet<>();
        for (WorkflowNode node : nodes.values()) {
            if (node.getKind() == kind) {
                result.add(node);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Children of a container in the order the container declares them.
     */
    public List<WorkflowNode> childrenOf(int containerId) {
        WorkflowNode container = nodes.get(containerId);
        if (container == null) {
            return List.of();
        }
        List<WorkflowNode> children = new ArrayList<>();
        for (Integer childId : container.getChildIds()) {
            WorkflowNode child = nodes.get(childId);
            if (child != null) {
                children.add(child);
            }
        }
        return children;
    }

    public List<WorkflowNode> getMacroReferenceNodes() {
        List<WorkflowNode> result = new ArrayList<>();
        for (WorkflowNode node : nodes.values()) {
            if (node.getMacroReference() != null) {
                result.add(node);
            }
        }
        return result;
    }

    public List<WorkflowNode> getUnresolvedMacroNodes() {
        List<WorkflowNode> result = new ArrayList<>();
        for (WorkflowNode node : getMacroReferenceNodes()) {
            if (node.getMacroReference().isUnresolved()) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * Highest node id, or 0 for an empty graph.
     */
    public int maxNodeId() {
        return nodes.isEmpty() ? 0 : nodes.lastKey();
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    private List<WorkflowNode> toNodes(Collection<Integer> ids) {
        List<WorkflowNode> result = new ArrayList<>(ids.size());
        for (Integer id : ids) {
            WorkflowNode node = nodes.get(id);
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }

    public Builder toBuilder() {
        Builder builder = new Builder(metadata);
        builder.nodes.putAll(nodes);
        builder.connections.addAll(connections);
        builder.diagnostics.merge(diagnostics);
        return builder;
    }

    public static Builder builder(WorkflowMetadata metadata) {
        return new Builder(metadata);
    }

    public static Builder builder(String name) {
        return new Builder(WorkflowMetadata.named(name));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowGraph that = (WorkflowGraph) o;
        return metadata.equals(that.metadata) &&
               nodes.equals(that.nodes) &&
               connections.equals(that.connections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadata, nodes, connections);
    }

    @Override
    public String toString() {
        return "WorkflowGraph{" +
               "name='" + getName() + '\'' +
               ", nodes=" + nodes.size() +
               ", connections=" + connections.size() +
               '}';
    }

    /**
     * Accumulates nodes and connections and validates them on {@link #build()}.
     */
    public static class Builder {
        private final WorkflowMetadata metadata;
        private final NavigableMap<Integer, WorkflowNode> nodes = new TreeMap<>();
        private final List<Connection> connections = new ArrayList<>();
        private final ValidationResult diagnostics = new ValidationResult();
        private final List<String> duplicateIds = new ArrayList<>();

        private Builder(WorkflowMetadata metadata) {
            this.metadata = Objects.requireNonNull(metadata, "Metadata cannot be null");
        }

        public Builder addNode(WorkflowNode node) {
            Objects.requireNonNull(node, "Node cannot be null");
            if (nodes.putIfAbsent(node.getId(), node) != null) {
                duplicateIds.add("Duplicate node id " + node.getId());
            }
            return this;
        }

        /**
         * Replaces the node with the same id, adding it if absent.
         */
        public Builder putNode(WorkflowNode node) {
            Objects.requireNonNull(node, "Node cannot be null");
            nodes.put(node.getId(), node);
            return this;
        }

        public Builder addConnection(Connection connection) {
            connections.add(Objects.requireNonNull(connection, "Connection cannot be null"));
            return this;
        }

        public Builder connections(List<Connection> newConnections) {
            connections.clear();
            connections.addAll(newConnections);
            return this;
        }

        public Builder diagnostics(ValidationResult result) {
            diagnostics.merge(result);
            return this;
        }

        public WorkflowNode node(int nodeId) {
            return nodes.get(nodeId);
        }

        /**
         * Validates structural invariants and creates the graph.
         *
         * @throws StructuralException listing every violation found
         */
        public WorkflowGraph build() throws StructuralException {
            List<String> violations = new ArrayList<>(duplicateIds);
            checkConnections(violations);
            checkContainers(violations);
            if (!violations.isEmpty()) {
                throw new StructuralException(metadata.getName(), violations);
            }
            return new WorkflowGraph(metadata, nodes, connections, diagnostics);
        }

        private void checkConnections(List<String> violations) {
            for (Connection connection : connections) {
                if (!nodes.containsKey(connection.getOriginId())) {
                    violations.add("Connection " + connection + " has unknown origin " + connection.getOriginId());
                }
                if (!nodes.containsKey(connection.getDestinationId())) {
                    violations.add("Connection " + connection + " has unknown destination "
                            + connection.getDestinationId());
                }
                if (connection.isSelfLoop()) {
                    violations.add("Connection " + connection + " is a self-loop on node " + connection.getOriginId());
                }
            }
        }

        private void checkContainers(List<String> violations) {
            for (WorkflowNode node : nodes.values()) {
                Integer containerId = node.getContainerId();
                if (containerId != null) {
                    WorkflowNode container = nodes.get(containerId);
                    if (container == null) {
                        violations.add("Node " + node.getId() + " references unknown container " + containerId);
                    } else if (!container.isContainer()) {
                        violations.add("Node " + node.getId() + " references node " + containerId
                                + " which is not a container");
                    } else if (!container.getChildIds().contains(node.getId())) {
                        violations.add("Node " + node.getId() + " is not listed as a child of container "
                                + containerId);
                    }
                }
                if (!node.getChildIds().isEmpty() && !node.isContainer()) {
                    violations.add("Node " + node.getId() + " lists children but is not a container");
                }
                for (Integer childId : node.getChildIds()) {
                    WorkflowNode child = nodes.get(childId);
                    if (child == null) {
                        violations.add("Container " + node.getId() + " lists unknown child " + childId);
                    } else if (!Objects.equals(child.getContainerId(), node.getId())) {
                        violations.add("Container " + node.getId() + " lists child " + childId
                                + " whose container is " + child.getContainerId());
                    }
                }
            }
            checkContainerCycles(violations);
        }

        private void checkContainerCycles(List<String> violations) {
            Set<Integer> reported = new HashSet<>();
            for (WorkflowNode node : nodes.values()) {
                Set<Integer> chain = new LinkedHashSet<>();
                WorkflowNode current = node;
                while (current != null && current.getContainerId() != null) {
                    if (!chain.add(current.getId())) {
                        if (reported.addAll(chain)) {
                            violations.add("Container membership cycle through nodes " + chain);
                        }
                        break;
                    }
                    current = nodes.get(current.getContainerId());
                }
            }
        }
    }
}
