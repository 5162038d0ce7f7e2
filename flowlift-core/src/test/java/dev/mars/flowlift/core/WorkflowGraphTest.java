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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkflowGraph queries and the structural checks performed by its builder.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
class WorkflowGraphTest {

    private WorkflowGraph graph;

    @BeforeEach
    void setUp() throws StructuralException {
        // 1 -> 5 (twice, parallel), 3 -> 5, 5 -> 9, 5 -> 7
        graph = WorkflowGraph.builder("Orders")
                .addNode(node(1, NodeKind.INPUT))
                .addNode(node(3, NodeKind.INPUT))
                .addNode(node(5, NodeKind.JOIN))
                .addNode(node(7, NodeKind.OUTPUT))
                .addNode(node(9, NodeKind.OUTPUT))
                .addConnection(new Connection(1, "Output", 5, "Left"))
                .addConnection(new Connection(1, "Output", 5, "Right"))
                .addConnection(new Connection(3, "Output", 5, "Left"))
                .addConnection(new Connection(5, "Join", 9, "Input"))
                .addConnection(new Connection(5, "Join", 7, "Input"))
                .build();
    }

    private static WorkflowNode node(int id, NodeKind kind) {
        return WorkflowNode.builder(id, kind).build();
    }

    private static List<Integer> ids(java.util.Collection<WorkflowNode> nodes) {
        return nodes.stream().map(WorkflowNode::getId).collect(Collectors.toList());
    }

    @Test
    void testUpstreamIsDistinctAndAscending() {
        assertEquals(List.of(1, 3), ids(graph.upstreamOf(5)));
    }

    @Test
    void testDownstreamIsAscendingRegardlessOfConnectionOrder() {
        assertEquals(List.of(7, 9), ids(graph.downstreamOf(5)));
    }

    @Test
    void testUnknownIdYieldsEmptyNeighbours() {
        assertTrue(graph.upstreamOf(42).isEmpty());
        assertTrue(graph.downstreamOf(42).isEmpty());
        assertTrue(graph.findNode(42).isEmpty());
        assertThrows(NoSuchElementException.class, () -> graph.getNode(42));
    }

    @Test
    void testSourcesOfKind() {
        assertEquals(List.of(1, 3), ids(graph.sourcesOf(NodeKind.INPUT)));
        assertEquals(List.of(7, 9), ids(graph.sourcesOf(NodeKind.OUTPUT)));
        assertTrue(graph.sourcesOf(NodeKind.SORT).isEmpty());
    }

    @Test
    void testSizeAndMaxId() {
        assertEquals(5, graph.size());
        assertEquals(9, graph.maxNodeId());
        assertEquals(2, graph.incomingConnections(9).size() + graph.incomingConnections(7).size());
    }

    @Test
    void testDanglingConnectionIsRejected() {
        WorkflowGraph.Builder builder = graph.toBuilder()
                .addConnection(new Connection(9, "Output", 12, "Input"));

        StructuralException e = assertThrows(StructuralException.class, builder::build);
        assertEquals(1, e.getViolations().size());
        assertTrue(e.getViolations().get(0).contains("unknown destination 12"));
    }

    @Test
    void testSelfLoopIsRejected() {
        WorkflowGraph.Builder builder = graph.toBuilder()
                .addConnection(new Connection(5, "Join", 5, "Left"));

        StructuralException e = assertThrows(StructuralException.class, builder::build);
        assertTrue(e.getMessage().contains("self-loop"));
    }

    @Test
    void testDuplicateNodeIdIsRejected() {
        WorkflowGraph.Builder builder = graph.toBuilder().addNode(node(5, NodeKind.SORT));
        assertThrows(StructuralException.class, builder::build);
    }

    @Test
    void testContainerMembershipIsMirrored() throws StructuralException {
        WorkflowGraph grouped = WorkflowGraph.builder("Grouped")
                .addNode(WorkflowNode.builder(20, NodeKind.CONTAINER)
                        .config(new ToolConfig.Container("Staging", false))
                        .childIds(List.of(21, 22)).build())
                .addNode(WorkflowNode.builder(21, NodeKind.INPUT).containerId(20).build())
                .addNode(WorkflowNode.builder(22, NodeKind.FILTER).containerId(20).build())
                .build();

        assertEquals(List.of(21, 22), ids(grouped.childrenOf(20)));
        assertTrue(grouped.childrenOf(21).isEmpty());
    }

    @Test
    void testContainerReferenceToNonContainerIsRejected() {
        WorkflowGraph.Builder builder = graph.toBuilder()
                .putNode(graph.getNode(7).toBuilder().containerId(1).build());

        StructuralException e = assertThrows(StructuralException.class, builder::build);
        assertTrue(e.getViolations().stream().anyMatch(v -> v.contains("not a container")));
    }

    @Test
    void testContainerCycleIsRejected() {
        WorkflowGraph.Builder builder = WorkflowGraph.builder("Loop")
                .addNode(WorkflowNode.builder(1, NodeKind.CONTAINER).containerId(2).childIds(List.of(2)).build())
                .addNode(WorkflowNode.builder(2, NodeKind.CONTAINER).containerId(1).childIds(List.of(1)).build());

        StructuralException e = assertThrows(StructuralException.class, builder::build);
        assertEquals(1, e.getViolations().stream().filter(v -> v.contains("cycle")).count());
    }

    @Test
    void testMacroQueries() throws StructuralException {
        WorkflowGraph withMacro = graph.toBuilder()
                .addNode(WorkflowNode.builder(11, NodeKind.MACRO)
                        .config(new ToolConfig.Macro(MacroReference.unresolved("Cleanse.yxmc"))).build())
                .build();

        assertEquals(List.of(11), ids(withMacro.getMacroReferenceNodes()));
        assertEquals(List.of(11), ids(withMacro.getUnresolvedMacroNodes()));
        assertTrue(graph.getMacroReferenceNodes().isEmpty());
    }

    @Test
    void testToBuilderRoundTripIsEqual() throws StructuralException {
        assertEquals(graph, graph.toBuilder().build());
    }
}
