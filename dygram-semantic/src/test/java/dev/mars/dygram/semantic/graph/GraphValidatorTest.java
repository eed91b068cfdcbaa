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

package dev.mars.dygram.semantic.graph;

import dev.mars.dygram.ast.Edge;
import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.Node;
import dev.mars.dygram.validation.GraphErrorCodes;
import dev.mars.dygram.validation.ValidationCategory;
import dev.mars.dygram.validation.ValidationContext;
import dev.mars.dygram.validation.ValidationError;
import dev.mars.dygram.validation.ValidationSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for control-flow analysis of machines.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-21
 */
class GraphValidatorTest {

    private ValidationContext context;

    @BeforeEach
    void setUp() {
        context = new ValidationContext();
    }

    private static Machine cycle() {
        return Machine.builder("Loop")
                .node("a").node("b").node("c")
                .edge(Edge.chain("a", "b", "c", "a"))
                .build();
    }

    // ========== Entry and exit points ==========

    @Test
    void testLinearMachine() {
        Machine machine = Machine.builder("Linear").node("start").node("end").edge("start", "end").build();
        GraphValidator validator = new GraphValidator(machine);

        GraphValidationResult result = validator.validateWithContext(context);

        assertEquals(List.of("start"), result.getEntryPoints());
        assertEquals(List.of("end"), result.getExitPoints());
        assertTrue(result.getUnreachableNodes().isEmpty());
        assertTrue(result.getOrphanedNodes().isEmpty());
        assertFalse(result.hasCycles());
        assertTrue(result.isValid());
        assertFalse(result.hasWarnings());
        assertEquals(0, context.getErrorCount());
    }

    @Test
    void testStatistics() {
        Machine machine = Machine.builder("Linear")
                .node("start").node("middle").node("end")
                .edge(Edge.chain("start", "middle", "end"))
                .build();

        GraphStatistics statistics = new GraphValidator(machine).getStatistics();

        assertEquals(3, statistics.nodeCount());
        assertEquals(2, statistics.edgeCount());
        assertEquals(0, statistics.dataEdgeCount());
        assertEquals(1, statistics.entryPointCount());
        assertEquals(1, statistics.exitPointCount());
        assertEquals(3, statistics.maxDepth());
        assertEquals(0, statistics.cycleCount());
    }

    @Test
    void testInitNodeIsEntryDespiteIncomingEdge() {
        Machine machine = Machine.builder("Init")
                .node("boot", "init")
                .node("work")
                .edge(Edge.chain("boot", "work", "boot"))
                .build();

        GraphValidator validator = new GraphValidator(machine);

        assertEquals(List.of("boot"), validator.findEntryPoints());
        assertTrue(validator.findUnreachableNodes().isEmpty());
        assertEquals(List.of(List.of("boot", "work")), validator.detectCycles());
    }

    @Test
    void testMultipleEntryPointsWarning() {
        Machine machine = Machine.builder("Two")
                .node("left").node("right").node("join")
                .edge("left", "join")
                .edge("right", "join")
                .build();

        GraphValidationResult result = new GraphValidator(machine).validate();

        assertEquals(List.of("left", "right"), result.getEntryPoints());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).startsWith("Multiple entry points found: left, right"));
    }

    // ========== Cycles ==========

    @Test
    void testCycleDetection() {
        GraphValidator validator = new GraphValidator(cycle());

        assertEquals(List.of(List.of("a", "b", "c")), validator.detectCycles());
        assertTrue(validator.isNodeInCycle("b"));
        assertFalse(validator.isNodeInCycle("z"));
    }

    @Test
    void testCycleWarnings() {
        GraphValidationResult result = new GraphValidator(cycle()).validateWithContext(context);

        assertTrue(result.isMissingEntryPoints());
        assertTrue(result.isMissingExitPoints());
        assertEquals(List.of("a", "b", "c"), result.getUnreachableNodes());

        List<ValidationError> cycleErrors = context.getErrorsByCode(GraphErrorCodes.CYCLE_DETECTED);
        assertEquals(3, cycleErrors.size());
        ValidationError first = cycleErrors.get(0);
        assertEquals("Cycle detected: a -> b -> c -> a", first.getMessage());
        assertEquals(ValidationSeverity.WARNING, first.getSeverity());
        assertEquals(ValidationCategory.GRAPH, first.getCategory());
        assertEquals(3, first.getContext().get("cycleLength"));
        assertEquals(0, first.getContext().get("cycleIndex"));

        assertEquals(1, context.getErrorsByCode(GraphErrorCodes.MISSING_ENTRY).size());
        assertEquals(1, context.getErrorsByCode(GraphErrorCodes.MISSING_EXIT).size());
        assertEquals(3, context.getErrorsByCode(GraphErrorCodes.UNREACHABLE_NODE).size());
        assertFalse(context.hasCriticalErrors());
    }

    @Test
    void testCycleWarningsCanBeSuppressed() {
        new GraphValidator(cycle()).validateWithContext(context, false);

        assertTrue(context.getErrorsByCode(GraphErrorCodes.CYCLE_DETECTED).isEmpty());
        assertEquals(1, context.getErrorsByCode(GraphErrorCodes.MISSING_ENTRY).size());
    }

    @Test
    void testSelfLoop() {
        Machine machine = Machine.builder("Retry")
                .node("start").node("retry")
                .edge("start", "retry")
                .edge("retry", "retry")
                .build();

        GraphValidator validator = new GraphValidator(machine);

        assertEquals(List.of(List.of("retry")), validator.detectCycles());
        assertTrue(validator.findExitPoints().isEmpty());
    }

    // ========== Reachability ==========

    @Test
    void testOrphanedNode() {
        Machine machine = Machine.builder("Orphan")
                .node("start").node("end").node("lonely")
                .edge("start", "end")
                .build();

        GraphValidationResult result = new GraphValidator(machine).validateWithContext(context);

        assertEquals(List.of("lonely"), result.getOrphanedNodes());
        assertTrue(result.getUnreachableNodes().isEmpty());
        assertFalse(result.isValid());
        List<ValidationError> orphans = context.getErrorsByCode(GraphErrorCodes.ORPHANED_NODE);
        assertEquals(1, orphans.size());
        assertEquals("lonely", orphans.get(0).getNodeName().orElseThrow());
    }

    @Test
    void testUnreachableIsland() {
        Machine machine = Machine.builder("Island")
                .node("start").node("end").node("x").node("y")
                .edge("start", "end")
                .edge(Edge.chain("x", "y", "x"))
                .build();

        GraphValidator validator = new GraphValidator(machine);

        assertEquals(List.of("x", "y"), validator.findUnreachableNodes());
        assertTrue(validator.findOrphanedNodes().isEmpty());
    }

    // ========== Data edges ==========

    @Test
    void testContextNodesAreExempt() {
        Machine machine = Machine.builder("Context")
                .node("fetch", "task")
                .node(Node.builder("settings").attribute("region", "eu").build())
                .node("done")
                .edge("fetch", "settings")
                .edge("fetch", "done")
                .build();

        GraphValidator validator = new GraphValidator(machine);

        assertEquals(List.of("fetch"), validator.findEntryPoints());
        assertEquals(List.of("done"), validator.findExitPoints());
        assertTrue(validator.findOrphanedNodes().isEmpty());
        assertEquals(1, validator.getStatistics().dataEdgeCount());
        assertEquals(1, validator.getStatistics().edgeCount());
    }

    @Test
    void testAttributeReferenceIsDataEdge() {
        Machine machine = Machine.builder("Attributes")
                .node("start")
                .node("check", "state")
                .node("gate", "state")
                .edge("start", "check")
                .edge("check", "gate.threshold")
                .build();

        GraphValidator validator = new GraphValidator(machine);

        assertEquals(List.of("check", "gate"), validator.findExitPoints());
        assertEquals(List.of("gate"), validator.findOrphanedNodes());
    }

    @Test
    void testTaskToContextLikeNodeIsDataEdge() {
        Machine machine = Machine.builder("Access")
                .node(Node.builder("summarize").attribute("prompt", "Summarize").build())
                .node("reportOutput", "state")
                .edge("summarize", "reportOutput")
                .build();

        GraphValidator validator = new GraphValidator(machine);

        assertEquals(0, validator.getStatistics().edgeCount());
        assertEquals(1, validator.getStatistics().dataEdgeCount());
    }

    // ========== Paths ==========

    @Test
    void testFindPath() {
        Machine machine = Machine.builder("Paths")
                .node("a").node("b").node("c").node("d")
                .edge(Edge.chain("a", "b", "c"))
                .edge("a", "d")
                .edge("d", "c")
                .build();

        GraphValidator validator = new GraphValidator(machine);

        assertEquals(List.of("a", "b", "c"), validator.findPath("a", "c"));
        assertTrue(validator.findPath("c", "a").isEmpty());
        assertTrue(validator.findPath("a", "unknown").isEmpty());
        assertEquals(List.of("a", "b", "c"), validator.findLongestPath());
    }

    @Test
    void testEmptyMachine() {
        GraphValidationResult result = new GraphValidator(new Machine("Empty")).validateWithContext(context);

        assertTrue(result.isMissingEntryPoints());
        assertEquals(1, context.getErrorCount());
        assertEquals(1, context.getErrorsByCode(GraphErrorCodes.MISSING_ENTRY).size());
    }
}
