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

package dev.mars.dygram.semantic.link;

import dev.mars.dygram.ast.Attribute;
import dev.mars.dygram.ast.Edge;
import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.Node;
import dev.mars.dygram.ast.PrimitiveValue;
import dev.mars.dygram.ast.Reference;
import dev.mars.dygram.core.exceptions.UnresolvedReferenceException;
import dev.mars.dygram.validation.StructuralErrorCodes;
import dev.mars.dygram.validation.ValidationContext;
import dev.mars.dygram.validation.ValidationError;
import dev.mars.dygram.validation.ValidationSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Description for MachineLinkerTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-21
 */
class MachineLinkerTest {

    private MachineLinker linker;
    private ValidationContext context;

    @BeforeEach
    void setUp() {
        linker = new MachineLinker();
        context = new ValidationContext();
    }

    private static Reference target(Edge edge) {
        return edge.getSegments().get(0).getTargets().get(0);
    }

    @Test
    void testResolvesDeclaredNodes() {
        Node start = new Node("start");
        Node end = new Node("end");
        Machine machine = Machine.builder("Simple").node(start).node(end).edge("start", "end").build();

        LinkResult result = linker.link(machine, context);

        Edge edge = machine.getEdges().get(0);
        assertSame(start, edge.getSources().get(0).getResolved().orElseThrow());
        assertSame(end, target(edge).getResolved().orElseThrow());
        assertEquals(2, result.getResolvedCount());
        assertTrue(result.getCreatedPlaceholders().isEmpty());
        assertTrue(result.isFullyResolved());
    }

    @Test
    void testResolvesNestedNodeBySimpleName() {
        Node review = new Node("review");
        Machine machine = Machine.builder("Nested")
                .node("start")
                .node(Node.builder("workflow").child(review).build())
                .edge("start", "review")
                .build();

        linker.link(machine, context);

        assertSame(review, target(machine.getEdges().get(0)).getResolved().orElseThrow());
    }

    @Test
    void testResolvesAttributeReference() {
        Node config = Node.builder("config").attribute("apiKey", "secret").build();
        Machine machine = Machine.builder("Attributes")
                .node(new Node("fetch", "task"))
                .node(config)
                .edge("fetch", "config.apiKey")
                .build();

        LinkResult result = linker.link(machine, context);

        Reference reference = target(machine.getEdges().get(0));
        assertSame(config, reference.getResolved().orElseThrow());
        assertEquals("apiKey", reference.getAttribute().orElseThrow());
        assertTrue(result.getCreatedPlaceholders().isEmpty());
    }

    // ========== Lenient mode ==========

    @Test
    void testLenientModeCreatesPlaceholder() {
        Machine machine = Machine.builder("Lenient").node("start").edge("start", "missing").build();

        LinkResult result = linker.link(machine, context);

        assertEquals(List.of("missing"), result.getCreatedPlaceholders());
        Node missing = machine.findChild("missing").orElseThrow();
        assertTrue(missing.isPlaceholder());
        assertSame(missing, target(machine.getEdges().get(0)).getResolved().orElseThrow());

        List<ValidationError> infos = context.getErrorsByCode(StructuralErrorCodes.PLACEHOLDER_CREATED);
        assertEquals(1, infos.size());
        assertEquals(ValidationSeverity.INFO, infos.get(0).getSeverity());
        assertFalse(context.hasCriticalErrors());
    }

    @Test
    void testLenientModeAnchorsDottedPlaceholder() {
        Machine machine = Machine.builder("Lenient")
                .node("start")
                .node("workflow")
                .edge("start", "workflow.review")
                .build();

        LinkResult result = linker.link(machine, context);

        assertEquals(List.of("workflow.review"), result.getCreatedPlaceholders());
        Node workflow = machine.findChild("workflow").orElseThrow();
        Node review = workflow.findChild("review").orElseThrow();
        assertSame(review, target(machine.getEdges().get(0)).getResolved().orElseThrow());
        assertEquals(2, machine.getNodes().size());
    }

    // ========== Strict mode ==========

    @Test
    void testStrictModeReportsUnresolved() {
        Machine machine = Machine.builder("Strict").strict().node("start").edge("start", "ghost").build();

        LinkResult result = linker.link(machine, context);

        assertEquals(List.of("ghost"), result.getUnresolvedReferences());
        assertFalse(result.isFullyResolved());
        assertEquals(1, machine.getNodes().size());
        assertFalse(target(machine.getEdges().get(0)).isResolved());

        List<ValidationError> errors = context.getErrorsByCode(StructuralErrorCodes.UNRESOLVED_REFERENCE);
        assertEquals(1, errors.size());
        assertEquals(ValidationSeverity.ERROR, errors.get(0).getSeverity());
        assertTrue(context.hasCriticalErrors());
    }

    @Test
    void testThrowIfUnresolved() {
        Machine machine = Machine.builder("Strict").strict().node("start").edge("start", "ghost").build();

        LinkResult result = linker.link(machine, context);

        UnresolvedReferenceException exception = assertThrows(UnresolvedReferenceException.class,
                result::throwIfUnresolved);
        assertEquals(List.of("ghost"), exception.getReferences());
        assertEquals("Strict", exception.getMachineTitle());
    }

    @Test
    void testStrictFlagOverridesMachineAnnotation() {
        Machine machine = Machine.builder("Forced").node("start").edge("start", "ghost").build();

        LinkResult result = linker.link(machine, context, true);

        assertEquals(List.of("ghost"), result.getUnresolvedReferences());
        assertTrue(result.getCreatedPlaceholders().isEmpty());
    }

    // ========== Notes ==========

    @Test
    void testNoteWithoutTargetPointsAtItself() {
        Node rootNote = new Node("remark", "note");
        Node nestedNote = new Node("hint", "Note");
        Node annotated = Node.builder("other").type("note")
                .attribute(Attribute.of("target", PrimitiveValue.quoted("start")))
                .build();
        Machine machine = Machine.builder("Notes")
                .node("start")
                .node(rootNote)
                .node(Node.builder("workflow").child(nestedNote).build())
                .node(annotated)
                .build();

        linker.link(machine, context);

        assertEquals(PrimitiveValue.quoted("remark"), rootNote.getAttribute("target").orElseThrow().getValue().orElseThrow());
        assertEquals(PrimitiveValue.quoted("workflow.hint"), nestedNote.getAttribute("target").orElseThrow().getValue().orElseThrow());
        assertEquals(PrimitiveValue.quoted("start"), annotated.getAttribute("target").orElseThrow().getValue().orElseThrow());
    }
}
