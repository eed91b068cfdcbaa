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

import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.Node;
import dev.mars.dygram.validation.StructuralErrorCodes;
import dev.mars.dygram.validation.ValidationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Description for PlaceholderMaterializerTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-21
 */
class PlaceholderMaterializerTest {

    private PlaceholderMaterializer materializer;
    private ValidationContext context;

    @BeforeEach
    void setUp() {
        materializer = new PlaceholderMaterializer();
        context = new ValidationContext();
    }

    @Test
    void testCreatesWholePathWhenNothingMatches() {
        Machine machine = Machine.builder("Empty").build();

        List<String> created = materializer.materialize(machine, "a.b.c", context);

        assertEquals(List.of("a", "a.b", "a.b.c"), created);
        Node a = machine.findChild("a").orElseThrow();
        assertTrue(a.isPlaceholder());
        assertTrue(a.findChild("b").flatMap(b -> b.findChild("c")).isPresent());
        assertEquals(3, context.getErrorsByCode(StructuralErrorCodes.PLACEHOLDER_CREATED).size());
    }

    @Test
    void testDeclaredReferencesAreLeftAlone() {
        Machine machine = Machine.builder("Declared")
                .node(Node.builder("config").attribute("apiKey", "secret").build())
                .node(Node.builder("workflow").child(new Node("review")).build())
                .edge("review", "config.apiKey")
                .edge("workflow.review", "config")
                .build();

        List<String> created = materializer.materialize(machine, context);

        assertTrue(created.isEmpty());
        assertEquals(0, context.getErrorCount());
    }

    @Test
    void testUnknownAttributePathBecomesChildPlaceholder() {
        Node config = Node.builder("config").attribute("apiKey", "secret").build();
        Machine machine = Machine.builder("Attributes")
                .node("start")
                .node(config)
                .edge("start", "config.timeout")
                .build();

        List<String> created = materializer.materialize(machine, context);

        assertEquals(List.of("config.timeout"), created);
        assertTrue(config.findChild("timeout").orElseThrow().isPlaceholder());
    }

    @Test
    void testRepeatedReferenceCreatesOnePlaceholder() {
        Machine machine = Machine.builder("Repeat")
                .node("start")
                .edge("start", "missing")
                .edge("missing", "start")
                .build();

        List<String> created = materializer.materialize(machine, context);

        assertEquals(List.of("missing"), created);
        assertEquals(2, machine.getNodes().size());
    }
}
