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

package dev.mars.dygram.semantic.nodes;

import dev.mars.dygram.ast.Attribute;
import dev.mars.dygram.ast.Edge;
import dev.mars.dygram.ast.EdgeSegment;
import dev.mars.dygram.ast.Node;
import dev.mars.dygram.ast.PrimitiveValue;
import dev.mars.dygram.ast.Reference;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for node type inference, agent decision points and context permissions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-21
 */
class NodeTypeCheckerTest {

    // ========== Type inference ==========

    @Test
    void testExplicitTypeWins() {
        Node node = Node.builder("analyze").type("state").attribute("prompt", "Analyze it").build();

        assertEquals("state", NodeTypeChecker.getNodeType(node).orElseThrow());
    }

    @Test
    void testDataAliasesFoldIntoContext() {
        assertEquals("context", NodeTypeChecker.getNodeType(new Node("customer", "Data")).orElseThrow());
        assertEquals("context", NodeTypeChecker.getNodeType(new Node("files", "resource")).orElseThrow());
        assertEquals("concept", NodeTypeChecker.getNodeType(new Node("idea", "concept")).orElseThrow());
    }

    @Test
    void testPromptInfersTask() {
        Node node = Node.builder("summarize").attribute("prompt", "Summarize the text").build();

        assertEquals(NodeTypeChecker.TASK, NodeTypeChecker.inferType(node).orElseThrow());
        assertTrue(NodeTypeChecker.isTask(node));
    }

    @Test
    void testToolAttributesInferTool() {
        Node node = Node.builder("search").attribute("schema", "{}").build();

        assertEquals(NodeTypeChecker.TOOL, NodeTypeChecker.inferType(node).orElseThrow());
        assertFalse(NodeTypeChecker.isTool(node));
    }

    @Test
    void testContextLikeNameInfersContext() {
        assertEquals(NodeTypeChecker.CONTEXT, NodeTypeChecker.inferType(new Node("userData")).orElseThrow());
        assertEquals(NodeTypeChecker.CONTEXT, NodeTypeChecker.inferType(new Node("appConfig")).orElseThrow());
        assertEquals(NodeTypeChecker.CONTEXT, NodeTypeChecker.inferType(new Node("sessionState")).orElseThrow());
        assertTrue(NodeTypeChecker.inferType(new Node("state")).isEmpty());
    }

    @Test
    void testDataOnlyAttributesInferContext() {
        Node settings = Node.builder("settings").attribute("region", "eu").build();
        Node guarded = Node.builder("gate").attribute("condition", "x > 1").build();

        assertEquals(NodeTypeChecker.CONTEXT, NodeTypeChecker.inferType(settings).orElseThrow());
        assertTrue(NodeTypeChecker.inferType(guarded).isEmpty());
    }

    @Test
    void testInitNeedsEdges() {
        Node begin = new Node("begin");
        List<SimpleEdge> edges = List.of(SimpleEdge.of("begin", "work"), SimpleEdge.of("work", "finish"));

        assertTrue(NodeTypeChecker.inferType(begin).isEmpty());
        assertEquals(NodeTypeChecker.INIT, NodeTypeChecker.inferType(begin, edges).orElseThrow());
        assertTrue(NodeTypeChecker.inferType(new Node("work"), edges).isEmpty());
    }

    @Test
    void testNoFallbackType() {
        assertTrue(NodeTypeChecker.getNodeType(new Node("idle")).isEmpty());
    }

    // ========== Predicates ==========

    @Test
    void testExplicitTypePredicatesIgnoreCase() {
        assertTrue(NodeTypeChecker.isState(new Node("waiting", "State")));
        assertTrue(NodeTypeChecker.isInit(new Node("boot", "INIT")));
        assertTrue(NodeTypeChecker.isTool(new Node("lookup", "tool")));
        assertFalse(NodeTypeChecker.isState(new Node("waiting")));
    }

    @Test
    void testIsContext() {
        assertTrue(NodeTypeChecker.isContext(new Node("facts", "concept")));
        assertTrue(NodeTypeChecker.isContext(new Node("requestInput", "state")));
        assertTrue(NodeTypeChecker.isContext(Node.builder("limits").attribute("max", "10").build()));
        assertFalse(NodeTypeChecker.isContext(new Node("review", "task")));
    }

    @Test
    void testContextAccessEdge() {
        Node task = Node.builder("fetch").attribute("prompt", "Fetch it").build();
        Node context = new Node("userData");
        Node other = new Node("review", "task");

        assertTrue(NodeTypeChecker.isContextAccessEdge(task, context));
        assertTrue(NodeTypeChecker.isContextAccessEdge(context, task));
        assertFalse(NodeTypeChecker.isContextAccessEdge(task, other));
    }

    @Test
    void testTaskIsNeverContextSide() {
        Node task = new Node("fetch", "task");
        Node outputTask = new Node("writeOutput", "task");

        assertFalse(NodeTypeChecker.isContextAccessEdge(task, outputTask));
    }

    @Test
    void testHasMeta() {
        Node quoted = Node.builder("a").attribute(Attribute.of("meta", PrimitiveValue.quoted("True"))).build();
        Node literal = Node.builder("b").attribute(Attribute.of("meta", PrimitiveValue.of(true))).build();
        Node off = Node.builder("c").attribute(Attribute.of("meta", PrimitiveValue.of(false))).build();

        assertTrue(NodeTypeChecker.hasMeta(quoted));
        assertTrue(NodeTypeChecker.hasMeta(literal));
        assertFalse(NodeTypeChecker.hasMeta(off));
        assertFalse(NodeTypeChecker.hasMeta(new Node("d")));
    }

    @Test
    void testHasAnnotation() {
        Node node = Node.builder("a").annotation("Async").build();

        assertTrue(NodeTypeChecker.hasAnnotation(node, "Async"));
        assertFalse(NodeTypeChecker.hasAnnotation(node, "Critical"));
    }

    // ========== Agent decisions ==========

    @Test
    void testPromptedTaskRequiresAgent() {
        Node task = Node.builder("decide").type("task").attribute("prompt", "Pick one").build();

        assertTrue(NodeTypeChecker.requiresAgentDecision(task));
    }

    @Test
    void testStateNeverRequiresAgent() {
        Node state = new Node("waiting", "state");
        List<SimpleEdge> edges = List.of(SimpleEdge.of("waiting", "a"), SimpleEdge.of("waiting", "b"));

        assertFalse(NodeTypeChecker.requiresAgentDecision(state, edges));
    }

    @Test
    void testBranchingRequiresAgent() {
        Node router = new Node("router");
        List<SimpleEdge> edges = List.of(
                new SimpleEdge("router", "a", "@auto"),
                SimpleEdge.of("router", "b"),
                SimpleEdge.of("router", "c"));

        assertFalse(NodeTypeChecker.requiresAgentDecision(router));
        assertTrue(NodeTypeChecker.requiresAgentDecision(router, edges));
        assertFalse(NodeTypeChecker.requiresAgentDecision(router, edges,
                e -> e.getLabel().isPresent() || e.getTarget().equals("c")));
    }

    // ========== Permissions ==========

    @Test
    void testUnlabelledEdgeGrantsRead() {
        ContextPermissions permissions = NodeTypeChecker.extractPermissionsFromEdge(SimpleEdge.of("task", "ctx"));

        assertTrue(permissions.canRead());
        assertFalse(permissions.canWrite());
        assertFalse(permissions.canStore());
        assertFalse(permissions.hasFieldRestriction());
    }

    @Test
    void testWriteWithFieldList() {
        ContextPermissions permissions = NodeTypeChecker.extractPermissionsFromEdge(
                new SimpleEdge("task", "ctx", "write: total, count"));

        assertTrue(permissions.canWrite());
        assertFalse(permissions.canRead());
        assertEquals(List.of("total", "count"), permissions.fields());
        assertTrue(permissions.hasFieldRestriction());
    }

    @Test
    void testStoreAndUpdateKeywords() {
        ContextPermissions store = NodeTypeChecker.extractPermissionsFromEdge(
                new SimpleEdge("task", "ctx", "calculate totals"));
        ContextPermissions update = NodeTypeChecker.extractPermissionsFromEdge(
                new SimpleEdge("task", "ctx", "Update: status"));

        assertTrue(store.canStore());
        assertFalse(store.canRead());
        assertTrue(update.canWrite());
        assertEquals(List.of("status"), update.fields());
    }

    // ========== Flattening ==========

    @Test
    void testFlattenChainedFanOut() {
        Edge edge = new Edge(
                List.of(new Reference("a")),
                List.of(EdgeSegment.labelled("go", "b", "c"),
                        EdgeSegment.to("d")));

        List<SimpleEdge> hops = SimpleEdge.flatten(edge);

        assertEquals(List.of(
                new SimpleEdge("a", "b", "go"),
                new SimpleEdge("a", "c", "go"),
                SimpleEdge.of("b", "d"),
                SimpleEdge.of("c", "d")), hops);
    }
}
