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

package dev.mars.dygram.ast;

import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Depth-first, pre-order traversal helpers over a node tree.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class NodeWalker {

    private NodeWalker() {
    }

    /**
     * Visits every node below {@code container} in document order, parents before children,
     * passing the node's qualified name (dot-joined ancestor names).
     */
    public static void walk(NodeContainer container, BiConsumer<String, Node> visitor) {
        walk(container, null, visitor);
    }

    private static void walk(NodeContainer container, String prefix, BiConsumer<String, Node> visitor) {
        for (Node node : container.getNodes()) {
            String qualified = prefix == null ? node.getName() : prefix + "." + node.getName();
            visitor.accept(qualified, node);
            walk(node, qualified, visitor);
        }
    }

    /**
     * Qualified name of every node, keyed by identity.
     */
    public static Map<Node, String> qualifiedNames(NodeContainer container) {
        Map<Node, String> names = new IdentityHashMap<>();
        walk(container, (qualified, node) -> names.put(node, qualified));
        return names;
    }

    /**
     * Name under which each node is reported in diagnostics and analysis results: the simple
     * name for the first node in document order to carry it, the qualified name for any later
     * node sharing that simple name.
     */
    public static Map<Node, String> displayNames(NodeContainer container) {
        Map<Node, String> names = new IdentityHashMap<>();
        Set<String> taken = new HashSet<>();
        walk(container, (qualified, node) ->
                names.put(node, taken.add(node.getName()) ? node.getName() : qualified));
        return names;
    }

    /**
     * Visits the edges of {@code container} and of every nested node.
     */
    public static void forEachEdge(NodeContainer container, Consumer<Edge> visitor) {
        container.getEdges().forEach(visitor);
        walk(container, (qualified, node) -> node.getEdges().forEach(visitor));
    }

    public static int countNodes(NodeContainer container) {
        int[] count = {0};
        walk(container, (qualified, node) -> count[0]++);
        return count[0];
    }
}
