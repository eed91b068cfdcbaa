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
import dev.mars.dygram.ast.EdgeSegment;
import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.Node;
import dev.mars.dygram.ast.NodeWalker;
import dev.mars.dygram.ast.Reference;
import dev.mars.dygram.semantic.nodes.NodeTypeChecker;
import dev.mars.dygram.validation.GraphErrorCodes;
import dev.mars.dygram.validation.ValidationCategory;
import dev.mars.dygram.validation.ValidationContext;
import dev.mars.dygram.validation.ValidationError;
import dev.mars.dygram.validation.ValidationSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Analyzes the control-flow graph of a machine: entry and exit points, reachability,
 * orphans and cycles.
 *
 * <p>Nodes live in an index-addressed arena, so cyclic graphs need no special handling. Every
 * node of the tree takes part, nested ones included. Edges are flattened into hops; chained
 * edges {@code a -> b -> c} give {@code a -> b} and {@code b -> c}. A hop is a data edge, and
 * left out of the control graph, when either end is a context node, either reference points
 * into an attribute ({@code config.retries}), or it connects a task with a context-like node.</p>
 *
 * <p>Nodes are reported by simple name; a node whose simple name was already used by an earlier
 * node is reported by its qualified name. The validator never blocks: everything it finds is
 * reported as a warning.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class GraphValidator {

    private static final Logger logger = LoggerFactory.getLogger(GraphValidator.class);

    private final Machine machine;
    private final List<Node> nodes = new ArrayList<>();
    private final List<String> names = new ArrayList<>();
    private final Map<Node, Integer> indexByNode = new IdentityHashMap<>();
    private final Map<String, Integer> indexByAlias = new HashMap<>();
    private final List<Set<Integer>> outgoing = new ArrayList<>();
    private final List<Set<Integer>> incoming = new ArrayList<>();
    private boolean[] context;
    private int controlEdgeCount;
    private int dataEdgeCount;
    private List<List<String>> cycles;

    public GraphValidator(Machine machine) {
        this.machine = Objects.requireNonNull(machine, "Machine cannot be null");
        buildArena();
        buildAdjacency();
        logger.debug("Built control graph for '{}': {} node(s), {} control edge(s), {} data edge(s)",
                machine.getTitle(), nodes.size(), controlEdgeCount, dataEdgeCount);
    }

    private void buildArena() {
        Map<Node, String> displayNames = NodeWalker.displayNames(machine);
        NodeWalker.walk(machine, (qualified, node) -> {
            int index = nodes.size();
            nodes.add(node);
            names.add(displayNames.get(node));
            indexByNode.put(node, index);
            indexByAlias.putIfAbsent(node.getName(), index);
            indexByAlias.putIfAbsent(qualified, index);
            outgoing.add(new LinkedHashSet<>());
            incoming.add(new LinkedHashSet<>());
        });

        context = new boolean[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            context[i] = NodeTypeChecker.getNodeType(nodes.get(i))
                    .filter(NodeTypeChecker.CONTEXT::equalsIgnoreCase)
                    .isPresent();
        }
    }

    private void buildAdjacency() {
        List<Edge> edges = new ArrayList<>();
        NodeWalker.forEachEdge(machine, edges::add);

        for (Edge edge : edges) {
            List<Endpoint> sources = resolveAll(edge.getSources());
            for (EdgeSegment segment : edge.getSegments()) {
                List<Endpoint> targets = resolveAll(segment.getTargets());
                for (Endpoint source : sources) {
                    for (Endpoint target : targets) {
                        addHop(source, target);
                    }
                }
                sources = targets;
            }
        }
    }

    private void addHop(Endpoint source, Endpoint target) {
        if (isDataHop(source, target)) {
            dataEdgeCount++;
            return;
        }
        if (outgoing.get(source.index).add(target.index)) {
            incoming.get(target.index).add(source.index);
            controlEdgeCount++;
        }
    }

    private boolean isDataHop(Endpoint source, Endpoint target) {
        if (context[source.index] || context[target.index]) {
            return true;
        }
        if (source.attributePath || target.attributePath) {
            return true;
        }
        return NodeTypeChecker.isContextAccessEdge(nodes.get(source.index), nodes.get(target.index));
    }

    private List<Endpoint> resolveAll(List<Reference> references) {
        List<Endpoint> endpoints = new ArrayList<>();
        for (Reference reference : references) {
            Endpoint endpoint = resolve(reference);
            if (endpoint != null) {
                endpoints.add(endpoint);
            } else {
                logger.debug("Ignoring unresolved reference '{}'", reference.getText());
            }
        }
        return endpoints;
    }

    private Endpoint resolve(Reference reference) {
        if (reference.isResolved()) {
            Integer index = indexByNode.get(reference.getResolved().get());
            if (index != null) {
                return new Endpoint(index, reference.getAttribute().isPresent());
            }
        }

        String text = reference.getText();
        Integer direct = indexByAlias.get(text);
        if (direct != null) {
            return new Endpoint(direct, false);
        }

        // Longest prefix naming a node; the rest is an attribute path.
        String[] segments = text.split("\\.");
        for (int i = segments.length - 1; i >= 1; i--) {
            Integer index = indexByAlias.get(String.join(".", Arrays.copyOfRange(segments, 0, i)));
            if (index != null) {
                return new Endpoint(index, true);
            }
        }
        return null;
    }

    public List<String> findEntryPoints() {
        List<String> entries = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (!context[i] && (incoming.get(i).isEmpty() || NodeTypeChecker.isInit(nodes.get(i)))) {
                entries.add(names.get(i));
            }
        }
        return entries;
    }

    public List<String> findExitPoints() {
        List<String> exits = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (!context[i] && outgoing.get(i).isEmpty()) {
                exits.add(names.get(i));
            }
        }
        return exits;
    }

    public List<String> findUnreachableNodes() {
        boolean[] visited = new boolean[nodes.size()];
        Deque<Integer> queue = new ArrayDeque<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (!context[i] && (incoming.get(i).isEmpty() || NodeTypeChecker.isInit(nodes.get(i)))) {
                visited[i] = true;
                queue.add(i);
            }
        }
        while (!queue.isEmpty()) {
            for (int next : outgoing.get(queue.poll())) {
                if (!visited[next]) {
                    visited[next] = true;
                    queue.add(next);
                }
            }
        }

        List<String> unreachable = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (!visited[i] && !context[i]) {
                unreachable.add(names.get(i));
            }
        }
        return unreachable;
    }

    public List<String> findOrphanedNodes() {
        List<String> orphaned = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (!context[i] && !NodeTypeChecker.isInit(nodes.get(i))
                    && incoming.get(i).isEmpty() && outgoing.get(i).isEmpty()) {
                orphaned.add(names.get(i));
            }
        }
        return orphaned;
    }

    /**
     * Cycles found by depth-first search. Each cycle lists its nodes from the first one the
     * search re-entered; a self-loop is a one-node cycle.
     */
    public List<List<String>> detectCycles() {
        if (cycles == null) {
            List<List<String>> found = new ArrayList<>();
            boolean[] visited = new boolean[nodes.size()];
            boolean[] onStack = new boolean[nodes.size()];
            List<Integer> stack = new ArrayList<>();
            for (int i = 0; i < nodes.size(); i++) {
                if (!visited[i]) {
                    detectCycles(i, visited, onStack, stack, found);
                }
            }
            cycles = Collections.unmodifiableList(found);
        }
        return cycles;
    }

    private void detectCycles(int node, boolean[] visited, boolean[] onStack, List<Integer> stack,
                              List<List<String>> found) {
        visited[node] = true;
        onStack[node] = true;
        stack.add(node);

        for (int next : outgoing.get(node)) {
            if (onStack[next]) {
                List<Integer> members = stack.subList(stack.indexOf(next), stack.size());
                found.add(members.stream().map(names::get).collect(Collectors.toUnmodifiableList()));
            } else if (!visited[next]) {
                detectCycles(next, visited, onStack, stack, found);
            }
        }

        stack.remove(stack.size() - 1);
        onStack[node] = false;
    }

    public boolean isNodeInCycle(String nodeName) {
        return detectCycles().stream().anyMatch(cycle -> cycle.contains(nodeName));
    }

    /**
     * Shortest control path between two nodes, both ends included; empty when there is none.
     */
    public List<String> findPath(String from, String to) {
        Integer start = indexByAlias.get(from);
        Integer goal = indexByAlias.get(to);
        if (start == null || goal == null) {
            return List.of();
        }

        int[] previous = new int[nodes.size()];
        Arrays.fill(previous, -1);
        boolean[] visited = new boolean[nodes.size()];
        Deque<Integer> queue = new ArrayDeque<>();
        visited[start] = true;
        queue.add(start);

        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (current == goal) {
                List<String> path = new ArrayList<>();
                for (int at = goal; at != -1; at = previous[at]) {
                    path.add(names.get(at));
                }
                Collections.reverse(path);
                return path;
            }
            for (int next : outgoing.get(current)) {
                if (!visited[next]) {
                    visited[next] = true;
                    previous[next] = current;
                    queue.add(next);
                }
            }
        }
        return List.of();
    }

    /**
     * The longest of the shortest paths from any entry point to any exit point.
     */
    public List<String> findLongestPath() {
        List<String> longest = List.of();
        for (String entry : findEntryPoints()) {
            for (String exit : findExitPoints()) {
                List<String> path = findPath(entry, exit);
                if (path.size() > longest.size()) {
                    longest = path;
                }
            }
        }
        return longest;
    }

    public GraphStatistics getStatistics() {
        return new GraphStatistics(
                nodes.size(),
                controlEdgeCount,
                dataEdgeCount,
                findEntryPoints().size(),
                findExitPoints().size(),
                findLongestPath().size(),
                detectCycles().size());
    }

    public GraphValidationResult validate() {
        List<String> entries = findEntryPoints();
        List<String> exits = findExitPoints();
        List<List<String>> found = detectCycles();

        List<String> warnings = new ArrayList<>();
        if (entries.isEmpty()) {
            warnings.add("No entry points found. Consider adding an init node or a node with no incoming edges.");
        } else if (entries.size() > 1) {
            warnings.add("Multiple entry points found: " + String.join(", ", entries)
                    + ". This may lead to ambiguous execution.");
        }
        if (exits.isEmpty()) {
            warnings.add("No exit points found. The machine may not have a clear termination condition.");
        }
        if (!found.isEmpty()) {
            warnings.add("Detected " + found.size() + " cycle(s) in the graph. This may lead to infinite loops.");
        }

        return new GraphValidationResult(entries, exits, findUnreachableNodes(), findOrphanedNodes(), found, warnings);
    }

    public GraphValidationResult validateWithContext(ValidationContext validationContext) {
        return validateWithContext(validationContext, true);
    }

    /**
     * Validates and records the findings as GRAPH warnings: one per unreachable or orphaned
     * node, one per node of every cycle, and one each for missing entry or exit points.
     */
    public GraphValidationResult validateWithContext(ValidationContext validationContext, boolean reportCycles) {
        GraphValidationResult result = validate();

        for (String node : result.getUnreachableNodes()) {
            validationContext.addError(warning(GraphErrorCodes.UNREACHABLE_NODE,
                    "Node '" + node + "' is unreachable from entry points")
                    .node(node)
                    .suggestion("Add an edge from an entry point or init node to this node, or remove it if unused")
                    .build());
        }

        for (String node : result.getOrphanedNodes()) {
            validationContext.addError(warning(GraphErrorCodes.ORPHANED_NODE,
                    "Node '" + node + "' is orphaned (no incoming or outgoing edges)")
                    .node(node)
                    .suggestion("Connect this node to the graph or remove it if unused")
                    .build());
        }

        if (reportCycles) {
            List<List<String>> found = result.getCycles();
            for (int index = 0; index < found.size(); index++) {
                List<String> cycle = found.get(index);
                String path = String.join(" -> ", cycle) + " -> " + cycle.get(0);
                for (String node : cycle) {
                    validationContext.addError(warning(GraphErrorCodes.CYCLE_DETECTED, "Cycle detected: " + path)
                            .node(node)
                            .context("cycleIndex", index)
                            .context("cyclePath", cycle)
                            .context("cycleLength", cycle.size())
                            .suggestion("Ensure cycle has proper exit condition or break the cycle if unintended")
                            .build());
                }
            }
        }

        if (result.isMissingEntryPoints()) {
            validationContext.addError(warning(GraphErrorCodes.MISSING_ENTRY, "No entry points found in machine")
                    .suggestion("Add an init node or designate an entry node")
                    .build());
        }
        if (result.isMissingExitPoints() && !nodes.isEmpty()) {
            validationContext.addError(warning(GraphErrorCodes.MISSING_EXIT, "No exit points found in machine")
                    .suggestion("Add a terminal node without outgoing edges")
                    .build());
        }

        logger.info("Graph validation of '{}': {}", machine.getTitle(), result);
        return result;
    }

    private static ValidationError.Builder warning(String code, String message) {
        return ValidationError.builder()
                .severity(ValidationSeverity.WARNING)
                .category(ValidationCategory.GRAPH)
                .code(code)
                .message(message);
    }

    private static final class Endpoint {
        private final int index;
        private final boolean attributePath;

        private Endpoint(int index, boolean attributePath) {
            this.index = index;
            this.attributePath = attributePath;
        }
    }
}
