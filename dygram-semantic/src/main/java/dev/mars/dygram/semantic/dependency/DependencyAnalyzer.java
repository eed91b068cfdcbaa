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

package dev.mars.dygram.semantic.dependency;

import dev.mars.dygram.ast.ArrayValue;
import dev.mars.dygram.ast.Attribute;
import dev.mars.dygram.ast.AttributeValue;
import dev.mars.dygram.ast.Edge;
import dev.mars.dygram.ast.EdgeSegment;
import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.Node;
import dev.mars.dygram.ast.NodeWalker;
import dev.mars.dygram.ast.ObjectValue;
import dev.mars.dygram.ast.PrimitiveValue;
import dev.mars.dygram.ast.Reference;
import dev.mars.dygram.config.DygramConfiguration;
import dev.mars.dygram.semantic.template.TemplateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Infers implicit dependencies between nodes from template references in attribute values and
 * from identifiers used in edge guards.
 *
 * <p>A node whose attribute contains {@code {{ config.apiKey }}} depends on {@code config}. An
 * edge guarded by {@code when: retries < maxRetries} makes each of its source nodes depend on
 * the node named {@code retries}, or on the single node that declares an attribute of that name.
 * Identifiers in {@link DygramConfiguration#getReservedIdentifiers()} are runtime state and never
 * name a node. Self-dependencies are not reported.</p>
 *
 * <p>Guards are tokenized identifier by identifier, so {@code config.retry.maxAttempts} also
 * yields {@code retry} and {@code maxAttempts}. Setting
 * {@value DygramConfiguration#ROOT_IDENTIFIERS_ONLY} keeps only the root of each dotted path.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class DependencyAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(DependencyAnalyzer.class);

    private static final Pattern IDENTIFIER = Pattern.compile("\\b([a-zA-Z_][a-zA-Z0-9_]*)\\b");
    private static final Pattern ROOT_IDENTIFIER =
            Pattern.compile("(?<![.\\w])([a-zA-Z_][a-zA-Z0-9_]*)(?:\\.[a-zA-Z_][a-zA-Z0-9_]*)*");

    private final Machine machine;
    private final Set<String> reservedIdentifiers;
    private final boolean rootIdentifiersOnly;
    private final Map<Node, String> displayNames;
    private final Map<String, Node> nodesByName = new HashMap<>();
    private final Map<String, List<Node>> attributeOwners = new HashMap<>();
    private List<InferredDependency> dependencies;

    public DependencyAnalyzer(Machine machine) {
        this(machine, DygramConfiguration.defaults());
    }

    public DependencyAnalyzer(Machine machine, DygramConfiguration configuration) {
        this.machine = Objects.requireNonNull(machine, "Machine cannot be null");
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.reservedIdentifiers = configuration.getReservedIdentifiers();
        this.rootIdentifiersOnly = configuration.isRootIdentifiersOnly();
        this.displayNames = NodeWalker.displayNames(machine);

        NodeWalker.walk(machine, (qualified, node) -> {
            nodesByName.putIfAbsent(node.getName(), node);
            nodesByName.putIfAbsent(qualified, node);
            for (Attribute attribute : node.getAttributes()) {
                attributeOwners.computeIfAbsent(attribute.getName(), name -> new ArrayList<>()).add(node);
            }
        });
    }

    /**
     * All inferred dependencies, template references first in document order, then guards.
     * The result is computed once and cached.
     */
    public List<InferredDependency> inferDependencies() {
        if (dependencies == null) {
            Map<String, InferredDependency> unique = new LinkedHashMap<>();
            NodeWalker.walk(machine, (qualified, node) -> analyzeAttributes(node, unique));
            NodeWalker.forEachEdge(machine, edge -> analyzeConditions(edge, unique));
            dependencies = List.copyOf(unique.values());
            logger.debug("Inferred {} dependencies for machine '{}'", dependencies.size(), machine.getTitle());
        }
        return dependencies;
    }

    public List<InferredDependency> getDependenciesFor(String nodeName) {
        return inferDependencies().stream()
                .filter(dependency -> dependency.source().equals(nodeName))
                .collect(Collectors.toList());
    }

    public List<InferredDependency> getDependentsOf(String nodeName) {
        return inferDependencies().stream()
                .filter(dependency -> dependency.target().equals(nodeName))
                .collect(Collectors.toList());
    }

    /**
     * Whether {@code source} depends on {@code target}, directly or transitively.
     */
    public boolean hasDependency(String source, String target) {
        Map<String, Set<String>> graph = adjacency();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(source);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(target)) {
                return true;
            }
            if (visited.add(current)) {
                for (String next : graph.getOrDefault(current, Set.of())) {
                    if (!visited.contains(next)) {
                        queue.add(next);
                    }
                }
            }
        }
        return false;
    }

    /**
     * Dependency cycles, each listed from the first node the search re-entered and closed by
     * repeating that node, e.g. {@code [a, b, a]}.
     */
    public List<List<String>> detectCircularDependencies() {
        Map<String, Set<String>> graph = adjacency();
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        List<String> stack = new ArrayList<>();

        for (String node : allNames()) {
            if (!visited.contains(node)) {
                detectCycles(node, graph, visited, stack, cycles);
            }
        }
        return cycles;
    }

    private void detectCycles(String node, Map<String, Set<String>> graph, Set<String> visited,
                              List<String> stack, List<List<String>> cycles) {
        int onStack = stack.indexOf(node);
        if (onStack >= 0) {
            List<String> cycle = new ArrayList<>(stack.subList(onStack, stack.size()));
            cycle.add(node);
            cycles.add(Collections.unmodifiableList(cycle));
            return;
        }
        if (!visited.add(node)) {
            return;
        }

        stack.add(node);
        for (String next : graph.getOrDefault(node, Set.of())) {
            detectCycles(next, graph, visited, stack, cycles);
        }
        stack.remove(stack.size() - 1);
    }

    /**
     * Groups every node into batches such that each node only depends on nodes of earlier
     * batches. Nodes without dependencies land in the first batch.
     *
     * @throws CircularDependencyException if the dependencies contain a cycle
     */
    public List<List<String>> getExecutionBatches() throws CircularDependencyException {
        Map<String, Set<String>> graph = adjacency();
        Map<String, Integer> pending = new LinkedHashMap<>();
        for (String node : allNames()) {
            pending.put(node, graph.getOrDefault(node, Set.of()).size());
        }

        List<List<String>> batches = new ArrayList<>();
        Set<String> processed = new HashSet<>();
        while (processed.size() < pending.size()) {
            List<String> batch = pending.entrySet().stream()
                    .filter(entry -> entry.getValue() == 0 && !processed.contains(entry.getKey()))
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toList());

            if (batch.isEmpty()) {
                List<String> remaining = pending.keySet().stream()
                        .filter(node -> !processed.contains(node))
                        .collect(Collectors.toList());
                throw new CircularDependencyException(remaining);
            }

            processed.addAll(batch);
            batches.add(Collections.unmodifiableList(batch));
            for (String done : batch) {
                graph.forEach((dependent, targets) -> {
                    if (targets.contains(done)) {
                        pending.merge(dependent, -1, Integer::sum);
                    }
                });
            }
        }
        return batches;
    }

    // ========== Template references ==========

    private void analyzeAttributes(Node node, Map<String, InferredDependency> unique) {
        String source = displayNames.get(node);
        for (Attribute attribute : node.getAttributes()) {
            Optional<AttributeValue> value = attribute.getValue();
            if (value.isEmpty()) {
                continue;
            }
            for (String path : templateReferences(value.get())) {
                Node target = nodesByName.get(path.split("\\.", 2)[0]);
                if (target == null || target == node) {
                    continue;
                }
                add(unique, new InferredDependency(source, displayNames.get(target),
                        "reads " + attribute.getName(), path));
            }
        }
    }

    private static Set<String> templateReferences(AttributeValue value) {
        Set<String> paths = new LinkedHashSet<>();
        collectTemplateReferences(value, paths);
        return paths;
    }

    private static void collectTemplateReferences(AttributeValue value, Set<String> paths) {
        switch (value.kind()) {
            case PRIMITIVE -> paths.addAll(TemplateParser.referencePaths(((PrimitiveValue) value).getText()));
            case ARRAY -> ((ArrayValue) value).getValues().forEach(item -> collectTemplateReferences(item, paths));
            case OBJECT -> ((ObjectValue) value).getAttributes().forEach(attribute ->
                    attribute.getValue().ifPresent(nested -> collectTemplateReferences(nested, paths)));
        }
    }

    // ========== Edge guards ==========

    // Every segment's guard is charged to the edge's own sources, chained hops included.
    private void analyzeConditions(Edge edge, Map<String, InferredDependency> unique) {
        List<Node> sources = resolveAll(edge.getSources());
        for (EdgeSegment segment : edge.getSegments()) {
            Optional<EdgeCondition> condition = segment.getLabel().flatMap(EdgeConditionParser::extractRaw);
            if (condition.isPresent()) {
                String expression = condition.get().expression();
                for (String identifier : identifiers(expression)) {
                    Node target = resolveIdentifier(identifier);
                    if (target == null) {
                        continue;
                    }
                    for (Node source : sources) {
                        if (source != target) {
                            add(unique, new InferredDependency(displayNames.get(source), displayNames.get(target),
                                    "condition references " + identifier, expression));
                        }
                    }
                }
            }
        }
    }

    Set<String> identifiers(String expression) {
        Set<String> identifiers = new LinkedHashSet<>();
        Matcher matcher = (rootIdentifiersOnly ? ROOT_IDENTIFIER : IDENTIFIER).matcher(expression);
        while (matcher.find()) {
            String identifier = matcher.group(1);
            if (!reservedIdentifiers.contains(identifier)) {
                identifiers.add(identifier);
            }
        }
        return identifiers;
    }

    private Node resolveIdentifier(String identifier) {
        Node node = nodesByName.get(identifier);
        if (node != null) {
            return node;
        }
        List<Node> owners = attributeOwners.getOrDefault(identifier, List.of());
        if (owners.size() > 1) {
            logger.debug("Attribute '{}' is declared by {} nodes, ignoring it in guards", identifier, owners.size());
        }
        return owners.size() == 1 ? owners.get(0) : null;
    }

    private List<Node> resolveAll(List<Reference> references) {
        List<Node> nodes = new ArrayList<>();
        for (Reference reference : references) {
            Node node = reference.getResolved().orElseGet(() -> nodesByName.get(reference.getText()));
            if (node != null && displayNames.containsKey(node)) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    // ========== Helpers ==========

    private static void add(Map<String, InferredDependency> unique, InferredDependency dependency) {
        unique.putIfAbsent(dependency.key(), dependency);
    }

    private Map<String, Set<String>> adjacency() {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        for (InferredDependency dependency : inferDependencies()) {
            graph.computeIfAbsent(dependency.source(), name -> new LinkedHashSet<>()).add(dependency.target());
        }
        return graph;
    }

    private List<String> allNames() {
        List<String> names = new ArrayList<>();
        NodeWalker.walk(machine, (qualified, node) -> names.add(displayNames.get(node)));
        return names;
    }
}
