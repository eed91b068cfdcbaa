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
import dev.mars.dygram.ast.AttributeValue;
import dev.mars.dygram.ast.Node;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Determines the effective type of a node, explicit or inferred, and a few behavioral traits
 * the executor relies on.
 *
 * <p>Inference applies these rules in order, the first match wins:</p>
 * <ol>
 *   <li>a {@code prompt} attribute makes a {@value #TASK}</li>
 *   <li>any of {@code input, output, parameters, schema, returns} makes a {@value #TOOL}</li>
 *   <li>a context-like name, or attributes none of which are behavioral, make a {@value #CONTEXT}</li>
 *   <li>with edges supplied: no incoming and at least one outgoing edge makes an {@value #INIT}</li>
 * </ol>
 * <p>Otherwise the type stays undefined; no fallback type is assumed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class NodeTypeChecker {

    public static final String TASK = "task";
    public static final String STATE = "state";
    public static final String CONTEXT = "context";
    public static final String INIT = "init";
    public static final String TOOL = "tool";
    public static final String NOTE = "note";

    private static final Set<String> CONTEXT_ALIASES =
            Set.of("data", "input", "output", "result", "entity", "resource");
    private static final Set<String> CONTEXT_LIKE_TYPES = Set.of("context", "concept", "input", "result");
    private static final List<String> TOOL_ATTRIBUTES =
            List.of("input", "output", "parameters", "schema", "returns");
    private static final Set<String> BEHAVIOR_ATTRIBUTES = Set.of("prompt", "meta", "condition", "action");
    private static final List<String> CONTEXT_NAME_FRAGMENTS =
            List.of("context", "output", "input", "data", "result", "config");

    private static final Pattern FIELD_LIST = Pattern.compile(
            "(?:write|read|store|update|set):\\s*([a-zA-Z0-9_,\\s]+)", Pattern.CASE_INSENSITIVE);

    private NodeTypeChecker() {
    }

    /**
     * Effective type: the explicit type, with data-like aliases folded into {@value #CONTEXT},
     * or the inferred type when none is declared.
     */
    public static Optional<String> getNodeType(Node node) {
        return getNodeType(node, null);
    }

    public static Optional<String> getNodeType(Node node, List<SimpleEdge> edges) {
        Optional<String> explicit = node.getType();
        if (explicit.isPresent()) {
            String type = explicit.get();
            if (CONTEXT_ALIASES.contains(type.toLowerCase(Locale.ROOT))) {
                return Optional.of(CONTEXT);
            }
            return Optional.of(type);
        }
        return inferType(node, edges);
    }

    public static Optional<String> inferType(Node node) {
        return inferType(node, null);
    }

    /**
     * Infers a type for an untyped node.
     *
     * @param edges flattened control edges of the machine, or null when unavailable;
     *              only the {@value #INIT} rule looks at them
     */
    public static Optional<String> inferType(Node node, List<SimpleEdge> edges) {
        if (node.hasAttribute("prompt")) {
            return Optional.of(TASK);
        }

        if (TOOL_ATTRIBUTES.stream().anyMatch(node::hasAttribute)) {
            return Optional.of(TOOL);
        }

        if (hasContextLikeName(node) || hasOnlyDataAttributes(node)) {
            return Optional.of(CONTEXT);
        }

        if (edges != null) {
            String name = node.getName();
            boolean hasIncoming = edges.stream().anyMatch(e -> e.getTarget().equals(name));
            boolean hasOutgoing = edges.stream().anyMatch(e -> e.getSource().equals(name));
            if (!hasIncoming && hasOutgoing) {
                return Optional.of(INIT);
            }
        }

        return Optional.empty();
    }

    public static boolean requiresAgentDecision(Node node) {
        return requiresAgentDecision(node, null, null);
    }

    public static boolean requiresAgentDecision(Node node, List<SimpleEdge> edges) {
        return requiresAgentDecision(node, edges, null);
    }

    /**
     * A task with a prompt always needs the agent; a state never does; anything else needs
     * it only when it branches over more than one non-automatic outgoing edge.
     *
     * @param autoChecker tells automatic edges apart, or null to count every edge
     */
    public static boolean requiresAgentDecision(Node node, List<SimpleEdge> edges, Predicate<SimpleEdge> autoChecker) {
        if (isTask(node) && node.hasAttribute("prompt")) {
            return true;
        }
        if (isState(node)) {
            return false;
        }
        if (edges == null) {
            return false;
        }

        long nonAutomatic = edges.stream()
                .filter(e -> e.getSource().equals(node.getName()))
                .filter(e -> autoChecker == null || !autoChecker.test(e))
                .count();
        return nonAutomatic > 1;
    }

    /**
     * True iff the {@code meta} attribute reads {@code true}, ignoring case and quotes.
     */
    public static boolean hasMeta(Node node) {
        return node.getAttribute("meta")
                .flatMap(Attribute::getValue)
                .map(AttributeValue::asText)
                .map(text -> text.trim().toLowerCase(Locale.ROOT))
                .filter("true"::equals)
                .isPresent();
    }

    public static boolean isState(Node node) {
        return hasExplicitType(node, STATE);
    }

    public static boolean isTask(Node node) {
        return hasExplicitType(node, TASK) || node.hasAttribute("prompt");
    }

    public static boolean isInit(Node node) {
        return hasExplicitType(node, INIT);
    }

    public static boolean isTool(Node node) {
        return hasExplicitType(node, TOOL);
    }

    /**
     * Looser than {@code getNodeType(node) == context}: also accepts concept-like explicit types
     * and data-like names regardless of the declared type.
     */
    public static boolean isContext(Node node) {
        Optional<String> type = node.getType().map(t -> t.toLowerCase(Locale.ROOT));
        if (type.isPresent() && CONTEXT_LIKE_TYPES.contains(type.get())) {
            return true;
        }
        if (getNodeType(node).filter(CONTEXT::equals).isPresent()) {
            return true;
        }
        String name = node.getName().toLowerCase(Locale.ROOT);
        return name.contains("context") || name.contains("output") || name.contains("input")
                || name.contains("data") || name.contains("result");
    }

    /**
     * An edge between a task and a context node, in either direction, models data access
     * rather than control flow. A task is never the context side, whatever its name.
     */
    public static boolean isContextAccessEdge(Node source, Node target) {
        boolean sourceTask = isTask(source);
        boolean targetTask = isTask(target);
        return sourceTask && !targetTask && isContext(target) || targetTask && !sourceTask && isContext(source);
    }

    /**
     * Reads access rights from an edge label. A label without any permission keyword grants read.
     */
    public static ContextPermissions extractPermissionsFromEdge(SimpleEdge edge) {
        String label = edge.getLabel().orElse("").toLowerCase(Locale.ROOT);

        boolean canRead = label.contains("read");
        boolean canWrite = label.contains("write") || label.contains("update") || label.contains("set");
        boolean canStore = label.contains("store") || label.contains("calculate");
        if (!canRead && !canWrite && !canStore) {
            canRead = true;
        }

        List<String> fields = new ArrayList<>();
        Matcher matcher = FIELD_LIST.matcher(label);
        if (matcher.find()) {
            fields = Arrays.stream(matcher.group(1).split(","))
                    .map(String::trim)
                    .filter(f -> !f.isEmpty())
                    .collect(Collectors.toList());
        }
        return new ContextPermissions(canRead, canWrite, canStore, fields);
    }

    public static boolean hasAnnotation(Node node, String annotationName) {
        return node.hasAnnotation(annotationName);
    }

    private static boolean hasExplicitType(Node node, String type) {
        return node.getType().filter(t -> t.equalsIgnoreCase(type)).isPresent();
    }

    private static boolean hasContextLikeName(Node node) {
        String name = node.getName().toLowerCase(Locale.ROOT);
        if (CONTEXT_NAME_FRAGMENTS.stream().anyMatch(name::contains)) {
            return true;
        }
        return name.contains("state") && !name.equals("state");
    }

    private static boolean hasOnlyDataAttributes(Node node) {
        List<Attribute> attributes = node.getAttributes();
        return !attributes.isEmpty()
                && attributes.stream().noneMatch(a -> BEHAVIOR_ATTRIBUTES.contains(a.getName()));
    }
}
