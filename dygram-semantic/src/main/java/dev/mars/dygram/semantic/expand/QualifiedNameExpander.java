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

package dev.mars.dygram.semantic.expand;

import dev.mars.dygram.ast.Annotation;
import dev.mars.dygram.ast.Attribute;
import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.Node;
import dev.mars.dygram.ast.NodeContainer;
import dev.mars.dygram.core.exceptions.MachineStructureException;
import dev.mars.dygram.validation.SemanticErrorCodes;
import dev.mars.dygram.validation.ValidationCategory;
import dev.mars.dygram.validation.ValidationContext;
import dev.mars.dygram.validation.ValidationError;
import dev.mars.dygram.validation.ValidationSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rewrites dotted node declarations into nested structure.
 *
 * <p>A declaration {@code team.lead.assistant} becomes {@code team > lead > assistant}. Missing
 * intermediate nodes are created; existing ones are reused. When the final segment names a node
 * that already exists at that level, the two declarations are merged:</p>
 * <ul>
 *   <li>title: the merged declaration's title replaces the existing one when present</li>
 *   <li>type: adopted when the existing node has none; on conflict the merged type wins,
 *       unless the machine is strict, in which case the existing type is kept and an error
 *       is recorded</li>
 *   <li>annotations: added unless one with the same name is already present</li>
 *   <li>attributes: replaced by name, the merged declaration wins</li>
 *   <li>child nodes: merged recursively by name</li>
 *   <li>edges: appended</li>
 * </ul>
 * <p>Dotted declarations are handled from the last to the first in each sibling list, so for
 * two declarations of the same path the earlier one is merged last. Created intermediates and
 * relocated leaves are appended to their container. Expansion is idempotent: an expanded tree
 * contains no dotted names.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class QualifiedNameExpander {

    private static final Logger logger = LoggerFactory.getLogger(QualifiedNameExpander.class);

    /**
     * Expands the machine in place, strict iff it carries {@code @StrictMode}.
     */
    public ExpansionResult expand(Machine machine, ValidationContext context) throws MachineStructureException {
        return expand(machine, context, machine.isStrictMode());
    }

    public ExpansionResult expand(Machine machine, ValidationContext context, boolean strict)
            throws MachineStructureException {
        Objects.requireNonNull(machine, "Machine cannot be null");
        Objects.requireNonNull(context, "Validation context cannot be null");

        Expansion expansion = new Expansion(context, strict);
        expansion.expandContainer(machine, null);

        logger.debug("Expanded {} qualified declaration(s), created {} intermediate node(s), merged {}",
                expansion.expanded, expansion.created, expansion.merged);
        return new ExpansionResult(expansion.expanded, expansion.created, expansion.merged);
    }

    /**
     * Counts of what one expansion pass did.
     */
    public record ExpansionResult(int expandedDeclarations, int createdIntermediates, int mergedDeclarations) {

        public boolean changedTree() {
            return expandedDeclarations > 0;
        }
    }

    private static final class Expansion {
        private final ValidationContext context;
        private final boolean strict;
        private int expanded;
        private int created;
        private int merged;

        private Expansion(ValidationContext context, boolean strict) {
            this.context = context;
            this.strict = strict;
        }

        private void expandContainer(NodeContainer container, String prefix) throws MachineStructureException {
            List<Node> nodes = container.getNodes();

            List<Integer> qualified = new ArrayList<>();
            for (int i = 0; i < nodes.size(); i++) {
                if (nodes.get(i).isQualified()) {
                    qualified.add(i);
                }
            }

            // Highest index first; new nodes are appended, so lower indices stay valid.
            for (int q = qualified.size() - 1; q >= 0; q--) {
                int index = qualified.get(q);
                Node node = nodes.remove(index);
                expandNode(container, node, prefix);
                expanded++;
            }

            for (Node child : new ArrayList<>(nodes)) {
                expandContainer(child, qualify(prefix, child.getName()));
            }
        }

        private void expandNode(NodeContainer container, Node node, String prefix) throws MachineStructureException {
            String[] segments = split(node.getName(), prefix);
            String leafType = node.getType().orElse(null);

            NodeContainer current = container;
            String path = prefix;
            for (int s = 0; s < segments.length - 1; s++) {
                String segment = segments[s];
                path = qualify(path, segment);
                Optional<Node> existing = current.findChild(segment);
                Node intermediate;
                if (existing.isPresent()) {
                    intermediate = existing.get();
                    if (intermediate.getType().isEmpty() && leafType != null) {
                        intermediate.setType(leafType);
                    }
                } else {
                    intermediate = new Node(segment, leafType);
                    current.getNodes().add(intermediate);
                    created++;
                    logger.trace("Created intermediate node '{}'", path);
                }
                current = intermediate;
            }

            String leaf = segments[segments.length - 1];
            Optional<Node> existingLeaf = current.findChild(leaf);
            if (existingLeaf.isPresent()) {
                merge(existingLeaf.get(), node, qualify(path, leaf));
                merged++;
            } else {
                node.setName(leaf);
                current.getNodes().add(node);
            }
        }

        private void merge(Node existing, Node incoming, String path) {
            incoming.getTitle().ifPresent(existing::setTitle);

            Optional<String> incomingType = incoming.getType();
            if (incomingType.isPresent()) {
                Optional<String> existingType = existing.getType();
                if (existingType.isEmpty()) {
                    existing.setType(incomingType.get());
                } else if (!existingType.get().equals(incomingType.get())) {
                    reportTypeConflict(existing, path, existingType.get(), incomingType.get());
                    if (!strict) {
                        existing.setType(incomingType.get());
                    }
                }
            }

            for (Annotation annotation : incoming.getAnnotations()) {
                if (!existing.hasAnnotation(annotation.getName())) {
                    existing.getAnnotations().add(annotation);
                }
            }

            for (Attribute attribute : incoming.getAttributes()) {
                existing.putAttribute(attribute);
            }

            for (Node child : incoming.getNodes()) {
                Optional<Node> match = existing.findChild(child.getName());
                if (match.isPresent()) {
                    merge(match.get(), child, qualify(path, child.getName()));
                } else {
                    existing.getNodes().add(child);
                }
            }

            existing.getEdges().addAll(incoming.getEdges());
        }

        private void reportTypeConflict(Node existing, String path, String existingType, String incomingType) {
            String message = strict
                    ? "Conflicting types for '" + path + "': keeping '" + existingType
                        + "', declaration as '" + incomingType + "' is not allowed in strict mode"
                    : "Conflicting types for '" + path + "': '" + incomingType + "' replaces '" + existingType + "'";

            context.addError(ValidationError.builder()
                    .severity(strict ? ValidationSeverity.ERROR : ValidationSeverity.WARNING)
                    .category(ValidationCategory.SEMANTIC)
                    .code(SemanticErrorCodes.INVALID_NODE_TYPE)
                    .message(message)
                    .node(existing.getName())
                    .expected(existingType)
                    .actual(incomingType)
                    .context("qualifiedName", path)
                    .suggestion("Declare '" + path + "' with a single type")
                    .build());
        }

        private static String[] split(String name, String prefix) throws MachineStructureException {
            String[] segments = name.split("\\.", -1);
            for (String segment : segments) {
                if (segment.isBlank()) {
                    throw new MachineStructureException("Invalid qualified name '" + qualify(prefix, name)
                            + "': empty path segment");
                }
            }
            return segments;
        }

        private static String qualify(String prefix, String name) {
            return prefix == null ? name : prefix + "." + name;
        }
    }
}
