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
import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.Node;
import dev.mars.dygram.ast.NodeContainer;
import dev.mars.dygram.ast.NodeWalker;
import dev.mars.dygram.ast.Reference;
import dev.mars.dygram.validation.StructuralErrorCodes;
import dev.mars.dygram.validation.ValidationCategory;
import dev.mars.dygram.validation.ValidationContext;
import dev.mars.dygram.validation.ValidationError;
import dev.mars.dygram.validation.ValidationSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Creates empty placeholder nodes for edge references that name nothing declared.
 *
 * <p>A reference is satisfied by a simple node name, a qualified path, or an attribute path
 * {@code <node>.<attribute>}. Any other reference gets a placeholder. Dotted references are
 * anchored at the longest prefix that names an existing node, and the remaining segments are
 * created beneath it, so {@code workflow.review} adds {@code review} under an existing
 * {@code workflow}. Every creation is recorded as an INFO diagnostic.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class PlaceholderMaterializer {

    private static final Logger logger = LoggerFactory.getLogger(PlaceholderMaterializer.class);

    /**
     * Materializes every missing reference of the machine.
     *
     * @return qualified names of the created nodes, in creation order
     */
    public List<String> materialize(Machine machine, ValidationContext context) {
        DeclaredNames declared = DeclaredNames.of(machine);
        List<Reference> references = new ArrayList<>();
        NodeWalker.forEachEdge(machine, edge -> edge.allReferences().forEach(references::add));

        List<String> created = new ArrayList<>();
        for (Reference reference : references) {
            String text = reference.getText();
            if (!declared.satisfies(text)) {
                created.addAll(create(machine, text, declared, context));
            }
        }

        if (!created.isEmpty()) {
            logger.info("Created {} placeholder node(s): {}", created.size(), created);
        }
        return created;
    }

    /**
     * Creates the placeholder for a single reference, as needed when resolution still fails
     * after {@link #materialize}.
     */
    public List<String> materialize(Machine machine, String referenceText, ValidationContext context) {
        DeclaredNames declared = DeclaredNames.of(machine);
        if (declared.satisfies(referenceText)) {
            return List.of();
        }
        return create(machine, referenceText, declared, context);
    }

    private List<String> create(Machine machine, String text, DeclaredNames declared, ValidationContext context) {
        String[] segments = text.split("\\.");
        NodeContainer container = machine;
        String path = null;
        int start = 0;

        for (int i = segments.length - 1; i >= 1; i--) {
            String prefix = String.join(".", Arrays.copyOfRange(segments, 0, i));
            Optional<Node> anchor = declared.node(prefix);
            if (anchor.isPresent()) {
                container = anchor.get();
                path = declared.qualifiedName(anchor.get());
                start = i;
                break;
            }
        }

        List<String> created = new ArrayList<>();
        for (int i = start; i < segments.length; i++) {
            String segment = segments[i];
            path = path == null ? segment : path + "." + segment;
            Optional<Node> existing = container.findChild(segment);
            if (existing.isPresent()) {
                container = existing.get();
                continue;
            }

            Node placeholder = Node.placeholder(segment);
            container.getNodes().add(placeholder);
            declared.add(placeholder, path);
            created.add(path);
            container = placeholder;

            context.addError(ValidationError.builder()
                    .severity(ValidationSeverity.INFO)
                    .category(ValidationCategory.STRUCTURAL)
                    .code(StructuralErrorCodes.PLACEHOLDER_CREATED)
                    .message("Node '" + path + "' was not declared; created an empty placeholder")
                    .node(segment)
                    .context("reference", text)
                    .context("qualifiedName", path)
                    .suggestion("Declare '" + path + "' explicitly, or enable @StrictMode to reject undeclared references")
                    .build());
            logger.debug("Created placeholder '{}' for reference '{}'", path, text);
        }
        return created;
    }

    /**
     * Names currently declared in a machine, updated as placeholders are added.
     */
    private static final class DeclaredNames {
        private final Map<String, Node> nodesByAlias = new HashMap<>();
        private final Map<Node, String> qualifiedNames = new IdentityHashMap<>();
        private final Set<String> attributePaths = new HashSet<>();

        static DeclaredNames of(Machine machine) {
            DeclaredNames names = new DeclaredNames();
            NodeWalker.walk(machine, (qualified, node) -> names.add(node, qualified));
            return names;
        }

        void add(Node node, String qualified) {
            qualifiedNames.put(node, qualified);
            nodesByAlias.putIfAbsent(node.getName(), node);
            nodesByAlias.putIfAbsent(qualified, node);
            for (Attribute attribute : node.getAttributes()) {
                attributePaths.add(node.getName() + "." + attribute.getName());
                attributePaths.add(qualified + "." + attribute.getName());
            }
        }

        boolean satisfies(String text) {
            return nodesByAlias.containsKey(text) || attributePaths.contains(text);
        }

        Optional<Node> node(String alias) {
            return Optional.ofNullable(nodesByAlias.get(alias));
        }

        String qualifiedName(Node node) {
            return qualifiedNames.get(node);
        }
    }
}
