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
import dev.mars.dygram.ast.EdgeSegment;
import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.NodeWalker;
import dev.mars.dygram.ast.PrimitiveValue;
import dev.mars.dygram.ast.Reference;
import dev.mars.dygram.semantic.nodes.NodeTypeChecker;
import dev.mars.dygram.semantic.scope.MachineScopeProvider;
import dev.mars.dygram.semantic.scope.ReferenceProperty;
import dev.mars.dygram.semantic.scope.Scope;
import dev.mars.dygram.semantic.scope.ScopeEntry;
import dev.mars.dygram.validation.StructuralErrorCodes;
import dev.mars.dygram.validation.ValidationCategory;
import dev.mars.dygram.validation.ValidationContext;
import dev.mars.dygram.validation.ValidationError;
import dev.mars.dygram.validation.ValidationLocation;
import dev.mars.dygram.validation.ValidationSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves every edge endpoint of a machine to the node it denotes.
 *
 * <p>In lenient mode missing nodes are first materialized as placeholders, so linking always
 * succeeds. In strict mode nothing is created; each unresolved reference is recorded as an
 * ERROR diagnostic and listed in the {@link LinkResult}.</p>
 *
 * <p>Linking also gives every {@code note} node lacking a {@code target} attribute one that
 * points at the note itself.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class MachineLinker {

    private static final Logger logger = LoggerFactory.getLogger(MachineLinker.class);

    private final MachineScopeProvider scopeProvider;
    private final PlaceholderMaterializer materializer;

    public MachineLinker() {
        this(new MachineScopeProvider(), new PlaceholderMaterializer());
    }

    public MachineLinker(MachineScopeProvider scopeProvider, PlaceholderMaterializer materializer) {
        this.scopeProvider = Objects.requireNonNull(scopeProvider, "Scope provider cannot be null");
        this.materializer = Objects.requireNonNull(materializer, "Placeholder materializer cannot be null");
    }

    public LinkResult link(Machine machine, ValidationContext context) {
        return link(machine, context, machine.isStrictMode());
    }

    public LinkResult link(Machine machine, ValidationContext context, boolean strict) {
        Objects.requireNonNull(machine, "Machine cannot be null");
        Objects.requireNonNull(context, "Validation context cannot be null");

        synthesizeNoteTargets(machine);

        List<String> created = new ArrayList<>();
        if (!strict) {
            created.addAll(materializer.materialize(machine, context));
        }

        List<Edge> edges = new ArrayList<>();
        NodeWalker.forEachEdge(machine, edges::add);

        Scope scope = scopeProvider.getScope(machine, ReferenceProperty.SOURCE);
        List<String> unresolved = new ArrayList<>();
        int resolved = 0;

        for (Edge edge : edges) {
            for (Reference source : edge.getSources()) {
                scope = resolve(machine, scope, source, ReferenceProperty.SOURCE, strict, created, unresolved, context);
                if (source.isResolved()) {
                    resolved++;
                }
            }
            for (EdgeSegment segment : edge.getSegments()) {
                for (Reference target : segment.getTargets()) {
                    scope = resolve(machine, scope, target, ReferenceProperty.TARGET, strict, created, unresolved, context);
                    if (target.isResolved()) {
                        resolved++;
                    }
                }
            }
        }

        LinkResult result = new LinkResult(machine.getTitle(), resolved, created, unresolved);
        logger.info("Linked machine '{}': {}", machine.getTitle(), result);
        return result;
    }

    private Scope resolve(Machine machine, Scope scope, Reference reference, ReferenceProperty property,
                          boolean strict, List<String> created, List<String> unresolved, ValidationContext context) {
        Optional<ScopeEntry> entry = scope.resolve(reference.getText());
        if (entry.isPresent()) {
            reference.resolve(entry.get().getNode(), entry.get().getAttribute().orElse(null));
            return scope;
        }

        if (!strict) {
            logger.debug("Reference '{}' still unresolved after materialization, creating on demand", reference.getText());
            created.addAll(materializer.materialize(machine, reference.getText(), context));
            Scope refreshed = scopeProvider.getScope(machine, property);
            refreshed.resolve(reference.getText())
                    .ifPresent(e -> reference.resolve(e.getNode(), e.getAttribute().orElse(null)));
            return refreshed;
        }

        reference.unresolve();
        unresolved.add(reference.getText());
        context.addError(ValidationError.builder()
                .severity(ValidationSeverity.ERROR)
                .category(ValidationCategory.STRUCTURAL)
                .code(StructuralErrorCodes.UNRESOLVED_REFERENCE)
                .message("Could not resolve reference '" + reference.getText() + "'")
                .location(new ValidationLocation(null, property.name().toLowerCase(Locale.ROOT), -1, -1, null))
                .context("reference", reference.getText())
                .suggestion("Declare a node named '" + reference.getText() + "' or remove @StrictMode")
                .build());
        return scope;
    }

    private void synthesizeNoteTargets(Machine machine) {
        NodeWalker.walk(machine, (qualified, node) -> {
            boolean isNote = node.getType().filter(t -> t.equalsIgnoreCase(NodeTypeChecker.NOTE)).isPresent();
            if (isNote && !node.hasAttribute("target")) {
                node.getAttributes().add(Attribute.of("target", PrimitiveValue.quoted(qualified)));
                logger.debug("Note '{}' targets itself", qualified);
            }
        });
    }
}
