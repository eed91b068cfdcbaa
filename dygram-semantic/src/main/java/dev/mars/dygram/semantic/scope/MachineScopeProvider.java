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

package dev.mars.dygram.semantic.scope;

import dev.mars.dygram.ast.Attribute;
import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.NodeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes the names a reference may use to denote a node.
 *
 * <p>For edge endpoints every node of the machine is visible, regardless of nesting, under
 * its simple name, its qualified path, and {@code <alias>.<attribute>} for each of its
 * attributes. Nodes are visited depth-first in document order and the first node to claim
 * an alias keeps it. Other reference kinds see simple node names only.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class MachineScopeProvider {

    private static final Logger logger = LoggerFactory.getLogger(MachineScopeProvider.class);

    public Scope getScope(Machine machine, ReferenceProperty property) {
        Objects.requireNonNull(machine, "Machine cannot be null");
        Objects.requireNonNull(property, "Reference property cannot be null");

        return property.isEdgeEndpoint() ? buildEndpointScope(machine) : buildDefaultScope(machine);
    }

    private Scope buildEndpointScope(Machine machine) {
        Scope scope = new Scope();
        int[] shadowed = {0};

        NodeWalker.walk(machine, (qualified, node) -> {
            List<String> aliases = new ArrayList<>();
            aliases.add(node.getName());
            if (!qualified.equals(node.getName())) {
                aliases.add(qualified);
            }

            for (String alias : aliases) {
                if (!scope.register(new ScopeEntry(alias, node, qualified, null))) {
                    shadowed[0]++;
                    logger.debug("Alias '{}' for node '{}' is already taken", alias, qualified);
                }
            }
            for (Attribute attribute : node.getAttributes()) {
                for (String alias : aliases) {
                    scope.register(new ScopeEntry(alias + "." + attribute.getName(), node, qualified, attribute.getName()));
                }
            }
        });

        logger.debug("Built endpoint scope with {} aliases ({} shadowed)", scope.size(), shadowed[0]);
        return scope;
    }

    private Scope buildDefaultScope(Machine machine) {
        Scope scope = new Scope();
        NodeWalker.walk(machine, (qualified, node) ->
                scope.register(new ScopeEntry(node.getName(), node, qualified, null)));
        return scope;
    }
}
