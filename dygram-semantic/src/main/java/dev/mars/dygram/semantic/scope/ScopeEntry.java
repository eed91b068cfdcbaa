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

import dev.mars.dygram.ast.Node;

import java.util.Objects;
import java.util.Optional;

/**
 * One alias under which a node, or one of its attributes, can be referenced.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class ScopeEntry {

    private final String alias;
    private final Node node;
    private final String qualifiedName;
    private final String attribute;

    public ScopeEntry(String alias, Node node, String qualifiedName, String attribute) {
        this.alias = Objects.requireNonNull(alias, "Alias cannot be null");
        this.node = Objects.requireNonNull(node, "Node cannot be null");
        this.qualifiedName = Objects.requireNonNull(qualifiedName, "Qualified name cannot be null");
        this.attribute = attribute;
    }

    public String getAlias() {
        return alias;
    }

    public Node getNode() {
        return node;
    }

    public String getQualifiedName() {
        return qualifiedName;
    }

    /**
     * The attribute this alias points into, for {@code node.attr} aliases.
     */
    public Optional<String> getAttribute() {
        return Optional.ofNullable(attribute);
    }

    public boolean isAttributeReference() {
        return attribute != null;
    }

    @Override
    public String toString() {
        return alias + " -> " + qualifiedName + (attribute != null ? "#" + attribute : "");
    }
}
