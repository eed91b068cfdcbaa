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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of a machine: a state, task, context store, tool or any user-defined kind.
 *
 * <p>Nodes are mutable because name expansion and linking rewrite the tree in place.
 * Before expansion a name may be dotted ({@code team.lead}); afterwards no name
 * contains a dot and the qualified name follows from the node's position.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class Node implements NodeContainer {

    private String name;
    private String type;
    private String title;
    private boolean placeholder;
    private final List<Annotation> annotations = new ArrayList<>();
    private final List<Attribute> attributes = new ArrayList<>();
    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();

    public Node(String name) {
        this.name = Objects.requireNonNull(name, "Node name cannot be null");
    }

    public Node(String name, String type) {
        this(name);
        this.type = type;
    }

    /**
     * Creates an empty node standing in for a reference that had no declaration.
     */
    public static Node placeholder(String name) {
        Node node = new Node(name);
        node.placeholder = true;
        return node;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "Node name cannot be null");
    }

    public Optional<String> getType() {
        return Optional.ofNullable(type);
    }

    public void setType(String type) {
        this.type = type;
    }

    public Optional<String> getTitle() {
        return Optional.ofNullable(title);
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public boolean isPlaceholder() {
        return placeholder;
    }

    public boolean isQualified() {
        return name.indexOf('.') >= 0;
    }

    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public boolean hasAnnotation(String annotationName) {
        return annotations.stream().anyMatch(a -> a.getName().equals(annotationName));
    }

    public List<Attribute> getAttributes() {
        return attributes;
    }

    public Optional<Attribute> getAttribute(String attributeName) {
        return attributes.stream().filter(a -> a.getName().equals(attributeName)).findFirst();
    }

    public boolean hasAttribute(String attributeName) {
        return getAttribute(attributeName).isPresent();
    }

    /**
     * Replaces the attribute with the same name in place, or appends it.
     */
    public void putAttribute(Attribute attribute) {
        for (int i = 0; i < attributes.size(); i++) {
            if (attributes.get(i).getName().equals(attribute.getName())) {
                attributes.set(i, attribute);
                return;
            }
        }
        attributes.add(attribute);
    }

    @Override
    public List<Node> getNodes() {
        return nodes;
    }

    @Override
    public List<Edge> getEdges() {
        return edges;
    }

    public boolean isEmpty() {
        return type == null && title == null && annotations.isEmpty() && attributes.isEmpty()
                && nodes.isEmpty() && edges.isEmpty();
    }

    @Override
    public String toString() {
        return "Node{" +
                "name='" + name + '\'' +
                (type != null ? ", type='" + type + '\'' : "") +
                ", attributes=" + attributes.size() +
                ", children=" + nodes.size() +
                (placeholder ? ", placeholder" : "") +
                '}';
    }

    /**
     * Fluent construction, mostly for tests and definition readers.
     */
    public static class Builder {
        private final Node node;

        private Builder(String name) {
            this.node = new Node(name);
        }

        public Builder type(String type) {
            node.setType(type);
            return this;
        }

        public Builder title(String title) {
            node.setTitle(title);
            return this;
        }

        public Builder annotation(String name) {
            node.annotations.add(new Annotation(name));
            return this;
        }

        public Builder annotation(Annotation annotation) {
            node.annotations.add(annotation);
            return this;
        }

        public Builder attribute(Attribute attribute) {
            node.attributes.add(attribute);
            return this;
        }

        public Builder attribute(String name, String quotedText) {
            node.attributes.add(Attribute.of(name, quotedText));
            return this;
        }

        public Builder child(Node child) {
            node.nodes.add(child);
            return this;
        }

        public Builder edge(Edge edge) {
            node.edges.add(edge);
            return this;
        }

        public Node build() {
            return node;
        }
    }
}
