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

/**
 * Root of a machine document: title, machine-level annotations, root nodes and root edges.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class Machine implements NodeContainer {

    public static final String STRICT_MODE_ANNOTATION = "StrictMode";

    private String title;
    private final List<Annotation> annotations = new ArrayList<>();
    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();

    public Machine() {
    }

    public Machine(String title) {
        this.title = title;
    }

    public static Builder builder(String title) {
        return new Builder(title);
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public boolean hasAnnotation(String name) {
        return annotations.stream().anyMatch(a -> a.getName().equals(name));
    }

    /**
     * Strict mode disables placeholder creation and lenient type merging.
     */
    public boolean isStrictMode() {
        return hasAnnotation(STRICT_MODE_ANNOTATION);
    }

    @Override
    public List<Node> getNodes() {
        return nodes;
    }

    @Override
    public List<Edge> getEdges() {
        return edges;
    }

    @Override
    public String toString() {
        return "Machine{" +
                "title='" + title + '\'' +
                ", nodes=" + nodes.size() +
                ", edges=" + edges.size() +
                ", strict=" + isStrictMode() +
                '}';
    }

    public static class Builder {
        private final Machine machine;

        private Builder(String title) {
            this.machine = new Machine(title);
        }

        public Builder annotation(String name) {
            machine.annotations.add(new Annotation(name));
            return this;
        }

        public Builder strict() {
            return annotation(STRICT_MODE_ANNOTATION);
        }

        public Builder node(Node node) {
            machine.nodes.add(node);
            return this;
        }

        public Builder node(String name) {
            machine.nodes.add(new Node(name));
            return this;
        }

        public Builder node(String name, String type) {
            machine.nodes.add(new Node(name, type));
            return this;
        }

        public Builder edge(Edge edge) {
            machine.edges.add(edge);
            return this;
        }

        public Builder edge(String source, String target) {
            machine.edges.add(Edge.of(source, target));
            return this;
        }

        public Machine build() {
            return machine;
        }
    }
}
