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

import dev.mars.dygram.ast.Edge;
import dev.mars.dygram.ast.EdgeSegment;
import dev.mars.dygram.ast.NodeContainer;
import dev.mars.dygram.ast.NodeWalker;
import dev.mars.dygram.ast.Reference;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single hop {@code source -> target}, with the label of the segment it came from.
 * Chained and fan-out edges are flattened into one hop per source/target pair.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class SimpleEdge {

    private final String source;
    private final String target;
    private final String label;

    public SimpleEdge(String source, String target, String label) {
        this.source = Objects.requireNonNull(source, "Source cannot be null");
        this.target = Objects.requireNonNull(target, "Target cannot be null");
        this.label = label;
    }

    public static SimpleEdge of(String source, String target) {
        return new SimpleEdge(source, target, null);
    }

    /**
     * Flattens every edge of the container and its nested nodes. Endpoints use the
     * resolved node's simple name when linked, otherwise the reference text.
     */
    public static List<SimpleEdge> flatten(NodeContainer container) {
        List<SimpleEdge> result = new ArrayList<>();
        NodeWalker.forEachEdge(container, edge -> result.addAll(flatten(edge)));
        return result;
    }

    public static List<SimpleEdge> flatten(Edge edge) {
        List<SimpleEdge> result = new ArrayList<>();
        List<Reference> sources = edge.getSources();
        for (EdgeSegment segment : edge.getSegments()) {
            String segmentLabel = segment.getLabel().orElse(null);
            for (Reference source : sources) {
                for (Reference target : segment.getTargets()) {
                    result.add(new SimpleEdge(nameOf(source), nameOf(target), segmentLabel));
                }
            }
            sources = segment.getTargets();
        }
        return result;
    }

    private static String nameOf(Reference reference) {
        return reference.getResolved().map(n -> n.getName()).orElse(reference.getText());
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public Optional<String> getLabel() {
        return Optional.ofNullable(label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SimpleEdge that = (SimpleEdge) o;
        return source.equals(that.source) && target.equals(that.target) && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, label);
    }

    @Override
    public String toString() {
        return source + (label != null ? " -" + label + "-> " : " -> ") + target;
    }
}
