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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * An edge with one or more sources and an ordered list of segments. The sources of
 * segment {@code i + 1} are the targets of segment {@code i}, so {@code a -> b -> c}
 * is one edge with two segments.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class Edge {

    private final List<Reference> sources;
    private final List<EdgeSegment> segments;

    public Edge(List<Reference> sources, List<EdgeSegment> segments) {
        this.sources = List.copyOf(Objects.requireNonNull(sources, "Edge sources cannot be null"));
        this.segments = List.copyOf(Objects.requireNonNull(segments, "Edge segments cannot be null"));
    }

    public static Edge of(String source, String target) {
        return new Edge(references(source), List.of(EdgeSegment.to(target)));
    }

    public static Edge labelled(String source, String label, String target) {
        return new Edge(references(source), List.of(EdgeSegment.labelled(label, target)));
    }

    /**
     * Builds {@code first -> second -> ... -> last}.
     */
    public static Edge chain(String first, String... rest) {
        List<EdgeSegment> segments = new ArrayList<>();
        for (String target : rest) {
            segments.add(EdgeSegment.to(target));
        }
        return new Edge(references(first), segments);
    }

    static List<Reference> references(String... texts) {
        return Arrays.stream(texts).map(Reference::new).collect(Collectors.toList());
    }

    public List<Reference> getSources() {
        return sources;
    }

    public List<EdgeSegment> getSegments() {
        return segments;
    }

    /**
     * All references of this edge, sources first, then each segment's targets.
     */
    public Stream<Reference> allReferences() {
        return Stream.concat(sources.stream(), segments.stream().flatMap(s -> s.getTargets().stream()));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(sources.stream().map(Reference::getText).collect(Collectors.joining(", ")));
        for (EdgeSegment segment : segments) {
            sb.append(' ').append(segment.getLabel().map(l -> "-" + l + "->").orElse("->")).append(' ');
            sb.append(segment.getTargets().stream().map(Reference::getText).collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }
}
