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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One hop of an edge: its target references and the optional label written on the arrow,
 * which may carry a condition such as {@code when: "retries < 3"}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class EdgeSegment {

    private final List<Reference> targets;
    private final String label;

    public EdgeSegment(List<Reference> targets, String label) {
        this.targets = List.copyOf(Objects.requireNonNull(targets, "Segment targets cannot be null"));
        this.label = label;
    }

    public static EdgeSegment to(String... targets) {
        return new EdgeSegment(Edge.references(targets), null);
    }

    public static EdgeSegment labelled(String label, String... targets) {
        return new EdgeSegment(Edge.references(targets), label);
    }

    public List<Reference> getTargets() {
        return targets;
    }

    public Optional<String> getLabel() {
        return Optional.ofNullable(label);
    }

    @Override
    public String toString() {
        return (label != null ? "-" + label + "-> " : "-> ") + targets;
    }
}
