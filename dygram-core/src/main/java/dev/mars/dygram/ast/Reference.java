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

import java.util.Objects;
import java.util.Optional;

/**
 * An edge endpoint as written in the source, e.g. {@code start}, {@code team.lead}
 * or {@code config.retries}. Linking fills in the node it denotes and, for
 * attribute paths, the attribute name.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class Reference {

    private final String text;
    private Node resolved;
    private String attribute;

    public Reference(String text) {
        Objects.requireNonNull(text, "Reference text cannot be null");
        this.text = text.trim();
    }

    public String getText() {
        return text;
    }

    public Optional<Node> getResolved() {
        return Optional.ofNullable(resolved);
    }

    public Optional<String> getAttribute() {
        return Optional.ofNullable(attribute);
    }

    public boolean isResolved() {
        return resolved != null;
    }

    public void resolve(Node node, String attributeName) {
        this.resolved = Objects.requireNonNull(node, "Resolved node cannot be null");
        this.attribute = attributeName;
    }

    public void unresolve() {
        this.resolved = null;
        this.attribute = null;
    }

    @Override
    public String toString() {
        return text;
    }
}
