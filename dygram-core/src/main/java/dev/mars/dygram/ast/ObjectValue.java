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
import java.util.stream.Collectors;

/**
 * A nested block of attributes, written {@code { key: value; }}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class ObjectValue implements AttributeValue {

    private final List<Attribute> attributes;

    public ObjectValue(List<Attribute> attributes) {
        this.attributes = List.copyOf(Objects.requireNonNull(attributes, "Object attributes cannot be null"));
    }

    public static ObjectValue of(Attribute... attributes) {
        return new ObjectValue(List.of(attributes));
    }

    public List<Attribute> getAttributes() {
        return attributes;
    }

    public Optional<Attribute> getAttribute(String name) {
        return attributes.stream().filter(a -> a.getName().equals(name)).findFirst();
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    @Override
    public Kind kind() {
        return Kind.OBJECT;
    }

    @Override
    public String asText() {
        return attributes.stream()
                .map(Attribute::getValue)
                .flatMap(Optional::stream)
                .map(AttributeValue::asText)
                .collect(Collectors.joining(" "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return attributes.equals(((ObjectValue) o).attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return attributes.stream().map(Object::toString).collect(Collectors.joining("; ", "{ ", " }"));
    }
}
