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
 * A named attribute of a node, optionally typed, optionally valued:
 * {@code retries<Integer>: 3;}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class Attribute {

    private final String name;
    private final TypeDef type;
    private final AttributeValue value;

    public Attribute(String name, TypeDef type, AttributeValue value) {
        this.name = Objects.requireNonNull(name, "Attribute name cannot be null");
        this.type = type;
        this.value = value;
    }

    public static Attribute of(String name, AttributeValue value) {
        return new Attribute(name, null, value);
    }

    public static Attribute of(String name, String quotedText) {
        return new Attribute(name, null, PrimitiveValue.quoted(quotedText));
    }

    public static Attribute typed(String name, String type, AttributeValue value) {
        return new Attribute(name, TypeDef.parse(type), value);
    }

    public String getName() {
        return name;
    }

    public Optional<TypeDef> getType() {
        return Optional.ofNullable(type);
    }

    public Optional<AttributeValue> getValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Attribute attribute = (Attribute) o;
        return name.equals(attribute.name)
                && Objects.equals(type, attribute.type)
                && Objects.equals(value, attribute.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, value);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        if (type != null) {
            sb.append('<').append(type).append('>');
        }
        if (value != null) {
            sb.append(": ").append(value);
        }
        return sb.toString();
    }
}
