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
import java.util.stream.Collectors;

/**
 * An ordered list of values, written {@code [a, b, c]}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class ArrayValue implements AttributeValue {

    private final List<AttributeValue> values;

    public ArrayValue(List<AttributeValue> values) {
        this.values = List.copyOf(Objects.requireNonNull(values, "Array values cannot be null"));
    }

    public static ArrayValue of(AttributeValue... values) {
        return new ArrayValue(List.of(values));
    }

    public List<AttributeValue> getValues() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public Kind kind() {
        return Kind.ARRAY;
    }

    @Override
    public String asText() {
        return values.stream().map(AttributeValue::asText).collect(Collectors.joining(" "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((ArrayValue) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
