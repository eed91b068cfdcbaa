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

/**
 * A scalar value. The parser hands every scalar over as text; {@code quoted} records
 * whether the source wrote it as a string literal, so {@code "42"} stays a string
 * while {@code 42} is read as a number.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class PrimitiveValue implements AttributeValue {

    private final String text;
    private final boolean quoted;

    private PrimitiveValue(String text, boolean quoted) {
        this.text = Objects.requireNonNull(text, "Primitive text cannot be null");
        this.quoted = quoted;
    }

    public static PrimitiveValue quoted(String text) {
        return new PrimitiveValue(text, true);
    }

    public static PrimitiveValue literal(String text) {
        return new PrimitiveValue(text, false);
    }

    public static PrimitiveValue of(Number number) {
        return new PrimitiveValue(String.valueOf(number), false);
    }

    public static PrimitiveValue of(boolean flag) {
        return new PrimitiveValue(String.valueOf(flag), false);
    }

    public String getText() {
        return text;
    }

    public boolean isQuoted() {
        return quoted;
    }

    @Override
    public Kind kind() {
        return Kind.PRIMITIVE;
    }

    @Override
    public String asText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PrimitiveValue that = (PrimitiveValue) o;
        return quoted == that.quoted && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, quoted);
    }

    @Override
    public String toString() {
        return quoted ? "\"" + text + "\"" : text;
    }
}
