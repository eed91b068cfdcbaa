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
import java.util.stream.Collectors;

/**
 * Declared type of an attribute.
 *
 * <p>Either a named type with optional generic parameters ({@code Map<string, Array<number>>}),
 * or a union of string literals ({@code 'low' | 'high'}). Both forms may carry the
 * optional marker {@code ?}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class TypeDef {

    private final String base;
    private final List<TypeDef> generics;
    private final List<String> literals;
    private final boolean optional;

    private TypeDef(String base, List<TypeDef> generics, List<String> literals, boolean optional) {
        this.base = base;
        this.generics = List.copyOf(generics);
        this.literals = List.copyOf(literals);
        this.optional = optional;
    }

    public static TypeDef of(String base) {
        return new TypeDef(requireBase(base), List.of(), List.of(), false);
    }

    public static TypeDef generic(String base, TypeDef... parameters) {
        return new TypeDef(requireBase(base), List.of(parameters), List.of(), false);
    }

    public static TypeDef literalUnion(String... literals) {
        if (literals.length == 0) {
            throw new IllegalArgumentException("Literal union needs at least one member");
        }
        return new TypeDef(null, List.of(), List.of(literals), false);
    }

    /**
     * Parses the surface form of a type, e.g. {@code Array<Date>?} or {@code 'a' | 'b'}.
     *
     * @throws IllegalArgumentException if the text is blank or its angle brackets do not balance
     */
    public static TypeDef parse(String text) {
        Objects.requireNonNull(text, "Type text cannot be null");
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Type text cannot be blank");
        }

        boolean optional = trimmed.endsWith("?");
        if (optional) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }

        if (trimmed.startsWith("'") || trimmed.startsWith("\"")) {
            List<String> members = new ArrayList<>();
            for (String part : trimmed.split("\\|")) {
                members.add(stripQuotes(part.trim()));
            }
            return new TypeDef(null, List.of(), members, optional);
        }

        int open = trimmed.indexOf('<');
        if (open < 0) {
            return new TypeDef(trimmed, List.of(), List.of(), optional);
        }
        if (!trimmed.endsWith(">")) {
            throw new IllegalArgumentException("Unbalanced generic type: " + text);
        }

        String base = trimmed.substring(0, open).trim();
        List<TypeDef> params = new ArrayList<>();
        for (String param : splitTopLevel(trimmed.substring(open + 1, trimmed.length() - 1), text)) {
            params.add(parse(param));
        }
        return new TypeDef(requireBase(base), params, List.of(), optional);
    }

    public String getBase() {
        return base;
    }

    public List<TypeDef> getGenerics() {
        return generics;
    }

    public List<String> getLiterals() {
        return literals;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isLiteralUnion() {
        return !literals.isEmpty();
    }

    public boolean isGeneric() {
        return !generics.isEmpty();
    }

    public TypeDef asOptional() {
        return new TypeDef(base, generics, literals, true);
    }

    private static String requireBase(String base) {
        Objects.requireNonNull(base, "Type base cannot be null");
        if (base.isBlank()) {
            throw new IllegalArgumentException("Type base cannot be blank");
        }
        return base;
    }

    private static String stripQuotes(String part) {
        if (part.length() >= 2
                && (part.startsWith("'") && part.endsWith("'") || part.startsWith("\"") && part.endsWith("\""))) {
            return part.substring(1, part.length() - 1);
        }
        return part;
    }

    private static List<String> splitTopLevel(String params, String original) {
        List<String> result = new ArrayList<>();
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (char c : params.toCharArray()) {
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
                if (depth < 0) {
                    throw new IllegalArgumentException("Unbalanced generic type: " + original);
                }
            } else if (c == ',' && depth == 0) {
                result.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (depth != 0) {
            throw new IllegalArgumentException("Unbalanced generic type: " + original);
        }
        if (current.length() > 0) {
            result.add(current.toString().trim());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeDef typeDef = (TypeDef) o;
        return optional == typeDef.optional
                && Objects.equals(base, typeDef.base)
                && generics.equals(typeDef.generics)
                && literals.equals(typeDef.literals);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, generics, literals, optional);
    }

    /**
     * Renders the type back to its surface form; {@code parse(t.toString())} yields an equal type.
     */
    @Override
    public String toString() {
        String rendered;
        if (isLiteralUnion()) {
            rendered = literals.stream().map(l -> "'" + l + "'").collect(Collectors.joining(" | "));
        } else if (isGeneric()) {
            rendered = base + generics.stream().map(TypeDef::toString).collect(Collectors.joining(", ", "<", ">"));
        } else {
            rendered = base;
        }
        return optional ? rendered + "?" : rendered;
    }
}
