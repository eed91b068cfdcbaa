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

package dev.mars.dygram.semantic.types;

import dev.mars.dygram.ast.ArrayValue;
import dev.mars.dygram.ast.Attribute;
import dev.mars.dygram.ast.AttributeValue;
import dev.mars.dygram.ast.ObjectValue;
import dev.mars.dygram.ast.PrimitiveValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts attribute values into plain Java values for {@link TypeValidator}s.
 *
 * <p>Quoted scalars stay {@link String}s. Unquoted scalars become {@link BigDecimal} when
 * numeric ({@link Double} infinity or zero when the exponent is out of {@code BigDecimal} range),
 * {@link Boolean} for {@code true}/{@code false}, {@code null} for {@code null},
 * and text otherwise. Arrays become {@link List}s and objects insertion-ordered {@link Map}s;
 * object attributes without a value are left out.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class ValueExtractor {

    static final Pattern NUMBER = Pattern.compile("^-?[0-9]+(\\.[0-9]+)?([eE][+-]?[0-9]+)?$");

    private ValueExtractor() {
    }

    public static Object extract(AttributeValue value) {
        return switch (value.kind()) {
            case PRIMITIVE -> extractPrimitive((PrimitiveValue) value);
            case ARRAY -> extractArray((ArrayValue) value);
            case OBJECT -> extractObject((ObjectValue) value);
        };
    }

    private static List<Object> extractArray(ArrayValue value) {
        List<Object> list = new ArrayList<>();
        for (AttributeValue element : value.getValues()) {
            list.add(extract(element));
        }
        return list;
    }

    private static Map<String, Object> extractObject(ObjectValue value) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Attribute attribute : value.getAttributes()) {
            attribute.getValue().ifPresent(v -> map.put(attribute.getName(), extract(v)));
        }
        return map;
    }

    private static Object extractPrimitive(PrimitiveValue value) {
        String text = value.getText();
        if (value.isQuoted()) {
            return text;
        }
        if (NUMBER.matcher(text).matches()) {
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                return Double.valueOf(text);
            }
        }
        if ("true".equals(text) || "false".equals(text)) {
            return Boolean.valueOf(text);
        }
        if ("null".equals(text)) {
            return null;
        }
        return text;
    }

    /**
     * Name of the runtime shape of an extracted value, as used in messages.
     */
    public static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof List) {
            return "array";
        }
        if (value instanceof Map) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }
}
