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

import dev.mars.dygram.ast.Attribute;
import dev.mars.dygram.ast.Node;
import dev.mars.dygram.ast.PrimitiveValue;
import dev.mars.dygram.ast.TypeDef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Description for TypeRegistryTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-21
 */
class TypeRegistryTest {

    private TypeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TypeRegistry();
    }

    @Test
    void testBuiltInTypesAreRegistered() {
        for (String type : List.of("string", "number", "boolean", "Date", "UUID", "URL", "Duration",
                "Integer", "Float", "Array", "List", "Map", "Record", "Promise", "Result", "any")) {
            assertTrue(registry.has(type), type);
        }
        assertFalse(registry.has("Person"));
    }

    @Test
    void testPrimitiveTypes() {
        assertTrue(registry.validate("string", "text").valid());
        assertTrue(registry.validate("number", new BigDecimal("1.5")).valid());
        assertTrue(registry.validate("boolean", Boolean.TRUE).valid());

        TypeValidationResult result = registry.validate("number", "1.5");
        assertFalse(result.valid());
        assertEquals("Expected number, received string", result.describe());
    }

    @Test
    void testUnregisteredTypeIsAccepted() {
        assertTrue(registry.validate("Whatever", 42).valid());
    }

    // ========== Semantic string types ==========

    @Test
    void testDate() {
        assertTrue(registry.validate("Date", "2025-08-21T10:15:30Z").valid());
        assertTrue(registry.validate("Date", "2025-08-21T10:15:30.125Z").valid());
        assertFalse(registry.validate("Date", "2025-08-21T10:15:30+02:00").valid());
        assertFalse(registry.validate("Date", "2025-08-21T10:15Z").valid());
        assertFalse(registry.validate("Date", "2025-13-21T10:15:30Z").valid());
        assertFalse(registry.validate("Date", "2025-08-21").valid());
        assertFalse(registry.validate("Date", "yesterday").valid());
    }

    @Test
    void testUuid() {
        assertTrue(registry.validate("UUID", "123e4567-e89b-12d3-a456-426614174000").valid());
        assertFalse(registry.validate("UUID", "123e4567").valid());
    }

    @Test
    void testUrl() {
        assertTrue(registry.validate("URL", "https://example.com/api").valid());
        assertFalse(registry.validate("URL", "relative/path").valid());
        assertFalse(registry.validate("URL", "not a url").valid());
    }

    @Test
    void testDuration() {
        for (String duration : List.of("PT4H5M", "P1Y2M3D", "PT0.5S", "30s", "5min", "2h", "3d")) {
            assertTrue(registry.validate("Duration", duration).valid(), duration);
        }
        assertFalse(registry.validate("Duration", "soon").valid());
        assertFalse(registry.validate("Duration", 30).valid());
    }

    @Test
    void testInteger() {
        assertTrue(registry.validate("Integer", new BigDecimal("3")).valid());
        assertTrue(registry.validate("Integer", new BigDecimal("3.0")).valid());
        assertTrue(registry.validate("Integer", 7L).valid());
        assertFalse(registry.validate("Integer", new BigDecimal("3.5")).valid());
        assertEquals("Expected number, received string", registry.validate("Integer", "3").describe());
    }

    // ========== Generics ==========

    @Test
    void testArrayElementsAreChecked() {
        assertTrue(registry.validateGenericType("Array", List.of("number"),
                List.of(BigDecimal.ONE, BigDecimal.TEN)).valid());

        TypeValidationResult result = registry.validateGenericType("Array", List.of("number"),
                List.of(BigDecimal.ONE, "two"));
        assertFalse(result.valid());
        assertEquals("[1]: Expected number, received string", result.describe());
    }

    @Test
    void testArrayRejectsNonList() {
        TypeValidationResult result = registry.validateGenericType("List", List.of("string"), "single");

        assertFalse(result.valid());
        assertEquals("Expected array, received string", result.describe());
    }

    @Test
    void testMapValuesAreChecked() {
        assertTrue(registry.validateGenericType("Map", List.of("string", "boolean"), Map.of("a", true)).valid());

        TypeValidationResult result = registry.validateGenericType("Record", List.of("string", "boolean"),
                Map.of("enabled", "yes"));
        assertFalse(result.valid());
        assertEquals(".enabled", result.path());
    }

    @Test
    void testNestedGenerics() {
        TypeValidator validator = registry.validatorFor(TypeDef.parse("Array<Array<Integer>>"));

        assertTrue(validator.validate(List.of(List.of(BigDecimal.ONE))).valid());
        TypeValidationResult result = validator.validate(List.of(List.of(BigDecimal.ONE, new BigDecimal("1.5"))));
        assertFalse(result.valid());
        assertEquals("[0][1]", result.path());
    }

    @Test
    void testUnknownElementTypeAcceptsAnything() {
        assertTrue(registry.validateGenericType("Array", List.of("Mystery"), List.of(1, "a")).valid());
        assertTrue(registry.validateGenericType("Promise", List.of("string"), 5).valid());
    }

    @Test
    void testLiteralUnionValidator() {
        TypeValidator validator = registry.validatorFor(TypeDef.parse("'low' | 'high'"));

        assertTrue(validator.validate("low").valid());
        assertFalse(validator.validate("medium").valid());
    }

    // ========== Node types ==========

    @Test
    void testNodeTypeChecksTypedFields() {
        Node person = Node.builder("Person")
                .attribute(Attribute.typed("name", "string", PrimitiveValue.quoted("")))
                .attribute(Attribute.typed("age", "Integer?", null))
                .attribute(Attribute.of("notes", "anything"))
                .build();

        assertTrue(registry.registerNodeType(person));
        assertTrue(registry.isNodeType("Person"));
        assertSame(person, registry.getNodeType("Person").orElseThrow());

        assertTrue(registry.validate("Person", Map.of("name", "Ada")).valid());
        assertTrue(registry.validate("Person", Map.of("name", "Ada", "age", BigDecimal.TEN)).valid());

        TypeValidationResult missing = registry.validate("Person", Map.of("age", BigDecimal.ONE));
        assertEquals(".name: Required", missing.describe());

        TypeValidationResult wrong = registry.validate("Person", Map.of("name", BigDecimal.ONE));
        assertEquals(".name", wrong.path());

        assertFalse(registry.validate("Person", "Ada").valid());
    }

    @Test
    void testNodeCannotShadowBuiltIn() {
        assertFalse(registry.registerNodeType(new Node("string")));
        assertFalse(registry.isNodeType("string"));
        assertTrue(registry.validate("string", "still a string").valid());
    }

    @Test
    void testCustomValidator() {
        registry.register("Even", value -> value instanceof Number && ((Number) value).intValue() % 2 == 0
                ? TypeValidationResult.ok()
                : TypeValidationResult.fail("Must be even"));

        assertTrue(registry.getRegisteredTypes().contains("Even"));
        assertTrue(registry.validate("Even", 4).valid());
        assertEquals("Must be even", registry.validate("Even", 3).describe());
    }
}
