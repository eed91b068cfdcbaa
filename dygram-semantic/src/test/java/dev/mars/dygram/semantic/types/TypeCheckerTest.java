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
import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.Node;
import dev.mars.dygram.ast.ObjectValue;
import dev.mars.dygram.ast.PrimitiveValue;
import dev.mars.dygram.core.exceptions.TypeInferenceException;
import dev.mars.dygram.validation.TypeErrorCodes;
import dev.mars.dygram.validation.ValidationCategory;
import dev.mars.dygram.validation.ValidationContext;
import dev.mars.dygram.validation.ValidationError;
import dev.mars.dygram.validation.ValidationSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for attribute type checking, type inference and template references.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-21
 */
class TypeCheckerTest {

    private Machine machine;
    private TypeChecker checker;

    @BeforeEach
    void setUp() {
        machine = Machine.builder("Types")
                .node(Node.builder("config")
                        .attribute("apiKey", "secret")
                        .attribute(Attribute.typed("timeout", "Integer", PrimitiveValue.of(30)))
                        .attribute(Attribute.of("regions", ArrayValue.of()))
                        .build())
                .node(Node.builder("Person")
                        .attribute(Attribute.typed("name", "string", PrimitiveValue.quoted("nobody")))
                        .build())
                .build();
        checker = new TypeChecker(machine);
    }

    // ========== Parsing ==========

    @Test
    void testParseType() {
        TypeInfo info = checker.parseType("Map<string, Array<number>>?");

        assertEquals("Map", info.baseType());
        assertEquals(List.of("string", "Array<number>"), info.genericParams());
        assertTrue(info.optional());
        assertTrue(info.isGeneric());
        assertFalse(checker.parseType("string").isGeneric());
    }

    @Test
    void testValidateGenericTypeSyntax() {
        assertTrue(checker.validateGenericType("Array<Map<string, number>>").isValid());

        TypeCheckResult result = checker.validateGenericType("Array<string");
        assertFalse(result.isValid());
        assertEquals(TypeErrorCodes.INVALID_GENERIC, result.getCode().orElseThrow());
    }

    // ========== Inference ==========

    @Test
    void testInferPrimitiveTypes() throws TypeInferenceException {
        assertEquals("string", checker.inferType(PrimitiveValue.quoted("42")));
        assertEquals("number", checker.inferType(PrimitiveValue.of(42)));
        assertEquals("number", checker.inferType(PrimitiveValue.literal("-1.5e3")));
        assertEquals("boolean", checker.inferType(PrimitiveValue.of(false)));
        assertEquals("null", checker.inferType(PrimitiveValue.literal("null")));
        assertEquals("string", checker.inferType(PrimitiveValue.literal("pending")));
        assertEquals(TypeChecker.UNDEFINED, checker.inferType(null));
    }

    @Test
    void testInferCollectionTypes() throws TypeInferenceException {
        assertEquals("Array<number>", checker.inferType(ArrayValue.of(PrimitiveValue.of(1), PrimitiveValue.of(2))));
        assertEquals("Array<any>", checker.inferType(ArrayValue.of(PrimitiveValue.of(1), PrimitiveValue.quoted("a"))));
        assertEquals("Object", checker.inferType(ObjectValue.of()));
        assertEquals("Record<string, any>", checker.inferType(ObjectValue.of(Attribute.of("a", "b"))));
    }

    @Test
    void testInferEmptyArrayFails() {
        assertThrows(TypeInferenceException.class, () -> checker.inferType(ArrayValue.of()));
    }

    // ========== Compatibility ==========

    @Test
    void testTypeCompatibility() {
        assertTrue(checker.areTypesCompatible("any", "number").isValid());
        assertTrue(checker.areTypesCompatible("Integer", "number").isValid());
        assertTrue(checker.areTypesCompatible("URL", "string").isValid());
        assertTrue(checker.areTypesCompatible("Array<Date>", "Array<string>").isValid());
        assertFalse(checker.areTypesCompatible("Array<number>", "Array<string>").isValid());
        assertFalse(checker.areTypesCompatible("Map<string, number>", "Map<string>").isValid());

        TypeCheckResult result = checker.areTypesCompatible("boolean", "string");
        assertFalse(result.isValid());
        assertEquals("boolean", result.getExpectedType().orElseThrow());
        assertEquals("string", result.getActualType().orElseThrow());
        assertEquals(TypeErrorCodes.TYPE_MISMATCH, result.getCode().orElseThrow());
    }

    // ========== Attribute validation ==========

    @Test
    void testUntypedAttributeIsValid() {
        assertTrue(checker.validateAttributeType(Attribute.of("anything", PrimitiveValue.of(1))).isValid());
    }

    @Test
    void testMissingValue() {
        TypeCheckResult required = checker.validateAttributeType(Attribute.typed("count", "number", null));
        assertFalse(required.isValid());
        assertEquals(TypeErrorCodes.MISSING_VALUE, required.getCode().orElseThrow());
        assertEquals(TypeChecker.UNDEFINED, required.getActualType().orElseThrow());

        assertTrue(checker.validateAttributeType(Attribute.typed("count", "number?", null)).isValid());
        assertTrue(checker.validateAttributeType(
                Attribute.typed("count", "number?", PrimitiveValue.literal("null"))).isValid());
        assertFalse(checker.validateAttributeType(
                Attribute.typed("count", "number", PrimitiveValue.literal("null"))).isValid());
    }

    @Test
    void testIntegerRejectsText() {
        TypeCheckResult result = checker.validateAttributeType(
                Attribute.typed("retries", "Integer", PrimitiveValue.quoted("abc")));

        assertFalse(result.isValid());
        assertEquals("Integer", result.getExpectedType().orElseThrow());
        assertEquals("string", result.getActualType().orElseThrow());
    }

    @Test
    void testExponentBeyondDecimalRange() {
        Attribute huge = Attribute.typed("limit", "number", PrimitiveValue.literal("1e9999999999"));
        Attribute tiny = Attribute.typed("epsilon", "number", PrimitiveValue.literal("1e-9999999999"));

        assertTrue(checker.validateAttributeType(huge).isValid());
        assertTrue(checker.validateAttributeType(tiny).isValid());

        Node limits = Node.builder("limits")
                .attribute(Attribute.typed("cap", "Integer", PrimitiveValue.literal("1e9999999999")))
                .build();
        ValidationContext context = new ValidationContext();
        int added = new TypeChecker(Machine.builder("Limits").node(limits).build())
                .validateAllAttributesWithContext(context);

        assertEquals(1, added);
        assertEquals(TypeErrorCodes.TYPE_MISMATCH, context.getErrors().get(0).getCode());
    }

    @Test
    void testTypedArrays() {
        Attribute dates = Attribute.typed("dates", "Array<Date>",
                ArrayValue.of(PrimitiveValue.quoted("2025-08-21T10:00:00Z")));
        Attribute numbers = Attribute.typed("numbers", "Array<number>",
                ArrayValue.of(PrimitiveValue.quoted("one")));
        Attribute empty = Attribute.typed("empty", "Array<number>", ArrayValue.of());

        assertTrue(checker.validateAttributeType(dates).isValid());
        assertFalse(checker.validateAttributeType(numbers).isValid());
        assertTrue(checker.validateAttributeType(empty).isValid());
    }

    @Test
    void testLiteralUnion() {
        assertTrue(checker.validateAttributeType(
                Attribute.typed("priority", "'low' | 'high'", PrimitiveValue.quoted("low"))).isValid());

        TypeCheckResult result = checker.validateAttributeType(
                Attribute.typed("priority", "'low' | 'high'", PrimitiveValue.quoted("urgent")));
        assertFalse(result.isValid());
        assertTrue(result.getMessage().orElseThrow().contains("'low', 'high'"));
    }

    @Test
    void testNodeAsObjectType() {
        assertTrue(checker.isNodeType("Person"));

        Attribute valid = Attribute.typed("owner", "Person",
                ObjectValue.of(Attribute.of("name", "Ada")));
        Attribute invalid = Attribute.typed("owner", "Person",
                ObjectValue.of(Attribute.of("name", PrimitiveValue.of(5))));

        assertTrue(checker.validateAttributeType(valid).isValid());
        TypeCheckResult result = checker.validateAttributeType(invalid);
        assertFalse(result.isValid());
        assertTrue(result.getMessage().orElseThrow().contains(".name"));
    }

    @Test
    void testValidateAllAttributesWithContext() {
        Node job = Node.builder("job")
                .attribute(Attribute.typed("retries", "Integer", PrimitiveValue.quoted("abc")))
                .build();
        Machine broken = Machine.builder("Broken").node(job).build();
        ValidationContext context = new ValidationContext();

        int added = new TypeChecker(broken).validateAllAttributesWithContext(context);

        assertEquals(1, added);
        ValidationError error = context.getErrors().get(0);
        assertEquals(ValidationSeverity.ERROR, error.getSeverity());
        assertEquals(ValidationCategory.TYPE, error.getCategory());
        assertEquals(TypeErrorCodes.TYPE_MISMATCH, error.getCode());
        assertEquals("job", error.getNodeName().orElseThrow());
        assertTrue(error.getSuggestion().orElseThrow().contains("Integer"));

        Map<String, TypeCheckResult> failures = new TypeChecker(broken).validateAllAttributes();
        assertEquals(List.of("job.retries"), List.copyOf(failures.keySet()));
    }

    // ========== Template references ==========

    @Test
    void testValidateTemplateReference() {
        assertTrue(checker.validateTemplateReference("config", null).isValid());
        assertTrue(checker.validateTemplateReference("config.apiKey", null).isValid());
        assertTrue(checker.validateTemplateReference("config.timeout", "Integer").isValid());
        assertFalse(checker.validateTemplateReference("config.timeout", "string").isValid());

        TypeCheckResult missingNode = checker.validateTemplateReference("nothing.here", null);
        assertEquals(TypeErrorCodes.UNDEFINED_REFERENCE, missingNode.getCode().orElseThrow());

        TypeCheckResult missingAttribute = checker.validateTemplateReference("config.region", null);
        assertFalse(missingAttribute.isValid());
        assertEquals("Node 'config' has no attribute 'region'", missingAttribute.getMessage().orElseThrow());
    }

    @Test
    void testTemplateReferencesWithContext() {
        Node fetch = Node.builder("fetch")
                .attribute("prompt", "Call with {{ config.apiKey }} in {{ config.region }} for {{ user.name }}")
                .build();
        machine.getNodes().add(fetch);
        ValidationContext context = new ValidationContext();

        int added = new TypeChecker(machine).validateTemplateReferencesWithContext(context);

        assertEquals(1, added);
        ValidationError warning = context.getErrors().get(0);
        assertEquals(ValidationSeverity.WARNING, warning.getSeverity());
        assertEquals(TypeErrorCodes.UNDEFINED_REFERENCE, warning.getCode());
        assertEquals("config.region", warning.getContext().get("reference"));
    }

    @Test
    void testGetAttributeType() {
        assertEquals("Integer", checker.getAttributeType("config", "timeout").orElseThrow());
        assertEquals("string", checker.getAttributeType("config", "apiKey").orElseThrow());
        assertEquals("Array<any>", checker.getAttributeType("config", "regions").orElseThrow());
        assertTrue(checker.getAttributeType("config", "missing").isEmpty());
        assertTrue(checker.getAttributeType("nobody", "apiKey").isEmpty());
    }
}
