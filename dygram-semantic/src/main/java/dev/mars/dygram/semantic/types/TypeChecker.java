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
import dev.mars.dygram.ast.Machine;
import dev.mars.dygram.ast.Node;
import dev.mars.dygram.ast.NodeWalker;
import dev.mars.dygram.ast.ObjectValue;
import dev.mars.dygram.ast.PrimitiveValue;
import dev.mars.dygram.ast.TypeDef;
import dev.mars.dygram.core.exceptions.TypeInferenceException;
import dev.mars.dygram.semantic.template.TemplateParser;
import dev.mars.dygram.validation.TypeErrorCodes;
import dev.mars.dygram.validation.ValidationCategory;
import dev.mars.dygram.validation.ValidationContext;
import dev.mars.dygram.validation.ValidationError;
import dev.mars.dygram.validation.ValidationSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks attribute values against their declared types.
 *
 * <p>Validation of a typed attribute proceeds in phases:</p>
 * <ol>
 *   <li>a missing value is accepted only for optional types ({@code T?})</li>
 *   <li>literal unions ({@code 'low' | 'high'}) require the value to be one of the literals</li>
 *   <li>parameterized and registered types, node types included, are checked by the
 *       {@link TypeRegistry} against the extracted value</li>
 *   <li>anything else falls back to structural compatibility between the declared type and
 *       the type inferred from the value's shape</li>
 * </ol>
 *
 * <p>Every node of the machine is registered as a type under its simple and qualified name,
 * so {@code owner<Person>: { name: "Ada" }} checks against the attributes of node {@code Person}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class TypeChecker {

    private static final Logger logger = LoggerFactory.getLogger(TypeChecker.class);

    public static final String UNDEFINED = "undefined";

    private static final Pattern GENERIC = Pattern.compile("^([^<]+)<(.+)>$");
    private static final Set<String> STRING_BASED_TYPES = Set.of("Date", "UUID", "URL", "Duration");
    private static final Set<String> NUMBER_BASED_TYPES = Set.of("Integer", "Float");

    private final Machine machine;
    private final TypeRegistry typeRegistry;
    private final Map<String, Node> nodesByName = new HashMap<>();
    private final Map<Node, String> displayNames;

    public TypeChecker(Machine machine) {
        this(machine, new TypeRegistry());
    }

    public TypeChecker(Machine machine, TypeRegistry typeRegistry) {
        this.machine = Objects.requireNonNull(machine, "Machine cannot be null");
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "Type registry cannot be null");
        this.displayNames = NodeWalker.displayNames(machine);
        registerNodesAsTypes();
    }

    private void registerNodesAsTypes() {
        NodeWalker.walk(machine, (qualified, node) -> {
            if (nodesByName.putIfAbsent(node.getName(), node) == null) {
                typeRegistry.registerNodeType(node, node.getName());
            }
            if (!qualified.equals(node.getName()) && nodesByName.putIfAbsent(qualified, node) == null) {
                typeRegistry.registerNodeType(node, qualified);
            }
        });
        logger.debug("Registered {} node name(s) as types", nodesByName.size());
    }

    public boolean isNodeType(String typeName) {
        return typeRegistry.isNodeType(typeName);
    }

    public TypeRegistry getTypeRegistry() {
        return typeRegistry;
    }

    /**
     * Splits a type string. A trailing {@code ?} marks it optional; parameters are split on
     * top-level commas only, so nested generics stay intact.
     */
    public TypeInfo parseType(String typeString) {
        String text = typeString.trim();
        boolean optional = text.endsWith("?");
        if (optional) {
            text = text.substring(0, text.length() - 1).trim();
        }

        Matcher matcher = GENERIC.matcher(text);
        if (matcher.matches()) {
            return new TypeInfo(matcher.group(1).trim(), parseGenericParams(matcher.group(2)), optional);
        }
        return new TypeInfo(text, List.of(), optional);
    }

    List<String> parseGenericParams(String params) {
        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (char c : params.toCharArray()) {
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == ',' && depth == 0) {
                result.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (!current.toString().isBlank()) {
            result.add(current.toString().trim());
        }
        return result;
    }

    /**
     * Infers a type from the shape of a value.
     *
     * @return {@value #UNDEFINED} for a missing value
     * @throws TypeInferenceException for an empty array, whose element type is unknowable
     */
    public String inferType(AttributeValue value) throws TypeInferenceException {
        if (value == null) {
            return UNDEFINED;
        }
        return switch (value.kind()) {
            case PRIMITIVE -> inferPrimitive((PrimitiveValue) value);
            case ARRAY -> inferArray((ArrayValue) value);
            case OBJECT -> ((ObjectValue) value).isEmpty() ? "Object" : "Record<string, any>";
        };
    }

    private String inferArray(ArrayValue array) throws TypeInferenceException {
        if (array.isEmpty()) {
            throw new TypeInferenceException("Unable to infer type for empty array");
        }
        String elementType = inferType(array.getValues().get(0));
        for (AttributeValue element : array.getValues()) {
            if (!elementType.equals(inferType(element))) {
                return "Array<any>";
            }
        }
        return "Array<" + elementType + ">";
    }

    // plain notation only for exponents a literal could spell out
    private static String literalText(BigDecimal decimal) {
        return Math.abs(decimal.scale()) > 1000 ? decimal.toString() : decimal.toPlainString();
    }

    private String inferPrimitive(PrimitiveValue value) {
        if (value.isQuoted()) {
            return "string";
        }
        String text = value.getText();
        if (ValueExtractor.NUMBER.matcher(text).matches()) {
            return "number";
        }
        if ("true".equals(text) || "false".equals(text)) {
            return "boolean";
        }
        if ("null".equals(text)) {
            return "null";
        }
        return "string";
    }

    /**
     * Structural compatibility of a declared type with an inferred one. {@code any} matches
     * everything; {@code Integer}/{@code Float} accept {@code number}; {@code Date}, {@code UUID},
     * {@code URL} and {@code Duration} accept {@code string}; generic parameters are compared
     * position by position.
     */
    public TypeCheckResult areTypesCompatible(String declared, String inferred) {
        TypeInfo declaredInfo = parseType(declared);
        TypeInfo inferredInfo = parseType(inferred);

        if ("any".equals(declaredInfo.baseType()) || "any".equals(inferredInfo.baseType())) {
            return TypeCheckResult.valid();
        }

        if (!declaredInfo.baseType().equals(inferredInfo.baseType())) {
            if (areBaseTypesCompatible(declaredInfo.baseType(), inferredInfo.baseType())) {
                return TypeCheckResult.valid();
            }
            return TypeCheckResult.mismatch(declared, inferred,
                    "Type mismatch: expected " + declared + ", got " + inferred);
        }

        if (declaredInfo.isGeneric() && inferredInfo.isGeneric()) {
            List<String> declaredParams = declaredInfo.genericParams();
            List<String> inferredParams = inferredInfo.genericParams();
            if (declaredParams.size() != inferredParams.size()) {
                return TypeCheckResult.mismatch(declared, inferred, "Generic parameter count mismatch");
            }
            for (int i = 0; i < declaredParams.size(); i++) {
                if (!areTypesCompatible(declaredParams.get(i), inferredParams.get(i)).isValid()) {
                    return TypeCheckResult.mismatch(declared, inferred,
                            "Generic parameter mismatch at position " + (i + 1));
                }
            }
        }
        return TypeCheckResult.valid();
    }

    private boolean areBaseTypesCompatible(String declared, String inferred) {
        if (declared.startsWith("Array") && inferred.startsWith("Array")) {
            return true;
        }
        if (STRING_BASED_TYPES.contains(declared) && "string".equals(inferred)) {
            return true;
        }
        return NUMBER_BASED_TYPES.contains(declared) && "number".equals(inferred);
    }

    public TypeCheckResult validateAttributeType(Attribute attribute) {
        Optional<TypeDef> declared = attribute.getType();
        if (declared.isEmpty()) {
            return TypeCheckResult.valid();
        }

        TypeDef type = declared.get();
        String typeString = type.toString();
        TypeInfo typeInfo = parseType(typeString);

        Optional<AttributeValue> value = attribute.getValue();
        if (value.isEmpty()) {
            if (type.isOptional()) {
                return TypeCheckResult.valid();
            }
            return TypeCheckResult.invalid(TypeErrorCodes.MISSING_VALUE, typeString, UNDEFINED,
                    "Attribute '" + attribute.getName() + "' has type " + typeString + " but no value provided");
        }

        Object extracted = ValueExtractor.extract(value.get());
        if (extracted == null) {
            if (type.isOptional()) {
                return TypeCheckResult.valid();
            }
            return TypeCheckResult.mismatch(typeString, "null",
                    "Type mismatch: expected " + typeString + ", got null");
        }

        if (type.isLiteralUnion()) {
            String text = extracted instanceof BigDecimal
                    ? literalText((BigDecimal) extracted)
                    : String.valueOf(extracted);
            if (!type.getLiterals().contains(text)) {
                String allowed = type.getLiterals().stream().map(l -> "'" + l + "'").collect(Collectors.joining(", "));
                return TypeCheckResult.mismatch(typeString, inferSafely(value.get(), typeString),
                        "Value \"" + text + "\" does not match any of the allowed literals: " + allowed);
            }
            return TypeCheckResult.valid();
        }

        TypeValidationResult registryResult = null;
        if (typeInfo.isGeneric()) {
            registryResult = typeRegistry.validateGenericType(typeInfo.baseType(), typeInfo.genericParams(), extracted);
        } else if (typeRegistry.has(typeInfo.baseType())) {
            registryResult = typeRegistry.validate(typeInfo.baseType(), extracted);
        }

        if (registryResult != null) {
            if (registryResult.valid()) {
                return TypeCheckResult.valid();
            }
            String inferred = inferSafely(value.get(), typeString);
            return TypeCheckResult.mismatch(typeString, inferred,
                    "Type mismatch: expected " + typeString + ", got " + inferred + ". " + registryResult.describe());
        }

        return areTypesCompatible(typeString, inferSafely(value.get(), typeString));
    }

    // An empty array is compatible with whatever was declared.
    private String inferSafely(AttributeValue value, String declared) {
        try {
            return inferType(value);
        } catch (TypeInferenceException e) {
            return declared;
        }
    }

    /**
     * Checks a template path such as {@code config.apiKey}: the root must be a node, the
     * second segment one of its attributes, and, when {@code expectedType} is given, the
     * attribute's declared type must be compatible with it.
     */
    public TypeCheckResult validateTemplateReference(String reference, String expectedType) {
        String[] parts = reference.split("\\.");
        if (parts.length == 0 || parts[0].isEmpty()) {
            return TypeCheckResult.invalid(TypeErrorCodes.UNDEFINED_REFERENCE, "Invalid template reference: " + reference);
        }

        Node root = nodesByName.get(parts[0]);
        if (root == null) {
            return TypeCheckResult.invalid(TypeErrorCodes.UNDEFINED_REFERENCE, "Reference to undefined node: " + parts[0]);
        }
        if (parts.length == 1) {
            return TypeCheckResult.valid();
        }

        Optional<Attribute> attribute = root.getAttribute(parts[1]);
        if (attribute.isEmpty()) {
            return TypeCheckResult.invalid(TypeErrorCodes.UNDEFINED_REFERENCE,
                    "Node '" + parts[0] + "' has no attribute '" + parts[1] + "'");
        }

        if (expectedType != null && attribute.get().getType().isPresent()) {
            return areTypesCompatible(expectedType, attribute.get().getType().get().toString());
        }
        return TypeCheckResult.valid();
    }

    /**
     * Failed checks of every typed attribute in the machine, keyed {@code node.attribute}.
     */
    public Map<String, TypeCheckResult> validateAllAttributes() {
        Map<String, TypeCheckResult> failures = new LinkedHashMap<>();
        NodeWalker.walk(machine, (qualified, node) -> {
            for (Attribute attribute : node.getAttributes()) {
                TypeCheckResult result = validateAttributeType(attribute);
                if (!result.isValid()) {
                    failures.put(displayNames.get(node) + "." + attribute.getName(), result);
                }
            }
        });
        return failures;
    }

    /**
     * Records every failed attribute check as a TYPE error.
     *
     * @return the number of diagnostics added
     */
    public int validateAllAttributesWithContext(ValidationContext context) {
        int[] added = {0};
        NodeWalker.walk(machine, (qualified, node) -> {
            for (Attribute attribute : node.getAttributes()) {
                TypeCheckResult result = validateAttributeType(attribute);
                if (result.isValid()) {
                    continue;
                }
                context.addError(ValidationError.builder()
                        .severity(ValidationSeverity.ERROR)
                        .category(ValidationCategory.TYPE)
                        .code(result.getCode().orElse(TypeErrorCodes.TYPE_MISMATCH))
                        .message(result.getMessage().orElse("Type validation failed"))
                        .property(displayNames.get(node), attribute.getName())
                        .expected(result.getExpectedType().orElse(null))
                        .actual(result.getActualType().orElse(null))
                        .suggestion(suggestionFor(result))
                        .build());
                added[0]++;
            }
        });
        if (added[0] > 0) {
            logger.info("Type check of machine '{}' found {} problem(s)", machine.getTitle(), added[0]);
        }
        return added[0];
    }

    /**
     * Records a WARNING for every template placeholder {@code {{ node.attr }}} whose root is a
     * node lacking that attribute. Placeholders whose root is not a node are runtime variables
     * and are left alone.
     *
     * @return the number of diagnostics added
     */
    public int validateTemplateReferencesWithContext(ValidationContext context) {
        int[] added = {0};
        NodeWalker.walk(machine, (qualified, node) -> {
            for (Attribute attribute : node.getAttributes()) {
                Optional<AttributeValue> value = attribute.getValue();
                if (value.isEmpty()) {
                    continue;
                }
                for (String path : TemplateParser.referencePaths(value.get().asText())) {
                    String[] parts = path.split("\\.");
                    if (parts.length < 2 || !nodesByName.containsKey(parts[0])) {
                        continue;
                    }
                    TypeCheckResult result = validateTemplateReference(path, null);
                    if (!result.isValid()) {
                        context.addError(ValidationError.builder()
                                .severity(ValidationSeverity.WARNING)
                                .category(ValidationCategory.TYPE)
                                .code(TypeErrorCodes.UNDEFINED_REFERENCE)
                                .message(result.getMessage().orElse("Undefined template reference"))
                                .property(displayNames.get(node), attribute.getName())
                                .context("reference", path)
                                .suggestion("Add attribute '" + parts[1] + "' to node '" + parts[0] + "'")
                                .build());
                        added[0]++;
                    }
                }
            }
        });
        return added[0];
    }

    private String suggestionFor(TypeCheckResult result) {
        Optional<String> expected = result.getExpectedType();
        Optional<String> actual = result.getActualType();
        if (expected.isEmpty() || actual.isEmpty()) {
            return null;
        }
        if (UNDEFINED.equals(actual.get())) {
            return "Provide a value of type '" + expected.get() + "' or make the type optional with '"
                    + expected.get() + "?'";
        }
        return "Change the value to match type '" + expected.get() + "' or update the type annotation to '"
                + actual.get() + "'";
    }

    /**
     * Syntax check of a type string: balanced angle brackets, recursively for every parameter.
     */
    public TypeCheckResult validateGenericType(String typeString) {
        long open = typeString.chars().filter(c -> c == '<').count();
        long close = typeString.chars().filter(c -> c == '>').count();
        if (open != close) {
            return TypeCheckResult.invalid(TypeErrorCodes.INVALID_GENERIC,
                    "Unbalanced generic brackets in type: " + typeString);
        }

        TypeInfo info = parseType(typeString);
        if (info.baseType().isEmpty()) {
            return TypeCheckResult.invalid(TypeErrorCodes.INVALID_GENERIC, "Invalid type syntax: " + typeString);
        }
        for (String param : info.genericParams()) {
            TypeCheckResult result = validateGenericType(param);
            if (!result.isValid()) {
                return result;
            }
        }
        return TypeCheckResult.valid();
    }

    /**
     * Declared type of an attribute, or its inferred type when undeclared. An empty array
     * reports {@code Array<any>}.
     */
    public Optional<String> getAttributeType(String nodeName, String attributeName) {
        Node node = nodesByName.get(nodeName);
        if (node == null) {
            return Optional.empty();
        }
        Optional<Attribute> attribute = node.getAttribute(attributeName);
        if (attribute.isEmpty()) {
            return Optional.empty();
        }
        if (attribute.get().getType().isPresent()) {
            return Optional.of(attribute.get().getType().get().toString());
        }
        return Optional.of(inferSafely(attribute.get().getValue().orElse(null), "Array<any>"));
    }
}
