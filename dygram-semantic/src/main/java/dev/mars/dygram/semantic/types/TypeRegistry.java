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
import dev.mars.dygram.ast.TypeDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Named value validators backing attribute type checks.
 *
 * <h3>Built-in types</h3>
 * <ul>
 *   <li>{@code string}, {@code number}, {@code boolean}</li>
 *   <li>{@code Date} (ISO-8601 UTC date-time ending in {@code Z}), {@code UUID}, {@code URL} (absolute URI)</li>
 *   <li>{@code Duration}: ISO-8601 ({@code PT4H5M}) or shorthand ({@code 30s}, {@code 5min}, {@code 2h})</li>
 *   <li>{@code Integer}, {@code Float}</li>
 *   <li>{@code Array}, {@code List}, {@code Map}, {@code Record}, {@code Promise}, {@code Result}
 *       and {@code any}, which accept anything unless parameterized</li>
 * </ul>
 *
 * <h3>Node types</h3>
 * <p>{@link #registerNodeType(Node, String)} turns a node into an object type whose fields are
 * the node's attributes. Typed attributes are checked, non-optional typed attributes are
 * required, untyped attributes accept anything. Built-in names cannot be redefined by nodes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class TypeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(TypeRegistry.class);

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern UTC_DATE_TIME = Pattern.compile(
            "^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?Z$");
    private static final Pattern ISO_DURATION = Pattern.compile(
            "^P(?:\\d+Y)?(?:\\d+M)?(?:\\d+W)?(?:\\d+D)?(?:T(?:\\d+H)?(?:\\d+M)?(?:\\d+(?:\\.\\d+)?S)?)?$");
    private static final Pattern SHORTHAND_DURATION = Pattern.compile(
            "^(\\d+(?:\\.\\d+)?)(s|ms|m|min|h|hr|d|w|y)$", Pattern.CASE_INSENSITIVE);

    private static final Set<String> LIST_TYPES = Set.of("Array", "List");
    private static final Set<String> MAP_TYPES = Set.of("Map", "Record");

    private final Map<String, TypeValidator> validators = new LinkedHashMap<>();
    private final Map<String, Node> nodeTypes = new LinkedHashMap<>();
    private final Set<String> builtIns;

    public TypeRegistry() {
        registerBuiltInTypes();
        this.builtIns = Set.copyOf(validators.keySet());
    }

    private void registerBuiltInTypes() {
        register("string", instance(String.class, "string"));
        register("number", instance(Number.class, "number"));
        register("boolean", instance(Boolean.class, "boolean"));

        register("Date", semanticString(TypeRegistry::isIsoDateTime, "Must be a valid ISO 8601 date string"));
        register("UUID", semanticString(s -> UUID_PATTERN.matcher(s).matches(), "Must be a valid UUID string"));
        register("URL", semanticString(TypeRegistry::isAbsoluteUrl, "Must be a valid URL"));
        register("Duration", semanticString(
                s -> ISO_DURATION.matcher(s).matches() || SHORTHAND_DURATION.matcher(s).matches(),
                "Must be a valid ISO 8601 duration (e.g., P1Y2M3D, PT4H5M6S) or shorthand format (e.g., 30s, 5min, 2h, 3d)"));

        register("Integer", value -> {
            if (!(value instanceof Number)) {
                return TypeValidationResult.fail("Expected number, received " + ValueExtractor.describe(value));
            }
            return isIntegral((Number) value) ? TypeValidationResult.ok() : TypeValidationResult.fail("Must be an integer");
        });
        register("Float", instance(Number.class, "number"));

        for (String container : List.of("Array", "List", "Map", "Record", "Promise", "Result", "any")) {
            register(container, TypeValidator.ANY);
        }
    }

    public void register(String name, TypeValidator validator) {
        Objects.requireNonNull(name, "Type name cannot be null");
        Objects.requireNonNull(validator, "Validator cannot be null");
        validators.put(name, validator);
    }

    public boolean has(String typeName) {
        return validators.containsKey(typeName);
    }

    public Optional<TypeValidator> getValidator(String typeName) {
        return Optional.ofNullable(validators.get(typeName));
    }

    /**
     * Validates against a named type. Unregistered types are assumed to be valid.
     */
    public TypeValidationResult validate(String typeName, Object value) {
        TypeValidator validator = validators.get(typeName);
        if (validator == null) {
            return TypeValidationResult.ok();
        }
        return validator.validate(value);
    }

    /**
     * Validates a parameterized container. {@code Array<T>} and {@code List<T>} check every
     * element against {@code T}; {@code Map<K, V>} and {@code Record<K, V>} check every value
     * against {@code V} (keys are always strings). Other generics are not checked.
     */
    public TypeValidationResult validateGenericType(String baseType, List<String> genericParams, Object value) {
        List<TypeDef> params = new ArrayList<>();
        for (String param : genericParams) {
            params.add(TypeDef.parse(param));
        }
        return genericValidator(baseType, params).validate(value);
    }

    /**
     * Validator for a full type definition, composing parameterized containers recursively.
     */
    public TypeValidator validatorFor(TypeDef type) {
        if (type.isLiteralUnion()) {
            List<String> literals = type.getLiterals();
            return value -> literals.contains(String.valueOf(value))
                    ? TypeValidationResult.ok()
                    : TypeValidationResult.fail("Expected one of " + literals + ", received " + value);
        }
        if (type.isGeneric()) {
            return genericValidator(type.getBase(), type.getGenerics());
        }
        return value -> validate(type.getBase(), value);
    }

    private TypeValidator genericValidator(String baseType, List<TypeDef> params) {
        if (LIST_TYPES.contains(baseType) && params.size() == 1) {
            TypeValidator element = elementValidator(params.get(0));
            return value -> {
                if (!(value instanceof List)) {
                    return TypeValidationResult.fail("Expected array, received " + ValueExtractor.describe(value));
                }
                List<?> list = (List<?>) value;
                for (int i = 0; i < list.size(); i++) {
                    TypeValidationResult result = element.validate(list.get(i));
                    if (!result.valid()) {
                        return result.nested("[" + i + "]");
                    }
                }
                return TypeValidationResult.ok();
            };
        }

        if (MAP_TYPES.contains(baseType) && params.size() == 2) {
            TypeValidator valueValidator = elementValidator(params.get(1));
            return value -> {
                if (!(value instanceof Map)) {
                    return TypeValidationResult.fail("Expected object, received " + ValueExtractor.describe(value));
                }
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                    TypeValidationResult result = valueValidator.validate(entry.getValue());
                    if (!result.valid()) {
                        return result.nested("." + entry.getKey());
                    }
                }
                return TypeValidationResult.ok();
            };
        }

        return TypeValidator.ANY;
    }

    private TypeValidator elementValidator(TypeDef param) {
        if (param.isGeneric() || param.isLiteralUnion() || has(param.getBase())) {
            return validatorFor(param);
        }
        return TypeValidator.ANY;
    }

    /**
     * Registers a node as an object type under {@code name}.
     *
     * @return false if {@code name} is a built-in type and was left untouched
     */
    public boolean registerNodeType(Node node, String name) {
        Objects.requireNonNull(node, "Node cannot be null");
        if (builtIns.contains(name)) {
            logger.debug("Node '{}' shadows built-in type, not registered as a type", name);
            return false;
        }
        nodeTypes.put(name, node);
        register(name, nodeSchema(node));
        return true;
    }

    public boolean registerNodeType(Node node) {
        return registerNodeType(node, node.getName());
    }

    public boolean isNodeType(String typeName) {
        return nodeTypes.containsKey(typeName);
    }

    public Optional<Node> getNodeType(String typeName) {
        return Optional.ofNullable(nodeTypes.get(typeName));
    }

    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(validators.keySet());
    }

    private TypeValidator nodeSchema(Node node) {
        List<Attribute> fields = List.copyOf(node.getAttributes());
        return value -> {
            if (!(value instanceof Map)) {
                return TypeValidationResult.fail("Expected object, received " + ValueExtractor.describe(value));
            }
            Map<?, ?> object = (Map<?, ?>) value;
            for (Attribute field : fields) {
                Optional<TypeDef> type = field.getType();
                if (type.isEmpty()) {
                    continue;
                }
                if (!object.containsKey(field.getName())) {
                    if (type.get().isOptional()) {
                        continue;
                    }
                    return TypeValidationResult.fail("Required").nested("." + field.getName());
                }
                TypeValidationResult result = validatorFor(type.get()).validate(object.get(field.getName()));
                if (!result.valid()) {
                    return result.nested("." + field.getName());
                }
            }
            return TypeValidationResult.ok();
        };
    }

    private static TypeValidator instance(Class<?> type, String name) {
        return value -> type.isInstance(value)
                ? TypeValidationResult.ok()
                : TypeValidationResult.fail("Expected " + name + ", received " + ValueExtractor.describe(value));
    }

    private static TypeValidator semanticString(Predicate<String> check, String message) {
        return value -> {
            if (!(value instanceof String)) {
                return TypeValidationResult.fail("Expected string, received " + ValueExtractor.describe(value));
            }
            return check.test((String) value) ? TypeValidationResult.ok() : TypeValidationResult.fail(message);
        };
    }

    private static boolean isIntegral(Number number) {
        if (number instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) number;
            return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger;
    }

    private static boolean isIsoDateTime(String text) {
        if (!UTC_DATE_TIME.matcher(text).matches()) {
            return false;
        }
        try {
            OffsetDateTime.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static boolean isAbsoluteUrl(String text) {
        try {
            URI uri = new URI(text);
            return uri.isAbsolute() && (uri.getHost() != null || uri.isOpaque());
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
