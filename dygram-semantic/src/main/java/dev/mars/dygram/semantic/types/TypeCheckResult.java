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

import dev.mars.dygram.validation.TypeErrorCodes;

import java.util.Optional;

/**
 * Outcome of a type check. Invalid results carry the declared and observed types and the
 * diagnostic code to report them under.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class TypeCheckResult {

    private static final TypeCheckResult VALID = new TypeCheckResult(true, null, null, null, null);

    private final boolean valid;
    private final String message;
    private final String expectedType;
    private final String actualType;
    private final String code;

    private TypeCheckResult(boolean valid, String message, String expectedType, String actualType, String code) {
        this.valid = valid;
        this.message = message;
        this.expectedType = expectedType;
        this.actualType = actualType;
        this.code = code;
    }

    public static TypeCheckResult valid() {
        return VALID;
    }

    public static TypeCheckResult mismatch(String expectedType, String actualType, String message) {
        return new TypeCheckResult(false, message, expectedType, actualType, TypeErrorCodes.TYPE_MISMATCH);
    }

    public static TypeCheckResult invalid(String code, String expectedType, String actualType, String message) {
        return new TypeCheckResult(false, message, expectedType, actualType, code);
    }

    public static TypeCheckResult invalid(String code, String message) {
        return new TypeCheckResult(false, message, null, null, code);
    }

    public boolean isValid() {
        return valid;
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    public Optional<String> getExpectedType() {
        return Optional.ofNullable(expectedType);
    }

    public Optional<String> getActualType() {
        return Optional.ofNullable(actualType);
    }

    public Optional<String> getCode() {
        return Optional.ofNullable(code);
    }

    @Override
    public String toString() {
        if (valid) {
            return "TypeCheckResult{valid}";
        }
        return "TypeCheckResult{" +
                "code=" + code +
                ", expected=" + expectedType +
                ", actual=" + actualType +
                ", message='" + message + '\'' +
                '}';
    }
}
