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

/**
 * Result of a {@link TypeValidator}. {@code path} locates the offending element inside
 * arrays and objects, e.g. {@code [2]} or {@code .owner.email}; it is empty at the top level.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public record TypeValidationResult(boolean valid, String message, String path) {

    private static final TypeValidationResult OK = new TypeValidationResult(true, null, "");

    public static TypeValidationResult ok() {
        return OK;
    }

    public static TypeValidationResult fail(String message) {
        return new TypeValidationResult(false, message, "");
    }

    TypeValidationResult nested(String segment) {
        return valid ? this : new TypeValidationResult(false, message, segment + path);
    }

    /**
     * Message prefixed with the element path when there is one.
     */
    public String describe() {
        if (valid) {
            return "valid";
        }
        return path.isEmpty() ? message : path + ": " + message;
    }
}
