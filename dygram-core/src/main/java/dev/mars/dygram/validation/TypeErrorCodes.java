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

package dev.mars.dygram.validation;

/**
 * Codes for {@link ValidationCategory#TYPE} diagnostics.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class TypeErrorCodes {

    public static final String TYPE_MISMATCH = "TYPE_MISMATCH";
    public static final String MISSING_VALUE = "MISSING_VALUE";
    public static final String INVALID_GENERIC = "INVALID_GENERIC";
    public static final String INCOMPATIBLE_TYPE = "INCOMPATIBLE_TYPE";
    public static final String UNDEFINED_REFERENCE = "UNDEFINED_REFERENCE";

    private TypeErrorCodes() {
    }
}
