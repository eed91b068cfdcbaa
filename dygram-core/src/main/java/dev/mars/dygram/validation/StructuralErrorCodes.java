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
 * Codes for {@link ValidationCategory#STRUCTURAL} diagnostics.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class StructuralErrorCodes {

    public static final String UNRESOLVED_REFERENCE = "UNRESOLVED_REFERENCE";
    public static final String PLACEHOLDER_CREATED = "PLACEHOLDER_CREATED";
    public static final String MALFORMED_NODE = "MALFORMED_NODE";
    public static final String MALFORMED_EDGE = "MALFORMED_EDGE";

    private StructuralErrorCodes() {
    }
}
