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
 * Severity of a diagnostic. Only {@link #ERROR} marks a node as blocked; the rest are advisory.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public enum ValidationSeverity {
    ERROR("error"),
    WARNING("warning"),
    INFO("info"),
    HINT("hint");

    private final String value;

    ValidationSeverity(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
