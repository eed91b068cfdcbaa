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
 * What kind of check produced a diagnostic.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public enum ValidationCategory {
    /** Attribute type mismatches and missing required values. */
    TYPE("type"),
    /** Annotation, relationship and transition validity. */
    SEMANTIC("semantic"),
    /** Reachability, cycles, entry and exit points. */
    GRAPH("graph"),
    /** Shape of the tree itself: names, references, placeholders. */
    STRUCTURAL("structural"),
    /** Reserved for the executor. */
    RUNTIME("runtime");

    private final String value;

    ValidationCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
