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

package dev.mars.dygram.semantic.nodes;

import java.util.List;

/**
 * Access rights an edge label grants a task over a context node, e.g. {@code write: total, count}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public record ContextPermissions(boolean canRead, boolean canWrite, boolean canStore, List<String> fields) {

    public ContextPermissions {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /**
     * True when the label restricts access to named fields.
     */
    public boolean hasFieldRestriction() {
        return !fields.isEmpty();
    }
}
