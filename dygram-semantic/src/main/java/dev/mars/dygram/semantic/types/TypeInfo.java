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

import java.util.List;

/**
 * A type string split into base, generic parameters and the optional marker.
 * {@code Map<string, Array<number>>?} gives base {@code Map}, parameters
 * {@code [string, Array<number>]}, optional.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public record TypeInfo(String baseType, List<String> genericParams, boolean optional) {

    public TypeInfo {
        genericParams = genericParams == null ? List.of() : List.copyOf(genericParams);
    }

    public boolean isGeneric() {
        return !genericParams.isEmpty();
    }
}
