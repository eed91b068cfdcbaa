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

package dev.mars.dygram.semantic.dependency;

import java.util.Objects;

/**
 * An implicit dependency: {@code source} reads from or is conditioned on {@code target}.
 *
 * @param source the dependent node
 * @param target the node depended upon
 * @param reason human readable cause, e.g. {@code reads prompt}
 * @param path the template reference or condition expression the dependency came from
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public record InferredDependency(String source, String target, String reason, String path) {

    public InferredDependency {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(target, "Target cannot be null");
        Objects.requireNonNull(reason, "Reason cannot be null");
        Objects.requireNonNull(path, "Path cannot be null");
    }

    String key() {
        return source + ":" + target + ":" + path;
    }
}
