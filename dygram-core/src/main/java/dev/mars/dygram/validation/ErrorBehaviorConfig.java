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

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Default recovery policy used when no explicit {@link RecoveryAction} was attached to a node.
 * Lookup order is node, then category, then the default strategy.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class ErrorBehaviorConfig {

    private final RecoveryStrategy defaultStrategy;
    private final Map<String, RecoveryStrategy> nodeStrategies;
    private final Map<ValidationCategory, RecoveryStrategy> categoryStrategies;
    private final boolean failFast;
    private final int maxErrors;

    private ErrorBehaviorConfig(Builder builder) {
        this.defaultStrategy = builder.defaultStrategy;
        this.nodeStrategies = Map.copyOf(builder.nodeStrategies);
        this.categoryStrategies = builder.categoryStrategies.isEmpty()
                ? Map.of() : new EnumMap<>(builder.categoryStrategies);
        this.failFast = builder.failFast;
        this.maxErrors = builder.maxErrors;
    }

    public static ErrorBehaviorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public RecoveryStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    public RecoveryStrategy getNodeStrategy(String nodeName) {
        return nodeStrategies.get(nodeName);
    }

    public RecoveryStrategy getCategoryStrategy(ValidationCategory category) {
        return categoryStrategies.get(category);
    }

    /**
     * When set, {@link ValidationContext} stops recording once the first ERROR is in.
     */
    public boolean isFailFast() {
        return failFast;
    }

    /**
     * Upper bound on recorded diagnostics; zero means unlimited.
     */
    public int getMaxErrors() {
        return maxErrors;
    }

    public static class Builder {
        private RecoveryStrategy defaultStrategy = RecoveryStrategy.CONTINUE;
        private final Map<String, RecoveryStrategy> nodeStrategies = new HashMap<>();
        private final Map<ValidationCategory, RecoveryStrategy> categoryStrategies = new HashMap<>();
        private boolean failFast;
        private int maxErrors;

        public Builder defaultStrategy(RecoveryStrategy strategy) {
            this.defaultStrategy = Objects.requireNonNull(strategy, "Strategy cannot be null");
            return this;
        }

        public Builder nodeStrategy(String nodeName, RecoveryStrategy strategy) {
            nodeStrategies.put(nodeName, strategy);
            return this;
        }

        public Builder categoryStrategy(ValidationCategory category, RecoveryStrategy strategy) {
            categoryStrategies.put(category, strategy);
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder maxErrors(int maxErrors) {
            if (maxErrors < 0) {
                throw new IllegalArgumentException("maxErrors cannot be negative");
            }
            this.maxErrors = maxErrors;
            return this;
        }

        public ErrorBehaviorConfig build() {
            return new ErrorBehaviorConfig(this);
        }
    }
}
