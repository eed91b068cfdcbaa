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
 * How an executor should proceed when it reaches a node carrying errors.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public enum RecoveryStrategy {
    /** Stop execution. */
    ABORT("abort"),
    /** Skip the node and continue with its successors. */
    SKIP("skip"),
    /** Substitute a default value for the failing one. */
    DEFAULT("default"),
    /** Retry the node. */
    RETRY("retry"),
    /** Continue as if nothing happened, reporting a warning. */
    CONTINUE("continue"),
    /** Defer to a caller-supplied handler. */
    CUSTOM("custom");

    private final String value;

    RecoveryStrategy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static RecoveryStrategy fromValue(String value) {
        for (RecoveryStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value) || strategy.name().equalsIgnoreCase(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown recovery strategy: " + value);
    }
}
