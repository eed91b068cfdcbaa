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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A recovery decision attached to a node, consumed later by the executor.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class RecoveryAction {

    private final RecoveryStrategy strategy;
    private final Object defaultValue;
    private final int maxRetries;
    private final Duration retryDelay;
    private final Function<ValidationError, Object> handler;

    private RecoveryAction(RecoveryStrategy strategy, Object defaultValue, int maxRetries,
                           Duration retryDelay, Function<ValidationError, Object> handler) {
        this.strategy = Objects.requireNonNull(strategy, "Strategy cannot be null");
        this.defaultValue = defaultValue;
        this.maxRetries = maxRetries;
        this.retryDelay = retryDelay;
        this.handler = handler;
    }

    public static RecoveryAction of(RecoveryStrategy strategy) {
        return new RecoveryAction(strategy, null, 0, null, null);
    }

    public static RecoveryAction abort() {
        return of(RecoveryStrategy.ABORT);
    }

    public static RecoveryAction skip() {
        return of(RecoveryStrategy.SKIP);
    }

    public static RecoveryAction continueExecution() {
        return of(RecoveryStrategy.CONTINUE);
    }

    public static RecoveryAction withDefault(Object defaultValue) {
        return new RecoveryAction(RecoveryStrategy.DEFAULT, defaultValue, 0, null, null);
    }

    public static RecoveryAction retry(int maxRetries, Duration retryDelay) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        return new RecoveryAction(RecoveryStrategy.RETRY, null, maxRetries,
                Objects.requireNonNull(retryDelay, "Retry delay cannot be null"), null);
    }

    public static RecoveryAction custom(Function<ValidationError, Object> handler) {
        return new RecoveryAction(RecoveryStrategy.CUSTOM, null, 0, null,
                Objects.requireNonNull(handler, "Handler cannot be null"));
    }

    public RecoveryStrategy getStrategy() {
        return strategy;
    }

    public Optional<Object> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Optional<Duration> getRetryDelay() {
        return Optional.ofNullable(retryDelay);
    }

    public Optional<Function<ValidationError, Object>> getHandler() {
        return Optional.ofNullable(handler);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RecoveryAction{").append(strategy.getValue());
        if (strategy == RecoveryStrategy.RETRY) {
            sb.append(", maxRetries=").append(maxRetries).append(", delay=").append(retryDelay);
        } else if (strategy == RecoveryStrategy.DEFAULT) {
            sb.append(", default=").append(defaultValue);
        }
        return sb.append('}').toString();
    }
}
