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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single structured diagnostic produced by one of the semantic passes.
 *
 * <p>Instances are immutable. {@link ValidationContext#addError(ValidationError)} stamps the
 * time of recording through {@link #withTimestamp(Instant)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class ValidationError {

    private final ValidationSeverity severity;
    private final ValidationCategory category;
    private final String code;
    private final String message;
    private final ValidationLocation location;
    private final String expected;
    private final String actual;
    private final Map<String, Object> context;
    private final String suggestion;
    private final Instant timestamp;

    private ValidationError(Builder builder) {
        this.severity = Objects.requireNonNull(builder.severity, "Severity cannot be null");
        this.category = Objects.requireNonNull(builder.category, "Category cannot be null");
        this.code = Objects.requireNonNull(builder.code, "Code cannot be null");
        this.message = Objects.requireNonNull(builder.message, "Message cannot be null");
        this.location = builder.location;
        this.expected = builder.expected;
        this.actual = builder.actual;
        this.context = Map.copyOf(builder.context);
        this.suggestion = builder.suggestion;
        this.timestamp = builder.timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ValidationSeverity getSeverity() {
        return severity;
    }

    public ValidationCategory getCategory() {
        return category;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Optional<ValidationLocation> getLocation() {
        return Optional.ofNullable(location);
    }

    /**
     * Shortcut for the node name of the location, if any.
     */
    public Optional<String> getNodeName() {
        return location == null ? Optional.empty() : location.getNode();
    }

    public Optional<String> getExpected() {
        return Optional.ofNullable(expected);
    }

    public Optional<String> getActual() {
        return Optional.ofNullable(actual);
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public Optional<String> getSuggestion() {
        return Optional.ofNullable(suggestion);
    }

    public Optional<Instant> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    public boolean isError() {
        return severity == ValidationSeverity.ERROR;
    }

    public ValidationError withTimestamp(Instant time) {
        return toBuilder().timestamp(time).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .severity(severity)
                .category(category)
                .code(code)
                .message(message)
                .location(location)
                .expected(expected)
                .actual(actual)
                .suggestion(suggestion)
                .timestamp(timestamp);
        builder.context.putAll(context);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationError that = (ValidationError) o;
        return severity == that.severity
                && category == that.category
                && code.equals(that.code)
                && message.equals(that.message)
                && Objects.equals(location, that.location)
                && Objects.equals(expected, that.expected)
                && Objects.equals(actual, that.actual)
                && context.equals(that.context)
                && Objects.equals(suggestion, that.suggestion)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, category, code, message, location, expected, actual, context, suggestion, timestamp);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.name()).append(" [").append(category.getValue()).append('/').append(code).append(']');
        if (location != null) {
            String where = location.toString();
            if (!where.isEmpty()) {
                sb.append(" (").append(where).append(')');
            }
        }
        sb.append(": ").append(message);
        if (suggestion != null) {
            sb.append(" Suggestion: ").append(suggestion);
        }
        return sb.toString();
    }

    public static class Builder {
        private ValidationSeverity severity = ValidationSeverity.ERROR;
        private ValidationCategory category = ValidationCategory.STRUCTURAL;
        private String code = "VALIDATION_ERROR";
        private String message;
        private ValidationLocation location;
        private String expected;
        private String actual;
        private final Map<String, Object> context = new LinkedHashMap<>();
        private String suggestion;
        private Instant timestamp;

        public Builder severity(ValidationSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder category(ValidationCategory category) {
            this.category = category;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder location(ValidationLocation location) {
            this.location = location;
            return this;
        }

        public Builder node(String nodeName) {
            this.location = ValidationLocation.ofNode(nodeName);
            return this;
        }

        public Builder property(String nodeName, String property) {
            this.location = ValidationLocation.ofProperty(nodeName, property);
            return this;
        }

        public Builder expected(String expected) {
            this.expected = expected;
            return this;
        }

        public Builder actual(String actual) {
            this.actual = actual;
            return this;
        }

        /**
         * Adds a context entry. Null values are skipped.
         */
        public Builder context(String key, Object value) {
            if (value != null) {
                this.context.put(key, value);
            }
            return this;
        }

        public Builder suggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public ValidationError build() {
            return new ValidationError(this);
        }
    }
}
