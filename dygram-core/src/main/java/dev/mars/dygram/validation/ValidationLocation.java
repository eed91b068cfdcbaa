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

import java.util.Objects;
import java.util.Optional;

/**
 * Where a diagnostic applies. Every part is optional; the node name is what ties the
 * diagnostic to a {@link NodeErrorFlag}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class ValidationLocation {

    private final String node;
    private final String property;
    private final int line;
    private final int column;
    private final String file;

    public ValidationLocation(String node, String property, int line, int column, String file) {
        this.node = node;
        this.property = property;
        this.line = line;
        this.column = column;
        this.file = file;
    }

    public static ValidationLocation ofNode(String node) {
        return new ValidationLocation(node, null, -1, -1, null);
    }

    public static ValidationLocation ofProperty(String node, String property) {
        return new ValidationLocation(node, property, -1, -1, null);
    }

    public Optional<String> getNode() {
        return Optional.ofNullable(node);
    }

    public Optional<String> getProperty() {
        return Optional.ofNullable(property);
    }

    /**
     * One-based line, or -1 when unknown.
     */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public Optional<String> getFile() {
        return Optional.ofNullable(file);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationLocation that = (ValidationLocation) o;
        return line == that.line && column == that.column
                && Objects.equals(node, that.node)
                && Objects.equals(property, that.property)
                && Objects.equals(file, that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(node, property, line, column, file);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (file != null) {
            sb.append(file).append(':');
        }
        if (line > 0) {
            sb.append(line);
            if (column > 0) {
                sb.append(':').append(column);
            }
            sb.append(' ');
        }
        if (node != null) {
            sb.append(node);
            if (property != null) {
                sb.append('.').append(property);
            }
        }
        return sb.toString().trim();
    }
}
