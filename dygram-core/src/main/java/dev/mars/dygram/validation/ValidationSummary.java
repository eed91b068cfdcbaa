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
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a {@link ValidationContext}: totals per severity and category, and the
 * nodes that are blocked.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class ValidationSummary {

    private final int totalErrors;
    private final Map<ValidationSeverity, Integer> bySeverity;
    private final Map<ValidationCategory, Integer> byCategory;
    private final List<String> blockedNodes;

    ValidationSummary(int totalErrors, Map<ValidationSeverity, Integer> bySeverity,
                      Map<ValidationCategory, Integer> byCategory, List<String> blockedNodes) {
        this.totalErrors = totalErrors;
        this.bySeverity = new EnumMap<>(bySeverity);
        this.byCategory = byCategory.isEmpty() ? new EnumMap<>(ValidationCategory.class) : new EnumMap<>(byCategory);
        this.blockedNodes = List.copyOf(blockedNodes);
    }

    public int getTotalErrors() {
        return totalErrors;
    }

    public int getCount(ValidationSeverity severity) {
        return bySeverity.getOrDefault(severity, 0);
    }

    public int getErrorCount() {
        return getCount(ValidationSeverity.ERROR);
    }

    public int getWarningCount() {
        return getCount(ValidationSeverity.WARNING);
    }

    public int getInfoCount() {
        return getCount(ValidationSeverity.INFO);
    }

    public int getHintCount() {
        return getCount(ValidationSeverity.HINT);
    }

    public int getCategoryCount(ValidationCategory category) {
        return byCategory.getOrDefault(category, 0);
    }

    public Map<ValidationCategory, Integer> getErrorsByCategory() {
        return Map.copyOf(byCategory);
    }

    public List<String> getBlockedNodes() {
        return blockedNodes;
    }

    /**
     * Multi-line report suitable for logs and console output.
     */
    public String formatReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("Validation summary: ").append(totalErrors).append(" diagnostic(s)\n");
        sb.append("  errors:   ").append(getErrorCount()).append('\n');
        sb.append("  warnings: ").append(getWarningCount()).append('\n');
        sb.append("  info:     ").append(getInfoCount()).append('\n');
        sb.append("  hints:    ").append(getHintCount()).append('\n');
        byCategory.forEach((category, count) ->
                sb.append("  [").append(category.getValue()).append("] ").append(count).append('\n'));
        if (!blockedNodes.isEmpty()) {
            sb.append("  blocked nodes: ").append(String.join(", ", blockedNodes)).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ValidationSummary{" +
                "total=" + totalErrors +
                ", errors=" + getErrorCount() +
                ", warnings=" + getWarningCount() +
                ", blocked=" + blockedNodes +
                '}';
    }
}
