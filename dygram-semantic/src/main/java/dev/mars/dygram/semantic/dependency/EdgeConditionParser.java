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

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code when:}, {@code unless:} and {@code if:} guards from edge labels.
 *
 * <p>Keywords are tried in that order and matched case-insensitively. The guard may be double
 * quoted, single quoted, or bare, in which case it runs to the next semicolon or the end of the
 * label.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class EdgeConditionParser {

    private static final List<String> KEYWORDS = List.of(EdgeCondition.WHEN, EdgeCondition.UNLESS, EdgeCondition.IF);
    private static final List<String> EXTERNAL_MARKERS = List.of("tool", "external", "api", "call");

    private EdgeConditionParser() {
    }

    public static Optional<EdgeCondition> extractRaw(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        for (String keyword : KEYWORDS) {
            Optional<String> expression = find(keyword, label);
            if (expression.isPresent()) {
                return Optional.of(new EdgeCondition(keyword, expression.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * The executable guard of a label, with {@code unless} negated.
     */
    public static Optional<String> extract(String label) {
        return extractRaw(label).map(EdgeCondition::executable);
    }

    /**
     * A condition is simple when it only looks at context and runtime state. Anything mentioning
     * tools or external calls needs an agent to decide.
     */
    public static boolean isSimpleCondition(String condition) {
        if (condition == null) {
            return true;
        }
        return EXTERNAL_MARKERS.stream().noneMatch(condition::contains);
    }

    private static Optional<String> find(String keyword, String label) {
        String prefix = "\\b" + keyword + ":\\s*";
        for (String body : List.of("\"([^\"]+)\"", "'([^']+)'", "([^;]+)")) {
            Matcher matcher = Pattern.compile(prefix + body, Pattern.CASE_INSENSITIVE).matcher(label);
            if (matcher.find()) {
                String expression = matcher.group(1).trim();
                if (!expression.isEmpty()) {
                    return Optional.of(expression);
                }
            }
        }
        return Optional.empty();
    }
}
