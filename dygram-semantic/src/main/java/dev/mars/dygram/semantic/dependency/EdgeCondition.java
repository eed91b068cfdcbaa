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
 * A guard found in an edge label.
 *
 * @param keyword {@code when}, {@code unless} or {@code if}, lower case
 * @param expression the guard text as written
 */
public record EdgeCondition(String keyword, String expression) {

    public static final String WHEN = "when";
    public static final String UNLESS = "unless";
    public static final String IF = "if";

    public EdgeCondition {
        Objects.requireNonNull(keyword, "Keyword cannot be null");
        Objects.requireNonNull(expression, "Expression cannot be null");
    }

    public boolean isNegated() {
        return UNLESS.equals(keyword);
    }

    /**
     * The expression an evaluator should run: {@code unless} guards come back negated.
     */
    public String executable() {
        return isNegated() ? "!(" + expression + ")" : expression;
    }
}
