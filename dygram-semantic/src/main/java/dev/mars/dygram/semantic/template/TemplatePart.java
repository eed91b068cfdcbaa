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

package dev.mars.dygram.semantic.template;

/**
 * A literal text run or a {@code {{ expression }}} placeholder within a template string.
 * {@code start} and {@code end} delimit the whole part, braces included; {@code contentStart}
 * is where the trimmed expression begins.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public record TemplatePart(Kind kind, String content, int start, int end, int contentStart) {

    public enum Kind {
        TEXT,
        PLACEHOLDER
    }

    public static TemplatePart text(String content, int start, int end) {
        return new TemplatePart(Kind.TEXT, content, start, end, start);
    }

    public boolean isPlaceholder() {
        return kind == Kind.PLACEHOLDER;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }
}
