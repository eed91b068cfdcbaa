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

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A template string split into parts, with offset queries for editor-style tooling.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public record TemplateStructure(boolean template, String raw, List<TemplatePart> parts) {

    public TemplateStructure {
        parts = List.copyOf(parts);
    }

    public Optional<TemplatePart> getPartAtOffset(int offset) {
        return parts.stream().filter(p -> p.contains(offset)).findFirst();
    }

    public boolean isInsidePlaceholder(int offset) {
        return getPartAtOffset(offset).filter(TemplatePart::isPlaceholder).isPresent();
    }

    /**
     * The part of the placeholder expression left of {@code offset}, or an empty string when
     * the offset is not inside a placeholder.
     */
    public String getExpressionBeforeCursor(int offset) {
        Optional<TemplatePart> part = getPartAtOffset(offset).filter(TemplatePart::isPlaceholder);
        if (part.isEmpty()) {
            return "";
        }
        String content = part.get().content();
        int relative = offset - part.get().contentStart();
        if (relative <= 0) {
            return "";
        }
        return relative >= content.length() ? content : content.substring(0, relative);
    }

    public List<String> getPlaceholders() {
        return parts.stream()
                .filter(TemplatePart::isPlaceholder)
                .map(TemplatePart::content)
                .collect(Collectors.toList());
    }
}
