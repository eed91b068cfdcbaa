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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code {{ ... }}} placeholders out of attribute text.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class TemplateParser {

    // Any placeholder, whatever the expression.
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([^}]*)\\}\\}");

    // Placeholders that are a plain dotted path, e.g. {{ config.apiKey }}.
    private static final Pattern REFERENCE = Pattern.compile("\\{\\{\\s*([a-zA-Z_][a-zA-Z0-9_.]*)\\s*\\}\\}");

    private TemplateParser() {
    }

    /**
     * Splits a value into text and placeholder parts. Surrounding quotes are removed first.
     */
    public static TemplateStructure parse(String value) {
        String cleaned = value.replaceAll("^[\"']|[\"']$", "");

        if (!cleaned.contains("{{")) {
            return new TemplateStructure(false, cleaned,
                    List.of(TemplatePart.text(cleaned, 0, cleaned.length())));
        }

        List<TemplatePart> parts = new ArrayList<>();
        int position = 0;
        Matcher matcher = PLACEHOLDER.matcher(cleaned);
        while (matcher.find()) {
            if (matcher.start() > position) {
                parts.add(TemplatePart.text(cleaned.substring(position, matcher.start()), position, matcher.start()));
            }
            String inner = matcher.group(1);
            int leading = inner.length() - inner.stripLeading().length();
            parts.add(new TemplatePart(TemplatePart.Kind.PLACEHOLDER, inner.trim(),
                    matcher.start(), matcher.end(), matcher.start(1) + leading));
            position = matcher.end();
        }
        if (position < cleaned.length()) {
            parts.add(TemplatePart.text(cleaned.substring(position), position, cleaned.length()));
        }
        return new TemplateStructure(true, cleaned, parts);
    }

    /**
     * Dotted reference paths used as placeholders, in order of first appearance.
     */
    public static Set<String> referencePaths(String text) {
        Set<String> paths = new LinkedHashSet<>();
        Matcher matcher = REFERENCE.matcher(text);
        while (matcher.find()) {
            paths.add(matcher.group(1));
        }
        return paths;
    }

    public static boolean isTemplate(String text) {
        return PLACEHOLDER.matcher(text).find();
    }
}
