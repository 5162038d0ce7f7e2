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

package dev.mars.flowlift.analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bracket-quoted field references in tool expressions, e.g. {@code [Order Date] > '2024-01-01'}.
 * Expressions are only normalized, never translated.
 */
public final class FieldReferences {

    private static final Pattern BRACKETED = Pattern.compile("\\[([^\\]]+)\\]");

    private FieldReferences() {
    }

    /**
     * Removes bracket quoting from every field reference.
     *
     * @return the normalized expression, or {@code null} for a {@code null} expression
     */
    public static String normalizeExpression(String expression) {
        if (expression == null) {
            return null;
        }
        return BRACKETED.matcher(expression).replaceAll("$1").trim();
    }

    /**
     * Distinct field names referenced in the expression, in order of first appearance.
     */
    public static List<String> referencedFields(String expression) {
        if (expression == null) {
            return List.of();
        }
        Set<String> fields = new LinkedHashSet<>();
        Matcher matcher = BRACKETED.matcher(expression);
        while (matcher.find()) {
            fields.add(matcher.group(1).trim());
        }
        return new ArrayList<>(fields);
    }

    public static String normalizeField(String field) {
        if (field == null) {
            return null;
        }
        String trimmed = field.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("[") && trimmed.endsWith("]")) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
