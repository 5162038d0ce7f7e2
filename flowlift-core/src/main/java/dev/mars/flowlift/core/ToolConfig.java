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

package dev.mars.flowlift.core;

import java.util.List;
import java.util.Objects;

/**
 * Typed configuration payload of a node. One variant per known {@link NodeKind};
 * anything else keeps its raw payload in {@link Other}.
 *
 * <p>Variants are plain values: string fields may be {@code null} when the source
 * document omits them, list fields are never {@code null}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public sealed interface ToolConfig {

    /**
     * Whether this configuration carries aggregation definitions.
     */
    default boolean hasAggregations() {
        return false;
    }

    /**
     * Data source read by an Input tool. {@code anchorName} is set only for Macro
     * Input boundary tools and names the input anchor of the enclosing macro.
     */
    record Input(String filePath, String connection, String table, String query, String anchorName)
            implements ToolConfig {
    }

    /**
     * Data sink written by an Output tool. {@code anchorName} is set only for
     * Macro Output boundary tools.
     */
    record Output(String filePath, String connection, String table, String anchorName)
            implements ToolConfig {
    }

    record Filter(String expression, boolean simpleMode) implements ToolConfig {
    }

    record FormulaField(String field, String expression, String type, String size) {
    }

    record Formula(List<FormulaField> fields) implements ToolConfig {
        public Formula {
            fields = List.copyOf(fields);
        }
    }

    record JoinKey(String left, String right) {
    }

    record Join(boolean byPosition, List<JoinKey> keys, String joinType) implements ToolConfig {
        public Join {
            keys = List.copyOf(keys);
        }
    }

    record Aggregation(String field, String operation, String outputName) {
    }

    record Summarize(List<String> groupBy, List<Aggregation> aggregations) implements ToolConfig {
        public Summarize {
            groupBy = List.copyOf(groupBy);
            aggregations = List.copyOf(aggregations);
        }

        @Override
        public boolean hasAggregations() {
            return !aggregations.isEmpty();
        }
    }

    record SelectField(String field, boolean selected, String rename, String type) {
    }

    record Select(List<SelectField> fields, boolean includeUnknownFields) implements ToolConfig {
        public Select {
            fields = List.copyOf(fields);
        }
    }

    record SortField(String field, boolean ascending) {
    }

    record Sort(List<SortField> fields) implements ToolConfig {
        public Sort {
            fields = List.copyOf(fields);
        }
    }

    record Union(String mode) implements ToolConfig {
    }

    record Container(String caption, boolean disabled) implements ToolConfig {
    }

    record Macro(MacroReference reference) implements ToolConfig {
        public Macro {
            Objects.requireNonNull(reference, "reference");
        }
    }

    /**
     * Tools the kind table does not know. The raw configuration XML is kept so
     * downstream generators can still inspect it.
     */
    record Other(String rawPayload) implements ToolConfig {
    }
}
