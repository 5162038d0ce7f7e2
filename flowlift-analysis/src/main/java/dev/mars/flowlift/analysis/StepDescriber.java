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

import dev.mars.flowlift.core.MacroReference;
import dev.mars.flowlift.core.ToolConfig;
import dev.mars.flowlift.core.WorkflowNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Short human-readable phrases for transformation steps.
 */
final class StepDescriber {

    private StepDescriber() {
    }

    static String describe(WorkflowNode node) {
        ToolConfig config = node.getConfig();
        if (node.isMacroInput()) {
            return "Macro input '" + node.getAnchorName() + "'";
        }
        if (node.isMacroOutput()) {
            return "Macro output '" + node.getAnchorName() + "'";
        }
        if (config instanceof ToolConfig.Input) {
            return "Read " + DataEndpoint.of(node).name();
        }
        if (config instanceof ToolConfig.Output) {
            return "Write " + DataEndpoint.of(node).name();
        }
        if (config instanceof ToolConfig.Filter) {
            String expression = FieldReferences.normalizeExpression(((ToolConfig.Filter) config).expression());
            return expression != null ? "Filter rows where " + expression : "Filter rows";
        }
        if (config instanceof ToolConfig.Formula) {
            List<String> fields = ((ToolConfig.Formula) config).fields().stream()
                    .map(field -> FieldReferences.normalizeField(field.field()))
                    .collect(Collectors.toList());
            return "Compute " + String.join(", ", fields);
        }
        if (config instanceof ToolConfig.Join) {
            ToolConfig.Join join = (ToolConfig.Join) config;
            if (join.byPosition()) {
                return "Join by record position";
            }
            List<String> keys = new ArrayList<>();
            for (ToolConfig.JoinKey key : join.keys()) {
                keys.add(FieldReferences.normalizeField(key.left()) + " = " + FieldReferences.normalizeField(key.right()));
            }
            return keys.isEmpty() ? "Join" : "Join on " + String.join(" and ", keys);
        }
        if (config instanceof ToolConfig.Summarize) {
            ToolConfig.Summarize summarize = (ToolConfig.Summarize) config;
            List<String> aggregations = summarize.aggregations().stream()
                    .map(aggregation -> aggregation.operation() + "(" + FieldReferences.normalizeField(aggregation.field()) + ")")
                    .collect(Collectors.toList());
            String description = "Aggregate " + (aggregations.isEmpty() ? "rows" : String.join(", ", aggregations));
            return summarize.groupBy().isEmpty() ? description
                    : description + " by " + String.join(", ", summarize.groupBy());
        }
        if (config instanceof ToolConfig.Select) {
            ToolConfig.Select select = (ToolConfig.Select) config;
            long kept = select.fields().stream().filter(ToolConfig.SelectField::selected).count();
            return "Select " + kept + " of " + select.fields().size() + " fields";
        }
        if (config instanceof ToolConfig.Sort) {
            List<String> order = ((ToolConfig.Sort) config).fields().stream()
                    .map(field -> FieldReferences.normalizeField(field.field()) + (field.ascending() ? " ASC" : " DESC"))
                    .collect(Collectors.toList());
            return "Sort by " + String.join(", ", order);
        }
        if (config instanceof ToolConfig.Union) {
            String mode = ((ToolConfig.Union) config).mode();
            return mode != null ? "Union inputs (" + mode + ")" : "Union inputs";
        }
        if (config instanceof ToolConfig.Macro) {
            MacroReference reference = ((ToolConfig.Macro) config).reference();
            String description = "Macro '" + reference.getReference() + "' (" + reference.getStatus();
            if (reference.getMissingReason() != null) {
                description += ": " + reference.getMissingReason().getDescription();
            }
            return description + ")";
        }
        return "Tool " + node.getPlugin();
    }

    /**
     * Normalized predicate of a Filter or assignments of a Formula, else {@code null}.
     */
    static String expression(WorkflowNode node) {
        ToolConfig config = node.getConfig();
        if (config instanceof ToolConfig.Filter) {
            return FieldReferences.normalizeExpression(((ToolConfig.Filter) config).expression());
        }
        if (config instanceof ToolConfig.Formula) {
            return ((ToolConfig.Formula) config).fields().stream()
                    .map(field -> FieldReferences.normalizeField(field.field()) + " = "
                            + FieldReferences.normalizeExpression(field.expression()))
                    .collect(Collectors.joining("; "));
        }
        return null;
    }
}
