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

package dev.mars.flowlift.workflow;

import dev.mars.flowlift.core.NodeKind;
import dev.mars.flowlift.core.ToolConfig;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static dev.mars.flowlift.workflow.XmlElements.attribute;
import static dev.mars.flowlift.workflow.XmlElements.child;
import static dev.mars.flowlift.workflow.XmlElements.childText;
import static dev.mars.flowlift.workflow.XmlElements.descendantText;
import static dev.mars.flowlift.workflow.XmlElements.descendants;
import static dev.mars.flowlift.workflow.XmlElements.firstDescendant;
import static dev.mars.flowlift.workflow.XmlElements.isTrue;
import static dev.mars.flowlift.workflow.XmlElements.text;
import static dev.mars.flowlift.workflow.XmlElements.toXml;

/**
 * Maps a tool's {@code Configuration} element to its typed {@link ToolConfig}.
 * Stateless; the same element always yields an equal value.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class ToolConfigExtractor {

    static final String MACRO_INPUT = "MacroInput";
    static final String MACRO_OUTPUT = "MacroOutput";
    private static final String FILE_SEPARATOR = "|||";

    /**
     * @param kind          the node kind resolved from the plugin
     * @param simpleName    last segment of the plugin identifier
     * @param configuration the {@code Properties/Configuration} element, may be {@code null}
     * @param toolId        used for default macro anchor names
     * @param annotation    node annotation, preferred anchor name fallback for macro boundaries
     */
    public ToolConfig extract(NodeKind kind, String simpleName, Element configuration, int toolId,
                              String annotation) {
        switch (kind) {
            case INPUT:
                return extractInput(configuration, MACRO_INPUT.equalsIgnoreCase(simpleName)
                        ? anchorName(configuration, annotation, "Input_" + toolId) : null);
            case OUTPUT:
                return extractOutput(configuration, MACRO_OUTPUT.equalsIgnoreCase(simpleName)
                        ? anchorName(configuration, annotation, "Output_" + toolId) : null);
            case FILTER:
                return extractFilter(configuration);
            case FORMULA:
                return extractFormula(configuration);
            case JOIN:
                return extractJoin(configuration);
            case SUMMARIZE:
                return extractSummarize(configuration);
            case SELECT:
                return extractSelect(configuration);
            case SORT:
                return extractSort(configuration);
            case UNION:
                return new ToolConfig.Union(descendantText(configuration, "Mode"));
            case CONTAINER:
                return new ToolConfig.Container(descendantText(configuration, "Caption"),
                        isTrue(attribute(child(configuration, "Disabled"), "value")));
            default:
                return new ToolConfig.Other(toXml(configuration));
        }
    }

    private String anchorName(Element configuration, String annotation, String fallback) {
        String name = childText(configuration, "Name");
        if (name != null) {
            return name;
        }
        return annotation != null && !annotation.isBlank() ? annotation.trim() : fallback;
    }

    private ToolConfig.Input extractInput(Element configuration, String anchorName) {
        String file = fileValue(configuration);
        String connection = descendantText(configuration, "Connection");
        String table = descendantText(configuration, "Table");
        String query = descendantText(configuration, "Query");
        if (query == null) {
            query = descendantText(configuration, "SQLStatement");
        }

        if (file != null && file.contains(FILE_SEPARATOR)) {
            int split = file.indexOf(FILE_SEPARATOR);
            String source = file.substring(0, split).trim();
            String target = file.substring(split + FILE_SEPARATOR.length()).trim();
            if (connection == null && !source.isEmpty()) {
                connection = source;
            }
            if (!target.isEmpty()) {
                if (looksLikeQuery(target)) {
                    query = query != null ? query : target;
                } else {
                    table = table != null ? table : target;
                }
            }
        }
        return new ToolConfig.Input(file, connection, table, query, anchorName);
    }

    private ToolConfig.Output extractOutput(Element configuration, String anchorName) {
        String file = fileValue(configuration);
        String connection = descendantText(configuration, "Connection");
        String table = descendantText(configuration, "Table");
        if (file != null && file.contains(FILE_SEPARATOR)) {
            int split = file.indexOf(FILE_SEPARATOR);
            String source = file.substring(0, split).trim();
            String target = file.substring(split + FILE_SEPARATOR.length()).trim();
            if (connection == null && !source.isEmpty()) {
                connection = source;
            }
            if (table == null && !target.isEmpty()) {
                table = target;
            }
        }
        return new ToolConfig.Output(file, connection, table, anchorName);
    }

    private String fileValue(Element configuration) {
        Element file = firstDescendant(configuration, "File");
        if (file == null) {
            return null;
        }
        String value = text(file);
        return value != null ? value : attribute(file, "OutputFileName");
    }

    private static boolean looksLikeQuery(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        return lower.startsWith("select ") || lower.startsWith("with ");
    }

    private ToolConfig.Filter extractFilter(Element configuration) {
        String expression = descendantText(configuration, "Expression");
        boolean simpleMode = "Simple".equalsIgnoreCase(descendantText(configuration, "Mode"));
        if (simpleMode) {
            String field = descendantText(configuration, "Field");
            String operator = descendantText(configuration, "Operator");
            if (field != null && operator != null) {
                StringBuilder sb = new StringBuilder();
                sb.append('[').append(field).append("] ").append(operator);
                List<String> operands = new ArrayList<>();
                for (Element operand : descendants(configuration, "Operand")) {
                    String value = text(operand);
                    if (value != null) {
                        operands.add(value);
                    }
                }
                if (!operands.isEmpty()) {
                    sb.append(' ').append(String.join(", ", operands));
                }
                expression = sb.toString();
            }
        }
        return new ToolConfig.Filter(expression, simpleMode);
    }

    private ToolConfig.Formula extractFormula(Element configuration) {
        List<ToolConfig.FormulaField> fields = new ArrayList<>();
        for (Element formula : descendants(configuration, "FormulaField")) {
            fields.add(new ToolConfig.FormulaField(
                    attribute(formula, "field"),
                    attribute(formula, "expression"),
                    attribute(formula, "type"),
                    attribute(formula, "size")));
        }
        return new ToolConfig.Formula(fields);
    }

    private ToolConfig.Join extractJoin(Element configuration) {
        Element byPositionElement = firstDescendant(configuration, "JoinByRecordPos");
        boolean byPosition = byPositionElement != null
                && (isTrue(attribute(byPositionElement, "value")) || isTrue(text(byPositionElement)));

        List<ToolConfig.JoinKey> keys = new ArrayList<>();
        for (Element field : descendants(configuration, "Field")) {
            String left = attribute(field, "left");
            String right = attribute(field, "right");
            if (left != null && right != null) {
                keys.add(new ToolConfig.JoinKey(left, right));
            }
        }

        if (keys.isEmpty()) {
            List<String> leftFields = new ArrayList<>();
            List<String> rightFields = new ArrayList<>();
            for (Element joinInfo : descendants(configuration, "JoinInfo")) {
                String side = attribute(joinInfo, "connection", "");
                List<String> target = "Left".equalsIgnoreCase(side) ? leftFields
                        : "Right".equalsIgnoreCase(side) ? rightFields : null;
                if (target == null) {
                    continue;
                }
                for (Element field : descendants(joinInfo, "Field")) {
                    String name = attribute(field, "field");
                    if (name != null) {
                        target.add(name);
                    }
                }
            }
            int pairs = Math.min(leftFields.size(), rightFields.size());
            for (int i = 0; i < pairs; i++) {
                keys.add(new ToolConfig.JoinKey(leftFields.get(i), rightFields.get(i)));
            }
        }

        String joinType = attribute(firstDescendant(configuration, "SelectJoinInfo"), "connection");
        return new ToolConfig.Join(byPosition, keys, joinType);
    }

    private ToolConfig.Summarize extractSummarize(Element configuration) {
        List<String> groupBy = new ArrayList<>();
        List<ToolConfig.Aggregation> aggregations = new ArrayList<>();
        for (Element field : descendants(configuration, "SummarizeField")) {
            String name = attribute(field, "field");
            String action = attribute(field, "action", "");
            if (name == null) {
                continue;
            }
            if ("GroupBy".equalsIgnoreCase(action)) {
                groupBy.add(name);
            } else {
                aggregations.add(new ToolConfig.Aggregation(name, action, attribute(field, "rename", name)));
            }
        }
        return new ToolConfig.Summarize(groupBy, aggregations);
    }

    private ToolConfig.Select extractSelect(Element configuration) {
        List<ToolConfig.SelectField> fields = new ArrayList<>();
        boolean includeUnknown = false;
        for (Element field : descendants(configuration, "SelectField")) {
            String name = attribute(field, "field");
            if (name == null) {
                continue;
            }
            boolean selected = !"False".equalsIgnoreCase(attribute(field, "selected", "True"));
            if ("*Unknown".equalsIgnoreCase(name)) {
                includeUnknown = selected;
                continue;
            }
            fields.add(new ToolConfig.SelectField(name, selected, attribute(field, "rename"), attribute(field, "type")));
        }
        return new ToolConfig.Select(fields, includeUnknown);
    }

    private ToolConfig.Sort extractSort(Element configuration) {
        List<ToolConfig.SortField> fields = new ArrayList<>();
        for (Element sortInfo : descendants(configuration, "SortInfo")) {
            addSortField(sortInfo, fields);
            for (Element field : descendants(sortInfo, "Field")) {
                addSortField(field, fields);
            }
        }
        return new ToolConfig.Sort(fields);
    }

    private void addSortField(Element element, List<ToolConfig.SortField> fields) {
        String name = attribute(element, "field");
        if (name != null) {
            String order = attribute(element, "order", "Ascending");
            fields.add(new ToolConfig.SortField(name, !"Descending".equalsIgnoreCase(order)));
        }
    }
}
