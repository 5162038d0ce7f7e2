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

import dev.mars.flowlift.core.NodeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a code generator needs to emit a model for one flow node. Parameters are
 * plain values (strings, booleans, integers, lists and maps of those) keyed by
 * the constants below, so a directive serializes directly to JSON.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-13
 * @version 1.0
 */
public record GenerationDirective(int nodeId, NodeKind kind, MedallionLayer layer, String modelName,
                                  String materialization, List<Integer> upstreamIds, Map<String, Object> parameters) {

    public static final String PREDICATE = "predicate";
    public static final String FIELDS = "fields";
    public static final String ASSIGNMENTS = "assignments";
    public static final String JOIN_VARIANT = "joinVariant";
    public static final String JOIN_KEYS = "joinKeys";
    public static final String BY_POSITION = "byPosition";
    public static final String GROUP_BY = "groupBy";
    public static final String AGGREGATIONS = "aggregations";
    public static final String COLUMNS = "columns";
    public static final String DROPPED = "dropped";
    public static final String INCLUDE_UNKNOWN = "includeUnknownFields";
    public static final String ORDER_BY = "orderBy";
    public static final String UNION_MODE = "mode";
    public static final String INPUT_COUNT = "inputCount";
    public static final String ENDPOINT = "endpoint";
    public static final String MACRO_REFERENCE = "reference";
    public static final String MACRO_STATUS = "status";
    public static final String MISSING_REASON = "missingReason";
    public static final String PLUGIN = "plugin";

    public GenerationDirective {
        upstreamIds = List.copyOf(upstreamIds);
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public Object parameter(String key) {
        return parameters.get(key);
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> listParameter(String key) {
        Object value = parameters.get(key);
        return value instanceof List ? (List<T>) value : List.of();
    }
}
