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
import dev.mars.flowlift.core.ToolConfig;
import dev.mars.flowlift.core.WorkflowNode;

/**
 * A data source or target of a workflow: the external side of an Input or Output tool.
 *
 * @param nodeId     id of the Input or Output node
 * @param name       table name, file stem, annotation or display name, whichever comes first
 * @param type       kind of endpoint
 * @param path       file path, if any
 * @param connection database connection, if any
 * @param table      table name, if any
 * @param query      SQL query, if any
 */
public record DataEndpoint(int nodeId, String name, Type type, String path, String connection, String table,
                           String query) {

    public enum Type {
        FILE,
        DATABASE,
        QUERY,
        UNKNOWN
    }

    /**
     * Endpoint of an Input or Output node, or {@code null} for any other node
     * and for macro boundary tools, which have no external side.
     */
    public static DataEndpoint of(WorkflowNode node) {
        if (node.isMacroInput() || node.isMacroOutput()) {
            return null;
        }
        String path = null;
        String connection = null;
        String table = null;
        String query = null;
        if (node.getConfig() instanceof ToolConfig.Input) {
            ToolConfig.Input input = (ToolConfig.Input) node.getConfig();
            path = input.filePath();
            connection = input.connection();
            table = input.table();
            query = input.query();
        } else if (node.getConfig() instanceof ToolConfig.Output) {
            ToolConfig.Output output = (ToolConfig.Output) node.getConfig();
            path = output.filePath();
            connection = output.connection();
            table = output.table();
        } else if (node.getKind() != NodeKind.INPUT && node.getKind() != NodeKind.OUTPUT) {
            return null;
        }
        return new DataEndpoint(node.getId(), nameOf(node, path, table), typeOf(path, connection, table, query),
                path, connection, table, query);
    }

    private static Type typeOf(String path, String connection, String table, String query) {
        if (query != null) {
            return Type.QUERY;
        }
        if (connection != null || table != null) {
            return Type.DATABASE;
        }
        return path != null ? Type.FILE : Type.UNKNOWN;
    }

    private static String nameOf(WorkflowNode node, String path, String table) {
        if (table != null) {
            return table;
        }
        if (path != null) {
            return fileStem(path);
        }
        if (node.getAnnotation() != null) {
            return node.getAnnotation();
        }
        return node.getDisplayName();
    }

    static String fileStem(String path) {
        String name = path;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int pipe = name.indexOf('|');
        if (pipe >= 0) {
            name = name.substring(0, pipe);
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
