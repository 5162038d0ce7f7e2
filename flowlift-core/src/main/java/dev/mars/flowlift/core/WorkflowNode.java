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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single tool of a workflow graph.
 *
 * <p>Nodes are immutable. Identity within a graph is the integer {@code id}; the
 * remaining fields describe what the tool does ({@link #getKind()},
 * {@link #getConfig()}) and where it sits ({@link #getContainerId()},
 * {@link #getChildIds()}). Container membership is recorded on both sides: the
 * container lists its children in declaration order and every child carries the
 * container id as a back-reference.</p>
 *
 * <h3>Builder Pattern:</h3>
 * <pre>{@code
 * WorkflowNode filter = WorkflowNode.builder(3, NodeKind.FILTER)
 *     .plugin("AlteryxBasePluginsGui.Filter.Filter")
 *     .config(new ToolConfig.Filter("[Amount] > 0", false))
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public final class WorkflowNode {

    private final int id;
    private final NodeKind kind;
    private final String plugin;
    private final String displayName;
    private final Position position;
    private final String annotation;
    private final ToolConfig config;
    private final String rawConfiguration;
    private final Integer containerId;
    private final List<Integer> childIds;
    private final NodeOrigin origin;

    private WorkflowNode(Builder builder) {
        this.id = builder.id;
        this.kind = Objects.requireNonNull(builder.kind, "Kind cannot be null");
        this.plugin = builder.plugin != null ? builder.plugin : "";
        this.displayName = builder.displayName != null ? builder.displayName : kind.getLabel();
        this.position = builder.position != null ? builder.position : Position.ORIGIN;
        this.annotation = builder.annotation;
        this.config = builder.config != null ? builder.config : new ToolConfig.Other(builder.rawConfiguration);
        this.rawConfiguration = builder.rawConfiguration;
        this.containerId = builder.containerId;
        this.childIds = List.copyOf(builder.childIds);
        this.origin = builder.origin;
    }

    public int getId() { return id; }

    public NodeKind getKind() { return kind; }

    /**
     * Plugin identifier from the source document; empty for macro references.
     */
    public String getPlugin() { return plugin; }

    public String getDisplayName() { return displayName; }

    public Position getPosition() { return position; }

    public String getAnnotation() { return annotation; }

    public ToolConfig getConfig() { return config; }

    public String getRawConfiguration() { return rawConfiguration; }

    public Integer getContainerId() { return containerId; }

    public List<Integer> getChildIds() { return childIds; }

    public NodeOrigin getOrigin() { return origin; }

    public boolean isContainer() {
        return kind == NodeKind.CONTAINER;
    }

    /**
     * The macro reference of a MACRO node, or {@code null} for every other kind.
     */
    public MacroReference getMacroReference() {
        if (config instanceof ToolConfig.Macro) {
            return ((ToolConfig.Macro) config).reference();
        }
        return null;
    }

    /**
     * Whether this is a Macro Input boundary tool, i.e. an Input that names an
     * anchor of the enclosing macro.
     */
    public boolean isMacroInput() {
        return config instanceof ToolConfig.Input && ((ToolConfig.Input) config).anchorName() != null;
    }

    public boolean isMacroOutput() {
        return config instanceof ToolConfig.Output && ((ToolConfig.Output) config).anchorName() != null;
    }

    /**
     * Anchor name of a macro boundary tool, or {@code null}.
     */
    public String getAnchorName() {
        if (config instanceof ToolConfig.Input) {
            return ((ToolConfig.Input) config).anchorName();
        }
        if (config instanceof ToolConfig.Output) {
            return ((ToolConfig.Output) config).anchorName();
        }
        return null;
    }

    public Builder toBuilder() {
        return new Builder(id, kind)
                .plugin(plugin)
                .displayName(displayName)
                .position(position)
                .annotation(annotation)
                .config(config)
                .rawConfiguration(rawConfiguration)
                .containerId(containerId)
                .childIds(childIds)
                .origin(origin);
    }

    public static Builder builder(int id, NodeKind kind) {
        return new Builder(id, kind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowNode that = (WorkflowNode) o;
        return id == that.id &&
               kind == that.kind &&
               plugin.equals(that.plugin) &&
               displayName.equals(that.displayName) &&
               position.equals(that.position) &&
               Objects.equals(annotation, that.annotation) &&
               config.equals(that.config) &&
               Objects.equals(rawConfiguration, that.rawConfiguration) &&
               Objects.equals(containerId, that.containerId) &&
               childIds.equals(that.childIds) &&
               Objects.equals(origin, that.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, plugin, displayName, containerId, childIds);
    }

    @Override
    public String toString() {
        return "WorkflowNode{" +
               "id=" + id +
               ", kind=" + kind +
               ", displayName='" + displayName + '\'' +
               (containerId != null ? ", containerId=" + containerId : "") +
               (childIds.isEmpty() ? "" : ", childIds=" + childIds) +
               '}';
    }

    public static class Builder {
        private int id;
        private final NodeKind kind;
        private String plugin;
        private String displayName;
        private Position position;
        private String annotation;
        private ToolConfig config;
        private String rawConfiguration;
        private Integer containerId;
        private List<Integer> childIds = new ArrayList<>();
        private NodeOrigin origin;

        private Builder(int id, NodeKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder plugin(String plugin) {
            this.plugin = plugin;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        public Builder annotation(String annotation) {
            this.annotation = annotation;
            return this;
        }

        public Builder config(ToolConfig config) {
            this.config = config;
            return this;
        }

        public Builder rawConfiguration(String rawConfiguration) {
            this.rawConfiguration = rawConfiguration;
            return this;
        }

        public Builder containerId(Integer containerId) {
            this.containerId = containerId;
            return this;
        }

        public Builder childIds(List<Integer> childIds) {
            this.childIds = new ArrayList<>(childIds != null ? childIds : List.of());
            return this;
        }

        public Builder addChild(int childId) {
            this.childIds.add(childId);
            return this;
        }

        public Builder origin(NodeOrigin origin) {
            this.origin = origin;
            return this;
        }

        public WorkflowNode build() {
            return new WorkflowNode(this);
        }
    }
}
