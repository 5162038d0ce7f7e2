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

import java.nio.file.Path;
import java.util.Objects;

/**
 * Document-level metadata of a workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-10-05
 */
public final class WorkflowMetadata {

    private final String name;
    private final String description;
    private final String author;
    private final String sourceVersion;
    private final Path documentPath;

    public WorkflowMetadata(String name, String description, String author, String sourceVersion,
                            Path documentPath) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.description = description;
        this.author = author;
        this.sourceVersion = sourceVersion;
        this.documentPath = documentPath;
    }

    public static WorkflowMetadata named(String name) {
        return new WorkflowMetadata(name, null, null, null, null);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getAuthor() {
        return author;
    }

    /**
     * The {@code yxmdVer} attribute of the source document, if present.
     */
    public String getSourceVersion() {
        return sourceVersion;
    }

    /**
     * Location the document was read from; {@code null} for in-memory documents.
     * Macro references are resolved relative to its parent directory.
     */
    public Path getDocumentPath() {
        return documentPath;
    }

    public Path getDocumentDirectory() {
        if (documentPath == null) {
            return null;
        }
        Path parent = documentPath.toAbsolutePath().getParent();
        return parent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowMetadata that = (WorkflowMetadata) o;
        return name.equals(that.name) &&
               Objects.equals(description, that.description) &&
               Objects.equals(author, that.author) &&
               Objects.equals(sourceVersion, that.sourceVersion) &&
               Objects.equals(documentPath, that.documentPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, author, sourceVersion, documentPath);
    }

    @Override
    public String toString() {
        return "WorkflowMetadata{" +
               "name='" + name + '\'' +
               ", sourceVersion='" + sourceVersion + '\'' +
               ", documentPath=" + documentPath +
               '}';
    }
}
