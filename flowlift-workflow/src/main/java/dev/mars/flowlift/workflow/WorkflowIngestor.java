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

import dev.mars.flowlift.core.WorkflowGraph;
import dev.mars.flowlift.core.exceptions.FormatException;
import dev.mars.flowlift.core.exceptions.StructuralException;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Turns a raw workflow document into a {@link WorkflowGraph}.
 *
 * <p>Implementations reject documents that are not well-formed or lack the
 * mandatory top-level elements with a {@link FormatException}, and documents
 * whose graph breaks a structural invariant with a {@link StructuralException}.
 * Node-level problems are recorded in the graph's diagnostics instead.</p>
 */
public interface WorkflowIngestor {

    WorkflowGraph parse(Path document) throws FormatException, StructuralException;

    /**
     * @param documentName name used for the graph when the document carries none
     * @param documentPath where the document lives; may be {@code null}, in which
     *                     case document-relative macro lookup is unavailable
     */
    WorkflowGraph parse(InputStream input, String documentName, Path documentPath)
            throws FormatException, StructuralException;

    default WorkflowGraph parseFromString(String content, String documentName)
            throws FormatException, StructuralException {
        if (content == null) {
            throw new FormatException(documentName, "Empty or invalid workflow content");
        }
        return parse(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), documentName, null);
    }
}
