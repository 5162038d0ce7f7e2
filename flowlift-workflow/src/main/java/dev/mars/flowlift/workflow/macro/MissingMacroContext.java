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

package dev.mars.flowlift.workflow.macro;

import java.nio.file.Path;
import java.util.List;

/**
 * What a {@link MissingMacroHandler} is told about an unresolved reference.
 *
 * @param reference        the reference string as written in the host document
 * @param fileName         last path segment of the reference
 * @param workflowName     name of the document that contains the reference
 * @param documentPath     path of that document, or {@code null} for in-memory documents
 * @param attempt          1-based attempt number for this reference
 * @param searchedPaths    candidate paths that were probed, in order
 * @param parseFailed      whether at least one candidate existed but failed to parse
 */
public record MissingMacroContext(String reference, String fileName, String workflowName, Path documentPath,
                                  int attempt, List<Path> searchedPaths, boolean parseFailed) {

    public MissingMacroContext {
        searchedPaths = List.copyOf(searchedPaths);
    }
}
