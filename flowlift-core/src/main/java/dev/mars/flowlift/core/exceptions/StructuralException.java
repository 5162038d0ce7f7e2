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

package dev.mars.flowlift.core.exceptions;

import java.util.List;

/**
 * Thrown when a graph violates a structural invariant: dangling connection
 * endpoints, self-loops, container references that do not resolve to a container,
 * or container membership cycles. Fatal for the affected document only.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class StructuralException extends FlowliftException {

    private final String documentName;
    private final List<String> violations;

    public StructuralException(String documentName, List<String> violations) {
        super(buildMessage(documentName, violations));
        this.documentName = documentName;
        this.violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public StructuralException(String documentName, String violation) {
        this(documentName, List.of(violation));
    }

    public String getDocumentName() {
        return documentName;
    }

    public List<String> getViolations() {
        return violations;
    }

    private static String buildMessage(String documentName, List<String> violations) {
        StringBuilder sb = new StringBuilder("Structural validation failed");
        if (documentName != null) {
            sb.append(" for '").append(documentName).append("'");
        }
        sb.append(':');
        if (violations != null) {
            for (String violation : violations) {
                sb.append("\n  - ").append(violation);
            }
        }
        return sb.toString();
    }
}
