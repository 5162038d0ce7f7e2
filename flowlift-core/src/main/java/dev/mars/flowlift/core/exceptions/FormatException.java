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

/**
 * Thrown when a workflow document cannot be parsed at all: unreadable file,
 * malformed XML, unexpected root element or a missing top-level section.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class FormatException extends FlowliftException {

    private final String documentName;
    private final int lineNumber;
    private final String fieldPath;

    public FormatException(String message) {
        this(null, -1, null, message, null);
    }

    public FormatException(String message, Throwable cause) {
        this(null, -1, null, message, cause);
    }

    public FormatException(String documentName, String message) {
        this(documentName, -1, null, message, null);
    }

    public FormatException(String documentName, String message, Throwable cause) {
        this(documentName, -1, null, message, cause);
    }

    public FormatException(String documentName, int lineNumber, String fieldPath, String message) {
        this(documentName, lineNumber, fieldPath, message, null);
    }

    public FormatException(String documentName, int lineNumber, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.documentName = documentName;
        this.lineNumber = lineNumber;
        this.fieldPath = fieldPath;
    }

    public String getDocumentName() {
        return documentName;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (documentName != null) {
            sb.append("Document '").append(documentName).append("': ");
        }

        if (lineNumber > 0) {
            sb.append("Line ").append(lineNumber).append(": ");
        }

        if (fieldPath != null) {
            sb.append("Element '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
