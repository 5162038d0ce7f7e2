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
 * Raised when a macro document is already on the in-progress resolution stack
 * (A references B references A). The resolver catches it and marks only the
 * offending reference node as missing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public class CircularMacroReferenceException extends FlowliftException {

    private final String reference;
    private final List<String> chain;

    public CircularMacroReferenceException(String reference, List<String> chain) {
        super("Circular reference to macro '" + reference + "' via " + String.join(" -> ", chain));
        this.reference = reference;
        this.chain = List.copyOf(chain);
    }

    public String getReference() {
        return reference;
    }

    public List<String> getChain() {
        return chain;
    }
}
