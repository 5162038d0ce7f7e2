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
import java.util.Objects;

/**
 * Answer of a {@link MissingMacroHandler}.
 */
public sealed interface MissingMacroDecision {

    /**
     * Add a search directory for the rest of the run and search again.
     */
    record Retry(Path directory) implements MissingMacroDecision {
        public Retry {
            Objects.requireNonNull(directory, "directory");
        }
    }

    /**
     * Use this file as the macro document.
     */
    record ForcePath(Path file) implements MissingMacroDecision {
        public ForcePath {
            Objects.requireNonNull(file, "file");
        }
    }

    /**
     * Leave this reference missing.
     */
    record Skip() implements MissingMacroDecision {
    }

    /**
     * Leave this and every later missing reference of the run missing, without asking again.
     */
    record SkipAll() implements MissingMacroDecision {
    }

    static MissingMacroDecision retry(Path directory) {
        return new Retry(directory);
    }

    static MissingMacroDecision forcePath(Path file) {
        return new ForcePath(file);
    }

    static MissingMacroDecision skip() {
        return new Skip();
    }

    static MissingMacroDecision skipAll() {
        return new SkipAll();
    }
}
