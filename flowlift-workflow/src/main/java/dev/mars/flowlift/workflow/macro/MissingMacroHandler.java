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

/**
 * Decides what to do when a macro reference could not be found. Consulted
 * only in interactive mode, at most {@link ResolutionConfig#getMaxPromptAttempts()}
 * times per reference. A text prompt, a GUI dialog or a scripted policy can all
 * sit behind this interface.
 */
@FunctionalInterface
public interface MissingMacroHandler {

    /**
     * @return the decision; {@code null} is treated as {@link MissingMacroDecision#skip()}
     */
    MissingMacroDecision onMissing(MissingMacroContext context);
}
