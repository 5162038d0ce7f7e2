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

import dev.mars.flowlift.core.MissingReason;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Every reference visited during one resolution, nested references included,
 * in the order they were settled.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-09
 * @version 1.0
 */
public final class ResolutionReport {

    private static final ResolutionReport EMPTY = new ResolutionReport(List.of());

    private final List<MacroResolution> entries;

    public ResolutionReport(List<MacroResolution> entries) {
        this.entries = List.copyOf(entries);
    }

    public static ResolutionReport empty() {
        return EMPTY;
    }

    public List<MacroResolution> getEntries() {
        return entries;
    }

    public List<MacroResolution> getResolved() {
        return entries.stream().filter(MacroResolution::isResolved).collect(Collectors.toList());
    }

    public List<MacroResolution> getMissing() {
        return entries.stream().filter(MacroResolution::isMissing).collect(Collectors.toList());
    }

    public List<MacroResolution> getMissing(MissingReason reason) {
        List<MacroResolution> result = new ArrayList<>();
        for (MacroResolution entry : entries) {
            if (entry.isMissing() && entry.missingReason() == reason) {
                result.add(entry);
            }
        }
        return result;
    }

    public boolean hasMissing() {
        return entries.stream().anyMatch(MacroResolution::isMissing);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "ResolutionReport{" +
               "resolved=" + getResolved().size() +
               ", missing=" + getMissing().size() +
               '}';
    }
}
