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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Macro usage across a batch of workflows: which macros were referenced, by
 * which workflows, whether they were found, and which are shared.
 * Macros are keyed by file name so the same macro referenced through different
 * relative paths counts once.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-11
 * @version 1.0
 */
public class MacroInventory {

    private final Map<String, Usage> macros = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    /**
     * Records every entry of a workflow's resolution report, nested references
     * included, against that workflow.
     */
    public synchronized void add(String workflowName, ResolutionReport report) {
        for (MacroResolution entry : report.getEntries()) {
            String key = entry.fileName().isEmpty() ? entry.reference() : entry.fileName();
            macros.computeIfAbsent(key, Usage::new).record(workflowName, entry);
        }
    }

    public synchronized List<Usage> getMacros() {
        return new ArrayList<>(macros.values());
    }

    /**
     * Macros used by more than one workflow.
     */
    public synchronized List<Usage> getShared() {
        List<Usage> shared = new ArrayList<>();
        for (Usage usage : macros.values()) {
            if (usage.getWorkflows().size() > 1) {
                shared.add(usage);
            }
        }
        return shared;
    }

    /**
     * Macros that were never resolved in any workflow.
     */
    public synchronized List<Usage> getMissing() {
        List<Usage> missing = new ArrayList<>();
        for (Usage usage : macros.values()) {
            if (!usage.isFound()) {
                missing.add(usage);
            }
        }
        return missing;
    }

    public synchronized Summary getSummary() {
        int found = 0;
        Map<String, Integer> usageCounts = new LinkedHashMap<>();
        for (Usage usage : macros.values()) {
            if (usage.isFound()) {
                found++;
            }
            usageCounts.put(usage.getName(), usage.getUseCount());
        }
        return new Summary(macros.size(), found, macros.size() - found, getShared().size(), usageCounts);
    }

    public record Summary(int totalMacros, int found, int missing, int shared, Map<String, Integer> usageCounts) {
        public Summary {
            usageCounts = Collections.unmodifiableMap(new LinkedHashMap<>(usageCounts));
        }
    }

    public static final class Usage {
        private final String name;
        private final Set<String> references = new LinkedHashSet<>();
        private final Set<String> workflows = new LinkedHashSet<>();
        private Path resolvedPath;
        private MissingReason missingReason;
        private int useCount;

        private Usage(String name) {
            this.name = name;
        }

        private void record(String workflowName, MacroResolution entry) {
            references.add(entry.reference());
            workflows.add(workflowName);
            useCount++;
            if (entry.isResolved()) {
                if (resolvedPath == null) {
                    resolvedPath = entry.resolvedPath();
                }
            } else if (missingReason == null) {
                missingReason = entry.missingReason();
            }
        }

        public String getName() {
            return name;
        }

        public Set<String> getReferences() {
            return Collections.unmodifiableSet(references);
        }

        public Set<String> getWorkflows() {
            return Collections.unmodifiableSet(workflows);
        }

        public boolean isFound() {
            return resolvedPath != null;
        }

        public Path getResolvedPath() {
            return resolvedPath;
        }

        /**
         * Reason of the first miss, or {@code null} if the macro was never missing.
         */
        public MissingReason getMissingReason() {
            return missingReason;
        }

        public int getUseCount() {
            return useCount;
        }

        @Override
        public String toString() {
            return "Usage{" +
                   "name='" + name + '\'' +
                   ", workflows=" + workflows +
                   ", found=" + isFound() +
                   '}';
        }
    }
}
