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

import dev.mars.flowlift.core.SearchLocation;
import dev.mars.flowlift.core.WorkflowGraph;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed macro documents keyed by reference string, kept for one resolution
 * run. The first successful resolution of a reference wins; later puts for the
 * same reference return the existing entry. All access is serialized on the
 * cache instance.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-09
 * @version 1.0
 */
public class ResolutionCache {

    /**
     * A parsed macro document and where it was found. The graph is the document
     * as ingested; nested macro references in it are still unresolved.
     */
    public record Entry(WorkflowGraph graph, Path path, SearchLocation location) {
        public Entry {
            Objects.requireNonNull(graph, "graph");
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(location, "location");
        }
    }

    private final Map<String, Entry> entries = new HashMap<>();
    private long hits;
    private long misses;

    public synchronized Optional<Entry> lookup(String reference) {
        Entry entry = entries.get(reference);
        if (entry != null) {
            hits++;
        } else {
            misses++;
        }
        return Optional.ofNullable(entry);
    }

    /**
     * Stores the entry unless the reference is already cached.
     *
     * @return the entry now associated with the reference
     */
    public synchronized Entry putIfAbsent(String reference, Entry entry) {
        Entry existing = entries.putIfAbsent(reference, entry);
        return existing != null ? existing : entry;
    }

    public synchronized boolean contains(String reference) {
        return entries.containsKey(reference);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long getHitCount() {
        return hits;
    }

    public synchronized long getMissCount() {
        return misses;
    }

    @Override
    public synchronized String toString() {
        return "ResolutionCache{" +
               "entries=" + entries.size() +
               ", hits=" + hits +
               ", misses=" + misses +
               '}';
    }
}
