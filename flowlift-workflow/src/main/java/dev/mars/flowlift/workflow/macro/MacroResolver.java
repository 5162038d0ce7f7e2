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

import dev.mars.flowlift.core.MacroReference;
import dev.mars.flowlift.core.MissingReason;
import dev.mars.flowlift.core.SearchLocation;
import dev.mars.flowlift.core.ToolConfig;
import dev.mars.flowlift.core.WorkflowGraph;
import dev.mars.flowlift.core.WorkflowNode;
import dev.mars.flowlift.core.exceptions.CircularMacroReferenceException;
import dev.mars.flowlift.core.exceptions.FormatException;
import dev.mars.flowlift.core.exceptions.StructuralException;
import dev.mars.flowlift.workflow.WorkflowIngestor;
import dev.mars.flowlift.workflow.observability.ResolutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Replaces every unresolved macro reference node of a workflow graph with the
 * contents of the referenced macro document, recursively.
 *
 * <p>A reference is looked up in this order, the first existing candidate that
 * parses winning:</p>
 * <ol>
 *   <li>the resolution cache</li>
 *   <li>the reference as a path</li>
 *   <li>the reference, then its file name, relative to the referencing document</li>
 *   <li>{@code macros/} and {@code Macros/} next to the referencing document</li>
 *   <li>the parent directory of the referencing document, and its {@code macros/}</li>
 *   <li>each configured search directory, then its subdirectories in sorted order</li>
 * </ol>
 *
 * <p>A reference that cannot be satisfied is marked MISSING with a reason and
 * left in the graph as an opaque node; resolution of the rest continues. A
 * document that is already being resolved further up the chain, or a chain
 * deeper than {@link ResolutionConfig#getMaxDepth()}, is reported as CIRCULAR.</p>
 *
 * <p>A resolver instance owns one {@link ResolutionCache}; reuse it across
 * documents of a batch so shared macros are parsed once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-10
 * @version 1.0
 */
public class MacroResolver {

    private static final Logger logger = LoggerFactory.getLogger(MacroResolver.class);

    private final WorkflowIngestor ingestor;
    private final ResolutionConfig config;
    private final ResolutionCache cache;
    private final MissingMacroHandler handler;
    private final ResolutionMetrics metrics;

    public MacroResolver(WorkflowIngestor ingestor, ResolutionConfig config) {
        this(ingestor, config, null);
    }

    public MacroResolver(WorkflowIngestor ingestor, ResolutionConfig config, MissingMacroHandler handler) {
        this(ingestor, config, handler, new ResolutionCache());
    }

    public MacroResolver(WorkflowIngestor ingestor, ResolutionConfig config, MissingMacroHandler handler,
                         ResolutionCache cache) {
        this.ingestor = Objects.requireNonNull(ingestor, "Ingestor cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.cache = Objects.requireNonNull(cache, "Cache cannot be null");
        this.handler = handler;
        this.metrics = config.isMetricsEnabled() ? ResolutionMetrics.getInstance() : null;
    }

    public ResolutionCache getCache() {
        return cache;
    }

    public ResolutionConfig getConfig() {
        return config;
    }

    /**
     * Resolves one graph. A graph without unresolved references is returned as
     * the same instance with an empty report.
     *
     * @throws StructuralException if splicing produces an invalid graph
     */
    public ResolutionOutcome resolve(WorkflowGraph graph) throws StructuralException {
        return resolve(graph, new RunState());
    }

    /**
     * Resolves a batch of graphs in order. Search directories added by a
     * {@link MissingMacroDecision.Retry} and a {@link MissingMacroDecision.SkipAll}
     * carry over to the later graphs of the batch.
     */
    public List<ResolutionOutcome> resolveAll(List<WorkflowGraph> graphs) throws StructuralException {
        RunState run = new RunState();
        List<ResolutionOutcome> outcomes = new ArrayList<>();
        for (WorkflowGraph graph : graphs) {
            outcomes.add(resolve(graph, run));
        }
        return outcomes;
    }

    private ResolutionOutcome resolve(WorkflowGraph graph, RunState run) throws StructuralException {
        Objects.requireNonNull(graph, "Graph cannot be null");
        if (graph.getUnresolvedMacroNodes().isEmpty()) {
            return new ResolutionOutcome(graph, ResolutionReport.empty());
        }
        long start = System.nanoTime();
        List<Path> stack = new ArrayList<>();
        Path root = graph.getMetadata().getDocumentPath();
        if (root != null) {
            stack.add(normalize(root));
        }
        List<MacroResolution> entries = new ArrayList<>();
        WorkflowGraph resolved = resolveGraph(graph, stack, 1, run, entries);
        ResolutionReport report = new ResolutionReport(entries);

        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        if (metrics != null) {
            metrics.recordResolutionRun(graph.getName(), seconds);
        }
        logger.info("Resolved macros of '{}': {} resolved, {} missing in {} ms",
                graph.getName(), report.getResolved().size(), report.getMissing().size(),
                Math.round(seconds * 1000));
        return new ResolutionOutcome(resolved, report);
    }

    private WorkflowGraph resolveGraph(WorkflowGraph graph, List<Path> stack, int depth, RunState run,
                                       List<MacroResolution> entries) throws StructuralException {
        WorkflowGraph current = graph;
        for (WorkflowNode node : graph.getUnresolvedMacroNodes()) {
            MacroReference reference = node.getMacroReference();
            Lookup lookup = resolveReference(reference, graph, stack, depth, run, entries);
            MacroReference outcome = lookup.reference;
            if (outcome.isResolved()) {
                current = MacroSplicer.splice(current, node.getId(), outcome);
                if (metrics != null) {
                    metrics.recordMacroResolved(graph.getName(), outcome.getLocation().name(), lookup.cacheHit);
                }
            } else {
                current = current.toBuilder()
                        .putNode(current.getNode(node.getId()).toBuilder().config(new ToolConfig.Macro(outcome)).build())
                        .build();
                logger.warn("Macro '{}' referenced by node {} of '{}' is missing: {}{}",
                        reference.getReference(), node.getId(), graph.getName(),
                        outcome.getMissingReason().getDescription(),
                        outcome.getDetail() != null ? " (" + outcome.getDetail() + ")" : "");
                if (metrics != null) {
                    metrics.recordMacroMissing(graph.getName(), outcome.getMissingReason().name());
                }
            }
            entries.add(MacroResolution.of(graph.getName(), node.getId(), outcome, lookup.cacheHit, depth));
        }
        return current;
    }

    private Lookup resolveReference(MacroReference reference, WorkflowGraph host, List<Path> stack, int depth,
                                    RunState run, List<MacroResolution> entries) throws StructuralException {
        String ref = reference.getReference();
        if (config.isSkipped(ref, reference.fileName())) {
            return new Lookup(reference.missing(MissingReason.SKIPPED, "Listed in skipped macros"), false);
        }
        MacroReference searching = reference.searching();
        if (!reference.hasReference()) {
            return new Lookup(searching.missing(MissingReason.NOT_FOUND, "Macro node has no reference"), false);
        }
        if (depth > config.getMaxDepth()) {
            return new Lookup(searching.missing(MissingReason.CIRCULAR,
                    "Maximum macro nesting depth " + config.getMaxDepth() + " exceeded"), false);
        }

        try {
            boolean cacheHit = false;
            ResolutionCache.Entry entry;
            Optional<ResolutionCache.Entry> cached = cache.lookup(ref);
            if (cached.isPresent()) {
                entry = cached.get();
                checkCircular(ref, entry.path(), stack);
                cacheHit = true;
                logger.debug("Macro '{}' served from cache ({})", ref, entry.path());
            } else {
                Search search = search(ref, host, stack, run);
                if (search.entry == null) {
                    search = consultHandler(reference, host, stack, run, search);
                }
                if (search.entry == null) {
                    MissingReason reason = search.skipped ? MissingReason.SKIPPED
                            : search.parseFailed ? MissingReason.PARSE_FAILED : MissingReason.NOT_FOUND;
                    return new Lookup(searching.missing(reason, search.detail()), false);
                }
                entry = cache.putIfAbsent(ref, search.entry);
            }

            stack.add(entry.path());
            WorkflowGraph subGraph;
            try {
                subGraph = resolveGraph(entry.graph(), stack, depth + 1, run, entries);
            } finally {
                stack.remove(stack.size() - 1);
            }
            SearchLocation location = cacheHit ? SearchLocation.CACHE : entry.location();
            return new Lookup(searching.resolved(subGraph, entry.path(), location), cacheHit);
        } catch (CircularMacroReferenceException e) {
            return new Lookup(searching.missing(MissingReason.CIRCULAR, e.getMessage()), false);
        }
    }

    private Search search(String ref, WorkflowGraph host, List<Path> stack, RunState run)
            throws CircularMacroReferenceException {
        Search search = new Search();
        for (Map.Entry<Path, SearchLocation> candidate : candidates(ref, host, run).entrySet()) {
            if (tryCandidate(ref, candidate.getKey(), candidate.getValue(), stack, search)) {
                return search;
            }
        }
        return search;
    }

    private Search consultHandler(MacroReference reference, WorkflowGraph host, List<Path> stack, RunState run,
                                  Search search) throws CircularMacroReferenceException {
        if (!config.isInteractive() || handler == null) {
            return search;
        }
        if (run.skipAll) {
            search.skipped = true;
            return search;
        }
        String ref = reference.getReference();
        for (int attempt = 1; attempt <= config.getMaxPromptAttempts(); attempt++) {
            MissingMacroContext context = new MissingMacroContext(ref, reference.fileName(), host.getName(),
                    host.getMetadata().getDocumentPath(), attempt, search.searched, search.parseFailed);
            MissingMacroDecision decision = handler.onMissing(context);
            if (decision == null || decision instanceof MissingMacroDecision.Skip) {
                search.skipped = true;
                return search;
            }
            if (decision instanceof MissingMacroDecision.SkipAll) {
                logger.info("Skipping all further missing macros of this run");
                run.skipAll = true;
                search.skipped = true;
                return search;
            }
            if (decision instanceof MissingMacroDecision.Retry) {
                Path directory = ((MissingMacroDecision.Retry) decision).directory();
                logger.info("Adding macro search directory {}", directory);
                run.extraDirectories.add(directory);
                Search retried = search(ref, host, stack, run);
                retried.parseFailed |= search.parseFailed;
                search = retried;
            } else if (decision instanceof MissingMacroDecision.ForcePath) {
                Path file = ((MissingMacroDecision.ForcePath) decision).file();
                tryCandidate(ref, file, SearchLocation.FORCED_PATH, stack, search);
            }
            if (search.entry != null) {
                return search;
            }
        }
        return search;
    }

    /**
     * @return whether the candidate was found and parsed
     */
    private boolean tryCandidate(String ref, Path candidate, SearchLocation location, List<Path> stack,
                                 Search search) throws CircularMacroReferenceException {
        search.searched.add(candidate);
        if (!Files.isRegularFile(candidate)) {
            return false;
        }
        Path path = normalize(candidate);
        checkCircular(ref, path, stack);
        try {
            WorkflowGraph graph = ingestor.parse(path);
            search.entry = new ResolutionCache.Entry(graph, path, location);
            logger.debug("Macro '{}' found at {} ({})", ref, path, location);
            return true;
        } catch (FormatException | StructuralException e) {
            logger.warn("Macro candidate {} for '{}' could not be parsed: {}", path, ref, e.getMessage());
            search.parseFailed = true;
            search.lastError = e.getMessage();
            return false;
        }
    }

    private void checkCircular(String ref, Path path, List<Path> stack) throws CircularMacroReferenceException {
        if (stack.contains(path)) {
            List<String> chain = new ArrayList<>();
            for (Path p : stack.subList(stack.indexOf(path), stack.size())) {
                chain.add(p.getFileName().toString());
            }
            chain.add(path.getFileName().toString());
            throw new CircularMacroReferenceException(ref, chain);
        }
    }

    /**
     * Candidate paths for a reference, in priority order and without duplicates.
     */
    Map<Path, SearchLocation> candidates(String ref, WorkflowGraph host, RunState run) {
        Map<Path, SearchLocation> candidates = new LinkedHashMap<>();
        String fileName = MacroReference.fileName(ref);
        String portable = ref.replace('\\', File.separatorChar).replace('/', File.separatorChar);

        Path exact = toPath(ref);
        if (exact != null) {
            add(candidates, exact, SearchLocation.EXACT_PATH);
        }
        Path portablePath = toPath(portable);
        if (portablePath != null && portablePath.isAbsolute()) {
            add(candidates, portablePath, SearchLocation.EXACT_PATH);
        }

        Path documentDirectory = host.getMetadata().getDocumentDirectory();
        if (documentDirectory != null) {
            if (portablePath != null && !portablePath.isAbsolute()) {
                add(candidates, documentDirectory.resolve(portablePath), SearchLocation.DOCUMENT_RELATIVE);
            }
            add(candidates, documentDirectory.resolve(fileName), SearchLocation.DOCUMENT_RELATIVE);
            add(candidates, documentDirectory.resolve("macros").resolve(fileName), SearchLocation.MACROS_SUBDIRECTORY);
            add(candidates, documentDirectory.resolve("Macros").resolve(fileName), SearchLocation.MACROS_SUBDIRECTORY);
            Path parent = documentDirectory.toAbsolutePath().getParent();
            if (parent != null) {
                add(candidates, parent.resolve(fileName), SearchLocation.PARENT_DIRECTORY);
                add(candidates, parent.resolve("macros").resolve(fileName), SearchLocation.PARENT_DIRECTORY);
            }
        }

        List<Path> directories = new ArrayList<>(config.getSearchDirectories());
        directories.addAll(run.extraDirectories);
        for (Path directory : directories) {
            add(candidates, directory.resolve(fileName), SearchLocation.SEARCH_DIRECTORY);
            for (Path subdirectory : subdirectories(directory)) {
                add(candidates, subdirectory.resolve(fileName), SearchLocation.SEARCH_DIRECTORY);
            }
        }
        return candidates;
    }

    private static void add(Map<Path, SearchLocation> candidates, Path path, SearchLocation location) {
        candidates.putIfAbsent(normalize(path), location);
    }

    private static List<Path> subdirectories(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isDirectory)
                    .filter(path -> !path.equals(directory))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Failed to list macro search directory {}: {}", directory, e.getMessage());
            return List.of();
        }
    }

    private static Path toPath(String value) {
        try {
            return Paths.get(value);
        } catch (InvalidPathException e) {
            logger.debug("Macro reference '{}' is not a valid path: {}", value, e.getMessage());
            return null;
        }
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static final class Lookup {
        private final MacroReference reference;
        private final boolean cacheHit;

        private Lookup(MacroReference reference, boolean cacheHit) {
            this.reference = reference;
            this.cacheHit = cacheHit;
        }
    }

    private static final class Search {
        private final List<Path> searched = new ArrayList<>();
        private ResolutionCache.Entry entry;
        private boolean parseFailed;
        private boolean skipped;
        private String lastError;

        private String detail() {
            if (skipped) {
                return "Skipped by missing-macro handler";
            }
            if (parseFailed) {
                return lastError;
            }
            return "Searched " + searched.size() + " locations";
        }
    }

    static final class RunState {
        private final List<Path> extraDirectories = new ArrayList<>();
        private boolean skipAll;
    }
}
