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

package dev.mars.flowlift.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for document ingestion and macro resolution.
 * Instruments are no-ops unless an OpenTelemetry SDK is registered globally.
 *
 * Provides:
 * - flowlift.documents.parsed (counter) - Workflow documents ingested
 * - flowlift.macros.resolved (counter) - Macro references resolved
 * - flowlift.macros.missing (counter) - Macro references left missing, by reason
 * - flowlift.macros.cache.hits (counter) - Resolutions served from the cache
 * - flowlift.resolution.duration.seconds (histogram) - Duration of a resolution run
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-09
 * @version 1.0
 */
public class ResolutionMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ResolutionMetrics.class);
    private static final String METER_NAME = "flowlift-workflow";

    private static ResolutionMetrics instance;

    private final LongCounter documentsParsed;
    private final LongCounter macrosResolved;
    private final LongCounter macrosMissing;
    private final LongCounter cacheHits;
    private final DoubleHistogram resolutionDuration;

    // Local mirrors for inspection without an SDK
    private final AtomicLong documentsParsedCount = new AtomicLong();
    private final AtomicLong macrosResolvedCount = new AtomicLong();
    private final AtomicLong macrosMissingCount = new AtomicLong();

    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> LOCATION_KEY = AttributeKey.stringKey("macro.location");
    private static final AttributeKey<String> MISSING_REASON_KEY = AttributeKey.stringKey("macro.missing.reason");

    private ResolutionMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        documentsParsed = meter.counterBuilder("flowlift.documents.parsed")
                .setDescription("Number of workflow documents ingested")
                .setUnit("1")
                .build();

        macrosResolved = meter.counterBuilder("flowlift.macros.resolved")
                .setDescription("Number of macro references resolved")
                .setUnit("1")
                .build();

        macrosMissing = meter.counterBuilder("flowlift.macros.missing")
                .setDescription("Number of macro references left missing")
                .setUnit("1")
                .build();

        cacheHits = meter.counterBuilder("flowlift.macros.cache.hits")
                .setDescription("Number of macro resolutions served from the cache")
                .setUnit("1")
                .build();

        resolutionDuration = meter.histogramBuilder("flowlift.resolution.duration.seconds")
                .setDescription("Macro resolution run duration in seconds")
                .setUnit("s")
                .build();

        logger.debug("ResolutionMetrics initialized");
    }

    public static synchronized ResolutionMetrics getInstance() {
        if (instance == null) {
            instance = new ResolutionMetrics();
        }
        return instance;
    }

    public void recordDocumentParsed(String workflowName) {
        documentsParsed.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
        documentsParsedCount.incrementAndGet();
    }

    public void recordMacroResolved(String workflowName, String location, boolean fromCache) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(LOCATION_KEY, location)
                .build();
        macrosResolved.add(1, attrs);
        macrosResolvedCount.incrementAndGet();
        if (fromCache) {
            cacheHits.add(1, attrs);
        }
    }

    public void recordMacroMissing(String workflowName, String reason) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(MISSING_REASON_KEY, reason != null ? reason : "unknown")
                .build();
        macrosMissing.add(1, attrs);
        macrosMissingCount.incrementAndGet();
    }

    public void recordResolutionRun(String workflowName, double durationSeconds) {
        resolutionDuration.record(durationSeconds, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
    }

    public long getDocumentsParsed() {
        return documentsParsedCount.get();
    }

    public long getMacrosResolved() {
        return macrosResolvedCount.get();
    }

    public long getMacrosMissing() {
        return macrosMissingCount.get();
    }
}
