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

import dev.mars.flowlift.config.FlowliftConfiguration;
import dev.mars.flowlift.workflow.YxmdWorkflowParser;
import dev.mars.flowlift.workflow.macro.MacroResolver;
import dev.mars.flowlift.workflow.macro.ResolutionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Properties;

import static dev.mars.flowlift.workflow.TestDocuments.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResolutionMetrics. The instance is process-wide, so every
 * assertion compares against the counts taken before the action.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
class ResolutionMetricsTest {

    @TempDir
    Path dir;

    private ResolutionMetrics metrics;
    private long parsedBefore;
    private long resolvedBefore;
    private long missingBefore;

    @BeforeEach
    void setUp() {
        metrics = ResolutionMetrics.getInstance();
        parsedBefore = metrics.getDocumentsParsed();
        resolvedBefore = metrics.getMacrosResolved();
        missingBefore = metrics.getMacrosMissing();
    }

    @Test
    void testSingleton() {
        assertSame(metrics, ResolutionMetrics.getInstance());
    }

    @Test
    void testRecordCounts() {
        metrics.recordDocumentParsed("Orders");
        metrics.recordMacroResolved("Orders", "CACHE", true);
        metrics.recordMacroResolved("Orders", "EXACT_PATH", false);
        metrics.recordMacroMissing("Orders", "NOT_FOUND");
        metrics.recordMacroMissing("Orders", null);
        metrics.recordResolutionRun("Orders", 0.25);

        assertEquals(parsedBefore + 1, metrics.getDocumentsParsed());
        assertEquals(resolvedBefore + 2, metrics.getMacrosResolved());
        assertEquals(missingBefore + 2, metrics.getMacrosMissing());
    }

    @Test
    void testEnabledRunIsCounted() throws Exception {
        resolveSample(configuration(true));

        assertEquals(parsedBefore + 2, metrics.getDocumentsParsed());
        assertEquals(resolvedBefore + 1, metrics.getMacrosResolved());
        assertEquals(missingBefore + 1, metrics.getMacrosMissing());
    }

    @Test
    void testDisabledRunIsNotCounted() throws Exception {
        resolveSample(configuration(false));

        assertEquals(parsedBefore, metrics.getDocumentsParsed());
        assertEquals(resolvedBefore, metrics.getMacrosResolved());
        assertEquals(missingBefore, metrics.getMacrosMissing());
    }

    private static FlowliftConfiguration configuration(boolean metricsEnabled) {
        Properties properties = new Properties();
        properties.setProperty(FlowliftConfiguration.METRICS_ENABLED, String.valueOf(metricsEnabled));
        return new FlowliftConfiguration(properties);
    }

    /**
     * Host with one macro that resolves and one that does not.
     */
    private void resolveSample(FlowliftConfiguration configuration) throws Exception {
        write(dir, "macros/Clean.yxmc", passThroughMacro("Clean"));
        Path host = write(dir, "host.yxmd", document("Host",
                input(1, "a.csv") + macro(2, "Clean.yxmc") + macro(3, "Nowhere.yxmc") + output(4, "b.csv"),
                connection(1, 2) + connection(2, 3) + connection(3, 4)));

        YxmdWorkflowParser parser = YxmdWorkflowParser.fromConfiguration(configuration);
        MacroResolver resolver = new MacroResolver(parser, ResolutionConfig.fromConfiguration(configuration));
        resolver.resolve(parser.parse(host));
    }
}
