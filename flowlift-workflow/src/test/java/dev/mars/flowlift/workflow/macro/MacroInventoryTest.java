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

import dev.mars.flowlift.core.MacroStatus;
import dev.mars.flowlift.core.MissingReason;
import dev.mars.flowlift.core.SearchLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class MacroInventoryTest {

    private MacroInventory inventory;

    @BeforeEach
    void setUp() {
        inventory = new MacroInventory();
    }

    private static MacroResolution found(String workflow, String reference, Path path) {
        return new MacroResolution(workflow, 2, reference, MacroStatus.RESOLVED, null, path,
                SearchLocation.MACROS_SUBDIRECTORY, false, 1, null);
    }

    private static MacroResolution missing(String workflow, String reference) {
        return new MacroResolution(workflow, 3, reference, MacroStatus.MISSING, MissingReason.NOT_FOUND,
                null, null, false, 1, "Searched 6 locations");
    }

    @Test
    void sameFileThroughDifferentPathsCountsOnce() {
        inventory.add("Sales", new ResolutionReport(List.of(found("Sales", "macros\\Clean.yxmc", Paths.get("/m/Clean.yxmc")))));
        inventory.add("Stock", new ResolutionReport(List.of(found("Stock", "C:\\lib\\Clean.yxmc", Paths.get("/m/Clean.yxmc")))));

        assertEquals(1, inventory.getMacros().size());
        MacroInventory.Usage usage = inventory.getMacros().get(0);
        assertThat(usage.getWorkflows()).containsExactly("Sales", "Stock");
        assertThat(usage.getReferences()).hasSize(2);
        assertEquals(1, inventory.getShared().size());
    }

    @Test
    void summaryCountsFoundMissingAndShared() {
        inventory.add("Sales", new ResolutionReport(List.of(
                found("Sales", "Clean.yxmc", Paths.get("/m/Clean.yxmc")),
                missing("Sales", "Legacy.yxmc"))));
        inventory.add("Stock", new ResolutionReport(List.of(found("Stock", "Clean.yxmc", Paths.get("/m/Clean.yxmc")))));

        MacroInventory.Summary summary = inventory.getSummary();

        assertEquals(2, summary.totalMacros());
        assertEquals(1, summary.found());
        assertEquals(1, summary.missing());
        assertEquals(1, summary.shared());
        assertEquals(2, summary.usageCounts().get("Clean.yxmc"));
        assertEquals(MissingReason.NOT_FOUND, inventory.getMissing().get(0).getMissingReason());
    }

    @Test
    void macroFoundAnywhereIsNotMissing() {
        inventory.add("Sales", new ResolutionReport(List.of(missing("Sales", "Clean.yxmc"))));
        inventory.add("Stock", new ResolutionReport(List.of(found("Stock", "Clean.yxmc", Paths.get("/m/Clean.yxmc")))));

        assertTrue(inventory.getMissing().isEmpty());
        assertTrue(inventory.getMacros().get(0).isFound());
    }

    @Test
    void emptyReportAddsNothing() {
        inventory.add("Plain", ResolutionReport.empty());

        assertEquals(0, inventory.getSummary().totalMacros());
    }
}
