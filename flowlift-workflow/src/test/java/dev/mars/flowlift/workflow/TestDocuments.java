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

package dev.mars.flowlift.workflow;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds small Alteryx documents for tests.
 */
public final class TestDocuments {

    public static final String INPUT = "AlteryxBasePluginsGui.DbFileInput.DbFileInput";
    public static final String OUTPUT = "AlteryxBasePluginsGui.DbFileOutput.DbFileOutput";
    public static final String FILTER = "AlteryxBasePluginsGui.Filter.Filter";
    public static final String FORMULA = "AlteryxBasePluginsGui.Formula.Formula";
    public static final String SUMMARIZE = "AlteryxSpatialPluginsGui.Summarize.Summarize";
    public static final String CONTAINER = "AlteryxGuiToolkit.ToolContainer.ToolContainer";
    public static final String MACRO_INPUT = "AlteryxBasePluginsGui.MacroInput.MacroInput";
    public static final String MACRO_OUTPUT = "AlteryxBasePluginsGui.MacroOutput.MacroOutput";

    private TestDocuments() {
    }

    public static String document(String name, String nodes, String connections) {
        return "<?xml version=\"1.0\"?>\n"
                + "<AlteryxDocument yxmdVer=\"2023.1\">\n"
                + "  <Nodes>\n" + nodes + "  </Nodes>\n"
                + "  <Connections>\n" + connections + "  </Connections>\n"
                + "  <Properties><MetaInfo><Name>" + name + "</Name></MetaInfo></Properties>\n"
                + "</AlteryxDocument>\n";
    }

    public static String node(int id, String plugin, String configuration) {
        return "    <Node ToolID=\"" + id + "\">\n"
                + "      <GuiSettings Plugin=\"" + plugin + "\"><Position x=\"" + (id * 60) + "\" y=\"54\"/></GuiSettings>\n"
                + "      <Properties><Configuration>" + configuration + "</Configuration></Properties>\n"
                + "    </Node>\n";
    }

    public static String input(int id, String file) {
        return node(id, INPUT, "<File>" + file + "</File>");
    }

    public static String output(int id, String file) {
        return node(id, OUTPUT, "<File>" + file + "</File>");
    }

    public static String filter(int id, String expression) {
        return node(id, FILTER, "<Mode>Custom</Mode><Expression>" + expression + "</Expression>");
    }

    public static String macroInput(int id, String anchor) {
        return node(id, MACRO_INPUT, "<Name>" + anchor + "</Name>");
    }

    public static String macroOutput(int id, String anchor) {
        return node(id, MACRO_OUTPUT, "<Name>" + anchor + "</Name>");
    }

    public static String macro(int id, String reference) {
        return "    <Node ToolID=\"" + id + "\">\n"
                + "      <GuiSettings><Position x=\"0\" y=\"0\"/></GuiSettings>\n"
                + "      <Properties><Configuration/></Properties>\n"
                + "      <EngineSettings Macro=\"" + reference + "\"/>\n"
                + "    </Node>\n";
    }

    public static String connection(int origin, String originAnchor, int destination, String destinationAnchor) {
        return "    <Connection>\n"
                + "      <Origin ToolID=\"" + origin + "\" Connection=\"" + originAnchor + "\"/>\n"
                + "      <Destination ToolID=\"" + destination + "\" Connection=\"" + destinationAnchor + "\"/>\n"
                + "    </Connection>\n";
    }

    public static String connection(int origin, int destination) {
        return connection(origin, "Output", destination, "Input");
    }

    /**
     * A macro whose single input feeds a filter that feeds its single output.
     */
    public static String passThroughMacro(String name) {
        return document(name,
                macroInput(1, "Input") + filter(2, "[Amount] &gt; 0") + macroOutput(3, "Output"),
                connection(1, 2) + connection(2, 3));
    }

    public static Path write(Path dir, String fileName, String content) throws IOException {
        Path file = dir.resolve(fileName);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
