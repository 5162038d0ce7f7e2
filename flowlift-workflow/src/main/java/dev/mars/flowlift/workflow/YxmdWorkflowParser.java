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

import dev.mars.flowlift.config.FlowliftConfiguration;
import dev.mars.flowlift.core.Connection;
import dev.mars.flowlift.core.MacroReference;
import dev.mars.flowlift.core.NodeKind;
import dev.mars.flowlift.core.Position;
import dev.mars.flowlift.core.ToolConfig;
import dev.mars.flowlift.core.ValidationResult;
import dev.mars.flowlift.core.WorkflowGraph;
import dev.mars.flowlift.core.WorkflowMetadata;
import dev.mars.flowlift.core.WorkflowNode;
import dev.mars.flowlift.core.exceptions.FormatException;
import dev.mars.flowlift.core.exceptions.StructuralException;
import dev.mars.flowlift.workflow.observability.ResolutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static dev.mars.flowlift.workflow.XmlElements.attribute;
import static dev.mars.flowlift.workflow.XmlElements.child;
import static dev.mars.flowlift.workflow.XmlElements.childText;
import static dev.mars.flowlift.workflow.XmlElements.children;
import static dev.mars.flowlift.workflow.XmlElements.isTrue;
import static dev.mars.flowlift.workflow.XmlElements.path;
import static dev.mars.flowlift.workflow.XmlElements.text;
import static dev.mars.flowlift.workflow.XmlElements.toXml;

/**
 * Ingestor for Alteryx workflow ({@code .yxmd}), macro ({@code .yxmc}) and
 * analytic app ({@code .yxwz}) documents.
 *
 * <p>Parsing runs in three passes over the DOM: node records (including nodes
 * nested in a container's {@code ChildNodes}), container membership, then
 * connections. Problems local to one node or connection are recorded as
 * warnings in the graph diagnostics; only document-level problems abort.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-08
 * @version 1.0
 */
public class YxmdWorkflowParser implements WorkflowIngestor {

    private static final Logger logger = LoggerFactory.getLogger(YxmdWorkflowParser.class);

    public static final Set<String> SUPPORTED_SUFFIXES = Set.of(".yxmd", ".yxmc", ".yxwz");
    static final String ROOT_ELEMENT = "AlteryxDocument";

    private final ToolKindRegistry registry;
    private final ToolConfigExtractor extractor;
    private final ResolutionMetrics metrics;

    public YxmdWorkflowParser() {
        this(ToolKindRegistry.loadDefault());
    }

    public YxmdWorkflowParser(ToolKindRegistry registry) {
        this(registry, ResolutionMetrics.getInstance());
    }

    /**
     * @param metrics where parsed documents are counted; {@code null} records nothing
     */
    public YxmdWorkflowParser(ToolKindRegistry registry, ResolutionMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "Tool kind registry cannot be null");
        this.extractor = new ToolConfigExtractor();
        this.metrics = metrics;
    }

    /**
     * Parser using the tool mapping override file named in the configuration, if
     * any, and recording metrics only when they are enabled there.
     */
    public static YxmdWorkflowParser fromConfiguration(FlowliftConfiguration configuration) throws FormatException {
        return new YxmdWorkflowParser(ToolKindRegistry.load(configuration.getToolMappingFile()),
                configuration.isMetricsEnabled() ? ResolutionMetrics.getInstance() : null);
    }

    public static boolean isSupported(Path file) {
        return file != null && SUPPORTED_SUFFIXES.contains(suffixOf(file));
    }

    @Override
    public WorkflowGraph parse(Path document) throws FormatException, StructuralException {
        Objects.requireNonNull(document, "Document path cannot be null");
        String fileName = document.getFileName() != null ? document.getFileName().toString() : document.toString();
        if (!isSupported(document)) {
            throw new FormatException(fileName, "Unsupported file type: '" + suffixOf(document)
                    + "'. Expected one of " + new TreeSet<>(SUPPORTED_SUFFIXES));
        }
        if (!Files.isRegularFile(document)) {
            throw new FormatException(fileName, "Workflow document not found: " + document);
        }
        try (InputStream input = Files.newInputStream(document)) {
            return parse(input, stemOf(fileName), document);
        } catch (IOException e) {
            throw new FormatException(fileName, "Failed to read workflow document: " + document, e);
        }
    }

    @Override
    public WorkflowGraph parse(InputStream input, String documentName, Path documentPath)
            throws FormatException, StructuralException {
        Objects.requireNonNull(input, "Input cannot be null");
        String name = documentName != null ? documentName : "workflow";

        Element root = readDocument(input, name).getDocumentElement();
        if (!ROOT_ELEMENT.equals(root.getNodeName())) {
            throw new FormatException(name, "Root element is '" + root.getNodeName()
                    + "', expected '" + ROOT_ELEMENT + "'");
        }
        Element nodesElement = child(root, "Nodes");
        if (nodesElement == null) {
            throw new FormatException(name, 0, "Nodes", "Missing top-level Nodes element");
        }
        Element connectionsElement = child(root, "Connections");
        if (connectionsElement == null) {
            throw new FormatException(name, 0, "Connections", "Missing top-level Connections element");
        }

        ValidationResult diagnostics = new ValidationResult();
        WorkflowMetadata metadata = parseMetadata(root, name, documentPath);

        Map<Integer, NodeRecord> records = new LinkedHashMap<>();
        collectNodes(nodesElement, null, "Nodes", records, diagnostics);
        assignContainers(records, diagnostics);

        WorkflowGraph.Builder builder = WorkflowGraph.builder(metadata);
        for (NodeRecord record : records.values()) {
            builder.addNode(record.toNode());
        }
        for (Connection connection : parseConnections(connectionsElement, records, diagnostics)) {
            builder.addConnection(connection);
        }
        builder.diagnostics(diagnostics);

        WorkflowGraph graph = builder.build();
        logger.info("Parsed workflow '{}': {} nodes, {} connections, {} warnings",
                graph.getName(), graph.size(), graph.getConnections().size(), diagnostics.getWarningCount());
        if (metrics != null) {
            metrics.recordDocumentParsed(graph.getName());
        }
        return graph;
    }

    private Document readDocument(InputStream input, String name) throws FormatException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder documentBuilder = factory.newDocumentBuilder();
            documentBuilder.setErrorHandler(new DefaultHandler());
            return documentBuilder.parse(input);
        } catch (SAXParseException e) {
            throw new FormatException(name, e.getLineNumber(), null, "Malformed XML: " + e.getMessage(), e);
        } catch (SAXException e) {
            throw new FormatException(name, "Malformed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new FormatException(name, "XML parser configuration failed", e);
        } catch (IOException e) {
            throw new FormatException(name, "Failed to read workflow document", e);
        }
    }

    private WorkflowMetadata parseMetadata(Element root, String documentName, Path documentPath) {
        Element properties = child(root, "Properties");
        Element metaInfo = child(properties, "MetaInfo");

        String name = childText(metaInfo, "Name");
        String description = childText(metaInfo, "Description");
        if (description == null) {
            description = text(path(properties, "Annotation", "DefaultAnnotationText"));
        }
        String author = childText(metaInfo, "Author");
        String version = attribute(root, "yxmdVer");

        return new WorkflowMetadata(name != null ? name : documentName, description, author, version, documentPath);
    }

    private void collectNodes(Element parent, Integer enclosingContainer, String location,
                              Map<Integer, NodeRecord> records, ValidationResult diagnostics) {
        List<Element> nodeElements = children(parent, "Node");
        for (int i = 0; i < nodeElements.size(); i++) {
            Element element = nodeElements.get(i);
            String fieldPath = location + "/Node[" + (i + 1) + "]";
            String toolIdValue = attribute(element, "ToolID");
            Integer toolId = parseId(toolIdValue);
            if (toolId == null) {
                diagnostics.addWarning(null, fieldPath, "Skipped node with missing or invalid ToolID '" + toolIdValue + "'");
                logger.warn("Skipping node at {}: invalid ToolID '{}'", fieldPath, toolIdValue);
                continue;
            }
            if (records.containsKey(toolId)) {
                diagnostics.addWarning(toolId, fieldPath, "Skipped duplicate node with ToolID " + toolId);
                logger.warn("Skipping duplicate node with ToolID {} at {}", toolId, fieldPath);
                continue;
            }

            NodeRecord record = readNode(toolId, element);
            record.implicitContainer = enclosingContainer;
            records.put(toolId, record);

            Element childNodes = child(element, "ChildNodes");
            if (childNodes != null) {
                Integer nestedContainer = toolId;
                if (record.kind != NodeKind.CONTAINER) {
                    diagnostics.addWarning(toolId, fieldPath, "Nested ChildNodes on a non-container node");
                    nestedContainer = enclosingContainer;
                }
                collectNodes(childNodes, nestedContainer, fieldPath + "/ChildNodes", records, diagnostics);
            }
        }
    }

    private NodeRecord readNode(int toolId, Element element) {
        Element guiSettings = child(element, "GuiSettings");
        String plugin = attribute(guiSettings, "Plugin");
        Element configuration = path(element, "Properties", "Configuration");
        String annotation = readAnnotation(element);

        NodeRecord record = new NodeRecord(toolId);
        record.plugin = plugin;
        record.annotation = annotation;
        record.position = readPosition(child(guiSettings, "Position"));
        record.rawConfiguration = toXml(configuration);
        record.declaredChildren = readDeclaredChildren(element);

        if (plugin == null) {
            String reference = readMacroReference(element, guiSettings, configuration);
            record.kind = NodeKind.MACRO;
            record.config = new ToolConfig.Macro(MacroReference.unresolved(reference));
            if (reference != null) {
                record.displayName = MacroReference.fileStem(reference);
            } else {
                record.displayName = annotation != null ? annotation : "Macro";
            }
        } else {
            String simpleName = ToolKindRegistry.simpleName(plugin);
            record.kind = registry.kindOf(plugin);
            record.displayName = simpleName;
            record.config = extractor.extract(record.kind, simpleName, configuration, toolId, annotation);
        }
        return record;
    }

    private String readAnnotation(Element element) {
        Element annotation = path(element, "Properties", "Annotation");
        String name = childText(annotation, "Name");
        return name != null ? name : childText(annotation, "DefaultAnnotationText");
    }

    private String readMacroReference(Element element, Element guiSettings, Element configuration) {
        String reference = attribute(child(element, "EngineSettings"), "Macro");
        if (reference == null) {
            reference = attribute(guiSettings, "Macro");
        }
        if (reference == null) {
            reference = childText(configuration, "Macro");
        }
        return reference;
    }

    private Position readPosition(Element position) {
        if (position == null) {
            return Position.ORIGIN;
        }
        return new Position(parseCoordinate(attribute(position, "x")), parseCoordinate(attribute(position, "y")));
    }

    private static double parseCoordinate(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Child id list from the first non-empty of the three locations a container may use.
     */
    private List<Integer> readDeclaredChildren(Element element) {
        Element[] candidates = {
                child(element, "ChildToolIds"),
                path(element, "Properties", "Configuration", "ChildToolIds"),
                path(element, "Properties", "ChildToolIds")
        };
        for (Element candidate : candidates) {
            List<Integer> ids = parseIdList(text(candidate));
            if (!ids.isEmpty()) {
                return ids;
            }
        }
        return List.of();
    }

    static List<Integer> parseIdList(String value) {
        List<Integer> ids = new ArrayList<>();
        if (value == null) {
            return ids;
        }
        for (String part : value.split("[,\\s]+")) {
            Integer id = parseId(part);
            if (id != null && !ids.contains(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    /**
     * Tool ids are non-negative integers; anything else is treated as absent.
     */
    private static Integer parseId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            int id = Integer.parseInt(value.trim());
            return id >= 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Resolves container membership. Containers are processed in ascending id
     * order so a node claimed twice stays with the lowest container id.
     */
    private void assignContainers(Map<Integer, NodeRecord> records, ValidationResult diagnostics) {
        SortedMap<Integer, NodeRecord> containers = new TreeMap<>();
        for (NodeRecord record : records.values()) {
            if (record.kind == NodeKind.CONTAINER) {
                containers.put(record.id, record);
            } else if (!record.declaredChildren.isEmpty()) {
                diagnostics.addWarning(record.id, "Ignored child list on non-container node");
            }
        }

        Map<Integer, List<Integer>> implicitChildren = new HashMap<>();
        for (NodeRecord record : records.values()) {
            if (record.implicitContainer != null) {
                implicitChildren.computeIfAbsent(record.implicitContainer, k -> new ArrayList<>()).add(record.id);
            }
        }

        for (NodeRecord container : containers.values()) {
            List<Integer> candidates = new ArrayList<>(container.declaredChildren);
            for (Integer nested : implicitChildren.getOrDefault(container.id, List.of())) {
                if (!candidates.contains(nested)) {
                    candidates.add(nested);
                }
            }
            for (Integer childId : candidates) {
                NodeRecord child = records.get(childId);
                if (child == null) {
                    diagnostics.addWarning(container.id, "Container lists unknown child " + childId);
                    continue;
                }
                if (childId == container.id) {
                    diagnostics.addWarning(container.id, "Container lists itself as a child");
                    continue;
                }
                if (child.containerId != null) {
                    diagnostics.addWarning(childId, "Node claimed by containers " + child.containerId + " and "
                            + container.id + "; keeping " + child.containerId);
                    continue;
                }
                child.containerId = container.id;
                container.childIds.add(childId);
            }
        }
    }

    private List<Connection> parseConnections(Element connectionsElement, Map<Integer, NodeRecord> records,
                                              ValidationResult diagnostics) {
        List<Connection> connections = new ArrayList<>();
        List<Element> elements = children(connectionsElement, "Connection");
        for (int i = 0; i < elements.size(); i++) {
            Element element = elements.get(i);
            String fieldPath = "Connections/Connection[" + (i + 1) + "]";
            Element origin = child(element, "Origin");
            Element destination = child(element, "Destination");
            Integer originId = parseId(attribute(origin, "ToolID"));
            Integer destinationId = parseId(attribute(destination, "ToolID"));
            if (originId == null || destinationId == null) {
                diagnostics.addWarning(null, fieldPath, "Dropped connection with missing or invalid endpoint ToolID");
                logger.warn("Dropping connection at {}: invalid endpoint", fieldPath);
                continue;
            }
            if (!records.containsKey(originId) || !records.containsKey(destinationId)) {
                int unknown = !records.containsKey(originId) ? originId : destinationId;
                diagnostics.addWarning(unknown, fieldPath, "Dropped connection " + originId + " -> " + destinationId
                        + ": node " + unknown + " does not exist");
                logger.warn("Dropping connection {} -> {}: node {} does not exist", originId, destinationId, unknown);
                continue;
            }
            connections.add(new Connection(
                    originId, attribute(origin, "Connection", Connection.DEFAULT_OUTPUT_ANCHOR),
                    destinationId, attribute(destination, "Connection", Connection.DEFAULT_INPUT_ANCHOR),
                    isTrue(attribute(element, "Wireless"))));
        }
        return connections;
    }

    private static String suffixOf(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String value = name.toString();
        int dot = value.lastIndexOf('.');
        return dot >= 0 ? value.substring(dot).toLowerCase(Locale.ROOT) : "";
    }

    private static String stemOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Mutable per-node state collected across the parse passes.
     */
    private static final class NodeRecord {
        final int id;
        NodeKind kind;
        String plugin;
        String displayName;
        String annotation;
        Position position;
        ToolConfig config;
        String rawConfiguration;
        List<Integer> declaredChildren = List.of();
        Integer implicitContainer;
        Integer containerId;
        final List<Integer> childIds = new ArrayList<>();

        NodeRecord(int id) {
            this.id = id;
        }

        WorkflowNode toNode() {
            return WorkflowNode.builder(id, kind)
                    .plugin(plugin)
                    .displayName(displayName)
                    .annotation(annotation)
                    .position(position)
                    .config(config)
                    .rawConfiguration(rawConfiguration)
                    .containerId(containerId)
                    .childIds(childIds)
                    .build();
        }
    }
}
