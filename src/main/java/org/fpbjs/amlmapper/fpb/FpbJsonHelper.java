package org.fpbjs.amlmapper.fpb;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.fpbjs.amlmapper.MappingException;
import org.fpbjs.amlmapper.fpb.models.Characteristic;
import org.fpbjs.amlmapper.fpb.models.DescriptiveElement;
import org.fpbjs.amlmapper.fpb.models.ElementVisual;
import org.fpbjs.amlmapper.fpb.models.FlowVisual;
import org.fpbjs.amlmapper.fpb.models.FpbDocument;
import org.fpbjs.amlmapper.fpb.models.FpbElement;
import org.fpbjs.amlmapper.fpb.models.FpbFlow;
import org.fpbjs.amlmapper.fpb.models.FpbProcess;
import org.fpbjs.amlmapper.fpb.models.FpbProject;
import org.fpbjs.amlmapper.fpb.models.Identification;
import org.fpbjs.amlmapper.fpb.models.Point;
import org.fpbjs.amlmapper.fpb.models.ProcessEntry;
import org.fpbjs.amlmapper.fpb.models.RelationalElement;
import org.fpbjs.amlmapper.fpb.models.Waypoint;
import org.fpbjs.amlmapper.mapping.FlowKind;
import org.fpbjs.amlmapper.mapping.NodeKind;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the FPB.JS JSON array (project header plus process entries) with the Jackson tree model.
 */
@Slf4j
public class FpbJsonHelper {
    public static final String PROJECT_TYPE = "fpb:Project";
    public static final String PROCESS_TYPE = "fpb:Process";
    public static final String IDENTIFICATION_TYPE = "fpb:Identification";

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * Parses JSON text into a tree.
     *
     * @throws MappingException if the text is empty or not well-formed JSON
     */
    public static JsonNode parse(String json) {
        if (json == null || json.isBlank()) {
            throw new MappingException("FPB.JS document is empty");
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MappingException("Failed to parse FPB.JS document: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Pretty prints with four-space indentation.
     */
    public static String toPrettyString(JsonNode node) {
        try {
            return mapper.writer(new FpbPrettyPrinter()).writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new MappingException("Failed to write FPB.JS document", e);
        }
    }

    // ---------------------------------------------------------------- reading

    /**
     * Reads the typed document from the JSON array. Entries and records of unknown type are skipped.
     *
     * @throws MappingException if the node is not an array or has no fpb:Project entry
     */
    public static FpbDocument readDocument(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new MappingException("FPB.JS document must be a JSON array");
        }

        FpbProject project = null;
        List<ProcessEntry> processes = new ArrayList<>();
        for (JsonNode entry : root) {
            if (project == null && PROJECT_TYPE.equals(entry.path("$type").asText())) {
                project = new FpbProject(
                        textOrNull(entry, "name"),
                        textOrNull(entry, "targetNamespace"),
                        textOrNull(entry, "entryPoint"));
            } else if (entry.path("process").isObject()) {
                processes.add(readProcessEntry(entry));
            }
        }

        if (project == null) {
            throw new MappingException("No fpb:Project header found");
        }
        return new FpbDocument(project, processes);
    }

    private static ProcessEntry readProcessEntry(JsonNode entry) {
        JsonNode p = entry.get("process");
        FpbProcess process = FpbProcess.builder()
                .id(textOrNull(p, "id"))
                .elementsContainer(stringList(p.get("elementsContainer")))
                .isDecomposedProcessOperator(textOrNull(p, "isDecomposedProcessOperator"))
                .consistsOfStates(stringList(p.get("consistsOfStates")))
                .consistsOfSystemLimit(textOrNull(p, "consistsOfSystemLimit"))
                .consistsOfProcesses(stringList(p.get("consistsOfProcesses")))
                .consistsOfProcessOperator(stringList(p.get("consistsOfProcessOperator")))
                .parent(textOrNull(p, "parent"))
                .build();

        List<FpbElement> elements = new ArrayList<>();
        List<FpbFlow> flows = new ArrayList<>();
        for (JsonNode data : entry.path("elementDataInformation")) {
            String type = data.path("$type").asText();
            NodeKind nodeKind = NodeKind.fromFpbType(type);
            FlowKind flowKind = FlowKind.fromFpbType(type);
            if (nodeKind != null) {
                elements.add(readElement(nodeKind, data));
            } else if (flowKind != null) {
                flows.add(readFlow(flowKind, data));
            } else {
                log.debug("Skipping record of unknown type '{}' in process {}", type, process.id());
            }
        }

        List<ElementVisual> elementVisuals = new ArrayList<>();
        List<FlowVisual> flowVisuals = new ArrayList<>();
        for (JsonNode visual : entry.path("elementVisualInformation")) {
            String id = textOrNull(visual, "id");
            if (id == null) {
                continue;
            }
            String type = visual.path("type").asText();
            if (visual.path("waypoints").isArray()) {
                flowVisuals.add(new FlowVisual(id, FlowKind.fromFpbType(type), readWaypoints(visual.get("waypoints"))));
            } else {
                elementVisuals.add(new ElementVisual(id, NodeKind.fromFpbType(type),
                        doubleOrNull(visual, "x"), doubleOrNull(visual, "y"),
                        doubleOrNull(visual, "width"), doubleOrNull(visual, "height")));
            }
        }

        return new ProcessEntry(process, elements, flows, elementVisuals, flowVisuals);
    }

    private static FpbElement readElement(NodeKind kind, JsonNode data) {
        List<Characteristic> characteristics = new ArrayList<>();
        for (JsonNode c : data.path("characteristics")) {
            characteristics.add(new Characteristic(
                    readIdentification(c.get("identification")),
                    readDescriptiveElement(c.get("descriptiveElement")),
                    readRelationalElement(c.get("relationalElement"))));
        }

        return FpbElement.builder()
                .kind(kind)
                .id(textOrNull(data, "id"))
                .name(textOrNull(data, "name"))
                .identification(readIdentification(data.get("identification")))
                .characteristics(characteristics)
                .incoming(stringList(data.get("incoming")))
                .outgoing(stringList(data.get("outgoing")))
                .isAssignedTo(stringList(data.get("isAssignedTo")))
                .decomposedView(textOrNull(data, "decomposedView"))
                .elementsContainer(stringList(data.get("elementsContainer")))
                .build();
    }

    private static FpbFlow readFlow(FlowKind kind, JsonNode data) {
        List<String> inTandemWith = null;
        if (data.path("inTandemWith").isArray()) {
            inTandemWith = stringList(data.get("inTandemWith"));
        } else if (kind.isTandem()) {
            inTandemWith = List.of();
        }
        return new FpbFlow(kind, textOrNull(data, "id"), textOrNull(data, "sourceRef"),
                textOrNull(data, "targetRef"), inTandemWith);
    }

    private static Identification readIdentification(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new Identification(
                textOrNull(node, "uniqueIdent"),
                textOrNull(node, "longName"),
                textOrNull(node, "shortName"),
                textOrNull(node, "versionNumber"),
                textOrNull(node, "revisionNumber"));
    }

    private static DescriptiveElement readDescriptiveElement(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new DescriptiveElement(
                textOrNull(node, "valueDeterminationProcess"),
                textOrNull(node, "representivity"),
                textOrNull(node, "setpointValue"),
                textOrNull(node, "validityLimits"),
                textOrNull(node, "actualValues"));
    }

    private static RelationalElement readRelationalElement(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new RelationalElement(
                textOrNull(node, "view"),
                textOrNull(node, "model"),
                textOrNull(node, "regulationsForRelationalGeneration"));
    }

    private static List<Waypoint> readWaypoints(JsonNode array) {
        List<Waypoint> waypoints = new ArrayList<>();
        for (JsonNode wp : array) {
            if (!wp.path("x").isNumber() || !wp.path("y").isNumber()) {
                log.debug("Skipping waypoint without numeric position: {}", wp);
                continue;
            }
            Point original = null;
            JsonNode o = wp.get("original");
            if (o != null && o.path("x").isNumber() && o.path("y").isNumber()) {
                original = new Point(o.get("x").asDouble(), o.get("y").asDouble());
            }
            waypoints.add(new Waypoint(wp.get("x").asDouble(), wp.get("y").asDouble(), original));
        }
        return waypoints;
    }

    // ---------------------------------------------------------------- writing

    /**
     * Writes the document as a JSON array with the project header first.
     */
    public static ArrayNode writeDocument(FpbDocument document) {
        ArrayNode root = mapper.createArrayNode();

        FpbProject project = document.project();
        ObjectNode projectNode = root.addObject();
        projectNode.put("$type", PROJECT_TYPE);
        projectNode.put("name", project.name());
        projectNode.put("targetNamespace", project.targetNamespace());
        projectNode.put("entryPoint", project.entryPoint());

        for (ProcessEntry entry : document.processes()) {
            ObjectNode entryNode = root.addObject();
            writeProcess(entryNode.putObject("process"), entry.process());

            ArrayNode data = entryNode.putArray("elementDataInformation");
            for (FpbElement element : entry.elements()) {
                writeElement(data.addObject(), element);
            }
            for (FpbFlow flow : entry.flows()) {
                writeFlow(data.addObject(), flow);
            }

            ArrayNode visuals = entryNode.putArray("elementVisualInformation");
            for (ElementVisual visual : entry.elementVisuals()) {
                writeElementVisual(visuals.addObject(), visual);
            }
            for (FlowVisual visual : entry.flowVisuals()) {
                writeFlowVisual(visuals.addObject(), visual);
            }
        }
        return root;
    }

    private static void writeProcess(ObjectNode node, FpbProcess process) {
        node.put("$type", PROCESS_TYPE);
        node.put("id", process.id());
        putStrings(node, "elementsContainer", process.elementsContainer());
        node.put("isDecomposedProcessOperator", process.isDecomposedProcessOperator());
        putStrings(node, "consistsOfStates", process.consistsOfStates());
        node.put("consistsOfSystemLimit", process.consistsOfSystemLimit());
        putStrings(node, "consistsOfProcesses", process.consistsOfProcesses());
        putStrings(node, "consistsOfProcessOperator", process.consistsOfProcessOperator());
        node.put("parent", process.parent());
    }

    private static void writeElement(ObjectNode node, FpbElement element) {
        node.put("$type", element.kind().fpbType());
        node.put("id", element.id());

        if (element.kind() == NodeKind.SYSTEM_LIMIT) {
            putStrings(node, "elementsContainer", element.elementsContainer());
            node.put("name", element.name());
            return;
        }

        if (element.identification() != null) {
            ObjectNode ident = node.putObject("identification");
            ident.put("$type", IDENTIFICATION_TYPE);
            writeIdentificationFields(ident, element.identification());
        }

        ArrayNode characteristics = node.putArray("characteristics");
        for (Characteristic c : element.characteristics()) {
            ObjectNode cNode = characteristics.addObject();
            if (c.identification() != null) {
                writeIdentificationFields(cNode.putObject("identification"), c.identification());
            }
            if (c.descriptiveElement() != null) {
                DescriptiveElement d = c.descriptiveElement();
                ObjectNode dNode = cNode.putObject("descriptiveElement");
                dNode.put("valueDeterminationProcess", d.valueDeterminationProcess());
                dNode.put("representivity", d.representivity());
                dNode.put("setpointValue", d.setpointValue());
                dNode.put("validityLimits", d.validityLimits());
                dNode.put("actualValues", d.actualValues());
            }
            if (c.relationalElement() != null) {
                RelationalElement r = c.relationalElement();
                ObjectNode rNode = cNode.putObject("relationalElement");
                rNode.put("view", r.view());
                rNode.put("model", r.model());
                rNode.put("regulationsForRelationalGeneration", r.regulationsForRelationalGeneration());
            }
        }

        putStrings(node, "incoming", element.incoming());
        putStrings(node, "outgoing", element.outgoing());
        putStrings(node, "isAssignedTo", element.isAssignedTo());
        node.put("name", element.name());
        if (element.decomposedView() != null) {
            node.put("decomposedView", element.decomposedView());
        }
    }

    private static void writeIdentificationFields(ObjectNode node, Identification identification) {
        node.put("uniqueIdent", identification.uniqueIdent());
        node.put("longName", identification.longName());
        node.put("shortName", identification.shortName());
        node.put("versionNumber", identification.versionNumber());
        node.put("revisionNumber", identification.revisionNumber());
    }

    private static void writeFlow(ObjectNode node, FpbFlow flow) {
        node.put("$type", flow.kind().fpbType());
        node.put("id", flow.id());
        node.put("sourceRef", flow.sourceRef());
        node.put("targetRef", flow.targetRef());
        if (flow.inTandemWith() != null) {
            putStrings(node, "inTandemWith", flow.inTandemWith());
        }
    }

    private static void writeElementVisual(ObjectNode node, ElementVisual visual) {
        node.put("id", visual.id());
        putNumber(node, "x", visual.x());
        putNumber(node, "y", visual.y());
        putNumber(node, "width", visual.width());
        putNumber(node, "height", visual.height());
        if (visual.type() != null) {
            node.put("type", visual.type().fpbType());
        }
        node.putObject("markers");
    }

    private static void writeFlowVisual(ObjectNode node, FlowVisual visual) {
        node.put("id", visual.id());
        if (visual.type() != null) {
            node.put("type", visual.type().fpbType());
        }
        ArrayNode waypoints = node.putArray("waypoints");
        for (Waypoint waypoint : visual.waypoints()) {
            ObjectNode wpNode = waypoints.addObject();
            if (waypoint.original() != null) {
                ObjectNode original = wpNode.putObject("original");
                putNumber(original, "x", waypoint.original().x());
                putNumber(original, "y", waypoint.original().y());
            }
            putNumber(wpNode, "x", waypoint.x());
            putNumber(wpNode, "y", waypoint.y());
        }
        node.putObject("markers");
    }

    /**
     * Integral values are written as JSON integers.
     */
    static void putNumber(ObjectNode node, String field, Double value) {
        if (value == null) {
            return;
        }
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            node.put(field, value.longValue());
        } else {
            node.put(field, value);
        }
    }

    private static void putStrings(ObjectNode node, String field, List<String> values) {
        ArrayNode array = node.putArray(field);
        for (String value : values) {
            array.add(value);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static Double doubleOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }

    private static List<String> stringList(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode value : array) {
            if (value.isValueNode() && !value.isNull()) {
                values.add(value.asText());
            }
        }
        return values;
    }

    /**
     * Four-space indentation, "key": value separators and [] / {} for empty containers.
     */
    private static class FpbPrettyPrinter extends DefaultPrettyPrinter {
        private static final DefaultIndenter INDENTER = new DefaultIndenter("    ", "\n");

        FpbPrettyPrinter() {
            indentArraysWith(INDENTER);
            indentObjectsWith(INDENTER);
        }

        FpbPrettyPrinter(FpbPrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new FpbPrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfValues > 0) {
                _arrayIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw(']');
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfEntries > 0) {
                _objectIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw('}');
        }
    }
}
