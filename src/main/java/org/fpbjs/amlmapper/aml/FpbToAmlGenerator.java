package org.fpbjs.amlmapper.aml;

import lombok.extern.slf4j.Slf4j;
import org.fpbjs.amlmapper.MappingException;
import org.fpbjs.amlmapper.config.models.MapperConfig;
import org.fpbjs.amlmapper.fpb.models.ElementVisual;
import org.fpbjs.amlmapper.fpb.models.FlowVisual;
import org.fpbjs.amlmapper.fpb.models.FpbDocument;
import org.fpbjs.amlmapper.fpb.models.FpbElement;
import org.fpbjs.amlmapper.fpb.models.FpbFlow;
import org.fpbjs.amlmapper.fpb.models.ProcessEntry;
import org.fpbjs.amlmapper.fpb.models.Waypoint;
import org.fpbjs.amlmapper.mapping.FpbAmlMappings;
import org.fpbjs.amlmapper.mapping.NodeKind;
import org.fpbjs.amlmapper.mapping.models.InterfaceClassPair;
import org.fpbjs.amlmapper.util.IdGenerator;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.fpbjs.amlmapper.aml.AmlXmlHelper.CAEX_NS;
import static org.fpbjs.amlmapper.aml.AmlXmlHelper.XSI_NS;
import static org.fpbjs.amlmapper.aml.AmlXmlHelper.appendElement;
import static org.fpbjs.amlmapper.aml.AmlXmlHelper.appendTextElement;

/**
 * Builds a CAEX 3.0 document from an FPB.JS document.
 * <p>
 * The entry process becomes the FPD_Process InternalElement of the instance hierarchy. Every flow becomes an
 * ExternalInterface on its source and target element plus one InternalLink joining them. A decomposed process
 * operator carries its child process as a nested FPD_Process.
 */
@Slf4j
public class FpbToAmlGenerator {
    private static final String XMLNS_NS = "http://www.w3.org/2000/xmlns/";
    private static final String SCHEMA_LOCATION = CAEX_NS + " CAEX_ClassModel_V.3.0.xsd";
    private static final DateTimeFormatter WRITING_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final MapperConfig config;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public FpbToAmlGenerator(MapperConfig config, IdGenerator idGenerator, Clock clock) {
        this.config = config;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /**
     * Generates the AML document for the project's entry point process.
     *
     * @throws MappingException if the entry point process does not exist or decomposition is too deep
     */
    public Document generate(FpbDocument fpbDocument) {
        if (fpbDocument.project() == null) {
            throw new MappingException("No fpb:Project header found");
        }
        return generate(fpbDocument, fpbDocument.project().entryPoint());
    }

    /**
     * Generates the AML document starting at the given process instead of the project's entry point.
     */
    public Document generate(FpbDocument fpbDocument, String entryProcessId) {
        if (fpbDocument.findProcess(entryProcessId) == null) {
            throw new MappingException("Entry point process not found: " + entryProcessId);
        }

        Document doc = AmlXmlHelper.newDocument();
        Element caex = doc.createElementNS(CAEX_NS, "CAEXFile");
        doc.appendChild(caex);
        caex.setAttributeNS(XMLNS_NS, "xmlns", CAEX_NS);
        caex.setAttributeNS(XMLNS_NS, "xmlns:xsi", XSI_NS);
        caex.setAttributeNS(XSI_NS, "xsi:schemaLocation", SCHEMA_LOCATION);
        caex.setAttribute("SchemaVersion", "3.0");
        caex.setAttribute("FileName", config.fileName);

        appendTextElement(caex, "SuperiorStandardVersion", "AutomationML 2.1");
        Element sourceInfo = appendElement(caex, "SourceDocumentInformation");
        sourceInfo.setAttribute("OriginName", config.originName);
        sourceInfo.setAttribute("OriginID", config.originId);
        sourceInfo.setAttribute("OriginVersion", config.originVersion);
        sourceInfo.setAttribute("LastWritingDateTime", WRITING_TIME.format(clock.instant()));

        Element hierarchy = appendElement(caex, "InstanceHierarchy");
        hierarchy.setAttribute("Name", "InstanceHierarchy");
        hierarchy.setAttribute("ID", idGenerator.nextId());
        appendTextElement(hierarchy, "Version", "1.0.0");

        buildProcess(hierarchy, entryProcessId, fpbDocument, 0);

        AmlLibraries.appendLibraries(caex);
        return doc;
    }

    private void buildProcess(Element parent, String processId, FpbDocument fpbDocument, int depth) {
        if (depth > config.maxDecompositionDepth) {
            throw new MappingException("Process decomposition exceeds maximum depth of " + config.maxDecompositionDepth);
        }

        ProcessEntry entry = fpbDocument.findProcess(processId);
        if (entry == null) {
            log.warn("Decomposed process {} not found, skipping", processId);
            return;
        }

        FpbElement systemLimit = entry.systemLimit();
        String processName = systemLimit != null && hasText(systemLimit.name()) ? systemLimit.name() : "Process";

        Element processIE = appendInternalElement(parent, processName, FpbAmlMappings.PROCESS_SUC_PATH);

        if (systemLimit != null) {
            Element slIE = appendInternalElement(processIE,
                    hasText(systemLimit.name()) ? systemLimit.name() : "SystemLimit",
                    FpbAmlMappings.systemUnitClassPath(NodeKind.SYSTEM_LIMIT));
            ElementVisual slVisual = entry.findElementVisual(systemLimit.id());
            if (slVisual != null) {
                AmlAttributeCodec.addVisual(slIE, slVisual);
            }
        }

        // flow id -> port ids, in the order flows first received a port
        Map<String, LinkEnds> linkEnds = new LinkedHashMap<>();
        AmlNaming.Counter portNames = new AmlNaming.Counter();

        for (FpbElement element : entry.elements()) {
            if (element.kind() == NodeKind.SYSTEM_LIMIT) {
                continue;
            }

            Element ie = appendInternalElement(processIE,
                    hasText(element.name()) ? element.name() : element.kind().shortName(),
                    FpbAmlMappings.systemUnitClassPath(element.kind()));

            if (element.identification() != null) {
                AmlAttributeCodec.addIdentification(ie, element.identification());
            }
            AmlAttributeCodec.addCharacteristics(ie, element.characteristics());
            ElementVisual visual = entry.findElementVisual(element.id());
            if (visual != null) {
                AmlAttributeCodec.addVisual(ie, visual);
            }

            for (FpbFlow flow : entry.flows()) {
                if (!element.id().equals(flow.sourceRef())) {
                    continue;
                }
                InterfaceClassPair classes = FpbAmlMappings.interfaceClasses(flow.kind());
                Element port = appendPort(ie, portNames.next(element.id(), classes.outBaseName()), classes.out());
                addOutCoordinates(port, waypointsOf(entry, flow));
                linkEnds.computeIfAbsent(flow.id(), k -> new LinkEnds()).outPortId = port.getAttribute("ID");
            }

            for (FpbFlow flow : entry.flows()) {
                if (!element.id().equals(flow.targetRef())) {
                    continue;
                }
                InterfaceClassPair classes = FpbAmlMappings.interfaceClasses(flow.kind());
                Element port = appendPort(ie, portNames.next(element.id(), classes.inBaseName()), classes.in());
                addInCoordinates(port, waypointsOf(entry, flow));
                linkEnds.computeIfAbsent(flow.id(), k -> new LinkEnds()).inPortId = port.getAttribute("ID");
            }

            if (element.kind() == NodeKind.PROCESS_OPERATOR && hasText(element.decomposedView())) {
                buildProcess(ie, element.decomposedView(), fpbDocument, depth + 1);
            }
        }

        int linkIndex = 0;
        for (Map.Entry<String, LinkEnds> link : linkEnds.entrySet()) {
            LinkEnds ends = link.getValue();
            if (ends.outPortId == null || ends.inPortId == null) {
                log.debug("Flow {} has only one port in process {}, no link written", link.getKey(), processId);
                continue;
            }
            Element internalLink = appendElement(processIE, "InternalLink");
            internalLink.setAttribute("RefPartnerSideA", ends.outPortId);
            internalLink.setAttribute("RefPartnerSideB", ends.inPortId);
            internalLink.setAttribute("Name", AmlNaming.indexedName("Link", linkIndex++));
        }

        log.debug("Generated process {} with {} elements, {} flows and {} links",
                processId, entry.elements().size(), entry.flows().size(), linkIndex);
    }

    private Element appendInternalElement(Element parent, String name, String sucPath) {
        Element ie = appendElement(parent, "InternalElement");
        ie.setAttribute("Name", name);
        ie.setAttribute("ID", idGenerator.nextId());
        ie.setAttribute("RefBaseSystemUnitPath", sucPath);
        return ie;
    }

    private Element appendPort(Element owner, String name, String interfaceClassPath) {
        Element port = appendElement(owner, "ExternalInterface");
        port.setAttribute("Name", name);
        port.setAttribute("ID", idGenerator.nextId());
        port.setAttribute("RefBaseClassPath", interfaceClassPath);
        return port;
    }

    /**
     * Source side: the first waypoint is the port coordinate, the interior ones are kept as FPD_Waypoint
     * attributes. The last waypoint belongs to the target side.
     */
    private static void addOutCoordinates(Element port, List<Waypoint> waypoints) {
        if (waypoints.isEmpty()) {
            AmlAttributeCodec.addEmptyPortCoordinate(port);
            return;
        }

        AmlAttributeCodec.addPortCoordinate(port, waypoints.get(0).anchor());

        int waypointIndex = 0;
        for (int i = 1; i < waypoints.size() - 1; i++) {
            Waypoint waypoint = waypoints.get(i);
            if (waypoint.original() != null) {
                continue;
            }
            AmlAttributeCodec.addWaypoint(port,
                    AmlNaming.indexedName(AmlAttributeCodec.WAYPOINT, waypointIndex++), waypoint);
        }
    }

    private static void addInCoordinates(Element port, List<Waypoint> waypoints) {
        if (waypoints.isEmpty()) {
            AmlAttributeCodec.addEmptyPortCoordinate(port);
            return;
        }
        AmlAttributeCodec.addPortCoordinate(port, waypoints.get(waypoints.size() - 1).anchor());
    }

    private static List<Waypoint> waypointsOf(ProcessEntry entry, FpbFlow flow) {
        FlowVisual visual = entry.findFlowVisual(flow.id());
        return visual != null ? visual.waypoints() : List.of();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    private static class LinkEnds {
        String outPortId;
        String inPortId;
    }
}
