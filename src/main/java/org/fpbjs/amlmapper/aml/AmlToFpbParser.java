package org.fpbjs.amlmapper.aml;

import lombok.extern.slf4j.Slf4j;
import org.fpbjs.amlmapper.MappingException;
import org.fpbjs.amlmapper.aml.models.InterfaceEntry;
import org.fpbjs.amlmapper.config.models.MapperConfig;
import org.fpbjs.amlmapper.fpb.models.ElementVisual;
import org.fpbjs.amlmapper.fpb.models.FlowVisual;
import org.fpbjs.amlmapper.fpb.models.FpbDocument;
import org.fpbjs.amlmapper.fpb.models.FpbElement;
import org.fpbjs.amlmapper.fpb.models.FpbFlow;
import org.fpbjs.amlmapper.fpb.models.FpbProcess;
import org.fpbjs.amlmapper.fpb.models.FpbProject;
import org.fpbjs.amlmapper.fpb.models.Point;
import org.fpbjs.amlmapper.fpb.models.ProcessEntry;
import org.fpbjs.amlmapper.fpb.models.Waypoint;
import org.fpbjs.amlmapper.mapping.FlowKind;
import org.fpbjs.amlmapper.mapping.FpbAmlMappings;
import org.fpbjs.amlmapper.mapping.NodeKind;
import org.fpbjs.amlmapper.mapping.PortDirection;
import org.fpbjs.amlmapper.mapping.models.InterfaceInfo;
import org.fpbjs.amlmapper.util.IdGenerator;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.fpbjs.amlmapper.aml.AmlXmlHelper.attributeOrNull;
import static org.fpbjs.amlmapper.aml.AmlXmlHelper.childElements;

/**
 * Reads a CAEX 3.0 document back into an FPB.JS document.
 * <p>
 * Flows are rebuilt from InternalLinks whose two partner sides are known ExternalInterfaces of the same
 * process. Nested FPD_Process elements become separate process entries that share their id with the
 * process operator containing them; they are emitted before their parent.
 */
@Slf4j
public class AmlToFpbParser {
    private final MapperConfig config;
    private final IdGenerator idGenerator;

    public AmlToFpbParser(MapperConfig config, IdGenerator idGenerator) {
        this.config = config;
        this.idGenerator = idGenerator;
    }

    /**
     * @throws MappingException if there is no InstanceHierarchy, no top level FPD_Process or the
     *                          decomposition is deeper than configured
     */
    public FpbDocument parse(Document doc) {
        Element root = doc.getDocumentElement();
        List<Element> hierarchies = childElements(root, "InstanceHierarchy");
        if (hierarchies.isEmpty()) {
            throw new MappingException("No InstanceHierarchy found");
        }

        Element topProcess = findBySystemUnitClass(childElements(hierarchies.get(0), "InternalElement"),
                FpbAmlMappings.PROCESS_SUC_PATH);
        if (topProcess == null) {
            throw new MappingException("No FPD_Process found in InstanceHierarchy");
        }

        ParseRun run = new ParseRun();
        String entryProcessId = parseProcess(topProcess, null, 0, run);

        FpbProject project = new FpbProject(config.projectName, config.targetNamespace, entryProcessId);
        log.debug("Parsed {} process(es), entry point {}", run.processes.size(), entryProcessId);
        return new FpbDocument(project, run.processes);
    }

    private String parseProcess(Element processIE, String parentOperatorId, int depth, ParseRun run) {
        if (depth > config.maxDecompositionDepth) {
            throw new MappingException("Process decomposition exceeds maximum depth of " + config.maxDecompositionDepth);
        }

        List<Element> children = childElements(processIE, "InternalElement");

        List<FpbElement> elements = new ArrayList<>();
        List<ElementVisual> elementVisuals = new ArrayList<>();
        List<FlowVisual> flowVisuals = new ArrayList<>();
        List<String> containerIds = new ArrayList<>();

        Element systemLimitIE = findBySystemUnitClass(children,
                FpbAmlMappings.systemUnitClassPath(NodeKind.SYSTEM_LIMIT));
        String systemLimitId = null;
        if (systemLimitIE != null) {
            systemLimitId = idGenerator.nextId();
            String name = attributeOrNull(systemLimitIE, "Name");
            elements.add(FpbElement.builder()
                    .kind(NodeKind.SYSTEM_LIMIT)
                    .id(systemLimitId)
                    .name(name == null || name.isEmpty() ? "SystemLimit" : name)
                    .elementsContainer(containerIds)
                    .build());
            ElementVisual visual = AmlAttributeCodec.parseVisual(systemLimitIE, systemLimitId, NodeKind.SYSTEM_LIMIT);
            if (visual != null) {
                elementVisuals.add(visual);
            }
        }

        String processId = parentOperatorId != null ? parentOperatorId : idGenerator.nextId();
        if (parentOperatorId != null) {
            run.decompositionParents.put(processId, parentOperatorId);
        }

        Map<String, InterfaceEntry> interfaces = new HashMap<>();
        Map<String, FpbElement> elementsById = new HashMap<>();
        List<String> stateIds = new ArrayList<>();
        List<String> operatorIds = new ArrayList<>();
        List<String> childProcessIds = new ArrayList<>();

        for (Element ie : children) {
            NodeKind kind = FpbAmlMappings.nodeKindForSystemUnitClass(ie.getAttribute("RefBaseSystemUnitPath"));
            if (kind == null) {
                if (!FpbAmlMappings.PROCESS_SUC_PATH.equals(ie.getAttribute("RefBaseSystemUnitPath"))) {
                    log.debug("Skipping InternalElement '{}' with unknown class '{}'",
                            ie.getAttribute("Name"), ie.getAttribute("RefBaseSystemUnitPath"));
                }
                continue;
            }
            if (kind == NodeKind.SYSTEM_LIMIT) {
                continue;
            }

            String uniqueIdent = AmlAttributeCodec.parseIdentificationId(ie);
            String elementId = uniqueIdent != null ? uniqueIdent : idGenerator.nextId();

            for (Element port : childElements(ie, "ExternalInterface")) {
                InterfaceInfo info = FpbAmlMappings.interfaceInfo(port.getAttribute("RefBaseClassPath"));
                if (info == null) {
                    log.debug("Skipping ExternalInterface '{}' with unknown class '{}'",
                            port.getAttribute("Name"), port.getAttribute("RefBaseClassPath"));
                    continue;
                }
                interfaces.put(port.getAttribute("ID"), new InterfaceEntry(elementId, info.flowKind(),
                        info.direction(), AmlAttributeCodec.parsePortCoordinate(port),
                        AmlAttributeCodec.parseWaypoints(port)));
            }

            String decomposedView = null;
            Element nestedProcess = findBySystemUnitClass(childElements(ie, "InternalElement"),
                    FpbAmlMappings.PROCESS_SUC_PATH);
            if (nestedProcess != null) {
                parseProcess(nestedProcess, elementId, depth + 1, run);
                decomposedView = elementId;
                childProcessIds.add(elementId);
            }

            String name = attributeOrNull(ie, "Name");
            FpbElement element = FpbElement.builder()
                    .kind(kind)
                    .id(elementId)
                    .name(name != null ? name : "")
                    .identification(AmlAttributeCodec.parseIdentification(ie))
                    .characteristics(AmlAttributeCodec.parseCharacteristics(ie))
                    .incoming(new ArrayList<>())
                    .outgoing(new ArrayList<>())
                    .isAssignedTo(new ArrayList<>())
                    .decomposedView(decomposedView)
                    .build();
            elements.add(element);
            elementsById.putIfAbsent(elementId, element);

            ElementVisual visual = AmlAttributeCodec.parseVisual(ie, elementId, kind);
            if (visual != null) {
                elementVisuals.add(visual);
            }

            containerIds.add(elementId);
            if (kind.isState()) {
                stateIds.add(elementId);
            } else if (kind == NodeKind.PROCESS_OPERATOR) {
                operatorIds.add(elementId);
            }
        }

        List<FpbFlow> flows = parseLinks(processIE, interfaces, elementsById, flowVisuals, containerIds);

        List<String> processContainer = new ArrayList<>();
        if (systemLimitId != null) {
            processContainer.add(systemLimitId);
            for (FpbElement element : elements) {
                if (element.kind() == NodeKind.TECHNICAL_RESOURCE) {
                    processContainer.add(element.id());
                }
            }
        }

        String decomposedOperator = run.decompositionParents.get(processId);
        FpbProcess process = FpbProcess.builder()
                .id(processId)
                .elementsContainer(processContainer)
                .isDecomposedProcessOperator(decomposedOperator)
                .consistsOfStates(stateIds)
                .consistsOfSystemLimit(systemLimitId)
                .consistsOfProcesses(childProcessIds)
                .consistsOfProcessOperator(operatorIds)
                .parent(decomposedOperator)
                .build();

        run.processes.add(new ProcessEntry(process, elements, flows, elementVisuals, flowVisuals));
        return processId;
    }

    private List<FpbFlow> parseLinks(Element processIE, Map<String, InterfaceEntry> interfaces,
                                     Map<String, FpbElement> elementsById, List<FlowVisual> flowVisuals,
                                     List<String> containerIds) {
        List<PendingFlow> pending = new ArrayList<>();

        for (Element link : childElements(processIE, "InternalLink")) {
            InterfaceEntry sideA = interfaces.get(link.getAttribute("RefPartnerSideA"));
            InterfaceEntry sideB = interfaces.get(link.getAttribute("RefPartnerSideB"));
            if (sideA == null || sideB == null) {
                log.debug("Skipping link '{}': partner interface not found", link.getAttribute("Name"));
                continue;
            }

            InterfaceEntry source;
            InterfaceEntry target;
            if (sideA.direction() == PortDirection.OUT && sideB.direction() == PortDirection.IN) {
                source = sideA;
                target = sideB;
            } else if (sideA.direction() == PortDirection.IN && sideB.direction() == PortDirection.OUT) {
                source = sideB;
                target = sideA;
            } else if (sideA.direction() == PortDirection.SHARED && sideB.direction() == PortDirection.SHARED) {
                source = sideA;
                target = sideB;
            } else {
                log.debug("Skipping link '{}': cannot tell source from target ({} / {})",
                        link.getAttribute("Name"), sideA.direction(), sideB.direction());
                continue;
            }

            FlowKind kind = source.flowKind();
            String flowId = idGenerator.nextId();
            pending.add(new PendingFlow(kind, flowId, source.ownerId(), target.ownerId()));

            List<Waypoint> waypoints = buildWaypoints(source, target);
            if (!waypoints.isEmpty()) {
                flowVisuals.add(new FlowVisual(flowId, kind, waypoints));
            }

            FpbElement sourceElement = elementsById.get(source.ownerId());
            FpbElement targetElement = elementsById.get(target.ownerId());
            if (sourceElement != null) {
                sourceElement.outgoing().add(flowId);
            }
            if (targetElement != null) {
                targetElement.incoming().add(flowId);
            }
            if (sourceElement != null && targetElement != null) {
                assign(kind, sourceElement, targetElement);
            }

            containerIds.add(flowId);
        }

        return withTandems(pending);
    }

    /**
     * Usage flows assign both ends to each other; other flows between a state and a process operator
     * assign the operator to the state.
     */
    private static void assign(FlowKind kind, FpbElement source, FpbElement target) {
        if (kind == FlowKind.USAGE) {
            addOnce(source.isAssignedTo(), target.id());
            addOnce(target.isAssignedTo(), source.id());
            return;
        }
        if (source.kind().isState() && target.kind() == NodeKind.PROCESS_OPERATOR) {
            addOnce(source.isAssignedTo(), target.id());
        }
        if (target.kind().isState() && source.kind() == NodeKind.PROCESS_OPERATOR) {
            addOnce(target.isAssignedTo(), source.id());
        }
    }

    /**
     * Parallel and alternative flows with the same source and kind list each other in inTandemWith.
     */
    private static List<FpbFlow> withTandems(List<PendingFlow> pending) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (PendingFlow flow : pending) {
            if (flow.kind().isTandem()) {
                groups.computeIfAbsent(flow.tandemKey(), k -> new ArrayList<>()).add(flow.id());
            }
        }

        List<FpbFlow> flows = new ArrayList<>();
        for (PendingFlow flow : pending) {
            if (!flow.kind().isTandem()) {
                flows.add(new FpbFlow(flow.kind(), flow.id(), flow.sourceRef(), flow.targetRef(), null));
                continue;
            }
            List<String> others = new ArrayList<>(groups.get(flow.tandemKey()));
            others.remove(flow.id());
            flows.add(new FpbFlow(flow.kind(), flow.id(), flow.sourceRef(), flow.targetRef(), others));
        }
        return flows;
    }

    /**
     * Source port coordinate, then the interior waypoints, then the target port coordinate. Both port
     * coordinates are flagged as original docking points.
     */
    private static List<Waypoint> buildWaypoints(InterfaceEntry source, InterfaceEntry target) {
        List<Waypoint> waypoints = new ArrayList<>();
        if (source.coordinate() != null) {
            waypoints.add(Waypoint.original(source.coordinate()));
        }
        for (Point point : source.waypoints()) {
            waypoints.add(new Waypoint(point.x(), point.y()));
        }
        if (target.coordinate() != null) {
            waypoints.add(Waypoint.original(target.coordinate()));
        }
        return waypoints;
    }

    private static void addOnce(List<String> ids, String id) {
        if (!ids.contains(id)) {
            ids.add(id);
        }
    }

    private static Element findBySystemUnitClass(List<Element> elements, String sucPath) {
        for (Element element : elements) {
            if (sucPath.equals(element.getAttribute("RefBaseSystemUnitPath"))) {
                return element;
            }
        }
        return null;
    }

    private record PendingFlow(FlowKind kind, String id, String sourceRef, String targetRef) {
        String tandemKey() {
            return sourceRef + "|" + kind.name();
        }
    }

    /**
     * State of one parse call: finished process entries in emission order and the decomposition table
     * (child process id to process operator id).
     */
    private static class ParseRun {
        final List<ProcessEntry> processes = new ArrayList<>();
        final Map<String, String> decompositionParents = new LinkedHashMap<>();
    }
}
