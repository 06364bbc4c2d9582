package org.fpbjs.amlmapper.mapping;

import org.fpbjs.amlmapper.mapping.models.InterfaceClassPair;
import org.fpbjs.amlmapper.mapping.models.InterfaceInfo;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Type mappings between FPB.JS and the FPD AutomationML libraries.
 */
public final class FpbAmlMappings {
    public static final String SYSTEM_UNIT_CLASS_LIB = "FPD_SystemUnitClassLib";
    public static final String INTERFACE_CLASS_LIB = "FPD_InterfaceClassLib";
    public static final String PROCESS_SUC_PATH = SYSTEM_UNIT_CLASS_LIB + "/FPD_Process";

    private static final Map<String, NodeKind> SUC_TO_NODE_KIND;
    private static final Map<String, InterfaceInfo> INTERFACE_TO_FLOW;

    static {
        Map<String, NodeKind> sucToNode = new HashMap<>();
        for (NodeKind kind : NodeKind.values()) {
            sucToNode.put(systemUnitClassPath(kind), kind);
        }
        SUC_TO_NODE_KIND = Collections.unmodifiableMap(sucToNode);

        Map<String, InterfaceInfo> interfaceToFlow = new HashMap<>();
        for (FlowKind kind : FlowKind.values()) {
            InterfaceClassPair paths = interfaceClasses(kind);
            if (paths.out().equals(paths.in())) {
                interfaceToFlow.put(paths.out(), new InterfaceInfo(kind, PortDirection.SHARED));
            } else {
                interfaceToFlow.put(paths.out(), new InterfaceInfo(kind, PortDirection.OUT));
                interfaceToFlow.put(paths.in(), new InterfaceInfo(kind, PortDirection.IN));
            }
        }
        INTERFACE_TO_FLOW = Collections.unmodifiableMap(interfaceToFlow);
    }

    private FpbAmlMappings() {
    }

    public static String systemUnitClassPath(NodeKind kind) {
        return switch (kind) {
            case PRODUCT -> SYSTEM_UNIT_CLASS_LIB + "/FPD_Product";
            case ENERGY -> SYSTEM_UNIT_CLASS_LIB + "/FPD_Energy";
            case INFORMATION -> SYSTEM_UNIT_CLASS_LIB + "/FPD_Information";
            case PROCESS_OPERATOR -> SYSTEM_UNIT_CLASS_LIB + "/FPD_ProcessOperator";
            case TECHNICAL_RESOURCE -> SYSTEM_UNIT_CLASS_LIB + "/FPD_TechnicalResource";
            case SYSTEM_LIMIT -> SYSTEM_UNIT_CLASS_LIB + "/FPD_SystemLimit";
        };
    }

    /**
     * @return the element kind of a RefBaseSystemUnitPath, or null for unknown paths and for FPD_Process
     */
    public static NodeKind nodeKindForSystemUnitClass(String sucPath) {
        if (sucPath == null) {
            return null;
        }
        return SUC_TO_NODE_KIND.get(sucPath);
    }

    public static InterfaceClassPair interfaceClasses(FlowKind kind) {
        return switch (kind) {
            case FLOW -> pair("FPD_FlowOut", "FPD_FlowIn");
            case PARALLEL_FLOW -> pair("FPD_ParallelFlowOut", "FPD_ParallelFlowIn");
            case ALTERNATIVE_FLOW -> pair("FPD_AlternativeFlowOut", "FPD_AlternativeFlowIn");
            case USAGE -> pair("FPD_Usage", "FPD_Usage");
        };
    }

    /**
     * Reverse lookup of an interface RefBaseClassPath.
     *
     * @return flow kind and direction, or null for unknown interface classes
     */
    public static InterfaceInfo interfaceInfo(String interfaceClassPath) {
        if (interfaceClassPath == null) {
            return null;
        }
        return INTERFACE_TO_FLOW.get(interfaceClassPath);
    }

    public static String attributeTypeRef(AttributeBlock block) {
        return block.ref();
    }

    private static InterfaceClassPair pair(String outName, String inName) {
        return new InterfaceClassPair(INTERFACE_CLASS_LIB + "/" + outName, INTERFACE_CLASS_LIB + "/" + inName);
    }
}
