package org.fpbjs.amlmapper.aml;

import org.fpbjs.amlmapper.mapping.AttributeBlock;
import org.w3c.dom.Element;

import java.util.List;

import static org.fpbjs.amlmapper.aml.AmlAttributeCodec.XS_DOUBLE;
import static org.fpbjs.amlmapper.aml.AmlAttributeCodec.XS_STRING;
import static org.fpbjs.amlmapper.aml.AmlAttributeCodec.addAttribute;
import static org.fpbjs.amlmapper.aml.AmlXmlHelper.appendElement;
import static org.fpbjs.amlmapper.aml.AmlXmlHelper.appendTextElement;

/**
 * The FPD class libraries (VDI 3682 library, version 1.0.0) embedded into every generated AML file.
 */
public class AmlLibraries {
    public static final String LIBRARY_VERSION = "1.0.0";

    private static final List<String> PORT_CLASSES = List.of(
            "FPD_FlowIn", "FPD_FlowOut",
            "FPD_Usage",
            "FPD_ParallelFlowIn", "FPD_ParallelFlowOut",
            "FPD_AlternativeFlowIn", "FPD_AlternativeFlowOut");

    private static final List<String> IDENTIFICATION_FIELDS =
            List.of("uniqueIdent", "longName", "shortName", "versionNumber", "revisionNumber");
    private static final List<String> DESCRIPTIVE_FIELDS =
            List.of("valueDeterminationProcess", "representivity", "setpointValue", "validityLimits", "actualValues");
    private static final List<String> RELATIONAL_FIELDS =
            List.of("view", "model", "regulationsForRelationalGeneration");

    /**
     * Appends InterfaceClassLib, SystemUnitClassLib, AttributeTypeLib and VisualAttributeTypeLib to the
     * CAEXFile element.
     */
    public static void appendLibraries(Element caexFile) {
        appendInterfaceClassLib(caexFile);
        appendSystemUnitClassLib(caexFile);
        appendAttributeTypeLib(caexFile);
        appendVisualAttributeTypeLib(caexFile);
    }

    private static void appendInterfaceClassLib(Element caexFile) {
        Element lib = versioned(caexFile, "InterfaceClassLib", "FPD_InterfaceClassLib");

        Element port = versioned(lib, "InterfaceClass", "FPD_Port");
        addCoordinate(port, "PortCoordinate");

        for (String name : PORT_CLASSES) {
            Element ic = versioned(lib, "InterfaceClass", name);
            ic.setAttribute("RefBaseClassPath", "FPD_InterfaceClassLib/FPD_Port");
        }
    }

    private static void appendSystemUnitClassLib(Element caexFile) {
        Element lib = versioned(caexFile, "SystemUnitClassLib", "FPD_SystemUnitClassLib");

        Element object = versioned(lib, "SystemUnitClass", "FPD_Object");
        addFields(addAttribute(object, "Identification", XS_STRING, AttributeBlock.IDENTIFICATION),
                IDENTIFICATION_FIELDS);
        Element characteristics = addAttribute(object, "Characteristics", XS_STRING, null);
        appendTextElement(characteristics, "Description", "Container for characteristics");
        addElementVisual(addAttribute(object, "Visual", XS_STRING, AttributeBlock.ELEMENT_VISUAL));

        for (String name : List.of("FPD_SystemLimit", "FPD_ProcessOperator", "FPD_TechnicalResource", "FPD_State")) {
            versioned(lib, "SystemUnitClass", name)
                    .setAttribute("RefBaseClassPath", "FPD_SystemUnitClassLib/FPD_Object");
        }
        for (String name : List.of("FPD_Product", "FPD_Information", "FPD_Energy")) {
            versioned(lib, "SystemUnitClass", name)
                    .setAttribute("RefBaseClassPath", "FPD_SystemUnitClassLib/FPD_State");
        }

        Element process = versioned(lib, "SystemUnitClass", "FPD_Process");
        Element systemLimit = appendElement(process, "InternalElement");
        systemLimit.setAttribute("Name", "SystemLimit");
        systemLimit.setAttribute("RefBaseSystemUnitPath", "FPD_SystemUnitClassLib/FPD_SystemLimit");
    }

    private static void appendAttributeTypeLib(Element caexFile) {
        Element lib = versioned(caexFile, "AttributeTypeLib", "FPD_AttributeTypeLib");

        Element identification = versionedType(lib, "FPD_Identification");
        addFields(identification, IDENTIFICATION_FIELDS);

        Element characteristic = versionedType(lib, "FPD_Characteristic");
        Element cIdent = addAttribute(characteristic, "Identification", XS_STRING, AttributeBlock.IDENTIFICATION);
        addFields(cIdent, IDENTIFICATION_FIELDS);
        addFields(addAttribute(characteristic, "DescriptiveElement", XS_STRING, null), DESCRIPTIVE_FIELDS);
        addFields(addAttribute(characteristic, "RelationalElement", XS_STRING, null), RELATIONAL_FIELDS);
    }

    private static void appendVisualAttributeTypeLib(Element caexFile) {
        Element lib = versioned(caexFile, "AttributeTypeLib", "FPD_VisualAttributeTypeLib");

        addElementVisual(versionedType(lib, "FPD_ElementVisual"));
        addCoordinate(versionedType(lib, "FPD_Waypoint"), "position");

        Element coordinate = versionedType(lib, "FPD_Coordinate");
        addAttribute(coordinate, "x", XS_DOUBLE, null);
        addAttribute(coordinate, "y", XS_DOUBLE, null);
    }

    private static Element versioned(Element parent, String tag, String name) {
        Element element = appendElement(parent, tag);
        element.setAttribute("Name", name);
        appendTextElement(element, "Version", LIBRARY_VERSION);
        return element;
    }

    private static Element versionedType(Element lib, String name) {
        Element type = versioned(lib, "AttributeType", name);
        type.setAttribute("AttributeDataType", XS_STRING);
        return type;
    }

    private static void addElementVisual(Element parent) {
        addCoordinate(parent, "position");
        addAttribute(parent, "width", XS_DOUBLE, null);
        addAttribute(parent, "height", XS_DOUBLE, null);
    }

    private static void addCoordinate(Element parent, String name) {
        Element coordinate = addAttribute(parent, name, XS_STRING, AttributeBlock.COORDINATE);
        addAttribute(coordinate, "x", XS_DOUBLE, null);
        addAttribute(coordinate, "y", XS_DOUBLE, null);
    }

    private static void addFields(Element parent, List<String> fieldNames) {
        for (String field : fieldNames) {
            addAttribute(parent, field, XS_STRING, null);
        }
    }
}
