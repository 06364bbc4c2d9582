package org.fpbjs.amlmapper.aml;

import lombok.extern.slf4j.Slf4j;
import org.fpbjs.amlmapper.fpb.models.Characteristic;
import org.fpbjs.amlmapper.fpb.models.DescriptiveElement;
import org.fpbjs.amlmapper.fpb.models.ElementVisual;
import org.fpbjs.amlmapper.fpb.models.Identification;
import org.fpbjs.amlmapper.fpb.models.Point;
import org.fpbjs.amlmapper.fpb.models.RelationalElement;
import org.fpbjs.amlmapper.fpb.models.Waypoint;
import org.fpbjs.amlmapper.mapping.AttributeBlock;
import org.fpbjs.amlmapper.mapping.NodeKind;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.fpbjs.amlmapper.aml.AmlXmlHelper.appendElement;
import static org.fpbjs.amlmapper.aml.AmlXmlHelper.appendTextElement;
import static org.fpbjs.amlmapper.aml.AmlXmlHelper.childElements;
import static org.fpbjs.amlmapper.aml.AmlXmlHelper.findDirectChild;

/**
 * Encodes and decodes the CAEX attribute blocks shared by both conversion directions:
 * Identification, Characteristics, Visual, PortCoordinate and FPD_Waypoint.
 * <p>
 * Encoding always writes every slot of a block; a missing value leaves the slot without a Value child.
 * Decoding is lenient: missing strings become "", missing numbers become 0.
 */
@Slf4j
public class AmlAttributeCodec {
    public static final String IDENTIFICATION = "Identification";
    public static final String CHARACTERISTICS = "Characteristics";
    public static final String CHARACTERISTIC = "Characteristic";
    public static final String DESCRIPTIVE_ELEMENT = "DescriptiveElement";
    public static final String RELATIONAL_ELEMENT = "RelationalElement";
    public static final String VISUAL = "Visual";
    public static final String POSITION = "position";
    public static final String PORT_COORDINATE = "PortCoordinate";
    public static final String WAYPOINT = "FPD_Waypoint";

    static final String XS_STRING = "xs:string";
    static final String XS_DOUBLE = "xs:double";

    // ---------------------------------------------------------------- encoding

    public static void addIdentification(Element parent, Identification identification) {
        Element attr = addAttribute(parent, IDENTIFICATION, XS_STRING, AttributeBlock.IDENTIFICATION);
        addStringSubAttr(attr, "uniqueIdent", identification.uniqueIdent());
        addStringSubAttr(attr, "longName", identification.longName());
        addStringSubAttr(attr, "shortName", identification.shortName());
        addStringSubAttr(attr, "versionNumber", identification.versionNumber());
        addStringSubAttr(attr, "revisionNumber", identification.revisionNumber());
    }

    /**
     * Writes the Characteristics container. The container is written even for an empty list.
     */
    public static void addCharacteristics(Element parent, List<Characteristic> characteristics) {
        Element container = addAttribute(parent, CHARACTERISTICS, XS_STRING, null);
        appendTextElement(container, "Description", "Container for characteristics");

        if (characteristics == null) {
            return;
        }
        for (int i = 0; i < characteristics.size(); i++) {
            Characteristic c = characteristics.get(i);
            Element cAttr = addAttribute(container, AmlNaming.indexedName(CHARACTERISTIC, i), XS_STRING,
                    AttributeBlock.CHARACTERISTIC);
            if (c.identification() != null) {
                addIdentification(cAttr, c.identification());
            }
            if (c.descriptiveElement() != null) {
                DescriptiveElement d = c.descriptiveElement();
                Element desc = addAttribute(cAttr, DESCRIPTIVE_ELEMENT, XS_STRING, null);
                addStringSubAttr(desc, "valueDeterminationProcess", d.valueDeterminationProcess());
                addStringSubAttr(desc, "representivity", d.representivity());
                addStringSubAttr(desc, "setpointValue", d.setpointValue());
                addStringSubAttr(desc, "validityLimits", d.validityLimits());
                addStringSubAttr(desc, "actualValues", d.actualValues());
            }
            if (c.relationalElement() != null) {
                RelationalElement r = c.relationalElement();
                Element rel = addAttribute(cAttr, RELATIONAL_ELEMENT, XS_STRING, null);
                addStringSubAttr(rel, "view", r.view());
                addStringSubAttr(rel, "model", r.model());
                addStringSubAttr(rel, "regulationsForRelationalGeneration", r.regulationsForRelationalGeneration());
            }
        }
    }

    public static void addVisual(Element parent, ElementVisual visual) {
        Element attr = addAttribute(parent, VISUAL, XS_STRING, AttributeBlock.ELEMENT_VISUAL);
        Element pos = addAttribute(attr, POSITION, XS_STRING, AttributeBlock.COORDINATE);
        addDoubleSubAttr(pos, "x", visual.x());
        addDoubleSubAttr(pos, "y", visual.y());
        addDoubleSubAttr(attr, "width", visual.width());
        addDoubleSubAttr(attr, "height", visual.height());
    }

    public static void addPortCoordinate(Element parent, Point point) {
        Element attr = addAttribute(parent, PORT_COORDINATE, XS_STRING, AttributeBlock.COORDINATE);
        addDoubleSubAttr(attr, "x", point.x());
        addDoubleSubAttr(attr, "y", point.y());
    }

    /**
     * PortCoordinate with x/y slots but no values, used for flows without visual information.
     */
    public static void addEmptyPortCoordinate(Element parent) {
        Element attr = addAttribute(parent, PORT_COORDINATE, XS_STRING, AttributeBlock.COORDINATE);
        addDoubleSubAttr(attr, "x", null);
        addDoubleSubAttr(attr, "y", null);
    }

    public static void addWaypoint(Element parent, String name, Waypoint waypoint) {
        Element attr = addAttribute(parent, name, XS_STRING, AttributeBlock.WAYPOINT);
        Element pos = addAttribute(attr, POSITION, XS_STRING, AttributeBlock.COORDINATE);
        addDoubleSubAttr(pos, "x", waypoint.x());
        addDoubleSubAttr(pos, "y", waypoint.y());
    }

    static Element addAttribute(Element parent, String name, String dataType, AttributeBlock refType) {
        Element attr = appendElement(parent, "Attribute");
        attr.setAttribute("Name", name);
        attr.setAttribute("AttributeDataType", dataType);
        if (refType != null) {
            attr.setAttribute("RefAttributeType", refType.ref());
        }
        return attr;
    }

    static void addStringSubAttr(Element parent, String name, String value) {
        Element attr = addAttribute(parent, name, XS_STRING, null);
        if (value != null && !value.isEmpty()) {
            appendTextElement(attr, "Value", value);
        }
    }

    static void addDoubleSubAttr(Element parent, String name, Double value) {
        Element attr = addAttribute(parent, name, XS_DOUBLE, null);
        if (value != null) {
            appendTextElement(attr, "Value", formatNumber(value));
        }
    }

    /**
     * Integral values are written without fraction ("120" rather than "120.0").
     */
    public static String formatNumber(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    // ---------------------------------------------------------------- decoding

    /**
     * @return the uniqueIdent of the element's Identification block, or null if absent or empty
     */
    public static String parseIdentificationId(Element ie) {
        Element ident = findAttribute(ie, IDENTIFICATION);
        if (ident == null) {
            return null;
        }
        String uid = subAttributeValue(ident, "uniqueIdent");
        return uid.isEmpty() ? null : uid;
    }

    public static Identification parseIdentification(Element owner) {
        Element ident = findAttribute(owner, IDENTIFICATION);
        if (ident == null) {
            return null;
        }
        return new Identification(
                subAttributeValue(ident, "uniqueIdent"),
                subAttributeValue(ident, "longName"),
                subAttributeValue(ident, "shortName"),
                subAttributeValue(ident, "versionNumber"),
                subAttributeValue(ident, "revisionNumber"));
    }

    public static List<Characteristic> parseCharacteristics(Element ie) {
        List<Characteristic> characteristics = new ArrayList<>();
        Element container = findAttribute(ie, CHARACTERISTICS);
        if (container == null) {
            return characteristics;
        }

        for (Element cAttr : childElements(container, "Attribute")) {
            if (!cAttr.getAttribute("Name").startsWith(CHARACTERISTIC)) {
                continue;
            }

            DescriptiveElement descriptive = null;
            Element desc = findAttribute(cAttr, DESCRIPTIVE_ELEMENT);
            if (desc != null) {
                descriptive = new DescriptiveElement(
                        subAttributeValue(desc, "valueDeterminationProcess"),
                        subAttributeValue(desc, "representivity"),
                        subAttributeValue(desc, "setpointValue"),
                        subAttributeValue(desc, "validityLimits"),
                        subAttributeValue(desc, "actualValues"));
            }

            RelationalElement relational = null;
            Element rel = findAttribute(cAttr, RELATIONAL_ELEMENT);
            if (rel != null) {
                relational = new RelationalElement(
                        subAttributeValue(rel, "view"),
                        subAttributeValue(rel, "model"),
                        subAttributeValue(rel, "regulationsForRelationalGeneration"));
            }

            characteristics.add(new Characteristic(parseIdentification(cAttr), descriptive, relational));
        }
        return characteristics;
    }

    /**
     * Reads the Visual block of an InternalElement.
     * A block whose position and size are all zero or missing counts as no visual information.
     *
     * @return the visual record, or null
     */
    public static ElementVisual parseVisual(Element ie, String id, NodeKind kind) {
        Element visual = findAttribute(ie, VISUAL);
        if (visual == null) {
            return null;
        }

        Element pos = findAttribute(visual, POSITION);
        double x = pos != null ? numberOrZero(subAttributeValue(pos, "x")) : 0;
        double y = pos != null ? numberOrZero(subAttributeValue(pos, "y")) : 0;
        double width = numberOrZero(subAttributeValue(visual, "width"));
        double height = numberOrZero(subAttributeValue(visual, "height"));

        if (x == 0 && y == 0 && width == 0 && height == 0) {
            return null;
        }
        return new ElementVisual(id, kind, x, y, width, height);
    }

    /**
     * @return the PortCoordinate of an ExternalInterface, or null if absent or not numeric
     */
    public static Point parsePortCoordinate(Element extIf) {
        Element pc = findAttribute(extIf, PORT_COORDINATE);
        if (pc == null) {
            return null;
        }
        Double x = parseNumber(subAttributeValue(pc, "x"));
        Double y = parseNumber(subAttributeValue(pc, "y"));
        if (x == null || y == null) {
            return null;
        }
        return new Point(x, y);
    }

    /**
     * Reads the FPD_Waypoint attributes of an ExternalInterface, ordered by their name suffix.
     * Waypoints with a non-numeric suffix or position are ignored.
     */
    public static List<Point> parseWaypoints(Element extIf) {
        List<IndexedPoint> indexed = new ArrayList<>();
        for (Element attr : childElements(extIf, "Attribute")) {
            Integer index = AmlNaming.indexOf(attr.getAttribute("Name"), WAYPOINT);
            if (index == null) {
                continue;
            }
            Element pos = findAttribute(attr, POSITION);
            if (pos == null) {
                continue;
            }
            Double x = parseNumber(subAttributeValue(pos, "x"));
            Double y = parseNumber(subAttributeValue(pos, "y"));
            if (x == null || y == null) {
                log.debug("Ignoring waypoint '{}' without numeric position", attr.getAttribute("Name"));
                continue;
            }
            indexed.add(new IndexedPoint(index, new Point(x, y)));
        }

        indexed.sort(Comparator.comparingInt(IndexedPoint::index));
        return indexed.stream().map(IndexedPoint::point).toList();
    }

    /**
     * Finds the direct child Attribute with the given Name.
     */
    public static Element findAttribute(Element owner, String name) {
        for (Element attr : childElements(owner, "Attribute")) {
            if (name.equals(attr.getAttribute("Name"))) {
                return attr;
            }
        }
        return null;
    }

    /**
     * Trimmed text of the attribute's Value child, "" when the attribute or value is missing.
     */
    public static String attributeValue(Element attr) {
        if (attr == null) {
            return "";
        }
        Element value = findDirectChild(attr, "Value");
        if (value == null) {
            return "";
        }
        return value.getTextContent().trim();
    }

    static String subAttributeValue(Element parent, String name) {
        return attributeValue(findAttribute(parent, name));
    }

    static Double parseNumber(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            double value = Double.parseDouble(text);
            return Double.isNaN(value) ? null : value;
        } catch (NumberFormatException e) {
            log.debug("Non-numeric value '{}'", text);
            return null;
        }
    }

    private static double numberOrZero(String text) {
        Double value = parseNumber(text);
        return value != null ? value : 0;
    }

    private record IndexedPoint(int index, Point point) {
    }
}
