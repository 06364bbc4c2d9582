package org.fpbjs.amlmapper.aml;

import org.fpbjs.amlmapper.fpb.models.Characteristic;
import org.fpbjs.amlmapper.fpb.models.DescriptiveElement;
import org.fpbjs.amlmapper.fpb.models.ElementVisual;
import org.fpbjs.amlmapper.fpb.models.Identification;
import org.fpbjs.amlmapper.fpb.models.Point;
import org.fpbjs.amlmapper.fpb.models.RelationalElement;
import org.fpbjs.amlmapper.fpb.models.Waypoint;
import org.fpbjs.amlmapper.mapping.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AmlAttributeCodecTest {
    private Element ie;

    @BeforeEach
    void setUp() {
        Document doc = AmlXmlHelper.newDocument();
        ie = doc.createElementNS(AmlXmlHelper.CAEX_NS, "InternalElement");
        doc.appendChild(ie);
    }

    @Test
    void shouldWriteIntegralNumbersWithoutFraction() {
        assertEquals("120", AmlAttributeCodec.formatNumber(120.0));
        assertEquals("-3", AmlAttributeCodec.formatNumber(-3.0));
        assertEquals("12.5", AmlAttributeCodec.formatNumber(12.5));
    }

    @Test
    void shouldLeaveEmptyStringSlotsWithoutValue() {
        AmlAttributeCodec.addIdentification(ie, new Identification("uid-1", "Long", null, "", "2"));

        Element ident = AmlAttributeCodec.findAttribute(ie, "Identification");
        assertEquals("FPD_AttributeTypeLib/FPD_Identification", ident.getAttribute("RefAttributeType"));
        assertEquals(5, AmlXmlHelper.childElements(ident, "Attribute").size());
        assertNull(AmlXmlHelper.findDirectChild(AmlAttributeCodec.findAttribute(ident, "shortName"), "Value"));
        assertNull(AmlXmlHelper.findDirectChild(AmlAttributeCodec.findAttribute(ident, "versionNumber"), "Value"));
        assertEquals("uid-1", AmlAttributeCodec.parseIdentificationId(ie));
    }

    @Test
    void shouldDecodeMissingIdentificationFieldsAsEmpty() {
        AmlAttributeCodec.addIdentification(ie, new Identification(null, "Long", null, null, null));

        Identification decoded = AmlAttributeCodec.parseIdentification(ie);
        assertEquals(new Identification("", "Long", "", "", ""), decoded);
        assertNull(AmlAttributeCodec.parseIdentificationId(ie));
    }

    @Test
    void shouldNameCharacteristicsSequentially() {
        Characteristic first = new Characteristic(null,
                new DescriptiveElement("measured", "high", "10", "0..20", "9.8"), null);
        Characteristic second = new Characteristic(new Identification("c2", "", "", "", ""), null,
                new RelationalElement("view", "model", "rule"));

        AmlAttributeCodec.addCharacteristics(ie, List.of(first, second));

        Element container = AmlAttributeCodec.findAttribute(ie, "Characteristics");
        assertEquals("Container for characteristics",
                AmlXmlHelper.findDirectChild(container, "Description").getTextContent());
        List<Element> entries = AmlXmlHelper.childElements(container, "Attribute");
        assertEquals("Characteristic", entries.get(0).getAttribute("Name"));
        assertEquals("Characteristic1", entries.get(1).getAttribute("Name"));
        assertEquals("FPD_AttributeTypeLib/FPD_Characteristic", entries.get(1).getAttribute("RefAttributeType"));

        List<Characteristic> decoded = AmlAttributeCodec.parseCharacteristics(ie);
        assertEquals(List.of(first, second), decoded);
    }

    @Test
    void shouldWriteCharacteristicsContainerWhenEmpty() {
        AmlAttributeCodec.addCharacteristics(ie, List.of());

        assertNotNull(AmlAttributeCodec.findAttribute(ie, "Characteristics"));
        assertTrue(AmlAttributeCodec.parseCharacteristics(ie).isEmpty());
    }

    @Test
    void shouldDecodeVisual() {
        AmlAttributeCodec.addVisual(ie, new ElementVisual("p1", NodeKind.PRODUCT, 10.0, 20.5, 50.0, 40.0));

        Element visual = AmlAttributeCodec.findAttribute(ie, "Visual");
        Element x = AmlAttributeCodec.findAttribute(AmlAttributeCodec.findAttribute(visual, "position"), "x");
        assertEquals("xs:double", x.getAttribute("AttributeDataType"));
        assertEquals("10", AmlAttributeCodec.attributeValue(x));

        assertEquals(new ElementVisual("p1", NodeKind.PRODUCT, 10.0, 20.5, 50.0, 40.0),
                AmlAttributeCodec.parseVisual(ie, "p1", NodeKind.PRODUCT));
    }

    @Test
    void shouldTreatAllZeroVisualAsAbsent() {
        AmlAttributeCodec.addVisual(ie, new ElementVisual("p1", NodeKind.PRODUCT, 0.0, 0.0, null, null));

        assertNull(AmlAttributeCodec.parseVisual(ie, "p1", NodeKind.PRODUCT));
    }

    @Test
    void shouldReturnNoCoordinateForEmptyPortCoordinate() {
        AmlAttributeCodec.addEmptyPortCoordinate(ie);

        Element pc = AmlAttributeCodec.findAttribute(ie, "PortCoordinate");
        assertEquals(2, AmlXmlHelper.childElements(pc, "Attribute").size());
        assertNull(AmlAttributeCodec.parsePortCoordinate(ie));
    }

    @Test
    void shouldDecodePortCoordinate() {
        AmlAttributeCodec.addPortCoordinate(ie, new Point(125, 130.25));

        assertEquals(new Point(125, 130.25), AmlAttributeCodec.parsePortCoordinate(ie));
    }

    @Test
    void shouldOrderWaypointsBySuffix() {
        AmlAttributeCodec.addWaypoint(ie, "FPD_Waypoint2", new Waypoint(3, 3));
        AmlAttributeCodec.addWaypoint(ie, "FPD_Waypoint", new Waypoint(1, 1));
        AmlAttributeCodec.addWaypoint(ie, "FPD_WaypointX", new Waypoint(9, 9));
        AmlAttributeCodec.addWaypoint(ie, "FPD_Waypoint1", new Waypoint(2, 2));

        assertEquals(List.of(new Point(1, 1), new Point(2, 2), new Point(3, 3)),
                AmlAttributeCodec.parseWaypoints(ie));
    }

    @Test
    void shouldSkipWaypointWithoutNumericPosition() {
        Element waypoint = AmlAttributeCodec.addAttribute(ie, "FPD_Waypoint", "xs:string", null);
        Element position = AmlAttributeCodec.addAttribute(waypoint, "position", "xs:string", null);
        AmlAttributeCodec.addStringSubAttr(position, "x", "left");
        AmlAttributeCodec.addStringSubAttr(position, "y", "1");

        assertTrue(AmlAttributeCodec.parseWaypoints(ie).isEmpty());
    }
}
