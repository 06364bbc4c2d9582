package org.fpbjs.amlmapper.mapping;

/**
 * Attribute blocks of the FPD libraries and the AttributeType each one references.
 */
public enum AttributeBlock {
    IDENTIFICATION("FPD_AttributeTypeLib/FPD_Identification"),
    CHARACTERISTIC("FPD_AttributeTypeLib/FPD_Characteristic"),
    ELEMENT_VISUAL("FPD_VisualAttributeTypeLib/FPD_ElementVisual"),
    COORDINATE("FPD_VisualAttributeTypeLib/FPD_Coordinate"),
    WAYPOINT("FPD_VisualAttributeTypeLib/FPD_Waypoint");

    private final String attributeTypeRef;

    AttributeBlock(String attributeTypeRef) {
        this.attributeTypeRef = attributeTypeRef;
    }

    public String ref() {
        return attributeTypeRef;
    }
}
