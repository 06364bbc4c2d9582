package org.fpbjs.amlmapper.mapping;

/**
 * Element kinds of an FPB.JS process.
 * The first three are states; they connect to process operators through flows.
 */
public enum NodeKind {
    PRODUCT("fpb:Product"),
    ENERGY("fpb:Energy"),
    INFORMATION("fpb:Information"),
    PROCESS_OPERATOR("fpb:ProcessOperator"),
    TECHNICAL_RESOURCE("fpb:TechnicalResource"),
    SYSTEM_LIMIT("fpb:SystemLimit");

    private final String fpbType;

    NodeKind(String fpbType) {
        this.fpbType = fpbType;
    }

    public String fpbType() {
        return fpbType;
    }

    /**
     * Type name without the "fpb:" prefix, e.g. "Product".
     */
    public String shortName() {
        return fpbType.substring(fpbType.indexOf(':') + 1);
    }

    public boolean isState() {
        return this == PRODUCT || this == ENERGY || this == INFORMATION;
    }

    /**
     * @return the kind for the given "$type" value, or null if it is not an element type
     */
    public static NodeKind fromFpbType(String fpbType) {
        for (NodeKind kind : values()) {
            if (kind.fpbType.equals(fpbType)) {
                return kind;
            }
        }
        return null;
    }
}
