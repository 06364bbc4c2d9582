package org.fpbjs.amlmapper.mapping;

public enum FlowKind {
    FLOW("fpb:Flow"),
    PARALLEL_FLOW("fpb:ParallelFlow"),
    ALTERNATIVE_FLOW("fpb:AlternativeFlow"),
    USAGE("fpb:Usage");

    private final String fpbType;

    FlowKind(String fpbType) {
        this.fpbType = fpbType;
    }

    public String fpbType() {
        return fpbType;
    }

    /**
     * Parallel and alternative flows sharing a source form a tandem group.
     */
    public boolean isTandem() {
        return this == PARALLEL_FLOW || this == ALTERNATIVE_FLOW;
    }

    public static FlowKind fromFpbType(String fpbType) {
        for (FlowKind kind : values()) {
            if (kind.fpbType.equals(fpbType)) {
                return kind;
            }
        }
        return null;
    }
}
