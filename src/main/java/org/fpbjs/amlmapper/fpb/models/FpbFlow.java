package org.fpbjs.amlmapper.fpb.models;

import org.fpbjs.amlmapper.mapping.FlowKind;

import java.util.List;

/**
 * A directed connection between two elements of the same process.
 *
 * @param inTandemWith ids of the flows sharing source and kind; only present (non-null) for parallel and
 *                     alternative flows
 */
public record FpbFlow(
        FlowKind kind,
        String id,
        String sourceRef,
        String targetRef,
        List<String> inTandemWith
) {
    public FpbFlow(FlowKind kind, String id, String sourceRef, String targetRef) {
        this(kind, id, sourceRef, targetRef, kind.isTandem() ? List.of() : null);
    }
}
