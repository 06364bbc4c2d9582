package org.fpbjs.amlmapper.fpb.models;

import org.fpbjs.amlmapper.mapping.FlowKind;

import java.util.List;

public record FlowVisual(
        String id,
        FlowKind type,
        List<Waypoint> waypoints
) {
    public FlowVisual {
        if (waypoints == null) {
            waypoints = List.of();
        }
    }
}
