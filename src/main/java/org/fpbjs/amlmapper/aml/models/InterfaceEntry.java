package org.fpbjs.amlmapper.aml.models;

import org.fpbjs.amlmapper.fpb.models.Point;
import org.fpbjs.amlmapper.mapping.FlowKind;
import org.fpbjs.amlmapper.mapping.PortDirection;

import java.util.List;

/**
 * An ExternalInterface read from a process, keyed by its CAEX ID while links are resolved.
 *
 * @param ownerId    FPB.JS id of the element carrying the interface
 * @param coordinate PortCoordinate, null when absent or not numeric
 * @param waypoints  interior waypoints in suffix order; only source-side interfaces carry them
 */
public record InterfaceEntry(
        String ownerId,
        FlowKind flowKind,
        PortDirection direction,
        Point coordinate,
        List<Point> waypoints
) {
}
