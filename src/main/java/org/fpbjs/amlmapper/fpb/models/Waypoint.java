package org.fpbjs.amlmapper.fpb.models;

/**
 * A point of a flow's polyline.
 *
 * @param original the docking point on the connected shape; set on the first and last waypoint only, may be null
 */
public record Waypoint(double x, double y, Point original) {

    public Waypoint(double x, double y) {
        this(x, y, null);
    }

    /**
     * Creates a waypoint flagged as original, with the same coordinates as its docking point.
     */
    public static Waypoint original(Point point) {
        return new Waypoint(point.x(), point.y(), point);
    }

    /**
     * The point a port is anchored to: the original docking point if present, else the waypoint itself.
     */
    public Point anchor() {
        return original != null ? original : new Point(x, y);
    }
}
