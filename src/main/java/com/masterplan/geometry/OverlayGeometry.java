package com.masterplan.geometry;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The drawable shape of an overlay as the viewer receives it. This is a closed set of variants: consumers that need
 * to treat them differently implement Visitor rather than testing the runtime class, so adding a variant is a compile
 * error everywhere it has to be handled.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = "path", value = OverlayGeometry.Path.class),
        @JsonSubTypes.Type(name = "polygon", value = OverlayGeometry.Polygon.class),
        @JsonSubTypes.Type(name = "point", value = OverlayGeometry.Point.class)
})
public abstract class OverlayGeometry {

    public interface Visitor<T> {
        T visitPath (Path path);
        T visitPolygon (Polygon polygon);
        T visitPoint (Point point);
    }

    public abstract <T> T accept (Visitor<T> visitor);

    /** SVG path data, kept verbatim so the viewer draws curves exactly as authored. */
    public static class Path extends OverlayGeometry {
        public String d;

        /** For deserialization only. */
        public Path () { }

        public Path (String d) {
            this.d = d;
        }

        @Override
        public <T> T accept (Visitor<T> visitor) {
            return visitor.visitPath(this);
        }
    }

    /** A single ring of vertices, serialized as [[x, y], ...]. */
    public static class Polygon extends OverlayGeometry {
        public double[][] points;

        /** For deserialization only. */
        public Polygon () { }

        public Polygon (double[][] points) {
            this.points = points;
        }

        @Override
        public <T> T accept (Visitor<T> visitor) {
            return visitor.visitPolygon(this);
        }
    }

    /** A point of interest with no area. */
    public static class Point extends OverlayGeometry {
        public double x;
        public double y;

        /** For deserialization only. */
        public Point () { }

        public Point (double x, double y) {
            this.x = x;
            this.y = y;
        }

        @Override
        public <T> T accept (Visitor<T> visitor) {
            return visitor.visitPoint(this);
        }
    }

}
