package com.masterplan.geometry;

import org.locationtech.jts.algorithm.construct.MaximumInscribedCircle;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Chooses where to draw an overlay's label. For real polygons this is the pole of inaccessibility, the interior point
 * farthest from any edge, which stays inside concave shapes where a centroid would not. Degenerate input falls back to
 * the center of the bounding box.
 */
public abstract class LabelPlacement {

    private static final Logger LOG = LoggerFactory.getLogger(LabelPlacement.class);

    private static final GeometryFactory geometryFactory = new GeometryFactory();

    /**
     * @param precision how close the result must be to the true pole, in document units. Must be positive.
     */
    public static Coordinate labelAnchor (FlattenedPath shape, double precision) {
        Envelope envelope = shape.envelope;
        if (shape.pointCount() < 3) {
            return center(envelope);
        }
        try {
            Polygon polygon = toPolygon(shape.rings);
            if (polygon == null || polygon.getArea() == 0) {
                return center(envelope);
            }
            Coordinate anchor = new MaximumInscribedCircle(polygon, precision).getCenter().getCoordinate();
            if (anchor == null || !envelope.covers(anchor)) {
                return center(envelope);
            }
            return anchor;
        } catch (RuntimeException e) {
            // Self-intersecting or otherwise invalid rings can make the distance computation fail.
            LOG.debug("Falling back to bounding box center for label anchor: {}", e.toString());
            return center(envelope);
        }
    }

    /**
     * Assemble rings into a single polygon. The ring with the largest area becomes the shell, and any other ring lying
     * inside it becomes a hole. Rings outside the shell are ignored for labelling purposes.
     */
    static Polygon toPolygon (List<Coordinate[]> rings) {
        List<Polygon> candidates = new ArrayList<>();
        for (Coordinate[] ring : rings) {
            Coordinate[] closed = closeRing(ring);
            if (closed.length < 4) continue;
            candidates.add(geometryFactory.createPolygon(closed));
        }
        if (candidates.isEmpty()) return null;
        Polygon shell = candidates.get(0);
        for (Polygon candidate : candidates) {
            if (candidate.getArea() > shell.getArea()) shell = candidate;
        }
        List<LinearRing> holes = new ArrayList<>();
        for (Polygon candidate : candidates) {
            if (candidate != shell && candidate.getArea() > 0 && shell.contains(candidate)) {
                holes.add(candidate.getExteriorRing());
            }
        }
        return geometryFactory.createPolygon(shell.getExteriorRing(), holes.toArray(new LinearRing[0]));
    }

    private static Coordinate[] closeRing (Coordinate[] ring) {
        if (ring.length > 0 && !ring[0].equals2D(ring[ring.length - 1])) {
            Coordinate[] closed = Arrays.copyOf(ring, ring.length + 1);
            closed[ring.length] = ring[0].copy();
            return closed;
        }
        return ring;
    }

    public static Coordinate center (Envelope envelope) {
        return envelope.centre();
    }

}
