package com.masterplan.geometry;

import com.google.common.collect.ImmutableList;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.awt.Shape;
import java.awt.geom.PathIterator;
import java.util.ArrayList;
import java.util.List;

/**
 * A shape reduced to straight line segments: one list of vertices per subpath, plus the bounding box of all of them.
 */
public class FlattenedPath {

    public final List<Coordinate[]> rings;
    public final Envelope envelope;

    public FlattenedPath (List<Coordinate[]> rings) {
        this.rings = ImmutableList.copyOf(rings);
        this.envelope = new Envelope();
        for (Coordinate[] ring : rings) {
            for (Coordinate coordinate : ring) {
                envelope.expandToInclude(coordinate);
            }
        }
    }

    /**
     * Walk the shape with a flattening iterator, which replaces every curve by line segments deviating from it by no
     * more than the given flatness.
     */
    public static FlattenedPath flatten (Shape shape, double flatness) {
        List<Coordinate[]> rings = new ArrayList<>();
        List<Coordinate> current = new ArrayList<>();
        double[] segment = new double[6];
        for (PathIterator iterator = shape.getPathIterator(null, flatness); !iterator.isDone(); iterator.next()) {
            switch (iterator.currentSegment(segment)) {
                case PathIterator.SEG_MOVETO:
                    addRing(rings, current);
                    current = new ArrayList<>();
                    current.add(checkedCoordinate(segment[0], segment[1]));
                    break;
                case PathIterator.SEG_LINETO:
                    current.add(checkedCoordinate(segment[0], segment[1]));
                    break;
                case PathIterator.SEG_CLOSE:
                    // The next segment, if any, starts from the first vertex of this ring, which we already have.
                    break;
                default:
                    throw new IllegalStateException("Flattening iterator returned a curve segment.");
            }
        }
        addRing(rings, current);
        if (rings.isEmpty()) {
            throw new MalformedGeometryException("Shape contains no coordinates.");
        }
        return new FlattenedPath(rings);
    }

    private static void addRing (List<Coordinate[]> rings, List<Coordinate> ring) {
        if (!ring.isEmpty()) {
            rings.add(ring.toArray(new Coordinate[0]));
        }
    }

    static Coordinate checkedCoordinate (double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new MalformedGeometryException(String.format("Non-finite coordinate (%s, %s).", x, y));
        }
        return new Coordinate(x, y);
    }

    public int pointCount () {
        return rings.stream().mapToInt(ring -> ring.length).sum();
    }

}
