package com.masterplan.geometry;

/**
 * Coordinate data of a single vector element could not be used. The importer catches this and records the element
 * as a GeometryError rather than failing the whole document.
 */
public class MalformedGeometryException extends RuntimeException {

    public MalformedGeometryException (String message) {
        super(message);
    }

}
