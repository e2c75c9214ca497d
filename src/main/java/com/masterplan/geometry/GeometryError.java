package com.masterplan.geometry;

/**
 * One vector element that was skipped during import, and why. These are collected and reported with the job result
 * rather than failing the import.
 */
public class GeometryError {

    /** The element's id attribute, or its generated reference if it had none. */
    public String elementId;

    /** Position of the element among the shape elements of the document, in document order. */
    public int index;

    public String message;

    /** For deserialization only. */
    public GeometryError () { }

    public GeometryError (String elementId, int index, String message) {
        this.elementId = elementId;
        this.index = index;
        this.message = message;
    }

    @Override
    public String toString () {
        return String.format("element %d (%s): %s", index, elementId, message);
    }

}
