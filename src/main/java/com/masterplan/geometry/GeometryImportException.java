package com.masterplan.geometry;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A vector document yielded no usable overlays at all. Any per-element errors that were collected on the way are
 * carried along so the cause can be reported.
 */
public class GeometryImportException extends RuntimeException {

    public final List<GeometryError> errors;

    public GeometryImportException (String message, List<GeometryError> errors) {
        super(errors.isEmpty() ? message : message + " (" + errors.size() + " elements rejected)");
        this.errors = ImmutableList.copyOf(errors);
    }

}
