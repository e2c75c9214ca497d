package com.masterplan.geometry;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;

import java.util.List;

/**
 * Everything recovered from one vector document: the overlays that could be imported, the elements that could not,
 * and the document's own coordinate frame.
 */
public class GeometryImportResult {

    public final List<Overlay> overlays;
    public final List<GeometryError> errors;

    /** The root element's viewBox attribute, or null if it had none. */
    public final String viewBox;

    /** Document size in user units. Null if it could be determined from neither width/height nor the view box. */
    public final Double width;
    public final Double height;

    public GeometryImportResult (
            List<Overlay> overlays, List<GeometryError> errors, String viewBox, Double width, Double height
    ) {
        this.overlays = ImmutableList.copyOf(overlays);
        this.errors = ImmutableList.copyOf(errors);
        this.viewBox = viewBox;
        this.width = width;
        this.height = height;
    }

    /** Overlays grouped by the id of their enclosing SVG group, in document order within each group. */
    public ImmutableListMultimap<String, Overlay> byLayer () {
        return Multimaps.index(overlays, overlay -> overlay.layer);
    }

}
