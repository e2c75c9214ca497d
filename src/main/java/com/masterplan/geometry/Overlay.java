package com.masterplan.geometry;

import com.google.common.collect.ImmutableMap;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.Map;

/**
 * One imported overlay: a clickable region or point on the plan with its label and where to draw that label.
 * Within a draft the pair (overlayType, ref) is unique.
 */
public class Overlay {

    public final String ref;
    public final String overlayType;
    public final OverlayGeometry geometry;

    /** Display label keyed on locale code. */
    public final Map<String, String> label;

    /** Always lies within bounds. */
    public final Coordinate labelAnchor;

    public final Envelope bounds;

    public final Map<String, Object> props;

    /** Id of the SVG group the element was found in. */
    public final String layer;

    /** Document order, used to keep the manifest stable. */
    public final int sortOrder;

    public Overlay (String ref, String overlayType, OverlayGeometry geometry, Map<String, String> label,
                    Coordinate labelAnchor, Envelope bounds, Map<String, Object> props, String layer, int sortOrder) {
        this.ref = ref;
        this.overlayType = overlayType;
        this.geometry = geometry;
        this.label = ImmutableMap.copyOf(label);
        this.labelAnchor = labelAnchor;
        this.bounds = bounds;
        this.props = ImmutableMap.copyOf(props);
        this.layer = layer;
        this.sortOrder = sortOrder;
    }

    @Override
    public String toString () {
        return String.format("[%s %s in %s]", overlayType, ref, layer);
    }

}
