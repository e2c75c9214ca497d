package com.masterplan.release;

import com.masterplan.geometry.Overlay;
import com.masterplan.geometry.OverlayGeometry;

import java.util.LinkedHashMap;
import java.util.Map;

/** An overlay as written into release.json. */
public class ManifestOverlay {

    public String ref;
    public String overlayType;
    public OverlayGeometry geometry;
    public Map<String, String> label;

    /** [x, y] in document units. */
    public double[] labelPosition;

    public Map<String, Object> props;
    public String layer;
    public int sortOrder;

    public ManifestOverlay () { }

    public static ManifestOverlay from (Overlay overlay) {
        ManifestOverlay result = new ManifestOverlay();
        result.ref = overlay.ref;
        result.overlayType = overlay.overlayType;
        result.geometry = overlay.geometry;
        result.label = new LinkedHashMap<>(overlay.label);
        result.labelPosition = new double[] {overlay.labelAnchor.x, overlay.labelAnchor.y};
        result.props = new LinkedHashMap<>(overlay.props);
        result.layer = overlay.layer;
        result.sortOrder = overlay.sortOrder;
        return result;
    }

}
