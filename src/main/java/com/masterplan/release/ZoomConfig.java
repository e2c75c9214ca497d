package com.masterplan.release;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Zoom bounds for the viewer, as multiples of the fitted image size. */
public class ZoomConfig {

    public double min = 0.5;
    public double max = 4.0;

    @JsonProperty("default")
    public double defaultZoom = 1.0;

    public ZoomConfig () { }

    public ZoomConfig (double min, double max, double defaultZoom) {
        this.min = min;
        this.max = max;
        this.defaultZoom = defaultZoom;
    }

}
