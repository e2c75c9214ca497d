package com.masterplan.release;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The project-level configuration block copied into each release: initial view, zoom bounds, locales and the styles
 * the viewer applies per status. It is supplied by the draft and passed through mostly untouched.
 */
public class ReleaseConfig {

    public String defaultViewBox;

    public ZoomConfig defaultZoom;

    public String defaultLocale = "en";

    public List<String> supportedLocales = new ArrayList<>(List.of("en"));

    /** Style per unit status (available, sold...), opaque to this service. */
    public Map<String, Object> statusStyles = new LinkedHashMap<>();

    /** Hover and selection styles, opaque to this service. */
    public Map<String, Object> interactionStyles = new LinkedHashMap<>();

    /**
     * Check internal consistency.
     * @return human readable problems, empty if the block is usable.
     */
    public List<String> validate () {
        List<String> errors = new ArrayList<>();
        if (defaultZoom == null) {
            errors.add("Configuration has no default_zoom.");
        } else {
            ZoomConfig zoom = defaultZoom;
            if (!(zoom.min > 0)) {
                errors.add("Minimum zoom must be positive.");
            }
            if (!(zoom.min <= zoom.defaultZoom && zoom.defaultZoom <= zoom.max)) {
                errors.add(String.format("Zoom must satisfy min <= default <= max, was %s <= %s <= %s.",
                        zoom.min, zoom.defaultZoom, zoom.max));
            }
        }
        if (supportedLocales == null || supportedLocales.isEmpty()) {
            errors.add("Configuration must list at least one supported locale.");
        } else if (defaultLocale == null || !supportedLocales.contains(defaultLocale)) {
            errors.add(String.format("Default locale '%s' is not among the supported locales %s.",
                    defaultLocale, supportedLocales));
        }
        if (defaultViewBox != null && !isViewBox(defaultViewBox)) {
            errors.add("default_view_box must have four numbers: " + defaultViewBox);
        }
        return errors;
    }

    /** True if the value is four numbers separated by whitespace or commas, as in an SVG viewBox attribute. */
    public static boolean isViewBox (String value) {
        if (value == null) return false;
        String[] parts = value.trim().split("[\\s,]+");
        if (parts.length != 4) return false;
        for (String part : parts) {
            try {
                if (!Double.isFinite(Double.parseDouble(part))) return false;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return true;
    }

    /** A copy of this configuration with the given view box. Nested styles and zoom bounds are shared. */
    public ReleaseConfig withDefaultViewBox (String viewBox) {
        ReleaseConfig copy = new ReleaseConfig();
        copy.defaultViewBox = viewBox;
        copy.defaultZoom = defaultZoom;
        copy.defaultLocale = defaultLocale;
        copy.supportedLocales = supportedLocales;
        copy.statusStyles = statusStyles;
        copy.interactionStyles = interactionStyles;
        return copy;
    }

}
