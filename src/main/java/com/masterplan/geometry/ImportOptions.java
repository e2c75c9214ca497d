package com.masterplan.geometry;

import java.util.regex.Pattern;

/** Settings for one geometry import. */
public class ImportOptions {

    public interface Config {
        // Maximum distance between a curve and the segments replacing it, in document units.
        double curveTolerance ();
        // Precision of the label anchor search, in document units.
        double labelPrecision ();
    }

    public static final double DEFAULT_CURVE_TOLERANCE = 0.25;
    public static final double DEFAULT_LABEL_PRECISION = 1.0;

    /** Overlay type assigned to every imported element: unit, zone, poi... */
    public final String overlayType;

    /** If set, only elements whose id matches from its first character are imported. */
    public final Pattern idPattern;

    /** Locale under which labels derived from element ids are stored. */
    public final String defaultLocale;

    public final double curveTolerance;
    public final double labelPrecision;

    public ImportOptions (
            String overlayType, String idPattern, String defaultLocale, double curveTolerance, double labelPrecision
    ) {
        if (!(curveTolerance > 0) || !(labelPrecision > 0)) {
            throw new IllegalArgumentException("Curve tolerance and label precision must be positive.");
        }
        this.overlayType = overlayType == null ? "unit" : overlayType;
        // An invalid expression throws PatternSyntaxException, which is an IllegalArgumentException.
        this.idPattern = (idPattern == null || idPattern.isEmpty()) ? null : Pattern.compile(idPattern);
        this.defaultLocale = defaultLocale == null ? "en" : defaultLocale;
        this.curveTolerance = curveTolerance;
        this.labelPrecision = labelPrecision;
    }

    public static ImportOptions defaults () {
        return new ImportOptions("unit", null, "en", DEFAULT_CURVE_TOLERANCE, DEFAULT_LABEL_PRECISION);
    }

    public static ImportOptions fromConfig (Config config, String overlayType, String idPattern, String defaultLocale) {
        return new ImportOptions(overlayType, idPattern, defaultLocale, config.curveTolerance(), config.labelPrecision());
    }

}
