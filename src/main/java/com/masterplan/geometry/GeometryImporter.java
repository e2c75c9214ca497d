package com.masterplan.geometry;

import com.masterplan.file.SourceAssetException;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an SVG document into overlays. Each shape element is converted independently: an element with broken
 * coordinates becomes a GeometryError and the rest of the document is still imported. Only a document that is not
 * well-formed, or that yields no overlay at all, fails the whole import.
 *
 * This class is stateless and may be shared between threads.
 */
public class GeometryImporter {

    private static final Logger LOG = LoggerFactory.getLogger(GeometryImporter.class);

    private static final Pattern LABEL_PREFIX = Pattern.compile("^(unit|zone|poi|path)-?", Pattern.CASE_INSENSITIVE);

    private static final Pattern LENGTH = Pattern.compile("^\\s*([-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?)(?:px)?\\s*$");

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(\\d+\\.?\\d*)");

    public GeometryImportResult importDocument (VectorDocument document, ImportOptions options) {
        SvgDocumentHandler handler = parse(document);
        List<Overlay> overlays = new ArrayList<>();
        List<GeometryError> errors = new ArrayList<>();
        Set<String> refs = new HashSet<>();
        int filtered = 0;
        for (SvgElement element : handler.getElements()) {
            String ref = element.id != null ? element.id : "path-" + element.index;
            if (options.idPattern != null) {
                String id = element.id == null ? "" : element.id;
                if (!options.idPattern.matcher(id).lookingAt()) {
                    filtered += 1;
                    continue;
                }
            }
            if (refs.contains(ref)) {
                errors.add(new GeometryError(ref, element.index,
                        String.format("Duplicate reference '%s' for overlay type %s.", ref, options.overlayType)));
                continue;
            }
            try {
                overlays.add(toOverlay(element, ref, options));
                refs.add(ref);
            } catch (MalformedGeometryException e) {
                errors.add(new GeometryError(ref, element.index, e.getMessage()));
            }
        }
        LOG.info("Imported {} overlays from {}, {} elements rejected, {} filtered out by id pattern.",
                overlays.size(), document.name, errors.size(), filtered);
        for (GeometryError error : errors) {
            LOG.debug("Rejected {}", error);
        }
        if (overlays.isEmpty()) {
            throw new GeometryImportException("No importable geometry in " + document.name, errors);
        }
        String viewBox = handler.getViewBox();
        return new GeometryImportResult(overlays, errors, viewBox,
                dimension(handler.getWidth(), viewBox, 2), dimension(handler.getHeight(), viewBox, 3));
    }

    private static SvgDocumentHandler parse (VectorDocument document) {
        SAXParser parser = newParser();
        SvgDocumentHandler handler = new SvgDocumentHandler();
        try {
            parser.parse(new ByteArrayInputStream(document.content), handler);
        } catch (SAXException | IOException e) {
            throw new SourceAssetException(
                String.format("Vector document %s is not well-formed XML: %s", document.name, e.getMessage()), e);
        }
        if (!handler.isSvgDocument()) {
            throw new SourceAssetException("Vector document " + document.name + " is not an SVG document.");
        }
        return handler;
    }

    private static SAXParser newParser () {
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            // SVG exports often declare a DTD. Never fetch it or any other external entity.
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            return factory.newSAXParser();
        } catch (ParserConfigurationException | SAXException e) {
            throw new IllegalStateException("Could not configure XML parser.", e);
        }
    }

    private static Overlay toOverlay (SvgElement element, String ref, ImportOptions options) {
        OverlayGeometry geometry;
        Envelope bounds;
        Coordinate anchor;
        if ("circle".equals(element.name)) {
            double x = length(element, "cx", 0);
            double y = length(element, "cy", 0);
            geometry = new OverlayGeometry.Point(x, y);
            anchor = new Coordinate(x, y);
            bounds = new Envelope(anchor);
        } else {
            FlattenedPath shape;
            if ("path".equals(element.name)) {
                String d = element.attribute("d");
                shape = FlattenedPath.flatten(SvgPathParser.parse(d), options.curveTolerance);
                geometry = new OverlayGeometry.Path(d.trim());
            } else if ("rect".equals(element.name)) {
                double x = length(element, "x", 0);
                double y = length(element, "y", 0);
                double w = length(element, "width", Double.NaN);
                double h = length(element, "height", Double.NaN);
                if (!(w > 0 && h > 0)) {
                    throw new MalformedGeometryException("Rectangle must have positive width and height.");
                }
                double[][] points = {{x, y}, {x + w, y}, {x + w, y + h}, {x, y + h}};
                shape = new FlattenedPath(Collections.singletonList(toCoordinates(points)));
                geometry = new OverlayGeometry.Polygon(points);
            } else {
                double[][] points = parsePoints(element.attribute("points"));
                shape = new FlattenedPath(Collections.singletonList(toCoordinates(points)));
                geometry = new OverlayGeometry.Polygon(points);
            }
            bounds = shape.envelope;
            anchor = LabelPlacement.labelAnchor(shape, options.labelPrecision);
        }
        Map<String, String> label = Collections.singletonMap(options.defaultLocale, deriveLabel(ref));
        return new Overlay(ref, options.overlayType, geometry, label, anchor, bounds,
                Collections.emptyMap(), element.group, element.index);
    }

    /**
     * Polygon and polyline points: whitespace or comma separated numbers taken in pairs.
     */
    static double[][] parsePoints (String points) {
        if (points == null || points.trim().isEmpty()) {
            throw new MalformedGeometryException("Element has no points.");
        }
        String[] tokens = points.trim().split("[\\s,]+");
        if (tokens.length % 2 != 0) {
            throw new MalformedGeometryException("Odd number of values in points list.");
        }
        double[][] result = new double[tokens.length / 2][];
        for (int i = 0; i < result.length; i++) {
            result[i] = new double[] {number(tokens[i * 2]), number(tokens[i * 2 + 1])};
        }
        return result;
    }

    private static double number (String token) {
        double value;
        try {
            value = Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new MalformedGeometryException("Not a number: " + token);
        }
        if (!Double.isFinite(value)) {
            throw new MalformedGeometryException("Non-finite coordinate: " + token);
        }
        return value;
    }

    private static double length (SvgElement element, String attribute, double defaultValue) {
        String value = element.attribute(attribute);
        if (value == null) {
            if (Double.isNaN(defaultValue)) {
                throw new MalformedGeometryException("Missing attribute " + attribute);
            }
            return defaultValue;
        }
        Matcher matcher = LENGTH.matcher(value);
        if (!matcher.matches()) {
            throw new MalformedGeometryException(String.format("Invalid %s: %s", attribute, value));
        }
        return number(matcher.group(1));
    }

    private static Coordinate[] toCoordinates (double[][] points) {
        Coordinate[] coordinates = new Coordinate[points.length];
        for (int i = 0; i < points.length; i++) {
            coordinates[i] = new Coordinate(points[i][0], points[i][1]);
        }
        return coordinates;
    }

    /** "unit-A_12" becomes "A 12". Ids that are nothing but a prefix keep their full text. */
    public static String deriveLabel (String ref) {
        String label = LABEL_PREFIX.matcher(ref).replaceFirst("");
        label = label.replaceAll("[_-]+", " ").trim();
        return label.isEmpty() ? ref : label;
    }

    /**
     * Parse a width or height attribute, ignoring any unit suffix. Without one, fall back to the corresponding
     * entry of the view box.
     */
    private static Double dimension (String attribute, String viewBox, int viewBoxIndex) {
        if (attribute != null) {
            Matcher matcher = LEADING_NUMBER.matcher(attribute);
            if (matcher.find()) {
                return Double.parseDouble(matcher.group(1));
            }
        }
        if (viewBox != null) {
            String[] parts = viewBox.trim().split("[\\s,]+");
            if (parts.length == 4) {
                try {
                    return Double.parseDouble(parts[viewBoxIndex]);
                } catch (NumberFormatException e) {
                    LOG.warn("Ignoring unparseable viewBox '{}'", viewBox);
                }
            }
        }
        return null;
    }

}
