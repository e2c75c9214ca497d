package com.masterplan.geometry;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.xml.sax.Attributes;
import org.xml.sax.helpers.DefaultHandler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Streaming SAX handler that collects the shape elements of an SVG document along with the group they belong to and
 * the root element's view box and size. Shapes inside non-rendered containers such as defs or clipPath are not
 * overlays and are skipped.
 */
public class SvgDocumentHandler extends DefaultHandler {

    public static final String ROOT_GROUP = "root";

    private static final Set<String> SHAPES = ImmutableSet.of("path", "polygon", "polyline", "rect", "circle");

    private static final Set<String> NON_RENDERED = ImmutableSet.of(
        "defs", "clippath", "mask", "symbol", "pattern", "marker", "lineargradient", "radialgradient"
    );

    private static final Map<String, Set<String>> KEPT_ATTRIBUTES = ImmutableMap.of(
        "path", ImmutableSet.of("d"),
        "polygon", ImmutableSet.of("points"),
        "polyline", ImmutableSet.of("points"),
        "rect", ImmutableSet.of("x", "y", "width", "height"),
        "circle", ImmutableSet.of("cx", "cy", "r")
    );

    private final List<SvgElement> elements = new ArrayList<>();

    /** One entry per open g element: its id, or an empty string if it has none. */
    private final Deque<String> groups = new ArrayDeque<>();

    private int nonRenderedDepth = 0;
    private int depth = 0;

    private String viewBox;
    private String width;
    private String height;
    private boolean sawRoot = false;

    @Override
    public void startElement (String uri, String localName, String qName, Attributes attributes) {
        String name = elementName(localName, qName);
        depth += 1;
        if (depth == 1) {
            sawRoot = "svg".equals(name);
            for (int i = 0; i < attributes.getLength(); i++) {
                String attribute = elementName(attributes.getLocalName(i), attributes.getQName(i));
                // viewBox is case-sensitive in SVG, but lowercase variants turn up in hand-edited files.
                if ("viewbox".equals(attribute)) viewBox = attributes.getValue(i);
                else if ("width".equals(attribute)) width = attributes.getValue(i);
                else if ("height".equals(attribute)) height = attributes.getValue(i);
            }
        }
        if (NON_RENDERED.contains(name)) {
            nonRenderedDepth += 1;
        }
        if ("g".equals(name)) {
            String id = blankToNull(attributes.getValue("id"));
            groups.push(id == null ? "" : id);
        } else if (nonRenderedDepth == 0 && SHAPES.contains(name)) {
            Map<String, String> kept = new HashMap<>();
            for (String key : KEPT_ATTRIBUTES.get(name)) {
                String value = attributes.getValue(key);
                if (value != null) kept.put(key, value);
            }
            elements.add(new SvgElement(name, blankToNull(attributes.getValue("id")), currentGroup(), elements.size(), kept));
        }
    }

    @Override
    public void endElement (String uri, String localName, String qName) {
        String name = elementName(localName, qName);
        depth -= 1;
        if (NON_RENDERED.contains(name)) {
            nonRenderedDepth -= 1;
        }
        if ("g".equals(name)) {
            groups.pop();
        }
    }

    private String currentGroup () {
        for (String group : groups) {
            if (!group.isEmpty()) return group;
        }
        return ROOT_GROUP;
    }

    private static String elementName (String localName, String qName) {
        String name = (localName == null || localName.isEmpty()) ? qName : localName;
        int colon = name.indexOf(':');
        if (colon >= 0) name = name.substring(colon + 1);
        return name.toLowerCase(Locale.ROOT);
    }

    private static String blankToNull (String value) {
        return (value == null || value.trim().isEmpty()) ? null : value.trim();
    }

    public List<SvgElement> getElements () {
        return elements;
    }

    public String getViewBox () {
        return viewBox;
    }

    public String getWidth () {
        return width;
    }

    public String getHeight () {
        return height;
    }

    public boolean isSvgDocument () {
        return sawRoot;
    }

}
