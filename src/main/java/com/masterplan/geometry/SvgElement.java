package com.masterplan.geometry;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * A shape element captured from an SVG document, with only the attributes that matter for import. Nothing has been
 * validated at this point: converting the attributes into geometry happens later, one element at a time, so a broken
 * element only affects itself.
 */
public class SvgElement {

    /** Local element name: path, polygon, polyline, rect or circle. */
    public final String name;

    /** The id attribute, or null if absent or blank. */
    public final String id;

    /** The id of the nearest enclosing group that has one, or "root". */
    public final String group;

    /** Position among the shape elements of the document. */
    public final int index;

    public final Map<String, String> attributes;

    public SvgElement (String name, String id, String group, int index, Map<String, String> attributes) {
        this.name = name;
        this.id = id;
        this.group = group;
        this.index = index;
        this.attributes = ImmutableMap.copyOf(attributes);
    }

    public String attribute (String key) {
        return attributes.get(key);
    }

    @Override
    public String toString () {
        return String.format("<%s id=%s> #%d in %s", name, id, index, group);
    }

}
