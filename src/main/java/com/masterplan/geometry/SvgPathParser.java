package com.masterplan.geometry;

import java.awt.Shape;
import java.awt.geom.AffineTransform;
import java.awt.geom.Arc2D;
import java.awt.geom.Path2D;

/**
 * Parses SVG path data (the d attribute) into a java.awt.geom.Path2D. All commands are supported in absolute and
 * relative form: M L H V C S Q T A Z. Arcs are converted from SVG's endpoint form to a rotated Arc2D, following the
 * conversion in the SVG implementation notes. Curves are kept as curves here and only flattened later by
 * {@link FlattenedPath#flatten(Shape, double)}.
 *
 * Instances hold parser state and are used for a single string, see {@link #parse(String)}.
 */
public class SvgPathParser {

    private final String data;
    private int pos = 0;

    private final Path2D.Double path = new Path2D.Double();

    // Current point and start of the current subpath
    private double x, y;
    private double startX, startY;

    // Last control point, for the smooth curve commands S and T
    private double controlX, controlY;
    private char previousCommand = ' ';

    private SvgPathParser (String data) {
        this.data = data;
    }

    public static Path2D.Double parse (String data) {
        if (data == null || data.trim().isEmpty()) {
            throw new MalformedGeometryException("Path data is empty.");
        }
        return new SvgPathParser(data).parsePath();
    }

    private Path2D.Double parsePath () {
        boolean first = true;
        while (skipSeparators()) {
            char command = data.charAt(pos);
            if (!isCommand(command)) {
                throw new MalformedGeometryException(
                    String.format("Expected a path command at position %d but found '%c'.", pos, command));
            }
            pos += 1;
            if (first && command != 'M' && command != 'm') {
                throw new MalformedGeometryException("Path data must begin with a move command.");
            }
            first = false;
            if (command == 'Z' || command == 'z') {
                path.closePath();
                x = startX;
                y = startY;
                previousCommand = command;
                continue;
            }
            // A command letter may be followed by several sets of arguments. Extra pairs after a move are lines.
            do {
                executeCommand(command);
                previousCommand = command;
                if (command == 'M') command = 'L';
                else if (command == 'm') command = 'l';
            } while (nextIsNumber());
        }
        return path;
    }

    private void executeCommand (char command) {
        boolean relative = Character.isLowerCase(command);
        double ox = relative ? x : 0;
        double oy = relative ? y : 0;
        switch (Character.toUpperCase(command)) {
            case 'M': {
                x = ox + nextNumber();
                y = oy + nextNumber();
                path.moveTo(x, y);
                startX = x;
                startY = y;
                break;
            }
            case 'L': {
                x = ox + nextNumber();
                y = oy + nextNumber();
                path.lineTo(x, y);
                break;
            }
            case 'H': {
                x = ox + nextNumber();
                path.lineTo(x, y);
                break;
            }
            case 'V': {
                y = oy + nextNumber();
                path.lineTo(x, y);
                break;
            }
            case 'C': {
                double x1 = ox + nextNumber();
                double y1 = oy + nextNumber();
                double x2 = ox + nextNumber();
                double y2 = oy + nextNumber();
                cubicTo(x1, y1, x2, y2, ox + nextNumber(), oy + nextNumber());
                break;
            }
            case 'S': {
                boolean follows = "CcSs".indexOf(previousCommand) >= 0;
                double x1 = follows ? 2 * x - controlX : x;
                double y1 = follows ? 2 * y - controlY : y;
                double x2 = ox + nextNumber();
                double y2 = oy + nextNumber();
                cubicTo(x1, y1, x2, y2, ox + nextNumber(), oy + nextNumber());
                break;
            }
            case 'Q': {
                double x1 = ox + nextNumber();
                double y1 = oy + nextNumber();
                quadTo(x1, y1, ox + nextNumber(), oy + nextNumber());
                break;
            }
            case 'T': {
                boolean follows = "QqTt".indexOf(previousCommand) >= 0;
                double x1 = follows ? 2 * x - controlX : x;
                double y1 = follows ? 2 * y - controlY : y;
                quadTo(x1, y1, ox + nextNumber(), oy + nextNumber());
                break;
            }
            case 'A': {
                double rx = nextNumber();
                double ry = nextNumber();
                double rotation = nextNumber();
                boolean largeArc = nextFlag();
                boolean sweep = nextFlag();
                double x2 = ox + nextNumber();
                double y2 = oy + nextNumber();
                arcTo(rx, ry, rotation, largeArc, sweep, x2, y2);
                break;
            }
            default:
                throw new MalformedGeometryException("Unsupported path command: " + command);
        }
    }

    private void cubicTo (double x1, double y1, double x2, double y2, double x3, double y3) {
        path.curveTo(x1, y1, x2, y2, x3, y3);
        controlX = x2;
        controlY = y2;
        x = x3;
        y = y3;
    }

    private void quadTo (double x1, double y1, double x2, double y2) {
        path.quadTo(x1, y1, x2, y2);
        controlX = x1;
        controlY = y1;
        x = x2;
        y = y2;
    }

    /**
     * Elliptical arc from the current point to (x2, y2), converting from endpoint to center parameterization.
     * Radii too small to span the endpoints are scaled up, and a zero radius degenerates to a straight line.
     */
    private void arcTo (double rx, double ry, double rotationDegrees, boolean largeArc, boolean sweep,
                        double x2, double y2) {
        double x1 = x;
        double y1 = y;
        x = x2;
        y = y2;
        if (x1 == x2 && y1 == y2) return;
        rx = Math.abs(rx);
        ry = Math.abs(ry);
        if (rx == 0 || ry == 0) {
            path.lineTo(x2, y2);
            return;
        }
        double phi = Math.toRadians(rotationDegrees % 360);
        double cos = Math.cos(phi);
        double sin = Math.sin(phi);
        double dx2 = (x1 - x2) / 2;
        double dy2 = (y1 - y2) / 2;
        double x1p = cos * dx2 + sin * dy2;
        double y1p = -sin * dx2 + cos * dy2;

        double lambda = (x1p * x1p) / (rx * rx) + (y1p * y1p) / (ry * ry);
        if (lambda > 1) {
            double scale = Math.sqrt(lambda);
            rx *= scale;
            ry *= scale;
        }
        double rx2 = rx * rx;
        double ry2 = ry * ry;
        double numerator = rx2 * ry2 - rx2 * y1p * y1p - ry2 * x1p * x1p;
        double denominator = rx2 * y1p * y1p + ry2 * x1p * x1p;
        double coefficient = Math.sqrt(Math.max(0, numerator / denominator));
        if (largeArc == sweep) coefficient = -coefficient;
        double cxp = coefficient * rx * y1p / ry;
        double cyp = -coefficient * ry * x1p / rx;
        double cx = cos * cxp - sin * cyp + (x1 + x2) / 2;
        double cy = sin * cxp + cos * cyp + (y1 + y2) / 2;

        double ux = (x1p - cxp) / rx;
        double uy = (y1p - cyp) / ry;
        double vx = (-x1p - cxp) / rx;
        double vy = (-y1p - cyp) / ry;
        double start = angle(1, 0, ux, uy);
        double extent = angle(ux, uy, vx, vy);
        if (!sweep && extent > 0) extent -= 2 * Math.PI;
        else if (sweep && extent < 0) extent += 2 * Math.PI;

        // Arc2D measures angles counterclockwise as drawn on screen, where y points down, so both angles flip sign.
        Arc2D.Double arc = new Arc2D.Double(cx - rx, cy - ry, rx * 2, ry * 2,
                -Math.toDegrees(start), -Math.toDegrees(extent), Arc2D.OPEN);
        Shape rotated = AffineTransform.getRotateInstance(phi, cx, cy).createTransformedShape(arc);
        path.append(rotated, true);
    }

    private static double angle (double ux, double uy, double vx, double vy) {
        return Math.atan2(ux * vy - uy * vx, ux * vx + uy * vy);
    }

    //// Tokenizing

    private static boolean isCommand (char c) {
        return "MmLlHhVvCcSsQqTtAaZz".indexOf(c) >= 0;
    }

    /** Skip whitespace and commas. @return true if there is anything left to read. */
    private boolean skipSeparators () {
        while (pos < data.length()) {
            char c = data.charAt(pos);
            if (c == ',' || Character.isWhitespace(c)) pos += 1;
            else break;
        }
        return pos < data.length();
    }

    private boolean nextIsNumber () {
        if (!skipSeparators()) return false;
        char c = data.charAt(pos);
        return Character.isDigit(c) || c == '-' || c == '+' || c == '.';
    }

    /**
     * Read one number. SVG allows numbers to run together when unambiguous, e.g. "1-2" or "0.5.5", so a number ends
     * at a second sign, a second decimal point, or anything that is not part of a number.
     */
    private double nextNumber () {
        if (!skipSeparators()) {
            throw new MalformedGeometryException("Path data ended where a number was expected.");
        }
        int start = pos;
        if (data.charAt(pos) == '+' || data.charAt(pos) == '-') pos += 1;
        boolean digits = false;
        boolean point = false;
        while (pos < data.length()) {
            char c = data.charAt(pos);
            if (Character.isDigit(c)) {
                digits = true;
            } else if (c == '.' && !point) {
                point = true;
            } else {
                break;
            }
            pos += 1;
        }
        if (!digits) {
            throw new MalformedGeometryException(String.format("Expected a number at position %d.", start));
        }
        if (pos < data.length() && (data.charAt(pos) == 'e' || data.charAt(pos) == 'E')) {
            int exponentStart = pos;
            pos += 1;
            if (pos < data.length() && (data.charAt(pos) == '+' || data.charAt(pos) == '-')) pos += 1;
            int exponentDigits = pos;
            while (pos < data.length() && Character.isDigit(data.charAt(pos))) pos += 1;
            if (pos == exponentDigits) {
                // Not an exponent after all
                pos = exponentStart;
            }
        }
        double value = Double.parseDouble(data.substring(start, pos));
        if (!Double.isFinite(value)) {
            throw new MalformedGeometryException("Number out of range at position " + start);
        }
        return value;
    }

    /** Arc flags are a single 0 or 1 and may be written without any separator before the next number. */
    private boolean nextFlag () {
        if (!skipSeparators()) {
            throw new MalformedGeometryException("Path data ended where an arc flag was expected.");
        }
        char c = data.charAt(pos);
        if (c != '0' && c != '1') {
            throw new MalformedGeometryException(String.format("Invalid arc flag '%c' at position %d.", c, pos));
        }
        pos += 1;
        return c == '1';
    }

}
