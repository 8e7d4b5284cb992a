// Author: Calista Verner
package org.foxesworld.layers.geometry.bounds;

import org.foxesworld.layers.core.model.*;
import org.foxesworld.layers.geometry.config.GeometryConfig;
import org.foxesworld.layers.geometry.shape.PolygonGeometry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import static org.foxesworld.layers.geometry.shape.SegmentMath.allFinite;

/**
 * Axis-aligned bounds for every layer type, plus rectangle set algebra.
 * <p>
 * Layers whose geometry cannot be computed (missing fields, groups, unknown types)
 * yield null. Returned bounds always have non-negative width and height.
 */
public final class BoundsCalculator {

    private final GeometryConfig config;

    public BoundsCalculator() {
        this(GeometryConfig.defaults());
    }

    public BoundsCalculator(GeometryConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public GeometryConfig config() {
        return config;
    }

    public Bounds getLayerBounds(Layer layer) {
        if (layer == null) return null;

        return switch (layer.type()) {
            case RECTANGLE, BLUR, TEXTBOX, IMAGE ->
                    layer instanceof BoxLayer b ? getRectangularBounds(b) : null;
            case LINE, ARROW -> layer instanceof SegmentLayer s ? getLineBounds(s) : null;
            case CIRCLE, ELLIPSE -> layer instanceof EllipticalLayer e ? getEllipseBounds(e) : null;
            case POLYGON -> layer instanceof PolygonLayer p ? getPolygonLayerBounds(p) : null;
            case STAR -> layer instanceof StarLayer s ? PolygonGeometry.envelope(PolygonGeometry.vertices(s)) : null;
            case PATH -> layer instanceof PathLayer p ? getPolygonBounds(p.points()) : null;
            case TEXT -> layer instanceof TextLayer t ? getTextBounds(t) : null;
            case GROUP, UNKNOWN -> null;
        };
    }

    public Bounds getRectangularBounds(BoxLayer layer) {
        if (!allFinite(layer.x(), layer.y(), layer.width(), layer.height())) return null;
        return Bounds.normalized(layer.x(), layer.y(), layer.width(), layer.height());
    }

    public Bounds getLineBounds(SegmentLayer layer) {
        if (!allFinite(layer.x1(), layer.y1(), layer.x2(), layer.y2())) return null;
        return Bounds.ofCorners(
                Math.min(layer.x1(), layer.x2()), Math.min(layer.y1(), layer.y2()),
                Math.max(layer.x1(), layer.x2()), Math.max(layer.y1(), layer.y2()));
    }

    public Bounds getEllipseBounds(EllipticalLayer layer) {
        if (!allFinite(layer.x(), layer.y())) return null;
        if (!Double.isFinite(layer.radius())
                && !Double.isFinite(layer.radiusX())
                && !Double.isFinite(layer.radiusY())) {
            return null;
        }
        double rx = radiusX(layer);
        double ry = radiusY(layer);
        return new Bounds(layer.x() - rx, layer.y() - ry, rx * 2, ry * 2);
    }

    /** Explicit point list or synthesized regular form. */
    public Bounds getPolygonLayerBounds(PolygonLayer layer) {
        if (layer.points() != null && !layer.points().isEmpty()) return getPolygonBounds(layer.points());
        return PolygonGeometry.envelope(PolygonGeometry.vertices(layer));
    }

    /** Envelope of a point list with at least 2 entries; invalid points are skipped. */
    public Bounds getPolygonBounds(List<Point> points) {
        if (points == null || points.size() < 2) return null;
        return PolygonGeometry.envelope(points);
    }

    public Bounds getTextBounds(TextLayer layer) {
        if (!allFinite(layer.x(), layer.y())) return null;

        double fontSize = positiveOr(layer.fontSize(), config.defaultFontSize());
        String text = layer.text() == null ? "" : layer.text();

        double width;
        if (nonZero(layer.width())) {
            width = layer.width();
        } else if (!text.isEmpty()) {
            width = text.length() * fontSize * config.textCharWidth();
        } else {
            width = fontSize * 5;
        }
        double height = nonZero(layer.height()) ? layer.height() : fontSize * config.textLineHeight();

        return Bounds.normalized(layer.x(), layer.y() - fontSize, width, height);
    }

    public Bounds getMultiLayerBounds(Collection<? extends Layer> layers) {
        if (layers == null || layers.isEmpty()) return null;
        List<Bounds> all = new ArrayList<>(layers.size());
        for (Layer l : layers) {
            Bounds b = getLayerBounds(l);
            if (b != null) all.add(b);
        }
        return mergeBounds(all);
    }

    // ---------------------------------------------------------------------
    // Set algebra
    // ---------------------------------------------------------------------

    /**
     * Union of all usable entries. A single usable entry is returned as is.
     */
    public static Bounds mergeBounds(Collection<Bounds> bounds) {
        if (bounds == null || bounds.isEmpty()) return null;

        Bounds only = null;
        int count = 0;
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Bounds b : bounds) {
            if (b == null || !b.isFinite()) continue;
            only = b;
            count++;
            minX = Math.min(minX, b.x());
            minY = Math.min(minY, b.y());
            maxX = Math.max(maxX, b.right());
            maxY = Math.max(maxY, b.bottom());
        }
        if (count == 0) return null;
        if (count == 1) return only;
        return Bounds.ofCorners(minX, minY, maxX, maxY);
    }

    public static boolean isPointInBounds(Point point, Bounds bounds) {
        if (point == null || bounds == null || !point.isFinite() || !bounds.isFinite()) return false;
        return point.x() >= bounds.x() && point.x() <= bounds.right()
                && point.y() >= bounds.y() && point.y() <= bounds.bottom();
    }

    /** Closed intervals: bounds that share only an edge intersect. */
    public static boolean boundsIntersect(Bounds a, Bounds b) {
        if (a == null || b == null || !a.isFinite() || !b.isFinite()) return false;
        return !(a.right() < b.x() || b.right() < a.x()
                || a.bottom() < b.y() || b.bottom() < a.y());
    }

    /**
     * Grows bounds by {@code amount} on every side; negative amounts shrink. An axis
     * shrunk past zero collapses onto its center.
     */
    public static Bounds expandBounds(Bounds bounds, double amount) {
        if (bounds == null) return null;
        if (!Double.isFinite(amount)) return bounds;

        double x = bounds.x() - amount;
        double y = bounds.y() - amount;
        double w = bounds.width() + amount * 2;
        double h = bounds.height() + amount * 2;
        if (w < 0) {
            x = bounds.x() + bounds.width() / 2.0;
            w = 0;
        }
        if (h < 0) {
            y = bounds.y() + bounds.height() / 2.0;
            h = 0;
        }
        return new Bounds(x, y, w, h);
    }

    public static Point getBoundsCenter(Bounds bounds) {
        return bounds == null ? null : bounds.center();
    }

    // ---------------------------------------------------------------------

    /** Horizontal half-extent: radiusX, else radius, else 0. */
    public static double radiusX(EllipticalLayer layer) {
        if (Double.isFinite(layer.radiusX())) return Math.abs(layer.radiusX());
        return Double.isFinite(layer.radius()) ? Math.abs(layer.radius()) : 0;
    }

    public static double radiusY(EllipticalLayer layer) {
        if (Double.isFinite(layer.radiusY())) return Math.abs(layer.radiusY());
        return Double.isFinite(layer.radius()) ? Math.abs(layer.radius()) : 0;
    }

    private static double positiveOr(double v, double def) {
        return (Double.isFinite(v) && v > 0) ? v : def;
    }

    private static boolean nonZero(double v) {
        return Double.isFinite(v) && v != 0;
    }
}
