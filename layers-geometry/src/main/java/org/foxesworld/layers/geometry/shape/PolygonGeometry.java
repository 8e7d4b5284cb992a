package org.foxesworld.layers.geometry.shape;

import org.foxesworld.layers.core.model.Bounds;
import org.foxesworld.layers.core.model.Point;
import org.foxesworld.layers.core.model.PolygonLayer;
import org.foxesworld.layers.core.model.StarLayer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Vertex synthesis for regular polygons and stars, plus envelope and containment over
 * vertex lists. Shapes are never rotated; the first vertex points straight up.
 */
public final class PolygonGeometry {

    public static final int DEFAULT_SIDES = 6;
    public static final int DEFAULT_STAR_POINTS = 5;
    public static final double DEFAULT_INNER_RATIO = 0.4;
    /** Upper bound for synthesized sides and star points; larger counts are clamped. */
    public static final int MAX_COUNT = 1000;

    private PolygonGeometry() {}

    public static List<Point> regularPolygonVertices(double cx, double cy, double radius, double sides) {
        int n = vertexCount(sides);
        List<Point> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double angle = (i * 2 * Math.PI) / n - Math.PI / 2;
            out.add(new Point(cx + radius * Math.cos(angle), cy + radius * Math.sin(angle)));
        }
        return out;
    }

    public static List<Point> starVertices(double cx, double cy, double outer, double inner, double count) {
        int n = vertexCount(count);
        List<Point> out = new ArrayList<>(n * 2);
        for (int i = 0; i < n * 2; i++) {
            double angle = (i * Math.PI) / n - Math.PI / 2;
            double r = (i % 2 == 0) ? outer : inner;
            out.add(new Point(cx + r * Math.cos(angle), cy + r * Math.sin(angle)));
        }
        return out;
    }

    private static int vertexCount(double count) {
        if (!Double.isFinite(count)) return 3;
        return (int) Math.max(3, Math.min(MAX_COUNT, Math.floor(count)));
    }

    /**
     * Outline of a polygon layer: the explicit point list when present, else the regular
     * form. Null when the regular form lacks its center or radius.
     */
    public static List<Point> vertices(PolygonLayer layer) {
        if (layer.points() != null && !layer.points().isEmpty()) return layer.points();
        if (!SegmentMath.allFinite(layer.x(), layer.y(), layer.radius())) return null;

        double sides = Double.isFinite(layer.sides()) ? layer.sides() : DEFAULT_SIDES;
        return regularPolygonVertices(layer.x(), layer.y(), Math.abs(layer.radius()), sides);
    }

    public static List<Point> vertices(StarLayer layer) {
        if (!SegmentMath.allFinite(layer.x(), layer.y(), layer.outerRadius())) return null;

        double outer = Math.abs(layer.outerRadius());
        double inner = Double.isFinite(layer.innerRadius())
                ? Math.abs(layer.innerRadius())
                : outer * DEFAULT_INNER_RATIO;
        double count = Double.isFinite(layer.pointCount()) ? layer.pointCount() : DEFAULT_STAR_POINTS;
        return starVertices(layer.x(), layer.y(), outer, inner, count);
    }

    /** Finite points only, in order. */
    public static List<Point> finitePoints(List<Point> points) {
        if (points == null || points.isEmpty()) return Collections.emptyList();
        List<Point> out = new ArrayList<>(points.size());
        for (Point p : points) {
            if (p != null && p.isFinite()) out.add(p);
        }
        return out;
    }

    /** Min/max envelope skipping non-finite points, or null when none is usable. */
    public static Bounds envelope(List<Point> points) {
        if (points == null) return null;

        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Point p : points) {
            if (p == null || !p.isFinite()) continue;
            minX = Math.min(minX, p.x());
            minY = Math.min(minY, p.y());
            maxX = Math.max(maxX, p.x());
            maxY = Math.max(maxY, p.y());
        }
        if (minX == Double.POSITIVE_INFINITY) return null;
        return Bounds.ofCorners(minX, minY, maxX, maxY);
    }

    /**
     * Even-odd ray casting. Non-finite vertices are dropped first; fewer than 3 usable
     * vertices never contain anything.
     */
    public static boolean isPointInPolygon(Point point, List<Point> vertices) {
        if (point == null || !point.isFinite()) return false;
        List<Point> v = finitePoints(vertices);
        int n = v.size();
        if (n < 3) return false;

        double px = point.x();
        double py = point.y();
        boolean inside = false;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            double xi = v.get(i).x(), yi = v.get(i).y();
            double xj = v.get(j).x(), yj = v.get(j).y();
            if ((yi > py) != (yj > py)) {
                double xCross = (xj - xi) * (py - yi) / (yj - yi) + xi;
                if (px < xCross) inside = !inside;
            }
        }
        return inside;
    }
}
