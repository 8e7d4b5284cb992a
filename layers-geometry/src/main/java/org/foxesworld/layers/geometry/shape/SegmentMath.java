package org.foxesworld.layers.geometry.shape;

import org.foxesworld.layers.core.model.Point;

/**
 * Distance and curve evaluation helpers for straight and quadratic segments.
 */
public final class SegmentMath {

    private SegmentMath() {}

    /** Distance from (px, py) to the closed segment (x1, y1)-(x2, y2). */
    public static double pointToSegmentDistance(double px, double py,
                                                double x1, double y1, double x2, double y2) {
        double dx = x2 - x1;
        double dy = y2 - y1;
        double len2 = dx * dx + dy * dy;
        if (len2 == 0) return Math.hypot(px - x1, py - y1);

        double t = ((px - x1) * dx + (py - y1) * dy) / len2;
        t = Math.max(0, Math.min(1, t));
        return Math.hypot(px - (x1 + t * dx), py - (y1 + t * dy));
    }

    /**
     * Approximate distance to a quadratic curve: minimum over {@code samples + 1} evenly
     * spaced curve points, endpoints included.
     */
    public static double pointToQuadraticBezierDistance(double px, double py,
                                                        double x0, double y0,
                                                        double cx, double cy,
                                                        double x1, double y1,
                                                        int samples) {
        int n = Math.max(1, samples);
        double best = Double.POSITIVE_INFINITY;
        for (int i = 0; i <= n; i++) {
            double t = (double) i / n;
            double u = 1 - t;
            double bx = u * u * x0 + 2 * u * t * cx + t * t * x1;
            double by = u * u * y0 + 2 * u * t * cy + t * t * y1;
            best = Math.min(best, Math.hypot(px - bx, py - by));
        }
        return best;
    }

    public static Point quadraticPoint(double t, double x0, double y0,
                                       double cx, double cy, double x1, double y1) {
        double u = 1 - t;
        return new Point(
                u * u * x0 + 2 * u * t * cx + t * t * x1,
                u * u * y0 + 2 * u * t * cy + t * t * y1
        );
    }

    /** Direction of the curve at {@code t}, in radians. */
    public static double quadraticTangent(double t, double x0, double y0,
                                          double cx, double cy, double x1, double y1) {
        double dx = 2 * (1 - t) * (cx - x0) + 2 * t * (x1 - cx);
        double dy = 2 * (1 - t) * (cy - y0) + 2 * t * (y1 - cy);
        return Math.atan2(dy, dx);
    }

    public static boolean allFinite(double... v) {
        for (double d : v) {
            if (!Double.isFinite(d)) return false;
        }
        return true;
    }
}
