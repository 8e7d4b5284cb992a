package org.foxesworld.layers.core.model;

/**
 * Immutable 2D point in canvas units. Missing coordinates are carried as {@link Double#NaN}.
 */
public record Point(double x, double y) {

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    public double distanceTo(Point other) {
        return Math.hypot(other.x - x, other.y - y);
    }
}
