package org.foxesworld.layers.core.model;

/**
 * Axis-aligned rectangle. Instances produced by the geometry kernel always have
 * non-negative {@code width} and {@code height}.
 */
public record Bounds(double x, double y, double width, double height) {

    /** Builds bounds from possibly negative extents by moving the origin. */
    public static Bounds normalized(double x, double y, double width, double height) {
        double nx = width < 0 ? x + width : x;
        double ny = height < 0 ? y + height : y;
        return new Bounds(nx, ny, Math.abs(width), Math.abs(height));
    }

    public static Bounds ofCorners(double minX, double minY, double maxX, double maxY) {
        return new Bounds(minX, minY, maxX - minX, maxY - minY);
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double area() {
        return width * height;
    }

    public Point center() {
        return new Point(x + width / 2.0, y + height / 2.0);
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y)
                && Double.isFinite(width) && Double.isFinite(height);
    }
}
