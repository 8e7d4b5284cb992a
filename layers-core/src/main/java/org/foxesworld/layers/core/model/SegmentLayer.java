package org.foxesworld.layers.core.model;

/**
 * Line and arrow layers. The optional control point makes the shaft a quadratic curve.
 */
public record SegmentLayer(LayerInfo info,
                           double x1, double y1, double x2, double y2,
                           double controlX, double controlY,
                           ArrowStyle arrowStyle, ArrowHeadType arrowHeadType,
                           double headScale, double tailWidth, double arrowSize) implements Layer {

    public Point start() {
        return new Point(x1, y1);
    }

    public Point end() {
        return new Point(x2, y2);
    }

    public boolean hasControlPoint() {
        return Double.isFinite(controlX) && Double.isFinite(controlY);
    }
}
