package org.foxesworld.layers.core.model;

import java.util.List;

/**
 * Polygon layer, either explicit ({@code points}) or regular ({@code x, y, sides, radius}).
 * {@code points} is null when the record carries no point list.
 */
public record PolygonLayer(LayerInfo info, List<Point> points,
                           double x, double y, double sides, double radius) implements Layer {

    public PolygonLayer {
        points = points == null ? null : List.copyOf(points);
    }
}
