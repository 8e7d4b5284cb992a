package org.foxesworld.layers.core.model;

import java.util.List;

/** Freehand path. Points with missing coordinates are kept as NaN entries. */
public record PathLayer(LayerInfo info, List<Point> points) implements Layer {

    public PathLayer {
        points = points == null ? null : List.copyOf(points);
    }
}
