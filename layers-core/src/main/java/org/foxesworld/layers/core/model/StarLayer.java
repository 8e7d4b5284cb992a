package org.foxesworld.layers.core.model;

/** Star layer centered at (x, y). NaN fields fall back to kernel defaults. */
public record StarLayer(LayerInfo info, double x, double y,
                        double pointCount, double outerRadius, double innerRadius) implements Layer {
}
