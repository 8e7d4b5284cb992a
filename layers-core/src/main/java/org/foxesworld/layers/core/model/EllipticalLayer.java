package org.foxesworld.layers.core.model;

/**
 * Circle and ellipse layers. Per-axis radii fall back to {@code radius} when absent.
 */
public record EllipticalLayer(LayerInfo info, double x, double y,
                              double radius, double radiusX, double radiusY) implements Layer {
}
