package org.foxesworld.layers.core.model;

/** Rectangle, blur, textbox and image layers. Extents may be negative. */
public record BoxLayer(LayerInfo info, double x, double y, double width, double height) implements Layer {
}
