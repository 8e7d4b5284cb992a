package org.foxesworld.layers.core.model;

/** Text layer anchored at its baseline origin. */
public record TextLayer(LayerInfo info, double x, double y, double fontSize,
                        String text, double width, double height) implements Layer {
}
