package org.foxesworld.layers.core.model;

/** Record with an unrecognized or missing type. Never has bounds and is never hit. */
public record UnknownLayer(LayerInfo info) implements Layer {
}
