package org.foxesworld.layers.core.model;

import java.util.List;

/** Group of layers referenced by id. Geometry is resolved through its children. */
public record GroupLayer(LayerInfo info, List<String> children) implements Layer {

    public GroupLayer {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
