package org.foxesworld.layers.geometry.hit;

import org.foxesworld.layers.core.model.Bounds;
import org.foxesworld.layers.core.model.Layer;
import org.foxesworld.layers.geometry.bounds.BoundsCalculator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What the hit tester may read from the editor: the ordered candidate layers and a
 * bounds lookup for types tested by their box (text, blur).
 * <p>
 * Implementations must not change the candidate list while a hit test runs.
 */
public interface HitTestContext {

    /** Candidates in document order. The first hit wins. */
    List<? extends Layer> layers();

    Bounds getLayerBounds(Layer layer);

    /**
     * Snapshot context backed by a {@link BoundsCalculator}. Null entries are dropped.
     */
    static HitTestContext of(List<? extends Layer> layers, BoundsCalculator bounds) {
        Objects.requireNonNull(bounds, "bounds");
        if (layers == null) return new Snapshot(List.of(), bounds);

        List<Layer> copy = new ArrayList<>(layers.size());
        for (Layer layer : layers) {
            if (layer != null) copy.add(layer);
        }
        return new Snapshot(Collections.unmodifiableList(copy), bounds);
    }

    record Snapshot(List<? extends Layer> layers, BoundsCalculator bounds) implements HitTestContext {
        @Override
        public Bounds getLayerBounds(Layer layer) {
            return bounds.getLayerBounds(layer);
        }
    }
}
