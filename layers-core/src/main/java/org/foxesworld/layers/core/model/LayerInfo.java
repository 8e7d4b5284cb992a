package org.foxesworld.layers.core.model;

import java.util.Objects;

/**
 * Attributes shared by every layer variant.
 *
 * @param id          document id, may be null for anonymous layers
 * @param type        resolved type tag
 * @param visible     false only when the record says so explicitly
 * @param locked      true only when the record says so explicitly
 * @param strokeWidth stroke width in canvas units, NaN when absent
 */
public record LayerInfo(String id, LayerType type, boolean visible, boolean locked, double strokeWidth) {

    public LayerInfo {
        Objects.requireNonNull(type, "type");
    }

    public static LayerInfo of(String id, LayerType type) {
        return new LayerInfo(id, type, true, false, Double.NaN);
    }
}
