package org.foxesworld.layers.core.model;

/**
 * A decoded layer. Variants group types that share geometric fields; {@link #type()}
 * picks the exact behaviour inside a variant.
 */
public interface Layer {

    LayerInfo info();

    default LayerType type() {
        return info().type();
    }

    default String id() {
        return info().id();
    }

    default boolean visible() {
        return info().visible();
    }

    default boolean locked() {
        return info().locked();
    }

    default double strokeWidth() {
        return info().strokeWidth();
    }
}
