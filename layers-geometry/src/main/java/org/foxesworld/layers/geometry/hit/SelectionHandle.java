package org.foxesworld.layers.geometry.hit;

import org.foxesworld.layers.core.model.Bounds;

/**
 * Resize/rotate handle drawn around a selection.
 *
 * @param type handle name as the editor uses it ({@code "nw"}, {@code "se"}, {@code "rotate"}...)
 * @param rect screen-space rectangle of the handle
 */
public record SelectionHandle(String type, Bounds rect) {
}
