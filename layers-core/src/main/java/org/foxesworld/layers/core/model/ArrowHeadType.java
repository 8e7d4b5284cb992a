package org.foxesworld.layers.core.model;

import java.util.Locale;

/**
 * Arrowhead shapes. {@code POINTED} is a plain triangle, {@code CHEVRON} a notched
 * triangle, {@code STANDARD} a triangle with thick barbs.
 */
public enum ArrowHeadType {
    POINTED,
    CHEVRON,
    STANDARD;

    public static ArrowHeadType of(String s, ArrowHeadType def) {
        if (s == null) return def;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "pointed" -> POINTED;
            case "chevron" -> CHEVRON;
            case "standard" -> STANDARD;
            default -> def;
        };
    }
}
