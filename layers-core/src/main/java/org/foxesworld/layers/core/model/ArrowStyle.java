package org.foxesworld.layers.core.model;

import java.util.Locale;

public enum ArrowStyle {
    NONE,
    SINGLE,
    DOUBLE;

    public static ArrowStyle of(String s, ArrowStyle def) {
        if (s == null) return def;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> NONE;
            case "single" -> SINGLE;
            case "double" -> DOUBLE;
            default -> def;
        };
    }
}
