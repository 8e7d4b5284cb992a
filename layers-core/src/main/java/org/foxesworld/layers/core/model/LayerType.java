package org.foxesworld.layers.core.model;

import java.util.Locale;

/**
 * Layer type tags as they appear in document records.
 */
public enum LayerType {
    RECTANGLE("rectangle"),
    BLUR("blur"),
    TEXTBOX("textbox"),
    IMAGE("image"),
    CIRCLE("circle"),
    ELLIPSE("ellipse"),
    LINE("line"),
    ARROW("arrow"),
    POLYGON("polygon"),
    STAR("star"),
    TEXT("text"),
    PATH("path"),
    GROUP("group"),
    UNKNOWN("unknown");

    private final String wireName;

    LayerType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Tag lookup, case-insensitive. Unrecognized or null tags map to {@link #UNKNOWN}. */
    public static LayerType of(String tag) {
        if (tag == null) return UNKNOWN;
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (LayerType type : values()) {
            if (type.wireName.equals(t)) return type;
        }
        return UNKNOWN;
    }
}
