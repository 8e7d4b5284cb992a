package org.foxesworld.layers.geometry.config;

import static org.foxesworld.layers.core.io.LayerValues.asInt;
import static org.foxesworld.layers.core.io.LayerValues.asNum;
import static org.foxesworld.layers.core.io.LayerValues.member;

/**
 * Tunables of the geometry kernel. Defaults reproduce the editor's behaviour.
 *
 * @param lineHitTolerance   minimum pick distance for lines, arrows and paths
 * @param strokePadding      added to the stroke width when computing the pick distance
 * @param handleHitTolerance padding around selection handles
 * @param bezierSamples      intervals used when measuring distance to a curved shaft
 * @param defaultFontSize    text size when a text layer has none
 * @param textLineHeight     text height as a multiple of the font size
 * @param textCharWidth      estimated glyph width as a multiple of the font size
 * @param maxGroupDepth      nesting limit when resolving group bounds
 * @param defaultArrowSize   arrowhead size when an arrow layer has none
 */
public record GeometryConfig(
        double lineHitTolerance,
        double strokePadding,
        double handleHitTolerance,
        int bezierSamples,
        double defaultFontSize,
        double textLineHeight,
        double textCharWidth,
        int maxGroupDepth,
        double defaultArrowSize
) {

    private static final GeometryConfig DEFAULTS = new GeometryConfig(6, 4, 4, 20, 16, 1.2, 0.6, 8, 15);

    public static GeometryConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads overrides from a guest object or a map. Missing or invalid keys keep their
     * defaults; values are clamped to sane ranges.
     */
    public static GeometryConfig from(Object cfg) {
        if (cfg == null) return DEFAULTS;
        if (cfg instanceof GeometryConfig gc) return gc;

        GeometryConfig d = DEFAULTS;
        return new GeometryConfig(
                clamp(asNum(member(cfg, "lineHitTolerance"), d.lineHitTolerance), 0, 1000),
                clamp(asNum(member(cfg, "strokePadding"), d.strokePadding), 0, 1000),
                clamp(asNum(member(cfg, "handleHitTolerance"), d.handleHitTolerance), 0, 1000),
                clampI(asInt(member(cfg, "bezierSamples"), d.bezierSamples), 1, 1000),
                clamp(asNum(member(cfg, "defaultFontSize"), d.defaultFontSize), 1, 4096),
                clamp(asNum(member(cfg, "textLineHeight"), d.textLineHeight), 0.1, 10),
                clamp(asNum(member(cfg, "textCharWidth"), d.textCharWidth), 0.05, 10),
                clampI(asInt(member(cfg, "maxGroupDepth"), d.maxGroupDepth), 1, 64),
                clamp(asNum(member(cfg, "defaultArrowSize"), d.defaultArrowSize), 1, 1000)
        );
    }

    private static double clamp(double v, double a, double b) {
        return Math.max(a, Math.min(b, v));
    }

    private static int clampI(int v, int a, int b) {
        return Math.max(a, Math.min(b, v));
    }
}
