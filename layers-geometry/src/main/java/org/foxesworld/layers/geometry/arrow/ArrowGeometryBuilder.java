// Author: Calista Verner
package org.foxesworld.layers.geometry.arrow;

import org.foxesworld.layers.core.model.*;
import org.foxesworld.layers.geometry.config.GeometryConfig;
import org.foxesworld.layers.geometry.shape.SegmentMath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static org.foxesworld.layers.geometry.shape.SegmentMath.allFinite;

/**
 * Builds the closed outline of an arrow as a single polygon: the shaft plus zero, one or
 * two heads. Outlines are implicitly closed (first vertex is not repeated).
 * <p>
 * Head proportions are multiples of {@code arrowSize}; all but the barb width also scale
 * with {@code headScale}. The vertex count depends only on style and head type.
 */
public final class ArrowGeometryBuilder {

    public static final double BARB_LENGTH_RATIO = 1.56;
    public static final double BARB_WIDTH_RATIO = 0.8;
    public static final double CHEVRON_DEPTH_RATIO = 0.52;
    public static final double HEAD_DEPTH_RATIO = 1.3;
    public static final double BARB_THICKNESS_RATIO = 1.5;

    private static final double BARB_ANGLE = Math.PI / 6;
    private static final double MIN_SHAFT_WIDTH = 4;

    private final GeometryConfig config;

    public ArrowGeometryBuilder() {
        this(GeometryConfig.defaults());
    }

    public ArrowGeometryBuilder(GeometryConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @param angle          shaft direction in radians, from (x1, y1) towards (x2, y2)
     * @param perpAngle      normal used for the shaft edges, normally {@code angle + PI/2}
     * @param halfShaftWidth half of the shaft thickness
     * @param tailWidth      extra width at (x1, y1), single and none styles only
     * @return the outline, or an empty list when a coordinate, angle or size is not finite
     */
    public List<Point> buildArrowVertices(double x1, double y1, double x2, double y2,
                                          double angle, double perpAngle,
                                          double halfShaftWidth, double arrowSize,
                                          ArrowStyle arrowStyle, ArrowHeadType headType,
                                          double headScale, double tailWidth) {
        Objects.requireNonNull(arrowStyle, "arrowStyle");
        Objects.requireNonNull(headType, "headType");
        if (!allFinite(x1, y1, x2, y2, angle, perpAngle, halfShaftWidth, arrowSize)) return new ArrayList<>();

        double scale = effectiveScale(headScale);
        double tailExtra = (Double.isFinite(tailWidth) && tailWidth > 0) ? tailWidth / 2.0 : 0;
        double perpCos = Math.cos(perpAngle);
        double perpSin = Math.sin(perpAngle);
        double tailHalf = halfShaftWidth + tailExtra;

        List<Point> out = new ArrayList<>(14);
        switch (arrowStyle) {
            case NONE -> {
                out.add(new Point(x1 + perpCos * tailHalf, y1 + perpSin * tailHalf));
                out.add(new Point(x2 + perpCos * halfShaftWidth, y2 + perpSin * halfShaftWidth));
                out.add(new Point(x2 - perpCos * halfShaftWidth, y2 - perpSin * halfShaftWidth));
                out.add(new Point(x1 - perpCos * tailHalf, y1 - perpSin * tailHalf));
            }
            case SINGLE -> {
                out.add(new Point(x1 + perpCos * tailHalf, y1 + perpSin * tailHalf));
                out.addAll(head(x2, y2, angle, perpAngle, halfShaftWidth, arrowSize, scale, headType));
                out.add(new Point(x1 - perpCos * tailHalf, y1 - perpSin * tailHalf));
            }
            case DOUBLE -> {
                // tail head runs from the -perp edge to the +perp edge, front head back again
                out.addAll(buildHeadVertices(x1, y1, angle + Math.PI, halfShaftWidth, arrowSize,
                        scale, headType, true));
                out.addAll(buildHeadVertices(x2, y2, angle, halfShaftWidth, arrowSize,
                        scale, headType, true));
            }
        }
        return out;
    }

    /**
     * Vertices of one head with its tip at (tipX, tipY) pointing along {@code angle}.
     * With {@code leftToRight} the list runs from the {@code +perp} shaft edge over the tip
     * to the {@code -perp} edge; otherwise reversed. Empty when an input is not finite.
     */
    public List<Point> buildHeadVertices(double tipX, double tipY, double angle,
                                         double halfShaftWidth, double arrowSize, double headScale,
                                         ArrowHeadType headType, boolean leftToRight) {
        Objects.requireNonNull(headType, "headType");
        if (!allFinite(tipX, tipY, angle, halfShaftWidth, arrowSize)) return new ArrayList<>();

        List<Point> v = head(tipX, tipY, angle, angle + Math.PI / 2, halfShaftWidth, arrowSize,
                effectiveScale(headScale), headType);
        if (!leftToRight) Collections.reverse(v);
        return v;
    }

    public double getBezierTangent(double t, double x0, double y0, double cx, double cy, double x1, double y1) {
        return SegmentMath.quadraticTangent(t, x0, y0, cx, cy, x1, y1);
    }

    public Point getBezierPoint(double t, double x0, double y0, double cx, double cy, double x1, double y1) {
        return SegmentMath.quadraticPoint(t, x0, y0, cx, cy, x1, y1);
    }

    /** True when the control point sits more than one unit away from the chord midpoint. */
    public boolean isCurved(SegmentLayer layer) {
        if (layer == null || !layer.hasControlPoint()) return false;
        if (!allFinite(layer.x1(), layer.y1(), layer.x2(), layer.y2())) return false;

        double midX = (layer.x1() + layer.x2()) / 2.0;
        double midY = (layer.y1() + layer.y2()) / 2.0;
        return Math.hypot(layer.controlX() - midX, layer.controlY() - midY) > 1;
    }

    /**
     * Straight outline for a line or arrow layer, or null when an endpoint is missing.
     * Lines get no heads.
     */
    public List<Point> buildLayerOutline(SegmentLayer layer) {
        Objects.requireNonNull(layer, "layer");
        if (!allFinite(layer.x1(), layer.y1(), layer.x2(), layer.y2())) return null;

        double angle = Math.atan2(layer.y2() - layer.y1(), layer.x2() - layer.x1());
        double arrowSize = (Double.isFinite(layer.arrowSize()) && layer.arrowSize() > 0)
                ? layer.arrowSize()
                : config.defaultArrowSize();
        double strokeWidth = Double.isFinite(layer.strokeWidth()) ? layer.strokeWidth() : 2;
        double shaftWidth = Math.max(Math.max(arrowSize * 0.4, strokeWidth * 1.5), MIN_SHAFT_WIDTH);

        ArrowStyle style = layer.type() == LayerType.ARROW ? layer.arrowStyle() : ArrowStyle.NONE;
        ArrowHeadType headType = layer.arrowHeadType() != null ? layer.arrowHeadType() : ArrowHeadType.POINTED;
        return buildArrowVertices(layer.x1(), layer.y1(), layer.x2(), layer.y2(),
                angle, angle + Math.PI / 2, shaftWidth / 2.0, arrowSize,
                style != null ? style : ArrowStyle.SINGLE, headType,
                layer.headScale(), layer.tailWidth());
    }

    // ---------------------------------------------------------------------

    private static double effectiveScale(double headScale) {
        return (Double.isFinite(headScale) && headScale > 0) ? headScale : 1.0;
    }

    /** Head outline from the +perp shaft edge over the tip to the -perp edge. */
    private static List<Point> head(double tipX, double tipY, double angle, double perpAngle,
                                    double halfShaft, double arrowSize, double scale,
                                    ArrowHeadType headType) {
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        double perpCos = Math.cos(perpAngle);
        double perpSin = Math.sin(perpAngle);

        double barbLength = arrowSize * BARB_LENGTH_RATIO * scale;
        double barbWidth = arrowSize * BARB_WIDTH_RATIO;
        double chevronDepth = arrowSize * CHEVRON_DEPTH_RATIO * scale;
        double headDepth = arrowSize * HEAD_DEPTH_RATIO * scale;
        double barbThickness = halfShaft * BARB_THICKNESS_RATIO;

        double baseX = tipX - cos * headDepth;
        double baseY = tipY - sin * headDepth;

        double lCos = Math.cos(angle - BARB_ANGLE);
        double lSin = Math.sin(angle - BARB_ANGLE);
        double rCos = Math.cos(angle + BARB_ANGLE);
        double rSin = Math.sin(angle + BARB_ANGLE);

        List<Point> v = new ArrayList<>(7);
        switch (headType) {
            case STANDARD -> {
                double lox = tipX - barbLength * lCos;
                double loy = tipY - barbLength * lSin;
                double lix = lox + barbThickness * lSin;
                double liy = loy - barbThickness * lCos;
                double lt = shaftStep(lix - baseX, liy - baseY, lCos, lSin, perpCos, perpSin, halfShaft);
                v.add(new Point(lix + lt * lCos, liy + lt * lSin));
                v.add(new Point(lix, liy));
                v.add(new Point(lox, loy));

                v.add(new Point(tipX, tipY));

                double rox = tipX - barbLength * rCos;
                double roy = tipY - barbLength * rSin;
                double rix = rox - barbThickness * rSin;
                double riy = roy + barbThickness * rCos;
                double rt = shaftStep(rix - baseX, riy - baseY, rCos, rSin, perpCos, perpSin, -halfShaft);
                v.add(new Point(rox, roy));
                v.add(new Point(rix, riy));
                v.add(new Point(rix + rt * rCos, riy + rt * rSin));
            }
            case CHEVRON -> {
                v.add(new Point(baseX + perpCos * halfShaft, baseY + perpSin * halfShaft));
                v.add(new Point(baseX - cos * chevronDepth + perpCos * barbWidth,
                        baseY - sin * chevronDepth + perpSin * barbWidth));
                v.add(new Point(tipX, tipY));
                v.add(new Point(baseX - cos * chevronDepth - perpCos * barbWidth,
                        baseY - sin * chevronDepth - perpSin * barbWidth));
                v.add(new Point(baseX - perpCos * halfShaft, baseY - perpSin * halfShaft));
            }
            case POINTED -> {
                v.add(new Point(baseX + perpCos * halfShaft, baseY + perpSin * halfShaft));
                v.add(new Point(tipX - barbLength * lCos, tipY - barbLength * lSin));
                v.add(new Point(tipX, tipY));
                v.add(new Point(tipX - barbLength * rCos, tipY - barbLength * rSin));
                v.add(new Point(baseX - perpCos * halfShaft, baseY - perpSin * halfShaft));
            }
        }
        return v;
    }

    /**
     * Distance to walk along a barb direction from an inner barb corner until it meets the
     * shaft edge at {@code target} along the normal. Zero when the barb runs parallel to
     * the shaft edge.
     */
    private static double shaftStep(double dx, double dy, double dirCos, double dirSin,
                                    double perpCos, double perpSin, double target) {
        double current = dx * perpCos + dy * perpSin;
        double perStep = dirCos * perpCos + dirSin * perpSin;
        if (Math.abs(perStep) < 1e-12) return 0;
        return (target - current) / perStep;
    }
}
