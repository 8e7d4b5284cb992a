// Author: Calista Verner
package org.foxesworld.layers.geometry.hit;

import org.foxesworld.layers.core.model.*;
import org.foxesworld.layers.geometry.bounds.BoundsCalculator;
import org.foxesworld.layers.geometry.config.GeometryConfig;
import org.foxesworld.layers.geometry.shape.PolygonGeometry;
import org.foxesworld.layers.geometry.shape.SegmentMath;

import java.util.List;
import java.util.Objects;

import static org.foxesworld.layers.geometry.shape.SegmentMath.allFinite;

/**
 * Point picking over layers and selection handles.
 * <p>
 * Layers are tested in the order the context lists them and the first visible,
 * unlocked layer that contains the point is returned. Rotation is not applied.
 */
public final class HitTestController {

    private static final double DEFAULT_STROKE_WIDTH = 2;

    private final GeometryConfig config;

    public HitTestController() {
        this(GeometryConfig.defaults());
    }

    public HitTestController(GeometryConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public Layer getLayerAtPoint(Point point, HitTestContext context) {
        Objects.requireNonNull(context, "context");
        if (point == null || !point.isFinite()) return null;

        List<? extends Layer> layers = context.layers();
        if (layers == null) return null;

        for (Layer layer : layers) {
            if (layer == null || !layer.visible() || layer.locked()) continue;
            if (isPointInLayer(point, layer, context)) return layer;
        }
        return null;
    }

    public boolean isPointInLayer(Point point, Layer layer, HitTestContext context) {
        if (point == null || layer == null || !point.isFinite()) return false;

        return switch (layer.type()) {
            case RECTANGLE, TEXTBOX, IMAGE -> layer instanceof BoxLayer b && isPointInBox(point, b);
            case BLUR, TEXT -> BoundsCalculator.isPointInBounds(point,
                    Objects.requireNonNull(context, "context").getLayerBounds(layer));
            case CIRCLE -> layer instanceof EllipticalLayer e && isPointInCircle(point, e);
            case ELLIPSE -> layer instanceof EllipticalLayer e && isPointInEllipse(point, e);
            case LINE, ARROW -> layer instanceof SegmentLayer s && isPointNearSegmentLayer(point, s);
            case PATH -> layer instanceof PathLayer p && isPointNearPath(point, p);
            case POLYGON -> layer instanceof PolygonLayer p
                    && PolygonGeometry.isPointInPolygon(point, PolygonGeometry.vertices(p));
            case STAR -> layer instanceof StarLayer s
                    && PolygonGeometry.isPointInPolygon(point, PolygonGeometry.vertices(s));
            case GROUP, UNKNOWN -> false;
        };
    }

    /**
     * First handle whose rectangle, grown by the handle tolerance, contains the point.
     */
    public SelectionHandle hitTestSelectionHandles(Point point, List<SelectionHandle> handles) {
        if (point == null || !point.isFinite() || handles == null) return null;

        for (SelectionHandle h : handles) {
            if (h == null || h.rect() == null) continue;
            Bounds grown = BoundsCalculator.expandBounds(h.rect(), config.handleHitTolerance());
            if (BoundsCalculator.isPointInBounds(point, grown)) return h;
        }
        return null;
    }

    /** Pick distance for stroked shapes: {@code max(lineHitTolerance, strokeWidth + strokePadding)}. */
    public double tolerance(Layer layer) {
        double sw = layer.strokeWidth();
        if (!Double.isFinite(sw) || sw == 0) sw = DEFAULT_STROKE_WIDTH;
        return Math.max(config.lineHitTolerance(), sw + config.strokePadding());
    }

    boolean isPointInBox(Point p, BoxLayer b) {
        if (!allFinite(b.x(), b.y(), b.width(), b.height())) return false;
        Bounds box = Bounds.normalized(b.x(), b.y(), b.width(), b.height());
        return BoundsCalculator.isPointInBounds(p, box);
    }

    boolean isPointInCircle(Point p, EllipticalLayer c) {
        if (!allFinite(c.x(), c.y(), c.radius())) return false;
        double dx = p.x() - c.x();
        double dy = p.y() - c.y();
        double r = Math.abs(c.radius());
        return dx * dx + dy * dy <= r * r;
    }

    boolean isPointInEllipse(Point p, EllipticalLayer e) {
        if (!allFinite(e.x(), e.y())) return false;
        double rx = BoundsCalculator.radiusX(e);
        double ry = BoundsCalculator.radiusY(e);
        if (rx == 0 || ry == 0) return false;

        double nx = (p.x() - e.x()) / rx;
        double ny = (p.y() - e.y()) / ry;
        return nx * nx + ny * ny <= 1;
    }

    boolean isPointNearSegmentLayer(Point p, SegmentLayer s) {
        if (!allFinite(s.x1(), s.y1(), s.x2(), s.y2())) return false;
        double tol = tolerance(s);

        if (hasCurve(s)) {
            return SegmentMath.pointToQuadraticBezierDistance(p.x(), p.y(),
                    s.x1(), s.y1(), s.controlX(), s.controlY(), s.x2(), s.y2(),
                    config.bezierSamples()) <= tol;
        }
        return SegmentMath.pointToSegmentDistance(p.x(), p.y(), s.x1(), s.y1(), s.x2(), s.y2()) <= tol;
    }

    boolean isPointNearPath(Point p, PathLayer path) {
        List<Point> pts = PolygonGeometry.finitePoints(path.points());
        if (pts.size() < 2) return false;

        double tol = tolerance(path);
        for (int i = 0; i < pts.size() - 1; i++) {
            Point a = pts.get(i);
            Point b = pts.get(i + 1);
            if (SegmentMath.pointToSegmentDistance(p.x(), p.y(), a.x(), a.y(), b.x(), b.y()) <= tol) {
                return true;
            }
        }
        return false;
    }

    /** Control point present and off the chord midpoint. */
    private static boolean hasCurve(SegmentLayer s) {
        if (!s.hasControlPoint()) return false;
        return s.controlX() != (s.x1() + s.x2()) / 2.0 || s.controlY() != (s.y1() + s.y2()) / 2.0;
    }
}
