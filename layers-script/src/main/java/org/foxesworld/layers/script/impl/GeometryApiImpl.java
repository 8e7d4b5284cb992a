// Author: Calista Verner
package org.foxesworld.layers.script.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.layers.core.io.LayerDecoder;
import org.foxesworld.layers.core.model.*;
import org.foxesworld.layers.geometry.arrow.ArrowGeometryBuilder;
import org.foxesworld.layers.geometry.bounds.BoundsCalculator;
import org.foxesworld.layers.geometry.config.GeometryConfig;
import org.foxesworld.layers.geometry.group.GroupBoundsResolver;
import org.foxesworld.layers.geometry.hit.HitTestContext;
import org.foxesworld.layers.geometry.hit.HitTestController;
import org.foxesworld.layers.geometry.hit.SelectionHandle;
import org.foxesworld.layers.script.api.GeometryApi;
import org.graalvm.polyglot.HostAccess;

import java.util.*;
import java.util.function.Supplier;

import static org.foxesworld.layers.core.io.LayerValues.*;

/**
 * Decodes guest records at the boundary, runs the kernel, marshals results back.
 * Holds only immutable kernel instances and can be shared between script contexts.
 */
public final class GeometryApiImpl implements GeometryApi {

    private static final Logger log = LogManager.getLogger(GeometryApiImpl.class);

    private final GeometryConfig config;
    private final BoundsCalculator bounds;
    private final HitTestController hits;
    private final ArrowGeometryBuilder arrows;
    private final GroupBoundsResolver groups;

    public GeometryApiImpl() {
        this(GeometryConfig.defaults());
    }

    public GeometryApiImpl(GeometryConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.bounds = new BoundsCalculator(config);
        this.hits = new HitTestController(config);
        this.arrows = new ArrowGeometryBuilder(config);
        this.groups = new GroupBoundsResolver(bounds);
        log.info("GeometryApi ready: lineHitTolerance={} handleHitTolerance={} bezierSamples={}",
                config.lineHitTolerance(), config.handleHitTolerance(), config.bezierSamples());
    }

    /** Builds the API from a guest config object or map; null means defaults. */
    public static GeometryApiImpl fromConfig(Object cfg) {
        return new GeometryApiImpl(GeometryConfig.from(cfg));
    }

    public GeometryConfig config() {
        return config;
    }

    @HostAccess.Export
    @Override
    public Object layerBounds(Object layer) {
        return call("layerBounds", () -> GeometryMarshalling.bounds(bounds.getLayerBounds(LayerDecoder.decode(layer))));
    }

    @HostAccess.Export
    @Override
    public Object multiLayerBounds(Object layers) {
        return call("multiLayerBounds", () -> GeometryMarshalling.bounds(
                bounds.getMultiLayerBounds(LayerDecoder.decodeAll(layers))));
    }

    @HostAccess.Export
    @Override
    public Object mergeBounds(Object boundsList) {
        return call("mergeBounds", () -> {
            List<Object> items = asList(boundsList);
            if (items == null) return null;
            List<Bounds> all = new ArrayList<>(items.size());
            for (Object item : items) all.add(LayerDecoder.bounds(item));
            return GeometryMarshalling.bounds(BoundsCalculator.mergeBounds(all));
        });
    }

    @HostAccess.Export
    @Override
    public Object groupBounds(Object group, Object layers) {
        return call("groupBounds", () -> {
            Layer g = LayerDecoder.decode(group);
            if (!(g instanceof GroupLayer gl)) return null;
            return GeometryMarshalling.bounds(
                    groups.getGroupBounds(gl, GroupBoundsResolver.lookupOf(LayerDecoder.decodeAll(layers))));
        });
    }

    @HostAccess.Export
    @Override
    public Object layerAtPoint(Object point, Object layers) {
        return call("layerAtPoint", () -> {
            List<Object> raw = asList(layers);
            if (raw == null || raw.isEmpty()) return null;

            // decoded layer -> caller's record, by identity so equal records stay distinct
            Map<Layer, Object> origin = new IdentityHashMap<>();
            List<Layer> decoded = new ArrayList<>(raw.size());
            for (Object item : raw) {
                Layer l = LayerDecoder.decode(item);
                if (l == null) continue;
                decoded.add(l);
                origin.put(l, item);
            }

            Layer hit = hits.getLayerAtPoint(LayerDecoder.point(point), HitTestContext.of(decoded, bounds));
            return hit == null ? null : origin.get(hit);
        });
    }

    @HostAccess.Export
    @Override
    public boolean pointInLayer(Object point, Object layer) {
        return call("pointInLayer", () -> {
            Layer l = LayerDecoder.decode(layer);
            return l != null && hits.isPointInLayer(LayerDecoder.point(point), l,
                    HitTestContext.of(List.of(l), bounds));
        });
    }

    @HostAccess.Export
    @Override
    public Object selectionHandleAt(Object point, Object handles) {
        return call("selectionHandleAt", () -> {
            List<Object> raw = asList(handles);
            if (raw == null || raw.isEmpty()) return null;

            Map<SelectionHandle, Object> origin = new IdentityHashMap<>();
            List<SelectionHandle> decoded = new ArrayList<>(raw.size());
            for (Object item : raw) {
                if (!isRecord(item)) continue;
                Object rect = member(item, "rect");
                SelectionHandle h = new SelectionHandle(
                        asString(member(item, "type"), null),
                        LayerDecoder.bounds(rect != null ? rect : item));
                decoded.add(h);
                origin.put(h, item);
            }

            SelectionHandle hit = hits.hitTestSelectionHandles(LayerDecoder.point(point), decoded);
            return hit == null ? null : origin.get(hit);
        });
    }

    @HostAccess.Export
    @Override
    public boolean pointInBounds(Object point, Object b) {
        return call("pointInBounds", () ->
                BoundsCalculator.isPointInBounds(LayerDecoder.point(point), LayerDecoder.bounds(b)));
    }

    @HostAccess.Export
    @Override
    public boolean boundsIntersect(Object a, Object b) {
        return call("boundsIntersect", () ->
                BoundsCalculator.boundsIntersect(LayerDecoder.bounds(a), LayerDecoder.bounds(b)));
    }

    @HostAccess.Export
    @Override
    public Object expandBounds(Object b, double amount) {
        return call("expandBounds", () ->
                GeometryMarshalling.bounds(BoundsCalculator.expandBounds(LayerDecoder.bounds(b), amount)));
    }

    @HostAccess.Export
    @Override
    public Object boundsCenter(Object b) {
        return call("boundsCenter", () ->
                GeometryMarshalling.point(BoundsCalculator.getBoundsCenter(LayerDecoder.bounds(b))));
    }

    @HostAccess.Export
    @Override
    public Object arrowVertices(Object cfg) {
        return call("arrowVertices", () -> {
            if (!isRecord(cfg)) {
                throw new IllegalArgumentException("arrowVertices: cfg must be an object");
            }
            double x1 = num(cfg, "x1"), y1 = num(cfg, "y1");
            double x2 = num(cfg, "x2"), y2 = num(cfg, "y2");
            if (!Double.isFinite(x1) || !Double.isFinite(y1) || !Double.isFinite(x2) || !Double.isFinite(y2)) {
                return null;
            }

            double angle = asNum(member(cfg, "angle"), Math.atan2(y2 - y1, x2 - x1));
            double perpAngle = asNum(member(cfg, "perpAngle"), angle + Math.PI / 2);
            double arrowSize = asNum(member(cfg, "arrowSize"), config.defaultArrowSize());
            double halfShaft = asNum(member(cfg, "halfShaftWidth"),
                    asNum(member(cfg, "shaftWidth"), Math.max(arrowSize * 0.4, 4)) / 2.0);

            List<Point> v = arrows.buildArrowVertices(x1, y1, x2, y2, angle, perpAngle, halfShaft, arrowSize,
                    ArrowStyle.of(asString(member(cfg, "arrowStyle"), null), ArrowStyle.SINGLE),
                    ArrowHeadType.of(asString(member(cfg, "arrowHeadType"), null), ArrowHeadType.POINTED),
                    num(cfg, "headScale"), num(cfg, "tailWidth"));
            return GeometryMarshalling.points(v);
        });
    }

    @HostAccess.Export
    @Override
    public Object layerOutline(Object layer) {
        return call("layerOutline", () -> {
            Layer l = LayerDecoder.decode(layer);
            if (!(l instanceof SegmentLayer s)) return null;
            return GeometryMarshalling.points(arrows.buildLayerOutline(s));
        });
    }

    @HostAccess.Export
    @Override
    public double bezierTangent(double t, double x0, double y0, double cx, double cy, double x1, double y1) {
        return arrows.getBezierTangent(t, x0, y0, cx, cy, x1, y1);
    }

    private static <T> T call(String op, Supplier<T> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.debug("Geometry.{} failed: {}", op, e.toString());
            throw new RuntimeException("Geometry." + op + " failed: " + e, e);
        }
    }
}
