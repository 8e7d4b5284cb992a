package org.foxesworld.layers.script.api;

import org.graalvm.polyglot.HostAccess;

/**
 * Script-facing geometry kernel. Arguments are guest objects or maps shaped like layer
 * records; results are plain {@code {x, y, width, height}} / {@code {x, y}} proxies.
 * Methods return null where the kernel has no answer.
 */
public interface GeometryApi {

    /** Bounds of one layer record, or null. */
    @HostAccess.Export Object layerBounds(Object layer);

    /** Merged bounds of an array of layer records. */
    @HostAccess.Export Object multiLayerBounds(Object layers);

    @HostAccess.Export Object mergeBounds(Object boundsList);

    /**
     * Bounds of a group record, resolving child ids against {@code layers}.
     */
    @HostAccess.Export Object groupBounds(Object group, Object layers);

    /**
     * Topmost hit in array order. Returns the caller's own record, not a copy.
     */
    @HostAccess.Export Object layerAtPoint(Object point, Object layers);

    @HostAccess.Export boolean pointInLayer(Object point, Object layer);

    /** First handle ({@code {type, rect}} or a bare rect) under the point. */
    @HostAccess.Export Object selectionHandleAt(Object point, Object handles);

    @HostAccess.Export boolean pointInBounds(Object point, Object bounds);

    @HostAccess.Export boolean boundsIntersect(Object a, Object b);

    @HostAccess.Export Object expandBounds(Object bounds, double amount);

    @HostAccess.Export Object boundsCenter(Object bounds);

    /**
     * Arrow outline from a config with {@code x1, y1, x2, y2} and optional
     * {@code angle, perpAngle, halfShaftWidth, arrowSize, arrowStyle, arrowHeadType,
     * headScale, tailWidth}.
     */
    @HostAccess.Export Object arrowVertices(Object cfg);

    /** Outline of a line or arrow layer record. */
    @HostAccess.Export Object layerOutline(Object layer);

    @HostAccess.Export double bezierTangent(double t, double x0, double y0,
                                            double cx, double cy, double x1, double y1);
}
