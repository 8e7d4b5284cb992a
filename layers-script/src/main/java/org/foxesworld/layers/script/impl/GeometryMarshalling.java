package org.foxesworld.layers.script.impl;

import org.foxesworld.layers.core.model.Bounds;
import org.foxesworld.layers.core.model.Point;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyArray;
import org.graalvm.polyglot.proxy.ProxyObject;

import java.util.List;

/**
 * Kernel results as read-only script objects.
 */
final class GeometryMarshalling {

    private GeometryMarshalling() {}

    static Object bounds(Bounds b) {
        return b == null ? null : new BoundsProxy(b.x(), b.y(), b.width(), b.height());
    }

    static Object point(Point p) {
        return p == null ? null : new PointProxy(p.x(), p.y());
    }

    static Object points(List<Point> pts) {
        if (pts == null) return null;
        if (pts.isEmpty()) return ProxyArray.fromArray();
        return new PointsProxy(pts);
    }

    private static final class PointsProxy implements ProxyArray {
        private final List<Point> pts;
        private PointsProxy(List<Point> pts) { this.pts = List.copyOf(pts); }

        @Override public long getSize() { return pts.size(); }

        @Override public Object get(long index) {
            int i = (int) index;
            return (i < 0 || i >= pts.size()) ? null : point(pts.get(i));
        }

        @Override public void set(long index, Value value) {
            throw new UnsupportedOperationException("vertex list is read-only");
        }

        @Override public boolean remove(long index) { return false; }
    }

    record PointProxy(double x, double y) implements ProxyObject {
        @Override public Object getMember(String key) {
            return switch (key) { case "x" -> x; case "y" -> y; default -> null; };
        }
        @Override public Object getMemberKeys() { return ProxyArray.fromArray("x", "y"); }
        @Override public boolean hasMember(String key) { return "x".equals(key) || "y".equals(key); }
        @Override public void putMember(String key, Value value) {
            throw new UnsupportedOperationException("point is read-only");
        }
    }

    record BoundsProxy(double x, double y, double width, double height) implements ProxyObject {
        @Override public Object getMember(String key) {
            return switch (key) {
                case "x" -> x;
                case "y" -> y;
                case "width" -> width;
                case "height" -> height;
                default -> null;
            };
        }
        @Override public Object getMemberKeys() { return ProxyArray.fromArray("x", "y", "width", "height"); }
        @Override public boolean hasMember(String key) {
            return switch (key) { case "x", "y", "width", "height" -> true; default -> false; };
        }
        @Override public void putMember(String key, Value value) {
            throw new UnsupportedOperationException("bounds are read-only");
        }
    }
}
