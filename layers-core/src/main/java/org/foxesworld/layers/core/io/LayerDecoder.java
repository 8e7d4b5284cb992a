// Author: Calista Verner
package org.foxesworld.layers.core.io;

import org.foxesworld.layers.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.foxesworld.layers.core.io.LayerValues.*;

/**
 * Turns loosely typed layer records (guest {@code Value} objects or {@code Map}s) into
 * {@link Layer} variants.
 * <p>
 * Decoding never validates geometry: absent or non-finite numbers are stored as NaN and
 * the kernel treats such layers as having no bounds. Records without a {@code type}
 * are classified from the fields they carry.
 */
public final class LayerDecoder {
    private static final Logger logger = LoggerFactory.getLogger(LayerDecoder.class);

    private LayerDecoder() {}

    /**
     * @return decoded layer, or null for null input
     * @throws IllegalArgumentException when the input is not a record
     */
    public static Layer decode(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Layer l) return l;
        if (!isRecord(raw)) {
            throw new IllegalArgumentException("Unsupported layer record: " + raw.getClass().getName());
        }

        Object typeRaw = member(raw, "type");
        LayerType type;
        if (typeRaw == null) {
            type = inferType(raw);
            logger.debug("Untyped layer record classified as {}", type.wireName());
        } else {
            type = LayerType.of(asString(typeRaw, null));
        }

        LayerInfo info = new LayerInfo(
                asString(member(raw, "id"), null),
                type,
                !Boolean.FALSE.equals(strictBool(member(raw, "visible"))),
                Boolean.TRUE.equals(strictBool(member(raw, "locked"))),
                num(raw, "strokeWidth")
        );

        return switch (type) {
            case RECTANGLE, BLUR, TEXTBOX, IMAGE -> new BoxLayer(info,
                    num(raw, "x"), num(raw, "y"), num(raw, "width"), num(raw, "height"));
            case CIRCLE, ELLIPSE -> new EllipticalLayer(info,
                    num(raw, "x"), num(raw, "y"),
                    num(raw, "radius"), num(raw, "radiusX"), num(raw, "radiusY"));
            case LINE, ARROW -> new SegmentLayer(info,
                    num(raw, "x1"), num(raw, "y1"), num(raw, "x2"), num(raw, "y2"),
                    num(raw, "controlX"), num(raw, "controlY"),
                    ArrowStyle.of(asString(member(raw, "arrowStyle"), null), ArrowStyle.SINGLE),
                    ArrowHeadType.of(asString(member(raw, "arrowHeadType"), null), ArrowHeadType.POINTED),
                    num(raw, "headScale"), num(raw, "tailWidth"), num(raw, "arrowSize"));
            case POLYGON -> new PolygonLayer(info, points(member(raw, "points")),
                    num(raw, "x"), num(raw, "y"), num(raw, "sides"),
                    firstNum(raw, "radius", "outerRadius"));
            case STAR -> new StarLayer(info, num(raw, "x"), num(raw, "y"),
                    firstNum(raw, "points", "starPoints"),
                    firstNum(raw, "outerRadius", "radius"),
                    num(raw, "innerRadius"));
            case TEXT -> new TextLayer(info, num(raw, "x"), num(raw, "y"), num(raw, "fontSize"),
                    asString(member(raw, "text"), null), num(raw, "width"), num(raw, "height"));
            case PATH -> new PathLayer(info, points(member(raw, "points")));
            case GROUP -> new GroupLayer(info, ids(member(raw, "children")));
            case UNKNOWN -> new UnknownLayer(info);
        };
    }

    /**
     * Decodes an array-like collection in order. Null entries are skipped.
     */
    public static List<Layer> decodeAll(Object rawList) {
        List<Object> items = asList(rawList);
        if (items == null || items.isEmpty()) return Collections.emptyList();

        List<Layer> out = new ArrayList<>(items.size());
        for (Object item : items) {
            Layer l = decode(item);
            if (l != null) out.add(l);
        }
        return out;
    }

    /** Legacy records: rectangle, then line, then circle, else unknown. */
    static LayerType inferType(Object raw) {
        if (hasNums(raw, "x", "y", "width", "height")) return LayerType.RECTANGLE;
        if (hasNums(raw, "x1", "y1", "x2", "y2")) return LayerType.LINE;
        if (hasNums(raw, "x", "y", "radius")) return LayerType.CIRCLE;
        return LayerType.UNKNOWN;
    }

    /**
     * Point array with its raw length. Entries that are not {x, y} records become
     * NaN points. Returns null when the value is not array-like.
     */
    public static List<Point> points(Object raw) {
        List<Object> items = asList(raw);
        if (items == null) return null;

        List<Point> out = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item instanceof Point p) {
                out.add(p);
            } else if (isRecord(item)) {
                out.add(new Point(num(item, "x"), num(item, "y")));
            } else {
                out.add(new Point(Double.NaN, Double.NaN));
            }
        }
        return out;
    }

    public static Point point(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Point p) return p;
        if (!isRecord(raw)) {
            throw new IllegalArgumentException("Unsupported point: " + raw.getClass().getName());
        }
        return new Point(num(raw, "x"), num(raw, "y"));
    }

    public static Bounds bounds(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Bounds b) return b;
        if (!isRecord(raw)) {
            throw new IllegalArgumentException("Unsupported bounds: " + raw.getClass().getName());
        }
        return new Bounds(num(raw, "x"), num(raw, "y"), num(raw, "width"), num(raw, "height"));
    }

    private static List<String> ids(Object raw) {
        List<Object> items = asList(raw);
        if (items == null) return List.of();

        List<String> out = new ArrayList<>(items.size());
        for (Object item : items) {
            String id = asString(item, null);
            if (id != null) out.add(id);
        }
        return out;
    }
}
