// Author: Calista Verner
package org.foxesworld.layers.core.io;

import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyArray;
import org.graalvm.polyglot.proxy.ProxyObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Coercion helpers for guest {@link Value}, host {@link ProxyObject}, {@link Map} and boxed
 * primitives.
 * Numbers that are missing or not finite come back as {@link Double#NaN}.
 */
public final class LayerValues {

    private LayerValues() {}

    public static Object member(Object obj, String key) {
        if (obj == null) return null;
        if (obj instanceof Value v) {
            if (v.isNull() || !v.hasMember(key)) return null;
            Value m = v.getMember(key);
            return (m == null || m.isNull()) ? null : m;
        }
        if (obj instanceof Map<?, ?> m) return m.get(key);
        if (obj instanceof ProxyObject p) return p.hasMember(key) ? p.getMember(key) : null;
        return null;
    }

    public static boolean isRecord(Object obj) {
        if (obj instanceof Map<?, ?> || obj instanceof ProxyObject) return true;
        if (obj instanceof Value v) {
            return !v.isNull() && v.hasMembers() && !v.hasArrayElements() && !v.isString();
        }
        return false;
    }

    public static double num(Object v) {
        double d = Double.NaN;
        if (v instanceof Number n) d = n.doubleValue();
        else if (v instanceof Value val && val.isNumber() && val.fitsInDouble()) d = val.asDouble();
        return Double.isFinite(d) ? d : Double.NaN;
    }

    public static double num(Object obj, String key) {
        return num(member(obj, key));
    }

    public static double asNum(Object v, double def) {
        double d = num(v);
        return Double.isFinite(d) ? d : def;
    }

    public static int asInt(Object v, int def) {
        double d = num(v);
        return Double.isFinite(d) ? (int) d : def;
    }

    /** Literal booleans only: {@code "false"} or {@code 0} yield null. */
    public static Boolean strictBool(Object v) {
        if (v instanceof Boolean b) return b;
        if (v instanceof Value val && val.isBoolean()) return val.asBoolean();
        return null;
    }

    public static boolean asBool(Object v, boolean def) {
        Boolean b = strictBool(v);
        return b != null ? b : def;
    }

    public static String asString(Object v, String def) {
        if (v == null) return def;
        if (v instanceof String s) return s;
        if (v instanceof Number n) return numberToString(n.doubleValue());
        if (v instanceof Value val) {
            if (val.isString()) return val.asString();
            if (val.isNumber() && val.fitsInDouble()) return numberToString(val.asDouble());
        }
        return def;
    }

    /** Array-like input as a list, or null when the value is not array-like. */
    public static List<Object> asList(Object v) {
        if (v == null) return null;
        if (v instanceof List<?> l) return Collections.unmodifiableList(l);
        if (v instanceof Object[] arr) return Collections.unmodifiableList(Arrays.asList(arr.clone()));
        if (v instanceof Value val && val.hasArrayElements()) {
            long n = val.getArraySize();
            List<Object> out = new ArrayList<>((int) Math.min(n, 4096));
            for (long i = 0; i < n; i++) {
                Value e = val.getArrayElement(i);
                out.add(e == null || e.isNull() ? null : e);
            }
            return out;
        }
        if (v instanceof ProxyArray pa) {
            long n = pa.getSize();
            List<Object> out = new ArrayList<>((int) Math.min(n, 4096));
            for (long i = 0; i < n; i++) out.add(pa.get(i));
            return out;
        }
        return null;
    }

    public static boolean hasNums(Object obj, String... keys) {
        for (String k : keys) {
            if (!Double.isFinite(num(obj, k))) return false;
        }
        return true;
    }

    public static double firstNum(Object obj, String... keys) {
        for (String k : keys) {
            double d = num(obj, k);
            if (Double.isFinite(d)) return d;
        }
        return Double.NaN;
    }

    private static String numberToString(double d) {
        if (d == Math.rint(d) && Math.abs(d) < 1e15) return Long.toString((long) d);
        return Double.toString(d);
    }
}
