package org.foxesworld.layers.geometry.shape;

import org.foxesworld.layers.core.model.Bounds;
import org.foxesworld.layers.core.model.Point;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static java.lang.Double.NaN;
import static org.foxesworld.layers.geometry.TestLayers.*;
import static org.junit.Assert.*;

public class PolygonGeometryTest {

    private static final double EPS = 1e-9;

    @Test
    public void regularPolygonStartsAtTheTop() {
        List<Point> v = PolygonGeometry.regularPolygonVertices(0, 0, 10, 4);
        assertEquals(4, v.size());
        assertEquals(0, v.get(0).x(), EPS);
        assertEquals(-10, v.get(0).y(), EPS);
        assertEquals(10, v.get(1).x(), EPS);
    }

    @Test
    public void sidesAreFlooredAndAtLeastThree() {
        assertEquals(5, PolygonGeometry.regularPolygonVertices(0, 0, 1, 5.9).size());
        assertEquals(3, PolygonGeometry.regularPolygonVertices(0, 0, 1, 1).size());
    }

    @Test
    public void starAlternatesOuterAndInner() {
        List<Point> v = PolygonGeometry.starVertices(0, 0, 10, 4, 5);
        assertEquals(10, v.size());
        for (int i = 0; i < v.size(); i++) {
            double r = Math.hypot(v.get(i).x(), v.get(i).y());
            assertEquals(i % 2 == 0 ? 10 : 4, r, EPS);
        }
        assertEquals(6, PolygonGeometry.starVertices(0, 0, 10, 4, 2).size());
    }

    @Test
    public void vertexCountsAreCappedAtMaxCount() {
        assertEquals(PolygonGeometry.MAX_COUNT,
                PolygonGeometry.regularPolygonVertices(0, 0, 1, 1e9).size());
        assertEquals(2 * PolygonGeometry.MAX_COUNT,
                PolygonGeometry.starVertices(0, 0, 10, 4, 2e9).size());
        assertEquals(6, PolygonGeometry.starVertices(0, 0, 10, 4, Double.POSITIVE_INFINITY).size());
    }

    @Test
    public void starDefaultsApplyToMissingFields() {
        List<Point> v = PolygonGeometry.vertices(star("s", 0, 0, NaN, 50, NaN));
        assertEquals(10, v.size());
        assertEquals(20, Math.hypot(v.get(1).x(), v.get(1).y()), EPS);
        assertNull(PolygonGeometry.vertices(star("s", 0, NaN, 5, 50, 20)));
    }

    @Test
    public void regularPolygonDefaultsToSixSides() {
        assertEquals(6, PolygonGeometry.vertices(regularPolygon("p", 0, 0, NaN, 10)).size());
    }

    @Test
    public void envelopeSkipsNonFinitePoints() {
        assertEquals(new Bounds(-1, 2, 4, 3),
                PolygonGeometry.envelope(Arrays.asList(p(-1, 2), p(NaN, 100), p(3, 5))));
        assertNull(PolygonGeometry.envelope(Arrays.asList(p(NaN, 1))));
        assertNull(PolygonGeometry.envelope(null));
    }

    @Test
    public void rayCastingOnConcaveShape() {
        // U shape open at the top
        List<Point> u = Arrays.asList(p(0, 0), p(10, 0), p(10, 30), p(20, 30), p(20, 0),
                p(30, 0), p(30, 40), p(0, 40));
        assertTrue(PolygonGeometry.isPointInPolygon(p(5, 20), u));
        assertFalse(PolygonGeometry.isPointInPolygon(p(15, 10), u));
        assertTrue(PolygonGeometry.isPointInPolygon(p(15, 35), u));
    }

    @Test
    public void fewerThanThreeVerticesContainNothing() {
        assertFalse(PolygonGeometry.isPointInPolygon(p(0, 0), Arrays.asList(p(-1, -1), p(1, 1), p(NaN, 0))));
        assertFalse(PolygonGeometry.isPointInPolygon(p(0, 0), null));
    }
}
