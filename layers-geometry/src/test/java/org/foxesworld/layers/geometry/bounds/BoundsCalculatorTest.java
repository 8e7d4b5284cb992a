package org.foxesworld.layers.geometry.bounds;

import org.foxesworld.layers.core.model.*;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static java.lang.Double.NaN;
import static org.foxesworld.layers.geometry.TestLayers.*;
import static org.junit.Assert.*;

public class BoundsCalculatorTest {

    private static final double EPS = 1e-9;

    private final BoundsCalculator calc = new BoundsCalculator();

    private static void assertBounds(double x, double y, double w, double h, Bounds b) {
        assertNotNull(b);
        assertEquals("x", x, b.x(), EPS);
        assertEquals("y", y, b.y(), EPS);
        assertEquals("width", w, b.width(), EPS);
        assertEquals("height", h, b.height(), EPS);
    }

    @Test
    public void negativeRectangleExtentsAreNormalized() {
        assertBounds(10, 20, 100, 50, calc.getLayerBounds(rect("r", 110, 70, -100, -50)));
    }

    @Test
    public void zeroSizeRectangleKeepsItsOrigin() {
        assertEquals(new Bounds(10, 20, 0, 0), calc.getLayerBounds(rect("r", 10, 20, 0, 0)));
    }

    @Test
    public void rectangleWithMissingFieldHasNoBounds() {
        assertNull(calc.getLayerBounds(rect("r", 10, NaN, 5, 5)));
    }

    @Test
    public void boxTypesShareRectangleRule() {
        for (LayerType t : new LayerType[]{LayerType.BLUR, LayerType.TEXTBOX, LayerType.IMAGE}) {
            assertBounds(0, 0, 4, 3, calc.getLayerBounds(box(t, 4, 3, -4, -3)));
        }
    }

    @Test
    public void lineBoundsSpanBothEndpoints() {
        assertBounds(20, 10, 80, 90, calc.getLayerBounds(line("l", 100, 10, 20, 100)));
        assertBounds(0, 5, 50, 0, calc.getLayerBounds(arrow("a", 0, 5, 50, 5)));
        assertNull(calc.getLayerBounds(line("l", 0, 0, NaN, 1)));
    }

    @Test
    public void ellipseUsesPerAxisRadii() {
        assertEquals(new Bounds(10, 30, 80, 40), calc.getLayerBounds(ellipse("e", 50, 50, 40, 20)));
    }

    @Test
    public void circleRadiusIsTakenAbsolute() {
        assertBounds(-25, -25, 50, 50, calc.getLayerBounds(circle("c", 0, 0, -25)));
    }

    @Test
    public void ellipseAxisWithoutRadiusCollapses() {
        EllipticalLayer onlyX = new EllipticalLayer(info("e", LayerType.ELLIPSE), 5, 5, NaN, 10, NaN);
        assertBounds(-5, 5, 20, 0, calc.getLayerBounds(onlyX));

        EllipticalLayer radiusFallback = new EllipticalLayer(info("e", LayerType.ELLIPSE), 0, 0, 8, NaN, 3);
        assertBounds(-8, -3, 16, 6, calc.getLayerBounds(radiusFallback));

        assertNull(calc.getLayerBounds(new EllipticalLayer(info("e", LayerType.ELLIPSE), 0, 0, NaN, NaN, NaN)));
    }

    @Test
    public void pathSkipsPointsWithMissingCoordinates() {
        Bounds b = calc.getLayerBounds(path("p", p(10, 10), p(NaN, 500), p(30, 40), p(-5, NaN)));
        assertBounds(10, 10, 20, 30, b);
    }

    @Test
    public void pointListsNeedTwoEntries() {
        assertNull(calc.getLayerBounds(path("p", p(1, 1))));
        assertNull(calc.getLayerBounds(path("p", p(NaN, 1), p(2, NaN))));
        assertNull(calc.getLayerBounds(new PathLayer(info("p", LayerType.PATH), null)));
    }

    @Test
    public void explicitPolygonUsesItsPoints() {
        assertBounds(0, 0, 10, 8, calc.getLayerBounds(polygon("poly", p(0, 0), p(10, 0), p(5, 8))));
    }

    @Test
    public void regularPolygonBoundsEnvelopeItsVertices() {
        assertBounds(-10, -10, 20, 20, calc.getLayerBounds(regularPolygon("poly", 0, 0, 4, 10)));
        assertNull(calc.getLayerBounds(regularPolygon("poly", 0, 0, 4, NaN)));
    }

    @Test
    public void starTopPointIsOuterRadius() {
        Bounds b = calc.getLayerBounds(star("s", 100, 100, 5, 50, 20));
        assertNotNull(b);
        assertEquals(50, b.y(), EPS);
        assertTrue(b.width() <= 100 + EPS);
        assertTrue(b.bottom() < 150);
    }

    @Test
    public void hugePointAndSideCountsAreClamped() {
        assertBounds(50, 50, 100, 100, calc.getLayerBounds(star("s", 100, 100, 2e9, 50, 20)));
        assertBounds(90, 90, 20, 20, calc.getLayerBounds(regularPolygon("p", 100, 100, 1e9, 10)));
    }

    @Test
    public void textWidthIsEstimatedFromCharacters() {
        assertBounds(10, 30, 48, 24, calc.getLayerBounds(text("t", 10, 50, 20, "abcd")));
    }

    @Test
    public void emptyTextFallsBackToFiveEms() {
        assertBounds(0, -16, 80, 19.2, calc.getLayerBounds(text("t", 0, 0, NaN, "")));
    }

    @Test
    public void explicitNegativeTextExtentsAreNormalized() {
        TextLayer t = new TextLayer(info("t", LayerType.TEXT), 100, 100, 10, "x", -40, 12);
        assertBounds(60, 90, 40, 12, calc.getLayerBounds(t));
    }

    @Test
    public void groupsAndUnknownHaveNoBounds() {
        assertNull(calc.getLayerBounds(group("g", "a")));
        assertNull(calc.getLayerBounds(new UnknownLayer(info("u", LayerType.UNKNOWN))));
        assertNull(calc.getLayerBounds(null));
    }

    @Test
    public void boundsOfBoundsAreStable() {
        Bounds first = calc.getLayerBounds(rect("r", 50, 60, -30, -20));
        Bounds second = calc.getLayerBounds(rect("r", first.x(), first.y(), first.width(), first.height()));
        assertEquals(first, second);
    }

    @Test
    public void mergeOfSingleEntryReturnsSameInstance() {
        Bounds b = new Bounds(1, 2, 3, 4);
        assertSame(b, BoundsCalculator.mergeBounds(Collections.singletonList(b)));
        assertSame(b, BoundsCalculator.mergeBounds(Arrays.asList(null, b, null)));
    }

    @Test
    public void mergeCoversAllEntries() {
        Bounds a = new Bounds(0, 0, 10, 10);
        Bounds b = new Bounds(20, 5, 10, 30);
        Bounds m = BoundsCalculator.mergeBounds(Arrays.asList(a, b));
        assertEquals(new Bounds(0, 0, 30, 35), m);
        assertTrue(BoundsCalculator.boundsIntersect(m, a));
        assertTrue(BoundsCalculator.boundsIntersect(m, b));
        assertTrue(m.area() >= Math.max(a.area(), b.area()));
    }

    @Test
    public void mergeOfNothingIsNull() {
        assertNull(BoundsCalculator.mergeBounds(null));
        assertNull(BoundsCalculator.mergeBounds(Collections.emptyList()));
        assertNull(BoundsCalculator.mergeBounds(Arrays.asList((Bounds) null, null)));
    }

    @Test
    public void multiLayerBoundsIgnoreLayersWithoutGeometry() {
        List<Layer> layers = Arrays.asList(
                rect("a", 0, 0, 10, 10),
                group("g", "a"),
                circle("c", 100, 100, 5));
        assertEquals(new Bounds(0, 0, 105, 105), calc.getMultiLayerBounds(layers));
        assertNull(calc.getMultiLayerBounds(Collections.singletonList(group("g"))));
    }

    @Test
    public void pointInBoundsIsInclusive() {
        Bounds b = new Bounds(0, 0, 10, 10);
        assertTrue(BoundsCalculator.isPointInBounds(p(0, 0), b));
        assertTrue(BoundsCalculator.isPointInBounds(p(10, 10), b));
        assertFalse(BoundsCalculator.isPointInBounds(p(10.001, 5), b));
        assertFalse(BoundsCalculator.isPointInBounds(p(NaN, 5), b));
        assertFalse(BoundsCalculator.isPointInBounds(null, b));
        assertFalse(BoundsCalculator.isPointInBounds(p(1, 1), null));
    }

    @Test
    public void touchingBoundsIntersect() {
        Bounds a = new Bounds(0, 0, 10, 10);
        assertTrue(BoundsCalculator.boundsIntersect(a, new Bounds(10, 10, 5, 5)));
        assertFalse(BoundsCalculator.boundsIntersect(a, new Bounds(10.5, 0, 5, 5)));
        assertFalse(BoundsCalculator.boundsIntersect(a, null));
    }

    @Test
    public void expandGrowsEverySide() {
        assertEquals(new Bounds(-2, -2, 14, 9), BoundsCalculator.expandBounds(new Bounds(0, 0, 10, 5), 2));
    }

    @Test
    public void expandWithNonFiniteAmountReturnsSameInstance() {
        Bounds b = new Bounds(0, 0, 10, 5);
        assertSame(b, BoundsCalculator.expandBounds(b, NaN));
        assertSame(b, BoundsCalculator.expandBounds(b, Double.POSITIVE_INFINITY));
        assertNull(BoundsCalculator.expandBounds(null, 3));
    }

    @Test
    public void shrinkingPastZeroCollapsesOntoCenter() {
        assertEquals(new Bounds(3, 2, 4, 0), BoundsCalculator.expandBounds(new Bounds(0, 0, 10, 4), -3));
    }

    @Test
    public void centerOfBounds() {
        assertEquals(p(15, 30), BoundsCalculator.getBoundsCenter(new Bounds(10, 20, 10, 20)));
        assertNull(BoundsCalculator.getBoundsCenter(null));
    }
}
