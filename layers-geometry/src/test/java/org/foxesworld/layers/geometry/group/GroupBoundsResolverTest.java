package org.foxesworld.layers.geometry.group;

import org.apache.logging.log4j.Level;
import org.foxesworld.layers.core.model.Bounds;
import org.foxesworld.layers.core.model.GroupLayer;
import org.foxesworld.layers.core.model.Layer;
import org.foxesworld.layers.geometry.bounds.BoundsCalculator;
import org.foxesworld.layers.geometry.LogCapture;
import org.foxesworld.layers.geometry.config.GeometryConfig;
import org.junit.Rule;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.foxesworld.layers.geometry.TestLayers.*;
import static org.junit.Assert.*;

public class GroupBoundsResolverTest {

    @Rule
    public final LogCapture logs = new LogCapture();

    private final GroupBoundsResolver resolver = new GroupBoundsResolver(new BoundsCalculator());

    @Test
    public void mergesNestedChildren() {
        List<Layer> doc = Arrays.asList(
                group("outer", "a", "inner"),
                rect("a", 0, 0, 10, 10),
                group("inner", "b", "c"),
                circle("b", 100, 100, 10),
                line("c", 50, -20, 60, -10));
        Function<String, Layer> lookup = GroupBoundsResolver.lookupOf(doc);

        assertEquals(new Bounds(0, -20, 110, 130), resolver.getGroupBounds(group("outer", "a", "inner"), lookup));
    }

    @Test
    public void missingChildrenAreIgnored() {
        Function<String, Layer> lookup = GroupBoundsResolver.lookupOf(List.of(rect("a", 1, 2, 3, 4)));
        assertEquals(new Bounds(1, 2, 3, 4), resolver.getGroupBounds(group("g", "a", "ghost"), lookup));
        assertNull(resolver.getGroupBounds(group("g", "ghost"), lookup));
    }

    @Test
    public void cyclesAreCutAndPartialResultReturned() {
        List<Layer> doc = Arrays.asList(
                group("g1", "a", "g2"),
                group("g2", "g1", "b"),
                rect("a", 0, 0, 10, 10),
                rect("b", 20, 20, 10, 10));
        Function<String, Layer> lookup = GroupBoundsResolver.lookupOf(doc);

        assertEquals(new Bounds(0, 0, 30, 30), resolver.getGroupBounds((GroupLayer) doc.get(0), lookup));
    }

    @Test
    public void sharedChildIsReportedAsAlreadyVisited() {
        List<Layer> doc = Arrays.asList(
                group("top", "left", "right"),
                group("left", "shared"),
                group("right", "shared", "r"),
                rect("shared", 0, 0, 10, 10),
                rect("r", 40, 40, 10, 10));
        Function<String, Layer> lookup = GroupBoundsResolver.lookupOf(doc);

        assertEquals(new Bounds(0, 0, 50, 50), resolver.getGroupBounds((GroupLayer) doc.get(0), lookup));
        List<String> warnings = logs.messages(Level.WARN);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("'shared' already visited"));
        assertFalse(warnings.get(0).contains("cycle"));
    }

    @Test
    public void selfReferenceIsIgnored() {
        Function<String, Layer> lookup = GroupBoundsResolver.lookupOf(List.of(group("g", "g")));
        assertTrue(resolver.collectDescendants(group("g", "g"), lookup).isEmpty());
    }

    @Test
    public void depthLimitStopsDescent() {
        GroupBoundsResolver shallow = new GroupBoundsResolver(
                new BoundsCalculator(GeometryConfig.from(Map.of("maxGroupDepth", 2))));

        List<Layer> doc = new ArrayList<>();
        doc.add(group("g0", "r0", "g1"));
        doc.add(rect("r0", 0, 0, 1, 1));
        doc.add(group("g1", "r1", "g2"));
        doc.add(rect("r1", 10, 10, 1, 1));
        doc.add(group("g2", "r2"));
        doc.add(rect("r2", 100, 100, 1, 1));
        Function<String, Layer> lookup = GroupBoundsResolver.lookupOf(doc);

        assertEquals(new Bounds(0, 0, 11, 11), shallow.getGroupBounds(group("g0", "r0", "g1"), lookup));
        assertEquals(new Bounds(0, 0, 101, 101), resolver.getGroupBounds(group("g0", "r0", "g1"), lookup));
    }

    @Test
    public void descendantsKeepChildOrder() {
        List<Layer> doc = Arrays.asList(group("inner", "x"), rect("x", 0, 0, 1, 1), rect("y", 0, 0, 1, 1));
        List<Layer> out = resolver.collectDescendants(group("outer", "inner", "y"),
                GroupBoundsResolver.lookupOf(doc));
        assertEquals(3, out.size());
        assertEquals("inner", out.get(0).id());
        assertEquals("x", out.get(1).id());
        assertEquals("y", out.get(2).id());
    }
}
