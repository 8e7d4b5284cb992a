package org.foxesworld.layers.geometry.group;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.layers.core.model.Bounds;
import org.foxesworld.layers.core.model.GroupLayer;
import org.foxesworld.layers.core.model.Layer;
import org.foxesworld.layers.geometry.bounds.BoundsCalculator;

import java.util.*;
import java.util.function.Function;

/**
 * Resolves group geometry by walking child ids through a caller-supplied lookup.
 * <p>
 * The walk keeps a visited set and a depth counter. A revisited id or a nesting level
 * beyond {@code maxGroupDepth} is reported once at WARN and that branch is skipped; the
 * rest of the tree still contributes.
 */
public final class GroupBoundsResolver {

    private static final Logger log = LogManager.getLogger(GroupBoundsResolver.class);

    private final BoundsCalculator bounds;
    private final int maxDepth;

    public GroupBoundsResolver(BoundsCalculator bounds) {
        this.bounds = Objects.requireNonNull(bounds, "bounds");
        this.maxDepth = bounds.config().maxGroupDepth();
    }

    /**
     * Merged bounds of all non-group descendants, or null when none has bounds.
     */
    public Bounds getGroupBounds(GroupLayer group, Function<String, ? extends Layer> lookup) {
        List<Layer> leaves = new ArrayList<>();
        for (Layer l : collectDescendants(group, lookup)) {
            if (!(l instanceof GroupLayer)) leaves.add(l);
        }
        return bounds.getMultiLayerBounds(leaves);
    }

    /**
     * Every layer reachable from {@code group}, depth first, in child order. Nested groups
     * are included before their own children.
     */
    public List<Layer> collectDescendants(GroupLayer group, Function<String, ? extends Layer> lookup) {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(lookup, "lookup");

        Set<String> visited = new HashSet<>();
        if (group.id() != null) visited.add(group.id());

        List<Layer> out = new ArrayList<>();
        walk(group, lookup, visited, 1, out);
        return out;
    }

    /** Id lookup over a layer snapshot. The first layer with a given id wins. */
    public static Function<String, Layer> lookupOf(Collection<? extends Layer> layers) {
        Map<String, Layer> byId = new HashMap<>();
        if (layers != null) {
            for (Layer l : layers) {
                if (l != null && l.id() != null) byId.putIfAbsent(l.id(), l);
            }
        }
        return byId::get;
    }

    private void walk(GroupLayer group, Function<String, ? extends Layer> lookup,
                      Set<String> visited, int depth, List<Layer> out) {
        for (String childId : group.children()) {
            if (!visited.add(childId)) {
                log.warn("Group '{}' child '{}' already visited, skipping", group.id(), childId);
                continue;
            }
            Layer child = lookup.apply(childId);
            if (child == null) continue;

            out.add(child);
            if (child instanceof GroupLayer nested) {
                if (depth >= maxDepth) {
                    log.warn("Group '{}' nested deeper than {} levels, skipping its children", nested.id(), maxDepth);
                    continue;
                }
                walk(nested, lookup, visited, depth + 1, out);
            }
        }
    }
}
