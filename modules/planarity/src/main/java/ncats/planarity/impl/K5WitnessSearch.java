package ncats.planarity.impl;

import ncats.planarity.PlanarityCheck;
import ncats.planarity.Violation;
import ncats.planarity.K5Witness;
import ncats.planarity.graph.CorridorGraph;
import ncats.planarity.graph.Component;
import ncats.planarity.graph.Combinations;

/**
 * Exhaustive search for five mutually adjacent nodes. All C(n,5) subsets
 * of the component are tried in lexicographic order, so the cost is
 * O(n^5); this is only meant for components of a few dozen nodes.
 */
public class K5WitnessSearch implements PlanarityCheck {

    public K5WitnessSearch () {
    }

    /*
     * first K5 under lexicographic enumeration or null
     */
    public K5Witness search (final CorridorGraph graph,
                             final Component component) {
        if (component.size() < K5Witness.SIZE)
            return null;
        
        final int[] nodes = component.nodes();
        final int[] found = new int[K5Witness.SIZE];
        final boolean[] ok = new boolean[1];
        new Combinations (nodes.length, K5Witness.SIZE).generate(c -> {
                for (int i = 0; i < c.length; ++i)
                    for (int j = i + 1; j < c.length; ++j)
                        if (!graph.adjacent(nodes[c[i]], nodes[c[j]]))
                            return true;
                
                for (int i = 0; i < c.length; ++i)
                    found[i] = nodes[c[i]];
                ok[0] = true;
                return false;
            });
        
        return ok[0] ? new K5Witness (graph, found) : null;
    }

    public Violation check (CorridorGraph graph, Component component) {
        return Violation.of(search (graph, component));
    }
}
