package ncats.planarity.impl;

import ncats.planarity.PlanarityCheck;
import ncats.planarity.Verdict;
import ncats.planarity.Violation;
import ncats.planarity.graph.CorridorGraph;
import ncats.planarity.graph.Component;

/**
 * A simple planar graph with n >= 3 nodes has at most 3n - 6 edges
 * (Euler's formula); more edges than that proves nonplanarity.
 */
public class DensityBoundCheck implements PlanarityCheck {
    public static final int MIN_NODES = 3;

    public DensityBoundCheck () {
    }

    /*
     * maximum number of edges of a planar graph with n >= 3 nodes
     */
    public static int bound (int n) {
        if (n < MIN_NODES)
            throw new IllegalArgumentException
                ("Bound is undefined for n="+n);
        return 3*n - 6;
    }

    public static boolean violates (int n, int m) {
        return n >= MIN_NODES && m > bound (n);
    }

    public Violation check (CorridorGraph graph, Component component) {
        return violates (component.size(), component.edgeCount())
            ? new Violation (Verdict.BOUND_VIOLATION) : null;
    }
}
