package ncats.planarity.impl;

import java.util.List;
import java.util.ArrayList;

import ncats.planarity.PlanarityCheck;
import ncats.planarity.Violation;
import ncats.planarity.K33Witness;
import ncats.planarity.graph.CorridorGraph;
import ncats.planarity.graph.Component;
import ncats.planarity.graph.Combinations;

/**
 * Exhaustive search for an exact K3,3: every 6-subset of the component
 * is split in all C(6,3) ways into groups A and B and accepted if all 9
 * cross pairs are adjacent. Each unordered split is visited twice, which
 * doesn't matter since only the first hit is kept.
 *
 * This only finds complete bipartite subgraphs, not subdivisions of
 * K3,3, so a component that is nonplanar through a subdivision is
 * reported as possibly planar.
 */
public class K33WitnessSearch implements PlanarityCheck {
    static final int SIZE = 2*K33Witness.SIDE;

    // positions in a 6-subset: {A0, A1, A2, B0, B1, B2}
    static final int[][] SPLITS;
    static {
        final List<int[]> splits = new ArrayList<>();
        new Combinations (SIZE, K33Witness.SIDE).generate(c -> {
                int[] split = new int[SIZE];
                boolean[] inA = new boolean[SIZE];
                for (int i = 0; i < c.length; ++i) {
                    split[i] = c[i];
                    inA[c[i]] = true;
                }
                for (int i = 0, j = K33Witness.SIDE; i < SIZE; ++i)
                    if (!inA[i])
                        split[j++] = i;
                splits.add(split);
                return true;
            });
        SPLITS = splits.toArray(new int[0][]);
    }

    public K33WitnessSearch () {
    }

    /*
     * first K3,3 under lexicographic enumeration or null
     */
    public K33Witness search (final CorridorGraph graph,
                              final Component component) {
        if (component.size() < SIZE)
            return null;

        final int[] nodes = component.nodes();
        final int[] s = new int[SIZE];
        final int[][] found = new int[1][];
        new Combinations (nodes.length, SIZE).generate(c -> {
                for (int i = 0; i < SIZE; ++i)
                    s[i] = nodes[c[i]];
                
                for (int[] split : SPLITS) {
                    if (isBiclique (graph, s, split)) {
                        found[0] = new int[SIZE];
                        for (int i = 0; i < SIZE; ++i)
                            found[0][i] = s[split[i]];
                        return false;
                    }
                }
                return true;
            });

        if (found[0] == null)
            return null;

        int[] a = new int[K33Witness.SIDE];
        int[] b = new int[K33Witness.SIDE];
        System.arraycopy(found[0], 0, a, 0, a.length);
        System.arraycopy(found[0], a.length, b, 0, b.length);
        return new K33Witness (graph, a, b);
    }

    static boolean isBiclique (CorridorGraph graph, int[] s, int[] split) {
        for (int i = 0; i < K33Witness.SIDE; ++i)
            for (int j = K33Witness.SIDE; j < SIZE; ++j)
                if (!graph.adjacent(s[split[i]], s[split[j]]))
                    return false;
        return true;
    }

    public Violation check (CorridorGraph graph, Component component) {
        return Violation.of(search (graph, component));
    }
}
