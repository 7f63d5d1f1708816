package ncats.planarity;

import java.util.List;
import java.util.Arrays;
import java.util.Collections;

import com.fasterxml.jackson.annotation.JsonProperty;

import ncats.planarity.graph.CorridorGraph;

/**
 * Two disjoint node triples A and B with every cross pair (a, b)
 * adjacent. Nothing is required of the pairs inside A or inside B.
 */
public class K33Witness implements Witness {
    public static final int SIDE = 3;

    private final int[] a, b;
    private final List<String> aids, bids;

    public K33Witness (CorridorGraph graph, int[] a, int[] b) {
        if (a.length != SIDE || b.length != SIDE)
            throw new IllegalArgumentException
                ("K3,3 witness needs two groups of "+SIDE+" nodes");
        this.a = a.clone();
        this.b = b.clone();
        aids = Collections.unmodifiableList(Arrays.asList(graph.ids(a)));
        bids = Collections.unmodifiableList(Arrays.asList(graph.ids(b)));
    }

    public Verdict verdict () { return Verdict.K33_FOUND; }

    public int[] nodes () {
        int[] nodes = new int[2*SIDE];
        System.arraycopy(a, 0, nodes, 0, SIDE);
        System.arraycopy(b, 0, nodes, SIDE, SIDE);
        return nodes;
    }

    public List<String> ids () {
        String[] all = new String[2*SIDE];
        aids.toArray(all);
        for (int i = 0; i < SIDE; ++i)
            all[SIDE+i] = bids.get(i);
        return Collections.unmodifiableList(Arrays.asList(all));
    }

    @JsonProperty("A")
    public List<String> groupA () { return aids; }
    @JsonProperty("B")
    public List<String> groupB () { return bids; }

    public boolean verify (CorridorGraph graph) {
        for (int i : a)
            for (int j : b)
                if (i == j || !graph.adjacent(i, j))
                    return false;
        return true;
    }

    public String toString () { return "K3,3"+aids+bids; }
}
