package ncats.planarity;

import java.util.List;
import java.util.Arrays;
import java.util.Collections;

import com.fasterxml.jackson.annotation.JsonProperty;

import ncats.planarity.graph.CorridorGraph;

/**
 * Five mutually adjacent nodes.
 */
public class K5Witness implements Witness {
    public static final int SIZE = 5;
    
    private final int[] nodes;
    private final List<String> ids;

    public K5Witness (CorridorGraph graph, int... nodes) {
        if (nodes.length != SIZE)
            throw new IllegalArgumentException
                ("K5 witness needs "+SIZE+" nodes but got "+nodes.length);
        this.nodes = nodes.clone();
        this.ids = Collections.unmodifiableList
            (Arrays.asList(graph.ids(this.nodes)));
    }

    public Verdict verdict () { return Verdict.K5_FOUND; }
    public int[] nodes () { return nodes.clone(); }

    @JsonProperty("nodes")
    public List<String> ids () { return ids; }

    public boolean verify (CorridorGraph graph) {
        for (int i = 0; i < nodes.length; ++i)
            for (int j = i + 1; j < nodes.length; ++j)
                if (!graph.adjacent(nodes[i], nodes[j]))
                    return false;
        return true;
    }

    public String toString () { return "K5"+ids; }
}
