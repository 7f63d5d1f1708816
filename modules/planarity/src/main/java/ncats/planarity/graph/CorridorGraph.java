package ncats.planarity.graph;

import java.util.Map;
import java.util.BitSet;
import java.util.List;
import java.util.Arrays;
import java.util.Collections;

/**
 * Simple undirected graph over settlements. Adjacency is symmetric and
 * loop-free; instances are immutable once built by {@link GraphBuilder}.
 */
public class CorridorGraph {
    private final String[] ids;
    private final Map<String, Integer> index;
    private final BitSet[] adj;
    private final int edges;

    // edges excluded while building
    private final int unknownEndpoints;
    private final int selfLoops;
    private final int duplicates;

    CorridorGraph (String[] ids, Map<String, Integer> index, BitSet[] adj,
                   int edges, int unknownEndpoints, int selfLoops,
                   int duplicates) {
        this.ids = ids;
        this.index = index;
        this.adj = adj;
        this.edges = edges;
        this.unknownEndpoints = unknownEndpoints;
        this.selfLoops = selfLoops;
        this.duplicates = duplicates;
    }

    public int size () { return ids.length; }
    public int edgeCount () { return edges; }

    public String id (int i) { return ids[i]; }
    public List<String> ids () {
        return Collections.unmodifiableList(Arrays.asList(ids));
    }
    
    public String[] ids (int... nodes) {
        String[] names = new String[nodes.length];
        for (int i = 0; i < nodes.length; ++i)
            names[i] = ids[nodes[i]];
        return names;
    }

    /*
     * node index of the given id or -1 if the id isn't part of this graph
     */
    public int index (String id) {
        Integer i = index.get(id);
        return i != null ? i : -1;
    }

    public boolean contains (String id) {
        return index.containsKey(id);
    }

    public boolean adjacent (int i, int j) {
        return adj[i].get(j);
    }

    public boolean adjacent (String a, String b) {
        int i = index (a), j = index (b);
        return i >= 0 && j >= 0 && adj[i].get(j);
    }

    public int degree (int i) { return adj[i].cardinality(); }

    /*
     * return a copy of the neighbors of node i
     */
    public BitSet neighbors (int i) {
        return (BitSet) adj[i].clone();
    }

    /*
     * number of edges with both endpoints in the given node set
     */
    public int edgeCount (int... nodes) {
        int m = 0;
        for (int i = 0; i < nodes.length; ++i)
            for (int j = i + 1; j < nodes.length; ++j)
                if (adj[nodes[i]].get(nodes[j]))
                    ++m;
        return m;
    }

    public int getUnknownEndpoints () { return unknownEndpoints; }
    public int getSelfLoops () { return selfLoops; }
    public int getDuplicates () { return duplicates; }
    public int getDroppedEdges () {
        return unknownEndpoints + selfLoops + duplicates;
    }

    public String toString () {
        return getClass().getSimpleName()+"{nodes="+ids.length
            +",edges="+edges+",dropped="+getDroppedEdges()+"}";
    }
}
