package ncats.planarity.graph;

import java.util.Map;
import java.util.HashMap;
import java.util.List;
import java.util.BitSet;

/**
 * Builds a {@link CorridorGraph} from a node id list and a list of
 * unordered id pairs. Edges that reference an unknown id, self-loops and
 * repeated pairs (in either direction) are left out of the graph and
 * only counted.
 */
public class GraphBuilder {
    final String[] ids;
    final Map<String, Integer> index = new HashMap<>();
    final BitSet[] adj;

    int edges;
    int unknownEndpoints;
    int selfLoops;
    int duplicates;

    public GraphBuilder (List<String> nodes) {
        this (nodes.toArray(new String[0]));
    }
    
    public GraphBuilder (String... nodes) {
        ids = nodes.clone();
        adj = new BitSet[ids.length];
        for (int i = 0; i < ids.length; ++i) {
            if (ids[i] == null)
                throw new IllegalArgumentException
                    ("Node at position "+i+" has no id!");
            
            Integer prev = index.put(ids[i], i);
            if (prev != null)
                throw new IllegalArgumentException
                    ("Node id \""+ids[i]+"\" is given at positions "
                     +prev+" and "+i+"!");
            adj[i] = new BitSet (ids.length);
        }
    }

    /*
     * returns true if the edge became part of the graph
     */
    public boolean add (String from, String to) {
        Integer a = from != null ? index.get(from) : null;
        Integer b = to != null ? index.get(to) : null;
        if (a == null || b == null) {
            ++unknownEndpoints;
            return false;
        }
        
        if (a.equals(b)) {
            ++selfLoops;
            return false;
        }

        if (adj[a].get(b)) {
            ++duplicates;
            return false;
        }
        
        adj[a].set(b);
        adj[b].set(a);
        ++edges;
        
        return true;
    }

    public CorridorGraph build () {
        BitSet[] copy = new BitSet[adj.length];
        for (int i = 0; i < adj.length; ++i)
            copy[i] = (BitSet) adj[i].clone();
        return new CorridorGraph (ids.clone(), new HashMap<>(index), copy,
                                  edges, unknownEndpoints, selfLoops,
                                  duplicates);
    }
}
