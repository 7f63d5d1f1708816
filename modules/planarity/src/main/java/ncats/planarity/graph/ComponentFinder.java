package ncats.planarity.graph;

import java.util.List;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Partition a graph into its connected components by depth-first
 * reachability from the lowest unvisited node.
 */
public class ComponentFinder {
    private ComponentFinder () {}

    public static List<Component> components (CorridorGraph graph) {
        int n = graph.size();
        BitSet seen = new BitSet (n);
        List<Component> comps = new ArrayList<>();
        
        for (int s = seen.nextClearBit(0); s < n;
             s = seen.nextClearBit(s+1)) {
            BitSet comp = new BitSet (n);
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(s);
            seen.set(s);
            
            while (!stack.isEmpty()) {
                int u = stack.pop();
                comp.set(u);
                BitSet nb = graph.neighbors(u);
                nb.andNot(seen);
                for (int v = nb.nextSetBit(0); v >= 0;
                     v = nb.nextSetBit(v+1)) {
                    seen.set(v);
                    stack.push(v);
                }
            }
            
            comps.add(new Component (graph, comps.size(),
                                     comp.stream().toArray()));
        }
        
        return comps;
    }
}
