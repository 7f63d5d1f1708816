package ncats.planarity.graph;

import java.util.List;
import java.util.Arrays;
import java.util.Collections;

/**
 * A (connected) component is a maximal set of linked nodes within a
 * graph. Node indices are kept sorted.
 */
public class Component {
    private final int ordinal;
    private final int[] nodes;
    private final int edges;
    private final List<String> members;

    public Component (CorridorGraph graph, int ordinal, int... nodes) {
        this.ordinal = ordinal;
        this.nodes = nodes.clone();
        Arrays.sort(this.nodes);
        this.edges = graph.edgeCount(this.nodes);
        this.members = Collections.unmodifiableList
            (Arrays.asList(graph.ids(this.nodes)));
    }

    /*
     * position of this component in the finder's output
     */
    public int ordinal () { return ordinal; }

    /*
     * number of nodes
     */
    public int size () { return nodes.length; }

    /*
     * number of edges with both endpoints in this component
     */
    public int edgeCount () { return edges; }

    public int[] nodes () { return nodes.clone(); }
    public int node (int i) { return nodes[i]; }
    public List<String> members () { return members; }

    public boolean isSingleton () { return nodes.length == 1; }

    public boolean contains (int node) {
        return Arrays.binarySearch(nodes, node) >= 0;
    }

    public String toString () {
        return "Component{ordinal="+ordinal+",nodes="+nodes.length
            +",edges="+edges+"}";
    }
}
