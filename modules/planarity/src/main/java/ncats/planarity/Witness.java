package ncats.planarity;

import java.util.List;

import ncats.planarity.graph.CorridorGraph;

/**
 * Concrete node subset exhibited as proof that a component is not
 * planar. Witnesses are immutable; {@link #verify} re-checks every
 * required pair against a graph.
 */
public interface Witness {
    Verdict verdict ();

    /*
     * node indices of the witness
     */
    int[] nodes ();

    /*
     * node ids of the witness, in the same order as nodes()
     */
    List<String> ids ();
    
    boolean verify (CorridorGraph graph);
}
