package ncats.planarity.graph;

/**
 * Visitor interface for combination enumeration; return false to stop
 * the enumeration. The array passed in is reused between calls, so copy
 * it if it has to outlive the call.
 */
public interface CombinationVisitor {
    boolean combination (int[] c);
}
