package ncats.planarity;

/**
 * Callback for each component report, in component order.
 */
public interface ComponentVisitor {
    void component (ComponentReport report);
}
