package ncats.planarity;

import ncats.planarity.graph.CorridorGraph;
import ncats.planarity.graph.Component;

/**
 * A single nonplanarity test applied to one component. Returns null if
 * the test found nothing; this says nothing about the component being
 * planar.
 */
public interface PlanarityCheck {
    Violation check (CorridorGraph graph, Component component);
}
