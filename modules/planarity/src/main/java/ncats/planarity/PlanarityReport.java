package ncats.planarity;

import java.util.List;
import java.util.ArrayList;
import java.util.Collections;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import ncats.planarity.graph.CorridorGraph;

/**
 * Aggregated result of one analysis run: one {@link ComponentReport} per
 * component plus the overall classification.
 */
@JsonPropertyOrder({"possiblyPlanar", "exitStatus", "nodes", "edges",
                    "unknownEndpoints", "selfLoops", "duplicates",
                    "isolated", "components"})
public class PlanarityReport {
    public static final int EXIT_POSSIBLY_PLANAR = 0;
    public static final int EXIT_NONPLANAR = 2;
    
    private final int nodes;
    private final int edges;
    private final int unknownEndpoints;
    private final int selfLoops;
    private final int duplicates;
    private final List<ComponentReport> components;
    private final List<String> isolated = new ArrayList<>();

    public PlanarityReport (CorridorGraph graph,
                            List<ComponentReport> components) {
        nodes = graph.size();
        edges = graph.edgeCount();
        unknownEndpoints = graph.getUnknownEndpoints();
        selfLoops = graph.getSelfLoops();
        duplicates = graph.getDuplicates();
        this.components = Collections.unmodifiableList
            (new ArrayList<>(components));
        for (ComponentReport r : components)
            if (r.nodes == 1)
                isolated.addAll(r.members);
    }

    public int getNodes () { return nodes; }
    public int getEdges () { return edges; }
    public int getUnknownEndpoints () { return unknownEndpoints; }
    public int getSelfLoops () { return selfLoops; }
    public int getDuplicates () { return duplicates; }
    public List<ComponentReport> getComponents () { return components; }
    public List<String> getIsolated () {
        return Collections.unmodifiableList(isolated);
    }

    /*
     * true only if every component is possibly planar
     */
    @JsonProperty("possiblyPlanar")
    public boolean isPossiblyPlanar () {
        for (ComponentReport r : components)
            if (!r.isPossiblyPlanar())
                return false;
        return true;
    }

    public List<ComponentReport> nonplanar () {
        List<ComponentReport> nonplanar = new ArrayList<>();
        for (ComponentReport r : components)
            if (!r.isPossiblyPlanar())
                nonplanar.add(r);
        return nonplanar;
    }

    @JsonProperty("exitStatus")
    public int exitStatus () {
        return isPossiblyPlanar () ? EXIT_POSSIBLY_PLANAR : EXIT_NONPLANAR;
    }
}
