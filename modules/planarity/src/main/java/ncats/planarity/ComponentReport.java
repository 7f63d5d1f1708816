package ncats.planarity;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import ncats.planarity.graph.Component;

/**
 * Verdict for a single component together with its size, membership and
 * the witness when one was found.
 */
@JsonPropertyOrder({"component", "nodes", "edges", "verdict",
                    "members", "witness"})
public class ComponentReport {
    public final int component;
    public final int nodes;
    public final int edges;
    public final Verdict verdict;
    public final List<String> members;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final Witness witness;

    public ComponentReport (Component comp, Verdict verdict) {
        this (comp, verdict, null);
    }
    
    public ComponentReport (Component comp, Violation violation) {
        this (comp, violation.verdict, violation.witness);
    }
    
    public ComponentReport (Component comp, Verdict verdict,
                            Witness witness) {
        this.component = comp.ordinal();
        this.nodes = comp.size();
        this.edges = comp.edgeCount();
        this.members = comp.members();
        this.verdict = verdict;
        this.witness = witness;
    }

    @JsonIgnore
    public boolean isPossiblyPlanar () {
        return verdict == Verdict.POSSIBLY_PLANAR;
    }

    public String toString () {
        return "ComponentReport{component="+component+",nodes="+nodes
            +",edges="+edges+",verdict="+verdict.tag()
            +(witness != null ? ",witness="+witness : "")+"}";
    }
}
