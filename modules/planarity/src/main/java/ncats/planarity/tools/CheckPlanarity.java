package ncats.planarity.tools;

import java.io.*;
import java.util.*;
import java.util.logging.Logger;
import java.util.logging.Level;

import com.typesafe.config.ConfigException;

import ncats.planarity.PlanarityAnalyzer;
import ncats.planarity.PlanarityConfig;
import ncats.planarity.PlanarityReport;
import ncats.planarity.ComponentReport;
import ncats.planarity.ComponentVisitor;
import ncats.planarity.K33Witness;
import ncats.planarity.Util;
import ncats.planarity.graph.CorridorGraph;
import ncats.planarity.graph.Component;
import ncats.planarity.graph.ComponentFinder;
import ncats.planarity.impl.JsonGraphLoader;

/**
 * Check the settlement graph for (certain) nonplanarity. Exits with 0 if
 * every component is possibly planar and 2 if at least one component is
 * nonplanar; 1 is reserved for usage and i/o errors.
 */
public class CheckPlanarity implements ComponentVisitor {
    static final Logger logger =
        Logger.getLogger(CheckPlanarity.class.getName());

    public static final int EXIT_ERROR = 1;

    final PrintStream out;
    
    public CheckPlanarity (PrintStream out) {
        this.out = out;
    }

    /**
     * ComponentVisitor interface
     */
    public void component (ComponentReport r) {
        switch (r.verdict) {
        case BOUND_VIOLATION:
            out.println("[nonplanar] component nodes="+r.nodes
                        +", edges="+r.edges+" violates m <= 3n-6. nodes: "
                        +r.members);
            break;
            
        case K5_FOUND:
            out.println("[nonplanar] K5 subgraph found among: "
                        +r.witness.ids());
            break;
            
        case K33_FOUND:
            { K33Witness w = (K33Witness) r.witness;
                out.println("[nonplanar] K3,3 subgraph found between A and B: "
                            +w.groupA()+" "+w.groupB());
            }
            break;

        default:
            if (r.nodes > 1) {
                out.println("[possibly planar] component nodes="+r.nodes
                            +", edges="+r.edges+". nodes: "+r.members);
            }
        }
    }

    public int check (CorridorGraph graph, PlanarityConfig config,
                      boolean json) {
        List<Component> components = ComponentFinder.components(graph);
        for (Component c : components) {
            if (c.size() > config.getLargeComponentWarning()) {
                logger.warning("Component "+c.ordinal()+" has "+c.size()
                               +" nodes; exhaustive witness search "
                               +"may take a long time!");
            }
        }

        PlanarityAnalyzer analyzer = new PlanarityAnalyzer ()
            .setThreads(config.getThreads());
        PlanarityReport report = analyzer.analyze
            (graph, components, json ? null : this);

        if (json) {
            if (!printJson (report))
                return EXIT_ERROR;
        }
        else {
            if (!report.getIsolated().isEmpty())
                out.println("## "+report.getIsolated().size()
                            +" isolated settlement(s): "
                            +report.getIsolated());
            int dropped = graph.getDroppedEdges();
            if (dropped > 0)
                out.println("## "+dropped+" connection(s) dropped: "
                            +graph.getUnknownEndpoints()+" unknown endpoint, "
                            +graph.getSelfLoops()+" self-loop, "
                            +graph.getDuplicates()+" duplicate");
            if (report.isPossiblyPlanar())
                out.println("Graph is possibly planar "
                            +"(no violations detected).");
        }
        
        return report.exitStatus();
    }

    /*
     * returns false if the object can't be serialized
     */
    public boolean printJson (Object obj) {
        String json = Util.toJson(obj);
        if (json == null) {
            logger.severe("Can't write report as json!");
            return false;
        }
        out.println(json);
        return true;
    }

    public static int run (String[] argv, PrintStream out, PrintStream err) {
        boolean json = false;
        File conf = null;
        List<String> files = new ArrayList<>();
        for (String a : argv) {
            if ("--json".equals(a)) {
                json = true;
            }
            else if (a.startsWith("--config=")) {
                conf = new File (a.substring("--config=".length()));
            }
            else if ("--help".equals(a) || "-h".equals(a)) {
                usage (out);
                return 0;
            }
            else if (a.startsWith("--")) {
                err.println("ERROR: unknown argument: "+a);
                usage (err);
                return EXIT_ERROR;
            }
            else {
                files.add(a);
            }
        }

        if (!files.isEmpty() && files.size() != 2) {
            err.println("ERROR: expecting CITIES and CONNECTIONS files");
            usage (err);
            return EXIT_ERROR;
        }

        PlanarityConfig config;
        try {
            config = conf != null
                ? PlanarityConfig.load(conf) : new PlanarityConfig ();
        }
        catch (ConfigException | IllegalArgumentException ex) {
            logger.log(Level.SEVERE, "Bad configuration", ex);
            err.println("ERROR: "+ex.getMessage());
            return EXIT_ERROR;
        }
        
        File cities = new File
            (files.isEmpty() ? config.getCities() : files.get(0));
        File connections = new File
            (files.isEmpty() ? config.getConnections() : files.get(1));
        
        CorridorGraph graph;
        try {
            graph = new JsonGraphLoader (config).load(cities, connections);
        }
        catch (IOException ex) {
            logger.log(Level.SEVERE, "Can't load graph", ex);
            err.println("ERROR: "+ex.getMessage());
            return EXIT_ERROR;
        }
        
        return new CheckPlanarity (out).check(graph, config, json);
    }

    static void usage (PrintStream ps) {
        ps.println("Usage: "+CheckPlanarity.class.getName()
                   +" [--json] [--config=FILE] [CITIES CONNECTIONS]");
        ps.println("Without files the paths are taken from the "
                   +"planarity.cities and planarity.connections settings.");
    }
    
    public static void main (String[] argv) throws Exception {
        System.exit(run (argv, System.out, System.err));
    }
}
