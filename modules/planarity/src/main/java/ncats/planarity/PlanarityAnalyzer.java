package ncats.planarity;

import java.util.List;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ExecutionException;

import ncats.planarity.graph.CorridorGraph;
import ncats.planarity.graph.Component;
import ncats.planarity.graph.ComponentFinder;
import ncats.planarity.impl.DensityBoundCheck;
import ncats.planarity.impl.K5WitnessSearch;
import ncats.planarity.impl.K33WitnessSearch;

/**
 * Runs a chain of {@link PlanarityCheck}s over every connected component
 * of a graph. For each component the checks are applied in order and
 * the first violation found becomes its verdict; singletons are never
 * checked. Components that pass every check are POSSIBLY_PLANAR.
 *
 * The graph is only read, so components can be analyzed in parallel
 * (see {@link #setThreads}); reports always come back in component
 * order.
 */
public class PlanarityAnalyzer {
    final List<PlanarityCheck> checks;
    int threads = 1;

    public PlanarityAnalyzer () {
        this (defaultChecks ());
    }

    public PlanarityAnalyzer (PlanarityCheck... checks) {
        this (Arrays.asList(checks));
    }
    
    public PlanarityAnalyzer (List<PlanarityCheck> checks) {
        this.checks = Collections.unmodifiableList(new ArrayList<>(checks));
    }

    /*
     * density bound, then K5, then K3,3
     */
    public static List<PlanarityCheck> defaultChecks () {
        List<PlanarityCheck> checks = new ArrayList<>();
        checks.add(new DensityBoundCheck ());
        checks.add(new K5WitnessSearch ());
        checks.add(new K33WitnessSearch ());
        return checks;
    }

    public List<PlanarityCheck> getChecks () { return checks; }

    public PlanarityAnalyzer setThreads (int threads) {
        if (threads < 1)
            throw new IllegalArgumentException
                ("Number of threads must be positive: "+threads);
        this.threads = threads;
        return this;
    }
    public int getThreads () { return threads; }

    public ComponentReport analyze (CorridorGraph graph,
                                    Component component) {
        if (component.isSingleton())
            return new ComponentReport (component, Verdict.POSSIBLY_PLANAR);
        
        for (PlanarityCheck check : checks) {
            Violation v = check.check(graph, component);
            if (v != null)
                return new ComponentReport (component, v);
        }
        
        return new ComponentReport (component, Verdict.POSSIBLY_PLANAR);
    }

    public PlanarityReport analyze (CorridorGraph graph) {
        return analyze (graph, ComponentFinder.components(graph), null);
    }

    public PlanarityReport analyze (CorridorGraph graph,
                                    ComponentVisitor visitor) {
        return analyze (graph, ComponentFinder.components(graph), visitor);
    }
    
    public PlanarityReport analyze (CorridorGraph graph,
                                    List<Component> components,
                                    ComponentVisitor visitor) {
        List<ComponentReport> reports = threads > 1 && components.size() > 1
            ? analyzeParallel (graph, components, visitor)
            : analyzeSerial (graph, components, visitor);
        return new PlanarityReport (graph, reports);
    }

    List<ComponentReport> analyzeSerial (CorridorGraph graph,
                                         List<Component> components,
                                         ComponentVisitor visitor) {
        List<ComponentReport> reports = new ArrayList<>();
        for (Component comp : components) {
            ComponentReport r = analyze (graph, comp);
            reports.add(r);
            if (visitor != null)
                visitor.component(r);
        }
        return reports;
    }

    List<ComponentReport> analyzeParallel (final CorridorGraph graph,
                                           List<Component> components,
                                           ComponentVisitor visitor) {
        ExecutorService threadPool = Executors.newFixedThreadPool
            (Math.min(threads, components.size()));
        try {
            List<Future<ComponentReport>> futures = new ArrayList<>();
            for (final Component comp : components)
                futures.add(threadPool.submit(() -> analyze (graph, comp)));

            List<ComponentReport> reports = new ArrayList<>();
            for (Future<ComponentReport> f : futures) {
                ComponentReport r = f.get();
                reports.add(r);
                if (visitor != null)
                    visitor.component(r);
            }
            return reports;
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException
                ("Interrupted while analyzing components", ex);
        }
        catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            throw new IllegalStateException
                ("Component analysis failed", cause);
        }
        finally {
            threadPool.shutdownNow();
        }
    }
}
