package ncats.planarity.test;

import java.util.*;

import ncats.planarity.PlanarityAnalyzer;
import ncats.planarity.PlanarityCheck;
import ncats.planarity.PlanarityReport;
import ncats.planarity.ComponentReport;
import ncats.planarity.K33Witness;
import ncats.planarity.Verdict;
import ncats.planarity.Violation;
import ncats.planarity.graph.CorridorGraph;
import ncats.planarity.graph.Component;
import ncats.planarity.impl.DensityBoundCheck;

import org.junit.Test;
import org.junit.Rule;
import org.junit.rules.TestName;
import static org.junit.Assert.*;
import static ncats.planarity.test.GraphFixtures.*;

public class TestPlanarityAnalyzer {
    @Rule public TestName name = new TestName();

    final PlanarityAnalyzer analyzer = new PlanarityAnalyzer ();

    static class CountingCheck implements PlanarityCheck {
        int calls;
        public Violation check (CorridorGraph graph, Component component) {
            ++calls;
            return null;
        }
    }
    
    @Test
    public void testCompleteK5IsBoundViolation () {
        String[] v = nodes ("A", "B", "C", "D", "E");
        PlanarityReport report = analyzer.analyze(graph (v, complete (v)));
        assertEquals (1, report.getComponents().size());
        
        ComponentReport r = report.getComponents().get(0);
        assertEquals (5, r.nodes);
        assertEquals (10, r.edges);
        assertEquals (Verdict.BOUND_VIOLATION, r.verdict);
        assertNull (r.witness);
        assertFalse (report.isPossiblyPlanar());
        assertEquals (PlanarityReport.EXIT_NONPLANAR, report.exitStatus());
    }

    @Test
    public void testK5MinusEdgeIsPossiblyPlanar () {
        String[] v = nodes ("A", "B", "C", "D", "E");
        List<String> edges = complete (v);
        edges.remove("C-E");
        PlanarityReport report = analyzer.analyze(graph (v, edges));
        ComponentReport r = report.getComponents().get(0);
        assertEquals (9, r.edges);
        assertEquals (Verdict.POSSIBLY_PLANAR, r.verdict);
        assertTrue (report.isPossiblyPlanar());
        assertEquals (PlanarityReport.EXIT_POSSIBLY_PLANAR,
                      report.exitStatus());
    }

    @Test
    public void testK33 () {
        String[] a = nodes ("A1", "A2", "A3"), b = nodes ("B1", "B2", "B3");
        PlanarityReport report = analyzer.analyze
            (graph (nodes ("A1", "A2", "A3", "B1", "B2", "B3"),
                    biclique (a, b)));
        ComponentReport r = report.getComponents().get(0);
        assertEquals (6, r.nodes);
        assertEquals (9, r.edges);
        assertEquals (Verdict.K33_FOUND, r.verdict);
        
        K33Witness w = (K33Witness) r.witness;
        assertEquals (Arrays.asList(a), w.groupA());
        assertEquals (Arrays.asList(b), w.groupB());
        assertFalse (report.isPossiblyPlanar());
    }

    @Test
    public void testK5BelowBound () {
        String[] v = nodes ("A", "B", "C", "D", "E", "F", "G", "H");
        List<String> edges = complete ("A", "B", "C", "D", "E");
        edges.addAll(Arrays.asList("E-F", "F-G", "G-H"));
        ComponentReport r = analyzer.analyze(graph (v, edges))
            .getComponents().get(0);
        assertEquals (13, r.edges);
        assertEquals (Verdict.K5_FOUND, r.verdict);
        assertEquals (Arrays.asList("A", "B", "C", "D", "E"),
                      r.witness.ids());
    }

    @Test
    public void testDisjointGroups () {
        String[] v = nodes ("A", "B", "C", "D", "E", "X", "Y", "Z");
        List<String> edges = complete ("A", "B", "C", "D", "E");
        edges.addAll(complete ("X", "Y", "Z"));
        PlanarityReport report = analyzer.analyze(graph (v, edges));
        
        assertEquals (2, report.getComponents().size());
        assertEquals (Verdict.BOUND_VIOLATION,
                      report.getComponents().get(0).verdict);
        assertEquals (Verdict.POSSIBLY_PLANAR,
                      report.getComponents().get(1).verdict);
        assertEquals (Arrays.asList("X", "Y", "Z"),
                      report.getComponents().get(1).members);
        assertFalse (report.isPossiblyPlanar());
        assertEquals (1, report.nonplanar().size());

        // both groups planar
        edges = complete ("A", "B", "C");
        edges.addAll(complete ("X", "Y", "Z"));
        report = analyzer.analyze(graph (v, edges));
        assertEquals (4, report.getComponents().size());
        assertTrue (report.isPossiblyPlanar());
        assertEquals (Arrays.asList("D", "E"), report.getIsolated());
    }

    @Test
    public void testDegenerate () {
        PlanarityReport report = analyzer.analyze(graph (nodes ("A")));
        assertEquals (1, report.getComponents().size());
        assertEquals (Verdict.POSSIBLY_PLANAR,
                      report.getComponents().get(0).verdict);
        assertEquals (Arrays.asList("A"), report.getIsolated());

        String[] v = nodes ("A", "B", "C", "D");
        report = analyzer.analyze(graph (v, complete (v)));
        assertEquals (6, report.getComponents().get(0).edges);
        assertEquals (Verdict.POSSIBLY_PLANAR,
                      report.getComponents().get(0).verdict);

        report = analyzer.analyze(graph (nodes ("A", "B"), "A-B"));
        assertTrue (report.isPossiblyPlanar());

        report = analyzer.analyze(graph (nodes ()));
        assertTrue (report.getComponents().isEmpty());
        assertTrue (report.isPossiblyPlanar());
    }

    @Test
    public void testBoundShortCircuits () {
        CountingCheck spy = new CountingCheck ();
        PlanarityAnalyzer a = new PlanarityAnalyzer
            (new DensityBoundCheck (), spy);
        String[] v = names ("n", 6);
        ComponentReport r = a.analyze(graph (v, complete (v)))
            .getComponents().get(0);
        assertEquals (Verdict.BOUND_VIOLATION, r.verdict);
        assertEquals ("No check after a bound violation", 0, spy.calls);
    }

    @Test
    public void testSingletonsAreNotChecked () {
        CountingCheck spy = new CountingCheck ();
        PlanarityAnalyzer a = new PlanarityAnalyzer (spy);
        PlanarityReport report = a.analyze
            (graph (nodes ("A", "B", "C", "D"), "A-B"));
        assertEquals (3, report.getComponents().size());
        assertEquals (1, spy.calls);
    }

    @Test
    public void testPossiblyPlanarIsNotPlanar () {
        // Petersen graph and a subdivided K3,3 are both nonplanar, but
        // neither contains an exact K5 or K3,3
        assertTrue (analyzer.analyze(petersen ()).isPossiblyPlanar());

        String[] a = nodes ("A1", "A2", "A3"), b = nodes ("B1", "B2", "B3");
        List<String> edges = biclique (a, b);
        edges.remove("A2-B3");
        edges.add("A2-X");
        edges.add("X-B3");
        PlanarityReport report = analyzer.analyze
            (graph (nodes ("A1", "A2", "A3", "B1", "B2", "B3", "X"), edges));
        assertEquals (Verdict.POSSIBLY_PLANAR,
                      report.getComponents().get(0).verdict);
    }

    @Test
    public void testVisitorSeesComponentsInOrder () {
        final List<Integer> seen = new ArrayList<>();
        String[] v = names ("n", 9);
        analyzer.analyze(graph (v, "n0-n1", "n2-n3", "n4-n5", "n6-n7"),
                         r -> seen.add(r.component));
        assertEquals (Arrays.asList(0, 1, 2, 3, 4), seen);
    }

    @Test
    public void testParallelSameAsSerial () {
        Random rand = new Random (31337l);
        List<String> nodes = new ArrayList<>();
        List<String> edges = new ArrayList<>();
        // a bunch of small random components
        for (int c = 0; c < 12; ++c) {
            String[] v = names ("c"+c+"_", 5 + rand.nextInt(4));
            nodes.addAll(Arrays.asList(v));
            for (int i = 1; i < v.length; ++i)
                edges.add(v[i-1]+"-"+v[i]);
            for (int i = 0; i < v.length; ++i)
                for (int j = i + 2; j < v.length; ++j)
                    if (rand.nextDouble() < 0.6)
                        edges.add(v[i]+"-"+v[j]);
        }
        CorridorGraph g = graph (nodes.toArray(new String[0]), edges);
        
        PlanarityReport serial = analyzer.analyze(g);
        PlanarityAnalyzer pa = new PlanarityAnalyzer ().setThreads(4);
        final List<Integer> order = new ArrayList<>();
        PlanarityReport parallel = pa.analyze(g, r -> order.add(r.component));

        assertEquals (serial.getComponents().size(),
                      parallel.getComponents().size());
        for (int i = 0; i < serial.getComponents().size(); ++i) {
            ComponentReport s = serial.getComponents().get(i);
            ComponentReport p = parallel.getComponents().get(i);
            assertEquals (i, p.component);
            assertEquals (i, (int) order.get(i));
            assertEquals (s.verdict, p.verdict);
            assertEquals (s.members, p.members);
            if (s.witness != null)
                assertEquals (s.witness.ids(), p.witness.ids());
        }
        assertEquals (serial.exitStatus(), parallel.exitStatus());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadThreads () {
        new PlanarityAnalyzer ().setThreads(0);
    }

    @Test
    public void testDroppedEdgesReported () {
        PlanarityReport report = analyzer.analyze
            (graph (nodes ("A", "B", "C"), "A-B", "B-A", "C-C", "A-Q"));
        assertEquals (1, report.getEdges());
        assertEquals (1, report.getDuplicates());
        assertEquals (1, report.getSelfLoops());
        assertEquals (1, report.getUnknownEndpoints());
        assertEquals (Arrays.asList("C"), report.getIsolated());
    }
}
