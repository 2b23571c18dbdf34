package org.wehi.stringnet;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DefaultUndirectedGraph;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EigenvectorCentralityTest {

    private static Graph<String, DefaultEdge> graph(String... edges) {
        Graph<String, DefaultEdge> graph = new DefaultUndirectedGraph<>(DefaultEdge.class);
        for (String edge : edges) {
            String[] nodes = edge.split("-");
            graph.addVertex(nodes[0]);
            graph.addVertex(nodes[1]);
            graph.addEdge(nodes[0], nodes[1]);
        }
        return graph;
    }

    @Test
    void pairScoresEqually() {
        Map<String, Double> scores = new EigenvectorCentrality<>(graph("A-B")).getScores();
        assertEquals(1 / Math.sqrt(2), scores.get("A"), 1e-9);
        assertEquals(1 / Math.sqrt(2), scores.get("B"), 1e-9);
    }

    @Test
    void hubOfStarScoresHighest() {
        Map<String, Double> scores = new EigenvectorCentrality<>(graph("X-A", "X-B", "X-C", "X-D")).getScores();
        for (String leaf : new String[]{"A", "B", "C", "D"}) {
            assertTrue(scores.get("X") > scores.get(leaf));
            assertEquals(scores.get("A"), scores.get(leaf), 1e-9);
        }
    }

    @Test
    void scoresHaveUnitLength() {
        Map<String, Double> scores = new EigenvectorCentrality<>(graph("A-B", "B-C", "C-D", "B-D", "D-E")).getScores();
        double sumOfSquares = 0;
        for (double score : scores.values()) {
            sumOfSquares += score * score;
        }
        assertEquals(1.0, sumOfSquares, 1e-9);
    }

    @Test
    void isolatedNodeScoresAlone() {
        Graph<String, DefaultEdge> graph = new DefaultUndirectedGraph<>(DefaultEdge.class);
        graph.addVertex("A");
        assertEquals(1.0, new EigenvectorCentrality<>(graph).getScores().get("A"), 1e-9);
    }

    @Test
    void emptyNetworkFails() {
        Graph<String, DefaultEdge> graph = new DefaultUndirectedGraph<>(DefaultEdge.class);
        assertThrows(NetworkComputationException.class, () -> new EigenvectorCentrality<>(graph).getScores());
    }

    @Test
    void failsWhenIterationsRunOut() {
        EigenvectorCentrality<DefaultEdge> centrality = new EigenvectorCentrality<>(graph("A-B", "B-C"), 1, 1e-6);
        NetworkComputationException e = assertThrows(NetworkComputationException.class, centrality::getScores);
        assertTrue(e.getMessage().contains("did not converge"));
    }
}
