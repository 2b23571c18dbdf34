package org.wehi.stringnet;

import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.IterationManager;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Eigenvector centrality by power iteration on A + I.
 * Scores are scaled to unit Euclidean length. The iteration stops once the summed change over all nodes
 * drops below n * tolerance and fails after maxIterations.
 */
public class EigenvectorCentrality<E> {

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_TOLERANCE = 1.0e-6;

    private final Graph<String, E> graph;
    private final int maxIterations;
    private final double tolerance;

    public EigenvectorCentrality(Graph<String, E> graph, int maxIterations, double tolerance) {
        this.graph = graph;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    public EigenvectorCentrality(Graph<String, E> graph) {
        this(graph, DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    /**
     * @throws NetworkComputationException if the graph has no nodes or the iteration does not converge
     */
    public Map<String, Double> getScores() {
        List<String> nodes = new ArrayList<>(graph.vertexSet());
        int n = nodes.size();
        if (n == 0) {
            throw new NetworkComputationException("Eigenvector centrality is undefined for a network without nodes");
        }

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(nodes.get(i), i);
        }
        int[][] neighbours = new int[n][];
        for (int i = 0; i < n; i++) {
            String node = nodes.get(i);
            List<Integer> adjacent = new ArrayList<>();
            for (E edge : graph.edgesOf(node)) {
                adjacent.add(index.get(Graphs.getOppositeVertex(graph, edge, node)));
            }
            neighbours[i] = adjacent.stream().mapToInt(Integer::intValue).toArray();
        }

        IterationManager iterations = new IterationManager(maxIterations);
        RealVector x = new ArrayRealVector(n, 1.0 / n);
        try {
            while (true) {
                iterations.incrementIterationCount();
                RealVector last = x;
                x = last.copy();
                for (int i = 0; i < n; i++) {
                    double share = last.getEntry(i);
                    for (int j : neighbours[i]) {
                        x.addToEntry(j, share);
                    }
                }
                double norm = x.getNorm();
                x = x.mapDivide(norm == 0 ? 1.0 : norm);
                if (x.getL1Distance(last) < n * tolerance) {
                    break;
                }
            }
        } catch (MaxCountExceededException e) {
            throw new NetworkComputationException("Eigenvector centrality did not converge in "
                    + maxIterations + " iterations", e);
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            scores.put(nodes.get(i), x.getEntry(i));
        }
        return scores;
    }
}
