package org.wehi.stringnet;

import org.jgrapht.Graph;
import org.jgrapht.alg.interfaces.ShortestPathAlgorithm;
import org.jgrapht.alg.scoring.BetweennessCentrality;
import org.jgrapht.alg.scoring.EdgeBetweennessCentrality;
import org.jgrapht.alg.shortestpath.BFSShortestPath;
import org.jgrapht.graph.DefaultEdge;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes the NetworkProperty values of a network and writes them to text files.
 * Every file name carries the timestamp of the run, files are never overwritten.
 */
public class NetworkProperties {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final File outputPath;
    private final String timestamp;

    public NetworkProperties(File outputPath, String timestamp) {
        this.outputPath = outputPath;
        this.timestamp = timestamp;
    }

    public NetworkProperties(File outputPath) {
        this(outputPath, timestamp());
    }

    public static String timestamp() {
        return LocalDateTime.now().format(TIMESTAMP);
    }

    public String getTimestamp() {
        return timestamp;
    }

    /**
     * Computes every property in declaration order, failing on the first that can not be computed
     */
    public Map<NetworkProperty, PropertyResult> computeAll(Graph<String, DefaultEdge> graph) {
        Map<NetworkProperty, PropertyResult> results = new EnumMap<>(NetworkProperty.class);
        for (NetworkProperty property : NetworkProperty.values()) {
            results.put(property, property.compute(graph));
        }
        return results;
    }

    /**
     * Writes one file per property: output-[network]-[property]-[timestamp].txt
     * @param network label placed in the file names, may be null
     * @return the files written
     * @throws java.nio.file.FileAlreadyExistsException if a file of that name exists
     */
    public Map<NetworkProperty, File> export(String network, Map<NetworkProperty, PropertyResult> results)
            throws IOException {
        Files.createDirectories(outputPath.toPath());
        Map<NetworkProperty, File> files = new EnumMap<>(NetworkProperty.class);
        for (Map.Entry<NetworkProperty, PropertyResult> entry : results.entrySet()) {
            File file = outputFile(network, entry.getKey());
            Files.write(file.toPath(), entry.getValue().toLines(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            files.put(entry.getKey(), file);
        }
        return files;
    }

    File outputFile(String network, NetworkProperty property) {
        String prefix = network == null || network.isEmpty() ? "output-" : "output-" + network + "-";
        return new File(outputPath, prefix + property.getLabel() + "-" + timestamp + ".txt");
    }

    /**
     * Number of edges divided by number of nodes
     */
    static double averageDegree(Graph<String, DefaultEdge> graph) {
        int nodes = graph.vertexSet().size();
        if (nodes == 0) {
            throw new NetworkComputationException("Average degree is undefined for a network without nodes");
        }
        return (double) graph.edgeSet().size() / nodes;
    }

    /**
     * Degree over n - 1, 1.0 for the node of a single-node network
     */
    static Map<String, Double> degreeCentrality(Graph<String, DefaultEdge> graph) {
        Map<String, Double> scores = new LinkedHashMap<>();
        int n = graph.vertexSet().size();
        for (String node : graph.vertexSet()) {
            scores.put(node, n <= 1 ? 1.0 : (double) graph.degreeOf(node) / (n - 1));
        }
        return scores;
    }

    /**
     * Fraction of shortest paths between other node pairs passing through a node, scaled by 2 / ((n-1)(n-2))
     */
    static Map<String, Double> betweennessCentrality(Graph<String, DefaultEdge> graph) {
        int n = graph.vertexSet().size();
        // unordered pairs of other nodes
        double scale = n > 2 ? 2.0 / ((double) (n - 1) * (n - 2)) : 1.0;
        Map<String, Double> scores = new LinkedHashMap<>();
        new BetweennessCentrality<>(graph).getScores()
                .forEach((node, score) -> scores.put(node, score * scale));
        return scores;
    }

    /**
     * Inverse mean distance to the reachable nodes, weighted by the share of the network reachable
     * (Wasserman and Faust), so nodes of small components do not score as central
     */
    static Map<String, Double> closenessCentrality(Graph<String, DefaultEdge> graph) {
        int n = graph.vertexSet().size();
        BFSShortestPath<String, DefaultEdge> bfs = new BFSShortestPath<>(graph);
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String node : graph.vertexSet()) {
            ShortestPathAlgorithm.SingleSourcePaths<String, DefaultEdge> paths = bfs.getPaths(node);
            double totalDistance = 0;
            int reachable = 0;
            for (String other : graph.vertexSet()) {
                double distance = paths.getWeight(other);
                if (!Double.isInfinite(distance)) {
                    totalDistance += distance;
                    reachable++;
                }
            }
            double closeness = 0.0;
            if (totalDistance > 0 && n > 1) {
                closeness = (reachable - 1) / totalDistance * ((reachable - 1) / (double) (n - 1));
            }
            scores.put(node, closeness);
        }
        return scores;
    }

    /**
     * Shortest paths between all node pairs passing through an edge, scaled by 2 / (n(n-1))
     */
    static Map<NodePair, Double> edgeBetweennessCentrality(Graph<String, DefaultEdge> graph) {
        int n = graph.vertexSet().size();
        double scale = n > 1 ? 2.0 / ((double) n * (n - 1)) : 1.0;
        Map<NodePair, Double> scores = new LinkedHashMap<>();
        new EdgeBetweennessCentrality<>(graph).getScores()
                .forEach((edge, score) -> scores.put(
                        new NodePair(graph.getEdgeSource(edge), graph.getEdgeTarget(edge)), score * scale));
        return scores;
    }
}
