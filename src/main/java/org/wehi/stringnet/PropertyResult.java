package org.wehi.stringnet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The value of a network property: a single number, a score per node or a score per edge.
 */
public abstract class PropertyResult {

    public enum Shape {
        SCALAR,
        PER_NODE,
        PER_EDGE
    }

    private PropertyResult() {
    }

    public abstract Shape getShape();

    /**
     * Lines of the exported listing, highest value first
     */
    public abstract List<String> toLines();

    public static Scalar scalar(double value) {
        return new Scalar(value);
    }

    public static NodeScores perNode(Map<String, Double> scores) {
        return new NodeScores(scores);
    }

    public static EdgeScores perEdge(Map<NodePair, Double> scores) {
        return new EdgeScores(scores);
    }

    /**
     * Sorts by value descending, ties by key
     */
    private static <K> List<Map.Entry<K, Double>> sortedDescending(Map<K, Double> scores) {
        List<Map.Entry<K, Double>> entries = new ArrayList<>(scores.entrySet());
        entries.sort(Comparator.<Map.Entry<K, Double>>comparingDouble(Map.Entry::getValue).reversed()
                .thenComparing(e -> e.getKey().toString()));
        return entries;
    }

    public static final class Scalar extends PropertyResult {

        private final double value;

        private Scalar(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public Shape getShape() {
            return Shape.SCALAR;
        }

        @Override
        public List<String> toLines() {
            return Collections.singletonList(Double.toString(value));
        }
    }

    public static final class NodeScores extends PropertyResult {

        private final Map<String, Double> scores;

        private NodeScores(Map<String, Double> scores) {
            this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        }

        public Map<String, Double> getScores() {
            return scores;
        }

        public double get(String node) {
            Double score = scores.get(node);
            if (score == null) {
                throw new IllegalArgumentException("No score for node " + node);
            }
            return score;
        }

        @Override
        public Shape getShape() {
            return Shape.PER_NODE;
        }

        @Override
        public List<String> toLines() {
            List<String> lines = new ArrayList<>(scores.size());
            for (Map.Entry<String, Double> entry : sortedDescending(scores)) {
                lines.add(entry.getKey() + " " + entry.getValue());
            }
            return lines;
        }
    }

    public static final class EdgeScores extends PropertyResult {

        private final Map<NodePair, Double> scores;

        private EdgeScores(Map<NodePair, Double> scores) {
            this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        }

        public Map<NodePair, Double> getScores() {
            return scores;
        }

        @Override
        public Shape getShape() {
            return Shape.PER_EDGE;
        }

        @Override
        public List<String> toLines() {
            List<String> lines = new ArrayList<>(scores.size());
            for (Map.Entry<NodePair, Double> entry : sortedDescending(scores)) {
                NodePair edge = entry.getKey();
                lines.add(edge.getFirst() + " " + edge.getSecond() + " " + entry.getValue());
            }
            return lines;
        }
    }
}
