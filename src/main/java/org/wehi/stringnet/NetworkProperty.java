package org.wehi.stringnet;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;

import java.util.Locale;

/**
 * The properties computed for every network
 */
public enum NetworkProperty {
    AVERAGE_DEGREE,
    DEGREE_CENTRALITY,
    EIGENVECTOR_CENTRALITY,
    BETWEENNESS_CENTRALITY,
    CLOSENESS_CENTRALITY,
    EDGE_BETWEENNESS_CENTRALITY;

    /**
     * @return name used in output files, e.g. edge_betweenness_centrality
     */
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    public PropertyResult compute(Graph<String, DefaultEdge> graph) {
        switch (this) {
            case AVERAGE_DEGREE:
                return PropertyResult.scalar(NetworkProperties.averageDegree(graph));
            case DEGREE_CENTRALITY:
                return PropertyResult.perNode(NetworkProperties.degreeCentrality(graph));
            case EIGENVECTOR_CENTRALITY:
                return PropertyResult.perNode(new EigenvectorCentrality<>(graph).getScores());
            case BETWEENNESS_CENTRALITY:
                return PropertyResult.perNode(NetworkProperties.betweennessCentrality(graph));
            case CLOSENESS_CENTRALITY:
                return PropertyResult.perNode(NetworkProperties.closenessCentrality(graph));
            case EDGE_BETWEENNESS_CENTRALITY:
                return PropertyResult.perEdge(NetworkProperties.edgeBetweennessCentrality(graph));
            default:
                throw new IllegalStateException("Unknown network property " + this);
        }
    }
}
