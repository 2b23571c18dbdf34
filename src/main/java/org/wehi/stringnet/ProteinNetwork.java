package org.wehi.stringnet;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DefaultUndirectedGraph;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.Collection;

/**
 * An undirected protein interaction network. Nodes are Ensembl protein ids, edges carry no weight.
 * Adding a pair twice, in either direction, leaves a single edge.
 */
public class ProteinNetwork {

    private final String name;
    private final Graph<String, DefaultEdge> graph;

    public ProteinNetwork(String name) {
        this.name = name;
        this.graph = new DefaultUndirectedGraph<>(DefaultEdge.class);
    }

    public static ProteinNetwork fromInteractions(String name, Collection<NodePair> interactions) {
        ProteinNetwork network = new ProteinNetwork(name);
        for (NodePair pair : interactions) {
            network.addInteraction(pair.getFirst(), pair.getSecond());
        }
        return network;
    }

    public void addInteraction(String protein1, String protein2) {
        graph.addVertex(protein1);
        graph.addVertex(protein2);
        graph.addEdge(protein1, protein2);
    }

    public String getName() {
        return name;
    }

    public Graph<String, DefaultEdge> getGraph() {
        return graph;
    }

    public int nodeCount() {
        return graph.vertexSet().size();
    }

    public int edgeCount() {
        return graph.edgeSet().size();
    }

    /**
     * Writes the network as a SIF file, one "protein1 pp protein2" line per edge
     * @return the file written, output-[name]-network-[timestamp].sif
     * @throws java.nio.file.FileAlreadyExistsException rather than overwrite an earlier file
     */
    public File writeSIF(File outputDir, String timestamp) throws IOException {
        File sifFile = new File(outputDir, "output-" + name + "-network-" + timestamp + ".sif");
        Files.createDirectories(outputDir.toPath());
        try (BufferedWriter out = Files.newBufferedWriter(sifFile.toPath(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            for (DefaultEdge edge : graph.edgeSet()) {
                out.write(graph.getEdgeSource(edge) + "\tpp\t" + graph.getEdgeTarget(edge) + "\n");
            }
        }
        return sifFile;
    }

    @Override
    public String toString() {
        return name + " network: " + nodeCount() + " nodes, " + edgeCount() + " edges";
    }
}
