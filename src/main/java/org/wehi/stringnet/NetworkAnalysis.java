package org.wehi.stringnet;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Runs the analysis steps on a built STRING database: gene lookup, network construction and network properties.
 * All output goes to outputPath, named with the timestamp of this run.
 */
public class NetworkAnalysis {

    private final StringDatabase database;
    private final int scoreThreshold;
    private final File outputPath;
    private final String timestamp;

    public NetworkAnalysis(StringDatabase database, int scoreThreshold, File outputPath, String timestamp) {
        this.database = database;
        this.scoreThreshold = scoreThreshold;
        this.outputPath = outputPath;
        this.timestamp = timestamp;
    }

    public NetworkAnalysis(StringDatabase database, int scoreThreshold, File outputPath) {
        this(database, scoreThreshold, outputPath, NetworkProperties.timestamp());
    }

    /**
     * Writes "symbol ids" per input gene, "-" for genes without a match
     * @return the file written, output-gene_mapping-[timestamp].txt
     */
    public File writeGeneMapping(List<String> genes) throws IOException, SQLException {
        List<GeneMapping> mappings = new GeneResolver(database).resolveSymbols(genes);
        List<String> lines = new ArrayList<>();
        int unresolved = 0;
        for (GeneMapping mapping : mappings) {
            lines.add(mapping.toString());
            if (!mapping.isResolved()) {
                unresolved++;
            }
        }
        File file = new File(outputPath, "output-gene_mapping-" + timestamp + ".txt");
        Files.createDirectories(outputPath.toPath());
        Files.write(file.toPath(), lines, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        System.out.println("Resolved " + (mappings.size() - unresolved) + " of " + mappings.size()
                + " genes, mapping written to " + file);
        return file;
    }

    /**
     * Resolves the genes and builds the initial network between them and the network expanded by one neighbourhood
     * @return {initial, expanded}
     */
    public List<ProteinNetwork> buildNetworks(List<String> genes) throws SQLException {
        List<String> ids = new GeneResolver(database).resolveIdentifiers(genes);
        System.out.println(genes.size() + " genes matched " + ids.size() + " protein aliases");

        NetworkBuilder builder = new NetworkBuilder(database, scoreThreshold);
        ProteinNetwork initial = builder.buildInitialNetwork(ids);
        ProteinNetwork expanded = builder.buildExpandedNetwork(ids);
        System.out.println(initial);
        System.out.println(expanded);
        return Arrays.asList(initial, expanded);
    }

    public List<File> writeNetworks(List<ProteinNetwork> networks) throws IOException {
        List<File> files = new ArrayList<>();
        for (ProteinNetwork network : networks) {
            File sif = network.writeSIF(outputPath, timestamp);
            System.out.println(network.getName() + " network written to " + sif);
            files.add(sif);
        }
        return files;
    }

    /**
     * Computes all network properties, writing them out if export is set
     */
    public Map<NetworkProperty, PropertyResult> networkProperties(ProteinNetwork network, boolean export)
            throws IOException {
        System.out.println("Computing properties of the " + network);
        NetworkProperties properties = new NetworkProperties(outputPath, timestamp);
        Map<NetworkProperty, PropertyResult> results = properties.computeAll(network.getGraph());

        PropertyResult averageDegree = results.get(NetworkProperty.AVERAGE_DEGREE);
        System.out.println(NetworkProperty.AVERAGE_DEGREE.getLabel() + ": " + averageDegree.toLines().get(0));
        if (export) {
            Map<NetworkProperty, File> files = properties.export(network.getName(), results);
            System.out.println(files.size() + " property files written to " + outputPath);
        }
        return results;
    }
}
