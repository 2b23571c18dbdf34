package org.wehi.stringnet;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

import java.io.File;
import java.io.IOException;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;

public class Main {

    public static void main(String[] args) throws IOException, SQLException {
        ArgumentParser parser = buildParser();
        try {
            Namespace ns = parser.parseArgs(args);
            run(ns);
        } catch (ArgumentParserException e) {
            parser.handleError(e);
            System.exit(1);
        }
    }

    static ArgumentParser buildParser() {
        ArgumentParser parser = ArgumentParsers.newFor("org.wehi.stringnet").build().defaultHelp(true)
                .description("A tool for building a local STRING database and analysing the protein interaction " +
                        "networks around a list of genes");

        parser.addArgument("--mode", "-m")
                .dest("mode")
                .help("\nThe function you would like to perform. \n" +
                        "Options are:\n" +
                        "\"CreateDB\", builds the database [-db] for the species [-s], downloading missing STRING files to [-dd]\n" +
                        "\"PrintSummary\", prints the number of rows per table of the database [-db]\n" +
                        "\"ResolveGenes\", maps the genes of the seed sheet in [-ip] onto the database [-db], writes the mapping to [-op]\n" +
                        "\"WriteNetworks\", writes the initial and expanded networks of the seed genes as SIF files to [-op]\n" +
                        "\"NetworkProperties\", computes the properties of the initial and expanded networks, writes them to [-op] unless [-ne]\n" +
                        "\"Analyse\", CreateDB followed by NetworkProperties\n")
                .type(String.class)
                .choices("CreateDB",
                        "PrintSummary",
                        "ResolveGenes",
                        "WriteNetworks",
                        "NetworkProperties",
                        "Analyse")
                .required(true);
        parser.addArgument("--database", "-db")
                .dest("database")
                .setDefault("string.db")
                .help("The STRING database file");
        parser.addArgument("--data_dir", "-dd")
                .dest("data_dir")
                .setDefault("data")
                .help("The directory holding the downloaded STRING files");
        parser.addArgument("--species", "-s")
                .dest("species")
                .nargs("*")
                .setDefault(Collections.singletonList("10090"))
                .help("NCBI taxonomy ids of the species to import, give the flag without ids to import all species");
        parser.addArgument("--threshold", "-t")
                .dest("threshold")
                .type(Integer.class)
                .setDefault(NetworkBuilder.DEFAULT_SCORE_THRESHOLD)
                .help("Interactions need a combined score above this value");
        parser.addArgument("--string_version", "-sv")
                .dest("string_version")
                .setDefault(StringDatabaseFactory.DEFAULT_VERSION)
                .help("The STRING release to download");
        parser.addArgument("--base_url", "-url")
                .dest("base_url")
                .setDefault(StringDownloader.DEFAULT_BASE_URL)
                .help("The STRING download location");
        parser.addArgument("--input_path", "-ip")
                .dest("input_path")
                .setDefault(".")
                .help("The directory holding the seed gene sheet (.xlsx)");
        parser.addArgument("--gene_column", "-gc")
                .dest("gene_column")
                .setDefault(SeedGeneReader.DEFAULT_GENE_COLUMN)
                .help("The column of the seed gene sheet holding the gene symbols");
        parser.addArgument("--output_path", "-op")
                .dest("output_path")
                .setDefault(".")
                .help("The directory output files are written to");
        parser.addArgument("--no_export", "-ne")
                .dest("no_export")
                .action(Arguments.storeTrue())
                .help("Compute network properties without writing them to files");
        return parser;
    }

    static void run(Namespace ns) throws IOException, SQLException {
        String mode = ns.getString("mode");
        File databaseFile = new File(ns.getString("database"));
        File outputPath = new File(ns.getString("output_path"));
        int threshold = ns.getInt("threshold");
        if (threshold < 0) {
            throw new IllegalArgumentException("Threshold must not be negative: " + threshold);
        }

        if (mode.equalsIgnoreCase("CreateDB") || mode.equalsIgnoreCase("Analyse")) {
            List<String> species = ns.getList("species");
            StringDatabaseFactory factory = new StringDatabaseFactory(databaseFile,
                    new File(ns.getString("data_dir")),
                    ns.getString("string_version"),
                    new StringDownloader(ns.getString("base_url")));
            factory.createDB(species);
            if (mode.equalsIgnoreCase("CreateDB")) {
                return;
            }
        }

        try (StringDatabase database = new StringDatabase(databaseFile)) {
            if (mode.equalsIgnoreCase("PrintSummary")) {
                database.printSummary();
                return;
            }

            List<String> genes = new SeedGeneReader(new File(ns.getString("input_path")),
                    ns.getString("gene_column")).readSeedGenes();
            NetworkAnalysis analysis = new NetworkAnalysis(database, threshold, outputPath);

            if (mode.equalsIgnoreCase("ResolveGenes")) {
                analysis.writeGeneMapping(genes);
            } else if (mode.equalsIgnoreCase("WriteNetworks")) {
                analysis.writeNetworks(analysis.buildNetworks(genes));
            } else {
                boolean export = !ns.getBoolean("no_export");
                for (ProteinNetwork network : analysis.buildNetworks(genes)) {
                    analysis.networkProperties(network, export);
                }
            }
        }
    }
}
