package org.wehi.stringnet;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.GZIPInputStream;

/**
 * Streams a STRING dump file into the tables of StringSchema.
 * Transactions are left to the caller.
 */
public class StringFileLoader {

    private static final int BATCH_SIZE = 10000;

    private final Connection connection;

    public StringFileLoader(Connection connection) {
        this.connection = connection;
    }

    /**
     * Loads a gzip compressed STRING file
     * @param gzFile e.g. 10090.protein.links.detailed.v11.0.txt.gz
     * @return number of data lines loaded
     * @throws UnrecognisedFormatException if the header matches no RecordType
     * @throws MalformedRecordException on the first line that can not be parsed
     */
    public int load(File gzFile) throws IOException, SQLException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new GZIPInputStream(Files.newInputStream(gzFile.toPath())), StandardCharsets.UTF_8))) {
            return load(reader, gzFile.getName());
        }
    }

    /**
     * Loads decompressed STRING content, the first line being the header
     * @param source name used in messages
     */
    public int load(BufferedReader reader, String source) throws IOException, SQLException {
        String header = reader.readLine();
        if (header == null) {
            throw new UnrecognisedFormatException(source, "");
        }
        RecordType type = RecordType.classify(header, source);
        List<String> columns = RecordType.headerColumns(header);

        if (type == RecordType.INTERACTION) {
            return loadInteractions(reader, source, columns);
        } else {
            return loadAliases(reader, source, columns);
        }
    }

    private int loadInteractions(BufferedReader reader, String source, List<String> columns)
            throws IOException, SQLException {
        int[] idx = RecordType.INTERACTION.columnIndices(columns);
        Set<String> proteins = new LinkedHashSet<>();
        int lineNumber = 1;
        int count = 0;

        try (PreparedStatement insertLink = connection.prepareStatement(
                "INSERT INTO " + StringSchema.LINKS + " VALUES (?, ?, ?)")) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String[] records = split(line.trim(), RecordType.INTERACTION, columns.size(), source, lineNumber);

                String protein1 = records[idx[0]];
                String protein2 = records[idx[1]];
                String id1 = splitIdentifier(protein1, source, lineNumber)[1];
                String id2 = splitIdentifier(protein2, source, lineNumber)[1];
                int combinedScore;
                try {
                    combinedScore = Integer.parseInt(records[idx[2]]);
                } catch (NumberFormatException e) {
                    throw new MalformedRecordException(source, lineNumber,
                            "combined_score is not an integer: \"" + records[idx[2]] + "\"", e);
                }
                proteins.add(protein1);
                proteins.add(protein2);

                insertLink.setString(1, id1);
                insertLink.setString(2, id2);
                insertLink.setInt(3, combinedScore);
                insertLink.addBatch();
                count++;
                if (count % BATCH_SIZE == 0) {
                    insertLink.executeBatch();
                }
            }
            insertLink.executeBatch();
        }

        try (PreparedStatement insertProtein = connection.prepareStatement(
                "INSERT INTO " + StringSchema.PROTEINS + " VALUES (?, ?)")) {
            int added = 0;
            for (String protein : proteins) {
                // identifiers were validated while reading the links
                String[] parts = splitIdentifier(protein, source, 0);
                insertProtein.setString(1, parts[1]);
                insertProtein.setString(2, parts[0]);
                insertProtein.addBatch();
                if (++added % BATCH_SIZE == 0) {
                    insertProtein.executeBatch();
                }
            }
            insertProtein.executeBatch();
        }

        System.out.println(String.format("%s: added %,d interactions between %,d proteins", source, count, proteins.size()));
        return count;
    }

    private int loadAliases(BufferedReader reader, String source, List<String> columns)
            throws IOException, SQLException {
        int[] idx = RecordType.ALIAS.columnIndices(columns);
        int lineNumber = 1;
        int count = 0;

        try (PreparedStatement insertAlias = connection.prepareStatement(
                "INSERT INTO " + StringSchema.ALIASES + " VALUES (?, ?, ?)")) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String[] records = split(line, RecordType.ALIAS, columns.size(), source, lineNumber);

                String ensemblId = splitIdentifier(records[idx[0]], source, lineNumber)[1];
                insertAlias.setString(1, ensemblId);
                insertAlias.setString(2, records[idx[1]]);
                insertAlias.setString(3, records[idx[2]]);
                insertAlias.addBatch();
                count++;
                if (count % BATCH_SIZE == 0) {
                    insertAlias.executeBatch();
                }
            }
            insertAlias.executeBatch();
        }

        System.out.println(String.format("%s: added %,d aliases", source, count));
        return count;
    }

    private static String[] split(String line, RecordType type, int expectedColumns, String source, int lineNumber)
            throws MalformedRecordException {
        String[] records = line.split(type.getDelimiter());
        if (records.length != expectedColumns) {
            throw new MalformedRecordException(source, lineNumber,
                    "expected " + expectedColumns + " columns but found " + records.length);
        }
        return records;
    }

    /**
     * Splits a species prefixed STRING identifier, e.g. 10090.ENSMUSP00000000001
     * @return {species, id}
     */
    static String[] splitIdentifier(String identifier, String source, int lineNumber) throws MalformedRecordException {
        String[] parts = identifier.split("\\.", -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new MalformedRecordException(source, lineNumber,
                    "identifier is not of the form <species>.<id>: \"" + identifier + "\"");
        }
        return parts;
    }
}
