package org.wehi.stringnet;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

/**
 * The two record layouts found in STRING dump files, told apart by their header line.
 */
public enum RecordType {
    // protein1 protein2 neighborhood fusion ... combined_score, space delimited
    INTERACTION("\\s+", "protein1", "protein2", "combined_score"),
    // ## string_protein_id ## alias ## source ##, tab delimited
    ALIAS("\t+", "string_protein_id", "alias", "source");

    private final String delimiter;
    private final List<String> requiredColumns;

    RecordType(String delimiter, String... requiredColumns) {
        this.delimiter = delimiter;
        this.requiredColumns = Collections.unmodifiableList(Arrays.asList(requiredColumns));
    }

    /**
     * @return regular expression separating the columns of a data line
     */
    public String getDelimiter() {
        return delimiter;
    }

    public List<String> getRequiredColumns() {
        return requiredColumns;
    }

    /**
     * Positions of the required columns within a header, in the order of getRequiredColumns()
     * @param headerColumns tokens of a header this record type was classified from
     */
    public int[] columnIndices(List<String> headerColumns) {
        int[] indices = new int[requiredColumns.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = headerColumns.indexOf(requiredColumns.get(i));
        }
        return indices;
    }

    /**
     * Splits a header line into its column names, dropping '#' comment markers
     */
    public static List<String> headerColumns(String header) {
        String stripped = header.replaceAll("#+", " ").trim();
        if (stripped.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(stripped.split("\\s+"));
    }

    /**
     * @param header the first line of a STRING file
     * @param source name of the file, used in the error message
     * @return INTERACTION if the header holds protein1, protein2 and combined_score,
     * ALIAS if it holds string_protein_id, alias and source
     * @throws UnrecognisedFormatException if it holds neither set
     */
    public static RecordType classify(String header, String source) throws UnrecognisedFormatException {
        HashSet<String> columns = new HashSet<>(headerColumns(header));
        for (RecordType type : values()) {
            if (columns.containsAll(type.requiredColumns)) {
                return type;
            }
        }
        throw new UnrecognisedFormatException(source, header);
    }

    public static RecordType classify(String header) throws UnrecognisedFormatException {
        return classify(header, "header");
    }
}
