package org.wehi.stringnet;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Tables of a local STRING database.
 * proteins holds Ensembl ids and their species, pp_links the interactions with STRING's combined score,
 * p_aliases the names each protein is known by, per source.
 * Foreign keys are declared but SQLite does not enforce them unless asked to.
 */
public final class StringSchema {

    public static final String PROTEINS = "proteins";
    public static final String LINKS = "pp_links";
    public static final String ALIASES = "p_aliases";

    private static final String CREATE_PROTEINS = "CREATE TABLE IF NOT EXISTS " + PROTEINS + " ("
            + "ensembl_id TEXT NOT NULL UNIQUE, "
            + "species TEXT NOT NULL, "
            + "PRIMARY KEY (ensembl_id))";

    private static final String CREATE_LINKS = "CREATE TABLE IF NOT EXISTS " + LINKS + " ("
            + "ensembl_id_1 TEXT NOT NULL, "
            + "ensembl_id_2 TEXT NOT NULL, "
            + "combined_score INTEGER NOT NULL, "
            + "PRIMARY KEY (ensembl_id_1, ensembl_id_2), "
            + "FOREIGN KEY (ensembl_id_1) REFERENCES " + PROTEINS + " (ensembl_id))";

    private static final String CREATE_ALIASES = "CREATE TABLE IF NOT EXISTS " + ALIASES + " ("
            + "ensembl_id TEXT NOT NULL, "
            + "alias TEXT NOT NULL, "
            + "sources TEXT NOT NULL, "
            + "PRIMARY KEY (ensembl_id, alias, sources), "
            + "FOREIGN KEY (ensembl_id) REFERENCES " + PROTEINS + " (ensembl_id))";

    private static final String CREATE_ALIAS_INDEX = "CREATE INDEX IF NOT EXISTS p_aliases_alias ON "
            + ALIASES + " (alias)";

    private StringSchema() {
    }

    /**
     * Creates the three tables unless they already exist
     */
    public static void createTables(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.executeUpdate(CREATE_PROTEINS);
            stmt.executeUpdate(CREATE_LINKS);
            stmt.executeUpdate(CREATE_ALIASES);
        }
    }

    /**
     * Indexes aliases for gene lookups. Run after loading, building the index up front slows the inserts down.
     */
    public static void createIndices(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.executeUpdate(CREATE_ALIAS_INDEX);
        }
    }
}
