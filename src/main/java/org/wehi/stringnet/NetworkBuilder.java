package org.wehi.stringnet;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Queries the interactions around a set of seed proteins and turns them into networks.
 * Only interactions scoring strictly above the threshold are used.
 */
public class NetworkBuilder {

    public static final int DEFAULT_SCORE_THRESHOLD = 400;
    public static final String INITIAL = "initial";
    public static final String EXPANDED = "expanded";

    private static final String SEED_TABLE = "seed_ids";

    private final StringDatabase database;
    private final int scoreThreshold;

    public NetworkBuilder(StringDatabase database, int scoreThreshold) {
        this.database = database;
        this.scoreThreshold = scoreThreshold;
    }

    public NetworkBuilder(StringDatabase database) {
        this(database, DEFAULT_SCORE_THRESHOLD);
    }

    public int getScoreThreshold() {
        return scoreThreshold;
    }

    /**
     * Interactions with both proteins among the seeds
     */
    public List<NodePair> directInteractions(Collection<String> seedIds) throws SQLException {
        loadSeeds(seedIds);
        return queryPairs("SELECT l.ensembl_id_1, l.ensembl_id_2 FROM " + StringSchema.LINKS + " l"
                + " JOIN " + SEED_TABLE + " a ON a.ensembl_id = l.ensembl_id_1"
                + " JOIN " + SEED_TABLE + " b ON b.ensembl_id = l.ensembl_id_2"
                + " WHERE l.combined_score > ?");
    }

    /**
     * Interactions whose first protein is a seed, the second protein may lie outside the seeds.
     * STRING lists every pair in both directions, so this is the one-hop neighbourhood of the seeds.
     */
    public List<NodePair> expandedInteractions(Collection<String> seedIds) throws SQLException {
        loadSeeds(seedIds);
        return queryPairs("SELECT l.ensembl_id_1, l.ensembl_id_2 FROM " + StringSchema.LINKS + " l"
                + " JOIN " + SEED_TABLE + " a ON a.ensembl_id = l.ensembl_id_1"
                + " WHERE l.combined_score > ?");
    }

    public ProteinNetwork buildInitialNetwork(Collection<String> seedIds) throws SQLException {
        return ProteinNetwork.fromInteractions(INITIAL, directInteractions(seedIds));
    }

    public ProteinNetwork buildExpandedNetwork(Collection<String> seedIds) throws SQLException {
        return ProteinNetwork.fromInteractions(EXPANDED, expandedInteractions(seedIds));
    }

    /**
     * Fills a temporary table with the seed ids, replacing whatever an earlier call left there
     */
    private void loadSeeds(Collection<String> seedIds) throws SQLException {
        Connection connection = database.getConnection();
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            try (Statement stmt = connection.createStatement()) {
                stmt.executeUpdate("CREATE TEMP TABLE IF NOT EXISTS " + SEED_TABLE
                        + " (ensembl_id TEXT PRIMARY KEY)");
                stmt.executeUpdate("DELETE FROM " + SEED_TABLE);
            }
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT OR IGNORE INTO " + SEED_TABLE + " VALUES (?)")) {
                for (String id : seedIds) {
                    insert.setString(1, id);
                    insert.addBatch();
                }
                insert.executeBatch();
            }
            connection.commit();
        } catch (SQLException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private List<NodePair> queryPairs(String sql) throws SQLException {
        List<NodePair> pairs = new ArrayList<>();
        try (PreparedStatement stmt = database.getConnection().prepareStatement(sql)) {
            stmt.setInt(1, scoreThreshold);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    pairs.add(new NodePair(rs.getString(1), rs.getString(2)));
                }
            }
        }
        return pairs;
    }
}
