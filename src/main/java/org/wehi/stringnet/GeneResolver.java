package org.wehi.stringnet;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps gene symbols onto Ensembl protein ids through the p_aliases table
 */
public class GeneResolver {

    // stays well below SQLite's limit on bound parameters
    private static final int MAX_QUERY_PARAMETERS = 500;

    private final StringDatabase database;

    public GeneResolver(StringDatabase database) {
        this.database = database;
    }

    /**
     * Looks up every alias row matching one of the (trimmed) symbols.
     * The result has one id per matching alias row: a protein known under the symbol from three sources
     * is listed three times, while a symbol given twice counts once and unknown symbols are dropped.
     */
    public List<String> resolveIdentifiers(List<String> symbols) throws SQLException {
        List<String> ids = new ArrayList<>();
        for (String[] row : aliasRows(trimmed(symbols))) {
            ids.add(row[1]);
        }
        return ids;
    }

    /**
     * One mapping per input symbol, in input order, each holding the distinct ids the symbol resolves to
     */
    public List<GeneMapping> resolveSymbols(List<String> symbols) throws SQLException {
        Map<String, Set<String>> idsByAlias = new HashMap<>();
        for (String[] row : aliasRows(trimmed(symbols))) {
            idsByAlias.computeIfAbsent(row[0], k -> new LinkedHashSet<>()).add(row[1]);
        }
        List<GeneMapping> mappings = new ArrayList<>();
        for (String symbol : symbols) {
            Set<String> ids = idsByAlias.getOrDefault(symbol.trim(), Collections.emptySet());
            mappings.add(new GeneMapping(symbol, new ArrayList<>(ids)));
        }
        return mappings;
    }

    private static Set<String> trimmed(Collection<String> symbols) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String symbol : symbols) {
            String s = symbol.trim();
            if (!s.isEmpty()) {
                distinct.add(s);
            }
        }
        return distinct;
    }

    /**
     * @return {alias, ensembl_id} for each alias row whose alias is one of the symbols
     */
    private List<String[]> aliasRows(Set<String> symbols) throws SQLException {
        List<String[]> rows = new ArrayList<>();
        List<String> batch = new ArrayList<>(MAX_QUERY_PARAMETERS);
        for (String symbol : symbols) {
            batch.add(symbol);
            if (batch.size() == MAX_QUERY_PARAMETERS) {
                queryAliases(batch, rows);
                batch.clear();
            }
        }
        if (!batch.isEmpty()) {
            queryAliases(batch, rows);
        }
        return rows;
    }

    private void queryAliases(List<String> batch, List<String[]> rows) throws SQLException {
        String sql = "SELECT alias, ensembl_id FROM " + StringSchema.ALIASES
                + " WHERE alias IN (" + String.join(",", Collections.nCopies(batch.size(), "?")) + ")";
        try (PreparedStatement stmt = database.getConnection().prepareStatement(sql)) {
            for (int i = 0; i < batch.size(); i++) {
                stmt.setString(i + 1, batch.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(new String[]{rs.getString(1), rs.getString(2)});
                }
            }
        }
    }
}
