package org.wehi.stringnet;

import java.util.Collections;
import java.util.List;

/**
 * One input gene symbol with the Ensembl ids its aliases point to
 */
public class GeneMapping {

    private final String symbol;
    private final List<String> ensemblIds;

    public GeneMapping(String symbol, List<String> ensemblIds) {
        this.symbol = symbol;
        this.ensemblIds = Collections.unmodifiableList(ensemblIds);
    }

    /**
     * @return the symbol as given, before trimming
     */
    public String getSymbol() {
        return symbol;
    }

    public List<String> getEnsemblIds() {
        return ensemblIds;
    }

    public boolean isResolved() {
        return !ensemblIds.isEmpty();
    }

    @Override
    public String toString() {
        return symbol.trim() + "\t" + (isResolved() ? String.join(",", ensemblIds) : "-");
    }
}
